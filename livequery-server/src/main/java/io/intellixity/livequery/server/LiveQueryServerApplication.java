package io.intellixity.livequery.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

@SpringBootApplication(exclude = {MongoAutoConfiguration.class})
public class LiveQueryServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(LiveQueryServerApplication.class, args);
  }
}
