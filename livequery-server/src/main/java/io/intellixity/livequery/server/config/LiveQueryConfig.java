package io.intellixity.livequery.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.livequery.channel.ClientPool;
import io.intellixity.livequery.change.ChangeClassifier;
import io.intellixity.livequery.mongo.MongoChangeFeed;
import io.intellixity.livequery.mongo.MongoEntityStore;
import io.intellixity.livequery.mongo.MongoHandle;
import io.intellixity.livequery.notify.ChangeNotifier;
import io.intellixity.livequery.notify.DefaultChangeNotifier;
import io.intellixity.livequery.protocol.HubMessageCodec;
import io.intellixity.livequery.registry.ConcurrentSubscriptionRegistry;
import io.intellixity.livequery.registry.SubscriptionRegistry;
import io.intellixity.livequery.server.hub.DatabaseApiHub;
import io.intellixity.livequery.server.web.HubWebSocketHandler;
import io.intellixity.livequery.server.web.WebSocketSessionChannel;
import io.intellixity.livequery.store.InMemoryEntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(LiveQueryProperties.class)
public class LiveQueryConfig {
  private static final Logger log = LoggerFactory.getLogger(LiveQueryConfig.class);

  @Bean
  public StoreBackend storeBackend(LiveQueryProperties props) {
    LiveQueryProperties.Mongo mongo = props.getMongo();
    if (mongo.getUri() == null || mongo.getUri().isBlank()) {
      log.warn("livequery.mongo.uri is not set, serving from an in-memory store");
      InMemoryEntityStore store = new InMemoryEntityStore();
      return new StoreBackend(store, store, null);
    }
    MongoClient client = MongoClients.create(mongo.getUri());
    MongoHandle handle = new MongoHandle(client, mongo.getDatabase());
    log.info("Serving MongoDB database {}", mongo.getDatabase());
    return new StoreBackend(new MongoEntityStore(handle), new MongoChangeFeed(handle), client);
  }

  @Bean
  public SubscriptionRegistry subscriptionRegistry() {
    return new ConcurrentSubscriptionRegistry();
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService fanoutExecutor(LiveQueryProperties props) {
    AtomicInteger n = new AtomicInteger();
    ThreadFactory threads = r -> {
      Thread t = new Thread(r, "livequery-fanout-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
    return Executors.newFixedThreadPool(Math.max(1, props.getFanoutThreads()), threads);
  }

  @Bean
  public HubMessageCodec hubMessageCodec(ObjectMapper objectMapper) {
    return new HubMessageCodec(objectMapper);
  }

  @Bean
  public WebSocketSessionChannel webSocketSessionChannel(HubMessageCodec codec) {
    return new WebSocketSessionChannel(codec);
  }

  @Bean
  public ChangeNotifier changeNotifier(StoreBackend backend,
                                       SubscriptionRegistry registry,
                                       WebSocketSessionChannel channel,
                                       ExecutorService fanoutExecutor,
                                       LiveQueryProperties props) {
    return new DefaultChangeNotifier(
        backend.store(),
        registry,
        new ClientPool(channel),
        new ChangeClassifier(backend.store()),
        fanoutExecutor,
        props.getIgnoredCollectionPrefixes());
  }

  @Bean
  public ChangeFeedLifecycle changeFeedLifecycle(StoreBackend backend, ChangeNotifier notifier) {
    return new ChangeFeedLifecycle(backend.feed(), notifier);
  }

  @Bean
  public DatabaseApiHub databaseApiHub(SubscriptionRegistry registry, ChangeNotifier notifier) {
    return new DatabaseApiHub(registry, notifier);
  }

  @Bean
  public HubWebSocketHandler hubWebSocketHandler(DatabaseApiHub hub,
                                                 WebSocketSessionChannel channel,
                                                 HubMessageCodec codec) {
    return new HubWebSocketHandler(hub, channel, codec);
  }
}
