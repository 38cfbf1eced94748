package io.intellixity.livequery.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "livequery")
public class LiveQueryProperties {
  private String endpoint = "/hub";
  private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
  private int fanoutThreads = 4;
  private List<String> ignoredCollectionPrefixes = new ArrayList<>(List.of("@hilo", "system."));
  private final Mongo mongo = new Mongo();
  private final Security security = new Security();

  public String getEndpoint() { return endpoint; }
  public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
  public List<String> getAllowedOrigins() { return allowedOrigins; }
  public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }
  public int getFanoutThreads() { return fanoutThreads; }
  public void setFanoutThreads(int fanoutThreads) { this.fanoutThreads = fanoutThreads; }
  public List<String> getIgnoredCollectionPrefixes() { return ignoredCollectionPrefixes; }
  public void setIgnoredCollectionPrefixes(List<String> prefixes) { this.ignoredCollectionPrefixes = prefixes; }
  public Mongo getMongo() { return mongo; }
  public Security getSecurity() { return security; }

  public static class Mongo {
    /** Connection string; when absent the server runs on an in-memory store. */
    private String uri;
    private String database = "livequery";

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
  }

  public static class Security {
    /** Reject WebSocket handshakes that carry no bearer token. */
    private boolean requireToken;

    public boolean isRequireToken() { return requireToken; }
    public void setRequireToken(boolean requireToken) { this.requireToken = requireToken; }
  }
}
