package io.intellixity.livequery.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Arrays;
import java.util.Objects;

/** Encodes and decodes {@link HubMessage} text frames with Jackson. */
public final class HubMessageCodec {
  private final ObjectMapper json;

  public HubMessageCodec() {
    this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
  }

  public HubMessageCodec(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public ObjectMapper mapper() { return json; }

  public String encode(String target, Object... arguments) {
    try {
      return json.writeValueAsString(new HubMessage(target, Arrays.asList(arguments)));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cannot encode " + target + " message", e);
    }
  }

  public HubMessage decode(String text) {
    try {
      HubMessage m = json.readValue(text, HubMessage.class);
      if (m == null) throw new IllegalArgumentException("Empty hub message");
      return m;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed hub message: " + e.getOriginalMessage(), e);
    }
  }

  /** Converts the argument at {@code index} to the requested type. */
  public <T> T argument(HubMessage message, int index, Class<T> type) {
    return json.convertValue(rawArgument(message, index), type);
  }

  public <T> T argument(HubMessage message, int index, TypeReference<T> type) {
    return json.convertValue(rawArgument(message, index), type);
  }

  private static Object rawArgument(HubMessage message, int index) {
    if (index >= message.arguments().size()) {
      throw new IllegalArgumentException(message.target() + " expects at least " + (index + 1) + " argument(s)");
    }
    return message.arguments().get(index);
  }
}
