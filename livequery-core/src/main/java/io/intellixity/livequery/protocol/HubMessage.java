package io.intellixity.livequery.protocol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** One invocation frame: {@code {"target": "<method>", "arguments": [...]}}. */
@JsonPropertyOrder({"target", "arguments"})
public record HubMessage(String target, List<Object> arguments) {
  public HubMessage {
    Objects.requireNonNull(target, "target");
    arguments = arguments == null ? List.of() : arguments;
  }
}
