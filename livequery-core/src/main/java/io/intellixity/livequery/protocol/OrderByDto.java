package io.intellixity.livequery.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Ordering as submitted by clients; {@code ascending} defaults to true when absent. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderByDto(List<String> fields, Boolean ascending) {
  public boolean ascendingOrDefault() { return ascending == null || ascending; }
}
