package io.intellixity.livequery.protocol;

import io.intellixity.livequery.change.Change;
import io.intellixity.livequery.change.ChangeType;
import io.intellixity.livequery.entity.Entity;

/** A change as pushed to clients: {@code {"entity": {...}, "type": 0|1}}. */
public record ExternalChange(Entity entity, ChangeType type) {
  public static ExternalChange from(Change change) {
    return new ExternalChange(change.entity(), change.type());
  }
}
