package io.intellixity.livequery.change;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of change pushed to clients; travels on the wire as its numeric code. */
public enum ChangeType {
  UPSERT(0),
  DELETE(1);

  private final int code;

  ChangeType(int code) {
    this.code = code;
  }

  @JsonValue
  public int code() { return code; }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ChangeType fromCode(int code) {
    for (ChangeType t : values()) {
      if (t.code == code) return t;
    }
    throw new IllegalArgumentException("Unknown change type code: " + code);
  }
}
