package io.intellixity.livequery.protocol;

/** Methods clients invoke on the server; each takes a single {@link QueryDto}. */
public final class ServerMethods {
  private ServerMethods() {}

  public static final String ADD_QUERY = "AddQuery";
  public static final String MODIFY_QUERY = "ModifyQuery";
  public static final String REMOVE_QUERY = "RemoveQuery";
}
