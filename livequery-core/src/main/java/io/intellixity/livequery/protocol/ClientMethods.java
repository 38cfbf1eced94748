package io.intellixity.livequery.protocol;

/** Methods the server invokes on clients. */
public final class ClientMethods {
  private ClientMethods() {}

  /** Arguments: query name, array of {@link ExternalChange}. */
  public static final String ENTITY_CHANGED = "entityChanged";

  /** Arguments: query name, {@link io.intellixity.livequery.store.PageInfo}. */
  public static final String PAGE_CHANGED = "pageChanged";
}
