package io.intellixity.livequery.change;

/** Raised for a store mutation that cannot be classified as an upsert or a deletion. */
public final class UnrecognizedMutationKindException extends RuntimeException {
  private final StoreMutation mutation;

  public UnrecognizedMutationKindException(StoreMutation mutation) {
    super("Unrecognized mutation kind " + mutation.kind() + " on " + mutation.collection() + "/" + mutation.id());
    this.mutation = mutation;
  }

  public StoreMutation mutation() { return mutation; }
}
