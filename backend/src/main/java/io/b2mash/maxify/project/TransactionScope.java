package io.b2mash.maxify.project;

/** Handle given to the work running inside {@link ProjectStore#scopedTransaction(ScopedWork)}. */
public interface TransactionScope {

  /** Marks the scope for rollback. Every change staged in it is discarded when the work returns. */
  void abort();

  boolean isAborted();
}
