package bsync;

import com.google.common.base.Preconditions;

/** Raised inside the engine when an edit cannot be applied; never escapes a public entry point. */
public class SyncException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Failure failure;

  public SyncException(Failure failure) {
    super(failure.message());
    this.failure = Preconditions.checkNotNull(failure);
  }

  public Failure failure() {
    return failure;
  }
}
