package bsync;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Outcome of one engine entry point. On success the trees passed in have been updated in place;
 * on failure they are exactly as they were.
 */
@AutoValue
public abstract class OperationResult {
  public abstract boolean success();

  /** Blocks created by the operation: one for add, one per top-level clipboard block for paste. */
  public abstract ImmutableList<String> blockIds();

  public abstract Optional<Failure> failure();

  /** The single created block, if any. */
  public Optional<String> blockId() {
    return blockIds().isEmpty() ? Optional.empty() : Optional.of(blockIds().get(0));
  }

  public static OperationResult ok() {
    return new AutoValue_OperationResult(true, ImmutableList.of(), Optional.empty());
  }

  public static OperationResult ok(String blockId) {
    return new AutoValue_OperationResult(true, ImmutableList.of(blockId), Optional.empty());
  }

  public static OperationResult ok(ImmutableList<String> blockIds) {
    return new AutoValue_OperationResult(true, blockIds, Optional.empty());
  }

  public static OperationResult failed(Failure failure) {
    return new AutoValue_OperationResult(false, ImmutableList.of(), Optional.of(failure));
  }

  @Override
  public String toString() {
    return success() ? "OK " + blockIds() : "FAILED " + failure().get();
  }
}
