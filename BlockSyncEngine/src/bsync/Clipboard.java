package bsync;

import java.time.Instant;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** Copied blocks, ready to be pasted any number of times into any label. */
@AutoValue
public abstract class Clipboard {
  public abstract ImmutableList<BlockSnapshot> blocks();

  /** Name of the label the blocks were copied from. */
  public abstract String sourceLabel();

  public abstract Instant timestamp();

  public boolean isEmpty() {
    return blocks().isEmpty();
  }

  public static Clipboard create(
      ImmutableList<BlockSnapshot> blocks, String sourceLabel, Instant timestamp) {
    return new AutoValue_Clipboard(blocks, sourceLabel, timestamp);
  }
}
