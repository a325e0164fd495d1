package bsync;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A block together with its parent and its index in the parent's children. */
@AutoValue
public abstract class BlockLocation {
  public abstract Block block();

  /** Empty for the label root. */
  public abstract Optional<Block> parent();

  /** Index in {@code parent().children()}, or {@link #ROOT_INDEX} for the label root. */
  public abstract int index();

  public static final int ROOT_INDEX = -1;

  /** The label root cannot be removed or moved. */
  public boolean isRoot() {
    return !parent().isPresent();
  }

  static BlockLocation root(Block root) {
    return new AutoValue_BlockLocation(root, Optional.empty(), ROOT_INDEX);
  }

  static BlockLocation child(Block block, Block parent, int index) {
    return new AutoValue_BlockLocation(block, Optional.of(parent), index);
  }
}
