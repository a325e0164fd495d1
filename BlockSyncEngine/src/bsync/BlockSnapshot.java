package bsync;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** An immutable copy of a block subtree, as held by a {@link Clipboard}. */
@AutoValue
public abstract class BlockSnapshot {
  public abstract String sourceId();

  public abstract BlockKind kind();

  /** Non-empty field values at copy time. */
  public abstract ImmutableMap<String, FieldValue> values();

  public abstract Optional<Address> sourceLink();

  public abstract ImmutableList<BlockSnapshot> children();

  static BlockSnapshot create(
      String sourceId,
      BlockKind kind,
      ImmutableMap<String, FieldValue> values,
      Optional<Address> sourceLink,
      ImmutableList<BlockSnapshot> children) {
    return new AutoValue_BlockSnapshot(sourceId, kind, values, sourceLink, children);
  }
}
