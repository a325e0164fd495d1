package bsync;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * A node of the visual block tree. Blocks are created by {@link NodeFactory}; their structure is
 * changed only through {@link SyncEngine} so that the paired AST stays in step.
 */
public final class Block {

  public static final class Field {
    private final BlockKind.FieldSpec spec;
    private Optional<FieldValue> value;

    private Field(BlockKind.FieldSpec spec) {
      this.spec = spec;
      this.value = spec.defaultValue();
    }

    public String name() {
      return spec.name();
    }

    public FieldType type() {
      return spec.type();
    }

    public boolean required() {
      return spec.required();
    }

    public Optional<FieldValue> value() {
      return value;
    }

    public void setValue(Optional<FieldValue> value) {
      this.value = Preconditions.checkNotNull(value);
    }

    /** The value as text, or the empty string when the field is unset. */
    public String text() {
      return value.map(FieldValue::asText).orElse("");
    }

    @Override
    public String toString() {
      return name() + "=" + value.map(FieldValue::asText).orElse("<empty>");
    }
  }

  private final String id;
  private final BlockKind kind;
  private final ImmutableList<Field> fields;
  private Optional<Address> link = Optional.empty();
  private final List<Block> children;

  Block(String id, BlockKind kind) {
    this.id = Preconditions.checkNotNull(id);
    this.kind = Preconditions.checkNotNull(kind);
    this.fields =
        kind.fields().stream().map(Field::new).collect(ImmutableList.toImmutableList());
    this.children = kind.isContainer() ? new ArrayList<>() : ImmutableList.of();
  }

  public String id() {
    return id;
  }

  public BlockKind kind() {
    return kind;
  }

  public BlockKind.Category category() {
    return kind.category();
  }

  public ImmutableList<Field> fields() {
    return fields;
  }

  public Optional<Field> field(String name) {
    return fields.stream().filter(f -> f.name().equals(name)).findFirst();
  }

  /** Text of the named field, or the empty string if the field is unset or unknown. */
  public String text(String fieldName) {
    return field(fieldName).map(Field::text).orElse("");
  }

  public Optional<FieldValue> value(String fieldName) {
    return field(fieldName).flatMap(Field::value);
  }

  /** Sets a field this kind is known to declare. */
  void set(String fieldName, Optional<FieldValue> value) {
    Optional<Field> field = field(fieldName);
    Preconditions.checkArgument(field.isPresent(), "%s has no field %s", kind, fieldName);
    field.get().setValue(value);
  }

  /** Current values of all non-empty fields, in declaration order. */
  public ImmutableMap<String, FieldValue> fieldValues() {
    ImmutableMap.Builder<String, FieldValue> builder = ImmutableMap.builder();
    for (Field field : fields) {
      field.value().ifPresent(v -> builder.put(field.name(), v));
    }
    return builder.build();
  }

  /** The paired AST entity; empty for comments. */
  public Optional<Address> link() {
    return link;
  }

  void setLink(Optional<Address> link) {
    this.link = Preconditions.checkNotNull(link);
  }

  /** Child blocks in order. Live for container kinds, an immutable empty list otherwise. */
  public List<Block> children() {
    return children;
  }

  public boolean isContainer() {
    return kind.isContainer();
  }

  /** Deep, immutable copy of this subtree. */
  public BlockSnapshot snapshot() {
    return BlockSnapshot.create(
        id,
        kind,
        fieldValues(),
        link,
        children.stream().map(Block::snapshot).collect(ImmutableList.toImmutableList()));
  }

  @Override
  public String toString() {
    return kind + "#" + id;
  }
}
