package bsync;

import java.util.Arrays;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** The closed set of block kinds, with their display category, shape and default fields. */
public enum BlockKind {
  LABEL(
      "label",
      Category.FLOW,
      Pairing.SCOPE,
      true,
      FieldSpec.required("name", FieldType.TEXT),
      FieldSpec.optional("parameters", FieldType.TEXT)),
  DIALOGUE(
      "dialogue",
      Category.DIALOGUE,
      Pairing.STATEMENT,
      false,
      FieldSpec.optional("speaker", FieldType.CHARACTER),
      FieldSpec.required("text", FieldType.MULTILINE),
      FieldSpec.optional("attributes", FieldType.TEXT)),
  SCENE(
      "scene",
      Category.SCENE,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("image", FieldType.IMAGE),
      FieldSpec.optional("onLayer", FieldType.SELECT)),
  SHOW(
      "show",
      Category.SCENE,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("character", FieldType.CHARACTER),
      FieldSpec.optional("position", FieldType.POSITION, FieldValue.of("center")),
      FieldSpec.optional("expression", FieldType.EXPRESSION)),
  HIDE(
      "hide",
      Category.SCENE,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("character", FieldType.CHARACTER)),
  WITH(
      "with",
      Category.SCENE,
      Pairing.STATEMENT,
      false,
      FieldSpec.required(
          "transition", FieldType.TRANSITION, FieldValue.of(Statement.With.DEFAULT_TRANSITION))),
  MENU(
      "menu",
      Category.FLOW,
      Pairing.STATEMENT,
      true,
      FieldSpec.optional("prompt", FieldType.TEXT)),
  CHOICE(
      "choice",
      Category.FLOW,
      Pairing.CHOICE,
      true,
      FieldSpec.required("text", FieldType.TEXT),
      FieldSpec.optional("condition", FieldType.EXPRESSION)),
  JUMP(
      "jump",
      Category.FLOW,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("target", FieldType.LABEL),
      FieldSpec.optional("expression", FieldType.BOOLEAN)),
  CALL(
      "call",
      Category.FLOW,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("target", FieldType.LABEL),
      FieldSpec.optional("arguments", FieldType.TEXT),
      FieldSpec.optional("expression", FieldType.BOOLEAN)),
  RETURN(
      "return",
      Category.FLOW,
      Pairing.STATEMENT,
      false,
      FieldSpec.optional("value", FieldType.TEXT)),
  IF(
      "if",
      Category.FLOW,
      Pairing.STATEMENT,
      true,
      FieldSpec.required("condition", FieldType.EXPRESSION)),
  ELIF(
      "elif",
      Category.FLOW,
      Pairing.BRANCH,
      true,
      FieldSpec.required("condition", FieldType.EXPRESSION)),
  ELSE("else", Category.FLOW, Pairing.BRANCH, true),
  PYTHON(
      "python",
      Category.ADVANCED,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("code", FieldType.MULTILINE)),
  SET(
      "set",
      Category.ADVANCED,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("variable", FieldType.TEXT),
      FieldSpec.required(
          "operator", FieldType.SELECT, FieldValue.of(Statement.Set.Operator.ASSIGN.symbol())),
      FieldSpec.required("value", FieldType.EXPRESSION)),
  PLAY_MUSIC(
      "play-music",
      Category.AUDIO,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("file", FieldType.AUDIO),
      FieldSpec.optional("fadein", FieldType.NUMBER),
      FieldSpec.optional("loop", FieldType.BOOLEAN, FieldValue.of(true)),
      FieldSpec.optional("volume", FieldType.NUMBER)),
  STOP_MUSIC(
      "stop-music",
      Category.AUDIO,
      Pairing.STATEMENT,
      false,
      FieldSpec.optional("fadeout", FieldType.NUMBER)),
  PLAY_SOUND(
      "play-sound",
      Category.AUDIO,
      Pairing.STATEMENT,
      false,
      FieldSpec.required("file", FieldType.AUDIO),
      FieldSpec.optional("fadein", FieldType.NUMBER),
      FieldSpec.optional("volume", FieldType.NUMBER),
      FieldSpec.optional("loop", FieldType.BOOLEAN)),
  COMMENT(
      "comment",
      Category.ADVANCED,
      Pairing.NONE,
      false,
      FieldSpec.optional("text", FieldType.MULTILINE));

  public enum Category {
    SCENE,
    DIALOGUE,
    FLOW,
    AUDIO,
    ADVANCED
  }

  /** How a block of this kind is represented in the AST. */
  public enum Pairing {
    /** The root of an edit session; pairs with a label. */
    SCOPE,
    /** A freestanding statement. */
    STATEMENT,
    /** An element of a menu's choice array. */
    CHOICE,
    /** An element of an if statement's branch array. */
    BRANCH,
    /** No AST counterpart. */
    NONE
  }

  @AutoValue
  public abstract static class FieldSpec {
    public abstract String name();

    public abstract FieldType type();

    public abstract boolean required();

    public abstract Optional<FieldValue> defaultValue();

    static FieldSpec required(String name, FieldType type) {
      return new AutoValue_BlockKind_FieldSpec(name, type, true, Optional.empty());
    }

    static FieldSpec required(String name, FieldType type, FieldValue defaultValue) {
      return new AutoValue_BlockKind_FieldSpec(name, type, true, Optional.of(defaultValue));
    }

    static FieldSpec optional(String name, FieldType type) {
      return new AutoValue_BlockKind_FieldSpec(name, type, false, Optional.empty());
    }

    static FieldSpec optional(String name, FieldType type, FieldValue defaultValue) {
      return new AutoValue_BlockKind_FieldSpec(name, type, false, Optional.of(defaultValue));
    }
  }

  private final String tagName;
  private final Category category;
  private final Pairing pairing;
  private final boolean container;
  private final ImmutableList<FieldSpec> fields;

  BlockKind(
      String tagName, Category category, Pairing pairing, boolean container, FieldSpec... fields) {
    this.tagName = tagName;
    this.category = category;
    this.pairing = pairing;
    this.container = container;
    this.fields = ImmutableList.copyOf(fields);
  }

  public String tagName() {
    return tagName;
  }

  public Category category() {
    return category;
  }

  public Pairing pairing() {
    return pairing;
  }

  public boolean isContainer() {
    return container;
  }

  /** True for kinds whose AST counterpart is an element of the parent's array. */
  public boolean isArrayElement() {
    return pairing == Pairing.CHOICE || pairing == Pairing.BRANCH;
  }

  public ImmutableList<FieldSpec> fields() {
    return fields;
  }

  private static final ImmutableMap<String, BlockKind> BY_TAG_NAME =
      Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(k -> k.tagName, k -> k));

  public static Optional<BlockKind> forTagName(String tagName) {
    return Optional.ofNullable(BY_TAG_NAME.get(tagName));
  }

  @Override
  public String toString() {
    return tagName;
  }
}
