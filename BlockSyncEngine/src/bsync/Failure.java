package bsync;

import com.google.auto.value.AutoValue;

/** Why an engine operation was refused. A failed operation leaves both trees unchanged. */
@AutoValue
public abstract class Failure {
  public enum Kind {
    /** A block, parent, label or AST entity could not be resolved by id. */
    NOT_FOUND,
    /** The edit is not allowed for the kinds involved, e.g. a choice outside a menu. */
    STRUCTURAL,
    /** Paste of an empty clipboard. */
    EMPTY_INPUT,
    /** A field value that cannot be mapped onto the AST. */
    INVALID_VALUE
  }

  public abstract Kind kind();

  public abstract String message();

  public static Failure notFound(String format, Object... args) {
    return create(Kind.NOT_FOUND, String.format(format, args));
  }

  public static Failure structural(String format, Object... args) {
    return create(Kind.STRUCTURAL, String.format(format, args));
  }

  public static Failure emptyInput(String format, Object... args) {
    return create(Kind.EMPTY_INPUT, String.format(format, args));
  }

  public static Failure invalidValue(String format, Object... args) {
    return create(Kind.INVALID_VALUE, String.format(format, args));
  }

  static Failure create(Kind kind, String message) {
    return new AutoValue_Failure(kind, message);
  }

  @Override
  public String toString() {
    return String.format("%s: %s", kind(), message());
  }
}
