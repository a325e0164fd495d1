package bsync;

import java.util.Optional;

import com.google.auto.value.AutoOneOf;
import com.google.common.base.Ascii;
import com.google.common.primitives.Doubles;

/** A non-empty block field value. An empty field is represented by {@code Optional.empty()}. */
@AutoOneOf(FieldValue.Kind.class)
public abstract class FieldValue {
  public enum Kind {
    TEXT,
    NUMBER,
    FLAG
  }

  // Beyond this, whole numbers keep their exponent form.
  private static final double INTEGRAL_TEXT_LIMIT = 1e15;

  public abstract Kind getKind();

  public abstract String text();

  public abstract Double number();

  public abstract Boolean flag();

  public static FieldValue of(String text) {
    return AutoOneOf_FieldValue.text(text);
  }

  public static FieldValue of(double number) {
    return AutoOneOf_FieldValue.number(number);
  }

  public static FieldValue of(boolean flag) {
    return AutoOneOf_FieldValue.flag(flag);
  }

  /** The value as script text: numbers without a trailing {@code .0}, flags as true/false. */
  public String asText() {
    switch (getKind()) {
      case TEXT:
        return text();
      case NUMBER:
        double d = number();
        return d == Math.rint(d) && Math.abs(d) < INTEGRAL_TEXT_LIMIT
            ? Long.toString((long) d)
            : Double.toString(d);
      case FLAG:
        return flag().toString();
    }
    throw new AssertionError(getKind());
  }

  /** Numeric reading of this value; text is parsed, flags never convert. */
  public Optional<Double> asNumber() {
    switch (getKind()) {
      case NUMBER:
        return Optional.of(number());
      case TEXT:
        return Optional.ofNullable(Doubles.tryParse(text().trim()));
      case FLAG:
        return Optional.empty();
    }
    throw new AssertionError(getKind());
  }

  /** Boolean reading of this value; only the texts "true" and "false" convert. */
  public Optional<Boolean> asFlag() {
    switch (getKind()) {
      case FLAG:
        return Optional.of(flag());
      case TEXT:
        String t = Ascii.toLowerCase(text().trim());
        if (t.equals("true")) return Optional.of(true);
        if (t.equals("false")) return Optional.of(false);
        return Optional.empty();
      case NUMBER:
        return Optional.empty();
    }
    throw new AssertionError(getKind());
  }

  @Override
  public String toString() {
    return asText();
  }
}
