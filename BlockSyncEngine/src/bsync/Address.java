package bsync;

import java.util.Optional;

import com.google.auto.value.AutoOneOf;
import com.google.auto.value.AutoValue;

/**
 * Where the AST counterpart of a block lives.
 *
 * <p>Most blocks pair with a freestanding statement ({@link Kind#NODE}). Menu choices and if
 * branches are elements of their owner's array; their address names the owner statement and the
 * element's own stable id. The string form, {@code <owner>_choice_<key>} or {@code
 * <owner>_branch_<key>}, is for display and interop only and is never matched against text.
 */
@AutoOneOf(Address.Kind.class)
public abstract class Address {
  public enum Kind {
    NODE,
    CHOICE,
    BRANCH
  }

  static final String CHOICE_SEPARATOR = "_choice_";
  static final String BRANCH_SEPARATOR = "_branch_";

  /** An element of an owner statement's array: a menu choice or an if branch. */
  @AutoValue
  public abstract static class Element {
    public abstract String ownerId();

    public abstract String elementId();

    static Element create(String ownerId, String elementId) {
      return new AutoValue_Address_Element(ownerId, elementId);
    }
  }

  public abstract Kind getKind();

  public abstract String node();

  public abstract Element choice();

  public abstract Element branch();

  public static Address node(String nodeId) {
    return AutoOneOf_Address.node(nodeId);
  }

  public static Address choice(String menuId, String choiceId) {
    return AutoOneOf_Address.choice(Element.create(menuId, choiceId));
  }

  public static Address branch(String ifId, String branchId) {
    return AutoOneOf_Address.branch(Element.create(ifId, branchId));
  }

  public boolean isSynthetic() {
    return getKind() != Kind.NODE;
  }

  /** The id of the statement that holds this address's AST entity. */
  public String ownerId() {
    switch (getKind()) {
      case NODE:
        return node();
      case CHOICE:
        return choice().ownerId();
      case BRANCH:
        return branch().ownerId();
    }
    throw new AssertionError(getKind());
  }

  public String encode() {
    switch (getKind()) {
      case NODE:
        return node();
      case CHOICE:
        return choice().ownerId() + CHOICE_SEPARATOR + choice().elementId();
      case BRANCH:
        return branch().ownerId() + BRANCH_SEPARATOR + branch().elementId();
    }
    throw new AssertionError(getKind());
  }

  /**
   * Parses the string form back into an address. Only synthetic forms are recognized: the last
   * separator wins, so owner ids may themselves contain a separator. Returns empty for plain ids.
   */
  public static Optional<Address> parseSynthetic(String encoded) {
    int choiceAt = encoded.lastIndexOf(CHOICE_SEPARATOR);
    int branchAt = encoded.lastIndexOf(BRANCH_SEPARATOR);
    if (choiceAt > branchAt && choiceAt > 0) {
      String key = encoded.substring(choiceAt + CHOICE_SEPARATOR.length());
      if (!key.isEmpty()) return Optional.of(choice(encoded.substring(0, choiceAt), key));
    } else if (branchAt > 0) {
      String key = encoded.substring(branchAt + BRANCH_SEPARATOR.length());
      if (!key.isEmpty()) return Optional.of(branch(encoded.substring(0, branchAt), key));
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return encode();
  }
}
