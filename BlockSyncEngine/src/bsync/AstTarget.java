package bsync;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoOneOf;

/** The AST entity an {@link Address} resolves to. */
@AutoOneOf(AstTarget.Kind.class)
public abstract class AstTarget {
  public enum Kind {
    STATEMENT,
    CHOICE,
    BRANCH
  }

  public abstract Kind getKind();

  public abstract Statement statement();

  public abstract Statement.Menu.Choice choice();

  public abstract Statement.If.Branch branch();

  static AstTarget of(Statement statement) {
    return AutoOneOf_AstTarget.statement(statement);
  }

  static AstTarget of(Statement.Menu.Choice choice) {
    return AutoOneOf_AstTarget.choice(choice);
  }

  static AstTarget of(Statement.If.Branch branch) {
    return AutoOneOf_AstTarget.branch(branch);
  }

  /** The id the entity carries in the AST. */
  public String id() {
    switch (getKind()) {
      case STATEMENT:
        return statement().id();
      case CHOICE:
        return choice().id();
      case BRANCH:
        return branch().id();
    }
    throw new AssertionError(getKind());
  }

  /**
   * The statement list owned by this entity, if it has exactly one. For an {@code if} statement
   * this is the body of its leading branch.
   */
  public Optional<List<Statement>> body() {
    switch (getKind()) {
      case STATEMENT:
        if (statement().type() == Statement.Type.IF) {
          Statement.If ifStatement = statement().cast();
          return ifStatement.branches().isEmpty()
              ? Optional.empty()
              : Optional.of(ifStatement.branches().get(0).body());
        }
        return Optional.empty();
      case CHOICE:
        return Optional.of(choice().body());
      case BRANCH:
        return Optional.of(branch().body());
    }
    throw new AssertionError(getKind());
  }
}
