package bsync;

import com.google.auto.value.AutoValue;

/** The trees one edit works on: a script, the name of the open label and that label's blocks. */
@AutoValue
public abstract class EditContext {
  public abstract AST ast();

  public abstract String labelName();

  /** The label root block of the open label. */
  public abstract Block root();

  public static EditContext create(AST ast, String labelName, Block root) {
    return new AutoValue_EditContext(ast, labelName, root);
  }
}
