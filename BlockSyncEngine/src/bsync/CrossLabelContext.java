package bsync;

import com.google.auto.value.AutoValue;

/** Two open labels of the same script, for moves from one to the other. */
@AutoValue
public abstract class CrossLabelContext {
  public abstract AST ast();

  public abstract String sourceLabel();

  public abstract Block sourceRoot();

  public abstract String targetLabel();

  public abstract Block targetRoot();

  public static CrossLabelContext create(
      AST ast, String sourceLabel, Block sourceRoot, String targetLabel, Block targetRoot) {
    return new AutoValue_CrossLabelContext(ast, sourceLabel, sourceRoot, targetLabel, targetRoot);
  }

  EditContext source() {
    return EditContext.create(ast(), sourceLabel(), sourceRoot());
  }

  EditContext target() {
    return EditContext.create(ast(), targetLabel(), targetRoot());
  }
}
