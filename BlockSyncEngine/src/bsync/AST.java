package bsync;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import bsync.processor.ASTChild;
import bsync.processor.ASTNode;

/**
 * A parsed script: an ordered list of labels, each owning the statement body executed when the
 * label is entered. The engine edits bodies in place, so every list returned here is live.
 */
@ASTNode
public class AST implements AST_ASTNode {

  @ASTNode
  public static final class Label implements AST_Label_ASTNode {
    private final String id;
    private String name;
    private ImmutableList<String> parameters = ImmutableList.of();
    private final List<Statement> body = new ArrayList<>();

    public Label(String id, String name) {
      this.id = Preconditions.checkNotNull(id);
      this.name = Preconditions.checkNotNull(name);
    }

    public String id() {
      return id;
    }

    public String name() {
      return name;
    }

    public void setName(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    public ImmutableList<String> parameters() {
      return parameters;
    }

    public void setParameters(List<String> parameters) {
      this.parameters = ImmutableList.copyOf(parameters);
    }

    @ASTChild
    @Override
    public List<Statement> body() {
      return body;
    }

    @Override
    public String toString() {
      return "label " + name;
    }
  }

  private final List<Label> labels = new ArrayList<>();

  @ASTChild
  @Override
  public List<Label> labels() {
    return labels;
  }

  public Optional<Label> label(String name) {
    return labels.stream().filter(l -> l.name().equals(name)).findFirst();
  }

  public Label addLabel(Label label) {
    Preconditions.checkArgument(
        !label(label.name()).isPresent(), "duplicate label: %s", label.name());
    labels.add(label);
    return label;
  }
}
