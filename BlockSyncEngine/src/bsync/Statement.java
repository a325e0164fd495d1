package bsync;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import bsync.processor.ASTChild;
import bsync.processor.ASTNode;

/** A statement inside a label body, a menu choice body or an if branch body. */
public abstract class Statement implements ASTNodeInterface {

  public static enum Type {
    DIALOGUE,
    SCENE,
    SHOW,
    HIDE,
    WITH,
    MENU,
    JUMP,
    CALL,
    RETURN,
    IF,
    SET,
    PYTHON,
    PLAY,
    STOP;

    public String keyword() {
      return name().toLowerCase();
    }
  }

  private final String id;
  private final Type type;

  protected Statement(Type type, String id) {
    this.type = type;
    this.id = Preconditions.checkNotNull(id);
  }

  public final String id() {
    return id;
  }

  public final Type type() {
    return type;
  }

  @SuppressWarnings("unchecked")
  public <T extends Statement> T cast() {
    return (T) this;
  }

  @Override
  public String toString() {
    return type.keyword() + "#" + id;
  }

  @ASTNode
  public static final class Dialogue extends Statement implements Statement_Dialogue_ASTNode {
    private Optional<String> speaker = Optional.empty();
    private String text = "";
    private ImmutableList<String> attributes = ImmutableList.of();

    public Dialogue(String id) {
      super(Type.DIALOGUE, id);
    }

    public Dialogue(String id, Optional<String> speaker, String text) {
      this(id);
      setSpeaker(speaker);
      setText(text);
    }

    /** Empty for narration. */
    public Optional<String> speaker() {
      return speaker;
    }

    public void setSpeaker(Optional<String> speaker) {
      this.speaker = Preconditions.checkNotNull(speaker);
    }

    public String text() {
      return text;
    }

    public void setText(String text) {
      this.text = Preconditions.checkNotNull(text);
    }

    public ImmutableList<String> attributes() {
      return attributes;
    }

    public void setAttributes(List<String> attributes) {
      this.attributes = ImmutableList.copyOf(attributes);
    }
  }

  @ASTNode
  public static final class Scene extends Statement implements Statement_Scene_ASTNode {
    private String image = "";
    private Optional<String> layer = Optional.empty();

    public Scene(String id) {
      super(Type.SCENE, id);
    }

    public String image() {
      return image;
    }

    public void setImage(String image) {
      this.image = Preconditions.checkNotNull(image);
    }

    public Optional<String> layer() {
      return layer;
    }

    public void setLayer(Optional<String> layer) {
      this.layer = Preconditions.checkNotNull(layer);
    }
  }

  @ASTNode
  public static final class Show extends Statement implements Statement_Show_ASTNode {
    private String image = "";
    private ImmutableList<String> attributes = ImmutableList.of();
    private Optional<String> atPosition = Optional.empty();

    public Show(String id) {
      super(Type.SHOW, id);
    }

    public String image() {
      return image;
    }

    public void setImage(String image) {
      this.image = Preconditions.checkNotNull(image);
    }

    public ImmutableList<String> attributes() {
      return attributes;
    }

    public void setAttributes(List<String> attributes) {
      this.attributes = ImmutableList.copyOf(attributes);
    }

    public Optional<String> atPosition() {
      return atPosition;
    }

    public void setAtPosition(Optional<String> atPosition) {
      this.atPosition = Preconditions.checkNotNull(atPosition);
    }
  }

  @ASTNode
  public static final class Hide extends Statement implements Statement_Hide_ASTNode {
    private String image = "";

    public Hide(String id) {
      super(Type.HIDE, id);
    }

    public String image() {
      return image;
    }

    public void setImage(String image) {
      this.image = Preconditions.checkNotNull(image);
    }
  }

  @ASTNode
  public static final class With extends Statement implements Statement_With_ASTNode {
    public static final String DEFAULT_TRANSITION = "dissolve";

    private String transition = DEFAULT_TRANSITION;

    public With(String id) {
      super(Type.WITH, id);
    }

    public String transition() {
      return transition;
    }

    public void setTransition(String transition) {
      this.transition = Preconditions.checkNotNull(transition);
    }
  }

  @ASTNode
  public static final class Menu extends Statement implements Statement_Menu_ASTNode {
    @ASTNode
    public static final class Choice implements Statement_Menu_Choice_ASTNode {
      private final String id;
      private String text;
      private Optional<String> condition = Optional.empty();
      private final List<Statement> body = new ArrayList<>();

      public Choice(String id, String text) {
        this.id = Preconditions.checkNotNull(id);
        this.text = Preconditions.checkNotNull(text);
      }

      /** Stable key of this choice within its menu; never derived from the text. */
      public String id() {
        return id;
      }

      public String text() {
        return text;
      }

      public void setText(String text) {
        this.text = Preconditions.checkNotNull(text);
      }

      public Optional<String> condition() {
        return condition;
      }

      public void setCondition(Optional<String> condition) {
        this.condition = Preconditions.checkNotNull(condition);
      }

      @ASTChild
      @Override
      public List<Statement> body() {
        return body;
      }

      @Override
      public String toString() {
        return "choice#" + id + " \"" + text + "\"";
      }
    }

    private Optional<String> prompt = Optional.empty();
    private final List<Choice> choices = new ArrayList<>();

    public Menu(String id) {
      super(Type.MENU, id);
    }

    public Optional<String> prompt() {
      return prompt;
    }

    public void setPrompt(Optional<String> prompt) {
      this.prompt = Preconditions.checkNotNull(prompt);
    }

    @ASTChild
    @Override
    public List<Choice> choices() {
      return choices;
    }

    public Optional<Choice> choice(String choiceId) {
      return choices.stream().filter(c -> c.id().equals(choiceId)).findFirst();
    }
  }

  @ASTNode
  public static final class Jump extends Statement implements Statement_Jump_ASTNode {
    private String target = "";
    private boolean expression = false;

    public Jump(String id) {
      super(Type.JUMP, id);
    }

    public String target() {
      return target;
    }

    public void setTarget(String target) {
      this.target = Preconditions.checkNotNull(target);
    }

    /** True if {@link #target()} is an expression evaluated at runtime rather than a label. */
    public boolean expression() {
      return expression;
    }

    public void setExpression(boolean expression) {
      this.expression = expression;
    }
  }

  @ASTNode
  public static final class Call extends Statement implements Statement_Call_ASTNode {
    private String target = "";
    private ImmutableList<String> arguments = ImmutableList.of();
    private boolean expression = false;

    public Call(String id) {
      super(Type.CALL, id);
    }

    public String target() {
      return target;
    }

    public void setTarget(String target) {
      this.target = Preconditions.checkNotNull(target);
    }

    public ImmutableList<String> arguments() {
      return arguments;
    }

    public void setArguments(List<String> arguments) {
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public boolean expression() {
      return expression;
    }

    public void setExpression(boolean expression) {
      this.expression = expression;
    }
  }

  @ASTNode
  public static final class Return extends Statement implements Statement_Return_ASTNode {
    private Optional<String> value = Optional.empty();

    public Return(String id) {
      super(Type.RETURN, id);
    }

    public Optional<String> value() {
      return value;
    }

    public void setValue(Optional<String> value) {
      this.value = Preconditions.checkNotNull(value);
    }
  }

  @ASTNode
  public static final class If extends Statement implements Statement_If_ASTNode {
    public static final String DEFAULT_CONDITION = "True";

    @ASTNode
    public static final class Branch implements Statement_If_Branch_ASTNode {
      private final String id;
      private Optional<String> condition;
      private final List<Statement> body = new ArrayList<>();

      public Branch(String id, Optional<String> condition) {
        this.id = Preconditions.checkNotNull(id);
        this.condition = Preconditions.checkNotNull(condition);
      }

      public String id() {
        return id;
      }

      /** Empty for an {@code else} branch. */
      public Optional<String> condition() {
        return condition;
      }

      public void setCondition(Optional<String> condition) {
        this.condition = Preconditions.checkNotNull(condition);
      }

      public boolean isElse() {
        return !condition.isPresent();
      }

      @ASTChild
      @Override
      public List<Statement> body() {
        return body;
      }

      @Override
      public String toString() {
        return "branch#" + id + condition.map(c -> " " + c).orElse(" else");
      }
    }

    private final List<Branch> branches = new ArrayList<>();

    public If(String id) {
      super(Type.IF, id);
    }

    @ASTChild
    @Override
    public List<Branch> branches() {
      return branches;
    }

    public Optional<Branch> branch(String branchId) {
      return branches.stream().filter(b -> b.id().equals(branchId)).findFirst();
    }

    public boolean hasElseBranch() {
      return !branches.isEmpty() && branches.get(branches.size() - 1).isElse();
    }
  }

  @ASTNode
  public static final class Set extends Statement implements Statement_Set_ASTNode {
    public static enum Operator {
      ASSIGN("="),
      ADD("+="),
      SUBTRACT("-="),
      MULTIPLY("*="),
      DIVIDE("/=");

      private final String symbol;

      Operator(String symbol) {
        this.symbol = symbol;
      }

      public String symbol() {
        return symbol;
      }

      private static final ImmutableMap<String, Operator> BY_SYMBOL =
          Arrays.stream(values()).collect(ImmutableMap.toImmutableMap(o -> o.symbol, o -> o));

      public static Optional<Operator> forSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol.trim()));
      }
    }

    private String variable = "";
    private Operator operator = Operator.ASSIGN;
    private String value = "";

    public Set(String id) {
      super(Type.SET, id);
    }

    public String variable() {
      return variable;
    }

    public void setVariable(String variable) {
      this.variable = Preconditions.checkNotNull(variable);
    }

    public Operator operator() {
      return operator;
    }

    public void setOperator(Operator operator) {
      this.operator = Preconditions.checkNotNull(operator);
    }

    public String value() {
      return value;
    }

    public void setValue(String value) {
      this.value = Preconditions.checkNotNull(value);
    }
  }

  @ASTNode
  public static final class Python extends Statement implements Statement_Python_ASTNode {
    private String code = "";

    public Python(String id) {
      super(Type.PYTHON, id);
    }

    public String code() {
      return code;
    }

    public void setCode(String code) {
      this.code = Preconditions.checkNotNull(code);
    }
  }

  public static enum Channel {
    MUSIC,
    SOUND,
    VOICE;
  }

  @ASTNode
  public static final class Play extends Statement implements Statement_Play_ASTNode {
    private final Channel channel;
    private String file = "";
    private Optional<Double> fadeIn = Optional.empty();
    private Optional<Boolean> loop = Optional.empty();
    private Optional<Double> volume = Optional.empty();

    public Play(String id, Channel channel) {
      super(Type.PLAY, id);
      this.channel = Preconditions.checkNotNull(channel);
    }

    public Channel channel() {
      return channel;
    }

    public String file() {
      return file;
    }

    public void setFile(String file) {
      this.file = Preconditions.checkNotNull(file);
    }

    /** Seconds. */
    public Optional<Double> fadeIn() {
      return fadeIn;
    }

    public void setFadeIn(Optional<Double> fadeIn) {
      this.fadeIn = Preconditions.checkNotNull(fadeIn);
    }

    public Optional<Boolean> loop() {
      return loop;
    }

    public void setLoop(Optional<Boolean> loop) {
      this.loop = Preconditions.checkNotNull(loop);
    }

    public Optional<Double> volume() {
      return volume;
    }

    public void setVolume(Optional<Double> volume) {
      this.volume = Preconditions.checkNotNull(volume);
    }
  }

  @ASTNode
  public static final class Stop extends Statement implements Statement_Stop_ASTNode {
    private final Channel channel;
    private Optional<Double> fadeOut = Optional.empty();

    public Stop(String id, Channel channel) {
      super(Type.STOP, id);
      this.channel = Preconditions.checkNotNull(channel);
    }

    public Channel channel() {
      return channel;
    }

    public Optional<Double> fadeOut() {
      return fadeOut;
    }

    public void setFadeOut(Optional<Double> fadeOut) {
      this.fadeOut = Preconditions.checkNotNull(fadeOut);
    }
  }
}
