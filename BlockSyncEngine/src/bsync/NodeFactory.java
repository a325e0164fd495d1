package bsync;

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * Creates blocks and the AST entities they pair with. The block-to-AST mapping here is lenient:
 * a value that does not parse maps to the statement's default, so a fresh statement can always be
 * created. {@link PropertySync} applies the same mapping strictly to single field edits.
 */
public final class NodeFactory {
  private final IdGenerator ids;

  public NodeFactory(IdGenerator ids) {
    this.ids = Preconditions.checkNotNull(ids);
  }

  /** A new block with a fresh id, default field values and no link. */
  public Block createBlock(BlockKind kind) {
    return new Block(ids.newBlockId(), kind);
  }

  /** A new block with a fresh id and the field values of {@code snapshot}; children not copied. */
  Block copyOf(BlockSnapshot snapshot) {
    Block block = createBlock(snapshot.kind());
    for (Block.Field field : block.fields()) {
      field.setValue(Optional.ofNullable(snapshot.values().get(field.name())));
    }
    return block;
  }

  /**
   * Builds the freestanding statement for a block, or empty for kinds that have none: comments,
   * labels, and choices and branches, which live inside their owner's array.
   */
  public Optional<Statement> createAstNode(BlockKind kind, Block block) {
    Preconditions.checkArgument(block.kind() == kind, "%s is not a %s block", block, kind);
    String id = ids.newNodeId();
    switch (kind) {
      case DIALOGUE:
        Statement.Dialogue dialogue = new Statement.Dialogue(id);
        dialogue.setSpeaker(PropertySync.optional(block, "speaker"));
        dialogue.setText(block.text("text"));
        dialogue.setAttributes(PropertySync.words(block.text("attributes")));
        return Optional.of(dialogue);
      case SCENE:
        Statement.Scene scene = new Statement.Scene(id);
        scene.setImage(block.text("image"));
        scene.setLayer(PropertySync.optional(block, "onLayer"));
        return Optional.of(scene);
      case SHOW:
        Statement.Show show = new Statement.Show(id);
        show.setImage(block.text("character"));
        show.setAtPosition(PropertySync.optional(block, "position"));
        show.setAttributes(PropertySync.words(block.text("expression")));
        return Optional.of(show);
      case HIDE:
        Statement.Hide hide = new Statement.Hide(id);
        hide.setImage(block.text("character"));
        return Optional.of(hide);
      case WITH:
        Statement.With with = new Statement.With(id);
        with.setTransition(
            PropertySync.optional(block, "transition").orElse(Statement.With.DEFAULT_TRANSITION));
        return Optional.of(with);
      case MENU:
        Statement.Menu menu = new Statement.Menu(id);
        menu.setPrompt(PropertySync.optional(block, "prompt"));
        return Optional.of(menu);
      case JUMP:
        Statement.Jump jump = new Statement.Jump(id);
        jump.setTarget(block.text("target"));
        jump.setExpression(flag(block, "expression").orElse(false));
        return Optional.of(jump);
      case CALL:
        Statement.Call call = new Statement.Call(id);
        call.setTarget(block.text("target"));
        call.setArguments(PropertySync.list(block.text("arguments")));
        call.setExpression(flag(block, "expression").orElse(false));
        return Optional.of(call);
      case RETURN:
        Statement.Return ret = new Statement.Return(id);
        ret.setValue(PropertySync.optional(block, "value"));
        return Optional.of(ret);
      case IF:
        Statement.If ifStatement = new Statement.If(id);
        ifStatement.branches().add(new Statement.If.Branch(ids.newNodeId(), condition(block)));
        return Optional.of(ifStatement);
      case PYTHON:
        Statement.Python python = new Statement.Python(id);
        python.setCode(block.text("code"));
        return Optional.of(python);
      case SET:
        Statement.Set set = new Statement.Set(id);
        set.setVariable(block.text("variable"));
        set.setOperator(
            Statement.Set.Operator.forSymbol(block.text("operator"))
                .orElse(Statement.Set.Operator.ASSIGN));
        set.setValue(block.text("value"));
        return Optional.of(set);
      case PLAY_MUSIC:
        return Optional.of(play(new Statement.Play(id, Statement.Channel.MUSIC), block));
      case PLAY_SOUND:
        return Optional.of(play(new Statement.Play(id, Statement.Channel.SOUND), block));
      case STOP_MUSIC:
        Statement.Stop stop = new Statement.Stop(id, Statement.Channel.MUSIC);
        stop.setFadeOut(number(block, "fadeout"));
        return Optional.of(stop);
      case LABEL:
      case CHOICE:
      case ELIF:
      case ELSE:
      case COMMENT:
        return Optional.empty();
    }
    throw new AssertionError(kind);
  }

  /** A menu choice carrying the block's text and condition. */
  public Statement.Menu.Choice createChoice(Block block) {
    Preconditions.checkArgument(block.kind() == BlockKind.CHOICE, block);
    Statement.Menu.Choice choice = new Statement.Menu.Choice(ids.newNodeId(), block.text("text"));
    choice.setCondition(PropertySync.optional(block, "condition"));
    return choice;
  }

  /** An if branch: conditional for {@code elif}, unconditional for {@code else}. */
  public Statement.If.Branch createBranch(Block block) {
    switch (block.kind()) {
      case ELIF:
        return new Statement.If.Branch(ids.newNodeId(), condition(block));
      case ELSE:
        return new Statement.If.Branch(ids.newNodeId(), Optional.empty());
      default:
        throw new IllegalArgumentException("not a branch block: " + block);
    }
  }

  private static Optional<String> condition(Block block) {
    return Optional.of(
        PropertySync.optional(block, "condition").orElse(Statement.If.DEFAULT_CONDITION));
  }

  private static Statement.Play play(Statement.Play play, Block block) {
    play.setFile(block.text("file"));
    play.setFadeIn(number(block, "fadein"));
    play.setLoop(flag(block, "loop"));
    play.setVolume(number(block, "volume"));
    return play;
  }

  private static Optional<Double> number(Block block, String fieldName) {
    return block.value(fieldName).flatMap(FieldValue::asNumber);
  }

  private static Optional<Boolean> flag(Block block, String fieldName) {
    return block.value(fieldName).flatMap(FieldValue::asFlag);
  }
}
