package bsync;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class BlockTreeBuilderTest {
  private final BlockTreeBuilder builder =
      new BlockTreeBuilder(new NodeFactory(IdGenerator.sequential()));

  private static ImmutableList<BlockKind> kinds(List<Block> blocks) {
    return blocks.stream().map(Block::kind).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void labelFields() {
    AST.Label label = new AST.Label("L1", "chapter_one");
    label.setParameters(ImmutableList.of("who", "mood"));

    Block root = builder.build(label);

    assertThat(root.kind()).isEqualTo(BlockKind.LABEL);
    assertThat(root.text("name")).isEqualTo("chapter_one");
    assertThat(root.text("parameters")).isEqualTo("who, mood");
    assertThat(root.link()).hasValue(Address.node("L1"));
    assertThat(root.children()).isEmpty();
  }

  @Test
  public void statementFields() {
    AST.Label label = new AST.Label("L1", "start");
    Statement.Show show = new Statement.Show("s1");
    show.setImage("eileen");
    show.setAttributes(ImmutableList.of("happy", "blush"));
    show.setAtPosition(Optional.of("left"));
    label.body().add(show);
    Statement.Call call = new Statement.Call("c1");
    call.setTarget("shop");
    call.setArguments(ImmutableList.of("1", "2"));
    label.body().add(call);
    Statement.Set set = new Statement.Set("v1");
    set.setVariable("gold");
    set.setOperator(Statement.Set.Operator.SUBTRACT);
    set.setValue("5");
    label.body().add(set);
    Statement.Play voice = new Statement.Play("a1", Statement.Channel.VOICE);
    voice.setFile("line01.ogg");
    voice.setVolume(Optional.of(0.5));
    label.body().add(voice);

    Block root = builder.build(label);

    assertThat(kinds(root.children()))
        .containsExactly(BlockKind.SHOW, BlockKind.CALL, BlockKind.SET, BlockKind.PLAY_SOUND)
        .inOrder();
    Block showBlock = root.children().get(0);
    assertThat(showBlock.text("character")).isEqualTo("eileen");
    assertThat(showBlock.text("expression")).isEqualTo("happy blush");
    assertThat(showBlock.text("position")).isEqualTo("left");
    assertThat(showBlock.link()).hasValue(Address.node("s1"));
    assertThat(root.children().get(1).text("arguments")).isEqualTo("1, 2");
    assertThat(root.children().get(1).text("expression")).isEqualTo("false");
    assertThat(root.children().get(2).text("operator")).isEqualTo("-=");
    assertThat(root.children().get(3).value("volume")).hasValue(FieldValue.of(0.5));
    assertThat(root.children().get(3).value("fadein")).isEmpty();
  }

  @Test
  public void nestedStructure() {
    AST.Label label = new AST.Label("L1", "start");
    Statement.Menu menu = new Statement.Menu("m1");
    Statement.Menu.Choice choice = new Statement.Menu.Choice("c1", "Left");
    choice.setCondition(Optional.of("brave"));
    choice.body().add(new Statement.Hide("h1"));
    menu.choices().add(choice);
    menu.choices().add(new Statement.Menu.Choice("c2", "Right"));
    label.body().add(menu);
    Statement.If ifStatement = new Statement.If("i1");
    Statement.If.Branch first = new Statement.If.Branch("b0", Optional.of("gold > 3"));
    first.body().add(new Statement.With("w1"));
    Statement.If.Branch second = new Statement.If.Branch("b1", Optional.of("gold > 1"));
    second.body().add(new Statement.Python("p1"));
    ifStatement.branches().add(first);
    ifStatement.branches().add(second);
    ifStatement.branches().add(new Statement.If.Branch("b2", Optional.empty()));
    label.body().add(ifStatement);

    Block root = builder.build(label);

    Block menuBlock = root.children().get(0);
    assertThat(kinds(menuBlock.children())).containsExactly(BlockKind.CHOICE, BlockKind.CHOICE);
    Block left = menuBlock.children().get(0);
    assertThat(left.link()).hasValue(Address.choice("m1", "c1"));
    assertThat(left.text("text")).isEqualTo("Left");
    assertThat(left.text("condition")).isEqualTo("brave");
    assertThat(kinds(left.children())).containsExactly(BlockKind.HIDE);

    Block ifBlock = root.children().get(1);
    assertThat(ifBlock.text("condition")).isEqualTo("gold > 3");
    assertThat(kinds(ifBlock.children()))
        .containsExactly(BlockKind.WITH, BlockKind.ELIF, BlockKind.ELSE)
        .inOrder();
    Block elif = ifBlock.children().get(1);
    assertThat(elif.link()).hasValue(Address.branch("i1", "b1"));
    assertThat(elif.text("condition")).isEqualTo("gold > 1");
    assertThat(kinds(elif.children())).containsExactly(BlockKind.PYTHON);
    assertThat(ifBlock.children().get(2).link()).hasValue(Address.branch("i1", "b2"));

    assertThat(AddressResolver.countBlocks(root, true))
        .isEqualTo(AddressResolver.countAstEntities(label));
  }

  @Test
  public void builtTreeIsEditable() {
    TestScript script = new TestScript();
    AST.Label label = script.ast.addLabel(new AST.Label("L1", "start"));
    Statement.Menu menu = new Statement.Menu("m1");
    menu.choices().add(new Statement.Menu.Choice("c1", "Only"));
    label.body().add(menu);
    EditContext ctx = script.open("start");
    String choiceId = ctx.root().children().get(0).children().get(0).id();

    script.add(ctx, BlockKind.DIALOGUE, choiceId, 0);
    script.add(ctx, BlockKind.CHOICE, ctx.root().children().get(0).id(), 0);

    assertThat(menu.choices()).hasSize(2);
    assertThat(menu.choices().get(1).body()).hasSize(1);
    TestScript.assertSynchronized(ctx);
  }
}
