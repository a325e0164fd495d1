package bsync;

import static bsync.TestScript.assertSynchronized;
import static bsync.TestScript.block;
import static bsync.TestScript.childIds;
import static bsync.TestScript.label;
import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ClipboardTest {
  private final TestScript script = new TestScript();
  private final SyncEngine engine = script.engine;
  private EditContext ctx;
  private String rootId;

  @BeforeEach
  public void setUp() {
    ctx = script.open("start");
    rootId = ctx.root().id();
  }

  private static int blockCount(BlockSnapshot snapshot) {
    int count = 1;
    for (BlockSnapshot child : snapshot.children()) {
      count += blockCount(child);
    }
    return count;
  }

  private String dialogue(String text) {
    String id = script.add(ctx, BlockKind.DIALOGUE);
    assertThat(engine.updateField(ctx, id, "speaker", "eileen").success()).isTrue();
    assertThat(engine.updateField(ctx, id, "text", text).success()).isTrue();
    return id;
  }

  @Test
  public void pastedCopyIsIndependent() {
    String original = dialogue("Hello");
    Clipboard clipboard = engine.copy(ctx, original).get();

    OperationResult pasted = engine.paste(ctx, clipboard, rootId, 1);
    assertThat(pasted.success()).isTrue();
    String clone = pasted.blockId().get();

    assertThat(clone).isNotEqualTo(original);
    assertThat(block(ctx, clone).link()).isNotEqualTo(block(ctx, original).link());
    assertThat(block(ctx, clone).fieldValues()).isEqualTo(block(ctx, original).fieldValues());

    assertThat(engine.updateField(ctx, original, "text", "Changed").success()).isTrue();
    assertThat(block(ctx, clone).text("text")).isEqualTo("Hello");
    assertThat(((Statement.Dialogue) TestScript.statement(ctx, clone)).text()).isEqualTo("Hello");
    assertThat(clipboard.blocks().get(0).values().get("text").asText()).isEqualTo("Hello");
    assertSynchronized(ctx);
  }

  @Test
  public void clipboardRecordsSource() {
    String id = dialogue("Hi");

    Clipboard clipboard = engine.copy(ctx, id).get();

    assertThat(clipboard.sourceLabel()).isEqualTo("start");
    assertThat(clipboard.timestamp()).isEqualTo(TestScript.NOW);
    assertThat(clipboard.blocks()).hasSize(1);
    assertThat(clipboard.blocks().get(0).sourceId()).isEqualTo(id);
    assertThat(engine.copy(ctx, "missing")).isEmpty();
    assertThat(engine.copy(ctx, ImmutableList.of(id, "missing"))).isEmpty();
  }

  @Test
  public void pasteRebuildsMenu() {
    String menu = script.add(ctx, BlockKind.MENU);
    String choice = script.add(ctx, BlockKind.CHOICE, menu, 0);
    assertThat(engine.updateField(ctx, choice, "text", "Go north").success()).isTrue();
    script.add(ctx, BlockKind.JUMP, choice, 0);
    script.add(ctx, BlockKind.CHOICE, menu, 1);
    Clipboard clipboard = engine.copy(ctx, menu).get();
    assertThat(blockCount(clipboard.blocks().get(0))).isEqualTo(4);

    OperationResult pasted = engine.paste(ctx, clipboard, rootId, 1);

    assertThat(pasted.success()).isTrue();
    Statement.Menu copy = TestScript.statement(ctx, pasted.blockId().get());
    Statement.Menu source = TestScript.statement(ctx, menu);
    assertThat(copy).isNotSameInstanceAs(source);
    assertThat(copy.choices()).hasSize(2);
    assertThat(copy.choices().get(0).text()).isEqualTo("Go north");
    assertThat(copy.choices().get(0).id()).isNotEqualTo(source.choices().get(0).id());
    assertThat(copy.choices().get(0).body()).hasSize(1);
    assertThat(label(ctx).body()).hasSize(2);
    assertSynchronized(ctx);
  }

  @Test
  public void pasteRebuildsIfBranches() {
    String ifBlock = script.add(ctx, BlockKind.IF);
    assertThat(engine.updateField(ctx, ifBlock, "condition", "points > 3").success()).isTrue();
    script.add(ctx, BlockKind.SHOW, ifBlock, 0);
    String elif = script.add(ctx, BlockKind.ELIF, ifBlock, 0);
    assertThat(engine.updateField(ctx, elif, "condition", "points > 1").success()).isTrue();
    script.add(ctx, BlockKind.HIDE, elif, 0);
    script.add(ctx, BlockKind.ELSE, ifBlock, 0);
    Clipboard clipboard = engine.copy(ctx, ifBlock).get();

    OperationResult pasted = engine.paste(ctx, clipboard, rootId, 0);

    assertThat(pasted.success()).isTrue();
    Statement.If copy = TestScript.statement(ctx, pasted.blockId().get());
    assertThat(copy.branches()).hasSize(3);
    assertThat(copy.branches().get(0).condition()).hasValue("points > 3");
    assertThat(copy.branches().get(1).condition()).hasValue("points > 1");
    assertThat(copy.branches().get(1).body()).hasSize(1);
    assertThat(copy.branches().get(2).isElse()).isTrue();
    assertSynchronized(ctx);
  }

  @Test
  public void pasteSeveralInOrder() {
    String a = dialogue("a");
    String b = dialogue("b");
    Clipboard clipboard = engine.copy(ctx, ImmutableList.of(a, b)).get();

    OperationResult pasted = engine.paste(ctx, clipboard, rootId, 0);

    assertThat(pasted.blockIds()).hasSize(2);
    assertThat(childIds(ctx.root()))
        .containsExactly(pasted.blockIds().get(0), pasted.blockIds().get(1), a, b)
        .inOrder();
    assertThat(block(ctx, pasted.blockIds().get(0)).text("text")).isEqualTo("a");
    assertSynchronized(ctx);
  }

  @Test
  public void pasteAfterLeafParent() {
    String a = dialogue("a");
    String b = dialogue("b");
    Clipboard clipboard = engine.copy(ctx, b).get();

    OperationResult pasted = engine.paste(ctx, clipboard, a, 0);

    assertThat(childIds(ctx.root())).containsExactly(a, pasted.blockId().get(), b).inOrder();
    assertSynchronized(ctx);
  }

  @Test
  public void pasteIntoAnotherLabel() {
    String a = dialogue("a");
    Clipboard clipboard = engine.copy(ctx, a).get();
    EditContext other = script.open("other");

    assertThat(engine.paste(other, clipboard, other.root().id(), 0).success()).isTrue();

    assertThat(other.root().children()).hasSize(1);
    assertThat(label(other).body()).hasSize(1);
    assertThat(label(ctx).body()).hasSize(1);
  }

  @Test
  public void emptyClipboardRejected() {
    Clipboard empty = Clipboard.create(ImmutableList.of(), "start", TestScript.NOW);

    OperationResult result = engine.paste(ctx, empty, rootId, 0);

    assertThat(result.failure().get().kind()).isEqualTo(Failure.Kind.EMPTY_INPUT);
  }

  @Test
  public void pasteIsAllOrNothing() {
    String a = dialogue("a");
    String menu = script.add(ctx, BlockKind.MENU);
    String choice = script.add(ctx, BlockKind.CHOICE, menu, 0);
    Clipboard clipboard = engine.copy(ctx, ImmutableList.of(a, choice)).get();

    OperationResult result = engine.paste(ctx, clipboard, rootId, 0);

    assertThat(result.failure().get().kind()).isEqualTo(Failure.Kind.STRUCTURAL);
    assertThat(childIds(ctx.root())).containsExactly(a, menu).inOrder();
    assertThat(label(ctx).body()).hasSize(2);
    assertSynchronized(ctx);
  }

  @Test
  public void snapshotIsDeep() {
    String menu = script.add(ctx, BlockKind.MENU);
    String choice = script.add(ctx, BlockKind.CHOICE, menu, 0);
    BlockSnapshot snapshot = block(ctx, menu).snapshot();

    assertThat(engine.delete(ctx, choice).success()).isTrue();

    assertThat(snapshot.children()).hasSize(1);
    assertThat(snapshot.children().get(0).kind()).isEqualTo(BlockKind.CHOICE);
    assertThat(snapshot.sourceLink()).isEqualTo(block(ctx, menu).link());
    assertThat(snapshot.values()).isEqualTo(block(ctx, menu).fieldValues());
    assertThat(blockCount(snapshot)).isEqualTo(2);
  }
}
