package bsync;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/** A script under edit, with helpers that assert on both trees at once. */
final class TestScript {
  static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  final AST ast = new AST();
  final SyncEngine engine =
      new SyncEngine(
          EngineConfig.builder()
              .setIdGenerator(IdGenerator.sequential())
              .setClock(Clock.fixed(NOW, ZoneOffset.UTC))
              .build());

  /** Opens a label for editing, creating it if the script does not have it yet. */
  EditContext open(String labelName) {
    AST.Label label =
        ast.label(labelName)
            .orElseGet(() -> ast.addLabel(new AST.Label("L_" + labelName, labelName)));
    Block root = new BlockTreeBuilder(engine.nodeFactory()).build(label);
    return EditContext.create(ast, labelName, root);
  }

  static AST.Label label(EditContext ctx) {
    return ctx.ast().label(ctx.labelName()).get();
  }

  String add(EditContext ctx, BlockKind kind, String parentId, int index) {
    OperationResult result = engine.add(ctx, kind, parentId, index);
    assertWithMessage("add %s: %s", kind, result).that(result.success()).isTrue();
    return result.blockId().get();
  }

  String add(EditContext ctx, BlockKind kind) {
    return add(ctx, kind, ctx.root().id(), Integer.MAX_VALUE);
  }

  static Block block(EditContext ctx, String blockId) {
    return AddressResolver.findBlock(ctx.root(), blockId).get();
  }

  static <T extends Statement> T statement(EditContext ctx, String blockId) {
    String nodeId = block(ctx, blockId).link().get().node();
    return AddressResolver.findAstNode(label(ctx), nodeId).get().cast();
  }

  static AstTarget target(EditContext ctx, String blockId) {
    return AddressResolver.resolve(block(ctx, blockId).link().get(), label(ctx)).get();
  }

  static ImmutableList<String> childIds(Block block) {
    return block.children().stream().map(Block::id).collect(ImmutableList.toImmutableList());
  }

  static ImmutableList<String> statementIds(List<Statement> body) {
    return body.stream().map(Statement::id).collect(ImmutableList.toImmutableList());
  }

  static ImmutableList<String> linkedIds(EditContext ctx, String... blockIds) {
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (String blockId : blockIds) {
      builder.add(block(ctx, blockId).link().get().node());
    }
    return builder.build();
  }

  /** Checks that every container's children match its AST entity, recursively. */
  static void assertSynchronized(EditContext ctx) {
    AST.Label label = label(ctx);
    assertBody(ctx.root(), label.body());
    assertThat(AddressResolver.countBlocks(ctx.root(), true))
        .isEqualTo(AddressResolver.countAstEntities(label));
  }

  private static void assertBody(Block container, List<Statement> body) {
    List<Block> statementBlocks =
        container.children().stream()
            .filter(b -> b.kind().pairing() == BlockKind.Pairing.STATEMENT)
            .collect(Collectors.toList());
    assertWithMessage("statements of %s", container)
        .that(statementBlocks.stream().map(b -> b.link().get().node()).collect(Collectors.toList()))
        .containsExactlyElementsIn(statementIds(body))
        .inOrder();
    for (int i = 0; i < body.size(); i++) {
      assertNested(statementBlocks.get(i), body.get(i));
    }
  }

  private static void assertNested(Block block, Statement statement) {
    switch (block.kind()) {
      case MENU:
        Statement.Menu menu = statement.cast();
        assertWithMessage("choices of %s", block)
            .that(
                block.children().stream()
                    .map(c -> c.link().get().choice().elementId())
                    .collect(Collectors.toList()))
            .containsExactlyElementsIn(
                menu.choices().stream().map(Statement.Menu.Choice::id).collect(Collectors.toList()))
            .inOrder();
        for (int i = 0; i < menu.choices().size(); i++) {
          assertBody(block.children().get(i), menu.choices().get(i).body());
        }
        break;
      case IF:
        Statement.If ifStatement = statement.cast();
        assertBody(block, ifStatement.branches().get(0).body());
        List<Block> branchBlocks =
            block.children().stream()
                .filter(b -> b.kind().isArrayElement())
                .collect(Collectors.toList());
        List<Statement.If.Branch> branches =
            ifStatement.branches().subList(1, ifStatement.branches().size());
        assertWithMessage("branches of %s", block)
            .that(
                branchBlocks.stream()
                    .map(b -> b.link().get().branch().elementId())
                    .collect(Collectors.toList()))
            .containsExactlyElementsIn(
                branches.stream().map(Statement.If.Branch::id).collect(Collectors.toList()))
            .inOrder();
        for (int i = 0; i < branches.size(); i++) {
          assertBody(branchBlocks.get(i), branches.get(i).body());
        }
        break;
      default:
        assertThat(block.children()).isEmpty();
    }
  }
}
