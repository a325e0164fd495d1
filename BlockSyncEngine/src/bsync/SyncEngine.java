package bsync;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Structural edits on a label's block tree, each mirrored onto the AST.
 *
 * <p>Every entry point mutates the block tree first and the AST second, recording each step in an
 * {@link EditLog}. When any step fails the log is rolled back and a failed {@link
 * OperationResult} is returned, so callers see either both trees updated or neither touched.
 *
 * <p>Index arguments are clamped into range rather than rejected. Under an {@code if} block the
 * true-branch statements come first and {@code elif}/{@code else} blocks last; statement inserts
 * are clamped into the leading segment. Branches are not strictly appended: a new {@code elif} is
 * inserted ahead of an existing {@code else}, which always stays last.
 */
public final class SyncEngine {
  private final EngineConfig config;
  private final NodeFactory factory;
  private final PropertySync propertySync = new PropertySync();

  public SyncEngine(EngineConfig config) {
    this.config = Preconditions.checkNotNull(config);
    this.factory = new NodeFactory(config.idGenerator());
  }

  public SyncEngine() {
    this(EngineConfig.defaults());
  }

  public NodeFactory nodeFactory() {
    return factory;
  }

  @FunctionalInterface
  private interface Operation {
    OperationResult apply(EditLog log) throws SyncException;
  }

  private static OperationResult transact(Operation operation) {
    EditLog log = new EditLog();
    try {
      return operation.apply(log);
    } catch (SyncException ex) {
      log.rollback();
      return OperationResult.failed(ex.failure());
    } catch (RuntimeException ex) {
      log.rollback();
      throw ex;
    }
  }

  /** Creates a block of {@code kind} and its AST counterpart under {@code parentId}. */
  public OperationResult add(EditContext ctx, BlockKind kind, String parentId, int index) {
    return transact(
        log -> {
          AST.Label label = label(ctx);
          Block parent = block(ctx.root(), parentId);
          Slot slot = slot(ctx.root(), parent, kind, index);

          Block block = factory.createBlock(kind);
          insert(block, slot.parent, slot.index, label, log);
          return OperationResult.ok(block.id());
        });
  }

  /** Removes a block with its subtree, and whatever of its AST counterpart exists. */
  public OperationResult delete(EditContext ctx, String blockId) {
    return transact(
        log -> {
          AST.Label label = label(ctx);
          BlockLocation location = locate(ctx.root(), blockId);
          if (location.isRoot()) {
            throw new SyncException(Failure.structural("the label root cannot be deleted"));
          }

          Block block = location.block();
          log.remove(location.parent().get().children(), location.index());
          removeFromAst(block, label, log);
          for (Block descendant : descendants(block)) {
            removeFromAst(descendant, label, log);
          }
          return OperationResult.ok();
        });
  }

  /** Moves a block within the open label, its AST entity following. */
  public OperationResult move(EditContext ctx, String blockId, String newParentId, int newIndex) {
    return transact(
        log -> {
          AST.Label label = label(ctx);
          BlockLocation location = locate(ctx.root(), blockId);
          Block block = location.block();
          checkMovable(location);

          Block newParent = block(ctx.root(), newParentId);
          checkAccepts(newParent, block.kind());
          if (AddressResolver.contains(block, newParent)) {
            throw new SyncException(
                Failure.structural("cannot move %s into its own subtree", block));
          }

          Block oldParent = location.parent().get();
          log.remove(oldParent.children(), location.index());
          int target = newIndex;
          if (oldParent == newParent && location.index() < newIndex) target--;
          int at = clampChildIndex(newParent, block.kind(), target);
          log.insert(newParent.children(), at, block);

          switch (block.kind().pairing()) {
            case CHOICE:
              moveChoice(block, newParent, at, label, log);
              break;
            case STATEMENT:
              Statement node = statement(block, label);
              log.remove(AddressResolver.findContainingBody(label, node.id()).get(), node);
              List<Statement> body = body(newParent, label);
              log.insert(body, astIndex(newParent, at, body), node);
              break;
            default:
              break;
          }
          return OperationResult.ok();
        });
  }

  private void moveChoice(Block block, Block newMenuBlock, int at, AST.Label label, EditLog log)
      throws SyncException {
    Address.Element address = block.link().get().choice();
    Statement.Menu oldMenu = menu(address.ownerId(), label);
    Optional<Statement.Menu.Choice> choice = oldMenu.choice(address.elementId());
    if (!choice.isPresent()) {
      throw new SyncException(Failure.notFound("no choice %s", block.link().get()));
    }

    Statement.Menu newMenu = menu(newMenuBlock, label);
    log.remove(oldMenu.choices(), choice.get());
    log.insert(newMenu.choices(), Math.min(at, newMenu.choices().size()), choice.get());
    if (newMenu != oldMenu) {
      log.set(
          block::link,
          block::setLink,
          Optional.of(Address.choice(newMenu.id(), choice.get().id())));
    }
  }

  /**
   * Moves a top-level or nested block of the source label to the root of the target label, at
   * {@code targetIndex}. Choices and branches cannot leave their owner.
   */
  public OperationResult moveAcrossLabels(
      CrossLabelContext ctx, String blockId, int targetIndex) {
    return transact(
        log -> {
          if (ctx.sourceLabel().equals(ctx.targetLabel())) {
            throw new SyncException(
                Failure.structural("source and target label are both %s", ctx.sourceLabel()));
          }
          AST.Label source = label(ctx.source());
          AST.Label target = label(ctx.target());

          BlockLocation location = locate(ctx.sourceRoot(), blockId);
          checkMovable(location);
          Block block = location.block();
          if (block.kind().isArrayElement()) {
            throw new SyncException(Failure.structural("%s cannot leave its owner", block));
          }

          Block targetRoot = ctx.targetRoot();
          log.remove(location.parent().get().children(), location.index());
          int at = clamp(targetIndex, targetRoot.children().size());
          log.insert(targetRoot.children(), at, block);

          if (block.kind().pairing() == BlockKind.Pairing.STATEMENT) {
            Statement node = statement(block, source);
            log.remove(AddressResolver.findContainingBody(source, node.id()).get(), node);
            log.insert(target.body(), astIndex(targetRoot, at, target.body()), node);
          }
          return OperationResult.ok();
        });
  }

  /** Deep copy of one block's subtree, or empty if it does not exist. */
  public Optional<Clipboard> copy(EditContext ctx, String blockId) {
    return copy(ctx, ImmutableList.of(blockId));
  }

  /** Deep copy of several blocks in the given order, or empty if any of them does not exist. */
  public Optional<Clipboard> copy(EditContext ctx, List<String> blockIds) {
    ImmutableList.Builder<BlockSnapshot> snapshots = ImmutableList.builder();
    for (String blockId : blockIds) {
      Optional<Block> block = AddressResolver.findBlock(ctx.root(), blockId);
      if (!block.isPresent()) return Optional.empty();
      snapshots.add(block.get().snapshot());
    }
    return Optional.of(
        Clipboard.create(snapshots.build(), ctx.labelName(), config.clock().instant()));
  }

  /**
   * Inserts fresh copies of the clipboard blocks, with fresh block and AST ids throughout, at
   * consecutive indices starting at {@code index}. Either every block is pasted or none is.
   */
  public OperationResult paste(EditContext ctx, Clipboard clipboard, String parentId, int index) {
    return transact(
        log -> {
          if (clipboard.isEmpty()) {
            throw new SyncException(Failure.emptyInput("nothing to paste"));
          }
          AST.Label label = label(ctx);
          Block parent = block(ctx.root(), parentId);

          Slot slot = slot(ctx.root(), parent, clipboard.blocks().get(0).kind(), index);
          int start = clamp(slot.index, slot.parent.children().size());

          ImmutableList.Builder<String> created = ImmutableList.builder();
          for (int i = 0; i < clipboard.blocks().size(); i++) {
            created.add(instantiate(clipboard.blocks().get(i), slot.parent, start + i, label, log));
          }
          return OperationResult.ok(created.build());
        });
  }

  private String instantiate(
      BlockSnapshot snapshot, Block parent, int index, AST.Label label, EditLog log)
      throws SyncException {
    Block block = factory.copyOf(snapshot);
    insert(block, parent, index, label, log);
    for (int i = 0; i < snapshot.children().size(); i++) {
      instantiate(snapshot.children().get(i), block, i, label, log);
    }
    return block.id();
  }

  /** Sets a block field and mirrors it onto the AST; an empty value clears the field. */
  public OperationResult updateField(
      EditContext ctx, String blockId, String fieldName, Optional<FieldValue> value) {
    return transact(
        log -> {
          AST.Label label = label(ctx);
          Block block = block(ctx.root(), blockId);
          Optional<Block.Field> field = block.field(fieldName);
          if (!field.isPresent()) {
            throw new SyncException(Failure.notFound("%s has no field %s", block, fieldName));
          }

          log.set(field.get()::value, field.get()::setValue, value);
          propertySync.sync(block, fieldName, ctx.ast(), label, log);
          return OperationResult.ok(block.id());
        });
  }

  public OperationResult updateField(
      EditContext ctx, String blockId, String fieldName, FieldValue value) {
    return updateField(ctx, blockId, fieldName, Optional.of(value));
  }

  /** Text convenience: the empty string clears the field. */
  public OperationResult updateField(
      EditContext ctx, String blockId, String fieldName, String value) {
    return updateField(
        ctx,
        blockId,
        fieldName,
        value.isEmpty() ? Optional.empty() : Optional.of(FieldValue.of(value)));
  }

  // Where a new block goes: a non-container parent gets the block as its next sibling.
  private static final class Slot {
    final Block parent;
    final int index;

    Slot(Block parent, int index) {
      this.parent = parent;
      this.index = index;
    }
  }

  private static Slot slot(Block root, Block parent, BlockKind kind, int index) {
    if (parent.isContainer() || kind.isArrayElement()) return new Slot(parent, index);

    BlockLocation location = AddressResolver.findBlockWithParent(root, parent.id()).get();
    return new Slot(location.parent().get(), location.index() + 1);
  }

  /** Links {@code block} into {@code parent} at {@code index} and creates its AST entity. */
  private void insert(Block block, Block parent, int index, AST.Label label, EditLog log)
      throws SyncException {
    checkAccepts(parent, block.kind());
    switch (block.kind().pairing()) {
      case CHOICE:
        insertChoice(block, parent, index, label, log);
        break;
      case BRANCH:
        insertBranch(block, parent, label, log);
        break;
      case STATEMENT:
      case NONE:
        int at = clampChildIndex(parent, block.kind(), index);
        log.insert(parent.children(), at, block);
        if (block.kind().pairing() == BlockKind.Pairing.STATEMENT) {
          Statement node = factory.createAstNode(block.kind(), block).get();
          List<Statement> body = body(parent, label);
          log.insert(body, astIndex(parent, at, body), node);
          log.set(block::link, block::setLink, Optional.of(Address.node(node.id())));
        }
        break;
      case SCOPE:
        throw new AssertionError(block.kind());
    }
  }

  private void insertChoice(Block block, Block menuBlock, int index, AST.Label label, EditLog log)
      throws SyncException {
    int at = clamp(index, menuBlock.children().size());
    log.insert(menuBlock.children(), at, block);

    Statement.Menu menu = menu(menuBlock, label);
    Statement.Menu.Choice choice = factory.createChoice(block);
    log.insert(menu.choices(), Math.min(at, menu.choices().size()), choice);
    log.set(block::link, block::setLink, Optional.of(Address.choice(menu.id(), choice.id())));
  }

  private void insertBranch(Block block, Block ifBlock, AST.Label label, EditLog log)
      throws SyncException {
    Optional<Block> elseBlock =
        ifBlock.children().stream().filter(c -> c.kind() == BlockKind.ELSE).findFirst();
    Statement.If ifStatement = ifStatement(ifBlock, label);
    if (block.kind() == BlockKind.ELSE && (elseBlock.isPresent() || ifStatement.hasElseBranch())) {
      throw new SyncException(Failure.structural("%s already has an else", ifBlock));
    }

    // A new elif goes before an existing else.
    int at =
        elseBlock.isPresent()
            ? ifBlock.children().indexOf(elseBlock.get())
            : ifBlock.children().size();
    log.insert(ifBlock.children(), at, block);

    List<Statement.If.Branch> branches = ifStatement.branches();
    Statement.If.Branch branch = factory.createBranch(block);
    log.insert(
        branches, ifStatement.hasElseBranch() ? branches.size() - 1 : branches.size(), branch);
    log.set(
        block::link, block::setLink, Optional.of(Address.branch(ifStatement.id(), branch.id())));
  }

  private static void removeFromAst(Block block, AST.Label label, EditLog log) {
    if (!block.link().isPresent()) return;

    Address link = block.link().get();
    switch (link.getKind()) {
      case NODE:
        Optional<Statement> node = AddressResolver.findAstNode(label, link.node());
        if (node.isPresent()) {
          log.remove(AddressResolver.findContainingBody(label, link.node()).get(), node.get());
        }
        break;
      case CHOICE:
        AddressResolver.findMenu(label, link.choice().ownerId())
            .ifPresent(
                menu ->
                    menu.choice(link.choice().elementId())
                        .ifPresent(choice -> log.remove(menu.choices(), choice)));
        break;
      case BRANCH:
        AddressResolver.findIf(label, link.branch().ownerId())
            .ifPresent(
                ifStatement ->
                    ifStatement
                        .branch(link.branch().elementId())
                        .ifPresent(branch -> log.remove(ifStatement.branches(), branch)));
        break;
    }
  }

  private static ImmutableList<Block> descendants(Block block) {
    ImmutableList.Builder<Block> builder = ImmutableList.builder();
    for (Block child : block.children()) {
      builder.add(child);
      builder.addAll(descendants(child));
    }
    return builder.build();
  }

  private static void checkAccepts(Block parent, BlockKind kind) throws SyncException {
    if (kind == BlockKind.LABEL) {
      throw new SyncException(Failure.structural("labels cannot be nested"));
    }
    if (kind == BlockKind.CHOICE && parent.kind() != BlockKind.MENU) {
      throw new SyncException(
          Failure.structural("a choice must be placed in a menu, not %s", parent));
    }
    if ((kind == BlockKind.ELIF || kind == BlockKind.ELSE) && parent.kind() != BlockKind.IF) {
      throw new SyncException(
          Failure.structural("%s must be placed in an if, not %s", kind, parent));
    }
    if (parent.kind() == BlockKind.MENU && kind != BlockKind.CHOICE) {
      throw new SyncException(Failure.structural("a menu holds only choices, not %s", kind));
    }
    if (!parent.isContainer()) {
      throw new SyncException(Failure.structural("%s cannot hold other blocks", parent));
    }
  }

  private static void checkMovable(BlockLocation location) throws SyncException {
    if (location.isRoot()) {
      throw new SyncException(Failure.structural("the label root cannot be moved"));
    }
    BlockKind kind = location.block().kind();
    if (kind == BlockKind.ELIF || kind == BlockKind.ELSE) {
      throw new SyncException(Failure.structural("%s blocks cannot be moved", kind));
    }
  }

  private static int clamp(int index, int size) {
    return Math.max(0, Math.min(index, size));
  }

  /** Clamps a child index; statements under an if stay ahead of its elif/else blocks. */
  private static int clampChildIndex(Block parent, BlockKind kind, int index) {
    List<Block> children = parent.children();
    int limit = children.size();
    if (parent.kind() == BlockKind.IF && !kind.isArrayElement()) {
      for (int i = 0; i < children.size(); i++) {
        if (children.get(i).kind().isArrayElement()) {
          limit = i;
          break;
        }
      }
    }
    return clamp(index, limit);
  }

  /** Index in {@code body} for the block at {@code blockIndex}: the statement blocks before it. */
  private static int astIndex(Block parent, int blockIndex, List<Statement> body) {
    int count = 0;
    for (Block sibling : parent.children().subList(0, blockIndex)) {
      if (sibling.kind().pairing() == BlockKind.Pairing.STATEMENT) count++;
    }
    return Math.min(count, body.size());
  }

  /** The statement list that holds the statements of {@code container}'s children. */
  private static List<Statement> body(Block container, AST.Label label) throws SyncException {
    if (container.kind() == BlockKind.LABEL) return label.body();

    if (!container.link().isPresent()) {
      throw new SyncException(Failure.notFound("%s is not linked to the AST", container));
    }
    Optional<List<Statement>> body =
        AddressResolver.resolve(container.link().get(), label).flatMap(AstTarget::body);
    if (!body.isPresent()) {
      throw new SyncException(
          Failure.notFound("no statement body for %s (%s)", container, container.link().get()));
    }
    return body.get();
  }

  private static Statement statement(Block block, AST.Label label) throws SyncException {
    Optional<Statement> node =
        block.link().flatMap(link -> AddressResolver.findAstNode(label, link.node()));
    if (!node.isPresent()) {
      throw new SyncException(Failure.notFound("no statement for %s", block));
    }
    return node.get();
  }

  private static Statement.Menu menu(Block menuBlock, AST.Label label) throws SyncException {
    if (!menuBlock.link().isPresent()) {
      throw new SyncException(Failure.notFound("%s is not linked to the AST", menuBlock));
    }
    return menu(menuBlock.link().get().node(), label);
  }

  private static Statement.Menu menu(String menuId, AST.Label label) throws SyncException {
    Optional<Statement.Menu> menu = AddressResolver.findMenu(label, menuId);
    if (!menu.isPresent()) throw new SyncException(Failure.notFound("no menu %s", menuId));
    return menu.get();
  }

  private static Statement.If ifStatement(Block ifBlock, AST.Label label) throws SyncException {
    Optional<Statement.If> ifStatement =
        ifBlock.link().flatMap(link -> AddressResolver.findIf(label, link.node()));
    if (!ifStatement.isPresent()) {
      throw new SyncException(Failure.notFound("no if statement for %s", ifBlock));
    }
    return ifStatement.get();
  }

  private static AST.Label label(EditContext ctx) throws SyncException {
    Preconditions.checkArgument(
        ctx.root().kind() == BlockKind.LABEL, "not a label root: %s", ctx.root());
    Optional<AST.Label> label = ctx.ast().label(ctx.labelName());
    if (!label.isPresent()) {
      throw new SyncException(Failure.notFound("no label %s", ctx.labelName()));
    }
    return label.get();
  }

  private static Block block(Block root, String blockId) throws SyncException {
    return locate(root, blockId).block();
  }

  private static BlockLocation locate(Block root, String blockId) throws SyncException {
    Optional<BlockLocation> location = AddressResolver.findBlockWithParent(root, blockId);
    if (!location.isPresent()) throw new SyncException(Failure.notFound("no block %s", blockId));
    return location.get();
  }
}
