package bsync;

import java.util.List;
import java.util.Optional;

import com.google.common.collect.Iterables;

/**
 * Read-only lookups over a block tree and the AST of one label. Nothing here throws for a missing
 * entity: every lookup answers with an empty result that callers treat as a normal condition.
 */
public final class AddressResolver {

  /** Depth-first search for a block by id, the root included. */
  public static Optional<Block> findBlock(Block root, String blockId) {
    return findBlockWithParent(root, blockId).map(BlockLocation::block);
  }

  /** Like {@link #findBlock}, also reporting the parent and index of the block. */
  public static Optional<BlockLocation> findBlockWithParent(Block root, String blockId) {
    if (root.id().equals(blockId)) return Optional.of(BlockLocation.root(root));
    return findChild(root, blockId);
  }

  private static Optional<BlockLocation> findChild(Block parent, String blockId) {
    List<Block> children = parent.children();
    for (int i = 0; i < children.size(); i++) {
      Block child = children.get(i);
      if (child.id().equals(blockId)) return Optional.of(BlockLocation.child(child, parent, i));

      Optional<BlockLocation> nested = findChild(child, blockId);
      if (nested.isPresent()) return nested;
    }
    return Optional.empty();
  }

  /** True if {@code candidate} is {@code ancestor} or lies in its subtree. */
  public static boolean contains(Block ancestor, Block candidate) {
    return findBlock(ancestor, candidate.id()).isPresent();
  }

  /** Searches the label body and, recursively, every choice body and branch body under it. */
  public static Optional<Statement> findAstNode(AST.Label label, String statementId) {
    StatementFinder finder = new StatementFinder(statementId);
    label.accept(finder, null);
    return Optional.ofNullable(finder.found);
  }

  /** Searches every label of the script. */
  public static Optional<Statement> findAstNode(AST ast, String statementId) {
    for (AST.Label label : ast.labels()) {
      Optional<Statement> found = findAstNode(label, statementId);
      if (found.isPresent()) return found;
    }
    return Optional.empty();
  }

  /** The live statement list that directly contains the given statement. */
  public static Optional<List<Statement>> findContainingBody(AST.Label label, String statementId) {
    BodyFinder finder = new BodyFinder(statementId);
    label.accept(finder, null);
    return Optional.ofNullable(finder.found);
  }

  /**
   * Recovers the owner statement id and element key from the string form of a choice or branch
   * address. Returns empty for anything that is not a synthetic address.
   */
  public static Optional<Address> resolveSyntheticOwner(String syntheticId) {
    return Address.parseSynthetic(syntheticId);
  }

  /** Resolves any address kind to its entity inside the given label. */
  public static Optional<AstTarget> resolve(Address address, AST.Label label) {
    switch (address.getKind()) {
      case NODE:
        return findAstNode(label, address.node()).map(AstTarget::of);
      case CHOICE:
        return findMenu(label, address.choice().ownerId())
            .flatMap(menu -> menu.choice(address.choice().elementId()))
            .map(AstTarget::of);
      case BRANCH:
        return findIf(label, address.branch().ownerId())
            .flatMap(ifStatement -> ifStatement.branch(address.branch().elementId()))
            .map(AstTarget::of);
    }
    throw new AssertionError(address.getKind());
  }

  static Optional<Statement.Menu> findMenu(AST.Label label, String menuId) {
    return findAstNode(label, menuId)
        .filter(s -> s.type() == Statement.Type.MENU)
        .map(Statement::cast);
  }

  static Optional<Statement.If> findIf(AST.Label label, String ifId) {
    return findAstNode(label, ifId).filter(s -> s.type() == Statement.Type.IF).map(Statement::cast);
  }

  /** Number of blocks below the root, optionally leaving out comments. */
  public static int countBlocks(Block root, boolean excludeComments) {
    int count = 0;
    for (Block child : root.children()) {
      if (!excludeComments || child.kind() != BlockKind.COMMENT) count++;
      count += countBlocks(child, excludeComments);
    }
    return count;
  }

  /** Number of statements anywhere under the label. */
  public static int countStatements(AST.Label label) {
    return label.accept(
        new DefaultASTVisitor<Integer>() {
          @Override
          protected Integer visitAny(ASTNodeInterface node, Integer value) {
            return super.visitAny(node, node instanceof Statement ? value + 1 : value);
          }
        },
        0);
  }

  /**
   * Number of AST entities that pair with a block: statements, menu choices, and every if branch
   * except the leading one, whose body belongs to the if block itself. Equals {@code
   * countBlocks(root, true)} for a synchronized tree.
   */
  public static int countAstEntities(AST.Label label) {
    return label.accept(
        new DefaultASTVisitor<Integer>() {
          @Override
          public Integer visit(Statement.Menu.Choice node, Integer value) {
            return node.visitChildren(this, value + 1);
          }

          @Override
          public Integer visit(Statement.If node, Integer value) {
            return node.visitChildren(this, value + Math.max(node.branches().size(), 1));
          }

          @Override
          protected Integer visitAny(ASTNodeInterface node, Integer value) {
            return super.visitAny(node, node instanceof Statement ? value + 1 : value);
          }
        },
        0);
  }

  private static final class StatementFinder extends VoidDefaultASTVisitor {
    private final String statementId;
    private Statement found;

    StatementFinder(String statementId) {
      this.statementId = statementId;
    }

    @Override
    public void visitAnyImpl(ASTNodeInterface node) {
      if (found != null) return;
      if (node instanceof Statement && ((Statement) node).id().equals(statementId)) {
        found = (Statement) node;
        return;
      }
      super.visitAnyImpl(node);
    }
  }

  private static final class BodyFinder extends VoidDefaultASTVisitor {
    private final String statementId;
    private List<Statement> found;

    BodyFinder(String statementId) {
      this.statementId = statementId;
    }

    private void check(List<Statement> body) {
      if (found == null && Iterables.any(body, s -> s.id().equals(statementId))) found = body;
    }

    @Override
    public void visitImpl(AST.Label label) {
      check(label.body());
      super.visitImpl(label);
    }

    @Override
    public void visitImpl(Statement.Menu.Choice choice) {
      check(choice.body());
      super.visitImpl(choice);
    }

    @Override
    public void visitImpl(Statement.If.Branch branch) {
      check(branch.body());
      super.visitImpl(branch);
    }

    @Override
    public void visitAnyImpl(ASTNodeInterface node) {
      if (found == null) super.visitAnyImpl(node);
    }
  }

  private AddressResolver() {}
}
