package bsync;

import java.util.List;
import java.util.Optional;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * Builds the block tree of one label from its AST, applying the {@link NodeFactory} mapping in
 * reverse. Every block comes out linked: statements by id, choices and branches by owner and
 * element id. An if block holds the leading branch's statements followed by one block per further
 * branch.
 *
 * <p>Play and stop statements on channels without a block kind of their own are shown as the
 * nearest audio block; their channel is left untouched by later edits.
 */
public final class BlockTreeBuilder extends DefaultASTVisitor<Block> {
  private static final Joiner WORDS = Joiner.on(' ');
  private static final Joiner LIST = Joiner.on(", ");

  private final NodeFactory factory;

  public BlockTreeBuilder(NodeFactory factory) {
    this.factory = Preconditions.checkNotNull(factory);
  }

  /** A fresh label root block holding one block per entity of {@code label}. */
  public Block build(AST.Label label) {
    Block root = factory.createBlock(BlockKind.LABEL);
    root.setLink(Optional.of(Address.node(label.id())));
    set(root, "name", label.name());
    set(root, "parameters", LIST.join(label.parameters()));
    ASTNodeUtils.accept(label.body(), this, root);
    return root;
  }

  private Block append(Block parent, BlockKind kind, Address link) {
    Block block = factory.createBlock(kind);
    block.setLink(Optional.of(link));
    parent.children().add(block);
    return block;
  }

  private Block append(Block parent, BlockKind kind, Statement statement) {
    return append(parent, kind, Address.node(statement.id()));
  }

  private static void set(Block block, String fieldName, String text) {
    block.set(fieldName, text.isEmpty() ? Optional.empty() : Optional.of(FieldValue.of(text)));
  }

  private static void set(Block block, String fieldName, Optional<String> text) {
    set(block, fieldName, text.orElse(""));
  }

  private static void setNumber(Block block, String fieldName, Optional<Double> number) {
    block.set(fieldName, number.map(FieldValue::of));
  }

  private static void setFlag(Block block, String fieldName, Optional<Boolean> flag) {
    block.set(fieldName, flag.map(FieldValue::of));
  }

  @Override
  public Block visit(Statement.Dialogue node, Block parent) {
    Block block = append(parent, BlockKind.DIALOGUE, node);
    set(block, "speaker", node.speaker());
    set(block, "text", node.text());
    set(block, "attributes", WORDS.join(node.attributes()));
    return parent;
  }

  @Override
  public Block visit(Statement.Scene node, Block parent) {
    Block block = append(parent, BlockKind.SCENE, node);
    set(block, "image", node.image());
    set(block, "onLayer", node.layer());
    return parent;
  }

  @Override
  public Block visit(Statement.Show node, Block parent) {
    Block block = append(parent, BlockKind.SHOW, node);
    set(block, "character", node.image());
    set(block, "position", node.atPosition());
    set(block, "expression", WORDS.join(node.attributes()));
    return parent;
  }

  @Override
  public Block visit(Statement.Hide node, Block parent) {
    set(append(parent, BlockKind.HIDE, node), "character", node.image());
    return parent;
  }

  @Override
  public Block visit(Statement.With node, Block parent) {
    set(append(parent, BlockKind.WITH, node), "transition", node.transition());
    return parent;
  }

  @Override
  public Block visit(Statement.Menu node, Block parent) {
    Block block = append(parent, BlockKind.MENU, node);
    set(block, "prompt", node.prompt());
    node.visitChildren(this, block);
    return parent;
  }

  @Override
  public Block visit(Statement.Menu.Choice node, Block menuBlock) {
    String menuId = menuBlock.link().get().node();
    Block block = append(menuBlock, BlockKind.CHOICE, Address.choice(menuId, node.id()));
    set(block, "text", node.text());
    set(block, "condition", node.condition());
    node.visitChildren(this, block);
    return menuBlock;
  }

  @Override
  public Block visit(Statement.Jump node, Block parent) {
    Block block = append(parent, BlockKind.JUMP, node);
    set(block, "target", node.target());
    setFlag(block, "expression", Optional.of(node.expression()));
    return parent;
  }

  @Override
  public Block visit(Statement.Call node, Block parent) {
    Block block = append(parent, BlockKind.CALL, node);
    set(block, "target", node.target());
    set(block, "arguments", LIST.join(node.arguments()));
    setFlag(block, "expression", Optional.of(node.expression()));
    return parent;
  }

  @Override
  public Block visit(Statement.Return node, Block parent) {
    set(append(parent, BlockKind.RETURN, node), "value", node.value());
    return parent;
  }

  @Override
  public Block visit(Statement.If node, Block parent) {
    Block block = append(parent, BlockKind.IF, node);
    List<Statement.If.Branch> branches = node.branches();
    for (int i = 0; i < branches.size(); i++) {
      Statement.If.Branch branch = branches.get(i);
      if (i == 0) {
        set(block, "condition", branch.condition());
        ASTNodeUtils.accept(branch.body(), this, block);
      } else {
        Block branchBlock =
            append(
                block,
                branch.isElse() ? BlockKind.ELSE : BlockKind.ELIF,
                Address.branch(node.id(), branch.id()));
        if (!branch.isElse()) set(branchBlock, "condition", branch.condition());
        ASTNodeUtils.accept(branch.body(), this, branchBlock);
      }
    }
    return parent;
  }

  @Override
  public Block visit(Statement.Set node, Block parent) {
    Block block = append(parent, BlockKind.SET, node);
    set(block, "variable", node.variable());
    set(block, "operator", node.operator().symbol());
    set(block, "value", node.value());
    return parent;
  }

  @Override
  public Block visit(Statement.Python node, Block parent) {
    set(append(parent, BlockKind.PYTHON, node), "code", node.code());
    return parent;
  }

  @Override
  public Block visit(Statement.Play node, Block parent) {
    BlockKind kind =
        node.channel() == Statement.Channel.MUSIC ? BlockKind.PLAY_MUSIC : BlockKind.PLAY_SOUND;
    Block block = append(parent, kind, node);
    set(block, "file", node.file());
    setNumber(block, "fadein", node.fadeIn());
    setFlag(block, "loop", node.loop());
    setNumber(block, "volume", node.volume());
    return parent;
  }

  @Override
  public Block visit(Statement.Stop node, Block parent) {
    setNumber(append(parent, BlockKind.STOP_MUSIC, node), "fadeout", node.fadeOut());
    return parent;
  }
}
