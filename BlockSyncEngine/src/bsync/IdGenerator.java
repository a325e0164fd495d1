package bsync;

/** Source of fresh ids for blocks and AST entities. Ids are never reused. */
public interface IdGenerator {
  String newBlockId();

  /** Id for a statement, menu choice or if branch. */
  String newNodeId();

  /** Numbers blocks {@code block_1, block_2, ...} and nodes {@code node_1, node_2, ...}. */
  static IdGenerator sequential() {
    return new IdGenerator() {
      private long blocks = 0;
      private long nodes = 0;

      @Override
      public String newBlockId() {
        return "block_" + ++blocks;
      }

      @Override
      public String newNodeId() {
        return "node_" + ++nodes;
      }
    };
  }
}
