package llmcl;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/** Collects the reference nodes of an IR tree in document order. */
final class References implements IrVisitor<Void> {
  private final ImmutableList.Builder<IrNode.Reference> references = ImmutableList.builder();

  static ImmutableList<IrNode.Reference> collect(IrNode root) {
    References collector = new References();
    root.accept(collector);
    return collector.references.build();
  }

  private void visitAll(List<IrNode> nodes) {
    nodes.stream().filter(Objects::nonNull).forEach(n -> n.accept(this));
  }

  @Override
  public Void visit(IrNode.Message node) {
    visitAll(node.content());
    return null;
  }

  @Override
  public Void visit(IrNode.Concept node) {
    visitAll(node.children());
    return null;
  }

  @Override
  public Void visit(IrNode.Relation node) {
    visitAll(node.children());
    return null;
  }

  @Override
  public Void visit(IrNode.Quantifier node) {
    visitAll(node.children());
    return null;
  }

  @Override
  public Void visit(IrNode.Reference node) {
    references.add(node);
    return null;
  }

  @Override
  public Void visit(IrNode.Generic node) {
    visitAll(node.children());
    return null;
  }

  private References() {}
}
