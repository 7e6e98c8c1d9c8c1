package llmcl;

/** One method per {@link IrNode.Kind}; adding a kind breaks every visitor until it is handled. */
public interface IrVisitor<V> {
  V visit(IrNode.Message node);

  V visit(IrNode.Concept node);

  V visit(IrNode.Relation node);

  V visit(IrNode.Quantifier node);

  V visit(IrNode.Reference node);

  V visit(IrNode.Generic node);
}
