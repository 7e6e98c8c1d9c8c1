package llmcl;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites IR in place into canonical form: defaults filled in, message content in a total order
 * and concept children grouped by kind. Running it twice is a no-op.
 *
 * <p>Placeholder ids for nameless concepts and relations come from a counter scoped to this
 * instance. They are handed out in document order only after the content has been sorted, so
 * the id a nameless node receives does not depend on where it appeared in the input.
 */
public class Canonicalizer implements IrVisitor<Void> {
  private static final Comparator<IrNode> CONTENT_ORDER =
      Comparator.comparing(IrNode::typeName)
          .thenComparing(Canonicalizer::sortId)
          .thenComparing(Canonicalizer::sortName)
          .thenComparing(Printer::print);

  private int placeholderCounter = 0;

  public <T extends IrNode> T canonicalize(T node) {
    node.accept(this);
    assignPlaceholders(node);
    if (node.kind() == IrNode.Kind.MESSAGE) {
      // Placeholder ids are now part of the sort key.
      node.<IrNode.Message>cast().content().sort(CONTENT_ORDER);
    }
    return node;
  }

  @Override
  public Void visit(IrNode.Message node) {
    if (!node.version().isPresent()) node.setVersion(Printer.DEFAULT_VERSION);

    List<IrNode> content = node.content();
    content.removeIf(Objects::isNull);
    content.forEach(n -> n.accept(this));
    // Entries are canonical before sorting so the printed tie-breaker is stable.
    content.sort(CONTENT_ORDER);
    return null;
  }

  @Override
  public Void visit(IrNode.Concept node) {
    List<IrNode> children = node.children();
    children.removeIf(Objects::isNull);

    List<IrNode> concepts = new ArrayList<>();
    List<IrNode> relations = new ArrayList<>();
    List<IrNode> others = new ArrayList<>();
    for (IrNode child : children) {
      switch (child.kind()) {
        case CONCEPT:
          concepts.add(child);
          break;
        case RELATION:
          relations.add(child);
          break;
        default:
          others.add(child);
          break;
      }
    }
    children.clear();
    children.addAll(concepts);
    children.addAll(relations);
    children.addAll(others);

    children.forEach(n -> n.accept(this));
    return null;
  }

  @Override
  public Void visit(IrNode.Relation node) {
    canonicalizeChildren(node.children());
    return null;
  }

  @Override
  public Void visit(IrNode.Quantifier node) {
    canonicalizeChildren(node.children());
    return null;
  }

  @Override
  public Void visit(IrNode.Reference node) {
    return null;
  }

  @Override
  public Void visit(IrNode.Generic node) {
    canonicalizeChildren(node.children());
    return null;
  }

  private void canonicalizeChildren(List<IrNode> children) {
    children.removeIf(Objects::isNull);
    children.forEach(n -> n.accept(this));
  }

  // Pre-order over the already ordered tree.
  private void assignPlaceholders(IrNode node) {
    List<IrNode> children;
    switch (node.kind()) {
      case MESSAGE:
        children = node.<IrNode.Message>cast().content();
        break;
      case CONCEPT:
        IrNode.Concept concept = node.cast();
        if (!concept.id().isPresent()) concept.setId("concept_" + nextPlaceholder());
        children = concept.children();
        break;
      case RELATION:
        IrNode.Relation relation = node.cast();
        if (!relation.name().isPresent()) relation.setName("relation_" + nextPlaceholder());
        children = relation.children();
        break;
      case QUANTIFIER:
        children = node.<IrNode.Quantifier>cast().children();
        break;
      case GENERIC:
        children = node.<IrNode.Generic>cast().children();
        break;
      default:
        return;
    }
    children.forEach(this::assignPlaceholders);
  }

  private int nextPlaceholder() {
    return ++placeholderCounter;
  }

  private static String sortId(IrNode node) {
    return node.kind() == IrNode.Kind.CONCEPT
        ? node.<IrNode.Concept>cast().id().orElse("")
        : "";
  }

  private static String sortName(IrNode node) {
    switch (node.kind()) {
      case RELATION:
        return node.<IrNode.Relation>cast().name().orElse("");
      case QUANTIFIER:
        return node.<IrNode.Quantifier>cast().name().orElse("");
      default:
        return "";
    }
  }
}
