package llmcl;

import java.util.List;

import com.google.common.collect.ImmutableMap;

/**
 * Converts a message into the tag-keyed form kept in a {@link ReferenceResolver}'s context.
 *
 * <p>Each node becomes a key equal to its surface tag ({@code #c501~approaches}, {@code ~cause},
 * {@code $count}, or a property's identifier). Leaves map to {@code true}, nodes with children
 * to a nested map. A reference maps to {@code {_reference: token}} so the pointer survives in
 * the view. The message version is stored under {@code _version}.
 *
 * <p>Views are immutable; entries handed out by the resolver cannot rewrite its history.
 */
public final class ContextView {
  public static final String VERSION_KEY = "_version";
  public static final String REFERENCE_KEY = "_reference";

  public static ImmutableMap<String, Object> of(IrNode.Message message) {
    ImmutableMap.Builder<String, Object> view = ImmutableMap.builder();
    view.put(VERSION_KEY, message.version().orElse(Printer.DEFAULT_VERSION));
    putAll(view, message.content());
    // Later duplicates overwrite earlier ones.
    return view.buildKeepingLast();
  }

  private static void putAll(ImmutableMap.Builder<String, Object> view, List<IrNode> nodes) {
    for (IrNode node : nodes) {
      if (node == null) continue;
      node.accept(
          new IrVisitor<Void>() {
            @Override
            public Void visit(IrNode.Message message) {
              putAll(view, message.content());
              return null;
            }

            @Override
            public Void visit(IrNode.Concept concept) {
              put(view, concept.tag(), concept.children());
              return null;
            }

            @Override
            public Void visit(IrNode.Relation relation) {
              put(view, relation.tag(), relation.children());
              return null;
            }

            @Override
            public Void visit(IrNode.Quantifier quantifier) {
              put(view, quantifier.tag(), quantifier.children());
              return null;
            }

            @Override
            public Void visit(IrNode.Reference reference) {
              view.put(reference.token(), ImmutableMap.of(REFERENCE_KEY, reference.token()));
              return null;
            }

            @Override
            public Void visit(IrNode.Generic generic) {
              generic.value().ifPresent(v -> put(view, v, generic.children()));
              return null;
            }
          });
    }
  }

  private static void put(
      ImmutableMap.Builder<String, Object> view, String key, List<IrNode> children) {
    if (children.isEmpty()) {
      view.put(key, true);
      return;
    }
    ImmutableMap.Builder<String, Object> nested = ImmutableMap.builder();
    putAll(nested, children);
    view.put(key, nested.buildKeepingLast());
  }

  private ContextView() {}
}
