package llmcl;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/** Lowers a parse tree into the intermediate representation. */
public class IrBuilder {
  private static final Pattern VERSION_NUMBER = Pattern.compile("v(\\d+\\.\\d+)");

  public IrNode build(SyntaxNode node) {
    switch (node.kind()) {
      case MESSAGE:
        return buildMessage(node);
      case CONCEPT:
        return buildConcept(node);
      case RELATION:
        return new IrNode.Relation(stripSigil(node.value()), buildAll(node.children()));
      case QUANTIFIER:
        return new IrNode.Quantifier(stripSigil(node.value()), buildAll(node.children()));
      case REFERENCE:
        return buildReference(node);
      default:
        return new IrNode.Generic(
            node.kind(), node.value(), node.attributes(), buildAll(node.children()));
    }
  }

  private IrNode.Message buildMessage(SyntaxNode node) {
    Optional<String> version =
        node.firstChild(SyntaxNode.Kind.VERSION)
            .flatMap(SyntaxNode::value)
            .flatMap(
                text -> {
                  Matcher matcher = VERSION_NUMBER.matcher(text);
                  return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
                });

    return new IrNode.Message(
        version,
        node.children()
            .stream()
            .filter(c -> c.kind() != SyntaxNode.Kind.VERSION)
            .map(this::build)
            .collect(ImmutableList.toImmutableList()));
  }

  // #id~qualifier: only the first '~' separates, the rest belongs to the qualifier.
  private IrNode.Concept buildConcept(SyntaxNode node) {
    Optional<String> id = Optional.empty();
    Optional<String> qualifier = Optional.empty();
    Optional<String> body = stripSigil(node.value());
    if (body.isPresent()) {
      int separator = body.get().indexOf(Scanner.RELATION_SIGIL);
      if (separator < 0) {
        id = body;
      } else {
        id = Optional.of(body.get().substring(0, separator));
        qualifier = Optional.of(body.get().substring(separator + 1));
      }
    }
    return new IrNode.Concept(id, qualifier, buildAll(node.children()));
  }

  private IrNode.Reference buildReference(SyntaxNode node) {
    String body = stripSigil(node.value()).orElse("");
    List<String> segments = Splitter.on('.').splitToList(body);
    return new IrNode.Reference(segments.get(0), segments.subList(1, segments.size()));
  }

  private ImmutableList<IrNode> buildAll(List<SyntaxNode> children) {
    return children.stream().map(this::build).collect(ImmutableList.toImmutableList());
  }

  private static Optional<String> stripSigil(Optional<String> value) {
    return value.map(v -> v.isEmpty() ? v : v.substring(1));
  }
}
