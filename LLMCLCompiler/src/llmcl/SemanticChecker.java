package llmcl;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * Checks a parsed message. Errors block lowering; warnings are reported alongside a successful
 * compile.
 */
public class SemanticChecker extends ErrorCollectingValidator {
  private static final Pattern BARE_CONCEPT_ID = Pattern.compile("#c\\d+");

  private static final String PREV_SCOPE = "prev";

  private final Optional<ConceptRegistry> registry;

  public SemanticChecker(Optional<ConceptRegistry> registry) {
    this.registry = registry;
  }

  public SemanticChecker check(SyntaxNode root) {
    visit(root);
    return this;
  }

  private void visit(SyntaxNode node) {
    switch (node.kind()) {
      case MESSAGE:
        checkMessage(node);
        break;
      case CONCEPT:
        checkConcept(node);
        break;
      case REFERENCE:
        checkReference(node);
        break;
      default:
        break;
    }

    node.children().forEach(this::visit);
  }

  private void checkMessage(SyntaxNode message) {
    if (!message.firstChild(SyntaxNode.Kind.VERSION).isPresent()) {
      logError("Message missing version marker");
    }
    if (message.children().stream().allMatch(c -> c.kind() == SyntaxNode.Kind.VERSION)) {
      logWarning("Message has no content nodes");
    }
  }

  // Qualified concepts and free-form tags are not registry ids. An empty registry knows no ids,
  // so it is treated like no registry at all.
  private void checkConcept(SyntaxNode concept) {
    String value = concept.value().orElse("");
    if (!BARE_CONCEPT_ID.matcher(value).matches()) return;
    if (!registry.isPresent() || registry.get().size() == 0) return;

    String id = value.substring(1);
    if (!registry.get().contains(id)) {
      logWarning("Unknown concept ID: " + id);
    }
  }

  private void checkReference(SyntaxNode reference) {
    String value = reference.value().orElse("");
    if (value.isEmpty()) {
      logError("Reference node has no value");
      return;
    }
    if (value.charAt(0) != Scanner.REFERENCE_SIGIL) {
      logError("Invalid reference format: " + value);
      return;
    }

    List<String> segments = Splitter.on('.').splitToList(value.substring(1));
    if (segments.isEmpty()) {
      logError("Reference needs at least one path segment: " + value);
      return;
    }

    String scope = segments.get(0);
    if (!scope.equals("self") && !scope.equals("shared") && !scope.startsWith(PREV_SCOPE)) {
      logWarning("Unusual reference type: " + scope);
    }
    if (scope.startsWith(PREV_SCOPE)) {
      String index = scope.substring(PREV_SCOPE.length());
      if (index.isEmpty() || !CharMatcher.inRange('0', '9').matchesAllOf(index)) {
        logError("Invalid prev index: " + scope);
      }
    }
  }
}
