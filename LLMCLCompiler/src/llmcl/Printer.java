package llmcl;

import java.util.List;

import com.google.common.base.Strings;

/**
 * Renders IR as LLM-CL source text with two-space indentation. Performs no validation; whatever
 * the IR holds is printed.
 */
public class Printer implements IrVisitor<String> {
  public static final String DEFAULT_VERSION = "1.0";

  private static final int INDENT_SIZE = 2;

  private int depth = 0;

  public static String print(IrNode node) {
    return new Printer().render(node);
  }

  private String render(IrNode node) {
    return node == null ? "" : node.accept(this);
  }

  @Override
  public String visit(IrNode.Message node) {
    return body("@v" + node.version().orElse(DEFAULT_VERSION), node.content(), "");
  }

  @Override
  public String visit(IrNode.Concept node) {
    return tagWithChildren(node.tag(), node.children());
  }

  @Override
  public String visit(IrNode.Relation node) {
    return tagWithChildren(node.tag(), node.children());
  }

  @Override
  public String visit(IrNode.Quantifier node) {
    return tagWithChildren(node.tag(), node.children());
  }

  @Override
  public String visit(IrNode.Reference node) {
    return node.token();
  }

  // Valueless generic nodes have no surface syntax.
  @Override
  public String visit(IrNode.Generic node) {
    if (!node.value().isPresent()) return "";
    return tagWithChildren(node.value().get(), node.children());
  }

  private String tagWithChildren(String tag, List<IrNode> children) {
    return children.isEmpty() ? tag : body(tag, children, indent());
  }

  // The first line is left unindented; the caller places it.
  private String body(String tag, List<IrNode> children, String closingIndent) {
    StringBuilder sb = new StringBuilder(tag).append("{\n");
    depth++;
    for (IrNode child : children) {
      String code = render(child);
      if (!code.isEmpty()) {
        sb.append(indent()).append(code).append('\n');
      }
    }
    depth--;
    return sb.append(closingIndent).append('}').toString();
  }

  private String indent() {
    return Strings.repeat(" ", depth * INDENT_SIZE);
  }
}
