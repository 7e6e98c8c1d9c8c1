package llmcl;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** A node of the parse tree. Children are owned by exactly one parent. */
public final class SyntaxNode {
  public enum Kind {
    MESSAGE,
    VERSION,
    CONCEPT,
    RELATION,
    QUANTIFIER,
    REFERENCE,
    LIST,
    ITEM,
    PROPERTY;
  }

  private final Kind kind;
  private final Optional<String> value;
  private final ImmutableList<SyntaxNode> children;
  private final ImmutableMap<String, String> attributes;

  private SyntaxNode(
      Kind kind,
      Optional<String> value,
      ImmutableList<SyntaxNode> children,
      ImmutableMap<String, String> attributes) {
    this.kind = kind;
    this.value = value;
    this.children = children;
    this.attributes = attributes;
  }

  public static SyntaxNode leaf(Kind kind, String value) {
    return new SyntaxNode(kind, Optional.of(value), ImmutableList.of(), ImmutableMap.of());
  }

  public static SyntaxNode create(
      Kind kind,
      Optional<String> value,
      Iterable<SyntaxNode> children,
      Map<String, String> attributes) {
    return new SyntaxNode(
        Preconditions.checkNotNull(kind),
        value,
        ImmutableList.copyOf(children),
        ImmutableMap.copyOf(attributes));
  }

  public Kind kind() {
    return kind;
  }

  public Optional<String> value() {
    return value;
  }

  public ImmutableList<SyntaxNode> children() {
    return children;
  }

  public ImmutableMap<String, String> attributes() {
    return attributes;
  }

  public Optional<String> attribute(String key) {
    return Optional.ofNullable(attributes.get(key));
  }

  public Optional<SyntaxNode> firstChild(Kind childKind) {
    return children.stream().filter(c -> c.kind() == childKind).findFirst();
  }

  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", kind.name());
    value.ifPresent(v -> map.put("value", v));
    if (!attributes.isEmpty()) map.put("attributes", new LinkedHashMap<>(attributes));
    if (!children.isEmpty()) {
      map.put(
          "children",
          children.stream().map(SyntaxNode::toMap).collect(ImmutableList.toImmutableList()));
    }
    return map;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof SyntaxNode)) return false;
    SyntaxNode other = (SyntaxNode) obj;
    return kind == other.kind
        && value.equals(other.value)
        && children.equals(other.children)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value, children, attributes);
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

  /** Accumulates children while the parser descends; the node is immutable once built. */
  public static final class Builder {
    private final Kind kind;
    private final Optional<String> value;
    private final ImmutableList.Builder<SyntaxNode> children = ImmutableList.builder();
    private final ImmutableMap.Builder<String, String> attributes = ImmutableMap.builder();

    public Builder(Kind kind, Optional<String> value) {
      this.kind = kind;
      this.value = value;
    }

    public Builder addChild(SyntaxNode child) {
      children.add(child);
      return this;
    }

    public Builder putAttribute(String key, String attributeValue) {
      attributes.put(key, attributeValue);
      return this;
    }

    public SyntaxNode build() {
      return new SyntaxNode(kind, value, children.build(), attributes.build());
    }
  }
}
