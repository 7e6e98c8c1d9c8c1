package llmcl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Intermediate representation of a message.
 *
 * <p>Nodes are mutable so the {@link Canonicalizer} can rewrite them in place. A node is owned
 * by exactly one parent list; use {@link #copy()} to obtain an independent tree.
 */
public abstract class IrNode {
  public enum Kind {
    MESSAGE,
    CONCEPT,
    RELATION,
    QUANTIFIER,
    REFERENCE,
    GENERIC;
  }

  private final Kind kind;

  protected IrNode(Kind kind) {
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  /** The node's type tag, as it appears under {@code "type"} in {@link #toMap()}. */
  public abstract String typeName();

  public abstract <V> V accept(IrVisitor<V> visitor);

  public abstract IrNode copy();

  public abstract Map<String, Object> toMap();

  @SuppressWarnings("unchecked")
  public <T extends IrNode> T cast() {
    return (T) this;
  }

  @Override
  public String toString() {
    return toMap().toString();
  }

  private static List<IrNode> copyAll(List<IrNode> nodes) {
    List<IrNode> copies = new ArrayList<>(nodes.size());
    for (IrNode node : nodes) {
      copies.add(node == null ? null : node.copy());
    }
    return copies;
  }

  private static void putChildren(Map<String, Object> map, String key, List<IrNode> nodes) {
    if (nodes.isEmpty()) return;
    List<Object> list = new ArrayList<>(nodes.size());
    for (IrNode node : nodes) {
      list.add(node == null ? null : node.toMap());
    }
    map.put(key, list);
  }

  private static Map<String, Object> typed(String typeName) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("type", typeName);
    return map;
  }

  public static final class Message extends IrNode {
    private Optional<String> version;
    private final List<IrNode> content;

    public Message(Optional<String> version, List<IrNode> content) {
      super(Kind.MESSAGE);
      this.version = Preconditions.checkNotNull(version);
      this.content = new ArrayList<>(content);
    }

    public Optional<String> version() {
      return version;
    }

    public void setVersion(String version) {
      this.version = Optional.of(version);
    }

    /** The live content list. */
    public List<IrNode> content() {
      return content;
    }

    @Override
    public String typeName() {
      return "Message";
    }

    @Override
    public <V> V accept(IrVisitor<V> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Message copy() {
      return new Message(version, copyAll(content));
    }

    @Override
    public Map<String, Object> toMap() {
      Map<String, Object> map = typed(typeName());
      version.ifPresent(v -> map.put("version", v));
      putChildren(map, "content", content);
      return map;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Message)) return false;
      Message other = (Message) obj;
      return version.equals(other.version) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
      return Objects.hash(version, content);
    }
  }

  public static final class Concept extends IrNode {
    private Optional<String> id;
    private final Optional<String> qualifier;
    private final List<IrNode> children;

    public Concept(Optional<String> id, Optional<String> qualifier, List<IrNode> children) {
      super(Kind.CONCEPT);
      this.id = Preconditions.checkNotNull(id);
      this.qualifier = Preconditions.checkNotNull(qualifier);
      this.children = new ArrayList<>(children);
    }

    public static Concept of(String id) {
      return new Concept(Optional.of(id), Optional.empty(), ImmutableList.of());
    }

    public Optional<String> id() {
      return id;
    }

    public void setId(String id) {
      this.id = Optional.of(id);
    }

    public Optional<String> qualifier() {
      return qualifier;
    }

    public List<IrNode> children() {
      return children;
    }

    /** The surface tag, e.g. {@code #c501~approaches}. */
    public String tag() {
      StringBuilder sb = new StringBuilder().append(Scanner.CONCEPT_SIGIL).append(id.orElse(""));
      qualifier.ifPresent(q -> sb.append(Scanner.RELATION_SIGIL).append(q));
      return sb.toString();
    }

    @Override
    public String typeName() {
      return "Concept";
    }

    @Override
    public <V> V accept(IrVisitor<V> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Concept copy() {
      return new Concept(id, qualifier, copyAll(children));
    }

    @Override
    public Map<String, Object> toMap() {
      Map<String, Object> map = typed(typeName());
      id.ifPresent(v -> map.put("id", v));
      qualifier.ifPresent(v -> map.put("qualifier", v));
      putChildren(map, "children", children);
      return map;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Concept)) return false;
      Concept other = (Concept) obj;
      return id.equals(other.id)
          && qualifier.equals(other.qualifier)
          && children.equals(other.children);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, qualifier, children);
    }
  }

  public static final class Relation extends IrNode {
    private Optional<String> name;
    private final List<IrNode> children;

    public Relation(Optional<String> name, List<IrNode> children) {
      super(Kind.RELATION);
      this.name = Preconditions.checkNotNull(name);
      this.children = new ArrayList<>(children);
    }

    public Optional<String> name() {
      return name;
    }

    public void setName(String name) {
      this.name = Optional.of(name);
    }

    public List<IrNode> children() {
      return children;
    }

    public String tag() {
      return Scanner.RELATION_SIGIL + name.orElse("");
    }

    @Override
    public String typeName() {
      return "Relation";
    }

    @Override
    public <V> V accept(IrVisitor<V> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Relation copy() {
      return new Relation(name, copyAll(children));
    }

    @Override
    public Map<String, Object> toMap() {
      Map<String, Object> map = typed(typeName());
      name.ifPresent(v -> map.put("name", v));
      putChildren(map, "children", children);
      return map;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Relation)) return false;
      Relation other = (Relation) obj;
      return name.equals(other.name) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, children);
    }
  }

  public static final class Quantifier extends IrNode {
    private final Optional<String> name;
    private final List<IrNode> children;

    public Quantifier(Optional<String> name, List<IrNode> children) {
      super(Kind.QUANTIFIER);
      this.name = Preconditions.checkNotNull(name);
      this.children = new ArrayList<>(children);
    }

    public Optional<String> name() {
      return name;
    }

    public List<IrNode> children() {
      return children;
    }

    public String tag() {
      return Scanner.QUANTIFIER_SIGIL + name.orElse("");
    }

    @Override
    public String typeName() {
      return "Quantifier";
    }

    @Override
    public <V> V accept(IrVisitor<V> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Quantifier copy() {
      return new Quantifier(name, copyAll(children));
    }

    @Override
    public Map<String, Object> toMap() {
      Map<String, Object> map = typed(typeName());
      name.ifPresent(v -> map.put("name", v));
      putChildren(map, "children", children);
      return map;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Quantifier)) return false;
      Quantifier other = (Quantifier) obj;
      return name.equals(other.name) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, children);
    }
  }

  public static final class Reference extends IrNode {
    private final String source;
    private final ImmutableList<String> path;

    public Reference(String source, List<String> path) {
      super(Kind.REFERENCE);
      this.source = Preconditions.checkNotNull(source);
      this.path = ImmutableList.copyOf(path);
    }

    public String source() {
      return source;
    }

    public ImmutableList<String> path() {
      return path;
    }

    /** The surface token, e.g. {@code ^prev1.#topic}. */
    public String token() {
      StringBuilder sb = new StringBuilder().append(Scanner.REFERENCE_SIGIL).append(source);
      path.forEach(p -> sb.append('.').append(p));
      return sb.toString();
    }

    @Override
    public String typeName() {
      return "Reference";
    }

    @Override
    public <V> V accept(IrVisitor<V> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Reference copy() {
      return new Reference(source, path);
    }

    @Override
    public Map<String, Object> toMap() {
      Map<String, Object> map = typed(typeName());
      map.put("source", source);
      if (!path.isEmpty()) map.put("path", path);
      return map;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Reference)) return false;
      Reference other = (Reference) obj;
      return source.equals(other.source) && path.equals(other.path);
    }

    @Override
    public int hashCode() {
      return Objects.hash(source, path);
    }
  }

  /** Verbatim lowering of syntax kinds that have no dedicated IR case (e.g. properties). */
  public static final class Generic extends IrNode {
    private final SyntaxNode.Kind syntaxKind;
    private final Optional<String> value;
    private final ImmutableMap<String, String> attributes;
    private final List<IrNode> children;

    public Generic(
        SyntaxNode.Kind syntaxKind,
        Optional<String> value,
        Map<String, String> attributes,
        List<IrNode> children) {
      super(Kind.GENERIC);
      this.syntaxKind = Preconditions.checkNotNull(syntaxKind);
      this.value = Preconditions.checkNotNull(value);
      this.attributes = ImmutableMap.copyOf(attributes);
      this.children = new ArrayList<>(children);
    }

    public SyntaxNode.Kind syntaxKind() {
      return syntaxKind;
    }

    public Optional<String> value() {
      return value;
    }

    public ImmutableMap<String, String> attributes() {
      return attributes;
    }

    public List<IrNode> children() {
      return children;
    }

    @Override
    public String typeName() {
      return syntaxKind.name();
    }

    @Override
    public <V> V accept(IrVisitor<V> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Generic copy() {
      return new Generic(syntaxKind, value, attributes, copyAll(children));
    }

    @Override
    public Map<String, Object> toMap() {
      Map<String, Object> map = typed(typeName());
      value.ifPresent(v -> map.put("value", v));
      if (!attributes.isEmpty()) map.put("attributes", new LinkedHashMap<>(attributes));
      putChildren(map, "children", children);
      return map;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Generic)) return false;
      Generic other = (Generic) obj;
      return syntaxKind == other.syntaxKind
          && value.equals(other.value)
          && attributes.equals(other.attributes)
          && children.equals(other.children);
    }

    @Override
    public int hashCode() {
      return Objects.hash(syntaxKind, value, attributes, children);
    }
  }
}
