package llmcl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import llmcl.Scanner.Token;

/**
 * Runs the full pipeline over one message: scan, parse, check, lower, canonicalize, print.
 *
 * <p>Parsing is fail-fast; semantic errors are reported in batch. When a {@link
 * ReferenceResolver} is supplied, references are resolved after lowering (failures become
 * warnings) and the compiled message is appended to the resolver's context.
 *
 * <p>An instance compiles once; intermediate products stay available for inspection.
 */
public class LlmclCompiler {
  private static final Logger logger = LoggerFactory.getLogger(LlmclCompiler.class);

  private final String source;
  private final Optional<ConceptRegistry> registry;
  private final Optional<ReferenceResolver> resolver;

  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final Map<String, Object> resolvedReferences = new LinkedHashMap<>();

  private Optional<CompileResult> result = Optional.empty();
  private ImmutableList<Token> tokens = ImmutableList.of();
  private Optional<SyntaxNode> syntaxTree = Optional.empty();
  private Optional<IrNode.Message> ir = Optional.empty();
  private Optional<IrNode.Message> canonicalIr = Optional.empty();

  public LlmclCompiler(String source) {
    this(source, Optional.empty(), Optional.empty());
  }

  public LlmclCompiler(
      String source, Optional<ConceptRegistry> registry, Optional<ReferenceResolver> resolver) {
    this.source = Preconditions.checkNotNull(source);
    this.registry = Preconditions.checkNotNull(registry);
    this.resolver = Preconditions.checkNotNull(resolver);
  }

  public static CompileResult compile(String source, ConceptRegistry registry) {
    return new LlmclCompiler(source, Optional.of(registry), Optional.empty()).compile();
  }

  public CompileResult compile() {
    if (!result.isPresent()) result = Optional.of(compileImpl());
    return result.get();
  }

  private CompileResult compileImpl() {
    tokens = new Scanner(source).scan();
    logger.debug("scanned {} tokens", tokens.size());

    Parser parser = new Parser(tokens);
    SyntaxNode tree = parser.parse();
    syntaxTree = Optional.of(tree);
    if (parser.hasErrors()) {
      errors.addAll(parser.errors());
      return fail();
    }

    SemanticChecker checker = new SemanticChecker(registry).check(tree);
    errors.addAll(checker.errors());
    warnings.addAll(checker.warnings());
    if (!errors.isEmpty()) return fail();

    IrNode.Message lowered = (IrNode.Message) new IrBuilder().build(tree);
    ir = Optional.of(lowered);
    resolver.ifPresent(r -> bindReferences(r, lowered));

    IrNode.Message canonical = new Canonicalizer().canonicalize(lowered.copy());
    canonicalIr = Optional.of(canonical);
    String output = Printer.print(canonical);

    resolver.ifPresent(r -> r.addToContext(ContextView.of(canonical)));
    logger.debug("compiled message with {} warning(s)", warnings.size());
    return CompileResult.success(output, warnings);
  }

  private CompileResult fail() {
    logger.debug("compilation failed with {} error(s)", errors.size());
    return CompileResult.failure(Joiner.on('\n').join(errors), warnings);
  }

  private void bindReferences(ReferenceResolver r, IrNode.Message message) {
    for (IrNode.Reference reference : References.collect(message)) {
      String token = reference.token();
      Optional<Object> resolved = r.resolve(token);
      if (resolved.isPresent()) {
        resolvedReferences.put(token, resolved.get());
      } else {
        warnings.add("Unresolved reference: " + token);
      }
    }
  }

  public ImmutableList<Token> tokens() {
    return tokens;
  }

  public Optional<SyntaxNode> syntaxTree() {
    return syntaxTree;
  }

  /** The IR as lowered, before canonicalization. */
  public Optional<IrNode.Message> ir() {
    return ir;
  }

  public Optional<IrNode.Message> canonicalIr() {
    return canonicalIr;
  }

  public Optional<Map<String, Object>> syntaxTreeAsMap() {
    return syntaxTree.map(SyntaxNode::toMap);
  }

  public Optional<Map<String, Object>> irAsMap() {
    return ir.map(IrNode::toMap);
  }

  public Optional<Map<String, Object>> canonicalIrAsMap() {
    return canonicalIr.map(IrNode::toMap);
  }

  public ImmutableList<String> errors() {
    return ImmutableList.copyOf(errors);
  }

  public ImmutableList<String> warnings() {
    return ImmutableList.copyOf(warnings);
  }

  /** Reference tokens that resolved against the context, with the values they resolved to. */
  public ImmutableMap<String, Object> resolvedReferences() {
    return ImmutableMap.copyOf(resolvedReferences);
  }
}
