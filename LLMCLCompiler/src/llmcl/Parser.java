package llmcl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import llmcl.Scanner.Token;

/**
 * Recursive-descent parser for a single message.
 *
 * <p>Parsing stops at the first structural error. The error is recorded in {@link #errors()}
 * and {@link #parse()} returns a degenerate {@code Message} node whose {@code error} attribute
 * carries the formatted message.
 */
public class Parser {
  private static final Logger logger = LoggerFactory.getLogger(Parser.class);

  public static final String ERROR_ATTRIBUTE = "error";

  private final ImmutableList<Token> tokens;
  private final List<String> errors = new ArrayList<>();
  private int current = 0;

  public Parser(List<Token> tokens) {
    this.tokens =
        tokens
            .stream()
            .filter(t -> t.kind() != Token.Kind.WHITESPACE)
            .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<String> errors() {
    return ImmutableList.copyOf(errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public SyntaxNode parse() {
    try {
      return parseMessage();
    } catch (CompilerException ex) {
      String error = ex.format();
      logger.debug("parse aborted: {}", error);
      errors.add(error);
      return new SyntaxNode.Builder(SyntaxNode.Kind.MESSAGE, Optional.of("Error"))
          .putAttribute(ERROR_ATTRIBUTE, error)
          .build();
    }
  }

  private SyntaxNode parseMessage() throws CompilerException {
    SyntaxNode.Builder message = new SyntaxNode.Builder(SyntaxNode.Kind.MESSAGE, Optional.empty());

    if (!check(Token.Kind.VERSION)) throw error("Expected version marker (@v1.0)");
    message.addChild(SyntaxNode.leaf(SyntaxNode.Kind.VERSION, advance().text()));

    consume(Token.Kind.OPEN_BRACE, "Expected '{' after version marker");
    while (!check(Token.Kind.CLOSE_BRACE) && !isAtEnd()) {
      Token token = advance();
      switch (token.kind()) {
        case CONCEPT:
          message.addChild(parseConcept(token));
          break;
        case RELATION:
          message.addChild(parseRelation(token));
          break;
        case QUANTIFIER:
          message.addChild(parseQuantifier(token));
          break;
        case REFERENCE:
          message.addChild(SyntaxNode.leaf(SyntaxNode.Kind.REFERENCE, token.text()));
          break;
        default:
          throw error(token, "Unexpected token: " + token.text());
      }
    }
    consume(Token.Kind.CLOSE_BRACE, "Expected '}' to close message");

    return message.build();
  }

  private SyntaxNode parseConcept(Token concept) throws CompilerException {
    SyntaxNode.Builder node =
        new SyntaxNode.Builder(SyntaxNode.Kind.CONCEPT, Optional.of(concept.text()));
    if (!match(Token.Kind.OPEN_BRACE)) return node.build();

    while (!check(Token.Kind.CLOSE_BRACE) && !isAtEnd()) {
      Token token = advance();
      switch (token.kind()) {
        case CONCEPT:
          node.addChild(parseConcept(token));
          break;
        case RELATION:
          node.addChild(parseRelation(token));
          break;
        case QUANTIFIER:
          node.addChild(parseQuantifier(token));
          break;
        case REFERENCE:
          node.addChild(SyntaxNode.leaf(SyntaxNode.Kind.REFERENCE, token.text()));
          break;
        default:
          throw error(token, "Unexpected token in concept: " + token.text());
      }
    }
    consume(Token.Kind.CLOSE_BRACE, "Expected '}' to close concept");

    return node.build();
  }

  // Relation bodies cannot hold quantifiers.
  private SyntaxNode parseRelation(Token relation) throws CompilerException {
    SyntaxNode.Builder node =
        new SyntaxNode.Builder(SyntaxNode.Kind.RELATION, Optional.of(relation.text()));
    if (!match(Token.Kind.OPEN_BRACE)) return node.build();

    while (!check(Token.Kind.CLOSE_BRACE) && !isAtEnd()) {
      Token token = advance();
      switch (token.kind()) {
        case CONCEPT:
          node.addChild(parseConcept(token));
          break;
        case RELATION:
          node.addChild(parseRelation(token));
          break;
        case REFERENCE:
          node.addChild(SyntaxNode.leaf(SyntaxNode.Kind.REFERENCE, token.text()));
          break;
        default:
          throw error(token, "Unexpected token in relation: " + token.text());
      }
    }
    consume(Token.Kind.CLOSE_BRACE, "Expected '}' to close relation");

    return node.build();
  }

  // Quantifier bodies hold concepts, nested quantifiers and bare property identifiers only.
  private SyntaxNode parseQuantifier(Token quantifier) throws CompilerException {
    SyntaxNode.Builder node =
        new SyntaxNode.Builder(SyntaxNode.Kind.QUANTIFIER, Optional.of(quantifier.text()));
    if (!match(Token.Kind.OPEN_BRACE)) return node.build();

    while (!check(Token.Kind.CLOSE_BRACE) && !isAtEnd()) {
      Token token = advance();
      switch (token.kind()) {
        case CONCEPT:
          node.addChild(parseConcept(token));
          break;
        case QUANTIFIER:
          node.addChild(parseQuantifier(token));
          break;
        case IDENTIFIER:
          node.addChild(SyntaxNode.leaf(SyntaxNode.Kind.PROPERTY, token.text()));
          break;
        default:
          throw error(token, "Unexpected token in quantifier: " + token.text());
      }
    }
    consume(Token.Kind.CLOSE_BRACE, "Expected '}' to close quantifier");

    return node.build();
  }

  private boolean match(Token.Kind kind) {
    if (!check(kind)) return false;
    advance();
    return true;
  }

  private boolean check(Token.Kind kind) {
    return !isAtEnd() && peek().kind() == kind;
  }

  private Token advance() {
    Token token = peek();
    if (!isAtEnd()) current++;
    return token;
  }

  private boolean isAtEnd() {
    return peek().kind() == Token.Kind.EOF;
  }

  private Token peek() {
    // Streams that did not come from the Scanner may lack a trailing EOF.
    if (current >= tokens.size()) {
      return tokens.isEmpty()
          ? Token.create(Token.Kind.EOF, "", Scanner.Pos.create(1, 1))
          : Token.create(Token.Kind.EOF, "", tokens.get(tokens.size() - 1).pos());
    }
    return tokens.get(current);
  }

  private void consume(Token.Kind kind, String errorMsg) throws CompilerException {
    if (!match(kind)) throw error(errorMsg);
  }

  private CompilerException error(String errorMsg) {
    return error(peek(), errorMsg);
  }

  private CompilerException error(Token token, String errorMsg) {
    return new CompilerException(token.pos(), errorMsg);
  }
}
