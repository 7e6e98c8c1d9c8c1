package llmcl;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;

/** Produces a tokenization of the input. Never fails; bad input becomes {@code ERROR} tokens. */
public class Scanner {
  @AutoValue
  public abstract static class Pos {
    public abstract int line();

    public abstract int column();

    public static Pos create(int line, int column) {
      return new AutoValue_Scanner_Pos(line, column);
    }

    @Override
    public String toString() {
      return String.format("line %d, column %d", line(), column());
    }
  }

  @AutoValue
  public abstract static class Token {
    public enum Kind {
      VERSION,
      CONCEPT,
      RELATION,
      QUANTIFIER,
      REFERENCE,
      OPERATOR,
      OPEN_BRACE,
      CLOSE_BRACE,
      IDENTIFIER,
      WHITESPACE,
      EOF,
      ERROR;
    }

    public abstract Kind kind();

    public abstract String text();

    public abstract Pos pos();

    public static Token create(Kind kind, String text, Pos pos) {
      return new AutoValue_Scanner_Token(kind, text, pos);
    }

    @Override
    public final String toString() {
      return String.format("%s('%s')@%d:%d", kind(), text(), pos().line(), pos().column());
    }
  }

  public static final char VERSION_SIGIL = '@';
  public static final char CONCEPT_SIGIL = '#';
  public static final char RELATION_SIGIL = '~';
  public static final char QUANTIFIER_SIGIL = '$';
  public static final char REFERENCE_SIGIL = '^';

  private static final Pattern VERSION_BODY = Pattern.compile("v\\d+\\.\\d+");

  private static final CharMatcher WORD =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.is('_'))
          .precomputed();
  private static final CharMatcher CONCEPT_WORD = WORD.or(CharMatcher.is(RELATION_SIGIL));
  private static final CharMatcher REFERENCE_WORD = WORD.or(CharMatcher.anyOf(".#"));
  private static final CharMatcher OPERATOR = CharMatcher.anyOf("+-*/<>");

  private final String source;
  private int offset = 0;
  private int line = 1;
  private int column = 1;

  private final ImmutableList.Builder<Token> tokensBuilder = ImmutableList.builder();

  public Scanner(String source) {
    this.source = source;
  }

  public ImmutableList<Token> scan() {
    while (offset < source.length()) {
      char ch = source.charAt(offset);
      if (Character.isWhitespace(ch)) {
        scanWhitespace();
      } else if (ch == VERSION_SIGIL) {
        scanVersion();
      } else if (ch == CONCEPT_SIGIL) {
        scanRun(Token.Kind.CONCEPT, CONCEPT_WORD);
      } else if (ch == RELATION_SIGIL) {
        scanRun(Token.Kind.RELATION, WORD);
      } else if (ch == QUANTIFIER_SIGIL) {
        scanRun(Token.Kind.QUANTIFIER, WORD);
      } else if (ch == REFERENCE_SIGIL) {
        scanRun(Token.Kind.REFERENCE, REFERENCE_WORD);
      } else if (ch == '{') {
        emitSingle(Token.Kind.OPEN_BRACE);
      } else if (ch == '}') {
        emitSingle(Token.Kind.CLOSE_BRACE);
      } else if (OPERATOR.matches(ch)) {
        emitSingle(Token.Kind.OPERATOR);
      } else if (WORD.matches(ch)) {
        scanIdentifier();
      } else {
        emitSingle(Token.Kind.ERROR);
      }
    }

    tokensBuilder.add(Token.create(Token.Kind.EOF, "", pos()));
    return tokensBuilder.build();
  }

  private Pos pos() {
    return Pos.create(line, column);
  }

  private void emitSingle(Token.Kind kind) {
    Pos start = pos();
    advance();
    tokensBuilder.add(Token.create(kind, source.substring(offset - 1, offset), start));
  }

  private void scanWhitespace() {
    Pos start = pos();
    int begin = offset;
    while (offset < source.length() && Character.isWhitespace(source.charAt(offset))) {
      advance();
    }
    tokensBuilder.add(Token.create(Token.Kind.WHITESPACE, source.substring(begin, offset), start));
  }

  private void scanVersion() {
    Pos start = pos();
    advance();

    Matcher matcher = VERSION_BODY.matcher(source).region(offset, source.length());
    if (!matcher.lookingAt()) {
      // Keep going after the lone '@'; the parser decides whether it matters.
      tokensBuilder.add(Token.create(Token.Kind.ERROR, String.valueOf(VERSION_SIGIL), start));
      return;
    }

    int begin = offset - 1;
    while (offset < matcher.end()) {
      advance();
    }
    tokensBuilder.add(Token.create(Token.Kind.VERSION, source.substring(begin, offset), start));
  }

  // Sigil followed by a (possibly empty) run of characters from the given class.
  private void scanRun(Token.Kind kind, CharMatcher body) {
    Pos start = pos();
    int begin = offset;
    advance();
    while (offset < source.length() && body.matches(source.charAt(offset))) {
      advance();
    }
    tokensBuilder.add(Token.create(kind, source.substring(begin, offset), start));
  }

  private void scanIdentifier() {
    Pos start = pos();
    int begin = offset;
    while (offset < source.length() && WORD.matches(source.charAt(offset))) {
      advance();
    }
    tokensBuilder.add(Token.create(Token.Kind.IDENTIFIER, source.substring(begin, offset), start));
  }

  private void advance() {
    if (source.charAt(offset++) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
  }
}
