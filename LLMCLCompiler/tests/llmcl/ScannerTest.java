package llmcl;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.truth.Correspondence;

import llmcl.Scanner.Token;

public class ScannerTest {

  private static ImmutableList<Token> scan(String source) {
    return new Scanner(source).scan();
  }

  private static ImmutableList<Token> scanSignificant(String source) {
    return scan(source)
        .stream()
        .filter(t -> t.kind() != Token.Kind.WHITESPACE)
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void emptySource() {
    ImmutableList<Token> tokens = scan("");

    assertThat(tokens).hasSize(1);
    assertThat(tokens.get(0).kind()).isEqualTo(Token.Kind.EOF);
  }

  @Test
  public void basicMessage() {
    ImmutableList<Token> tokens = scan("@v1.0{#c501~approaches}");

    assertThat(tokens)
        .comparingElementsUsing(kindAndText())
        .containsExactly(
            "VERSION:@v1.0",
            "OPEN_BRACE:{",
            "CONCEPT:#c501~approaches",
            "CLOSE_BRACE:}",
            "EOF:")
        .inOrder();
    assertThat(tokens.get(2).pos()).isEqualTo(Scanner.Pos.create(1, 7));
  }

  @Test
  public void allSigils() {
    ImmutableList<Token> tokens = scanSignificant("~cause $count ^prev1.#topic.0 items_2");

    assertThat(tokens)
        .comparingElementsUsing(kindAndText())
        .containsExactly(
            "RELATION:~cause",
            "QUANTIFIER:$count",
            "REFERENCE:^prev1.#topic.0",
            "IDENTIFIER:items_2",
            "EOF:")
        .inOrder();
  }

  @Test
  public void relationStopsAtQualifierSeparator() {
    assertThat(scanSignificant("~a~b"))
        .comparingElementsUsing(kindAndText())
        .containsExactly("RELATION:~a", "RELATION:~b", "EOF:")
        .inOrder();
  }

  @Test
  public void malformedVersionKeepsScanning() {
    assertThat(scanSignificant("@x{"))
        .comparingElementsUsing(kindAndText())
        .containsExactly("ERROR:@", "IDENTIFIER:x", "OPEN_BRACE:{", "EOF:")
        .inOrder();
    assertThat(scanSignificant("@v1{"))
        .comparingElementsUsing(kindAndText())
        .containsExactly("ERROR:@", "IDENTIFIER:v1", "OPEN_BRACE:{", "EOF:")
        .inOrder();
  }

  @Test
  public void operatorsAndUnknownCharacters() {
    assertThat(scanSignificant("+ - * / < > % ."))
        .comparingElementsUsing(kindAndText())
        .containsExactly(
            "OPERATOR:+",
            "OPERATOR:-",
            "OPERATOR:*",
            "OPERATOR:/",
            "OPERATOR:<",
            "OPERATOR:>",
            "ERROR:%",
            "ERROR:.",
            "EOF:")
        .inOrder();
  }

  @Test
  public void whitespaceIsTokenized() {
    ImmutableList<Token> tokens = scan("#a \n\t#b");

    assertThat(tokens)
        .comparingElementsUsing(kindAndText())
        .containsExactly("CONCEPT:#a", "WHITESPACE: \n\t", "CONCEPT:#b", "EOF:")
        .inOrder();
  }

  @Test
  public void positionsTrackNewlines() {
    ImmutableList<Token> tokens = scanSignificant("@v1.0{\n  #a\n}");

    assertThat(tokens.get(2).text()).isEqualTo("#a");
    assertThat(tokens.get(2).pos()).isEqualTo(Scanner.Pos.create(2, 3));
    assertThat(tokens.get(3).kind()).isEqualTo(Token.Kind.CLOSE_BRACE);
    assertThat(tokens.get(3).pos()).isEqualTo(Scanner.Pos.create(3, 1));
    assertThat(tokens.get(4).pos()).isEqualTo(Scanner.Pos.create(3, 2));
  }

  @Test
  public void bareSigils() {
    assertThat(scanSignificant("# ~ $ ^"))
        .comparingElementsUsing(kindAndText())
        .containsExactly("CONCEPT:#", "RELATION:~", "QUANTIFIER:$", "REFERENCE:^", "EOF:")
        .inOrder();
  }

  private static Correspondence<Token, String> kindAndText() {
    return Correspondence.from(
        (t, s) -> (t.kind() + ":" + t.text()).equals(s), "has kind:text equal to");
  }
}
