package llmcl;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ParserTest {

  private static Parser parser(String source) {
    return new Parser(new Scanner(source).scan());
  }

  private static SyntaxNode assertParses(String source) {
    Parser parser = parser(source);
    SyntaxNode tree = parser.parse();
    assertThat(parser.errors()).isEmpty();
    return tree;
  }

  private static String assertError(String errorSubstr, String source) {
    Parser parser = parser(source);
    SyntaxNode tree = parser.parse();

    ImmutableList<String> errors = parser.errors();
    assertThat(errors).hasSize(1);
    assertThat(errors.get(0)).contains(errorSubstr);

    assertThat(tree.kind()).isEqualTo(SyntaxNode.Kind.MESSAGE);
    assertThat(tree.value().get()).isEqualTo("Error");
    assertThat(tree.children()).isEmpty();
    assertThat(tree.attribute(Parser.ERROR_ATTRIBUTE).get()).isEqualTo(errors.get(0));
    return errors.get(0);
  }

  @Test
  public void nestedMessage() {
    SyntaxNode tree =
        assertParses("@v1.0{#request~information #topic{#c501~approaches #c142~agi}}");

    assertThat(tree.kind()).isEqualTo(SyntaxNode.Kind.MESSAGE);
    assertThat(tree.children()).hasSize(3);
    assertThat(tree.children().get(0)).isEqualTo(SyntaxNode.leaf(SyntaxNode.Kind.VERSION, "@v1.0"));
    assertThat(tree.children().get(1))
        .isEqualTo(SyntaxNode.leaf(SyntaxNode.Kind.CONCEPT, "#request~information"));

    SyntaxNode topic = tree.children().get(2);
    assertThat(topic.value().get()).isEqualTo("#topic");
    assertThat(topic.children())
        .containsExactly(
            SyntaxNode.leaf(SyntaxNode.Kind.CONCEPT, "#c501~approaches"),
            SyntaxNode.leaf(SyntaxNode.Kind.CONCEPT, "#c142~agi"))
        .inOrder();
  }

  @Test
  public void emptyMessage() {
    SyntaxNode tree = assertParses("@v2.1{}");

    assertThat(tree.children()).containsExactly(SyntaxNode.leaf(SyntaxNode.Kind.VERSION, "@v2.1"));
  }

  @Test
  public void conceptBodyAcceptsEveryContentKind() {
    SyntaxNode tree = assertParses("@v1.0{#x{#a ~r{#b} $q{#c} ^self}}");

    SyntaxNode x = tree.children().get(1);
    assertThat(x.children()).hasSize(4);
    assertThat(x.children().get(1).kind()).isEqualTo(SyntaxNode.Kind.RELATION);
    assertThat(x.children().get(2).kind()).isEqualTo(SyntaxNode.Kind.QUANTIFIER);
    assertThat(x.children().get(3).kind()).isEqualTo(SyntaxNode.Kind.REFERENCE);
  }

  @Test
  public void quantifierBodyHoldsProperties() {
    SyntaxNode tree = assertParses("@v1.0{$count{3 items #c1 $inner}}");

    SyntaxNode count = tree.children().get(1);
    assertThat(count.children())
        .containsExactly(
            SyntaxNode.leaf(SyntaxNode.Kind.PROPERTY, "3"),
            SyntaxNode.leaf(SyntaxNode.Kind.PROPERTY, "items"),
            SyntaxNode.leaf(SyntaxNode.Kind.CONCEPT, "#c1"),
            SyntaxNode.leaf(SyntaxNode.Kind.QUANTIFIER, "$inner"))
        .inOrder();
  }

  @Test
  public void relationBodyRejectsQuantifier() {
    assertError("Unexpected token in relation: $many", "@v1.0{~cause{$many}}");
    assertParses("@v1.0{#cause{$many}}");
    assertParses("@v1.0{~cause{#a ~b ^prev1}}");
  }

  @Test
  public void quantifierBodyRejectsRelationAndReference() {
    assertError("Unexpected token in quantifier: ~r", "@v1.0{$q{~r}}");
    assertError("Unexpected token in quantifier: ^self", "@v1.0{$q{^self}}");
  }

  @Test
  public void missingVersion() {
    assertError("Expected version marker (@v1.0)", "{#c1}");
    assertError("Expected version marker", "#a");
    assertError("Expected version marker", "@x1.0{#a}");
  }

  @Test
  public void missingBraces() {
    assertError("Expected '{' after version marker", "@v1.0 #a");
    assertError("Expected '}' to close message", "@v1.0{#a");
    assertError("Expected '}' to close concept", "@v1.0{#a{#b");
    assertError("Expected '}' to close relation", "@v1.0{~a{");
    assertError("Expected '}' to close quantifier", "@v1.0{$a{3");
  }

  @Test
  public void unexpectedTokens() {
    assertError("Unexpected token: %", "@v1.0{#a %}");
    assertError("Unexpected token: +", "@v1.0{+}");
    assertError("Unexpected token: word", "@v1.0{word}");
    assertError("Unexpected token in concept: {", "@v1.0{#a{{}}}");
  }

  @Test
  public void stopsAtFirstError() {
    String error = assertError("Unexpected token: %", "@v1.0{% & ~r{$q}}");

    assertThat(error).isEqualTo("Error at line 1, column 7: Unexpected token: %");
  }

  @Test
  public void errorPosition() {
    String error = assertError("Unexpected token in relation", "@v1.0{\n  ~r{$q}\n}");

    assertThat(error).isEqualTo("Error at line 2, column 6: Unexpected token in relation: $q");
  }

  @Test
  public void errorAtEndOfInput() {
    String error = assertError("Expected '}'", "@v1.0{#a");

    assertThat(error).isEqualTo("Error at line 1, column 9: Expected '}' to close message");
  }

  @Test
  public void trailingTokensAreIgnored() {
    SyntaxNode tree = assertParses("@v1.0{#a} #b");

    assertThat(tree.children()).hasSize(2);
  }

  @Test
  public void treeAsMap() {
    SyntaxNode tree = assertParses("@v1.0{#a{~r}}");

    assertThat(tree.toMap().toString())
        .isEqualTo(
            "{type=MESSAGE, children=[{type=VERSION, value=@v1.0},"
                + " {type=CONCEPT, value=#a, children=[{type=RELATION, value=~r}]}]}");
  }
}
