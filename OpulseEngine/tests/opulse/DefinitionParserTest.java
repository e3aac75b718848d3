package opulse;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class DefinitionParserTest {

  private static void assertSyntaxError(String text) {
    SynthesisException e =
        assertThrows(SynthesisException.class, () -> DefinitionParser.parse(text));
    assertThat(e.reason()).isEqualTo(SynthesisException.Reason.SYNTAX_ERROR);
    assertThat(e.getMessage()).contains(text);
  }

  @Test
  public void simpleInfix() throws SynthesisException {
    Definition definition = DefinitionParser.parse("a ⊕ b = { ((a+b)*2) }");

    assertThat(definition.symbol()).isEqualTo("⊕");
    assertThat(definition.fixity()).isEqualTo(Fixity.INFIX);
    assertThat(definition.operands()).containsExactly("a", "b").inOrder();
    assertThat(definition.isBranching()).isFalse();

    Definition.Binary body = (Definition.Binary) definition.branches().get(0).expression();
    assertThat(body.symbol()).isEqualTo("*");
    assertThat(body.left().type()).isEqualTo(Definition.Term.Type.BINARY);
    assertThat(((Definition.Literal) body.right()).value()).isEqualTo(2);
  }

  @Test
  public void unaryPatterns() throws SynthesisException {
    Definition prefix = DefinitionParser.parse("~x = { (x*x) }");
    Definition postfix = DefinitionParser.parse("x!! = { (-x) }");

    assertThat(prefix.fixity()).isEqualTo(Fixity.PREFIX);
    assertThat(prefix.symbol()).isEqualTo("~");
    assertThat(prefix.operands()).containsExactly("x");
    assertThat(postfix.fixity()).isEqualTo(Fixity.POSTFIX);
    assertThat(postfix.symbol()).isEqualTo("!!");

    Definition.Unary body = (Definition.Unary) postfix.branches().get(0).expression();
    assertThat(body.fixity()).isEqualTo(Fixity.PREFIX);
    assertThat(body.symbol()).isEqualTo("-");
  }

  @Test
  public void branches() throws SynthesisException {
    Definition definition =
        DefinitionParser.parse(
            "a ⊕ b = { (a+b), if a > 0 and b < 3 ; (a-b), if a == 0 or (b%2) != 1 ; 0, else }");

    assertThat(definition.isBranching()).isTrue();
    assertThat(definition.branches()).hasSize(3);

    Definition.Connective first =
        (Definition.Connective) definition.branches().get(0).condition().get();
    assertThat(first.isConjunction()).isTrue();
    assertThat(((Definition.Comparison) first.left()).comparison())
        .isEqualTo(Value.Comparison.GT);

    Definition.Connective second =
        (Definition.Connective) definition.branches().get(1).condition().get();
    assertThat(second.isConjunction()).isFalse();
    Definition.Comparison parity = (Definition.Comparison) second.right();
    assertThat(parity.comparison()).isEqualTo(Value.Comparison.NE);
    assertThat(parity.left().type()).isEqualTo(Definition.Term.Type.BINARY);

    assertThat(definition.branches().get(2).condition().isPresent()).isFalse();
  }

  @Test
  public void orBindsLooserThanAnd() throws SynthesisException {
    Definition definition =
        DefinitionParser.parse("~a = { 1, if a > 1 or a < 0 and a != 5 ; 2, else }");

    Definition.Connective root =
        (Definition.Connective) definition.branches().get(0).condition().get();
    assertThat(root.isConjunction()).isFalse();
    assertThat(((Definition.Connective) root.right()).isConjunction()).isTrue();
  }

  @Test
  public void negativeLiteralReadsAsNegation() throws SynthesisException {
    Definition definition = DefinitionParser.parse("a ⊕ b = { (a+(-5)) }");

    Definition.Binary body = (Definition.Binary) definition.branches().get(0).expression();
    assertThat(body.right().type()).isEqualTo(Definition.Term.Type.UNARY);
  }

  @Test
  public void malformed() {
    assertSyntaxError("a ⊕ b (a+b)");
    assertSyntaxError("a ⊕ b { (a+b) }");
    assertSyntaxError("a ⊕ b = { (a+b+a) }");
    assertSyntaxError("a ⊕ a = { (a+a) }");
    assertSyntaxError("a ⊕ 1 = { a }");
    assertSyntaxError("a = { a }");
    assertSyntaxError("a ⊕ b = { ((a+b) }");
    assertSyntaxError("a ⊕ b = { 0, else ; 1, if a > b }");
    assertSyntaxError("a ⊕ b = { 0, if a > b ; 1, if a < b }");
    assertSyntaxError("a ⊕ b = { 0, if a ; 1, else }");
    assertSyntaxError("a ⊕ b = { a ; b }");
    assertSyntaxError("a ⊕ b = { (a+99999999999999999999) }");
  }
}
