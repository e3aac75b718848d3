package opulse;

import static com.google.common.truth.Truth.assertThat;

import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.node.ObjectNode;

public class ExpressionEvaluatorTest {

  private OperatorRegistry registry;
  private ExpressionEvaluator evaluator;

  @BeforeEach
  public void setUp() throws SynthesisException {
    registry = new OperatorRegistry();
    SeedOperators.install(registry);
    registry.add(
        OperatorData.builder().setSymbol("&").setFixity(Fixity.PREFIX).setBaseTag(2).build());
    registry.add(
        OperatorData.builder().setSymbol("$").setFixity(Fixity.PREFIX).setBaseTag(10).build());
    evaluator =
        new ExpressionEvaluator(
            registry, new BaseConverter("0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ"), "NaN");
  }

  private ExpressionNode num(long value) {
    return ExpressionNode.number(value, 10);
  }

  private ExpressionNode binary(int id, ExpressionNode left, ExpressionNode right) {
    return ExpressionNode.binary(registry.get(id), left, right);
  }

  @Test
  public void lowerPrecedenceChildIsBracketed() {
    ExpressionNode tree = binary(4, binary(1, num(2), num(3)), num(5));

    assertThat(evaluator.render(tree, NumberStyle.PLAIN, false)).isEqualTo("(2+3)*5");
    assertThat(evaluator.render(tree, NumberStyle.PLAIN, true)).isEqualTo("((2+3)*5)");
  }

  @Test
  public void associativityDecidesBrackets() {
    ExpressionNode leftNested = binary(2, binary(2, num(7), num(2)), num(1));
    ExpressionNode rightNested = binary(2, num(7), binary(2, num(2), num(1)));

    assertThat(evaluator.render(leftNested, NumberStyle.PLAIN, false)).isEqualTo("7-2-1");
    assertThat(evaluator.render(rightNested, NumberStyle.PLAIN, false)).isEqualTo("7-(2-1)");
  }

  @Test
  public void numberStyles() {
    ExpressionNode binaryFive = ExpressionNode.number(5, 2);

    assertThat(evaluator.render(binaryFive, NumberStyle.BASE_SYMBOL, false)).isEqualTo("&101");
    assertThat(evaluator.render(num(5), NumberStyle.TAGGED, false)).isEqualTo("$5$");
    assertThat(evaluator.render(num(-5), NumberStyle.PLAIN, false)).isEqualTo("(-5)");
  }

  @Test
  public void unaryIsAlwaysBracketed() {
    ExpressionNode tree = ExpressionNode.unary(registry.get(3), num(4));

    assertThat(evaluator.render(tree, NumberStyle.PLAIN, false)).isEqualTo("(-4)");
    assertThat(evaluator.fold(tree).value()).isEqualTo(Value.of(-4));
  }

  @Test
  public void evaluate() {
    EvaluatedExpression evaluated =
        evaluator.evaluate(7, binary(4, binary(1, num(2), num(3)), num(5)));

    assertThat(evaluated.expression()).isEqualTo("($2+$3)*$5");
    assertThat(evaluated.expressionNoBaseSymbol()).isEqualTo("($2$+$3$)*$5$");
    assertThat(evaluated.result()).isEqualTo(Value.of(25));
    // + costs 1, * costs min(|5|, |5|).
    assertThat(evaluated.normalizedExpansionDegree()).isEqualTo(Value.of(6));
    assertThat(evaluated.applicationCount()).isEqualTo(2);
    assertThat(evaluated.complexityRatio()).isEqualTo(3.0);
    assertThat(evaluated.priorityHierarchicalComplexity()).isEqualTo(2);
    assertThat(evaluated.highestOrder()).isEqualTo(1);
    assertThat(evaluated.maxDigitCount()).isEqualTo(1);
    assertThat(evaluated.operatorUsage().elementSet()).containsExactly(1, 4);

    ObjectNode json = evaluated.toJson();
    assertThat(json.get("id").asInt()).isEqualTo(7);
    assertThat(json.get("result").asLong()).isEqualTo(25);
    assertThat(json.get("operation_count").asInt()).isEqualTo(2);
    assertThat(json.get("tree").get("type").asText()).isNotEmpty();
  }

  @Test
  public void divisionByZeroFoldsToNan() {
    EvaluatedExpression evaluated = evaluator.evaluate(0, binary(5, num(7), num(0)));

    assertThat(evaluated.result().isNan()).isTrue();
    assertThat(evaluated.normalizedExpansionDegree().isNan()).isTrue();
    assertThat(evaluated.complexityRatio()).isEqualTo(0.0);
    assertThat(evaluated.toJson().get("result").asText()).isEqualTo("NaN");
  }

  @Test
  public void nanPropagatesUpward() {
    ExpressionNode tree = binary(1, binary(6, num(1), num(0)), num(2));

    assertThat(evaluator.fold(tree).isNan()).isTrue();
  }

  @Test
  public void variableFoldsToNan() {
    ExpressionNode tree = binary(1, ExpressionNode.variable("a"), num(2));

    assertThat(evaluator.render(tree, NumberStyle.PLAIN, false)).isEqualTo("a+2");
    assertThat(evaluator.fold(tree).isNan()).isTrue();
  }

  private OperatorRecord translated(String symbol, Fixity fixity, String text)
      throws SynthesisException {
    OperatorRecord record =
        registry.add(
            OperatorData.builder()
                .setSymbol(symbol)
                .setFixity(fixity)
                .setKind(DefinitionKind.SIMPLE)
                .build());
    setDefinition(record, text);
    return record;
  }

  private void setDefinition(OperatorRecord record, String text) throws SynthesisException {
    DefinitionTranslator.Procedures procedures =
        new DefinitionTranslator(registry).translate(record, DefinitionParser.parse(text));
    registry.setProcedures(record.id(), procedures.compute(), procedures.cost());
  }

  @Test
  public void postfixRendersAfterItsOperand() throws SynthesisException {
    OperatorRecord square = translated("!", Fixity.POSTFIX, "x! = { (x*x) }");
    ExpressionNode tree = ExpressionNode.unary(square, binary(1, num(2), num(1)));

    String text = evaluator.render(tree, NumberStyle.PLAIN, true);
    assertThat(text).isEqualTo("((2+1)!)");
    Definition.Unary body =
        (Definition.Unary)
            DefinitionParser.parse("⊙a = { " + text + " }").branches().get(0).expression();
    assertThat(body.fixity()).isEqualTo(Fixity.POSTFIX);
    assertThat(evaluator.fold(tree).value()).isEqualTo(Value.of(9));
  }

  @Test
  public void bracketedRenderingReadsBackAsDefinitionBody()
      throws ConfigurationException, SynthesisException {
    translated("!", Fixity.POSTFIX, "x! = { (x*x) }");
    GeneratorConfig config =
        GeneratorConfig.parse(
            String.join(
                "\n",
                "max_base: 10",
                "expr_numeric_range: [0, 12]",
                "expr_type_weights: {binary: 0.5, unary_prefix: 0.15, unary_postfix: 0.15,"
                    + " atoms: 0.2}"));
    ExpressionGenerator generator =
        new ExpressionGenerator(config, registry, evaluator, new Random(2024));
    OperatorRecord body = translated("⊙", Fixity.PREFIX, "⊙a = { 0 }");

    int nans = 0;
    for (int i = 0; i < 200; i++) {
      ExpressionNode tree = generator.generate(0, 4, ExpressionGenerator.AtomPolicy.NUMBER);
      String text = evaluator.render(tree, NumberStyle.PLAIN, true);
      setDefinition(body, "⊙a = { " + text + " }");
      FoldResult readBack =
          FoldResult.create(
              registry.compile(body.id(), Slot.COST).get().invoke(0),
              registry.compile(body.id(), Slot.COMPUTE).get().invoke(0));

      FoldResult folded = evaluator.fold(tree);
      assertThat(readBack).isEqualTo(folded);
      if (folded.isNan()) {
        nans++;
      }
    }
    assertThat(nans).isLessThan(200);
  }

  @Test
  public void longestNumeral() {
    BaseConverter converter = new BaseConverter("0123456789ABCDEF");

    assertThat(converter.convert(255, 16)).isEqualTo("FF");
    assertThat(converter.convert(-6, 2)).isEqualTo("-110");
    assertThat(converter.longestNumeral("&1011+$FF")).isEqualTo(4);
  }
}
