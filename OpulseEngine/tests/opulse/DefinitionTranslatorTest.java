package opulse;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class DefinitionTranslatorTest {

  private OperatorRegistry registry;
  private DefinitionTranslator translator;

  @BeforeEach
  public void setUp() throws SynthesisException {
    registry = new OperatorRegistry();
    SeedOperators.install(registry);
    translator = new DefinitionTranslator(registry);
  }

  private OperatorRecord install(String symbol, Fixity fixity, String text)
      throws SynthesisException {
    OperatorRecord record =
        registry.add(
            OperatorData.builder()
                .setSymbol(symbol)
                .setFixity(fixity)
                .setDefinition(text)
                .setKind(DefinitionKind.SIMPLE)
                .build());
    DefinitionTranslator.Procedures procedures =
        translator.translate(record, DefinitionParser.parse(text));
    registry.setProcedures(record.id(), procedures.compute(), procedures.cost());
    return record;
  }

  private Value compute(OperatorRecord record, long... args) {
    return registry.compile(record.id(), Slot.COMPUTE).get().invoke(args);
  }

  private Value cost(OperatorRecord record, long... args) {
    return registry.compile(record.id(), Slot.COST).get().invoke(args);
  }

  @Test
  public void simple() throws SynthesisException {
    OperatorRecord record = install("⊕", Fixity.INFIX, "a ⊕ b = { ((a*b)+1) }");

    assertThat(compute(record, 3, 4)).isEqualTo(Value.of(13));
    // + costs 1, * costs min(|3|, |4|).
    assertThat(cost(record, 3, 4)).isEqualTo(Value.of(4));
    assertThat(registry.procedureSource(record.id(), Slot.COMPUTE).get())
        .isEqualTo("(proc (a b) (op 1 (op 4 a b) 1))");
    assertThat(registry.extractDependencies(record.id())).containsExactly(1, 4);
  }

  @Test
  public void atomBodyIsFree() throws SynthesisException {
    OperatorRecord record = install("⊲", Fixity.INFIX, "a ⊲ b = { b }");

    assertThat(compute(record, 3, 4)).isEqualTo(Value.of(4));
    assertThat(cost(record, 3, 4)).isEqualTo(Value.of(0));
  }

  @Test
  public void branches() throws SynthesisException {
    OperatorRecord record =
        install("~", Fixity.PREFIX, "~a = { (a*2), if a > 10 ; (-a), else }");

    assertThat(compute(record, 11)).isEqualTo(Value.of(22));
    assertThat(cost(record, 11)).isEqualTo(Value.of(2));
    assertThat(compute(record, 3)).isEqualTo(Value.of(-3));
    assertThat(cost(record, 3)).isEqualTo(Value.of(1));
  }

  @Test
  public void nanConditionYieldsNan() throws SynthesisException {
    OperatorRecord record =
        install("⊘", Fixity.INFIX, "a ⊘ b = { 1, if (a/b) > 0 ; 2, else }");

    assertThat(compute(record, 4, 2)).isEqualTo(Value.of(1));
    assertThat(compute(record, 4, 0).isNan()).isTrue();
  }

  @Test
  public void selfReference() throws SynthesisException {
    OperatorRecord record =
        install("!", Fixity.POSTFIX, "n! = { 1, if n <= 0 ; (n*((n-1)!)), else }");

    assertThat(compute(record, 5)).isEqualTo(Value.of(120));
    assertThat(cost(record, 5).isNan()).isFalse();
    assertThat(registry.extractDependencies(record.id())).containsExactly(2, 4);
  }

  @Test
  public void mismatchedSymbol() throws SynthesisException {
    OperatorRecord record =
        registry.add(OperatorData.builder().setSymbol("@").setFixity(Fixity.INFIX).build());

    SynthesisException e =
        assertThrows(
            SynthesisException.class,
            () -> translator.translate(record, DefinitionParser.parse("a ⊕ b = { a }")));
    assertThat(e.reason()).isEqualTo(SynthesisException.Reason.COMPILE_FAILURE);
  }

  @Test
  public void unresolvedNames() throws SynthesisException {
    OperatorRecord record =
        registry.add(OperatorData.builder().setSymbol("⊕").setFixity(Fixity.INFIX).build());

    assertThrows(
        SynthesisException.class,
        () -> translator.translate(record, DefinitionParser.parse("a ⊕ b = { (a^b) }")));
    assertThrows(
        SynthesisException.class,
        () -> translator.translate(record, DefinitionParser.parse("a ⊕ b = { (a+c) }")));
    // No postfix minus.
    assertThrows(
        SynthesisException.class,
        () -> translator.translate(record, DefinitionParser.parse("a ⊕ b = { (a-) }")));
  }
}
