package opulse;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ProcedureParserTest {

  private OperatorRegistry registry;

  @BeforeEach
  public void setUp() throws SynthesisException {
    registry = new OperatorRegistry(ExecutionLimits.create(10_000, 32));
    SeedOperators.install(registry);
  }

  private CompiledProcedure compute(int id) {
    return registry.compile(id, Slot.COMPUTE).get();
  }

  @Test
  public void sourceRoundTrips() throws SynthesisException {
    String source = "(proc (a b) (if (== b 0) nan (+ (op 4 a b) (cost 1 a b))))";

    Procedure procedure = registry.parseProcedure(source);

    assertThat(procedure.toSource(registry.idResolver())).isEqualTo(source);
    assertThat(procedure.arity()).isEqualTo(2);
  }

  @Test
  public void seedProcedures() {
    assertThat(compute(1).invoke(2, 3)).isEqualTo(Value.of(5));
    assertThat(compute(3).invoke(4)).isEqualTo(Value.of(-4));
    assertThat(compute(5).invoke(-7, 2)).isEqualTo(Value.of(-4));
    assertThat(compute(6).invoke(-7, 2)).isEqualTo(Value.of(1));
    assertThat(registry.compile(4, Slot.COST).get().invoke(-3, 8)).isEqualTo(Value.of(3));
  }

  @Test
  public void divisionByZeroIsNan() {
    assertThat(compute(5).invoke(7, 0).isNan()).isTrue();
    assertThat(registry.compile(5, Slot.COST).get().invoke(7, 0).isNan()).isTrue();
  }

  @Test
  public void nanArgumentShortCircuits() {
    assertThat(compute(1).invoke(Value.nan(), Value.of(1)).isNan()).isTrue();
  }

  @Test
  public void overflowIsNan() {
    assertThat(compute(4).invoke(Long.MAX_VALUE, 2).isNan()).isTrue();
  }

  @Test
  public void repeatFeedsAccumulator() throws SynthesisException {
    // 2 doubled three times.
    Procedure procedure =
        registry.parseProcedure("(proc (a b) (repeat (abs b) a (op 1 result result)))");
    OperatorRecord record =
        registry.add(
            OperatorData.builder()
                .setSymbol("@")
                .setFixity(Fixity.INFIX)
                .setKind(DefinitionKind.RECURSIVE)
                .build());
    registry.setProcedures(
        record.id(),
        procedure,
        registry.parseProcedure(
            "(proc (a b) (repeat-cost (abs b) a (op 1 result result) (cost 1 result result)))"));

    assertThat(compute(record.id()).invoke(2, -3)).isEqualTo(Value.of(16));
    assertThat(registry.compile(record.id(), Slot.COST).get().invoke(2, 3))
        .isEqualTo(Value.of(3));
  }

  @Test
  public void runawayRecursionIsNan() throws SynthesisException {
    OperatorRecord record =
        registry.add(OperatorData.builder().setSymbol("~").setFixity(Fixity.PREFIX).build());
    int id = record.id();
    registry.setProcedures(
        id,
        registry.parseProcedure("(proc (a) (op " + id + " a))"),
        registry.parseProcedure("(proc (a) 1)"));

    assertThat(compute(id).invoke(1).isNan()).isTrue();
  }

  @Test
  public void unknownOperator() {
    SynthesisException e =
        assertThrows(
            SynthesisException.class, () -> registry.parseProcedure("(proc (a) (op 99 a))"));
    assertThat(e.reason()).isEqualTo(SynthesisException.Reason.COMPILE_FAILURE);
  }

  @Test
  public void malformedSource() {
    assertThrows(SynthesisException.class, () -> registry.parseProcedure("(proc (a b c) a)"));
    assertThrows(SynthesisException.class, () -> registry.parseProcedure("(proc (a a) a)"));
    assertThrows(SynthesisException.class, () -> registry.parseProcedure("(proc (a) (+ a"));
    assertThrows(SynthesisException.class, () -> registry.parseProcedure("(proc (a) c)"));
    assertThrows(
        SynthesisException.class,
        () -> registry.parseProcedure("(proc (a) 99999999999999999999)"));
  }
}
