package opulse;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

public class OperatorRegistryTest {

  private OperatorRegistry registry;

  @BeforeEach
  public void setUp() throws SynthesisException {
    registry = new OperatorRegistry();
    SeedOperators.install(registry);
  }

  private OperatorRecord define(
      String symbol, Fixity fixity, DefinitionKind kind, String compute, String cost)
      throws SynthesisException {
    OperatorRecord record =
        registry.add(
            OperatorData.builder().setSymbol(symbol).setFixity(fixity).setKind(kind).build());
    registry.setProcedures(
        record.id(), registry.parseProcedure(compute), registry.parseProcedure(cost));
    registry.extractDependencies(record.id());
    registry.calculateOrder(record.id());
    return record;
  }

  @Test
  public void seeds() {
    assertThat(registry.size()).isEqualTo(6);
    assertThat(registry.find("-", Fixity.PREFIX).get().id()).isEqualTo(3);
    assertThat(registry.find("-", Fixity.INFIX).get().id()).isEqualTo(2);
    assertThat(registry.find("-", Fixity.POSTFIX).isPresent()).isFalse();
    assertThat(registry.nextId()).isEqualTo(7);
  }

  @Test
  public void seedsNeedEmptyRegistry() {
    assertThrows(IllegalStateException.class, () -> SeedOperators.install(registry));
  }

  @Test
  public void duplicateId() {
    assertThrows(
        DuplicateOperatorException.class,
        () ->
            registry.add(
                OperatorData.builder().setId(1).setSymbol("@").setFixity(Fixity.INFIX).build()));
  }

  @Test
  public void unknownId() {
    assertThrows(OperatorNotFoundException.class, () -> registry.get(42));
    assertThat(registry.find(42).isPresent()).isFalse();
  }

  @Test
  public void orderOfNonRecursiveOperatorIsMaxOfDependencies() {
    registry.calculateOrder(4);

    assertThat(registry.dependencyIds(registry.get(4))).containsExactly(1);
    assertThat(registry.get(4).order().get()).isEqualTo(1);
  }

  @Test
  public void recursiveOperatorAddsAnOrder() throws SynthesisException {
    OperatorRecord loop =
        define(
            "@",
            Fixity.INFIX,
            DefinitionKind.RECURSIVE,
            "(proc (a b) (repeat (abs b) a (op 4 result a)))",
            "(proc (a b) (repeat-cost (abs b) a (op 4 result a) (cost 4 result a)))");
    OperatorRecord outer =
        define(
            "#",
            Fixity.PREFIX,
            DefinitionKind.SIMPLE,
            "(proc (a) (op " + loop.id() + " a 2))",
            "(proc (a) (cost " + loop.id() + " a 2))");

    assertThat(registry.dependencyIds(loop)).containsExactly(4);
    assertThat(loop.order().get()).isEqualTo(2);
    assertThat(outer.order().get()).isEqualTo(2);
  }

  @Test
  public void selfCallIsNotADependency() throws SynthesisException {
    OperatorRecord record =
        registry.add(
            OperatorData.builder()
                .setSymbol("~")
                .setFixity(Fixity.PREFIX)
                .setKind(DefinitionKind.BRANCH)
                .build());
    String self = "(op " + record.id() + " (- a 1))";
    registry.setProcedures(
        record.id(),
        registry.parseProcedure("(proc (a) (if (<= a 0) 0 (op 1 a " + self + ")))"),
        registry.parseProcedure("(proc (a) 1)"));

    assertThat(registry.extractDependencies(record.id())).containsExactly(1);
  }

  @Test
  public void deleteCascadeRenumbers() throws SynthesisException {
    define(
        "~",
        Fixity.PREFIX,
        DefinitionKind.SIMPLE,
        "(proc (a) (op 2 a a))",
        "(proc (a) (cost 2 a a))");
    OperatorRecord square =
        define(
            "!",
            Fixity.POSTFIX,
            DefinitionKind.SIMPLE,
            "(proc (a) (op 4 a a))",
            "(proc (a) (cost 4 a a))");

    // 5 and 6 declare 2; 7 calls it.
    assertThat(registry.deleteCascade(2)).containsExactly(2, 5, 6, 7).inOrder();

    assertThat(registry.size()).isEqualTo(4);
    assertThat(registry.operators().stream().map(OperatorRecord::id).toArray())
        .asList()
        .containsExactly(1, 2, 3, 4)
        .inOrder();
    assertThat(registry.get(3).symbol()).isEqualTo("*");
    assertThat(square.id()).isEqualTo(4);
    assertThat(registry.procedureSource(4, Slot.COMPUTE).get()).isEqualTo("(proc (a) (op 3 a a))");
    assertThat(registry.dependencyIds(registry.get(3))).containsExactly(1);
    assertThat(registry.compile(4, Slot.COMPUTE).get().invoke(-5)).isEqualTo(Value.of(25));
  }

  private void assertOrdersFollowDependencies() {
    for (OperatorRecord record : registry.operators()) {
      int expected = 1;
      ImmutableSet<Integer> deps = registry.dependencyIds(record);
      if (!deps.isEmpty()) {
        int max = 0;
        for (int dep : deps) {
          max = Math.max(max, registry.get(dep).order().get());
        }
        expected = record.kind() == DefinitionKind.RECURSIVE ? max + 1 : max;
      }
      assertThat(record.order().get()).isAtLeast(1);
      assertThat(record.order().get()).isEqualTo(expected);
    }
  }

  @Test
  public void randomDependencyGraphsFollowOrderRule() throws SynthesisException {
    for (int seed = 0; seed < 20; seed++) {
      setUp();
      Random random = new Random(seed);
      List<Integer> binary = new ArrayList<>(ImmutableSet.of(1, 2, 4, 5, 6));
      for (int i = 0; i < 15; i++) {
        String body = "(+ a b)";
        int calls = random.nextInt(4);
        for (int c = 0; c < calls; c++) {
          int dep = binary.get(random.nextInt(binary.size()));
          body = "(op " + dep + " " + body + " b)";
        }
        DefinitionKind kind =
            random.nextInt(3) == 0 ? DefinitionKind.RECURSIVE : DefinitionKind.SIMPLE;
        OperatorRecord record =
            define("@" + i, Fixity.INFIX, kind, "(proc (a b) " + body + ")", "(proc (a b) 1)");
        binary.add(record.id());
      }
      for (OperatorRecord record : registry.operators()) {
        registry.calculateOrder(record.id());
      }
      assertOrdersFollowDependencies();

      int victim = 1 + random.nextInt(registry.size());
      assertThat(registry.deleteCascade(victim)).contains(victim);
      assertOrdersFollowDependencies();
      for (OperatorRecord record : registry.operators()) {
        int before = record.order().get();
        registry.calculateOrder(record.id());
        assertThat(record.order().get()).isEqualTo(before);
      }
    }
  }

  @Test
  public void compiledNamesFollowRenumbering() throws SynthesisException {
    OperatorRecord square =
        define(
            "!",
            Fixity.POSTFIX,
            DefinitionKind.SIMPLE,
            "(proc (a) (op 4 a a))",
            "(proc (a) (cost 4 a a))");
    assertThat(registry.compile(square.id(), Slot.COMPUTE).get().name()).isEqualTo("op_7");

    registry.deleteCascade(6);

    assertThat(square.id()).isEqualTo(6);
    assertThat(registry.compile(6, Slot.COMPUTE).get().name()).isEqualTo("op_6");
    assertThat(registry.compile(6, Slot.COMPUTE).get().invoke(-5)).isEqualTo(Value.of(25));
  }

  @Test
  public void deleteLeafKeepsEverythingElse() {
    assertThat(registry.deleteCascade(6)).containsExactly(6);
    assertThat(registry.size()).isEqualTo(5);
  }

  @Test
  public void byFixednessSkipsBaseOperators() {
    registry.add(
        OperatorData.builder()
            .setSymbol("$")
            .setFixity(Fixity.PREFIX)
            .setBaseTag(2)
            .build());

    OperatorPartitions partitions = registry.operatorsByFixedness();

    assertThat(partitions.prefix()).containsExactly(registry.get(3));
    assertThat(partitions.postfix()).isEmpty();
    assertThat(partitions.binary()).hasSize(5);
    assertThat(registry.baseOperator(2).symbol()).isEqualTo("$");
    assertThrows(OperatorNotFoundException.class, () -> registry.baseOperator(3));
  }

  @Test
  public void unknownDependencyIsDropped() {
    OperatorRecord record =
        registry.add(
            OperatorData.builder()
                .setSymbol("@")
                .setFixity(Fixity.INFIX)
                .setDependencies(ImmutableSet.of(1, 99))
                .build());

    assertThat(registry.dependencyIds(record)).containsExactly(1);
  }

  @Test
  public void compileWithoutProceduresIsEmpty() {
    OperatorRecord record =
        registry.add(OperatorData.builder().setSymbol("@").setFixity(Fixity.INFIX).build());

    assertThat(registry.compile(record.id(), Slot.COMPUTE).isPresent()).isFalse();
  }
}
