package opulse;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class OperatorGeneratorTest {

  private static final String CONFIG =
      String.join(
          "\n",
          "max_base: 4",
          "expr_max_depth: 3",
          "max_if_branches: 3",
          "operator_symbol_min_len: 2",
          "operator_symbol_max_len: 2");

  private OperatorRegistry registry;
  private OperatorGenerator generator;

  @BeforeEach
  public void setUp() throws ConfigurationException, SynthesisException {
    registry = new OperatorRegistry();
    SeedOperators.install(registry);
    generator =
        OperatorSynthesizer.create(GeneratorConfig.parse(CONFIG), registry, new Random(3))
            .generator();
  }

  @Test
  public void randomSymbolIsFresh() throws SynthesisException {
    for (int i = 0; i < 50; i++) {
      String symbol = generator.randomSymbol();
      assertThat(symbol).hasLength(2);
      assertThat(registry.symbols()).doesNotContain(symbol);
    }
  }

  @Test
  public void lhs() {
    assertThat(generator.lhs("⊕", Fixity.INFIX)).isEqualTo("a⊕b");
    assertThat(generator.lhs("⊕", Fixity.PREFIX)).isEqualTo("⊕a");
    assertThat(generator.lhs("⊕", Fixity.POSTFIX)).isEqualTo("a⊕");
  }

  @Test
  public void baseOperatorsAreMintedOnce() throws SynthesisException {
    ImmutableList<OperatorRecord> minted = generator.generateBaseOperators();

    assertThat(minted).hasSize(3);
    for (int base = 2; base <= 4; base++) {
      OperatorRecord record = registry.baseOperator(base);
      assertThat(record.fixity()).isEqualTo(Fixity.PREFIX);
      assertThat(record.kind()).isEqualTo(DefinitionKind.BASE);
      assertThat(record.isRecursionEnabled()).isFalse();
    }
    assertThat(registry.symbols()).hasSize(5 + 3);
    assertThat(generator.generateBaseOperators()).isEmpty();
  }

  @Test
  public void proposalsParse() throws SynthesisException {
    for (DefinitionKind kind :
        ImmutableList.of(DefinitionKind.SIMPLE, DefinitionKind.BRANCH, DefinitionKind.RECURSIVE)) {
      for (int i = 0; i < 20; i++) {
        OperatorData data = generator.proposeDefinition(kind);

        assertThat(data.temporary()).isTrue();
        assertThat(data.kind()).isEqualTo(kind);
        Definition definition = DefinitionParser.parse(data.definition().get());
        assertThat(definition.symbol()).isEqualTo(data.symbol());
        assertThat(definition.fixity()).isEqualTo(data.fixity());
        if (kind == DefinitionKind.RECURSIVE) {
          assertThat(definition.branches()).hasSize(3);
        } else if (kind == DefinitionKind.SIMPLE) {
          assertThat(definition.isBranching()).isFalse();
        }
      }
    }
  }

  @Test
  public void baseIsNotADefinitionKind() {
    assertThrows(
        IllegalArgumentException.class, () -> generator.proposeDefinition(DefinitionKind.BASE));
  }

  @Test
  public void recursiveLoopClaimsARoutingBit() throws SynthesisException {
    Optional<OperatorData> proposal = generator.proposeRecursiveLoop();

    assertThat(proposal.isPresent()).isTrue();
    OperatorData data = proposal.get();
    assertThat(data.kind()).isEqualTo(DefinitionKind.RECURSIVE);
    assertThat(data.compute().isPresent()).isTrue();
    assertThat(data.cost().isPresent()).isTrue();
    Definition definition = DefinitionParser.parse(data.definition().get());
    assertThat(definition.fixity()).isEqualTo(data.fixity());

    int claimed = 0;
    for (OperatorRecord seed : registry.operators()) {
      claimed += Integer.bitCount(seed.recursionUsage());
    }
    assertThat(claimed).isEqualTo(1);
  }

  @Test
  public void saturatedRegistryHasNoCallee() {
    for (OperatorRecord seed : registry.operators()) {
      for (int bit = 0; bit < 8; bit++) {
        registry.claimRecursionBit(seed.id(), bit);
      }
    }

    SynthesisException e =
        assertThrows(SynthesisException.class, () -> generator.proposeRecursiveLoop());
    assertThat(e.reason()).isEqualTo(SynthesisException.Reason.RECURSION_SATURATED);
  }
}
