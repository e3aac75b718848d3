package opulse;

import static com.google.common.truth.Truth.assertThat;

import java.util.Random;

import org.junit.jupiter.api.Test;

public class PriorityAssignerTest {

  @Test
  public void assignsMissingPrecedence() throws SynthesisException {
    OperatorRegistry registry = new OperatorRegistry();
    SeedOperators.install(registry);
    OperatorRecord binary =
        registry.add(OperatorData.builder().setSymbol("@").setFixity(Fixity.INFIX).build());
    OperatorRecord prefix =
        registry.add(OperatorData.builder().setSymbol("~").setFixity(Fixity.PREFIX).build());
    OperatorRecord postfix =
        registry.add(OperatorData.builder().setSymbol("!").setFixity(Fixity.POSTFIX).build());
    OperatorRecord base =
        registry.add(
            OperatorData.builder().setSymbol("$").setFixity(Fixity.PREFIX).setBaseTag(2).build());

    int assigned = new PriorityAssigner(new Random(7)).assignPriorities(registry);

    assertThat(assigned).isEqualTo(3);
    int level = binary.precedence().get();
    assertThat(level).isAtLeast(1);
    assertThat(level).isAtMost(3);
    assertThat(binary.associativity().isPresent()).isTrue();

    int unaryLevel = Math.max(2, level) + 1;
    assertThat(prefix.precedence().get()).isEqualTo(unaryLevel);
    assertThat(prefix.associativity().get()).isEqualTo(Associativity.RIGHT);
    assertThat(postfix.precedence().get()).isEqualTo(unaryLevel);

    assertThat(base.precedence().isPresent()).isFalse();
    assertThat(registry.get(4).precedence().get()).isEqualTo(2);
  }

  @Test
  public void nothingToAssign() throws SynthesisException {
    OperatorRegistry registry = new OperatorRegistry();
    SeedOperators.install(registry);

    assertThat(new PriorityAssigner(new Random()).assignPriorities(registry)).isEqualTo(0);
  }
}
