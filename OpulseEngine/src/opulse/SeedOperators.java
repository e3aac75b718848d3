package opulse;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** The six hand-written arithmetic operators every operator family starts from. */
public final class SeedOperators {
  private SeedOperators() {}

  private static final class Seed {
    final String symbol;
    final Fixity fixity;
    final int precedence;
    final Associativity associativity;
    final ImmutableSet<Integer> dependencies;
    final String compute;
    final String cost;

    Seed(
        String symbol,
        Fixity fixity,
        int precedence,
        Associativity associativity,
        ImmutableSet<Integer> dependencies,
        String compute,
        String cost) {
      this.symbol = symbol;
      this.fixity = fixity;
      this.precedence = precedence;
      this.associativity = associativity;
      this.dependencies = dependencies;
      this.compute = compute;
      this.cost = cost;
    }
  }

  private static final ImmutableList<Seed> SEEDS =
      ImmutableList.of(
          new Seed(
              "+",
              Fixity.INFIX,
              1,
              Associativity.LEFT,
              ImmutableSet.of(),
              "(proc (a b) (+ a b))",
              "(proc (a b) 1)"),
          new Seed(
              "-",
              Fixity.INFIX,
              1,
              Associativity.LEFT,
              ImmutableSet.of(),
              "(proc (a b) (- a b))",
              "(proc (a b) 1)"),
          new Seed(
              "-",
              Fixity.PREFIX,
              3,
              Associativity.RIGHT,
              ImmutableSet.of(),
              "(proc (a) (neg a))",
              "(proc (a) 1)"),
          new Seed(
              "*",
              Fixity.INFIX,
              2,
              Associativity.LEFT,
              ImmutableSet.of(1),
              "(proc (a b) (* a b))",
              "(proc (a b) (min (abs a) (abs b)))"),
          new Seed(
              "/",
              Fixity.INFIX,
              2,
              Associativity.LEFT,
              ImmutableSet.of(2),
              "(proc (a b) (if (== b 0) nan (// a b)))",
              "(proc (a b) (if (== b 0) nan (// (abs a) (abs b))))"),
          new Seed(
              "%",
              Fixity.INFIX,
              2,
              Associativity.LEFT,
              ImmutableSet.of(2),
              "(proc (a b) (if (== b 0) nan (% a b)))",
              "(proc (a b) (if (== b 0) nan (// (abs a) (abs b))))"));

  public static int count() {
    return SEEDS.size();
  }

  /** Registers the seeds as ids 1..6. The registry must be empty. */
  public static void install(OperatorRegistry registry) throws SynthesisException {
    if (!registry.isEmpty()) {
      throw new IllegalStateException("Seed operators go into an empty registry");
    }
    for (int i = 0; i < SEEDS.size(); i++) {
      Seed seed = SEEDS.get(i);
      registry.add(
          OperatorData.builder()
              .setId(i + 1)
              .setSymbol(seed.symbol)
              .setFixity(seed.fixity)
              .setPrecedence(seed.precedence)
              .setAssociativity(seed.associativity)
              .setOrder(1)
              .setDependencies(seed.dependencies)
              .setCompute(registry.parseProcedure(seed.compute))
              .setCost(registry.parseProcedure(seed.cost))
              .build());
    }
  }
}
