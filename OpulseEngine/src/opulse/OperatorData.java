package opulse;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

// Everything needed to register a new operator.
@AutoValue
public abstract class OperatorData {
  public abstract Optional<Integer> id();

  public abstract String symbol();

  public abstract Fixity fixity();

  public abstract Optional<Integer> baseTag();

  public abstract Optional<String> definition();

  public abstract DefinitionKind kind();

  public abstract Optional<Integer> precedence();

  public abstract Optional<Associativity> associativity();

  public abstract Optional<Integer> order();

  // Declared dependency ids; replaced by extraction once a compute procedure exists.
  public abstract ImmutableSet<Integer> dependencies();

  public abstract Optional<Procedure> compute();

  public abstract Optional<Procedure> cost();

  public abstract boolean temporary();

  public abstract int recursionUsage();

  public abstract boolean recursionEnabled();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_OperatorData.Builder()
        .setKind(DefinitionKind.PRIMITIVE)
        .setDependencies(ImmutableSet.of())
        .setTemporary(false)
        .setRecursionUsage(0)
        .setRecursionEnabled(true);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setId(Integer id);

    public abstract Builder setId(Optional<Integer> id);

    public abstract Builder setSymbol(String symbol);

    public abstract Builder setFixity(Fixity fixity);

    public abstract Builder setBaseTag(Integer baseTag);

    public abstract Builder setBaseTag(Optional<Integer> baseTag);

    public abstract Builder setDefinition(String definition);

    public abstract Builder setDefinition(Optional<String> definition);

    public abstract Builder setKind(DefinitionKind kind);

    public abstract Builder setPrecedence(Integer precedence);

    public abstract Builder setPrecedence(Optional<Integer> precedence);

    public abstract Builder setAssociativity(Associativity associativity);

    public abstract Builder setAssociativity(Optional<Associativity> associativity);

    public abstract Builder setOrder(Integer order);

    public abstract Builder setOrder(Optional<Integer> order);

    public abstract Builder setDependencies(ImmutableSet<Integer> dependencies);

    public abstract Builder setCompute(Procedure compute);

    public abstract Builder setCost(Procedure cost);

    public abstract Builder setTemporary(boolean temporary);

    public abstract Builder setRecursionUsage(int recursionUsage);

    public abstract Builder setRecursionEnabled(boolean recursionEnabled);

    public abstract OperatorData build();
  }
}
