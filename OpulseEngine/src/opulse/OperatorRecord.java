package opulse;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * One operator. Identity (handle, symbol, fixity, base tag, definition) is fixed at creation;
 * everything else is mutated only through {@link OperatorRegistry}.
 */
public final class OperatorRecord {
  private final OperatorHandle handle;
  private final String symbol;
  private final Fixity fixity;
  private final Optional<Integer> baseTag;
  private final Optional<String> definition;
  private final DefinitionKind kind;

  private int id;
  private Optional<Integer> precedence;
  private Optional<Associativity> associativity;
  private Optional<Integer> order;
  private final Map<Slot, Procedure> procedures = new EnumMap<>(Slot.class);
  private final Map<Slot, CompiledProcedure> compiled = new EnumMap<>(Slot.class);
  private ImmutableSet<OperatorHandle> dependencies = ImmutableSet.of();
  private boolean temporary;
  private int recursionUsage;
  private boolean recursionEnabled;

  OperatorRecord(OperatorHandle handle, int id, OperatorData data) {
    this.handle = handle;
    this.id = id;
    this.symbol = data.symbol();
    this.fixity = data.fixity();
    this.baseTag = data.baseTag();
    this.definition = data.definition();
    this.kind = data.baseTag().isPresent() ? DefinitionKind.BASE : data.kind();
    this.precedence = data.precedence();
    this.associativity = data.associativity();
    this.order = data.order();
    this.temporary = data.temporary();
    this.recursionUsage = data.recursionUsage();
    this.recursionEnabled = data.recursionEnabled() && kind != DefinitionKind.BASE;
  }

  public OperatorHandle handle() {
    return handle;
  }

  public int id() {
    return id;
  }

  public String symbol() {
    return symbol;
  }

  public Fixity fixity() {
    return fixity;
  }

  public int arity() {
    return fixity.arity();
  }

  public Optional<Integer> baseTag() {
    return baseTag;
  }

  public boolean isBase() {
    return baseTag.isPresent();
  }

  public Optional<String> definition() {
    return definition;
  }

  public DefinitionKind kind() {
    return kind;
  }

  public Optional<Integer> precedence() {
    return precedence;
  }

  public Optional<Associativity> associativity() {
    return associativity;
  }

  public Optional<Integer> order() {
    return order;
  }

  public Optional<Procedure> procedure(Slot slot) {
    return Optional.ofNullable(procedures.get(slot));
  }

  public ImmutableSet<OperatorHandle> dependencies() {
    return dependencies;
  }

  public boolean isTemporary() {
    return temporary;
  }

  public int recursionUsage() {
    return recursionUsage;
  }

  public boolean isRecursionEnabled() {
    return recursionEnabled;
  }

  void setId(int id) {
    this.id = id;
  }

  void setPrecedence(int level, Associativity associativity) {
    Preconditions.checkArgument(level >= 1, "precedence must be positive: %s", level);
    this.precedence = Optional.of(level);
    this.associativity = Optional.of(associativity);
  }

  void setOrder(int order) {
    this.order = Optional.of(order);
  }

  void setProcedure(Slot slot, Procedure procedure) {
    Preconditions.checkArgument(
        procedure.arity() == arity(),
        "%s procedure of '%s' takes %s params, expected %s",
        slot,
        symbol,
        procedure.arity(),
        arity());
    procedures.put(slot, procedure);
    compiled.clear();
  }

  Optional<CompiledProcedure> compiled(Slot slot) {
    return Optional.ofNullable(compiled.get(slot));
  }

  void cacheCompiled(Slot slot, CompiledProcedure procedure) {
    compiled.put(slot, procedure);
  }

  void clearCompiled() {
    compiled.clear();
  }

  void setDependencies(ImmutableSet<OperatorHandle> dependencies) {
    Preconditions.checkArgument(!dependencies.contains(handle), "self dependency");
    this.dependencies = dependencies;
  }

  void setTemporary(boolean temporary) {
    this.temporary = temporary;
  }

  // Returns false if the bit was already taken. Disables recursion once the mask saturates.
  boolean claimRecursionBit(int bit) {
    Preconditions.checkArgument(bit >= 0 && bit < 8, "bit out of range: %s", bit);
    if (!recursionEnabled || (recursionUsage & (1 << bit)) != 0) {
      return false;
    }
    recursionUsage |= 1 << bit;
    int saturated = RecursionRouting.saturationMask(fixity);
    if ((recursionUsage & saturated) == saturated) {
      recursionEnabled = false;
    }
    return true;
  }

  @Override
  public String toString() {
    return String.format("Operator[%d '%s' %s]", id, symbol, fixity);
  }
}
