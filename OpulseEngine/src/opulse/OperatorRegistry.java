package opulse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.BiMap;
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.HashBiMap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Table;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.Graphs;
import com.google.common.graph.MutableGraph;

/**
 * Owns every {@link OperatorRecord}. Records live in an arena keyed by stable handles; external
 * ids map onto handles, so renumbering never touches procedure bodies.
 */
public final class OperatorRegistry {
  private static final Logger logger = LoggerFactory.getLogger(OperatorRegistry.class);

  private final ExecutionLimits limits;
  private long nextKey = 1;

  private final Map<OperatorHandle, OperatorRecord> arena = new LinkedHashMap<>();
  private final BiMap<Integer, OperatorHandle> ids = HashBiMap.create();
  private final ListMultimap<String, OperatorHandle> bySymbol = LinkedListMultimap.create();
  private final ListMultimap<Integer, OperatorHandle> byBase = LinkedListMultimap.create();

  public OperatorRegistry() {
    this(ExecutionLimits.defaults());
  }

  public OperatorRegistry(ExecutionLimits limits) {
    this.limits = limits;
  }

  public ExecutionLimits limits() {
    return limits;
  }

  public int size() {
    return arena.size();
  }

  public boolean isEmpty() {
    return arena.isEmpty();
  }

  public int nextId() {
    return ids.keySet().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
  }

  public OperatorRecord add(OperatorData data) {
    int id = data.id().orElseGet(this::nextId);
    Preconditions.checkArgument(id >= 1, "ids are positive: %s", id);
    if (ids.containsKey(id)) {
      throw new DuplicateOperatorException(id);
    }

    OperatorHandle handle = OperatorHandle.create(nextKey++);
    OperatorRecord record = new OperatorRecord(handle, id, data);
    arena.put(handle, record);
    ids.put(id, handle);
    bySymbol.put(record.symbol(), handle);
    record.baseTag().ifPresent(base -> byBase.put(base, handle));

    declareDependencies(id, data.dependencies());
    data.compute().ifPresent(p -> setProcedure(record, Slot.COMPUTE, p));
    data.cost().ifPresent(p -> setProcedure(record, Slot.COST, p));
    logger.debug("Added {}", record);
    return record;
  }

  public void remove(int id) {
    OperatorRecord record = get(id);
    detach(record);
    logger.debug("Removed {}", record);
  }

  private void detach(OperatorRecord record) {
    OperatorHandle handle = record.handle();
    arena.remove(handle);
    ids.inverse().remove(handle);
    bySymbol.remove(record.symbol(), handle);
    record.baseTag().ifPresent(base -> byBase.remove(base, handle));
    record.clearCompiled();
  }

  /**
   * Deletes {@code id} and every operator that transitively depends on it, then renumbers the
   * survivors to 1..N in their previous order. Returns the deleted ids (pre-renumbering).
   */
  public ImmutableSortedSet<Integer> deleteCascade(int id) {
    OperatorRecord target = get(id);

    MutableGraph<OperatorHandle> dependsOn = GraphBuilder.directed().allowsSelfLoops(true).build();
    for (OperatorRecord record : arena.values()) {
      dependsOn.addNode(record.handle());
      for (OperatorHandle dep : references(record)) {
        if (arena.containsKey(dep)) {
          dependsOn.putEdge(record.handle(), dep);
        }
      }
    }
    Set<OperatorHandle> doomed =
        Graphs.reachableNodes(Graphs.transpose(dependsOn), target.handle());

    ImmutableSortedSet.Builder<Integer> removed = ImmutableSortedSet.naturalOrder();
    for (OperatorHandle handle : doomed) {
      OperatorRecord record = arena.get(handle);
      removed.add(record.id());
      detach(record);
    }
    ImmutableSortedSet<Integer> result = removed.build();
    logger.info("Deleted operators {} (cascade from {})", result, id);
    renumber();
    return result;
  }

  // Operators whose procedures this record can reach directly: declared dependencies plus every
  // call target in either slot.
  private Set<OperatorHandle> references(OperatorRecord record) {
    Set<OperatorHandle> refs = new HashSet<>(record.dependencies());
    for (Slot slot : Slot.values()) {
      record.procedure(slot).ifPresent(p -> refs.addAll(p.callees()));
    }
    return refs;
  }

  private void renumber() {
    List<OperatorRecord> survivors = new ArrayList<>(arena.values());
    survivors.sort(Comparator.comparingInt(OperatorRecord::id));
    ids.clear();
    boolean shifted = false;
    int next = 1;
    for (OperatorRecord record : survivors) {
      if (record.id() != next) {
        logger.debug("Renumbered operator {} -> {}", record.id(), next);
        shifted = true;
      }
      record.setId(next);
      ids.put(next, record.handle());
      next++;
    }
    // Compiled procedures are named after the id they were linked under.
    if (shifted) {
      survivors.forEach(OperatorRecord::clearCompiled);
    }
  }

  public ImmutableSet<Integer> extractDependencies(int id) {
    OperatorRecord record = get(id);
    ImmutableSet<OperatorHandle> deps =
        record.procedure(Slot.COMPUTE).map(Procedure::callees).orElse(ImmutableSet.of()).stream()
            .filter(h -> !h.equals(record.handle()))
            .collect(ImmutableSet.toImmutableSet());
    record.setDependencies(deps);
    return dependencyIds(record);
  }

  public void declareDependencies(int id, Iterable<Integer> dependencyIds) {
    OperatorRecord record = get(id);
    ImmutableSet.Builder<OperatorHandle> declared = ImmutableSet.builder();
    for (int dep : dependencyIds) {
      Optional<OperatorHandle> depHandle = Optional.ofNullable(ids.get(dep));
      if (depHandle.isPresent() && !depHandle.get().equals(record.handle())) {
        declared.add(depHandle.get());
      } else {
        logger.warn("Operator {} declares unknown or self dependency {}; dropped", id, dep);
      }
    }
    record.setDependencies(declared.build());
  }

  public ImmutableSet<Integer> dependencyIds(OperatorRecord record) {
    return record.dependencies().stream()
        .filter(arena::containsKey)
        .map(h -> arena.get(h).id())
        .collect(ImmutableSet.toImmutableSet());
  }

  public void calculateOrder(int id) {
    Optional<OperatorRecord> record = find(id);
    if (!record.isPresent()) {
      logger.error("Cannot calculate order of unknown operator {}", id);
      return;
    }
    calculateOrder(record.get(), new HashSet<>());
  }

  private int calculateOrder(OperatorRecord record, Set<OperatorHandle> visiting) {
    if (!visiting.add(record.handle())) {
      logger.error("Dependency cycle through {}", record);
      return record.order().orElse(1);
    }
    int order;
    if (record.dependencies().isEmpty()) {
      order = 1;
    } else {
      int max = 0;
      for (OperatorHandle depHandle : record.dependencies()) {
        OperatorRecord dep = arena.get(depHandle);
        if (dep == null) {
          logger.error("{} depends on a deleted operator", record);
          continue;
        }
        int depOrder = dep.order().isPresent() ? dep.order().get() : calculateOrder(dep, visiting);
        max = Math.max(max, depOrder);
      }
      order = record.kind() == DefinitionKind.RECURSIVE ? max + 1 : Math.max(max, 1);
    }
    visiting.remove(record.handle());
    record.setOrder(order);
    return order;
  }

  /**
   * Compiles the procedure in {@code slot}, linking calls to other operators' compiled
   * procedures. Empty if the operator has no such procedure or it fails to link.
   */
  public Optional<CompiledProcedure> compile(int id, Slot slot) {
    OperatorRecord record = get(id);
    Optional<CompiledProcedure> cached = record.compiled(slot);
    if (cached.isPresent()) {
      return cached;
    }
    Table<OperatorHandle, Slot, CompiledProcedure> linked = HashBasedTable.create();
    try {
      CompiledProcedure procedure = link(record.handle(), slot, linked);
      for (Table.Cell<OperatorHandle, Slot, CompiledProcedure> cell : linked.cellSet()) {
        arena.get(cell.getRowKey()).cacheCompiled(cell.getColumnKey(), cell.getValue());
      }
      return Optional.of(procedure);
    } catch (SynthesisException e) {
      logger.warn("Failed to compile {} procedure of operator {}: {}", slot, id, e.getMessage());
      return Optional.empty();
    }
  }

  private CompiledProcedure link(
      OperatorHandle handle, Slot slot, Table<OperatorHandle, Slot, CompiledProcedure> linked)
      throws SynthesisException {
    OperatorRecord record = arena.get(handle);
    if (record == null) {
      throw new SynthesisException(
          SynthesisException.Reason.COMPILE_FAILURE, "call to a deleted operator");
    }
    Optional<CompiledProcedure> cached = record.compiled(slot);
    if (cached.isPresent()) {
      return cached.get();
    } else if (linked.contains(handle, slot)) {
      return linked.get(handle, slot);
    }

    Procedure procedure =
        record
            .procedure(slot)
            .orElseThrow(
                () ->
                    new SynthesisException(
                        SynthesisException.Reason.COMPILE_FAILURE,
                        String.format("operator %d has no %s procedure", record.id(), slot)));
    CompiledProcedure compiled =
        new CompiledProcedure(
            slot.keyword() + "_" + record.id(), procedure.arity(), limits);
    linked.put(handle, slot, compiled);
    compiled.bind(
        procedure.compile(
            (callee, calleeSlot, argCount) -> {
              CompiledProcedure target = link(callee, calleeSlot, linked);
              if (target.arity() != argCount) {
                throw new SynthesisException(
                    SynthesisException.Reason.COMPILE_FAILURE,
                    String.format(
                        "%s takes %d arguments, called with %d",
                        target.name(), target.arity(), argCount));
              }
              return target;
            }));
    return compiled;
  }

  public OperatorPartitions operatorsByFixedness() {
    ImmutableList.Builder<OperatorRecord> prefix = ImmutableList.builder();
    ImmutableList.Builder<OperatorRecord> postfix = ImmutableList.builder();
    ImmutableList.Builder<OperatorRecord> binary = ImmutableList.builder();
    for (OperatorRecord record : operators()) {
      if (record.isBase()) {
        continue;
      }
      switch (record.fixity()) {
        case PREFIX:
          prefix.add(record);
          break;
        case POSTFIX:
          postfix.add(record);
          break;
        case INFIX:
          binary.add(record);
          break;
      }
    }
    return OperatorPartitions.create(prefix.build(), postfix.build(), binary.build());
  }

  public OperatorRecord get(int id) {
    return find(id).orElseThrow(() -> OperatorNotFoundException.forId(id));
  }

  public boolean contains(OperatorHandle handle) {
    return arena.containsKey(handle);
  }

  public Optional<OperatorRecord> find(int id) {
    return Optional.ofNullable(ids.get(id)).map(arena::get);
  }

  public OperatorRecord get(OperatorHandle handle) {
    OperatorRecord record = arena.get(handle);
    if (record == null) {
      throw new OperatorNotFoundException("No operator for handle " + handle.key());
    }
    return record;
  }

  // Sorted by id.
  public ImmutableList<OperatorRecord> operators() {
    return arena.values().stream()
        .sorted(Comparator.comparingInt(OperatorRecord::id))
        .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<OperatorRecord> operatorsBySymbol(String symbol) {
    return bySymbol.get(symbol).stream().map(arena::get).collect(ImmutableList.toImmutableList());
  }

  public Optional<OperatorRecord> find(String symbol, Fixity fixity) {
    return operatorsBySymbol(symbol).stream()
        .filter(r -> r.fixity() == fixity && !r.isBase())
        .findFirst();
  }

  public ImmutableSet<String> symbols() {
    return ImmutableSet.copyOf(bySymbol.keySet());
  }

  public OperatorRecord baseOperator(int base) {
    List<OperatorHandle> handles = byBase.get(base);
    if (handles.isEmpty()) {
      throw new OperatorNotFoundException("No operator for base " + base);
    }
    return arena.get(handles.get(0));
  }

  public ImmutableList<OperatorRecord> operatorsByPrecedence(int level) {
    return operators().stream()
        .filter(r -> r.precedence().equals(Optional.of(level)))
        .collect(ImmutableList.toImmutableList());
  }

  public void setProcedures(int id, Procedure compute, Procedure cost) {
    OperatorRecord record = get(id);
    setProcedure(record, Slot.COMPUTE, compute);
    setProcedure(record, Slot.COST, cost);
  }

  private void setProcedure(OperatorRecord record, Slot slot, Procedure procedure) {
    for (OperatorHandle callee : procedure.callees()) {
      Preconditions.checkArgument(
          arena.containsKey(callee), "%s procedure of %s calls an unknown operator", slot, record);
    }
    record.setProcedure(slot, procedure);
  }

  public Procedure parseProcedure(String source) throws SynthesisException {
    return ProcedureParser.parse(source, handleResolver());
  }

  public Optional<String> procedureSource(int id, Slot slot) {
    return get(id).procedure(slot).map(p -> p.toSource(idResolver()));
  }

  public void assignPrecedence(int id, int level, Associativity associativity) {
    get(id).setPrecedence(level, associativity);
  }

  public void updateTemporaryStatus(int id, boolean temporary) {
    get(id).setTemporary(temporary);
  }

  /** Claims {@code bit} of the operator's recursion-usage mask; false if already taken. */
  public boolean claimRecursionBit(int id, int bit) {
    OperatorRecord record = get(id);
    boolean claimed = record.claimRecursionBit(bit);
    if (claimed && !record.isRecursionEnabled()) {
      logger.info("Recursion saturated for {}", record);
    }
    return claimed;
  }

  public Instruction.IdResolver idResolver() {
    return handle -> get(handle).id();
  }

  public ProcedureParser.HandleResolver handleResolver() {
    return id -> Optional.ofNullable(ids.get(id));
  }
}
