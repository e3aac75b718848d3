package opulse;

import java.util.LinkedHashSet;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** A parameterized instruction tree; the unit compiled into a {@link CompiledProcedure}. */
public final class Procedure {
  private final ImmutableList<String> params;
  private final Instruction body;

  public Procedure(ImmutableList<String> params, Instruction body) {
    Preconditions.checkArgument(
        params.size() == 1 || params.size() == 2, "Procedures take 1 or 2 params: %s", params);
    Preconditions.checkArgument(
        ImmutableSet.copyOf(params).size() == params.size(), "Duplicate params: %s", params);
    this.params = params;
    this.body = body;
  }

  public ImmutableList<String> params() {
    return params;
  }

  public int arity() {
    return params.size();
  }

  public Instruction body() {
    return body;
  }

  // Every operator referenced by a call node, in first-occurrence order.
  public ImmutableSet<OperatorHandle> callees() {
    Set<OperatorHandle> out = new LinkedHashSet<>();
    body.collectCallees(out);
    return ImmutableSet.copyOf(out);
  }

  public String toSource(Instruction.IdResolver ids) {
    return String.format("(proc (%s) %s)", Joiner.on(' ').join(params), body.toSource(ids));
  }

  CompiledProcedure.Evaluable compile(Instruction.Linker linker) throws SynthesisException {
    return body.compile(linker);
  }
}
