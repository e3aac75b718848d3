package opulse;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;

/** Callable form of a {@link Procedure}: a tree of closures evaluated by walking it. */
public final class CompiledProcedure {

  interface Evaluable {
    Value evaluate(Frame frame);
  }

  static final class Frame {
    final Value[] args;
    final Budget budget;
    final int depth;
    Value accumulator = Value.nan();

    Frame(Value[] args, Budget budget, int depth) {
      this.args = args;
      this.budget = budget;
      this.depth = depth;
    }
  }

  static final class Budget {
    private final ExecutionLimits limits;
    private long steps = 0;

    Budget(ExecutionLimits limits) {
      this.limits = limits;
    }

    void tick() {
      if (++steps > limits.stepLimit()) {
        throw new BudgetExhaustedException();
      }
    }

    void checkDepth(int depth) {
      if (depth > limits.callDepthLimit()) {
        throw new BudgetExhaustedException();
      }
    }
  }

  private static final class BudgetExhaustedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    BudgetExhaustedException() {
      super(null, null, false, false);
    }
  }

  private final String name;
  private final int arity;
  private final ExecutionLimits limits;
  private Evaluable body;

  CompiledProcedure(String name, int arity, ExecutionLimits limits) {
    this.name = name;
    this.arity = arity;
    this.limits = limits;
  }

  void bind(Evaluable body) {
    Preconditions.checkState(this.body == null, "%s already bound", name);
    this.body = body;
  }

  public String name() {
    return name;
  }

  public int arity() {
    return arity;
  }

  public Value invoke(Value... args) {
    try {
      return call(args, new Budget(limits), 0);
    } catch (BudgetExhaustedException e) {
      return Value.nan();
    }
  }

  public Value invoke(long... args) {
    Value[] values = new Value[args.length];
    for (int i = 0; i < args.length; i++) {
      values[i] = Value.of(args[i]);
    }
    return invoke(values);
  }

  Value call(Value[] args, Budget budget, int depth) {
    Preconditions.checkArgument(
        args.length == arity, "%s expects %s arguments, got %s", name, arity, args.length);
    Verify.verifyNotNull(body, "%s invoked before it was bound", name);
    for (Value arg : args) {
      if (arg.isNan()) {
        return Value.nan();
      }
    }
    budget.checkDepth(depth);
    budget.tick();
    return body.evaluate(new Frame(args, budget, depth));
  }

  @Override
  public String toString() {
    return name + "/" + arity;
  }
}
