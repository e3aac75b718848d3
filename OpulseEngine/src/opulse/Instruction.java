package opulse;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import opulse.CompiledProcedure.Evaluable;

// Instruction tree of a procedure body.
public abstract class Instruction {

  public enum Type {
    CONSTANT,
    PARAMETER,
    ACCUMULATOR,
    PRIMITIVE,
    CONDITIONAL,
    CALL,
    REPEAT;
  }

  public enum Primitive {
    NEG("neg", 1),
    ABS("abs", 1),
    NOT("not", 1),
    ADD("+", 2),
    SUBTRACT("-", 2),
    MULTIPLY("*", 2),
    FLOOR_DIV("//", 2),
    FLOOR_MOD("%", 2),
    MIN("min", 2),
    MAX("max", 2),
    EQ("==", 2),
    NE("!=", 2),
    LT("<", 2),
    LE("<=", 2),
    GT(">", 2),
    GE(">=", 2),
    AND("and", 2),
    OR("or", 2);

    private final String keyword;
    private final int arity;

    Primitive(String keyword, int arity) {
      this.keyword = keyword;
      this.arity = arity;
    }

    public String keyword() {
      return keyword;
    }

    public int arity() {
      return arity;
    }

    public static Optional<Primitive> forKeyword(String keyword) {
      for (Primitive p : values()) {
        if (p.keyword.equals(keyword)) {
          return Optional.of(p);
        }
      }
      return Optional.empty();
    }

    public static Primitive forComparison(Value.Comparison comparison) {
      return forKeyword(comparison.symbol()).get();
    }

    Value apply(Value x) {
      switch (this) {
        case NEG:
          return x.negate();
        case ABS:
          return x.abs();
        case NOT:
          return x.isNan() ? x : Value.of(!x.isTrue());
        default:
          throw new IllegalStateException(keyword + " is not unary");
      }
    }

    Value apply(Value x, Value y) {
      switch (this) {
        case ADD:
          return x.add(y);
        case SUBTRACT:
          return x.subtract(y);
        case MULTIPLY:
          return x.multiply(y);
        case FLOOR_DIV:
          return x.floorDiv(y);
        case FLOOR_MOD:
          return x.floorMod(y);
        case MIN:
          return x.min(y);
        case MAX:
          return x.max(y);
        case EQ:
          return x.compare(y, Value.Comparison.EQ);
        case NE:
          return x.compare(y, Value.Comparison.NE);
        case LT:
          return x.compare(y, Value.Comparison.LT);
        case LE:
          return x.compare(y, Value.Comparison.LE);
        case GT:
          return x.compare(y, Value.Comparison.GT);
        case GE:
          return x.compare(y, Value.Comparison.GE);
        case AND:
          return x.isNan() || y.isNan() ? Value.nan() : Value.of(x.isTrue() && y.isTrue());
        case OR:
          return x.isNan() || y.isNan() ? Value.nan() : Value.of(x.isTrue() || y.isTrue());
        default:
          throw new IllegalStateException(keyword + " is not binary");
      }
    }
  }

  // Resolves callees while compiling.
  interface Linker {
    CompiledProcedure link(OperatorHandle callee, Slot slot, int argCount)
        throws SynthesisException;
  }

  public interface IdResolver {
    int idOf(OperatorHandle handle);
  }

  public abstract Type type();

  abstract void appendSource(StringBuilder out, IdResolver ids);

  abstract void collectCallees(Set<OperatorHandle> out);

  abstract Evaluable compile(Linker linker) throws SynthesisException;

  public final String toSource(IdResolver ids) {
    StringBuilder sb = new StringBuilder();
    appendSource(sb, ids);
    return sb.toString();
  }

  private static Evaluable[] compileAll(List<Instruction> instructions, Linker linker)
      throws SynthesisException {
    Evaluable[] compiled = new Evaluable[instructions.size()];
    for (int i = 0; i < compiled.length; i++) {
      compiled[i] = instructions.get(i).compile(linker);
    }
    return compiled;
  }

  private static void appendList(
      StringBuilder out, String head, List<Instruction> operands, IdResolver ids) {
    out.append('(').append(head);
    for (Instruction operand : operands) {
      out.append(' ');
      operand.appendSource(out, ids);
    }
    out.append(')');
  }

  public static Instruction constant(long value) {
    return new Constant(Value.of(value));
  }

  public static Instruction nan() {
    return new Constant(Value.nan());
  }

  public static Instruction parameter(int index, String name) {
    return new Parameter(index, name);
  }

  public static Instruction accumulator() {
    return Accumulator.INSTANCE;
  }

  public static Instruction apply(Primitive primitive, Instruction... operands) {
    return new Apply(primitive, ImmutableList.copyOf(operands));
  }

  public static Instruction conditional(
      Instruction condition, Instruction ifTrue, Instruction ifFalse) {
    return new Conditional(condition, ifTrue, ifFalse);
  }

  public static Instruction call(Slot slot, OperatorHandle callee, List<Instruction> args) {
    return new Call(slot, callee, ImmutableList.copyOf(args));
  }

  public static Instruction repeat(Instruction count, Instruction initial, Instruction step) {
    return new Repeat(count, initial, step, Optional.empty());
  }

  public static Instruction repeatCost(
      Instruction count, Instruction initial, Instruction step, Instruction cost) {
    return new Repeat(count, initial, step, Optional.of(cost));
  }

  public static final class Constant extends Instruction {
    private final Value value;

    private Constant(Value value) {
      this.value = value;
    }

    public Value value() {
      return value;
    }

    @Override
    public Type type() {
      return Type.CONSTANT;
    }

    @Override
    void appendSource(StringBuilder out, IdResolver ids) {
      out.append(value.isNan() ? "nan" : Long.toString(value.longValue()));
    }

    @Override
    void collectCallees(Set<OperatorHandle> out) {}

    @Override
    Evaluable compile(Linker linker) {
      return frame -> value;
    }
  }

  public static final class Parameter extends Instruction {
    private final int index;
    private final String name;

    private Parameter(int index, String name) {
      Preconditions.checkArgument(index >= 0);
      this.index = index;
      this.name = name;
    }

    public int index() {
      return index;
    }

    @Override
    public Type type() {
      return Type.PARAMETER;
    }

    @Override
    void appendSource(StringBuilder out, IdResolver ids) {
      out.append(name);
    }

    @Override
    void collectCallees(Set<OperatorHandle> out) {}

    @Override
    Evaluable compile(Linker linker) {
      int i = index;
      return frame -> frame.args[i];
    }
  }

  public static final class Accumulator extends Instruction {
    static final String NAME = "result";
    private static final Accumulator INSTANCE = new Accumulator();

    private Accumulator() {}

    @Override
    public Type type() {
      return Type.ACCUMULATOR;
    }

    @Override
    void appendSource(StringBuilder out, IdResolver ids) {
      out.append(NAME);
    }

    @Override
    void collectCallees(Set<OperatorHandle> out) {}

    @Override
    Evaluable compile(Linker linker) {
      return frame -> frame.accumulator;
    }
  }

  public static final class Apply extends Instruction {
    private final Primitive primitive;
    private final ImmutableList<Instruction> operands;

    private Apply(Primitive primitive, ImmutableList<Instruction> operands) {
      Preconditions.checkArgument(
          operands.size() == primitive.arity(),
          "%s takes %s operands",
          primitive.keyword(),
          primitive.arity());
      this.primitive = primitive;
      this.operands = operands;
    }

    public Primitive primitive() {
      return primitive;
    }

    @Override
    public Type type() {
      return Type.PRIMITIVE;
    }

    @Override
    void appendSource(StringBuilder out, IdResolver ids) {
      appendList(out, primitive.keyword(), operands, ids);
    }

    @Override
    void collectCallees(Set<OperatorHandle> out) {
      operands.forEach(o -> o.collectCallees(out));
    }

    @Override
    Evaluable compile(Linker linker) throws SynthesisException {
      Primitive p = primitive;
      Evaluable[] compiled = compileAll(operands, linker);
      if (compiled.length == 1) {
        Evaluable x = compiled[0];
        return frame -> p.apply(x.evaluate(frame));
      }
      Evaluable x = compiled[0];
      Evaluable y = compiled[1];
      return frame -> p.apply(x.evaluate(frame), y.evaluate(frame));
    }
  }

  public static final class Conditional extends Instruction {
    private final Instruction condition;
    private final Instruction ifTrue;
    private final Instruction ifFalse;

    private Conditional(Instruction condition, Instruction ifTrue, Instruction ifFalse) {
      this.condition = condition;
      this.ifTrue = ifTrue;
      this.ifFalse = ifFalse;
    }

    @Override
    public Type type() {
      return Type.CONDITIONAL;
    }

    @Override
    void appendSource(StringBuilder out, IdResolver ids) {
      appendList(out, "if", ImmutableList.of(condition, ifTrue, ifFalse), ids);
    }

    @Override
    void collectCallees(Set<OperatorHandle> out) {
      condition.collectCallees(out);
      ifTrue.collectCallees(out);
      ifFalse.collectCallees(out);
    }

    @Override
    Evaluable compile(Linker linker) throws SynthesisException {
      Evaluable c = condition.compile(linker);
      Evaluable t = ifTrue.compile(linker);
      Evaluable f = ifFalse.compile(linker);
      return frame -> {
        Value test = c.evaluate(frame);
        if (test.isNan()) {
          return test;
        }
        return test.isTrue() ? t.evaluate(frame) : f.evaluate(frame);
      };
    }
  }

  public static final class Call extends Instruction {
    private final Slot slot;
    private final OperatorHandle callee;
    private final ImmutableList<Instruction> args;

    private Call(Slot slot, OperatorHandle callee, ImmutableList<Instruction> args) {
      this.slot = slot;
      this.callee = callee;
      this.args = args;
    }

    public Slot slot() {
      return slot;
    }

    public OperatorHandle callee() {
      return callee;
    }

    @Override
    public Type type() {
      return Type.CALL;
    }

    @Override
    void appendSource(StringBuilder out, IdResolver ids) {
      appendList(out, slot.keyword() + " " + ids.idOf(callee), args, ids);
    }

    @Override
    void collectCallees(Set<OperatorHandle> out) {
      out.add(callee);
      args.forEach(a -> a.collectCallees(out));
    }

    @Override
    Evaluable compile(Linker linker) throws SynthesisException {
      CompiledProcedure target = linker.link(callee, slot, args.size());
      Evaluable[] compiled = compileAll(args, linker);
      return frame -> {
        Value[] values = new Value[compiled.length];
        for (int i = 0; i < values.length; i++) {
          values[i] = compiled[i].evaluate(frame);
        }
        return target.call(values, frame.budget, frame.depth + 1);
      };
    }
  }

  // Sets the accumulator to `initial`, then |count| times to `step`. With a cost expression,
  // evaluates to the sum of the cost expression taken before each step instead.
  public static final class Repeat extends Instruction {
    private final Instruction count;
    private final Instruction initial;
    private final Instruction step;
    private final Optional<Instruction> cost;

    private Repeat(
        Instruction count, Instruction initial, Instruction step, Optional<Instruction> cost) {
      this.count = count;
      this.initial = initial;
      this.step = step;
      this.cost = cost;
    }

    @Override
    public Type type() {
      return Type.REPEAT;
    }

    @Override
    void appendSource(StringBuilder out, IdResolver ids) {
      if (cost.isPresent()) {
        appendList(out, "repeat-cost", ImmutableList.of(count, initial, step, cost.get()), ids);
      } else {
        appendList(out, "repeat", ImmutableList.of(count, initial, step), ids);
      }
    }

    @Override
    void collectCallees(Set<OperatorHandle> out) {
      count.collectCallees(out);
      initial.collectCallees(out);
      step.collectCallees(out);
      cost.ifPresent(c -> c.collectCallees(out));
    }

    @Override
    Evaluable compile(Linker linker) throws SynthesisException {
      Evaluable n = count.compile(linker);
      Evaluable init = initial.compile(linker);
      Evaluable next = step.compile(linker);
      Evaluable sum = cost.isPresent() ? cost.get().compile(linker) : null;
      return frame -> {
        Value times = n.evaluate(frame).abs();
        if (times.isNan()) {
          return times;
        }
        Value saved = frame.accumulator;
        frame.accumulator = init.evaluate(frame);
        Value total = Value.of(0);
        for (long i = 0; i < times.longValue(); i++) {
          frame.budget.tick();
          if (sum != null) {
            total = total.add(sum.evaluate(frame));
          }
          frame.accumulator = next.evaluate(frame);
        }
        Value out = sum != null ? total : frame.accumulator;
        frame.accumulator = saved;
        return out;
      };
    }
  }
}
