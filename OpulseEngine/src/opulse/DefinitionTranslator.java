package opulse;

import java.util.ArrayList;
import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import opulse.Definition.Branch;
import opulse.Definition.Condition;
import opulse.Definition.Term;
import opulse.Instruction.Primitive;

/**
 * Lowers a parsed {@link Definition} to the compute and cost procedures of an operator. Symbols
 * resolve against the registry by (symbol, fixity); the operator's own symbol resolves to itself.
 */
public final class DefinitionTranslator {

  @AutoValue
  public abstract static class Procedures {
    public abstract Procedure compute();

    public abstract Procedure cost();

    static Procedures create(Procedure compute, Procedure cost) {
      return new AutoValue_DefinitionTranslator_Procedures(compute, cost);
    }
  }

  private final OperatorRegistry registry;

  public DefinitionTranslator(OperatorRegistry registry) {
    this.registry = registry;
  }

  public Procedures translate(OperatorRecord record, Definition definition)
      throws SynthesisException {
    if (!definition.symbol().equals(record.symbol()) || definition.fixity() != record.fixity()) {
      throw failure(
          String.format(
              "definition of %s %s does not match operator %s",
              definition.fixity(), definition.symbol(), record));
    }
    Scope scope = new Scope(record, definition.operands());

    ImmutableList<Branch> branches = definition.branches();
    Branch last = branches.get(branches.size() - 1);
    Instruction compute = scope.compute(last.expression());
    Instruction cost = scope.cost(last.expression());
    for (int i = branches.size() - 2; i >= 0; i--) {
      Branch branch = branches.get(i);
      Instruction test = scope.condition(branch.condition().get());
      compute = Instruction.conditional(test, scope.compute(branch.expression()), compute);
      cost = Instruction.conditional(test, scope.cost(branch.expression()), cost);
    }
    return Procedures.create(
        new Procedure(definition.operands(), compute), new Procedure(definition.operands(), cost));
  }

  private final class Scope {
    private final OperatorRecord self;
    private final ImmutableList<String> operands;

    Scope(OperatorRecord self, ImmutableList<String> operands) {
      this.self = self;
      this.operands = operands;
    }

    Instruction compute(Term term) throws SynthesisException {
      switch (term.type()) {
        case NUMBER:
          return Instruction.constant(((Definition.Literal) term).value());
        case NAME:
          {
            String name = ((Definition.Name) term).name();
            int index = operands.indexOf(name);
            if (index < 0) {
              throw failure("unknown operand " + name);
            }
            return Instruction.parameter(index, name);
          }
        case UNARY:
          {
            Definition.Unary unary = (Definition.Unary) term;
            OperatorRecord op = resolve(unary.symbol(), unary.fixity());
            return Instruction.call(
                Slot.COMPUTE, op.handle(), ImmutableList.of(compute(unary.operand())));
          }
        case BINARY:
          {
            Definition.Binary binary = (Definition.Binary) term;
            OperatorRecord op = resolve(binary.symbol(), Fixity.INFIX);
            return Instruction.call(
                Slot.COMPUTE,
                op.handle(),
                ImmutableList.of(compute(binary.left()), compute(binary.right())));
          }
      }
      throw new AssertionError(term.type());
    }

    // Cost of every application in the term plus the cost of its operands. Atoms are free.
    Instruction cost(Term term) throws SynthesisException {
      List<Instruction> terms = new ArrayList<>();
      collectCosts(term, terms);
      if (terms.isEmpty()) {
        return Instruction.constant(0);
      }
      Instruction sum = terms.get(0);
      for (Instruction next : terms.subList(1, terms.size())) {
        sum = Instruction.apply(Primitive.ADD, sum, next);
      }
      return sum;
    }

    private void collectCosts(Term term, List<Instruction> out) throws SynthesisException {
      switch (term.type()) {
        case NUMBER:
        case NAME:
          return;
        case UNARY:
          {
            Definition.Unary unary = (Definition.Unary) term;
            OperatorRecord op = resolve(unary.symbol(), unary.fixity());
            out.add(
                Instruction.call(
                    Slot.COST, op.handle(), ImmutableList.of(compute(unary.operand()))));
            collectCosts(unary.operand(), out);
            return;
          }
        case BINARY:
          {
            Definition.Binary binary = (Definition.Binary) term;
            OperatorRecord op = resolve(binary.symbol(), Fixity.INFIX);
            out.add(
                Instruction.call(
                    Slot.COST,
                    op.handle(),
                    ImmutableList.of(compute(binary.left()), compute(binary.right()))));
            collectCosts(binary.left(), out);
            collectCosts(binary.right(), out);
            return;
          }
      }
      throw new AssertionError(term.type());
    }

    Instruction condition(Condition condition) throws SynthesisException {
      if (condition instanceof Definition.Comparison) {
        Definition.Comparison comparison = (Definition.Comparison) condition;
        return Instruction.apply(
            Primitive.forComparison(comparison.comparison()),
            compute(comparison.left()),
            compute(comparison.right()));
      }
      Definition.Connective connective = (Definition.Connective) condition;
      return Instruction.apply(
          connective.isConjunction() ? Primitive.AND : Primitive.OR,
          condition(connective.left()),
          condition(connective.right()));
    }

    private OperatorRecord resolve(String symbol, Fixity fixity) throws SynthesisException {
      if (symbol.equals(self.symbol()) && fixity == self.fixity()) {
        return self;
      }
      return registry
          .find(symbol, fixity)
          .orElseThrow(() -> failure(String.format("no %s operator %s", fixity, symbol)));
    }
  }

  private static SynthesisException failure(String msg) {
    return new SynthesisException(SynthesisException.Reason.COMPILE_FAILURE, msg);
  }
}
