package opulse;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import opulse.ExpressionGenerator.AtomPolicy;
import opulse.Instruction.Primitive;

/**
 * Proposes new operators: base operators, operators defined by definition text, and loop
 * operators that wrap an existing callee. Proposals are not validated here.
 */
public final class OperatorGenerator {
  private static final Logger logger = LoggerFactory.getLogger(OperatorGenerator.class);

  private static final ImmutableList<String> BASIC_SYMBOLS =
      ImmutableList.of("+", "-", "*", "/", "%");
  // Mathematical Operators, Supplemental Mathematical Operators, Arrows.
  private static final int[][] UNICODE_RANGES = {
    {0x2200, 0x22FF}, {0x2A00, 0x2AFF}, {0x2190, 0x21FF}
  };

  private final GeneratorConfig config;
  private final OperatorRegistry registry;
  private final ExpressionGenerator expressions;
  private final ConditionGenerator conditions;
  private final Random random;
  private final ImmutableList<String> symbolAlphabet;

  public OperatorGenerator(
      GeneratorConfig config,
      OperatorRegistry registry,
      ExpressionGenerator expressions,
      ConditionGenerator conditions,
      Random random) {
    this.config = config;
    this.registry = registry;
    this.expressions = expressions;
    this.conditions = conditions;
    this.random = random;

    ImmutableList.Builder<String> alphabet = ImmutableList.<String>builder().addAll(BASIC_SYMBOLS);
    for (int[] range : UNICODE_RANGES) {
      for (int codepoint = range[0]; codepoint <= range[1]; codepoint++) {
        alphabet.add(new String(Character.toChars(codepoint)));
      }
    }
    this.symbolAlphabet = alphabet.build();
  }

  /** A symbol no registered operator uses. */
  public String randomSymbol() throws SynthesisException {
    for (int attempt = 0; attempt < config.maxRegenerationAttempts(); attempt++) {
      int length =
          Sampling.between(
              random, config.operatorSymbolMinLength(), config.operatorSymbolMaxLength());
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < length; i++) {
        sb.append(Sampling.uniform(random, symbolAlphabet));
      }
      String symbol = sb.toString();
      if (!registry.symbols().contains(symbol)) {
        return symbol;
      }
      logger.debug("Symbol {} already taken", symbol);
    }
    throw new SynthesisException(
        SynthesisException.Reason.RETRY_EXHAUSTED, "no free operator symbol found");
  }

  public Fixity randomFixity() {
    if (random.nextBoolean()) {
      return Fixity.INFIX;
    }
    return random.nextBoolean() ? Fixity.PREFIX : Fixity.POSTFIX;
  }

  public String lhs(String symbol, Fixity fixity) {
    switch (fixity) {
      case PREFIX:
        return symbol + config.leftOperand();
      case POSTFIX:
        return config.leftOperand() + symbol;
      case INFIX:
        return config.leftOperand() + symbol + config.rightOperand();
    }
    throw new AssertionError(fixity);
  }

  /** Mints a prefix base operator for every base in 2..max_base that has none yet. */
  public ImmutableList<OperatorRecord> generateBaseOperators() throws SynthesisException {
    ImmutableList.Builder<OperatorRecord> minted = ImmutableList.builder();
    for (int base = 2; base <= config.maxBase(); base++) {
      int tag = base;
      if (registry.operators().stream().anyMatch(r -> r.baseTag().equals(Optional.of(tag)))) {
        continue;
      }
      OperatorRecord record =
          registry.add(
              OperatorData.builder()
                  .setSymbol(randomSymbol())
                  .setFixity(Fixity.PREFIX)
                  .setBaseTag(base)
                  .setKind(DefinitionKind.BASE)
                  .build());
      logger.info("Base operator for base {} is '{}'", base, record.symbol());
      minted.add(record);
    }
    return minted.build();
  }

  /**
   * A temporary operator carrying definition text of the given kind, with no procedures yet.
   * {@link DefinitionKind#RECURSIVE} yields the self-referential text form.
   */
  public OperatorData proposeDefinition(DefinitionKind kind) throws SynthesisException {
    String symbol = randomSymbol();
    Fixity fixity = randomFixity();
    ImmutableList<String> variables = config.operands(fixity.arity());
    expressions.setVariables(variables);
    conditions.setVariables(variables);

    String body;
    switch (kind) {
      case SIMPLE:
        body = expressions.createDefinitionExpression(AtomPolicy.VARIABLE_AND_NUMBER);
        break;
      case BRANCH:
        body = branches();
        break;
      case RECURSIVE:
        body = recursiveBranches(symbol, fixity);
        break;
      default:
        throw new IllegalArgumentException("Cannot propose a definition of kind " + kind);
    }
    String definition = lhs(symbol, fixity) + " = { " + body + " }";
    logger.debug("Proposed {}", definition);
    return OperatorData.builder()
        .setSymbol(symbol)
        .setFixity(fixity)
        .setDefinition(definition)
        .setKind(kind)
        .setTemporary(true)
        .build();
  }

  private String branches() {
    int count = Sampling.between(random, 1, config.maxIfBranches());
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < count; i++) {
      sb.append(expressions.createDefinitionExpression(AtomPolicy.VARIABLE_AND_NUMBER))
          .append(", if ")
          .append(conditions.generateCondition())
          .append(" ; ");
    }
    return sb.append(expressions.createDefinitionExpression(AtomPolicy.VARIABLE_AND_NUMBER))
        .append(", else")
        .toString();
  }

  private String recursiveBranches(String symbol, Fixity fixity) throws SynthesisException {
    ImmutableList<String> variables = config.operands(fixity.arity());
    String counter = variables.get(variables.size() - 1);
    String base = expressions.createDefinitionExpression(AtomPolicy.VARIABLE_AND_NUMBER);
    String down = selfReferencing(variables, selfTerm(symbol, fixity, counter + "-1"));
    String up = selfReferencing(variables, selfTerm(symbol, fixity, counter + "+1"));
    expressions.setVariables(variables);
    return String.format(
        "%s, if %s == 0 ; %s, if %s > 0 ; %s, else", base, counter, down, counter, up);
  }

  // The operator applied to its operands with the counting operand replaced by `shifted`.
  private String selfTerm(String symbol, Fixity fixity, String shifted) {
    switch (fixity) {
      case PREFIX:
        return "(" + symbol + "(" + shifted + "))";
      case POSTFIX:
        return "((" + shifted + ")" + symbol + ")";
      case INFIX:
        return "(" + config.leftOperand() + symbol + "(" + shifted + "))";
    }
    throw new AssertionError(fixity);
  }

  // Regenerates until the expression uses `selfTerm` as one of its leaves.
  private String selfReferencing(List<String> variables, String selfTerm)
      throws SynthesisException {
    expressions.setVariables(
        ImmutableList.<String>builder().addAll(variables).add(selfTerm).build());
    for (int attempt = 0; attempt < config.maxRegenerationAttempts(); attempt++) {
      ExpressionNode tree = expressions.createDefinitionTree(AtomPolicy.VARIABLE_AND_NUMBER);
      AtomicBoolean found = new AtomicBoolean();
      tree.forEach(
          node -> {
            if (node.type() == ExpressionNode.Type.VARIABLE
                && ((ExpressionNode.Variable) node).name().equals(selfTerm)) {
              found.set(true);
            }
          });
      if (found.get()) {
        return expressions.renderDefinition(tree);
      }
    }
    throw new SynthesisException(
        SynthesisException.Reason.RETRY_EXHAUSTED,
        String.format(
            "no expression referencing %s after %d attempts",
            selfTerm, config.maxRegenerationAttempts()));
  }

  /**
   * A temporary operator that applies a randomly chosen callee |n| times, n being its last
   * operand. Empty if the chosen routing was already used on that callee.
   *
   * @throws SynthesisException with {@code RECURSION_SATURATED} if no operator can be a callee
   */
  public Optional<OperatorData> proposeRecursiveLoop() throws SynthesisException {
    ImmutableList<OperatorRecord> callees =
        registry.operators().stream()
            .filter(r -> r.isRecursionEnabled() && !r.isBase() && !r.isTemporary())
            .collect(ImmutableList.toImmutableList());
    if (callees.isEmpty()) {
      throw new SynthesisException(
          SynthesisException.Reason.RECURSION_SATURATED, "no operator accepts recursive calls");
    }
    OperatorRecord callee = Sampling.uniform(random, callees);
    String symbol = randomSymbol();
    Fixity fixity = randomFixity();
    RecursionRouting routing =
        Sampling.uniform(random, RecursionRouting.choices(fixity, callee.fixity()));
    if (!registry.claimRecursionBit(callee.id(), routing.bit(fixity, callee.fixity()))) {
      logger.warn("Routing {} from {} into {} already used", routing, fixity, callee);
      return Optional.empty();
    }

    ImmutableList<String> names = config.operands(fixity.arity());
    ImmutableList.Builder<Instruction> params = ImmutableList.builder();
    for (int i = 0; i < names.size(); i++) {
      params.add(Instruction.parameter(i, names.get(i)));
    }
    ImmutableList<Instruction> operands = params.build();
    Instruction count = Instruction.apply(Primitive.ABS, operands.get(operands.size() - 1));
    ImmutableList<Instruction> args = routing.arguments(operands);
    Instruction step = Instruction.call(Slot.COMPUTE, callee.handle(), args);
    Procedure compute = new Procedure(names, Instruction.repeat(count, operands.get(0), step));
    Procedure cost =
        new Procedure(
            names,
            Instruction.repeatCost(
                count,
                operands.get(0),
                step,
                Instruction.call(Slot.COST, callee.handle(), args)));

    String definition = loopDefinition(symbol, fixity, callee, routing);
    logger.debug("Proposed {}", definition);
    return Optional.of(
        OperatorData.builder()
            .setSymbol(symbol)
            .setFixity(fixity)
            .setDefinition(definition)
            .setKind(DefinitionKind.RECURSIVE)
            .setCompute(compute)
            .setCost(cost)
            .setTemporary(true)
            .build());
  }

  // Readable text for a loop operator; the procedures are authoritative.
  private String loopDefinition(
      String symbol, Fixity fixity, OperatorRecord callee, RecursionRouting routing) {
    ImmutableList<String> names = config.operands(fixity.arity());
    String counter = names.get(names.size() - 1);
    String down = loopStep(fixity, callee, routing, selfTerm(symbol, fixity, counter + "-1"));
    String up = loopStep(fixity, callee, routing, selfTerm(symbol, fixity, counter + "+1"));
    return String.format(
        "%s = { %s, if %s == 0 ; %s, if %s > 0 ; %s, else }",
        lhs(symbol, fixity), names.get(0), counter, down, counter, up);
  }

  private String loopStep(
      Fixity fixity, OperatorRecord callee, RecursionRouting routing, String previous) {
    ImmutableList<String> names = config.operands(fixity.arity());
    List<String> args;
    switch (routing) {
      case RESULT:
        args = ImmutableList.of(previous);
        break;
      case RESULT_RESULT:
        args = ImmutableList.of(previous, previous);
        break;
      case RESULT_LEFT:
        args = ImmutableList.of(previous, names.get(0));
        break;
      case RESULT_RIGHT:
        args = ImmutableList.of(previous, names.get(1));
        break;
      case LEFT_RESULT:
        args = ImmutableList.of(names.get(0), previous);
        break;
      case RIGHT_RESULT:
        args = ImmutableList.of(names.get(1), previous);
        break;
      default:
        throw new AssertionError(routing);
    }
    switch (callee.fixity()) {
      case PREFIX:
        return "(" + callee.symbol() + "(" + args.get(0) + "))";
      case POSTFIX:
        return "((" + args.get(0) + ")" + callee.symbol() + ")";
      case INFIX:
        return "((" + Joiner.on(")" + callee.symbol() + "(").join(args) + "))";
    }
    throw new AssertionError(callee.fixity());
  }
}
