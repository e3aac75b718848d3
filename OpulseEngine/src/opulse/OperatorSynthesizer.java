package opulse;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;

import opulse.SynthesisException.Reason;

/**
 * Drives candidates through proposed, compiled, executable and accepted. A candidate that fails
 * any step is removed from the registry and another one is proposed.
 */
public final class OperatorSynthesizer {
  private static final Logger logger = LoggerFactory.getLogger(OperatorSynthesizer.class);

  @AutoValue
  public abstract static class Report {
    public abstract int accepted();

    public abstract int discarded();

    // Requested operators given up on after max_synthesis_attempts.
    public abstract int exhausted();

    public abstract int baseOperators();

    static Report create(int accepted, int discarded, int exhausted, int baseOperators) {
      return new AutoValue_OperatorSynthesizer_Report(
          accepted, discarded, exhausted, baseOperators);
    }
  }

  private final GeneratorConfig config;
  private final OperatorRegistry registry;
  private final OperatorGenerator generator;
  private final DefinitionTranslator translator;
  private final PriorityAssigner priorities;
  private final Random random;

  private Optional<Path> journal = Optional.empty();
  private int discarded = 0;

  public OperatorSynthesizer(
      GeneratorConfig config,
      OperatorRegistry registry,
      OperatorGenerator generator,
      PriorityAssigner priorities,
      Random random) {
    this.config = config;
    this.registry = registry;
    this.generator = generator;
    this.translator = new DefinitionTranslator(registry);
    this.priorities = priorities;
    this.random = random;
  }

  public static OperatorSynthesizer create(
      GeneratorConfig config, OperatorRegistry registry, Random random) {
    BaseConverter converter = new BaseConverter(config.customDigits());
    ExpressionEvaluator evaluator =
        new ExpressionEvaluator(registry, converter, config.nanSymbol());
    ExpressionGenerator expressions = new ExpressionGenerator(config, registry, evaluator, random);
    ConditionGenerator conditions = new ConditionGenerator(config, random);
    OperatorGenerator generator =
        new OperatorGenerator(config, registry, expressions, conditions, random);
    return new OperatorSynthesizer(
        config, registry, generator, new PriorityAssigner(random), random);
  }

  /** Accepted operators are appended to {@code path} as they are accepted. */
  public void setJournal(Path path) {
    this.journal = Optional.of(path);
  }

  public OperatorGenerator generator() {
    return generator;
  }

  public int discarded() {
    return discarded;
  }

  /**
   * Synthesizes one accepted operator of {@code kind}.
   *
   * @throws SynthesisException with {@code RETRY_EXHAUSTED} after max_synthesis_attempts
   *     rejected candidates
   */
  public OperatorRecord synthesize(DefinitionKind kind) throws SynthesisException, IOException {
    for (int attempt = 0; attempt < config.maxSynthesisAttempts(); attempt++) {
      OperatorRecord candidate;
      try {
        candidate = propose(kind);
      } catch (SynthesisException e) {
        discarded++;
        logger.debug("Discarded {} proposal: {}", kind, e.describe());
        continue;
      }
      try {
        validate(candidate);
      } catch (SynthesisException e) {
        discarded++;
        logger.debug("Discarded {}: {}", candidate, e.describe());
        registry.remove(candidate.id());
        continue;
      }
      accept(candidate);
      return candidate;
    }
    throw new SynthesisException(
        Reason.RETRY_EXHAUSTED,
        String.format(
            "no %s operator accepted after %d attempts", kind, config.maxSynthesisAttempts()));
  }

  private OperatorRecord propose(DefinitionKind kind) throws SynthesisException {
    if (kind == DefinitionKind.RECURSIVE
        && random.nextDouble() < config.recursiveLoopProbability()) {
      OperatorData data =
          generator
              .proposeRecursiveLoop()
              .orElseThrow(
                  () ->
                      new SynthesisException(
                          Reason.RECURSION_SATURATED, "recursive routing already used"));
      return registry.add(data);
    }

    OperatorData data = generator.proposeDefinition(kind);
    OperatorRecord record = registry.add(data);
    try {
      Definition definition = DefinitionParser.parse(data.definition().get());
      DefinitionTranslator.Procedures procedures = translator.translate(record, definition);
      registry.setProcedures(record.id(), procedures.compute(), procedures.cost());
    } catch (SynthesisException e) {
      registry.remove(record.id());
      throw e;
    }
    return record;
  }

  /** Round-trips, compiles and executes both procedures of {@code record}. */
  public void validate(OperatorRecord record) throws SynthesisException {
    for (Slot slot : Slot.values()) {
      String source =
          registry
              .procedureSource(record.id(), slot)
              .orElseThrow(
                  () ->
                      new SynthesisException(
                          Reason.COMPILE_FAILURE, String.format("%s has no %s", record, slot)));
      registry.parseProcedure(source);

      CompiledProcedure procedure =
          registry
              .compile(record.id(), slot)
              .orElseThrow(
                  () ->
                      new SynthesisException(
                          Reason.COMPILE_FAILURE,
                          String.format("%s procedure of %s does not compile", slot, record)));

      long[] args = new long[record.arity()];
      for (int sample = 0; sample < config.validationSamples(); sample++) {
        for (int i = 0; i < args.length; i++) {
          args[i] = Sampling.between(random, config.validationMin(), config.validationMax());
        }
        try {
          procedure.invoke(args);
        } catch (RuntimeException e) {
          throw new SynthesisException(
              Reason.EXECUTION_FAILURE,
              String.format("%s failed on %s", procedure.name(), Arrays.toString(args)),
              e);
        }
      }
    }
  }

  private void accept(OperatorRecord record) throws IOException {
    registry.updateTemporaryStatus(record.id(), false);
    registry.extractDependencies(record.id());
    registry.calculateOrder(record.id());
    logger.info("Accepted {}: {}", record, record.definition().orElse(""));
    if (journal.isPresent()) {
      OperatorStore.append(registry, record, journal.get());
    }
  }

  /**
   * Synthesizes {@code total} operators including one base operator per base: the definition
   * operators are split by the configured fractions, the rest drawn from random_definition_kinds.
   * Precedence is assigned before the base operators are minted.
   */
  public Report generateBatch(int total) throws SynthesisException, IOException {
    int startDiscarded = discarded;
    int definitions = Math.max(0, total - (config.maxBase() - 1));
    int simple = (int) (definitions * config.simpleFraction());
    int branch = (int) (definitions * config.branchFraction());
    int recursive = (int) (definitions * config.recursiveFraction());
    int remainder = definitions - simple - branch - recursive;
    logger.info(
        "Generating {} simple, {} branch, {} recursive and {} random definitions",
        simple,
        branch,
        recursive,
        remainder);

    int accepted = 0;
    int exhausted = 0;
    for (int i = 0; i < definitions; i++) {
      DefinitionKind kind;
      if (i < simple) {
        kind = DefinitionKind.SIMPLE;
      } else if (i < simple + branch) {
        kind = DefinitionKind.BRANCH;
      } else if (i < simple + branch + recursive) {
        kind = DefinitionKind.RECURSIVE;
      } else {
        kind = Sampling.uniform(random, config.randomDefinitionKinds());
      }
      try {
        synthesize(kind);
        accepted++;
      } catch (SynthesisException e) {
        exhausted++;
        logger.error("Giving up on a {} operator: {}", kind, e.describe());
      }
    }

    priorities.assignPriorities(registry);
    int bases = generator.generateBaseOperators().size();
    Report report = Report.create(accepted, discarded - startDiscarded, exhausted, bases);
    logger.info("Batch finished: {}", report);
    return report;
  }
}
