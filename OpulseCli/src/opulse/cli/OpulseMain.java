package opulse.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import opulse.ExpressionDataset;
import opulse.ExpressionGenerator;
import opulse.GeneratorConfig;
import opulse.OperatorRegistry;
import opulse.OperatorStore;
import opulse.OperatorSynthesizer;
import opulse.PriorityAssigner;
import opulse.SeedOperators;
import opulse.SynthesisException;
import picocli.CommandLine;

@CommandLine.Command(
    name = "opulse",
    mixinStandardHelpOptions = true,
    description = "Synthesizes custom operators and datasets of expressions over them.",
    subcommands = {
      OpulseMain.Seed.class,
      OpulseMain.GenerateOperators.class,
      OpulseMain.GenerateBase.class,
      OpulseMain.AssignPriorities.class,
      OpulseMain.GenerateExpressions.class,
      OpulseMain.DeleteOperator.class
    })
public class OpulseMain implements Runnable {

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  public static void main(String[] args) {
    System.exit(newCommandLine().execute(args));
  }

  static CommandLine newCommandLine() {
    return new CommandLine(new OpulseMain()).setCaseInsensitiveEnumValuesAllowed(true);
  }

  @Override
  public void run() {
    spec.commandLine().usage(spec.commandLine().getOut());
  }

  @CommandLine.Command(name = "seed", description = "Writes the six seed operators.")
  static class Seed extends OpulseCommand {
    @CommandLine.Option(names = "--output", required = true)
    Path output;

    @Override
    int run(GeneratorConfig config) throws IOException, SynthesisException {
      OperatorRegistry registry = new OperatorRegistry(config.executionLimits());
      SeedOperators.install(registry);
      OperatorStore.save(registry, output);
      out().printf("Wrote %d seed operators to %s%n", registry.size(), output);
      return 0;
    }
  }

  @CommandLine.Command(
      name = "generate-operators",
      description = "Synthesizes operators, assigns priorities and mints base operators.")
  static class GenerateOperators extends OpulseCommand {
    @CommandLine.Option(names = "--input", required = true)
    Path input;

    @CommandLine.Option(names = "--output", required = true)
    Path output;

    @CommandLine.Option(
        names = "--count",
        required = true,
        description = "Operators to add, base operators included.")
    int count;

    @CommandLine.Option(names = "--journal", description = "Appends accepted operators here.")
    Path journal;

    @Override
    int run(GeneratorConfig config) throws IOException, SynthesisException {
      OperatorRegistry registry = load(input, config);
      OperatorSynthesizer synthesizer =
          OperatorSynthesizer.create(config, registry, config.newRandom());
      if (journal != null) {
        synthesizer.setJournal(journal);
      }
      OperatorSynthesizer.Report report = synthesizer.generateBatch(count);
      OperatorStore.save(registry, output);
      out().printf(
          "Generated %d operators and %d base operators; discarded %d candidates%n",
          report.accepted(), report.baseOperators(), report.discarded());
      if (report.exhausted() > 0) {
        out().printf("Gave up on %d operators%n", report.exhausted());
      }
      return 0;
    }
  }

  @CommandLine.Command(
      name = "generate-base",
      description = "Mints a base operator for every base from 2 to max_base that lacks one.")
  static class GenerateBase extends OpulseCommand {
    @CommandLine.Option(names = "--input", required = true)
    Path input;

    @CommandLine.Option(names = "--output", required = true)
    Path output;

    @Override
    int run(GeneratorConfig config) throws IOException, SynthesisException {
      OperatorRegistry registry = load(input, config);
      OperatorSynthesizer synthesizer =
          OperatorSynthesizer.create(config, registry, config.newRandom());
      int minted = synthesizer.generator().generateBaseOperators().size();
      OperatorStore.save(registry, output);
      out().printf("Generated %d base operators%n", minted);
      return 0;
    }
  }

  @CommandLine.Command(
      name = "assign-priorities",
      description = "Gives every operator without one a precedence and associativity.")
  static class AssignPriorities extends OpulseCommand {
    @CommandLine.Option(names = "--input", required = true)
    Path input;

    @CommandLine.Option(names = "--output", required = true)
    Path output;

    @Override
    int run(GeneratorConfig config) throws IOException {
      OperatorRegistry registry = load(input, config);
      int assigned = new PriorityAssigner(config.newRandom()).assignPriorities(registry);
      OperatorStore.save(registry, output);
      out().printf("Assigned priorities to %d operators%n", assigned);
      return 0;
    }
  }

  enum Atoms {
    VARIABLE(ExpressionGenerator.AtomPolicy.VARIABLE),
    NUMBER(ExpressionGenerator.AtomPolicy.NUMBER),
    BOTH(ExpressionGenerator.AtomPolicy.VARIABLE_AND_NUMBER);

    final ExpressionGenerator.AtomPolicy policy;

    Atoms(ExpressionGenerator.AtomPolicy policy) {
      this.policy = policy;
    }
  }

  @CommandLine.Command(
      name = "generate-expressions",
      description = "Generates and evaluates random expressions over the operators.")
  static class GenerateExpressions extends OpulseCommand {
    @CommandLine.Option(names = "--operators", required = true)
    Path operators;

    @CommandLine.Option(names = "--output", required = true)
    Path output;

    @CommandLine.Option(names = "--usage", required = true, description = "Operator usage index.")
    Path usage;

    @CommandLine.Option(names = "--count", required = true)
    int count;

    @CommandLine.Option(
        names = "--atoms",
        defaultValue = "NUMBER",
        description = "Leaf kinds: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}.")
    Atoms atoms;

    @Override
    int run(GeneratorConfig config) throws IOException {
      OperatorRegistry registry = load(operators, config);
      if (registry.isEmpty()) {
        throw new CommandLine.ParameterException(
            spec.commandLine(), "No operators in " + operators);
      }
      if (atoms != Atoms.VARIABLE) {
        for (int base = 2; base <= config.maxBase(); base++) {
          int tag = base;
          if (registry.operators().stream().noneMatch(r -> r.baseTag().equals(Optional.of(tag)))) {
            throw new CommandLine.ParameterException(
                spec.commandLine(),
                "No base operator for base " + base + " in " + operators
                    + "; run generate-base first");
          }
        }
      }
      ExpressionDataset dataset =
          ExpressionDataset.generate(config, registry, config.newRandom(), count, atoms.policy);
      dataset.write(output);
      dataset.usage().write(usage);
      out().printf("Generated %d expressions%n", dataset.expressions().size());
      return 0;
    }
  }

  @CommandLine.Command(
      name = "delete-operator",
      description = "Deletes an operator and everything depending on it, then renumbers.")
  static class DeleteOperator extends OpulseCommand {
    @CommandLine.Option(names = "--input", required = true)
    Path input;

    @CommandLine.Option(names = "--output", required = true)
    Path output;

    @CommandLine.Option(names = "--id", required = true)
    int id;

    @Override
    int run(GeneratorConfig config) throws IOException {
      OperatorRegistry registry = load(input, config);
      if (!registry.find(id).isPresent()) {
        throw new CommandLine.ParameterException(
            spec.commandLine(), "No operator with id " + id + " in " + input);
      }
      String target = registry.get(id).toString();
      int deleted = registry.deleteCascade(id).size();
      OperatorStore.save(registry, output);
      out().printf(
          "Deleted %s and %d dependent operators; %d remain%n",
          target, deleted - 1, registry.size());
      return 0;
    }
  }
}
