package opulse.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import opulse.ConfigurationException;
import opulse.GeneratorConfig;
import opulse.OperatorRegistry;
import opulse.OperatorStore;
import opulse.SynthesisException;
import picocli.CommandLine;

/** Shared plumbing of the subcommands. Unrecoverable failures exit with status 1. */
abstract class OpulseCommand implements Callable<Integer> {
  private static final Logger logger = LoggerFactory.getLogger(OpulseCommand.class);

  @CommandLine.Spec CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = "--config",
      description = "YAML generation config. Built-in defaults apply to missing keys.")
  Path configPath;

  @Override
  public final Integer call() {
    try {
      GeneratorConfig config =
          configPath == null ? GeneratorConfig.defaults() : GeneratorConfig.load(configPath);
      return run(config);
    } catch (ConfigurationException e) {
      return fail("Configuration error: " + e.getMessage(), e);
    } catch (IOException e) {
      return fail("I/O error: " + e.getMessage(), e);
    } catch (SynthesisException e) {
      return fail("Generation failed: " + e.describe(), e);
    }
  }

  abstract int run(GeneratorConfig config)
      throws IOException, ConfigurationException, SynthesisException;

  OperatorRegistry load(Path path, GeneratorConfig config) throws IOException {
    return OperatorStore.load(path, config.executionLimits());
  }

  PrintWriter out() {
    return spec.commandLine().getOut();
  }

  private int fail(String msg, Exception e) {
    logger.error(msg, e);
    spec.commandLine().getErr().println(msg);
    return 1;
  }
}
