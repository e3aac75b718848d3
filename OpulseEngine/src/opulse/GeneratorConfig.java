package opulse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** Generation parameters, bound from YAML. Every key is optional. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GeneratorConfig {
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

  @JsonProperty("max_base")
  private int maxBase = 36;

  @JsonProperty("custom_digits")
  private String customDigits = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

  @JsonProperty("left_operand")
  private String leftOperand = "a";

  @JsonProperty("right_operand")
  private String rightOperand = "b";

  @JsonProperty("nan_symbol")
  private String nanSymbol = "NaN";

  @JsonProperty("operator_symbol_min_len")
  private int operatorSymbolMinLength = 1;

  @JsonProperty("operator_symbol_max_len")
  private int operatorSymbolMaxLength = 3;

  @JsonProperty("comparison_ops")
  private List<String> comparisonOps = ImmutableList.of("==", ">", "<", ">=", "<=", "!=");

  @JsonProperty("logical_connectors")
  private List<String> logicalConnectors = ImmutableList.of("and", "or");

  @JsonProperty("condition_numeric_range")
  private List<Integer> conditionNumericRange = ImmutableList.of(0, 1000);

  @JsonProperty("condition_probabilities")
  private Map<Integer, Double> conditionProbabilities = ImmutableMap.of(1, 0.7, 2, 0.2, 3, 0.1);

  @JsonProperty("max_if_branches")
  private int maxIfBranches = 5;

  @JsonProperty("expr_numeric_range")
  private List<Integer> exprNumericRange = ImmutableList.of(0, 1000);

  @JsonProperty("expr_max_depth")
  private int exprMaxDepth = 5;

  @JsonProperty("expr_type_weights")
  private Map<String, Double> exprTypeWeights =
      ImmutableMap.of("binary", 0.7, "unary_prefix", 0.2, "unary_postfix", 0.0, "atoms", 0.1);

  @JsonProperty("expr_atom_type_weights")
  private Map<String, Double> exprAtomTypeWeights = ImmutableMap.of("variable", 0.8, "number", 0.2);

  @JsonProperty("simple_fraction")
  private double simpleFraction = 0.2;

  @JsonProperty("branch_fraction")
  private double branchFraction = 0.2;

  @JsonProperty("recursive_fraction")
  private double recursiveFraction = 0.0;

  @JsonProperty("random_definition_kinds")
  private List<String> randomDefinitionKinds =
      ImmutableList.of("simple_definition", "branch_definition");

  @JsonProperty("recursive_loop_probability")
  private double recursiveLoopProbability = 0.5;

  @JsonProperty("max_regeneration_attempts")
  private int maxRegenerationAttempts = 1000;

  @JsonProperty("max_synthesis_attempts")
  private int maxSynthesisAttempts = 10000;

  @JsonProperty("validation_samples")
  private int validationSamples = 100;

  @JsonProperty("validation_range")
  private List<Integer> validationRange = ImmutableList.of(-1000, 1000);

  @JsonProperty("procedure_step_limit")
  private long procedureStepLimit = 1_000_000;

  @JsonProperty("procedure_call_depth_limit")
  private int procedureCallDepthLimit = 256;

  @JsonProperty("seed")
  private Long seed;

  public static GeneratorConfig defaults() {
    return new GeneratorConfig();
  }

  public static GeneratorConfig load(Path path) throws ConfigurationException {
    if (!Files.isRegularFile(path)) {
      throw new ConfigurationException("Configuration file not found: " + path);
    }
    try {
      return validate(YAML.readValue(path.toFile(), GeneratorConfig.class), path.toString());
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read configuration " + path, e);
    }
  }

  public static GeneratorConfig parse(String yaml) throws ConfigurationException {
    try {
      GeneratorConfig config = YAML.readValue(yaml, GeneratorConfig.class);
      return validate(config == null ? defaults() : config, "<inline>");
    } catch (IOException e) {
      throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
    }
  }

  private static GeneratorConfig validate(GeneratorConfig config, String source)
      throws ConfigurationException {
    check(config.maxBase >= 2, source, "max_base must be at least 2");
    check(
        config.maxBase <= config.customDigits.length(),
        source,
        "max_base exceeds the number of custom_digits");
    checkRange(config.conditionNumericRange, source, "condition_numeric_range");
    checkRange(config.exprNumericRange, source, "expr_numeric_range");
    checkRange(config.validationRange, source, "validation_range");
    check(
        !config.leftOperand.equals(config.rightOperand),
        source,
        "left_operand and right_operand must differ");
    check(
        config.operatorSymbolMinLength >= 1
            && config.operatorSymbolMinLength <= config.operatorSymbolMaxLength,
        source,
        "invalid operator symbol length bounds");
    check(config.maxIfBranches >= 1, source, "max_if_branches must be at least 1");
    check(config.exprMaxDepth >= 0, source, "expr_max_depth must be non-negative");
    check(!config.comparisonOps.isEmpty(), source, "comparison_ops must not be empty");
    for (String op : config.comparisonOps) {
      check(Value.Comparison.forSymbol(op).isPresent(), source, "unknown comparison " + op);
    }
    check(!config.logicalConnectors.isEmpty(), source, "logical_connectors must not be empty");
    for (String connector : config.logicalConnectors) {
      check(
          connector.equals("and") || connector.equals("or"),
          source,
          "unknown connector " + connector);
    }
    check(!config.conditionProbabilities.isEmpty(), source, "condition_probabilities is empty");
    for (String kind : config.randomDefinitionKinds) {
      try {
        DefinitionKind parsed = DefinitionKind.forTag(kind);
        check(parsed != DefinitionKind.BASE, source, "base is not a random definition kind");
      } catch (IllegalArgumentException e) {
        throw new ConfigurationException(source + ": " + e.getMessage(), e);
      }
    }
    check(
        config.simpleFraction >= 0
            && config.branchFraction >= 0
            && config.recursiveFraction >= 0
            && config.simpleFraction + config.branchFraction + config.recursiveFraction <= 1,
        source,
        "definition fractions must be non-negative and sum to at most 1");
    check(config.maxRegenerationAttempts >= 1, source, "max_regeneration_attempts < 1");
    check(config.maxSynthesisAttempts >= 1, source, "max_synthesis_attempts < 1");
    check(config.validationSamples >= 0, source, "validation_samples < 0");
    check(
        config.procedureStepLimit >= 1 && config.procedureCallDepthLimit >= 1,
        source,
        "procedure limits must be positive");
    return config;
  }

  private static void checkRange(List<Integer> range, String source, String key)
      throws ConfigurationException {
    check(
        range != null && range.size() == 2 && range.get(0) <= range.get(1),
        source,
        key + " must be [min, max]");
  }

  private static void check(boolean condition, String source, String msg)
      throws ConfigurationException {
    if (!condition) {
      throw new ConfigurationException(source + ": " + msg);
    }
  }

  public Random newRandom() {
    return seed == null ? new Random() : new Random(seed);
  }

  public ExecutionLimits executionLimits() {
    return ExecutionLimits.create(procedureStepLimit, procedureCallDepthLimit);
  }

  public ImmutableList<String> operands(int arity) {
    return arity == 1 ? ImmutableList.of(leftOperand) : ImmutableList.of(leftOperand, rightOperand);
  }

  public int maxBase() {
    return maxBase;
  }

  public String customDigits() {
    return customDigits;
  }

  public String leftOperand() {
    return leftOperand;
  }

  public String rightOperand() {
    return rightOperand;
  }

  public String nanSymbol() {
    return nanSymbol;
  }

  public int operatorSymbolMinLength() {
    return operatorSymbolMinLength;
  }

  public int operatorSymbolMaxLength() {
    return operatorSymbolMaxLength;
  }

  public ImmutableList<String> comparisonOps() {
    return ImmutableList.copyOf(comparisonOps);
  }

  public ImmutableList<String> logicalConnectors() {
    return ImmutableList.copyOf(logicalConnectors);
  }

  public int conditionMin() {
    return conditionNumericRange.get(0);
  }

  public int conditionMax() {
    return conditionNumericRange.get(1);
  }

  public ImmutableMap<Integer, Double> conditionProbabilities() {
    return ImmutableMap.copyOf(conditionProbabilities);
  }

  public int maxIfBranches() {
    return maxIfBranches;
  }

  public int exprMin() {
    return exprNumericRange.get(0);
  }

  public int exprMax() {
    return exprNumericRange.get(1);
  }

  public int exprMaxDepth() {
    return exprMaxDepth;
  }

  public double exprTypeWeight(String type) {
    return exprTypeWeights.getOrDefault(type, 0.0);
  }

  public double atomTypeWeight(String type) {
    return exprAtomTypeWeights.getOrDefault(type, 0.0);
  }

  public double simpleFraction() {
    return simpleFraction;
  }

  public double branchFraction() {
    return branchFraction;
  }

  public double recursiveFraction() {
    return recursiveFraction;
  }

  public ImmutableList<DefinitionKind> randomDefinitionKinds() {
    return randomDefinitionKinds.stream()
        .map(DefinitionKind::forTag)
        .collect(ImmutableList.toImmutableList());
  }

  public double recursiveLoopProbability() {
    return recursiveLoopProbability;
  }

  public int maxRegenerationAttempts() {
    return maxRegenerationAttempts;
  }

  public int maxSynthesisAttempts() {
    return maxSynthesisAttempts;
  }

  public int validationSamples() {
    return validationSamples;
  }

  public int validationMin() {
    return validationRange.get(0);
  }

  public int validationMax() {
    return validationRange.get(1);
  }

  public Optional<Long> seed() {
    return Optional.ofNullable(seed);
  }
}
