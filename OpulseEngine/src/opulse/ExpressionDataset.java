package opulse;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

/** A batch of evaluated expressions over one registry, written one JSON object per line. */
public final class ExpressionDataset {
  private static final Logger logger = LoggerFactory.getLogger(ExpressionDataset.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ImmutableList<EvaluatedExpression> expressions;
  private final OperatorUsageIndex usage;

  private ExpressionDataset(
      ImmutableList<EvaluatedExpression> expressions, OperatorUsageIndex usage) {
    this.expressions = expressions;
    this.usage = usage;
  }

  public static ExpressionDataset generate(
      GeneratorConfig config,
      OperatorRegistry registry,
      Random random,
      int count,
      ExpressionGenerator.AtomPolicy policy) {
    ExpressionEvaluator evaluator =
        new ExpressionEvaluator(
            registry, new BaseConverter(config.customDigits()), config.nanSymbol());
    ExpressionGenerator generator = new ExpressionGenerator(config, registry, evaluator, random);
    ImmutableList.Builder<EvaluatedExpression> expressions = ImmutableList.builder();
    int nan = 0;
    for (int i = 0; i < count; i++) {
      EvaluatedExpression expression = generator.createExpression(policy);
      if (expression.result().isNan()) {
        nan++;
      }
      expressions.add(expression);
    }
    logger.info("Generated {} expressions, {} of them NaN", count, nan);
    return new ExpressionDataset(expressions.build(), generator.usage());
  }

  public ImmutableList<EvaluatedExpression> expressions() {
    return expressions;
  }

  public OperatorUsageIndex usage() {
    return usage;
  }

  public void write(Path path) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      for (EvaluatedExpression expression : expressions) {
        writer.write(MAPPER.writeValueAsString(expression.toJson()));
        writer.write('\n');
      }
    }
    logger.info("Wrote {} expressions to {}", expressions.size(), path);
  }
}
