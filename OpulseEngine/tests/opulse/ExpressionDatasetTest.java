package opulse;

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ExpressionDatasetTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir Path tempDir;

  @Test
  public void writesOneObjectPerLine()
      throws ConfigurationException, SynthesisException, IOException {
    GeneratorConfig config = GeneratorConfig.parse("max_base: 3\nexpr_max_depth: 3");
    OperatorRegistry registry = new OperatorRegistry();
    SeedOperators.install(registry);
    OperatorSynthesizer.create(config, registry, new Random(1))
        .generator()
        .generateBaseOperators();

    ExpressionDataset dataset =
        ExpressionDataset.generate(
            config, registry, new Random(2), 20, ExpressionGenerator.AtomPolicy.NUMBER);
    Path output = tempDir.resolve("expressions.jsonl");
    Path usage = tempDir.resolve("usage.jsonl");
    dataset.write(output);
    dataset.usage().write(usage);

    List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
    assertThat(lines).hasSize(20);
    for (int i = 0; i < lines.size(); i++) {
      JsonNode node = MAPPER.readTree(lines.get(i));
      assertThat(node.get("id").asInt()).isEqualTo(i);
      assertThat(node.has("expression")).isTrue();
      assertThat(node.has("expression_no_base_symbol")).isTrue();
      assertThat(node.has("normalized_expansion_degree")).isTrue();
      assertThat(node.has("complexity_ratio")).isTrue();
      JsonNode result = node.get("result");
      assertThat(result.isNumber() || result.asText().equals("NaN")).isTrue();
    }

    for (String line : Files.readAllLines(usage, StandardCharsets.UTF_8)) {
      JsonNode node = MAPPER.readTree(line);
      int operator = node.get("op_id").asInt();
      assertThat(registry.find(operator).isPresent()).isTrue();
      for (JsonNode id : node.get("expr_id")) {
        assertThat(dataset.expressions().get(id.asInt()).operatorUsage()).contains(operator);
      }
    }
  }
}
