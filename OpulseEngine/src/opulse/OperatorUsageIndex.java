package opulse;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

// Reverse index from operator id to the ids of the expressions using it.
public final class OperatorUsageIndex {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final ListMultimap<Integer, Integer> expressionsByOperator =
      MultimapBuilder.treeKeys().arrayListValues().build();

  public void record(EvaluatedExpression expression) {
    for (int operatorId : expression.operatorUsage().elementSet()) {
      expressionsByOperator.put(operatorId, expression.id());
    }
  }

  public ImmutableList<Integer> expressionsUsing(int operatorId) {
    return ImmutableList.copyOf(expressionsByOperator.get(operatorId));
  }

  public boolean isEmpty() {
    return expressionsByOperator.isEmpty();
  }

  public void write(Path path) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      for (Map.Entry<Integer, Collection<Integer>> entry :
          expressionsByOperator.asMap().entrySet()) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("op_id", entry.getKey());
        ArrayNode ids = node.putArray("expr_id");
        entry.getValue().forEach(ids::add);
        writer.write(MAPPER.writeValueAsString(node));
        writer.write('\n');
      }
    }
  }
}
