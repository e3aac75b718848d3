package opulse;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;

/** Line-delimited JSON persistence of operators, one record per line. */
public final class OperatorStore {
  private static final Logger logger = LoggerFactory.getLogger(OperatorStore.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private OperatorStore() {}

  private static final class Pending {
    final int id;
    final Optional<String> compute;
    final Optional<String> cost;
    final List<Integer> dependencies;

    Pending(int id, Optional<String> compute, Optional<String> cost, List<Integer> dependencies) {
      this.id = id;
      this.compute = compute;
      this.cost = cost;
      this.dependencies = dependencies;
    }
  }

  public static OperatorRegistry load(Path path, ExecutionLimits limits) throws IOException {
    OperatorRegistry registry = new OperatorRegistry(limits);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      List<String> lines = new ArrayList<>();
      String line;
      while ((line = reader.readLine()) != null) {
        lines.add(line);
      }
      int loaded = load(lines, registry);
      logger.info("Loaded {} operators from {}", loaded, path);
    }
    return registry;
  }

  /**
   * Adds every well-formed line to {@code registry}. Records are created before any procedure is
   * parsed, so procedures may call operators defined later in the file. Returns the number of
   * operators that survived loading.
   */
  public static int load(List<String> lines, OperatorRegistry registry) {
    Map<Integer, Pending> pending = new LinkedHashMap<>();
    int lineNumber = 0;
    for (String line : lines) {
      lineNumber++;
      if (line.trim().isEmpty()) {
        logger.debug("Skipping blank line {}", lineNumber);
        continue;
      }
      try {
        JsonNode node = MAPPER.readTree(line);
        OperatorData data = fromJson(node);
        List<Integer> dependencies = integers(node.path("dependencies"));
        OperatorRecord record = registry.add(data);
        pending.put(
            record.id(),
            new Pending(
                record.id(),
                text(node, "op_compute_func"),
                text(node, "op_count_func"),
                dependencies));
      } catch (JsonProcessingException | IllegalArgumentException | DuplicateOperatorException e) {
        logger.warn("Skipping malformed operator on line {}: {}", lineNumber, e.getMessage());
      }
    }

    List<Integer> broken = new ArrayList<>();
    for (Pending p : pending.values()) {
      try {
        registry.declareDependencies(p.id, p.dependencies);
        Optional<Procedure> compute =
            p.compute.isPresent()
                ? Optional.of(registry.parseProcedure(p.compute.get()))
                : Optional.empty();
        Optional<Procedure> cost =
            p.cost.isPresent()
                ? Optional.of(registry.parseProcedure(p.cost.get()))
                : Optional.empty();
        if (compute.isPresent() != cost.isPresent()) {
          throw new SynthesisException(
              SynthesisException.Reason.COMPILE_FAILURE, "compute and cost must come together");
        }
        if (compute.isPresent()) {
          registry.setProcedures(p.id, compute.get(), cost.get());
        }
      } catch (SynthesisException | IllegalArgumentException e) {
        logger.warn("Skipping operator {} with unusable procedures: {}", p.id, e.getMessage());
        broken.add(p.id);
      }
    }
    dropBroken(registry, broken);
    return registry.size();
  }

  // Removes the broken operators and, transitively, every operator calling one of them. Surviving
  // ids are left as they were in the file.
  private static void dropBroken(OperatorRegistry registry, List<Integer> broken) {
    broken.forEach(registry::remove);
    boolean changed = !broken.isEmpty();
    while (changed) {
      changed = false;
      for (OperatorRecord record : registry.operators()) {
        boolean dangling = false;
        for (Slot slot : Slot.values()) {
          dangling |=
              record.procedure(slot).map(p -> !p.callees().stream().allMatch(registry::contains))
                  .orElse(false);
        }
        if (dangling) {
          logger.warn("Skipping operator {}: it calls a skipped operator", record.id());
          registry.remove(record.id());
          changed = true;
        }
      }
    }
  }

  static OperatorData fromJson(JsonNode node) {
    if (!node.isObject()) {
      throw new IllegalArgumentException("expected a JSON object");
    }
    JsonNode symbol = node.path("symbol");
    JsonNode arity = node.path("n_ary");
    if (!symbol.isTextual() || symbol.asText().isEmpty() || !arity.isInt()) {
      throw new IllegalArgumentException("symbol and n_ary are required");
    }

    OperatorData.Builder builder =
        OperatorData.builder()
            .setSymbol(symbol.asText())
            .setFixity(Fixity.of(arity.asInt(), text(node, "unary_position")))
            .setId(integer(node, "id"))
            .setBaseTag(integer(node, "is_base"))
            .setDefinition(text(node, "definition"))
            .setPrecedence(integer(node, "priority"))
            .setAssociativity(text(node, "associativity_direction").map(Associativity::forTag))
            .setOrder(integer(node, "n_order"))
            .setTemporary(node.path("is_temporary").asBoolean(false))
            .setRecursionUsage(node.path("recursive_used_cases").asInt(0))
            .setRecursionEnabled(node.path("is_recursion_enabled").asBoolean(true));
    Optional<String> kind = text(node, "definition_type");
    if (node.hasNonNull("is_base")) {
      builder.setKind(DefinitionKind.BASE);
    } else if (kind.isPresent()) {
      builder.setKind(DefinitionKind.forTag(kind.get()));
    }
    return builder.build();
  }

  public static ObjectNode toJson(OperatorRegistry registry, OperatorRecord record) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put("id", record.id());
    node.put("symbol", record.symbol());
    node.put("n_ary", record.arity());
    putOptional(node, "unary_position", record.fixity().unaryPosition());
    putOptionalInt(node, "is_base", record.baseTag());
    putOptional(node, "definition", record.definition());
    putOptional(node, "definition_type", record.kind().tag());
    putOptionalInt(node, "priority", record.precedence());
    putOptional(node, "associativity_direction", record.associativity().map(Associativity::tag));
    putOptionalInt(node, "n_order", record.order());
    putOptional(node, "op_compute_func", registry.procedureSource(record.id(), Slot.COMPUTE));
    putOptional(node, "op_count_func", registry.procedureSource(record.id(), Slot.COST));
    ArrayNode deps = node.putArray("dependencies");
    registry.dependencyIds(record).stream().sorted().forEach(deps::add);
    node.put("is_temporary", record.isTemporary());
    node.put("recursive_used_cases", record.recursionUsage());
    node.put("is_recursion_enabled", record.isRecursionEnabled());
    return node;
  }

  public static void save(OperatorRegistry registry, Path path) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      for (OperatorRecord record : registry.operators()) {
        writer.write(MAPPER.writeValueAsString(toJson(registry, record)));
        writer.write('\n');
      }
    }
    logger.info("Saved {} operators to {}", registry.size(), path);
  }

  public static void append(OperatorRegistry registry, OperatorRecord record, Path path)
      throws IOException {
    try (Writer writer =
        Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND)) {
      writer.write(MAPPER.writeValueAsString(toJson(registry, record)));
      writer.write('\n');
    }
  }

  private static Optional<String> text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? Optional.empty() : Optional.of(value.asText());
  }

  private static Optional<Integer> integer(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return Optional.empty();
    } else if (!value.isInt()) {
      throw new IllegalArgumentException(field + " must be an integer");
    }
    return Optional.of(value.asInt());
  }

  private static List<Integer> integers(JsonNode array) {
    List<Integer> values = new ArrayList<>();
    for (JsonNode value : array) {
      if (!value.isInt()) {
        throw new IllegalArgumentException("dependencies must be integers");
      }
      values.add(value.asInt());
    }
    return ImmutableSet.copyOf(values).asList();
  }

  private static void putOptional(ObjectNode node, String field, Optional<String> value) {
    if (value.isPresent()) {
      node.put(field, value.get());
    } else {
      node.putNull(field);
    }
  }

  private static void putOptionalInt(ObjectNode node, String field, Optional<Integer> value) {
    if (value.isPresent()) {
      node.put(field, value.get());
    } else {
      node.putNull(field);
    }
  }
}
