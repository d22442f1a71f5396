package regionquery.query;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import regionquery.error.InputNotFoundException;
import regionquery.error.MalformedQueryException;
import regionquery.error.Stage;
import regionquery.model.Box;
import regionquery.model.CropFilter;

/**
 * Translates a JSON query description into a {@link PredicateNode}.
 *
 * <pre>
 * { "query": { "operator_and": [
 *     { "operator_crop": { "region": { "p_min": {"x": 0, "y": 0}, "p_max": {"x": 10, "y": 10} } } },
 *     { "operator_crop": { "region": { ... }, "category": 2, "one_of_groups": [1, 4], "proper": true } }
 * ] } }
 * </pre>
 *
 * <p>Validation is purely structural; nothing is evaluated. Optional crop keys set to JSON {@code
 * null} count as absent.
 */
public final class QueryTreeBuilder {
  static final String QUERY = "query";
  static final String OPERATOR_CROP = "operator_crop";
  static final String OPERATOR_AND = "operator_and";
  static final String OPERATOR_OR = "operator_or";

  private static final Set<String> OPERATORS = Set.of(OPERATOR_CROP, OPERATOR_AND, OPERATOR_OR);
  private static final TypeAdapter<JsonElement> JSON = new Gson().getAdapter(JsonElement.class);

  /** Reads and builds the query stored at {@code path}. */
  public PredicateNode read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new InputNotFoundException(Stage.PARSE, path);
    }
    return parse(Files.readString(path, StandardCharsets.UTF_8));
  }

  public PredicateNode parse(String json) {
    Objects.requireNonNull(json, "json");
    JsonElement document;
    try (JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.setLenient(false);
      document = JSON.read(reader);
      if (reader.peek() != JsonToken.END_DOCUMENT) {
        throw new MalformedQueryException(
            "Query is not valid JSON: content after the document", (Throwable) null);
      }
    } catch (IOException | JsonParseException ex) {
      throw new MalformedQueryException("Query is not valid JSON: " + ex.getMessage(), ex);
    }
    return build(document);
  }

  public PredicateNode build(JsonElement document) {
    if (document == null || !document.isJsonObject()) {
      throw new MalformedQueryException("$", "expected a JSON object with a 'query' member");
    }
    JsonElement query = document.getAsJsonObject().get(QUERY);
    if (query == null || query.isJsonNull()) {
      throw new MalformedQueryException("$", "missing '" + QUERY + "'");
    }
    return node(query, "$." + QUERY);
  }

  private PredicateNode node(JsonElement element, String path) {
    if (!element.isJsonObject()) {
      throw new MalformedQueryException(path, "operator node must be a JSON object");
    }
    JsonObject obj = element.getAsJsonObject();
    if (obj.size() == 0) {
      throw new MalformedQueryException(path, "empty node, expected one of " + sorted(OPERATORS));
    }
    for (String key : obj.keySet()) {
      if (!OPERATORS.contains(key)) {
        throw new MalformedQueryException(path, "unknown operator '" + key + "'");
      }
    }
    if (obj.size() > 1) {
      throw new MalformedQueryException(
          path, "expected exactly one operator, found " + List.copyOf(obj.keySet()));
    }
    Map.Entry<String, JsonElement> entry = obj.entrySet().iterator().next();
    String operator = entry.getKey();
    String childPath = path + "." + operator;
    return switch (operator) {
      case OPERATOR_CROP -> PredicateNode.crop(crop(entry.getValue(), childPath));
      case OPERATOR_AND -> new PredicateNode.And(operands(entry.getValue(), childPath));
      case OPERATOR_OR -> new PredicateNode.Or(operands(entry.getValue(), childPath));
      default -> throw new MalformedQueryException(path, "unknown operator '" + operator + "'");
    };
  }

  private List<PredicateNode> operands(JsonElement element, String path) {
    if (element == null || element.isJsonNull()) {
      throw new MalformedQueryException(path, "missing operand list");
    }
    if (!element.isJsonArray()) {
      throw new MalformedQueryException(path, "operand list must be a JSON array");
    }
    JsonArray array = element.getAsJsonArray();
    if (array.isEmpty()) {
      throw new MalformedQueryException(path, "operand list must not be empty");
    }
    List<PredicateNode> children = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      children.add(node(array.get(i), path + "[" + i + "]"));
    }
    return children;
  }

  private CropFilter crop(JsonElement element, String path) {
    if (element == null || !element.isJsonObject()) {
      throw new MalformedQueryException(path, "crop parameters must be a JSON object");
    }
    JsonObject params = element.getAsJsonObject();
    Box box = region(requiredObject(params, "region", path), path + ".region");
    OptionalInt category = readCategory(params, path);
    Set<Long> groups = readGroups(params, path);
    boolean proper = readProper(params, path);
    return new CropFilter(box, category, groups, proper);
  }

  private Box region(JsonObject region, String path) {
    JsonObject min = requiredObject(region, "p_min", path);
    JsonObject max = requiredObject(region, "p_max", path);
    double minX = requiredNumber(min, "x", path + ".p_min");
    double minY = requiredNumber(min, "y", path + ".p_min");
    double maxX = requiredNumber(max, "x", path + ".p_max");
    double maxY = requiredNumber(max, "y", path + ".p_max");
    try {
      return new Box(minX, minY, maxX, maxY);
    } catch (IllegalArgumentException ex) {
      throw new MalformedQueryException(path, "invalid region: " + ex.getMessage());
    }
  }

  private static OptionalInt readCategory(JsonObject params, String path) {
    JsonElement value = params.get("category");
    if (value == null || value.isJsonNull()) {
      return OptionalInt.empty();
    }
    BigDecimal number = integral(value, path + ".category");
    try {
      return OptionalInt.of(number.intValueExact());
    } catch (ArithmeticException ex) {
      throw new MalformedQueryException(path + ".category", "out of range: " + value);
    }
  }

  private static Set<Long> readGroups(JsonObject params, String path) {
    JsonElement value = params.get("one_of_groups");
    String groupsPath = path + ".one_of_groups";
    if (value == null || value.isJsonNull()) {
      return Set.of();
    }
    if (!value.isJsonArray()) {
      throw new MalformedQueryException(groupsPath, "must be an array of group ids");
    }
    Set<Long> groups = new LinkedHashSet<>();
    JsonArray array = value.getAsJsonArray();
    for (int i = 0; i < array.size(); i++) {
      String itemPath = groupsPath + "[" + i + "]";
      BigDecimal number = integral(array.get(i), itemPath);
      try {
        groups.add(number.longValueExact());
      } catch (ArithmeticException ex) {
        throw new MalformedQueryException(itemPath, "out of range: " + array.get(i));
      }
    }
    return groups;
  }

  private static boolean readProper(JsonObject params, String path) {
    JsonElement value = params.get("proper");
    if (value == null || value.isJsonNull()) {
      return false;
    }
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
      throw new MalformedQueryException(path + ".proper", "must be a boolean");
    }
    return value.getAsBoolean();
  }

  private static JsonObject requiredObject(JsonObject parent, String field, String path) {
    JsonElement value = parent.get(field);
    if (value == null || value.isJsonNull()) {
      throw new MalformedQueryException(path, "missing '" + field + "'");
    }
    if (!value.isJsonObject()) {
      throw new MalformedQueryException(path + "." + field, "must be a JSON object");
    }
    return value.getAsJsonObject();
  }

  private static double requiredNumber(JsonObject parent, String field, String path) {
    JsonElement value = parent.get(field);
    if (value == null || value.isJsonNull()) {
      throw new MalformedQueryException(path, "missing '" + field + "'");
    }
    if (!isNumber(value)) {
      throw new MalformedQueryException(path + "." + field, "not a number: " + value);
    }
    return value.getAsDouble();
  }

  private static BigDecimal integral(JsonElement value, String path) {
    if (!isNumber(value)) {
      throw new MalformedQueryException(path, "not an integer: " + value);
    }
    BigDecimal number;
    try {
      number = value.getAsBigDecimal();
    } catch (NumberFormatException ex) {
      throw new MalformedQueryException(path, "not an integer: " + value);
    }
    if (number.signum() != 0 && number.stripTrailingZeros().scale() > 0) {
      throw new MalformedQueryException(path, "not an integer: " + value);
    }
    return number;
  }

  private static boolean isNumber(JsonElement value) {
    if (!value.isJsonPrimitive()) {
      return false;
    }
    JsonPrimitive primitive = value.getAsJsonPrimitive();
    return primitive.isNumber();
  }

  private static List<String> sorted(Set<String> values) {
    return values.stream().sorted().toList();
  }
}
