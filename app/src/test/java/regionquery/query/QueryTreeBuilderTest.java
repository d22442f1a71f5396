package regionquery.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import regionquery.error.InputNotFoundException;
import regionquery.error.MalformedQueryException;
import regionquery.error.Stage;
import regionquery.model.Box;
import regionquery.model.CropFilter;

final class QueryTreeBuilderTest {
  private final QueryTreeBuilder builder = new QueryTreeBuilder();

  private static String crop(String region, String extra) {
    return "{\"operator_crop\": {\"region\": " + region + extra + "}}";
  }

  private static String region(double x0, double y0, double x1, double y1) {
    return "{\"p_min\": {\"x\": "
        + x0
        + ", \"y\": "
        + y0
        + "}, \"p_max\": {\"x\": "
        + x1
        + ", \"y\": "
        + y1
        + "}}";
  }

  private static String query(String node) {
    return "{\"query\": " + node + "}";
  }

  @Test
  void cropDefaultsOptionalParameters() {
    PredicateNode node = builder.parse(query(crop(region(0, 0, 10, 10), "")));

    PredicateNode.Crop crop = assertInstanceOf(PredicateNode.Crop.class, node);
    CropFilter filter = crop.filter();
    assertEquals(Box.of(0, 0, 10, 10), filter.box());
    assertEquals(OptionalInt.empty(), filter.category());
    assertTrue(filter.oneOfGroups().isEmpty());
    assertFalse(filter.proper());
  }

  @Test
  void cropReadsEveryOptionalParameter() {
    String extra = ", \"category\": 2, \"one_of_groups\": [7, 3, 7], \"proper\": true";
    PredicateNode node = builder.parse(query(crop(region(-1.5, 0, 2, 3.25), extra)));

    CropFilter filter = assertInstanceOf(PredicateNode.Crop.class, node).filter();
    assertEquals(Box.of(-1.5, 0, 2, 3.25), filter.box());
    assertEquals(OptionalInt.of(2), filter.category());
    assertEquals(List.of(7L, 3L), List.copyOf(filter.oneOfGroups()));
    assertTrue(filter.proper());
  }

  @Test
  void nullOptionalParametersCountAsAbsent() {
    String extra = ", \"category\": null, \"one_of_groups\": null, \"proper\": null";
    CropFilter filter =
        assertInstanceOf(
                PredicateNode.Crop.class, builder.parse(query(crop(region(0, 0, 1, 1), extra))))
            .filter();

    assertEquals(OptionalInt.empty(), filter.category());
    assertFalse(filter.restrictsGroups());
    assertFalse(filter.proper());
  }

  @Test
  void nestedOperatorsKeepOperandOrder() {
    String first = crop(region(0, 0, 1, 1), "");
    String second = crop(region(2, 2, 3, 3), ", \"category\": 4");
    String third = crop(region(4, 4, 5, 5), "");
    String json =
        query(
            "{\"operator_or\": [{\"operator_and\": ["
                + first
                + ", "
                + second
                + "]}, "
                + third
                + "]}");

    PredicateNode.Or or = assertInstanceOf(PredicateNode.Or.class, builder.parse(json));
    assertEquals(2, or.children().size());
    PredicateNode.And and = assertInstanceOf(PredicateNode.And.class, or.children().get(0));
    assertEquals(
        Box.of(0, 0, 1, 1),
        assertInstanceOf(PredicateNode.Crop.class, and.children().get(0)).filter().box());
    assertEquals(
        OptionalInt.of(4),
        assertInstanceOf(PredicateNode.Crop.class, and.children().get(1)).filter().category());
    assertEquals(
        Box.of(4, 4, 5, 5),
        assertInstanceOf(PredicateNode.Crop.class, or.children().get(1)).filter().box());
    assertEquals(5, or.nodeCount());
  }

  @Test
  void rejectsMissingQueryMember() {
    MalformedQueryException ex =
        assertThrows(
            MalformedQueryException.class, () -> builder.parse(crop(region(0, 0, 1, 1), "")));
    assertEquals("$: missing 'query'", ex.getMessage());
    assertEquals(Stage.BUILD, ex.stage());
  }

  @Test
  void unknownOperatorNamesItsPath() {
    String json =
        query("{\"operator_and\": [" + crop(region(0, 0, 1, 1), "") + ", {\"operator_xor\": []}]}");

    MalformedQueryException ex =
        assertThrows(MalformedQueryException.class, () -> builder.parse(json));
    assertEquals("$.query.operator_and[1]", ex.jsonPath());
    assertEquals("$.query.operator_and[1]: unknown operator 'operator_xor'", ex.getMessage());
  }

  @Test
  void rejectsNodeWithTwoOperators() {
    String json = query("{\"operator_and\": [], \"operator_or\": []}");

    MalformedQueryException ex =
        assertThrows(MalformedQueryException.class, () -> builder.parse(json));
    assertTrue(ex.getMessage().contains("expected exactly one operator"), ex.getMessage());
  }

  @Test
  void rejectsEmptyOrMissingOperandLists() {
    MalformedQueryException empty =
        assertThrows(
            MalformedQueryException.class,
            () -> builder.parse(query("{\"operator_and\": []}")));
    assertEquals("$.query.operator_and: operand list must not be empty", empty.getMessage());

    MalformedQueryException missing =
        assertThrows(
            MalformedQueryException.class,
            () -> builder.parse(query("{\"operator_or\": null}")));
    assertEquals("$.query.operator_or: missing operand list", missing.getMessage());

    assertThrows(
        MalformedQueryException.class,
        () -> builder.parse(query("{\"operator_or\": {\"a\": 1}}")));
  }

  @Test
  void rejectsInvertedRegion() {
    MalformedQueryException ex =
        assertThrows(
            MalformedQueryException.class,
            () -> builder.parse(query(crop(region(5, 0, 1, 1), ""))));
    assertEquals("$.query.operator_crop.region", ex.jsonPath());
    assertTrue(ex.getMessage().contains("exceeds maxX"), ex.getMessage());

    assertThrows(
        MalformedQueryException.class,
        () -> builder.parse(query(crop(region(0, 3, 1, 2), ""))));
  }

  @Test
  void rejectsMissingOrNonNumericBounds() {
    String missingMax = crop("{\"p_min\": {\"x\": 0, \"y\": 0}}", "");
    MalformedQueryException ex =
        assertThrows(MalformedQueryException.class, () -> builder.parse(query(missingMax)));
    assertEquals("$.query.operator_crop.region: missing 'p_max'", ex.getMessage());

    String textBound =
        crop("{\"p_min\": {\"x\": \"zero\", \"y\": 0}, \"p_max\": {\"x\": 1, \"y\": 1}}", "");
    ex = assertThrows(MalformedQueryException.class, () -> builder.parse(query(textBound)));
    assertEquals("$.query.operator_crop.region.p_min.x", ex.jsonPath());

    String missingY = crop("{\"p_min\": {\"x\": 0}, \"p_max\": {\"x\": 1, \"y\": 1}}", "");
    ex = assertThrows(MalformedQueryException.class, () -> builder.parse(query(missingY)));
    assertEquals("$.query.operator_crop.region.p_min: missing 'y'", ex.getMessage());

    ex =
        assertThrows(
            MalformedQueryException.class,
            () -> builder.parse(query("{\"operator_crop\": {\"category\": 1}}")));
    assertEquals("$.query.operator_crop: missing 'region'", ex.getMessage());
  }

  @Test
  void rejectsMistypedOptionalParameters() {
    String box = region(0, 0, 1, 1);
    assertThrows(
        MalformedQueryException.class,
        () -> builder.parse(query(crop(box, ", \"category\": 2.5"))));
    assertThrows(
        MalformedQueryException.class,
        () -> builder.parse(query(crop(box, ", \"category\": \"2\""))));
    assertThrows(
        MalformedQueryException.class,
        () -> builder.parse(query(crop(box, ", \"one_of_groups\": 3"))));
    assertThrows(
        MalformedQueryException.class,
        () -> builder.parse(query(crop(box, ", \"one_of_groups\": [1, \"x\"]"))));
    MalformedQueryException ex =
        assertThrows(
            MalformedQueryException.class,
            () -> builder.parse(query(crop(box, ", \"proper\": \"yes\""))));
    assertEquals("$.query.operator_crop.proper: must be a boolean", ex.getMessage());
  }

  @Test
  void integralCategoryWrittenAsDecimalIsAccepted() {
    CropFilter filter =
        assertInstanceOf(
                PredicateNode.Crop.class,
                builder.parse(query(crop(region(0, 0, 1, 1), ", \"category\": 3.0"))))
            .filter();
    assertEquals(OptionalInt.of(3), filter.category());
  }

  @Test
  void invalidJsonFailsInParseStage() {
    MalformedQueryException ex =
        assertThrows(
            MalformedQueryException.class,
            () -> builder.parse("{\"query\": {\"operator_and\": ["));
    assertEquals(Stage.PARSE, ex.stage());

    String unquotedKeys =
        "{query: {operator_crop: {region: {p_min: {x: 0, y: 0}, p_max: {x: 1, y: 1}}}}}";
    ex = assertThrows(MalformedQueryException.class, () -> builder.parse(unquotedKeys));
    assertEquals(Stage.PARSE, ex.stage());

    String trailing = query(crop(region(0, 0, 1, 1), "")) + " {}";
    ex = assertThrows(MalformedQueryException.class, () -> builder.parse(trailing));
    assertEquals(Stage.PARSE, ex.stage());

    ex = assertThrows(MalformedQueryException.class, () -> builder.parse(""));
    assertEquals(Stage.PARSE, ex.stage());
  }

  @Test
  void readsQueryFiles(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("query.json");
    Files.writeString(
        file, query(crop(region(0, 0, 10, 10), ", \"proper\": true")), StandardCharsets.UTF_8);

    PredicateNode node = builder.read(file);
    assertTrue(assertInstanceOf(PredicateNode.Crop.class, node).filter().proper());
  }

  @Test
  void missingQueryFileIsInputNotFound(@TempDir Path dir) {
    Path missing = dir.resolve("nope.json");
    InputNotFoundException ex =
        assertThrows(InputNotFoundException.class, () -> builder.read(missing));
    assertEquals(missing, ex.path());
    assertEquals(Stage.PARSE, ex.stage());
  }
}
