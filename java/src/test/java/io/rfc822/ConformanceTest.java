package io.rfc822;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rfc822.ast.CivilDateTime;
import io.rfc822.lexer.Tokens;
import io.rfc822.parser.Parser;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

/** Conformance tests loaded from spec/tests.json. */
public class ConformanceTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static JsonNode SPEC;

  @BeforeAll
  static void loadSpec() throws IOException {
    Path specPath = Path.of("spec/tests.json");
    String json = Files.readString(specPath);
    SPEC = MAPPER.readTree(json);
  }

  @TestFactory
  Stream<DynamicTest> parseTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : SPEC.get("parse").get("tests")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                Rfc822DateTime dt =
                    Rfc822DateTime.parse(input)
                        .orElseThrow(() -> new AssertionError("expected match: " + input));

                assertEquals(input, dt.stamp());
                assertTokens(tc.get("tokens"), dt.tokens());
                assertDateTime(tc.get("dateTime"), dt.dateTime());
                assertEquals(tc.get("epochSecond").asLong(), dt.instant().getEpochSecond());
                assertEquals(Instant.parse(tc.get("instant").asText()), dt.instant());
                assertEquals(
                    tc.get("impliedDayOfWeek").asText(), dt.impliedDayOfWeek().toString());
                assertEquals(
                    tc.get("dayOfWeekConsistent").asBoolean(), dt.isDayOfWeekConsistent());
              }));
    }
    return tests.stream();
  }

  @TestFactory
  Stream<DynamicTest> rejectTests() {
    List<DynamicTest> tests = new ArrayList<>();
    for (JsonNode tc : SPEC.get("reject").get("tests")) {
      String name = tc.get("name").asText();
      String input = tc.get("input").asText();
      String kind = tc.get("kind").asText();

      tests.add(
          DynamicTest.dynamicTest(
              name,
              () -> {
                assertTrue(
                    Rfc822DateTime.parse(input).isEmpty(), "expected no result for: " + input);
                assertFalse(Rfc822DateTime.validate(input));

                Rfc822Exception e =
                    assertThrows(Rfc822Exception.class, () -> Parser.parse(input));
                assertEquals(kind, e.kind().value(), "error kind for: " + input);
              }));
    }
    return tests.stream();
  }

  private static void assertTokens(JsonNode expected, Tokens actual) {
    assertEquals(expected.get("dayOfWeek").asText(), actual.dayOfWeek(), "dayOfWeek");
    assertEquals(expected.get("day").asText(), actual.day(), "day");
    assertEquals(expected.get("month").asText(), actual.month(), "month");
    assertEquals(expected.get("year").asText(), actual.year(), "year");
    assertEquals(expected.get("hour").asText(), actual.hour(), "hour");
    assertEquals(expected.get("minute").asText(), actual.minute(), "minute");
    assertEquals(expected.get("second").asText(), actual.second(), "second");
    assertEquals(expected.get("timeZone").asText(), actual.timeZone(), "timeZone");
  }

  private static void assertDateTime(JsonNode expected, CivilDateTime actual) {
    CivilDateTime want =
        new CivilDateTime(
            expected.get("day").asInt(),
            expected.get("month").asInt(),
            expected.get("year").asInt(),
            expected.get("hour").asInt(),
            expected.get("minute").asInt(),
            expected.get("second").asInt(),
            expected.get("timeZoneDifferential").asInt());
    assertEquals(want, actual);
  }
}
