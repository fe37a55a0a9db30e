package io.fuzzydate.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.fuzzydate.ErrorKind;
import io.fuzzydate.FuzzyDate;
import io.fuzzydate.FuzzyDateException;
import io.fuzzydate.Span;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/** Tests for fixed-width parsing. */
public class FuzzyDateParserTest {

  private static FuzzyDateParser.Fields fields(Integer year, Integer month, Integer day) {
    return new FuzzyDateParser.Fields(opt(year), opt(month), opt(day));
  }

  private static OptionalInt opt(Integer value) {
    return value == null ? OptionalInt.empty() : OptionalInt.of(value);
  }

  @Test
  void testYear() {
    assertEquals(fields(2019, null, null), FuzzyDateParser.parse("2019"));
  }

  @Test
  void testYearMonth() {
    assertEquals(fields(2019, 3, null), FuzzyDateParser.parse("2019/03"));
  }

  @Test
  void testYearMonthDay() {
    assertEquals(fields(2019, 3, 5), FuzzyDateParser.parse("2019/03/05"));
  }

  @Test
  void testShortTextHasNoComponents() {
    assertEquals(fields(null, null, null), FuzzyDateParser.parse(""));
    assertEquals(fields(null, null, null), FuzzyDateParser.parse("201"));
    assertEquals(fields(null, null, null), FuzzyDateParser.parse("abc"));
  }

  @Test
  void testLengthBetweenFormsKeepsLeadingComponents() {
    assertEquals(fields(2019, null, null), FuzzyDateParser.parse("2019/0"));
    assertEquals(fields(2019, 3, null), FuzzyDateParser.parse("2019/03/0"));
  }

  @Test
  void testDayOnlyReadAtExactLength() {
    assertEquals(fields(2019, 3, null), FuzzyDateParser.parse("2019/03/05Z"));
  }

  @Test
  void testSeparatorsAreNotInspected() {
    assertEquals(fields(2019, 3, 5), FuzzyDateParser.parse("2019-03-05"));
    assertEquals(fields(2019, 3, 5), FuzzyDateParser.parse("2019.03.05"));
  }

  @Test
  void testNegativeYear() {
    assertEquals(fields(-5, null, null), FuzzyDateParser.parse("-005"));
  }

  @Test
  void testPlusSignIsRejected() {
    FuzzyDateException e =
        assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("+201"));
    assertEquals("invalid year \"+201\"", e.getMessage());
    assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("2019/+3"));
    assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("2019/03/+5"));
  }

  @Test
  void testMinusSignOnlyAllowedInYear() {
    FuzzyDateException e =
        assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("2019/-3"));
    assertEquals(new Span(5, 7), e.span().orElseThrow());
    assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("2019/03/-5"));
    assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("--05"));
  }

  @Test
  void testNonAsciiDigitsAreRejected() {
    FuzzyDateException e =
        assertThrows(
            FuzzyDateException.class, () -> FuzzyDateParser.parse("\u0662\u0660\u0661\u0669"));
    assertEquals(ErrorKind.FORMAT, e.kind());
    assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("2019/\uff10\uff13"));
  }

  @Test
  void testNegativeCanonicalYearReadsBack() {
    assertEquals(FuzzyDate.of(-44, 3, 15), FuzzyDate.parse("-044/03/15"));
  }

  @Test
  void testInvalidYear() {
    FuzzyDateException e =
        assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("20x9"));
    assertEquals(ErrorKind.FORMAT, e.kind());
    assertEquals(new Span(0, 4), e.span().orElseThrow());
    assertEquals("20x9", e.input().orElseThrow());
    assertInstanceOf(NumberFormatException.class, e.getCause());
  }

  @Test
  void testInvalidMonth() {
    FuzzyDateException e =
        assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("2019/x3"));
    assertEquals(new Span(5, 7), e.span().orElseThrow());
    assertEquals("invalid month \"x3\"", e.getMessage());
    assertEquals("error: invalid month \"x3\"\n  2019/x3\n       ^^", e.displayRich());
  }

  @Test
  void testInvalidDay() {
    FuzzyDateException e =
        assertThrows(FuzzyDateException.class, () -> FuzzyDateParser.parse("2019/03/ab"));
    assertEquals(new Span(8, 10), e.span().orElseThrow());
    assertEquals("invalid day \"ab\"", e.getMessage());
  }

  @Test
  void testNullInput() {
    assertThrows(NullPointerException.class, () -> FuzzyDateParser.parse(null));
  }

  @Test
  void testParsedDateIsValidated() {
    FuzzyDateException e = assertThrows(FuzzyDateException.class, () -> FuzzyDate.parse("2019/13"));
    assertEquals(ErrorKind.VALIDATION, e.kind());
    assertEquals("month-must-be-in-range", e.rule().orElseThrow());
  }

  @Test
  void testParseBuildsDate() {
    assertEquals(FuzzyDate.unknown(), FuzzyDate.parse("19"));
    assertEquals(FuzzyDate.of(2018), FuzzyDate.parse("2018"));
    assertEquals(FuzzyDate.of(2019, 3), FuzzyDate.parse("2019/03"));
    assertEquals(FuzzyDate.of(2019, 3, 5), FuzzyDate.parse("2019/03/05"));
  }
}
