package net.larse.seriesmatch.timeseries;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.larse.seriesmatch.helper.SeriesMatchException;
import org.junit.Before;
import org.junit.Test;

public class DateColumnResolverTest {
  private Map<String, List<?>> table;

  @Before
  public void setUp() throws Exception {
    table = new LinkedHashMap<>();
  }

  @Test
  public void testPicksDateColumn() {
    table.put("id", Arrays.asList(1, 2, 3, 4));
    table.put("month", Arrays.asList("2020-01-01", "2020-02-01", "2020-03-01", "2020-04-01"));
    table.put("sales", Arrays.asList("10.5", "11", "9.75", "12"));

    assertEquals("month", new DateColumnResolver().resolve(table));
  }

  @Test
  public void testThreshold() {
    // 8 of 10 values parse.
    table.put("when", Arrays.asList("2021-01-01", "2021-01-02", "2021-01-03", "2021-01-04",
        "2021-01-05", "2021-01-06", "2021-01-07", "2021-01-08", "n/a", ""));
    table.put("value", Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8, 9, 10));

    assertEquals(0.8, DateColumnResolver.parsedFraction(table.get("when")), 1e-12);
    assertEquals("when", new DateColumnResolver(0.8).resolve(table));
    try {
      new DateColumnResolver().resolve(table);
      fail("expected NoDateColumnFound");
    } catch (SeriesMatchException.NoDateColumnFound e) {
      assertNotNull(e.getMessage());
    }
  }

  @Test
  public void testTieGoesToFirstColumn() {
    table.put("value", Arrays.asList(1.0, 2.0));
    table.put("created", Arrays.asList("2019-05-01", "2019-06-01"));
    table.put("updated", Arrays.asList("2019-05-02", "2019-06-02"));

    assertEquals("created", new DateColumnResolver().resolve(table));
  }

  @Test
  public void testBestFractionWins() {
    table.put("partly", Arrays.asList("2019-05-01", "x", "2019-07-01", "2019-08-01"));
    table.put("fully", Arrays.asList("2019-05-01", "2019-06-01", "2019-07-01", "2019-08-01"));

    assertEquals("fully", new DateColumnResolver(0.5).resolve(table));
  }

  @Test(expected = SeriesMatchException.NoDateColumnFound.class)
  public void testNoColumns() {
    new DateColumnResolver().resolve(Collections.<String, List<?>>emptyMap());
  }

  @Test(expected = SeriesMatchException.NoDateColumnFound.class)
  public void testNumbersAreNotDates() {
    table.put("year", Arrays.asList(2001, 2002, 2003));
    table.put("epoch", Arrays.asList("1577836800", "1577923200", "1578009600"));

    new DateColumnResolver().resolve(table);
  }

  @Test
  public void testEmptyColumnParsesNothing() {
    assertEquals(0.0, DateColumnResolver.parsedFraction(Collections.emptyList()), 0.0);
  }

  @Test
  public void testParseTimestampFormats() {
    Instant newYear = Instant.parse("2020-01-01T00:00:00Z");

    assertEquals(newYear, DateColumnResolver.parseTimestamp("2020-01-01T00:00:00Z"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("2020-01-01T01:00:00+01:00"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("2020-01-01T00:00:00"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("2020-01-01 00:00:00"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("2020-01-01 00:00"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("2020-01-01"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("2020/01/01"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("01/01/2020"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("01.01.2020"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp("2020-01"));
    assertEquals(newYear, DateColumnResolver.parseTimestamp(" 2020-01-01 "));
  }

  @Test
  public void testParseTimestampObjects() {
    Instant newYear = Instant.parse("2020-01-01T00:00:00Z");

    assertEquals(newYear, DateColumnResolver.parseTimestamp(newYear));
    assertEquals(newYear, DateColumnResolver.parseTimestamp(LocalDate.of(2020, 1, 1)));
    assertEquals(newYear, DateColumnResolver.parseTimestamp(LocalDateTime.of(2020, 1, 1, 0, 0)));
    assertEquals(newYear, DateColumnResolver.parseTimestamp(java.util.Date.from(newYear)));
  }

  @Test
  public void testSqlDateColumn() {
    table.put("value", Arrays.asList(1.0, 2.0));
    table.put("day", Arrays.asList(
        java.sql.Date.valueOf("2020-01-01"), java.sql.Date.valueOf("2020-01-02")));

    assertEquals("day", new DateColumnResolver().resolve(table));
    assertEquals(Instant.parse("2020-01-01T00:00:00Z"),
        DateColumnResolver.parseTimestamp(java.sql.Date.valueOf("2020-01-01")));
    assertEquals(Instant.parse("2020-01-01T10:30:00Z"), DateColumnResolver.parseTimestamp(
        java.sql.Timestamp.from(Instant.parse("2020-01-01T10:30:00Z"))));
    assertNull(DateColumnResolver.parseTimestamp(java.sql.Time.valueOf("10:30:00")));
  }

  @Test
  public void testInstantBeyondEpochMillis() {
    assertNull(DateColumnResolver.parseTimestamp(Instant.MAX));
    assertNull(DateColumnResolver.parseTimestamp("+1000000000-01-01T00:00:00Z"));
    assertEquals(0.5, DateColumnResolver.parsedFraction(
        Arrays.asList(Instant.MIN, Instant.EPOCH)), 0.0);
  }

  @Test
  public void testParseTimestampRejects() {
    assertNull(DateColumnResolver.parseTimestamp(null));
    assertNull(DateColumnResolver.parseTimestamp(""));
    assertNull(DateColumnResolver.parseTimestamp("   "));
    assertNull(DateColumnResolver.parseTimestamp("12.5"));
    assertNull(DateColumnResolver.parseTimestamp(42));
    assertNull(DateColumnResolver.parseTimestamp("2020-13-45"));
    assertNull(DateColumnResolver.parseTimestamp("yesterday"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testThresholdOutOfRange() {
    new DateColumnResolver(1.5);
  }
}
