/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.seriesmatch.timeseries;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.Map;
import net.larse.seriesmatch.helper.SeriesMatchException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the column of a table that holds the time axis.
 *
 * Every value of every column is tried as a timestamp. The column with the highest share of
 * parseable values wins if that share reaches the threshold; the first such column in table
 * order wins a tie.
 */
public class DateColumnResolver {
  private static final Logger logger = LoggerFactory.getLogger(DateColumnResolver.class);

  public static final double DEFAULT_THRESHOLD = 0.9;

  private static final List<DateTimeFormatter> DATE_TIME_FORMATS = ImmutableList.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
      DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"));

  private static final List<DateTimeFormatter> DATE_FORMATS = ImmutableList.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("yyyy/MM/dd"),
      DateTimeFormatter.ofPattern("MM/dd/yyyy"),
      DateTimeFormatter.ofPattern("dd.MM.yyyy"));

  private static final DateTimeFormatter YEAR_MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

  private final double threshold;

  public DateColumnResolver() {
    this(DEFAULT_THRESHOLD);
  }

  public DateColumnResolver(double threshold) {
    Preconditions.checkArgument(threshold > 0 && threshold <= 1,
        "threshold must be in (0, 1], got %s", threshold);
    this.threshold = threshold;
  }

  public double getThreshold() {
    return threshold;
  }

  /**
   * Returns the name of the time column.
   *
   * @param table column name to column values, iterated in table order
   * @throws SeriesMatchException.NoDateColumnFound if no column reaches the threshold
   */
  public String resolve(Map<String, ? extends List<?>> table) {
    Preconditions.checkNotNull(table, "table");

    String best = null;
    double bestFraction = -1;
    for (Map.Entry<String, ? extends List<?>> column : table.entrySet()) {
      double fraction = parsedFraction(column.getValue());
      logger.debug("Column '{}' parses as time in {} of its values", column.getKey(), fraction);
      if (fraction > bestFraction) {
        best = column.getKey();
        bestFraction = fraction;
      }
    }

    if (best == null || bestFraction < threshold) {
      throw new SeriesMatchException.NoDateColumnFound(String.format(
          "No column parses as timestamps in at least %.0f%% of its values (best: %s at %.2f).",
          threshold * 100, best, Math.max(bestFraction, 0)));
    }
    return best;
  }

  /** Share of values that parse as timestamps, 0 for an empty column. */
  public static double parsedFraction(List<?> values) {
    if (values == null || values.isEmpty()) {
      return 0;
    }
    int parsed = 0;
    for (Object value : values) {
      if (parseTimestamp(value) != null) {
        parsed++;
      }
    }
    return (double) parsed / values.size();
  }

  /**
   * Interprets one cell as a point in time, or returns null. Local dates and times are taken
   * as UTC. Plain numbers, times of day without a date and instants outside the epoch
   * millisecond range are not treated as timestamps.
   */
  public static Instant parseTimestamp(Object value) {
    Instant instant = toInstant(value);
    if (instant == null) {
      return null;
    }
    try {
      instant.toEpochMilli();
    } catch (ArithmeticException e) {
      logger.debug("Timestamp {} does not fit in epoch milliseconds", instant);
      return null;
    }
    return instant;
  }

  private static Instant toInstant(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Instant) {
      return (Instant) value;
    }
    if (value instanceof java.sql.Date) {
      return ((java.sql.Date) value).toLocalDate().atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    if (value instanceof java.sql.Time) {
      return null;
    }
    if (value instanceof Date) {
      return ((Date) value).toInstant();
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof ZonedDateTime) {
      return ((ZonedDateTime) value).toInstant();
    }
    if (!(value instanceof CharSequence)) {
      return null;
    }
    return parseTimestamp(value.toString());
  }

  private static Instant parseTimestamp(String raw) {
    String s = raw.trim();
    if (StringUtils.isBlank(s) || Doubles.tryParse(s) != null) {
      return null;
    }

    try {
      return Instant.parse(s);
    } catch (DateTimeParseException e) {
      // fall through to the next format
    }
    try {
      return OffsetDateTime.parse(s).toInstant();
    } catch (DateTimeParseException e) {
      // fall through to the next format
    }
    for (DateTimeFormatter format : DATE_TIME_FORMATS) {
      try {
        return LocalDateTime.parse(s, format).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException e) {
        // fall through to the next format
      }
    }
    for (DateTimeFormatter format : DATE_FORMATS) {
      try {
        return LocalDate.parse(s, format).atStartOfDay(ZoneOffset.UTC).toInstant();
      } catch (DateTimeParseException e) {
        // fall through to the next format
      }
    }
    try {
      return YearMonth.parse(s, YEAR_MONTH_FORMAT).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
