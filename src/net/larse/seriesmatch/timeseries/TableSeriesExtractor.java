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
import com.google.common.primitives.Doubles;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntComparator;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an already parsed table into a {@link TimeSeries}: the time axis comes from the column
 * picked by {@link DateColumnResolver}, the values from a named target column.
 */
public class TableSeriesExtractor {
  private static final Logger logger = LoggerFactory.getLogger(TableSeriesExtractor.class);

  private final DateColumnResolver resolver;

  public TableSeriesExtractor() {
    this(new DateColumnResolver());
  }

  public TableSeriesExtractor(DateColumnResolver resolver) {
    this.resolver = Preconditions.checkNotNull(resolver, "resolver");
  }

  /**
   * Rows whose timestamp does not parse are dropped. Target cells that are not numbers become
   * NaN. The result is sorted by time; rows with equal timestamps keep their table order.
   */
  public TimeSeries extract(Map<String, ? extends List<?>> table, String targetColumn) {
    Preconditions.checkNotNull(table, "table");
    Preconditions.checkArgument(table.containsKey(targetColumn),
        "table has no column '%s'", targetColumn);

    String dateColumn = resolver.resolve(table);
    List<?> dates = table.get(dateColumn);
    List<?> targets = table.get(targetColumn);
    Preconditions.checkArgument(dates.size() == targets.size(),
        "column '%s' has %s rows, '%s' has %s", dateColumn, dates.size(), targetColumn,
        targets.size());

    IntArrayList rows = new IntArrayList(dates.size());
    long[] parsed = new long[dates.size()];
    for (int i = 0; i < dates.size(); i++) {
      Instant instant = DateColumnResolver.parseTimestamp(dates.get(i));
      if (instant != null) {
        parsed[i] = instant.toEpochMilli();
        rows.add(i);
      }
    }
    if (rows.size() < dates.size()) {
      logger.debug("Dropped {} rows without a parseable '{}'", dates.size() - rows.size(),
          dateColumn);
    }

    // Stable sort on time.
    rows.sort((IntComparator) (a, b) -> Long.compare(parsed[a], parsed[b]));

    long[] timestamps = new long[rows.size()];
    double[] values = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      int row = rows.getInt(i);
      timestamps[i] = parsed[row];
      values[i] = toDouble(targets.get(row));
    }
    return new TimeSeries(timestamps, values);
  }

  static double toDouble(Object cell) {
    if (cell instanceof Number) {
      return ((Number) cell).doubleValue();
    }
    if (cell != null) {
      Double value = Doubles.tryParse(cell.toString().trim());
      if (value != null) {
        return value;
      }
    }
    return Double.NaN;
  }
}
