/*
 * Licensed to Julian Hyde under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package net.hydromatic.questcli.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Schemes for converting the rows returned by a SQL statement into
 * text. */
public enum OutputFormat {
  /** Table output format.
   *
   * <p>Example:
   *
   * <blockquote><pre>
   *   +-------+--------+--------+
   *   | ename | deptno | gender |
   *   +-------+--------+--------+
   *   | Jane  |     10 | F      |
   *   | Bob   |     10 | M      |
   *   +-------+--------+--------+
   *   (2 rows)
   * </pre></blockquote>
   */
  TABLE {
    @Override public RowSink sink(PrintWriter out) {
      return new BufferingSink(out) {
        @Override void print(List<Column> columns, List<Row> rows) {
          printTable(out, columns, rows);
        }
      };
    }
  },

  /** CSV output format, with a header line, quoting values only where
   * necessary (RFC 4180). */
  CSV {
    @Override public RowSink sink(PrintWriter out) {
      return new BufferingSink(out) {
        @Override void print(List<Column> columns, List<Row> rows) {
          printCsv(out, columns, rows);
        }
      };
    }
  },

  /** JSON output format; an array of objects, one per row.
   *
   * <p>Doubles, integers and booleans are JSON numbers and booleans;
   * everything else is a string. */
  JSON {
    @Override public RowSink sink(PrintWriter out) {
      return new BufferingSink(out) {
        @Override void print(List<Column> columns, List<Row> rows) {
          printJson(out, columns, rows);
        }

        @Override void printEmpty() {
          out.println("[]");
        }
      };
    }
  },

  /** Vertical output format.
   *
   * <p>Example:
   *
   * <blockquote><pre>
   * Row 1:
   *   ename: Jane
   *   deptno: 10
   * &nbsp;
   * Row 2:
   *   ename: Bob
   *   deptno: 10
   * &nbsp;
   * </pre></blockquote>
   */
  VERTICAL {
    @Override public RowSink sink(PrintWriter out) {
      return new StreamingSink(out) {
        @Override void print(List<Column> columns, Row row, int ordinal) {
          out.println("Row " + ordinal + ":");
          for (int i = 0; i < columns.size(); i++) {
            final Column column = columns.get(i);
            out.println("  " + column.name + ": "
                + column.type.display(row.get(i)));
          }
          out.println();
        }
      };
    }
  },

  /** Record output format; one line per row.
   *
   * <p>Example:
   *
   * <blockquote><pre>
   * ename: Jane, deptno: 10
   * ename: Bob, deptno: 10
   * </pre></blockquote>
   */
  RECORD {
    @Override public RowSink sink(PrintWriter out) {
      return new StreamingSink(out) {
        @Override void print(List<Column> columns, Row row, int ordinal) {
          final StringBuilder buf = new StringBuilder();
          for (int i = 0; i < columns.size(); i++) {
            final Column column = columns.get(i);
            buf.append(i > 0 ? ", " : "")
                .append(column.name)
                .append(": ")
                .append(column.type.display(row.get(i)));
          }
          out.println(buf);
        }
      };
    }
  };

  /** Message printed instead of an empty result. */
  public static final String NO_ROWS = "(No rows returned)";

  private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

  private static final CsvMapper CSV_MAPPER = new CsvMapper();

  /** Creates a sink that prints rows in this format to a writer. */
  public abstract RowSink sink(PrintWriter out);

  /** Formats a complete result set as a string. */
  public String format(List<Column> columns, Iterable<Row> rows) {
    final StringWriter sw = new StringWriter();
    final PrintWriter pw = new PrintWriter(sw);
    final RowSink sink = sink(pw);
    sink.start(columns);
    rows.forEach(sink::row);
    sink.end();
    pw.flush();
    return sw.toString();
  }

  /** Returns the name that a user types to select this format,
   * e.g. "csv". */
  public String displayName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns the names of all formats, e.g.
   * "table, csv, json, vertical, record". */
  public static String displayNames() {
    return Stream.of(values())
        .map(OutputFormat::displayName)
        .collect(Collectors.joining(", "));
  }

  /** Looks up a format by name, case-insensitively. */
  public static Optional<OutputFormat> lookup(@Nullable String name) {
    if (name == null) {
      return Optional.empty();
    }
    for (OutputFormat format : values()) {
      if (format.displayName().equalsIgnoreCase(name.trim())) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  /** Looks up a format by name, returning {@link #TABLE} if the name is null
   * or not recognized. */
  public static OutputFormat lookupOrDefault(@Nullable String name) {
    return lookup(name).orElse(TABLE);
  }

  private static void printTable(PrintWriter out, List<Column> columns,
      List<Row> rows) {
    final int n = columns.size();
    final int[] widths = new int[n];
    final List<String[]> lines = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      widths[i] = columns.get(i).name.length();
    }
    for (Row row : rows) {
      final String[] line = new String[n];
      for (int i = 0; i < n; i++) {
        line[i] = columns.get(i).type.display(row.get(i));
        widths[i] = Math.max(widths[i], line[i].length());
      }
      lines.add(line);
    }

    // Compute "+-----+---+"
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < n; i++) {
      buf.append("+").append(chars('-', widths[i] + 2));
    }
    buf.append("+");
    final String hyphens = flush(buf);

    // Print "| FOO | B |"
    out.println(hyphens);
    for (int i = 0; i < n; i++) {
      buf.append(i > 0 ? " | " : "| ")
          .append(pad(columns.get(i).name, widths[i], false));
    }
    buf.append(" |");
    out.println(flush(buf));
    out.println(hyphens);
    for (String[] line : lines) {
      for (int i = 0; i < n; i++) {
        buf.append(i > 0 ? " | " : "| ")
            .append(pad(line[i], widths[i], columns.get(i).type.isNumeric()));
      }
      buf.append(" |");
      out.println(flush(buf));
    }
    out.println(hyphens);
    out.println(rows.size() == 1 ? "(1 row)" : "(" + rows.size() + " rows)");
  }

  private static void printCsv(PrintWriter out, List<Column> columns,
      List<Row> rows) {
    final CsvSchema.Builder builder = CsvSchema.builder();
    for (Column column : columns) {
      builder.addColumn(column.name);
    }
    final CsvSchema schema = builder.build().withHeader();
    try (SequenceWriter writer =
             CSV_MAPPER.writerFor(String[].class)
                 .with(schema)
                 .with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
                 .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                 .writeValues(out)) {
      for (Row row : rows) {
        final String[] values = new String[columns.size()];
        for (int i = 0; i < values.length; i++) {
          values[i] = columns.get(i).type.display(row.get(i));
        }
        writer.write(values);
      }
    } catch (IOException e) {
      throw Throwables.propagate(e);
    }
    out.flush();
  }

  private static void printJson(PrintWriter out, List<Column> columns,
      List<Row> rows) {
    final ArrayNode array = JSON_MAPPER.createArrayNode();
    for (Row row : rows) {
      final ObjectNode object = array.addObject();
      for (int i = 0; i < columns.size(); i++) {
        final Column column = columns.get(i);
        final Object value = row.get(i);
        if (value == null) {
          object.putNull(column.name);
        } else if (value instanceof Double
            && column.type == ColumnType.DOUBLE) {
          object.put(column.name, (Double) value);
        } else if (value instanceof Integer
            && column.type == ColumnType.INTEGER) {
          object.put(column.name, (Integer) value);
        } else if (value instanceof Boolean
            && column.type == ColumnType.BOOLEAN) {
          object.put(column.name, (Boolean) value);
        } else {
          object.put(column.name, column.type.display(value));
        }
      }
    }
    try {
      out.println(
          JSON_MAPPER.writerWithDefaultPrettyPrinter()
              .writeValueAsString(array));
    } catch (IOException e) {
      throw Throwables.propagate(e);
    }
  }

  private static String pad(String s, int width, boolean right) {
    final int x = width - s.length();
    if (x <= 0) {
      return s;
    }
    return right ? chars(' ', x) + s : s + chars(' ', x);
  }

  private static String chars(char c, int count) {
    final char[] chars = new char[count];
    Arrays.fill(chars, c);
    return new String(chars);
  }

  /** Returns the contents of a StringBuilder and clears it for the next
   * use. */
  private static String flush(StringBuilder buf) {
    final String s = buf.toString();
    buf.setLength(0);
    return s;
  }

  /** Sink that holds every row until the end of the result set, because its
   * format needs to see all of them (to size columns, say). */
  private abstract static class BufferingSink implements RowSink {
    final PrintWriter out;
    private List<Column> columns = ImmutableList.of();
    private final List<Row> rows = new ArrayList<>();

    BufferingSink(PrintWriter out) {
      this.out = out;
    }

    @Override public void start(List<Column> columns) {
      this.columns = ImmutableList.copyOf(columns);
    }

    @Override public void row(Row row) {
      rows.add(row);
    }

    @Override public void end() {
      if (rows.isEmpty()) {
        printEmpty();
      } else {
        print(columns, rows);
      }
      out.flush();
    }

    abstract void print(List<Column> columns, List<Row> rows);

    void printEmpty() {
      out.println(NO_ROWS);
    }
  }

  /** Sink that prints each row as it arrives. */
  private abstract static class StreamingSink implements RowSink {
    final PrintWriter out;
    private List<Column> columns = ImmutableList.of();
    private int count;

    StreamingSink(PrintWriter out) {
      this.out = out;
    }

    @Override public void start(List<Column> columns) {
      this.columns = ImmutableList.copyOf(columns);
    }

    @Override public void row(Row row) {
      print(columns, row, ++count);
      out.flush();
    }

    @Override public void end() {
      if (count == 0) {
        out.println(NO_ROWS);
      }
      out.flush();
    }

    abstract void print(List<Column> columns, Row row, int ordinal);
  }
}

// End OutputFormat.java
