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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.lang.reflect.Proxy;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.List;

import static net.hydromatic.questcli.util.TestUtils.isLines;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Tests for {@link OutputFormat} and {@link ColumnType}.
 */
public class OutputFormatTest {
  private static final List<Column> EMP =
      ImmutableList.of(new Column("ename", ColumnType.VARCHAR),
          new Column("deptno", ColumnType.INTEGER));

  private static final List<Row> EMP_ROWS =
      ImmutableList.of(Row.of("Jane", 10), Row.of("Bob", 10));

  private static final List<Column> NULLS =
      ImmutableList.of(new Column("i", ColumnType.INTEGER),
          new Column("s", ColumnType.VARCHAR),
          new Column("d", ColumnType.DOUBLE),
          new Column("b", ColumnType.BOOLEAN),
          new Column("t", ColumnType.TIMESTAMP),
          new Column("o", ColumnType.OTHER));

  private static final LocalDateTime TS =
      LocalDateTime.of(2024, 1, 2, 3, 4, 5, 123_456_000);

  @Test void testTable() {
    assertThat(OutputFormat.TABLE.format(EMP, EMP_ROWS),
        isLines("+-------+--------+",
            "| ename | deptno |",
            "+-------+--------+",
            "| Jane  |     10 |",
            "| Bob   |     10 |",
            "+-------+--------+",
            "(2 rows)"));
  }

  @Test void testTableOneRow() {
    final List<Column> columns =
        ImmutableList.of(new Column("?column?", ColumnType.INTEGER));
    assertThat(
        OutputFormat.TABLE.format(columns, ImmutableList.of(Row.of(1))),
        isLines("+----------+",
            "| ?column? |",
            "+----------+",
            "|        1 |",
            "+----------+",
            "(1 row)"));
  }

  /** Every format prints its "empty" representation for a result set with
   * no rows, and never a bare header. */
  @Test void testEmpty() {
    for (OutputFormat format : OutputFormat.values()) {
      final String s = format.format(EMP, ImmutableList.of());
      if (format == OutputFormat.JSON) {
        assertThat(s, isLines("[]"));
      } else {
        assertThat(format.name(), s, isLines(OutputFormat.NO_ROWS));
      }
    }
  }

  /** Null is rendered as "NULL" for every column type, including types that
   * cannot otherwise be displayed. */
  @Test void testNulls() {
    final List<Row> rows =
        ImmutableList.of(Row.of(null, null, null, null, null, null));
    assertThat(OutputFormat.RECORD.format(NULLS, rows),
        isLines("i: NULL, s: NULL, d: NULL, b: NULL, t: NULL, o: NULL"));
    assertThat(OutputFormat.CSV.format(NULLS, rows),
        isLines("i,s,d,b,t,o", "NULL,NULL,NULL,NULL,NULL,NULL"));
    assertThat(OutputFormat.VERTICAL.format(NULLS, rows),
        isLines("Row 1:",
            "  i: NULL",
            "  s: NULL",
            "  d: NULL",
            "  b: NULL",
            "  t: NULL",
            "  o: NULL",
            ""));
    assertThat(OutputFormat.TABLE.format(NULLS, rows),
        containsString("| NULL | NULL | NULL | NULL | NULL | NULL |"));
  }

  @Test void testJsonNulls() throws IOException {
    final String s =
        OutputFormat.JSON.format(NULLS,
            ImmutableList.of(Row.of(null, null, null, null, null, null)));
    final JsonNode node = new ObjectMapper().readTree(s);
    assertThat(node.isArray(), is(true));
    assertThat(node.size(), is(1));
    for (Column column : NULLS) {
      assertThat(column.name, node.get(0).get(column.name).isNull(), is(true));
    }
  }

  /** An empty string is not confused with null. */
  @Test void testEmptyString() {
    final List<Column> columns =
        ImmutableList.of(new Column("s", ColumnType.VARCHAR));
    assertThat(
        OutputFormat.RECORD.format(columns, ImmutableList.of(Row.of(""))),
        isLines("s: "));
  }

  @Test void testJsonNativeTypes() throws IOException {
    final List<Column> columns =
        ImmutableList.of(new Column("i", ColumnType.INTEGER),
            new Column("d", ColumnType.DOUBLE),
            new Column("b", ColumnType.BOOLEAN),
            new Column("s", ColumnType.VARCHAR),
            new Column("t", ColumnType.TIMESTAMP));
    final String s =
        OutputFormat.JSON.format(columns,
            ImmutableList.of(Row.of(7, 1.5d, true, "x", TS)));
    final JsonNode row = new ObjectMapper().readTree(s).get(0);
    assertThat(row.get("i").isInt(), is(true));
    assertThat(row.get("i").intValue(), is(7));
    assertThat(row.get("d").isDouble(), is(true));
    assertThat(row.get("d").doubleValue(), is(1.5d));
    assertThat(row.get("b").isBoolean(), is(true));
    assertThat(row.get("s").textValue(), is("x"));
    assertThat(row.get("t").textValue(), is("2024-01-02T03:04:05.123456Z"));
  }

  @Test void testCsvQuoting() {
    final List<Column> columns =
        ImmutableList.of(new Column("a", ColumnType.INTEGER),
            new Column("b", ColumnType.VARCHAR));
    final List<Row> rows =
        ImmutableList.of(Row.of(1, "x,y"), Row.of(2, "say \"hi\""),
            Row.of(3, "plain"));
    assertThat(OutputFormat.CSV.format(columns, rows),
        isLines("a,b",
            "1,\"x,y\"",
            "2,\"say \"\"hi\"\"\"",
            "3,plain"));
  }

  @Test void testVertical() {
    assertThat(OutputFormat.VERTICAL.format(EMP, EMP_ROWS),
        isLines("Row 1:",
            "  ename: Jane",
            "  deptno: 10",
            "",
            "Row 2:",
            "  ename: Bob",
            "  deptno: 10",
            ""));
  }

  @Test void testRecord() {
    assertThat(OutputFormat.RECORD.format(EMP, EMP_ROWS),
        isLines("ename: Jane, deptno: 10",
            "ename: Bob, deptno: 10"));
  }

  @Test void testTimestamp() {
    assertThat(ColumnType.TIMESTAMP.display(TS),
        is("2024-01-02T03:04:05.123456Z"));
    assertThat(
        ColumnType.TIMESTAMP.display(LocalDateTime.of(2024, 1, 2, 3, 4)),
        is("2024-01-02T03:04:00.000000Z"));
    assertThat(ColumnType.TIMESTAMP_WITH_TIME_ZONE.display(TS),
        is("2024-01-02T03:04:05.123456Z"));
  }

  /** A value of a type without a conversion renders as a placeholder, and
   * does not abort the row. */
  /** A timestamp is read as a {@link LocalDateTime}, not via
   * {@link java.sql.Timestamp}, so a wall-clock time inside a daylight-saving
   * gap (such as New York's in March 2024) comes back unchanged whatever the
   * JVM's time zone. */
  @Test void testReadTimestampInGap() throws SQLException {
    final LocalDateTime gap = LocalDateTime.of(2024, 3, 10, 2, 30);
    final ResultSet resultSet = timestamps(gap, null);
    final Object value = ColumnType.TIMESTAMP.read(resultSet, 1);
    assertThat(value, is(gap));
    assertThat(ColumnType.TIMESTAMP.display(value),
        is("2024-03-10T02:30:00.000000Z"));
    assertThat(ColumnType.TIMESTAMP.read(resultSet, 2) == null, is(true));
  }

  /** Returns a result set whose columns hold the given values, and which
   * supports only {@link ResultSet#getObject(int, Class)}. */
  private static ResultSet timestamps(LocalDateTime... values) {
    return (ResultSet) Proxy.newProxyInstance(
        OutputFormatTest.class.getClassLoader(),
        new Class[]{ResultSet.class}, (proxy, method, args) -> {
          if (method.getName().equals("getObject")
              && args.length == 2
              && args[1] == LocalDateTime.class) {
            return values[(Integer) args[0] - 1];
          }
          throw new SQLFeatureNotSupportedException(method.getName());
        });
  }

  @Test void testUnsupported() {
    final List<Column> columns =
        ImmutableList.of(new Column("o", ColumnType.OTHER),
            new Column("i", ColumnType.INTEGER));
    final String s =
        OutputFormat.RECORD.format(columns,
            ImmutableList.of(Row.of(new byte[] {1, 2}, 5)));
    assertThat(s, isLines("o: Unsupported Type, i: 5"));
    assertThat(s, not(containsString("[B")));
  }

  @Test void testColumnTypeOf() {
    assertThat(ColumnType.of(Types.TIMESTAMP, "timestamp"),
        is(ColumnType.TIMESTAMP));
    assertThat(ColumnType.of(Types.TIMESTAMP, "timestamptz"),
        is(ColumnType.TIMESTAMP_WITH_TIME_ZONE));
    assertThat(ColumnType.of(Types.TIMESTAMP_WITH_TIMEZONE, null),
        is(ColumnType.TIMESTAMP_WITH_TIME_ZONE));
    assertThat(ColumnType.of(Types.DOUBLE, "float8"), is(ColumnType.DOUBLE));
    assertThat(ColumnType.of(Types.VARCHAR, "varchar"),
        is(ColumnType.VARCHAR));
    assertThat(ColumnType.of(Types.BOOLEAN, "boolean"),
        is(ColumnType.BOOLEAN));
    assertThat(ColumnType.of(Types.BIT, "bool"), is(ColumnType.BOOLEAN));
    assertThat(ColumnType.of(Types.BIT, "bit"), is(ColumnType.OTHER));
    assertThat(ColumnType.of(Types.INTEGER, "int4"), is(ColumnType.INTEGER));
    assertThat(ColumnType.of(Types.BIGINT, "int8"), is(ColumnType.OTHER));
    assertThat(ColumnType.of(Types.BINARY, "bytea"), is(ColumnType.OTHER));
  }

  @Test void testLookup() {
    assertThat(OutputFormat.lookup("csv").isPresent(), is(true));
    assertThat(OutputFormat.lookup("JSON").get(), is(OutputFormat.JSON));
    assertThat(OutputFormat.lookup(" Vertical ").get(),
        is(OutputFormat.VERTICAL));
    assertThat(OutputFormat.lookup("xml").isPresent(), is(false));
    assertThat(OutputFormat.lookup(null).isPresent(), is(false));
    assertThat(OutputFormat.lookupOrDefault("xml"), is(OutputFormat.TABLE));
    assertThat(OutputFormat.displayNames(),
        is("table, csv, json, vertical, record"));
  }
}

// End OutputFormatTest.java
