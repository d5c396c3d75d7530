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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Classification of a server column type, used to choose how values of
 * that column are read and displayed.
 *
 * <p>Only a few types have a dedicated conversion; everything else is
 * {@link #OTHER} and displays as {@link #UNSUPPORTED}. */
public enum ColumnType {
  TIMESTAMP {
    @Override @Nullable Object read(ResultSet resultSet, int i)
        throws SQLException {
      // Read as LocalDateTime; going through java.sql.Timestamp would shift
      // wall-clock times that fall in a JVM time zone's DST gap.
      return resultSet.getObject(i, LocalDateTime.class);
    }

    @Override String toText(Object value) {
      return TIMESTAMP_FORMAT.format((LocalDateTime) value);
    }
  },

  /** Timestamp with time zone. Values are normalized to UTC, so they
   * display the same way as {@link #TIMESTAMP}. */
  TIMESTAMP_WITH_TIME_ZONE {
    @Override @Nullable Object read(ResultSet resultSet, int i)
        throws SQLException {
      final OffsetDateTime dateTime =
          resultSet.getObject(i, OffsetDateTime.class);
      return dateTime == null
          ? null
          : dateTime.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
    }

    @Override String toText(Object value) {
      return TIMESTAMP_FORMAT.format((LocalDateTime) value);
    }
  },

  DOUBLE {
    @Override @Nullable Object read(ResultSet resultSet, int i)
        throws SQLException {
      final double d = resultSet.getDouble(i);
      return resultSet.wasNull() ? null : d;
    }

    @Override boolean isNumeric() {
      return true;
    }
  },

  VARCHAR {
    @Override @Nullable Object read(ResultSet resultSet, int i)
        throws SQLException {
      return resultSet.getString(i);
    }
  },

  BOOLEAN {
    @Override @Nullable Object read(ResultSet resultSet, int i)
        throws SQLException {
      final boolean b = resultSet.getBoolean(i);
      return resultSet.wasNull() ? null : b;
    }
  },

  INTEGER {
    @Override @Nullable Object read(ResultSet resultSet, int i)
        throws SQLException {
      final int n = resultSet.getInt(i);
      return resultSet.wasNull() ? null : n;
    }

    @Override boolean isNumeric() {
      return true;
    }
  },

  OTHER {
    @Override @Nullable Object read(ResultSet resultSet, int i)
        throws SQLException {
      // Only read to find out whether the value is null.
      return resultSet.getObject(i);
    }

    @Override String toText(Object value) {
      return UNSUPPORTED;
    }
  };

  /** Text displayed for a value whose type has no conversion. */
  public static final String UNSUPPORTED = "Unsupported Type";

  /** Text displayed for a null value. */
  public static final String NULL = "NULL";

  /** Microsecond precision, always rendered as UTC. */
  static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'",
          Locale.ROOT);

  /** Reads the value of column {@code i} (1-based) of the current row. */
  abstract @Nullable Object read(ResultSet resultSet, int i)
      throws SQLException;

  /** Converts a non-null value of this type to display text. */
  String toText(Object value) {
    return value.toString();
  }

  /** Converts a value of this type to display text, rendering null as
   * {@link #NULL}. */
  public String display(@Nullable Object value) {
    return value == null ? NULL : toText(value);
  }

  /** Whether values are right-aligned in a table. */
  boolean isNumeric() {
    return false;
  }

  /** Derives the type of a column from its JDBC type code and the
   * database-specific type name. */
  public static ColumnType of(int jdbcType, @Nullable String typeName) {
    final String name =
        typeName == null ? "" : typeName.toLowerCase(Locale.ROOT);
    switch (jdbcType) {
    case Types.TIMESTAMP:
      return name.equals("timestamptz")
          ? TIMESTAMP_WITH_TIME_ZONE
          : TIMESTAMP;
    case Types.TIMESTAMP_WITH_TIMEZONE:
      return TIMESTAMP_WITH_TIME_ZONE;
    case Types.DOUBLE:
      return DOUBLE;
    case Types.VARCHAR:
      return VARCHAR;
    case Types.BOOLEAN:
      return BOOLEAN;
    case Types.BIT:
      // PostgreSQL reports "bool" columns as BIT
      return name.equals("bool") ? BOOLEAN : OTHER;
    case Types.INTEGER:
      return INTEGER;
    default:
      return OTHER;
    }
  }
}

// End ColumnType.java
