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
import java.util.Arrays;
import java.util.List;

/** Values of one row of a result set, positionally aligned with its
 * {@link Column}s. Values may be null. */
public class Row {
  private final @Nullable Object[] values;

  private Row(@Nullable Object[] values) {
    this.values = values;
  }

  /** Creates a row from the given values. */
  public static Row of(@Nullable Object... values) {
    return new Row(values.clone());
  }

  /** Reads the current row of a result set, converting each value according
   * to its column's type. */
  public static Row read(ResultSet resultSet, List<Column> columns)
      throws SQLException {
    final @Nullable Object[] values = new Object[columns.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = columns.get(i).type.read(resultSet, i + 1);
    }
    return new Row(values);
  }

  public int size() {
    return values.length;
  }

  public @Nullable Object get(int i) {
    return values[i];
  }

  @Override public String toString() {
    return Arrays.toString(values);
  }
}

// End Row.java
