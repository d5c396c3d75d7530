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

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/** Name and type of a column in a result set. Immutable. */
public class Column {
  public final String name;
  public final ColumnType type;

  public Column(String name, ColumnType type) {
    this.name = requireNonNull(name, "name");
    this.type = requireNonNull(type, "type");
  }

  /** Creates the list of columns described by result set metadata. */
  public static List<Column> of(ResultSetMetaData metaData)
      throws SQLException {
    final int n = metaData.getColumnCount();
    final List<Column> columns = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      columns.add(
          new Column(metaData.getColumnLabel(i + 1),
              ColumnType.of(metaData.getColumnType(i + 1),
                  metaData.getColumnTypeName(i + 1))));
    }
    return columns;
  }

  @Override public String toString() {
    return name + ":" + type;
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Column
        && name.equals(((Column) o).name)
        && type == ((Column) o).type;
  }

  @Override public int hashCode() {
    return name.hashCode() * 31 + type.hashCode();
  }
}

// End Column.java
