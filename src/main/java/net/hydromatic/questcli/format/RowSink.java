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

import java.util.List;

/** Receives a result set one row at a time.
 *
 * <p>Calls arrive in the order {@link #start}, any number of {@link #row},
 * {@link #end}. A sink may print each row as it arrives or hold rows until
 * {@link #end}, depending on whether its format needs to see every row
 * first. */
public interface RowSink {
  /** Called before the first row. */
  void start(List<Column> columns);

  /** Called for each row, in the order the server returned them. */
  void row(Row row);

  /** Called after the last row; also after a partial result set if reading
   * was abandoned because of an error. */
  void end();
}

// End RowSink.java
