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
package net.hydromatic.questcli;

import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

import java.util.List;

import static java.util.Objects.requireNonNull;

/** Adapts {@link SqlCompleter} to JLine's {@link Completer} interface. */
class JLineCompleter implements Completer {
  private final SqlCompleter completer;

  JLineCompleter(SqlCompleter completer) {
    this.completer = requireNonNull(completer, "completer");
  }

  @Override public void complete(LineReader reader, ParsedLine line,
      List<Candidate> candidates) {
    final SqlCompleter.Completion completion =
        completer.complete(line.line(), line.cursor());
    for (String candidate : completion.candidates) {
      candidates.add(new Candidate(candidate));
    }
  }
}

// End JLineCompleter.java
