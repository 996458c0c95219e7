/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.itir.ast;

import java.util.Objects;

/** Position in the source of the embedded program that a node came from.
 *
 * <p>The front end fills this in; nodes created by passes carry
 * {@link #ZERO}. */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a Pos that spans a single line. */
  public static Pos of(String file, int line, int startColumn, int endColumn) {
    return new Pos(file, line, startColumn, line, endColumn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.file.equals(((Pos) o).file)
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn + 1 || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }
}

// End Pos.java
