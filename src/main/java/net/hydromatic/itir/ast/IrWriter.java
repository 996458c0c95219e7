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

import java.util.List;

/** Writes iterator IR nodes as strings, inserting parentheses where operator
 * precedence requires them. */
public class IrWriter {
  private final StringBuilder b = new StringBuilder();

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string. */
  public IrWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier. */
  public IrWriter id(String s) {
    b.append(s);
    return this;
  }

  /** Starts a new, indented line. */
  public IrWriter newline() {
    b.append("\n  ");
    return this;
  }

  /** Appends a node, given the precedence of the operators to its left and
   * right. */
  public IrWriter append(Ir.Node node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a list of nodes separated by a string. */
  public IrWriter appendAll(List<? extends Ir.Node> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(sep);
      }
      append(nodes.get(i), 0, 0);
    }
    return this;
  }

  /** Appends a call to an infix operator. */
  public IrWriter infix(int left, Ir.Node a0, Op op, Ir.Node a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    return append(a0, left, op.left)
        .append(op.padded)
        .append(a1, op.right, right);
  }

  /** Appends a call to a prefix operator, such as "·" (deref). */
  public IrWriter prefix(int left, String symbol, Ir.Node a, int right) {
    if (right >= Op.FUN_CALL.left) {
      return append("(").prefix(0, symbol, a, 0).append(")");
    }
    return append(symbol).append(a, Op.FUN_CALL.right, right);
  }

  /** Appends a call to a postfix operator, such as "[0]" (tuple access). */
  public IrWriter postfix(int left, Ir.Node a, String symbol, int right) {
    return append(a, left, Op.FUN_CALL.left).append(symbol);
  }
}

// End IrWriter.java
