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
package net.hydromatic.frost.graph;

import java.util.List;
import net.hydromatic.frost.eval.Values;

/**
 * Converts a graph to text.
 *
 * <p>For example,
 *
 * <pre>{@code
 * graph(%self : __torch__.M, %x : int):
 *   %2 : int = prim::Constant[value=2]()
 *   %3 : int = aten::add(%x, %2)
 *   return (%3)
 * }</pre>
 */
public class GraphWriter {
  private final StringBuilder buf = new StringBuilder();

  private GraphWriter() {}

  /** Writes a graph. */
  public static String write(Graph graph) {
    final GraphWriter w = new GraphWriter();
    w.buf.append("graph");
    w.values(graph.inputs(), true).append(":\n");
    w.nodes(graph.block(), 1);
    w.indent(1).append("return ");
    w.values(graph.outputs(), false).append('\n');
    return w.buf.toString();
  }

  /** Describes a single node, without its nested blocks. */
  public static String describe(Node n) {
    final GraphWriter w = new GraphWriter();
    w.node(n);
    return w.buf.toString();
  }

  private StringBuilder indent(int depth) {
    for (int i = 0; i < depth; i++) {
      buf.append("  ");
    }
    return buf;
  }

  private StringBuilder values(List<Value> values, boolean typed) {
    buf.append('(');
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) {
        buf.append(", ");
      }
      final Value value = values.get(i);
      buf.append(value);
      if (typed) {
        buf.append(" : ").append(value.type().moniker());
      }
    }
    return buf.append(')');
  }

  private void nodes(Block block, int depth) {
    for (Node n : block.nodes()) {
      indent(depth);
      node(n);
      buf.append('\n');
      for (int i = 0; i < n.blocks().size(); i++) {
        final Block b = n.blocks().get(i);
        indent(depth + 1).append("block").append(i);
        values(b.inputs(), true).append(":\n");
        nodes(b, depth + 2);
        indent(depth + 2).append("-> ");
        values(b.outputs(), false).append('\n');
      }
    }
  }

  private void node(Node n) {
    final List<Value> outputs = n.outputs();
    for (int i = 0; i < outputs.size(); i++) {
      final Value output = outputs.get(i);
      buf.append(i > 0 ? ", " : "")
          .append(output)
          .append(" : ")
          .append(output.type().moniker());
    }
    if (!outputs.isEmpty()) {
      buf.append(" = ");
    }
    buf.append(n.op().opName);
    if (n.hasValue()) {
      buf.append("[value=")
          .append(Values.toLiteralString(n.value()))
          .append(']');
    } else if (n.hasName()) {
      buf.append("[name=\"").append(n.name()).append("\"]");
    }
    values(n.inputs(), false);
  }
}

// End GraphWriter.java
