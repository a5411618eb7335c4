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

/** Kinds of {@link Node}. */
public enum Op {
  // structural; one of each per block, not in the block's node list
  PARAM("prim::Param", true),
  RETURN("prim::Return", false),

  CONSTANT("prim::Constant", true),

  // attributes
  /** Reads an attribute; input is the receiver. */
  GET_ATTR("prim::GetAttr", true),
  /** Writes an attribute; inputs are the receiver and the new value. */
  SET_ATTR("prim::SetAttr", false),
  /** Calls a method; inputs are the receiver and the arguments. */
  CALL_METHOD("prim::CallMethod", false),

  // arithmetic and comparison
  ADD("aten::add", true),
  SUB("aten::sub", true),
  MUL("aten::mul", true),
  EQ("aten::eq", true),
  LT("aten::lt", true),

  // control
  /** Conditional; one input, two blocks, outputs are those of the block
   * taken. */
  IF("prim::If", false),
  /** Loop; inputs are the trip count and the initial values of the
   * loop-carried values; the block has the iteration number and the
   * loop-carried values as inputs. */
  LOOP("prim::Loop", false),
  /** Throws an exception whose message is the node's name. */
  RAISE("prim::RaiseException", false),

  // tuples
  TUPLE_CONSTRUCT("prim::TupleConstruct", true),
  /** Decomposes a tuple into one output per element. */
  TUPLE_UNPACK("prim::TupleUnpack", true);

  /** Name used when printing a graph. */
  public final String opName;

  /**
   * Whether a node of this kind has no side effect other than producing its
   * outputs. Nodes that own blocks are never pure; whether they can be
   * removed depends on what is in their blocks.
   */
  public final boolean pure;

  Op(String opName, boolean pure) {
    this.opName = opName;
    this.pure = pure;
  }

  /** Returns whether this is an arithmetic or comparison operator. */
  public boolean isArithmetic() {
    switch (this) {
      case ADD:
      case SUB:
      case MUL:
      case EQ:
      case LT:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
