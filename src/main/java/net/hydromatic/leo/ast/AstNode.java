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
package net.hydromatic.leo.ast;

import static java.util.Objects.requireNonNull;

/**
 * Abstract syntax tree node.
 *
 * <p>Every node carries a {@link NodeId} (unique number and source span)
 * and an {@link Op} that says which kind of node it is, or which operator it
 * applies.
 *
 * <p>Equality is structural, and deliberately ignores {@link #nodeId}: two
 * nodes are equal if they have the same class, op and contents, recursively.
 * That way a tree that has been through a pass that mints new identities, or
 * through JSON, still equals a tree that was built directly. Use
 * {@code ==} or compare {@link #nodeId} when identity matters.
 */
public abstract class AstNode {
  public final NodeId nodeId;
  public final Op op;

  AstNode(NodeId nodeId, Op op) {
    this.nodeId = requireNonNull(nodeId);
    this.op = requireNonNull(op);
  }

  /** Returns the source span of this node. */
  public final Span span() {
    return nodeId.span;
  }

  /** Returns the unique number of this node. */
  public final long id() {
    return nodeId.id;
  }

  /**
   * Converts this node into Leo source code.
   *
   * <p>The purpose of this string is debugging and testing. Derived classes
   * override {@link #unparse(AstWriter, int, int)}, not this method.
   */
  @Override public final String toString() {
    return unparse(new AstWriter());
  }

  /** Converts this node into Leo source code, with a given writer. */
  public final String unparse(AstWriter w) {
    return unparse(w, 0, 0).toString();
  }

  abstract AstWriter unparse(AstWriter w, int left, int right);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
   * to the type of this node.
   */
  public abstract void accept(Visitor visitor);

  // Sub-classes must implement both, and must not look at nodeId.
  @Override public abstract boolean equals(Object o);

  @Override public abstract int hashCode();
}

// End AstNode.java
