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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of a syntax tree node: a unique number plus the node's
 * {@link Span}.
 *
 * <p>Identities are minted from a process-wide counter, so no two calls to
 * {@link #of(Span)} ever return the same number, even when several trees
 * are being built on different threads.
 *
 * <p>The rule that keeps identities unique within a tree is this: when a
 * pass rebuilds a node whose content it did not change (for example because
 * one of its children was rewritten), the new node keeps the old node's
 * {@code NodeId}; when a pass creates a node that did not exist before, it
 * must call {@link #of(Span)} to get a fresh one. The {@code copy} methods
 * in {@link Ast} and the default methods of {@link Reducer} follow the first
 * half of the rule; {@link AstBuilder} callers are responsible for the
 * second.
 *
 * <p>{@code NodeId} takes no part in the structural equality of nodes; see
 * {@link AstNode}.
 */
public final class NodeId {
  private static final AtomicLong NEXT = new AtomicLong(1);

  public final long id;
  public final Span span;

  private NodeId(long id, Span span) {
    this.id = id;
    this.span = requireNonNull(span);
  }

  /** Mints a fresh identity. */
  public static NodeId of(Span span) {
    return new NodeId(NEXT.getAndIncrement(), span);
  }

  /**
   * Re-creates an identity that was minted earlier, for example by a tree
   * that has been written to JSON and is now being read back.
   *
   * <p>Advances the counter past {@code id}, so that identities minted later
   * in this process do not collide with it. {@link Long#MAX_VALUE} is
   * rejected, because the counter cannot move past it.
   */
  public static NodeId of(long id, Span span) {
    checkArgument(id > 0 && id < Long.MAX_VALUE,
        "node id must be positive and less than %s: %s", Long.MAX_VALUE, id);
    NEXT.accumulateAndGet(id + 1, Math::max);
    return new NodeId(id, span);
  }

  @Override public int hashCode() {
    return Long.hashCode(id);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof NodeId
        && this.id == ((NodeId) o).id
        && this.span.equals(((NodeId) o).span);
  }

  @Override public String toString() {
    return "#" + id + "@" + span;
  }
}

// End NodeId.java
