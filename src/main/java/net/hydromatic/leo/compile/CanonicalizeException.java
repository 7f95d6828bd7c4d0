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
package net.hydromatic.leo.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.leo.ast.Span;
import net.hydromatic.leo.util.LeoException;

/** An error occurred while canonicalizing a program. */
public class CanonicalizeException extends RuntimeException
    implements LeoException {
  private final Kind kind;
  private final Span span;

  public CanonicalizeException(Kind kind, String message, Span span) {
    super(message);
    this.kind = requireNonNull(kind);
    this.span = requireNonNull(span);
  }

  @Override public String toString() {
    return super.toString() + " at " + span;
  }

  public Kind kind() {
    return kind;
  }

  @Override public Span span() {
    return span;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return span.describeTo(buf)
        .append(" Error: ")
        .append(getMessage());
  }

  /** What went wrong. */
  public enum Kind {
    /** A compound assignment, such as "+=", whose left side is not a
     * variable, member, element or slice. */
    INVALID_ASSIGNMENT_TARGET,
    /** A tuple definition binds a different number of names than its
     * value has elements. */
    ARITY_MISMATCH,
    MALFORMED_GROUP_LITERAL,
    MALFORMED_ADDRESS_LITERAL,
    /** "Self", or ".x", used outside a circuit. */
    SELF_OUTSIDE_CIRCUIT
  }
}

// End CanonicalizeException.java
