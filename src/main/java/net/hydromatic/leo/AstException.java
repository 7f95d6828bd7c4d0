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
package net.hydromatic.leo;

import static java.util.Objects.requireNonNull;

import java.nio.file.Path;
import net.hydromatic.leo.ast.Span;
import net.hydromatic.leo.util.LeoException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An error occurred while converting a syntax tree to or from JSON, or
 * while reading or writing a file that holds one. */
public class AstException extends RuntimeException implements LeoException {
  private final Kind kind;
  private final @Nullable Path path;

  public AstException(Kind kind, String message, @Nullable Path path,
      Throwable cause) {
    super(message, requireNonNull(cause));
    this.kind = requireNonNull(kind);
    this.path = path;
  }

  public Kind kind() {
    return kind;
  }

  /** Returns the file that was being read or written, or null. */
  public @Nullable Path path() {
    return path;
  }

  /** Returns {@link Span#ZERO}; these errors are not related to a node. */
  @Override public Span span() {
    return Span.ZERO;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    if (path != null) {
      buf.append(path).append(": ");
    }
    return buf.append(kind.description)
        .append(" Error: ")
        .append(getMessage());
  }

  @Override public String toString() {
    return path == null ? super.toString() : super.toString() + " in " + path;
  }

  /** What went wrong. */
  public enum Kind {
    JSON_ENCODE("encode"),
    JSON_DECODE("decode"),
    CREATE_FILE("create file"),
    WRITE_FILE("write file"),
    READ_FILE("read file");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }
}

// End AstException.java
