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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import net.hydromatic.leo.ast.Ast;
import net.hydromatic.leo.compile.CanonicalizeException;
import net.hydromatic.leo.compile.Canonicalizer;
import net.hydromatic.leo.json.AstJson;
import org.apache.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Owns the syntax tree of one Leo program.
 *
 * <p>Canonicalizes the tree, and converts it to and from JSON, in memory or
 * in a file. Every operation either succeeds or throws and leaves the tree
 * as it was.
 */
public class SyntaxTree {
  private static final Logger LOGGER = Logger.getLogger(SyntaxTree.class);

  private final ImmutableMap<Prop, Object> props;
  private Ast.@Nullable Program program;

  /** Creates a SyntaxTree with default properties. */
  public SyntaxTree(Ast.Program program) {
    this(program, ImmutableMap.of());
  }

  /** Creates a SyntaxTree.
   *
   * @param program Program
   * @param props Properties; see {@link Prop}
   */
  public SyntaxTree(Ast.Program program, Map<Prop, Object> props) {
    this.program = requireNonNull(program);
    this.props = ImmutableMap.copyOf(props);
  }

  private Ast.Program program() {
    if (program == null) {
      throw new IllegalStateException("program has been taken by intoRepr");
    }
    return program;
  }

  private AstJson json() {
    return json(props);
  }

  private static AstJson json(Map<Prop, Object> props) {
    return new AstJson(Prop.PRETTY.booleanValue(props),
        Prop.FAIL_ON_UNKNOWN_PROPERTIES.booleanValue(props));
  }

  @Override public String toString() {
    return program().toString();
  }

  /** Rewrites the program into canonical form.
   *
   * <p>If canonicalization fails, the program is unchanged.
   *
   * @throws CanonicalizeException if the program contains a construct that
   * cannot be canonicalized */
  public void canonicalize() {
    // Assign only if the whole pass succeeds.
    this.program = Canonicalizer.canonicalize(program());
  }

  /** Returns the program. */
  public Ast.Program asRepr() {
    return program();
  }

  /** Returns the program, and detaches it from this SyntaxTree. After this
   * call, every other method of this SyntaxTree throws
   * {@link IllegalStateException}. */
  public Ast.Program intoRepr() {
    final Ast.Program program = program();
    this.program = null;
    return program;
  }

  /** Converts the program to a JSON string.
   *
   * @throws AstException of kind {@link AstException.Kind#JSON_ENCODE} if
   * the program cannot be converted */
  public String toJsonString() {
    try {
      return json().toJson(program());
    } catch (JsonProcessingException e) {
      throw new AstException(AstException.Kind.JSON_ENCODE,
          "cannot encode program: " + e.getOriginalMessage(), null, e);
    }
  }

  /** Writes the program as JSON to a file, creating or replacing it.
   *
   * @param directory Directory
   * @param fileName Name of the file within the directory
   * @return Path of the file written
   * @throws AstException if the file cannot be created or written
   */
  public Path toJsonFile(Path directory, String fileName) {
    final String json = toJsonString();
    final Path path = directory.resolve(fileName);
    final Writer writer;
    try {
      writer = Files.newBufferedWriter(path, Prop.charset(props));
    } catch (IOException e) {
      throw new AstException(AstException.Kind.CREATE_FILE,
          "cannot create file: " + e, path, e);
    }
    try (Writer w = writer) {
      w.write(json);
    } catch (IOException e) {
      throw new AstException(AstException.Kind.WRITE_FILE,
          "cannot write file: " + e, path, e);
    }
    LOGGER.debug("wrote program '" + program().name + "' to " + path);
    return path;
  }

  /** Creates a SyntaxTree from a JSON string, with default properties. */
  public static SyntaxTree fromJsonString(String json) {
    return fromJsonString(json, ImmutableMap.of());
  }

  /** Creates a SyntaxTree from a JSON string.
   *
   * @throws AstException of kind {@link AstException.Kind#JSON_DECODE} if
   * the string is not valid JSON, or does not describe a program */
  public static SyntaxTree fromJsonString(String json,
      Map<Prop, Object> props) {
    return new SyntaxTree(decode(json, props, null), props);
  }

  /** Creates a SyntaxTree from a JSON file, with default properties. */
  public static SyntaxTree fromJsonFile(Path path) {
    return fromJsonFile(path, ImmutableMap.of());
  }

  /** Creates a SyntaxTree from a JSON file.
   *
   * @throws AstException of kind {@link AstException.Kind#READ_FILE} if the
   * file cannot be read, or {@link AstException.Kind#JSON_DECODE} if its
   * contents do not describe a program */
  public static SyntaxTree fromJsonFile(Path path, Map<Prop, Object> props) {
    final String json;
    try {
      json = new String(Files.readAllBytes(path), Prop.charset(props));
    } catch (IOException e) {
      throw new AstException(AstException.Kind.READ_FILE,
          "cannot read file: " + e, path, e);
    }
    final Ast.Program program = decode(json, props, path);
    LOGGER.debug("read program '" + program.name + "' from " + path);
    return new SyntaxTree(program, props);
  }

  private static Ast.Program decode(String json, Map<Prop, Object> props,
      @Nullable Path path) {
    try {
      return json(props).toProgram(json);
    } catch (JsonProcessingException e) {
      throw new AstException(AstException.Kind.JSON_DECODE,
          "invalid JSON: " + e.getOriginalMessage(), path, e);
    } catch (AstJson.DecodeException e) {
      throw new AstException(AstException.Kind.JSON_DECODE,
          "invalid program: " + e.getMessage(), path, e);
    }
  }
}

// End SyntaxTree.java
