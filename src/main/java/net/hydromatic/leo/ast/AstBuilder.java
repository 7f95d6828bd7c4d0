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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes.
 *
 * <p>Every method takes the {@link NodeId} of the node it creates. Use
 * {@link NodeId#of(Span)} to mint a new identity. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // declarations

  /** Creates a program.
   *
   * @throws IllegalArgumentException if two circuits, or two functions, have
   * the same name */
  public Ast.Program program(NodeId nodeId, String name,
      Iterable<Ast.Import> imports, Iterable<Ast.Circuit> circuits,
      Iterable<Ast.Function> functions, Iterable<Ast.Definition> globalConsts) {
    final Map<String, Ast.Circuit> circuitMap = new LinkedHashMap<>();
    for (Ast.Circuit circuit : circuits) {
      if (circuitMap.put(circuit.name.name, circuit) != null) {
        throw new IllegalArgumentException("duplicate circuit "
            + circuit.name.name);
      }
    }
    final Map<String, Ast.Function> functionMap = new LinkedHashMap<>();
    for (Ast.Function function : functions) {
      if (functionMap.put(function.name.name, function) != null) {
        throw new IllegalArgumentException("duplicate function "
            + function.name.name);
      }
    }
    return new Ast.Program(nodeId, name, ImmutableList.copyOf(imports),
        ImmutableMap.copyOf(circuitMap), ImmutableMap.copyOf(functionMap),
        ImmutableList.copyOf(globalConsts));
  }

  public Ast.Import importPath(NodeId nodeId, Iterable<Ast.Id> path,
      Ast.@Nullable Id alias) {
    return new Ast.Import(nodeId, ImmutableList.copyOf(path), alias,
        ImmutableList.of(), false);
  }

  public Ast.Import importStar(NodeId nodeId, Iterable<Ast.Id> path) {
    return new Ast.Import(nodeId, ImmutableList.copyOf(path), null,
        ImmutableList.of(), true);
  }

  public Ast.Import importSymbols(NodeId nodeId, Iterable<Ast.Id> path,
      Iterable<Ast.ImportSymbol> symbols) {
    return new Ast.Import(nodeId, ImmutableList.copyOf(path), null,
        ImmutableList.copyOf(symbols), false);
  }

  public Ast.ImportSymbol importSymbol(NodeId nodeId, Ast.Id name,
      Ast.@Nullable Id alias) {
    return new Ast.ImportSymbol(nodeId, name, alias);
  }

  public Ast.Circuit circuit(NodeId nodeId, Ast.Id name,
      Iterable<Ast.Member> members, Iterable<Ast.Function> functions) {
    return new Ast.Circuit(nodeId, name, ImmutableList.copyOf(members),
        ImmutableList.copyOf(functions));
  }

  public Ast.Member member(NodeId nodeId, Ast.Id name, Ast.Type type) {
    return new Ast.Member(nodeId, name, type);
  }

  public Ast.Function function(NodeId nodeId,
      Iterable<Ast.Annotation> annotations, Ast.Id name,
      Iterable<Ast.Param> params, Ast.@Nullable Type output, Ast.Block body) {
    return new Ast.Function(nodeId, ImmutableList.copyOf(annotations), name,
        ImmutableList.copyOf(params), output, body);
  }

  public Ast.Param param(NodeId nodeId, Ast.Id name, Ast.Type type) {
    return new Ast.Param(nodeId, name, type, false, false);
  }

  public Ast.Param constParam(NodeId nodeId, Ast.Id name, Ast.Type type) {
    return new Ast.Param(nodeId, name, type, true, false);
  }

  public Ast.Param mutParam(NodeId nodeId, Ast.Id name, Ast.Type type) {
    return new Ast.Param(nodeId, name, type, false, true);
  }

  /** Creates the "self" parameter of a method. */
  public Ast.Param selfParam(NodeId nodeId, boolean mutable) {
    return new Ast.Param(nodeId, id(nodeId.span, Ast.Id.SELF),
        selfType(NodeId.of(nodeId.span)), false, mutable);
  }

  public Ast.Annotation annotation(NodeId nodeId, Ast.Id name,
      Iterable<String> arguments) {
    return new Ast.Annotation(nodeId, name, ImmutableList.copyOf(arguments));
  }

  // statements

  public Ast.Return return_(NodeId nodeId, Ast.Exp exp) {
    return new Ast.Return(nodeId, exp);
  }

  /** Creates a "let" or "const" definition. */
  public Ast.Definition definition(NodeId nodeId, Op op,
      Iterable<Ast.VariableName> names, Ast.@Nullable Type type,
      Ast.Exp value) {
    return new Ast.Definition(nodeId, op, ImmutableList.copyOf(names), type,
        value);
  }

  public Ast.Definition let(NodeId nodeId, Ast.VariableName name,
      Ast.@Nullable Type type, Ast.Exp value) {
    return definition(nodeId, Op.LET, ImmutableList.of(name), type, value);
  }

  public Ast.Definition const_(NodeId nodeId, Ast.VariableName name,
      Ast.@Nullable Type type, Ast.Exp value) {
    return definition(nodeId, Op.CONST, ImmutableList.of(name), type, value);
  }

  public Ast.VariableName variableName(NodeId nodeId, Ast.Id name,
      boolean mutable) {
    return new Ast.VariableName(nodeId, name, mutable);
  }

  /** Creates an assignment; {@code op} is {@link Op#ASSIGN} or a compound
   * assignment operator such as {@link Op#ADD_ASSIGN}. */
  public Ast.Assign assign(NodeId nodeId, Op op, Ast.Exp target,
      Ast.Exp value) {
    return new Ast.Assign(nodeId, op, target, value);
  }

  public Ast.Assign assign(NodeId nodeId, Ast.Exp target, Ast.Exp value) {
    return assign(nodeId, Op.ASSIGN, target, value);
  }

  public Ast.Conditional conditional(NodeId nodeId, Ast.Exp condition,
      Ast.Block block, Ast.@Nullable Stmt next) {
    return new Ast.Conditional(nodeId, condition, block, next);
  }

  public Ast.Iteration iteration(NodeId nodeId, Ast.Id variable,
      Ast.Exp start, Ast.Exp stop, boolean inclusive, Ast.Block block) {
    return new Ast.Iteration(nodeId, variable, start, stop, inclusive, block);
  }

  public Ast.Console consoleAssert(NodeId nodeId, Ast.Exp exp) {
    return new Ast.Console(nodeId, Op.CONSOLE_ASSERT, null,
        ImmutableList.of(exp));
  }

  public Ast.Console consoleLog(NodeId nodeId, String format,
      Iterable<Ast.Exp> args) {
    return new Ast.Console(nodeId, Op.CONSOLE_LOG, format,
        ImmutableList.copyOf(args));
  }

  public Ast.Console consoleError(NodeId nodeId, String format,
      Iterable<Ast.Exp> args) {
    return new Ast.Console(nodeId, Op.CONSOLE_ERROR, format,
        ImmutableList.copyOf(args));
  }

  /** Creates a console statement of a given kind. */
  public Ast.Console console(NodeId nodeId, Op op, @Nullable String format,
      Iterable<Ast.Exp> args) {
    return new Ast.Console(nodeId, op, format, ImmutableList.copyOf(args));
  }

  public Ast.ExpressionStmt expressionStmt(NodeId nodeId, Ast.Exp exp) {
    return new Ast.ExpressionStmt(nodeId, exp);
  }

  public Ast.Block block(NodeId nodeId, Iterable<? extends Ast.Stmt> stmts) {
    return new Ast.Block(nodeId, ImmutableList.copyOf(stmts));
  }

  // expressions

  public Ast.Literal boolLiteral(NodeId nodeId, boolean b) {
    return new Ast.Literal(nodeId, Op.BOOL_LITERAL, String.valueOf(b), null);
  }

  /** Creates an integer literal with a type suffix, such as "5u8". */
  public Ast.Literal intLiteral(NodeId nodeId, String value, Op intType) {
    return new Ast.Literal(nodeId, Op.INT_LITERAL, value,
        requireNonNull(intType));
  }

  /** Creates a number without a type suffix, such as "5". */
  public Ast.Literal implicitLiteral(NodeId nodeId, String value) {
    return new Ast.Literal(nodeId, Op.IMPLICIT_LITERAL, value, null);
  }

  public Ast.Literal fieldLiteral(NodeId nodeId, String value) {
    return new Ast.Literal(nodeId, Op.FIELD_LITERAL, value, null);
  }

  /** Creates a group literal as written, such as "2group" or
   * "(0, _)group". */
  public Ast.Literal groupLiteral(NodeId nodeId, String text) {
    return new Ast.Literal(nodeId, Op.GROUP_LITERAL, text, null);
  }

  public Ast.Literal addressLiteral(NodeId nodeId, String text) {
    return new Ast.Literal(nodeId, Op.ADDRESS_LITERAL, text, null);
  }

  public Ast.Literal stringLiteral(NodeId nodeId, String value) {
    return new Ast.Literal(nodeId, Op.STRING_LITERAL, value, null);
  }

  public Ast.Literal charLiteral(NodeId nodeId, String value) {
    return new Ast.Literal(nodeId, Op.CHAR_LITERAL, value, null);
  }

  /** Creates a literal of a given kind. */
  public Ast.Literal literal(NodeId nodeId, Op op, String value,
      @Nullable Op intType) {
    return new Ast.Literal(nodeId, op, value, intType);
  }

  /** Creates a group literal that is a multiple of the generator. */
  public Ast.GroupLiteral groupScalar(NodeId nodeId, String scalar) {
    return new Ast.GroupLiteral(nodeId, requireNonNull(scalar), null, null);
  }

  /** Creates a group literal that is a point. */
  public Ast.GroupLiteral groupPoint(NodeId nodeId, Ast.GroupCoordinate x,
      Ast.GroupCoordinate y) {
    return new Ast.GroupLiteral(nodeId, null, requireNonNull(x),
        requireNonNull(y));
  }

  public Ast.Id id(NodeId nodeId, String name) {
    return new Ast.Id(nodeId, name);
  }

  /** Creates an identifier with a new identity. */
  public Ast.Id id(Span span, String name) {
    return new Ast.Id(NodeId.of(span), name);
  }

  public Ast.ImplicitMember implicitMember(NodeId nodeId, Ast.Id name) {
    return new Ast.ImplicitMember(nodeId, name);
  }

  public Ast.Unary unary(NodeId nodeId, Op op, Ast.Exp inner) {
    return new Ast.Unary(nodeId, op, inner);
  }

  public Ast.Binary binary(NodeId nodeId, Op op, Ast.Exp left,
      Ast.Exp right) {
    return new Ast.Binary(nodeId, op, left, right);
  }

  public Ast.Ternary ternary(NodeId nodeId, Ast.Exp condition,
      Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.Ternary(nodeId, condition, ifTrue, ifFalse);
  }

  public Ast.Call call(NodeId nodeId, Ast.Exp function,
      Iterable<? extends Ast.Exp> args) {
    return new Ast.Call(nodeId, function, ImmutableList.copyOf(args));
  }

  public Ast.ArrayInline arrayInline(NodeId nodeId,
      Iterable<? extends Ast.Exp> elements) {
    return new Ast.ArrayInline(nodeId, ImmutableList.copyOf(elements));
  }

  public Ast.ArrayInit arrayInit(NodeId nodeId, Ast.Exp element,
      List<Integer> dimensions) {
    return new Ast.ArrayInit(nodeId, element, ImmutableList.copyOf(dimensions));
  }

  public Ast.TupleInit tupleInit(NodeId nodeId,
      Iterable<? extends Ast.Exp> elements) {
    return new Ast.TupleInit(nodeId, ImmutableList.copyOf(elements));
  }

  public Ast.CircuitInit circuitInit(NodeId nodeId, Ast.Id name,
      Iterable<Ast.CircuitField> fields) {
    return new Ast.CircuitInit(nodeId, name, ImmutableList.copyOf(fields));
  }

  /** Creates a field of a circuit literal; if {@code value} is null, the
   * field has the value of the variable of the same name. */
  public Ast.CircuitField circuitField(NodeId nodeId, Ast.Id name,
      Ast.@Nullable Exp value) {
    return new Ast.CircuitField(nodeId, name, value);
  }

  public Ast.ArrayAccess arrayAccess(NodeId nodeId, Ast.Exp array,
      Ast.Exp index) {
    return new Ast.ArrayAccess(nodeId, array, index);
  }

  public Ast.ArrayRangeAccess arrayRangeAccess(NodeId nodeId, Ast.Exp array,
      Ast.@Nullable Exp left, Ast.@Nullable Exp right) {
    return new Ast.ArrayRangeAccess(nodeId, array, left, right);
  }

  public Ast.TupleAccess tupleAccess(NodeId nodeId, Ast.Exp tuple,
      int index) {
    return new Ast.TupleAccess(nodeId, tuple, index);
  }

  public Ast.MemberAccess memberAccess(NodeId nodeId, Ast.Exp inner,
      Ast.Id name) {
    return new Ast.MemberAccess(nodeId, inner, name);
  }

  public Ast.StaticAccess staticAccess(NodeId nodeId, Ast.Exp inner,
      Ast.Id name) {
    return new Ast.StaticAccess(nodeId, inner, name);
  }

  public Ast.Cast cast(NodeId nodeId, Ast.Exp inner, Ast.Type type) {
    return new Ast.Cast(nodeId, inner, type);
  }

  // types

  public Ast.PrimitiveType primitiveType(NodeId nodeId, Op op) {
    return new Ast.PrimitiveType(nodeId, op);
  }

  public Ast.ArrayType arrayType(NodeId nodeId, Ast.Type element,
      List<Integer> dimensions) {
    return new Ast.ArrayType(nodeId, element,
        ImmutableList.copyOf(dimensions));
  }

  public Ast.TupleType tupleType(NodeId nodeId,
      Iterable<? extends Ast.Type> types) {
    return new Ast.TupleType(nodeId, ImmutableList.copyOf(types));
  }

  public Ast.NamedType namedType(NodeId nodeId, Ast.Id name) {
    return new Ast.NamedType(nodeId, name);
  }

  public Ast.SelfType selfType(NodeId nodeId) {
    return new Ast.SelfType(nodeId);
  }
}

// End AstBuilder.java
