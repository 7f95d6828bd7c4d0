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
import static net.hydromatic.leo.util.Static.transformEager;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Walks a syntax tree in post-order, applying a {@link Reducer} to each node.
 *
 * <p>Children are reduced in source order before their parent. Within a
 * program, the order is imports, circuits, functions, then global constants.
 * Within a circuit, {@link Reducer#enterCircuit} is called before the
 * circuit's children are reduced and {@link Reducer#exitCircuit} after the
 * circuit itself is reduced.
 *
 * <p>The director catches nothing; the first exception thrown by the
 * reducer aborts the walk.
 */
public class Director {
  private final Reducer reducer;

  public Director(Reducer reducer) {
    this.reducer = requireNonNull(reducer);
  }

  /** Reduces a program. */
  public Ast.Program reduceProgram(Ast.Program program) {
    reducer.enterProgram(program);
    final List<Ast.Import> imports =
        transformEager(program.imports, reducer::reduceImport);
    final List<Ast.Circuit> circuits =
        transformEager(program.circuits.values(), this::reduceCircuit);
    final List<Ast.Function> functions =
        transformEager(program.functions.values(), this::reduceFunction);
    final List<Ast.Definition> globalConsts =
        transformEager(program.globalConsts, this::reduceDefinition);
    return reducer.reduceProgram(program, imports, circuits, functions,
        globalConsts);
  }

  /** Reduces a circuit. */
  public Ast.Circuit reduceCircuit(Ast.Circuit circuit) {
    reducer.enterCircuit(circuit);
    final Ast.Id name = reduce(circuit.name);
    final List<Ast.Member> members =
        transformEager(circuit.members, this::reduceMember);
    final List<Ast.Function> functions =
        transformEager(circuit.functions, this::reduceFunction);
    final Ast.Circuit circuit2 =
        reducer.reduceCircuit(circuit, name, members, functions);
    reducer.exitCircuit(circuit);
    return circuit2;
  }

  private Ast.Member reduceMember(Ast.Member member) {
    return reducer.reduceMember(member, reduce(member.name),
        reduceType(member.type));
  }

  /** Reduces a function. */
  public Ast.Function reduceFunction(Ast.Function function) {
    final List<Ast.Annotation> annotations =
        transformEager(function.annotations, reducer::reduceAnnotation);
    final Ast.Id name = reduce(function.name);
    final List<Ast.Param> params =
        transformEager(function.params, this::reduceParam);
    final Ast.Type output =
        function.output == null ? null : reduceType(function.output);
    final Ast.Block body = reduce(function.body);
    return reducer.reduceFunction(function, annotations, name, params, output,
        body);
  }

  private Ast.Param reduceParam(Ast.Param param) {
    return reducer.reduceParam(param, reduce(param.name),
        reduceType(param.type));
  }

  /** Reduces a statement. */
  public Ast.Stmt reduceStatement(Ast.Stmt stmt) {
    return stmt.reduce(this);
  }

  /** Reduces an expression. */
  public Ast.Exp reduceExpression(Ast.Exp exp) {
    return exp.reduce(this);
  }

  /** Reduces a type. */
  public Ast.Type reduceType(Ast.Type type) {
    return type.reduce(this);
  }

  private Ast.@Nullable Exp reduceNullable(Ast.@Nullable Exp exp) {
    return exp == null ? null : exp.reduce(this);
  }

  // statements

  Ast.Stmt reduce(Ast.Return aReturn) {
    return reducer.reduceReturn(aReturn, reduceExpression(aReturn.exp));
  }

  Ast.Definition reduce(Ast.Definition definition) {
    return reduceDefinition(definition);
  }

  private Ast.Definition reduceDefinition(Ast.Definition definition) {
    final List<Ast.VariableName> names =
        transformEager(definition.names, this::reduceVariableName);
    final Ast.Type type =
        definition.type == null ? null : reduceType(definition.type);
    final Ast.Exp value = reduceExpression(definition.value);
    return reducer.reduceDefinition(definition, names, type, value);
  }

  private Ast.VariableName reduceVariableName(Ast.VariableName variableName) {
    return reducer.reduceVariableName(variableName,
        reduce(variableName.name));
  }

  Ast.Stmt reduce(Ast.Assign assign) {
    return reducer.reduceAssign(assign, reduceExpression(assign.target),
        reduceExpression(assign.value));
  }

  Ast.Stmt reduce(Ast.Conditional conditional) {
    final Ast.Exp condition = reduceExpression(conditional.condition);
    final Ast.Block block = reduce(conditional.block);
    final Ast.Stmt next =
        conditional.next == null ? null : reduceStatement(conditional.next);
    return reducer.reduceConditional(conditional, condition, block, next);
  }

  Ast.Stmt reduce(Ast.Iteration iteration) {
    final Ast.Id variable = reduce(iteration.variable);
    final Ast.Exp start = reduceExpression(iteration.start);
    final Ast.Exp stop = reduceExpression(iteration.stop);
    final Ast.Block block = reduce(iteration.block);
    return reducer.reduceIteration(iteration, variable, start, stop, block);
  }

  Ast.Stmt reduce(Ast.Console console) {
    return reducer.reduceConsole(console,
        transformEager(console.args, this::reduceExpression));
  }

  Ast.Stmt reduce(Ast.ExpressionStmt expressionStmt) {
    return reducer.reduceExpressionStmt(expressionStmt,
        reduceExpression(expressionStmt.exp));
  }

  /** Reduces a block. */
  public Ast.Block reduceBlock(Ast.Block block) {
    return reduce(block);
  }

  Ast.Block reduce(Ast.Block block) {
    return reducer.reduceBlock(block,
        transformEager(block.statements, this::reduceStatement));
  }

  // expressions

  Ast.Exp reduce(Ast.Literal literal) {
    return reducer.reduceLiteral(literal);
  }

  Ast.Exp reduce(Ast.GroupLiteral groupLiteral) {
    return reducer.reduceGroupLiteral(groupLiteral);
  }

  Ast.Id reduce(Ast.Id id) {
    return reducer.reduceId(id);
  }

  Ast.Exp reduce(Ast.ImplicitMember implicitMember) {
    return reducer.reduceImplicitMember(implicitMember,
        reduce(implicitMember.name));
  }

  Ast.Exp reduce(Ast.Unary unary) {
    return reducer.reduceUnary(unary, reduceExpression(unary.inner));
  }

  Ast.Exp reduce(Ast.Binary binary) {
    final Ast.Exp left = reduceExpression(binary.left);
    final Ast.Exp right = reduceExpression(binary.right);
    return reducer.reduceBinary(binary, left, right);
  }

  Ast.Exp reduce(Ast.Ternary ternary) {
    final Ast.Exp condition = reduceExpression(ternary.condition);
    final Ast.Exp ifTrue = reduceExpression(ternary.ifTrue);
    final Ast.Exp ifFalse = reduceExpression(ternary.ifFalse);
    return reducer.reduceTernary(ternary, condition, ifTrue, ifFalse);
  }

  Ast.Exp reduce(Ast.Call call) {
    final Ast.Exp function = reduceExpression(call.function);
    final List<Ast.Exp> args =
        transformEager(call.args, this::reduceExpression);
    return reducer.reduceCall(call, function, args);
  }

  Ast.Exp reduce(Ast.ArrayInline arrayInline) {
    return reducer.reduceArrayInline(arrayInline,
        transformEager(arrayInline.elements, this::reduceExpression));
  }

  Ast.Exp reduce(Ast.ArrayInit arrayInit) {
    return reducer.reduceArrayInit(arrayInit,
        reduceExpression(arrayInit.element));
  }

  Ast.Exp reduce(Ast.TupleInit tupleInit) {
    return reducer.reduceTupleInit(tupleInit,
        transformEager(tupleInit.elements, this::reduceExpression));
  }

  Ast.Exp reduce(Ast.CircuitInit circuitInit) {
    final Ast.Id name = reduce(circuitInit.name);
    final List<Ast.CircuitField> fields =
        transformEager(circuitInit.fields, this::reduceCircuitField);
    return reducer.reduceCircuitInit(circuitInit, name, fields);
  }

  private Ast.CircuitField reduceCircuitField(Ast.CircuitField circuitField) {
    final Ast.Id name = reduce(circuitField.name);
    final Ast.Exp value = reduceNullable(circuitField.value);
    return reducer.reduceCircuitField(circuitField, name, value);
  }

  Ast.Exp reduce(Ast.ArrayAccess arrayAccess) {
    final Ast.Exp array = reduceExpression(arrayAccess.array);
    final Ast.Exp index = reduceExpression(arrayAccess.index);
    return reducer.reduceArrayAccess(arrayAccess, array, index);
  }

  Ast.Exp reduce(Ast.ArrayRangeAccess arrayRangeAccess) {
    final Ast.Exp array = reduceExpression(arrayRangeAccess.array);
    final Ast.Exp left = reduceNullable(arrayRangeAccess.left);
    final Ast.Exp right = reduceNullable(arrayRangeAccess.right);
    return reducer.reduceArrayRangeAccess(arrayRangeAccess, array, left,
        right);
  }

  Ast.Exp reduce(Ast.TupleAccess tupleAccess) {
    return reducer.reduceTupleAccess(tupleAccess,
        reduceExpression(tupleAccess.tuple));
  }

  Ast.Exp reduce(Ast.MemberAccess memberAccess) {
    final Ast.Exp inner = reduceExpression(memberAccess.inner);
    final Ast.Id name = reduce(memberAccess.name);
    return reducer.reduceMemberAccess(memberAccess, inner, name);
  }

  Ast.Exp reduce(Ast.StaticAccess staticAccess) {
    final Ast.Exp inner = reduceExpression(staticAccess.inner);
    final Ast.Id name = reduce(staticAccess.name);
    return reducer.reduceStaticAccess(staticAccess, inner, name);
  }

  Ast.Exp reduce(Ast.Cast cast) {
    final Ast.Exp inner = reduceExpression(cast.inner);
    final Ast.Type type = reduceType(cast.type);
    return reducer.reduceCast(cast, inner, type);
  }

  // types

  Ast.Type reduce(Ast.PrimitiveType primitiveType) {
    return reducer.reducePrimitiveType(primitiveType);
  }

  Ast.Type reduce(Ast.ArrayType arrayType) {
    return reducer.reduceArrayType(arrayType, reduceType(arrayType.element));
  }

  Ast.Type reduce(Ast.TupleType tupleType) {
    return reducer.reduceTupleType(tupleType,
        transformEager(tupleType.types, this::reduceType));
  }

  Ast.Type reduce(Ast.NamedType namedType) {
    return reducer.reduceNamedType(namedType, reduce(namedType.name));
  }

  Ast.Type reduce(Ast.SelfType selfType) {
    return reducer.reduceSelfType(selfType);
  }
}

// End Director.java
