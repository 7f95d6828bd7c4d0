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

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites a syntax tree bottom-up.
 *
 * <p>A {@link Director} walks the tree in post-order. For each node, it first
 * reduces the node's children, then calls the {@code reduceXxx} method for the
 * node, passing the original node and the reduced children. The method returns
 * the node that replaces the original.
 *
 * <p>Every method has a default implementation that rebuilds the node from the
 * reduced children using the node's {@code copy} method. The rebuilt node keeps
 * the original's {@link NodeId}, and if no child changed, the original node is
 * returned, so a reducer that overrides nothing returns the same tree.
 *
 * <p>A method may throw; the exception propagates out of the director.
 */
public interface Reducer {
  /** Called before the children of a program are reduced. */
  default void enterProgram(Ast.Program program) {}

  /** Called before the children of a circuit are reduced. */
  default void enterCircuit(Ast.Circuit circuit) {}

  /** Called after a circuit has been reduced, with the original circuit. */
  default void exitCircuit(Ast.Circuit circuit) {}

  // declarations

  default Ast.Program reduceProgram(Ast.Program program,
      List<Ast.Import> imports, List<Ast.Circuit> circuits,
      List<Ast.Function> functions, List<Ast.Definition> globalConsts) {
    return program.copy(imports, circuits, functions, globalConsts);
  }

  /** Reduces an import. Imports have no children that a director
   * descends into. */
  default Ast.Import reduceImport(Ast.Import anImport) {
    return anImport;
  }

  default Ast.Circuit reduceCircuit(Ast.Circuit circuit, Ast.Id name,
      List<Ast.Member> members, List<Ast.Function> functions) {
    return circuit.copy(name, members, functions);
  }

  default Ast.Member reduceMember(Ast.Member member, Ast.Id name,
      Ast.Type type) {
    return member.copy(name, type);
  }

  default Ast.Function reduceFunction(Ast.Function function,
      List<Ast.Annotation> annotations, Ast.Id name, List<Ast.Param> params,
      Ast.@Nullable Type output, Ast.Block body) {
    return function.copy(annotations, name, params, output, body);
  }

  default Ast.Annotation reduceAnnotation(Ast.Annotation annotation) {
    return annotation;
  }

  default Ast.Param reduceParam(Ast.Param param, Ast.Id name, Ast.Type type) {
    return param.copy(name, type);
  }

  // statements

  default Ast.Stmt reduceReturn(Ast.Return aReturn, Ast.Exp exp) {
    return aReturn.copy(exp);
  }

  default Ast.Definition reduceDefinition(Ast.Definition definition,
      List<Ast.VariableName> names, Ast.@Nullable Type type, Ast.Exp value) {
    return definition.copy(names, type, value);
  }

  default Ast.VariableName reduceVariableName(Ast.VariableName variableName,
      Ast.Id name) {
    return variableName.copy(name);
  }

  default Ast.Stmt reduceAssign(Ast.Assign assign, Ast.Exp target,
      Ast.Exp value) {
    return assign.copy(target, value);
  }

  default Ast.Stmt reduceConditional(Ast.Conditional conditional,
      Ast.Exp condition, Ast.Block block, Ast.@Nullable Stmt next) {
    return conditional.copy(condition, block, next);
  }

  default Ast.Stmt reduceIteration(Ast.Iteration iteration, Ast.Id variable,
      Ast.Exp start, Ast.Exp stop, Ast.Block block) {
    return iteration.copy(variable, start, stop, block);
  }

  default Ast.Stmt reduceConsole(Ast.Console console, List<Ast.Exp> args) {
    return console.copy(args);
  }

  default Ast.Stmt reduceExpressionStmt(Ast.ExpressionStmt expressionStmt,
      Ast.Exp exp) {
    return expressionStmt.copy(exp);
  }

  default Ast.Block reduceBlock(Ast.Block block, List<Ast.Stmt> statements) {
    return block.copy(statements);
  }

  // expressions

  default Ast.Exp reduceLiteral(Ast.Literal literal) {
    return literal;
  }

  default Ast.Exp reduceGroupLiteral(Ast.GroupLiteral groupLiteral) {
    return groupLiteral;
  }

  default Ast.Id reduceId(Ast.Id id) {
    return id;
  }

  default Ast.Exp reduceImplicitMember(Ast.ImplicitMember implicitMember,
      Ast.Id name) {
    return implicitMember.copy(name);
  }

  default Ast.Exp reduceUnary(Ast.Unary unary, Ast.Exp inner) {
    return unary.copy(inner);
  }

  default Ast.Exp reduceBinary(Ast.Binary binary, Ast.Exp left,
      Ast.Exp right) {
    return binary.copy(left, right);
  }

  default Ast.Exp reduceTernary(Ast.Ternary ternary, Ast.Exp condition,
      Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return ternary.copy(condition, ifTrue, ifFalse);
  }

  default Ast.Exp reduceCall(Ast.Call call, Ast.Exp function,
      List<Ast.Exp> args) {
    return call.copy(function, args);
  }

  default Ast.Exp reduceArrayInline(Ast.ArrayInline arrayInline,
      List<Ast.Exp> elements) {
    return arrayInline.copy(elements);
  }

  default Ast.Exp reduceArrayInit(Ast.ArrayInit arrayInit, Ast.Exp element) {
    return arrayInit.copy(element);
  }

  default Ast.Exp reduceTupleInit(Ast.TupleInit tupleInit,
      List<Ast.Exp> elements) {
    return tupleInit.copy(elements);
  }

  default Ast.Exp reduceCircuitInit(Ast.CircuitInit circuitInit, Ast.Id name,
      List<Ast.CircuitField> fields) {
    return circuitInit.copy(name, fields);
  }

  default Ast.CircuitField reduceCircuitField(Ast.CircuitField circuitField,
      Ast.Id name, Ast.@Nullable Exp value) {
    return circuitField.copy(name, value);
  }

  default Ast.Exp reduceArrayAccess(Ast.ArrayAccess arrayAccess,
      Ast.Exp array, Ast.Exp index) {
    return arrayAccess.copy(array, index);
  }

  default Ast.Exp reduceArrayRangeAccess(
      Ast.ArrayRangeAccess arrayRangeAccess, Ast.Exp array,
      Ast.@Nullable Exp left, Ast.@Nullable Exp right) {
    return arrayRangeAccess.copy(array, left, right);
  }

  default Ast.Exp reduceTupleAccess(Ast.TupleAccess tupleAccess,
      Ast.Exp tuple) {
    return tupleAccess.copy(tuple);
  }

  default Ast.Exp reduceMemberAccess(Ast.MemberAccess memberAccess,
      Ast.Exp inner, Ast.Id name) {
    return memberAccess.copy(inner, name);
  }

  default Ast.Exp reduceStaticAccess(Ast.StaticAccess staticAccess,
      Ast.Exp inner, Ast.Id name) {
    return staticAccess.copy(inner, name);
  }

  default Ast.Exp reduceCast(Ast.Cast cast, Ast.Exp inner, Ast.Type type) {
    return cast.copy(inner, type);
  }

  // types

  default Ast.Type reducePrimitiveType(Ast.PrimitiveType primitiveType) {
    return primitiveType;
  }

  default Ast.Type reduceArrayType(Ast.ArrayType arrayType,
      Ast.Type element) {
    return arrayType.copy(element);
  }

  default Ast.Type reduceTupleType(Ast.TupleType tupleType,
      List<Ast.Type> types) {
    return tupleType.copy(types);
  }

  default Ast.Type reduceNamedType(Ast.NamedType namedType, Ast.Id name) {
    return namedType.copy(name);
  }

  default Ast.Type reduceSelfType(Ast.SelfType selfType) {
    return selfType;
  }
}

// End Reducer.java
