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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Visits syntax trees.
 *
 * <p>Each {@code visit} method visits the node's children, in source order.
 * Sub-classes override the methods for the nodes they care about, and call
 * {@code super.visit} to keep descending. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  /** Visits a node that is null if absent. */
  protected void acceptNullable(@Nullable AstNode node) {
    if (node != null) {
      node.accept(this);
    }
  }

  // declarations

  protected void visit(Ast.Program program) {
    program.imports.forEach(this::accept);
    program.globalConsts.forEach(this::accept);
    program.circuits.values().forEach(this::accept);
    program.functions.values().forEach(this::accept);
  }

  protected void visit(Ast.Import anImport) {
    anImport.path.forEach(this::accept);
    acceptNullable(anImport.alias);
    anImport.symbols.forEach(this::accept);
  }

  protected void visit(Ast.ImportSymbol importSymbol) {
    importSymbol.name.accept(this);
    acceptNullable(importSymbol.alias);
  }

  protected void visit(Ast.Circuit circuit) {
    circuit.name.accept(this);
    circuit.members.forEach(this::accept);
    circuit.functions.forEach(this::accept);
  }

  protected void visit(Ast.Member member) {
    member.name.accept(this);
    member.type.accept(this);
  }

  protected void visit(Ast.Function function) {
    function.annotations.forEach(this::accept);
    function.name.accept(this);
    function.params.forEach(this::accept);
    acceptNullable(function.output);
    function.body.accept(this);
  }

  protected void visit(Ast.Param param) {
    param.name.accept(this);
    param.type.accept(this);
  }

  protected void visit(Ast.Annotation annotation) {
    annotation.name.accept(this);
  }

  // statements

  protected void visit(Ast.Return aReturn) {
    aReturn.exp.accept(this);
  }

  protected void visit(Ast.Definition definition) {
    definition.names.forEach(this::accept);
    acceptNullable(definition.type);
    definition.value.accept(this);
  }

  protected void visit(Ast.VariableName variableName) {
    variableName.name.accept(this);
  }

  protected void visit(Ast.Assign assign) {
    assign.target.accept(this);
    assign.value.accept(this);
  }

  protected void visit(Ast.Conditional conditional) {
    conditional.condition.accept(this);
    conditional.block.accept(this);
    acceptNullable(conditional.next);
  }

  protected void visit(Ast.Iteration iteration) {
    iteration.variable.accept(this);
    iteration.start.accept(this);
    iteration.stop.accept(this);
    iteration.block.accept(this);
  }

  protected void visit(Ast.Console console) {
    console.args.forEach(this::accept);
  }

  protected void visit(Ast.ExpressionStmt expressionStmt) {
    expressionStmt.exp.accept(this);
  }

  protected void visit(Ast.Block block) {
    block.statements.forEach(this::accept);
  }

  // expressions

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.GroupLiteral groupLiteral) {}

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.ImplicitMember implicitMember) {
    implicitMember.name.accept(this);
  }

  protected void visit(Ast.Unary unary) {
    unary.inner.accept(this);
  }

  protected void visit(Ast.Binary binary) {
    binary.left.accept(this);
    binary.right.accept(this);
  }

  protected void visit(Ast.Ternary ternary) {
    ternary.condition.accept(this);
    ternary.ifTrue.accept(this);
    ternary.ifFalse.accept(this);
  }

  protected void visit(Ast.Call call) {
    call.function.accept(this);
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.ArrayInline arrayInline) {
    arrayInline.elements.forEach(this::accept);
  }

  protected void visit(Ast.ArrayInit arrayInit) {
    arrayInit.element.accept(this);
  }

  protected void visit(Ast.TupleInit tupleInit) {
    tupleInit.elements.forEach(this::accept);
  }

  protected void visit(Ast.CircuitInit circuitInit) {
    circuitInit.name.accept(this);
    circuitInit.fields.forEach(this::accept);
  }

  protected void visit(Ast.CircuitField circuitField) {
    circuitField.name.accept(this);
    acceptNullable(circuitField.value);
  }

  protected void visit(Ast.ArrayAccess arrayAccess) {
    arrayAccess.array.accept(this);
    arrayAccess.index.accept(this);
  }

  protected void visit(Ast.ArrayRangeAccess arrayRangeAccess) {
    arrayRangeAccess.array.accept(this);
    acceptNullable(arrayRangeAccess.left);
    acceptNullable(arrayRangeAccess.right);
  }

  protected void visit(Ast.TupleAccess tupleAccess) {
    tupleAccess.tuple.accept(this);
  }

  protected void visit(Ast.MemberAccess memberAccess) {
    memberAccess.inner.accept(this);
    memberAccess.name.accept(this);
  }

  protected void visit(Ast.StaticAccess staticAccess) {
    staticAccess.inner.accept(this);
    staticAccess.name.accept(this);
  }

  protected void visit(Ast.Cast cast) {
    cast.inner.accept(this);
    cast.type.accept(this);
  }

  // types

  protected void visit(Ast.PrimitiveType primitiveType) {}

  protected void visit(Ast.ArrayType arrayType) {
    arrayType.element.accept(this);
  }

  protected void visit(Ast.TupleType tupleType) {
    tupleType.types.forEach(this::accept);
  }

  protected void visit(Ast.NamedType namedType) {
    namedType.name.accept(this);
  }

  protected void visit(Ast.SelfType selfType) {}
}

// End Visitor.java
