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

import static net.hydromatic.leo.ast.AstBuilder.ast;

import java.util.List;
import net.hydromatic.leo.ast.Ast;
import net.hydromatic.leo.ast.AstNode;
import net.hydromatic.leo.ast.Director;
import net.hydromatic.leo.ast.NodeId;
import net.hydromatic.leo.ast.Reducer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Copies an expression or type, giving every node in the copy a new
 * {@link NodeId} with the same span as the node it copies.
 *
 * <p>Used when a rewrite needs a sub-tree in two places, for example the
 * target of "x += 1", which becomes both the target and the left operand
 * of "x = x + 1".
 */
public class FreshCopier implements Reducer {
  private static final FreshCopier INSTANCE = new FreshCopier();
  private static final Director DIRECTOR = new Director(INSTANCE);

  private FreshCopier() {}

  /** Returns a copy of an expression with fresh identities. */
  public static Ast.Exp copy(Ast.Exp exp) {
    return DIRECTOR.reduceExpression(exp);
  }

  /** Returns a copy of a type with fresh identities. */
  public static Ast.Type copy(Ast.Type type) {
    return DIRECTOR.reduceType(type);
  }

  private static NodeId fresh(AstNode node) {
    return NodeId.of(node.span());
  }

  @Override public Ast.Exp reduceLiteral(Ast.Literal literal) {
    return ast.literal(fresh(literal), literal.op, literal.value,
        literal.intType);
  }

  @Override public Ast.Exp reduceGroupLiteral(Ast.GroupLiteral g) {
    return g.scalar != null
        ? ast.groupScalar(fresh(g), g.scalar)
        : ast.groupPoint(fresh(g), g.x, g.y);
  }

  @Override public Ast.Id reduceId(Ast.Id id) {
    return ast.id(fresh(id), id.name);
  }

  @Override public Ast.Exp reduceImplicitMember(Ast.ImplicitMember m,
      Ast.Id name) {
    return ast.implicitMember(fresh(m), name);
  }

  @Override public Ast.Exp reduceUnary(Ast.Unary unary, Ast.Exp inner) {
    return ast.unary(fresh(unary), unary.op, inner);
  }

  @Override public Ast.Exp reduceBinary(Ast.Binary binary, Ast.Exp left,
      Ast.Exp right) {
    return ast.binary(fresh(binary), binary.op, left, right);
  }

  @Override public Ast.Exp reduceTernary(Ast.Ternary ternary,
      Ast.Exp condition, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return ast.ternary(fresh(ternary), condition, ifTrue, ifFalse);
  }

  @Override public Ast.Exp reduceCall(Ast.Call call, Ast.Exp function,
      List<Ast.Exp> args) {
    return ast.call(fresh(call), function, args);
  }

  @Override public Ast.Exp reduceArrayInline(Ast.ArrayInline arrayInline,
      List<Ast.Exp> elements) {
    return ast.arrayInline(fresh(arrayInline), elements);
  }

  @Override public Ast.Exp reduceArrayInit(Ast.ArrayInit arrayInit,
      Ast.Exp element) {
    return ast.arrayInit(fresh(arrayInit), element, arrayInit.dimensions);
  }

  @Override public Ast.Exp reduceTupleInit(Ast.TupleInit tupleInit,
      List<Ast.Exp> elements) {
    return ast.tupleInit(fresh(tupleInit), elements);
  }

  @Override public Ast.Exp reduceCircuitInit(Ast.CircuitInit circuitInit,
      Ast.Id name, List<Ast.CircuitField> fields) {
    return ast.circuitInit(fresh(circuitInit), name, fields);
  }

  @Override public Ast.CircuitField reduceCircuitField(
      Ast.CircuitField circuitField, Ast.Id name, Ast.@Nullable Exp value) {
    return ast.circuitField(fresh(circuitField), name, value);
  }

  @Override public Ast.Exp reduceArrayAccess(Ast.ArrayAccess arrayAccess,
      Ast.Exp array, Ast.Exp index) {
    return ast.arrayAccess(fresh(arrayAccess), array, index);
  }

  @Override public Ast.Exp reduceArrayRangeAccess(
      Ast.ArrayRangeAccess arrayRangeAccess, Ast.Exp array,
      Ast.@Nullable Exp left, Ast.@Nullable Exp right) {
    return ast.arrayRangeAccess(fresh(arrayRangeAccess), array, left, right);
  }

  @Override public Ast.Exp reduceTupleAccess(Ast.TupleAccess tupleAccess,
      Ast.Exp tuple) {
    return ast.tupleAccess(fresh(tupleAccess), tuple, tupleAccess.index);
  }

  @Override public Ast.Exp reduceMemberAccess(Ast.MemberAccess memberAccess,
      Ast.Exp inner, Ast.Id name) {
    return ast.memberAccess(fresh(memberAccess), inner, name);
  }

  @Override public Ast.Exp reduceStaticAccess(Ast.StaticAccess staticAccess,
      Ast.Exp inner, Ast.Id name) {
    return ast.staticAccess(fresh(staticAccess), inner, name);
  }

  @Override public Ast.Exp reduceCast(Ast.Cast cast, Ast.Exp inner,
      Ast.Type type) {
    return ast.cast(fresh(cast), inner, type);
  }

  @Override public Ast.Type reducePrimitiveType(Ast.PrimitiveType type) {
    return ast.primitiveType(fresh(type), type.op);
  }

  @Override public Ast.Type reduceArrayType(Ast.ArrayType arrayType,
      Ast.Type element) {
    return ast.arrayType(fresh(arrayType), element, arrayType.dimensions);
  }

  @Override public Ast.Type reduceTupleType(Ast.TupleType tupleType,
      List<Ast.Type> types) {
    return ast.tupleType(fresh(tupleType), types);
  }

  @Override public Ast.Type reduceNamedType(Ast.NamedType namedType,
      Ast.Id name) {
    return ast.namedType(fresh(namedType), name);
  }

  @Override public Ast.Type reduceSelfType(Ast.SelfType selfType) {
    return ast.selfType(fresh(selfType));
  }
}

// End FreshCopier.java
