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

import static net.hydromatic.leo.ast.AstBuilder.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.leo.ast.Ast;
import net.hydromatic.leo.ast.AstNode;
import net.hydromatic.leo.ast.NodeId;
import net.hydromatic.leo.ast.Op;
import net.hydromatic.leo.ast.Span;
import net.hydromatic.leo.json.AstJson;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds syntax trees for tests.
 *
 * <p>Each node gets a span one column to the right of the previous node's,
 * so that no two nodes built by the same {@code Fixtures} have the same
 * span. Call {@link #newline()} to move to the next line.
 */
public class Fixtures {
  /** A valid address, in canonical form. */
  public static final String ADDRESS =
      "aleo1r23clxd5mzfsh79vn6pg0kaytjeq8w4ur23clxd5mzfsh79vn6pg0kaytj";

  private int line = 1;
  private int column = 1;

  /** Returns a new span. */
  public Span span() {
    final int c = column++;
    return Span.of(line, c, c);
  }

  /** Returns a new identity, with a new span. */
  public NodeId nid() {
    return NodeId.of(span());
  }

  /** Moves to the start of the next line. */
  public Fixtures newline() {
    ++line;
    column = 1;
    return this;
  }

  /** Returns every node of a tree, keyed by id, as the span of the node.
   * Fails if two nodes have the same id. */
  public static Map<Long, Span> idSpans(AstNode node) {
    final Map<Long, Span> map = new LinkedHashMap<>();
    collect(new AstJson(false, true).toJsonNode(node), map);
    return map;
  }

  private static void collect(JsonNode json, Map<Long, Span> map) {
    if (json.isObject() && json.has("kind") && json.has("span")) {
      final JsonNode s = json.get("span");
      final Span span =
          new Span(s.get("file").textValue(), s.get("startLine").intValue(),
              s.get("startColumn").intValue(), s.get("endLine").intValue(),
              s.get("endColumn").intValue());
      if (map.put(json.get("id").longValue(), span) != null) {
        throw new AssertionError("duplicate id " + json.get("id"));
      }
    }
    for (Iterator<JsonNode> i = json.elements(); i.hasNext();) {
      collect(i.next(), map);
    }
  }

  // expressions

  public Ast.Id id(String name) {
    return ast.id(nid(), name);
  }

  /** Creates a number without a type suffix, such as "5". */
  public Ast.Literal num(String value) {
    return ast.implicitLiteral(nid(), value);
  }

  public Ast.Literal u8(int value) {
    return ast.intLiteral(nid(), String.valueOf(value), Op.U8);
  }

  public Ast.Literal u32(int value) {
    return ast.intLiteral(nid(), String.valueOf(value), Op.U32);
  }

  public Ast.Literal bool(boolean value) {
    return ast.boolLiteral(nid(), value);
  }

  public Ast.Literal field(String value) {
    return ast.fieldLiteral(nid(), value);
  }

  public Ast.Literal str(String value) {
    return ast.stringLiteral(nid(), value);
  }

  public Ast.Literal ch(String value) {
    return ast.charLiteral(nid(), value);
  }

  /** Creates a group literal from its text, such as "(0, +)group". */
  public Ast.Literal group(String text) {
    return ast.groupLiteral(nid(), text);
  }

  public Ast.Literal address(String text) {
    return ast.addressLiteral(nid(), text);
  }

  public Ast.Unary unary(Op op, Ast.Exp e) {
    return ast.unary(nid(), op, e);
  }

  public Ast.Binary binary(Op op, Ast.Exp left, Ast.Exp right) {
    return ast.binary(nid(), op, left, right);
  }

  public Ast.Ternary ternary(Ast.Exp c, Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return ast.ternary(nid(), c, ifTrue, ifFalse);
  }

  public Ast.Call call(Ast.Exp function, Ast.Exp... args) {
    return ast.call(nid(), function, Arrays.asList(args));
  }

  public Ast.Call call(String function, Ast.Exp... args) {
    return call(id(function), args);
  }

  public Ast.MemberAccess member(Ast.Exp inner, String name) {
    return ast.memberAccess(nid(), inner, id(name));
  }

  public Ast.ImplicitMember implicitMember(String name) {
    return ast.implicitMember(nid(), id(name));
  }

  public Ast.StaticAccess staticAccess(String circuit, String name) {
    return ast.staticAccess(nid(), id(circuit), id(name));
  }

  public Ast.TupleAccess tupleAccess(Ast.Exp tuple, int index) {
    return ast.tupleAccess(nid(), tuple, index);
  }

  public Ast.ArrayAccess arrayAccess(Ast.Exp array, Ast.Exp index) {
    return ast.arrayAccess(nid(), array, index);
  }

  public Ast.ArrayRangeAccess arrayRangeAccess(Ast.Exp array,
      Ast.@Nullable Exp left, Ast.@Nullable Exp right) {
    return ast.arrayRangeAccess(nid(), array, left, right);
  }

  public Ast.TupleInit tuple(Ast.Exp... elements) {
    return ast.tupleInit(nid(), Arrays.asList(elements));
  }

  public Ast.ArrayInline array(Ast.Exp... elements) {
    return ast.arrayInline(nid(), Arrays.asList(elements));
  }

  public Ast.ArrayInit arrayInit(Ast.Exp element, Integer... dimensions) {
    return ast.arrayInit(nid(), element, Arrays.asList(dimensions));
  }

  public Ast.CircuitInit circuitInit(String name,
      Ast.CircuitField... fields) {
    return ast.circuitInit(nid(), id(name), Arrays.asList(fields));
  }

  public Ast.CircuitField circuitField(String name,
      Ast.@Nullable Exp value) {
    return ast.circuitField(nid(), id(name), value);
  }

  public Ast.Cast cast(Ast.Exp e, Ast.Type type) {
    return ast.cast(nid(), e, type);
  }

  // types

  public Ast.PrimitiveType prim(Op op) {
    return ast.primitiveType(nid(), op);
  }

  public Ast.NamedType namedType(String name) {
    return ast.namedType(nid(), id(name));
  }

  public Ast.SelfType selfType() {
    return ast.selfType(nid());
  }

  public Ast.TupleType tupleType(Ast.Type... types) {
    return ast.tupleType(nid(), Arrays.asList(types));
  }

  public Ast.ArrayType arrayType(Ast.Type element, Integer... dimensions) {
    return ast.arrayType(nid(), element, Arrays.asList(dimensions));
  }

  // statements

  public Ast.VariableName var(String name) {
    return ast.variableName(nid(), id(name), false);
  }

  public Ast.VariableName mutVar(String name) {
    return ast.variableName(nid(), id(name), true);
  }

  public Ast.Definition let(String name, Ast.Exp value) {
    return ast.let(nid(), var(name), null, value);
  }

  public Ast.Definition let(Ast.VariableName name, Ast.@Nullable Type type,
      Ast.Exp value) {
    return ast.let(nid(), name, type, value);
  }

  /** Creates a definition that binds several names, such as
   * "let (a, b) = e;". */
  public Ast.Definition letTuple(List<String> names, Ast.@Nullable Type type,
      Ast.Exp value) {
    return definition(Op.LET, names, type, value);
  }

  public Ast.Definition definition(Op op, List<String> names,
      Ast.@Nullable Type type, Ast.Exp value) {
    final ImmutableList.Builder<Ast.VariableName> b = ImmutableList.builder();
    names.forEach(name -> b.add(var(name)));
    return ast.definition(nid(), op, b.build(), type, value);
  }

  public Ast.Assign assign(Op op, Ast.Exp target, Ast.Exp value) {
    return ast.assign(nid(), op, target, value);
  }

  public Ast.Return ret(Ast.Exp e) {
    return ast.return_(nid(), e);
  }

  public Ast.ExpressionStmt exprStmt(Ast.Exp e) {
    return ast.expressionStmt(nid(), e);
  }

  public Ast.Block block(Ast.Stmt... statements) {
    return ast.block(nid(), Arrays.asList(statements));
  }

  public Ast.Conditional if_(Ast.Exp condition, Ast.Block block,
      Ast.@Nullable Stmt next) {
    return ast.conditional(nid(), condition, block, next);
  }

  // declarations

  public Ast.Param param(String name, Ast.Type type) {
    return ast.param(nid(), id(name), type);
  }

  public Ast.Function function(String name, List<Ast.Param> params,
      Ast.@Nullable Type output, Ast.Stmt... body) {
    return ast.function(nid(), ImmutableList.of(), id(name), params, output,
        block(body));
  }

  public Ast.Program program(List<Ast.Circuit> circuits,
      List<Ast.Function> functions) {
    return ast.program(nid(), "test", ImmutableList.of(), circuits, functions,
        ImmutableList.of());
  }

  /** Creates a program with one function "main" that has no parameters
   * and a given body. */
  public Ast.Program main(Ast.Stmt... body) {
    return program(ImmutableList.of(),
        ImmutableList.of(function("main", ImmutableList.of(), null, body)));
  }

  /**
   * Creates a program that uses every kind of node.
   *
   * <p>It is equivalent to the following, and can be canonicalized:
   *
   * <blockquote><pre>
   * import std.math.*;
   * import std.io.print as p;
   * import std.util.(min, max as maximum);
   * const (LO, HI) = (0u8, 255u8);
   * circuit Point {
   *   x: u32, y: u32,
   *   function new(x: u32, y: u32) -&gt; Self {
   *     return Self { x, y: y };
   *   }
   *   function norm(mut self) -&gt; u32 {
   *     .x += 1u32;
   *     return .x * .x + self.y ** 2u32;
   *   }
   *   function origin() -&gt; Self {
   *     return Self::new(0u32, 0u32);
   *   }
   * }
   * &#64;test(fast)
   * function main(const a: u8, b: [u8; (2, 3)]) -&gt; (u8, bool) {
   *   let (q, r) = pair(a);
   *   let mut arr: [u8; (2, 3)] = [0u8; (2, 3)];
   *   arr[0][1] = q;
   *   let t = (q, true);
   *   let s = arr[0][..2];
   *   let addr: address = address(ALEO1...);
   *   let f: field = 1field;
   *   let c: char = 'a';
   *   let m: string = "hi";
   *   let g: group = (0, +)group;
   *   let pt = Point::new(1u32, 2u32);
   *   let n = pt.norm();
   *   let v = [1u8, 2u8];
   *   for i in 0u8..3u8 { q += i; }
   *   if a == 0u8 { console.log("zero {}", a); }
   *   else if a &gt; 1u8 { console.error("big"); }
   *   else { console.assert(b[0][0] == 0u8); }
   *   let w = a &gt; 1u8 ? -a : ~a;
   *   let y = !true;
   *   pair(a as u8);
   *   return (q, r == 0u8);
   * }
   * function pair(x: u8) -&gt; (u8, u8) {
   *   return (x, x);
   * }
   * </pre></blockquote>
   */
  public Ast.Program sampleProgram() {
    final List<Ast.Import> imports =
        ImmutableList.of(
            ast.importStar(nid(), ImmutableList.of(id("std"), id("math"))),
            ast.importPath(nid(),
                ImmutableList.of(id("std"), id("io"), id("print")), id("p")),
            ast.importSymbols(nid(), ImmutableList.of(id("std"), id("util")),
                ImmutableList.of(ast.importSymbol(nid(), id("min"), null),
                    ast.importSymbol(nid(), id("max"), id("maximum")))));
    newline();
    final Ast.Definition globalConst =
        definition(Op.CONST, ImmutableList.of("LO", "HI"), null,
            tuple(u8(0), u8(255)));
    newline();

    final Ast.Function newFn =
        function("new",
            ImmutableList.of(param("x", prim(Op.U32)),
                param("y", prim(Op.U32))),
            selfType(),
            ret(
                circuitInit("Self", circuitField("x", null),
                    circuitField("y", id("y")))));
    newline();
    final Ast.Function normFn =
        ast.function(nid(), ImmutableList.of(), id("norm"),
            ImmutableList.of(ast.selfParam(nid(), true)), prim(Op.U32),
            block(
                assign(Op.ADD_ASSIGN, implicitMember("x"), u32(1)),
                ret(
                    binary(Op.ADD,
                        binary(Op.MUL, implicitMember("x"),
                            implicitMember("x")),
                        binary(Op.POW, member(id("self"), "y"), u32(2))))));
    newline();
    final Ast.Function originFn =
        function("origin", ImmutableList.of(), selfType(),
            ret(call(staticAccess("Self", "new"), u32(0), u32(0))));
    newline();
    final Ast.Circuit point =
        ast.circuit(nid(), id("Point"),
            ImmutableList.of(ast.member(nid(), id("x"), prim(Op.U32)),
                ast.member(nid(), id("y"), prim(Op.U32))),
            ImmutableList.of(newFn, normFn, originFn));
    newline();

    final Ast.Function mainFn =
        ast.function(nid(),
            ImmutableList.of(
                ast.annotation(nid(), id("test"), ImmutableList.of("fast"))),
            id("main"),
            ImmutableList.of(ast.constParam(nid(), id("a"), prim(Op.U8)),
                param("b", arrayType(prim(Op.U8), 2, 3))),
            tupleType(prim(Op.U8), prim(Op.BOOLEAN_TYPE)),
            block(
                letTuple(ImmutableList.of("q", "r"), null,
                    call("pair", id("a"))),
                let(mutVar("arr"), arrayType(prim(Op.U8), 2, 3),
                    arrayInit(u8(0), 2, 3)),
                assign(Op.ASSIGN,
                    arrayAccess(arrayAccess(id("arr"), num("0")), num("1")),
                    id("q")),
                let("t", tuple(id("q"), bool(true))),
                let("s",
                    arrayRangeAccess(arrayAccess(id("arr"), num("0")), null,
                        num("2"))),
                let(var("addr"), prim(Op.ADDRESS_TYPE),
                    address("address(" + ADDRESS.toUpperCase() + ")")),
                let(var("f"), prim(Op.FIELD_TYPE), field("1")),
                let(var("c"), prim(Op.CHAR_TYPE), ch("a")),
                let(var("m"), prim(Op.STRING_TYPE), str("hi")),
                let(var("g"), prim(Op.GROUP_TYPE), group("(0, +)group")),
                let("pt", call(staticAccess("Point", "new"), u32(1), u32(2))),
                let("n", call(member(id("pt"), "norm"))),
                let("v", array(u8(1), u8(2))),
                ast.iteration(nid(), id("i"), u8(0), u8(3), false,
                    block(assign(Op.ADD_ASSIGN, id("q"), id("i")))),
                if_(binary(Op.EQ, id("a"), u8(0)),
                    block(
                        ast.consoleLog(nid(), "zero {}",
                            ImmutableList.of(id("a")))),
                    if_(binary(Op.GT, id("a"), u8(1)),
                        block(
                            ast.consoleError(nid(), "big", ImmutableList.of())),
                        block(
                            ast.consoleAssert(nid(),
                                binary(Op.EQ,
                                    arrayAccess(arrayAccess(id("b"), num("0")),
                                        num("0")),
                                    u8(0)))))),
                let("w",
                    ternary(binary(Op.GT, id("a"), u8(1)),
                        unary(Op.NEGATE, id("a")), unary(Op.BIT_NOT, id("a")))),
                let("y", unary(Op.NOT, bool(true))),
                exprStmt(call("pair", cast(id("a"), prim(Op.U8)))),
                ret(tuple(id("q"), binary(Op.EQ, id("r"), u8(0))))));
    newline();
    final Ast.Function pairFn =
        function("pair", ImmutableList.of(param("x", prim(Op.U8))),
            tupleType(prim(Op.U8), prim(Op.U8)),
            ret(tuple(id("x"), id("x"))));
    return ast.program(nid(), "sample", imports, ImmutableList.of(point),
        ImmutableList.of(mainFn, pairFn), ImmutableList.of(globalConst));
  }
}

// End Fixtures.java
