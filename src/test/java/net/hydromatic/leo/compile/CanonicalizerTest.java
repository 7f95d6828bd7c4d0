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
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import net.hydromatic.leo.Fixtures;
import net.hydromatic.leo.ast.Ast;
import net.hydromatic.leo.ast.Op;
import net.hydromatic.leo.ast.Span;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

/** Tests for {@link Canonicalizer}. */
class CanonicalizerTest {
  /** Creates a program with a function "main" that has a given body, and a
   * function "pair" that returns a 2-tuple. */
  private static Ast.Program withPair(Fixtures f, Ast.Stmt... body) {
    final Ast.Function pair =
        f.function("pair", ImmutableList.of(),
            f.tupleType(f.prim(Op.U8), f.prim(Op.U8)),
            f.ret(f.tuple(f.u8(1), f.u8(2))));
    final Ast.Function nothing =
        f.function("nothing", ImmutableList.of(), null);
    final Ast.Function main =
        f.function("main", ImmutableList.of(), null, body);
    return f.program(ImmutableList.of(),
        ImmutableList.of(main, pair, nothing));
  }

  /** Canonicalizes a program and returns the body of its "main"
   * function. */
  private static Ast.Block mainBody(Ast.Program program) {
    return Canonicalizer.canonicalize(program).functions.get("main").body;
  }

  private static Ast.Block mainBody(Fixtures f, Ast.Stmt... body) {
    return mainBody(withPair(f, body));
  }

  /** Asserts that canonicalizing a program fails with an error of a given
   * kind at a given span. */
  private static CanonicalizeException assertFails(
      CanonicalizeException.Kind kind, Span span, Executable executable) {
    final CanonicalizeException e =
        assertThrows(CanonicalizeException.class, executable);
    assertThat(e.kind(), is(kind));
    assertThat(e.span(), is(span));
    return e;
  }

  /** "x += 1;" becomes "x = x + 1;". */
  @Test void testCompoundAssignment() {
    final Fixtures f = new Fixtures();
    final Ast.Assign assign = f.assign(Op.ADD_ASSIGN, f.id("x"), f.num("1"));
    final Ast.Block block = mainBody(f, assign);
    assertThat(block, hasToString("{ x = x + 1; }"));

    final Ast.Assign assign2 = (Ast.Assign) block.statements.get(0);
    assertThat(assign2.op, is(Op.ASSIGN));
    assertThat(assign2.isCompound(), is(false));
    assertThat(assign2.nodeId, sameInstance(assign.nodeId));
    assertThat(assign2.target, sameInstance(assign.target));
    assertThat(assign2.value, instanceOf(Ast.Binary.class));

    // The target appears twice, with different identities but the same
    // span. The new binary expression spans the target and the value.
    final Ast.Binary binary = (Ast.Binary) assign2.value;
    assertThat(binary.op, is(Op.ADD));
    assertThat(binary.left.id(), not(is(assign.target.id())));
    assertThat(binary.left.span(), is(assign.target.span()));
    assertThat(binary.right, sameInstance(assign.value));
    assertThat(binary.span(),
        is(assign.target.span().plus(assign.value.span())));
  }

  @Test void testCompoundAssignmentOperators() {
    final Fixtures f = new Fixtures();
    final Ast.Exp target =
        f.arrayAccess(f.member(f.id("a"), "b"), f.num("0"));
    assertThat(mainBody(f, f.assign(Op.MUL_ASSIGN, target, f.u8(2))),
        hasToString("{ a.b[0] = a.b[0] * 2u8; }"));
    assertThat(
        mainBody(f,
            f.assign(Op.SHL_ASSIGN, f.tupleAccess(f.id("t"), 1), f.u8(1)),
            f.assign(Op.OR_ASSIGN, f.id("p"), f.bool(true)),
            f.assign(Op.POW_ASSIGN, f.id("x"), f.binary(Op.ADD, f.id("y"),
                f.num("1")))),
        hasToString("{ t.1 = t.1 << 1u8; p = p || true; "
            + "x = x ** (y + 1); }"));

    // A plain assignment is left alone.
    final Ast.Assign assign = f.assign(Op.ASSIGN, f.id("x"), f.num("1"));
    assertThat(mainBody(f, assign).statements.get(0), sameInstance(assign));
  }

  @Test void testInvalidAssignmentTarget() {
    final Fixtures f = new Fixtures();
    final Ast.Call call = f.call("g");
    final Ast.Program program =
        withPair(f, f.assign(Op.ADD_ASSIGN, call, f.num("1")));
    final CanonicalizeException e =
        assertFails(CanonicalizeException.Kind.INVALID_ASSIGNMENT_TARGET,
            call.span(), () -> Canonicalizer.canonicalize(program));
    assertThat(e.getMessage(),
        is("invalid assignment target 'g()' for operator '+='"));

    final Ast.Literal literal = f.u8(3);
    assertFails(CanonicalizeException.Kind.INVALID_ASSIGNMENT_TARGET,
        literal.span(),
        () -> mainBody(f, f.assign(Op.SUB_ASSIGN, literal, f.num("1"))));

    // A member of a call result is not a valid target either.
    final Ast.Exp member = f.member(f.call("g"), "x");
    assertFails(CanonicalizeException.Kind.INVALID_ASSIGNMENT_TARGET,
        member.span(),
        () -> mainBody(f, f.assign(Op.SUB_ASSIGN, member, f.num("1"))));
  }

  /** Returns the number of times that a string occurs in another. */
  private static int occurrences(String s, String sub) {
    int count = 0;
    for (int i = s.indexOf(sub); i >= 0; i = s.indexOf(sub, i + 1)) {
      ++count;
    }
    return count;
  }

  /** "let (a, b) = pair();" becomes "let $t0 = pair(); let a = $t0.0;
   * let b = $t0.1;". */
  @Test void testTupleDefinition() {
    final Fixtures f = new Fixtures();
    final Ast.Definition definition =
        f.letTuple(ImmutableList.of("a", "b"), null, f.call("pair"));
    final Ast.Block block = mainBody(f, definition, f.ret(f.id("a")));
    assertThat(block,
        hasToString("{ let $t0 = pair(); let a = $t0.0; let b = $t0.1; "
            + "return a; }"));

    final Ast.Definition temp = (Ast.Definition) block.statements.get(0);
    final Ast.Definition a = (Ast.Definition) block.statements.get(1);
    final Ast.Definition b = (Ast.Definition) block.statements.get(2);
    assertThat(temp.names, hasSize(1));
    assertThat(temp.names.get(0).mutable, is(false));
    assertThat(temp.op, is(Op.LET));
    assertThat(temp.span(), is(definition.span()));
    assertThat(a.names, hasSize(1));
    assertThat(a.names.get(0), sameInstance(definition.names.get(0)));
    assertThat(b.names.get(0), sameInstance(definition.names.get(1)));
    assertThat(a.span(), is(definition.span()));
    assertThat(b.span(), is(definition.span()));
    assertThat(a.id(), not(is(b.id())));
    assertThat(a.id(), not(is(definition.id())));
    assertThat(temp.id(), not(is(definition.id())));

    // The call is evaluated once, by the temporary.
    assertThat(temp.value, sameInstance(definition.value));
    final Ast.TupleAccess a0 = (Ast.TupleAccess) a.value;
    final Ast.TupleAccess b1 = (Ast.TupleAccess) b.value;
    assertThat(a0.index, is(0));
    assertThat(b1.index, is(1));
    assertThat(a0.tuple, hasToString("$t0"));
    assertThat(a0.tuple.id(), not(is(b1.tuple.id())));
    assertThat(a0.span(), is(definition.value.span()));
    assertThat(occurrences(block.toString(), "pair()"), is(1));
  }

  /** "let (x, y) = (y, x);" swaps; binding each name to its element would
   * make "y" see the new "x". */
  @Test void testTupleDefinitionSwap() {
    final Fixtures f = new Fixtures();
    final Ast.Block block =
        mainBody(f,
            f.letTuple(ImmutableList.of("x", "y"), null,
                f.tuple(f.id("y"), f.id("x"))),
            f.ret(f.tuple(f.id("x"), f.id("y"))));
    assertThat(block,
        hasToString("{ let $t0 = (y, x); let x = $t0.0; let y = $t0.1; "
            + "return (x, y); }"));

    // An element that refers to a name bound earlier in the same
    // definition also goes through a temporary.
    assertThat(
        mainBody(f,
            f.letTuple(ImmutableList.of("a", "b"), null,
                f.tuple(f.u8(1), f.binary(Op.ADD, f.id("a"), f.u8(1))))),
        hasToString("{ let $t0 = (1u8, a + 1u8); let a = $t0.0; "
            + "let b = $t0.1; }"));
  }

  /** "let (a, b) = g(a);" calls "g" once, with the old value of "a". */
  @Test void testTupleDefinitionRefersToBoundName() {
    final Fixtures f = new Fixtures();
    final Ast.Block block =
        mainBody(f,
            f.letTuple(ImmutableList.of("a", "b"), null,
                f.call("g", f.id("a"))));
    assertThat(block,
        hasToString("{ let $t0 = g(a); let a = $t0.0; let b = $t0.1; }"));
    assertThat(occurrences(block.toString(), "g(a)"), is(1));
  }

  /** A method that takes "mut self" changes its receiver, so it must be
   * called once however many names its result is bound to. */
  @Test void testTupleDefinitionMutSelfCall() {
    final Fixtures f = new Fixtures();
    final Ast.Function next =
        ast.function(f.nid(), ImmutableList.of(), f.id("next"),
            ImmutableList.of(ast.selfParam(f.nid(), true)),
            f.tupleType(f.prim(Op.U8), f.prim(Op.U8)),
            f.block(f.assign(Op.ADD_ASSIGN, f.implicitMember("n"), f.u8(1)),
                f.ret(f.tuple(f.implicitMember("n"), f.u8(0)))));
    final Ast.Circuit counter =
        ast.circuit(f.nid(), f.id("Counter"),
            ImmutableList.of(ast.member(f.nid(), f.id("n"), f.prim(Op.U8))),
            ImmutableList.of(next));
    final Ast.Function main =
        f.function("main",
            ImmutableList.of(f.param("c", f.namedType("Counter"))), null,
            f.letTuple(ImmutableList.of("a", "b"), null,
                f.call(f.member(f.id("c"), "next"))),
            f.ret(f.binary(Op.ADD, f.id("a"), f.id("b"))));
    final Ast.Block block =
        mainBody(f.program(ImmutableList.of(counter), ImmutableList.of(main)));
    assertThat(block,
        hasToString("{ let $t0 = c.next(); let a = $t0.0; let b = $t0.1; "
            + "return a + b; }"));
    assertThat(occurrences(block.toString(), "c.next()"), is(1));
  }

  /** Each split gets its own temporary, whose name is not used anywhere
   * else in the program. */
  @Test void testTupleDefinitionTempNames() {
    final Fixtures f = new Fixtures();
    assertThat(
        mainBody(f,
            f.let("$t0", f.u8(1)),
            f.letTuple(ImmutableList.of("a", "b"), null, f.call("pair")),
            f.letTuple(ImmutableList.of("c", "d"), null, f.call("pair"))),
        hasToString("{ let $t0 = 1u8; "
            + "let $t1 = pair(); let a = $t1.0; let b = $t1.1; "
            + "let $t2 = pair(); let c = $t2.0; let d = $t2.1; }"));
  }

  @Test void testTupleDefinitionVariants() {
    final Fixtures f = new Fixtures();

    // Tuple literal; its elements are bound directly.
    assertThat(
        mainBody(f,
            ast.definition(f.nid(), Op.LET,
                ImmutableList.of(f.mutVar("a"), f.var("b")), null,
                f.tuple(f.u8(1), f.bool(false)))),
        hasToString("{ let mut a = 1u8; let b = false; }"));

    // Declared type is split too.
    assertThat(
        mainBody(f,
            f.letTuple(ImmutableList.of("a", "b"),
                f.tupleType(f.prim(Op.U8), f.prim(Op.U8)), f.call("pair"))),
        hasToString("{ let $t0: (u8, u8) = pair(); let a: u8 = $t0.0; "
            + "let b: u8 = $t0.1; }"));

    // A call to an unknown function cannot be checked, but is split.
    assertThat(
        mainBody(f,
            f.letTuple(ImmutableList.of("a", "b", "c"), null,
                f.call("unknown"))),
        hasToString("{ let $t0 = unknown(); let a = $t0.0; "
            + "let b = $t0.1; let c = $t0.2; }"));

    // A definition inside a nested block.
    assertThat(
        mainBody(f,
            f.if_(f.bool(true),
                f.block(
                    f.letTuple(ImmutableList.of("a", "b"), null,
                        f.call("pair"))),
                null)),
        hasToString("{ if true { let $t0 = pair(); let a = $t0.0; "
            + "let b = $t0.1; } }"));
  }

  /** "let (a, b, c) = pair();" fails, because "pair" returns a 2-tuple. */
  @Test void testTupleDefinitionArityMismatch() {
    final Fixtures f = new Fixtures();
    final Ast.Definition definition =
        f.letTuple(ImmutableList.of("a", "b", "c"), null, f.call("pair"));
    final CanonicalizeException e =
        assertFails(CanonicalizeException.Kind.ARITY_MISMATCH,
            definition.span(), () -> mainBody(f, definition));
    assertThat(e.getMessage(),
        is("definition binds 3 names but its value has 2 element(s)"));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is(definition.span()
            + " Error: definition binds 3 names but its value has "
            + "2 element(s)"));

    final Ast.Definition d2 =
        f.letTuple(ImmutableList.of("a", "b"), null,
            f.tuple(f.u8(1), f.u8(2), f.u8(3)));
    assertFails(CanonicalizeException.Kind.ARITY_MISMATCH, d2.span(),
        () -> mainBody(f, d2));

    // A function with no declared output returns the empty tuple.
    final Ast.Definition d3 =
        f.letTuple(ImmutableList.of("a", "b"), null, f.call("nothing"));
    assertFails(CanonicalizeException.Kind.ARITY_MISMATCH, d3.span(),
        () -> mainBody(f, d3));

    final Ast.Definition d4 =
        f.letTuple(ImmutableList.of("a", "b"),
            f.tupleType(f.prim(Op.U8), f.prim(Op.U8), f.prim(Op.U8)),
            f.call("unknown"));
    final CanonicalizeException e4 =
        assertFails(CanonicalizeException.Kind.ARITY_MISMATCH, d4.span(),
            () -> mainBody(f, d4));
    assertThat(e4.getMessage(),
        is("definition binds 2 names but its type has 3 element(s)"));

    final Ast.Definition d5 =
        f.letTuple(ImmutableList.of("a", "b"), f.prim(Op.U8),
            f.call("unknown"));
    assertFails(CanonicalizeException.Kind.ARITY_MISMATCH, d5.span(),
        () -> mainBody(f, d5));
  }

  /** Tests a tuple definition whose value is a static call to a function
   * of a circuit. */
  @Test void testTupleDefinitionStaticCall() {
    final Fixtures f = new Fixtures();
    final Ast.Circuit circuit =
        ast.circuit(f.nid(), f.id("C"), ImmutableList.of(),
            ImmutableList.of(
                f.function("two", ImmutableList.of(),
                    f.tupleType(f.prim(Op.U8), f.prim(Op.BOOLEAN_TYPE)),
                    f.ret(f.tuple(f.u8(1), f.bool(true))))));
    final Ast.Definition ok =
        f.letTuple(ImmutableList.of("a", "b"), null,
            f.call(f.staticAccess("C", "two")));
    final Ast.Program program =
        f.program(ImmutableList.of(circuit),
            ImmutableList.of(
                f.function("main", ImmutableList.of(), null, ok)));
    assertThat(mainBody(program),
        hasToString("{ let $t0 = C::two(); let a = $t0.0; "
            + "let b = $t0.1; }"));

    final Ast.Definition bad =
        f.letTuple(ImmutableList.of("a", "b", "c"), null,
            f.call(f.staticAccess("C", "two")));
    final Ast.Program program2 =
        f.program(ImmutableList.of(circuit),
            ImmutableList.of(
                f.function("main", ImmutableList.of(), null, bad)));
    assertFails(CanonicalizeException.Kind.ARITY_MISMATCH, bad.span(),
        () -> Canonicalizer.canonicalize(program2));
  }

  @Test void testGlobalConstTuple() {
    final Fixtures f = new Fixtures();
    final Ast.Program program = f.sampleProgram();
    final Ast.Program program2 = Canonicalizer.canonicalize(program);
    assertThat(program2.globalConsts, hasSize(2));
    assertThat(program2.globalConsts.get(0), hasToString("const LO = 0u8;"));
    assertThat(program2.globalConsts.get(1),
        hasToString("const HI = 255u8;"));
    assertThat(program2.globalConsts.get(0).op, is(Op.CONST));
  }

  /** "if a {} else if b {}" becomes "if a {} else { if b {} }". */
  @Test void testElseIf() {
    final Fixtures f = new Fixtures();
    final Ast.Conditional inner =
        f.if_(f.id("c"), f.block(), f.block(f.ret(f.num("3"))));
    final Ast.Conditional middle =
        f.if_(f.id("b"), f.block(f.ret(f.num("2"))), inner);
    final Ast.Conditional outer =
        f.if_(f.id("a"), f.block(f.ret(f.num("1"))), middle);
    final Ast.Block block = mainBody(f, outer);
    assertThat(block,
        hasToString("{ if a { return 1; } else { if b { return 2; } "
            + "else { if c {} else { return 3; } } } }"));

    final Ast.Conditional outer2 = (Ast.Conditional) block.statements.get(0);
    assertThat(outer2.nodeId, sameInstance(outer.nodeId));
    assertThat(outer2.next, instanceOf(Ast.Block.class));
    assertThat(outer2.next.span(), is(middle.span()));
    final Ast.Block elseBlock = (Ast.Block) outer2.next;
    assertThat(elseBlock.statements, hasSize(1));
    assertThat(elseBlock.statements.get(0).nodeId,
        sameInstance(middle.nodeId));

    // "if" without "else", and "if" with "else", are already canonical.
    final Ast.Conditional plain = f.if_(f.id("a"), f.block(), null);
    final Ast.Conditional withElse = f.if_(f.id("a"), f.block(), f.block());
    final Ast.Block block2 = mainBody(f, plain, withElse);
    assertThat(block2.statements.get(0), sameInstance(plain));
    assertThat(block2.statements.get(1), sameInstance(withElse));
  }

  private static Ast.Exp canonicalExp(Fixtures f, Ast.Exp exp) {
    final Ast.Block block = mainBody(f, f.ret(exp));
    return ((Ast.Return) block.statements.get(0)).exp;
  }

  @Test void testGroupLiteral() {
    final Fixtures f = new Fixtures();
    final Ast.Literal literal = f.group("(0, +)group");
    final Ast.Exp exp = canonicalExp(f, literal);
    assertThat(exp, instanceOf(Ast.GroupLiteral.class));
    assertThat(exp.op, is(Op.GROUP_VALUE));
    assertThat(exp.span(), is(literal.span()));
    assertThat(exp.id(), not(is(literal.id())));
    final Ast.GroupLiteral group = (Ast.GroupLiteral) exp;
    assertThat(group.scalar, nullValue());
    assertThat(group.x, is(Ast.GroupCoordinate.number("0")));
    assertThat(group.y,
        is(Ast.GroupCoordinate.of(Ast.CoordinateKind.SIGN_HIGH)));

    assertThat(canonicalExp(f, f.group("2group")), hasToString("2group"));
    final Ast.Exp scalar = canonicalExp(f, f.group("2group"));
    assertThat(((Ast.GroupLiteral) scalar).scalar, is("2"));
    assertThat(canonicalExp(f, f.group("007group")), hasToString("7group"));
    assertThat(canonicalExp(f, f.group("-0group")), hasToString("0group"));
    assertThat(canonicalExp(f, f.group("-12group")), hasToString("-12group"));
    assertThat(canonicalExp(f, f.group("( 012 , _ )group")),
        hasToString("(12, _)group"));
    assertThat(canonicalExp(f, f.group("(-, -5)group")),
        hasToString("(-, -5)group"));
  }

  @Test void testMalformedGroupLiteral() {
    final Fixtures f = new Fixtures();
    for (String s
        : ImmutableList.of("(1, 2, 3)group", "(1)group", "(a, 1)group",
            "(1, 2)", "xgroup", "group", "1.5group", "(1, )group")) {
      final Ast.Literal literal = f.group(s);
      final CanonicalizeException e =
          assertFails(CanonicalizeException.Kind.MALFORMED_GROUP_LITERAL,
              literal.span(), () -> canonicalExp(f, literal));
      assertThat(e.getMessage(), is("malformed group literal '" + s + "'"));
    }
  }

  @Test void testAddressLiteral() {
    final Fixtures f = new Fixtures();
    final Ast.Literal literal =
        f.address("address(" + Fixtures.ADDRESS.toUpperCase() + ")");
    final Ast.Exp exp = canonicalExp(f, literal);
    assertThat(exp.op, is(Op.ADDRESS_LITERAL));
    assertThat(((Ast.Literal) exp).value, is(Fixtures.ADDRESS));
    assertThat(exp.nodeId, sameInstance(literal.nodeId));

    assertThat(
        ((Ast.Literal) canonicalExp(f,
            f.address("address(" + Fixtures.ADDRESS + ")"))).value,
        is(Fixtures.ADDRESS));

    // An address that is already canonical is not rebuilt.
    final Ast.Literal canonical = f.address(Fixtures.ADDRESS);
    assertThat(canonicalExp(f, canonical), sameInstance(canonical));
  }

  /** Tests that {@link Canonicalizer#isCanonical} agrees with
   * {@link Canonicalizer#canonicalize} about address literals. */
  @Test void testIsCanonicalAddress() {
    final Fixtures f = new Fixtures();
    final Ast.Program canonical = f.main(f.ret(f.address(Fixtures.ADDRESS)));
    assertThat(Canonicalizer.isCanonical(canonical), is(true));
    assertThat(Canonicalizer.canonicalize(canonical), sameInstance(canonical));

    // Surrounding space is trimmed, so the literal is not canonical.
    final Ast.Program spaced =
        f.main(f.ret(f.address(" " + Fixtures.ADDRESS + " ")));
    assertThat(Canonicalizer.isCanonical(spaced), is(false));
    final Ast.Program spaced2 = Canonicalizer.canonicalize(spaced);
    assertThat(spaced2, not(is(spaced)));
    assertThat(Canonicalizer.isCanonical(spaced2), is(true));

    // A malformed address, even in lower case, is not canonical.
    final Ast.Literal literal = f.address("aleo1short");
    final Ast.Program malformed = f.main(f.ret(literal));
    assertThat(Canonicalizer.isCanonical(malformed), is(false));
    assertFails(CanonicalizeException.Kind.MALFORMED_ADDRESS_LITERAL,
        literal.span(), () -> Canonicalizer.canonicalize(malformed));
  }

  @Test void testMalformedAddressLiteral() {
    final Fixtures f = new Fixtures();
    final String a = Fixtures.ADDRESS;
    final List<String> list =
        ImmutableList.of("aleo1R" + a.substring(6),
            "aleo2" + a.substring(5),
            a.substring(0, 62),
            a + "q",
            a.substring(0, 62) + "b",
            "address()");
    final List<String> reasons =
        ImmutableList.of("mixed case",
            "must start with 'aleo1'",
            "must have 63 characters",
            "must have 63 characters",
            "invalid character 'b'",
            "must start with 'aleo1'");
    for (int i = 0; i < list.size(); i++) {
      final Ast.Literal literal = f.address(list.get(i));
      final CanonicalizeException e =
          assertFails(CanonicalizeException.Kind.MALFORMED_ADDRESS_LITERAL,
              literal.span(), () -> canonicalExp(f, literal));
      assertThat(e.getMessage(),
          is("malformed address literal '" + list.get(i) + "': "
              + reasons.get(i)));
    }
  }

  /** Tests the rules that apply inside a circuit: ".x" becomes "self.x",
   * "Self" becomes the circuit's name, and "Point { x }" becomes
   * "Point { x: x }". */
  @Test void testCircuit() {
    final Fixtures f = new Fixtures();
    final Ast.Program program = f.sampleProgram();
    final Ast.Program program2 = Canonicalizer.canonicalize(program);
    final Ast.Circuit point = program2.circuits.get("Point");
    assertThat(point,
        hasToString("circuit Point { x: u32, y: u32 "
            + "function new(x: u32, y: u32) -> Point "
            + "{ return Point { x: x, y: y }; } "
            + "function norm(mut self: Point) -> u32 "
            + "{ self.x = self.x + 1u32; "
            + "return self.x * self.x + self.y ** 2u32; } "
            + "function origin() -> Point "
            + "{ return Point::new(0u32, 0u32); } }"));
    assertThat(point.nodeId,
        sameInstance(program.circuits.get("Point").nodeId));

    // The implied field value has the span of the field name.
    final Ast.Return ret =
        (Ast.Return) point.function("new").body.statements.get(0);
    final Ast.CircuitField field = ((Ast.CircuitInit) ret.exp).fields.get(0);
    assertThat(field.value, instanceOf(Ast.Id.class));
    assertThat(field.value.span(), is(field.name.span()));
    assertThat(field.value.id(), not(is(field.name.id())));
  }

  @Test void testSelfOutsideCircuit() {
    final Fixtures f = new Fixtures();
    final Ast.Id self = f.id("Self");
    final Ast.Exp selfCall =
        f.call(ast.staticAccess(f.nid(), self, f.id("new")));
    assertFails(CanonicalizeException.Kind.SELF_OUTSIDE_CIRCUIT,
        self.span(), () -> mainBody(f, f.exprStmt(selfCall)));

    final Ast.ImplicitMember member = f.implicitMember("x");
    final CanonicalizeException e =
        assertFails(CanonicalizeException.Kind.SELF_OUTSIDE_CIRCUIT,
            member.span(), () -> mainBody(f, f.ret(member)));
    assertThat(e.getMessage(), is("'.x' is only valid inside a circuit"));

    final Ast.CircuitInit init = f.circuitInit("Self");
    assertFails(CanonicalizeException.Kind.SELF_OUTSIDE_CIRCUIT,
        init.name.span(), () -> mainBody(f, f.ret(init)));

    final Ast.SelfType selfType = f.selfType();
    final Ast.Program program =
        f.program(ImmutableList.of(),
            ImmutableList.of(
                f.function("main", ImmutableList.of(), selfType)));
    assertFails(CanonicalizeException.Kind.SELF_OUTSIDE_CIRCUIT,
        selfType.span(), () -> Canonicalizer.canonicalize(program));
  }

  @Test void testMultiDimensionalArray() {
    final Fixtures f = new Fixtures();
    final Ast.ArrayInit init = f.arrayInit(f.u8(0), 2, 3, 4);
    final Ast.Exp exp = canonicalExp(f, init);
    assertThat(exp, hasToString("[[[0u8; 4]; 3]; 2]"));
    assertThat(exp.nodeId, sameInstance(init.nodeId));
    final Ast.ArrayInit middle = (Ast.ArrayInit) ((Ast.ArrayInit) exp).element;
    assertThat(middle.span(), is(init.span()));
    assertThat(middle.id(), not(is(init.id())));
    assertThat(middle.dimensions, hasToString("[3]"));
    assertThat(((Ast.ArrayInit) middle.element).element,
        sameInstance(init.element));

    final Ast.ArrayType type = f.arrayType(f.prim(Op.BOOLEAN_TYPE), 5, 6);
    final Ast.Block block =
        mainBody(f, f.let(f.var("a"), type, f.arrayInit(f.bool(true), 5, 6)));
    assertThat(block,
        hasToString("{ let a: [[bool; 6]; 5] = [[true; 6]; 5]; }"));
    final Ast.Definition definition = (Ast.Definition) block.statements.get(0);
    assertThat(definition.type.nodeId, sameInstance(type.nodeId));

    // One dimension is already canonical.
    final Ast.ArrayInit one = f.arrayInit(f.u8(0), 2);
    assertThat(canonicalExp(f, one), sameInstance(one));
  }

  /** Tests every rule at once, on a program that uses every kind of node. */
  @Test void testSample() {
    final Fixtures f = new Fixtures();
    final Ast.Program program = f.sampleProgram();
    final String before = program.toString();
    assertThat(Canonicalizer.isCanonical(program), is(false));

    final Ast.Program program2 = Canonicalizer.canonicalize(program);
    assertThat(Canonicalizer.isCanonical(program2), is(true));
    assertThat(program2.nodeId, sameInstance(program.nodeId));

    // The input is not modified.
    assertThat(program.toString(), is(before));
    assertThat(program, is(new Fixtures().sampleProgram()));

    final Ast.Function main = program2.functions.get("main");
    assertThat(main.params.get(1), hasToString("b: [[u8; 3]; 2]"));
    final List<String> expected =
        ImmutableList.of("let $t0 = pair(a);",
            "let q = $t0.0;",
            "let r = $t0.1;",
            "let mut arr: [[u8; 3]; 2] = [[0u8; 3]; 2];",
            "arr[0][1] = q;",
            "let t = (q, true);",
            "let s = arr[0][..2];",
            "let addr: address = " + Fixtures.ADDRESS + ";",
            "let f: field = 1field;",
            "let c: char = 'a';",
            "let m: string = \"hi\";",
            "let g: group = (0, +)group;",
            "let pt = Point::new(1u32, 2u32);",
            "let n = pt.norm();",
            "let v = [1u8, 2u8];",
            "for i in 0u8..3u8 { q = q + i; }",
            "if a == 0u8 { console.log(\"zero {}\", a); } "
                + "else { if a > 1u8 { console.error(\"big\"); } "
                + "else { console.assert(b[0][0] == 0u8); } }",
            "let w = a > 1u8 ? -a : ~a;",
            "let y = !true;",
            "pair(a as u8);",
            "return (q, r == 0u8);");
    assertThat(main.body.statements, hasSize(expected.size()));
    for (int i = 0; i < expected.size(); i++) {
      assertThat(main.body.statements.get(i), hasToString(expected.get(i)));
    }
  }

  /** Tests that canonicalization is idempotent. */
  @Test void testIdempotent() {
    final Ast.Program program = new Fixtures().sampleProgram();
    final Ast.Program program2 = Canonicalizer.canonicalize(program);
    final Ast.Program program3 = Canonicalizer.canonicalize(program2);
    assertThat(program3, is(program2));
    // No rule matched, so nothing was rebuilt.
    assertThat(program3, sameInstance(program2));

    // A program with no sugar comes back unchanged.
    final Fixtures f = new Fixtures();
    final Ast.Program plain =
        f.main(f.let("x", f.u8(1)), f.ret(f.binary(Op.ADD, f.id("x"),
            f.u8(2))));
    assertThat(Canonicalizer.isCanonical(plain), is(true));
    assertThat(Canonicalizer.canonicalize(plain), sameInstance(plain));
  }

  /** Tests that no two nodes of a canonical tree have the same identity,
   * and that every node that survives keeps its span. */
  @Test void testIdentitiesAndSpans() {
    final Ast.Program program = new Fixtures().sampleProgram();
    final Map<Long, Span> before = Fixtures.idSpans(program);
    final Ast.Program program2 = Canonicalizer.canonicalize(program);
    final Map<Long, Span> after = Fixtures.idSpans(program2);

    int kept = 0;
    for (Map.Entry<Long, Span> entry : after.entrySet()) {
      final Span span = before.get(entry.getKey());
      if (span != null) {
        assertThat(entry.getValue(), is(span));
        ++kept;
      }
    }
    assertThat(kept, greaterThan(before.size() / 2));
    assertThat(after.size(), greaterThan(kept));
  }
}

// End CanonicalizerTest.java
