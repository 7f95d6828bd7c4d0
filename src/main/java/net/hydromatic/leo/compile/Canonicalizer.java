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
import static net.hydromatic.leo.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import net.hydromatic.leo.ast.Ast;
import net.hydromatic.leo.ast.AstNode;
import net.hydromatic.leo.ast.Director;
import net.hydromatic.leo.ast.NodeId;
import net.hydromatic.leo.ast.Op;
import net.hydromatic.leo.ast.Reducer;
import net.hydromatic.leo.ast.Span;
import net.hydromatic.leo.ast.Visitor;
import org.apache.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites syntactic sugar into a smaller, canonical vocabulary.
 *
 * <p>The rewrites are:
 *
 * <ul>
 * <li>compound assignment: {@code x += 1} becomes {@code x = x + 1};
 * <li>tuple definition: {@code let (a, b) = f();} becomes
 *   {@code let $t0 = f(); let a = $t0.0; let b = $t0.1;}, so that
 *   {@code f()} is evaluated once; {@code let (a, b) = (1, x);} becomes
 *   {@code let a = 1; let b = x;} when no element refers to a name being
 *   bound;
 * <li>"else if": {@code if a {} else if b {}} becomes
 *   {@code if a {} else { if b {} }};
 * <li>group literal: the text of the literal is parsed into an
 *   {@link Ast.GroupLiteral};
 * <li>address literal: {@code address(ALEO1...)} becomes {@code aleo1...};
 * <li>implicit member: {@code .x} becomes {@code self.x};
 * <li>{@code Self}, as a type, as in {@code Self::f}, or as in
 *   {@code Self { ... }}, becomes the name of the enclosing circuit;
 * <li>multi-dimensional array: {@code [u8; (2, 3)]} becomes
 *   {@code [[u8; 3]; 2]}, and likewise array initializers;
 * <li>implied circuit field: {@code Foo { x }} becomes
 *   {@code Foo { x: x }}.
 * </ul>
 *
 * <p>No rule matches its own output, so canonicalization is idempotent.
 * A node that no rule touches keeps its {@link NodeId} and span. A node
 * that replaces a construct of a different kind gets a new identity with the
 * span of the construct it replaces.
 *
 * <p>An instance holds the state of one pass; use
 * {@link #canonicalize(Ast.Program)}.
 */
public class Canonicalizer implements Reducer {
  private static final Logger LOGGER = Logger.getLogger(Canonicalizer.class);

  /** Characters allowed in the data part of an address. */
  private static final String BECH32_CHARSET =
      "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
  private static final String ADDRESS_PREFIX = "aleo1";
  private static final int ADDRESS_LENGTH = 63;

  private static final Pattern NUMBER = Pattern.compile("-?[0-9]+");
  private static final String GROUP_SUFFIX = "group";

  /** Prefix of the names of temporary variables. "$" cannot start an
   * identifier in Leo source. */
  static final String TEMP_PREFIX = "$t";

  private Ast.@Nullable Program program;
  /** The circuit whose members are being reduced, or null. */
  private Ast.@Nullable Circuit circuit;
  private int rewriteCount;
  /** Names in the program, and temporaries created so far. */
  private final Set<String> usedNames = new HashSet<>();
  private int tempCount;

  private Canonicalizer() {}

  /** Canonicalizes a program, returning a new program.
   *
   * <p>The argument is not modified.
   *
   * @throws CanonicalizeException if the program contains a construct that
   * cannot be canonicalized */
  public static Ast.Program canonicalize(Ast.Program program) {
    final Canonicalizer canonicalizer = new Canonicalizer();
    LOGGER.debug("canonicalizing program '" + program.name + "'");
    final Ast.Program program2 =
        new Director(canonicalizer).reduceProgram(program);
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("canonicalized program '" + program.name + "'; "
          + canonicalizer.rewriteCount + " rewrite(s)");
    }
    return program2;
  }

  /** Returns whether a program contains none of the constructs that
   * canonicalization rewrites. */
  public static boolean isCanonical(Ast.Program program) {
    final SugarFinder finder = new SugarFinder();
    program.accept(finder);
    return finder.sugar == null;
  }

  private void rewrote(String rule, Span span) {
    ++rewriteCount;
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("rewrote " + rule + " at " + span);
    }
  }

  private Ast.Circuit enclosingCircuit(String what, Span span) {
    if (circuit == null) {
      throw new CanonicalizeException(
          CanonicalizeException.Kind.SELF_OUTSIDE_CIRCUIT,
          what + " is only valid inside a circuit", span);
    }
    return circuit;
  }

  @Override public void enterProgram(Ast.Program program) {
    this.program = program;
    usedNames.addAll(names(program));
  }

  @Override public void enterCircuit(Ast.Circuit circuit) {
    this.circuit = circuit;
  }

  @Override public void exitCircuit(Ast.Circuit circuit) {
    this.circuit = null;
  }

  // declarations

  @Override public Ast.Program reduceProgram(Ast.Program program,
      List<Ast.Import> imports, List<Ast.Circuit> circuits,
      List<Ast.Function> functions, List<Ast.Definition> globalConsts) {
    final List<Ast.Definition> consts = new ArrayList<>();
    globalConsts.forEach(d -> consts.addAll(split(d)));
    return program.copy(imports, circuits, functions, consts);
  }

  // statements

  @Override public Ast.Stmt reduceAssign(Ast.Assign assign, Ast.Exp target,
      Ast.Exp value) {
    if (!assign.isCompound()) {
      return assign.copy(target, value);
    }
    if (!isAssignable(target)) {
      throw new CanonicalizeException(
          CanonicalizeException.Kind.INVALID_ASSIGNMENT_TARGET,
          "invalid assignment target '" + target + "' for operator '"
              + assign.op.padded.trim() + "'",
          target.span());
    }
    final Ast.Binary binary =
        ast.binary(NodeId.of(target.span().plus(value.span())),
            assign.op.toBinary(), FreshCopier.copy(target), value);
    rewrote("compound assignment", assign.span());
    return ast.assign(assign.nodeId, Op.ASSIGN, target, binary);
  }

  /** Returns whether an expression is a path that can be assigned to:
   * a variable, or a member, element or slice of such a path. */
  static boolean isAssignable(Ast.Exp exp) {
    switch (exp.op) {
    case ID:
      return true;
    case MEMBER_ACCESS:
      return isAssignable(((Ast.MemberAccess) exp).inner);
    case ARRAY_ACCESS:
      return isAssignable(((Ast.ArrayAccess) exp).array);
    case ARRAY_RANGE_ACCESS:
      return isAssignable(((Ast.ArrayRangeAccess) exp).array);
    case TUPLE_ACCESS:
      return isAssignable(((Ast.TupleAccess) exp).tuple);
    default:
      return false;
    }
  }

  @Override public Ast.Definition reduceDefinition(Ast.Definition definition,
      List<Ast.VariableName> names, Ast.@Nullable Type type, Ast.Exp value) {
    final Ast.Definition definition2 = definition.copy(names, type, value);
    if (names.size() > 1) {
      checkArity(definition2);
    }
    return definition2;
  }

  private void checkArity(Ast.Definition definition) {
    final int nameCount = definition.names.size();
    final int valueArity = arity(definition.value);
    if (valueArity >= 0 && valueArity != nameCount) {
      throw new CanonicalizeException(
          CanonicalizeException.Kind.ARITY_MISMATCH,
          "definition binds " + nameCount + " names but its value has "
              + valueArity + " element(s)",
          definition.span());
    }
    if (definition.type != null) {
      final int typeArity = definition.type instanceof Ast.TupleType
          ? ((Ast.TupleType) definition.type).types.size()
          : 1;
      if (typeArity != nameCount) {
        throw new CanonicalizeException(
            CanonicalizeException.Kind.ARITY_MISMATCH,
            "definition binds " + nameCount + " names but its type has "
                + typeArity + " element(s)",
            definition.span());
      }
    }
  }

  /** Returns the number of elements of the tuple that an expression
   * produces, or -1 if it cannot be determined without type inference. */
  private int arity(Ast.Exp exp) {
    if (exp instanceof Ast.TupleInit) {
      return ((Ast.TupleInit) exp).elements.size();
    }
    if (exp instanceof Ast.Call) {
      final Ast.Function function = callee((Ast.Call) exp);
      if (function != null) {
        if (function.output == null) {
          return 0;
        }
        return function.output instanceof Ast.TupleType
            ? ((Ast.TupleType) function.output).types.size()
            : 1;
      }
    }
    return -1;
  }

  /** Returns the function that a call invokes, if it is a top-level
   * function or a static function of a circuit in this program. */
  private Ast.@Nullable Function callee(Ast.Call call) {
    final Ast.Program program = requireNonNull(this.program);
    if (call.function instanceof Ast.Id) {
      return program.functions.get(((Ast.Id) call.function).name);
    }
    if (call.function instanceof Ast.StaticAccess) {
      final Ast.StaticAccess access = (Ast.StaticAccess) call.function;
      if (access.inner instanceof Ast.Id) {
        final Ast.Circuit circuit =
            program.circuits.get(((Ast.Id) access.inner).name);
        if (circuit != null) {
          return circuit.function(access.name.name);
        }
      }
    }
    return null;
  }

  /** Splits a definition that binds several names into one definition per
   * name. The arity has already been checked.
   *
   * <p>If the value is a tuple literal none of whose elements refers to a
   * name being bound, each name is bound to its element. Otherwise the
   * value is bound once to a temporary, and each name to an element of the
   * temporary. */
  private List<Ast.Definition> split(Ast.Definition definition) {
    if (definition.names.size() == 1) {
      return ImmutableList.of(definition);
    }
    final Span span = definition.span();
    final ImmutableList.Builder<Ast.Definition> b = ImmutableList.builder();
    final @Nullable String temp;
    if (definition.value instanceof Ast.TupleInit
        && !refersTo(definition.value, definition.names)) {
      temp = null;
    } else {
      temp = newTempName();
      final Ast.Type tempType = definition.type == null
          ? null
          : FreshCopier.copy(definition.type);
      b.add(
          ast.definition(NodeId.of(span), definition.op,
              ImmutableList.of(
                  ast.variableName(NodeId.of(span), ast.id(span, temp),
                      false)),
              tempType, definition.value));
    }
    for (int i = 0; i < definition.names.size(); i++) {
      final Ast.Type type = definition.type == null
          ? null
          : ((Ast.TupleType) definition.type).types.get(i);
      final Ast.Exp value;
      if (temp == null) {
        value = ((Ast.TupleInit) definition.value).elements.get(i);
      } else {
        final Span valueSpan = definition.value.span();
        value =
            ast.tupleAccess(NodeId.of(valueSpan), ast.id(valueSpan, temp),
                i);
      }
      b.add(
          ast.definition(NodeId.of(span), definition.op,
              ImmutableList.of(definition.names.get(i)), type, value));
    }
    rewrote("tuple definition", span);
    return b.build();
  }

  /** Returns a name for a temporary variable that is not used elsewhere in
   * the program. */
  private String newTempName() {
    for (;;) {
      final String name = TEMP_PREFIX + tempCount++;
      if (usedNames.add(name)) {
        return name;
      }
    }
  }

  /** Returns whether an expression refers to any of the given names. */
  private static boolean refersTo(Ast.Exp exp,
      List<Ast.VariableName> variableNames) {
    final Set<String> names = names(exp);
    for (Ast.VariableName variableName : variableNames) {
      if (names.contains(variableName.name.name)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the names of all identifiers in a tree, member and field
   * names included. */
  static Set<String> names(AstNode node) {
    final Set<String> names = new HashSet<>();
    node.accept(new Visitor() {
      @Override protected void visit(Ast.Id id) {
        names.add(id.name);
      }
    });
    return names;
  }

  @Override public Ast.Block reduceBlock(Ast.Block block,
      List<Ast.Stmt> statements) {
    final List<Ast.Stmt> list = new ArrayList<>();
    for (Ast.Stmt statement : statements) {
      if (statement instanceof Ast.Definition) {
        list.addAll(split((Ast.Definition) statement));
      } else {
        list.add(statement);
      }
    }
    return block.copy(list);
  }

  @Override public Ast.Stmt reduceConditional(Ast.Conditional conditional,
      Ast.Exp condition, Ast.Block block, Ast.@Nullable Stmt next) {
    if (next instanceof Ast.Conditional) {
      next = ast.block(NodeId.of(next.span()), ImmutableList.of(next));
      rewrote("else if", next.span());
    }
    return conditional.copy(condition, block, next);
  }

  // expressions

  @Override public Ast.Exp reduceLiteral(Ast.Literal literal) {
    switch (literal.op) {
    case GROUP_LITERAL:
      rewrote("group literal", literal.span());
      return groupLiteral(literal);
    case ADDRESS_LITERAL:
      final String address = canonicalAddress(literal);
      if (address.equals(literal.value)) {
        return literal;
      }
      rewrote("address literal", literal.span());
      return ast.addressLiteral(literal.nodeId, address);
    default:
      return literal;
    }
  }

  /** Parses the text of a group literal, "2group" or "(x, y)group". */
  private static Ast.GroupLiteral groupLiteral(Ast.Literal literal) {
    final String text = literal.value.trim();
    if (text.endsWith(GROUP_SUFFIX)) {
      final String body =
          text.substring(0, text.length() - GROUP_SUFFIX.length()).trim();
      final NodeId nodeId = NodeId.of(literal.span());
      if (body.startsWith("(") && body.endsWith(")")) {
        final String[] parts =
            body.substring(1, body.length() - 1).split(",", -1);
        if (parts.length == 2) {
          final Ast.GroupCoordinate x = coordinate(parts[0]);
          final Ast.GroupCoordinate y = coordinate(parts[1]);
          if (x != null && y != null) {
            return ast.groupPoint(nodeId, x, y);
          }
        }
      } else {
        final String scalar = normalizeNumber(body);
        if (scalar != null) {
          return ast.groupScalar(nodeId, scalar);
        }
      }
    }
    throw new CanonicalizeException(
        CanonicalizeException.Kind.MALFORMED_GROUP_LITERAL,
        "malformed group literal '" + literal.value + "'", literal.span());
  }

  private static Ast.@Nullable GroupCoordinate coordinate(String s) {
    switch (s.trim()) {
    case "+":
      return Ast.GroupCoordinate.of(Ast.CoordinateKind.SIGN_HIGH);
    case "-":
      return Ast.GroupCoordinate.of(Ast.CoordinateKind.SIGN_LOW);
    case "_":
      return Ast.GroupCoordinate.of(Ast.CoordinateKind.INFERRED);
    default:
      final String number = normalizeNumber(s.trim());
      return number == null ? null : Ast.GroupCoordinate.number(number);
    }
  }

  /** Removes leading zeros from a decimal integer; returns null if the
   * string is not one. "-0" becomes "0". */
  static @Nullable String normalizeNumber(String s) {
    if (!NUMBER.matcher(s).matches()) {
      return null;
    }
    final boolean negative = s.startsWith("-");
    String digits = negative ? s.substring(1) : s;
    int i = 0;
    while (i < digits.length() - 1 && digits.charAt(i) == '0') {
      ++i;
    }
    digits = digits.substring(i);
    return negative && !digits.equals("0") ? "-" + digits : digits;
  }

  /** Returns the canonical text of an address literal: lower case, without
   * an "address(...)" wrapper. */
  static String canonicalAddress(Ast.Literal literal) {
    String s = literal.value.trim();
    if (s.startsWith("address(") && s.endsWith(")")) {
      s = s.substring("address(".length(), s.length() - 1).trim();
    }
    final String lower = s.toLowerCase(Locale.ROOT);
    if (!s.equals(lower) && !s.equals(s.toUpperCase(Locale.ROOT))) {
      throw malformedAddress(literal, "mixed case");
    }
    if (!lower.startsWith(ADDRESS_PREFIX)) {
      throw malformedAddress(literal,
          "must start with '" + ADDRESS_PREFIX + "'");
    }
    if (lower.length() != ADDRESS_LENGTH) {
      throw malformedAddress(literal,
          "must have " + ADDRESS_LENGTH + " characters");
    }
    for (int i = ADDRESS_PREFIX.length(); i < lower.length(); i++) {
      if (BECH32_CHARSET.indexOf(lower.charAt(i)) < 0) {
        throw malformedAddress(literal,
            "invalid character '" + lower.charAt(i) + "'");
      }
    }
    return lower;
  }

  private static CanonicalizeException malformedAddress(Ast.Literal literal,
      String reason) {
    return new CanonicalizeException(
        CanonicalizeException.Kind.MALFORMED_ADDRESS_LITERAL,
        "malformed address literal '" + literal.value + "': " + reason,
        literal.span());
  }

  @Override public Ast.Exp reduceImplicitMember(
      Ast.ImplicitMember implicitMember, Ast.Id name) {
    final Span span = implicitMember.span();
    enclosingCircuit("'." + name.name + "'", span);
    rewrote("implicit member", span);
    return ast.memberAccess(NodeId.of(span), ast.id(span, Ast.Id.SELF),
        name);
  }

  @Override public Ast.Exp reduceStaticAccess(Ast.StaticAccess staticAccess,
      Ast.Exp inner, Ast.Id name) {
    if (inner instanceof Ast.Id
        && ((Ast.Id) inner).name.equals(Ast.Id.SELF_TYPE)) {
      inner = circuitName(inner.span());
    }
    return staticAccess.copy(inner, name);
  }

  @Override public Ast.Exp reduceCircuitInit(Ast.CircuitInit circuitInit,
      Ast.Id name, List<Ast.CircuitField> fields) {
    if (name.name.equals(Ast.Id.SELF_TYPE)) {
      name = circuitName(name.span());
    }
    return circuitInit.copy(name, fields);
  }

  /** Creates a reference to the enclosing circuit, to replace "Self". */
  private Ast.Id circuitName(Span span) {
    final Ast.Circuit circuit = enclosingCircuit("'Self'", span);
    rewrote("Self", span);
    return ast.id(span, circuit.name.name);
  }

  @Override public Ast.CircuitField reduceCircuitField(
      Ast.CircuitField circuitField, Ast.Id name, Ast.@Nullable Exp value) {
    if (value == null) {
      value = ast.id(name.span(), name.name);
      rewrote("implied circuit field", circuitField.span());
    }
    return circuitField.copy(name, value);
  }

  @Override public Ast.Exp reduceArrayInit(Ast.ArrayInit arrayInit,
      Ast.Exp element) {
    final List<Integer> dimensions = arrayInit.dimensions;
    if (dimensions.size() == 1) {
      return arrayInit.copy(element);
    }
    Ast.Exp e = element;
    for (int i = dimensions.size() - 1; i > 0; i--) {
      e = ast.arrayInit(NodeId.of(arrayInit.span()), e,
          ImmutableList.of(dimensions.get(i)));
    }
    rewrote("multi-dimensional array", arrayInit.span());
    return ast.arrayInit(arrayInit.nodeId, e,
        ImmutableList.of(dimensions.get(0)));
  }

  // types

  @Override public Ast.Type reduceArrayType(Ast.ArrayType arrayType,
      Ast.Type element) {
    final List<Integer> dimensions = arrayType.dimensions;
    if (dimensions.size() == 1) {
      return arrayType.copy(element);
    }
    Ast.Type t = element;
    for (int i = dimensions.size() - 1; i > 0; i--) {
      t = ast.arrayType(NodeId.of(arrayType.span()), t,
          ImmutableList.of(dimensions.get(i)));
    }
    rewrote("multi-dimensional array type", arrayType.span());
    return ast.arrayType(arrayType.nodeId, t,
        ImmutableList.of(dimensions.get(0)));
  }

  @Override public Ast.Type reduceSelfType(Ast.SelfType selfType) {
    final Span span = selfType.span();
    return ast.namedType(NodeId.of(span), circuitName(span));
  }

  /** Finds the first construct that canonicalization would rewrite. */
  private static class SugarFinder extends Visitor {
    @Nullable String sugar;

    private void found(String what) {
      if (sugar == null) {
        sugar = what;
      }
    }

    @Override protected void visit(Ast.Definition definition) {
      if (definition.names.size() > 1) {
        found("tuple definition");
      }
      super.visit(definition);
    }

    @Override protected void visit(Ast.Assign assign) {
      if (assign.isCompound()) {
        found("compound assignment");
      }
      super.visit(assign);
    }

    @Override protected void visit(Ast.Conditional conditional) {
      if (conditional.next instanceof Ast.Conditional) {
        found("else if");
      }
      super.visit(conditional);
    }

    @Override protected void visit(Ast.Literal literal) {
      if (literal.op == Op.GROUP_LITERAL) {
        found("group literal");
      } else if (literal.op == Op.ADDRESS_LITERAL
          && !isCanonicalAddress(literal)) {
        found("address literal");
      }
    }

    /** Returns whether an address literal would come out of
     * {@link #canonicalAddress} unchanged. A malformed address is not
     * canonical. */
    private static boolean isCanonicalAddress(Ast.Literal literal) {
      try {
        return canonicalAddress(literal).equals(literal.value);
      } catch (CanonicalizeException e) {
        return false;
      }
    }

    @Override protected void visit(Ast.ImplicitMember implicitMember) {
      found("implicit member");
    }

    @Override protected void visit(Ast.Id id) {
      if (id.name.equals(Ast.Id.SELF_TYPE)) {
        found("Self");
      }
    }

    @Override protected void visit(Ast.SelfType selfType) {
      found("Self");
    }

    @Override protected void visit(Ast.CircuitField circuitField) {
      if (circuitField.value == null) {
        found("implied circuit field");
      }
      super.visit(circuitField);
    }

    @Override protected void visit(Ast.ArrayInit arrayInit) {
      if (arrayInit.dimensions.size() > 1) {
        found("multi-dimensional array");
      }
      super.visit(arrayInit);
    }

    @Override protected void visit(Ast.ArrayType arrayType) {
      if (arrayType.dimensions.size() > 1) {
        found("multi-dimensional array type");
      }
      super.visit(arrayType);
    }
  }
}

// End Canonicalizer.java
