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

import com.google.common.collect.ImmutableMap;
import java.util.Locale;

/** Sub-types of {@link AstNode}, and the operators they carry. */
public enum Op {
  // declarations
  PROGRAM,
  IMPORT,
  IMPORT_SYMBOL,
  CIRCUIT,
  MEMBER,
  FUNCTION,
  PARAM,
  ANNOTATION,

  // statements
  RETURN,
  LET("let "),
  CONST("const "),
  VARIABLE_NAME,
  CONDITIONAL,
  ITERATION,
  CONSOLE_ASSERT("assert"),
  CONSOLE_LOG("log"),
  CONSOLE_ERROR("error"),
  EXPRESSION_STMT,
  BLOCK,

  // assignment; every compound operator names its binary operator
  ASSIGN(" = "),
  ADD_ASSIGN(" += "),
  SUB_ASSIGN(" -= "),
  MUL_ASSIGN(" *= "),
  DIV_ASSIGN(" /= "),
  MOD_ASSIGN(" %= "),
  POW_ASSIGN(" **= "),
  AND_ASSIGN(" &&= "),
  OR_ASSIGN(" ||= "),
  BIT_AND_ASSIGN(" &= "),
  BIT_OR_ASSIGN(" |= "),
  BIT_XOR_ASSIGN(" ^= "),
  SHL_ASSIGN(" <<= "),
  SHR_ASSIGN(" >>= "),
  SHR_SIGNED_ASSIGN(" >>>= "),

  // literals
  BOOL_LITERAL(true),
  INT_LITERAL(true),
  /** Number without a type suffix, e.g. "5"; its type is inferred later. */
  IMPLICIT_LITERAL(true),
  FIELD_LITERAL(true),
  /** Group literal as written, e.g. "(0, _)group"; not canonical. */
  GROUP_LITERAL(true),
  /** Group literal after canonicalization; see {@link Ast.GroupLiteral}. */
  GROUP_VALUE(true),
  ADDRESS_LITERAL(true),
  STRING_LITERAL(true),
  CHAR_LITERAL(true),

  // identifiers
  ID(true),
  /** Receiver-less member reference, ".x", inside a circuit. */
  IMPLICIT_MEMBER(true),

  // prefix operators
  NOT("!", 16),
  NEGATE("-", 16),
  BIT_NOT("~", 16),

  // infix operators
  CAST(" as ", 15),
  POW(" ** ", 14, false),
  MUL(" * ", 13),
  DIV(" / ", 13),
  MOD(" % ", 13),
  ADD(" + ", 12),
  SUB(" - ", 12),
  SHL(" << ", 11),
  SHR(" >> ", 11),
  SHR_SIGNED(" >>> ", 11),
  BIT_AND(" & ", 10),
  BIT_XOR(" ^ ", 9),
  BIT_OR(" | ", 8),
  EQ(" == ", 7),
  NE(" != ", 7),
  LT(" < ", 7),
  LE(" <= ", 7),
  GT(" > ", 7),
  GE(" >= ", 7),
  AND(" && ", 6),
  OR(" || ", 5),
  TERNARY(" ? ", 4, false),

  // postfix and other compound expressions
  CALL("(", 20),
  ARRAY_ACCESS("[", 20),
  ARRAY_RANGE_ACCESS("[", 20),
  TUPLE_ACCESS(".", 20),
  MEMBER_ACCESS(".", 20),
  STATIC_ACCESS("::", 20),
  ARRAY_INLINE(true),
  ARRAY_INIT(true),
  TUPLE_INIT(true),
  CIRCUIT_INIT(true),
  CIRCUIT_FIELD,

  // types
  ADDRESS_TYPE("address"),
  BOOLEAN_TYPE("bool"),
  CHAR_TYPE("char"),
  FIELD_TYPE("field"),
  GROUP_TYPE("group"),
  STRING_TYPE("string"),
  I8("i8"),
  I16("i16"),
  I32("i32"),
  I64("i64"),
  I128("i128"),
  U8("u8"),
  U16("u16"),
  U32("u32"),
  U64("u64"),
  U128("u128"),
  ARRAY_TYPE,
  TUPLE_TYPE,
  NAMED_TYPE,
  /** The "Self" type; valid only inside a circuit, until canonicalized. */
  SELF_TYPE("Self");

  /** Padded name, e.g. " + ", or the keyword of a primitive type. */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  /** Primitive types, keyed by their keyword, e.g. "u8" maps to {@link #U8}. */
  public static final ImmutableMap<String, Op> BY_TYPE_KEYWORD;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      if (op.isPrimitiveType()) {
        b.put(op.padded, op);
      }
    }
    BY_TYPE_KEYWORD = b.build();
  }

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns the name in lower case, e.g. "group_literal". */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns whether this is a fixed-width integer type. */
  public boolean isInteger() {
    switch (this) {
    case I8:
    case I16:
    case I32:
    case I64:
    case I128:
    case U8:
    case U16:
    case U32:
    case U64:
    case U128:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether this is the op of an {@link Ast.PrimitiveType}. */
  public boolean isPrimitiveType() {
    switch (this) {
    case ADDRESS_TYPE:
    case BOOLEAN_TYPE:
    case CHAR_TYPE:
    case FIELD_TYPE:
    case GROUP_TYPE:
    case STRING_TYPE:
      return true;
    default:
      return isInteger();
    }
  }

  /** Returns whether this is the op of an {@link Ast.Literal}. */
  public boolean isLiteral() {
    switch (this) {
    case BOOL_LITERAL:
    case INT_LITERAL:
    case IMPLICIT_LITERAL:
    case FIELD_LITERAL:
    case GROUP_LITERAL:
    case ADDRESS_LITERAL:
    case STRING_LITERAL:
    case CHAR_LITERAL:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether this is the op of an {@link Ast.Unary}. */
  public boolean isUnary() {
    return this == NOT || this == NEGATE || this == BIT_NOT;
  }

  /** Returns whether this is the op of an {@link Ast.Binary}. */
  public boolean isBinary() {
    return ordinal() >= POW.ordinal() && ordinal() <= OR.ordinal();
  }

  /** Returns whether this is the op of an {@link Ast.Assign}. */
  public boolean isAssign() {
    return ordinal() >= ASSIGN.ordinal()
        && ordinal() <= SHR_SIGNED_ASSIGN.ordinal();
  }

  /** Returns whether this is the op of an {@link Ast.Console}. */
  public boolean isConsole() {
    return this == CONSOLE_ASSERT || this == CONSOLE_LOG
        || this == CONSOLE_ERROR;
  }

  /**
   * Converts a compound assignment operator to the binary operator it
   * applies; for example, {@code ADD_ASSIGN} becomes {@code ADD}.
   */
  public Op toBinary() {
    switch (this) {
    case ADD_ASSIGN:
      return ADD;
    case SUB_ASSIGN:
      return SUB;
    case MUL_ASSIGN:
      return MUL;
    case DIV_ASSIGN:
      return DIV;
    case MOD_ASSIGN:
      return MOD;
    case POW_ASSIGN:
      return POW;
    case AND_ASSIGN:
      return AND;
    case OR_ASSIGN:
      return OR;
    case BIT_AND_ASSIGN:
      return BIT_AND;
    case BIT_OR_ASSIGN:
      return BIT_OR;
    case BIT_XOR_ASSIGN:
      return BIT_XOR;
    case SHL_ASSIGN:
      return SHL;
    case SHR_ASSIGN:
      return SHR;
    case SHR_SIGNED_ASSIGN:
      return SHR_SIGNED;
    default:
      throw new AssertionError("not a compound assignment: " + this);
    }
  }
}

// End Op.java
