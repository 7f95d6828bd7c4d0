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
package net.hydromatic.leo.json;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.leo.ast.AstBuilder.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.regex.Pattern;
import net.hydromatic.leo.ast.Ast;
import net.hydromatic.leo.ast.AstNode;
import net.hydromatic.leo.ast.NodeId;
import net.hydromatic.leo.ast.Op;
import net.hydromatic.leo.ast.Span;
import net.hydromatic.leo.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts syntax trees to and from JSON.
 *
 * <p>Every node becomes a JSON object with the fields
 *
 * <ul>
 * <li>{@code kind}, the name of the node's class, such as "Binary";
 * <li>{@code id}, the number of its {@link NodeId};
 * <li>{@code span}, an object with {@code file}, {@code startLine},
 *   {@code startColumn}, {@code endLine} and {@code endColumn};
 * <li>{@code op}, for those classes whose nodes may have one of several
 *   operators, such as "ADD";
 * </ul>
 *
 * <p>plus one field for each of the node's own fields, under the same name.
 * A field whose value is absent is written as {@code null}.
 *
 * <p>Reading a document re-creates every node with its original
 * {@link NodeId}, so a tree that is written and read back is equal to the
 * original and has the same identities and spans.
 */
public class AstJson {
  private static final Pattern NUMBER = Pattern.compile("-?[0-9]+");

  private final ObjectMapper mapper;
  private final boolean pretty;
  private final boolean failOnUnknownProperties;

  /** Creates an AstJson.
   *
   * @param pretty Whether to indent the output
   * @param failOnUnknownProperties Whether to reject documents whose objects
   *   have fields that the node does not define */
  public AstJson(boolean pretty, boolean failOnUnknownProperties) {
    this.pretty = pretty;
    this.failOnUnknownProperties = failOnUnknownProperties;
    this.mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
  }

  /** Converts a node, and its descendants, to a JSON tree. */
  public ObjectNode toJsonNode(AstNode node) {
    return new Encoder().encode(node);
  }

  /** Converts a node, and its descendants, to a JSON string. */
  public String toJson(AstNode node) throws JsonProcessingException {
    final ObjectNode json = toJsonNode(node);
    return pretty
        ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json)
        : mapper.writeValueAsString(json);
  }

  /** Parses a JSON string into a program.
   *
   * @throws JsonProcessingException if the string is not valid JSON
   * @throws DecodeException if the JSON does not describe a program */
  public Ast.Program toProgram(String json) throws JsonProcessingException {
    return toProgram(mapper.readTree(json));
  }

  /** Converts a JSON tree into a program.
   *
   * @throws DecodeException if the JSON does not describe a program */
  public Ast.Program toProgram(@Nullable JsonNode json) {
    return new Decoder().program(json, "$");
  }

  /** Converts a JSON tree into an expression. */
  public Ast.Exp toExp(JsonNode json) {
    return new Decoder().exp(json, "$");
  }

  /** Converts a JSON tree into a statement. */
  public Ast.Stmt toStmt(JsonNode json) {
    return new Decoder().stmt(json, "$");
  }

  /** Converts a JSON tree into a type. */
  public Ast.Type toType(JsonNode json) {
    return new Decoder().type(json, "$");
  }

  /** Thrown when a JSON document is well-formed but does not describe a
   * syntax tree. */
  public static class DecodeException extends RuntimeException {
    /** Location of the offending value, for example
     * "$.functions[0].body.statements[1].op". */
    public final String path;

    DecodeException(String path, String message, @Nullable Throwable cause) {
      super(path + ": " + message, cause);
      this.path = requireNonNull(path);
    }
  }

  /** Converts nodes into JSON objects. */
  private class Encoder extends Visitor {
    private @Nullable ObjectNode last;

    ObjectNode encode(AstNode node) {
      node.accept(this);
      return requireNonNull(last);
    }

    private JsonNode encodeNullable(@Nullable AstNode node) {
      return node == null ? mapper.nullNode() : encode(node);
    }

    private ArrayNode encodeAll(List<? extends AstNode> nodes) {
      final ArrayNode array = mapper.createArrayNode();
      nodes.forEach(node -> array.add(encode(node)));
      return array;
    }

    private ArrayNode ints(List<Integer> list) {
      final ArrayNode array = mapper.createArrayNode();
      list.forEach(i -> array.add(i.intValue()));
      return array;
    }

    /** Creates an object with the fields common to all nodes. */
    private ObjectNode start(AstNode node) {
      final ObjectNode o = mapper.createObjectNode();
      o.put("kind", node.getClass().getSimpleName());
      o.put("id", node.id());
      final Span span = node.span();
      final ObjectNode spanNode = o.putObject("span");
      spanNode.put("file", span.file);
      spanNode.put("startLine", span.startLine);
      spanNode.put("startColumn", span.startColumn);
      spanNode.put("endLine", span.endLine);
      spanNode.put("endColumn", span.endColumn);
      return o;
    }

    private ObjectNode startWithOp(AstNode node) {
      return start(node).put("op", node.op.name());
    }

    // declarations

    @Override protected void visit(Ast.Program program) {
      final ObjectNode o = start(program);
      o.put("name", program.name);
      o.set("imports", encodeAll(program.imports));
      o.set("circuits",
          encodeAll(ImmutableList.copyOf(program.circuits.values())));
      o.set("functions",
          encodeAll(ImmutableList.copyOf(program.functions.values())));
      o.set("globalConsts", encodeAll(program.globalConsts));
      last = o;
    }

    @Override protected void visit(Ast.Import anImport) {
      final ObjectNode o = start(anImport);
      o.set("path", encodeAll(anImport.path));
      o.set("alias", encodeNullable(anImport.alias));
      o.set("symbols", encodeAll(anImport.symbols));
      o.put("star", anImport.star);
      last = o;
    }

    @Override protected void visit(Ast.ImportSymbol importSymbol) {
      final ObjectNode o = start(importSymbol);
      o.set("name", encode(importSymbol.name));
      o.set("alias", encodeNullable(importSymbol.alias));
      last = o;
    }

    @Override protected void visit(Ast.Circuit circuit) {
      final ObjectNode o = start(circuit);
      o.set("name", encode(circuit.name));
      o.set("members", encodeAll(circuit.members));
      o.set("functions", encodeAll(circuit.functions));
      last = o;
    }

    @Override protected void visit(Ast.Member member) {
      final ObjectNode o = start(member);
      o.set("name", encode(member.name));
      o.set("type", encode(member.type));
      last = o;
    }

    @Override protected void visit(Ast.Function function) {
      final ObjectNode o = start(function);
      o.set("annotations", encodeAll(function.annotations));
      o.set("name", encode(function.name));
      o.set("params", encodeAll(function.params));
      o.set("output", encodeNullable(function.output));
      o.set("body", encode(function.body));
      last = o;
    }

    @Override protected void visit(Ast.Param param) {
      final ObjectNode o = start(param);
      o.set("name", encode(param.name));
      o.set("type", encode(param.type));
      o.put("isConst", param.isConst);
      o.put("isMut", param.isMut);
      last = o;
    }

    @Override protected void visit(Ast.Annotation annotation) {
      final ObjectNode o = start(annotation);
      o.set("name", encode(annotation.name));
      final ArrayNode arguments = o.putArray("arguments");
      annotation.arguments.forEach(arguments::add);
      last = o;
    }

    // statements

    @Override protected void visit(Ast.Return aReturn) {
      final ObjectNode o = start(aReturn);
      o.set("exp", encode(aReturn.exp));
      last = o;
    }

    @Override protected void visit(Ast.Definition definition) {
      final ObjectNode o = startWithOp(definition);
      o.set("names", encodeAll(definition.names));
      o.set("type", encodeNullable(definition.type));
      o.set("value", encode(definition.value));
      last = o;
    }

    @Override protected void visit(Ast.VariableName variableName) {
      final ObjectNode o = start(variableName);
      o.set("name", encode(variableName.name));
      o.put("mutable", variableName.mutable);
      last = o;
    }

    @Override protected void visit(Ast.Assign assign) {
      final ObjectNode o = startWithOp(assign);
      o.set("target", encode(assign.target));
      o.set("value", encode(assign.value));
      last = o;
    }

    @Override protected void visit(Ast.Conditional conditional) {
      final ObjectNode o = start(conditional);
      o.set("condition", encode(conditional.condition));
      o.set("block", encode(conditional.block));
      o.set("next", encodeNullable(conditional.next));
      last = o;
    }

    @Override protected void visit(Ast.Iteration iteration) {
      final ObjectNode o = start(iteration);
      o.set("variable", encode(iteration.variable));
      o.set("start", encode(iteration.start));
      o.set("stop", encode(iteration.stop));
      o.put("inclusive", iteration.inclusive);
      o.set("block", encode(iteration.block));
      last = o;
    }

    @Override protected void visit(Ast.Console console) {
      final ObjectNode o = startWithOp(console);
      o.put("format", console.format);
      o.set("args", encodeAll(console.args));
      last = o;
    }

    @Override protected void visit(Ast.ExpressionStmt expressionStmt) {
      final ObjectNode o = start(expressionStmt);
      o.set("exp", encode(expressionStmt.exp));
      last = o;
    }

    @Override protected void visit(Ast.Block block) {
      final ObjectNode o = start(block);
      o.set("statements", encodeAll(block.statements));
      last = o;
    }

    // expressions

    @Override protected void visit(Ast.Literal literal) {
      final ObjectNode o = startWithOp(literal);
      o.put("value", literal.value);
      o.put("intType",
          literal.intType == null ? null : literal.intType.name());
      last = o;
    }

    @Override protected void visit(Ast.GroupLiteral groupLiteral) {
      final ObjectNode o = start(groupLiteral);
      o.put("scalar", groupLiteral.scalar);
      o.put("x", groupLiteral.x == null ? null : groupLiteral.x.toString());
      o.put("y", groupLiteral.y == null ? null : groupLiteral.y.toString());
      last = o;
    }

    @Override protected void visit(Ast.Id id) {
      final ObjectNode o = start(id);
      o.put("name", id.name);
      last = o;
    }

    @Override protected void visit(Ast.ImplicitMember implicitMember) {
      final ObjectNode o = start(implicitMember);
      o.set("name", encode(implicitMember.name));
      last = o;
    }

    @Override protected void visit(Ast.Unary unary) {
      final ObjectNode o = startWithOp(unary);
      o.set("inner", encode(unary.inner));
      last = o;
    }

    @Override protected void visit(Ast.Binary binary) {
      final ObjectNode o = startWithOp(binary);
      o.set("left", encode(binary.left));
      o.set("right", encode(binary.right));
      last = o;
    }

    @Override protected void visit(Ast.Ternary ternary) {
      final ObjectNode o = start(ternary);
      o.set("condition", encode(ternary.condition));
      o.set("ifTrue", encode(ternary.ifTrue));
      o.set("ifFalse", encode(ternary.ifFalse));
      last = o;
    }

    @Override protected void visit(Ast.Call call) {
      final ObjectNode o = start(call);
      o.set("function", encode(call.function));
      o.set("args", encodeAll(call.args));
      last = o;
    }

    @Override protected void visit(Ast.ArrayInline arrayInline) {
      final ObjectNode o = start(arrayInline);
      o.set("elements", encodeAll(arrayInline.elements));
      last = o;
    }

    @Override protected void visit(Ast.ArrayInit arrayInit) {
      final ObjectNode o = start(arrayInit);
      o.set("element", encode(arrayInit.element));
      o.set("dimensions", ints(arrayInit.dimensions));
      last = o;
    }

    @Override protected void visit(Ast.TupleInit tupleInit) {
      final ObjectNode o = start(tupleInit);
      o.set("elements", encodeAll(tupleInit.elements));
      last = o;
    }

    @Override protected void visit(Ast.CircuitInit circuitInit) {
      final ObjectNode o = start(circuitInit);
      o.set("name", encode(circuitInit.name));
      o.set("fields", encodeAll(circuitInit.fields));
      last = o;
    }

    @Override protected void visit(Ast.CircuitField circuitField) {
      final ObjectNode o = start(circuitField);
      o.set("name", encode(circuitField.name));
      o.set("value", encodeNullable(circuitField.value));
      last = o;
    }

    @Override protected void visit(Ast.ArrayAccess arrayAccess) {
      final ObjectNode o = start(arrayAccess);
      o.set("array", encode(arrayAccess.array));
      o.set("index", encode(arrayAccess.index));
      last = o;
    }

    @Override protected void visit(Ast.ArrayRangeAccess arrayRangeAccess) {
      final ObjectNode o = start(arrayRangeAccess);
      o.set("array", encode(arrayRangeAccess.array));
      o.set("left", encodeNullable(arrayRangeAccess.left));
      o.set("right", encodeNullable(arrayRangeAccess.right));
      last = o;
    }

    @Override protected void visit(Ast.TupleAccess tupleAccess) {
      final ObjectNode o = start(tupleAccess);
      o.set("tuple", encode(tupleAccess.tuple));
      o.put("index", tupleAccess.index);
      last = o;
    }

    @Override protected void visit(Ast.MemberAccess memberAccess) {
      final ObjectNode o = start(memberAccess);
      o.set("inner", encode(memberAccess.inner));
      o.set("name", encode(memberAccess.name));
      last = o;
    }

    @Override protected void visit(Ast.StaticAccess staticAccess) {
      final ObjectNode o = start(staticAccess);
      o.set("inner", encode(staticAccess.inner));
      o.set("name", encode(staticAccess.name));
      last = o;
    }

    @Override protected void visit(Ast.Cast cast) {
      final ObjectNode o = start(cast);
      o.set("inner", encode(cast.inner));
      o.set("type", encode(cast.type));
      last = o;
    }

    // types

    @Override protected void visit(Ast.PrimitiveType primitiveType) {
      last = startWithOp(primitiveType);
    }

    @Override protected void visit(Ast.ArrayType arrayType) {
      final ObjectNode o = start(arrayType);
      o.set("element", encode(arrayType.element));
      o.set("dimensions", ints(arrayType.dimensions));
      last = o;
    }

    @Override protected void visit(Ast.TupleType tupleType) {
      final ObjectNode o = start(tupleType);
      o.set("types", encodeAll(tupleType.types));
      last = o;
    }

    @Override protected void visit(Ast.NamedType namedType) {
      final ObjectNode o = start(namedType);
      o.set("name", encode(namedType.name));
      last = o;
    }

    @Override protected void visit(Ast.SelfType selfType) {
      last = start(selfType);
    }
  }

  /** Reads the fields of one JSON object, remembering which it has read so
   * that it can reject the others. */
  private class Obj {
    final JsonNode json;
    final String path;
    final Set<String> seen = new HashSet<>();

    Obj(@Nullable JsonNode json, String path) {
      if (json == null || !json.isObject()) {
        throw new DecodeException(path, "expected object", null);
      }
      this.json = json;
      this.path = path;
    }

    DecodeException error(String field, String message) {
      return new DecodeException(path + "." + field, message, null);
    }

    String kind() {
      return string("kind");
    }

    JsonNode required(String field) {
      seen.add(field);
      final JsonNode value = json.get(field);
      if (value == null || value.isNull()) {
        throw error(field, "missing field");
      }
      return value;
    }

    @Nullable JsonNode optional(String field) {
      seen.add(field);
      final JsonNode value = json.get(field);
      return value == null || value.isNull() ? null : value;
    }

    String string(String field) {
      final JsonNode value = required(field);
      if (!value.isTextual()) {
        throw error(field, "expected string");
      }
      return value.textValue();
    }

    @Nullable String optionalString(String field) {
      final JsonNode value = optional(field);
      if (value == null) {
        return null;
      }
      if (!value.isTextual()) {
        throw error(field, "expected string");
      }
      return value.textValue();
    }

    boolean bool(String field) {
      final JsonNode value = required(field);
      if (!value.isBoolean()) {
        throw error(field, "expected boolean");
      }
      return value.booleanValue();
    }

    int integer(String field) {
      final JsonNode value = required(field);
      if (!value.isInt()) {
        throw error(field, "expected integer");
      }
      return value.intValue();
    }

    Op op(String field) {
      final String name = string(field);
      try {
        return Op.valueOf(name);
      } catch (IllegalArgumentException e) {
        throw new DecodeException(path + "." + field,
            "unknown operator '" + name + "'", e);
      }
    }

    @Nullable Op optionalOp(String field) {
      return optional(field) == null ? null : op(field);
    }

    NodeId nodeId() {
      final JsonNode id = required("id");
      if (!id.canConvertToLong() || !id.isIntegralNumber()
          || id.longValue() <= 0) {
        throw error("id", "expected positive integer");
      }
      if (id.longValue() == Long.MAX_VALUE) {
        throw error("id", "id out of range");
      }
      final Obj span = new Obj(required("span"), path + ".span");
      final Span s =
          new Span(span.string("file"), span.integer("startLine"),
              span.integer("startColumn"), span.integer("endLine"),
              span.integer("endColumn"));
      span.finish();
      return NodeId.of(id.longValue(), s);
    }

    <E> ImmutableList<E> list(String field,
        BiFunction<JsonNode, String, E> fn) {
      final JsonNode value = required(field);
      if (!value.isArray()) {
        throw error(field, "expected array");
      }
      final ImmutableList.Builder<E> b = ImmutableList.builder();
      for (int i = 0; i < value.size(); i++) {
        b.add(fn.apply(value.get(i), path + "." + field + "[" + i + "]"));
      }
      return b.build();
    }

    ImmutableList<Integer> ints(String field) {
      return list(field, (element, elementPath) -> {
        if (!element.isInt()) {
          throw new DecodeException(elementPath, "expected integer", null);
        }
        return element.intValue();
      });
    }

    ImmutableList<String> strings(String field) {
      return list(field, (element, elementPath) -> {
        if (!element.isTextual()) {
          throw new DecodeException(elementPath, "expected string", null);
        }
        return element.textValue();
      });
    }

    <E> E node(String field, BiFunction<JsonNode, String, E> fn) {
      return fn.apply(required(field), path + "." + field);
    }

    <E> @Nullable E nullableNode(String field,
        BiFunction<JsonNode, String, E> fn) {
      final JsonNode value = optional(field);
      return value == null ? null : fn.apply(value, path + "." + field);
    }

    /** Checks that the object has no fields other than those read. */
    void finish() {
      if (!failOnUnknownProperties) {
        return;
      }
      for (Iterator<String> names = json.fieldNames(); names.hasNext();) {
        final String name = names.next();
        if (!seen.contains(name)) {
          throw error(name, "unknown field");
        }
      }
    }
  }

  /** Converts JSON objects into nodes. */
  private class Decoder {
    Ast.Program program(@Nullable JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "Program");
      final NodeId nodeId = o.nodeId();
      try {
        final Ast.Program program =
            ast.program(nodeId, o.string("name"),
                o.list("imports", this::import_),
                o.list("circuits", this::circuit),
                o.list("functions", this::function),
                o.list("globalConsts", this::definition));
        o.finish();
        return program;
      } catch (IllegalArgumentException e) {
        throw new DecodeException(path, e.getMessage(), e);
      }
    }

    private void checkKind(Obj o, String expected) {
      final String kind = o.kind();
      if (!kind.equals(expected)) {
        throw o.error("kind",
            "expected kind '" + expected + "', got '" + kind + "'");
      }
    }

    Ast.Import import_(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "Import");
      final NodeId nodeId = o.nodeId();
      final List<Ast.Id> importPath = o.list("path", this::id);
      final Ast.Id alias = o.nullableNode("alias", this::id);
      final List<Ast.ImportSymbol> symbols =
          o.list("symbols", this::importSymbol);
      final boolean star = o.bool("star");
      o.finish();
      try {
        if (star) {
          checkNoAliasOrSymbols(alias, symbols);
          return ast.importStar(nodeId, importPath);
        }
        return symbols.isEmpty()
            ? ast.importPath(nodeId, importPath, alias)
            : ast.importSymbols(nodeId, importPath, symbols);
      } catch (IllegalArgumentException e) {
        throw new DecodeException(path, e.getMessage(), e);
      }
    }

    private void checkNoAliasOrSymbols(Ast.@Nullable Id alias,
        List<Ast.ImportSymbol> symbols) {
      if (alias != null || !symbols.isEmpty()) {
        throw new IllegalArgumentException(
            "star import cannot have alias or symbols");
      }
    }

    Ast.ImportSymbol importSymbol(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "ImportSymbol");
      final Ast.ImportSymbol symbol =
          ast.importSymbol(o.nodeId(), o.node("name", this::id),
              o.nullableNode("alias", this::id));
      o.finish();
      return symbol;
    }

    Ast.Circuit circuit(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "Circuit");
      final Ast.Circuit circuit =
          ast.circuit(o.nodeId(), o.node("name", this::id),
              o.list("members", this::member),
              o.list("functions", this::function));
      o.finish();
      return circuit;
    }

    Ast.Member member(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "Member");
      final Ast.Member member =
          ast.member(o.nodeId(), o.node("name", this::id),
              o.node("type", this::type));
      o.finish();
      return member;
    }

    Ast.Function function(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "Function");
      final Ast.Function function =
          ast.function(o.nodeId(), o.list("annotations", this::annotation),
              o.node("name", this::id), o.list("params", this::param),
              o.nullableNode("output", this::type),
              o.node("body", this::block));
      o.finish();
      return function;
    }

    Ast.Param param(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "Param");
      final NodeId nodeId = o.nodeId();
      final Ast.Id name = o.node("name", this::id);
      final Ast.Type type = o.node("type", this::type);
      final boolean isConst = o.bool("isConst");
      final boolean isMut = o.bool("isMut");
      o.finish();
      if (isConst && isMut) {
        throw new DecodeException(path,
            "parameter cannot be const and mut", null);
      }
      return isConst ? ast.constParam(nodeId, name, type)
          : isMut ? ast.mutParam(nodeId, name, type)
          : ast.param(nodeId, name, type);
    }

    Ast.Annotation annotation(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "Annotation");
      final Ast.Annotation annotation =
          ast.annotation(o.nodeId(), o.node("name", this::id),
              o.strings("arguments"));
      o.finish();
      return annotation;
    }

    Ast.VariableName variableName(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "VariableName");
      final Ast.VariableName variableName =
          ast.variableName(o.nodeId(), o.node("name", this::id),
              o.bool("mutable"));
      o.finish();
      return variableName;
    }

    Ast.CircuitField circuitField(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      checkKind(o, "CircuitField");
      final Ast.CircuitField circuitField =
          ast.circuitField(o.nodeId(), o.node("name", this::id),
              o.nullableNode("value", this::exp));
      o.finish();
      return circuitField;
    }

    // statements

    Ast.Stmt stmt(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      final String kind = o.kind();
      final NodeId nodeId = o.nodeId();
      final Ast.Stmt stmt;
      try {
        switch (kind) {
        case "Return":
          stmt = ast.return_(nodeId, o.node("exp", this::exp));
          break;
        case "Definition":
          stmt = ast.definition(nodeId, o.op("op"),
              o.list("names", this::variableName),
              o.nullableNode("type", this::type),
              o.node("value", this::exp));
          break;
        case "Assign":
          stmt = ast.assign(nodeId, o.op("op"), o.node("target", this::exp),
              o.node("value", this::exp));
          break;
        case "Conditional":
          stmt = ast.conditional(nodeId, o.node("condition", this::exp),
              o.node("block", this::block),
              o.nullableNode("next", this::stmt));
          break;
        case "Iteration":
          stmt = ast.iteration(nodeId, o.node("variable", this::id),
              o.node("start", this::exp), o.node("stop", this::exp),
              o.bool("inclusive"), o.node("block", this::block));
          break;
        case "Console":
          stmt = ast.console(nodeId, o.op("op"), o.optionalString("format"),
              o.list("args", this::exp));
          break;
        case "ExpressionStmt":
          stmt = ast.expressionStmt(nodeId, o.node("exp", this::exp));
          break;
        case "Block":
          stmt = ast.block(nodeId, o.list("statements", this::stmt));
          break;
        default:
          throw o.error("kind", "unknown statement kind '" + kind + "'");
        }
      } catch (IllegalArgumentException e) {
        throw new DecodeException(path, e.getMessage(), e);
      }
      o.finish();
      return stmt;
    }

    Ast.Block block(JsonNode json, String path) {
      final Ast.Stmt stmt = stmt(json, path);
      if (!(stmt instanceof Ast.Block)) {
        throw new DecodeException(path + ".kind", "expected kind 'Block'",
            null);
      }
      return (Ast.Block) stmt;
    }

    Ast.Definition definition(JsonNode json, String path) {
      final Ast.Stmt stmt = stmt(json, path);
      if (!(stmt instanceof Ast.Definition)) {
        throw new DecodeException(path + ".kind",
            "expected kind 'Definition'", null);
      }
      return (Ast.Definition) stmt;
    }

    // expressions

    Ast.Exp exp(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      final String kind = o.kind();
      final NodeId nodeId = o.nodeId();
      final Ast.Exp exp;
      try {
        switch (kind) {
        case "Literal":
          exp = ast.literal(nodeId, o.op("op"), o.string("value"),
              o.optionalOp("intType"));
          break;
        case "GroupLiteral":
          final String scalar = o.optionalString("scalar");
          final String x = o.optionalString("x");
          final String y = o.optionalString("y");
          if (scalar != null) {
            if (x != null || y != null) {
              throw o.error("scalar",
                  "group literal cannot be both a scalar and a point");
            }
            exp = ast.groupScalar(nodeId, scalar);
          } else {
            exp = ast.groupPoint(nodeId, coordinate(o, "x", x),
                coordinate(o, "y", y));
          }
          break;
        case "Id":
          exp = ast.id(nodeId, o.string("name"));
          break;
        case "ImplicitMember":
          exp = ast.implicitMember(nodeId, o.node("name", this::id));
          break;
        case "Unary":
          exp = ast.unary(nodeId, o.op("op"), o.node("inner", this::exp));
          break;
        case "Binary":
          exp = ast.binary(nodeId, o.op("op"), o.node("left", this::exp),
              o.node("right", this::exp));
          break;
        case "Ternary":
          exp = ast.ternary(nodeId, o.node("condition", this::exp),
              o.node("ifTrue", this::exp), o.node("ifFalse", this::exp));
          break;
        case "Call":
          exp = ast.call(nodeId, o.node("function", this::exp),
              o.list("args", this::exp));
          break;
        case "ArrayInline":
          exp = ast.arrayInline(nodeId, o.list("elements", this::exp));
          break;
        case "ArrayInit":
          exp = ast.arrayInit(nodeId, o.node("element", this::exp),
              o.ints("dimensions"));
          break;
        case "TupleInit":
          exp = ast.tupleInit(nodeId, o.list("elements", this::exp));
          break;
        case "CircuitInit":
          exp = ast.circuitInit(nodeId, o.node("name", this::id),
              o.list("fields", this::circuitField));
          break;
        case "ArrayAccess":
          exp = ast.arrayAccess(nodeId, o.node("array", this::exp),
              o.node("index", this::exp));
          break;
        case "ArrayRangeAccess":
          exp = ast.arrayRangeAccess(nodeId, o.node("array", this::exp),
              o.nullableNode("left", this::exp),
              o.nullableNode("right", this::exp));
          break;
        case "TupleAccess":
          exp = ast.tupleAccess(nodeId, o.node("tuple", this::exp),
              o.integer("index"));
          break;
        case "MemberAccess":
          exp = ast.memberAccess(nodeId, o.node("inner", this::exp),
              o.node("name", this::id));
          break;
        case "StaticAccess":
          exp = ast.staticAccess(nodeId, o.node("inner", this::exp),
              o.node("name", this::id));
          break;
        case "Cast":
          exp = ast.cast(nodeId, o.node("inner", this::exp),
              o.node("type", this::type));
          break;
        default:
          throw o.error("kind", "unknown expression kind '" + kind + "'");
        }
      } catch (IllegalArgumentException e) {
        throw new DecodeException(path, e.getMessage(), e);
      }
      o.finish();
      return exp;
    }

    private Ast.GroupCoordinate coordinate(Obj o, String field,
        @Nullable String s) {
      if (s == null) {
        throw o.error(field, "missing field");
      }
      switch (s) {
      case "+":
        return Ast.GroupCoordinate.of(Ast.CoordinateKind.SIGN_HIGH);
      case "-":
        return Ast.GroupCoordinate.of(Ast.CoordinateKind.SIGN_LOW);
      case "_":
        return Ast.GroupCoordinate.of(Ast.CoordinateKind.INFERRED);
      default:
        if (!NUMBER.matcher(s).matches()) {
          throw o.error(field, "invalid group coordinate '" + s + "'");
        }
        return Ast.GroupCoordinate.number(s);
      }
    }

    Ast.Id id(JsonNode json, String path) {
      final Ast.Exp exp = exp(json, path);
      if (!(exp instanceof Ast.Id)) {
        throw new DecodeException(path + ".kind", "expected kind 'Id'",
            null);
      }
      return (Ast.Id) exp;
    }

    // types

    Ast.Type type(JsonNode json, String path) {
      final Obj o = new Obj(json, path);
      final String kind = o.kind();
      final NodeId nodeId = o.nodeId();
      final Ast.Type type;
      try {
        switch (kind) {
        case "PrimitiveType":
          type = ast.primitiveType(nodeId, o.op("op"));
          break;
        case "ArrayType":
          type = ast.arrayType(nodeId, o.node("element", this::type),
              o.ints("dimensions"));
          break;
        case "TupleType":
          type = ast.tupleType(nodeId, o.list("types", this::type));
          break;
        case "NamedType":
          type = ast.namedType(nodeId, o.node("name", this::id));
          break;
        case "SelfType":
          type = ast.selfType(nodeId);
          break;
        default:
          throw o.error("kind", "unknown type kind '" + kind + "'");
        }
      } catch (IllegalArgumentException e) {
        throw new DecodeException(path, e.getMessage(), e);
      }
      o.finish();
      return type;
    }
  }
}

// End AstJson.java
