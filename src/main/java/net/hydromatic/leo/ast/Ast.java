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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.leo.util.Static.same;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>Each category of node (statement, expression, type) is an abstract
 * class whose constructor is package-private, so the set of variants in
 * each category is closed: only this class can add one. Each variant
 * implements {@code reduce(Director)}, which is how {@link Director} finds
 * the {@link Reducer} method for it; a new variant that does not do so
 * does not compile.
 */
public class Ast {
  private Ast() {}

  /** Maps a list of named nodes to an immutable map keyed by name. */
  private static <E> ImmutableMap<String, E> byName(List<E> list,
      java.util.function.Function<E, Id> nameFn) {
    final ImmutableMap.Builder<String, E> b = ImmutableMap.builder();
    list.forEach(e -> b.put(nameFn.apply(e).name, e));
    return b.buildOrThrow();
  }

  //-------------------------------------------------------------------------
  // Declarations

  /** Root of the tree: a whole Leo program. */
  public static class Program extends AstNode {
    public final String name;
    public final List<Import> imports;
    /** Circuit definitions, keyed by name, in declaration order. */
    public final Map<String, Circuit> circuits;
    /** Function definitions, keyed by name, in declaration order. */
    public final Map<String, Function> functions;
    public final List<Definition> globalConsts;

    Program(NodeId nodeId, String name, ImmutableList<Import> imports,
        ImmutableMap<String, Circuit> circuits,
        ImmutableMap<String, Function> functions,
        ImmutableList<Definition> globalConsts) {
      super(nodeId, Op.PROGRAM);
      this.name = requireNonNull(name);
      this.imports = requireNonNull(imports);
      this.circuits = requireNonNull(circuits);
      this.functions = requireNonNull(functions);
      this.globalConsts = requireNonNull(globalConsts);
      circuits.forEach((k, v) -> checkArgument(k.equals(v.name.name)));
      functions.forEach((k, v) -> checkArgument(k.equals(v.name.name)));
      globalConsts.forEach(d -> checkArgument(d.op == Op.CONST,
          "global declaration must be const: %s", d));
    }

    @Override public int hashCode() {
      return Objects.hash(name, imports, circuits, functions, globalConsts);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Program
          && name.equals(((Program) o).name)
          && imports.equals(((Program) o).imports)
          && circuits.equals(((Program) o).circuits)
          && functions.equals(((Program) o).functions)
          && globalConsts.equals(((Program) o).globalConsts);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      String sep = "";
      for (Import anImport : imports) {
        w.append(sep).append(anImport, 0, 0);
        sep = "\n";
      }
      for (Definition globalConst : globalConsts) {
        w.append(sep).append(globalConst, 0, 0);
        sep = "\n";
      }
      for (Circuit circuit : circuits.values()) {
        w.append(sep).append(circuit, 0, 0);
        sep = "\n";
      }
      for (Function function : functions.values()) {
        w.append(sep).append(function, 0, 0);
        sep = "\n";
      }
      return w;
    }

    /** Creates a copy of this {@code Program} with given contents,
     * or {@code this} if the contents are the same. */
    public Program copy(List<Import> imports, List<Circuit> circuits,
        List<Function> functions, List<Definition> globalConsts) {
      return same(this.imports, imports)
          && same(ImmutableList.copyOf(this.circuits.values()), circuits)
          && same(ImmutableList.copyOf(this.functions.values()), functions)
          && same(this.globalConsts, globalConsts)
          ? this
          : new Program(nodeId, name, ImmutableList.copyOf(imports),
              byName(circuits, c -> c.name),
              byName(functions, f -> f.name),
              ImmutableList.copyOf(globalConsts));
    }
  }

  /** Import of a package, or of symbols from a package.
   *
   * <p>For example, "import math.sqrt;", "import math.*;",
   * "import math.sqrt as root;", "import math.(sqrt, pow as power);". */
  public static class Import extends AstNode {
    public final List<Id> path;
    public final @Nullable Id alias;
    public final List<ImportSymbol> symbols;
    public final boolean star;

    Import(NodeId nodeId, ImmutableList<Id> path, @Nullable Id alias,
        ImmutableList<ImportSymbol> symbols, boolean star) {
      super(nodeId, Op.IMPORT);
      this.path = requireNonNull(path);
      this.alias = alias;
      this.symbols = requireNonNull(symbols);
      this.star = star;
      checkArgument(!path.isEmpty(), "empty import path");
      checkArgument(!star || alias == null && symbols.isEmpty(),
          "star import cannot have alias or symbols");
      checkArgument(alias == null || symbols.isEmpty(),
          "import cannot have both alias and symbols");
    }

    @Override public int hashCode() {
      return Objects.hash(path, alias, symbols, star);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Import
          && path.equals(((Import) o).path)
          && Objects.equals(alias, ((Import) o).alias)
          && symbols.equals(((Import) o).symbols)
          && star == ((Import) o).star;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("import ").appendAll(path, ".");
      if (star) {
        w.append(".*");
      } else if (alias != null) {
        w.append(" as ").append(alias, 0, 0);
      } else if (!symbols.isEmpty()) {
        w.append(".(").appendAll(symbols, ", ").append(")");
      }
      return w.append(";");
    }
  }

  /** Symbol imported from a package, with an optional alias. */
  public static class ImportSymbol extends AstNode {
    public final Id name;
    public final @Nullable Id alias;

    ImportSymbol(NodeId nodeId, Id name, @Nullable Id alias) {
      super(nodeId, Op.IMPORT_SYMBOL);
      this.name = requireNonNull(name);
      this.alias = alias;
    }

    @Override public int hashCode() {
      return Objects.hash(name, alias);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ImportSymbol
          && name.equals(((ImportSymbol) o).name)
          && Objects.equals(alias, ((ImportSymbol) o).alias);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name, 0, 0);
      return alias == null ? w : w.append(" as ").append(alias, 0, 0);
    }
  }

  /** Circuit definition: a named record type with methods.
   *
   * <p>For example, "circuit Point { x: u32, y: u32, function len() {...} }".
   */
  public static class Circuit extends AstNode {
    public final Id name;
    public final List<Member> members;
    public final List<Function> functions;

    Circuit(NodeId nodeId, Id name, ImmutableList<Member> members,
        ImmutableList<Function> functions) {
      super(nodeId, Op.CIRCUIT);
      this.name = requireNonNull(name);
      this.members = requireNonNull(members);
      this.functions = requireNonNull(functions);
    }

    /** Returns the method with a given name, or null. */
    public @Nullable Function function(String name) {
      for (Function function : functions) {
        if (function.name.name.equals(name)) {
          return function;
        }
      }
      return null;
    }

    @Override public int hashCode() {
      return Objects.hash(name, members, functions);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Circuit
          && name.equals(((Circuit) o).name)
          && members.equals(((Circuit) o).members)
          && functions.equals(((Circuit) o).functions);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("circuit ").append(name, 0, 0).append(" {");
      String sep = " ";
      for (Member member : members) {
        w.append(sep).append(member, 0, 0);
        sep = ", ";
      }
      for (Function function : functions) {
        w.append(" ").append(function, 0, 0);
      }
      return w.append(" }");
    }

    /** Creates a copy of this {@code Circuit} with given contents,
     * or {@code this} if the contents are the same. */
    public Circuit copy(Id name, List<Member> members,
        List<Function> functions) {
      return this.name == name
          && same(this.members, members)
          && same(this.functions, functions)
          ? this
          : new Circuit(nodeId, name, ImmutableList.copyOf(members),
              ImmutableList.copyOf(functions));
    }
  }

  /** Member variable of a circuit, for example "x: u32". */
  public static class Member extends AstNode {
    public final Id name;
    public final Type type;

    Member(NodeId nodeId, Id name, Type type) {
      super(nodeId, Op.MEMBER);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
    }

    @Override public int hashCode() {
      return Objects.hash(name, type);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Member
          && name.equals(((Member) o).name)
          && type.equals(((Member) o).type);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name, 0, 0).append(": ").append(type, 0, 0);
    }

    /** Creates a copy of this {@code Member} with given contents,
     * or {@code this} if the contents are the same. */
    public Member copy(Id name, Type type) {
      return this.name == name && this.type == type
          ? this
          : new Member(nodeId, name, type);
    }
  }

  /** Function definition, either at the top level or in a circuit. */
  public static class Function extends AstNode {
    public final List<Annotation> annotations;
    public final Id name;
    public final List<Param> params;
    /** Declared output type; null means the empty tuple. */
    public final @Nullable Type output;
    public final Block body;

    Function(NodeId nodeId, ImmutableList<Annotation> annotations, Id name,
        ImmutableList<Param> params, @Nullable Type output, Block body) {
      super(nodeId, Op.FUNCTION);
      this.annotations = requireNonNull(annotations);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.output = output;
      this.body = requireNonNull(body);
    }

    /** Returns whether the first parameter is "self". */
    public boolean isMethod() {
      return !params.isEmpty() && params.get(0).isSelf();
    }

    @Override public int hashCode() {
      return Objects.hash(annotations, name, params, output, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Function
          && annotations.equals(((Function) o).annotations)
          && name.equals(((Function) o).name)
          && params.equals(((Function) o).params)
          && Objects.equals(output, ((Function) o).output)
          && body.equals(((Function) o).body);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      for (Annotation annotation : annotations) {
        w.append(annotation, 0, 0).append(" ");
      }
      w.append("function ").append(name, 0, 0)
          .append("(").appendAll(params, ", ").append(")");
      if (output != null) {
        w.append(" -> ").append(output, 0, 0);
      }
      return w.append(" ").append(body, 0, 0);
    }

    /** Creates a copy of this {@code Function} with given contents,
     * or {@code this} if the contents are the same. */
    public Function copy(List<Annotation> annotations, Id name,
        List<Param> params, @Nullable Type output, Block body) {
      return same(this.annotations, annotations)
          && this.name == name
          && same(this.params, params)
          && this.output == output
          && this.body == body
          ? this
          : new Function(nodeId, ImmutableList.copyOf(annotations), name,
              ImmutableList.copyOf(params), output, body);
    }
  }

  /** Function parameter, for example "const x: u8" or "mut self". */
  public static class Param extends AstNode {
    public final Id name;
    public final Type type;
    public final boolean isConst;
    public final boolean isMut;

    Param(NodeId nodeId, Id name, Type type, boolean isConst, boolean isMut) {
      super(nodeId, Op.PARAM);
      this.name = requireNonNull(name);
      this.type = requireNonNull(type);
      this.isConst = isConst;
      this.isMut = isMut;
      checkArgument(!(isConst && isMut), "parameter cannot be const and mut");
    }

    /** Returns whether this is the "self" parameter of a method. */
    public boolean isSelf() {
      return name.name.equals(Id.SELF);
    }

    @Override public int hashCode() {
      return Objects.hash(name, type, isConst, isMut);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Param
          && name.equals(((Param) o).name)
          && type.equals(((Param) o).type)
          && isConst == ((Param) o).isConst
          && isMut == ((Param) o).isMut;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(isConst ? "const " : isMut ? "mut " : "");
      w.append(name, 0, 0);
      if (isSelf() && type instanceof SelfType) {
        return w;
      }
      return w.append(": ").append(type, 0, 0);
    }

    /** Creates a copy of this {@code Param} with given contents,
     * or {@code this} if the contents are the same. */
    public Param copy(Id name, Type type) {
      return this.name == name && this.type == type
          ? this
          : new Param(nodeId, name, type, isConst, isMut);
    }
  }

  /** Annotation of a function, for example "@test(a, b)". */
  public static class Annotation extends AstNode {
    public final Id name;
    public final List<String> arguments;

    Annotation(NodeId nodeId, Id name, ImmutableList<String> arguments) {
      super(nodeId, Op.ANNOTATION);
      this.name = requireNonNull(name);
      this.arguments = requireNonNull(arguments);
    }

    @Override public int hashCode() {
      return Objects.hash(name, arguments);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Annotation
          && name.equals(((Annotation) o).name)
          && arguments.equals(((Annotation) o).arguments);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("@").append(name, 0, 0);
      if (!arguments.isEmpty()) {
        w.append("(").append(String.join(", ", arguments)).append(")");
      }
      return w;
    }
  }

  //-------------------------------------------------------------------------
  // Statements

  /** Base class of statements. */
  public abstract static class Stmt extends AstNode {
    Stmt(NodeId nodeId, Op op) {
      super(nodeId, op);
    }

    /** Calls the {@link Director} method for this kind of statement. */
    abstract Stmt reduce(Director director);
  }

  /** "return" statement. */
  public static class Return extends Stmt {
    public final Exp exp;

    Return(NodeId nodeId, Exp exp) {
      super(nodeId, Op.RETURN);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Return
          && exp.equals(((Return) o).exp);
    }

    @Override Stmt reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("return ").append(exp, 0, 0).append(";");
    }

    /** Creates a copy of this {@code Return} with given contents,
     * or {@code this} if the contents are the same. */
    public Return copy(Exp exp) {
      return this.exp == exp ? this : new Return(nodeId, exp);
    }
  }

  /** Variable or constant definition.
   *
   * <p>For example, "let mut x: u8 = 1;", "const c = 2;", and the tuple
   * destructuring form "let (a, b) = pair();". */
  public static class Definition extends Stmt {
    public final List<VariableName> names;
    public final @Nullable Type type;
    public final Exp value;

    Definition(NodeId nodeId, Op op, ImmutableList<VariableName> names,
        @Nullable Type type, Exp value) {
      super(nodeId, op);
      this.names = requireNonNull(names);
      this.type = type;
      this.value = requireNonNull(value);
      checkArgument(op == Op.LET || op == Op.CONST, "bad op %s", op);
      checkArgument(!names.isEmpty(), "definition must bind a name");
    }

    @Override public int hashCode() {
      return Objects.hash(op, names, type, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Definition
          && op == ((Definition) o).op
          && names.equals(((Definition) o).names)
          && Objects.equals(type, ((Definition) o).type)
          && value.equals(((Definition) o).value);
    }

    @Override Stmt reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(op.padded);
      if (names.size() == 1) {
        w.append(names.get(0), 0, 0);
      } else {
        w.append("(").appendAll(names, ", ").append(")");
      }
      if (type != null) {
        w.append(": ").append(type, 0, 0);
      }
      return w.append(" = ").append(value, 0, 0).append(";");
    }

    /** Creates a copy of this {@code Definition} with given contents,
     * or {@code this} if the contents are the same. */
    public Definition copy(List<VariableName> names, @Nullable Type type,
        Exp value) {
      return same(this.names, names)
          && this.type == type
          && this.value == value
          ? this
          : new Definition(nodeId, op, ImmutableList.copyOf(names), type,
              value);
    }
  }

  /** Name bound by a {@link Definition}, for example "mut x". */
  public static class VariableName extends AstNode {
    public final Id name;
    public final boolean mutable;

    VariableName(NodeId nodeId, Id name, boolean mutable) {
      super(nodeId, Op.VARIABLE_NAME);
      this.name = requireNonNull(name);
      this.mutable = mutable;
    }

    @Override public int hashCode() {
      return Objects.hash(name, mutable);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof VariableName
          && name.equals(((VariableName) o).name)
          && mutable == ((VariableName) o).mutable;
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(mutable ? "mut " : "").append(name, 0, 0);
    }

    /** Creates a copy of this {@code VariableName} with given contents,
     * or {@code this} if the contents are the same. */
    public VariableName copy(Id name) {
      return this.name == name ? this : new VariableName(nodeId, name, mutable);
    }
  }

  /** Assignment statement, "target = value", or a compound assignment
   * such as "target += value". */
  public static class Assign extends Stmt {
    public final Exp target;
    public final Exp value;

    Assign(NodeId nodeId, Op op, Exp target, Exp value) {
      super(nodeId, op);
      this.target = requireNonNull(target);
      this.value = requireNonNull(value);
      checkArgument(op.isAssign(), "bad op %s", op);
    }

    /** Returns whether this is a compound assignment, such as "+=". */
    public boolean isCompound() {
      return op != Op.ASSIGN;
    }

    @Override public int hashCode() {
      return Objects.hash(op, target, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assign
          && op == ((Assign) o).op
          && target.equals(((Assign) o).target)
          && value.equals(((Assign) o).value);
    }

    @Override Stmt reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(target, 0, 0).append(op.padded)
          .append(value, 0, 0).append(";");
    }

    /** Creates a copy of this {@code Assign} with given contents,
     * or {@code this} if the contents are the same. */
    public Assign copy(Exp target, Exp value) {
      return this.target == target && this.value == value
          ? this
          : new Assign(nodeId, op, target, value);
    }
  }

  /** "if" statement.
   *
   * <p>{@link #next} is null if there is no "else", a {@link Block} for
   * "else { ... }", or another {@code Conditional} for "else if". */
  public static class Conditional extends Stmt {
    public final Exp condition;
    public final Block block;
    public final @Nullable Stmt next;

    Conditional(NodeId nodeId, Exp condition, Block block,
        @Nullable Stmt next) {
      super(nodeId, Op.CONDITIONAL);
      this.condition = requireNonNull(condition);
      this.block = requireNonNull(block);
      this.next = next;
      checkArgument(next == null
              || next instanceof Block
              || next instanceof Conditional,
          "else branch must be a block or conditional: %s", next);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, block, next);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Conditional
          && condition.equals(((Conditional) o).condition)
          && block.equals(((Conditional) o).block)
          && Objects.equals(next, ((Conditional) o).next);
    }

    @Override Stmt reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if ").append(condition, 0, 0).append(" ")
          .append(block, 0, 0);
      if (next != null) {
        w.append(" else ").append(next, 0, 0);
      }
      return w;
    }

    /** Creates a copy of this {@code Conditional} with given contents,
     * or {@code this} if the contents are the same. */
    public Conditional copy(Exp condition, Block block, @Nullable Stmt next) {
      return this.condition == condition
          && this.block == block
          && this.next == next
          ? this
          : new Conditional(nodeId, condition, block, next);
    }
  }

  /** "for" loop over a range, for example "for i in 0..10 { ... }". */
  public static class Iteration extends Stmt {
    public final Id variable;
    public final Exp start;
    public final Exp stop;
    /** Whether the range is "start..=stop" rather than "start..stop". */
    public final boolean inclusive;
    public final Block block;

    Iteration(NodeId nodeId, Id variable, Exp start, Exp stop,
        boolean inclusive, Block block) {
      super(nodeId, Op.ITERATION);
      this.variable = requireNonNull(variable);
      this.start = requireNonNull(start);
      this.stop = requireNonNull(stop);
      this.inclusive = inclusive;
      this.block = requireNonNull(block);
    }

    @Override public int hashCode() {
      return Objects.hash(variable, start, stop, inclusive, block);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Iteration
          && variable.equals(((Iteration) o).variable)
          && start.equals(((Iteration) o).start)
          && stop.equals(((Iteration) o).stop)
          && inclusive == ((Iteration) o).inclusive
          && block.equals(((Iteration) o).block);
    }

    @Override Stmt reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("for ").append(variable, 0, 0).append(" in ")
          .append(start, 0, 0).append(inclusive ? "..=" : "..")
          .append(stop, 0, 0).append(" ").append(block, 0, 0);
    }

    /** Creates a copy of this {@code Iteration} with given contents,
     * or {@code this} if the contents are the same. */
    public Iteration copy(Id variable, Exp start, Exp stop, Block block) {
      return this.variable == variable
          && this.start == start
          && this.stop == stop
          && this.block == block
          ? this
          : new Iteration(nodeId, variable, start, stop, inclusive, block);
    }
  }

  /** Call to a console function: "console.assert(e);",
   * "console.log("x = {}", x);" or "console.error(...)". */
  public static class Console extends Stmt {
    /** Format string; null for "assert". */
    public final @Nullable String format;
    public final List<Exp> args;

    Console(NodeId nodeId, Op op, @Nullable String format,
        ImmutableList<Exp> args) {
      super(nodeId, op);
      this.format = format;
      this.args = requireNonNull(args);
      checkArgument(op.isConsole(), "bad op %s", op);
      if (op == Op.CONSOLE_ASSERT) {
        checkArgument(format == null && args.size() == 1,
            "assert takes one expression and no format");
      } else {
        checkArgument(format != null, "%s requires a format string", op);
      }
    }

    @Override public int hashCode() {
      return Objects.hash(op, format, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Console
          && op == ((Console) o).op
          && Objects.equals(format, ((Console) o).format)
          && args.equals(((Console) o).args);
    }

    @Override Stmt reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("console.").append(op.padded).append("(");
      if (format != null) {
        w.quoted(format, '"');
        if (!args.isEmpty()) {
          w.append(", ");
        }
      }
      return w.appendAll(args, ", ").append(");");
    }

    /** Creates a copy of this {@code Console} with given contents,
     * or {@code this} if the contents are the same. */
    public Console copy(List<Exp> args) {
      return same(this.args, args)
          ? this
          : new Console(nodeId, op, format, ImmutableList.copyOf(args));
    }
  }

  /** Expression evaluated for its effect, for example "f(x);". */
  public static class ExpressionStmt extends Stmt {
    public final Exp exp;

    ExpressionStmt(NodeId nodeId, Exp exp) {
      super(nodeId, Op.EXPRESSION_STMT);
      this.exp = requireNonNull(exp);
    }

    @Override public int hashCode() {
      return Objects.hash(op, exp);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ExpressionStmt
          && exp.equals(((ExpressionStmt) o).exp);
    }

    @Override Stmt reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(exp, 0, 0).append(";");
    }

    /** Creates a copy of this {@code ExpressionStmt} with given contents,
     * or {@code this} if the contents are the same. */
    public ExpressionStmt copy(Exp exp) {
      return this.exp == exp ? this : new ExpressionStmt(nodeId, exp);
    }
  }

  /** Block of statements, "{ ... }". */
  public static class Block extends Stmt {
    public final List<Stmt> statements;

    Block(NodeId nodeId, ImmutableList<Stmt> statements) {
      super(nodeId, Op.BLOCK);
      this.statements = requireNonNull(statements);
    }

    @Override public int hashCode() {
      return Objects.hash(op, statements);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Block
          && statements.equals(((Block) o).statements);
    }

    @Override Block reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (statements.isEmpty()) {
        return w.append("{}");
      }
      w.append("{");
      for (Stmt statement : statements) {
        w.append(" ").append(statement, 0, 0);
      }
      return w.append(" }");
    }

    /** Creates a copy of this {@code Block} with given contents,
     * or {@code this} if the contents are the same. */
    public Block copy(List<Stmt> statements) {
      return same(this.statements, statements)
          ? this
          : new Block(nodeId, ImmutableList.copyOf(statements));
    }
  }

  //-------------------------------------------------------------------------
  // Expressions

  /** Base class of expressions. */
  public abstract static class Exp extends AstNode {
    Exp(NodeId nodeId, Op op) {
      super(nodeId, op);
    }

    /** Calls the {@link Director} method for this kind of expression. */
    abstract Exp reduce(Director director);
  }

  /** Literal (constant) as written in the source.
   *
   * <p>The value is the text of the literal without any type suffix,
   * except for group literals, whose text is kept whole until
   * canonicalization parses it into a {@link GroupLiteral}. Integer
   * literals carry their type, for example "5u8" has value "5" and
   * {@link #intType} {@link Op#U8}. */
  public static class Literal extends Exp {
    public final String value;
    public final @Nullable Op intType;

    Literal(NodeId nodeId, Op op, String value, @Nullable Op intType) {
      super(nodeId, op);
      this.value = requireNonNull(value);
      this.intType = intType;
      checkArgument(op.isLiteral(), "bad op %s", op);
      checkArgument((op == Op.INT_LITERAL) == (intType != null),
          "integer literal must have a type, others must not");
      checkArgument(intType == null || intType.isInteger(),
          "not an integer type: %s", intType);
    }

    @Override public int hashCode() {
      return Objects.hash(op, value, intType);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && op == ((Literal) o).op
          && value.equals(((Literal) o).value)
          && intType == ((Literal) o).intType;
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
      case INT_LITERAL:
        return w.append(value).append(requireNonNull(intType).padded);
      case FIELD_LITERAL:
        return w.append(value).append("field");
      case STRING_LITERAL:
        return w.quoted(value, '"');
      case CHAR_LITERAL:
        return w.quoted(value, '\'');
      default:
        return w.append(value);
      }
    }
  }

  /** Kind of a {@link GroupCoordinate}. */
  public enum CoordinateKind {
    /** An explicit number, such as "5" or "-3". */
    NUMBER,
    /** "+": the coordinate with the greater sign. */
    SIGN_HIGH,
    /** "-": the coordinate with the lesser sign. */
    SIGN_LOW,
    /** "_": the coordinate is to be inferred from the other one. */
    INFERRED
  }

  /** One coordinate of a group element written as a pair. */
  public static class GroupCoordinate {
    public final CoordinateKind kind;
    /** Normalized number if {@link #kind} is NUMBER, otherwise null. */
    public final @Nullable String number;

    private GroupCoordinate(CoordinateKind kind, @Nullable String number) {
      this.kind = requireNonNull(kind);
      this.number = number;
      checkArgument((kind == CoordinateKind.NUMBER) == (number != null));
    }

    public static GroupCoordinate number(String number) {
      return new GroupCoordinate(CoordinateKind.NUMBER, number);
    }

    public static GroupCoordinate of(CoordinateKind kind) {
      checkArgument(kind != CoordinateKind.NUMBER);
      return new GroupCoordinate(kind, null);
    }

    @Override public int hashCode() {
      return Objects.hash(kind, number);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof GroupCoordinate
          && kind == ((GroupCoordinate) o).kind
          && Objects.equals(number, ((GroupCoordinate) o).number);
    }

    @Override public String toString() {
      switch (kind) {
      case NUMBER:
        return requireNonNull(number);
      case SIGN_HIGH:
        return "+";
      case SIGN_LOW:
        return "-";
      default:
        return "_";
      }
    }
  }

  /** Group literal in canonical form.
   *
   * <p>Either a scalar multiple of the generator, such as "2group"
   * ({@link #scalar} is not null), or an affine point such as
   * "(0, +)group" ({@link #x} and {@link #y} are not null). */
  public static class GroupLiteral extends Exp {
    public final @Nullable String scalar;
    public final @Nullable GroupCoordinate x;
    public final @Nullable GroupCoordinate y;

    GroupLiteral(NodeId nodeId, @Nullable String scalar,
        @Nullable GroupCoordinate x, @Nullable GroupCoordinate y) {
      super(nodeId, Op.GROUP_VALUE);
      this.scalar = scalar;
      this.x = x;
      this.y = y;
      checkArgument(scalar != null
              ? x == null && y == null
              : x != null && y != null,
          "group literal is either a scalar or a pair");
    }

    @Override public int hashCode() {
      return Objects.hash(scalar, x, y);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof GroupLiteral
          && Objects.equals(scalar, ((GroupLiteral) o).scalar)
          && Objects.equals(x, ((GroupLiteral) o).x)
          && Objects.equals(y, ((GroupLiteral) o).y);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (scalar != null) {
        return w.append(scalar).append("group");
      }
      return w.append("(").append(String.valueOf(x)).append(", ")
          .append(String.valueOf(y)).append(")group");
    }
  }

  /** Identifier, used both as an expression and as the name of a
   * declaration, parameter, member, field or type. */
  public static class Id extends Exp {
    /** Name of the receiver parameter of a method. */
    public static final String SELF = "self";
    /** Name that stands for the enclosing circuit. */
    public static final String SELF_TYPE = "Self";

    public final String name;

    Id(NodeId nodeId, String name) {
      super(nodeId, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Id
          && name.equals(((Id) o).name);
    }

    @Override Id reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Member of the enclosing circuit's receiver, written without the
   * receiver: ".x" means "self.x". */
  public static class ImplicitMember extends Exp {
    public final Id name;

    ImplicitMember(NodeId nodeId, Id name) {
      super(nodeId, Op.IMPLICIT_MEMBER);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return Objects.hash(op, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ImplicitMember
          && name.equals(((ImplicitMember) o).name);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(".").append(name, 0, 0);
    }

    /** Creates a copy of this {@code ImplicitMember} with given contents,
     * or {@code this} if the contents are the same. */
    public ImplicitMember copy(Id name) {
      return this.name == name ? this : new ImplicitMember(nodeId, name);
    }
  }

  /** Call to a prefix operator: "!", "-" or "~". */
  public static class Unary extends Exp {
    public final Exp inner;

    Unary(NodeId nodeId, Op op, Exp inner) {
      super(nodeId, op);
      this.inner = requireNonNull(inner);
      checkArgument(op.isUnary(), "bad op %s", op);
    }

    @Override public int hashCode() {
      return Objects.hash(op, inner);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Unary
          && op == ((Unary) o).op
          && inner.equals(((Unary) o).inner);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, inner, right);
    }

    /** Creates a copy of this {@code Unary} with given contents,
     * or {@code this} if the contents are the same. */
    public Unary copy(Exp inner) {
      return this.inner == inner ? this : new Unary(nodeId, op, inner);
    }
  }

  /** Call to an infix operator, such as "a + b". */
  public static class Binary extends Exp {
    public final Exp left;
    public final Exp right;

    Binary(NodeId nodeId, Op op, Exp left, Exp right) {
      super(nodeId, op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
      checkArgument(op.isBinary(), "bad op %s", op);
    }

    @Override public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Binary
          && op == ((Binary) o).op
          && left.equals(((Binary) o).left)
          && right.equals(((Binary) o).right);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, this.left, op, this.right, right);
    }

    /** Creates a copy of this {@code Binary} with given contents,
     * or {@code this} if the contents are the same. */
    public Binary copy(Exp left, Exp right) {
      return this.left == left && this.right == right
          ? this
          : new Binary(nodeId, op, left, right);
    }
  }

  /** Conditional expression, "c ? a : b". */
  public static class Ternary extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    Ternary(NodeId nodeId, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(nodeId, Op.TERNARY);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, ifTrue, ifFalse);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Ternary
          && condition.equals(((Ternary) o).condition)
          && ifTrue.equals(((Ternary) o).ifTrue)
          && ifFalse.equals(((Ternary) o).ifFalse);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append(condition, left, op.left).append(" ? ")
          .append(ifTrue, 0, 0).append(" : ")
          .append(ifFalse, op.right, right);
    }

    /** Creates a copy of this {@code Ternary} with given contents,
     * or {@code this} if the contents are the same. */
    public Ternary copy(Exp condition, Exp ifTrue, Exp ifFalse) {
      return this.condition == condition
          && this.ifTrue == ifTrue
          && this.ifFalse == ifFalse
          ? this
          : new Ternary(nodeId, condition, ifTrue, ifFalse);
    }
  }

  /** Function call, for example "f(x, y)", "Foo::new(1)" or "p.len()". */
  public static class Call extends Exp {
    public final Exp function;
    public final List<Exp> args;

    Call(NodeId nodeId, Exp function, ImmutableList<Exp> args) {
      super(nodeId, Op.CALL);
      this.function = requireNonNull(function);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(function, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Call
          && function.equals(((Call) o).function)
          && args.equals(((Call) o).args);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, function, op)
          .append("(").appendAll(args, ", ").append(")");
    }

    /** Creates a copy of this {@code Call} with given contents,
     * or {@code this} if the contents are the same. */
    public Call copy(Exp function, List<Exp> args) {
      return this.function == function && same(this.args, args)
          ? this
          : new Call(nodeId, function, ImmutableList.copyOf(args));
    }
  }

  /** Array literal listing its elements, "[a, b, c]". */
  public static class ArrayInline extends Exp {
    public final List<Exp> elements;

    ArrayInline(NodeId nodeId, ImmutableList<Exp> elements) {
      super(nodeId, Op.ARRAY_INLINE);
      this.elements = requireNonNull(elements);
    }

    @Override public int hashCode() {
      return Objects.hash(op, elements);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ArrayInline
          && elements.equals(((ArrayInline) o).elements);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").appendAll(elements, ", ").append("]");
    }

    /** Creates a copy of this {@code ArrayInline} with given contents,
     * or {@code this} if the contents are the same. */
    public ArrayInline copy(List<Exp> elements) {
      return same(this.elements, elements)
          ? this
          : new ArrayInline(nodeId, ImmutableList.copyOf(elements));
    }
  }

  /** Array literal that repeats an element, "[e; 3]", or, with several
   * dimensions, "[e; (2, 3)]". */
  public static class ArrayInit extends Exp {
    public final Exp element;
    public final List<Integer> dimensions;

    ArrayInit(NodeId nodeId, Exp element, ImmutableList<Integer> dimensions) {
      super(nodeId, Op.ARRAY_INIT);
      this.element = requireNonNull(element);
      this.dimensions = requireNonNull(dimensions);
      checkDimensions(dimensions);
    }

    @Override public int hashCode() {
      return Objects.hash(op, element, dimensions);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ArrayInit
          && element.equals(((ArrayInit) o).element)
          && dimensions.equals(((ArrayInit) o).dimensions);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[").append(element, 0, 0).append("; ");
      return appendDimensions(w, dimensions).append("]");
    }

    /** Creates a copy of this {@code ArrayInit} with given contents,
     * or {@code this} if the contents are the same. */
    public ArrayInit copy(Exp element) {
      return this.element == element
          ? this
          : new ArrayInit(nodeId, element,
              ImmutableList.copyOf(dimensions));
    }
  }

  private static void checkDimensions(List<Integer> dimensions) {
    checkArgument(!dimensions.isEmpty(), "array must have a dimension");
    dimensions.forEach(d ->
        checkArgument(d >= 0, "negative array dimension %s", d));
  }

  private static AstWriter appendDimensions(AstWriter w,
      List<Integer> dimensions) {
    if (dimensions.size() == 1) {
      return w.append(String.valueOf(dimensions.get(0)));
    }
    w.append("(");
    for (int i = 0; i < dimensions.size(); i++) {
      w.append(i == 0 ? "" : ", ").append(String.valueOf(dimensions.get(i)));
    }
    return w.append(")");
  }

  /** Tuple literal, "(a, b)". */
  public static class TupleInit extends Exp {
    public final List<Exp> elements;

    TupleInit(NodeId nodeId, ImmutableList<Exp> elements) {
      super(nodeId, Op.TUPLE_INIT);
      this.elements = requireNonNull(elements);
    }

    @Override public int hashCode() {
      return Objects.hash(op, elements);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TupleInit
          && elements.equals(((TupleInit) o).elements);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").appendAll(elements, ", ").append(")");
    }

    /** Creates a copy of this {@code TupleInit} with given contents,
     * or {@code this} if the contents are the same. */
    public TupleInit copy(List<Exp> elements) {
      return same(this.elements, elements)
          ? this
          : new TupleInit(nodeId, ImmutableList.copyOf(elements));
    }
  }

  /** Circuit literal, "Point { x: 1, y }". */
  public static class CircuitInit extends Exp {
    public final Id name;
    public final List<CircuitField> fields;

    CircuitInit(NodeId nodeId, Id name, ImmutableList<CircuitField> fields) {
      super(nodeId, Op.CIRCUIT_INIT);
      this.name = requireNonNull(name);
      this.fields = requireNonNull(fields);
    }

    @Override public int hashCode() {
      return Objects.hash(name, fields);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof CircuitInit
          && name.equals(((CircuitInit) o).name)
          && fields.equals(((CircuitInit) o).fields);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name, 0, 0);
      if (fields.isEmpty()) {
        return w.append(" {}");
      }
      return w.append(" { ").appendAll(fields, ", ").append(" }");
    }

    /** Creates a copy of this {@code CircuitInit} with given contents,
     * or {@code this} if the contents are the same. */
    public CircuitInit copy(Id name, List<CircuitField> fields) {
      return this.name == name && same(this.fields, fields)
          ? this
          : new CircuitInit(nodeId, name, ImmutableList.copyOf(fields));
    }
  }

  /** Field of a {@link CircuitInit}: "x: e", or just "x" when the value is
   * a variable of the same name. */
  public static class CircuitField extends AstNode {
    public final Id name;
    public final @Nullable Exp value;

    CircuitField(NodeId nodeId, Id name, @Nullable Exp value) {
      super(nodeId, Op.CIRCUIT_FIELD);
      this.name = requireNonNull(name);
      this.value = value;
    }

    @Override public int hashCode() {
      return Objects.hash(name, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof CircuitField
          && name.equals(((CircuitField) o).name)
          && Objects.equals(value, ((CircuitField) o).value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append(name, 0, 0);
      return value == null ? w : w.append(": ").append(value, 0, 0);
    }

    /** Creates a copy of this {@code CircuitField} with given contents,
     * or {@code this} if the contents are the same. */
    public CircuitField copy(Id name, @Nullable Exp value) {
      return this.name == name && this.value == value
          ? this
          : new CircuitField(nodeId, name, value);
    }
  }

  /** Array element access, "a[i]". */
  public static class ArrayAccess extends Exp {
    public final Exp array;
    public final Exp index;

    ArrayAccess(NodeId nodeId, Exp array, Exp index) {
      super(nodeId, Op.ARRAY_ACCESS);
      this.array = requireNonNull(array);
      this.index = requireNonNull(index);
    }

    @Override public int hashCode() {
      return Objects.hash(op, array, index);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ArrayAccess
          && array.equals(((ArrayAccess) o).array)
          && index.equals(((ArrayAccess) o).index);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, array, op)
          .append("[").append(index, 0, 0).append("]");
    }

    /** Creates a copy of this {@code ArrayAccess} with given contents,
     * or {@code this} if the contents are the same. */
    public ArrayAccess copy(Exp array, Exp index) {
      return this.array == array && this.index == index
          ? this
          : new ArrayAccess(nodeId, array, index);
    }
  }

  /** Array slice, "a[i..j]"; either bound may be omitted. */
  public static class ArrayRangeAccess extends Exp {
    public final Exp array;
    public final @Nullable Exp left;
    public final @Nullable Exp right;

    ArrayRangeAccess(NodeId nodeId, Exp array, @Nullable Exp left,
        @Nullable Exp right) {
      super(nodeId, Op.ARRAY_RANGE_ACCESS);
      this.array = requireNonNull(array);
      this.left = left;
      this.right = right;
    }

    @Override public int hashCode() {
      return Objects.hash(op, array, left, right);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ArrayRangeAccess
          && array.equals(((ArrayRangeAccess) o).array)
          && Objects.equals(left, ((ArrayRangeAccess) o).left)
          && Objects.equals(right, ((ArrayRangeAccess) o).right);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.postfix(left, array, op).append("[");
      if (this.left != null) {
        w.append(this.left, 0, 0);
      }
      w.append("..");
      if (this.right != null) {
        w.append(this.right, 0, 0);
      }
      return w.append("]");
    }

    /** Creates a copy of this {@code ArrayRangeAccess} with given contents,
     * or {@code this} if the contents are the same. */
    public ArrayRangeAccess copy(Exp array, @Nullable Exp left,
        @Nullable Exp right) {
      return this.array == array && this.left == left && this.right == right
          ? this
          : new ArrayRangeAccess(nodeId, array, left, right);
    }
  }

  /** Tuple element access, "t.0". */
  public static class TupleAccess extends Exp {
    public final Exp tuple;
    public final int index;

    TupleAccess(NodeId nodeId, Exp tuple, int index) {
      super(nodeId, Op.TUPLE_ACCESS);
      this.tuple = requireNonNull(tuple);
      this.index = index;
      checkArgument(index >= 0, "negative tuple index %s", index);
    }

    @Override public int hashCode() {
      return Objects.hash(op, tuple, index);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TupleAccess
          && tuple.equals(((TupleAccess) o).tuple)
          && index == ((TupleAccess) o).index;
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, tuple, op).append(".")
          .append(String.valueOf(index));
    }

    /** Creates a copy of this {@code TupleAccess} with given contents,
     * or {@code this} if the contents are the same. */
    public TupleAccess copy(Exp tuple) {
      return this.tuple == tuple ? this : new TupleAccess(nodeId, tuple, index);
    }
  }

  /** Circuit member access, "p.x". */
  public static class MemberAccess extends Exp {
    public final Exp inner;
    public final Id name;

    MemberAccess(NodeId nodeId, Exp inner, Id name) {
      super(nodeId, Op.MEMBER_ACCESS);
      this.inner = requireNonNull(inner);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return Objects.hash(op, inner, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MemberAccess
          && inner.equals(((MemberAccess) o).inner)
          && name.equals(((MemberAccess) o).name);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, inner, op).append(".").append(name, 0, 0);
    }

    /** Creates a copy of this {@code MemberAccess} with given contents,
     * or {@code this} if the contents are the same. */
    public MemberAccess copy(Exp inner, Id name) {
      return this.inner == inner && this.name == name
          ? this
          : new MemberAccess(nodeId, inner, name);
    }
  }

  /** Static member access, "Point::origin". */
  public static class StaticAccess extends Exp {
    public final Exp inner;
    public final Id name;

    StaticAccess(NodeId nodeId, Exp inner, Id name) {
      super(nodeId, Op.STATIC_ACCESS);
      this.inner = requireNonNull(inner);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return Objects.hash(op, inner, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof StaticAccess
          && inner.equals(((StaticAccess) o).inner)
          && name.equals(((StaticAccess) o).name);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, inner, op).append("::").append(name, 0, 0);
    }

    /** Creates a copy of this {@code StaticAccess} with given contents,
     * or {@code this} if the contents are the same. */
    public StaticAccess copy(Exp inner, Id name) {
      return this.inner == inner && this.name == name
          ? this
          : new StaticAccess(nodeId, inner, name);
    }
  }

  /** Type conversion, "e as u32". */
  public static class Cast extends Exp {
    public final Exp inner;
    public final Type type;

    Cast(NodeId nodeId, Exp inner, Type type) {
      super(nodeId, Op.CAST);
      this.inner = requireNonNull(inner);
      this.type = requireNonNull(type);
    }

    @Override public int hashCode() {
      return Objects.hash(op, inner, type);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Cast
          && inner.equals(((Cast) o).inner)
          && type.equals(((Cast) o).type);
    }

    @Override Exp reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, inner, op, type, right);
    }

    /** Creates a copy of this {@code Cast} with given contents,
     * or {@code this} if the contents are the same. */
    public Cast copy(Exp inner, Type type) {
      return this.inner == inner && this.type == type
          ? this
          : new Cast(nodeId, inner, type);
    }
  }

  //-------------------------------------------------------------------------
  // Types

  /** Base class for parse tree nodes that represent types. */
  public abstract static class Type extends AstNode {
    Type(NodeId nodeId, Op op) {
      super(nodeId, op);
    }

    /** Calls the {@link Director} method for this kind of type. */
    abstract Type reduce(Director director);
  }

  /** Built-in scalar type, such as "bool", "field" or "u32". */
  public static class PrimitiveType extends Type {
    PrimitiveType(NodeId nodeId, Op op) {
      super(nodeId, op);
      checkArgument(op.isPrimitiveType(), "bad op %s", op);
    }

    @Override public int hashCode() {
      return op.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof PrimitiveType
          && op == ((PrimitiveType) o).op;
    }

    @Override Type reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded);
    }
  }

  /** Array type, "[u8; 3]", or, with several dimensions,
   * "[u8; (2, 3)]". */
  public static class ArrayType extends Type {
    public final Type element;
    public final List<Integer> dimensions;

    ArrayType(NodeId nodeId, Type element, ImmutableList<Integer> dimensions) {
      super(nodeId, Op.ARRAY_TYPE);
      this.element = requireNonNull(element);
      this.dimensions = requireNonNull(dimensions);
      checkDimensions(dimensions);
    }

    @Override public int hashCode() {
      return Objects.hash(op, element, dimensions);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ArrayType
          && element.equals(((ArrayType) o).element)
          && dimensions.equals(((ArrayType) o).dimensions);
    }

    @Override Type reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("[").append(element, 0, 0).append("; ");
      return appendDimensions(w, dimensions).append("]");
    }

    /** Creates a copy of this {@code ArrayType} with given contents,
     * or {@code this} if the contents are the same. */
    public ArrayType copy(Type element) {
      return this.element == element
          ? this
          : new ArrayType(nodeId, element, ImmutableList.copyOf(dimensions));
    }
  }

  /** Tuple type, "(u8, bool)". */
  public static class TupleType extends Type {
    public final List<Type> types;

    TupleType(NodeId nodeId, ImmutableList<Type> types) {
      super(nodeId, Op.TUPLE_TYPE);
      this.types = requireNonNull(types);
    }

    @Override public int hashCode() {
      return Objects.hash(op, types);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TupleType
          && types.equals(((TupleType) o).types);
    }

    @Override Type reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").appendAll(types, ", ").append(")");
    }

    /** Creates a copy of this {@code TupleType} with given contents,
     * or {@code this} if the contents are the same. */
    public TupleType copy(List<Type> types) {
      return same(this.types, types)
          ? this
          : new TupleType(nodeId, ImmutableList.copyOf(types));
    }
  }

  /** Reference to a circuit type by name, "Point". */
  public static class NamedType extends Type {
    public final Id name;

    NamedType(NodeId nodeId, Id name) {
      super(nodeId, Op.NAMED_TYPE);
      this.name = requireNonNull(name);
    }

    @Override public int hashCode() {
      return Objects.hash(op, name);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NamedType
          && name.equals(((NamedType) o).name);
    }

    @Override Type reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name, 0, 0);
    }

    /** Creates a copy of this {@code NamedType} with given contents,
     * or {@code this} if the contents are the same. */
    public NamedType copy(Id name) {
      return this.name == name ? this : new NamedType(nodeId, name);
    }
  }

  /** The type "Self", which stands for the enclosing circuit until
   * canonicalization replaces it. */
  public static class SelfType extends Type {
    SelfType(NodeId nodeId) {
      super(nodeId, Op.SELF_TYPE);
    }

    @Override public int hashCode() {
      return op.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o instanceof SelfType;
    }

    @Override Type reduce(Director director) {
      return director.reduce(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded);
    }
  }
}

// End Ast.java
