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
package net.hydromatic.hdl;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.hdl.Matchers.throwsA;
import static net.hydromatic.hdl.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.hdl.ast.Ast;
import net.hydromatic.hdl.ast.Pos;
import net.hydromatic.hdl.compile.Classification;
import net.hydromatic.hdl.compile.CompileException;
import net.hydromatic.hdl.compile.Environment;
import net.hydromatic.hdl.compile.LoweredBlock;
import net.hydromatic.hdl.compile.Lowering;
import net.hydromatic.hdl.compile.Prop;
import net.hydromatic.hdl.compile.Tracer;
import net.hydromatic.hdl.compile.Tracers;
import net.hydromatic.hdl.model.Bundle;
import net.hydromatic.hdl.model.Component;
import net.hydromatic.hdl.model.Signal;
import net.hydromatic.hdl.type.Bits;
import org.hamcrest.Matcher;

/** Fluent test helper for lowering. */
public class Lowerings {
  public static final Pos POS = Pos.of("test.py", 1, 1, 2);

  private final Environment env;
  private final Ast.Decl decl;
  private final Map<Prop, Object> propMap;

  Lowerings(Environment env, Ast.Decl decl, Map<Prop, Object> propMap) {
    this.env = requireNonNull(env);
    this.decl = requireNonNull(decl);
    this.propMap = ImmutableMap.copyOf(propMap);
  }

  /** Creates a {@code Lowerings} for a block of a given component, which
   * refers to the component as "s". */
  public static Lowerings lowering(Component self, Ast.Decl decl) {
    return lowering(Environment.of(self, "s"), decl);
  }

  /** Creates a {@code Lowerings} with a given environment. */
  public static Lowerings lowering(Environment env, Ast.Decl decl) {
    return new Lowerings(env, decl, ImmutableMap.of());
  }

  public Lowerings withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Lowerings(env, decl, map);
  }

  private Lowering lowering(Tracer tracer) {
    return new Lowering(propMap, tracer);
  }

  /** Lowers the block. */
  public LoweredBlock lower() {
    return lowering(Tracers.empty()).lower(env, decl);
  }

  /** Checks the tree after a given pass. */
  public Lowerings assertPass(String pass, String expected) {
    final Map<String, String> trees = new LinkedHashMap<>();
    final Tracer tracer =
        Tracers.withOnPass(Tracers.empty(), pass,
            node -> trees.put(pass, node.toString()));
    lowering(tracer).lower(env, decl);
    assertThat("pass " + pass + " was not run", trees.get(pass),
        notNullValue());
    assertThat(trees.get(pass), is(expected));
    return this;
  }

  /** Checks the lowered block. */
  public Lowerings assertLowered(String expected) {
    assertThat(lower().functionDef.toString(), is(expected));
    return this;
  }

  /** Checks the lowered block, which is a single statement in a block
   * called "logic". */
  public Lowerings assertLoweredBody(String... lines) {
    final StringBuilder b = new StringBuilder();
    for (String line : lines) {
      b.append("\n  ").append(line);
    }
    return assertLowered("@" + lower().tag + "\ndef logic():" + b);
  }

  /** Checks the classification of the lowered block. */
  public Lowerings assertClassification(Consumer<Classification> consumer) {
    consumer.accept(lower().classification);
    return this;
  }

  /** Checks that lowering fails with an error of a given kind. */
  public Lowerings assertError(CompileException.Kind kind, String message) {
    assertError(this::lower, throwsA(kind, message));
    return this;
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  public static void assertError(Runnable runnable,
      Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  // Builders for syntax trees.

  /** Creates a block "logic" decorated with "s.tag". */
  public static Ast.FunctionDef block(String tag, Ast.Stmt... stmts) {
    return ast.functionDef(POS, "logic",
        ImmutableList.of(ast.path(POS, "s", tag)), Arrays.asList(stmts));
  }

  /** Creates a combinational block. */
  public static Ast.FunctionDef comb(Ast.Stmt... stmts) {
    return block("combinational", stmts);
  }

  /** Creates a path that is read, such as "s.adder.out". */
  public static Ast.Exp load(String root, String... attrs) {
    return ast.path(POS, root, attrs);
  }

  /** Creates a path that is written, such as "s.out.next". */
  public static Ast.Exp store(String root, String... attrs) {
    if (attrs.length == 0) {
      return ast.name(POS, root, Ast.Ctx.STORE, null);
    }
    final Ast.Exp receiver =
        ast.path(POS, root, Arrays.copyOf(attrs, attrs.length - 1));
    return ast.attribute(POS, receiver, attrs[attrs.length - 1],
        Ast.Ctx.STORE, null);
  }

  /** Creates an element reference that is written, "value[index]". */
  public static Ast.Exp storeAt(Ast.Exp value, Ast.Exp index) {
    return ast.subscript(POS, value, index, Ast.Ctx.STORE, null);
  }

  public static Ast.Exp at(Ast.Exp value, Ast.Exp index) {
    return ast.subscript(POS, value, index);
  }

  public static Ast.Exp attr(Ast.Exp receiver, String attr) {
    return ast.attribute(POS, receiver, attr);
  }

  public static Ast.Exp storeAttr(Ast.Exp receiver, String attr) {
    return ast.attribute(POS, receiver, attr, Ast.Ctx.STORE, null);
  }

  public static Ast.Exp num(long value) {
    return ast.num(POS, value);
  }

  public static Ast.Exp call(String func, Ast.Exp... args) {
    return ast.call(POS, func, args);
  }

  public static Ast.Stmt assign(Ast.Exp target, Ast.Exp value) {
    return ast.assign(POS, target, value);
  }

  /** Creates "for i in range(args): body". */
  public static Ast.Stmt forRange(String var, List<Ast.Exp> args,
      Ast.Stmt... body) {
    return ast.forLoop(POS, store(var), ast.call(POS, ast.name(POS, "range"),
        args), Arrays.asList(body));
  }

  /**
   * Creates a sample design.
   *
   * <p>Component "top" (class Top) has ports "in_" and "out", a register
   * "acc", parameter "NBITS", constant "MASK", range "LOW", sub-component
   * "adder" (which has its own sub-component "inc"), bundle "req", a list of
   * components "units", a list of bundles "resp", and a list of registers
   * "regs".
   */
  public static Component top() {
    final Component top = new Component("Top", "top");
    top.inPort("in_", 8);
    top.outPort("out", 8);
    top.reg("acc", 8);
    top.param("NBITS", 8);
    top.constant("MASK", Bits.of(8, 0xf0));
    top.range("LOW", 0, 4);

    final Component adder = top.submodule(new Component("Adder", "adder"));
    adder.inPort("in_", 8);
    adder.outPort("out", 8);
    final Component inc = adder.submodule(new Component("Inc", "inc"));
    inc.outPort("out", 8);

    final Bundle req = top.add("req", new Bundle("ReqBundle", "req"));
    req.inPort("msg", 4);
    req.inPort("val", 1);

    final ImmutableList.Builder<Component> units = ImmutableList.builder();
    final ImmutableList.Builder<Bundle> resp = ImmutableList.builder();
    for (int i = 0; i < 2; i++) {
      final Component unit = new Component("Unit", "units[" + i + "]");
      unit.inPort("in_", 8);
      unit.outPort("out", 8);
      units.add(unit);
      final Bundle bundle = new Bundle("RespBundle", "resp[" + i + "]");
      bundle.outPort("msg", 4);
      resp.add(bundle);
    }
    top.list("units", units.build());
    top.list("resp", resp.build());
    top.signals(Signal.Kind.REG, "regs", 4, 8);
    return top;
  }
}

// End Lowerings.java
