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

import static net.hydromatic.hdl.Lowerings.POS;
import static net.hydromatic.hdl.Lowerings.assign;
import static net.hydromatic.hdl.Lowerings.at;
import static net.hydromatic.hdl.Lowerings.attr;
import static net.hydromatic.hdl.Lowerings.block;
import static net.hydromatic.hdl.Lowerings.call;
import static net.hydromatic.hdl.Lowerings.comb;
import static net.hydromatic.hdl.Lowerings.forRange;
import static net.hydromatic.hdl.Lowerings.load;
import static net.hydromatic.hdl.Lowerings.lowering;
import static net.hydromatic.hdl.Lowerings.num;
import static net.hydromatic.hdl.Lowerings.store;
import static net.hydromatic.hdl.Lowerings.storeAt;
import static net.hydromatic.hdl.Lowerings.storeAttr;
import static net.hydromatic.hdl.Lowerings.top;
import static net.hydromatic.hdl.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.hdl.ast.Ast;
import net.hydromatic.hdl.ast.Op;
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
import net.hydromatic.hdl.model.Constant;
import net.hydromatic.hdl.model.DesignList;
import net.hydromatic.hdl.model.DesignObject;
import net.hydromatic.hdl.model.IntValue;
import net.hydromatic.hdl.model.Signal;
import net.hydromatic.hdl.type.Bits;
import org.junit.jupiter.api.Test;

/** Tests for {@link Lowering}, running all passes on small blocks. */
public class LoweringTest {
  /** Returns the object of the target of the {@code i}th statement. */
  private static DesignObject targetObj(LoweredBlock block, int i) {
    final Ast.Assign assign = (Ast.Assign) block.functionDef.body.get(i);
    return assign.targets.get(0).obj;
  }

  @Test
  void testSimpleAssign() {
    final Component top = top();
    final Ast.FunctionDef f =
        comb(
            assign(store("s", "out", "value"),
                ast.binOp(Op.PLUS, load("s", "in_"), load("s", "NBITS"))));
    lowering(top, f)
        .assertPass(Lowering.BIND,
            "@s.combinational\n"
                + "def logic():\n"
                + "  s.out.value = s.in_ + s.NBITS")
        .assertPass(Lowering.SIMPLIFY_DECORATOR,
            "@combinational\n"
                + "def logic():\n"
                + "  s.out.value = s.in_ + s.NBITS")
        .assertPass(Lowering.STRIP_ACCESSORS,
            "@combinational\n"
                + "def logic():\n"
                + "  s.out = s.in_ + s.NBITS")
        .assertLoweredBody("out = in_ + NBITS")
        .assertClassification(c -> {
          assertThat(c.registerNames(), is(ImmutableList.of("top.out")));
          assertThat(c.loopVariables.isEmpty(), is(true));
          assertThat(c.arrays.isEmpty(), is(true));
          assertThat(c.parameters,
              hasItem(new Classification.Param("NBITS", IntValue.of(8))));
          assertThat(c.parameters.size(), is(1));
        });
  }

  @Test
  void testTag() {
    final Ast.FunctionDef f =
        block("tick_rtl", assign(store("s", "acc", "next"), load("s", "in_")));
    final LoweredBlock b = lowering(top(), f).lower();
    assertThat(b.tag, is("tick_rtl"));
    assertThat(b.name(), is("logic"));
    assertThat(b.toString(), is("@tick_rtl\ndef logic():\n  acc = in_"));
  }

  /** Tests that "value", "next", "v" and "n" all denote the signal, and that
   * the signal takes over the accessor's context. */
  @Test
  void testAccessors() {
    final Ast.FunctionDef f =
        comb(assign(store("s", "acc", "next"), load("s", "in_", "v")),
            assign(store("s", "out", "n"), load("s", "acc", "value")));
    final LoweredBlock b =
        lowering(top(), f)
            .assertLoweredBody("acc = in_", "out = acc")
            .lower();
    final Ast.Assign assign = (Ast.Assign) b.functionDef.body.get(0);
    assertThat(((Ast.Attribute) assign.targets.get(0)).ctx,
        is(Ast.Ctx.STORE));
    assertThat(((Ast.Attribute) assign.value).ctx, is(Ast.Ctx.LOAD));
    assertThat(b.classification.registerNames(),
        is(ImmutableList.of("top.acc", "top.out")));
  }

  @Test
  void testAccessorOnListElement() {
    final Ast.FunctionDef f =
        comb(
            assign(storeAttr(at(load("s", "regs"), num(2)), "next"),
                load("s", "in_")));
    final LoweredBlock b =
        lowering(top(), f).assertLoweredBody("regs[2] = in_").lower();
    final Ast.Subscript target =
        (Ast.Subscript)
            ((Ast.Assign) b.functionDef.body.get(0)).targets.get(0);
    assertThat(target.ctx, is(Ast.Ctx.STORE));
  }

  @Test
  void testAccessorNamesProp() {
    final Ast.FunctionDef f =
        comb(assign(store("s", "out", "next"), load("s", "in_")));
    lowering(top(), f)
        .withProp(Prop.ACCESSOR_NAMES, "value")
        .assertError(CompileException.Kind.UNRESOLVED_REFERENCE,
            "Unknown attribute 'next' of signal out");
  }

  @Test
  void testBareNameDecorator() {
    final Ast.FunctionDef f =
        ast.functionDef(POS, "logic",
            ImmutableList.of(ast.name(POS, "combinational")),
            ImmutableList.of(assign(store("s", "out"), load("s", "in_"))));
    lowering(top(), f)
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Unsupported decorator 'combinational'");
  }

  @Test
  void testDecoratorErrors() {
    final ImmutableList<Ast.Stmt> body =
        ImmutableList.of(assign(store("s", "out"), load("s", "in_")));
    lowering(top(), ast.functionDef(POS, "logic", ImmutableList.of(), body))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "must have exactly one decorator, has 0");
    final ImmutableList<Ast.Exp> twoDecorators =
        ImmutableList.of(load("s", "combinational"), load("s", "posedge_clk"));
    lowering(top(), ast.functionDef(POS, "logic", twoDecorators, body))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "must have exactly one decorator, has 2");
    final ImmutableList<Ast.Exp> callDecorator =
        ImmutableList.of(call("combinational", num(1)));
    lowering(top(), ast.functionDef(POS, "logic", callDecorator, body))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Unsupported decorator 'combinational(1)'");
  }

  @Test
  void testRangeOneArg() {
    final Ast.FunctionDef f =
        comb(
            forRange("i", ImmutableList.of(num(4)),
                assign(storeAt(load("s", "regs"), load("i")), num(0))));
    lowering(top(), f)
        .assertLoweredBody("for i in slice(0, 4, 1):", "  regs[i] = 0")
        .assertClassification(c -> {
          assertThat(c.loopVariables, hasItem("i"));
          assertThat(c.registers.isEmpty(), is(true));
          assertThat(c.arrays.size(), is(1));
        });
  }

  @Test
  void testRangeTwoArgs() {
    final Ast.FunctionDef f =
        comb(
            forRange("i", ImmutableList.of(num(1), num(4)),
                assign(storeAt(load("s", "regs"), load("i")), num(0))));
    lowering(top(), f)
        .assertPass(Lowering.CANONICALIZE_LOOPS,
            "@combinational\n"
                + "def logic():\n"
                + "  for i in slice(1, 4, 1):\n"
                + "    regs[i] = 0");
  }

  @Test
  void testRangeThreeArgs() {
    final Ast.FunctionDef f =
        comb(
            forRange("i", ImmutableList.of(num(0), load("s", "NBITS"), num(2)),
                assign(storeAt(load("s", "out"), load("i")), num(1))));
    lowering(top(), f)
        .assertLoweredBody("for i in slice(0, NBITS, 2):", "  out[i] = 1")
        .assertClassification(c -> {
          assertThat(c.parameters,
              hasItem(new Classification.Param("NBITS", IntValue.of(8))));
          assertThat(c.registerNames(), is(ImmutableList.of("top.out")));
        });
  }

  @Test
  void testXrange() {
    final Ast.Stmt loop =
        ast.forLoop(POS, store("i"),
            call("xrange", num(3)),
            ImmutableList.of(
                assign(storeAt(load("s", "regs"), load("i")), num(0))));
    lowering(top(), comb(loop))
        .assertLoweredBody("for i in slice(0, 3, 1):", "  regs[i] = 0");
    lowering(top(), comb(loop))
        .withProp(Prop.RANGE_FUNCTIONS, "range")
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Loop must iterate over one of [range]");
  }

  @Test
  void testLoopErrors() {
    final Ast.Stmt body = assign(store("s", "out"), num(0));
    final Ast.Stmt overList =
        ast.forLoop(POS, store("i"), load("s", "regs"),
            ImmutableList.of(body));
    lowering(top(), comb(overList))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Loop must iterate over one of [range, xrange], not 'regs'");
    lowering(top(), comb(forRange("i", ImmutableList.of(), body)))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Invalid number of arguments to range: 0");
    final List<Ast.Exp> fourArgs =
        ImmutableList.of(num(0), num(1), num(2), num(3));
    lowering(top(), comb(forRange("i", fourArgs, body)))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Invalid number of arguments to range: 4");
  }

  @Test
  void testRangeConstant() {
    final Ast.FunctionDef f =
        comb(assign(store("s", "out"), at(load("s", "in_"), load("s", "LOW"))));
    lowering(top(), f).assertLoweredBody("out = in_[0:4]");
    lowering(top(), f)
        .withProp(Prop.EXPAND_RANGE_CONSTANTS, false)
        .assertLoweredBody("out = in_[LOW]");
  }

  @Test
  void testSubmodules() {
    final Ast.FunctionDef f =
        comb(assign(store("s", "adder", "in_"), load("s", "in_")),
            assign(store("s", "out"), load("s", "adder", "inc", "out")));
    lowering(top(), f)
        .assertPass(Lowering.REMOVE_SELF,
            "@combinational\n"
                + "def logic():\n"
                + "  adder.in_ = in_\n"
                + "  out = adder.inc.out")
        .assertLoweredBody("adder$in_ = in_", "out = adder$inc$out")
        .assertClassification(c ->
            assertThat(c.registerNames(),
                is(ImmutableList.of("top.adder.in_", "top.out"))));
  }

  @Test
  void testBundle() {
    final Ast.FunctionDef f =
        comb(assign(store("s", "out"), load("s", "req", "msg")),
            assign(store("s", "acc"), load("s", "req", "val", "value")));
    lowering(top(), f).assertLoweredBody("out = req_msg", "acc = req_val");
  }

  @Test
  void testComponentList() {
    final Component top = top();
    final Ast.FunctionDef f =
        comb(
            forRange("i", ImmutableList.of(num(2)),
                assign(storeAttr(at(load("s", "units"), load("i")), "in_"),
                    load("s", "in_")),
                assign(store("s", "out"),
                    attr(at(load("s", "units"), num(1)), "out"))));
    final LoweredBlock b =
        lowering(top, f)
            .assertLoweredBody("for i in slice(0, 2, 1):",
                "  units$in_[i] = in_",
                "  out = units$out[1]")
            .lower();

    final Ast.For loop = (Ast.For) b.functionDef.body.get(0);
    final Ast.Subscript target =
        (Ast.Subscript) ((Ast.Assign) loop.body.get(0)).targets.get(0);
    assertThat(target.ctx, is(Ast.Ctx.STORE));
    final DesignList projection = (DesignList) target.obj;
    assertThat(projection.name, is("units$in_"));
    assertThat(projection.size(), is(2));
    assertThat(target.value.obj, sameInstance((DesignObject) projection));

    // Elements of the projected list are the ports of the units.
    final DesignList units = (DesignList) top.members().get("units");
    for (int i = 0; i < 2; i++) {
      assertThat(projection.get(i),
          sameInstance(units.get(i).resolveField("in_").get()));
    }
    assertThat(b.classification.isWritten(projection), is(true));
    assertThat(b.classification.registerNames(),
        is(ImmutableList.of("top.out")));
  }

  @Test
  void testProjectionIsCached() {
    final Ast.FunctionDef f =
        comb(
            assign(store("s", "out"),
                attr(at(load("s", "units"), num(0)), "out")),
            assign(store("s", "acc"),
                attr(at(load("s", "units"), num(1)), "out")));
    final LoweredBlock b = lowering(top(), f).lower();
    final Ast.Exp v0 = ((Ast.Assign) b.functionDef.body.get(0)).value;
    final Ast.Exp v1 = ((Ast.Assign) b.functionDef.body.get(1)).value;
    assertThat(v0.obj, sameInstance(v1.obj));
    assertThat(b.classification.arrays.size(), is(1));
    assertThat(b.classification.isWritten((DesignList) v0.obj), is(false));
  }

  @Test
  void testBundleList() {
    final Ast.FunctionDef f =
        comb(
            assign(storeAttr(at(load("s", "resp"), num(1)), "msg"),
                load("s", "req", "msg")));
    lowering(top(), f).assertLoweredBody("resp_msg[1] = req_msg");
  }

  @Test
  void testAmbiguousFlattening() {
    final Ast.Exp list =
        ast.list(POS,
            ImmutableList.of(load("s", "adder"), load("s", "adder")));
    final Ast.FunctionDef f =
        comb(assign(store("s", "out"), attr(at(list, num(0)), "out")));
    lowering(top(), f)
        .assertError(CompileException.Kind.AMBIGUOUS_FLATTENING,
            "Don't know how to flatten '[adder, adder][0].out'");
  }

  /** A sub-component or bundle of an element of a list cannot be flattened
   * without losing the index. */
  @Test
  void testNestedThroughList() {
    final Component top = new Component("Top", "top");
    top.outPort("out", 8);
    final ImmutableList.Builder<Component> units = ImmutableList.builder();
    for (int i = 0; i < 2; i++) {
      final Component unit = new Component("Unit", "units[" + i + "]");
      final Component core = unit.submodule(new Component("Core", "core"));
      core.outPort("out", 8);
      final Bundle req = unit.add("req", new Bundle("ReqBundle", "req"));
      req.inPort("msg", 8);
      units.add(unit);
    }
    top.list("units", units.build());

    final Ast.Exp unit = at(load("s", "units"), num(1));
    lowering(top,
        comb(assign(store("s", "out"), attr(attr(unit, "core"), "out"))))
        .assertError(CompileException.Kind.AMBIGUOUS_FLATTENING,
            "Don't know how to flatten 'units[1].core.out'");
    lowering(top,
        comb(assign(store("s", "out"), attr(attr(unit, "req"), "msg"))))
        .assertError(CompileException.Kind.AMBIGUOUS_FLATTENING,
            "Don't know how to flatten 'units[1].req.msg'");
  }

  @Test
  void testHeterogeneousList() {
    final Component top = top();
    final Component unit = new Component("Unit", "mixed[0]");
    unit.outPort("out", 8);
    top.list("mixed",
        ImmutableList.of(unit, new Bundle("RespBundle", "mixed[1]")));
    final Ast.FunctionDef f =
        comb(
            assign(store("s", "out"),
                attr(at(load("s", "mixed"), num(0)), "out")));
    lowering(top, f)
        .assertError(CompileException.Kind.HETEROGENEOUS_LIST,
            "Elements of list 'mixed' have different kinds");
    lowering(top, f)
        .withProp(Prop.CHECK_HOMOGENEOUS, false)
        .assertError(CompileException.Kind.UNRESOLVED_REFERENCE,
            "element 1 of mixed has no field 'out'");
  }

  @Test
  void testUnresolvedAttribute() {
    lowering(top(), comb(assign(store("s", "out"), load("s", "bogus"))))
        .assertError(CompileException.Kind.UNRESOLVED_REFERENCE,
            "Unknown attribute 'bogus' of component Top(top)");
    lowering(top(), comb(assign(store("s", "out"), load("s", "in_", "foo"))))
        .assertError(CompileException.Kind.UNRESOLVED_REFERENCE,
            "Unknown attribute 'foo' of signal in_");
  }

  @Test
  void testSelfAsValue() {
    lowering(top(), comb(assign(store("s", "out"), load("s"))))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Reference to the enclosing component 's'");
  }

  @Test
  void testSelfDroppedFromArguments() {
    final Ast.FunctionDef f =
        comb(
            assign(store("x"),
                call("concat", load("s"), load("s", "in_"),
                    load("s", "out"))),
            assign(store("s", "acc"), load("x")));
    final LoweredBlock b =
        lowering(top(), f)
            .assertLoweredBody("x = concat(in_, out)", "acc = x")
            .lower();
    assertThat(((Signal) targetObj(b, 0)).nbits, is(16));
  }

  @Test
  void testInferFromSignal() {
    final Ast.FunctionDef f =
        comb(assign(store("x"), load("s", "in_")),
            assign(store("s", "out"), load("x")));
    final LoweredBlock b =
        lowering(top(), f).assertLoweredBody("x = in_", "out = x").lower();
    final Signal x = (Signal) targetObj(b, 0);
    assertThat(x.name, is("x"));
    assertThat(x.nbits, is(8));
    assertThat(x.parent, nullValue());
    assertThat(x.signalKind, is(Signal.Kind.IN_PORT));

    // The later load of "x" carries the same object.
    final Ast.Assign second = (Ast.Assign) b.functionDef.body.get(1);
    assertThat(second.value.obj, sameInstance((DesignObject) x));

    // Temporaries that are signals are registers; "x" has no parent.
    assertThat(b.classification.registerNames(),
        is(ImmutableList.of("x", "top.out")));
  }

  @Test
  void testInferIntegers() {
    final Ast.FunctionDef f =
        comb(assign(store("n"), load("s", "NBITS")),
            assign(store("k"), num(3)),
            assign(store("m"), load("n")));
    final LoweredBlock b = lowering(top(), f).lower();
    assertThat(targetObj(b, 0).toString(), is("(n, 8)"));
    assertThat(targetObj(b, 1).toString(), is("(k, 3)"));
    assertThat(targetObj(b, 2).toString(), is("(m, 8)"));
    final Classification c = b.classification;
    assertThat(c.loopVariables, is(ImmutableSet.of("n", "k", "m")));
    assertThat(c.registers.isEmpty(), is(true));
  }

  @Test
  void testInferWidths() {
    final Ast.FunctionDef f =
        comb(
            assign(store("b"),
                ast.compare(Op.EQ, load("s", "in_"), load("s", "out"))),
            assign(store("c"), at(load("s", "in_"), num(0))),
            assign(store("w"),
                call("concat", load("s", "in_"), load("s", "req", "msg"))),
            assign(store("e"), call("sext", load("s", "in_"), num(16))),
            assign(store("z"),
                call("zext", load("s", "req", "msg"), load("s", "NBITS"))),
            assign(store("r"), call("reduce_or", load("s", "in_"))),
            assign(store("m"), load("s", "MASK")),
            assign(store("a"),
                ast.boolOp(Op.AND, load("b"), load("c"))));
    final LoweredBlock b = lowering(top(), f).lower();
    final int[] widths = {1, 1, 12, 16, 8, 1, 8, 1};
    for (int i = 0; i < widths.length; i++) {
      assertThat(((Signal) targetObj(b, i)).nbits, is(widths[i]));
    }
    assertThat(b.classification.parameters,
        hasItem(
            new Classification.Param("MASK",
                new Constant(Bits.of(8, 0xf0)))));
  }

  @Test
  void testInferErrors() {
    lowering(top(), comb(assign(store("y"), call("foo", load("s", "in_")))))
        .assertError(CompileException.Kind.TYPE_INFERENCE,
            "Function is not translatable: foo");
    lowering(top(),
        comb(
            assign(store("y"),
                ast.binOp(Op.PLUS, load("s", "in_"), num(1)))))
        .assertError(CompileException.Kind.TYPE_INFERENCE,
            "Cannot infer type of temporary 'y'");
    lowering(top(),
        comb(
            assign(store("y"), call("sext", load("s", "in_"),
                load("s", "out")))))
        .assertError(CompileException.Kind.TYPE_INFERENCE,
            "Width 'out' is not an integer constant");
    lowering(top(), comb(assign(store("y"), load("z"))))
        .assertError(CompileException.Kind.TYPE_INFERENCE,
            "Cannot infer type of temporary 'y' from unresolved reference");
    lowering(top(), comb(assign(store("y"), call("concat"))))
        .assertError(CompileException.Kind.TYPE_INFERENCE,
            "Function concat requires at least one argument");
    final Ast.Exp reversed =
        at(load("s", "in_"), ast.slice(POS, num(4), num(0), null));
    lowering(top(), comb(assign(store("y"), call("concat", reversed))))
        .assertError(CompileException.Kind.TYPE_INFERENCE,
            "Invalid width -4 of slice");
    final Ast.Exp huge =
        at(load("s", "in_"), ast.slice(POS, num(0), num(1L << 40), null));
    lowering(top(), comb(assign(store("y"), call("concat", huge))))
        .assertError(CompileException.Kind.TYPE_INFERENCE,
            "Invalid width 1099511627776 of slice");
  }

  /** A malformed block is reported as a compile error, and does not stop
   * the blocks after it from being lowered. */
  @Test
  void testInferErrorInLowerAll() {
    final List<CompileException> errors = new ArrayList<>();
    final List<LoweredBlock> blocks =
        Lowering.create()
            .withTracer(
                Tracers.withOnCompileException(Tracers.empty(), errors::add))
            .lowerAll(Environment.of(top(), "s"),
                ImmutableList.of(
                    comb(assign(store("y"), call("concat"))),
                    comb(assign(store("s", "out"), load("s", "in_")))));
    assertThat(blocks.size(), is(1));
    assertThat(errors.size(), is(1));
    assertThat(errors.get(0).kind, is(CompileException.Kind.TYPE_INFERENCE));
  }

  @Test
  void testReadBeforeAssign() {
    lowering(top(), comb(assign(store("s", "out"), load("y"))))
        .assertError(CompileException.Kind.UNRESOLVED_REFERENCE,
            "Variable 'y' is read but never assigned");
    lowering(top(),
        comb(
            assign(store("s", "out"), load("t")),
            assign(store("t"), load("s", "in_"))))
        .assertError(CompileException.Kind.UNRESOLVED_REFERENCE,
            "Variable 't' is read but never assigned");

    // A loop variable is in scope only inside its loop.
    final Ast.Stmt loop =
        forRange("i", ImmutableList.of(num(4)),
            assign(storeAt(load("s", "regs"), load("i")), load("s", "in_")));
    lowering(top(), comb(loop))
        .assertLoweredBody("for i in slice(0, 4, 1):", "  regs[i] = in_");
    lowering(top(),
        comb(loop, assign(store("s", "out"), at(load("s", "in_"), load("i")))))
        .assertError(CompileException.Kind.UNRESOLVED_REFERENCE,
            "Variable 'i' is read but never assigned");
  }

  @Test
  void testAssignTargets() {
    final Ast.Stmt twoTargets =
        ast.assign(POS, ImmutableList.of(store("x"), store("y")), num(1));
    lowering(top(), comb(twoTargets))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Assignment must have exactly one target, has 2");
    lowering(top(), comb(assign(storeAt(load("x"), num(0)), num(1))))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Cannot assign to unresolved target 'x[0]'");
  }

  /** A name may be both a register and a loop variable; both are
   * reported. */
  @Test
  void testRegisterAndLoopVariable() {
    final Ast.FunctionDef f =
        comb(
            forRange("i", ImmutableList.of(num(4)),
                assign(storeAt(load("s", "regs"), load("i")),
                    load("s", "in_"))),
            assign(store("i"), load("s", "in_")));
    lowering(top(), f)
        .assertClassification(c -> {
          assertThat(c.loopVariables, hasItem("i"));
          assertThat(c.registerNames(), is(ImmutableList.of("i")));
        });
  }

  @Test
  void testArrayWritten() {
    final Component top = top();
    final DesignList regs = (DesignList) top.members().get("regs");
    final Ast.FunctionDef f =
        comb(
            assign(
                storeAt(load("s", "regs"),
                    attr(at(load("s", "units"), num(0)), "out")),
                num(1)),
            assign(store("s", "out"), at(load("s", "regs"), num(1))));
    final LoweredBlock b =
        lowering(top, f)
            .assertLoweredBody("regs[units$out[0]] = 1", "out = regs[1]")
            .lower();
    final Classification c = b.classification;
    assertThat(c.arrays.size(), is(2));
    assertThat(c.isWritten(regs), is(true));

    // The index is read, even though it is on the left-hand side.
    final Ast.Subscript target =
        (Ast.Subscript)
            ((Ast.Assign) b.functionDef.body.get(0)).targets.get(0);
    assertThat(c.isWritten((DesignList) target.index.obj), is(false));
  }

  @Test
  void testCapturedAndGlobal() {
    final Component top = top();
    final Component adder = (Component) top.members().get("adder");
    final Environment env =
        Environment.of(top, "s")
            .bindCaptured("a", adder)
            .bindGlobal("WIDTH", IntValue.of(16));
    final Ast.FunctionDef f =
        comb(assign(store("s", "out"), load("a", "out")),
            assign(store("w"), load("WIDTH")));
    lowering(env, f)
        .assertLoweredBody("out = adder$out", "w = WIDTH")
        .assertClassification(c -> {
          assertThat(c.parameters,
              hasItem(new Classification.Param("WIDTH", IntValue.of(16))));
          assertThat(c.loopVariables, hasItem("w"));
        });
  }

  @Test
  void testModule() {
    final Ast.FunctionDef f = comb(assign(store("s", "out"), load("s", "in_")));
    lowering(top(), ast.module(POS, ImmutableList.of(f)))
        .assertPass(Lowering.UNWRAP_MODULE,
            "@s.combinational\ndef logic():\n  s.out = s.in_")
        .assertLoweredBody("out = in_");
    lowering(top(), ast.module(POS, ImmutableList.of(f, f)))
        .assertError(CompileException.Kind.UNSUPPORTED_SYNTAX,
            "Expected exactly one function definition, got 2");
  }

  @Test
  void testLowerAll() {
    final Component top = top();
    final Ast.FunctionDef good =
        comb(assign(store("s", "out"), load("s", "in_")));
    final Ast.FunctionDef bad =
        comb(assign(store("s", "out"), load("s", "missing")));
    final List<CompileException> errors = new ArrayList<>();
    final List<Classification> classifications = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnClassification(
            Tracers.withOnCompileException(Tracers.empty(), errors::add),
            classifications::add);
    final List<LoweredBlock> blocks =
        Lowering.create()
            .withTracer(tracer)
            .lowerAll(Environment.of(top, "s"),
                ImmutableList.of(bad, good));
    assertThat(blocks.size(), is(1));
    assertThat(blocks.get(0).toString(),
        is("@combinational\ndef logic():\n  out = in_"));
    assertThat(errors.size(), is(1));
    assertThat(errors.get(0).kind,
        is(CompileException.Kind.UNRESOLVED_REFERENCE));
    assertThat(errors.get(0).describeTo(new StringBuilder()).toString(),
        is("test.py:1.1 Error: Unknown attribute 'missing' of component "
            + "Top(top)"));
    assertThat(classifications.size(), is(1));
  }
}

// End LoweringTest.java
