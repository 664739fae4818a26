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
package net.hydromatic.hdl.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.hdl.ast.Ast;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers behavioral blocks into a flat, typed form for code generation.
 *
 * <p>Lowering runs these passes in order: binding, module unwrapping,
 * decorator simplification, accessor stripping, self removal, loop
 * canonicalization, range-constant expansion, sub-component flattening,
 * bundle flattening, list flattening, temporary type inference and
 * classification.
 *
 * <p>A {@code Lowering} is immutable and may be shared between threads; each
 * call to {@link #lower} creates its own pass objects.
 */
public class Lowering {
  private static final Logger LOGGER = LogManager.getLogger();

  public static final String BIND = "bind";
  public static final String UNWRAP_MODULE = "unwrapModule";
  public static final String SIMPLIFY_DECORATOR = "simplifyDecorator";
  public static final String STRIP_ACCESSORS = "stripAccessors";
  public static final String REMOVE_SELF = "removeSelf";
  public static final String CANONICALIZE_LOOPS = "canonicalizeLoops";
  public static final String EXPAND_RANGE_CONSTANTS = "expandRangeConstants";
  public static final String FLATTEN_SUBMODULES = "flattenSubmodules";
  public static final String FLATTEN_BUNDLES = "flattenBundles";
  public static final String FLATTEN_LISTS = "flattenLists";
  public static final String INFER_TYPES = "inferTypes";

  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  public Lowering(Map<Prop, Object> propMap, Tracer tracer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Lowering with default properties and no tracing. */
  public static Lowering create() {
    return new Lowering(ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a copy of this Lowering with a given tracer. */
  public Lowering withTracer(Tracer tracer) {
    return tracer == this.tracer ? this : new Lowering(propMap, tracer);
  }

  /** Returns a copy of this Lowering with a property set. */
  public Lowering withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new HashMap<>(propMap);
    prop.set(map, value);
    return new Lowering(map, tracer);
  }

  /**
   * Lowers one block.
   *
   * @param env Environment of the block: the enclosing component, captured
   *            variables, and global constants
   * @param decl A function definition, or a module that contains exactly one
   * @throws CompileException if the block cannot be lowered
   */
  public LoweredBlock lower(Environment env, Ast.Decl decl) {
    LOGGER.debug("Lowering block of {} in environment:\n{}", () -> env.self,
        env::asString);
    final Ast.Decl bound = Binder.bind(env, propMap, decl);
    trace(BIND, bound);
    Ast.FunctionDef f = Desugarer.unwrapModule(bound);
    trace(UNWRAP_MODULE, f);
    f = pass(SIMPLIFY_DECORATOR, f,
        f2 -> Desugarer.simplifyDecorator(env.self, f2));
    f = pass(STRIP_ACCESSORS, f, f2 -> Desugarer.stripAccessors(propMap, f2));
    f = pass(REMOVE_SELF, f, f2 -> Desugarer.removeSelf(env.self, f2));
    f = pass(CANONICALIZE_LOOPS, f,
        f2 -> Desugarer.canonicalizeLoops(propMap, f2));
    if (Prop.EXPAND_RANGE_CONSTANTS.booleanValue(propMap)) {
      f = pass(EXPAND_RANGE_CONSTANTS, f, Desugarer::expandRangeConstants);
    }
    final Flattener flattener = new Flattener();
    f = pass(FLATTEN_SUBMODULES, f, flattener::flattenSubmodules);
    f = pass(FLATTEN_BUNDLES, f, flattener::flattenBundles);
    f = pass(FLATTEN_LISTS, f, flattener::flattenLists);
    f = pass(INFER_TYPES, f, TemporaryTypeInferrer::infer);

    final Classification classification = Classifier.classify(f);
    tracer.onClassification(classification);
    LOGGER.info("Lowered block {} ({}): {}", f.name, f.tag, classification);
    return new LoweredBlock(f, requireNonNull(f.tag, "tag"), classification);
  }

  /**
   * Lowers several blocks of the same component.
   *
   * <p>A block that fails is reported to the tracer and skipped; the result
   * contains the blocks that succeeded, in order.
   */
  public ImmutableList<LoweredBlock> lowerAll(Environment env,
      Iterable<? extends Ast.Decl> decls) {
    final ImmutableList.Builder<LoweredBlock> blocks = ImmutableList.builder();
    for (Ast.Decl decl : decls) {
      try {
        blocks.add(lower(env, decl));
      } catch (CompileException e) {
        LOGGER.warn("Failed to lower block in {}: {}", env.self,
            e.describeTo(new StringBuilder()));
        tracer.handleCompileException(e);
      }
    }
    return blocks.build();
  }

  private Ast.FunctionDef pass(String name, Ast.FunctionDef f,
      UnaryOperator<Ast.FunctionDef> pass) {
    final Ast.FunctionDef f2 = pass.apply(f);
    trace(name, f2);
    return f2;
  }

  private void trace(String pass, Ast.Decl decl) {
    LOGGER.debug("After {}:\n{}", pass, decl);
    tracer.onPass(pass, decl);
  }
}

// End Lowering.java
