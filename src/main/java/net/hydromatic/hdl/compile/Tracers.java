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

import java.util.function.Consumer;
import net.hydromatic.hdl.ast.AstNode;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the tree after a
   * given pass, then calls the underlying tracer. */
  public static Tracer withOnPass(Tracer tracer, String pass,
      Consumer<AstNode> consumer) {
    final String expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override
      public void onPass(String pass, AstNode node) {
        if (pass.equals(expectedPass)) {
          consumer.accept(node);
        }
        super.onPass(pass, node);
      }
    };
  }

  /** Returns a tracer that performs the given action on a classification,
   * then calls the underlying tracer. */
  public static Tracer withOnClassification(Tracer tracer,
      Consumer<Classification> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onClassification(Classification classification) {
        consumer.accept(classification);
        super.onClassification(classification);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onPass(String pass, AstNode node) {}

    @Override
    public void onClassification(Classification classification) {}

    @Override
    public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onPass(String pass, AstNode node) {
      tracer.onPass(pass, node);
    }

    @Override
    public void onClassification(Classification classification) {
      tracer.onClassification(classification);
    }

    @Override
    public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
