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
package net.hydromatic.honeybee.session;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.honeybee.derivation.DerivationException;
import net.hydromatic.honeybee.derivation.Obligation;
import net.hydromatic.honeybee.derivation.Tree;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each new tree, then
   * calls the underlying tracer.
   */
  public static Tracer withOnTree(Tracer tracer, Consumer<Tree> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onTree(Tree tree) {
        consumer.accept(tree);
        super.onTree(tree);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each list of
   * obligations, then calls the underlying tracer.
   */
  public static Tracer withOnObligations(Tracer tracer,
      Consumer<List<Obligation>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onObligations(List<Obligation> obligations) {
        consumer.accept(obligations);
        super.onObligations(obligations);
      }
    };
  }

  public static Tracer withOnSolution(Tracer tracer,
      BiConsumer<Obligation, Solution> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onSolution(Obligation obligation, Solution solution) {
        consumer.accept(obligation, solution);
        super.onSolution(obligation, solution);
      }
    };
  }

  /**
   * Returns a tracer that handles exceptions by passing them to the given
   * consumer.
   */
  public static Tracer withOnException(Tracer tracer,
      Consumer<DerivationException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onException(DerivationException e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onTree(Tree tree) {}

    @Override
    public void onObligations(List<Obligation> obligations) {}

    @Override
    public void onSolution(Obligation obligation, Solution solution) {}

    @Override
    public boolean onException(DerivationException e) {
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
    public void onTree(Tree tree) {
      tracer.onTree(tree);
    }

    @Override
    public void onObligations(List<Obligation> obligations) {
      tracer.onObligations(obligations);
    }

    @Override
    public void onSolution(Obligation obligation, Solution solution) {
      tracer.onSolution(obligation, solution);
    }

    @Override
    public boolean onException(DerivationException e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java
