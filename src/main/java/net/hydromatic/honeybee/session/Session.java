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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.honeybee.derivation.DerivationException;
import net.hydromatic.honeybee.derivation.Obligation;
import net.hydromatic.honeybee.derivation.Path;
import net.hydromatic.honeybee.derivation.Tree;
import net.hydromatic.honeybee.ir.ComputationSignature;
import net.hydromatic.honeybee.ir.Fact;
import net.hydromatic.honeybee.ir.Library;
import net.hydromatic.honeybee.ir.Predicate;
import net.hydromatic.honeybee.query.Query;
import net.hydromatic.honeybee.render.TreeWriter;

/**
 * Interactive derivation session.
 *
 * <p>A session holds the current snapshot of a derivation tree. Each round,
 * the caller extracts obligations, has a {@link Solver} answer one of them,
 * and folds the answer back with {@link #solve}, producing the next snapshot.
 *
 * <p>Not thread-safe.
 */
public class Session {
  public final Library library;

  /** Property values. */
  public final Map<Prop, Object> map = new HashMap<>();

  private Tracer tracer = Tracers.empty();
  private Tree tree;

  private Session(Library library, Tree tree) {
    this.library = requireNonNull(library, "library");
    this.tree = requireNonNull(tree, "tree");
  }

  /** Starts a session whose goal is to derive a given fact. */
  public static Session start(Library library, Fact goal) {
    return new Session(library, Tree.fromGoal(goal));
  }

  /**
   * Starts a session from a closed query.
   *
   * @throws DerivationException of kind {@code GOAL_NOT_CLOSED} if the query
   *     is not closed
   */
  public static Session start(Library library, Query query) {
    final Optional<Tree> tree = Tree.fromQuery(query);
    if (!tree.isPresent()) {
      throw new DerivationException(DerivationException.Kind.GOAL_NOT_CLOSED,
          Path.EMPTY, "query is not closed: " + query);
    }
    return new Session(library, tree.get());
  }

  /** Starts a session from an existing tree. */
  public static Session of(Library library, Tree tree) {
    return new Session(library, tree);
  }

  /** Sets the tracer; returns this session. */
  public Session withTracer(Tracer tracer) {
    this.tracer = requireNonNull(tracer, "tracer");
    return this;
  }

  /** Returns the current tree. */
  public Tree tree() {
    return tree;
  }

  /** Returns whether the current tree has no goals. */
  public boolean complete() {
    return tree.complete();
  }

  /** Returns the obligations of the current tree. */
  public List<Obligation> obligations() {
    final List<Obligation> obligations = tree.queries(library);
    tracer.onObligations(obligations);
    return obligations;
  }

  /**
   * Grafts the solution of an obligation into the current tree.
   *
   * <p>Each sibling of the obligation's query is replaced by an axiom, if its
   * choice has no computation, or by a step that applies the chosen
   * computation and whose antecedents are new goals.
   *
   * <p>If the obligation is stale, because its path no longer exists or a
   * sibling is no longer an open goal, the exception is offered to the
   * tracer; returns false if the tracer handles it, and rethrows it
   * otherwise.
   *
   * @throws IllegalArgumentException if the solution does not cover every
   *     sibling, or a chosen fact or computation does not match its sibling
   */
  public boolean solve(Obligation obligation, Solution solution) {
    tracer.onSolution(obligation, solution);
    Tree t = tree;
    try {
      for (Map.Entry<String, String> sibling
          : obligation.query.siblings.entrySet()) {
        final String tag = sibling.getKey();
        final Solution.Choice choice = solution.choices.get(tag);
        checkArgument(choice != null, "solution has no choice for %s", tag);
        checkArgument(choice.fact.name.equals(sibling.getValue()),
            "fact %s does not discharge goal %s", choice.fact,
            sibling.getValue());
        final Path path = obligation.path.append(tag);
        final Tree current = t.get(path);
        if (!(current instanceof Tree.Goal)
            || !((Tree.Goal) current).factName.equals(sibling.getValue())) {
          throw DerivationException.notAGoal(path, current,
              sibling.getValue());
        }
        t = t.replace(path, graft(choice));
      }
    } catch (DerivationException e) {
      if (tracer.onException(e)) {
        return false;
      }
      throw e;
    }
    setTree(t);
    return true;
  }

  /** Converts a choice into the subtree that replaces a goal. */
  private Tree graft(Solution.Choice choice) {
    if (choice.computation == null) {
      return Tree.axiom(choice.fact);
    }
    final ComputationSignature cs =
        library.computationSignature(choice.computation);
    checkArgument(cs.ret.equals(choice.fact.name),
        "computation %s returns %s, not %s", cs.name, cs.ret,
        choice.fact.name);
    return Tree.fromComputationSignature(cs, choice.fact.args);
  }

  /**
   * Appends constraints to the side condition of the step at a given path.
   *
   * @throws DerivationException if the path does not address a step and the
   *     tracer does not handle the exception
   */
  public boolean addSideCondition(Path path, Predicate predicate) {
    final Tree t;
    try {
      t = tree.addSideCondition(path, predicate);
    } catch (DerivationException e) {
      if (tracer.onException(e)) {
        return false;
      }
      throw e;
    }
    setTree(t);
    return true;
  }

  /**
   * Solves obligations until the tree is complete, the solver finds no
   * solution, or {@link Prop#MAX_STEPS} solutions have been applied.
   *
   * <p>Each round re-extracts obligations and solves the first, so that paths
   * are never stale.
   *
   * @return Number of solutions applied
   */
  public int run(Solver solver) {
    final int maxSteps = Prop.MAX_STEPS.intValue(map);
    int steps = 0;
    while (steps < maxSteps && !tree.complete()) {
      final List<Obligation> obligations = obligations();
      if (obligations.isEmpty()) {
        break;
      }
      final Obligation obligation = obligations.get(0);
      final Optional<Solution> solution = solver.solve(obligation.query);
      if (!solution.isPresent() || !solve(obligation, solution.get())) {
        break;
      }
      ++steps;
    }
    return steps;
  }

  /** Renders the current tree, using this session's properties. */
  public String render() {
    return new TreeWriter(map).write(tree);
  }

  private void setTree(Tree tree) {
    this.tree = tree;
    tracer.onTree(tree);
  }
}

// End Session.java
