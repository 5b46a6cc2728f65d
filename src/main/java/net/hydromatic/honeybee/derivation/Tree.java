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
package net.hydromatic.honeybee.derivation;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import net.hydromatic.honeybee.ir.ComputationSignature;
import net.hydromatic.honeybee.ir.Fact;
import net.hydromatic.honeybee.ir.Library;
import net.hydromatic.honeybee.ir.Predicate;
import net.hydromatic.honeybee.ir.Value;
import net.hydromatic.honeybee.query.Query;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Derivation tree.
 *
 * <p>A tree justifies a fact by applications of computations. Each node is
 * one of the following:
 *
 * <ul>
 *   <li>{@link Axiom}, a fact taken as already justified;
 *   <li>{@link Goal}, an obligation for some fact of a given family that has
 *       not been discharged yet;
 *   <li>{@link Step}, one application of a computation, whose antecedents are
 *       themselves trees.
 * </ul>
 *
 * <p>Trees are immutable. Methods such as {@link #replace} and {@link
 * #addSideCondition} return a new tree that shares every untouched subtree
 * with the original.
 */
public abstract class Tree {
  /** Name of the synthetic computation, and of its only antecedent, that
   * wraps a top-level goal. */
  public static final String OUTPUT = "output";

  public final Kind kind;

  private Tree(Kind kind) {
    this.kind = requireNonNull(kind, "kind");
  }

  /** Creates an axiom. */
  public static Axiom axiom(Fact fact) {
    return new Axiom(fact);
  }

  /** Creates a goal. */
  public static Goal goal(String factName) {
    return new Goal(factName);
  }

  /**
   * Creates a step.
   *
   * @throws IllegalArgumentException if {@code antecedents} contains two
   *     entries with the same tag
   */
  public static Step step(String label,
      List<? extends Map.Entry<String, ? extends Tree>> antecedents,
      Fact consequent, Predicate sideCondition) {
    final StepBuilder b = step(label);
    antecedents.forEach(e -> b.antecedent(e.getKey(), e.getValue()));
    return b.consequent(consequent).sideCondition(sideCondition).build();
  }

  /** Creates a builder for a step. */
  public static StepBuilder step(String label) {
    return new StepBuilder(label);
  }

  /**
   * Creates a step that applies a computation, whose antecedents are all
   * goals, and whose consequent has the given arguments.
   */
  public static Step fromComputationSignature(ComputationSignature cs,
      Map<String, Value> retArgs) {
    return new Step(cs.name, goals(cs), Fact.of(cs.ret, retArgs),
        cs.precondition);
  }

  /**
   * Creates a tree from a closed query, or returns empty if the query is not
   * closed.
   *
   * <p>The consequent has no arguments; they are found later by search.
   */
  public static Optional<Tree> fromQuery(Query query) {
    if (!query.closed()) {
      return Optional.empty();
    }
    final ComputationSignature cs = query.computationSignature;
    return Optional.of(
        new Step(cs.name, goals(cs), Fact.of(query.factSignature.name),
            cs.precondition));
  }

  /**
   * Creates a tree whose only obligation is to derive a given fact.
   *
   * <p>The root is a synthetic step called {@link #OUTPUT} with a single goal
   * antecedent, also called {@link #OUTPUT}.
   */
  public static Tree fromGoal(Fact fact) {
    return fromQuery(Query.fromFact(fact, OUTPUT))
        .orElseThrow(() -> new AssertionError("query from fact is closed"));
  }

  private static ImmutableMap<String, Tree> goals(ComputationSignature cs) {
    final ImmutableMap.Builder<String, Tree> b = ImmutableMap.builder();
    cs.params.forEach(p -> b.put(p.name, goal(p.factName)));
    return b.buildOrThrow();
  }

  /** Accepts a visitor, calling the method appropriate to this node. */
  public abstract <R> R accept(TreeVisitor<R> visitor);

  /** Returns the fact this node establishes, or empty if it is a goal. */
  public abstract Optional<Fact> head();

  /** Returns whether there are no goals in this tree. */
  public abstract boolean complete();

  /**
   * Returns the next units of search work: for each step with at least one
   * goal among its immediate antecedents, a query that solves those goals
   * jointly, and the path of that step.
   *
   * <p>Obligations inside an antecedent come before the obligation of the
   * step itself.
   */
  public List<Obligation> queries(Library library) {
    return ImmutableList.of();
  }

  /**
   * Returns every node in the tree, each with its path, antecedents before the
   * step they belong to.
   */
  public List<Map.Entry<Path, Tree>> postorder() {
    final ImmutableList.Builder<Map.Entry<Path, Tree>> b =
        ImmutableList.builder();
    forEachPostorder(Path.EMPTY, (path, tree) ->
        b.add(Maps.immutableEntry(path, tree)));
    return b.build();
  }

  /** Returns the path and fact name of every goal, in post-order. */
  public List<Map.Entry<Path, String>> goals() {
    final ImmutableList.Builder<Map.Entry<Path, String>> b =
        ImmutableList.builder();
    forEachPostorder(Path.EMPTY, (path, tree) -> {
      if (tree instanceof Goal) {
        b.add(Maps.immutableEntry(path, ((Goal) tree).factName));
      }
    });
    return b.build();
  }

  void forEachPostorder(Path path, BiConsumer<Path, Tree> consumer) {
    consumer.accept(path, this);
  }

  /**
   * Returns the subtree at a given path.
   *
   * @throws DerivationException if the path does not exist
   */
  public Tree get(Path path) {
    Tree tree = this;
    Path done = Path.EMPTY;
    for (String tag : path.tags) {
      final Step step = tree.asStep(done);
      tree = step.antecedent(done, tag);
      done = done.append(tag);
    }
    return tree;
  }

  /**
   * Returns a copy of this tree with the subtree at a given path replaced.
   *
   * @throws DerivationException if the path passes through a node that is
   *     not a step, or names an antecedent that does not exist
   */
  public Tree replace(Path path, Tree subtree) {
    requireNonNull(subtree, "subtree");
    return replace(Path.EMPTY, path, subtree);
  }

  private Tree replace(Path done, Path path, Tree subtree) {
    if (path.isEmpty()) {
      return subtree;
    }
    final Step step = asStep(done);
    final String tag = path.head();
    final Tree antecedent = step.antecedent(done, tag);
    return step.withAntecedent(tag,
        antecedent.replace(done.append(tag), path.tail(), subtree));
  }

  /**
   * Returns a copy of this tree in which the step at a given path has extra
   * constraints appended to its side condition.
   *
   * @throws DerivationException if the path passes through, or ends at, a
   *     node that is not a step, or names an antecedent that does not exist
   */
  public Tree addSideCondition(Path path, Predicate predicate) {
    requireNonNull(predicate, "predicate");
    return addSideCondition(Path.EMPTY, path, predicate);
  }

  private Tree addSideCondition(Path done, Path path, Predicate predicate) {
    final Step step = asStep(done);
    if (path.isEmpty()) {
      return step.withSideCondition(step.sideCondition.concat(predicate));
    }
    final String tag = path.head();
    final Tree antecedent = step.antecedent(done, tag);
    return step.withAntecedent(tag,
        antecedent.addSideCondition(done.append(tag), path.tail(), predicate));
  }

  private Step asStep(Path done) {
    if (!(this instanceof Step)) {
      throw DerivationException.notAStep(done, this);
    }
    return (Step) this;
  }

  /** Kind of node. */
  public enum Kind {
    AXIOM,
    GOAL,
    STEP
  }

  /** Leaf that holds a fact already justified. */
  public static final class Axiom extends Tree {
    public final Fact fact;

    Axiom(Fact fact) {
      super(Kind.AXIOM);
      this.fact = requireNonNull(fact, "fact");
    }

    @Override
    public <R> R accept(TreeVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Optional<Fact> head() {
      return Optional.of(fact);
    }

    @Override
    public boolean complete() {
      return true;
    }

    @Override
    public int hashCode() {
      return fact.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Axiom && ((Axiom) o).fact.equals(fact);
    }

    @Override
    public String toString() {
      return fact.toString();
    }
  }

  /** Leaf that stands for an undischarged obligation. */
  public static final class Goal extends Tree {
    public final String factName;

    Goal(String factName) {
      super(Kind.GOAL);
      this.factName = requireNonNull(factName, "factName");
      checkArgument(!factName.isEmpty(), "empty fact name");
    }

    @Override
    public <R> R accept(TreeVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Optional<Fact> head() {
      return Optional.empty();
    }

    @Override
    public boolean complete() {
      return false;
    }

    @Override
    public int hashCode() {
      return factName.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Goal && ((Goal) o).factName.equals(factName);
    }

    @Override
    public String toString() {
      return "?" + factName;
    }
  }

  /**
   * Application of a computation.
   *
   * <p>The tags of the antecedents are expected to be the parameter names of
   * the computation called {@link #label}, though this is not checked. Tags
   * are unique within a step.
   */
  public static final class Step extends Tree {
    public final String label;
    public final ImmutableMap<String, Tree> antecedents;
    public final Fact consequent;

    /** The computation's precondition, with some variables substituted. */
    public final Predicate sideCondition;

    Step(String label, ImmutableMap<String, Tree> antecedents,
        Fact consequent, Predicate sideCondition) {
      super(Kind.STEP);
      this.label = requireNonNull(label, "label");
      this.antecedents = requireNonNull(antecedents, "antecedents");
      this.consequent = requireNonNull(consequent, "consequent");
      this.sideCondition = requireNonNull(sideCondition, "sideCondition");
    }

    @Override
    public <R> R accept(TreeVisitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Optional<Fact> head() {
      return Optional.of(consequent);
    }

    @Override
    public boolean complete() {
      for (Tree antecedent : antecedents.values()) {
        if (!antecedent.complete()) {
          return false;
        }
      }
      return true;
    }

    @Override
    public List<Obligation> queries(Library library) {
      final ImmutableList.Builder<Obligation> obligations =
          ImmutableList.builder();
      final Map<String, String> siblings = new LinkedHashMap<>();
      antecedents.forEach((tag, antecedent) -> {
        switch (antecedent.kind) {
        case AXIOM:
          break;
        case GOAL:
          siblings.put(tag, ((Goal) antecedent).factName);
          break;
        case STEP:
          antecedent.queries(library)
              .forEach(obligation -> obligations.add(obligation.under(tag)));
          break;
        default:
          throw new AssertionError(antecedent.kind);
        }
      });
      if (!siblings.isEmpty()) {
        // Bind the fields of "ret" that are already known, so that the
        // solver sees them as constants.
        final Predicate condition =
            sideCondition.substituteAll(Query.RET, consequent.args);
        obligations.add(
            new Obligation(Path.EMPTY,
                Query.free(library, siblings, condition)));
      }
      return obligations.build();
    }

    @Override
    void forEachPostorder(Path path, BiConsumer<Path, Tree> consumer) {
      antecedents.forEach((tag, antecedent) ->
          antecedent.forEachPostorder(path.append(tag), consumer));
      consumer.accept(path, this);
    }

    /** Returns the antecedent with a given tag. */
    Tree antecedent(Path done, String tag) {
      final Tree antecedent = antecedents.get(tag);
      if (antecedent == null) {
        throw DerivationException.unknownTag(done, tag);
      }
      return antecedent;
    }

    /** Returns a copy of this step with one antecedent replaced. */
    Step withAntecedent(String tag, Tree tree) {
      if (antecedents.get(tag) == tree) {
        return this;
      }
      final ImmutableMap.Builder<String, Tree> b = ImmutableMap.builder();
      antecedents.forEach((tag2, tree2) ->
          b.put(tag2, tag2.equals(tag) ? tree : tree2));
      return new Step(label, b.buildOrThrow(), consequent, sideCondition);
    }

    /** Returns a copy of this step with a different side condition. */
    public Step withSideCondition(Predicate sideCondition) {
      return sideCondition.equals(this.sideCondition) ? this
          : new Step(label, antecedents, consequent, sideCondition);
    }

    @Override
    public int hashCode() {
      return Objects.hash(label, antecedents, consequent, sideCondition);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Step
              && ((Step) o).label.equals(label)
              && ((Step) o).antecedents.entrySet().asList()
                  .equals(antecedents.entrySet().asList())
              && ((Step) o).consequent.equals(consequent)
              && ((Step) o).sideCondition.equals(sideCondition);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder(label).append('{');
      antecedents.forEach((tag, antecedent) ->
          b.append(b.charAt(b.length() - 1) == '{' ? "" : ", ")
              .append(tag).append(": ").append(antecedent));
      return b.append("} => ").append(consequent).toString();
    }
  }

  /** Builder for {@link Step}. */
  public static class StepBuilder {
    private final String label;
    private final ImmutableMap.Builder<String, Tree> antecedents =
        ImmutableMap.builder();
    private final Set<String> tags = new HashSet<>();
    private @Nullable Fact consequent;
    private Predicate sideCondition = Predicate.TRUE;

    StepBuilder(String label) {
      this.label = requireNonNull(label, "label");
    }

    /**
     * Adds an antecedent.
     *
     * @throws IllegalArgumentException if there is already an antecedent with
     *     this tag
     */
    public StepBuilder antecedent(String tag, Tree tree) {
      checkArgument(tags.add(tag), "duplicate antecedent tag %s", tag);
      antecedents.put(tag, tree);
      return this;
    }

    public StepBuilder consequent(Fact consequent) {
      this.consequent = requireNonNull(consequent, "consequent");
      return this;
    }

    public StepBuilder sideCondition(Predicate sideCondition) {
      this.sideCondition = requireNonNull(sideCondition, "sideCondition");
      return this;
    }

    public Step build() {
      checkArgument(consequent != null, "step %s has no consequent", label);
      return new Step(label, antecedents.buildOrThrow(), consequent,
          sideCondition);
    }
  }
}

// End Tree.java
