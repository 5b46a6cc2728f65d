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

import static net.hydromatic.honeybee.Fixtures.ASSEMBLE;
import static net.hydromatic.honeybee.Fixtures.REPORT_RULE;
import static net.hydromatic.honeybee.Fixtures.assembly;
import static net.hydromatic.honeybee.Fixtures.isTree;
import static net.hydromatic.honeybee.Fixtures.reads;
import static net.hydromatic.honeybee.Fixtures.report;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import net.hydromatic.honeybee.Fixtures;
import net.hydromatic.honeybee.ir.Fact;
import net.hydromatic.honeybee.ir.Predicate;
import net.hydromatic.honeybee.ir.PredicateAtom;
import net.hydromatic.honeybee.ir.Value;
import net.hydromatic.honeybee.query.Query;
import org.junit.jupiter.api.Test;

/** Tests {@link Tree}: construction, rewriting and traversal. */
class TreeTest {
  private static final Path OUTPUT = Path.of(Tree.OUTPUT);

  /**
   * Returns a tree for "Report(s1)" in which the report step has been
   * chosen, its reads are known, and its assembly is still a goal.
   */
  private static Tree partialReport() {
    return Tree.fromGoal(report("s1"))
        .replace(OUTPUT,
            Tree.fromComputationSignature(REPORT_RULE,
                report("s1").args))
        .replace(Path.of(Tree.OUTPUT, "ref"), Tree.axiom(reads("s1")));
  }

  /** Returns the list of paths in a tree, in post-order. */
  private static List<String> paths(Tree tree) {
    return tree.postorder().stream()
        .map(e -> e.getKey().toString())
        .collect(Collectors.toList());
  }

  @Test void testFromGoal() {
    final Tree tree = Tree.fromGoal(report("s1"));
    assertThat(tree, instanceOf(Tree.Step.class));
    final Tree.Step step = (Tree.Step) tree;
    assertThat(step.label, is(Tree.OUTPUT));
    assertThat(step.antecedents,
        is(ImmutableMap.<String, Tree>of(Tree.OUTPUT, Tree.goal("Report"))));
    assertThat(step.consequent, is(Fact.of(Query.GOAL_FACT_NAME)));
    assertThat(step.sideCondition,
        hasToString("eq(left: output.sample, right: \"s1\")"));
    assertThat(tree.complete(), is(false));
  }

  @Test void testFromComputationSignature() {
    final Tree.Step step =
        Tree.fromComputationSignature(REPORT_RULE, report("s1").args);
    assertThat(step.label, is("report"));
    assertThat(step.antecedents.keySet(), contains("asm", "ref"));
    assertThat(step.antecedents.get("asm"), isTree(Tree.goal("Assembly")));
    assertThat(step.antecedents.get("ref"), isTree(Tree.goal("Reads")));
    assertThat(step.consequent, is(report("s1")));
    assertThat(step.sideCondition, sameInstance(REPORT_RULE.precondition));
  }

  @Test void testFromQuery() {
    final Optional<Tree> tree =
        Tree.fromQuery(Query.fromFact(report("s1"), "top"));
    assertThat(tree.isPresent(), is(true));
    assertThat(tree.get(), hasToString("top{top: ?Report} => &goal()"));

    final Query free =
        Query.free(Fixtures.LIBRARY, ImmutableMap.of("asm", "Assembly"),
            Predicate.TRUE);
    assertThat(Tree.fromQuery(free), is(Optional.empty()));
  }

  @Test void testComplete() {
    // No goals
    final Tree.Step complete =
        Tree.step("assemble")
            .antecedent("reads", Tree.axiom(reads("s1")))
            .consequent(assembly("s1", 40))
            .build();
    assertThat(complete.complete(), is(true));
    assertThat(Tree.axiom(reads("s1")).complete(), is(true));

    // One goal
    assertThat(Tree.goal("Reads").complete(), is(false));
    final Tree partial = partialReport();
    assertThat(partial.complete(), is(false));
    assertThat(partial.goals(),
        contains(
            Maps.immutableEntry(Path.of(Tree.OUTPUT, "asm"), "Assembly")));

    // Many goals
    final Tree many =
        Tree.fromComputationSignature(REPORT_RULE, report("s1").args);
    assertThat(many.complete(), is(false));
    assertThat(many.goals().size(), is(2));

    // Completing the last goal completes the tree
    final Tree done =
        partial.replace(Path.of(Tree.OUTPUT, "asm"), complete);
    assertThat(done.complete(), is(true));
    assertThat(done.goals().isEmpty(), is(true));

    // complete() holds iff post-order contains no goals
    for (Tree tree : ImmutableList.of(complete, partial, many, done)) {
      final boolean hasGoal =
          tree.postorder().stream()
              .anyMatch(e -> e.getValue().kind == Tree.Kind.GOAL);
      assertThat(tree.complete(), is(!hasGoal));
    }
  }

  @Test void testPostorder() {
    final Tree tree = partialReport();
    assertThat(paths(tree),
        contains(".output.asm", ".output.ref", ".output", ""));
    final List<Map.Entry<Path, Tree>> postorder = tree.postorder();
    assertThat(postorder.get(3).getValue(), sameInstance(tree));
    assertThat(postorder.get(1).getValue(), isTree(Tree.axiom(reads("s1"))));

    final Tree leaf = Tree.goal("Reads");
    assertThat(leaf.postorder(),
        contains(Maps.immutableEntry(Path.EMPTY, leaf)));
  }

  @Test void testGetAndReplace() {
    final Tree tree = partialReport();
    final Path path = Path.of(Tree.OUTPUT, "asm");
    assertThat(tree.get(path), isTree(Tree.goal("Assembly")));
    assertThat(tree.get(Path.EMPTY), sameInstance(tree));

    final Tree assemble =
        Tree.fromComputationSignature(ASSEMBLE, assembly("s1", 40).args);
    final Tree tree2 = tree.replace(path, assemble);
    assertThat(tree2.get(path), sameInstance(assemble));
    assertThat(paths(tree2),
        contains(".output.asm.reads", ".output.asm", ".output.ref",
            ".output", ""));

    // The original is unchanged, and the untouched antecedent is shared.
    assertThat(tree.get(path), isTree(Tree.goal("Assembly")));
    assertThat(tree2.get(Path.of(Tree.OUTPUT, "ref")),
        sameInstance(tree.get(Path.of(Tree.OUTPUT, "ref"))));

    // Replacing a subtree with itself preserves shape and value.
    for (Map.Entry<Path, Tree> e : tree2.postorder()) {
      final Tree tree3 = tree2.replace(e.getKey(), e.getValue());
      assertThat(paths(tree3), is(paths(tree2)));
      assertThat(tree3, is(tree2));
    }

    // The empty path replaces the whole tree.
    assertThat(tree.replace(Path.EMPTY, assemble), sameInstance(assemble));
  }

  @Test void testReplaceUnknownTag() {
    final Tree tree = partialReport();
    final DerivationException e =
        assertThrows(DerivationException.class,
            () -> tree.replace(Path.of(Tree.OUTPUT, "genome"),
                Tree.goal("Reads")));
    assertThat(e.kind, is(DerivationException.Kind.UNKNOWN_TAG));
    assertThat(e.path, is(OUTPUT));
    assertThat(e.getMessage(), is("no antecedent 'genome' at '.output'"));
  }

  @Test void testReplaceThroughLeaf() {
    final Tree tree = partialReport();
    final DerivationException e =
        assertThrows(DerivationException.class,
            () -> tree.replace(Path.of(Tree.OUTPUT, "ref", "x"),
                Tree.goal("Reads")));
    assertThat(e.kind, is(DerivationException.Kind.PATH_NOT_A_STEP));
    assertThat(e.path, is(Path.of(Tree.OUTPUT, "ref")));
    assertThat(e.getMessage(),
        is("expected step at '.output.ref', found AXIOM"));

    final DerivationException e2 =
        assertThrows(DerivationException.class,
            () -> tree.get(Path.of(Tree.OUTPUT, "asm", "reads")));
    assertThat(e2.kind, is(DerivationException.Kind.PATH_NOT_A_STEP));
  }

  @Test void testAddSideCondition() {
    final Tree tree = partialReport();
    final PredicateAtom extra =
        PredicateAtom.eq(Value.var("asm", "quality"), Value.of(40));
    final PredicateAtom first =
        ((Tree.Step) tree.get(OUTPUT)).sideCondition.atoms.get(0);
    final Tree tree2 =
        tree.addSideCondition(OUTPUT, Predicate.of(extra, first));

    // Constraints are appended in order, without removing duplicates.
    final Tree.Step step = (Tree.Step) tree2.get(OUTPUT);
    assertThat(step.sideCondition.size(), is(4));
    assertThat(step.sideCondition.atoms.get(0), is(first));
    assertThat(step.sideCondition.atoms.get(2), is(extra));
    assertThat(step.sideCondition.atoms.get(3), is(first));

    // The path is consumed front to back: only the inner step changes.
    assertThat(((Tree.Step) tree2).sideCondition,
        is(((Tree.Step) tree).sideCondition));
    assertThat(step.antecedents,
        is(((Tree.Step) tree.get(OUTPUT)).antecedents));

    // The empty path extends the root.
    final Tree tree3 = tree.addSideCondition(Path.EMPTY, Predicate.of(extra));
    assertThat(((Tree.Step) tree3).sideCondition.atoms,
        contains(((Tree.Step) tree).sideCondition.atoms.get(0), extra));
  }

  @Test void testAddSideConditionToLeaf() {
    final Tree tree = partialReport();
    final Predicate extra =
        Predicate.of(PredicateAtom.eq(Value.var("x"), Value.of(1)));
    DerivationException e =
        assertThrows(DerivationException.class,
            () -> tree.addSideCondition(Path.of(Tree.OUTPUT, "asm"), extra));
    assertThat(e.kind, is(DerivationException.Kind.PATH_NOT_A_STEP));
    assertThat(e.path, is(Path.of(Tree.OUTPUT, "asm")));

    e = assertThrows(DerivationException.class,
        () -> tree.addSideCondition(Path.of("nope"), extra));
    assertThat(e.kind, is(DerivationException.Kind.UNKNOWN_TAG));
    assertThat(e.path, is(Path.EMPTY));
  }

  @Test void testDuplicateTag() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Tree.step("merge")
                .antecedent("r", Tree.goal("Reads"))
                .antecedent("r", Tree.goal("Reads")));
    assertThat(e.getMessage(), is("duplicate antecedent tag r"));
  }

  /** Antecedents are a sequence; the same tags in another order make a
   * different step. */
  @Test void testEqualsRespectsAntecedentOrder() {
    final Tree xy =
        Tree.step("s")
            .antecedent("x", Tree.goal("Reads"))
            .antecedent("y", Tree.axiom(reads("s1")))
            .consequent(report("s1"))
            .build();
    final Tree yx =
        Tree.step("s")
            .antecedent("y", Tree.axiom(reads("s1")))
            .antecedent("x", Tree.goal("Reads"))
            .consequent(report("s1"))
            .build();
    final Tree xy2 =
        Tree.step("s")
            .antecedent("x", Tree.goal("Reads"))
            .antecedent("y", Tree.axiom(reads("s1")))
            .consequent(report("s1"))
            .build();
    assertThat(xy.equals(yx), is(false));
    assertThat(xy.equals(xy2), is(true));
    assertThat(xy.hashCode(), is(xy2.hashCode()));
    assertThat(paths(xy), contains(".x", ".y", ""));
    assertThat(paths(yx), contains(".y", ".x", ""));
  }

  @Test void testHead() {
    final Tree tree = partialReport();
    assertThat(tree.head(), is(Optional.of(Fact.of(Query.GOAL_FACT_NAME))));
    assertThat(tree.get(OUTPUT).head(), is(Optional.of(report("s1"))));
    assertThat(tree.get(Path.of(Tree.OUTPUT, "asm")).head(),
        is(Optional.empty()));
  }

  @Test void testVisitor() {
    final TreeVisitor<Integer> goalCounter =
        new TreeVisitor<Integer>() {
          @Override public Integer visit(Tree.Axiom axiom) {
            return 0;
          }

          @Override public Integer visit(Tree.Goal goal) {
            return 1;
          }

          @Override public Integer visit(Tree.Step step) {
            int n = 0;
            for (Tree antecedent : step.antecedents.values()) {
              n += antecedent.accept(this);
            }
            return n;
          }
        };
    assertThat(partialReport().accept(goalCounter), is(1));
    assertThat(
        Tree.fromComputationSignature(REPORT_RULE, report("s1").args)
            .accept(goalCounter),
        is(2));
  }

  @Test void testPath() {
    final Path path = Path.of("a", "b");
    assertThat(path, hasToString(".a.b"));
    assertThat(path.head(), is("a"));
    assertThat(path.tail(), is(Path.of("b")));
    assertThat(path.tail().tail(), sameInstance(Path.EMPTY));
    assertThat(path.prepend("z"), is(Path.of("z", "a", "b")));
    assertThat(path.append("c"), is(Path.of("a", "b", "c")));
    assertThat(path.startsWith(Path.of("a")), is(true));
    assertThat(path.startsWith(Path.EMPTY), is(true));
    assertThat(path.startsWith(Path.of("b")), is(false));
    assertThat(Path.of("a").startsWith(path), is(false));
    assertThat(path.prefix(1), is(Path.of("a")));
    assertThat(Path.EMPTY, hasToString(""));
    assertThrows(IllegalArgumentException.class, Path.EMPTY::head);
  }
}

// End TreeTest.java
