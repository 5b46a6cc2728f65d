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
package net.hydromatic.honeybee.render;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import java.util.Map;
import net.hydromatic.honeybee.derivation.Tree;
import net.hydromatic.honeybee.derivation.TreeVisitor;
import net.hydromatic.honeybee.query.Query;
import net.hydromatic.honeybee.session.Prop;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renders a derivation tree as text, one node per line.
 *
 * <p>In {@link Prop.Style#TREE} style, nesting is shown with box-drawing
 * glyphs:
 *
 * <pre>
 * • .output [report] Report(sample: "s1")
 * ├─• .asm [goal] (Assembly)
 * └─• .ref [fact] Reads(sample: "s1")
 * </pre>
 *
 * <p>In {@link Prop.Style#OUTLINE} style, nesting is shown by the number of
 * dashes:
 *
 * <pre>
 * -- &lt;output&gt;: Report(sample: "s1") [report]
 * ---- &lt;asm&gt;: *** Assembly
 * ---- &lt;ref&gt;: Reads(sample: "s1") [&amp;axiom]
 * </pre>
 */
public class TreeWriter {
  private final Prop.Style style;
  private final int indent;
  private final boolean showSideConditions;
  private final boolean unwrapGoal;

  /** Creates a TreeWriter with default properties. */
  public TreeWriter() {
    this(ImmutableMap.of());
  }

  /** Creates a TreeWriter. */
  public TreeWriter(Map<Prop, Object> map) {
    this.style = Prop.STYLE.enumValue(map, Prop.Style.class);
    this.indent = Prop.INDENT.intValue(map);
    this.showSideConditions = Prop.SHOW_SIDE_CONDITIONS.booleanValue(map);
    this.unwrapGoal = Prop.UNWRAP_GOAL.booleanValue(map);
  }

  /** Renders a tree. */
  public String write(Tree tree) {
    final StringBuilder b = new StringBuilder();
    Tree root = tree;
    @Nullable String tag = null;
    if (unwrapGoal && isGoalWrapper(tree)) {
      final Map.Entry<String, Tree> entry =
          Iterables.getOnlyElement(((Tree.Step) tree).antecedents.entrySet());
      tag = entry.getKey();
      root = entry.getValue();
    }
    switch (style) {
    case TREE:
      writeTree(b, root, tag, "", "");
      break;
    case OUTLINE:
      writeOutline(b, root, tag, 1);
      break;
    default:
      throw new AssertionError(style);
    }
    return b.toString();
  }

  /** Returns whether a tree is the synthetic root created for a top-level
   * goal. */
  private static boolean isGoalWrapper(Tree tree) {
    return tree instanceof Tree.Step
        && ((Tree.Step) tree).consequent.name.equals(Query.GOAL_FACT_NAME)
        && ((Tree.Step) tree).antecedents.size() == 1;
  }

  private void writeTree(StringBuilder b, Tree tree, @Nullable String tag,
      String itemPrefix, String childPrefix) {
    if (b.length() > 0) {
      b.append('\n');
    }
    b.append(itemPrefix)
        .append(tree.accept(new TreeLine(tag == null ? "" : "." + tag)));
    if (tree instanceof Tree.Step) {
      final Map<String, Tree> antecedents = ((Tree.Step) tree).antecedents;
      int i = 0;
      for (Map.Entry<String, Tree> e : antecedents.entrySet()) {
        final boolean last = ++i == antecedents.size();
        writeTree(b, e.getValue(), e.getKey(),
            childPrefix + (last ? "└─" : "├─"),
            childPrefix + (last ? "  " : "│ "));
      }
    }
  }

  private void writeOutline(StringBuilder b, Tree tree, @Nullable String tag,
      int depth) {
    if (b.length() > 0) {
      b.append('\n');
    }
    b.append(Strings.repeat("-", depth * indent)).append(' ')
        .append(
            tree.accept(
                new OutlineLine(tag == null ? "" : "<" + tag + ">: ")));
    if (tree instanceof Tree.Step) {
      ((Tree.Step) tree).antecedents.forEach((tag2, tree2) ->
          writeOutline(b, tree2, tag2, depth + 1));
    }
  }

  private String sideCondition(Tree.Step step) {
    return showSideConditions && !step.sideCondition.isEmpty()
        ? " where " + step.sideCondition
        : "";
  }

  /** Formats a node in {@link Prop.Style#TREE} style. */
  private class TreeLine implements TreeVisitor<String> {
    private final String prefix;

    TreeLine(String prefix) {
      this.prefix = prefix.isEmpty() ? "" : " " + prefix;
    }

    @Override
    public String visit(Tree.Axiom axiom) {
      return "•" + prefix + " [fact] " + axiom.fact;
    }

    @Override
    public String visit(Tree.Goal goal) {
      return "•" + prefix + " [goal] (" + goal.factName + ")";
    }

    @Override
    public String visit(Tree.Step step) {
      return "•" + prefix + " [" + step.label + "] " + step.consequent
          + sideCondition(step);
    }
  }

  /** Formats a node in {@link Prop.Style#OUTLINE} style. */
  private class OutlineLine implements TreeVisitor<String> {
    private final String prefix;

    OutlineLine(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public String visit(Tree.Axiom axiom) {
      return prefix + axiom.fact + " [&axiom]";
    }

    @Override
    public String visit(Tree.Goal goal) {
      return prefix + "*** " + goal.factName;
    }

    @Override
    public String visit(Tree.Step step) {
      return prefix + step.consequent + " [" + step.label + "]"
          + sideCondition(step);
    }
  }
}

// End TreeWriter.java
