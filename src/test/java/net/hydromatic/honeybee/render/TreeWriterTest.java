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

import static net.hydromatic.honeybee.Fixtures.REPORT_RULE;
import static net.hydromatic.honeybee.Fixtures.reads;
import static net.hydromatic.honeybee.Fixtures.report;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.honeybee.derivation.Path;
import net.hydromatic.honeybee.derivation.Tree;
import net.hydromatic.honeybee.session.Prop;
import org.junit.jupiter.api.Test;

/** Tests {@link TreeWriter}. */
class TreeWriterTest {
  private static Tree tree() {
    return Tree.fromGoal(report("s1"))
        .replace(Path.of(Tree.OUTPUT),
            Tree.fromComputationSignature(REPORT_RULE, report("s1").args))
        .replace(Path.of(Tree.OUTPUT, "ref"), Tree.axiom(reads("s1")));
  }

  @Test void testTree() {
    final String expected = "• .output [report] Report(sample: \"s1\")\n"
        + "├─• .asm [goal] (Assembly)\n"
        + "└─• .ref [fact] Reads(sample: \"s1\")";
    assertThat(new TreeWriter().write(tree()), is(expected));
  }

  @Test void testTreeWithoutUnwrap() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.UNWRAP_GOAL.set(map, false);
    final String expected = "• [output] &goal()\n"
        + "└─• .output [report] Report(sample: \"s1\")\n"
        + "  ├─• .asm [goal] (Assembly)\n"
        + "  └─• .ref [fact] Reads(sample: \"s1\")";
    assertThat(new TreeWriter(map).write(tree()), is(expected));
  }

  @Test void testOutline() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.STYLE.set(map, Prop.Style.OUTLINE);
    final String expected = "-- <output>: Report(sample: \"s1\") [report]\n"
        + "---- <asm>: *** Assembly\n"
        + "---- <ref>: Reads(sample: \"s1\") [&axiom]";
    assertThat(new TreeWriter(map).write(tree()), is(expected));

    Prop.INDENT.set(map, 1);
    Prop.UNWRAP_GOAL.set(map, false);
    final String expected2 = "- &goal() [output]\n"
        + "-- <output>: Report(sample: \"s1\") [report]\n"
        + "--- <asm>: *** Assembly\n"
        + "--- <ref>: Reads(sample: \"s1\") [&axiom]";
    assertThat(new TreeWriter(map).write(tree()), is(expected2));
  }

  @Test void testSideConditions() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.SHOW_SIDE_CONDITIONS.set(map, true);
    final String expected = "• .output [report] Report(sample: \"s1\")"
        + " where eq(left: asm.sample, right: ret.sample)"
        + " & eq(left: ref.sample, right: ret.sample)\n"
        + "├─• .asm [goal] (Assembly)\n"
        + "└─• .ref [fact] Reads(sample: \"s1\")";
    assertThat(new TreeWriter(map).write(tree()), is(expected));
  }

  @Test void testLeaf() {
    assertThat(new TreeWriter().write(Tree.goal("Reads")),
        is("• [goal] (Reads)"));
  }
}

// End TreeWriterTest.java
