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
package net.hydromatic.honeybee;

import static org.hamcrest.CoreMatchers.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.honeybee.derivation.Tree;
import net.hydromatic.honeybee.ir.ComputationSignature;
import net.hydromatic.honeybee.ir.Fact;
import net.hydromatic.honeybee.ir.FactSignature;
import net.hydromatic.honeybee.ir.Library;
import net.hydromatic.honeybee.ir.Mode;
import net.hydromatic.honeybee.ir.Predicate;
import net.hydromatic.honeybee.ir.PredicateAtom;
import net.hydromatic.honeybee.ir.Value;
import net.hydromatic.honeybee.ir.ValueType;
import net.hydromatic.honeybee.query.Query;
import org.hamcrest.Matcher;

/**
 * Library and facts shared by tests.
 *
 * <p>Sequencing reads of a sample are assembled, and an assembly plus the
 * original reads produce a report.
 */
public abstract class Fixtures {
  private Fixtures() {}

  public static final FactSignature READS =
      new FactSignature("Reads", ImmutableMap.of("sample", ValueType.STR),
          FactSignature.Kind.ANNOTATION);

  public static final FactSignature ASSEMBLY =
      new FactSignature("Assembly",
          ImmutableMap.of("sample", ValueType.STR, "quality", ValueType.INT),
          FactSignature.Kind.ANALYSIS);

  public static final FactSignature REPORT =
      new FactSignature("Report", ImmutableMap.of("sample", ValueType.STR),
          FactSignature.Kind.ANALYSIS);

  /** Fact with no parameters. */
  public static final FactSignature APPROVED =
      new FactSignature("Approved", ImmutableMap.of(),
          FactSignature.Kind.ANNOTATION);

  public static final ComputationSignature ASSEMBLE =
      new ComputationSignature("assemble",
          ImmutableList.of(
              new ComputationSignature.Param("reads", "Reads", Mode.EXISTS)),
          "Assembly",
          Predicate.of(
              PredicateAtom.eq(Value.var("reads", "sample"),
                  Value.var(Query.RET, "sample"))));

  public static final ComputationSignature REPORT_RULE =
      new ComputationSignature("report",
          ImmutableList.of(
              new ComputationSignature.Param("asm", "Assembly", Mode.EXISTS),
              new ComputationSignature.Param("ref", "Reads", Mode.EXISTS)),
          "Report",
          Predicate.of(
              PredicateAtom.eq(Value.var("asm", "sample"),
                  Value.var(Query.RET, "sample")),
              PredicateAtom.eq(Value.var("ref", "sample"),
                  Value.var(Query.RET, "sample"))));

  public static final Library LIBRARY =
      Library.builder()
          .add(READS)
          .add(ASSEMBLY)
          .add(REPORT)
          .add(APPROVED)
          .add(ASSEMBLE)
          .add(REPORT_RULE)
          .build();

  public static Fact reads(String sample) {
    return Fact.of("Reads", "sample", Value.of(sample));
  }

  public static Fact assembly(String sample, int quality) {
    return Fact.of("Assembly", "sample", Value.of(sample), "quality",
        Value.of(quality));
  }

  public static Fact report(String sample) {
    return Fact.of("Report", "sample", Value.of(sample));
  }

  /** Matches a tree that is equal to a given tree. */
  public static Matcher<Tree> isTree(Tree tree) {
    return is(tree);
  }
}

// End Fixtures.java
