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
package net.hydromatic.honeybee.query;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.honeybee.ir.ComputationSignature;
import net.hydromatic.honeybee.ir.Fact;
import net.hydromatic.honeybee.ir.FactSignature;
import net.hydromatic.honeybee.ir.Library;
import net.hydromatic.honeybee.ir.Mode;
import net.hydromatic.honeybee.ir.Predicate;
import net.hydromatic.honeybee.ir.PredicateAtom;
import net.hydromatic.honeybee.ir.Value;
import net.hydromatic.honeybee.ir.ValueType;

/**
 * Unit of search work, to be solved by an external engine.
 *
 * <p>A query has a synthetic {@link ComputationSignature} whose parameters
 * are the obligations to be discharged jointly, and whose precondition is the
 * constraint they must jointly satisfy. Its {@link FactSignature} lists the
 * unknowns that the engine must find.
 *
 * <p>A query is <em>closed</em> if there are no unknowns.
 */
public final class Query {
  /** Name of the variable that refers to the fact a computation returns. */
  public static final String RET = "ret";

  /** Name of the synthetic fact that a top-level goal establishes. */
  public static final String GOAL_FACT_NAME = "&goal";

  /** Name of the synthetic fact and computation of a free query. */
  public static final String FREE_FACT_NAME = "&free";

  public final FactSignature factSignature;
  public final ComputationSignature computationSignature;

  /** Obligations to be discharged, as a map from tag to fact name. */
  public final ImmutableMap<String, String> siblings;

  private Query(FactSignature factSignature,
      ComputationSignature computationSignature) {
    this.factSignature = requireNonNull(factSignature, "factSignature");
    this.computationSignature =
        requireNonNull(computationSignature, "computationSignature");
    final ImmutableMap.Builder<String, String> b = ImmutableMap.builder();
    computationSignature.params.forEach(p -> b.put(p.name, p.factName));
    this.siblings = b.build();
  }

  /**
   * Creates a closed query that asks how to derive a given fact.
   *
   * <p>The query's computation, named {@code name}, has a single parameter,
   * also called {@code name}, whose fact must equal {@code fact} in every
   * argument.
   */
  public static Query fromFact(Fact fact, String name) {
    final ImmutableList.Builder<PredicateAtom> atoms = ImmutableList.builder();
    fact.args.forEach((k, v) ->
        atoms.add(PredicateAtom.eq(Value.var(name, k), v)));
    final ComputationSignature computationSignature =
        new ComputationSignature(name,
            ImmutableList.of(
                new ComputationSignature.Param(name, fact.name, Mode.EXISTS)),
            GOAL_FACT_NAME, Predicate.of(atoms.build()));
    final FactSignature factSignature =
        new FactSignature(GOAL_FACT_NAME, ImmutableMap.of(),
            FactSignature.Kind.ANALYSIS);
    return new Query(factSignature, computationSignature);
  }

  /**
   * Creates a free query that asks for facts to discharge several sibling
   * obligations at once.
   *
   * <p>The unknowns are the arguments of each sibling; the argument {@code p}
   * of sibling {@code tag} is named "tag.p". The library supplies the
   * parameters of each sibling's fact family.
   *
   * @param library Library in which to look up sibling facts
   * @param siblings Map from tag to fact name
   * @param sideCondition Constraint the siblings must jointly satisfy
   * @throws IllegalArgumentException if a sibling's fact is not in the library,
   *     or two siblings yield the same unknown name
   */
  public static Query free(Library library, Map<String, String> siblings,
      Predicate sideCondition) {
    final Map<String, ValueType> unknowns = new LinkedHashMap<>();
    final ImmutableList.Builder<ComputationSignature.Param> params =
        ImmutableList.builder();
    siblings.forEach((tag, factName) -> {
      final FactSignature signature = library.factSignature(factName);
      signature.params.forEach((p, type) -> {
        final String unknown = tag + "." + p;
        checkArgument(unknowns.put(unknown, type) == null,
            "ambiguous unknown %s", unknown);
      });
      params.add(new ComputationSignature.Param(tag, factName, Mode.EXISTS));
    });
    final ComputationSignature computationSignature =
        new ComputationSignature(FREE_FACT_NAME, params.build(),
            FREE_FACT_NAME, sideCondition);
    final FactSignature factSignature =
        new FactSignature(FREE_FACT_NAME, unknowns,
            FactSignature.Kind.ANALYSIS);
    return new Query(factSignature, computationSignature);
  }

  /** Returns whether this query has no unknowns. */
  public boolean closed() {
    return factSignature.params.isEmpty();
  }

  /** Returns the constraint that a solution must satisfy. */
  public Predicate condition() {
    return computationSignature.precondition;
  }

  @Override
  public int hashCode() {
    return Objects.hash(factSignature, computationSignature);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Query
            && ((Query) o).factSignature.equals(factSignature)
            && ((Query) o).computationSignature.equals(computationSignature);
  }

  @Override
  public String toString() {
    return "Query{" + siblings + " where " + condition()
        + (closed() ? "" : " find " + factSignature.params.keySet()) + "}";
  }
}

// End Query.java
