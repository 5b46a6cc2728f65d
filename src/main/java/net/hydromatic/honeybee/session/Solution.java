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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Objects;
import java.util.Optional;
import net.hydromatic.honeybee.ir.Fact;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Answer to a query: for each sibling tag, the fact that discharges it and,
 * if the fact is to be derived rather than assumed, the computation that
 * derives it.
 */
public final class Solution {
  public final ImmutableMap<String, Choice> choices;

  private Solution(ImmutableMap<String, Choice> choices) {
    this.choices = choices;
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public int hashCode() {
    return choices.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Solution && ((Solution) o).choices.equals(choices);
  }

  @Override
  public String toString() {
    return choices.toString();
  }

  /** The fact chosen for one sibling, and how it is justified. */
  public static final class Choice {
    public final Fact fact;

    /** Name of the computation that derives {@link #fact}, or null if the
     * fact is an axiom. */
    public final @Nullable String computation;

    Choice(Fact fact, @Nullable String computation) {
      this.fact = requireNonNull(fact, "fact");
      this.computation = computation;
    }

    public Optional<String> computation() {
      return Optional.ofNullable(computation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fact, computation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Choice
              && ((Choice) o).fact.equals(fact)
              && Objects.equals(((Choice) o).computation, computation);
    }

    @Override
    public String toString() {
      return computation == null ? fact.toString()
          : fact + " by " + computation;
    }
  }

  /** Builder for {@link Solution}. */
  public static class Builder {
    private final ImmutableMap.Builder<String, Choice> choices =
        ImmutableMap.builder();

    /** Discharges a sibling with a fact that needs no further derivation. */
    public Builder axiom(String tag, Fact fact) {
      choices.put(tag, new Choice(fact, null));
      return this;
    }

    /**
     * Discharges a sibling with a fact that is to be derived by a given
     * computation, whose antecedents become new goals.
     */
    public Builder step(String tag, String computation, Fact fact) {
      choices.put(tag,
          new Choice(fact, requireNonNull(computation, "computation")));
      return this;
    }

    public Solution build() {
      return new Solution(choices.buildOrThrow());
    }
  }
}

// End Solution.java
