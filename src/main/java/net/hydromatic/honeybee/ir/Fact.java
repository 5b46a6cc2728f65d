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
package net.hydromatic.honeybee.ir;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.honeybee.util.Static;

/**
 * Instance of a judgment: the name of a fact family plus a value for each of
 * its parameters.
 *
 * <p>Immutable. Argument order is the order in which arguments were given.
 */
public final class Fact {
  public final String name;
  public final ImmutableMap<String, Value> args;

  private Fact(String name, ImmutableMap<String, Value> args) {
    this.name = requireNonNull(name, "name");
    this.args = requireNonNull(args, "args");
    checkArgument(!name.isEmpty(), "empty fact name");
  }

  /** Creates a fact. */
  public static Fact of(String name, Map<String, ? extends Value> args) {
    return new Fact(name, ImmutableMap.copyOf(args));
  }

  /** Creates a fact with no arguments. */
  public static Fact of(String name) {
    return new Fact(name, ImmutableMap.of());
  }

  /** Creates a fact with one argument. */
  public static Fact of(String name, String k0, Value v0) {
    return new Fact(name, ImmutableMap.of(k0, v0));
  }

  /** Creates a fact with two arguments. */
  public static Fact of(String name, String k0, Value v0, String k1,
      Value v1) {
    return new Fact(name, ImmutableMap.of(k0, v0, k1, v1));
  }

  /** Returns whether this fact's arguments are all literals. */
  public boolean isGround() {
    return args.values().stream().allMatch(Value::isLiteral);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, args);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Fact
            && ((Fact) o).name.equals(name)
            && ((Fact) o).args.equals(args);
  }

  @Override
  public String toString() {
    return Static.describe(new StringBuilder(), name, args).toString();
  }
}

// End Fact.java
