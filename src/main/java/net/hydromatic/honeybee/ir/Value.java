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

import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Value that may appear as the argument of a {@link Fact} or of a {@link
 * PredicateAtom}.
 *
 * <p>A value is either a literal ({@link Int}, {@link Str}, {@link Bool}) or a
 * reference to a variable ({@link Var}). Variables only occur in predicates;
 * facts hold literals.
 */
public abstract class Value {
  private Value() {}

  /** Creates an integer literal. */
  public static Int of(long value) {
    return new Int(value);
  }

  /** Creates a string literal. */
  public static Str of(String value) {
    return new Str(value);
  }

  /** Creates a boolean literal. */
  public static Bool of(boolean value) {
    return value ? Bool.TRUE : Bool.FALSE;
  }

  /** Creates a reference to a variable, for example "x". */
  public static Var var(String name) {
    return new Var(name, null);
  }

  /**
   * Creates a reference to a field of a variable, for example "ret.sample".
   */
  public static Var var(String name, String selector) {
    return new Var(name, requireNonNull(selector, "selector"));
  }

  /** Returns whether this value contains no variables. */
  public boolean isLiteral() {
    return true;
  }

  /**
   * Replaces this value if it is a field of variable {@code var} whose
   * selector has a binding; otherwise returns this value.
   */
  public Value substitute(String var, Map<String, Value> bindings) {
    return this;
  }

  /** Integer literal. */
  public static final class Int extends Value {
    public final long value;

    Int(long value) {
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Int && ((Int) o).value == value;
    }

    @Override
    public String toString() {
      return Long.toString(value);
    }
  }

  /** String literal. */
  public static final class Str extends Value {
    public final String value;

    Str(String value) {
      this.value = requireNonNull(value, "value");
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Str && ((Str) o).value.equals(value);
    }

    @Override
    public String toString() {
      return '"' + value.replace("\"", "\\\"") + '"';
    }
  }

  /** Boolean literal. */
  public static final class Bool extends Value {
    static final Bool TRUE = new Bool(true);
    static final Bool FALSE = new Bool(false);

    public final boolean value;

    private Bool(boolean value) {
      this.value = value;
    }

    @Override
    public int hashCode() {
      return Boolean.hashCode(value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Bool && ((Bool) o).value == value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  /**
   * Reference to a variable, or to a field of a variable.
   *
   * <p>The variable {@code ret} with selector {@code sample} refers to the
   * {@code sample} argument of the fact that a rule returns.
   */
  public static final class Var extends Value {
    public final String name;
    public final @Nullable String selector;

    Var(String name, @Nullable String selector) {
      this.name = requireNonNull(name, "name");
      this.selector = selector;
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public boolean isLiteral() {
      return false;
    }

    @Override
    public Value substitute(String var, Map<String, Value> bindings) {
      if (selector == null || !name.equals(var)) {
        return this;
      }
      final Value value = bindings.get(selector);
      return value != null ? value : this;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, selector);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Var
              && ((Var) o).name.equals(name)
              && Objects.equals(((Var) o).selector, selector);
    }

    @Override
    public String toString() {
      return selector == null ? name : name + "." + selector;
    }
  }
}

// End Value.java
