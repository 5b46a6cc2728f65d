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
package net.hydromatic.honeybee.util;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns all but the first element of a list. */
  public static <E> List<E> skip(List<E> list) {
    return skip(list, 1);
  }

  /** Returns all but the first {@code count} elements of a list. */
  public static <E> List<E> skip(List<E> list, int count) {
    return list.subList(count, list.size());
  }

  /** Returns a list with one element appended. */
  public static <E> List<E> append(List<E> list, E e) {
    return ImmutableList.<E>builder().addAll(list).add(e).build();
  }

  /** Returns a list with one element prepended. */
  public static <E> List<E> prepend(E e, List<E> list) {
    return ImmutableList.<E>builder().add(e).addAll(list).build();
  }

  /** Returns the concatenation of two lists. */
  public static <E> List<E> concat(List<E> list0, List<E> list1) {
    if (list1.isEmpty()) {
      return ImmutableList.copyOf(list0);
    }
    return ImmutableList.<E>builder().addAll(list0).addAll(list1).build();
  }

  /**
   * Appends a name and a list of named arguments to a builder, in the form
   * "name(k0: v0, k1: v1)".
   */
  public static StringBuilder describe(StringBuilder b, String name,
      Map<String, ?> args) {
    b.append(name).append('(');
    int i = 0;
    for (Map.Entry<String, ?> e : args.entrySet()) {
      if (i++ > 0) {
        b.append(", ");
      }
      b.append(e.getKey()).append(": ").append(e.getValue());
    }
    return b.append(')');
  }
}

// End Static.java
