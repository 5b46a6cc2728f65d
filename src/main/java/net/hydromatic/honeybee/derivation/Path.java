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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.honeybee.util.Static;

/**
 * Address of a node within a {@link Tree}: the sequence of antecedent tags to
 * follow from the root.
 *
 * <p>The empty path addresses the root. Paths are consumed front to back; the
 * first tag selects an antecedent of the root, the second an antecedent of
 * that, and so on.
 */
public final class Path {
  /** The empty path. */
  public static final Path EMPTY = new Path(ImmutableList.of());

  public final ImmutableList<String> tags;

  private Path(ImmutableList<String> tags) {
    this.tags = tags;
  }

  /** Creates a path. */
  public static Path of(String... tags) {
    return of(ImmutableList.copyOf(tags));
  }

  /** Creates a path. */
  public static Path of(List<String> tags) {
    return tags.isEmpty() ? EMPTY : new Path(ImmutableList.copyOf(tags));
  }

  public boolean isEmpty() {
    return tags.isEmpty();
  }

  public int size() {
    return tags.size();
  }

  /** Returns the first tag. */
  public String head() {
    checkArgument(!tags.isEmpty(), "empty path has no head");
    return tags.get(0);
  }

  /** Returns every tag but the first. */
  public Path tail() {
    checkArgument(!tags.isEmpty(), "empty path has no tail");
    return of(Static.skip(tags));
  }

  /** Returns a path with a tag added at the front. */
  public Path prepend(String tag) {
    return new Path(ImmutableList.copyOf(Static.prepend(tag, tags)));
  }

  /** Returns a path with a tag added at the end. */
  public Path append(String tag) {
    return new Path(ImmutableList.copyOf(Static.append(tags, tag)));
  }

  /** Returns the first {@code n} tags of this path. */
  public Path prefix(int n) {
    return of(tags.subList(0, n));
  }

  /**
   * Returns whether this path starts with another path; that is, whether the
   * node this path addresses is inside the subtree that {@code path}
   * addresses.
   */
  public boolean startsWith(Path path) {
    return path.size() <= size()
        && tags.subList(0, path.size()).equals(path.tags);
  }

  @Override
  public int hashCode() {
    return tags.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this || o instanceof Path && ((Path) o).tags.equals(tags);
  }

  /** Returns the path in the form ".a.b", or "" if empty. */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    tags.forEach(tag -> b.append('.').append(tag));
    return b.toString();
  }
}

// End Path.java
