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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.honeybee.query.Query;

/**
 * Query for the next unit of work at a step, and the path of that step.
 *
 * <p>Once the query is solved, the solutions for its siblings are grafted at
 * {@code path.append(tag)} for each sibling tag.
 */
public final class Obligation {
  public final Path path;
  public final Query query;

  public Obligation(Path path, Query query) {
    this.path = requireNonNull(path, "path");
    this.query = requireNonNull(query, "query");
  }

  /** Returns this obligation with a tag prepended to its path. */
  Obligation under(String tag) {
    return new Obligation(path.prepend(tag), query);
  }

  @Override
  public int hashCode() {
    return Objects.hash(path, query);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Obligation
            && ((Obligation) o).path.equals(path)
            && ((Obligation) o).query.equals(query);
  }

  @Override
  public String toString() {
    return "'" + path + "': " + query;
  }
}

// End Obligation.java
