/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.dirc.common.util;

import com.google.common.base.Objects;

/**
 * An immutable pair of values, used for (result, changed) returns and
 * for keys made of two parts.
 * @param <T1>
 * @param <T2>
 */
public class Pair<T1, T2> {
  public final T1 val1;
  public final T2 val2;

  private Pair(T1 val1, T2 val2) {
    this.val1 = val1;
    this.val2 = val2;
  }

  public static <T1, T2> Pair<T1, T2> create(T1 val1, T2 val2) {
    return new Pair<T1, T2>(val1, val2);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(val1, val2);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Pair)) {
      return false;
    }
    Pair<?, ?> other = (Pair<?, ?>)obj;
    return Objects.equal(val1, other.val1) && Objects.equal(val2, other.val2);
  }

  @Override
  public String toString() {
    return "(" + val1 + ", " + val2 + ")";
  }
}
