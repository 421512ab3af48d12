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

import exm.dirc.common.exceptions.DIRCRuntimeError;

/**
 * Either a value or an error message, for lookups that can fail in
 * an expected way.
 * @param <T>
 */
public class Result<T> {

  private final T value;
  private final String error;

  private Result(T value, String error) {
    this.value = value;
    this.error = error;
  }

  public static <T> Result<T> ofValue(T value) {
    assert(value != null);
    return new Result<T>(value, null);
  }

  public static <T> Result<T> ofError(String error) {
    assert(error != null);
    return new Result<T>(null, error);
  }

  public boolean isValue() {
    return this.value != null;
  }

  public boolean isError() {
    return this.error != null;
  }

  public T getValue() {
    if (this.value == null) {
      throw new DIRCRuntimeError(
          "Attempted to get the value of a failed result: " + error);
    }
    return this.value;
  }

  /**
   * @param alternative
   * @return value if present, otherwise alternative
   */
  public T getValueOr(T alternative) {
    return this.value != null ? this.value : alternative;
  }

  public String getError() {
    if (this.error == null) {
      throw new DIRCRuntimeError(
          "Attempted to get the error of a successful result");
    }
    return this.error;
  }

  @Override
  public String toString() {
    return isValue() ? "Ok(" + value + ")" : "Err(" + error + ")";
  }
}
