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
package exm.dirc.ir.tree;

import exm.dirc.common.lang.Types.Type;

/**
 * A statement that defines locations, as seen by expressions that
 * refer to its definitions.  Implemented by the statement layer.
 */
public interface Statement {

  /**
   * @return statement number, unique within a procedure
   */
  public int getNumber();

  /**
   * @return true if this is an implicit definition of the initial
   *         value of its locations
   */
  public boolean isImplicit();

  public boolean isAssign();

  /**
   * @return left hand side of an assignment, or null
   */
  public Exp getLeft();

  /**
   * @return type this statement gives to the location, or null
   */
  public Type getTypeFor(Exp loc);
}
