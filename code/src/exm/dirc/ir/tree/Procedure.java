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

import exm.dirc.signature.Platform;
import exm.dirc.signature.Signature;

/**
 * The procedure an expression belongs to, as needed by locations,
 * function constants and the simplifier.
 */
public interface Procedure {

  public String getName();

  public Signature getSignature();

  public Platform getPlatform();

  public boolean isWin32();

  /**
   * @param left a location
   * @return the expression the location is proven equal to on exit,
   *         or null if nothing is proven
   */
  public Exp getProven(Exp left);
}
