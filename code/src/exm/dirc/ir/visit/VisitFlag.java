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
package exm.dirc.ir.visit;

/**
 * Out-parameter for visitors: whether to stop the walker's own
 * descent (for {@link ExpVisitor}) or whether to recurse into children
 * (for {@link ExpModifier}).
 */
public class VisitFlag {
  private boolean set;

  public VisitFlag(boolean initial) {
    this.set = initial;
  }

  public void set() {
    this.set = true;
  }

  public void clear() {
    this.set = false;
  }

  public void set(boolean val) {
    this.set = val;
  }

  public boolean isSet() {
    return set;
  }
}
