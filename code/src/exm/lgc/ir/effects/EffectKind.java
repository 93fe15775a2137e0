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
package exm.lgc.ir.effects;

/**
 * The effect lattice, ordered from least to greatest.  Declaration order is
 * the lattice order.
 */
public enum EffectKind {
  PURE,
  READ,
  WRITE,
  CONSUME,
  ALLOC,
  IO,
  SECURITY_CHECK,
  DIVERGE,
  UNKNOWN;

  public static EffectKind join(EffectKind a, EffectKind b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  public boolean isAtLeast(EffectKind other) {
    return this.compareTo(other) >= 0;
  }

  public boolean isAtMost(EffectKind other) {
    return this.compareTo(other) <= 0;
  }
}
