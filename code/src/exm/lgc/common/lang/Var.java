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
package exm.lgc.common.lang;

import exm.lgc.common.lang.Types.Type;

/**
 * A binding: a local variable, parameter or global.
 *
 * Binding names are unique within a function (shadowing is resolved before
 * the core runs), so equality is by name.
 */
public class Var implements Comparable<Var> {

  public static enum VarKind {
    LOCAL,
    PARAMETER,
    GLOBAL,
    /** Introduced by an optimizer pass */
    TEMPORARY,
  }

  private final String name;
  private final Type type;
  private final boolean mutable;
  private final VarKind kind;

  public Var(String name, Type type, boolean mutable, VarKind kind) {
    assert(name != null && type != null && kind != null);
    this.name = name;
    this.type = type;
    this.mutable = mutable;
    this.kind = kind;
  }

  public static Var local(String name, Type type) {
    return new Var(name, type, true, VarKind.LOCAL);
  }

  public static Var param(String name, Type type) {
    return new Var(name, type, false, VarKind.PARAMETER);
  }

  public static Var global(String name, Type type) {
    return new Var(name, type, true, VarKind.GLOBAL);
  }

  public String name() {
    return name;
  }

  public Type type() {
    return type;
  }

  public boolean isMutable() {
    return mutable;
  }

  public VarKind kind() {
    return kind;
  }

  /**
   * @return true if the binding can be observed outside the function
   */
  public boolean visibleToCaller() {
    return kind == VarKind.PARAMETER || kind == VarKind.GLOBAL;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Var))
      return false;
    return name.equals(((Var)obj).name);
  }

  @Override
  public int compareTo(Var o) {
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return name;
  }
}
