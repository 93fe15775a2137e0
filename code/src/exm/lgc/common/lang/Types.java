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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

/**
 * Resolved static types, as handed over by the type checker.
 *
 * The core only needs enough type information to decide ownership
 * (copy vs move-only), whether a binding is integer-valued (and so tracked
 * by the range analysis) and whether a binding is a collection whose length
 * is tracked.
 */
public class Types {

  public static enum TypeKind {
    INT,
    FLOAT,
    BOOL,
    TEXT,
    NOTHING,
    LIST,
    SET,
    MAP,
    STRUCT,
    OPTION,
    TUPLE,
    PIPE,
    TASK,
    FUNCTION,
    /** Types of foreign or otherwise opaque values */
    OPAQUE,
  }

  public static final Type INT = new Type(TypeKind.INT, null, null);
  public static final Type FLOAT = new Type(TypeKind.FLOAT, null, null);
  public static final Type BOOL = new Type(TypeKind.BOOL, null, null);
  public static final Type TEXT = new Type(TypeKind.TEXT, null, null);
  public static final Type NOTHING = new Type(TypeKind.NOTHING, null, null);
  public static final Type TASK = new Type(TypeKind.TASK, null, null);
  public static final Type FUNCTION = new Type(TypeKind.FUNCTION, null, null);
  public static final Type OPAQUE = new Type(TypeKind.OPAQUE, null, null);

  public static Type listOf(Type elem) {
    return new Type(TypeKind.LIST, null, Collections.singletonList(elem));
  }

  public static Type setOf(Type elem) {
    return new Type(TypeKind.SET, null, Collections.singletonList(elem));
  }

  public static Type mapOf(Type key, Type val) {
    List<Type> params = new ArrayList<Type>(2);
    params.add(key);
    params.add(val);
    return new Type(TypeKind.MAP, null, params);
  }

  public static Type optionOf(Type elem) {
    return new Type(TypeKind.OPTION, null, Collections.singletonList(elem));
  }

  public static Type pipeOf(Type elem) {
    return new Type(TypeKind.PIPE, null, Collections.singletonList(elem));
  }

  public static Type tupleOf(List<Type> elems) {
    return new Type(TypeKind.TUPLE, null, elems);
  }

  public static Type struct(String name) {
    return new Type(TypeKind.STRUCT, name, Collections.<Type>emptyList());
  }

  public static boolean isInt(Type t) {
    return t.kind == TypeKind.INT;
  }

  /**
   * @return true if values of the type have a length that the range analysis
   *         can track
   */
  public static boolean hasLength(Type t) {
    switch (t.kind) {
      case LIST:
      case SET:
      case MAP:
      case TEXT:
        return true;
      default:
        return false;
    }
  }

  /**
   * @return true if indexing a value of the type selects by position, so
   *         that an index in [min index, length] is always present.  Map
   *         lookups go by key and can miss whatever the length.
   */
  public static boolean isPositional(Type t) {
    return t.kind == TypeKind.LIST || t.kind == TypeKind.TEXT;
  }

  /**
   * @return true if giving away a value of this type leaves the source
   *          binding usable, i.e. the value is implicitly copied
   */
  public static boolean isCopy(Type t) {
    switch (t.kind) {
      case INT:
      case FLOAT:
      case BOOL:
      case NOTHING:
        return true;
      default:
        return false;
    }
  }

  public static class Type {
    public final TypeKind kind;
    /** Name for nominal types, null otherwise */
    private final String name;
    private final List<Type> params;

    private Type(TypeKind kind, String name, List<Type> params) {
      this.kind = kind;
      this.name = name;
      this.params = params == null ? Collections.<Type>emptyList()
                      : Collections.unmodifiableList(new ArrayList<Type>(params));
    }

    public String name() {
      return name;
    }

    public List<Type> params() {
      return params;
    }

    /**
     * @return element type of a collection, option or pipe type
     */
    public Type elemType() {
      assert(params.size() >= 1) : this;
      return params.get(params.size() - 1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, name, params);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof Type))
        return false;
      Type other = (Type) obj;
      return kind == other.kind && Objects.equals(name, other.name) &&
             params.equals(other.params);
    }

    @Override
    public String toString() {
      if (name != null) {
        return name;
      }
      String k = StringUtils.capitalize(kind.name().toLowerCase());
      if (params.isEmpty()) {
        return k;
      }
      return k + "<" + StringUtils.join(params, ", ") + ">";
    }
  }
}
