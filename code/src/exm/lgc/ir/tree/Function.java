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
package exm.lgc.ir.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.lgc.common.lang.Types.Type;
import exm.lgc.common.lang.Var;

public class Function {
  private final String name;
  private final List<Var> params;
  private final Type returnType;
  private final Block body;
  /** Implemented outside the language: no body to analyze */
  private final boolean isNative;

  public Function(String name, List<Var> params, Type returnType,
                  Block body, boolean isNative) {
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.returnType = returnType;
    this.body = isNative ? Block.EMPTY : body;
    this.isNative = isNative;
  }

  public static Function nativeFunction(String name, List<Var> params,
                                        Type returnType) {
    return new Function(name, params, returnType, null, true);
  }

  public String name() {
    return name;
  }

  public List<Var> params() {
    return params;
  }

  public Type returnType() {
    return returnType;
  }

  public Block body() {
    return body;
  }

  public boolean isNative() {
    return isNative;
  }

  /**
   * @return copy of this function with a different body
   */
  public Function withBody(Block newBody) {
    return new Function(name, params, returnType, newBody, isNative);
  }

  @Override
  public String toString() {
    return AstPrinter.print(this);
  }
}
