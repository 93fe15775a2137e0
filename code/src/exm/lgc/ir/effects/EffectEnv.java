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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Maps;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.exceptions.LGCRuntimeError;
import exm.lgc.common.lang.Var;

/**
 * Effect summaries of all functions in a compilation unit.
 *
 * Summaries are published one SCC at a time, and only once that SCC is
 * stable.  The env is frozen after the fixed point, after which it is
 * read-only.
 */
public class EffectEnv {
  private final Map<String, EffectSet> summaries = Maps.newConcurrentMap();
  private final List<Diagnostic> diagnostics =
      Collections.synchronizedList(new ArrayList<Diagnostic>());
  private final Map<String, List<Var>> signatures = Maps.newConcurrentMap();
  private volatile boolean frozen = false;

  /**
   * Record a function's parameters, used to map summaries onto call sites
   */
  void declare(String function, List<Var> params) {
    checkNotFrozen();
    signatures.put(function, params);
  }

  /**
   * @return parameters of the function, or null if not declared
   */
  public List<Var> params(String function) {
    return signatures.get(function);
  }

  /**
   * @return the summary, or null if the function has none (not analyzed yet
   *         or not part of the program)
   */
  public EffectSet get(String function) {
    return summaries.get(function);
  }

  void publish(Map<String, EffectSet> sccSummaries) {
    checkNotFrozen();
    summaries.putAll(sccSummaries);
  }

  void addDiagnostics(Iterable<Diagnostic> diags) {
    checkNotFrozen();
    for (Diagnostic d: diags) {
      diagnostics.add(d);
    }
  }

  void freeze() {
    frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  private void checkNotFrozen() {
    if (frozen) {
      throw new LGCRuntimeError("Effect env is frozen");
    }
  }

  public List<Diagnostic> diagnostics() {
    synchronized (diagnostics) {
      return new ArrayList<Diagnostic>(diagnostics);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof EffectEnv)) {
      return false;
    }
    return summaries.equals(((EffectEnv)obj).summaries);
  }

  @Override
  public int hashCode() {
    return summaries.hashCode();
  }

  @Override
  public String toString() {
    return summaries.toString();
  }
}
