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
package exm.lgc.common;

/**
 * Internal diagnostic for compiler maintainers.  These never fail the build:
 * they record where an analysis or optimization gave up.
 */
public class Diagnostic {
  public static enum Kind {
    /** A construct couldn't be classified and was treated conservatively */
    ANALYSIS_INCOMPLETE,
    /** An optimization candidate failed a safety precondition */
    UNSOUND_HOIST_REJECTED,
    /** A fixed point didn't converge within the iteration cap */
    ITERATION_CAP,
    /** An embedded evaluator ran out of steps and kept the original code */
    STEP_BUDGET_EXHAUSTED,
  }

  public final Kind kind;
  public final String message;

  public Diagnostic(Kind kind, String message) {
    this.kind = kind;
    this.message = message;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + message.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Diagnostic)) {
      return false;
    }
    Diagnostic other = (Diagnostic)obj;
    return kind == other.kind && message.equals(other.message);
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
