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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;

import exm.lgc.common.exceptions.LGCRuntimeError;
import exm.lgc.common.lang.Var;

/**
 * A whole compilation unit.  Immutable: passes build a new program.
 */
public class Program {
  private final List<Var> globals;
  private final Map<String, Function> functions;

  public Program(List<Var> globals, List<Function> functions) {
    this.globals = ImmutableList.copyOf(globals);
    this.functions = new LinkedHashMap<String, Function>();
    for (Function f: functions) {
      if (this.functions.put(f.name(), f) != null) {
        throw new LGCRuntimeError("Duplicate function " + f.name());
      }
    }
  }

  public List<Var> globals() {
    return globals;
  }

  public List<Function> functions() {
    return ImmutableList.copyOf(functions.values());
  }

  /**
   * @return the function, or null if not defined in this program
   */
  public Function lookupFunction(String name) {
    return functions.get(name);
  }

  /**
   * @return copy of program with the function of the same name replaced
   */
  public Program replaceFunction(Function f) {
    if (!functions.containsKey(f.name())) {
      throw new LGCRuntimeError("Function " + f.name() + " not in program");
    }
    List<Function> newFns = new ArrayList<Function>(functions.size());
    for (Function old: functions.values()) {
      newFns.add(old.name().equals(f.name()) ? f : old);
    }
    return new Program(globals, newFns);
  }

  /**
   * Log the program to an output stream with a header
   */
  public void log(PrintStream out, String header) {
    out.println("// " + header);
    out.println(AstPrinter.print(this));
    out.flush();
  }

  @Override
  public String toString() {
    return AstPrinter.print(this);
  }
}
