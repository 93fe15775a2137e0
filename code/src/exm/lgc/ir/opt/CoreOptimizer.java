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
package exm.lgc.ir.opt;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Settings;
import exm.lgc.common.exceptions.InvalidOptionException;
import exm.lgc.ir.effects.EffectAnalyzer;
import exm.lgc.ir.ranges.RangeAnalyzer;
import exm.lgc.ir.tree.Program;

public class CoreOptimizer {

  /**
   * Optimize the program and return a new one.  The input is not modified.
   *
   * @param icOutput where to log the AST between passes.  Null for
   *              no output
   * @param diagnostics receives diagnostics for compiler maintainers
   */
  public static Program optimize(Logger logger, PrintStream icOutput,
      Program prog, List<Diagnostic> diagnostics)
          throws InvalidOptionException {
    boolean logIC = icOutput != null;
    if (logIC) {
      prog.log(icOutput, "Initial AST before optimization");
    }

    boolean debug = Settings.getBoolean(Settings.COMPILER_DEBUG);

    EffectAnalyzer effects = EffectAnalyzer.fromSettings(logger);
    RangeAnalyzer ranges = RangeAnalyzer.fromSettings(logger, effects);

    OptimizerPipeline pipe = new OptimizerPipeline(icOutput, effects, ranges,
                                                   debug);
    // Folding first so that ranges see literals
    pipe.addPass(new ConstantFold());
    pipe.addPass(new HoistLoops());
    pipe.addPass(new LoopUnswitch());
    pipe.addPass(new LoopPeel());
    // Peeled iterations can expose dead stores
    pipe.addPass(new DeadStoreElimination());

    Program result = pipe.runPipeline(logger, prog);
    diagnostics.addAll(pipe.diagnostics());

    if (logIC) {
      result.log(icOutput, "Final optimized AST");
    }
    return result;
  }

  public static Program optimize(Logger logger, PrintStream icOutput,
                   Program prog) throws InvalidOptionException {
    List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
    Program result = optimize(logger, icOutput, prog, diagnostics);
    for (Diagnostic d: diagnostics) {
      logger.debug(d);
    }
    return result;
  }
}
