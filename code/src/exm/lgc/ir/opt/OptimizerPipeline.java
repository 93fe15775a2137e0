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
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import exm.lgc.common.Diagnostic;
import exm.lgc.common.Settings;
import exm.lgc.common.exceptions.InvalidOptionException;
import exm.lgc.common.exceptions.LGCRuntimeError;
import exm.lgc.ir.effects.EffectAnalyzer;
import exm.lgc.ir.ranges.RangeAnalyzer;
import exm.lgc.ir.tree.Program;

/**
 * Runs passes in order.  Each pass gets analyses derived from the program
 * as it is when the pass starts, since results over older nodes don't
 * describe the rewritten tree.
 */
public class OptimizerPipeline {

  public OptimizerPipeline(PrintStream icOutput, EffectAnalyzer effects,
                           RangeAnalyzer ranges, boolean checkGuards) {
    this.icOutput = icOutput;
    this.effects = effects;
    this.ranges = ranges;
    this.checkGuards = checkGuards;
  }

  private final List<OptimizerPass> passes = new ArrayList<OptimizerPass>();
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();
  private final PrintStream icOutput;
  private final EffectAnalyzer effects;
  private final RangeAnalyzer ranges;
  /** Verify security checks after each pass */
  private final boolean checkGuards;

  public void addPass(OptimizerPass pass) {
    passes.add(pass);
  }

  public Program runPipeline(Logger logger, Program program) {
    for (OptimizerPass pass: passes) {
      if (passEnabled(pass)) {
        logger.debug("Pass: " + pass.getPassName());
        AnalysisResults analyses = AnalysisResults.derive(logger, program,
                                            effects, ranges, diagnostics);
        Program result = pass.optimize(logger, program, analyses);
        if (checkGuards) {
          SecurityCheckGuard.verify(pass.getPassName(), analyses, program,
                                    result);
        }
        program = result;
        if (icOutput != null) {
          program.log(icOutput, "AST after " + pass.getPassName());
        }
      }
    }
    return program;
  }

  public boolean passEnabled(OptimizerPass pass) {
    try {
      String key = pass.getConfigEnabledKey();
      return key == null || Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new LGCRuntimeError("Expected config key " +
                      pass.getConfigEnabledKey() + " to exist");
    }
  }

  public List<Diagnostic> diagnostics() {
    return Collections.unmodifiableList(diagnostics);
  }
}
