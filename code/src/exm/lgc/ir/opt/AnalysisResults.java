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

import java.util.List;

import org.apache.log4j.Logger;

import exm.lgc.common.Diagnostic;
import exm.lgc.ir.callgraph.CallGraph;
import exm.lgc.ir.effects.EffectAnalyzer;
import exm.lgc.ir.effects.EffectEnv;
import exm.lgc.ir.effects.EffectSet;
import exm.lgc.ir.ranges.RangeAnalyzer;
import exm.lgc.ir.ranges.RangeResults;
import exm.lgc.ir.tree.Block;
import exm.lgc.ir.tree.Exprs.Expr;
import exm.lgc.ir.tree.Program;
import exm.lgc.ir.tree.Stmts.Stmt;

/**
 * Analyses of one program snapshot.  Effects are computed up front; ranges
 * are computed on first use, since they build on effects.
 */
public class AnalysisResults {
  private final Logger logger;
  private final Program program;
  private final CallGraph callGraph;
  private final EffectAnalyzer effectAnalyzer;
  private final EffectEnv effects;
  private final RangeAnalyzer rangeAnalyzer;
  private RangeResults ranges = null;
  private final List<Diagnostic> diagnostics;

  private AnalysisResults(Logger logger, Program program, CallGraph callGraph,
      EffectAnalyzer effectAnalyzer, EffectEnv effects,
      RangeAnalyzer rangeAnalyzer, List<Diagnostic> diagnostics) {
    this.logger = logger;
    this.program = program;
    this.callGraph = callGraph;
    this.effectAnalyzer = effectAnalyzer;
    this.effects = effects;
    this.rangeAnalyzer = rangeAnalyzer;
    this.diagnostics = diagnostics;
  }

  /**
   * Run the effect analysis over the program
   * @param diagnostics where to report diagnostics
   */
  public static AnalysisResults derive(Logger logger, Program program,
        EffectAnalyzer effectAnalyzer, RangeAnalyzer rangeAnalyzer,
        List<Diagnostic> diagnostics) {
    CallGraph callGraph = CallGraph.build(program);
    EffectEnv effects = effectAnalyzer.analyzeProgram(program, callGraph);
    diagnostics.addAll(effects.diagnostics());
    return new AnalysisResults(logger, program, callGraph, effectAnalyzer,
                               effects, rangeAnalyzer, diagnostics);
  }

  public Program program() {
    return program;
  }

  public CallGraph callGraph() {
    return callGraph;
  }

  public EffectEnv effects() {
    return effects;
  }

  public RangeResults ranges() {
    if (ranges == null) {
      ranges = rangeAnalyzer.analyzeProgram(program, callGraph, effects);
      diagnostics.addAll(ranges.diagnostics());
    }
    return ranges;
  }

  public EffectSet effectOf(Stmt s) {
    return effectAnalyzer.classifyStmt(s, effects);
  }

  public EffectSet effectOf(Expr e) {
    return effectAnalyzer.classifyExpr(e, effects);
  }

  public EffectSet effectOf(Block b) {
    return effectAnalyzer.classifyBlock(b, effects);
  }

  public void report(Diagnostic.Kind kind, String msg) {
    logger.debug(kind + ": " + msg);
    diagnostics.add(new Diagnostic(kind, msg));
  }
}
