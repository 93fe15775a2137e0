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

import org.apache.log4j.Logger;

import exm.lgc.ir.tree.Program;

/**
 * An optimizer pass.  Passes never modify their input: they return a new
 * program built from fresh nodes, or the input if nothing changed.
 */
public interface OptimizerPass {
  public abstract String getPassName();
  /**
   * @return Key indicating whether pass is enabled.  If null, always enabled
   */
  public abstract String getConfigEnabledKey();
  /**
   * @param analyses fresh analyses of exactly this program
   */
  public abstract Program optimize(Logger logger, Program program,
                                   AnalysisResults analyses);
}
