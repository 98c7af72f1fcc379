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

package exm.tinyc.frontend;

import exm.tinyc.common.util.Counters;

/**
 * Hands out structural labels for loops.  Numbers increase
 * monotonically within a compilation unit and are never reused.
 */
public class ControlFlowLabeler {
  private static final String LOOP_COUNTER = "loop";

  public static final String CONTINUE_PREFIX = "loop";
  public static final String BREAK_PREFIX = "break";

  private final Counters<String> counters = new Counters<String>();

  public LoopLabels newLoop() {
    long n = counters.increment(LOOP_COUNTER);
    return new LoopLabels(CONTINUE_PREFIX + n, BREAK_PREFIX + n);
  }

  /**
   * Labels of one loop: branch to the continue label to start the
   * next iteration, to the break label to leave the loop.
   */
  public static class LoopLabels {
    public final String continueLabel;
    public final String breakLabel;

    public LoopLabels(String continueLabel, String breakLabel) {
      this.continueLabel = continueLabel;
      this.breakLabel = breakLabel;
    }

    @Override
    public String toString() {
      return "(" + continueLabel + ", " + breakLabel + ")";
    }
  }
}
