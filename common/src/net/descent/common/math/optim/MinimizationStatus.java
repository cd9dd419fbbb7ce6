/*
 * Copyright Descent Contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.descent.common.math.optim;

/**
 * Why a minimization stopped.
 */
public enum MinimizationStatus {

  /** Projected gradient fell below the gradient tolerance. */
  GRADIENT_TOLERANCE_REACHED(true),
  /** Relative reduction in function value fell below the function tolerance. */
  FUNCTION_TOLERANCE_REACHED(true),
  /** The iteration budget ran out first. */
  MAX_ITERATIONS_REACHED(false),
  /** No step along the search direction produced sufficient decrease. */
  LINE_SEARCH_FAILED(false);

  private final boolean converged;

  MinimizationStatus(boolean converged) {
    this.converged = converged;
  }

  public boolean isConverged() {
    return converged;
  }

}
