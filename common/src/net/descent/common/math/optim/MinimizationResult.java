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

import java.util.Arrays;

/**
 * Outcome of {@link LbfgsbMinimizer#minimize(double[])}: the final iterate and how it was reached.
 */
public final class MinimizationResult {

  private final double[] point;
  private final double value;
  private final MinimizationStatus status;
  private final int iterations;
  private final int evaluations;

  MinimizationResult(double[] point, double value, MinimizationStatus status, int iterations, int evaluations) {
    this.point = point;
    this.value = value;
    this.status = status;
    this.iterations = iterations;
    this.evaluations = evaluations;
  }

  /**
   * @return copy of the final iterate
   */
  public double[] getPoint() {
    return point.clone();
  }

  /**
   * @return function value at {@link #getPoint()}
   */
  public double getValue() {
    return value;
  }

  public MinimizationStatus getStatus() {
    return status;
  }

  public int getIterations() {
    return iterations;
  }

  /**
   * @return number of times the function and gradient were evaluated
   */
  public int getEvaluations() {
    return evaluations;
  }

  @Override
  public String toString() {
    return status + " after " + iterations + " iterations (" + evaluations + " evaluations): f=" + value +
        " at " + Arrays.toString(point);
  }

}
