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

package net.descent.proxops;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.RealMatrix;

import net.descent.common.math.TridiagonalSolver;

/**
 * <p>Proximal operator for a squared L2 roughness penalty along one axis of a matrix: axis 0 smooths
 * down each column, axis 1 along each row. Applying it solves the tridiagonal system</p>
 *
 * <pre>
 *   penalty * tridiag(-1, 2 + weight / penalty, -1) x = weight * point
 * </pre>
 *
 * <p>with the chosen axis leading. The objective is not yet supported.</p>
 */
public final class SmoothingOperator extends AbstractProximalOperator {

  private final int axis;
  private final double penalty;

  /**
   * @param axis 0 to smooth along rows (down columns), 1 to smooth along columns (across rows)
   * @param penalty strength of smoothing; positive
   */
  public SmoothingOperator(int axis, double penalty) {
    Preconditions.checkArgument(axis == 0 || axis == 1, "Axis must be 0 or 1: %s", axis);
    this.axis = axis;
    this.penalty = checkPenalty(penalty, false);
  }

  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    RealMatrix rotated = axis == 0 ? point : point.transpose();
    TridiagonalSolver solver = TridiagonalSolver.symmetricToeplitz(rotated.getRowDimension(),
                                                                   penalty * (2.0 + weight / penalty),
                                                                   -penalty);
    RealMatrix smoothed = solver.solve(rotated.scalarMultiply(weight));
    return axis == 0 ? smoothed : smoothed.transpose();
  }

  @Override
  public String toString() {
    return "smooth(axis=" + axis + ", penalty=" + penalty + ')';
  }

}
