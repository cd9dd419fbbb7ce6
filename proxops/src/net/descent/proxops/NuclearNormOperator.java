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

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.FastMath;

import net.descent.common.math.MatrixUtils;

/**
 * Proximal operator for the nuclear norm (sum of singular values) of a matrix, scaled by a penalty.
 * Applying it soft-thresholds the singular values by {@code penalty / weight}.
 */
public final class NuclearNormOperator extends AbstractProximalOperator {

  private final double penalty;

  /**
   * @param penalty weight on the nuclear norm; non-negative
   */
  public NuclearNormOperator(double penalty) {
    this.penalty = checkPenalty(penalty, true);
  }

  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    SingularValueDecomposition svd = new SingularValueDecomposition(point);
    double threshold = penalty / weight;
    double[] singularValues = svd.getSingularValues();
    double[] thresholded = new double[singularValues.length];
    for (int i = 0; i < singularValues.length; i++) {
      thresholded[i] = FastMath.max(singularValues[i] - threshold, 0.0);
    }
    return MatrixUtils.multiplyWithDiagonal(svd.getU(), thresholded, svd.getVT());
  }

  /**
   * @return the nuclear norm of {@code point}
   */
  @Override
  public double objective(RealMatrix point) {
    double total = 0.0;
    for (double singularValue : new SingularValueDecomposition(point).getSingularValues()) {
      total += singularValue;
    }
    return total;
  }

  @Override
  public String toString() {
    return "nucnorm(penalty=" + penalty + ')';
  }

}
