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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import net.descent.common.math.MatrixUtils;

/**
 * Proximal operator for the L1 norm, scaled by a penalty: soft thresholding. Entries above
 * {@code penalty / weight} move down by it, entries below its negative move up by it, and
 * the rest become zero. NaN entries stay NaN.
 */
public final class SparseOperator extends AbstractProximalOperator {

  private final double penalty;

  /**
   * @param penalty weight on the L1 norm; non-negative
   */
  public SparseOperator(double penalty) {
    this.penalty = checkPenalty(penalty, true);
  }

  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    double threshold = penalty / weight;
    int rows = point.getRowDimension();
    int cols = point.getColumnDimension();
    RealMatrix result = new Array2DRowRealMatrix(rows, cols);
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < cols; col++) {
        double value = point.getEntry(row, col);
        if (value >= threshold) {
          result.setEntry(row, col, value - threshold);
        } else if (value <= -threshold) {
          result.setEntry(row, col, value + threshold);
        } else if (Double.isNaN(value)) {
          result.setEntry(row, col, value);
        }
      }
    }
    return result;
  }

  /**
   * @return sum of absolute values of entries of {@code point}
   */
  @Override
  public double objective(RealMatrix point) {
    return MatrixUtils.sumOfAbsoluteValues(point);
  }

  @Override
  public String toString() {
    return "sparse(penalty=" + penalty + ')';
  }

}
