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

/**
 * Projection onto the non-negative orthant: negative entries become zero. The weight is unused.
 * The objective is the orthant's indicator function.
 */
public final class NonNegativeOperator extends AbstractProximalOperator {

  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    int rows = point.getRowDimension();
    int cols = point.getColumnDimension();
    RealMatrix result = new Array2DRowRealMatrix(rows, cols);
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < cols; col++) {
        double value = point.getEntry(row, col);
        // NaN is kept
        if (value > 0.0 || Double.isNaN(value)) {
          result.setEntry(row, col, value);
        }
      }
    }
    return result;
  }

  /**
   * @return 0 if all entries are non-negative, {@link Double#POSITIVE_INFINITY} otherwise
   */
  @Override
  public double objective(RealMatrix point) {
    for (int row = 0; row < point.getRowDimension(); row++) {
      for (int col = 0; col < point.getColumnDimension(); col++) {
        if (!(point.getEntry(row, col) >= 0.0)) {
          return Double.POSITIVE_INFINITY;
        }
      }
    }
    return 0.0;
  }

  @Override
  public String toString() {
    return "nonneg";
  }

}
