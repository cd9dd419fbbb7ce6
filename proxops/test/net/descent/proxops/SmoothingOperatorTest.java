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
import org.junit.Test;

import net.descent.common.math.MatrixUtils;

public final class SmoothingOperatorTest extends ProxopsTest {

  @Test
  public void testAlongColumns() {
    RealMatrix point = randomMatrix(6, 3);
    RealMatrix expected = MatrixUtils.getSolver(laplacianSystem(6, 0.5, 2.0)).solve(point.scalarMultiply(2.0));
    assertMatrixEquals(expected, new SmoothingOperator(0, 0.5).apply(point, 2.0), 1.0e-10);
  }

  @Test
  public void testAlongRows() {
    RealMatrix point = randomMatrix(3, 7);
    RealMatrix expected = MatrixUtils.getSolver(laplacianSystem(7, 3.0, 0.25))
        .solve(point.transpose().scalarMultiply(0.25)).transpose();
    RealMatrix result = new SmoothingOperator(1, 3.0).apply(point, 0.25);
    assertEquals(3, result.getRowDimension());
    assertEquals(7, result.getColumnDimension());
    assertMatrixEquals(expected, result, 1.0e-10);
  }

  @Test
  public void testTinyPenaltyAndWeight() {
    // Scaling penalty and weight together leaves the solution unchanged
    RealMatrix point = randomMatrix(4, 2);
    RealMatrix expected = new SmoothingOperator(0, 1.0).apply(point, 1.0);
    assertMatrixEquals(expected, new SmoothingOperator(0, 1.0e-13).apply(point, 1.0e-13), 1.0e-10);
  }

  @Test
  public void testReducesRoughness() {
    RealMatrix point = randomMatrix(20, 1);
    RealMatrix smoothed = new SmoothingOperator(0, 10.0).apply(point, 1.0);
    assertTrue(roughness(smoothed) < roughness(point));
  }

  @Test
  public void testObjectiveUnsupported() {
    assertNaN(new SmoothingOperator(0, 1.0).objective(randomMatrix(3, 3)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBadAxis() {
    new SmoothingOperator(2, 1.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroPenalty() {
    new SmoothingOperator(0, 0.0);
  }

  /**
   * @return penalty * tridiag(-1, 2 + weight / penalty, -1), densely
   */
  private static RealMatrix laplacianSystem(int n, double penalty, double weight) {
    RealMatrix M = new Array2DRowRealMatrix(n, n);
    for (int i = 0; i < n; i++) {
      M.setEntry(i, i, penalty * (2.0 + weight / penalty));
      if (i > 0) {
        M.setEntry(i, i - 1, -penalty);
        M.setEntry(i - 1, i, -penalty);
      }
    }
    return M;
  }

  private static double roughness(RealMatrix column) {
    double total = 0.0;
    for (int i = 1; i < column.getRowDimension(); i++) {
      double d = column.getEntry(i, 0) - column.getEntry(i - 1, 0);
      total += d * d;
    }
    return total;
  }

}
