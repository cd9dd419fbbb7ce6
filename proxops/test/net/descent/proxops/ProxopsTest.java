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
import org.apache.commons.math3.random.RandomGenerator;
import org.junit.Assert;
import org.junit.Before;

import net.descent.common.random.RandomManager;

public abstract class ProxopsTest extends Assert {

  static final double EPSILON = 1.0e-10;

  @Before
  public void setUp() throws Exception {
    RandomManager.useTestSeed();
  }

  protected static void assertNaN(double d) {
    assertTrue("Expected NaN but got " + d, Double.isNaN(d));
  }

  /**
   * Asserts that two matrices have the same shape and agree entrywise within {@code epsilon}.
   */
  protected static void assertMatrixEquals(RealMatrix expected, RealMatrix actual, double epsilon) {
    assertEquals("rows", expected.getRowDimension(), actual.getRowDimension());
    assertEquals("columns", expected.getColumnDimension(), actual.getColumnDimension());
    for (int row = 0; row < expected.getRowDimension(); row++) {
      assertArrayEquals("row " + row, expected.getRow(row), actual.getRow(row), epsilon);
    }
  }

  protected static RealMatrix matrix(double[]... rows) {
    return new Array2DRowRealMatrix(rows, true);
  }

  protected static RealMatrix row(double... values) {
    return new Array2DRowRealMatrix(new double[][] {values}, true);
  }

  /**
   * @return matrix with entries uniform in [-1,1), from the test-seeded generator
   */
  protected static RealMatrix randomMatrix(int rows, int cols) {
    RandomGenerator random = RandomManager.getRandom();
    RealMatrix M = new Array2DRowRealMatrix(rows, cols);
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        M.setEntry(r, c, 2.0 * random.nextDouble() - 1.0);
      }
    }
    return M;
  }

}
