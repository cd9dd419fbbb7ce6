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


package net.descent.common.math;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import net.descent.common.DescentTest;

/**
 * Tests {@link TridiagonalSolver} against a dense solve.
 */
public final class TridiagonalSolverTest extends DescentTest {

  @Test
  public void testMatchesDenseSolve() {
    double[] lower = {-1.0, 0.5, 2.0, -0.25};
    double[] diagonal = {4.0, 5.0, -6.0, 7.0, 3.0};
    double[] upper = {1.0, -2.0, 0.5, 1.5};
    RealMatrix dense = new Array2DRowRealMatrix(5, 5);
    for (int i = 0; i < 5; i++) {
      dense.setEntry(i, i, diagonal[i]);
      if (i < 4) {
        dense.setEntry(i + 1, i, lower[i]);
        dense.setEntry(i, i + 1, upper[i]);
      }
    }
    RealMatrix B = randomMatrix(5, 3);
    RealMatrix expected = MatrixUtils.getSolver(dense).solve(B);
    TridiagonalSolver solver = new TridiagonalSolver(lower, diagonal, upper);
    assertEquals(5, solver.getDimension());
    assertMatrixEquals(expected, solver.solve(B), 1.0e-10);
    assertMatrixEquals(B, dense.multiply(solver.solve(B)), 1.0e-10);
  }

  @Test
  public void testSymmetricToeplitz() {
    TridiagonalSolver solver = TridiagonalSolver.symmetricToeplitz(3, 2.0, -1.0);
    // [2 -1 0; -1 2 -1; 0 -1 2] * [1 1 1]' = [1 0 1]'
    assertArrayEquals(new double[] {1.0, 1.0, 1.0}, solver.solve(new double[] {1.0, 0.0, 1.0}), 1.0e-12);
  }

  @Test
  public void testOneByOne() {
    TridiagonalSolver solver = TridiagonalSolver.symmetricToeplitz(1, 4.0, 1.0);
    assertArrayEquals(new double[] {0.5}, solver.solve(new double[] {2.0}), 1.0e-12);
  }

  @Test
  public void testTinyScale() {
    double[] b = {1.0, 0.0, 1.0, 2.0};
    double[] unit = TridiagonalSolver.symmetricToeplitz(4, 2.5, -1.0).solve(b);
    double[] tiny = TridiagonalSolver.symmetricToeplitz(4, 2.5e-14, -1.0e-14).solve(b);
    for (int i = 0; i < b.length; i++) {
      assertEquals(unit[i], tiny[i] * 1.0e-14, 1.0e-10);
    }
  }

  @Test(expected = SingularMatrixSolverException.class)
  public void testNaNPivot() {
    TridiagonalSolver.symmetricToeplitz(2, Double.NaN, 1.0);
  }

  @Test(expected = SingularMatrixSolverException.class)
  public void testZeroPivot() {
    new TridiagonalSolver(new double[] {1.0}, new double[] {1.0, 1.0}, new double[] {1.0});
  }

  @Test(expected = IllegalArgumentException.class)
  public void testWrongLength() {
    TridiagonalSolver.symmetricToeplitz(3, 2.0, -1.0).solve(new double[2]);
  }

}
