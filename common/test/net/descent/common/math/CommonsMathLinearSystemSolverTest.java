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

public final class CommonsMathLinearSystemSolverTest extends DescentTest {

  private final LinearSystemSolver solver = new CommonsMathLinearSystemSolver();

  @Test
  public void testSolve() {
    RealMatrix A = randomMatrix(6, 6).add(MatrixUtils.scaledIdentity(6, 10.0));
    RealMatrix B = randomMatrix(6, 2);
    assertTrue(solver.isNonSingular(A));
    RealMatrix X = solver.getSolver(A).solve(B);
    assertMatrixEquals(B, A.multiply(X), 1.0e-10);
  }

  @Test
  public void testSingular() {
    RealMatrix A = new Array2DRowRealMatrix(new double[][] {{1.0, 2.0, 3.0}, {2.0, 4.0, 6.0}, {0.0, 1.0, 1.0}});
    assertFalse(solver.isNonSingular(A));
    try {
      solver.getSolver(A);
      fail();
    } catch (SingularMatrixSolverException smse) {
      assertEquals(2, smse.getApparentRank());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNotSquare() {
    solver.getSolver(new Array2DRowRealMatrix(2, 3));
  }

}
