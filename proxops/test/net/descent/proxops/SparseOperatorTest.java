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
import org.junit.Test;

public final class SparseOperatorTest extends ProxopsTest {

  @Test
  public void testSoftThreshold() {
    RealMatrix result = new SparseOperator(1.0).apply(row(-3.0, -0.5, 0.0, 0.5, 3.0), 1.0);
    assertArrayEquals(new double[] {-2.0, 0.0, 0.0, 0.0, 2.0}, result.getRow(0), EPSILON);
  }

  @Test
  public void testThresholdScalesWithWeight() {
    ProximalOperator sparse = new SparseOperator(2.0);
    assertArrayEquals(new double[] {4.5, -4.5, 0.0, 0.0},
                      sparse.apply(row(5.0, -5.0, 0.5, -0.25), 4.0).getRow(0), EPSILON);
    assertArrayEquals(new double[] {4.5, -4.5, 0.5, -0.5},
                      sparse.apply(row(5.0, -5.0, 1.0, -1.0), 4.0).getRow(0), EPSILON);
    assertArrayEquals(new double[] {3.0, -3.0, 0.0, 0.0},
                      sparse.apply(row(5.0, -5.0, 1.0, -1.0), 1.0).getRow(0), EPSILON);
  }

  @Test
  public void testNaNKept() {
    RealMatrix result = new SparseOperator(1.0).apply(row(Double.NaN, 3.0), 1.0);
    assertNaN(result.getEntry(0, 0));
    assertEquals(2.0, result.getEntry(0, 1), EPSILON);
  }

  @Test
  public void testZeroPenaltyIsIdentity() {
    RealMatrix point = randomMatrix(3, 4);
    assertMatrixEquals(point, new SparseOperator(0.0).apply(point, 2.0), 0.0);
  }

  @Test
  public void testObjective() {
    assertEquals(6.0, new SparseOperator(1.0).objective(matrix(new double[] {1.0, -2.0}, new double[] {0.0, 3.0})),
                 EPSILON);
  }

  @Test
  public void testDoesNotModifyPoint() {
    RealMatrix point = row(-3.0, 3.0);
    new SparseOperator(1.0).apply(point, 1.0);
    assertArrayEquals(new double[] {-3.0, 3.0}, point.getRow(0), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativePenalty() {
    new SparseOperator(-1.0);
  }

  @Test
  public void testToString() {
    assertEquals("sparse(penalty=2.0)", new SparseOperator(2.0).toString());
  }

}
