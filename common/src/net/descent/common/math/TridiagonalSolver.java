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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * <p>A {@link Solver} for banded, tridiagonal systems, using the Thomas algorithm (LU factorization
 * without pivoting). The factorization is computed once at construction, and costs O(n), as
 * does each solve. Storage is O(n); the full matrix is never formed.</p>
 *
 * <p>Without pivoting this is stable for diagonally dominant or symmetric positive definite
 * matrices, which is what the smoothing operators produce.</p>
 */
public final class TridiagonalSolver implements Solver {

  private final double[] lower;
  // Pivots of the factorization, and the upper band divided by them
  private final double[] pivots;
  private final double[] scaledUpper;

  /**
   * @param lower sub-diagonal; {@code lower[i]} is entry (i+1, i). Length n-1.
   * @param diagonal diagonal, of length n
   * @param upper super-diagonal; {@code upper[i]} is entry (i, i+1). Length n-1.
   * @throws SingularMatrixSolverException if a pivot is zero, or nearly so relative to the largest entry
   */
  public TridiagonalSolver(double[] lower, double[] diagonal, double[] upper) {
    int n = diagonal.length;
    Preconditions.checkArgument(n > 0, "Empty system");
    Preconditions.checkArgument(lower.length == n - 1 && upper.length == n - 1,
                                "Bands must have length %s", n - 1);
    this.lower = lower.clone();
    double tolerance = LinearSystemSolver.SINGULARITY_THRESHOLD * largestMagnitude(lower, diagonal, upper);
    pivots = new double[n];
    scaledUpper = new double[n - 1];
    for (int i = 0; i < n; i++) {
      double pivot = diagonal[i];
      if (i > 0) {
        pivot -= lower[i - 1] * scaledUpper[i - 1];
      }
      // Also rejects NaN
      if (!(FastMath.abs(pivot) > tolerance)) {
        throw new SingularMatrixSolverException(i, "Zero pivot at row " + i);
      }
      pivots[i] = pivot;
      if (i < n - 1) {
        scaledUpper[i] = upper[i] / pivot;
      }
    }
  }

  private static double largestMagnitude(double[]... bands) {
    double max = 0.0;
    for (double[] band : bands) {
      for (double value : band) {
        max = FastMath.max(max, FastMath.abs(value));
      }
    }
    return max;
  }

  /**
   * @param n dimension
   * @param diagonal value of every diagonal entry
   * @param offDiagonal value of every entry directly above and below the diagonal
   * @return solver for the symmetric tridiagonal Toeplitz matrix with these values
   */
  public static TridiagonalSolver symmetricToeplitz(int n, double diagonal, double offDiagonal) {
    Preconditions.checkArgument(n > 0, "Empty system");
    double[] diag = new double[n];
    Arrays.fill(diag, diagonal);
    double[] off = new double[n - 1];
    Arrays.fill(off, offDiagonal);
    return new TridiagonalSolver(off, diag, off);
  }

  /**
   * @return dimension n of the system
   */
  public int getDimension() {
    return pivots.length;
  }

  @Override
  public double[] solve(double[] b) {
    int n = pivots.length;
    Preconditions.checkArgument(b.length == n, "Expected %s values but got %s", n, b.length);
    double[] x = new double[n];
    // Forward substitution
    x[0] = b[0] / pivots[0];
    for (int i = 1; i < n; i++) {
      x[i] = (b[i] - lower[i - 1] * x[i - 1]) / pivots[i];
    }
    // Back substitution
    for (int i = n - 2; i >= 0; i--) {
      x[i] -= scaledUpper[i] * x[i + 1];
    }
    return x;
  }

  @Override
  public RealMatrix solve(RealMatrix B) {
    Preconditions.checkArgument(B.getRowDimension() == pivots.length,
                                "Expected %s rows but got %s", pivots.length, B.getRowDimension());
    int cols = B.getColumnDimension();
    RealMatrix X = new Array2DRowRealMatrix(pivots.length, cols);
    for (int col = 0; col < cols; col++) {
      X.setColumn(col, solve(B.getColumn(col)));
    }
    return X;
  }

}
