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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.descent.common.ClassUtils;

/**
 * Contains utility methods for dealing with dense matrices, which are here represented as
 * {@link RealMatrix}es. Vectors are represented as n x 1 column matrices.
 */
public final class MatrixUtils {

  private static final Logger log = LoggerFactory.getLogger(MatrixUtils.class);

  private static final LinearSystemSolver MATRIX_SOLVER;
  static {
    String solverClassName =
        System.getProperty("common.matrix.solver", CommonsMathLinearSystemSolver.class.getName());
    MATRIX_SOLVER = ClassUtils.loadInstanceOf(solverClassName, LinearSystemSolver.class);
    log.debug("Using linear system solver {}", solverClassName);
  }

  private MatrixUtils() {
  }

  /**
   * @param A square matrix
   * @return a {@link Solver} for A, from the configured {@link LinearSystemSolver}
   * @throws SingularMatrixSolverException if A is singular
   */
  public static Solver getSolver(RealMatrix A) {
    return MATRIX_SOLVER.getSolver(A);
  }

  /**
   * @param values vector entries
   * @return a new n x 1 column matrix holding a copy of {@code values}
   */
  public static RealMatrix columnVector(double... values) {
    Preconditions.checkArgument(values.length > 0, "Empty vector");
    RealMatrix result = new Array2DRowRealMatrix(values.length, 1);
    result.setColumn(0, values);
    return result;
  }

  /**
   * @throws IllegalArgumentException if the matrices don't have the same dimensions
   */
  public static void checkSameShape(RealMatrix a, RealMatrix b) {
    Preconditions.checkArgument(
        a.getRowDimension() == b.getRowDimension() && a.getColumnDimension() == b.getColumnDimension(),
        "Shape mismatch: %s x %s vs %s x %s",
        a.getRowDimension(), a.getColumnDimension(), b.getRowDimension(), b.getColumnDimension());
  }

  /**
   * @return entries of M in row-major order, as a new array
   */
  public static double[] flatten(RealMatrix M) {
    int rows = M.getRowDimension();
    int cols = M.getColumnDimension();
    double[] result = new double[rows * cols];
    int offset = 0;
    for (int row = 0; row < rows; row++) {
      for (int col = 0; col < cols; col++) {
        result[offset++] = M.getEntry(row, col);
      }
    }
    return result;
  }

  /**
   * Inverse of {@link #flatten(RealMatrix)}.
   *
   * @param values entries in row-major order
   * @param rows number of rows of the result
   * @param cols number of columns of the result
   * @return a new {@code rows x cols} matrix
   */
  public static RealMatrix unflatten(double[] values, int rows, int cols) {
    Preconditions.checkArgument(values.length == rows * cols,
                                "Can't shape %s values as %s x %s", values.length, rows, cols);
    double[][] data = new double[rows][cols];
    int offset = 0;
    for (double[] dataRow : data) {
      System.arraycopy(values, offset, dataRow, 0, cols);
      offset += cols;
    }
    return new Array2DRowRealMatrix(data, false);
  }

  /**
   * @return sum of absolute values of all entries of M (the entrywise L1 norm)
   */
  public static double sumOfAbsoluteValues(RealMatrix M) {
    double total = 0.0;
    for (int row = 0; row < M.getRowDimension(); row++) {
      for (int col = 0; col < M.getColumnDimension(); col++) {
        total += FastMath.abs(M.getEntry(row, col));
      }
    }
    return total;
  }

  /**
   * @return the Euclidean distance between M and N, viewed as flat vectors
   */
  public static double distance(RealMatrix M, RealMatrix N) {
    checkSameShape(M, N);
    return M.subtract(N).getFrobeniusNorm();
  }

  /**
   * @param U m x p matrix
   * @param s p diagonal values
   * @param VT p x n matrix
   * @return U * diag(s) * VT as a new m x n matrix
   */
  public static RealMatrix multiplyWithDiagonal(RealMatrix U, double[] s, RealMatrix VT) {
    Preconditions.checkArgument(U.getColumnDimension() == s.length && VT.getRowDimension() == s.length,
                                "Inner dimensions don't match %s", s.length);
    RealMatrix scaled = U.copy();
    for (int row = 0; row < scaled.getRowDimension(); row++) {
      for (int col = 0; col < s.length; col++) {
        scaled.multiplyEntry(row, col, s[col]);
      }
    }
    return scaled.multiply(VT);
  }

  /**
   * @param M square matrix
   * @return a new symmetric matrix with the lower triangle (and diagonal) of M, mirrored into
   *  the upper triangle
   */
  public static RealMatrix symmetricFromLower(RealMatrix M) {
    Preconditions.checkArgument(M.isSquare(), "Matrix is not square: %s x %s",
                                M.getRowDimension(), M.getColumnDimension());
    int n = M.getRowDimension();
    RealMatrix result = new Array2DRowRealMatrix(n, n);
    for (int row = 0; row < n; row++) {
      for (int col = 0; col <= row; col++) {
        double value = M.getEntry(row, col);
        result.setEntry(row, col, value);
        result.setEntry(col, row, value);
      }
    }
    return result;
  }

  /**
   * @param n dimension
   * @param value diagonal value
   * @return n x n matrix with {@code value} on the diagonal
   */
  public static RealMatrix scaledIdentity(int n, double value) {
    RealMatrix result = new Array2DRowRealMatrix(n, n);
    for (int i = 0; i < n; i++) {
      result.setEntry(i, i, value);
    }
    return result;
  }

}
