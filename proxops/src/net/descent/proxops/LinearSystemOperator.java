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

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.RealMatrix;

import net.descent.common.math.MatrixUtils;

/**
 * <p>Proximal operator for the least squares objective</p>
 *
 * <pre>
 *   f(x) = (1/2) ||Ax - b||^2
 * </pre>
 *
 * <p>Applying it solves the regularized normal equations
 * {@code (weight I + A'A) x = weight point + A'b}. {@code A'A} and {@code A'b} are computed once,
 * at construction. {@code b} may have several columns, in which case each is an independent
 * right-hand side and the norm is the Frobenius norm.</p>
 */
public final class LinearSystemOperator extends AbstractProximalOperator {

  private final RealMatrix A;
  private final RealMatrix b;
  private final RealMatrix AtA;
  private final RealMatrix Atb;

  /**
   * @param A m x n sensing matrix; copied
   * @param b m x k responses; copied
   */
  public LinearSystemOperator(RealMatrix A, RealMatrix b) {
    Preconditions.checkNotNull(A);
    Preconditions.checkNotNull(b);
    Preconditions.checkArgument(A.getRowDimension() == b.getRowDimension(),
                                "A has %s rows but b has %s", A.getRowDimension(), b.getRowDimension());
    this.A = A.copy();
    this.b = b.copy();
    RealMatrix At = A.transpose();
    AtA = At.multiply(A);
    Atb = At.multiply(b);
  }

  /**
   * @throws net.descent.common.math.SingularMatrixSolverException if the system can't be solved
   */
  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    MatrixUtils.checkSameShape(point, Atb);
    RealMatrix system = AtA.add(MatrixUtils.scaledIdentity(AtA.getRowDimension(), weight));
    RealMatrix rhs = point.scalarMultiply(weight).add(Atb);
    return MatrixUtils.getSolver(system).solve(rhs);
  }

  /**
   * @return half the squared norm of the residual {@code A point - b}
   */
  @Override
  public double objective(RealMatrix point) {
    double residualNorm = A.multiply(point).subtract(b).getFrobeniusNorm();
    return 0.5 * residualNorm * residualNorm;
  }

  @Override
  public String toString() {
    return "linsys(" + A.getRowDimension() + 'x' + A.getColumnDimension() + ')';
  }

}
