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
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

import net.descent.common.math.MatrixUtils;

/**
 * Projection onto the cone of positive semidefinite matrices: eigenvalues of the symmetric input
 * are clamped at zero. Only the lower triangle of the input is read. The weight is unused and
 * the objective is unsupported.
 */
public final class SemidefiniteConeOperator extends AbstractProximalOperator {

  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    Preconditions.checkArgument(point.isSquare(), "Matrix is not square: %s x %s",
                                point.getRowDimension(), point.getColumnDimension());
    EigenDecomposition eigen = new EigenDecomposition(MatrixUtils.symmetricFromLower(point));
    double[] eigenvalues = eigen.getRealEigenvalues();
    double[] clamped = new double[eigenvalues.length];
    for (int i = 0; i < eigenvalues.length; i++) {
      clamped[i] = FastMath.max(eigenvalues[i], 0.0);
    }
    return MatrixUtils.multiplyWithDiagonal(eigen.getV(), clamped, eigen.getVT());
  }

  @Override
  public String toString() {
    return "semidefinite_cone";
  }

}
