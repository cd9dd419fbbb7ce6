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
 * Proximal operator for the squared error to a fixed, observed reference. The result is the
 * weighted average {@code (point + reference / weight) / (1 + 1 / weight)}: close to
 * {@code point} for large weights and to the reference for small ones.
 */
public final class SquaredErrorOperator extends AbstractProximalOperator {

  private final RealMatrix reference;

  /**
   * @param reference observed value to stay close to; copied, so later changes to it have no effect
   */
  public SquaredErrorOperator(RealMatrix reference) {
    Preconditions.checkNotNull(reference);
    this.reference = reference.copy();
  }

  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    MatrixUtils.checkSameShape(point, reference);
    return point.add(reference.scalarMultiply(1.0 / weight)).scalarMultiply(1.0 / (1.0 + 1.0 / weight));
  }

  /**
   * @return Euclidean distance from {@code point} to the reference
   */
  @Override
  public double objective(RealMatrix point) {
    return MatrixUtils.distance(reference, point);
  }

  @Override
  public String toString() {
    return "squared_error(" + reference.getRowDimension() + 'x' + reference.getColumnDimension() + ')';
  }

}
