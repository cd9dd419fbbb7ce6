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

import net.descent.common.LangUtils;

/**
 * Superclass for the built-in operators. {@link #apply(RealMatrix, double)} checks its arguments the
 * same way for every operator, then delegates to {@link #doApply(RealMatrix, double)}. The objective is
 * unsupported ({@link Double#NaN}) unless overridden.
 */
public abstract class AbstractProximalOperator implements ProximalOperator {

  /**
   * @throws NullPointerException if {@code point} is null
   * @throws IllegalArgumentException if {@code weight} is not positive and finite
   */
  @Override
  public final RealMatrix apply(RealMatrix point, double weight) {
    Preconditions.checkNotNull(point, "No point");
    checkWeight(weight);
    return doApply(point, weight);
  }

  /**
   * @param point current point, not null; must not be modified
   * @param weight positive, finite weight
   * @return newly allocated result
   */
  protected abstract RealMatrix doApply(RealMatrix point, double weight);

  @Override
  public double objective(RealMatrix point) {
    return Double.NaN;
  }

  static void checkWeight(double weight) {
    Preconditions.checkArgument(weight > 0.0 && LangUtils.isFinite(weight),
                                "Weight must be positive and finite: %s", weight);
  }

  static double checkPenalty(double penalty, boolean allowZero) {
    Preconditions.checkArgument(LangUtils.isFinite(penalty) && (allowZero ? penalty >= 0.0 : penalty > 0.0),
                                "Bad penalty: %s", penalty);
    return penalty;
  }

}
