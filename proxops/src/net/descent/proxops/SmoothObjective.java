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

/**
 * A smooth function and its gradient, the input to {@link LbfgsOperator}.
 */
public interface SmoothObjective {

  /**
   * @param theta point at which to evaluate; must not be modified
   * @return value and gradient at {@code theta}
   */
  Evaluation evaluate(RealMatrix theta);

  /**
   * Value of a {@link SmoothObjective} and its gradient, which has the shape of the point.
   */
  final class Evaluation {

    private final double value;
    private final RealMatrix gradient;

    public Evaluation(double value, RealMatrix gradient) {
      this.value = value;
      this.gradient = gradient;
    }

    public double getValue() {
      return value;
    }

    public RealMatrix getGradient() {
      return gradient;
    }

  }

}
