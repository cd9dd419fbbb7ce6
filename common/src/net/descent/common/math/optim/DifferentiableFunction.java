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

package net.descent.common.math.optim;

/**
 * A smooth function that computes its value and gradient together.
 */
public interface DifferentiableFunction {

  /**
   * @param x point at which to evaluate; must not be modified
   * @param gradient array of the same length as {@code x}, overwritten with the gradient at {@code x}
   * @return function value at {@code x}
   */
  double evaluate(double[] x, double[] gradient);

}
