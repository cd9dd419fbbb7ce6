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
 * <p>A proximal operator for some function f: {@link #apply(RealMatrix, double)} returns</p>
 *
 * <pre>
 *   argmin_x  f(x) + (weight / 2) ||x - point||^2
 * </pre>
 *
 * <p>and {@link #objective(RealMatrix)} evaluates f itself, for monitoring.</p>
 *
 * <p>Implementations hold only immutable parameters set at construction. {@code apply} is a
 * deterministic function of those parameters and its arguments, and never modifies its input.
 * Distinct instances may be used concurrently. Unless an implementation says otherwise,
 * concurrent calls on the same instance are safe too.</p>
 */
public interface ProximalOperator extends ProximalMapping {

  /**
   * @param point point at which to evaluate
   * @return value of f at {@code point}; {@link Double#POSITIVE_INFINITY} when a hard constraint
   *  is violated, or {@link Double#NaN} if this operator can't evaluate f
   */
  double objective(RealMatrix point);

}
