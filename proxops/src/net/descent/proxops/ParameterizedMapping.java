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
 * A proximal mapping that needs extra arguments. {@link ProximalOperators#resolve(Object, OperatorArguments)}
 * binds the arguments once, producing an operator whose {@code apply} passes them along on every call.
 */
public interface ParameterizedMapping {

  /**
   * @param point current point; must not be modified
   * @param weight positive quadratic penalty weight
   * @param arguments arguments bound at resolution time
   * @return newly allocated mapped point, of the same shape as {@code point}
   */
  RealMatrix apply(RealMatrix point, double weight, OperatorArguments arguments);

}
