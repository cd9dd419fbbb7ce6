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
 * A bare proximal mapping: given a point and a positive weight, returns the mapped point.
 * Mappings supplied directly to {@link ProximalOperators#resolve(Object)} are wrapped so that they
 * satisfy the full {@link ProximalOperator} contract.
 */
public interface ProximalMapping {

  /**
   * @param point current point; must not be modified
   * @param weight positive quadratic penalty weight; larger values keep the result closer to {@code point}
   * @return newly allocated mapped point, of the same shape as {@code point}
   */
  RealMatrix apply(RealMatrix point, double weight);

}
