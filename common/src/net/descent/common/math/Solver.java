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

import org.apache.commons.math3.linear.RealMatrix;

/**
 * A solver for the system Ax = b, where A is an n x n matrix and x and b are n-element vectors,
 * or n x k matrices whose columns are solved independently.
 * An implementation of this class encapsulates a solver which implicitly contains A.
 */
public interface Solver {

  /**
   * Solves a linear system Ax = b, where {@code A} is implicit in this instance.
   *
   * @param b vector, as {@code double} array; not modified
   * @return x as newly allocated {@code double} array
   */
  double[] solve(double[] b);

  /**
   * Like {@link #solve(double[])}, for each column of {@code B}.
   *
   * @param B n x k matrix; not modified
   * @return X, a newly allocated n x k matrix, such that AX = B
   */
  RealMatrix solve(RealMatrix B);

}
