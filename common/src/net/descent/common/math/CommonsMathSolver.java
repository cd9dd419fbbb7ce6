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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Encapsulates a {@link DecompositionSolver} from Commons Math.
 */
final class CommonsMathSolver implements Solver {

  private final DecompositionSolver solver;

  CommonsMathSolver(DecompositionSolver solver) {
    this.solver = solver;
  }

  @Override
  public double[] solve(double[] b) {
    RealVector vec = solver.solve(new ArrayRealVector(b, true));
    return vec.toArray();
  }

  @Override
  public RealMatrix solve(RealMatrix B) {
    return solver.solve(B);
  }

}
