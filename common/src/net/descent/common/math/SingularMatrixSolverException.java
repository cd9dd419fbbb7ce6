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

/**
 * A {@link SolverException} indicating that the system's matrix is singular, or close enough to
 * singular that a solution is meaningless.
 */
public final class SingularMatrixSolverException extends SolverException {

  private final int apparentRank;

  public SingularMatrixSolverException(int apparentRank, String message) {
    super(message);
    this.apparentRank = apparentRank;
  }

  /**
   * @return the number of linearly independent rows that the matrix appeared to have
   */
  public int getApparentRank() {
    return apparentRank;
  }

}
