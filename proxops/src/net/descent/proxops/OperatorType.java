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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The built-in operators that {@link ProximalOperators} can construct by name, with the names of
 * their constructor parameters in positional order.
 */
public enum OperatorType {

  /** Nuclear norm penalty; see {@link NuclearNormOperator}. */
  NUCNORM("nucnorm", 1, "penalty"),
  /** L1 norm penalty; see {@link SparseOperator}. */
  SPARSE("sparse", 1, "penalty"),
  /** Non-negative orthant; see {@link NonNegativeOperator}. */
  NONNEG("nonneg", 0),
  /** Least squares Ax = b; see {@link LinearSystemOperator}. */
  LINSYS("linsys", 2, "A", "b"),
  /** Squared error to a reference; see {@link SquaredErrorOperator}. */
  SQUARED_ERROR("squared_error", 1, "x_obs"),
  /** Smooth function, minimized by L-BFGS; see {@link LbfgsOperator}. */
  LBFGS("lbfgs", 1, "f_df", "numiter"),
  /** Total variation; see {@link TotalVariationOperator}. */
  TVD("tvd", 1, "penalty"),
  /** Laplacian smoothing along an axis; see {@link SmoothingOperator}. */
  SMOOTH("smooth", 2, "axis", "penalty"),
  /** Positive semidefinite cone; see {@link SemidefiniteConeOperator}. */
  SEMIDEFINITE_CONE("semidefinite_cone", 0);

  private final String operatorName;
  private final int requiredCount;
  private final List<String> parameterNames;

  OperatorType(String operatorName, int requiredCount, String... parameterNames) {
    this.operatorName = operatorName;
    this.requiredCount = requiredCount;
    this.parameterNames = ImmutableList.copyOf(parameterNames);
  }

  /**
   * @return name by which the operator is requested
   */
  public String getOperatorName() {
    return operatorName;
  }

  /**
   * @return all parameter names, required ones first
   */
  public List<String> getParameterNames() {
    return parameterNames;
  }

  /**
   * @return number of leading parameters in {@link #getParameterNames()} that must be given
   */
  public int getRequiredCount() {
    return requiredCount;
  }

  BoundArguments bind(OperatorArguments arguments) {
    return arguments.bind(operatorName, parameterNames, requiredCount);
  }

}
