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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.descent.common.LangUtils;
import net.descent.common.math.MatrixUtils;
import net.descent.common.math.SimpleVectorMath;
import net.descent.common.math.SolverException;
import net.descent.common.math.optim.DifferentiableFunction;
import net.descent.common.math.optim.LbfgsbMinimizer;
import net.descent.common.math.optim.MinimizationResult;
import net.descent.common.math.optim.MinimizationStatus;

/**
 * <p>Proximal operator for a general smooth function f, given as a {@link SmoothObjective}. Applying
 * it runs a bounded number of L-BFGS iterations on</p>
 *
 * <pre>
 *   f(theta) + (weight / 2) ||theta - point||^2
 * </pre>
 *
 * <p>starting from {@code point}, and returns the last iterate. The number of corrections kept is
 * set by the {@code proxops.lbfgs.corrections} system property (default 10).</p>
 *
 * <p>The point and weight of each call live only in that call. This class is not safe for
 * concurrent calls to {@link #apply(RealMatrix, double)} on the same instance, since it can't vouch
 * for the {@link SmoothObjective}; calls on different instances are independent.</p>
 */
public final class LbfgsOperator extends AbstractProximalOperator {

  private static final Logger log = LoggerFactory.getLogger(LbfgsOperator.class);

  public static final int DEFAULT_ITERATIONS = 20;

  private static final int CORRECTIONS =
      LangUtils.getPositiveIntProperty("proxops.lbfgs.corrections", LbfgsbMinimizer.DEFAULT_CORRECTIONS);

  private final SmoothObjective smoothObjective;
  private final int maxIterations;

  public LbfgsOperator(SmoothObjective smoothObjective) {
    this(smoothObjective, DEFAULT_ITERATIONS);
  }

  /**
   * @param smoothObjective f and its gradient
   * @param maxIterations maximum number of L-BFGS iterations per {@code apply}
   */
  public LbfgsOperator(SmoothObjective smoothObjective, int maxIterations) {
    Preconditions.checkNotNull(smoothObjective);
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive: %s", maxIterations);
    this.smoothObjective = smoothObjective;
    this.maxIterations = maxIterations;
  }

  /**
   * @throws SolverException if f or its gradient is not finite where the minimizer evaluates it
   */
  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    int rows = point.getRowDimension();
    int cols = point.getColumnDimension();
    double[] reference = MatrixUtils.flatten(point);
    AugmentedObjective augmented = new AugmentedObjective(smoothObjective, reference, weight, rows, cols);
    LbfgsbMinimizer minimizer = LbfgsbMinimizer.builder()
        .function(augmented)
        .dimension(reference.length)
        .corrections(CORRECTIONS)
        .maxIterations(maxIterations)
        .build();
    MinimizationResult result = minimizer.minimize(reference);
    if (result.getStatus() == MinimizationStatus.LINE_SEARCH_FAILED) {
      log.warn("Line search failed after {} iterations; returning last iterate", result.getIterations());
    } else {
      log.debug("L-BFGS stopped: {} after {} iterations", result.getStatus(), result.getIterations());
    }
    return MatrixUtils.unflatten(result.getPoint(), rows, cols);
  }

  /**
   * @return f at {@code point}, without the quadratic term
   */
  @Override
  public double objective(RealMatrix point) {
    return smoothObjective.evaluate(point.copy()).getValue();
  }

  @Override
  public String toString() {
    return "lbfgs(numiter=" + maxIterations + ')';
  }

  /**
   * f plus the quadratic term anchoring it to one call's point and weight, over flattened matrices.
   */
  private static final class AugmentedObjective implements DifferentiableFunction {

    private final SmoothObjective smoothObjective;
    private final double[] reference;
    private final double weight;
    private final int rows;
    private final int cols;

    AugmentedObjective(SmoothObjective smoothObjective, double[] reference, double weight, int rows, int cols) {
      this.smoothObjective = smoothObjective;
      this.reference = reference;
      this.weight = weight;
      this.rows = rows;
      this.cols = cols;
    }

    @Override
    public double evaluate(double[] x, double[] gradient) {
      SmoothObjective.Evaluation evaluation = smoothObjective.evaluate(MatrixUtils.unflatten(x, rows, cols));
      RealMatrix objectiveGradient = evaluation.getGradient();
      if (objectiveGradient == null ||
          objectiveGradient.getRowDimension() != rows ||
          objectiveGradient.getColumnDimension() != cols) {
        throw new SolverException("Gradient must be a " + rows + " x " + cols + " matrix");
      }
      double[] df = MatrixUtils.flatten(objectiveGradient);
      for (int i = 0; i < x.length; i++) {
        gradient[i] = df[i] + weight * (x[i] - reference[i]);
      }
      return evaluation.getValue() + 0.5 * weight * SimpleVectorMath.distanceSquared(x, reference);
    }
  }

}
