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

import java.util.Arrays;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.descent.common.LangUtils;
import net.descent.common.math.SimpleVectorMath;
import net.descent.common.math.SolverException;

/**
 * <p>Limited-memory BFGS minimization with simple bounds on each variable:</p>
 *
 * <pre>
 *   minimize f(x)
 *   subject to l &lt;= x &lt;= u
 * </pre>
 *
 * <p>This is a projected quasi-Newton method. The search direction comes from the usual two-loop
 * recursion over the last few corrections; components that would push a variable already at a
 * bound further outside are dropped, and trial points are projected back onto the box before the
 * Armijo backtracking test.</p>
 *
 * <p>Instances are immutable. Each call to {@link #minimize(double[])} allocates its own working
 * storage, so one instance may be used from several threads as long as its
 * {@link DifferentiableFunction} is safe to call from several threads.</p>
 */
public final class LbfgsbMinimizer {

  private static final Logger log = LoggerFactory.getLogger(LbfgsbMinimizer.class);

  public static final int DEFAULT_CORRECTIONS = 10;
  public static final int DEFAULT_MAX_ITERATIONS = 15000;
  /** Relative reduction in f below which minimization stops; about 1e7 times machine epsilon. */
  public static final double DEFAULT_FUNCTION_TOLERANCE = 2.220446049250313e-9;
  public static final double DEFAULT_GRADIENT_TOLERANCE = 1.0e-5;

  private static final double ARMIJO_FACTOR = 1.0e-4;
  private static final int MAX_BACKTRACKS = 40;
  private static final double CURVATURE_EPSILON = 2.2e-16;

  private final DifferentiableFunction function;
  private final int dimension;
  private final int corrections;
  private final int maxIterations;
  private final double functionTolerance;
  private final double gradientTolerance;
  private final Bound[] bounds;

  private LbfgsbMinimizer(Builder builder) {
    this.function = builder.function;
    this.dimension = builder.dimension;
    this.corrections = builder.corrections;
    this.maxIterations = builder.maxIterations;
    this.functionTolerance = builder.functionTolerance;
    this.gradientTolerance = builder.gradientTolerance;
    if (builder.bounds == null) {
      bounds = new Bound[dimension];
      Arrays.fill(bounds, Bound.unbounded());
    } else {
      bounds = builder.bounds.clone();
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public int getDimension() {
    return dimension;
  }

  /**
   * @param initialPoint starting point; not modified. It is first projected onto the bounds.
   * @return the last iterate and why minimization stopped. Running out of iterations or a failed
   *  line search is reported in the result's status, not thrown.
   * @throws SolverException if the function value or gradient is not finite at an accepted point
   */
  public MinimizationResult minimize(double[] initialPoint) {
    Preconditions.checkArgument(initialPoint.length == dimension,
                                "Initial point must have dimension %s", dimension);
    double[] x = project(initialPoint);
    double[] g = new double[dimension];
    double f = function.evaluate(x, g);
    int evaluations = 1;
    checkFinite(f, g, 0);

    CorrectionHistory history = new CorrectionHistory(corrections);
    double[] xNew = new double[dimension];
    double[] gNew = new double[dimension];
    MinimizationStatus status;
    int iteration = 0;

    while (true) {
      if (projectedGradientNorm(x, g) <= gradientTolerance) {
        status = MinimizationStatus.GRADIENT_TOLERANCE_REACHED;
        break;
      }
      if (iteration >= maxIterations) {
        status = MinimizationStatus.MAX_ITERATIONS_REACHED;
        break;
      }

      double[] direction = history.direction(g);
      dropBlockedComponents(x, direction);
      double slope = SimpleVectorMath.dot(g, direction);
      if (!(slope < 0.0)) {
        // Curvature information is misleading here; restart from steepest descent
        log.debug("Resetting corrections at iteration {}; slope {}", iteration, slope);
        history.clear();
        direction = history.direction(g);
        dropBlockedComponents(x, direction);
        slope = SimpleVectorMath.dot(g, direction);
        if (!(slope < 0.0)) {
          status = MinimizationStatus.GRADIENT_TOLERANCE_REACHED;
          break;
        }
      }

      double step = history.isEmpty() ? FastMath.min(1.0, 1.0 / SimpleVectorMath.norm(direction)) : 1.0;
      boolean accepted = false;
      double fNew = Double.NaN;
      for (int backtrack = 0; backtrack < MAX_BACKTRACKS; backtrack++) {
        double expectedDecrease = 0.0;
        for (int i = 0; i < dimension; i++) {
          xNew[i] = bounds[i].clamp(x[i] + step * direction[i]);
          expectedDecrease += g[i] * (xNew[i] - x[i]);
        }
        fNew = function.evaluate(xNew, gNew);
        evaluations++;
        if (LangUtils.isFinite(fNew) && fNew <= f + ARMIJO_FACTOR * expectedDecrease) {
          accepted = true;
          break;
        }
        step *= 0.5;
      }
      if (!accepted) {
        status = MinimizationStatus.LINE_SEARCH_FAILED;
        break;
      }
      iteration++;
      checkFinite(fNew, gNew, iteration);

      double[] s = new double[dimension];
      double[] y = new double[dimension];
      for (int i = 0; i < dimension; i++) {
        s[i] = xNew[i] - x[i];
        y[i] = gNew[i] - g[i];
      }
      history.add(s, y);

      double relativeReduction = (f - fNew) / FastMath.max(FastMath.max(FastMath.abs(f), FastMath.abs(fNew)), 1.0);
      System.arraycopy(xNew, 0, x, 0, dimension);
      System.arraycopy(gNew, 0, g, 0, dimension);
      f = fNew;
      if (relativeReduction <= functionTolerance) {
        status = MinimizationStatus.FUNCTION_TOLERANCE_REACHED;
        break;
      }
    }

    log.debug("Minimization stopped: {} after {} iterations, f = {}", status, iteration, f);
    return new MinimizationResult(x, f, status, iteration, evaluations);
  }

  private double[] project(double[] x) {
    double[] projected = new double[dimension];
    for (int i = 0; i < dimension; i++) {
      projected[i] = bounds[i].clamp(x[i]);
    }
    return projected;
  }

  /**
   * @return infinity norm of P(x - g) - x, where P projects onto the bounds
   */
  private double projectedGradientNorm(double[] x, double[] g) {
    double max = 0.0;
    for (int i = 0; i < dimension; i++) {
      double component = FastMath.abs(bounds[i].clamp(x[i] - g[i]) - x[i]);
      if (component > max) {
        max = component;
      }
    }
    return max;
  }

  private void dropBlockedComponents(double[] x, double[] direction) {
    for (int i = 0; i < dimension; i++) {
      Bound bound = bounds[i];
      if ((direction[i] < 0.0 && x[i] <= bound.getLower()) ||
          (direction[i] > 0.0 && x[i] >= bound.getUpper())) {
        direction[i] = 0.0;
      }
    }
  }

  private static void checkFinite(double f, double[] g, int iteration) {
    if (!LangUtils.isFinite(f) || !SimpleVectorMath.isFinite(g)) {
      log.warn("Non-finite function value or gradient at iteration {}: f = {}", iteration, f);
      throw new SolverException("Non-finite function value or gradient at iteration " + iteration);
    }
  }

  /**
   * The last few (s, y) pairs, kept in a ring buffer, and the two-loop recursion over them.
   */
  private static final class CorrectionHistory {

    private final double[][] s;
    private final double[][] y;
    private final double[] rho;
    private final double[] alpha;
    private int newest;
    private int size;

    CorrectionHistory(int capacity) {
      s = new double[capacity][];
      y = new double[capacity][];
      rho = new double[capacity];
      alpha = new double[capacity];
      newest = -1;
    }

    boolean isEmpty() {
      return size == 0;
    }

    void clear() {
      size = 0;
      newest = -1;
    }

    void add(double[] sNew, double[] yNew) {
      double sy = SimpleVectorMath.dot(sNew, yNew);
      double yy = SimpleVectorMath.dot(yNew, yNew);
      if (sy <= CURVATURE_EPSILON * yy) {
        // Skipping keeps the approximation positive definite
        return;
      }
      newest = (newest + 1) % s.length;
      s[newest] = sNew;
      y[newest] = yNew;
      rho[newest] = 1.0 / sy;
      if (size < s.length) {
        size++;
      }
    }

    /**
     * @return -H g, where H approximates the inverse Hessian
     */
    double[] direction(double[] g) {
      int capacity = s.length;
      double[] q = g.clone();
      int j = newest;
      for (int i = 0; i < size; i++) {
        alpha[j] = rho[j] * SimpleVectorMath.dot(s[j], q);
        axpy(-alpha[j], y[j], q);
        j = (j - 1 + capacity) % capacity;
      }
      if (size > 0) {
        double gamma = 1.0 / (rho[newest] * SimpleVectorMath.dot(y[newest], y[newest]));
        for (int k = 0; k < q.length; k++) {
          q[k] *= gamma;
        }
      }
      j = (newest - size + 1 + capacity) % capacity;
      for (int i = 0; i < size; i++) {
        double beta = rho[j] * SimpleVectorMath.dot(y[j], q);
        axpy(alpha[j] - beta, s[j], q);
        j = (j + 1) % capacity;
      }
      for (int k = 0; k < q.length; k++) {
        q[k] = -q[k];
      }
      return q;
    }

    private static void axpy(double a, double[] x, double[] target) {
      for (int k = 0; k < target.length; k++) {
        target[k] += a * x[k];
      }
    }
  }

  public static final class Builder {

    private DifferentiableFunction function;
    private int dimension;
    private int corrections = DEFAULT_CORRECTIONS;
    private int maxIterations = DEFAULT_MAX_ITERATIONS;
    private double functionTolerance = DEFAULT_FUNCTION_TOLERANCE;
    private double gradientTolerance = DEFAULT_GRADIENT_TOLERANCE;
    private Bound[] bounds;

    private Builder() {
    }

    public Builder function(DifferentiableFunction function) {
      this.function = function;
      return this;
    }

    public Builder dimension(int dimension) {
      this.dimension = dimension;
      return this;
    }

    /**
     * @param corrections number of (s, y) pairs kept for the inverse Hessian approximation
     */
    public Builder corrections(int corrections) {
      this.corrections = corrections;
      return this;
    }

    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    public Builder functionTolerance(double functionTolerance) {
      this.functionTolerance = functionTolerance;
      return this;
    }

    public Builder gradientTolerance(double gradientTolerance) {
      this.gradientTolerance = gradientTolerance;
      return this;
    }

    /**
     * @param bounds one {@link Bound} per variable; when never set, all variables are unbounded
     */
    public Builder bounds(Bound... bounds) {
      this.bounds = bounds;
      return this;
    }

    public LbfgsbMinimizer build() {
      Preconditions.checkNotNull(function, "No function");
      Preconditions.checkArgument(dimension > 0, "Dimension must be positive: %s", dimension);
      Preconditions.checkArgument(corrections > 0, "Corrections must be positive: %s", corrections);
      Preconditions.checkArgument(maxIterations > 0, "Max iterations must be positive: %s", maxIterations);
      Preconditions.checkArgument(functionTolerance >= 0.0 && gradientTolerance >= 0.0, "Negative tolerance");
      if (bounds != null) {
        Preconditions.checkArgument(bounds.length == dimension,
                                    "Need %s bounds but got %s", dimension, bounds.length);
        for (Bound bound : bounds) {
          Preconditions.checkNotNull(bound);
        }
      }
      return new LbfgsbMinimizer(this);
    }
  }

}
