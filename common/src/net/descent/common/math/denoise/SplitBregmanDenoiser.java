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

package net.descent.common.math.denoise;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.descent.common.LangUtils;

/**
 * <p>Isotropic total variation denoising by split Bregman iteration, after Goldstein and Osher,
 * "The Split Bregman Method for L1-Regularized Problems". Minimizes</p>
 *
 * <pre>
 *   (weight / 2) ||u - f||^2 + ||grad u||_1
 * </pre>
 *
 * <p>with Gauss-Seidel sweeps. The image border is extended by replicating edge values. Iteration
 * stops when the root mean square change of a sweep drops below the tolerance
 * ({@code proxops.tvd.tolerance}, default 0.001) or after {@code proxops.tvd.maxIterations}
 * (default 100) sweeps.</p>
 */
public final class SplitBregmanDenoiser implements TotalVariationDenoiser {

  private static final Logger log = LoggerFactory.getLogger(SplitBregmanDenoiser.class);

  private static final int DEFAULT_MAX_ITERATIONS =
      LangUtils.getPositiveIntProperty("proxops.tvd.maxIterations", 100);
  private static final double DEFAULT_TOLERANCE =
      LangUtils.getPositiveDoubleProperty("proxops.tvd.tolerance", 1.0e-3);

  private final int maxIterations;
  private final double tolerance;

  public SplitBregmanDenoiser() {
    this(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
  }

  public SplitBregmanDenoiser(int maxIterations, double tolerance) {
    Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive: %s", maxIterations);
    Preconditions.checkArgument(tolerance > 0.0, "tolerance must be positive: %s", tolerance);
    this.maxIterations = maxIterations;
    this.tolerance = tolerance;
  }

  @Override
  public RealMatrix denoise(RealMatrix image, double weight) {
    Preconditions.checkArgument(weight > 0.0, "weight must be positive: %s", weight);
    int rows = image.getRowDimension();
    int cols = image.getColumnDimension();

    // Working arrays carry a one-cell border on each side
    double[][] u = padReplicatingEdges(image);
    double[][] dx = new double[rows + 2][cols + 2];
    double[][] dy = new double[rows + 2][cols + 2];
    double[][] bx = new double[rows + 2][cols + 2];
    double[][] by = new double[rows + 2][cols + 2];

    double lambda = 2.0 * weight;
    double norm = weight + 4.0 * lambda;
    double total = rows * cols;

    double rmse = Double.POSITIVE_INFINITY;
    int iteration = 0;
    while (iteration < maxIterations && rmse > tolerance) {
      double sumSquaredChange = 0.0;
      for (int r = 1; r <= rows; r++) {
        for (int c = 1; c <= cols; c++) {
          double uPrev = u[r][c];
          double ux = u[r][c + 1] - uPrev;
          double uy = u[r + 1][c] - uPrev;

          double uNew = (lambda * (u[r + 1][c] + u[r - 1][c] + u[r][c + 1] + u[r][c - 1]
                                   + dx[r][c - 1] - dx[r][c] + dy[r - 1][c] - dy[r][c]
                                   - bx[r][c - 1] + bx[r][c] - by[r - 1][c] + by[r][c])
                         + weight * image.getEntry(r - 1, c - 1)) / norm;
          u[r][c] = uNew;
          double change = uNew - uPrev;
          sumSquaredChange += change * change;

          double bxx = bx[r][c];
          double byy = by[r][c];
          double shrink = FastMath.sqrt((ux + bxx) * (ux + bxx) + (uy + byy) * (uy + byy));
          double scale = shrink * lambda / (shrink * lambda + 1.0);
          double dxx = scale * (ux + bxx);
          double dyy = scale * (uy + byy);
          dx[r][c] = dxx;
          dy[r][c] = dyy;
          bx[r][c] += ux - dxx;
          by[r][c] += uy - dyy;
        }
      }
      rmse = FastMath.sqrt(sumSquaredChange / total);
      iteration++;
    }
    log.debug("Denoised {} x {} image in {} iterations (rmse {})", rows, cols, iteration, rmse);

    RealMatrix result = new Array2DRowRealMatrix(rows, cols);
    for (int r = 0; r < rows; r++) {
      for (int c = 0; c < cols; c++) {
        result.setEntry(r, c, u[r + 1][c + 1]);
      }
    }
    return result;
  }

  private static double[][] padReplicatingEdges(RealMatrix image) {
    int rows = image.getRowDimension();
    int cols = image.getColumnDimension();
    double[][] padded = new double[rows + 2][cols + 2];
    for (int r = 0; r < rows + 2; r++) {
      int sourceRow = FastMath.min(FastMath.max(r - 1, 0), rows - 1);
      for (int c = 0; c < cols + 2; c++) {
        int sourceCol = FastMath.min(FastMath.max(c - 1, 0), cols - 1);
        padded[r][c] = image.getEntry(sourceRow, sourceCol);
      }
    }
    return padded;
  }

}
