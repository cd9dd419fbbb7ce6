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

import java.util.concurrent.Callable;

import org.apache.commons.math3.linear.RealMatrix;

import net.descent.common.BackendUnavailableException;
import net.descent.common.LazyReference;
import net.descent.common.math.denoise.TotalVariationDenoiser;
import net.descent.common.math.denoise.TotalVariationDenoisers;

/**
 * Proximal operator for total variation, scaled by a penalty gamma. Applying it denoises the point,
 * as an image, with fidelity weight {@code weight / gamma}. The denoiser is the one configured by
 * the {@code proxops.tvd.denoiser} system property, loaded on first use. If it can't be loaded,
 * every call to {@code apply} fails with {@link BackendUnavailableException}. The objective is
 * unsupported.
 */
public final class TotalVariationOperator extends AbstractProximalOperator {

  private final double gamma;
  private final LazyReference<TotalVariationDenoiser> denoiser;

  /**
   * @param penalty gamma, the weight on total variation; positive
   */
  public TotalVariationOperator(double penalty) {
    this(penalty, new Callable<TotalVariationDenoiser>() {
      @Override
      public TotalVariationDenoiser call() {
        return TotalVariationDenoisers.load();
      }
    });
  }

  /**
   * @param penalty gamma, the weight on total variation; positive
   * @param denoiserClassName {@link TotalVariationDenoiser} implementation to use
   */
  public TotalVariationOperator(double penalty, final String denoiserClassName) {
    this(penalty, new Callable<TotalVariationDenoiser>() {
      @Override
      public TotalVariationDenoiser call() {
        return TotalVariationDenoisers.load(denoiserClassName);
      }
    });
  }

  private TotalVariationOperator(double penalty, Callable<TotalVariationDenoiser> loader) {
    this.gamma = checkPenalty(penalty, false);
    this.denoiser = new LazyReference<TotalVariationDenoiser>(loader);
  }

  /**
   * @throws BackendUnavailableException if the denoiser can't be loaded
   */
  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    return denoiser.get().denoise(point, weight / gamma);
  }

  @Override
  public String toString() {
    return "tvd(penalty=" + gamma + ')';
  }

}
