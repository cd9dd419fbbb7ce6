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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.descent.common.BackendUnavailableException;
import net.descent.common.ClassUtils;

/**
 * Loads the {@link TotalVariationDenoiser} implementation named by the {@code proxops.tvd.denoiser}
 * system property, or {@link SplitBregmanDenoiser} by default.
 */
public final class TotalVariationDenoisers {

  private static final Logger log = LoggerFactory.getLogger(TotalVariationDenoisers.class);

  public static final String DENOISER_PROPERTY = "proxops.tvd.denoiser";

  private TotalVariationDenoisers() {
  }

  /**
   * @return new instance of the configured implementation
   * @throws BackendUnavailableException if it can't be loaded
   */
  public static TotalVariationDenoiser load() {
    return load(System.getProperty(DENOISER_PROPERTY, SplitBregmanDenoiser.class.getName()));
  }

  /**
   * @param implClassName name of a {@link TotalVariationDenoiser} implementation with a public no-arg constructor
   * @return new instance of it
   * @throws BackendUnavailableException if it can't be loaded
   */
  public static TotalVariationDenoiser load(String implClassName) {
    try {
      TotalVariationDenoiser denoiser = ClassUtils.loadInstanceOf(implClassName, TotalVariationDenoiser.class);
      log.info("Loaded total variation denoiser {}", implClassName);
      return denoiser;
    } catch (IllegalStateException ise) {
      log.warn("Total variation denoiser {} is unavailable: {}", implClassName, ise.getMessage());
      throw new BackendUnavailableException("Total variation denoiser " + implClassName + " is unavailable", ise);
    }
  }

}
