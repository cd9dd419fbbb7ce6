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

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Total variation denoising of a 2-D signal (an image).
 */
public interface TotalVariationDenoiser {

  /**
   * @param image values to denoise; not modified
   * @param weight fidelity weight; larger values keep the result closer to {@code image}
   * @return newly allocated denoised matrix, of the same shape as {@code image}
   */
  RealMatrix denoise(RealMatrix image, double weight);

}
