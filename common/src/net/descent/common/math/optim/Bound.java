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

import com.google.common.base.Preconditions;

/**
 * Simple bounds on one variable. Infinite limits mean no bound on that side.
 */
public final class Bound {

  private static final Bound UNBOUNDED = new Bound(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

  private final double lower;
  private final double upper;

  private Bound(double lower, double upper) {
    Preconditions.checkArgument(!Double.isNaN(lower) && !Double.isNaN(upper), "Bound can't be NaN");
    Preconditions.checkArgument(lower <= upper, "Lower bound %s exceeds upper bound %s", lower, upper);
    this.lower = lower;
    this.upper = upper;
  }

  public static Bound unbounded() {
    return UNBOUNDED;
  }

  public static Bound between(double lower, double upper) {
    return new Bound(lower, upper);
  }

  public static Bound atLeast(double lower) {
    return new Bound(lower, Double.POSITIVE_INFINITY);
  }

  public static Bound atMost(double upper) {
    return new Bound(Double.NEGATIVE_INFINITY, upper);
  }

  public double getLower() {
    return lower;
  }

  public double getUpper() {
    return upper;
  }

  public boolean isUnbounded() {
    return Double.isInfinite(lower) && Double.isInfinite(upper);
  }

  /**
   * @return the nearest value to {@code x} that satisfies this bound
   */
  public double clamp(double x) {
    if (x < lower) {
      return lower;
    }
    if (x > upper) {
      return upper;
    }
    return x;
  }

  @Override
  public String toString() {
    return "[" + lower + ", " + upper + ']';
  }

}
