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

package net.descent.common;

import com.google.common.base.Preconditions;

/**
 * General utility methods related to the language, or primitives, and to reading numeric
 * settings from system properties.
 */
public final class LangUtils {

  private LangUtils() {
  }

  /**
   * Parses a {@code double} from a {@link String} as if by {@link Double#valueOf(String)}, but disallows special
   * values like {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} and {@link Double#NEGATIVE_INFINITY}.
   *
   * @param s {@link String} to parse
   * @return floating-point value in the {@link String}
   * @throws NumberFormatException if input does not parse as a floating-point value
   * @throws IllegalArgumentException if input is infinite or {@link Double#NaN}
   */
  public static double parseDouble(String s) {
    double value = Double.parseDouble(s);
    Preconditions.checkArgument(isFinite(value), "Bad value: %s", value);
    return value;
  }

  /**
   * @return true if argument is not {@link Double#NaN}, {@link Double#POSITIVE_INFINITY} or
   *  {@link Double#NEGATIVE_INFINITY}
   */
  public static boolean isFinite(double d) {
    return !(Double.isNaN(d) || Double.isInfinite(d));
  }

  /**
   * @param name system property name
   * @param defaultValue value to use when the property is not set
   * @return the property's value, parsed as by {@link #parseDouble(String)}, which must also be positive
   * @throws IllegalArgumentException if the value is not finite or not positive
   */
  public static double getPositiveDoubleProperty(String name, double defaultValue) {
    String raw = System.getProperty(name);
    double value = raw == null ? defaultValue : parseDouble(raw.trim());
    Preconditions.checkArgument(value > 0.0, "%s must be positive: %s", name, value);
    return value;
  }

  /**
   * @param name system property name
   * @param defaultValue value to use when the property is not set
   * @return the property's value as an {@code int}, which must be positive
   * @throws NumberFormatException if the value does not parse as an integer
   * @throws IllegalArgumentException if the value is not positive
   */
  public static int getPositiveIntProperty(String name, int defaultValue) {
    String raw = System.getProperty(name);
    int value = raw == null ? defaultValue : Integer.parseInt(raw.trim());
    Preconditions.checkArgument(value > 0, "%s must be positive: %s", name, value);
    return value;
  }

}
