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

import java.util.Map;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

import net.descent.common.math.MatrixUtils;

/**
 * {@link OperatorArguments} matched to one operator's parameter names, with typed accessors.
 * Type mismatches are reported as {@link ConfigurationException}s.
 */
final class BoundArguments {

  private final String operatorName;
  private final Map<String,Object> values;

  BoundArguments(String operatorName, Map<String,Object> values) {
    this.operatorName = operatorName;
    this.values = values;
  }

  boolean has(String name) {
    return values.containsKey(name);
  }

  /**
   * @return the argument as a {@code double}; any {@link Number} is accepted
   */
  double getDouble(String name) {
    Object value = values.get(name);
    if (!(value instanceof Number)) {
      throw mismatch(name, "a number", value);
    }
    return ((Number) value).doubleValue();
  }

  /**
   * @return the argument as an {@code int}; any {@link Number} with an integral value is accepted,
   *  or {@code defaultValue} if the argument wasn't given
   */
  int getInt(String name, int defaultValue) {
    if (!has(name)) {
      return defaultValue;
    }
    return getInt(name);
  }

  int getInt(String name) {
    Object value = values.get(name);
    if (value instanceof Number) {
      double d = ((Number) value).doubleValue();
      if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
        return (int) d;
      }
    }
    throw mismatch(name, "an integer", value);
  }

  /**
   * @return the argument as a matrix. A {@code double[]} is taken as a column vector and a
   *  {@code double[][]} as rows of a matrix; both are copied.
   */
  RealMatrix getMatrix(String name) {
    Object value = values.get(name);
    if (value instanceof RealMatrix) {
      return (RealMatrix) value;
    }
    if (value instanceof double[]) {
      double[] vector = (double[]) value;
      if (vector.length > 0) {
        return MatrixUtils.columnVector(vector);
      }
    }
    if (value instanceof double[][]) {
      double[][] data = (double[][]) value;
      if (data.length > 0 && data[0].length > 0) {
        try {
          return new Array2DRowRealMatrix(data, true);
        } catch (IllegalArgumentException iae) {
          throw new ConfigurationException(operatorName + " argument '" + name + "' is not rectangular", iae);
        }
      }
    }
    throw mismatch(name, "a non-empty matrix", value);
  }

  <T> T get(String name, Class<T> type) {
    Object value = values.get(name);
    if (!type.isInstance(value)) {
      throw mismatch(name, "a " + type.getSimpleName(), value);
    }
    return type.cast(value);
  }

  private ConfigurationException mismatch(String name, String expected, Object value) {
    String actual = value == null ? "nothing" : value.getClass().getName();
    return new ConfigurationException(operatorName + " argument '" + name + "' must be " + expected +
                                      " but got " + actual);
  }

}
