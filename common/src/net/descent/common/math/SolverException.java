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

package net.descent.common.math;

/**
 * Thrown when a numerical method can't produce a result, for example because a system is
 * singular or an iterative method produced non-finite values.
 */
public class SolverException extends RuntimeException {

  public SolverException(String message) {
    super(message);
  }

  public SolverException(Throwable cause) {
    super(cause);
  }

  public SolverException(String message, Throwable cause) {
    super(message, cause);
  }

}
