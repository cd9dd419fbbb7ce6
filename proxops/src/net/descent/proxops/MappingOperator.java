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

/**
 * Adapts a bare {@link ProximalMapping} to the {@link ProximalOperator} contract. The objective is
 * unsupported.
 */
final class MappingOperator extends AbstractProximalOperator {

  private final ProximalMapping mapping;
  private final String description;

  MappingOperator(ProximalMapping mapping, String description) {
    this.mapping = Preconditions.checkNotNull(mapping);
    this.description = description;
  }

  @Override
  protected RealMatrix doApply(RealMatrix point, double weight) {
    RealMatrix result = mapping.apply(point, weight);
    Preconditions.checkState(result != null, "%s returned no result", description);
    Preconditions.checkState(result.getRowDimension() == point.getRowDimension() &&
                             result.getColumnDimension() == point.getColumnDimension(),
                             "%s returned a %s x %s result for a %s x %s point",
                             description,
                             result.getRowDimension(), result.getColumnDimension(),
                             point.getRowDimension(), point.getColumnDimension());
    return result;
  }

  @Override
  public String toString() {
    return description;
  }

}
