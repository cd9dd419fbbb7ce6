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
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Resolves and constructs {@link ProximalOperator}s. An operator is identified either by the name
 * of one of the built-in {@link OperatorType}s, or by a mapping supplied directly:</p>
 *
 * <ul>
 *  <li>a {@link ProximalOperator}, used as is</li>
 *  <li>a {@link ProximalMapping}, wrapped to give an operator with an unsupported objective</li>
 *  <li>a {@link ParameterizedMapping}, bound to the given {@link OperatorArguments} and wrapped likewise</li>
 * </ul>
 *
 * <p>Any problem with the identifier or arguments is reported immediately as a
 * {@link ConfigurationException}.</p>
 */
public final class ProximalOperators {

  private static final Logger log = LoggerFactory.getLogger(ProximalOperators.class);

  private interface OperatorConstructor {
    ProximalOperator construct(BoundArguments arguments);
  }

  private static final Map<String,OperatorType> TYPES_BY_NAME;
  private static final Map<OperatorType,OperatorConstructor> CONSTRUCTORS;
  static {
    ImmutableMap.Builder<String,OperatorType> typesByName = ImmutableMap.builder();
    for (OperatorType type : OperatorType.values()) {
      typesByName.put(type.getOperatorName(), type);
    }
    TYPES_BY_NAME = typesByName.build();

    Map<OperatorType,OperatorConstructor> constructors = Maps.newEnumMap(OperatorType.class);
    constructors.put(OperatorType.NUCNORM, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new NuclearNormOperator(arguments.getDouble("penalty"));
      }
    });
    constructors.put(OperatorType.SPARSE, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new SparseOperator(arguments.getDouble("penalty"));
      }
    });
    constructors.put(OperatorType.NONNEG, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new NonNegativeOperator();
      }
    });
    constructors.put(OperatorType.LINSYS, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new LinearSystemOperator(arguments.getMatrix("A"), arguments.getMatrix("b"));
      }
    });
    constructors.put(OperatorType.SQUARED_ERROR, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new SquaredErrorOperator(arguments.getMatrix("x_obs"));
      }
    });
    constructors.put(OperatorType.LBFGS, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new LbfgsOperator(arguments.get("f_df", SmoothObjective.class),
                                 arguments.getInt("numiter", LbfgsOperator.DEFAULT_ITERATIONS));
      }
    });
    constructors.put(OperatorType.TVD, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new TotalVariationOperator(arguments.getDouble("penalty"));
      }
    });
    constructors.put(OperatorType.SMOOTH, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new SmoothingOperator(arguments.getInt("axis"), arguments.getDouble("penalty"));
      }
    });
    constructors.put(OperatorType.SEMIDEFINITE_CONE, new OperatorConstructor() {
      @Override
      public ProximalOperator construct(BoundArguments arguments) {
        return new SemidefiniteConeOperator();
      }
    });
    for (OperatorType type : OperatorType.values()) {
      Preconditions.checkState(constructors.containsKey(type), "No constructor registered for %s", type);
    }
    CONSTRUCTORS = Maps.immutableEnumMap(constructors);
  }

  private ProximalOperators() {
  }

  /**
   * @return names of all built-in operators
   */
  public static Set<String> getOperatorNames() {
    return TYPES_BY_NAME.keySet();
  }

  /**
   * Like {@link #resolve(Object, OperatorArguments)}, with no arguments.
   */
  public static ProximalOperator resolve(Object identifier) {
    return resolve(identifier, OperatorArguments.none());
  }

  /**
   * Like {@link #resolve(Object, OperatorArguments)} for a built-in operator, with positional arguments
   * as in {@link OperatorArguments#of(Object...)}.
   */
  public static ProximalOperator resolve(String name, Object... positionalArguments) {
    return resolve(name, OperatorArguments.of(positionalArguments));
  }

  /**
   * @param identifier name of a built-in operator, a {@link ProximalOperator}, a {@link ProximalMapping}
   *  or a {@link ParameterizedMapping}
   * @param arguments arguments to construct the operator with, or to bind to a {@link ParameterizedMapping};
   *  must be empty for the other kinds of mapping
   * @return operator ready to apply
   * @throws ConfigurationException if the identifier is unknown or of another type, or the arguments
   *  don't suit it
   */
  public static ProximalOperator resolve(Object identifier, OperatorArguments arguments) {
    Preconditions.checkNotNull(arguments);
    if (identifier instanceof String) {
      return construct((String) identifier, arguments);
    }
    if (identifier instanceof ProximalOperator) {
      checkNoArguments(identifier, arguments);
      return (ProximalOperator) identifier;
    }
    if (identifier instanceof ProximalMapping) {
      checkNoArguments(identifier, arguments);
      return new MappingOperator((ProximalMapping) identifier, identifier.toString());
    }
    if (identifier instanceof ParameterizedMapping) {
      return new MappingOperator(bind((ParameterizedMapping) identifier, arguments),
                                 identifier + "(" + arguments + ')');
    }
    throw new ConfigurationException(
        "Operator must be given by name or as a mapping, not " +
        (identifier == null ? "null" : identifier.getClass().getName()));
  }

  private static ProximalOperator construct(String name, OperatorArguments arguments) {
    OperatorType type = TYPES_BY_NAME.get(name);
    if (type == null) {
      throw new ConfigurationException(name + " is not a valid operator; choose from " + TYPES_BY_NAME.keySet());
    }
    BoundArguments bound = type.bind(arguments);
    ProximalOperator operator;
    try {
      operator = CONSTRUCTORS.get(type).construct(bound);
    } catch (ConfigurationException ce) {
      throw ce;
    } catch (IllegalArgumentException iae) {
      throw new ConfigurationException("Bad arguments for " + name + ": " + iae.getMessage(), iae);
    }
    log.debug("Constructed {}", operator);
    return operator;
  }

  private static ProximalMapping bind(final ParameterizedMapping mapping, final OperatorArguments arguments) {
    return new ProximalMapping() {
      @Override
      public RealMatrix apply(RealMatrix point, double weight) {
        return mapping.apply(point, weight, arguments);
      }
    };
  }

  private static void checkNoArguments(Object identifier, OperatorArguments arguments) {
    if (!arguments.isEmpty()) {
      throw new ConfigurationException(identifier + " takes no arguments but got " + arguments);
    }
  }

  public static ProximalOperator nuclearNorm(double penalty) {
    return new NuclearNormOperator(penalty);
  }

  public static ProximalOperator sparse(double penalty) {
    return new SparseOperator(penalty);
  }

  public static ProximalOperator nonNegative() {
    return new NonNegativeOperator();
  }

  public static ProximalOperator linearSystem(RealMatrix A, RealMatrix b) {
    return new LinearSystemOperator(A, b);
  }

  public static ProximalOperator squaredError(RealMatrix reference) {
    return new SquaredErrorOperator(reference);
  }

  public static ProximalOperator lbfgs(SmoothObjective smoothObjective, int maxIterations) {
    return new LbfgsOperator(smoothObjective, maxIterations);
  }

  public static ProximalOperator totalVariation(double penalty) {
    return new TotalVariationOperator(penalty);
  }

  public static ProximalOperator smooth(int axis, double penalty) {
    return new SmoothingOperator(axis, penalty);
  }

  public static ProximalOperator semidefiniteCone() {
    return new SemidefiniteConeOperator();
  }

}
