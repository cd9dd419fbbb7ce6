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

import org.apache.commons.math3.linear.RealMatrix;
import org.junit.Test;

import net.descent.common.math.MatrixUtils;

/**
 * Tests {@link ProximalOperators}.
 */
public final class ProximalOperatorsTest extends ProxopsTest {

  private static final ProximalMapping NEGATE = new ProximalMapping() {
    @Override
    public RealMatrix apply(RealMatrix point, double weight) {
      return point.scalarMultiply(-1.0);
    }
    @Override
    public String toString() {
      return "negate";
    }
  };

  private static final ParameterizedMapping SCALE = new ParameterizedMapping() {
    @Override
    public RealMatrix apply(RealMatrix point, double weight, OperatorArguments arguments) {
      double factor = ((Number) arguments.getKeyword("factor")).doubleValue();
      return point.scalarMultiply(factor);
    }
  };

  @Test
  public void testAllNamesRegistered() {
    assertEquals(OperatorType.values().length, ProximalOperators.getOperatorNames().size());
    for (OperatorType type : OperatorType.values()) {
      assertTrue(ProximalOperators.getOperatorNames().contains(type.getOperatorName()));
    }
  }

  @Test
  public void testEndToEndByName() {
    ProximalOperator sparse = ProximalOperators.resolve("sparse", 2.0);
    assertTrue(sparse instanceof SparseOperator);
    assertArrayEquals(new double[] {4.5, -4.5, 0.0, 0.0},
                      sparse.apply(row(5.0, -5.0, 0.25, -0.5), 4.0).getRow(0), EPSILON);
  }

  @Test
  public void testEachType() {
    RealMatrix A = randomMatrix(4, 3);
    RealMatrix b = randomMatrix(4, 1);
    assertTrue(ProximalOperators.resolve("nucnorm", 1.0) instanceof NuclearNormOperator);
    assertTrue(ProximalOperators.resolve("nonneg") instanceof NonNegativeOperator);
    assertTrue(ProximalOperators.resolve("linsys", A, b) instanceof LinearSystemOperator);
    assertTrue(ProximalOperators.resolve("squared_error", new double[] {1.0, 2.0}) instanceof SquaredErrorOperator);
    assertTrue(ProximalOperators.resolve("tvd", 0.5) instanceof TotalVariationOperator);
    assertTrue(ProximalOperators.resolve("smooth", 1, 2.0) instanceof SmoothingOperator);
    assertTrue(ProximalOperators.resolve("semidefinite_cone") instanceof SemidefiniteConeOperator);
    SmoothObjective zero = new SmoothObjective() {
      @Override
      public Evaluation evaluate(RealMatrix theta) {
        return new Evaluation(0.0, theta.scalarMultiply(0.0));
      }
    };
    assertEquals("lbfgs(numiter=20)", ProximalOperators.resolve("lbfgs", zero).toString());
    assertEquals("lbfgs(numiter=5)", ProximalOperators.resolve("lbfgs", zero, 5).toString());
  }

  @Test
  public void testKeywordArguments() {
    OperatorArguments arguments = OperatorArguments.builder()
        .positional(0)
        .keyword("penalty", 3.0)
        .build();
    assertEquals("smooth(axis=0, penalty=3.0)", ProximalOperators.resolve("smooth", arguments).toString());
    RealMatrix x = MatrixUtils.columnVector(1.0, 2.0);
    ProximalOperator squaredError = ProximalOperators.resolve(
        "squared_error", OperatorArguments.builder().keyword("x_obs", x).build());
    assertEquals(0.0, squaredError.objective(x), EPSILON);
  }

  @Test
  public void testMatrixFromArrays() {
    ProximalOperator linsys = ProximalOperators.resolve(
        "linsys", new double[][] {{1.0, 0.0}, {0.0, 1.0}}, new double[] {2.0, 3.0});
    assertEquals(0.0, linsys.objective(MatrixUtils.columnVector(2.0, 3.0)), EPSILON);
  }

  @Test
  public void testLoneMatrixArrayIsOneArgument() {
    ProximalOperator squaredError = ProximalOperators.resolve("squared_error", new double[][] {{1.0, 2.0}, {3.0, 4.0}});
    assertEquals("squared_error(2x2)", squaredError.toString());
    assertEquals(0.0, squaredError.objective(matrix(new double[] {1.0, 2.0}, new double[] {3.0, 4.0})), EPSILON);
  }

  @Test
  public void testOperatorPassesThrough() {
    ProximalOperator nonneg = new NonNegativeOperator();
    assertSame(nonneg, ProximalOperators.resolve(nonneg));
  }

  @Test
  public void testMappingWrapped() {
    ProximalOperator operator = ProximalOperators.resolve(NEGATE);
    assertArrayEquals(new double[] {-1.0, 2.0}, operator.apply(row(1.0, -2.0), 1.0).getRow(0), 0.0);
    assertNaN(operator.objective(row(1.0)));
    assertEquals("negate", operator.toString());
  }

  @Test
  public void testParameterizedMapping() {
    ProximalOperator operator =
        ProximalOperators.resolve(SCALE, OperatorArguments.builder().keyword("factor", 3.0).build());
    assertArrayEquals(new double[] {3.0, -6.0}, operator.apply(row(1.0, -2.0), 1.0).getRow(0), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMappingWeightChecked() {
    ProximalOperators.resolve(NEGATE).apply(row(1.0), -1.0);
  }

  @Test(expected = IllegalStateException.class)
  public void testMappingResultShapeChecked() {
    ProximalOperators.resolve(new ProximalMapping() {
      @Override
      public RealMatrix apply(RealMatrix point, double weight) {
        return point.transpose();
      }
    }).apply(randomMatrix(2, 3), 1.0);
  }

  @Test(expected = ConfigurationException.class)
  public void testUnknownName() {
    ProximalOperators.resolve("l2");
  }

  @Test(expected = ConfigurationException.class)
  public void testNull() {
    ProximalOperators.resolve(null);
  }

  @Test(expected = ConfigurationException.class)
  public void testNotAnOperator() {
    ProximalOperators.resolve(Integer.valueOf(3));
  }

  @Test(expected = ConfigurationException.class)
  public void testArgumentsForMapping() {
    ProximalOperators.resolve(NEGATE, OperatorArguments.of(1.0));
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingArgument() {
    ProximalOperators.resolve("sparse");
  }

  @Test(expected = ConfigurationException.class)
  public void testTooManyArguments() {
    ProximalOperators.resolve("nonneg", 1.0);
  }

  @Test(expected = ConfigurationException.class)
  public void testWrongArgumentType() {
    ProximalOperators.resolve("sparse", "two");
  }

  @Test(expected = ConfigurationException.class)
  public void testNonIntegralAxis() {
    ProximalOperators.resolve("smooth", 0.5, 1.0);
  }

  @Test
  public void testInvalidArgumentValue() {
    try {
      ProximalOperators.resolve("smooth", 2, 1.0);
      fail();
    } catch (ConfigurationException ce) {
      assertTrue(ce.getCause() instanceof IllegalArgumentException);
    }
  }

  @Test
  public void testTypedFactories() {
    assertEquals("nucnorm(penalty=1.0)", ProximalOperators.nuclearNorm(1.0).toString());
    assertEquals("sparse(penalty=1.0)", ProximalOperators.sparse(1.0).toString());
    assertEquals("nonneg", ProximalOperators.nonNegative().toString());
    assertEquals("tvd(penalty=1.0)", ProximalOperators.totalVariation(1.0).toString());
    assertEquals("smooth(axis=1, penalty=1.0)", ProximalOperators.smooth(1, 1.0).toString());
    assertEquals("semidefinite_cone", ProximalOperators.semidefiniteCone().toString());
    assertEquals("linsys(2x2)",
                 ProximalOperators.linearSystem(MatrixUtils.scaledIdentity(2, 1.0),
                                                MatrixUtils.columnVector(1.0, 1.0)).toString());
    assertEquals("squared_error(2x1)",
                 ProximalOperators.squaredError(MatrixUtils.columnVector(1.0, 1.0)).toString());
  }

}
