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

import org.junit.Test;

public final class LangUtilsTest extends DescentTest {

  @Test(expected = IllegalArgumentException.class)
  public void testDoubleNaN() {
    LangUtils.parseDouble("NaN");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDoubleInf() {
    LangUtils.parseDouble("Infinity");
  }

  @Test
  public void testDouble() {
    assertEquals(3.1, LangUtils.parseDouble("3.1"));
  }

  @Test
  public void testIsFinite() {
    assertTrue(LangUtils.isFinite(0.0));
    assertTrue(LangUtils.isFinite(-Double.MAX_VALUE));
    assertFalse(LangUtils.isFinite(Double.NaN));
    assertFalse(LangUtils.isFinite(Double.NEGATIVE_INFINITY));
  }

  @Test
  public void testPropertyDefaults() {
    assertEquals(2.5, LangUtils.getPositiveDoubleProperty("descent.test.unset", 2.5));
    assertEquals(7, LangUtils.getPositiveIntProperty("descent.test.unset", 7));
  }

  @Test
  public void testPropertyValues() {
    System.setProperty("descent.test.double", " 0.25 ");
    System.setProperty("descent.test.int", "12");
    try {
      assertEquals(0.25, LangUtils.getPositiveDoubleProperty("descent.test.double", 1.0));
      assertEquals(12, LangUtils.getPositiveIntProperty("descent.test.int", 1));
    } finally {
      System.clearProperty("descent.test.double");
      System.clearProperty("descent.test.int");
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveProperty() {
    System.setProperty("descent.test.int", "0");
    try {
      LangUtils.getPositiveIntProperty("descent.test.int", 1);
    } finally {
      System.clearProperty("descent.test.int");
    }
  }

}
