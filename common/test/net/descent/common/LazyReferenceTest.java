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

import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

public final class LazyReferenceTest extends DescentTest {

  @Test
  public void testCreatesOnce() {
    final AtomicInteger calls = new AtomicInteger();
    LazyReference<String> reference = new LazyReference<String>(new Callable<String>() {
      @Override
      public String call() {
        calls.incrementAndGet();
        return "value";
      }
    });
    assertEquals(0, calls.get());
    assertEquals("value", reference.get());
    assertEquals("value", reference.get());
    assertEquals(1, calls.get());
  }

  @Test
  public void testFailureNotCached() {
    final AtomicInteger calls = new AtomicInteger();
    LazyReference<String> reference = new LazyReference<String>(new Callable<String>() {
      @Override
      public String call() {
        calls.incrementAndGet();
        throw new UnsupportedOperationException();
      }
    });
    for (int i = 0; i < 2; i++) {
      try {
        reference.get();
        fail();
      } catch (UnsupportedOperationException uoe) {
        // expected
      }
    }
    assertEquals(2, calls.get());
  }

  @Test(expected = IllegalStateException.class)
  public void testCheckedExceptionWrapped() {
    new LazyReference<String>(new Callable<String>() {
      @Override
      public String call() throws Exception {
        throw new Exception("nope");
      }
    }).get();
  }

}
