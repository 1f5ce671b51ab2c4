/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.drill.json.exec.expr.fn.json.path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.List;

import org.apache.drill.json.categories.JsonTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(JsonTest.class)
public class TestJsonPathTokenCache {

  @Test
  public void testHitReturnsSameTokens() {
    JsonPathTokenCache cache = new JsonPathTokenCache();
    assertEquals(JsonPathTokenCache.DEFAULT_CAPACITY, cache.capacity());
    List<JsonPathToken> first = cache.resolve("$.a.b");
    List<JsonPathToken> second = cache.resolve("$.a.b");
    assertSame(first, second);
    assertEquals(1, cache.size());
    assertEquals(1, cache.stats().hitCount());
    assertEquals(1, cache.stats().missCount());
  }

  @Test
  public void testEviction() {
    JsonPathTokenCache cache = new JsonPathTokenCache(2);
    cache.resolve("a");
    cache.resolve("b");

    // Touch "a" so that "b" is the least recently used
    cache.resolve("a");
    cache.resolve("c");
    assertEquals(2, cache.size());
    assertEquals(1, cache.stats().hitCount());

    cache.resolve("a");
    assertEquals(2, cache.stats().hitCount());
    cache.resolve("b");
    assertEquals(2, cache.stats().hitCount());
    assertEquals(4, cache.stats().missCount());
  }

  @Test
  public void testZeroCapacity() {
    JsonPathTokenCache cache = new JsonPathTokenCache(0);
    List<JsonPathToken> first = cache.resolve("$.a[0]");
    List<JsonPathToken> second = cache.resolve("$.a[0]");
    assertNotSame(first, second);
    assertEquals(first, second);
    assertEquals(0, cache.size());
  }

  @Test
  public void testInvalidPathNotCached() {
    JsonPathTokenCache cache = new JsonPathTokenCache();
    for (int i = 0; i < 2; i++) {
      try {
        cache.resolve("$.");
        fail();
      } catch (InvalidJsonPathException e) {
        // expected
      }
    }
    assertEquals(0, cache.size());
    assertEquals(2, cache.stats().missCount());
  }

  @Test
  public void testClear() {
    JsonPathTokenCache cache = new JsonPathTokenCache();
    cache.resolve("a");
    cache.clear();
    assertEquals(0, cache.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeCapacity() {
    new JsonPathTokenCache(-1);
  }
}
