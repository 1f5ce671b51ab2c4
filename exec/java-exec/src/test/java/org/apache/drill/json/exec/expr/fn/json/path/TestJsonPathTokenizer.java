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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.drill.json.categories.JsonTest;
import org.junit.Test;
import org.junit.experimental.categories.Category;

@Category(JsonTest.class)
public class TestJsonPathTokenizer {

  private static List<JsonPathToken> tokens(Object... parts) {
    JsonPathToken[] result = new JsonPathToken[parts.length];
    for (int i = 0; i < parts.length; i++) {
      result[i] = parts[i] == JsonPathToken.WILDCARD
          ? JsonPathToken.WILDCARD : JsonPathToken.of((String) parts[i]);
    }
    return Arrays.asList(result);
  }

  private static void expectInvalid(String path, int position) {
    try {
      JsonPathTokenizer.tokenize(path);
      fail("Expected an invalid path: " + path);
    } catch (InvalidJsonPathException e) {
      assertEquals(path, e.getPath());
      assertEquals(position, e.getPosition());
    }
  }

  @Test
  public void testRoot() {
    assertEquals(Collections.emptyList(), JsonPathTokenizer.tokenize("$"));
  }

  @Test
  public void testDotted() {
    assertEquals(tokens("a", "b"), JsonPathTokenizer.tokenize("$.a.b"));

    // The root marker is optional
    assertEquals(tokens("a", "b"), JsonPathTokenizer.tokenize("a.b"));
    assertEquals(tokens("a-b:c", "d_1"), JsonPathTokenizer.tokenize("$.a-b:c.d_1"));

    // Digits in dotted form are plain keys that may index arrays
    assertEquals(tokens("a", "0"), JsonPathTokenizer.tokenize("a.0"));
  }

  @Test
  public void testBrackets() {
    assertEquals(tokens("store", "book", "0", "title"),
        JsonPathTokenizer.tokenize("$.store.book[0].title"));
    assertEquals(tokens("0", "1"), JsonPathTokenizer.tokenize("$[0][1]"));
    assertEquals(tokens("0"), JsonPathTokenizer.tokenize("[0]"));
    assertEquals(tokens("key with.dot"), JsonPathTokenizer.tokenize("$[\"key with.dot\"]"));
    assertEquals(tokens(""), JsonPathTokenizer.tokenize("$[\"\"]"));
  }

  @Test
  public void testQuotedEscapes() {
    assertEquals(tokens("a\"b\\c"), JsonPathTokenizer.tokenize("$[\"a\\\"b\\\\c\"]"));
  }

  @Test
  public void testWildcard() {
    assertEquals(tokens("a", JsonPathToken.WILDCARD), JsonPathTokenizer.tokenize("a[*]"));
    assertEquals(tokens("a", JsonPathToken.WILDCARD, "b"), JsonPathTokenizer.tokenize("$.a.*.b"));
    assertTrue(JsonPathTokenizer.tokenize("$[*]").get(0).isWildcard());

    // Quoted, the star is an ordinary field name
    List<JsonPathToken> quoted = JsonPathTokenizer.tokenize("$[\"*\"]");
    assertFalse(quoted.get(0).isWildcard());
    assertEquals("*", quoted.get(0).name());
  }

  @Test
  public void testArrayIndex() {
    assertEquals(0, JsonPathToken.of("0").arrayIndex());
    assertEquals(12, JsonPathToken.of("12").arrayIndex());
    assertEquals(-1, JsonPathToken.of("01").arrayIndex());
    assertEquals(-1, JsonPathToken.of("-1").arrayIndex());
    assertEquals(-1, JsonPathToken.of("a").arrayIndex());
    assertEquals(-1, JsonPathToken.of("").arrayIndex());
    assertEquals(-1, JsonPathToken.of("99999999999").arrayIndex());
    assertEquals(-1, JsonPathToken.WILDCARD.arrayIndex());
  }

  @Test
  public void testInvalid() {
    expectInvalid("", 0);
    expectInvalid("$.", 2);
    expectInvalid("$.a.", 4);
    expectInvalid("$[]", 2);
    expectInvalid("$[0", 3);
    expectInvalid("$[\"a", 4);
    expectInvalid("$.a b", 3);
    expectInvalid("$.a*", 3);
    expectInvalid("$..a", 2);
    expectInvalid("$$", 1);
    expectInvalid("$[\"a\\n\"]", 5);
    expectInvalid("$[a.b]", 3);
  }

  @Test(expected = InvalidJsonPathException.class)
  public void testNullPath() {
    JsonPathTokenizer.tokenize(null);
  }
}
