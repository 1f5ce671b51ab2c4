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
package org.apache.drill.json.exec.expr.fn.json;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.drill.json.categories.JsonTest;
import org.apache.drill.json.common.config.DrillJsonConfig;
import org.apache.drill.json.common.exceptions.ErrorType;
import org.apache.drill.json.common.exceptions.UserException;
import org.apache.drill.json.exec.expr.fn.BaseTestJsonFunctions;
import org.apache.drill.json.exec.expr.fn.JsonFunctionRegistry;
import org.apache.drill.json.exec.vector.BigIntVector;
import org.apache.drill.json.exec.vector.BitVector;
import org.apache.drill.json.exec.vector.Float8Vector;
import org.apache.drill.json.exec.vector.VarCharVector;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.google.common.collect.ImmutableMap;

@Category(JsonTest.class)
public class TestJsonFunctions extends BaseTestJsonFunctions {

  @Test
  public void testJsonExtract() {
    VarCharVector input = json(
        "{\"a\":{\"b\":1}}",
        "{\"a\":[1,2,3]}",
        "not json",
        null,
        "1",
        "{\"b\":1}");
    expectVarChar(call("json_extract", input, literal("$.a", 6)),
        "{\"b\":1}", "[1,2,3]", null, null, null, null);
    expectVarChar(call("json_extract", input, literal("a[*]", 6)),
        null, "[1,2,3]", null, null, null, null);
    expectVarChar(call("json_extract", input, literal("a.b", 6)),
        "1", null, null, null, null, null);
  }

  @Test
  public void testJsonExtractStreamingBackend() {
    registry = JsonFunctionRegistry.builtIn(CONFIG.withValues(
        ImmutableMap.of(DrillJsonConfig.EXTRACT_BACKEND, "streaming")));
    VarCharVector input = json(
        "{\"a\":{\"b\":1}}",
        "{\"a\":[{\"b\":2},{\"c\":3}]}",
        "{\"a\":1,}");
    expectVarChar(call("json_extract", input, literal("a", 3)),
        "{\"b\":1}", "[{\"b\":2},{\"c\":3}]", null);

    // Wildcard paths still go to the tree
    expectVarChar(call("json_extract", input, literal("a[*].b", 3)),
        null, "[2]", null);
  }

  @Test
  public void testJsonExtractScalar() {
    VarCharVector input = json(
        "{\"a\":\"x\\ty\"}",
        "{\"a\":12}",
        "{\"a\":{\"b\":1}}",
        "{\"a\":[true]}",
        "[");
    expectVarChar(call("json_extract_scalar", input, literal("$.a", 5)),
        "x\ty", "12", null, null, null);
    expectVarChar(call("json_extract_scalar", input, literal("$.a[0]", 5)),
        null, null, null, "true", null);
  }

  @Test
  public void testJsonArrayLength() {
    expectBigInt(call("json_array_length", json("[1,2,3]", "[]", "{}", "[", "5", null)),
        3L, 0L, null, null, null, null);
  }

  @Test
  public void testJsonArrayContainsBigInt() {
    VarCharVector input = json(
        "[1,2,3]", "[\"2\"]", "[2.0]", "{\"a\":2}", "[1,", "[18446744073709551616]", "[3,[2]]");
    expectBit(call("json_array_contains", input, BigIntVector.constant("v", 2L, 7)),
        true, false, false, false, false, false, false);
    expectBit(call("json_array_contains", json("[18446744073709551616, 0]"), BigIntVector.flat("v", 0L)),
        true);
  }

  @Test
  public void testJsonArrayContainsVarChar() {
    VarCharVector input = json("[1,2,3]", "[\"2\"]", "[\"x\",\"2\"]", "[\"22\"]");
    expectBit(call("json_array_contains", input, VarCharVector.constant("v", "2", 4)),
        false, true, true, false);
  }

  @Test
  public void testJsonArrayContainsFloat8() {
    VarCharVector input = json("[2]", "[2.0]", "[1.5, 2.5]");
    expectBit(call("json_array_contains", input, Float8Vector.flat("v", 2.0, 2.0, 2.5)),
        false, true, true);
  }

  @Test
  public void testJsonArrayContainsBit() {
    VarCharVector input = json("[true]", "[1]", "[false, true]", "[\"true\"]", "[false]");
    expectBit(call("json_array_contains", input, BitVector.constant("v", true, 5)),
        true, false, true, false, false);
  }

  @Test
  public void testJsonArrayContainsNulls() {
    expectBit(call("json_array_contains", json("[1]", null), BigIntVector.flat("v", null, 1L)),
        null, null);
  }

  @Test
  public void testJsonKeys() {
    expectVarChar(call("json_keys", json("{\"x\":1,\"y\":2}", "{}", "[1]", "{\"q\\\"\":{\"n\":1}}", "{")),
        "[\"x\",\"y\"]", "[]", null, "[\"q\\\"\"]", null);
  }

  @Test
  public void testJsonSize() {
    String doc = "{\"a\":[1,2,3],\"o\":{\"k\":1},\"s\":\"t\"}";
    VarCharVector input = json(doc, doc, doc, doc, doc, "{");
    VarCharVector paths = VarCharVector.flat("path", "$.a", "$.o", "$.s", "$.b", "$.", "$");
    expectBigInt(call("json_size", input, paths), 3L, 1L, 0L, null, null, null);
  }

  @Test
  public void testIsJsonScalar() {
    expectBit(call("is_json_scalar", json("1", "\"a\"", "null", "{}", "[1]", "[", null)),
        true, true, true, false, false, false, null);
  }

  @Test
  public void testJsonParse() {
    expectVarChar(call("json_parse", json(" {\"a\" : [1, 2.0] } ", "\"s\"", null)),
        "{\"a\":[1,2.0]}", "\"s\"", null);
  }

  @Test
  public void testJsonParseFailsOnMalformed() {
    try {
      call("json_parse", json("{\"a\":1}", "{\"a\":"));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.DATA_READ, e.getErrorType());
      assertEquals("Cannot convert '{\"a\":' to JSON", e.getOriginalMessage());
      assertTrue(e.getContext().contains("Row 1"));
    }
  }

  @Test
  public void testOutOfRangeNumbersAreMalformed() {
    VarCharVector input = json("{\"a\":1e400}", "{\"a\":1e300}", "{\"a\":1,\"b\":[-1e400]}");
    expectVarChar(call("json_extract", input, literal("$.a", 3)), null, "1.0E300", null);
    expectVarChar(call("json_extract_scalar", input, literal("$.a", 3)), null, "1.0E300", null);
    expectBigInt(call("json_valid", input), 0L, 1L, 0L);
    expectBigInt(call("json_size", input, literal("$", 3)), null, 1L, null);
  }

  @Test
  public void testJsonParseFailsOnOutOfRangeNumber() {
    try {
      call("json_parse", json("[1e400]"));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.DATA_READ, e.getErrorType());
    }
  }

  @Test
  public void testJsonFormat() {
    expectVarChar(call("json_format", json("[ 1 , {\"b\" : null} ]", "{\"a\":", "")),
        "[1,{\"b\":null}]", null, null);
  }

  @Test
  public void testJsonValid() {
    expectBigInt(call("json_valid", json("{}", "[1, {\"a\": [null]}]", "42", "{", "", "{} {}", "[1,]", null)),
        1L, 1L, 1L, 0L, 0L, 0L, 0L, null);
  }
}
