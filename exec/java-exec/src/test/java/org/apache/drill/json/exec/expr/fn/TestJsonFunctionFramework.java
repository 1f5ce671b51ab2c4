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
package org.apache.drill.json.exec.expr.fn;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.drill.json.categories.JsonTest;
import org.apache.drill.json.common.config.DrillJsonConfig;
import org.apache.drill.json.common.exceptions.ErrorType;
import org.apache.drill.json.common.exceptions.UserException;
import org.apache.drill.json.common.types.MinorType;
import org.apache.drill.json.exec.vector.BigIntVector;
import org.apache.drill.json.exec.vector.ValueVector;
import org.apache.drill.json.exec.vector.VarCharVector;
import org.apache.drill.json.exec.vector.VectorEncoding;
import org.junit.Test;
import org.junit.experimental.categories.Category;

import com.google.common.collect.ImmutableMap;

@Category(JsonTest.class)
public class TestJsonFunctionFramework extends BaseTestJsonFunctions {

  /**
   * Functions used only to check how the row loop treats errors.
   */
  public static class ErrorFunctions {

    @FunctionTemplate(
        names = "fail_on_b",
        params = MinorType.VARCHAR,
        output = MinorType.VARCHAR)
    public static class FailingFunction extends VarCharJsonFunction {

      @Override
      protected String compute(int row, ValueVector[] args) {
        String value = text(args[0], row);
        if (value.equals("b")) {
          throw new IllegalStateException("bad row");
        }
        return value.toUpperCase();
      }
    }
  }

  @Test
  public void testSignatures() {
    assertTrue(registry.contains("json_extract", MinorType.VARCHAR, MinorType.VARCHAR));
    assertTrue(registry.contains("JSON_EXTRACT", MinorType.VARCHAR, MinorType.VARCHAR));
    assertTrue(registry.contains("json_array_contains", MinorType.VARCHAR, MinorType.BIT));
    assertTrue(registry.contains("json_array_contains", MinorType.VARCHAR, MinorType.BIGINT));
    assertTrue(registry.contains("json_array_contains", MinorType.VARCHAR, MinorType.FLOAT8));
    assertTrue(registry.contains("json_array_contains", MinorType.VARCHAR, MinorType.VARCHAR));
    assertFalse(registry.contains("json_extract", MinorType.VARCHAR));
    assertEquals(13, registry.signatures().size());
  }

  @Test
  public void testUnknownFunction() {
    try {
      call("json_extract", json("{}"));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
      assertEquals("No function matches json_extract(VARCHAR)", e.getOriginalMessage());
    }
  }

  @Test
  public void testInvalidLiteralPathFailsAtSetup() {
    try {
      registry.newCall("json_extract", json("{\"a\":1}"), literal("$.a.", 1));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALIDATION, e.getErrorType());
      assertEquals("Invalid JSON path: $.a.", e.getOriginalMessage());
      assertTrue(e.getContext().contains("Function json_extract"));
    }
  }

  @Test
  public void testInvalidRowPathGivesNull() {
    VarCharVector input = json("{\"a\":1}", "{\"a\":2}", "{\"a\":3}");
    VarCharVector paths = VarCharVector.flat("path", "a", "$[", "$.a");
    expectVarChar(call("json_extract", input, paths), "1", null, "3");
    expectVarChar(call("json_extract_scalar", input, paths), "1", null, "3");
  }

  @Test
  public void testNullLiteralPath() {
    VarCharVector input = json("{\"a\":1}", "{\"a\":2}");
    expectVarChar(call("json_extract", input, VarCharVector.constant("path", null, 2)), null, null);
  }

  @Test
  public void testConstantArguments() {
    String doc = "{\"a\":[1,{\"b\":\"c\"}]}";
    ValueVector constant = call("json_extract", VarCharVector.constant("json", doc, 4), literal("a[1]", 4));
    assertTrue(constant.isConstant());
    expectVarChar(constant, "{\"b\":\"c\"}", "{\"b\":\"c\"}", "{\"b\":\"c\"}", "{\"b\":\"c\"}");

    ValueVector flat = call("json_extract", json(doc, doc, doc, doc), literal("a[1]", 4));
    assertFalse(flat.isConstant());
    for (int i = 0; i < 4; i++) {
      assertEquals(constant.getAccessor().getObject(i), flat.getAccessor().getObject(i));
    }
  }

  @Test
  public void testConstantJsonWithRowPaths() {
    String doc = "{\"a\":[10,20],\"b\":{\"c\":true}}";
    VarCharVector input = VarCharVector.constant("json", doc, 4);
    VarCharVector paths = VarCharVector.flat("path", "a[1]", "b", "a[*]", "x");
    expectVarChar(call("json_extract", input, paths), "20", "{\"c\":true}", "[10,20]", null);

    // A malformed constant document fails every row the same way
    VarCharVector bad = VarCharVector.constant("json", "{", 3);
    expectVarChar(call("json_extract", bad, VarCharVector.flat("path", "a", "b", "c")), null, null, null);
  }

  @Test
  public void testConstantNullInput() {
    ValueVector result = call("json_array_length", VarCharVector.constant("json", null, 3));
    assertTrue(result.isConstant());
    expectBigInt(result, null, null, null);
  }

  @Test
  public void testCacheDoesNotChangeResults() {
    JsonFunctionRegistry uncached = JsonFunctionRegistry.builtIn(CONFIG.withValues(
        ImmutableMap.of(DrillJsonConfig.PATH_CACHE_SIZE, 0)));
    JsonFunctionRegistry tiny = JsonFunctionRegistry.builtIn(CONFIG.withValues(
        ImmutableMap.of(DrillJsonConfig.PATH_CACHE_SIZE, 1)));
    String doc = "{\"a\":{\"b\":[1,2]},\"c\":\"d\"}";
    String[] pathText = {"a", "a.b", "a", "c", "a.b[1]", "$[", "a.b[*]", "c", "a"};
    String[] docs = new String[pathText.length];
    Arrays.fill(docs, doc);
    VarCharVector input = json(docs);
    VarCharVector paths = VarCharVector.flat("path", pathText);
    int n = pathText.length;

    ValueVector expected = registry.newCall("json_extract", input, paths).eval(n, input, paths);
    ValueVector noCache = uncached.newCall("json_extract", input, paths).eval(n, input, paths);
    ValueVector small = tiny.newCall("json_extract", input, paths).eval(n, input, paths);
    for (int i = 0; i < n; i++) {
      assertEquals(expected.getAccessor().getObject(i), noCache.getAccessor().getObject(i));
      assertEquals(expected.getAccessor().getObject(i), small.getAccessor().getObject(i));
    }
  }

  @Test
  public void testSeveralBatches() {
    JsonFunction function = registry.newCall("json_extract_scalar", json("{\"a\":1}"), literal("a", 1));
    VarCharVector first = json("{\"a\":1}");
    expectVarChar(function.eval(1, first, literal("a", 1)), "1");
    VarCharVector second = json("{\"a\":2}", "{\"a\":\"x\"}");
    expectVarChar(function.eval(2, second, literal("a", 2)), "2", "x");

    // Later batches may carry a different path
    expectVarChar(function.eval(2, second, literal("b", 2)), null, null);
  }

  @Test
  public void testEmptyBatch() {
    ValueVector result = call("json_extract", json(), literal("a", 0));
    assertEquals(0, result.getAccessor().getValueCount());
  }

  @Test
  public void testUnexpectedErrorIsFatal() {
    registry.register(ErrorFunctions.class);
    expectVarChar(call("fail_on_b", json("a", null)), "A", null);
    try {
      call("fail_on_b", json("a", "b"));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.SYSTEM, e.getErrorType());
      assertTrue(e.getCause() instanceof IllegalStateException);
      assertTrue(e.getContext().contains("Function fail_on_b"));
      assertTrue(e.getContext().contains("Row 1"));
    }
  }

  private static VarCharVector rawJson(byte[]... rows) {
    VarCharVector vector = new VarCharVector("json", VectorEncoding.FLAT);
    for (int i = 0; i < rows.length; i++) {
      vector.getMutator().setSafe(i, rows[i]);
    }
    vector.getMutator().setValueCount(rows.length);
    return vector;
  }

  @Test
  public void testNonUtf8RowIsMalformed() {
    VarCharVector input = rawJson(
        new byte[] {0, 0, 0, '[', 0x7F, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF},
        "[1]".getBytes(StandardCharsets.UTF_8),
        "[1,2,3]".getBytes(StandardCharsets.UTF_16LE),
        new byte[] {'[', '"', (byte) 0xC3, '"', ']'});
    expectBigInt(call("json_valid", input), 0L, 1L, 0L, 0L);
    expectVarChar(call("json_extract", input, literal("$[0]", 4)), null, "1", null, null);
    expectVarChar(call("json_extract_scalar", input, literal("$[0]", 4)), null, "1", null, null);
    expectBigInt(call("json_array_length", input), null, 1L, null, null);
    expectBigInt(call("json_size", input, literal("$", 4)), null, 1L, null, null);
  }

  @Test(expected = IllegalStateException.class)
  public void testDuplicateRegistration() {
    registry.register(ErrorFunctions.class);
    registry.register(ErrorFunctions.class);
  }

  @Test
  public void testBigIntArgumentTypes() {
    expectBit(call("json_array_contains", json("[5]", "[6]"), BigIntVector.constant("v", 5L, 2)),
        true, false);
  }
}
