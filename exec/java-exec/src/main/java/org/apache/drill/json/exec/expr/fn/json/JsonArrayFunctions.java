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

import java.util.Iterator;

import org.apache.drill.json.common.types.MinorType;
import org.apache.drill.json.exec.expr.fn.BigIntJsonFunction;
import org.apache.drill.json.exec.expr.fn.BitJsonFunction;
import org.apache.drill.json.exec.expr.fn.FunctionTemplate;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonDocument;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonElement;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonParserContext.Backend;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonType;
import org.apache.drill.json.exec.vector.BigIntVector;
import org.apache.drill.json.exec.vector.BitVector;
import org.apache.drill.json.exec.vector.Float8Vector;
import org.apache.drill.json.exec.vector.ValueVector;

/**
 * Functions over a top-level JSON array.
 */
public class JsonArrayFunctions {

  private JsonArrayFunctions() { }

  // BIGINT json_array_length(VARCHAR json)

  @FunctionTemplate(
      names = "json_array_length",
      params = MinorType.VARCHAR,
      output = MinorType.BIGINT)
  public static class JsonArrayLengthFunction extends BigIntJsonFunction {

    @Override
    protected Long compute(int row, ValueVector[] args) {
      try (JsonDocument doc = parse(row, args[0], Backend.STREAMING)) {
        JsonElement root = doc.root();
        return root.type() == JsonType.ARRAY ? (long) root.size() : null;
      }
    }
  }

  /**
   * Shared scan for the {@code json_array_contains} overloads. Stops at
   * the first match; elements of other JSON types never match.
   */
  public abstract static class ArrayContainsFunction extends BitJsonFunction {

    @Override
    protected Boolean compute(int row, ValueVector[] args) {
      try (JsonDocument doc = parse(row, args[0], Backend.STREAMING)) {
        JsonElement root = doc.root();
        if (root.type() != JsonType.ARRAY) {
          return false;
        }
        Iterator<JsonElement> elements = root.elements();
        while (elements.hasNext()) {
          if (matches(elements.next(), args[1], row)) {
            return true;
          }
        }
        return false;
      }
    }

    protected abstract boolean matches(JsonElement element, ValueVector search, int row);
  }

  // BIT json_array_contains(VARCHAR json, BIT value)

  @FunctionTemplate(
      names = "json_array_contains",
      params = {MinorType.VARCHAR, MinorType.BIT},
      output = MinorType.BIT)
  public static class ContainsBooleanFunction extends ArrayContainsFunction {

    @Override
    protected boolean matches(JsonElement element, ValueVector search, int row) {
      return element.type() == JsonType.BOOLEAN
          && element.booleanValue() == ((BitVector) search).getAccessor().get(row);
    }
  }

  // BIT json_array_contains(VARCHAR json, BIGINT value)

  @FunctionTemplate(
      names = "json_array_contains",
      params = {MinorType.VARCHAR, MinorType.BIGINT},
      output = MinorType.BIT)
  public static class ContainsBigIntFunction extends ArrayContainsFunction {

    @Override
    protected boolean matches(JsonElement element, ValueVector search, int row) {
      return element.type() == JsonType.INTEGER
          && element.fitsInLong()
          && element.longValue() == ((BigIntVector) search).getAccessor().get(row);
    }
  }

  // BIT json_array_contains(VARCHAR json, FLOAT8 value)

  @FunctionTemplate(
      names = "json_array_contains",
      params = {MinorType.VARCHAR, MinorType.FLOAT8},
      output = MinorType.BIT)
  public static class ContainsFloat8Function extends ArrayContainsFunction {

    @Override
    protected boolean matches(JsonElement element, ValueVector search, int row) {
      return element.type() == JsonType.FLOAT
          && element.doubleValue() == ((Float8Vector) search).getAccessor().get(row);
    }
  }

  // BIT json_array_contains(VARCHAR json, VARCHAR value)

  @FunctionTemplate(
      names = "json_array_contains",
      params = {MinorType.VARCHAR, MinorType.VARCHAR},
      output = MinorType.BIT)
  public static class ContainsVarCharFunction extends ArrayContainsFunction {

    @Override
    protected boolean matches(JsonElement element, ValueVector search, int row) {
      return element.type() == JsonType.STRING
          && element.stringValue().equals(text(search, row));
    }
  }
}
