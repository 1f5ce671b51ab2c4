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

import org.apache.drill.json.common.exceptions.UserException;
import org.apache.drill.json.common.types.MinorType;
import org.apache.drill.json.exec.expr.fn.BigIntJsonFunction;
import org.apache.drill.json.exec.expr.fn.BitJsonFunction;
import org.apache.drill.json.exec.expr.fn.FunctionTemplate;
import org.apache.drill.json.exec.expr.fn.VarCharJsonFunction;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonDocument;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonElement;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonParserContext.Backend;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonType;
import org.apache.drill.json.exec.expr.fn.json.parser.MalformedJsonException;
import org.apache.drill.json.exec.vector.ValueVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Functions that check, describe or normalize a whole JSON document.
 */
public class JsonInspectFunctions {
  private static final Logger logger = LoggerFactory.getLogger(JsonInspectFunctions.class);

  private JsonInspectFunctions() { }

  // VARCHAR json_keys(VARCHAR json)

  @FunctionTemplate(
      names = "json_keys",
      params = MinorType.VARCHAR,
      output = MinorType.VARCHAR)
  public static class JsonKeysFunction extends VarCharJsonFunction {

    @Override
    protected String compute(int row, ValueVector[] args) {
      try (JsonDocument doc = parse(row, args[0], Backend.STREAMING)) {
        JsonElement root = doc.root();
        return root.type() == JsonType.OBJECT ? context.renderer().renderFieldNames(root) : null;
      }
    }
  }

  // BIT is_json_scalar(VARCHAR json)

  @FunctionTemplate(
      names = "is_json_scalar",
      params = MinorType.VARCHAR,
      output = MinorType.BIT)
  public static class IsJsonScalarFunction extends BitJsonFunction {

    @Override
    protected Boolean compute(int row, ValueVector[] args) {
      try (JsonDocument doc = parse(row, args[0], Backend.STREAMING)) {
        return doc.root().type().isScalar();
      }
    }
  }

  // VARCHAR json_parse(VARCHAR json)
  // Fails the query on malformed input.

  @FunctionTemplate(
      names = "json_parse",
      params = MinorType.VARCHAR,
      output = MinorType.VARCHAR)
  public static class JsonParseFunction extends VarCharJsonFunction {

    @Override
    protected String compute(int row, ValueVector[] args) {
      try (JsonDocument doc = parse(row, args[0], Backend.TREE)) {
        return context.renderer().renderStructural(doc.root());
      } catch (MalformedJsonException e) {
        throw UserException.dataReadError(e)
            .message("Cannot convert '%s' to JSON", text(args[0], row))
            .addContext("Function", context.functionName())
            .addContext("Row", row)
            .build(logger);
      }
    }
  }

  // VARCHAR json_format(VARCHAR json)
  // Same output as json_parse, but null on malformed input.

  @FunctionTemplate(
      names = "json_format",
      params = MinorType.VARCHAR,
      output = MinorType.VARCHAR)
  public static class JsonFormatFunction extends VarCharJsonFunction {

    @Override
    protected String compute(int row, ValueVector[] args) {
      try (JsonDocument doc = parse(row, args[0], Backend.TREE)) {
        return context.renderer().renderStructural(doc.root());
      }
    }
  }

  // BIGINT json_valid(VARCHAR json)

  @FunctionTemplate(
      names = "json_valid",
      params = MinorType.VARCHAR,
      output = MinorType.BIGINT)
  public static class JsonValidFunction extends BigIntJsonFunction {

    @Override
    protected Long failureValue() {
      return 0L;
    }

    @Override
    protected Long compute(int row, ValueVector[] args) {
      try (JsonDocument doc = parse(row, args[0], Backend.STREAMING)) {
        return 1L;
      }
    }
  }
}
