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

import java.util.List;

import org.apache.drill.json.common.types.MinorType;
import org.apache.drill.json.exec.expr.fn.BigIntJsonFunction;
import org.apache.drill.json.exec.expr.fn.FunctionTemplate;
import org.apache.drill.json.exec.expr.fn.VarCharJsonFunction;
import org.apache.drill.json.exec.expr.fn.json.extract.JsonExtractor;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonDocument;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonParserContext.Backend;
import org.apache.drill.json.exec.expr.fn.json.path.JsonPathToken;
import org.apache.drill.json.exec.vector.ValueVector;

/**
 * Functions that navigate a JSON document along a path.
 */
public class JsonExtractFunctions {

  private JsonExtractFunctions() { }

  // VARCHAR json_extract(VARCHAR json, VARCHAR path)

  @FunctionTemplate(
      names = "json_extract",
      params = {MinorType.VARCHAR, MinorType.VARCHAR},
      output = MinorType.VARCHAR)
  public static class JsonExtractFunction extends VarCharJsonFunction {

    @Override
    protected int pathArgIndex() { return 1; }

    @Override
    protected String compute(int row, ValueVector[] args) {
      List<JsonPathToken> path = path(row, args[1]);

      // Wildcards revisit elements, which only the tree can do.
      Backend backend = JsonExtractor.hasWildcard(path) ? Backend.TREE : context.extractBackend();
      try (JsonDocument doc = parse(row, args[0], backend)) {
        return context.extractor().extract(doc, path);
      }
    }
  }

  // VARCHAR json_extract_scalar(VARCHAR json, VARCHAR path)

  @FunctionTemplate(
      names = "json_extract_scalar",
      params = {MinorType.VARCHAR, MinorType.VARCHAR},
      output = MinorType.VARCHAR)
  public static class JsonExtractScalarFunction extends VarCharJsonFunction {

    @Override
    protected int pathArgIndex() { return 1; }

    @Override
    protected String compute(int row, ValueVector[] args) {
      List<JsonPathToken> path = path(row, args[1]);
      try (JsonDocument doc = parse(row, args[0], Backend.STREAMING)) {
        return context.extractor().extractScalar(doc, path);
      }
    }
  }

  // BIGINT json_size(VARCHAR json, VARCHAR path)

  @FunctionTemplate(
      names = "json_size",
      params = {MinorType.VARCHAR, MinorType.VARCHAR},
      output = MinorType.BIGINT)
  public static class JsonSizeFunction extends BigIntJsonFunction {

    @Override
    protected int pathArgIndex() { return 1; }

    @Override
    protected Long compute(int row, ValueVector[] args) {
      List<JsonPathToken> path = path(row, args[1]);
      try (JsonDocument doc = parse(row, args[0], Backend.STREAMING)) {
        return context.extractor().size(doc, path);
      }
    }
  }
}
