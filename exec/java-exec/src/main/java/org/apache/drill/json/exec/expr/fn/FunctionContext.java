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

import org.apache.drill.json.common.config.DrillJsonConfig;
import org.apache.drill.json.exec.expr.fn.json.extract.JsonExtractor;
import org.apache.drill.json.exec.expr.fn.json.extract.JsonValueRenderer;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonParserContext;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonParserContext.Backend;
import org.apache.drill.json.exec.expr.fn.json.path.JsonPathTokenCache;

/**
 * State owned by one function call site: the path cache, the parser
 * and the extraction engine. Never shared between call sites, so none
 * of it needs locking.
 */
public class FunctionContext {

  private final String functionName;
  private final JsonPathTokenCache pathCache;
  private final JsonParserContext parserContext;
  private final JsonExtractor extractor;
  private final Backend extractBackend;

  public FunctionContext(String functionName, DrillJsonConfig config) {
    this.functionName = functionName;
    this.pathCache = new JsonPathTokenCache(config.pathCacheSize());
    this.parserContext = new JsonParserContext(config);
    this.extractor = new JsonExtractor(new JsonValueRenderer(parserContext));
    this.extractBackend = Backend.fromConfig(config.extractBackend());
  }

  public String functionName() { return functionName; }

  public JsonPathTokenCache pathCache() { return pathCache; }

  public JsonParserContext parserContext() { return parserContext; }

  public JsonExtractor extractor() { return extractor; }

  public JsonValueRenderer renderer() { return extractor.renderer(); }

  /**
   * @return the backend {@code json_extract} uses for paths without a
   * wildcard
   */
  public Backend extractBackend() { return extractBackend; }
}
