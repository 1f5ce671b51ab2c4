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
package org.apache.drill.json.exec.expr.fn.json.extract;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.drill.json.exec.expr.fn.json.extract.JsonValueRenderer.Mode;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonDocument;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonElement;
import org.apache.drill.json.exec.expr.fn.json.path.JsonPathToken;

import com.fasterxml.jackson.core.JsonPointer;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * Walks a parsed document along a token path and renders what it
 * finds.
 * <p>
 * Structural extraction follows the tokens one step at a time. A
 * wildcard over an array applies the rest of the path to every element
 * and gathers the non-null results into a new array; a wildcard over
 * an object matches nothing. Scalar extraction and size lookups turn
 * the tokens into a single JSON pointer and resolve it directly, which
 * the streaming backend does without reading past the target.
 * <p>
 * Each method returns {@code null} when the path does not resolve.
 */
public class JsonExtractor {

  private static final Joiner COMMA = Joiner.on(',');

  private final JsonValueRenderer renderer;

  public JsonExtractor(JsonValueRenderer renderer) {
    this.renderer = renderer;
  }

  public JsonValueRenderer renderer() { return renderer; }

  /**
   * Extracts the JSON text at the path. The document root must be an
   * object or an array.
   */
  public String extract(JsonDocument doc, List<JsonPathToken> tokens) {
    JsonElement root = doc.root();
    if (! root.type().isContainer()) {
      return null;
    }
    if (! doc.isRandomAccess()) {
      Preconditions.checkArgument(! hasWildcard(tokens),
          "Wildcard paths need a random-access document");
    }
    return navigate(root, tokens, 0);
  }

  /**
   * Resolves {@code tokens[index...]} against the value.
   */
  public String navigate(JsonElement value, List<JsonPathToken> tokens, int index) {
    if (index == tokens.size()) {
      return renderer.render(value, Mode.STRUCTURAL);
    }
    JsonPathToken token = tokens.get(index);
    switch (value.type()) {
      case OBJECT:
        if (token.isWildcard()) {
          return null;
        }
        JsonElement field = value.field(token.name());
        return field == null ? null : navigate(field, tokens, index + 1);
      case ARRAY:
        if (token.isWildcard()) {
          return expandWildcard(value, tokens, index + 1);
        }
        int arrayIndex = token.arrayIndex();
        if (arrayIndex < 0) {
          return null;
        }
        JsonElement element = value.element(arrayIndex);
        return element == null ? null : navigate(element, tokens, index + 1);
      default:
        return null;
    }
  }

  private String expandWildcard(JsonElement array, List<JsonPathToken> tokens, int next) {
    List<String> matches = new ArrayList<>();
    Iterator<JsonElement> elements = array.elements();
    while (elements.hasNext()) {
      String result = navigate(elements.next(), tokens, next);
      if (result != null) {
        matches.add(result);
      }
    }
    return "[" + COMMA.join(matches) + "]";
  }

  /**
   * Extracts the scalar at the path as plain text. Objects, arrays and
   * wildcard paths give {@code null}.
   */
  public String extractScalar(JsonDocument doc, List<JsonPathToken> tokens) {
    JsonElement target = lookup(doc, tokens);
    return target == null ? null : renderer.render(target, Mode.SCALAR);
  }

  /**
   * @return the number of elements or fields of the value at the path,
   * 0 if it is a scalar, or {@code null} if the path does not resolve
   */
  public Long size(JsonDocument doc, List<JsonPathToken> tokens) {
    JsonElement target = lookup(doc, tokens);
    return target == null ? null : (long) target.size();
  }

  private JsonElement lookup(JsonDocument doc, List<JsonPathToken> tokens) {
    if (hasWildcard(tokens)) {
      return null;
    }
    return doc.root().at(toPointer(tokens));
  }

  public static boolean hasWildcard(List<JsonPathToken> tokens) {
    for (JsonPathToken token : tokens) {
      if (token.isWildcard()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Converts tokens to an RFC 6901 pointer, escaping {@code ~} and
   * {@code /} within names. No tokens gives the root pointer.
   */
  public static JsonPointer toPointer(List<JsonPathToken> tokens) {
    if (tokens.isEmpty()) {
      return JsonPointer.empty();
    }
    StringBuilder buf = new StringBuilder();
    for (JsonPathToken token : tokens) {
      buf.append('/');
      String name = token.name();
      for (int i = 0; i < name.length(); i++) {
        char c = name.charAt(i);
        if (c == '~') {
          buf.append("~0");
        } else if (c == '/') {
          buf.append("~1");
        } else {
          buf.append(c);
        }
      }
    }
    return JsonPointer.compile(buf.toString());
  }
}
