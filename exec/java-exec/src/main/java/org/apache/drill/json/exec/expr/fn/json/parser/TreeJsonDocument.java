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
package org.apache.drill.json.exec.expr.fn.json.parser;

import java.io.IOException;
import java.util.Iterator;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

/**
 * Fully materialized document backed by a Jackson {@link JsonNode} tree.
 * Supports revisiting values, which wildcard expansion needs.
 */
public class TreeJsonDocument implements JsonDocument {

  private final ObjectMapper mapper;
  private final TreeElement root;

  TreeJsonDocument(ObjectMapper mapper, JsonNode rootNode) {
    this.mapper = mapper;
    this.root = new TreeElement(rootNode);
  }

  @Override
  public JsonElement root() { return root; }

  @Override
  public boolean isRandomAccess() { return true; }

  @Override
  public void close() { }

  private JsonElement wrap(JsonNode node) {
    return node == null || node.isMissingNode() ? null : new TreeElement(node);
  }

  private class TreeElement implements JsonElement {

    private final JsonNode node;

    TreeElement(JsonNode node) {
      this.node = node;
    }

    @Override
    public JsonType type() {
      switch (node.getNodeType()) {
        case OBJECT:
          return JsonType.OBJECT;
        case ARRAY:
          return JsonType.ARRAY;
        case STRING:
          return JsonType.STRING;
        case NUMBER:
          return node.isIntegralNumber() ? JsonType.INTEGER : JsonType.FLOAT;
        case BOOLEAN:
          return JsonType.BOOLEAN;
        case NULL:
          return JsonType.NULL;
        default:
          throw new IllegalStateException("Unexpected JSON node type: " + node.getNodeType());
      }
    }

    @Override
    public JsonElement field(String name) {
      return node.isObject() ? wrap(node.get(name)) : null;
    }

    @Override
    public JsonElement element(int index) {
      return node.isArray() ? wrap(node.get(index)) : null;
    }

    @Override
    public JsonElement at(JsonPointer pointer) {
      return wrap(node.at(pointer));
    }

    @Override
    public Iterator<JsonElement> elements() {
      Preconditions.checkState(node.isArray(), "Not an array: %s", node.getNodeType());
      return Iterators.transform(node.elements(), TreeElement::new);
    }

    @Override
    public Iterator<String> fieldNames() {
      Preconditions.checkState(node.isObject(), "Not an object: %s", node.getNodeType());
      return node.fieldNames();
    }

    @Override
    public int size() { return node.size(); }

    @Override
    public String stringValue() { return node.textValue(); }

    @Override
    public long longValue() { return node.longValue(); }

    @Override
    public boolean fitsInLong() {
      return node.isIntegralNumber() && node.canConvertToLong();
    }

    @Override
    public double doubleValue() { return node.doubleValue(); }

    @Override
    public boolean booleanValue() { return node.booleanValue(); }

    @Override
    public void write(JsonGenerator generator) throws IOException {
      mapper.writeTree(generator, node);
    }
  }
}
