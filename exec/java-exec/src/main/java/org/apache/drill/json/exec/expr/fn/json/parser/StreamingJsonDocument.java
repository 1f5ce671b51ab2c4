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
import java.math.BigInteger;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonStreamContext;
import com.fasterxml.jackson.core.JsonToken;
import com.google.common.base.Preconditions;

/**
 * Forward-only document over a Jackson {@link JsonParser}. Nothing is
 * materialized: lookups skip unwanted values token by token, and a
 * container is rendered by copying its tokens straight to the output.
 * <p>
 * Each container may be read once, and children must be consumed in
 * document order. Scalar values are captured when their element is
 * created, so they stay readable after the parser moves on.
 * <p>
 * Navigation stops as soon as the target is found. {@link #close()}
 * reads whatever was skipped so that syntax errors after the target, or
 * trailing content, are still reported.
 */
public class StreamingJsonDocument implements JsonDocument {
  private static final Logger logger = LoggerFactory.getLogger(StreamingJsonDocument.class);

  private final JsonParser parser;
  private final StreamingElement root;
  private boolean closed;

  StreamingJsonDocument(JsonParser parser) {
    this.parser = parser;
    try {
      JsonToken token = nextToken();
      if (token == null) {
        throw new MalformedJsonException("No JSON content");
      }
      this.root = newElement(token);
    } catch (RuntimeException e) {
      closeParser();
      throw e;
    }
  }

  @Override
  public JsonElement root() { return root; }

  @Override
  public boolean isRandomAccess() { return false; }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      root.finish();
      JsonToken token = nextToken();
      if (token != null) {
        throw new MalformedJsonException("Unexpected content after the JSON value: " + token);
      }
    } finally {
      closeParser();
    }
  }

  private void closeParser() {
    try {
      parser.close();
    } catch (IOException e) {
      logger.warn("Ignored failure when closing JSON parser", e);
    }
  }

  /**
   * Reads every token of the document, including skipped and copied
   * ones, so that out-of-range numbers are caught wherever they are.
   */
  private JsonToken nextToken() {
    try {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.VALUE_NUMBER_FLOAT) {
        JsonParserContext.checkFinite(parser.getDoubleValue());
      }
      return token;
    } catch (IOException e) {
      throw JsonParserContext.parseFailure(e);
    }
  }

  private JsonToken requireNextToken() {
    JsonToken token = nextToken();
    if (token == null) {
      throw new MalformedJsonException("Unexpected end of JSON input");
    }
    return token;
  }

  /**
   * Moves past the container that starts at the current token. A no-op
   * on a scalar.
   */
  private void skipChildren() {
    JsonToken token = parser.currentToken();
    if (token == null || ! token.isStructStart()) {
      return;
    }
    for (int depth = 1; depth > 0;) {
      token = requireNextToken();
      if (token.isStructStart()) {
        depth++;
      } else if (token.isStructEnd()) {
        depth--;
      }
    }
  }

  /**
   * Copies the container that starts at the current token. Strings are
   * decoded lazily, so copying a token may still read input.
   */
  private void copyStructure(JsonGenerator generator) {
    JsonToken token = parser.currentToken();
    int depth = 0;
    for (;;) {
      try {
        generator.copyCurrentEvent(parser);
      } catch (IOException e) {
        throw JsonParserContext.parseFailure(e);
      }
      if (token.isStructStart()) {
        depth++;
      } else if (token.isStructEnd()) {
        depth--;
      }
      if (depth == 0) {
        return;
      }
      token = requireNextToken();
    }
  }

  private StreamingElement newElement(JsonToken token) {
    try {
      return new StreamingElement(token);
    } catch (IOException e) {
      throw JsonParserContext.parseFailure(e);
    }
  }

  private class StreamingElement implements JsonElement {

    private final JsonType type;

    // Context the parser enters at the container's start token. Used to
    // find the container's end when only part of it has been read.
    private final JsonStreamContext context;
    private final Object value;
    private boolean started;
    private boolean finished;

    StreamingElement(JsonToken token) throws IOException {
      switch (token) {
        case START_OBJECT:
          type = JsonType.OBJECT;
          value = null;
          break;
        case START_ARRAY:
          type = JsonType.ARRAY;
          value = null;
          break;
        case VALUE_STRING:
          type = JsonType.STRING;
          value = parser.getText();
          break;
        case VALUE_NUMBER_INT:
          type = JsonType.INTEGER;
          value = parser.getNumberValue();
          break;
        case VALUE_NUMBER_FLOAT:
          type = JsonType.FLOAT;
          value = parser.getDoubleValue();
          break;
        case VALUE_TRUE:
          type = JsonType.BOOLEAN;
          value = Boolean.TRUE;
          break;
        case VALUE_FALSE:
          type = JsonType.BOOLEAN;
          value = Boolean.FALSE;
          break;
        case VALUE_NULL:
          type = JsonType.NULL;
          value = null;
          break;
        default:
          throw new MalformedJsonException("Unexpected JSON token: " + token);
      }
      if (type.isContainer()) {
        context = parser.getParsingContext();
      } else {
        context = null;
        finished = true;
      }
    }

    @Override
    public JsonType type() { return type; }

    private void start(JsonType expected) {
      Preconditions.checkState(type == expected, "Not an %s: %s", expected, type);
      Preconditions.checkState(! started, "Forward-only %s has already been read", type);
      started = true;
    }

    @Override
    public JsonElement field(String name) {
      if (type != JsonType.OBJECT) {
        return null;
      }
      start(JsonType.OBJECT);
      for (;;) {
        JsonToken token = requireNextToken();
        if (token == JsonToken.END_OBJECT) {
          finished = true;
          return null;
        }
        String key = currentName();
        JsonToken valueToken = requireNextToken();
        if (name.equals(key)) {
          return newElement(valueToken);
        }
        skipChildren();
      }
    }

    @Override
    public JsonElement element(int index) {
      if (type != JsonType.ARRAY) {
        return null;
      }
      start(JsonType.ARRAY);
      for (int i = 0;; i++) {
        JsonToken token = requireNextToken();
        if (token == JsonToken.END_ARRAY) {
          finished = true;
          return null;
        }
        if (i == index) {
          return newElement(token);
        }
        skipChildren();
      }
    }

    @Override
    public JsonElement at(JsonPointer pointer) {
      JsonElement current = this;
      for (JsonPointer ptr = pointer; current != null && ! ptr.matches(); ptr = ptr.tail()) {
        switch (current.type()) {
          case OBJECT:
            current = current.field(ptr.getMatchingProperty());
            break;
          case ARRAY:
            int index = ptr.getMatchingIndex();
            current = index < 0 ? null : current.element(index);
            break;
          default:
            current = null;
        }
      }
      return current;
    }

    @Override
    public Iterator<JsonElement> elements() {
      start(JsonType.ARRAY);
      return new Iterator<JsonElement>() {
        private StreamingElement current;
        private StreamingElement pending;

        @Override
        public boolean hasNext() {
          if (pending != null) {
            return true;
          }
          if (finished) {
            return false;
          }
          if (current != null) {
            current.finish();
            current = null;
          }
          JsonToken token = requireNextToken();
          if (token == JsonToken.END_ARRAY) {
            finished = true;
            return false;
          }
          pending = newElement(token);
          return true;
        }

        @Override
        public JsonElement next() {
          if (! hasNext()) {
            throw new NoSuchElementException();
          }
          current = pending;
          pending = null;
          return current;
        }
      };
    }

    @Override
    public Iterator<String> fieldNames() {
      start(JsonType.OBJECT);
      return new Iterator<String>() {
        private String pending;

        @Override
        public boolean hasNext() {
          if (pending != null) {
            return true;
          }
          if (finished) {
            return false;
          }
          JsonToken token = requireNextToken();
          if (token == JsonToken.END_OBJECT) {
            finished = true;
            return false;
          }
          pending = currentName();
          requireNextToken();
          skipChildren();
          return true;
        }

        @Override
        public String next() {
          if (! hasNext()) {
            throw new NoSuchElementException();
          }
          String name = pending;
          pending = null;
          return name;
        }
      };
    }

    @Override
    public int size() {
      if (type.isScalar()) {
        return 0;
      }
      start(type);
      JsonToken end = type == JsonType.OBJECT ? JsonToken.END_OBJECT : JsonToken.END_ARRAY;
      int count = 0;
      for (;;) {
        JsonToken token = requireNextToken();
        if (token == end) {
          finished = true;
          return count;
        }
        if (token == JsonToken.FIELD_NAME) {
          requireNextToken();
        }
        skipChildren();
        count++;
      }
    }

    @Override
    public String stringValue() {
      return type == JsonType.STRING ? (String) value : null;
    }

    @Override
    public long longValue() {
      return value instanceof Number ? ((Number) value).longValue() : 0;
    }

    @Override
    public boolean fitsInLong() {
      return type == JsonType.INTEGER && ! (value instanceof BigInteger);
    }

    @Override
    public double doubleValue() {
      return value instanceof Number ? ((Number) value).doubleValue() : 0;
    }

    @Override
    public boolean booleanValue() {
      return value == Boolean.TRUE;
    }

    @Override
    public void write(JsonGenerator generator) throws IOException {
      switch (type) {
        case OBJECT:
        case ARRAY:
          start(type);
          copyStructure(generator);
          finished = true;
          break;
        case STRING:
          generator.writeString((String) value);
          break;
        case INTEGER:
          writeInteger(generator);
          break;
        case FLOAT:
          generator.writeNumber((Double) value);
          break;
        case BOOLEAN:
          generator.writeBoolean((Boolean) value);
          break;
        default:
          generator.writeNull();
      }
    }

    private void writeInteger(JsonGenerator generator) throws IOException {
      if (value instanceof Integer) {
        generator.writeNumber((Integer) value);
      } else if (value instanceof Long) {
        generator.writeNumber((Long) value);
      } else {
        generator.writeNumber((BigInteger) value);
      }
    }

    /**
     * Moves the parser past the end of this container, however much of
     * it has been read. A no-op for scalars and for containers already
     * read to the end.
     */
    void finish() {
      if (finished) {
        return;
      }
      finished = true;
      if (! started) {
        skipChildren();
        return;
      }
      while (isInside(parser.getParsingContext())) {
        JsonToken token = requireNextToken();
        if (token.isStructStart()) {
          skipChildren();
        }
      }
    }

    private boolean isInside(JsonStreamContext ctx) {
      for (JsonStreamContext c = ctx; c != null; c = c.getParent()) {
        if (c == context) {
          return true;
        }
      }
      return false;
    }
  }

  private String currentName() {
    try {
      return parser.currentName();
    } catch (IOException e) {
      throw JsonParserContext.parseFailure(e);
    }
  }
}
