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

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Iterator;

import org.apache.drill.json.exec.expr.fn.json.parser.JsonElement;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonParserContext;
import org.apache.drill.json.exec.expr.fn.json.parser.MalformedJsonException;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;

/**
 * Turns parsed values back into text. Structural output is compact,
 * canonical JSON; scalar output is the plain value, with strings
 * unquoted and unescaped.
 */
public class JsonValueRenderer {

  public enum Mode {
    STRUCTURAL,
    SCALAR
  }

  private final JsonParserContext parserContext;

  public JsonValueRenderer(JsonParserContext parserContext) {
    this.parserContext = parserContext;
  }

  /**
   * @return the value as text, or {@code null} if a scalar was asked
   * for and the value is an object or array
   */
  public String render(JsonElement value, Mode mode) {
    if (mode == Mode.SCALAR) {
      return renderScalar(value);
    }
    return renderStructural(value);
  }

  public String renderStructural(JsonElement value) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = parserContext.createGenerator(out)) {
      value.write(gen);
    } catch (JsonProcessingException e) {
      throw new MalformedJsonException(e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }

  public String renderScalar(JsonElement value) {
    switch (value.type()) {
      case OBJECT:
      case ARRAY:
        return null;
      case STRING:
        return value.stringValue();
      default:
        return renderStructural(value);
    }
  }

  /**
   * Writes the field names of an object as a JSON array of strings.
   */
  public String renderFieldNames(JsonElement object) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = parserContext.createGenerator(out)) {
      gen.writeStartArray();
      Iterator<String> names = object.fieldNames();
      while (names.hasNext()) {
        gen.writeString(names.next());
      }
      gen.writeEndArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return out.toString();
  }
}
