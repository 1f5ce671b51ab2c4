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

/**
 * A value within a parsed JSON document, independent of the parser that
 * produced it. Tree elements can be visited any number of times in any
 * order. Streaming elements are forward-only: each container can be
 * read once, by exactly one of {@link #field(String)},
 * {@link #element(int)}, {@link #at(JsonPointer)}, {@link #elements()},
 * {@link #fieldNames()}, {@link #size()} or {@link #write(JsonGenerator)},
 * and the children of a container must be used in document order.
 * <p>
 * Lookups return {@code null} when the value does not exist. Syntax
 * errors found while reading raise {@link MalformedJsonException}.
 */
public interface JsonElement {

  JsonType type();

  /**
   * @return the value of the named field, or {@code null} if this is not
   * an object or has no such field
   */
  JsonElement field(String name);

  /**
   * @return the array element at the index, or {@code null} if this is
   * not an array or the index is out of range
   */
  JsonElement element(int index);

  /**
   * Resolves an RFC 6901 pointer relative to this value.
   *
   * @return the target value, or {@code null} if it does not exist
   */
  JsonElement at(JsonPointer pointer);

  /**
   * @return the elements of an array, in order
   * @throws IllegalStateException if this is not an array
   */
  Iterator<JsonElement> elements();

  /**
   * @return the field names of an object, in declaration order
   * @throws IllegalStateException if this is not an object
   */
  Iterator<String> fieldNames();

  /**
   * @return the number of array elements or object fields; 0 for
   * scalars
   */
  int size();

  String stringValue();

  long longValue();

  /**
   * @return {@code true} if this is an integer within the range of a
   * Java {@code long}
   */
  boolean fitsInLong();

  double doubleValue();

  boolean booleanValue();

  /**
   * Writes this value, and everything below it, to the generator.
   */
  void write(JsonGenerator generator) throws IOException;
}
