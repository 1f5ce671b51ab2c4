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

/**
 * One parsed JSON text. Created per row and closed as soon as the
 * row's result has been captured.
 */
public interface JsonDocument extends AutoCloseable {

  JsonElement root();

  /**
   * @return {@code true} if elements may be revisited and read in any
   * order, as wildcard expansion requires
   */
  boolean isRandomAccess();

  /**
   * Releases the parser. A streaming document first reads the part of
   * the input that navigation skipped, so that malformed input is
   * reported the same way by both backends.
   *
   * @throws MalformedJsonException if the unread remainder of the input
   * is not valid JSON
   */
  @Override
  void close();
}
