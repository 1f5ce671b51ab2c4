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
package org.apache.drill.json.exec.expr.fn.json.path;

/**
 * A path string does not follow the JSON path syntax. Carries the path
 * and the character offset at which the tokenizer gave up.
 */
@SuppressWarnings("serial")
public class InvalidJsonPathException extends RuntimeException {

  private final String path;
  private final int position;

  public InvalidJsonPathException(String path, int position, String reason) {
    super(String.format("Invalid JSON path '%s' at position %d: %s", path, position, reason));
    this.path = path;
    this.position = position;
  }

  public String getPath() { return path; }

  public int getPosition() { return position; }
}
