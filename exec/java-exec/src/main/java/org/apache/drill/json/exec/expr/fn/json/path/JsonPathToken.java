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

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * One step of a JSON path: a field name, an array index written as
 * its decimal text, or the wildcard. Whether a name is used as a field
 * or an index depends on the value the path reaches at that step.
 */
public final class JsonPathToken {

  public static final JsonPathToken WILDCARD = new JsonPathToken(null);

  private final String name;

  private JsonPathToken(String name) {
    this.name = name;
  }

  public static JsonPathToken of(String name) {
    return new JsonPathToken(Preconditions.checkNotNull(name));
  }

  public boolean isWildcard() { return this == WILDCARD; }

  /**
   * @return the field name or index text; {@code "*"} for the wildcard
   */
  public String name() {
    return isWildcard() ? "*" : name;
  }

  /**
   * Interprets the token as an array index. Only canonical decimal
   * forms count: no sign, no leading zeros.
   *
   * @return the index, or -1 if the token is not a valid index
   */
  public int arrayIndex() {
    if (isWildcard() || name.isEmpty() || name.length() > 10) {
      return -1;
    }
    if (name.length() > 1 && name.charAt(0) == '0') {
      return -1;
    }
    long value = 0;
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (c < '0' || c > '9') {
        return -1;
      }
      value = value * 10 + (c - '0');
    }
    return value > Integer.MAX_VALUE ? -1 : (int) value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (! (o instanceof JsonPathToken)) {
      return false;
    }
    return Objects.equals(name, ((JsonPathToken) o).name);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name);
  }

  @Override
  public String toString() {
    return isWildcard() ? "*" : "\"" + name + "\"";
  }
}
