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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Splits a JSON path into tokens. The accepted syntax is a small
 * subset of JSONPath:
 * <pre>
 * path      := [ '$' ] [ key ] ( '.' key | '[' subscript ']' )*
 * key       := '*' | ( letter | digit | '_' | ':' | '-' )+
 * subscript := '*' | '"' quoted '"' | ( letter | digit | '_' )+
 * </pre>
 * The leading key without a dot is allowed only when the path does
 * not start with {@code $}, so {@code a.b} and {@code $.a.b} are the
 * same path. Inside quotes, {@code \\} and {@code \"} are the only
 * escapes. A quoted {@code ["*"]} is a field named {@code *}, not the
 * wildcard. No whitespace is allowed anywhere.
 * <p>
 * Examples: {@code $.store.book[0].title}, {@code a.b[*]},
 * {@code $["key with.dot"]}, {@code $} (the whole document).
 * <p>
 * Instances are single use: create one per path.
 */
public class JsonPathTokenizer {

  private static final char ROOT = '$';
  private static final char DOT = '.';
  private static final char OPEN_BRACKET = '[';
  private static final char CLOSE_BRACKET = ']';
  private static final char QUOTE = '"';
  private static final char BACKSLASH = '\\';
  private static final char WILDCARD = '*';

  private final String path;
  private int index;

  private JsonPathTokenizer(String path) {
    this.path = path;
  }

  /**
   * Tokenizes a path.
   *
   * @param path the path text
   * @return the tokens in path order; empty for the root path
   * @throws InvalidJsonPathException if the path is null, empty or
   * malformed
   */
  public static List<JsonPathToken> tokenize(String path) {
    if (path == null || path.isEmpty()) {
      throw new InvalidJsonPathException(String.valueOf(path), 0, "path is empty");
    }
    return new JsonPathTokenizer(path).parse();
  }

  private List<JsonPathToken> parse() {
    ImmutableList.Builder<JsonPathToken> tokens = ImmutableList.builder();
    if (peek() == ROOT) {
      index++;
    } else if (peek() != DOT && peek() != OPEN_BRACKET) {
      tokens.add(parseKey());
    }
    while (hasNext()) {
      char c = next();
      if (c == DOT) {
        tokens.add(parseKey());
      } else if (c == OPEN_BRACKET) {
        tokens.add(parseSubscript());
        expect(CLOSE_BRACKET);
      } else {
        throw invalid(index - 1, "unexpected character '" + c + "'");
      }
    }
    return tokens.build();
  }

  private JsonPathToken parseKey() {
    if (hasNext() && peek() == WILDCARD) {
      index++;
      if (hasNext() && peek() != DOT && peek() != OPEN_BRACKET) {
        throw invalid(index, "wildcard must be a whole path step");
      }
      return JsonPathToken.WILDCARD;
    }
    int start = index;
    while (hasNext() && isUnquotedKeyChar(peek())) {
      index++;
    }
    if (start == index) {
      throw invalid(index, hasNext() ? "unexpected character '" + peek() + "'" : "missing key");
    }
    return JsonPathToken.of(path.substring(start, index));
  }

  private JsonPathToken parseSubscript() {
    if (! hasNext()) {
      throw invalid(index, "unclosed bracket");
    }
    char c = peek();
    if (c == WILDCARD) {
      index++;
      return JsonPathToken.WILDCARD;
    }
    if (c == QUOTE) {
      index++;
      return JsonPathToken.of(parseQuoted());
    }
    int start = index;
    while (hasNext() && isUnquotedSubscriptChar(peek())) {
      index++;
    }
    if (start == index) {
      throw invalid(index, hasNext() ? "unexpected character '" + peek() + "'" : "unclosed bracket");
    }
    return JsonPathToken.of(path.substring(start, index));
  }

  private String parseQuoted() {
    StringBuilder buf = new StringBuilder();
    for (;;) {
      if (! hasNext()) {
        throw invalid(index, "unterminated quoted key");
      }
      char c = next();
      if (c == QUOTE) {
        return buf.toString();
      }
      if (c == BACKSLASH) {
        if (! hasNext()) {
          throw invalid(index, "unterminated escape");
        }
        char escaped = next();
        if (escaped != BACKSLASH && escaped != QUOTE) {
          throw invalid(index - 1, "invalid escape '\\" + escaped + "'");
        }
        buf.append(escaped);
      } else {
        buf.append(c);
      }
    }
  }

  private void expect(char expected) {
    if (! hasNext()) {
      throw invalid(index, "expected '" + expected + "'");
    }
    char c = next();
    if (c != expected) {
      throw invalid(index - 1, "expected '" + expected + "' but found '" + c + "'");
    }
  }

  private static boolean isUnquotedKeyChar(char c) {
    return c == ':' || c == '-' || isUnquotedSubscriptChar(c);
  }

  private static boolean isUnquotedSubscriptChar(char c) {
    return c == '_' || Character.isLetterOrDigit(c);
  }

  private boolean hasNext() { return index < path.length(); }

  private char peek() { return path.charAt(index); }

  private char next() { return path.charAt(index++); }

  private InvalidJsonPathException invalid(int position, String reason) {
    return new InvalidJsonPathException(path, position, reason);
  }
}
