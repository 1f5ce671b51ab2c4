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

import java.io.ByteArrayInputStream;
import java.io.CharConversionException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import org.apache.drill.json.common.config.DrillJsonConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NumericNode;
import com.google.common.base.Preconditions;

/**
 * Creates documents for both parser backends from a single, configured
 * Jackson factory. JSON is parsed strictly: no comments, no single
 * quotes, no non-numeric numbers and nothing after the root value.
 * Input is always decoded as UTF-8; bytes that are not valid UTF-8 make
 * the document malformed. Numbers beyond the range of a double are
 * malformed too, so a value never renders as {@code "Infinity"}.
 * Documents read the caller's byte array without copying it.
 */
public class JsonParserContext {
  private static final Logger logger = LoggerFactory.getLogger(JsonParserContext.class);

  /**
   * Parser used to read a document.
   */
  public enum Backend {

    /**
     * Materializes the document as a Jackson tree. Random access.
     */
    TREE,

    /**
     * Reads tokens on demand. Forward-only.
     */
    STREAMING;

    /**
     * Maps a configuration value, such as {@code "streaming"}, to a
     * backend.
     */
    public static Backend fromConfig(String value) {
      Preconditions.checkNotNull(value);
      try {
        return valueOf(value.trim().toUpperCase());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Unknown JSON parser backend: " + value, e);
      }
    }
  }

  private final ObjectMapper mapper;
  private final int maxNestingDepth;

  public JsonParserContext(DrillJsonConfig config) {
    this(config.maxNestingDepth());
  }

  public JsonParserContext(int maxNestingDepth) {
    Preconditions.checkArgument(maxNestingDepth > 0, "nesting depth must be positive: %s", maxNestingDepth);
    this.maxNestingDepth = maxNestingDepth;
    JsonFactory factory = JsonFactory.builder()
        .streamReadConstraints(StreamReadConstraints.builder()
            .maxNestingDepth(maxNestingDepth)
            .build())
        .build();
    this.mapper = new ObjectMapper(factory)
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .setNodeFactory(new FiniteNumberNodeFactory());
    logger.debug("JSON parser created with maximum nesting depth {}", maxNestingDepth);
  }

  public int maxNestingDepth() { return maxNestingDepth; }

  public JsonDocument parse(Backend backend, byte[] bytes, int start, int length) {
    switch (backend) {
      case TREE:
        return parseAsTree(bytes, start, length);
      case STREAMING:
        return parseAsStream(bytes, start, length);
      default:
        throw new IllegalStateException("Unexpected backend: " + backend);
    }
  }

  /**
   * Parses the whole input into a tree.
   *
   * @throws MalformedJsonException if the input is empty, is not valid
   * JSON or has content after the root value
   */
  public TreeJsonDocument parseAsTree(byte[] bytes, int start, int length) {
    JsonNode root;
    try {
      root = mapper.readTree(utf8Reader(bytes, start, length));
    } catch (IOException e) {
      throw parseFailure(e);
    }
    if (root == null || root.isMissingNode()) {
      throw new MalformedJsonException("No JSON content");
    }
    return new TreeJsonDocument(mapper, root);
  }

  /**
   * Opens a forward-only document positioned on the root value. Only
   * the first token is read here; the caller must close the document
   * to validate the rest of the input.
   *
   * @throws MalformedJsonException if the input is empty or starts
   * with invalid JSON
   */
  public StreamingJsonDocument parseAsStream(byte[] bytes, int start, int length) {
    JsonParser parser;
    try {
      parser = mapper.getFactory().createParser(utf8Reader(bytes, start, length));
    } catch (IOException e) {
      throw parseFailure(e);
    }
    return new StreamingJsonDocument(parser);
  }

  /**
   * Jackson guesses UTF-16 or UTF-32 from zero bytes in a byte source.
   * Decoding through a strict reader pins the encoding to UTF-8.
   */
  private static Reader utf8Reader(byte[] bytes, int start, int length) {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    return new InputStreamReader(new ByteArrayInputStream(bytes, start, length), decoder);
  }

  /**
   * Maps a failure while reading input. Syntax and encoding errors are
   * problems with the data; anything else is an I/O failure.
   */
  static RuntimeException parseFailure(IOException e) {
    if (e instanceof JsonProcessingException) {
      return new MalformedJsonException(((JsonProcessingException) e).getOriginalMessage(), e);
    }
    if (e instanceof CharacterCodingException || e instanceof CharConversionException) {
      return new MalformedJsonException("Invalid UTF-8 input", e);
    }
    return new UncheckedIOException(e);
  }

  static void checkFinite(double value) {
    if (! Double.isFinite(value)) {
      throw new MalformedJsonException("Number out of range: " + value);
    }
  }

  /**
   * Rejects floating-point numbers that overflow a double while the tree
   * is built.
   */
  private static class FiniteNumberNodeFactory extends JsonNodeFactory {
    private static final long serialVersionUID = 1L;

    FiniteNumberNodeFactory() {
      super(false);
    }

    @Override
    public NumericNode numberNode(double v) {
      checkFinite(v);
      return super.numberNode(v);
    }

    @Override
    public NumericNode numberNode(float v) {
      checkFinite(v);
      return super.numberNode(v);
    }
  }

  public TreeJsonDocument parseAsTree(String json) {
    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
    return parseAsTree(bytes, 0, bytes.length);
  }

  public StreamingJsonDocument parseAsStream(String json) {
    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
    return parseAsStream(bytes, 0, bytes.length);
  }

  /**
   * Creates a generator that writes compact JSON to the writer.
   */
  public JsonGenerator createGenerator(Writer out) {
    try {
      return mapper.getFactory().createGenerator(out);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
