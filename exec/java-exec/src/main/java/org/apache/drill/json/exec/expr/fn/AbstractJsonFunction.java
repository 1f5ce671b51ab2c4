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
package org.apache.drill.json.exec.expr.fn;

import java.util.List;

import org.apache.drill.json.common.exceptions.UserException;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonDocument;
import org.apache.drill.json.exec.expr.fn.json.parser.JsonParserContext.Backend;
import org.apache.drill.json.exec.expr.fn.json.parser.MalformedJsonException;
import org.apache.drill.json.exec.expr.fn.json.path.InvalidJsonPathException;
import org.apache.drill.json.exec.expr.fn.json.path.JsonPathToken;
import org.apache.drill.json.exec.vector.ValueVector;
import org.apache.drill.json.exec.vector.VarCharVector;
import org.apache.drill.json.exec.vector.VectorEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Row loop shared by the JSON functions. Subclasses compute the value
 * of one row; this class handles nulls, constant arguments and errors.
 * <p>
 * For each row:
 * <ul>
 * <li>If any argument is null, the result is null.</li>
 * <li>Malformed JSON, or a path argument that does not parse, gives
 * the function's {@link #failureValue()}: null, or false for
 * predicates.</li>
 * <li>A {@link UserException} aborts the batch as is. Any other
 * runtime exception aborts it as a system error that names the
 * function and the row.</li>
 * </ul>
 * When every argument is constant the value is computed once and the
 * result is a constant vector.
 *
 * @param <T> Java type of the result
 */
public abstract class AbstractJsonFunction<T> implements JsonFunction {
  private static final Logger logger = LoggerFactory.getLogger(AbstractJsonFunction.class);

  protected FunctionContext context;

  // Tokens of a constant path argument, resolved in setup.
  private List<JsonPathToken> literalPath;
  private String literalPathText;

  // A constant JSON argument parsed as a tree, kept for one batch.
  private VarCharVector constantJson;
  private JsonDocument constantDoc;
  private MalformedJsonException constantDocError;

  @Override
  public void setup(FunctionContext context, ValueVector... args) {
    this.context = Preconditions.checkNotNull(context);
    int pathIndex = pathArgIndex();
    if (pathIndex >= 0 && args.length > pathIndex && args[pathIndex].isConstant()) {
      setupLiteralPath((VarCharVector) args[pathIndex]);
    }
  }

  private void setupLiteralPath(VarCharVector pathArg) {
    if (pathArg.getAccessor().isNull(0)) {
      return;
    }
    String path = pathArg.getAccessor().getString(0);
    try {
      literalPath = context.pathCache().resolve(path);
      literalPathText = path;
    } catch (InvalidJsonPathException e) {
      throw UserException.validationError(e)
          .message("Invalid JSON path: %s", path)
          .addContext("Function", context.functionName())
          .addContext("Position", e.getPosition())
          .build(logger);
    }
  }

  /**
   * @return position of the path argument, or -1 if the function takes
   * no path
   */
  protected int pathArgIndex() {
    return -1;
  }

  @Override
  public ValueVector eval(int rowCount, ValueVector... args) {
    Preconditions.checkState(context != null, "Function not set up");
    boolean allConstant = args.length > 0;
    for (ValueVector arg : args) {
      allConstant &= arg.isConstant();
    }
    ValueVector out = newOutput(allConstant ? VectorEncoding.CONSTANT : VectorEncoding.FLAT);
    int evalRows = allConstant ? Math.min(rowCount, 1) : rowCount;
    try {
      for (int row = 0; row < evalRows; row++) {
        evalRow(row, args, out);
      }
    } finally {
      constantJson = null;
      constantDoc = null;
      constantDocError = null;
    }
    out.getMutator().setValueCount(rowCount);
    return out;
  }

  private void evalRow(int row, ValueVector[] args, ValueVector out) {
    for (ValueVector arg : args) {
      if (arg.getAccessor().isNull(row)) {
        out.getMutator().setNull(row);
        return;
      }
    }
    T value;
    try {
      value = compute(row, args);
    } catch (MalformedJsonException | InvalidJsonPathException e) {
      logger.trace("{}: row {} failed: {}", context.functionName(), row, e.getMessage());
      value = failureValue();
    } catch (UserException e) {
      throw e;
    } catch (RuntimeException e) {
      throw UserException.systemError(e)
          .addContext("Function", context.functionName())
          .addContext("Row", row)
          .build(logger);
    }
    if (value == null) {
      out.getMutator().setNull(row);
    } else {
      write(out, row, value);
    }
  }

  /**
   * Computes the value of one row. No argument is null.
   *
   * @return the value, or {@code null} for a null result
   */
  protected abstract T compute(int row, ValueVector[] args);

  /**
   * @return the value of a row whose JSON or path is invalid
   */
  protected T failureValue() {
    return null;
  }

  protected abstract ValueVector newOutput(VectorEncoding encoding);

  protected abstract void write(ValueVector out, int row, T value);

  /**
   * Returns the path tokens for a row: the ones resolved at setup for
   * a constant path, else the cached or freshly tokenized ones.
   *
   * @throws InvalidJsonPathException if the row's path is malformed
   */
  protected List<JsonPathToken> path(int row, ValueVector pathArg) {
    VarCharVector vector = (VarCharVector) pathArg;
    if (literalPath != null && vector.isConstant()) {
      String path = vector.getAccessor().getString(row);
      if (path.equals(literalPathText)) {
        return literalPath;
      }
    }
    return context.pathCache().resolve(vector.getAccessor().getString(row));
  }

  /**
   * Parses the row's JSON. The caller closes the document. A constant
   * JSON argument read as a tree is parsed only once per batch.
   *
   * @throws MalformedJsonException if the text is not valid JSON
   */
  protected JsonDocument parse(int row, ValueVector jsonArg, Backend backend) {
    VarCharVector json = (VarCharVector) jsonArg;
    if (json.isConstant() && backend == Backend.TREE) {
      if (constantJson != json) {
        constantJson = json;
        constantDoc = null;
        constantDocError = null;
        try {
          constantDoc = parseRow(json, row, backend);
        } catch (MalformedJsonException e) {
          constantDocError = e;
        }
      }
      if (constantDocError != null) {
        throw constantDocError;
      }
      return constantDoc;
    }
    return parseRow(json, row, backend);
  }

  private JsonDocument parseRow(VarCharVector json, int row, Backend backend) {
    byte[] bytes = json.getAccessor().get(row);
    return context.parserContext().parse(backend, bytes, 0, bytes.length);
  }

  protected static String text(ValueVector arg, int row) {
    return ((VarCharVector) arg).getAccessor().getString(row);
  }
}
