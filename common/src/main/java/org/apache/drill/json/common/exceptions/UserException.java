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
package org.apache.drill.json.common.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;

import com.google.common.base.Preconditions;

/**
 * Base class for all user-facing errors. Use one of the static
 * builder methods to create an instance:
 * <pre><code>
 * throw UserException.validationError()
 *     .message("Invalid JSON path: %s", path)
 *     .addContext("Function", "json_extract")
 *     .build(logger);
 * </code></pre>
 * The builder logs the error, with its id, when it is built so that
 * the message in the log can be matched with the one the user sees.
 */
@SuppressWarnings("serial")
public class UserException extends RuntimeException {

  private final ErrorType errorType;
  private final String errorId;
  private final String originalMessage;
  private final List<String> context;

  protected UserException(Builder builder) {
    super(builder.fullMessage(), builder.cause);
    this.errorType = builder.errorType;
    this.errorId = builder.errorId;
    this.originalMessage = builder.message;
    this.context = Collections.unmodifiableList(new ArrayList<>(builder.context));
  }

  public static Builder validationError() {
    return validationError(null);
  }

  public static Builder validationError(Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  public static Builder dataReadError() {
    return dataReadError(null);
  }

  public static Builder dataReadError(Throwable cause) {
    return new Builder(ErrorType.DATA_READ, cause);
  }

  public static Builder functionError() {
    return functionError(null);
  }

  public static Builder functionError(Throwable cause) {
    return new Builder(ErrorType.FUNCTION, cause);
  }

  /**
   * Wraps an unexpected exception. If the cause is already a
   * {@code UserException}, the builder keeps the original error type
   * and message so that wrapping twice does not hide the root error.
   */
  public static Builder systemError(Throwable cause) {
    Preconditions.checkNotNull(cause);
    if (cause instanceof UserException) {
      UserException ue = (UserException) cause;
      Builder builder = new Builder(ue.errorType, ue.getCause());
      builder.message = ue.originalMessage;
      builder.context.addAll(ue.context);
      return builder;
    }
    return new Builder(ErrorType.SYSTEM, cause);
  }

  public ErrorType getErrorType() { return errorType; }

  public String getErrorId() { return errorId; }

  /**
   * @return the message given to the builder, without the error type
   * prefix or the context lines
   */
  public String getOriginalMessage() { return originalMessage; }

  public List<String> getContext() { return context; }

  public static class Builder {

    private final ErrorType errorType;
    private final Throwable cause;
    private final String errorId = UUID.randomUUID().toString();
    private final List<String> context = new ArrayList<>();
    private String message;

    protected Builder(ErrorType errorType, Throwable cause) {
      this.errorType = errorType;
      this.cause = cause;
      if (cause != null) {
        this.message = cause.getMessage();
      }
    }

    public Builder message(String format, Object... args) {
      message = args.length == 0 ? format : String.format(format, args);
      return this;
    }

    public Builder addContext(String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(String name, String value) {
      context.add(name + " " + value);
      return this;
    }

    public Builder addContext(String name, long value) {
      return addContext(name, Long.toString(value));
    }

    /**
     * Builds the exception and logs it. The caller throws the
     * result.
     *
     * @param logger logger of the class that raised the error
     * @return the new exception
     */
    public UserException build(Logger logger) {
      UserException e = new UserException(this);
      if (errorType == ErrorType.SYSTEM) {
        logger.error(e.getMessage(), e);
      } else {
        logger.info("User error occurred: {}", e.getMessage());
      }
      return e;
    }

    private String fullMessage() {
      StringBuilder buf = new StringBuilder()
          .append(errorType.name())
          .append(" ERROR: ");
      if (message != null) {
        buf.append(message);
      }
      buf.append("\n");
      for (String item : context) {
        buf.append("\n").append(item);
      }
      buf.append("\n\n[Error Id: ").append(errorId).append("]");
      return buf.toString();
    }
  }
}
