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

/**
 * Broad category of a {@link UserException}. Determines the prefix
 * of the message shown to the user.
 */
public enum ErrorType {

  /**
   * A query or function argument is invalid: for example, a literal
   * JSON path that does not parse.
   */
  VALIDATION,

  /**
   * Input data could not be interpreted, and the function was asked
   * to fail rather than to return null.
   */
  DATA_READ,

  /**
   * A function failed while evaluating a value.
   */
  FUNCTION,

  /**
   * Unexpected internal failure. Aborts the query.
   */
  SYSTEM
}
