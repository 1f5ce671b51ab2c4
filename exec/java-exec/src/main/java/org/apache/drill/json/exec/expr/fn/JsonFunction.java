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

import org.apache.drill.json.exec.vector.ValueVector;

/**
 * One call site of a JSON function. Set up once with the first
 * batch's arguments, then evaluated once per batch. An instance is used
 * by a single thread.
 */
public interface JsonFunction {

  /**
   * Prepares the call. Constant arguments, such as a literal path, are
   * checked here.
   *
   * @throws org.apache.drill.json.common.exceptions.UserException if a
   * constant argument is invalid
   */
  void setup(FunctionContext context, ValueVector... args);

  /**
   * Evaluates the function for every row of a batch.
   *
   * @param rowCount number of rows in the batch
   * @param args argument vectors, each holding {@code rowCount} rows
   * @return a new vector of results
   */
  ValueVector eval(int rowCount, ValueVector... args);
}
