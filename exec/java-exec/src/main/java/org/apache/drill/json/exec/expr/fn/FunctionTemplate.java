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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.apache.drill.json.common.types.MinorType;

/**
 * Declares a function implementation to the
 * {@link JsonFunctionRegistry}. The annotated class must implement
 * {@link JsonFunction} and have a public no-argument constructor. All
 * functions are null-if-null: a null in any argument gives a null
 * result for that row.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface FunctionTemplate {

  /**
   * SQL names the function is called by.
   */
  String[] names();

  /**
   * Argument types, in order.
   */
  MinorType[] params();

  MinorType output();
}
