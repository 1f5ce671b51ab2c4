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

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.apache.drill.json.common.config.DrillJsonConfig;
import org.apache.drill.json.common.exceptions.UserException;
import org.apache.drill.json.common.types.MinorType;
import org.apache.drill.json.exec.expr.fn.json.JsonArrayFunctions;
import org.apache.drill.json.exec.expr.fn.json.JsonExtractFunctions;
import org.apache.drill.json.exec.expr.fn.json.JsonInspectFunctions;
import org.apache.drill.json.exec.vector.ValueVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Finds function implementations by SQL name and argument types.
 * Implementations are the nested classes of holder classes, marked
 * with {@link FunctionTemplate}. Each lookup creates a new instance
 * with its own {@link FunctionContext}.
 */
public class JsonFunctionRegistry {
  private static final Logger logger = LoggerFactory.getLogger(JsonFunctionRegistry.class);

  public static final List<Class<?>> BUILT_IN_HOLDERS = ImmutableList.of(
      JsonExtractFunctions.class,
      JsonArrayFunctions.class,
      JsonInspectFunctions.class);

  private final DrillJsonConfig config;
  private final Map<String, Class<? extends JsonFunction>> functions = new TreeMap<>();

  public JsonFunctionRegistry(DrillJsonConfig config) {
    this.config = config;
  }

  /**
   * @return a registry holding the built-in JSON functions
   */
  public static JsonFunctionRegistry builtIn(DrillJsonConfig config) {
    JsonFunctionRegistry registry = new JsonFunctionRegistry(config);
    for (Class<?> holder : BUILT_IN_HOLDERS) {
      registry.register(holder);
    }
    return registry;
  }

  /**
   * Registers every annotated nested class of the holder.
   */
  public void register(Class<?> holder) {
    for (Class<?> member : holder.getDeclaredClasses()) {
      FunctionTemplate template = member.getAnnotation(FunctionTemplate.class);
      if (template == null) {
        continue;
      }
      Preconditions.checkArgument(JsonFunction.class.isAssignableFrom(member),
          "%s is not a JsonFunction", member.getName());
      Class<? extends JsonFunction> impl = member.asSubclass(JsonFunction.class);
      for (String name : template.names()) {
        String key = signature(name, template.params());
        Class<? extends JsonFunction> prior = functions.put(key, impl);
        Preconditions.checkState(prior == null, "Duplicate function: %s", key);
        logger.debug("Registered {} as {}", key, impl.getSimpleName());
      }
    }
  }

  public Set<String> signatures() {
    return functions.keySet();
  }

  public boolean contains(String name, MinorType... argTypes) {
    return functions.containsKey(signature(name, argTypes));
  }

  /**
   * Creates and sets up a call of the function that matches the name
   * and the types of the arguments.
   *
   * @param name SQL function name, in any case
   * @param args the first batch's arguments
   * @return the function, ready to evaluate batches
   * @throws UserException if no function matches, or a constant
   * argument is invalid
   */
  public JsonFunction newCall(String name, ValueVector... args) {
    MinorType[] argTypes = new MinorType[args.length];
    for (int i = 0; i < args.length; i++) {
      argTypes[i] = args[i].getType();
    }
    String key = signature(name, argTypes);
    Class<? extends JsonFunction> impl = functions.get(key);
    if (impl == null) {
      throw UserException.validationError()
          .message("No function matches %s", key)
          .build(logger);
    }
    JsonFunction function;
    try {
      function = impl.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw UserException.systemError(e)
          .message("Cannot create function %s", impl.getName())
          .build(logger);
    }
    function.setup(new FunctionContext(name.toLowerCase(), config), args);
    return function;
  }

  private static String signature(String name, MinorType[] types) {
    return name.toLowerCase() + "(" + Joiner.on(", ").join(Arrays.asList(types)) + ")";
  }
}
