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
package org.apache.drill.json.exec.vector;

import org.apache.drill.json.common.types.MinorType;

/**
 * A column of values for one batch. Values are read through the
 * {@link Accessor} and written through the {@link Mutator}. Every
 * vector is nullable: each row carries a null flag alongside its value.
 * <p>
 * A vector is either {@link VectorEncoding#FLAT}, with a slot per row,
 * or {@link VectorEncoding#CONSTANT}, with one slot that every row
 * index maps onto. Readers need not care which: the accessor resolves
 * the row index either way.
 */
public interface ValueVector {

  String getName();

  MinorType getType();

  VectorEncoding getEncoding();

  boolean isConstant();

  Accessor getAccessor();

  Mutator getMutator();

  interface Accessor {

    /**
     * @return the number of rows in the vector; for a constant
     * vector, the number of rows the single value stands for
     */
    int getValueCount();

    boolean isNull(int index);

    /**
     * @return the value at the given row as a Java object, or
     * {@code null} if the row is null
     */
    Object getObject(int index);
  }

  interface Mutator {

    void setNull(int index);

    void setValueCount(int valueCount);

    void reset();
  }
}
