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

import java.util.Arrays;

import org.apache.drill.json.common.types.MinorType;

/**
 * Double-precision floating point values.
 */
public final class Float8Vector extends BaseValueVector {

  private final Accessor accessor = new Accessor();
  private final Mutator mutator = new Mutator();
  private double[] values = new double[0];

  public Float8Vector(String name, VectorEncoding encoding) {
    super(name, MinorType.FLOAT8, encoding);
  }

  public static Float8Vector flat(String name, Double... values) {
    Float8Vector vector = new Float8Vector(name, VectorEncoding.FLAT);
    for (int i = 0; i < values.length; i++) {
      if (values[i] == null) {
        vector.mutator.setNull(i);
      } else {
        vector.mutator.setSafe(i, values[i]);
      }
    }
    vector.mutator.setValueCount(values.length);
    return vector;
  }

  public static Float8Vector constant(String name, Double value, int rowCount) {
    Float8Vector vector = new Float8Vector(name, VectorEncoding.CONSTANT);
    if (value == null) {
      vector.mutator.setNull(0);
    } else {
      vector.mutator.setSafe(0, value);
    }
    vector.mutator.setValueCount(rowCount);
    return vector;
  }

  @Override
  public Accessor getAccessor() { return accessor; }

  @Override
  public Mutator getMutator() { return mutator; }

  public final class Accessor extends BaseAccessor {

    /**
     * @return the value of the row; undefined if the row is null
     */
    public double get(int index) {
      int slot = slot(index);
      return slot < values.length ? values[slot] : 0D;
    }

    @Override
    public Object getObject(int index) {
      return isNull(index) ? null : get(index);
    }
  }

  public final class Mutator extends BaseMutator {

    public void setSafe(int index, double value) {
      int slot = writeSlot(index);
      if (slot >= values.length) {
        values = Arrays.copyOf(values, capacityFor(values.length, slot));
      }
      values[slot] = value;
      setNotNull(slot);
    }

    @Override
    public void reset() {
      super.reset();
      values = new double[0];
    }
  }
}
