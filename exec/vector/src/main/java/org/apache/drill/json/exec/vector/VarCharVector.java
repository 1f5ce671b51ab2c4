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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.apache.drill.json.common.types.MinorType;

/**
 * Variable-width UTF-8 text. Values are held as byte arrays; readers
 * borrow the stored array and must not modify it.
 */
public final class VarCharVector extends BaseValueVector {

  private final Accessor accessor = new Accessor();
  private final Mutator mutator = new Mutator();
  private byte[][] values = new byte[0][];

  public VarCharVector(String name, VectorEncoding encoding) {
    super(name, MinorType.VARCHAR, encoding);
  }

  /**
   * Builds a flat vector with one row per value. A {@code null} value
   * produces a null row.
   */
  public static VarCharVector flat(String name, String... values) {
    VarCharVector vector = new VarCharVector(name, VectorEncoding.FLAT);
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

  /**
   * Builds a constant vector that repeats one value, or null, for
   * the given number of rows.
   */
  public static VarCharVector constant(String name, String value, int rowCount) {
    VarCharVector vector = new VarCharVector(name, VectorEncoding.CONSTANT);
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
     * @return the UTF-8 bytes of the row, or {@code null} if the row
     * is null
     */
    public byte[] get(int index) {
      int slot = slot(index);
      return nulls.get(slot) || slot >= values.length ? null : values[slot];
    }

    public String getString(int index) {
      byte[] value = get(index);
      return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public Object getObject(int index) {
      return getString(index);
    }
  }

  public final class Mutator extends BaseMutator {

    public void setSafe(int index, byte[] value) {
      int slot = writeSlot(index);
      if (slot >= values.length) {
        values = Arrays.copyOf(values, capacityFor(values.length, slot));
      }
      values[slot] = value;
      setNotNull(slot);
    }

    public void setSafe(int index, String value) {
      setSafe(index, value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void reset() {
      super.reset();
      values = new byte[0][];
    }
  }
}
