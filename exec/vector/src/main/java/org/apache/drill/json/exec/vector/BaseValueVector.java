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

import java.util.BitSet;

import org.apache.drill.json.common.types.MinorType;

import com.google.common.base.Preconditions;

public abstract class BaseValueVector implements ValueVector {

  public static final int INITIAL_VALUE_ALLOCATION = 64;

  protected final String name;
  protected final MinorType type;
  protected final VectorEncoding encoding;
  protected final BitSet nulls = new BitSet();
  protected int valueCount;

  protected BaseValueVector(String name, MinorType type, VectorEncoding encoding) {
    this.name = Preconditions.checkNotNull(name, "name cannot be null");
    this.type = type;
    this.encoding = encoding;
  }

  @Override
  public String getName() { return name; }

  @Override
  public MinorType getType() { return type; }

  @Override
  public VectorEncoding getEncoding() { return encoding; }

  @Override
  public boolean isConstant() { return encoding == VectorEncoding.CONSTANT; }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[name = " + name +
        ", encoding = " + encoding + ", valueCount = " + valueCount + "]";
  }

  /**
   * Maps a row index to the slot that holds its value.
   */
  protected int slot(int index) {
    Preconditions.checkElementIndex(index, Math.max(valueCount, 1));
    return isConstant() ? 0 : index;
  }

  protected int capacityFor(int currentCapacity, int index) {
    int capacity = Math.max(currentCapacity, INITIAL_VALUE_ALLOCATION);
    while (capacity <= index) {
      capacity *= 2;
    }
    return capacity;
  }

  public abstract class BaseAccessor implements ValueVector.Accessor {
    protected BaseAccessor() { }

    @Override
    public int getValueCount() { return valueCount; }

    @Override
    public boolean isNull(int index) {
      return nulls.get(slot(index));
    }
  }

  public abstract class BaseMutator implements ValueVector.Mutator {
    protected BaseMutator() { }

    /**
     * Returns the slot a write to the given row goes to. A constant
     * vector only accepts writes to row 0.
     */
    protected int writeSlot(int index) {
      Preconditions.checkArgument(index >= 0, "negative index: %s", index);
      Preconditions.checkState(! isConstant() || index == 0,
          "Constant vector %s accepts only row 0, got %s", name, index);
      return index;
    }

    @Override
    public void setNull(int index) {
      nulls.set(writeSlot(index));
    }

    protected void setNotNull(int index) {
      nulls.clear(index);
    }

    @Override
    public void setValueCount(int valueCount) {
      Preconditions.checkArgument(valueCount >= 0);
      BaseValueVector.this.valueCount = valueCount;
    }

    @Override
    public void reset() {
      nulls.clear();
      valueCount = 0;
    }
  }
}
