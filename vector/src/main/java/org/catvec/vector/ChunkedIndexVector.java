/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.catvec.vector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntToLongFunction;
import java.util.function.IntUnaryOperator;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.util.Preconditions;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.catvec.vector.compute.VectorCasts;
import org.catvec.vector.types.DataType;
import org.catvec.vector.util.SharedVectors;

/**
 * Nullable unsigned 32-bit indices stored as one or more {@link UInt4Vector} chunks.
 *
 * <p>The vector owns its chunks. Zero-copy operations ({@link #duplicate(String)},
 * {@link #slice(int, int)}, {@link #append(ChunkedIndexVector)}) return vectors whose chunks share
 * the reference-counted Arrow buffers, so either side may be closed first.</p>
 */
public class ChunkedIndexVector implements Column {

  public static final ArrowType INDEX_TYPE = new ArrowType.Int(32, false);

  private final String name;
  private final BufferAllocator allocator;
  private final List<UInt4Vector> chunks;
  // offsets[c] is the global index of the first value of chunk c; the last entry is the length.
  private final int[] offsets;
  private IsSorted sortedFlag = IsSorted.NOT;

  /**
   * Creates a vector that takes ownership of {@code chunks}.
   */
  public ChunkedIndexVector(String name, BufferAllocator allocator, List<UInt4Vector> chunks) {
    Preconditions.checkNotNull(allocator, "allocator");
    Preconditions.checkArgument(!chunks.isEmpty(), "at least one chunk is required");
    this.name = name;
    this.allocator = allocator;
    this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
    this.offsets = new int[chunks.size() + 1];
    for (int c = 0; c < chunks.size(); c++) {
      offsets[c + 1] = Math.addExact(offsets[c], chunks.get(c).getValueCount());
    }
  }

  /**
   * Wraps a single chunk, taking ownership of it.
   */
  public static ChunkedIndexVector of(String name, UInt4Vector chunk) {
    return new ChunkedIndexVector(name, chunk.getAllocator(), Collections.singletonList(chunk));
  }

  public static ChunkedIndexVector of(UInt4Vector chunk) {
    return of(chunk.getName(), chunk);
  }

  public static ChunkedIndexVector empty(String name, BufferAllocator allocator) {
    return of(name, new UInt4Vector(name, allocator));
  }

  @Override
  public String getName() {
    return name;
  }

  public BufferAllocator getAllocator() {
    return allocator;
  }

  @Override
  public int getValueCount() {
    return offsets[chunks.size()];
  }

  @Override
  public int getNullCount() {
    int nullCount = 0;
    for (UInt4Vector chunk : chunks) {
      nullCount += chunk.getNullCount();
    }
    return nullCount;
  }

  public boolean hasNulls() {
    for (UInt4Vector chunk : chunks) {
      if (chunk.getNullCount() > 0) {
        return true;
      }
    }
    return false;
  }

  @Override
  public DataType getDataType() {
    return DataType.UINT32;
  }

  public int getChunkCount() {
    return chunks.size();
  }

  public List<UInt4Vector> getChunks() {
    return chunks;
  }

  public UInt4Vector getChunk(int chunkIndex) {
    return chunks.get(chunkIndex);
  }

  private int chunkFor(int index) {
    int low = 0;
    int high = chunks.size() - 1;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (offsets[mid] <= index) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }

  public boolean isNull(int index) {
    Preconditions.checkElementIndex(index, getValueCount());
    int c = chunkFor(index);
    return chunks.get(c).isNull(index - offsets[c]);
  }

  /**
   * Gets the code at {@code index} as raw bits, to be read as unsigned.
   *
   * @throws IllegalStateException if the value is null
   */
  public int get(int index) {
    Preconditions.checkElementIndex(index, getValueCount());
    int c = chunkFor(index);
    return chunks.get(c).get(index - offsets[c]);
  }

  /**
   * Gets the code at {@code index}, or null.
   */
  public Integer getObject(int index) {
    Preconditions.checkElementIndex(index, getValueCount());
    int c = chunkFor(index);
    UInt4Vector chunk = chunks.get(c);
    int i = index - offsets[c];
    return chunk.isNull(i) ? null : chunk.get(i);
  }

  /**
   * Calls {@code consumer} for every non-null code, in order.
   */
  public void forEachNonNull(IndexConsumer consumer) {
    for (int c = 0; c < chunks.size(); c++) {
      UInt4Vector chunk = chunks.get(c);
      int count = chunk.getValueCount();
      boolean noNulls = chunk.getNullCount() == 0;
      for (int i = 0; i < count; i++) {
        if (noNulls || !chunk.isNull(i)) {
          consumer.accept(offsets[c] + i, chunk.get(i));
        }
      }
    }
  }

  /**
   * Applies {@code function} to every non-null code. Nulls stay null and the chunk layout is
   * kept; the result carries no sorted flag.
   */
  public ChunkedIndexVector remap(String newName, IntUnaryOperator function) {
    List<UInt4Vector> remapped = new ArrayList<>(chunks.size());
    try {
      for (UInt4Vector chunk : chunks) {
        int count = chunk.getValueCount();
        UInt4Vector target = new UInt4Vector(newName, allocator);
        remapped.add(target);
        target.allocateNew(count);
        for (int i = 0; i < count; i++) {
          if (chunk.isNull(i)) {
            target.setNull(i);
          } else {
            target.set(i, function.applyAsInt(chunk.get(i)));
          }
        }
        target.setValueCount(count);
      }
    } catch (RuntimeException e) {
      closeAll(remapped);
      throw e;
    }
    return new ChunkedIndexVector(newName, allocator, remapped);
  }

  public ChunkedIndexVector remap(IntUnaryOperator function) {
    return remap(name, function);
  }

  /**
   * Like {@link #remap(String, IntUnaryOperator)}, but a negative result turns the value into
   * a null. Non-negative results are stored as unsigned 32-bit codes.
   */
  public ChunkedIndexVector remapToNullable(String newName, IntToLongFunction function) {
    List<UInt4Vector> remapped = new ArrayList<>(chunks.size());
    try {
      for (UInt4Vector chunk : chunks) {
        int count = chunk.getValueCount();
        UInt4Vector target = new UInt4Vector(newName, allocator);
        remapped.add(target);
        target.allocateNew(count);
        for (int i = 0; i < count; i++) {
          long code = chunk.isNull(i) ? -1 : function.applyAsLong(chunk.get(i));
          if (code < 0) {
            target.setNull(i);
          } else {
            target.set(i, (int) code);
          }
        }
        target.setValueCount(count);
      }
    } catch (RuntimeException e) {
      closeAll(remapped);
      throw e;
    }
    return new ChunkedIndexVector(newName, allocator, remapped);
  }

  /**
   * Zero-copy copy of this vector, sorted flag included.
   */
  public ChunkedIndexVector duplicate(String newName) {
    List<UInt4Vector> shared = new ArrayList<>(chunks.size());
    for (UInt4Vector chunk : chunks) {
      shared.add(SharedVectors.share(chunk, newName));
    }
    ChunkedIndexVector duplicate = new ChunkedIndexVector(newName, allocator, shared);
    duplicate.sortedFlag = sortedFlag;
    return duplicate;
  }

  public ChunkedIndexVector duplicate() {
    return duplicate(name);
  }

  /**
   * Zero-copy view of {@code length} values starting at {@code offset}. A contiguous range of a
   * sorted vector is still sorted, so the flag is kept.
   */
  public ChunkedIndexVector slice(int offset, int length) {
    Preconditions.checkPositionIndexes(offset, offset + length, getValueCount());
    List<UInt4Vector> shared = new ArrayList<>();
    int end = offset + length;
    for (int c = 0; c < chunks.size() && length > 0; c++) {
      int chunkStart = offsets[c];
      int chunkEnd = offsets[c + 1];
      int from = Math.max(offset, chunkStart);
      int to = Math.min(end, chunkEnd);
      if (from < to) {
        shared.add(SharedVectors.share(chunks.get(c), name, from - chunkStart, to - from));
      }
    }
    if (shared.isEmpty()) {
      shared.add(new UInt4Vector(name, allocator));
    }
    ChunkedIndexVector slice = new ChunkedIndexVector(name, allocator, shared);
    slice.sortedFlag = sortedFlag;
    return slice;
  }

  /**
   * Concatenates {@code other} after this vector without copying. Empty chunks are dropped.
   */
  public ChunkedIndexVector append(ChunkedIndexVector other) {
    List<UInt4Vector> shared = new ArrayList<>(chunks.size() + other.chunks.size());
    for (ChunkedIndexVector source : new ChunkedIndexVector[] {this, other}) {
      for (UInt4Vector chunk : source.chunks) {
        if (chunk.getValueCount() > 0) {
          shared.add(SharedVectors.share(chunk, name));
        }
      }
    }
    if (shared.isEmpty()) {
      shared.add(new UInt4Vector(name, allocator));
    }
    return new ChunkedIndexVector(name, allocator, shared);
  }

  /**
   * Copies all values into a single chunk.
   */
  public ChunkedIndexVector rechunk() {
    if (chunks.size() == 1) {
      return duplicate(name);
    }
    int count = getValueCount();
    UInt4Vector target = new UInt4Vector(name, allocator);
    try {
      target.allocateNew(count);
      for (int c = 0; c < chunks.size(); c++) {
        UInt4Vector chunk = chunks.get(c);
        for (int i = 0; i < chunk.getValueCount(); i++) {
          target.copyFromSafe(i, offsets[c] + i, chunk);
        }
      }
      target.setValueCount(count);
    } catch (RuntimeException e) {
      target.close();
      throw e;
    }
    ChunkedIndexVector rechunked = ChunkedIndexVector.of(name, target);
    rechunked.sortedFlag = sortedFlag;
    return rechunked;
  }

  /**
   * Casts the codes, read as unsigned integers, to another Arrow type.
   */
  public FieldVector castWithOptions(ArrowType targetType, CastOptions options) {
    return VectorCasts.castIndices(this, targetType, options);
  }

  public IsSorted getSortedFlag() {
    return sortedFlag;
  }

  public void setSortedFlag(IsSorted sortedFlag) {
    this.sortedFlag = Preconditions.checkNotNull(sortedFlag, "sortedFlag");
  }

  @Override
  public void close() {
    closeAll(chunks);
  }

  private static void closeAll(List<UInt4Vector> vectors) {
    for (UInt4Vector vector : vectors) {
      vector.close();
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(name).append(": [");
    int count = Math.min(getValueCount(), 10);
    for (int i = 0; i < count; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      Integer code = getObject(i);
      sb.append(code == null ? "null" : Integer.toUnsignedString(code));
    }
    if (getValueCount() > count) {
      sb.append(", ...");
    }
    return sb.append("]").toString();
  }

  /**
   * Receives a position and the code stored there.
   */
  @FunctionalInterface
  public interface IndexConsumer {
    void accept(int index, int code);
  }
}
