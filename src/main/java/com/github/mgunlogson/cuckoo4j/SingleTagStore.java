/*
   Copyright 2016 Mark Gunlogson

   Licensed under the Apache License, Version 2.0 (the "License");
   you may not use this file except in compliance with the License.
   You may obtain a copy of the License at

       http://www.apache.org/licenses/LICENSE-2.0

   Unless required by applicable law or agreed to in writing, software
   distributed under the License is distributed on an "AS IS" BASIS,
   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
   See the License for the specific language governing permissions and
   limitations under the License.
*/

package com.github.mgunlogson.cuckoo4j;

import static com.google.common.base.Preconditions.checkArgument;

import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.math.IntMath;
import com.google.common.math.LongMath;

/**
 * Tag store that gives every slot its own whole bytes. Uses more memory than
 * {@link PackedTagStore} unless tags are a multiple of 8 bits, but reads and
 * writes are plain array accesses.
 *
 * @author Mark Gunlogson
 *
 */
public final class SingleTagStore extends AbstractTagStore {
	private final byte[] slots;
	private final int bytesPerTag;

	private SingleTagStore(byte[] slots, int bitsPerTag, long numBuckets) {
		super(bitsPerTag, numBuckets);
		this.slots = slots;
		this.bytesPerTag = IntMath.divide(bitsPerTag, Byte.SIZE, RoundingMode.CEILING);
	}

	/**
	 * Creates a SingleTagStore
	 *
	 * @param bitsPerTag
	 *            number of bits needed for each tag
	 * @param numBuckets
	 *            number of buckets in store
	 * @return an empty store
	 */
	public static SingleTagStore create(int bitsPerTag, long numBuckets) {
		checkDimensions(bitsPerTag, numBuckets);
		int bytesPerTag = IntMath.divide(bitsPerTag, Byte.SIZE, RoundingMode.CEILING);
		long size = LongMath.checkedMultiply(numBuckets, (long) Utils.SLOTS_PER_BUCKET * bytesPerTag);
		checkArgument(size <= Integer.MAX_VALUE - 8,
				"%s buckets of %s byte tags do not fit in one array, use a PackedTagStore", numBuckets, bytesPerTag);
		return new SingleTagStore(new byte[(int) size], bitsPerTag, numBuckets);
	}

	@Override
	public long readTag(long bucketIndex, int posInBucket) {
		int offset = getTagOffset(bucketIndex, posInBucket);
		long tag = 0;
		// little endian
		for (int i = bytesPerTag - 1; i >= 0; i--) {
			tag = (tag << Byte.SIZE) | (slots[offset + i] & 0xFFL);
		}
		return tag;
	}

	@Override
	public void writeTag(long bucketIndex, int posInBucket, long tag) {
		assert fits(tag) : "tag " + tag + " wider than " + bitsPerTag + " bits";
		int offset = getTagOffset(bucketIndex, posInBucket);
		for (int i = 0; i < bytesPerTag; i++) {
			slots[offset + i] = (byte) (tag >>> (i * Byte.SIZE));
		}
	}

	@Override
	public long sizeInBytes() {
		return slots.length;
	}

	private int getTagOffset(long bucketIndex, int posInBucket) {
		return (int) ((bucketIndex * Utils.SLOTS_PER_BUCKET + posInBucket) * bytesPerTag);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (object == this) {
			return true;
		}
		if (object instanceof SingleTagStore) {
			SingleTagStore that = (SingleTagStore) object;
			return this.bitsPerTag == that.bitsPerTag && this.numBuckets == that.numBuckets
					&& Arrays.equals(this.slots, that.slots);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(bitsPerTag, numBuckets, Arrays.hashCode(slots));
	}

	@Override
	public SingleTagStore copy() {
		return new SingleTagStore(slots.clone(), bitsPerTag, numBuckets);
	}

}
