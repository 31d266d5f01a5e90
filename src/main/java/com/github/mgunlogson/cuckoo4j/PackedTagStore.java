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

import java.math.RoundingMode;
import java.util.Objects;

import javax.annotation.Nullable;

import org.apache.lucene.util.LongBitSet;

import com.google.common.math.IntMath;
import com.google.common.math.LongMath;

/**
 * Tag store that packs {@code bitsPerTag} bits per slot into one bit set,
 * without any padding between slots or buckets.
 *
 * @author Mark Gunlogson
 *
 */
public final class PackedTagStore extends AbstractTagStore {
	/*
	 * NOTE: we use the Lucene LongBitSet directly, it supports longs so the
	 * table can grow past 2^31 bits.
	 *
	 * NOTE: for speed, we don't check for inserts into invalid bucket indexes
	 * or bucket positions!
	 */
	private final LongBitSet memBlock;

	private PackedTagStore(LongBitSet memBlock, int bitsPerTag, long numBuckets) {
		super(bitsPerTag, numBuckets);
		this.memBlock = memBlock;
	}

	/**
	 * Creates a PackedTagStore
	 *
	 * @param bitsPerTag
	 *            number of bits needed for each tag
	 * @param numBuckets
	 *            number of buckets in store
	 * @return an empty store
	 */
	public static PackedTagStore create(int bitsPerTag, long numBuckets) {
		checkDimensions(bitsPerTag, numBuckets);
		// checked so our implementors don't get too.... "enthusiastic" with
		// table size
		long bitsPerBucket = IntMath.checkedMultiply(Utils.SLOTS_PER_BUCKET, bitsPerTag);
		long bitSetSize = LongMath.checkedMultiply(bitsPerBucket, numBuckets);
		return new PackedTagStore(new LongBitSet(bitSetSize), bitsPerTag, numBuckets);
	}

	@Override
	public long readTag(long bucketIndex, int posInBucket) {
		long tagStartIdx = getTagOffset(bucketIndex, posInBucket);
		long tag = 0;
		for (int i = 0; i < bitsPerTag; i++) {
			if (memBlock.get(tagStartIdx + i))
				tag |= 1L << i;
		}
		return tag;
	}

	@Override
	public void writeTag(long bucketIndex, int posInBucket, long tag) {
		assert fits(tag) : "tag " + tag + " wider than " + bitsPerTag + " bits";
		long tagStartIdx = getTagOffset(bucketIndex, posInBucket);
		for (int i = 0; i < bitsPerTag; i++) {
			// second arg just does bit test in tag
			if ((tag & (1L << i)) != 0) {
				memBlock.set(tagStartIdx + i);
			} else {
				memBlock.clear(tagStartIdx + i);
			}
		}
	}

	/**
	 * Faster than regular read because it stops checking if it finds a
	 * non-matching bit.
	 */
	@Override
	public boolean checkTag(long bucketIndex, int posInBucket, long tag) {
		long tagStartIdx = getTagOffset(bucketIndex, posInBucket);
		for (int i = 0; i < bitsPerTag; i++) {
			if (memBlock.get(tagStartIdx + i) != ((tag & (1L << i)) != 0))
				return false;
		}
		return true;
	}

	@Override
	public void clear(long bucketIndex, int posInBucket) {
		long tagStartIdx = getTagOffset(bucketIndex, posInBucket);
		memBlock.clear(tagStartIdx, tagStartIdx + bitsPerTag);
	}

	@Override
	public long sizeInBytes() {
		return LongMath.divide(memBlock.length(), Byte.SIZE, RoundingMode.CEILING);
	}

	/**
	 * Finds the bit offset in the bitset for a tag
	 */
	private long getTagOffset(long bucketIndex, int posInBucket) {
		return (bucketIndex * Utils.SLOTS_PER_BUCKET * bitsPerTag) + (posInBucket * bitsPerTag);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (object == this) {
			return true;
		}
		if (object instanceof PackedTagStore) {
			PackedTagStore that = (PackedTagStore) object;
			return this.bitsPerTag == that.bitsPerTag && this.memBlock.equals(that.memBlock)
					&& this.numBuckets == that.numBuckets;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(bitsPerTag, memBlock, numBuckets);
	}

	@Override
	public PackedTagStore copy() {
		return new PackedTagStore(memBlock.clone(), bitsPerTag, numBuckets);
	}

}
