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

/**
 * Bucket level operations shared by the tag layouts. Subclasses only need to
 * read and write single slots.
 *
 * @author Mark Gunlogson
 *
 */
abstract class AbstractTagStore implements TagStore {

	static final int MAX_TAG_BITS = 32;

	final int bitsPerTag;
	final long numBuckets;

	AbstractTagStore(int bitsPerTag, long numBuckets) {
		checkDimensions(bitsPerTag, numBuckets);
		this.bitsPerTag = bitsPerTag;
		this.numBuckets = numBuckets;
	}

	static void checkDimensions(int bitsPerTag, long numBuckets) {
		checkArgument(bitsPerTag > 0, "bitsPerTag (%s) must be > 0", bitsPerTag);
		checkArgument(bitsPerTag <= MAX_TAG_BITS, "bitsPerTag (%s) must be <= %s", bitsPerTag, MAX_TAG_BITS);
		checkArgument(numBuckets > 0, "numBuckets (%s) must be > 0", numBuckets);
	}

	@Override
	public final long bucketCount() {
		return numBuckets;
	}

	@Override
	public final int slotsPerBucket() {
		return Utils.SLOTS_PER_BUCKET;
	}

	@Override
	public final int bitsPerTag() {
		return bitsPerTag;
	}

	@Override
	public boolean occupied(long bucketIndex, int posInBucket) {
		return !checkTag(bucketIndex, posInBucket, 0);
	}

	@Override
	public void clear(long bucketIndex, int posInBucket) {
		writeTag(bucketIndex, posInBucket, 0);
	}

	@Override
	public boolean checkTag(long bucketIndex, int posInBucket, long tag) {
		return readTag(bucketIndex, posInBucket) == tag;
	}

	@Override
	public boolean insertToBucket(long bucketIndex, long tag) {
		for (int i = 0; i < Utils.SLOTS_PER_BUCKET; i++) {
			if (checkTag(bucketIndex, i, 0)) {
				writeTag(bucketIndex, i, tag);
				return true;
			}
		}
		return false;
	}

	@Override
	public long swapTagInBucket(long bucketIndex, int posInBucket, long tag) {
		long old = readTag(bucketIndex, posInBucket);
		writeTag(bucketIndex, posInBucket, tag);
		return old;
	}

	@Override
	public boolean findTag(long i1, long i2, long tag) {
		for (int i = 0; i < Utils.SLOTS_PER_BUCKET; i++) {
			if (checkTag(i1, i, tag) || checkTag(i2, i, tag))
				return true;
		}
		return false;
	}

	@Override
	public int countTag(long i1, long i2, long tag) {
		int tagCount = 0;
		for (int posInBucket = 0; posInBucket < Utils.SLOTS_PER_BUCKET; posInBucket++) {
			if (checkTag(i1, posInBucket, tag))
				tagCount++;
			if (checkTag(i2, posInBucket, tag))
				tagCount++;
		}
		return tagCount;
	}

	@Override
	public boolean deleteFromBucket(long bucketIndex, long tag) {
		for (int i = 0; i < Utils.SLOTS_PER_BUCKET; i++) {
			if (checkTag(bucketIndex, i, tag)) {
				clear(bucketIndex, i);
				return true;
			}
		}
		return false;
	}

	/**
	 * Tags wider than the store would silently lose bits.
	 */
	final boolean fits(long tag) {
		return (tag >>> bitsPerTag) == 0;
	}

}
