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
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Arrays;
import java.util.Objects;

import javax.annotation.Nullable;

/**
 * Hopefully keeping this class as simple as possible will allow JVM to prevent
 * allocating these entirely.
 *
 * @author Mark Gunlogson
 *
 */
final class BucketAndTag {

	final long index;
	final long tag;
	final int seed;

	BucketAndTag(long bucketIndex, long tag, int seed) {
		this.index = bucketIndex;
		this.tag = tag;
		this.seed = seed;
	}
}

/**
 * This class calculates tag and bucket indexes for filter items.
 * <p>
 * The primary index never depends on a seed, it comes from the unkeyed
 * digest. The tag is taken from the digest keyed with the seed of that
 * primary bucket, so changing one bucket's seed only re-tags the items that
 * first land there. Index and tag always come from disjoint halves of the
 * digest.
 *
 * @author Mark Gunlogson
 *
 * @param <T>
 *            type of item to hash
 */
final class IndexTagCalc<T> {
	/**
	 * tag value written when the digest's tag bits are all zero, since zero
	 * means an empty slot
	 */
	static final long ZERO_TAG_SENTINEL = 1;
	/**
	 * seeded indexes come from the low digest bits, tags from the upper half
	 */
	static final int MAX_SEEDED_HASH_POWER = ArrayKeyStore.MAX_HASH_POWER;

	private final KeyedHasher<? super T> hasher;
	private final long numBuckets;
	private final int tagBits;
	private final long tagMask;
	@Nullable
	private final int[] seeds;
	private final int hashPower;

	/**
	 * @param seeds
	 *            one seed per bucket, or null to hash every item unkeyed
	 * @param hashPower
	 *            hash power of the companion table the seeds were computed
	 *            against, ignored without seeds
	 */
	IndexTagCalc(KeyedHasher<? super T> hasher, long numBuckets, int tagBits, @Nullable int[] seeds,
			int hashPower) {
		checkNotNull(hasher);
		checkArgument(tagBits > 0, "Number of tag bits (%s) must be positive", tagBits);
		checkArgument(tagBits <= AbstractTagStore.MAX_TAG_BITS, "Number of tag bits (%s) must be <= %s", tagBits,
				AbstractTagStore.MAX_TAG_BITS);
		checkArgument(numBuckets > 0, "Number of buckets (%s) must be positive", numBuckets);
		if (seeds != null) {
			checkArgument(seeds.length == numBuckets, "Seed table length (%s) must match number of buckets (%s)",
					seeds.length, numBuckets);
			checkArgument(hashPower >= 0 && hashPower <= MAX_SEEDED_HASH_POWER, "hashPower (%s) must be in [0, %s]",
					hashPower, MAX_SEEDED_HASH_POWER);
			checkArgument(numBuckets <= CuckooIndex.hashSize(hashPower),
					"Seed table length (%s) exceeds 2^hashPower (%s)", numBuckets, hashPower);
		}
		this.hasher = hasher;
		this.numBuckets = numBuckets;
		this.tagBits = tagBits;
		this.tagMask = (1L << tagBits) - 1;
		this.seeds = seeds;
		this.hashPower = hashPower;
	}

	static <T> IndexTagCalc<T> create(KeyedHasher<? super T> hasher, long numBuckets, int tagBits) {
		return new IndexTagCalc<>(hasher, numBuckets, tagBits, null, 0);
	}

	long getNumBuckets() {
		return numBuckets;
	}

	int getTagBits() {
		return tagBits;
	}

	boolean isSeeded() {
		return seeds != null;
	}

	int getHashPower() {
		return hashPower;
	}

	/**
	 * Generates the bucket index and tag for a given item.
	 */
	BucketAndTag generate(T item) {
		long unkeyed = hasher.hash(item, 0);
		long bucketIndex = primaryIndex(unkeyed);
		int seed = seedFor(bucketIndex);
		long keyed = seed == 0 ? unkeyed : hasher.hash(item, seed);
		long tagBits = seeds == null ? keyed : keyed >>> 32;
		return new BucketAndTag(bucketIndex, tagHash(tagBits), seed);
	}

	/**
	 * Without seeds the index comes from the upper half of the digest and the
	 * tag from the lower bits. With seeds the index follows the companion
	 * table's layout, taking the digest's low {@code hashPower} bits, and the
	 * tag moves to the upper half.
	 */
	long primaryIndex(long unkeyed) {
		if (seeds != null) {
			return hashIndex(CuckooIndex.indexHash(hashPower, unkeyed));
		}
		return hashIndex(unkeyed >>> 32);
	}

	int seedFor(long bucketIndex) {
		if (seeds == null)
			return 0;
		return seeds[(int) bucketIndex];
	}

	long tagHash(long hashVal) {
		long tag = hashVal & tagMask;
		if (tag == 0)
			tag = ZERO_TAG_SENTINEL;
		return tag;
	}

	long altIndex(long bucketIndex, long tag) {
		return CuckooIndex.altIndex(bucketIndex, tag, numBuckets);
	}

	long hashIndex(long index) {
		/*
		 * we always need to return a bucket index within table range if we try
		 * to range it later during read/write things will go terribly wrong
		 * since the index becomes circular
		 */
		return Long.remainderUnsigned(index, numBuckets);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (object == this) {
			return true;
		}
		if (object instanceof IndexTagCalc) {
			IndexTagCalc<?> that = (IndexTagCalc<?>) object;
			return this.hasher.equals(that.hasher) && this.numBuckets == that.numBuckets
					&& this.tagBits == that.tagBits && Arrays.equals(this.seeds, that.seeds)
					&& this.hashPower == that.hashPower;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(hasher, numBuckets, tagBits, Arrays.hashCode(seeds), hashPower);
	}

}
