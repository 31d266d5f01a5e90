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
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.math.DoubleMath;
import com.google.common.math.LongMath;

/**
 * Enums, small objects, and internal sizing calculations shared by the filter
 * and the hash table.
 *
 * @author Mark Gunlogson
 *
 */
public final class Utils {

	/**
	 * Slots per bucket for every store in this library.
	 */
	static final int SLOTS_PER_BUCKET = 4;

	/**
	 * filter capacity is doubled once if the requested keys would push the
	 * table above this occupancy
	 */
	static final double MAX_FILTER_FILL = 0.96;

	private Utils() {
	}

	/**
	 * The hashing algorithm used by {@link FunnelHasher}.
	 *
	 * @author Mark Gunlogson
	 *
	 */
	public enum Algorithm {
		/**
		 * Murmer3 - 128 bit version. This is the default.
		 */
		Murmur3_128,
		/**
		 * SHA256 secure hash.
		 */
		sha256,
		/**
		 * SipHash(2,4) secure hash.
		 */
		sipHash24,
		/**
		 * FarmHash Fingerprint64, unseeded so the salt is mixed into the
		 * hashed stream instead.
		 */
		farmHashFingerprint64
	}

	/**
	 * When the filter's eviction walk runs out of kicks, the last tag that
	 * failed to be repositioned is left without a home. We keep it here so
	 * it still counts as inserted. Only one may exist at a time.
	 */
	static final class Victim {
		private long index;
		private long tag;

		Victim() {
		}

		Victim(long bucketIndex, long tag) {
			this.index = bucketIndex;
			this.tag = tag;
		}

		long getIndex() {
			return index;
		}

		void setIndex(long index) {
			this.index = index;
		}

		long getTag() {
			return tag;
		}

		void setTag(long tag) {
			this.tag = tag;
		}

		/**
		 * true if this victim could belong to an item with the given tag and
		 * candidate buckets
		 */
		boolean matches(long i1, long i2, long tag) {
			return this.tag == tag && (this.index == i1 || this.index == i2);
		}

		@Override
		public int hashCode() {
			return Objects.hash(index, tag);
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (object == this) {
				return true;
			}
			if (object instanceof Utils.Victim) {
				Utils.Victim that = (Utils.Victim) object;
				return this.index == that.index && this.tag == that.tag;
			}
			return false;
		}

		Victim copy() {
			return new Victim(index, tag);
		}
	}

	/**
	 * Calculates how many bits are needed to reach a given false positive rate.
	 *
	 * @param fpProb
	 *            the false positive probability.
	 * @return the length of the tag needed (in bits) to reach the false
	 *         positive rate.
	 */
	static int getBitsPerItemForFpRate(double fpProb, double loadFactor) {
		/*
		 * equation from Cuckoo Filter: Practically Better Than Bloom Bin Fan,
		 * David G. Andersen, Michael Kaminsky , Michael D. Mitzenmacher
		 */
		return DoubleMath.roundToInt(DoubleMath.log2((1 / fpProb) + 3) / loadFactor, RoundingMode.UP);
	}

	/**
	 * Smallest power of two that is >= {@code value}. Values below 1 round up
	 * to 1.
	 */
	static long upperPowerOfTwo(long value) {
		if (value <= 1)
			return 1;
		return LongMath.checkedPow(2, LongMath.log2(value, RoundingMode.CEILING));
	}

	/**
	 * Calculates how many buckets the filter needs for {@code maxKeys} keys.
	 * The count is a power of two, doubled once more if the keys would fill
	 * it beyond {@link #MAX_FILTER_FILL}.
	 *
	 * @param maxKeys
	 *            the number of keys the filter is expected to hold before
	 *            insertion failure.
	 * @return The number of buckets needed
	 */
	static long getBucketsNeeded(long maxKeys) {
		long numBuckets = upperPowerOfTwo(Math.max(1, maxKeys / SLOTS_PER_BUCKET));
		double frac = (double) maxKeys / numBuckets / SLOTS_PER_BUCKET;
		if (frac > MAX_FILTER_FILL) {
			numBuckets <<= 1;
		}
		return numBuckets;
	}

	/**
	 * Returns the smallest hash power whose table holds {@code slots} keys.
	 */
	static int getHashPowerNeeded(long slots) {
		checkArgument(slots > 0, "slots (%s) must be > 0", slots);
		long buckets = LongMath.divide(slots, SLOTS_PER_BUCKET, RoundingMode.CEILING);
		return LongMath.log2(upperPowerOfTwo(buckets), RoundingMode.UNNECESSARY);
	}

}
