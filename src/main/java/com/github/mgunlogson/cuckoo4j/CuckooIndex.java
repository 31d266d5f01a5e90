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

/**
 * Bucket index arithmetic shared by the filter and the table. The alternate
 * index is an involution: {@code altIndex(altIndex(i, x, n), x, n) == i} for
 * every {@code i < n}, which is what lets an evicted entry find its way back
 * without knowing which of its two buckets it came from.
 *
 * @author Mark Gunlogson
 *
 */
final class CuckooIndex {

	/**
	 * 0xc6a4a7935bd1e995L hash mixing constant from 64 bit MurmurHash2
	 */
	static final long MULTIPLIER = 0xc6a4a7935bd1e995L;

	private CuckooIndex() {
	}

	static boolean isPowerOfTwo(long numBuckets) {
		return numBuckets > 0 && (numBuckets & (numBuckets - 1)) == 0;
	}

	/**
	 * @return number of buckets for a hash power
	 */
	static long hashSize(int hashPower) {
		return 1L << hashPower;
	}

	/**
	 * @return bitmask selecting a bucket for a hash power
	 */
	static long hashMask(int hashPower) {
		return hashSize(hashPower) - 1;
	}

	/**
	 * First candidate bucket of a digest in a power of two table.
	 */
	static long indexHash(int hashPower, long hashVal) {
		return hashVal & hashMask(hashPower);
	}

	/**
	 * Alternate bucket for an entry with the given fingerprint currently
	 * sitting in {@code index}.
	 * <p>
	 * Power of two tables xor the index with the scrambled fingerprint and
	 * mask. Other sizes cannot mask, and xor followed by modulo loses the
	 * involution, so they reflect the index around the scrambled fingerprint
	 * instead: {@code (h - index) mod n}.
	 */
	static long altIndex(long index, long fingerprint, long numBuckets) {
		// ensure fingerprint is nonzero for the multiply
		long scrambled = (fingerprint + 1) * MULTIPLIER;
		if (isPowerOfTwo(numBuckets)) {
			return (index ^ scrambled) & (numBuckets - 1);
		}
		long reflected = Math.floorMod(scrambled, numBuckets) - index;
		if (reflected < 0)
			reflected += numBuckets;
		return reflected;
	}

	/**
	 * Alternate bucket for a full digest in a table of {@code 2^hashPower}
	 * buckets. The bits already used for the first index are shifted off so
	 * the fingerprint is the remainder of the digest.
	 */
	static long tableAltIndex(int hashPower, long hashVal, long index) {
		return altIndex(index, hashVal >>> hashPower, hashSize(hashPower));
	}

}
