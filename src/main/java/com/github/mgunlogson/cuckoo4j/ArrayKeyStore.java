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

import javax.annotation.Nullable;

/**
 * Key store backed by a single object array, {@code 2^hashPower} buckets of
 * four slots laid out back to back.
 *
 * @author Mark Gunlogson
 *
 * @param <K>
 *            key type
 */
public final class ArrayKeyStore<K> implements KeyStore<K> {
	// 2^28 buckets * 4 slots stays below the maximum array length
	static final int MAX_HASH_POWER = 28;

	private final Object[] slots;
	private final int hashPower;

	private ArrayKeyStore(Object[] slots, int hashPower) {
		this.slots = slots;
		this.hashPower = hashPower;
	}

	/**
	 * Creates an empty store with {@code 2^hashPower} buckets.
	 */
	public static <K> ArrayKeyStore<K> create(int hashPower) {
		checkArgument(hashPower >= 0, "hashPower (%s) must be >= 0", hashPower);
		checkArgument(hashPower <= MAX_HASH_POWER, "hashPower (%s) must be <= %s", hashPower, MAX_HASH_POWER);
		return new ArrayKeyStore<>(new Object[(1 << hashPower) * Utils.SLOTS_PER_BUCKET], hashPower);
	}

	int hashPower() {
		return hashPower;
	}

	@Override
	public long bucketCount() {
		return 1L << hashPower;
	}

	@Override
	public int slotsPerBucket() {
		return Utils.SLOTS_PER_BUCKET;
	}

	@Override
	public boolean occupied(long bucketIndex, int posInBucket) {
		return slots[offset(bucketIndex, posInBucket)] != null;
	}

	@Override
	public void clear(long bucketIndex, int posInBucket) {
		slots[offset(bucketIndex, posInBucket)] = null;
	}

	@Override
	@SuppressWarnings("unchecked")
	@Nullable
	public K getKey(long bucketIndex, int posInBucket) {
		return (K) slots[offset(bucketIndex, posInBucket)];
	}

	@Override
	public void setKey(long bucketIndex, int posInBucket, K key) {
		checkNotNull(key);
		slots[offset(bucketIndex, posInBucket)] = key;
	}

	private static int offset(long bucketIndex, int posInBucket) {
		return (int) bucketIndex * Utils.SLOTS_PER_BUCKET + posInBucket;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (object == this) {
			return true;
		}
		if (object instanceof ArrayKeyStore) {
			ArrayKeyStore<?> that = (ArrayKeyStore<?>) object;
			return this.hashPower == that.hashPower && Arrays.equals(this.slots, that.slots);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return 31 * hashPower + Arrays.hashCode(slots);
	}

	@Override
	public ArrayKeyStore<K> copy() {
		return new ArrayKeyStore<>(slots.clone(), hashPower);
	}

}
