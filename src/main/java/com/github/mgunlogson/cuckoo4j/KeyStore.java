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

import javax.annotation.Nullable;

/**
 * Storage for full keys used by {@link CuckooHashTable}. Keys are held by
 * reference, null is reserved for an empty slot.
 *
 * @author Mark Gunlogson
 *
 * @param <K>
 *            key type
 */
public interface KeyStore<K> extends BucketStore {

	/**
	 * @return the key in the slot or null if empty
	 */
	@Nullable
	K getKey(long bucketIndex, int posInBucket);

	/**
	 * Stores a key in the slot, replacing anything there.
	 */
	void setKey(long bucketIndex, int posInBucket, K key);

	/**
	 * @return a store holding the same keys, sharing no slots with this one
	 */
	KeyStore<K> copy();

}
