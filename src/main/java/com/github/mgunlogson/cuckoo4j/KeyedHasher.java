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
 * A keyed hash family mapping {@code (item, seed)} to a 64 bit digest. Both
 * {@link CuckooFilter} and {@link CuckooHashTable} route every item through
 * one of these.
 *
 * <p>
 * Implementations must be at least 2-independent: digests produced for the
 * same item under different seeds should look statistically independent, and
 * the full 64 bits should be usable. The filter takes its primary bucket index
 * and its tags from different parts of the digest, so a hash that only mixes
 * the low bits will crowd the table.
 *
 * @author Mark Gunlogson
 *
 * @param <T>
 *            type of item to hash
 */
public interface KeyedHasher<T> {

	/**
	 * Hashes {@code item} under {@code seed}. Must be deterministic for a
	 * given hasher instance.
	 *
	 * @param item
	 *            item to hash, never null
	 * @param seed
	 *            seed selecting a member of the hash family. Zero is the
	 *            unkeyed default.
	 * @return 64 bit digest
	 */
	long hash(T item, int seed);

}
