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
 * Receives diagnostic events from {@link CuckooFilter} and
 * {@link CuckooHashTable}. The engines never print; register a listener
 * through their builders to observe rehashed buckets, lookup misses, victim
 * handling, cuckoo moves and table-full failures. Every method defaults to a
 * no-op.
 * <p>
 * Callbacks run synchronously inside the operation that raised them and must
 * not call back into the engine.
 *
 * @author Mark Gunlogson
 *
 */
public interface CuckooListener {

	/**
	 * Listener that ignores everything. The default for both engines.
	 */
	CuckooListener NO_OP = new CuckooListener() {
	};

	/**
	 * An item was routed through a bucket with a non-zero seed from the
	 * filter's seed table.
	 */
	default void seededBucketUsed(long bucketIndex, int seed) {
	}

	/**
	 * A filter lookup found the tag in neither candidate bucket nor the
	 * victim.
	 */
	default void lookupMiss(long i1, long i2, long tag) {
	}

	/**
	 * The filter's eviction walk ran out of kicks and parked a tag in the
	 * victim slot.
	 */
	default void victimStored(long bucketIndex, long tag) {
	}

	/**
	 * A parked victim tag was placed back into the filter after a deletion.
	 */
	default void victimReclaimed(long bucketIndex, long tag) {
	}

	/**
	 * The hash table moved a key one step along a cuckoo path.
	 */
	default void keyMoved(long fromBucket, int fromSlot, long toBucket, int toSlot) {
	}

	/**
	 * The hash table found no cuckoo path within its search budget.
	 */
	default void tableFull(int hashPower, long size, double loadFactor) {
	}

}
