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
 * Fixed capacity array of buckets, each holding {@link #slotsPerBucket()}
 * slots. The engines only ever talk to their storage through this contract
 * (and the {@link TagStore} / {@link KeyStore} refinements), so physical
 * layouts can be swapped freely.
 *
 * <p>
 * Stores do not check bucket indexes or slot positions for range. The engines
 * always hand them indexes below {@link #bucketCount()}.
 *
 * @author Mark Gunlogson
 *
 */
public interface BucketStore {

	/**
	 * @return number of buckets in the store
	 */
	long bucketCount();

	/**
	 * @return number of slots in each bucket
	 */
	int slotsPerBucket();

	/**
	 * @return true if the slot holds an entry
	 */
	boolean occupied(long bucketIndex, int posInBucket);

	/**
	 * Empties a slot.
	 */
	void clear(long bucketIndex, int posInBucket);

}
