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
 * Storage for filter tags. A tag is a non-zero value of at most
 * {@link #bitsPerTag()} bits, zero marks an empty slot.
 *
 * @author Mark Gunlogson
 *
 */
public interface TagStore extends BucketStore {

	int bitsPerTag();

	/**
	 * @return the tag in the slot, zero if empty
	 */
	long readTag(long bucketIndex, int posInBucket);

	/**
	 * Overwrites the slot with {@code tag}. Writing zero empties it.
	 */
	void writeTag(long bucketIndex, int posInBucket, long tag);

	/**
	 * @return true if the slot holds exactly {@code tag}
	 */
	boolean checkTag(long bucketIndex, int posInBucket, long tag);

	/**
	 * Inserts a tag into the first empty position of the bucket, in ascending
	 * slot order.
	 *
	 * @return true if insert succeeded (bucket not full)
	 */
	boolean insertToBucket(long bucketIndex, long tag);

	/**
	 * Replaces the tag at a position and returns the tag that was there.
	 */
	long swapTagInBucket(long bucketIndex, int posInBucket, long tag);

	/**
	 * @return true if tag found in one of the two buckets
	 */
	boolean findTag(long i1, long i2, long tag);

	/**
	 * Counts the slots holding {@code tag} across both buckets. A bucket
	 * passed twice is counted twice.
	 */
	int countTag(long i1, long i2, long tag);

	/**
	 * Deletes one copy of {@code tag} from the bucket.
	 *
	 * @return true if a tag was deleted
	 */
	boolean deleteFromBucket(long bucketIndex, long tag);

	/**
	 * @return memory held by the tag slots, in bytes
	 */
	long sizeInBytes();

	/**
	 * @return an equal store sharing no mutable state with this one
	 */
	TagStore copy();

}
