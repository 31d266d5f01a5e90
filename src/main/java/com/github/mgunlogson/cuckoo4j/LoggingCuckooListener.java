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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CuckooListener} that forwards every event to SLF4J. Routine events
 * go to debug, victim storage and table-full failures to warn.
 *
 * @author Mark Gunlogson
 *
 */
public class LoggingCuckooListener implements CuckooListener {
	private static final Logger LOG = LoggerFactory.getLogger(LoggingCuckooListener.class);

	private final Logger log;

	public LoggingCuckooListener() {
		this(LOG);
	}

	public LoggingCuckooListener(Logger log) {
		this.log = log;
	}

	@Override
	public void seededBucketUsed(long bucketIndex, int seed) {
		log.debug("rehashed {} bucket {}", seed, bucketIndex);
	}

	@Override
	public void lookupMiss(long i1, long i2, long tag) {
		log.debug("not found {}: {}, {}", tag, i1, i2);
	}

	@Override
	public void victimStored(long bucketIndex, long tag) {
		log.warn("filter is full, tag {} for bucket {} kept as victim", tag, bucketIndex);
	}

	@Override
	public void victimReclaimed(long bucketIndex, long tag) {
		log.debug("victim tag {} placed back from bucket {}", tag, bucketIndex);
	}

	@Override
	public void keyMoved(long fromBucket, int fromSlot, long toBucket, int toSlot) {
		if (log.isDebugEnabled()) {
			log.debug("moved key from {},{} to {},{}", fromBucket, fromSlot, toBucket, toSlot);
		}
	}

	@Override
	public void tableFull(int hashPower, long size, double loadFactor) {
		log.warn("hashtable is full (hashpower = {}, hash_items = {}, load factor = {}), need to increase hashpower",
				hashPower, size, loadFactor);
	}

}
