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

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Test;

import com.github.mgunlogson.cuckoo4j.CuckooFilter.Status;
import com.github.mgunlogson.cuckoo4j.Utils.Algorithm;
import com.github.mgunlogson.cuckoo4j.Utils.Victim;
import com.google.common.hash.Funnels;
import com.google.common.testing.EqualsTester;
import com.google.common.testing.NullPointerTester;

public class TestCuckooFilter {

	private static final long SALT = 0x5EED5EEDL;
	private static final FunnelHasher<Integer> INT_HASHER = FunnelHasher.create(Algorithm.Murmur3_128,
			Funnels.integerFunnel(), SALT);
	private static final FunnelHasher<Long> LONG_HASHER = FunnelHasher.create(Algorithm.Murmur3_128,
			Funnels.longFunnel(), SALT);

	private static CuckooFilter.Builder<Integer> builder(long maxKeys) {
		return new CuckooFilter.Builder<Integer>(INT_HASHER, maxKeys);
	}

	static final class RecordingListener implements CuckooListener {
		int seededBuckets;
		int misses;
		int victimsStored;
		int victimsReclaimed;

		@Override
		public void seededBucketUsed(long bucketIndex, int seed) {
			seededBuckets++;
		}

		@Override
		public void lookupMiss(long i1, long i2, long tag) {
			misses++;
		}

		@Override
		public void victimStored(long bucketIndex, long tag) {
			victimsStored++;
		}

		@Override
		public void victimReclaimed(long bucketIndex, long tag) {
			victimsReclaimed++;
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsTooHighFp() {
		builder(2000000).withFalsePositiveRate(1).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsZeroFp() {
		builder(2000000).withFalsePositiveRate(0.0).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsNegItems() {
		builder(-2000000).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsZeroItems() {
		builder(0).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsNegFp() {
		builder(2000000).withFalsePositiveRate(-0.02).build();
	}

	// tags this short can't fill a table
	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsTagTooShort() {
		builder(2000000).withBitsPerItem(4).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsTagTooLong() {
		builder(2000000).withBitsPerItem(33).build();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsEmptySeedTable() {
		builder(100).withSeedTable(new int[0], 4);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidArgsSeedTableBeyondHashPower() {
		builder(100).withSeedTable(new int[17], 4);
	}

	@Test
	public void testDefaults() {
		CuckooFilter<Integer> filter = builder(2000000).build();
		assertEquals(8, filter.getTagBits());
		// 500000 buckets round up to 2^19, 95% full so no doubling
		assertEquals(1 << 19, filter.getBucketCount());
		assertEquals(4L << 19, filter.getActualCapacity());
		assertEquals(0, filter.getCount());
		assertTrue(Double.isNaN(filter.getBitsPerItem()));
		assertFalse(filter.hasVictim());
	}

	@Test
	public void testCreateDifferentHashAlgorithms() {
		for (Algorithm alg : Algorithm.values()) {
			CuckooFilter<Integer> filter = new CuckooFilter.Builder<Integer>(
					FunnelHasher.create(alg, Funnels.integerFunnel()), 20000).build();
			for (int i = 0; i < 10000; i++) {
				assertTrue(filter.put(i));
			}
			for (int i = 0; i < 10000; i++) {
				assertTrue(alg + " lost " + i, filter.mightContain(i));
			}
		}
	}

	@Test
	public void testFunnelBuilder() {
		CuckooFilter<Integer> filter = new CuckooFilter.Builder<>(Funnels.integerFunnel(), 1000).build();
		assertTrue(filter.put(5));
		assertTrue(filter.mightContain(5));
	}

	@Test
	public void testInsertedItemsAreFound() {
		CuckooFilter<Long> filter = new CuckooFilter.Builder<Long>(LONG_HASHER, 1000).withBitsPerItem(8).build();
		Random rando = new Random(1000);
		Set<Long> items = new LinkedHashSet<>();
		while (items.size() < 500) {
			items.add(rando.nextLong());
		}
		for (Long item : items) {
			assertEquals(Status.OK, filter.insert(item));
		}
		for (Long item : items) {
			assertEquals(Status.OK, filter.contains(item));
		}
		assertEquals(500, filter.getCount());
	}

	@Test
	public void sanityFalseNegative() {
		CuckooFilter<Integer> filter = builder(130000).withFalsePositiveRate(0.01).build();
		// add them to filter
		for (int i = 0; i < 100000; i++) {
			// will return false if filter is full...should NOT be
			assertTrue(filter.put(i));
		}
		// check for false negatives
		int falseNegatives = 0;
		for (int i = 0; i < 100000; i++) {
			if (!filter.mightContain(i)) {
				falseNegatives++;
			}
		}
		assertTrue(falseNegatives + " false negatives detected", falseNegatives == 0);
	}

	@Test
	public void sanityPackedStore() {
		CuckooFilter<Integer> filter = builder(130000).withBitsPerItem(13).withPackedStore(true).build();
		for (int i = 0; i < 100000; i++) {
			assertTrue(filter.put(i));
		}
		for (int i = 0; i < 100000; i++) {
			assertTrue(filter.mightContain(i));
		}
		// 65536 buckets * 4 slots * 13 bits
		assertEquals(65536L * 4 * 13 / 8, filter.getSizeInBytes());
		assertEquals(8.0 * filter.getSizeInBytes() / 100000, filter.getBitsPerItem(), 1e-9);
	}

	@Test
	public void sanityApproximateCount() {
		CuckooFilter<Integer> filter = builder(130000).withFalsePositiveRate(0.01).build();
		// fill buckets with duplicates, count along the way
		for (int i = 0; i < 8; i++) {
			assertTrue(filter.put(42));
			assertTrue(filter.approximateCount(42) == i + 1);
		}
		// should fill victim
		assertTrue(filter.put(42));
		assertTrue(filter.hasVictim());
		assertTrue(filter.approximateCount(42) == 9);
		// should fail
		assertFalse(filter.put(42));
		// count should be the same
		assertTrue(filter.approximateCount(42) == 9);
		// frees a slot for the victim, then takes another copy
		assertTrue(filter.delete(42) == Status.OK && filter.delete(42) == Status.OK);
		assertFalse(filter.hasVictim());
		// should be 7 copies now
		assertTrue(filter.approximateCount(42) == 7);
		// loop delete rest
		for (int i = 7; i > 0; i--) {
			assertEquals(Status.OK, filter.delete(42));
			assertTrue(filter.approximateCount(42) == i - 1);
		}
		// should be empty
		assertFalse(filter.mightContain(42));
	}

	@Test
	public void sanityOverFillFilter() {
		// make test set bigger than any size filter we're running
		for (int i = 1; i < 5; i++) {
			int filterKeys = 100000 * i;
			CuckooFilter<Integer> filter = builder(filterKeys).withFalsePositiveRate(0.01).build();
			int countFailedAt = 0;
			while (true) {
				if (!filter.put(countFailedAt))
					break;
				countFailedAt++;
			}
			// make sure the filter reports as many as we actually put in
			assertTrue("Filter reports " + filter.getCount() + " when we actually added " + countFailedAt
					+ " items before failing", filter.getCount() == countFailedAt);

			// it's okay if filter is a bit bigger than we asked for, it should
			// never be more than twice as big plus 1 (due to numBuckets power
			// of 2 rounding)
			assertTrue("We were able to add " + countFailedAt + " keys to a filter that was only made to hold "
					+ filterKeys, countFailedAt <= (filterKeys * 2) + 1);

			assertTrue("Load Factor only " + filter.getLoadFactor() + " for filter with " + filterKeys
					+ " capacity at first insertion failure. Expected more than 0.93", filter.getLoadFactor() > .93);
			assertTrue("Load Factor " + filter.getLoadFactor() + " for filter with " + filterKeys
					+ " capacity at first insertion failure. Expected at most 1", filter.getLoadFactor() <= 1.0);
		}
	}

	@Test
	public void sanityOverFillBucketMoreThan2B() {
		CuckooFilter<Integer> filter = builder(100000).withFalsePositiveRate(0.01).build();
		int maxTries = 30;
		int failedAt = maxTries;
		for (int i = 0; i < maxTries; i++) {
			if (!filter.put(2)) {
				failedAt = i;
				break;
			}
		}
		assertTrue("Duplicate insert failed at " + failedAt + " Expected value is (2*BUCKET_SIZE)+victim cache = 9",
				failedAt == 9);
	}

	@Test
	public void sanityFailedDelete() {
		CuckooFilter<Integer> filter = builder(130000).withFalsePositiveRate(0.01).build();
		// make a list of test values(all unique)
		int maxInsertedVal = 100000;
		for (int i = 0; i < maxInsertedVal; i++) {
			// will return false if filter is full...should NOT be
			assertTrue(filter.put(i));
		}
		// check for false deletes(if I can't delete something that's
		// definitely there)
		int falseDeletes = 0;
		for (int i = 0; i < maxInsertedVal; i++) {
			if (filter.delete(i) != Status.OK) {
				falseDeletes++;
			}
		}
		assertTrue(falseDeletes + " false deletions detected", falseDeletes == 0);
		assertEquals(0, filter.getCount());
	}

	@Test
	public void sanityFalseDeleteRate() {
		CuckooFilter<Integer> filter = builder(130000).withFalsePositiveRate(0.01).build();
		int maxInsertedVal = 100000;
		for (int i = 0; i < maxInsertedVal; i++) {
			// will return false if filter is full...should NOT be
			assertTrue(filter.put(i));
		}
		// check for false delete rate(deleted something I didn't add
		// successfully)
		int falseDeletes = 0;
		// false delete rate should roughly match false positive rate
		int totalAttempts = 10000;
		maxInsertedVal += 1;
		for (int i = maxInsertedVal; i < totalAttempts + maxInsertedVal; i++) {
			if (filter.delete(i) == Status.OK)
				falseDeletes++;
		}
		assertTrue(
				falseDeletes
						+ " false deletions detected. False delete rate is above 0.02 on filter with 0.01 false positive rate",
				(double) falseDeletes / totalAttempts < 0.02);
	}

	@Test
	public void sanityFalsePositiveRate() {
		CuckooFilter<Integer> filter = builder(130000).withFalsePositiveRate(0.01).build();
		int maxInsertedVal = 100000;
		// make a list of test values(all unique)
		for (int i = 0; i < maxInsertedVal; i++) {
			// will return false if filter is full...should NOT be
			assertTrue(filter.put(i));
		}
		// check for false positive rate(contains something I didn't add)
		int falsePositives = 0;
		maxInsertedVal += 1;
		int totalAttempts = 100000;
		for (int i = maxInsertedVal; i < totalAttempts + maxInsertedVal; i++) {
			if (filter.mightContain(i))
				falsePositives++;
		}
		assertTrue((double) falsePositives / totalAttempts + " false positive rate is above limit",
				(double) falsePositives / totalAttempts < 0.02);
	}

	@Test
	public void sanityFalsePositiveRateWideTags() {
		CuckooFilter<Integer> filter = builder(130000).withBitsPerItem(16).build();
		for (int i = 0; i < 100000; i++) {
			assertTrue(filter.put(i));
		}
		int falsePositives = 0;
		int totalAttempts = 100000;
		for (int i = 200000; i < 200000 + totalAttempts; i++) {
			if (filter.mightContain(i))
				falsePositives++;
		}
		// 8 probed slots per lookup, doubled for slack
		double bound = 2 * 8.0 / (1 << 16);
		assertTrue(falsePositives + " false positives with 16 bit tags",
				(double) falsePositives / totalAttempts < bound);
	}

	@Test
	public void sanityTestVictimCache() {
		CuckooFilter<Integer> filter = builder(130000).withFalsePositiveRate(0.01).build();
		for (int i = 0; i < 9; i++) {
			assertTrue(filter.put(42));
		}
		assertTrue(filter.getCount() == 9);
		for (int i = 0; i < 9; i++) {
			assertTrue(filter.mightContain(42));
			assertEquals(Status.OK, filter.delete(42));
		}
		assertEquals(Status.NOT_FOUND, filter.delete(42));
		assertFalse(filter.mightContain(42));
		assertTrue(filter.getCount() == 0);
	}

	@Test
	public void testVictimCacheTagComparison() {
		CuckooFilter<Integer> filter = builder(130000).withFalsePositiveRate(0.01).build();
		filter.hasVictim = true;
		filter.victim = new Victim(1, 42);
		assertTrue(filter.checkIsVictim(1, 2, 42));
		assertTrue(filter.checkIsVictim(2, 1, 42));
		assertFalse(filter.checkIsVictim(2, 3, 42));
		assertFalse(filter.checkIsVictim(1, 2, 43));
		filter.hasVictim = false;
		assertFalse(filter.checkIsVictim(1, 2, 42));
	}

	@Test
	public void testLookupConsultsVictim() {
		CuckooFilter<Integer> filter = builder(1000).build();
		BucketAndTag pos = filter.hasher.generate(7);
		assertFalse(filter.mightContain(7));
		filter.hasVictim = true;
		filter.victim = new Victim(filter.hasher.altIndex(pos.index, pos.tag), pos.tag);
		assertEquals(Status.OK, filter.contains(7));
		assertEquals(1, filter.approximateCount(7));
		assertEquals(Status.NOT_ENOUGH_SPACE, filter.insert(8));
	}

	@Test
	public void testOverflowAndVictimReclaim() {
		RecordingListener listener = new RecordingListener();
		CuckooFilter<Long> filter = new CuckooFilter.Builder<Long>(LONG_HASHER, 1000).withListener(listener)
				.build();
		List<Long> inserted = new ArrayList<>();
		Status status = Status.OK;
		for (long i = 0; i < 100000 && status == Status.OK; i++) {
			status = filter.insert(i);
			if (status == Status.OK)
				inserted.add(i);
		}
		assertEquals(Status.NOT_ENOUGH_SPACE, status);
		assertTrue(filter.hasVictim());
		assertEquals(1, listener.victimsStored);
		assertEquals(inserted.size(), filter.getCount());
		long countBefore = filter.getCount();
		assertEquals(Status.NOT_ENOUGH_SPACE, filter.insert(-1L));
		assertEquals(countBefore, filter.getCount());

		// find a stored item whose deletion frees a slot in the victim's bucket
		long victimIndex = filter.victim.getIndex();
		Long freesVictimBucket = null;
		for (Long item : inserted) {
			BucketAndTag pos = filter.hasher.generate(item);
			long i2 = filter.hasher.altIndex(pos.index, pos.tag);
			boolean inPrimary = filter.table.countTag(pos.index, pos.index, pos.tag) > 0;
			boolean inAlt = filter.table.countTag(i2, i2, pos.tag) > 0;
			if ((pos.index == victimIndex && inPrimary) || (i2 == victimIndex && inAlt && !inPrimary)) {
				freesVictimBucket = item;
				break;
			}
		}
		assertNotNull(freesVictimBucket);
		assertEquals(Status.OK, filter.delete(freesVictimBucket));
		assertFalse(filter.hasVictim());
		assertEquals(1, listener.victimsReclaimed);
		assertEquals(countBefore - 1, filter.getCount());

		// a freed slot takes the next insert without a walk
		Long other = inserted.get(0).equals(freesVictimBucket) ? inserted.get(1) : inserted.get(0);
		assertEquals(Status.OK, filter.delete(other));
		assertEquals(Status.OK, filter.insert(other));
		assertFalse(filter.hasVictim());
		assertEquals(countBefore - 1, filter.getCount());
		for (Long item : inserted) {
			if (!item.equals(freesVictimBucket))
				assertTrue(filter.mightContain(item));
		}
	}

	@Test
	public void testLookupMissReported() {
		RecordingListener listener = new RecordingListener();
		CuckooFilter<Integer> filter = builder(1000).withBitsPerItem(16).withListener(listener).build();
		filter.put(1);
		assertTrue(filter.mightContain(1));
		assertEquals(0, listener.misses);
		int misses = 0;
		for (int i = 1000; i < 1100; i++) {
			if (!filter.mightContain(i))
				misses++;
		}
		assertEquals(misses, listener.misses);
		assertTrue(misses > 0);
	}

	@Test
	public void sanityFillDeleteAllAndCheckABunchOfStuff() {
		// test with different filter sizes
		for (int k = 1; k < 6; k++) {
			int filterKeys = 20000 * k;
			CuckooFilter<Integer> filter = builder(filterKeys).withFalsePositiveRate(0.01).build();
			// repeatedly fill and drain filter
			for (int j = 0; j < 3; j++) {
				stressFillDrainCheck(filter);
			}
		}
	}

	private void stressFillDrainCheck(CuckooFilter<Integer> filter) {
		int maxInsertedVal = 0;
		while (true) {
			// go until filter totally full
			if (!filter.put(maxInsertedVal)) {
				break;
			}
			maxInsertedVal++;
		}
		// everything we added should be there
		for (int i = 0; i < maxInsertedVal; i++) {
			assertTrue("filter doesn't contain " + i + " with " + maxInsertedVal + " total insertions",
					filter.mightContain(i));
		}
		// delete everything we just added
		// make two passes
		// first pass will get most
		// second pass should get any we deleted from "wrong" bucket
		int deleteCount = 0;
		for (int i = 0; i < maxInsertedVal; i++) {
			if (filter.delete(i) == Status.OK)
				deleteCount++;
		}
		// second pass
		for (int i = 0; i < maxInsertedVal; i++) {
			if (filter.delete(i) == Status.OK)
				deleteCount++;
		}
		// did we get everything?
		assertTrue(maxInsertedVal == deleteCount);
		// does filter know it's empty?
		assertTrue(filter.getCount() == 0);
		assertFalse(filter.hasVictim());

		// just to make sure everything is properly "gone"
		for (int i = 0; i < maxInsertedVal; i++) {
			assertEquals(Status.NOT_FOUND, filter.delete(i));
		}
		// and even more sure...should be zero false positives because filter
		// is totally empty
		for (int i = 0; i < maxInsertedVal; i++) {
			assertFalse(filter.mightContain(i));
		}
	}

	@Test
	public void testSeedTable() {
		RecordingListener listener = new RecordingListener();
		int[] seeds = new int[64];
		for (int i = 0; i < seeds.length; i += 3) {
			seeds[i] = i + 1;
		}
		CuckooFilter<Integer> filter = builder(1).withSeedTable(seeds, 6).withBitsPerItem(12).withListener(listener)
				.build();
		assertEquals(64, filter.getBucketCount());
		for (int i = 0; i < 180; i++) {
			assertEquals(Status.OK, filter.insert(i));
		}
		for (int i = 0; i < 180; i++) {
			assertTrue(filter.mightContain(i));
		}
		assertTrue(listener.seededBuckets > 0);
		// the builder kept its own copy
		seeds[0] = 99;
		assertTrue(filter.mightContain(0));
	}

	@Test
	public void testSeedTableOtherSize() {
		int[] seeds = new int[48];
		for (int i = 0; i < seeds.length; i++) {
			seeds[i] = i % 2 == 0 ? 0 : 1000 + i;
		}
		CuckooFilter<Integer> filter = builder(1).withSeedTable(seeds, 6).withBitsPerItem(12).build();
		assertEquals(48, filter.getBucketCount());
		for (int i = 0; i < 120; i++) {
			assertEquals(Status.OK, filter.insert(i));
		}
		assertFalse(filter.hasVictim());
		for (int i = 0; i < 120; i++) {
			assertTrue(filter.mightContain(i));
		}
		for (int i = 0; i < 120; i++) {
			assertEquals(Status.OK, filter.delete(i));
		}
		assertEquals(0, filter.getCount());
	}

	private static int[] sparseSeeds(int buckets, int every) {
		int[] seeds = new int[buckets];
		for (int i = 0; i < buckets; i += every) {
			seeds[i] = 31 * i + 17;
		}
		return seeds;
	}

	@Test
	public void sanitySeedTableFillsLikePlainFilter() {
		CuckooFilter<Integer> filter = builder(1).withSeedTable(sparseSeeds(1024, 5), 10).withBitsPerItem(8)
				.build();
		int i = 0;
		while (!filter.hasVictim()) {
			assertEquals(Status.OK, filter.insert(i++));
		}
		assertTrue(filter.getLoadFactor() > 0.9);
		assertEquals(Status.NOT_ENOUGH_SPACE, filter.insert(i));
		for (int j = 0; j < i; j++) {
			assertTrue(filter.mightContain(j));
		}
	}

	@Test
	public void sanitySeedTableFalsePositiveRate() {
		CuckooFilter<Integer> filter = builder(1).withSeedTable(sparseSeeds(4096, 7), 12).withBitsPerItem(8)
				.build();
		int inserts = 8192;
		for (int i = 0; i < inserts; i++) {
			assertEquals(Status.OK, filter.insert(i));
		}
		assertFalse(filter.hasVictim());
		int falsePositives = 0;
		for (int i = 1000000; i < 1000000 + inserts; i++) {
			if (filter.mightContain(i))
				falsePositives++;
		}
		// half full, 8 slots probed: about 4 / 255
		double fpRate = falsePositives / (double) inserts;
		assertTrue("seeded false positive rate " + fpRate, fpRate < 0.03);
	}

	@Test
	public void testCopyInsertIntoCandidateBuckets() {
		CuckooFilter<Integer> filter = builder(1).withSeedTable(sparseSeeds(1024, 3), 10).withBitsPerItem(12)
				.build();
		for (int key = 0; key < 200; key++) {
			long[] buckets = filter.bucketsOf(key);
			assertEquals(2, buckets.length);
			assertEquals(filter.hasher.altIndex(buckets[0], filter.tagOf(key)), buckets[1]);
			// alternate between the two candidates
			long preferred = buckets[key % 2];
			long other = buckets[1 - key % 2];
			assertTrue(copyToFirstFreeSlot(filter, filter.tagOf(key), preferred)
					|| copyToFirstFreeSlot(filter, filter.tagOf(key), other));
		}
		assertEquals(200, filter.getCount());
		for (int key = 0; key < 200; key++) {
			assertTrue(filter.mightContain(key));
		}
	}

	private static boolean copyToFirstFreeSlot(CuckooFilter<Integer> filter, long tag, long bucket) {
		for (int slot = 0; slot < CuckooFilter.BUCKET_SIZE; slot++) {
			if (filter.copyInsert(tag, bucket, slot) == Status.OK)
				return true;
		}
		return false;
	}

	@Test
	public void testCopyInsert() {
		CuckooFilter<Integer> filter = builder(1000).withBitsPerItem(12).build();
		BucketAndTag pos = filter.hasher.generate(5);
		assertFalse(filter.mightContain(5));
		assertEquals(Status.OK, filter.copyInsert(pos.tag, pos.index, 2));
		assertTrue(filter.mightContain(5));
		assertEquals(1, filter.getCount());
		assertEquals(pos.tag, filter.table.readTag(pos.index, 2));
		// slot taken
		assertEquals(Status.NOT_SUPPORTED, filter.copyInsert(pos.tag, pos.index, 2));
		// empty marker and oversized tags can't be stored
		assertEquals(Status.NOT_SUPPORTED, filter.copyInsert(0, pos.index, 3));
		assertEquals(Status.NOT_SUPPORTED, filter.copyInsert(1 << 12, pos.index, 3));
		assertEquals(1, filter.getCount());
		assertEquals(Status.OK, filter.delete(5));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testCopyInsertBucketOutOfRange() {
		CuckooFilter<Integer> filter = builder(1000).build();
		filter.copyInsert(1, filter.getBucketCount(), 0);
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void testCopyInsertSlotOutOfRange() {
		CuckooFilter<Integer> filter = builder(1000).build();
		filter.copyInsert(1, 0, 4);
	}

	@Test
	public void testEquals() {
		CuckooFilter<Integer> partFull = builder(200000).withFalsePositiveRate(0.01).build();
		CuckooFilter<Integer> full = builder(200000).withFalsePositiveRate(0.01).build();
		for (int i = 0; i < 100000; i++) {
			assertTrue(partFull.put(i));
		}
		for (int i = 0;; i++) {
			if (!full.put(i))
				break;
		}
		new EqualsTester().addEqualityGroup(partFull).addEqualityGroup(full)
				.addEqualityGroup(builder(200000).withFalsePositiveRate(0.01).build(),
						builder(200000).withFalsePositiveRate(0.01).build())
				.addEqualityGroup(new CuckooFilter.Builder<Long>(LONG_HASHER, 200000).build())
				.addEqualityGroup(builder(100000).withFalsePositiveRate(0.01).build())
				.addEqualityGroup(builder(200000).withFalsePositiveRate(0.001).build())
				.addEqualityGroup(new CuckooFilter.Builder<Integer>(
						FunnelHasher.create(Algorithm.sipHash24, Funnels.integerFunnel(), SALT), 200000).build())
				.testEquals();
	}

	@Test
	public void testCopyEmpty() {
		CuckooFilter<Integer> filter = builder(200000).build();
		CuckooFilter<Integer> filterCopy = filter.copy();
		assertTrue(filterCopy.equals(filter));
		assertNotSame(filter, filterCopy);
	}

	@Test
	public void testCopyPartFull() {
		CuckooFilter<Integer> filter = builder(200000).build();
		for (int i = 0; i < 100000; i++) {
			assertTrue(filter.put(i));
		}
		CuckooFilter<Integer> filterCopy = filter.copy();
		assertTrue(filterCopy.equals(filter));
		assertNotSame(filter, filterCopy);
		// no shared state
		filterCopy.delete(5);
		assertFalse(filterCopy.equals(filter));
		assertTrue(filter.mightContain(5));
	}

	@Test
	public void testCopyFull() {
		// totally full will test victim cache as well
		CuckooFilter<Integer> filter = builder(200000).build();
		for (int i = 0;; i++) {
			// go until filter totally full
			if (!filter.put(i))
				break;
		}
		assertTrue(filter.hasVictim());
		CuckooFilter<Integer> filterCopy = filter.copy();
		assertTrue(filterCopy.equals(filter));
		assertTrue(filterCopy.hasVictim());
		assertNotSame(filter, filterCopy);
	}

	@Test
	public void testInfo() {
		CuckooFilter<Integer> filter = builder(1000).withPackedStore(true).build();
		filter.put(3);
		String info = filter.info();
		assertTrue(info, info.contains("PackedTagStore"));
		assertTrue(info, info.contains("Keys stored: 1"));
		assertEquals(info, filter.toString());
	}

	@Test
	public void autoTestNulls() {
		NullPointerTester tester = new NullPointerTester();
		tester.testAllPublicInstanceMethods(builder(1000).build());
		tester.testAllPublicInstanceMethods(builder(1000));
		tester.testAllPublicConstructors(CuckooFilter.Builder.class);
	}

}
