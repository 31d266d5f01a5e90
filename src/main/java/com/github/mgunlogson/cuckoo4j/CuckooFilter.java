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
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.Random;

import javax.annotation.Nullable;

import com.github.mgunlogson.cuckoo4j.Utils.Victim;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Funnel;

/**
 * A Cuckoo filter for instances of {@code T}. Cuckoo filters are probabilistic
 * hash tables similar to Bloom filters but with several advantages. Like Bloom
 * filters, a Cuckoo filter can determine if an object is contained within a set
 * at a specified false positive rate with no false negatives. In addition, and
 * unlike standard Bloom filters, Cuckoo filters allow deletions and counting.
 *
 * <p>
 * Each item is reduced to a short tag of {@code bitsPerItem} bits stored in one
 * of two candidate buckets of four slots. A lookup probes eight slots, so the
 * false positive rate is bounded by roughly {@code 8 / 2^bitsPerItem}. When
 * both buckets are full, insertion kicks a resident tag to its own alternate
 * bucket, repeating up to {@value #MAX_KICKS} times. A tag still homeless after
 * that is parked in a single victim slot; the insert is accepted but the filter
 * then reports itself full ({@link Status#NOT_ENOUGH_SPACE}) until a deletion
 * frees room and the victim is placed back.
 *
 * <p>
 * Existing items can be deleted without affecting the false positive rate or
 * causing false negatives. However, deleting items that were <i>not</i>
 * previously added to the filter can cause false negatives.
 *
 * <p>
 * An optional seed table assigns one hash seed per bucket. An item's tag is
 * computed with the seed of its primary bucket, which lets an external
 * optimizer re-tag the items of a crowded bucket without touching the rest of
 * the table.
 *
 * <p>
 * This class is not thread safe. A concurrent wrapper must serialize access,
 * either with one lock or with per-bucket locks on both candidate buckets,
 * always acquired in ascending bucket order so that two operations on the
 * same pair of buckets cannot deadlock. Eviction walks touch many buckets, so
 * inserts and deletes additionally need the victim guarded.
 *
 * @see <a href="https://www.cs.cmu.edu/~dga/papers/cuckoo-conext2014.pdf">
 *      paper on Cuckoo filter properties.</a>
 * @see <a href="https://github.com/efficient/cuckoofilter">C++ reference
 *      implementation</a>
 *
 * @param <T>
 *            the type of items that the {@code CuckooFilter} accepts
 * @author Mark Gunlogson
 */
public final class CuckooFilter<T> {

	/**
	 * Outcome of a filter operation.
	 */
	public enum Status {
		/**
		 * Operation succeeded. For an insert this means accepted: the item is
		 * either in the table or parked as the victim.
		 */
		OK,
		/**
		 * Item not present.
		 */
		NOT_FOUND,
		/**
		 * The victim slot is taken, the filter cannot accept more items until
		 * some are deleted.
		 */
		NOT_ENOUGH_SPACE,
		/**
		 * The requested direct placement is not possible.
		 */
		NOT_SUPPORTED
	}

	/** maximum number of cuckoo kicks before claiming failure */
	static final int MAX_KICKS = 500;
	static final int BUCKET_SIZE = Utils.SLOTS_PER_BUCKET;
	// make sure to update getBitsPerItemForFpRate() if changing this... then
	// again don't change this
	private static final double LOAD_FACTOR = 0.955;
	private static final double DEFAULT_FP = 0.01;
	private static final long DEFAULT_KICK_SEED = 0x5bd1e995L;

	@VisibleForTesting
	final TagStore table;
	@VisibleForTesting
	final IndexTagCalc<T> hasher;
	private final long kickSeed;
	private final Random kicker;
	private final CuckooListener listener;
	private long count;

	@VisibleForTesting
	Victim victim;
	@VisibleForTesting
	boolean hasVictim;

	private CuckooFilter(IndexTagCalc<T> hasher, TagStore table, long count, boolean hasVictim,
			@Nullable Victim victim, long kickSeed, CuckooListener listener) {
		this.hasher = hasher;
		this.table = table;
		this.count = count;
		this.hasVictim = hasVictim;
		// no nulls even if victim hasn't been used!
		if (victim == null)
			this.victim = new Victim();
		else
			this.victim = victim;
		this.kickSeed = kickSeed;
		this.kicker = new Random(kickSeed);
		this.listener = listener;
	}

	/***
	 * Builds a Cuckoo Filter. To Create a Cuckoo filter, construct this then
	 * call {@code #build()}.
	 *
	 * @author Mark Gunlogson
	 *
	 * @param <T>
	 *            the type of item the filter accepts
	 */
	public static class Builder<T> {
		// required arguments
		private final KeyedHasher<? super T> keyedHasher;
		private final long maxKeys;
		// optional arguments
		private int bitsPerItem = Utils.getBitsPerItemForFpRate(DEFAULT_FP, LOAD_FACTOR);
		@Nullable
		private int[] seeds;
		private int hashPower;
		private boolean packed;
		private long kickSeed = DEFAULT_KICK_SEED;
		private CuckooListener listener = CuckooListener.NO_OP;

		/**
		 * Creates a Builder for a filter expected to hold {@code maxKeys}
		 * items. The bucket count is the next power of two above
		 * {@code maxKeys / 4}, doubled once more if that would be more than
		 * 96% full.
		 *
		 * @param hasher
		 *            keyed hash family for the items
		 * @param maxKeys
		 *            the number of expected insertions; must be positive
		 */
		public Builder(KeyedHasher<? super T> hasher, long maxKeys) {
			checkNotNull(hasher);
			checkArgument(maxKeys > 0, "maxKeys (%s) must be > 0, increase maxKeys", maxKeys);
			this.keyedHasher = hasher;
			this.maxKeys = maxKeys;
		}

		/**
		 * Creates a Builder hashing items through {@code funnel} with a
		 * randomly salted Murmur3 {@link FunnelHasher}.
		 *
		 * <p>
		 * It is recommended that the funnel be implemented as a Java enum,
		 * since {@link #equals} relies on the funnel's equality.
		 */
		public Builder(Funnel<? super T> funnel, long maxKeys) {
			this(FunnelHasher.create(funnel), maxKeys);
		}

		/**
		 * Sets the tag width. The default is 8 bits, about 3% false
		 * positives at full load.
		 *
		 * @param bitsPerItem
		 *            tag width in bits, 5 to 32
		 * @return The builder interface
		 */
		public Builder<T> withBitsPerItem(int bitsPerItem) {
			// shorter fingerprints don't give us a good fill capacity
			checkArgument(bitsPerItem > 4, "bitsPerItem (%s) must be > 4", bitsPerItem);
			checkArgument(bitsPerItem <= AbstractTagStore.MAX_TAG_BITS, "bitsPerItem (%s) must be <= %s",
					bitsPerItem, AbstractTagStore.MAX_TAG_BITS);
			this.bitsPerItem = bitsPerItem;
			return this;
		}

		/**
		 * Sets the tag width from a target false positive rate.
		 *
		 * @param fpp
		 *            false positive rate ( value is (expected %)/100 ) from 0-1
		 *            exclusive.
		 * @return The builder interface
		 */
		public Builder<T> withFalsePositiveRate(double fpp) {
			checkArgument(fpp > 0, "fpp (%s) must be > 0, increase fpp", fpp);
			checkArgument(fpp < .25, "fpp (%s) must be < 0.25, decrease fpp", fpp);
			return withBitsPerItem(Math.max(5, Utils.getBitsPerItemForFpRate(fpp, LOAD_FACTOR)));
		}

		/**
		 * Uses an externally computed seed table. The filter gets exactly
		 * {@code seeds.length} buckets, which need not be a power of two, and
		 * ignores the expected key count. An item's primary bucket is then the
		 * first-choice bucket a {@link CuckooHashTable} of
		 * {@code 2^hashPower} buckets picks with the same {@link KeyedHasher}
		 * (reduced modulo the bucket count), so seeds computed against that
		 * table's first-choice collisions apply here. Alternate buckets still
		 * follow the filter's tags.
		 *
		 * @param seeds
		 *            one seed per bucket, zero meaning unkeyed
		 * @param hashPower
		 *            hash power of the table the seeds were computed against,
		 *            at most {@value IndexTagCalc#MAX_SEEDED_HASH_POWER}
		 * @return The builder interface
		 */
		public Builder<T> withSeedTable(int[] seeds, int hashPower) {
			checkNotNull(seeds);
			checkArgument(seeds.length > 0, "seed table must not be empty");
			checkArgument(hashPower >= 0 && hashPower <= IndexTagCalc.MAX_SEEDED_HASH_POWER,
					"hashPower (%s) must be in [0, %s]", hashPower, IndexTagCalc.MAX_SEEDED_HASH_POWER);
			checkArgument(seeds.length <= CuckooIndex.hashSize(hashPower),
					"seed table length (%s) exceeds 2^hashPower (%s)", seeds.length, hashPower);
			this.seeds = seeds.clone();
			this.hashPower = hashPower;
			return this;
		}

		/**
		 * Selects the bit packed {@link PackedTagStore} instead of the default
		 * byte aligned {@link SingleTagStore}.
		 *
		 * @return The builder interface
		 */
		public Builder<T> withPackedStore(boolean packed) {
			this.packed = packed;
			return this;
		}

		/**
		 * Seeds the choice of which slot gets kicked during eviction. Filters
		 * built with the same seed and hasher evolve identically.
		 *
		 * @return The builder interface
		 */
		public Builder<T> withKickSeed(long kickSeed) {
			this.kickSeed = kickSeed;
			return this;
		}

		/**
		 * @return The builder interface
		 */
		public Builder<T> withListener(CuckooListener listener) {
			this.listener = checkNotNull(listener);
			return this;
		}

		/**
		 * Builds and returns a {@code CuckooFilter<T>}. Invalid configurations
		 * will fail on this call.
		 *
		 * @return a Cuckoo filter of type T
		 */
		public CuckooFilter<T> build() {
			long numBuckets = seeds == null ? Utils.getBucketsNeeded(maxKeys) : seeds.length;
			IndexTagCalc<T> calc = new IndexTagCalc<>(keyedHasher, numBuckets, bitsPerItem, seeds, hashPower);
			TagStore store = packed ? PackedTagStore.create(bitsPerItem, numBuckets)
					: SingleTagStore.create(bitsPerItem, numBuckets);
			return new CuckooFilter<>(calc, store, 0, false, null, kickSeed, listener);
		}
	}

	/**
	 * Gets the current number of items in the filter, the victim included.
	 *
	 * @return number of items in filter
	 */
	public long getCount() {
		return count;
	}

	/**
	 * Gets the current load factor of the filter. Reasonably sized filters
	 * with randomly distributed values can be expected to reach a load factor
	 * of around 95% (0.95) before insertion failure.
	 *
	 * @return load fraction of total space used
	 */
	public double getLoadFactor() {
		return count / (double) getActualCapacity();
	}

	/**
	 * Gets the absolute maximum number of items the filter can theoretically
	 * hold. <i>This is NOT the maximum you can expect it to reliably hold.</i>
	 *
	 * @return number of slots in the table
	 */
	public long getActualCapacity() {
		return hasher.getNumBuckets() * BUCKET_SIZE;
	}

	public long getBucketCount() {
		return hasher.getNumBuckets();
	}

	/**
	 * @return size of the tag storage in bytes
	 */
	public long getSizeInBytes() {
		return table.sizeInBytes();
	}

	/**
	 * @return configured tag width in bits
	 */
	public int getTagBits() {
		return hasher.getTagBits();
	}

	/**
	 * Storage spent per stored item, in bits. {@code NaN} while the filter is
	 * empty.
	 */
	public double getBitsPerItem() {
		if (count == 0)
			return Double.NaN;
		return 8.0 * table.sizeInBytes() / count;
	}

	/**
	 * True while an item is accepted but pending placement in the victim slot.
	 * Inserts fail with {@link Status#NOT_ENOUGH_SPACE} until it is placed.
	 */
	public boolean hasVictim() {
		return hasVictim;
	}

	/**
	 * Puts an element into this {@code CuckooFilter}. Ensures that subsequent
	 * invocations of {@link #contains(Object)} with the same element will
	 * always return {@link Status#OK}.
	 * <p>
	 * Inserting the same item more than 8 times will fill both of its buckets
	 * and park the 9th copy as the victim.
	 *
	 * @param item
	 *            item to insert into the filter
	 *
	 * @return {@link Status#OK} if the item was accepted, possibly into the
	 *         victim slot. {@link Status#NOT_ENOUGH_SPACE} if a victim was
	 *         already held, in which case nothing changed.
	 */
	public Status insert(T item) {
		checkNotNull(item);
		// don't do insertion loop if victim slot is already filled
		if (hasVictim)
			return Status.NOT_ENOUGH_SPACE;
		BucketAndTag pos = generate(item);
		addImpl(pos.index, pos.tag);
		count++;
		return Status.OK;
	}

	/**
	 * Same as {@link #insert(Object)} but returns {@code false} instead of
	 * {@link Status#NOT_ENOUGH_SPACE}.
	 */
	public boolean put(T item) {
		return insert(item) == Status.OK;
	}

	/**
	 * Places a tag starting at {@code bucketIndex}, kicking tags to their
	 * alternate buckets while both candidates are full. The first probe of
	 * each bucket prefers an empty slot; only full buckets lose a tag.
	 *
	 * @return true if the tag and every tag it displaced found a slot,
	 *         false if the last one became the victim
	 */
	private boolean addImpl(long bucketIndex, long tag) {
		long curIndex = bucketIndex;
		long curTag = tag;
		for (int kicks = 0; kicks < MAX_KICKS; kicks++) {
			if (table.insertToBucket(curIndex, curTag)) {
				return true;
			}
			if (kicks > 0) {
				curTag = table.swapTagInBucket(curIndex, kicker.nextInt(BUCKET_SIZE), curTag);
			}
			curIndex = hasher.altIndex(curIndex, curTag);
		}
		victim.setIndex(curIndex);
		victim.setTag(curTag);
		hasVictim = true;
		listener.victimStored(curIndex, curTag);
		return false;
	}

	/**
	 * Tries to put the victim back into the table. Items in the victim slot
	 * already count as inserted, so the count doesn't change. If the walk
	 * fails again, whatever tag it ends with becomes the new victim.
	 */
	private void reclaimVictim() {
		if (!hasVictim)
			return;
		hasVictim = false;
		long index = victim.getIndex();
		long tag = victim.getTag();
		if (addImpl(index, tag))
			listener.victimReclaimed(index, tag);
	}

	/**
	 * Checks if a given tag is the victim.
	 */
	@VisibleForTesting
	boolean checkIsVictim(long i1, long i2, long tag) {
		return hasVictim && victim.matches(i1, i2, tag);
	}

	/**
	 * Reports whether the item <i>might</i> have been put in this filter. The
	 * victim is consulted too, so an item parked there is still found.
	 *
	 * @param item
	 *            to check
	 *
	 * @return {@link Status#OK} if the item might be in the filter,
	 *         {@link Status#NOT_FOUND} if it definitely is not
	 */
	public Status contains(T item) {
		checkNotNull(item);
		BucketAndTag pos = generate(item);
		long i1 = pos.index;
		long i2 = hasher.altIndex(pos.index, pos.tag);
		if (table.findTag(i1, i2, pos.tag) || checkIsVictim(i1, i2, pos.tag)) {
			return Status.OK;
		}
		listener.lookupMiss(i1, i2, pos.tag);
		return Status.NOT_FOUND;
	}

	/**
	 * Returns {@code true} if the element <i>might</i> have been put in this
	 * filter, {@code false} if this is <i>definitely</i> not the case.
	 */
	public boolean mightContain(T item) {
		return contains(item) == Status.OK;
	}

	/**
	 * This method returns the approximate number of times an item was added to
	 * the filter. This count is probabilistic like the rest of the filter, so
	 * it may occasionally over-count but never under-count (unless you've been
	 * deleting non-existent items).
	 *
	 * @param item
	 *            item to check
	 * @return number of matching tags in both candidate buckets and the victim
	 */
	public int approximateCount(T item) {
		checkNotNull(item);
		BucketAndTag pos = generate(item);
		long i1 = pos.index;
		long i2 = hasher.altIndex(pos.index, pos.tag);
		// both candidates are the same bucket when the alt index folds back
		int tagCount = i1 == i2 ? table.countTag(i1, i1, pos.tag) / 2 : table.countTag(i1, i2, pos.tag);
		if (checkIsVictim(i1, i2, pos.tag))
			tagCount++;
		return tagCount;
	}

	/**
	 * Deletes one copy of an element from this filter. Only delete items that
	 * have been previously added: deleting a non-existent item may remove a
	 * colliding tag, causing a false negative.
	 * <p>
	 * Any successful removal is followed by an attempt to place the victim back
	 * into the table.
	 *
	 * @param item
	 *            the item to delete
	 * @return {@link Status#OK} if a copy was removed, {@link Status#NOT_FOUND}
	 *         otherwise
	 */
	public Status delete(T item) {
		checkNotNull(item);
		BucketAndTag pos = generate(item);
		long i1 = pos.index;
		long i2 = hasher.altIndex(pos.index, pos.tag);
		if (table.deleteFromBucket(i1, pos.tag) || table.deleteFromBucket(i2, pos.tag)) {
			count--;
			reclaimVictim();
			return Status.OK;
		}
		// if delete failed but we have a victim, check if the item we're
		// trying to delete IS actually the victim
		if (checkIsVictim(i1, i2, pos.tag)) {
			hasVictim = false;
			count--;
			reclaimVictim();
			return Status.OK;
		}
		return Status.NOT_FOUND;
	}

	/**
	 * The tag this filter stores for {@code item}.
	 */
	public long tagOf(T item) {
		checkNotNull(item);
		return hasher.generate(item).tag;
	}

	/**
	 * The two candidate buckets of {@code item}, primary first. They are equal
	 * when the alternate index folds back onto the primary one.
	 */
	public long[] bucketsOf(T item) {
		checkNotNull(item);
		BucketAndTag pos = hasher.generate(item);
		return new long[] { pos.index, hasher.altIndex(pos.index, pos.tag) };
	}

	/**
	 * Writes a tag straight into a given slot, bypassing hashing and eviction.
	 * Meant for loading a layout computed elsewhere, for instance by an
	 * offline placement pass working from {@link #tagOf(Object)} and
	 * {@link #bucketsOf(Object)}. The caller is responsible for the tag
	 * belonging in that bucket: a tag written outside its item's candidate
	 * buckets will not be found.
	 *
	 * @return {@link Status#OK} if written, {@link Status#NOT_SUPPORTED} if the
	 *         slot is occupied or the tag is zero or too wide
	 */
	public Status copyInsert(long tag, long bucketIndex, int posInBucket) {
		checkElementIndex(posInBucket, BUCKET_SIZE, "posInBucket");
		checkArgument(bucketIndex >= 0 && bucketIndex < hasher.getNumBuckets(),
				"bucketIndex (%s) out of range [0, %s)", bucketIndex, hasher.getNumBuckets());
		if (tag == 0 || (tag >>> hasher.getTagBits()) != 0 || table.occupied(bucketIndex, posInBucket)) {
			return Status.NOT_SUPPORTED;
		}
		table.writeTag(bucketIndex, posInBucket, tag);
		count++;
		return Status.OK;
	}

	private BucketAndTag generate(T item) {
		BucketAndTag pos = hasher.generate(item);
		if (pos.seed != 0)
			listener.seededBucketUsed(pos.index, pos.seed);
		return pos;
	}

	/**
	 * Human readable status summary.
	 */
	public String info() {
		StringBuilder sb = new StringBuilder();
		sb.append("CuckooFilter Status:\n");
		sb.append("\t\t").append(table.getClass().getSimpleName()).append(" with tag size: ")
				.append(table.bitsPerTag()).append(" bits");
		if (hasher.isSeeded())
			sb.append(", seeded against hash power ").append(hasher.getHashPower());
		sb.append("\n");
		sb.append("\t\tBucket count: ").append(getBucketCount()).append("\n");
		sb.append("\t\tKeys stored: ").append(count).append("\n");
		sb.append("\t\tLoad factor: ").append(getLoadFactor()).append("\n");
		sb.append("\t\tHashtable size: ").append(table.sizeInBytes() >> 10).append(" KB\n");
		if (count > 0) {
			sb.append("\t\tbit/key:   ").append(getBitsPerItem()).append("\n");
		} else {
			sb.append("\t\tbit/key:   N/A\n");
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return info();
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (object == this) {
			return true;
		}
		if (object instanceof CuckooFilter) {
			CuckooFilter<?> that = (CuckooFilter<?>) object;
			if (hasVictim) {
				// only compare victim if set, victim is sometimes stale
				// since we use bool flag to determine if set or not
				return this.hasher.equals(that.hasher) && this.table.equals(that.table)
						&& this.count == that.count && this.hasVictim == that.hasVictim
						&& victim.equals(that.victim);
			}
			return this.hasher.equals(that.hasher) && this.table.equals(that.table) && this.count == that.count
					&& this.hasVictim == that.hasVictim;
		}
		return false;
	}

	@Override
	public int hashCode() {
		if (hasVictim) {
			return Objects.hash(hasher, table, count, victim);
		}
		return Objects.hash(hasher, table, count);
	}

	/**
	 * Creates a new {@code CuckooFilter} that's a copy of this instance. The
	 * new instance is equal to this instance but shares no mutable state. Note
	 * that further inserts <i>may</i> cause a copy to diverge even if the same
	 * operations are performed on both filters, since the kick sequence
	 * restarts from the seed.
	 *
	 * @return a copy of the filter
	 */
	public CuckooFilter<T> copy() {
		return new CuckooFilter<>(hasher, table.copy(), count, hasVictim, victim.copy(), kickSeed, listener);
	}

}
