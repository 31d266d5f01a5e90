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
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Verify.verify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import javax.annotation.Nullable;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Equivalence;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Funnel;
import com.google.common.math.IntMath;

/**
 * An exact cuckoo hash table of keys. Every key lives in one of two buckets of
 * four slots, both derived from its 64 bit digest: the low {@code hashPower}
 * bits pick the first bucket, the remaining bits pick the alternate.
 *
 * <p>
 * When both buckets are full, insertion runs a breadth-first search from the
 * two buckets for an empty slot reachable through at most
 * {@value #MAX_BFS_PATH_LEN} buckets, each step following an occupant to its
 * alternate bucket. The keys on the discovered path are then shifted one step
 * towards the empty slot, freeing a slot in one of the new key's buckets. If
 * no path exists within that budget the table reports
 * {@link InsertStatus#TABLE_FULL}; it never grows on its own, the caller has
 * to rebuild with a larger hash power or reject the key.
 *
 * <p>
 * This class is not thread safe. Any concurrent wrapper must lock both
 * candidate buckets of an operation in ascending bucket order, and eviction
 * moves keys across arbitrary buckets, so inserts need exclusive access to the
 * whole table.
 *
 * @param <K>
 *            key type, expected to be immutable
 * @author Mark Gunlogson
 */
public final class CuckooHashTable<K> {

	/**
	 * The maximum number of items in a cuckoo BFS path. It determines the
	 * maximum number of slots we search when cuckooing.
	 */
	static final int MAX_BFS_PATH_LEN = 5;
	static final int SLOT_PER_BUCKET = Utils.SLOTS_PER_BUCKET;
	private static final int DEFAULT_HASH_POWER = 16;

	/**
	 * Outcome of an insert.
	 */
	public enum InsertStatus {
		/** the key was stored */
		OK,
		/** an equal key was already stored, nothing changed */
		DUPLICATE,
		/** no cuckoo path was found, nothing changed */
		TABLE_FULL
	}

	/**
	 * A bucket and slot in the table.
	 */
	public static final class Position {
		private final long bucket;
		private final int slot;

		Position(long bucket, int slot) {
			this.bucket = bucket;
			this.slot = slot;
		}

		public long bucket() {
			return bucket;
		}

		public int slot() {
			return slot;
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (object == this) {
				return true;
			}
			if (object instanceof Position) {
				Position that = (Position) object;
				return this.bucket == that.bucket && this.slot == that.slot;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(bucket, slot);
		}

		@Override
		public String toString() {
			return "(" + bucket + ", " + slot + ")";
		}
	}

	/**
	 * One key shifted along a cuckoo path, from one slot to another.
	 */
	public static final class Move {
		private final Position from;
		private final Position to;

		Move(Position from, Position to) {
			this.from = from;
			this.to = to;
		}

		public Position from() {
			return from;
		}

		public Position to() {
			return to;
		}

		@Override
		public boolean equals(@Nullable Object object) {
			if (object == this) {
				return true;
			}
			if (object instanceof Move) {
				Move that = (Move) object;
				return this.from.equals(that.from) && this.to.equals(that.to);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return Objects.hash(from, to);
		}

		@Override
		public String toString() {
			return from + " -> " + to;
		}
	}

	/**
	 * Result of {@link CuckooHashTable#insert(Object)}. The position is the
	 * new key's slot for {@link InsertStatus#OK} and the existing key's slot for
	 * {@link InsertStatus#DUPLICATE}. A full table has no position.
	 */
	public static final class InsertResult {
		private static final InsertResult FULL = new InsertResult(InsertStatus.TABLE_FULL, null,
				ImmutableList.<Move>of());

		private final InsertStatus status;
		@Nullable
		private final Position position;
		private final ImmutableList<Move> trail;

		private InsertResult(InsertStatus status, @Nullable Position position, ImmutableList<Move> trail) {
			this.status = status;
			this.position = position;
			this.trail = trail;
		}

		public InsertStatus status() {
			return status;
		}

		public boolean isOk() {
			return status == InsertStatus.OK;
		}

		/**
		 * @throws IllegalStateException
		 *             if the table was full
		 */
		public Position position() {
			checkState(position != null, "insert failed with %s, no position", status);
			return position;
		}

		public long bucket() {
			return position().bucket();
		}

		public int slot() {
			return position().slot();
		}

		/**
		 * Keys displaced by this insert, in the order they were moved. The
		 * first move listed is the one next to the empty slot the search
		 * found, the last one frees {@link #position()}. Only filled by
		 * {@link CuckooHashTable#insertTracked(Object)}.
		 */
		public List<Move> trail() {
			return trail;
		}

		@Override
		public String toString() {
			return MoreObjects.toStringHelper(this).add("status", status).add("position", position)
					.add("moves", trail.size()).toString();
		}
	}

	private final KeyedHasher<? super K> hasher;
	private final Equivalence<? super K> keyEq;
	private final KeyStore<K> buckets;
	private final int hashPower;
	private final CuckooListener listener;
	private long numItems;

	// search scratch space, reused by every insert
	private final BQueue queue = new BQueue();
	private final CuckooRecord[] cuckooPath = new CuckooRecord[MAX_BFS_PATH_LEN];

	private CuckooHashTable(KeyedHasher<? super K> hasher, Equivalence<? super K> keyEq, KeyStore<K> buckets,
			int hashPower, long numItems, CuckooListener listener) {
		this.hasher = hasher;
		this.keyEq = keyEq;
		this.buckets = buckets;
		this.hashPower = hashPower;
		this.numItems = numItems;
		this.listener = listener;
		for (int i = 0; i < cuckooPath.length; i++) {
			cuckooPath[i] = new CuckooRecord();
		}
	}

	/***
	 * Builds a cuckoo hash table. Construct this, then call {@code #build()}.
	 *
	 * @author Mark Gunlogson
	 *
	 * @param <K>
	 *            key type
	 */
	public static class Builder<K> {
		private final KeyedHasher<? super K> keyedHasher;
		private int hashPower = DEFAULT_HASH_POWER;
		private Equivalence<? super K> keyEq = Equivalence.equals();
		private CuckooListener listener = CuckooListener.NO_OP;

		/**
		 * Creates a Builder for a table of {@code 2^16} buckets.
		 *
		 * @param hasher
		 *            hash family for the keys, used unkeyed
		 */
		public Builder(KeyedHasher<? super K> hasher) {
			this.keyedHasher = checkNotNull(hasher);
		}

		/**
		 * Creates a Builder hashing keys through {@code funnel} with a randomly
		 * salted Murmur3 {@link FunnelHasher}.
		 */
		public Builder(Funnel<? super K> funnel) {
			this(FunnelHasher.create(funnel));
		}

		/**
		 * Sizes the table to the smallest power of two bucket count holding
		 * {@code slots} keys at full occupancy.
		 *
		 * @return The builder interface
		 */
		public Builder<K> withCapacity(long slots) {
			checkArgument(slots > 0, "capacity (%s) must be > 0", slots);
			return withHashPower(Utils.getHashPowerNeeded(slots));
		}

		/**
		 * Sets the bucket count to {@code 2^hashPower}.
		 *
		 * @return The builder interface
		 */
		public Builder<K> withHashPower(int hashPower) {
			checkArgument(hashPower >= 0 && hashPower <= ArrayKeyStore.MAX_HASH_POWER,
					"hashPower (%s) must be in [0, %s]", hashPower, ArrayKeyStore.MAX_HASH_POWER);
			this.hashPower = hashPower;
			return this;
		}

		/**
		 * Sets how keys are compared. Defaults to {@link Object#equals}. Keys
		 * equivalent under it must hash identically.
		 *
		 * @return The builder interface
		 */
		public Builder<K> withKeyEquivalence(Equivalence<? super K> keyEq) {
			this.keyEq = checkNotNull(keyEq);
			return this;
		}

		/**
		 * @return The builder interface
		 */
		public Builder<K> withListener(CuckooListener listener) {
			this.listener = checkNotNull(listener);
			return this;
		}

		public CuckooHashTable<K> build() {
			return new CuckooHashTable<>(keyedHasher, keyEq, ArrayKeyStore.<K>create(hashPower), hashPower, 0,
					listener);
		}
	}

	/**
	 * Returns the hashpower of the table, which is log2({@link #bucketCount()}).
	 */
	public int hashPower() {
		return hashPower;
	}

	public long bucketCount() {
		return CuckooIndex.hashSize(hashPower);
	}

	public int slotsPerBucket() {
		return SLOT_PER_BUCKET;
	}

	/**
	 * @return number of keys in the table
	 */
	public long size() {
		return numItems;
	}

	public boolean isEmpty() {
		return numItems == 0;
	}

	/**
	 * @return {@link #bucketCount()} &times; {@link #slotsPerBucket()}
	 */
	public long capacity() {
		return bucketCount() * SLOT_PER_BUCKET;
	}

	/**
	 * @return {@link #size()} &divide; {@link #capacity()}
	 */
	public double loadFactor() {
		return (double) numItems / capacity();
	}

	/**
	 * Inserts a key. An equal key already in the table is left alone and its
	 * position returned with {@link InsertStatus#DUPLICATE}.
	 *
	 * @param key
	 *            key to insert
	 * @return where the key lives, or {@link InsertStatus#TABLE_FULL}
	 */
	public InsertResult insert(K key) {
		return insert(key, null);
	}

	/**
	 * Same as {@link #insert(Object)}, additionally recording every key the
	 * cuckoo path moved. Applying the moves in order, then storing the new
	 * key at {@link InsertResult#position()}, turns the old layout into the
	 * new one.
	 */
	public InsertResult insertTracked(K key) {
		return insert(key, new ArrayList<Move>());
	}

	private InsertResult insert(K key, @Nullable List<Move> trail) {
		checkNotNull(key);
		long hv = hashedKey(key);
		long i1 = CuckooIndex.indexHash(hashPower, hv);
		long i2 = CuckooIndex.tableAltIndex(hashPower, hv, i1);

		// check both buckets for a duplicate before taking any free slot
		int slot = tryReadFromBucket(i1, key);
		if (slot != -1) {
			return result(InsertStatus.DUPLICATE, new Position(i1, slot), trail);
		}
		slot = tryReadFromBucket(i2, key);
		if (slot != -1) {
			return result(InsertStatus.DUPLICATE, new Position(i2, slot), trail);
		}

		Position pos = null;
		slot = findEmptySlot(i1);
		if (slot != -1) {
			pos = new Position(i1, slot);
		} else if ((slot = findEmptySlot(i2)) != -1) {
			pos = new Position(i2, slot);
		} else {
			// We are unlucky, so let's perform cuckoo hashing ~
			pos = runCuckoo(i1, i2, trail);
			if (pos == null) {
				listener.tableFull(hashPower, numItems, loadFactor());
				return InsertResult.FULL;
			}
		}
		assert !buckets.occupied(pos.bucket(), pos.slot());
		assert pos.bucket() == i1 || pos.bucket() == i2;
		buckets.setKey(pos.bucket(), pos.slot(), key);
		numItems++;
		return result(InsertStatus.OK, pos, trail);
	}

	private static InsertResult result(InsertStatus status, Position pos, @Nullable List<Move> trail) {
		if (trail == null) {
			return new InsertResult(status, pos, ImmutableList.<Move>of());
		}
		return new InsertResult(status, pos, ImmutableList.copyOf(trail));
	}

	/**
	 * Searches the table for {@code key}.
	 *
	 * @return the stored key equal to {@code key}, or empty if absent
	 */
	public Optional<K> find(K key) {
		checkNotNull(key);
		long hv = hashedKey(key);
		long i1 = CuckooIndex.indexHash(hashPower, hv);
		int slot = tryReadFromBucket(i1, key);
		if (slot != -1) {
			return Optional.of(buckets.getKey(i1, slot));
		}
		long i2 = CuckooIndex.tableAltIndex(hashPower, hv, i1);
		slot = tryReadFromBucket(i2, key);
		if (slot != -1) {
			return Optional.of(buckets.getKey(i2, slot));
		}
		return Optional.empty();
	}

	public boolean contains(K key) {
		return find(key).isPresent();
	}

	/**
	 * @return the slot of the bucket holding a key equivalent to {@code key},
	 *         or -1 if not found
	 */
	private int tryReadFromBucket(long bucket, K key) {
		for (int i = 0; i < SLOT_PER_BUCKET; ++i) {
			K stored = buckets.getKey(bucket, i);
			if (stored != null && keyEq.equivalent(stored, key)) {
				return i;
			}
		}
		return -1;
	}

	/**
	 * @return the lowest empty slot of the bucket, or -1 if full
	 */
	private int findEmptySlot(long bucket) {
		for (int i = 0; i < SLOT_PER_BUCKET; ++i) {
			if (!buckets.occupied(bucket, i)) {
				return i;
			}
		}
		return -1;
	}

	private long hashedKey(K key) {
		return hasher.hash(key, 0);
	}

	/**
	 * Performs cuckoo hashing to free up a slot in either of the insert
	 * buckets.
	 *
	 * @return the freed bucket and slot, or null if no path was found
	 */
	@Nullable
	private Position runCuckoo(long i1, long i2, @Nullable List<Move> trail) {
		int depth = cuckoopathSearch(i1, i2);
		if (depth < 0) {
			return null;
		}
		// nothing can touch the table between search and move
		verify(cuckoopathMove(depth, i1, i2, trail), "cuckoo path from %s/%s invalidated before move", i1, i2);
		CuckooRecord first = cuckooPath[0];
		assert first.bucket == i1 || first.bucket == i2;
		assert !buckets.occupied(first.bucket, first.slot);
		return new Position(first.bucket, first.slot);
	}

	/**
	 * Finds a cuckoo path from one of the starting buckets to an empty slot in
	 * another bucket and fills {@link #cuckooPath} with it.
	 *
	 * @return the depth of the discovered cuckoo path, or -1 on failure
	 */
	@VisibleForTesting
	int cuckoopathSearch(long i1, long i2) {
		int found = slotSearch(i1, i2);
		if (found == -1) {
			return -1;
		}
		int depth = queue.depth(found);
		int pathcode = queue.pathcode(found);
		// Fill in the cuckoo path slots from the end to the beginning.
		for (int i = depth; i >= 0; i--) {
			cuckooPath[i].slot = pathcode % SLOT_PER_BUCKET;
			pathcode /= SLOT_PER_BUCKET;
		}
		// what's left of the pathcode tells which bucket the path starts on
		CuckooRecord first = cuckooPath[0];
		if (pathcode == 0) {
			first.bucket = i1;
		} else {
			assert pathcode == 1;
			first.bucket = i2;
		}
		if (!buckets.occupied(first.bucket, first.slot)) {
			return 0;
		}
		first.hv = hashedKey(buckets.getKey(first.bucket, first.slot));
		for (int i = 1; i <= depth; ++i) {
			CuckooRecord curr = cuckooPath[i];
			CuckooRecord prev = cuckooPath[i - 1];
			// the bucket this slot is on is the alternate of the previous one
			curr.bucket = CuckooIndex.tableAltIndex(hashPower, prev.hv, prev.bucket);
			if (!buckets.occupied(curr.bucket, curr.slot)) {
				return i;
			}
			curr.hv = hashedKey(buckets.getKey(curr.bucket, curr.slot));
		}
		return depth;
	}

	/**
	 * Moves keys along {@link #cuckooPath}, starting next to the empty slot,
	 * so that the path's first slot ends up empty. Every step is checked
	 * against what the search saw.
	 *
	 * @return false if the path no longer matches the table
	 */
	private boolean cuckoopathMove(int depth, long i1, long i2, @Nullable List<Move> trail) {
		if (depth == 0) {
			long bucket = cuckooPath[0].bucket;
			assert bucket == i1 || bucket == i2;
			return !buckets.occupied(bucket, cuckooPath[0].slot);
		}
		while (depth > 0) {
			CuckooRecord from = cuckooPath[depth - 1];
			CuckooRecord to = cuckooPath[depth];
			if (buckets.occupied(to.bucket, to.slot) || !buckets.occupied(from.bucket, from.slot)) {
				return false;
			}
			K moving = buckets.getKey(from.bucket, from.slot);
			if (hashedKey(moving) != from.hv) {
				return false;
			}
			buckets.setKey(to.bucket, to.slot, moving);
			buckets.clear(from.bucket, from.slot);
			listener.keyMoved(from.bucket, from.slot, to.bucket, to.slot);
			if (trail != null) {
				trail.add(new Move(new Position(from.bucket, from.slot), new Position(to.bucket, to.slot)));
			}
			depth--;
		}
		return true;
	}

	/**
	 * Breadth-first search for an empty slot, starting from the i1 and i2
	 * buckets. Each occupied slot enqueues the alternate bucket of its key,
	 * until the path length budget is spent.
	 *
	 * @return the queue entry whose bucket has an empty slot, its pathcode
	 *         extended with that slot, or -1 if none was found
	 */
	private int slotSearch(long i1, long i2) {
		BQueue q = queue;
		q.reset();
		// The initial pathcode informs cuckoopathSearch which bucket the path
		// starts on
		q.enqueue(i1, 0, 0);
		q.enqueue(i2, 1, 0);
		while (!q.isEmpty()) {
			int x = q.dequeue();
			long bucket = q.bucket(x);
			int pathcode = q.pathcode(x);
			int depth = q.depth(x);
			// Picks a (sort-of) random slot to start from
			int startingSlot = pathcode % SLOT_PER_BUCKET;
			for (int i = 0; i < SLOT_PER_BUCKET; ++i) {
				int slot = (startingSlot + i) % SLOT_PER_BUCKET;
				if (!buckets.occupied(bucket, slot)) {
					// We can terminate the search here
					q.setPathcode(x, pathcode * SLOT_PER_BUCKET + slot);
					return x;
				}
				// If x has less than the maximum number of path components,
				// enqueue the bucket we would have to go to if we kicked out the
				// item at this slot.
				if (depth < MAX_BFS_PATH_LEN - 1) {
					long hv = hashedKey(buckets.getKey(bucket, slot));
					assert !q.isFull();
					q.enqueue(CuckooIndex.tableAltIndex(hashPower, hv, bucket), pathcode * SLOT_PER_BUCKET + slot,
							depth + 1);
				}
			}
		}
		// We didn't find a short-enough cuckoo path
		return -1;
	}

	/**
	 * Size of the BFS queue. It holds just enough entries for a
	 * {@value #MAX_BFS_PATH_LEN} deep search from two starting buckets with no
	 * wrapping around: twice the geometric sum
	 * {@code (slots^MAX_BFS_PATH_LEN - 1) / (slots - 1)}, or twice the path
	 * length with one slot per bucket.
	 */
	@VisibleForTesting
	static int maxCuckooCount(int slotsPerBucket, int maxPathLen) {
		checkArgument(slotsPerBucket > 0, "slotsPerBucket (%s) must be > 0", slotsPerBucket);
		if (slotsPerBucket == 1)
			return 2 * maxPathLen;
		return 2 * (IntMath.checkedPow(slotsPerBucket, maxPathLen) - 1) / (slotsPerBucket - 1);
	}

	/**
	 * One position in a cuckoo path. Only the digest of the key being moved is
	 * kept, enough to re-derive the next bucket and to check nothing changed.
	 */
	static final class CuckooRecord {
		long bucket;
		int slot;
		long hv;
	}

	/**
	 * Fixed capacity FIFO of BFS entries kept in parallel arrays. A pathcode is
	 * a base-{@link #SLOT_PER_BUCKET} number listing the slot taken in each
	 * bucket of the path, prefixed by the starting bucket (0 for i1, 1 for i2).
	 */
	static final class BQueue {
		static final int MAX_CUCKOO_COUNT = maxCuckooCount(SLOT_PER_BUCKET, MAX_BFS_PATH_LEN);

		private final long[] buckets = new long[MAX_CUCKOO_COUNT];
		private final int[] pathcodes = new int[MAX_CUCKOO_COUNT];
		private final int[] depths = new int[MAX_CUCKOO_COUNT];
		// index of the head of the queue
		private int first;
		// one past the last item of the queue
		private int last;

		void reset() {
			first = 0;
			last = 0;
		}

		void enqueue(long bucket, int pathcode, int depth) {
			assert !isFull();
			assert depth < MAX_BFS_PATH_LEN;
			buckets[last] = bucket;
			pathcodes[last] = pathcode;
			depths[last] = depth;
			last++;
		}

		/**
		 * @return the position of the dequeued entry
		 */
		int dequeue() {
			assert !isEmpty();
			return first++;
		}

		long bucket(int entry) {
			return buckets[entry];
		}

		int pathcode(int entry) {
			return pathcodes[entry];
		}

		void setPathcode(int entry, int pathcode) {
			pathcodes[entry] = pathcode;
		}

		int depth(int entry) {
			return depths[entry];
		}

		boolean isEmpty() {
			return first == last;
		}

		boolean isFull() {
			return last == MAX_CUCKOO_COUNT;
		}

		int size() {
			return last - first;
		}
	}

	@VisibleForTesting
	KeyStore<K> store() {
		return buckets;
	}

	/**
	 * Human readable status summary.
	 */
	public String info() {
		return "CuckooHashtable Status:\n" + "\t\tSlot per bucket: " + SLOT_PER_BUCKET + "\n" + "\t\tBucket count: "
				+ bucketCount() + "\n" + "\t\tCapacity: " + capacity() + "\n\n" + "\t\tKeys stored: " + numItems
				+ "\n" + "\t\tLoad factor: " + loadFactor() + "\n";
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
		if (object instanceof CuckooHashTable) {
			CuckooHashTable<?> that = (CuckooHashTable<?>) object;
			return this.hasher.equals(that.hasher) && this.hashPower == that.hashPower
					&& this.numItems == that.numItems && this.buckets.equals(that.buckets);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return Objects.hash(hasher, hashPower, numItems, buckets);
	}

	/**
	 * Creates a table holding the same keys in the same slots, sharing no
	 * mutable state with this one.
	 */
	public CuckooHashTable<K> copy() {
		return new CuckooHashTable<>(hasher, keyEq, buckets.copy(), hashPower, numItems, listener);
	}

	/**
	 * Unmodifiable view of the slots of one bucket, nulls for empty slots.
	 */
	@VisibleForTesting
	List<K> bucketContents(long bucket) {
		List<K> keys = new ArrayList<>(SLOT_PER_BUCKET);
		for (int i = 0; i < SLOT_PER_BUCKET; i++) {
			keys.add(buckets.getKey(bucket, i));
		}
		return Collections.unmodifiableList(keys);
	}

}
