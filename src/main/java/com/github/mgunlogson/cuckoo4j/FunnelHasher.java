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

import static com.google.common.base.Preconditions.checkNotNull;

import java.security.SecureRandom;
import java.util.Objects;

import javax.annotation.Nullable;

import com.github.mgunlogson.cuckoo4j.Utils.Algorithm;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * Salted {@link KeyedHasher} built on Guava's HashFunctions. Guava doesn't
 * set up salt and seed automatically, so every instance carries its own
 * salt and mixes the per-call seed in after the item.
 *
 * @author Mark Gunlogson
 *
 * @param <T>
 *            type of item to hash
 */
public final class FunnelHasher<T> implements KeyedHasher<T> {
	// provides some protection against collision attacks
	private final long salt;
	// second half of the SipHash key
	private final long sipKey;
	private final Algorithm algorithm;
	private final Funnel<? super T> funnel;
	private final HashFunction hashFunction;

	@VisibleForTesting
	FunnelHasher(long salt, long sipKey, Funnel<? super T> funnel, Algorithm algorithm) {
		this.salt = salt;
		this.sipKey = sipKey;
		this.funnel = checkNotNull(funnel);
		this.algorithm = checkNotNull(algorithm);
		this.hashFunction = hashFunctionFor(algorithm, salt, sipKey);
	}

	/**
	 * Creates a Murmur3 hasher with a random salt.
	 */
	public static <T> FunnelHasher<T> create(Funnel<? super T> funnel) {
		return create(Algorithm.Murmur3_128, funnel);
	}

	/**
	 * Creates a hasher with a random salt.
	 */
	public static <T> FunnelHasher<T> create(Algorithm algorithm, Funnel<? super T> funnel) {
		SecureRandom random = new SecureRandom();
		return new FunnelHasher<>(random.nextLong(), random.nextLong(), funnel, algorithm);
	}

	/**
	 * Creates a hasher with an explicit salt. Two hashers created with the
	 * same arguments produce identical digests, which makes tables
	 * reproducible across runs.
	 */
	public static <T> FunnelHasher<T> create(Algorithm algorithm, Funnel<? super T> funnel, long salt) {
		return new FunnelHasher<>(salt, ~salt, funnel, algorithm);
	}

	private static HashFunction hashFunctionFor(Algorithm algorithm, long salt, long sipKey) {
		switch (algorithm) {
		case Murmur3_128:
			return Hashing.murmur3_128((int) salt);
		case sha256:
			return Hashing.sha256();
		case sipHash24:
			return Hashing.sipHash24(salt, sipKey);
		case farmHashFingerprint64:
			return Hashing.farmHashFingerprint64();
		default:
			throw new IllegalArgumentException("Unknown hash algorithm " + algorithm);
		}
	}

	/**
	 * Salt goes in after the item, then the seed. Seed zero adds nothing, so
	 * it hashes exactly like the unkeyed digest.
	 */
	@Override
	public long hash(T item, int seed) {
		Hasher sink = hashFunction.newHasher().putObject(item, funnel).putLong(salt);
		if (seed != 0)
			sink.putInt(seed);
		return sink.hash().asLong();
	}

	Algorithm getAlgorithm() {
		return algorithm;
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (!(object instanceof FunnelHasher)) {
			return false;
		}
		FunnelHasher<?> that = (FunnelHasher<?>) object;
		return salt == that.salt && sipKey == that.sipKey && algorithm == that.algorithm
				&& funnel.equals(that.funnel);
	}

	@Override
	public int hashCode() {
		return Objects.hash(salt, sipKey, algorithm, funnel);
	}

	public FunnelHasher<T> copy() {
		return new FunnelHasher<>(salt, sipKey, funnel, algorithm);
	}

}
