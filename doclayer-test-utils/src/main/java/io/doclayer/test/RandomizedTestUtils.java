/*
 * RandomizedTestUtils.java
 *
 * This source file is part of the DocLayer open source project
 *
 * Copyright 2025 the DocLayer project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.doclayer.test;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.security.SecureRandom;
import java.util.stream.LongStream;

/**
 * Seed selection for randomized tests.
 * <p>
 *     Set {@code tests.randomSeeds} to the number of fresh seeds to append to the fixed ones (default 1), or set
 *     {@code tests.nightly} to {@code true} to run a larger batch. Fresh seeds are printed. To replay a failure, set
 *     {@code tests.replaySeed} to the printed seed and only that seed runs.
 * </p>
 */
public final class RandomizedTestUtils {
    private static final int NIGHTLY_RANDOM_SEEDS = 20;
    private static final SecureRandom SEED_SOURCE = new SecureRandom();

    private RandomizedTestUtils() {
    }

    @Nonnull
    public static LongStream randomSeeds(@Nonnull long... fixedSeeds) {
        return seeds(freshSeedCount(), fixedSeeds);
    }

    /**
     * Get the fixed seeds followed by {@code freshCount} new ones, unless a replay seed is configured.
     *
     * @param freshCount how many fresh seeds to generate
     * @param fixedSeeds seeds that always run first
     * @return the seeds to run
     */
    @Nonnull
    public static LongStream seeds(int freshCount, @Nonnull long... fixedSeeds) {
        final Long replay = replaySeed();
        if (replay != null) {
            return LongStream.of(replay);
        }
        final LongStream fresh = LongStream.generate(RandomizedTestUtils::freshSeed).limit(freshCount);
        return LongStream.concat(LongStream.of(fixedSeeds), fresh);
    }

    static int freshSeedCount() {
        if (Boolean.parseBoolean(System.getProperty("tests.nightly", "false"))) {
            return NIGHTLY_RANDOM_SEEDS;
        }
        return Integer.parseInt(System.getProperty("tests.randomSeeds", "1"));
    }

    @Nullable
    static Long replaySeed() {
        final String replay = System.getProperty("tests.replaySeed");
        return replay == null || replay.isEmpty() ? null : Long.decode(replay);
    }

    private static long freshSeed() {
        final long seed = SEED_SOURCE.nextLong();
        System.out.println("Random seed: " + seed);
        return seed;
    }
}
