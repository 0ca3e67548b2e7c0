/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.connalysis.network.nullmodel;

import io.connalysis.network.AdjacencyMatrix;
import io.connalysis.network.Curve;
import io.connalysis.network.Direction;
import io.connalysis.network.NullModelCurve;
import io.connalysis.network.richclub.RichClubAnalyzer;
import io.connalysis.network.util.RandomGenerators;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/// # RichClubNullModel
///
/// Normalizes observed rich-club curves against a null model.
///
/// ## Null models
///
/// | [NullModelType] | Expected curve |
/// |-----------------|----------------|
/// | `analytical` | [RichClubAnalyzer#analyticalExpectedRichClubCurve], boolean matrices only |
/// | `shuffled` | per-threshold mean and standard deviation over `trials` [DegreePreservingShuffle] controls |
///
/// ## Normalization
///
/// | [Normalization] | Output |
/// |-----------------|--------|
/// | `mean` | `observed / mean` |
/// | `std` | `(observed - mean) / std` |
///
/// Observed and null curves both start at threshold 1 with unit spacing for
/// boolean matrices. The output covers their common leading length; points
/// without a valid null value carry `NaN`.
///
/// ## Trials
///
/// Shuffle trials share nothing but read access to the observed matrix. Each
/// trial draws from its own jumped stream of one seeded generator and the
/// trials run on a fixed worker pool, so results depend on the seed only,
/// not on scheduling.
///
/// ## Usage
/// ```java
/// RichClubNullModel nullModel = RichClubNullModel.builder()
///     .trials(20)
///     .seed(42L)
///     .build();
/// Curve z = nullModel.normalizedRichClubCurve(matrix, Direction.EFFERENT,
///     Normalization.STD, NullModelType.SHUFFLED);
/// ```
public final class RichClubNullModel {

    private static final Logger logger = LogManager.getLogger(RichClubNullModel.class);

    /// Default number of shuffle trials.
    public static final int DEFAULT_TRIALS = 10;

    /// Default seed of the shuffle trials.
    public static final long DEFAULT_SEED = 0L;

    private final int trials;
    private final long seed;
    private final int parallelism;

    private RichClubNullModel(int trials, long seed, int parallelism) {
        this.trials = trials;
        this.seed = seed;
        this.parallelism = parallelism;
    }

    /// @return a null model with default trials, seed and parallelism
    public static RichClubNullModel defaults() {
        return builder().build();
    }

    /// @return a builder for custom configuration
    public static Builder builder() {
        return new Builder();
    }

    /// @return number of shuffle trials
    public int trials() {
        return trials;
    }

    /// @return seed of the shuffle trials
    public long seed() {
        return seed;
    }

    /// Name-based variant of
    /// [#normalizedRichClubCurve(AdjacencyMatrix, Direction, Normalization, NullModelType)].
    ///
    /// @param matrix adjacency matrix
    /// @param direction `efferent` or `afferent`
    /// @param normalize `mean` or `std`
    /// @param normalizeWith `analytical` or `shuffled`
    /// @return the normalized curve
    /// @throws IllegalArgumentException for unknown names
    public Curve normalizedRichClubCurve(AdjacencyMatrix matrix, String direction,
                                         String normalize, String normalizeWith) {
        Normalization normalization = Normalization.fromName(normalize);
        NullModelType nullModel = NullModelType.fromName(normalizeWith);
        return normalizedRichClubCurve(matrix, Direction.fromName(direction), normalization, nullModel);
    }

    /// Rich-club curve normalized by a null model.
    ///
    /// @param matrix adjacency matrix
    /// @param direction [Direction#EFFERENT] or [Direction#AFFERENT]
    /// @param normalize output transform
    /// @param normalizeWith null model
    /// @return the normalized curve over the common threshold domain
    /// @throws IllegalArgumentException for a null or unsupported option
    /// @throws IllegalStateException for the analytical model on a weighted matrix
    public Curve normalizedRichClubCurve(AdjacencyMatrix matrix, Direction direction,
                                         Normalization normalize, NullModelType normalizeWith) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        Direction.requireSingleAxis(direction);
        if (normalize == null) {
            throw new IllegalArgumentException("Unknown normalization: null");
        }
        if (normalizeWith == null) {
            throw new IllegalArgumentException("Unknown null model: null");
        }
        if (normalizeWith == NullModelType.ANALYTICAL && !matrix.isBoolean()) {
            throw new IllegalStateException("The analytical rich-club null model only supports boolean matrices");
        }

        Curve observed = observedRichClubCurve(matrix, direction);
        NullModelCurve control = normalizeWith == NullModelType.ANALYTICAL
            ? RichClubAnalyzer.analyticalExpectedRichClubCurve(matrix, direction)
            : shuffledRichClubCurve(matrix, direction);
        return applyNormalization(observed, control, normalize);
    }

    /// Applies a normalization point by point over the common leading length.
    ///
    /// Zero spread gives an infinite z-score where the observed value differs
    /// from the mean and `NaN` where it matches.
    static Curve applyNormalization(Curve observed, NullModelCurve control, Normalization normalize) {
        int length = Math.min(observed.length(), control.length());
        double[] mean = control.mean();
        double[] std = control.std();
        double[] x = new double[length];
        double[] y = new double[length];
        for (int i = 0; i < length; i++) {
            x[i] = observed.x(i);
            y[i] = normalize == Normalization.MEAN
                ? observed.y(i) / mean[i]
                : (observed.y(i) - mean[i]) / std[i];
        }
        return new Curve(x, y);
    }

    /// Mean of the std-normalized rich-club curve, ignoring `NaN` points.
    /// A threshold where every control agrees (zero spread) but the observed
    /// value differs contributes an infinite z-score.
    ///
    /// @param matrix adjacency matrix
    /// @param direction [Direction#EFFERENT] or [Direction#AFFERENT]
    /// @param normalizeWith null model
    /// @return the rich-club coefficient, `NaN` if every point is `NaN`
    public double richClubCoefficient(AdjacencyMatrix matrix, Direction direction, NullModelType normalizeWith) {
        return normalizedRichClubCurve(matrix, direction, Normalization.STD, normalizeWith).nanMean();
    }

    /// Observed curve on the threshold grid used for normalization: thresholds
    /// `1..max degree` for boolean matrices, degree bins for weighted ones.
    ///
    /// @param matrix adjacency matrix
    /// @param direction [Direction#EFFERENT] or [Direction#AFFERENT]
    /// @return the observed rich-club curve
    public static Curve observedRichClubCurve(AdjacencyMatrix matrix, Direction direction) {
        Direction.requireSingleAxis(direction);
        if (!matrix.isBoolean()) {
            return RichClubAnalyzer.richClubCurve(matrix, direction);
        }
        Curve all = RichClubAnalyzer.efficientRichClubCurve(matrix, direction);
        double[] x = Arrays.copyOfRange(all.x(), 1, all.length());
        double[] y = Arrays.copyOfRange(all.y(), 1, all.length());
        return new Curve(x, y);
    }

    /// Expected rich-club curve over degree-preserving shuffles.
    ///
    /// @param matrix adjacency matrix
    /// @param direction [Direction#EFFERENT] or [Direction#AFFERENT]
    /// @return per-threshold mean and population standard deviation of the trials
    public NullModelCurve shuffledRichClubCurve(AdjacencyMatrix matrix, Direction direction) {
        Direction.requireSingleAxis(direction);
        List<UniformRandomProvider> streams = RandomGenerators.independentStreams(seed, trials);
        List<Curve> curves = new ArrayList<>(trials);

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(parallelism, trials)));
        try {
            List<Future<Curve>> futures = new ArrayList<>(trials);
            for (int t = 0; t < trials; t++) {
                final int trial = t;
                final UniformRandomProvider rng = streams.get(t);
                futures.add(executor.submit(() -> {
                    AdjacencyMatrix control = DegreePreservingShuffle.generateDegreeBasedControl(matrix, direction, rng);
                    Curve curve = observedRichClubCurve(control, direction);
                    logger.debug("Shuffle trial {} of {}: {} thresholds", trial + 1, trials, curve.length());
                    return curve;
                }));
            }
            for (Future<Curve> future : futures) {
                curves.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running shuffle trials", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Shuffle trial failed", cause);
        } finally {
            executor.shutdownNow();
        }

        Curve longest = curves.stream()
            .reduce((a, b) -> b.length() > a.length() ? b : a)
            .orElse(new Curve(new double[0], new double[0]));
        List<double[]> samples = new ArrayList<>(curves.size());
        for (Curve curve : curves) {
            double[] padded = Arrays.copyOf(curve.y(), longest.length());
            Arrays.fill(padded, curve.length(), padded.length, Double.NaN);
            samples.add(padded);
        }
        NullModelCurve result = NullModelCurve.fromSamples(longest.x(), samples);
        logger.info("Shuffled rich-club null model: {} trials, {} thresholds, direction {}",
            trials, result.length(), direction);
        return result;
    }

    /// Builder for [RichClubNullModel].
    public static final class Builder {
        private int trials = DEFAULT_TRIALS;
        private long seed = DEFAULT_SEED;
        private int parallelism = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        /// Sets the number of shuffle trials.
        public Builder trials(int trials) {
            if (trials <= 0) {
                throw new IllegalArgumentException("trials must be positive: " + trials);
            }
            this.trials = trials;
            return this;
        }

        /// Sets the seed from which every trial stream is derived.
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        /// Sets the number of worker threads for shuffle trials.
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        /// @return the configured null model
        public RichClubNullModel build() {
            return new RichClubNullModel(trials, seed, parallelism);
        }
    }
}
