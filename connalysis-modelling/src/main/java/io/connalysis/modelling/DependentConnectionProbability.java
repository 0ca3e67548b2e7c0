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

package io.connalysis.modelling;

import io.connalysis.modelling.covariate.CovariateMatrix;
import io.connalysis.network.AdjacencyMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Connection probability conditioned on one or more pairwise covariates.
 *
 * <h2>Algorithm</h2>
 *
 * <pre>{@code
 * for each source row r in chunk:
 *     slice every covariate row r          (D buffers of N values)
 *     walk targets c = 0..N-1 alongside the sorted stored targets of r
 *         cell = row-major index of (bin_0(c), ..., bin_D-1(c)), skip if any bin is -1
 *         total[cell]++
 *         connected[cell]++ if (r, c) is stored
 * }</pre>
 *
 * <p>Every pair is visited once regardless of the number of bins, and no
 * N x N mask is materialized: covariates are read one row at a time.</p>
 *
 * <h2>Chunking</h2>
 *
 * <p>Rows are split into {@code chunks} consecutive blocks of
 * {@code ceil(N / chunks)} rows (trailing blocks may be shorter or empty).
 * Blocks are counted independently, on up to {@code parallelism} workers,
 * and summed. Counts are integers, so chunked and unchunked results are
 * identical.</p>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ConnectionProbabilityTable table = DependentConnectionProbability.builder()
 *     .chunks(8)
 *     .parallelism(4)
 *     .build()
 *     .extract(adjacency, List.of(distances), List.of(BinEdges.uniform(100.0, 10)));
 * }</pre>
 */
public final class DependentConnectionProbability {

    private static final Logger logger = LogManager.getLogger(DependentConnectionProbability.class);

    private final int chunks;
    private final int parallelism;

    private DependentConnectionProbability(int chunks, int parallelism) {
        this.chunks = chunks;
        this.parallelism = parallelism;
    }

    /**
     * Returns an extractor that counts all rows in one block on the calling thread.
     *
     * @return single-chunk extractor
     */
    public static DependentConnectionProbability singleChunk() {
        return builder().chunks(1).parallelism(1).build();
    }

    /**
     * Creates a new builder.
     *
     * @return a builder with one chunk and one worker per processor
     */
    public static Builder builder() {
        return new Builder();
    }

    /** @return number of row blocks */
    public int getChunks() {
        return chunks;
    }

    /** @return maximum number of concurrently counted blocks */
    public int getParallelism() {
        return parallelism;
    }

    /**
     * Counts connected and total pairs per covariate bin combination.
     *
     * @param adjacency adjacency matrix; a pair is connected if it has a stored entry
     * @param covariates one matrix per dimension, each the shape of {@code adjacency}
     * @param bins bin edges per dimension, aligned with {@code covariates}
     * @return the probability table
     * @throws IllegalArgumentException on a covariate/bin count mismatch or a shape mismatch
     */
    public ConnectionProbabilityTable extract(AdjacencyMatrix adjacency, List<? extends CovariateMatrix> covariates,
                                              List<BinEdges> bins) {
        if (covariates.size() != bins.size()) {
            throw new IllegalArgumentException("Covariate/bin count mismatch: " + covariates.size()
                + " covariates, " + bins.size() + " bin edge sets");
        }
        if (covariates.isEmpty()) {
            throw new IllegalArgumentException("At least one covariate required");
        }
        int n = adjacency.size();
        for (int d = 0; d < covariates.size(); d++) {
            CovariateMatrix covariate = covariates.get(d);
            if (covariate.rows() != n || covariate.columns() != n) {
                throw new IllegalArgumentException("Covariate " + d + " has shape " + covariate.rows() + "x"
                    + covariate.columns() + ", adjacency matrix is " + n + "x" + n);
            }
        }

        int[] shape = new int[bins.size()];
        int cells = 1;
        for (int d = 0; d < shape.length; d++) {
            shape[d] = bins.get(d).binCount();
            cells = Math.multiplyExact(cells, shape[d]);
        }
        logger.info("Extracting {}-dimensional ({}) connection probabilities over {}x{} pairs in {} chunk(s)",
            shape.length, shapeLabel(shape), n, n, chunks);

        long[] connected = new long[cells];
        long[] total = new long[cells];
        List<int[]> ranges = rowRanges(n, chunks);
        if (parallelism == 1 || ranges.size() == 1) {
            for (int[] range : ranges) {
                countRows(adjacency, covariates, bins, shape, range[0], range[1], connected, total);
            }
        } else {
            countParallel(adjacency, covariates, bins, shape, ranges, connected, total);
        }

        ConnectionProbabilityTable table = new ConnectionProbabilityTable(bins, connected, total);
        logger.debug("Extracted {}", table);
        return table;
    }

    private void countParallel(AdjacencyMatrix adjacency, List<? extends CovariateMatrix> covariates,
                               List<BinEdges> bins, int[] shape, List<int[]> ranges,
                               long[] connected, long[] total) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, ranges.size()));
        try {
            List<Future<long[][]>> futures = new ArrayList<>(ranges.size());
            for (int[] range : ranges) {
                futures.add(executor.submit(() -> {
                    long[] chunkConnected = new long[connected.length];
                    long[] chunkTotal = new long[total.length];
                    countRows(adjacency, covariates, bins, shape, range[0], range[1], chunkConnected, chunkTotal);
                    logger.debug("Counted rows {} to {}", range[0], range[1]);
                    return new long[][]{chunkConnected, chunkTotal};
                }));
            }
            for (Future<long[][]> future : futures) {
                long[][] partial = future.get();
                for (int i = 0; i < connected.length; i++) {
                    connected[i] += partial[0][i];
                    total[i] += partial[1][i];
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while counting connection probabilities", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Chunk count failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /** Accumulates counts for rows {@code [from, to)} into the given arrays. */
    static void countRows(AdjacencyMatrix adjacency, List<? extends CovariateMatrix> covariates,
                          List<BinEdges> bins, int[] shape, int from, int to,
                          long[] connected, long[] total) {
        int n = adjacency.size();
        int dims = shape.length;
        double[][] slices = new double[dims][n];
        for (int r = from; r < to; r++) {
            for (int d = 0; d < dims; d++) {
                covariates.get(d).rowSlice(r, slices[d]);
            }
            int[] targets = adjacency.rowIndices(r);
            int next = 0;
            for (int c = 0; c < n; c++) {
                boolean stored = next < targets.length && targets[next] == c;
                if (stored) {
                    next++;
                }
                int cell = 0;
                for (int d = 0; d < dims; d++) {
                    int bin = bins.get(d).binOf(slices[d][c]);
                    if (bin < 0) {
                        cell = -1;
                        break;
                    }
                    cell = cell * shape[d] + bin;
                }
                if (cell < 0) {
                    continue;
                }
                total[cell]++;
                if (stored) {
                    connected[cell]++;
                }
            }
        }
    }

    /** Splits {@code 0..n-1} into {@code chunks} consecutive ranges of {@code ceil(n / chunks)} rows. */
    static List<int[]> rowRanges(int n, int chunks) {
        int size = (int) Math.ceil((double) n / chunks);
        List<int[]> ranges = new ArrayList<>(chunks);
        for (int k = 0; k < chunks; k++) {
            long start = (long) k * size;
            int from = (int) Math.min(start, n);
            int to = k == chunks - 1 ? n : (int) Math.min(start + size, n);
            ranges.add(new int[]{from, to});
        }
        return ranges;
    }

    private static String shapeLabel(int[] shape) {
        StringBuilder sb = new StringBuilder();
        for (int d = 0; d < shape.length; d++) {
            if (d > 0) {
                sb.append('x');
            }
            sb.append(shape[d]);
        }
        return sb.toString();
    }

    /**
     * Builder for {@link DependentConnectionProbability}.
     */
    public static final class Builder {
        private int chunks = 1;
        private int parallelism = Runtime.getRuntime().availableProcessors();

        private Builder() {}

        /**
         * Sets the number of row blocks.
         *
         * @param chunks number of blocks, at least 1
         * @return this builder
         */
        public Builder chunks(int chunks) {
            if (chunks <= 0) {
                throw new IllegalArgumentException("Number of chunks must be positive: " + chunks);
            }
            this.chunks = chunks;
            return this;
        }

        /**
         * Sets the maximum number of blocks counted concurrently.
         *
         * @param parallelism number of workers, at least 1
         * @return this builder
         */
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Builds the extractor.
         *
         * @return configured extractor
         */
        public DependentConnectionProbability build() {
            return new DependentConnectionProbability(chunks, parallelism);
        }
    }
}
