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

package io.connalysis.network.measures;

import io.connalysis.network.AdjacencyMatrix;
import io.connalysis.network.ConnectomeMeasure;
import io.connalysis.network.Direction;
import io.connalysis.network.degree.DegreeAnalyzer;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.Map;

/**
 * Afferent and efferent degree vectors with summary statistics.
 *
 * For weighted matrices the degrees are weight sums.
 */
public class DegreeMeasure implements ConnectomeMeasure<DegreeMeasure.DegreeResult> {

    /// Mnemonic under which results are registered.
    public static final String MNEMONIC = "Degree";

    @Override
    public String getMnemonic() {
        return MNEMONIC;
    }

    @Override
    public String[] getDependencies() {
        return new String[0];
    }

    @Override
    public DegreeResult compute(AdjacencyMatrix matrix, Map<String, Object> dependencyResults) {
        double[] efferent = DegreeAnalyzer.degreeVector(matrix, Direction.EFFERENT);
        double[] afferent = DegreeAnalyzer.degreeVector(matrix, Direction.AFFERENT);
        return new DegreeResult(efferent, afferent, summarize(efferent), summarize(afferent));
    }

    private static SummaryStatistics summarize(double[] values) {
        SummaryStatistics stats = new SummaryStatistics();
        for (double v : values) {
            stats.addValue(v);
        }
        return stats;
    }

    /**
     * Result container for degree analysis.
     */
    public static class DegreeResult {
        /// Out-degree (row sum) per node
        public final double[] efferent;
        /// In-degree (column sum) per node
        public final double[] afferent;
        /// Statistics of the out-degree distribution
        public final SummaryStatistics efferentStats;
        /// Statistics of the in-degree distribution
        public final SummaryStatistics afferentStats;

        /// Creates a degree result.
        ///
        /// @param efferent out-degree per node
        /// @param afferent in-degree per node
        /// @param efferentStats out-degree statistics
        /// @param afferentStats in-degree statistics
        public DegreeResult(double[] efferent, double[] afferent,
                            SummaryStatistics efferentStats, SummaryStatistics afferentStats) {
            this.efferent = efferent;
            this.afferent = afferent;
            this.efferentStats = efferentStats;
            this.afferentStats = afferentStats;
        }

        /**
         * Gets the degree vector for one direction.
         * @param direction efferent or afferent
         * @return the degree vector
         */
        public double[] degrees(Direction direction) {
            return Direction.requireSingleAxis(direction) == Direction.EFFERENT ? efferent : afferent;
        }

        /**
         * Gets the number of nodes analyzed.
         * @return node count
         */
        public int getNodeCount() {
            return efferent.length;
        }

        @Override
        public String toString() {
            return String.format("DegreeResult{nodes=%d, out=%.2f ± %.2f, in=%.2f ± %.2f}",
                getNodeCount(), efferentStats.getMean(), efferentStats.getStandardDeviation(),
                afferentStats.getMean(), afferentStats.getStandardDeviation());
        }
    }
}
