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

package io.connalysis.network;

import io.connalysis.network.measures.DegreeMeasure;
import io.connalysis.network.measures.GiniMeasure;
import io.connalysis.network.measures.RichClubMeasure;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/// # ConnectomeAnalyzer
///
/// Runs a set of [ConnectomeMeasure]s over an [AdjacencyMatrix] and collects
/// their results into one report.
///
/// ## Features
/// - **Measure Registration**: measures are pluggable and keyed by mnemonic
/// - **Dependency Management**: dependencies are computed once, before their dependents
///
/// ## Usage
/// ```java
/// ConnectomeAnalyzer analyzer = new ConnectomeAnalyzer();
/// AnalysisReport report = analyzer.analyze(matrix);
/// System.out.println(report.getSummary());
/// ```
///
/// ## Default Measures
/// - **Degree**: in- and out-degree vectors
/// - **Gini**: degree inequality, raw and normalized
/// - **RichClub**: normalized rich-club curve and coefficient
public class ConnectomeAnalyzer {

    private static final Logger logger = LogManager.getLogger(ConnectomeAnalyzer.class);

    private final Map<String, ConnectomeMeasure<?>> measures;

    /// Creates an analyzer with the default measures registered.
    public ConnectomeAnalyzer() {
        this(true);
    }

    /// Creates an analyzer.
    ///
    /// @param registerDefaults whether to register Degree, Gini and RichClub
    public ConnectomeAnalyzer(boolean registerDefaults) {
        this.measures = new LinkedHashMap<>();
        if (registerDefaults) {
            registerMeasure(new DegreeMeasure());
            registerMeasure(new GiniMeasure());
            registerMeasure(new RichClubMeasure());
        }
    }

    /// Registers a measure, replacing any measure with the same mnemonic.
    ///
    /// @param measure the measure to register
    public void registerMeasure(ConnectomeMeasure<?> measure) {
        measures.put(measure.getMnemonic(), measure);
    }

    /// Computes every registered measure. Results live only in the returned
    /// report, so concurrent calls do not see each other's results.
    ///
    /// @param matrix the connectome to analyze
    /// @return report with one result per registered measure
    /// @throws IllegalStateException if a measure depends on an unregistered mnemonic
    public AnalysisReport analyze(AdjacencyMatrix matrix) {
        Map<String, Object> computedResults = new LinkedHashMap<>();
        logger.info("Analyzing {}x{} connectome with {} stored entries using measures {}",
            matrix.size(), matrix.size(), matrix.nonZeroCount(), measures.keySet());

        for (ConnectomeMeasure<?> measure : measures.values()) {
            computeMeasure(measure, matrix, computedResults, new LinkedHashMap<>());
        }

        return new AnalysisReport(matrix, computedResults);
    }

    private Object computeMeasure(ConnectomeMeasure<?> measure, AdjacencyMatrix matrix,
                                  Map<String, Object> computedResults, Map<String, Boolean> inProgress) {
        String mnemonic = measure.getMnemonic();

        if (computedResults.containsKey(mnemonic)) {
            return computedResults.get(mnemonic);
        }
        if (inProgress.put(mnemonic, Boolean.TRUE) != null) {
            throw new IllegalStateException("Circular dependency: " + inProgress.keySet() + " -> " + mnemonic);
        }

        Map<String, Object> dependencyResults = new HashMap<>();
        for (String dependency : measure.getDependencies()) {
            ConnectomeMeasure<?> depMeasure = measures.get(dependency);
            if (depMeasure == null) {
                throw new IllegalStateException("Unknown dependency: " + dependency + " for measure: " + mnemonic);
            }
            dependencyResults.put(dependency, computeMeasure(depMeasure, matrix, computedResults, inProgress));
        }

        long start = System.nanoTime();
        Object result = measure.compute(matrix, dependencyResults);
        logger.debug("Computed {} in {} ms", mnemonic, (System.nanoTime() - start) / 1_000_000);
        computedResults.put(mnemonic, result);
        inProgress.remove(mnemonic);

        return result;
    }

    /// ## AnalysisReport
    ///
    /// All measure results computed for one connectome.
    public static class AnalysisReport {
        /// The analyzed connectome
        public final AdjacencyMatrix matrix;
        /// Measure mnemonics mapped to their results, in registration order
        public final Map<String, Object> results;

        /// Creates a report.
        ///
        /// @param matrix the analyzed connectome
        /// @param results measure results keyed by mnemonic
        public AnalysisReport(AdjacencyMatrix matrix, Map<String, Object> results) {
            this.matrix = matrix;
            this.results = results;
        }

        /// Gets a result by mnemonic with type checking.
        ///
        /// @param mnemonic the measure mnemonic
        /// @param resultClass the expected result class
        /// @param <T> the result type
        /// @return the result, or null if not available or of another type
        @SuppressWarnings("unchecked")
        public <T> T getResult(String mnemonic, Class<T> resultClass) {
            Object result = results.get(mnemonic);
            if (result != null && resultClass.isAssignableFrom(result.getClass())) {
                return (T) result;
            }
            return null;
        }

        /// Multi-line text summary of the results.
        ///
        /// @return formatted summary
        public String getSummary() {
            StringBuilder sb = new StringBuilder();
            sb.append("Connectome Analysis Report\n");
            sb.append("==========================\n");
            sb.append(String.format("Nodes: %d, Entries: %d, Density: %.4f, %s\n",
                matrix.size(), matrix.nonZeroCount(), matrix.density(),
                matrix.isBoolean() ? "boolean" : "weighted"));
            sb.append("\n");

            DegreeMeasure.DegreeResult degrees = getResult(DegreeMeasure.MNEMONIC, DegreeMeasure.DegreeResult.class);
            if (degrees != null) {
                sb.append("Degrees:\n");
                sb.append(String.format("  Out: %.2f ± %.2f (max %.2f)\n",
                    degrees.efferentStats.getMean(), degrees.efferentStats.getStandardDeviation(),
                    degrees.efferentStats.getMax()));
                sb.append(String.format("  In:  %.2f ± %.2f (max %.2f)\n",
                    degrees.afferentStats.getMean(), degrees.afferentStats.getStandardDeviation(),
                    degrees.afferentStats.getMax()));
                sb.append("\n");
            }

            GiniMeasure.GiniResult gini = getResult(GiniMeasure.MNEMONIC, GiniMeasure.GiniResult.class);
            if (gini != null) {
                sb.append("Degree Inequality (Gini):\n");
                sb.append(String.format("  Out: %.4f (normalized %.4f)\n",
                    gini.efferentGini, gini.normalizedEfferentGini));
                sb.append(String.format("  In:  %.4f (normalized %.4f)\n",
                    gini.afferentGini, gini.normalizedAfferentGini));
                sb.append("\n");
            }

            RichClubMeasure.RichClubResult richClub =
                getResult(RichClubMeasure.MNEMONIC, RichClubMeasure.RichClubResult.class);
            if (richClub != null) {
                sb.append("Rich Club:\n");
                sb.append(String.format("  Direction: %s, null model: %s\n",
                    richClub.direction, richClub.nullModel.label()));
                sb.append(String.format("  Thresholds: %d\n", richClub.normalized.length()));
                sb.append(String.format("  Coefficient: %.4f\n", richClub.coefficient));
                sb.append("\n");
            }

            return sb.toString();
        }

        @Override
        public String toString() {
            return getSummary();
        }
    }
}
