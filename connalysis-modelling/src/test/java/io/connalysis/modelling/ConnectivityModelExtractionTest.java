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

import io.connalysis.modelling.covariate.PairwiseDistanceMatrix;
import io.connalysis.network.AdjacencyMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class ConnectivityModelExtractionTest {

    private static final double[][] POSITIONS = DependentConnectionProbabilityTest.randomPositions(80, 11L);
    private static final AdjacencyMatrix ADJACENCY = DependentConnectionProbabilityTest.distanceDependent(POSITIONS, 12L);

    @Test
    public void distanceBinsDefaultToLargestDistance() {
        ConnectionProbabilityTable table = ConnectivityModelExtraction.extractDistanceDependent(
            ADJACENCY, POSITIONS, 100.0, null, 1);
        double max = PairwiseDistanceMatrix.of(POSITIONS).maxDistance();

        assertThat(table.dimensions()).isEqualTo(1);
        assertThat(table.bins(0).lower()).isEqualTo(0.0);
        assertThat(table.bins(0).upper()).isEqualTo(Math.ceil(max / 100.0) * 100.0);
        assertThat(Arrays.stream(table.totalCounts()).sum()).isEqualTo(80L * 79L);
        assertThat(Arrays.stream(table.connectedCounts()).sum()).isEqualTo(ADJACENCY.nonZeroCount());
    }

    @Test
    public void probabilityDecaysWithDistance() {
        ConnectionProbabilityTable table = ConnectivityModelExtraction.extractDistanceDependent(
            ADJACENCY, POSITIONS, 100.0, 500.0, 1);
        assertThat(table.shape()).containsExactly(5);
        assertThat(table.probability(0)).isGreaterThan(table.probability(4));
    }

    @Test
    public void chunkingRequiresMaximumRange() {
        assertThatThrownBy(() -> ConnectivityModelExtraction.extractDistanceDependent(
            ADJACENCY, POSITIONS, 100.0, null, 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Maximum range");
    }

    @Test
    public void chunkedExtractionMatchesSinglePass() {
        ConnectionProbabilityTable single = ConnectivityModelExtraction.extractDistanceDependent(
            ADJACENCY, POSITIONS, 100.0, 900.0, 1);
        ConnectionProbabilityTable chunked = ConnectivityModelExtraction.extractDistanceDependent(
            ADJACENCY, POSITIONS, 100.0, 900.0, 4);
        assertThat(chunked.connectedCounts()).isEqualTo(single.connectedCounts());
        assertThat(chunked.totalCounts()).isEqualTo(single.totalCounts());
    }

    @Test
    public void bipolarExtractionSeparatesEqualDepth() {
        double[] depths = DependentConnectionProbabilityTest.randomDepths(80, 13L);
        ConnectionProbabilityTable table = ConnectivityModelExtraction.extractBipolarDistanceDependent(
            ADJACENCY, POSITIONS, depths, 100.0, null, 1);

        assertThat(table.shape()[1]).isEqualTo(3);
        long equalDepthPairs = 0;
        for (int r = 0; r < depths.length; r++) {
            for (int c = 0; c < depths.length; c++) {
                if (r != c && depths[r] == depths[c]) equalDepthPairs++;
            }
        }
        long zeroBin = 0;
        long negative = 0;
        long positive = 0;
        for (int i = 0; i < table.shape()[0]; i++) {
            negative += table.totalCount(i, 0);
            zeroBin += table.totalCount(i, 1);
            positive += table.totalCount(i, 2);
        }
        assertThat(zeroBin).isEqualTo(equalDepthPairs);
        assertThat(negative).isEqualTo(positive);
    }

    @Test
    public void alignmentIsValidated() {
        assertThatThrownBy(() -> ConnectivityModelExtraction.extractDistanceDependent(
            ADJACENCY, new double[3][3], 100.0, null, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConnectivityModelExtraction.extractBipolarDistanceDependent(
            ADJACENCY, POSITIONS, new double[5], 100.0, null, 1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ConnectivityModelExtraction.extractDistanceDependent(
            ADJACENCY, POSITIONS, 0.0, null, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void subsampleIsReproducible() {
        ConnectivityModelExtraction.Subsample first = ConnectivityModelExtraction.subsample(ADJACENCY, 20, 5L);
        ConnectivityModelExtraction.Subsample second = ConnectivityModelExtraction.subsample(ADJACENCY, 20, 5L);

        assertThat(first.nodes()).hasSize(20).isSorted().isEqualTo(second.nodes());
        assertThat(first.adjacency().size()).isEqualTo(20);
        assertThat(first.adjacency()).isEqualTo(ADJACENCY.subMatrix(first.nodes()));
        assertThat(first.select(POSITIONS)[3]).isSameAs(POSITIONS[first.nodes()[3]]);
    }

    @Test
    public void subsampleKeepsEverythingForOutOfRangeSizes() {
        assertThat(ConnectivityModelExtraction.subsample(ADJACENCY, 0, 1L).adjacency()).isSameAs(ADJACENCY);
        assertThat(ConnectivityModelExtraction.subsample(ADJACENCY, 500, 1L).nodes()).hasSize(80);
    }
}
