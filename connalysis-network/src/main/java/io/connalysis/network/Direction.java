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

import java.util.Locale;

/// Axis along which node degrees are taken from an [AdjacencyMatrix].
///
/// Rows are sources and columns are targets, so:
///
/// | Direction | Degree | Matrix axis |
/// |-----------|--------|-------------|
/// | [#EFFERENT] | out-degree | row sums |
/// | [#AFFERENT] | in-degree | column sums |
/// | [#BOTH] | in + out | row sums + column sums |
///
/// [#BOTH] is only meaningful for rich-club curves; the degree and Gini
/// analysis and the shuffle reject it.
public enum Direction {

    /// Outgoing connections (row sums).
    EFFERENT("efferent"),

    /// Incoming connections (column sums).
    AFFERENT("afferent"),

    /// Sum of incoming and outgoing connections.
    BOTH("both");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    /// @return the lower-case name accepted by [#fromName(String)]
    public String label() {
        return label;
    }

    /// Parses a direction name such as `efferent` or `afferent`.
    ///
    /// @param name the direction name, case-insensitive
    /// @return the matching direction
    /// @throws IllegalArgumentException if the name is null or unknown
    public static Direction fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Unknown value for argument direction: null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (Direction direction : values()) {
            if (direction.label.equals(normalized)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown value for argument direction: " + name);
    }

    /// Rejects [#BOTH] for operations that need a single matrix axis.
    ///
    /// @param direction the requested direction
    /// @return the same direction
    /// @throws IllegalArgumentException if direction is null or [#BOTH]
    public static Direction requireSingleAxis(Direction direction) {
        if (direction == null || direction == BOTH) {
            throw new IllegalArgumentException("Unknown value for argument direction: " + direction
                + " (expected efferent or afferent)");
        }
        return direction;
    }

    @Override
    public String toString() {
        return label;
    }
}
