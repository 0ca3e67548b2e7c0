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

import java.util.Locale;

/// Null model used to normalize a rich-club curve.
public enum NullModelType {

    /// Closed-form hypergeometric expectation; boolean matrices only.
    ANALYTICAL("analytical"),

    /// Average over degree-preserving shuffles.
    SHUFFLED("shuffled");

    private final String label;

    NullModelType(String label) {
        this.label = label;
    }

    /// @return the lower-case name accepted by [#fromName(String)]
    public String label() {
        return label;
    }

    /// @param name the null model name, case-insensitive
    /// @return the matching constant
    /// @throws IllegalArgumentException if the name is null or unknown
    public static NullModelType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (NullModelType value : values()) {
                if (value.label.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown null model: " + name);
    }
}
