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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class DirectionTest {

    @Test
    public void parsesLabelsCaseInsensitively() {
        assertThat(Direction.fromName("efferent")).isEqualTo(Direction.EFFERENT);
        assertThat(Direction.fromName("Afferent")).isEqualTo(Direction.AFFERENT);
        assertThat(Direction.fromName(" both ")).isEqualTo(Direction.BOTH);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "in", "outgoing", "sideways"})
    public void rejectsUnknownNames(String name) {
        assertThatThrownBy(() -> Direction.fromName(name))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("direction");
    }

    @Test
    public void singleAxisRejectsBoth() {
        assertThat(Direction.requireSingleAxis(Direction.AFFERENT)).isEqualTo(Direction.AFFERENT);
        assertThatThrownBy(() -> Direction.requireSingleAxis(Direction.BOTH))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Direction.requireSingleAxis(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
