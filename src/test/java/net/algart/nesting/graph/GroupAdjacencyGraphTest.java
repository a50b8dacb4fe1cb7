/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2017-2025 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.nesting.graph;

import org.junit.jupiter.api.Test;

import java.util.BitSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupAdjacencyGraphTest {
    @Test
    void repeatedEdges_areMerged() {
        final BitSet exterior = new BitSet();
        exterior.set(2);
        GroupAdjacencyGraph graph = GroupAdjacencyGraph.newInstance(3, List.of(
                new GroupAdjacencyGraph.Edge(3, 1),
                new GroupAdjacencyGraph.Edge(1, 3),
                new GroupAdjacencyGraph.Edge(2, 1)), exterior);

        assertThat(graph.numberOfEdges()).isEqualTo(2);
        assertThat(graph.neighbours(1)).containsExactly(2, 3);
        assertThat(graph.neighbour(3, 0)).isEqualTo(1);
        assertThat(graph.touchesExterior(2)).isTrue();
        assertThat(graph.touchesExterior(1)).isFalse();
        assertThat(graph.numberOfExteriorLabels()).isEqualTo(1);
    }

    @Test
    void illegalEdges_areRejected() {
        assertThatThrownBy(() -> new GroupAdjacencyGraph.Edge(2, 2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GroupAdjacencyGraph.Edge(0, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GroupAdjacencyGraph.newInstance(2,
                List.of(new GroupAdjacencyGraph.Edge(1, 3)), new BitSet()))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void exteriorLabels_mustBeInRange() {
        final BitSet background = new BitSet();
        background.set(0);
        final BitSet tooLarge = new BitSet();
        tooLarge.set(4);

        assertThatThrownBy(() -> GroupAdjacencyGraph.newInstance(3, List.of(), background))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GroupAdjacencyGraph.newInstance(3, List.of(), tooLarge))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GroupAdjacencyGraph.newInstance(3, List.of(), new BitSet()).touchesExterior(4))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
