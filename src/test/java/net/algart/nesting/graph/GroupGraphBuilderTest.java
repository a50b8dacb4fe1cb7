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

import net.algart.math.IPoint;
import net.algart.nesting.labels.LabelledRegions;
import net.algart.nesting.labels.RegionLabeler;
import net.algart.nesting.patterns.NeighbourhoodPattern;
import net.algart.nesting.patterns.PatternRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GroupGraphBuilderTest {
    static final int[] NESTED_RINGS = {
            1, 1, 1, 1, 1, 1, 1,
            1, 2, 2, 2, 2, 2, 1,
            1, 2, 2, 2, 2, 2, 1,
            1, 2, 2, 3, 2, 2, 1,
            1, 2, 2, 2, 2, 2, 1,
            1, 2, 2, 2, 2, 2, 1,
            1, 1, 1, 1, 1, 1, 1};

    @Test
    void nestedRings_formChain() {
        GroupAdjacencyGraph graph = build2D(NESTED_RINGS, PatternRegistry.newStraight(2), 7, 7);

        assertThat(graph.numberOfLabels()).isEqualTo(3);
        assertThat(graph.exteriorLabels()).containsExactly(1);
        assertThat(graph.numberOfEdges()).isEqualTo(2);
        assertThat(graph.neighbours(2)).containsExactly(1, 3);
        assertThat(graph.areAdjacent(3, 2)).isTrue();
        assertThat(graph.areAdjacent(1, 3)).isFalse();
    }

    @Test
    void contactWithBackground_isContactWithExterior() {
        final int[] values = {
                1, 1, 1, 1, 1,
                1, 0, 0, 0, 1,
                1, 0, 2, 0, 1,
                1, 0, 0, 0, 1,
                1, 1, 1, 1, 1};
        GroupAdjacencyGraph graph = build2D(values, PatternRegistry.newStraight(2), 5, 5, 0);

        assertThat(graph.numberOfLabels()).isEqualTo(2);
        assertThat(graph.exteriorLabels()).containsExactly(1, 2);
        assertThat(graph.numberOfEdges()).isZero();
    }

    @Test
    void diagonalPattern_addsDiagonalContacts() {
        final int[] values = {
                1, 1, 1, 1,
                1, 2, 3, 1,
                1, 3, 1, 1};
        GroupAdjacencyGraph straight = build2D(values, PatternRegistry.newStraight(2), 4, 3);
        GroupAdjacencyGraph diagonal = build2D(values, PatternRegistry.newStraightAndDiagonal(2), 4, 3);

        assertThat(straight.numberOfLabels()).isEqualTo(4);
        // - two separate regions of value 3 in 4-connectivity
        assertThat(diagonal.numberOfLabels()).isEqualTo(3);
        assertThat(diagonal.neighbours(2)).containsExactly(1, 3);
    }

    @Test
    void distantPattern_skipsImmediateNeighbours() {
        PatternRegistry registry = PatternRegistry.newInstance(NeighbourhoodPattern.ofOffsets(
                List.of(IPoint.valueOf(2), IPoint.valueOf(-2))));
        GroupAdjacencyGraph graph = build1D(new int[] {1, 2, 1}, registry, 3);

        assertThat(graph.numberOfLabels()).isEqualTo(2);
        assertThat(graph.numberOfEdges()).isZero();
        assertThat(graph.exteriorLabels()).containsExactly(1, 2);
    }

    @Test
    void contact_isDefinedByPatternOfEitherCell() {
        PatternRegistry registry = PatternRegistry.newInstance(
                        NeighbourhoodPattern.ofOffsets(List.of(IPoint.valueOf(2))))
                .setPattern(1, NeighbourhoodPattern.ofOffsets(List.of(IPoint.valueOf(1))));

        assertThat(build1D(new int[] {1, 2}, registry, 2).areAdjacent(1, 2)).isTrue();
        assertThat(build1D(new int[] {2, 1}, registry, 2).areAdjacent(1, 2)).isFalse();
    }

    @Test
    void graph_isRebuiltFromScratch() {
        LabelledRegions regions = RegionLabeler.newInstance(PatternRegistry.newStraight(2))
                .label(NESTED_RINGS, 7, 7);
        GroupGraphBuilder builder = GroupGraphBuilder.newInstance(regions);

        GroupAdjacencyGraph first = builder.build();
        GroupAdjacencyGraph second = builder.build();

        assertThat(second.numberOfEdges()).isEqualTo(first.numberOfEdges());
        assertThat(second.exteriorLabels()).containsExactly(first.exteriorLabels());
    }

    private static GroupAdjacencyGraph build1D(
            int[] values,
            PatternRegistry registry,
            long dimX,
            int... background) {
        return build(values, registry, new long[] {dimX}, background);
    }

    private static GroupAdjacencyGraph build2D(
            int[] values,
            PatternRegistry registry,
            long dimX,
            long dimY,
            int... background) {
        return build(values, registry, new long[] {dimX, dimY}, background);
    }

    private static GroupAdjacencyGraph build(
            int[] values,
            PatternRegistry registry,
            long[] dimensions,
            int[] background) {
        final LabelledRegions regions = RegionLabeler.newInstance(registry, background).label(values, dimensions);
        return GroupGraphBuilder.build(regions);
    }
}
