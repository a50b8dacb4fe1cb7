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

import net.algart.nesting.labels.CellGrid;
import net.algart.nesting.labels.LabelledRegions;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Builds {@link GroupAdjacencyGraph} for labelled regions.
 *
 * <p>For every cell <i>a</i> and every offset <i>o</i> of its own pattern, the cell <i>b=a+o</i>
 * is in contact with <i>a</i>; the contact is symmetric, so two cells touch when the offset between them
 * belongs to the pattern of either of them. Then:
 * <ul>
 *     <li>two different labels are adjacent if some cells of them are in contact;</li>
 *     <li>a label touches the exterior if some of its cells lies on the array boundary, or has a contact
 *     outside the array bounds, or is in contact with a background cell.</li>
 * </ul>
 * Background cells are not layered: they are transparent and lead directly to the exterior.
 */
public final class GroupGraphBuilder {
    private static final System.Logger LOG = System.getLogger(GroupGraphBuilder.class.getName());

    private final LabelledRegions regions;
    private final BitSet exterior = new BitSet();
    private final Set<Long> knownPairs = new HashSet<>();
    private final List<GroupAdjacencyGraph.Edge> edges = new ArrayList<>();

    private GroupGraphBuilder(LabelledRegions regions) {
        this.regions = Objects.requireNonNull(regions, "Null labelled regions");
    }

    public static GroupGraphBuilder newInstance(LabelledRegions regions) {
        return new GroupGraphBuilder(regions);
    }

    public static GroupAdjacencyGraph build(LabelledRegions regions) {
        return newInstance(regions).build();
    }

    public GroupAdjacencyGraph build() {
        long t1 = System.nanoTime();
        exterior.clear();
        knownPairs.clear();
        edges.clear();
        final CellGrid grid = regions.grid();
        final int[][][] offsets = new int[regions.numberOfPatterns()][][];
        for (int k = 0; k < offsets.length; k++) {
            offsets[k] = regions.pattern(k).offsetCoordinates();
        }
        final int[] coordinates = new int[grid.dimCount()];
        for (int index = 0, n = grid.length(); index < n; index++, grid.next(coordinates)) {
            final int label = regions.labelOfCell(index);
            if (label != LabelledRegions.BACKGROUND_LABEL && grid.isOnBoundary(coordinates)) {
                exterior.set(label);
            }
            for (int[] offset : offsets[regions.patternIndex(index)]) {
                final int neighbour = grid.neighbour(index, coordinates, offset);
                if (neighbour < 0) {
                    if (label != LabelledRegions.BACKGROUND_LABEL) {
                        exterior.set(label);
                    }
                    continue;
                }
                final int other = regions.labelOfCell(neighbour);
                if (other == label) {
                    continue;
                }
                if (label == LabelledRegions.BACKGROUND_LABEL) {
                    touchBackground(other);
                } else if (other == LabelledRegions.BACKGROUND_LABEL) {
                    touchBackground(label);
                } else {
                    addPair(label, other);
                }
            }
        }
        final GroupAdjacencyGraph result = GroupAdjacencyGraph.newInstance(
                regions.numberOfLabels(), edges, exterior);
        long t2 = System.nanoTime();
        LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                "Building graph for %s: %s; %.3f ms", regions, result, (t2 - t1) * 1e-6));
        return result;
    }

    // Background is transparent: any contact with it is a contact with the exterior.
    private void touchBackground(int label) {
        exterior.set(label);
    }

    private void addPair(int label1, int label2) {
        final int min = Math.min(label1, label2);
        final int max = Math.max(label1, label2);
        if (knownPairs.add(((long) min << 32) | max)) {
            edges.add(new GroupAdjacencyGraph.Edge(min, max));
        }
    }
}
