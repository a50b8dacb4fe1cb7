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

package net.algart.nesting.labels;

import net.algart.arrays.Matrix;
import net.algart.arrays.PFixedArray;
import net.algart.nesting.patterns.NeighbourhoodPattern;
import net.algart.nesting.patterns.PatternRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Labels maximal connected regions of equal values in an n-dimensional integer array.
 *
 * <p>Two cells with equal values are connected if the offset between them belongs to the pattern,
 * resolved for at least one of them by the {@link PatternRegistry}. Cells with background values
 * are not labeled and get {@link LabelledRegions#BACKGROUND_LABEL}.
 *
 * <p>The algorithm is a single pass of union-find over all cells in the linear order,
 * followed by numbering of the found sets in the order of their first cells.
 * So, the result is fully determined by the array and the configuration.
 */
public final class RegionLabeler {
    private static final System.Logger LOG = System.getLogger(RegionLabeler.class.getName());

    private final PatternRegistry patterns;
    private final int[] backgroundValues;

    private RegionLabeler(PatternRegistry patterns, int[] backgroundValues) {
        Objects.requireNonNull(patterns, "Null patterns");
        Objects.requireNonNull(backgroundValues, "Null background values");
        this.patterns = patterns.clone();
        this.backgroundValues = backgroundValues.clone();
        Arrays.sort(this.backgroundValues);
    }

    public static RegionLabeler newInstance(PatternRegistry patterns, int... backgroundValues) {
        return new RegionLabeler(patterns, backgroundValues);
    }

    public PatternRegistry patterns() {
        return patterns.clone();
    }

    public int[] backgroundValues() {
        return backgroundValues.clone();
    }

    public boolean isBackground(int value) {
        return Arrays.binarySearch(backgroundValues, value) >= 0;
    }

    public LabelledRegions label(Matrix<? extends PFixedArray> matrix) {
        Objects.requireNonNull(matrix, "Null matrix");
        patterns.checkPatterns(matrix.dimCount());
        final CellGrid grid = CellGrid.newInstance(matrix.dimensions());
        final PFixedArray array = matrix.array();
        final int[] values = new int[grid.length()];
        for (int i = 0; i < values.length; i++) {
            final long v = array.getLong(i);
            if (v != (int) v) {
                throw new IllegalArgumentException("Value " + v + " at index " + i
                        + " cannot be represented as 32-bit int");
            }
            values[i] = (int) v;
        }
        return label(grid, values);
    }

    public LabelledRegions label(int[] values, long... dimensions) {
        Objects.requireNonNull(values, "Null values");
        Objects.requireNonNull(dimensions, "Null dimensions");
        patterns.checkPatterns(dimensions.length);
        final CellGrid grid = CellGrid.newInstance(dimensions);
        if (values.length != grid.length()) {
            throw new IllegalArgumentException("Length of values array " + values.length
                    + " does not match " + grid);
        }
        return label(grid, values.clone());
    }

    private LabelledRegions label(CellGrid grid, int[] values) {
        long t1 = System.nanoTime();
        final int n = grid.length();
        final List<NeighbourhoodPattern> resolved = new ArrayList<>();
        resolved.add(patterns.getDefaultPattern());
        final int[] patternIndexes = patterns.hasOverrides() ? resolvePatterns(values, resolved) : null;
        final int[][][] backwardOffsets = new int[resolved.size()][][];
        for (int k = 0; k < backwardOffsets.length; k++) {
            backwardOffsets[k] = backwardOffsets(resolved.get(k));
        }
        final boolean[] foreground = new boolean[n];
        final DynamicDisjointSet disjointSet = DynamicDisjointSet.newInstance(n);
        final int[] coordinates = new int[grid.dimCount()];
        for (int index = 0; index < n; index++, grid.next(coordinates)) {
            final int value = values[index];
            if (isBackground(value)) {
                continue;
            }
            foreground[index] = true;
            final int[][] offsets = backwardOffsets[patternIndexes == null ? 0 : patternIndexes[index]];
            for (int[] offset : offsets) {
                final int neighbour = grid.neighbour(index, coordinates, offset);
                if (neighbour >= 0 && values[neighbour] == value) {
                    assert neighbour < index;
                    disjointSet.jointObjects(index, neighbour);
                }
            }
        }
        long t2 = System.nanoTime();
        final int[] labels = new int[n];
        final int numberOfLabels = disjointSet.reindexToSequentialLabels(labels, foreground);
        final int[] firstCells = new int[numberOfLabels + 1];
        final int[] cardinalities = new int[numberOfLabels + 1];
        for (int index = 0, lastLabel = 0; index < n; index++) {
            final int label = labels[index];
            if (label > lastLabel) {
                // - labels appear in increasing order
                assert label == lastLabel + 1;
                firstCells[label] = index;
                cardinalities[label] = disjointSet.cardinality(disjointSet.findBase(index));
                lastLabel = label;
            }
        }
        long t3 = System.nanoTime();
        LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                "Labeling %s: %d regions, %d patterns; %.3f ms = %.3f ms joining + %.3f ms numbering",
                grid, numberOfLabels, resolved.size(),
                (t3 - t1) * 1e-6, (t2 - t1) * 1e-6, (t3 - t2) * 1e-6));
        return new LabelledRegions(
                grid,
                values,
                labels,
                numberOfLabels,
                firstCells,
                cardinalities,
                resolved.toArray(new NeighbourhoodPattern[0]),
                patternIndexes);
    }

    private int[] resolvePatterns(int[] values, List<NeighbourhoodPattern> resolved) {
        final Map<Integer, Integer> indexOfValue = new HashMap<>();
        final Map<NeighbourhoodPattern, Integer> indexOfPattern = new HashMap<>();
        indexOfPattern.put(resolved.get(0), 0);
        final int[] result = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            final int value = values[i];
            Integer index = indexOfValue.get(value);
            if (index == null) {
                final NeighbourhoodPattern pattern = patterns.patternFor(value);
                index = indexOfPattern.get(pattern);
                if (index == null) {
                    index = resolved.size();
                    resolved.add(pattern);
                    indexOfPattern.put(pattern, index);
                }
                indexOfValue.put(value, index);
            }
            result[i] = index;
        }
        return result;
    }

    // Offsets of the symmetric closure, pointing to cells that precede the current one in the linear order:
    // for cells inside the array, it is the sign of the last non-zero coordinate.
    static int[][] backwardOffsets(NeighbourhoodPattern pattern) {
        final List<int[]> result = new ArrayList<>();
        for (int[] offset : pattern.symmetricClosure().offsetCoordinates()) {
            int k = offset.length - 1;
            while (k >= 0 && offset[k] == 0) {
                k--;
            }
            assert k >= 0 : "origin is never included into a pattern";
            if (offset[k] < 0) {
                result.add(offset);
            }
        }
        return result.toArray(new int[0][]);
    }
}
