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

import net.algart.arrays.IntArray;
import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.SimpleMemoryModel;
import net.algart.nesting.patterns.NeighbourhoodPattern;

import java.util.Objects;

/**
 * Result of {@link RegionLabeler}: the label of every cell (0 for background cells)
 * and per-label information. Labels are <code>1..{@link #numberOfLabels()}</code>, numbered in the order
 * of the first appearance of their cells in the linear order of the array.
 *
 * <p>This class is immutable.
 */
public final class LabelledRegions {
    public static final int BACKGROUND_LABEL = 0;

    private final CellGrid grid;
    private final int[] values;
    private final int[] labels;
    private final int numberOfLabels;
    private final int[] firstCells;
    private final int[] cardinalities;
    private final NeighbourhoodPattern[] patterns;
    private final int[] patternIndexes;

    LabelledRegions(
            CellGrid grid,
            int[] values,
            int[] labels,
            int numberOfLabels,
            int[] firstCells,
            int[] cardinalities,
            NeighbourhoodPattern[] patterns,
            int[] patternIndexes) {
        this.grid = Objects.requireNonNull(grid);
        this.values = Objects.requireNonNull(values);
        this.labels = Objects.requireNonNull(labels);
        this.numberOfLabels = numberOfLabels;
        this.firstCells = Objects.requireNonNull(firstCells);
        this.cardinalities = Objects.requireNonNull(cardinalities);
        this.patterns = Objects.requireNonNull(patterns);
        this.patternIndexes = patternIndexes;
        assert labels.length == grid.length() && values.length == grid.length();
        assert firstCells.length == numberOfLabels + 1 && cardinalities.length == numberOfLabels + 1;
    }

    public CellGrid grid() {
        return grid;
    }

    public long[] dimensions() {
        return grid.dimensions();
    }

    public int dimCount() {
        return grid.dimCount();
    }

    public int numberOfCells() {
        return grid.length();
    }

    public int numberOfLabels() {
        return numberOfLabels;
    }

    public Matrix<? extends IntArray> labels() {
        return Matrices.matrix(SimpleMemoryModel.asUpdatableIntArray(labels).asImmutable(), grid.dimensions());
    }

    public int[] labelsArray() {
        return labels.clone();
    }

    public int label(long... coordinates) {
        return labels[grid.index(coordinates)];
    }

    public int labelOfCell(int index) {
        return labels[index];
    }

    public int valueOfCell(int index) {
        return values[index];
    }

    public boolean isBackgroundCell(int index) {
        return labels[index] == BACKGROUND_LABEL;
    }

    /**
     * Returns the value of the source array in all cells of the given region.
     *
     * @param label region label.
     * @return its cell value.
     */
    public int value(int label) {
        return values[firstCell(label)];
    }

    public int cardinality(int label) {
        checkLabel(label);
        return cardinalities[label];
    }

    public int firstCell(int label) {
        checkLabel(label);
        return firstCells[label];
    }

    public int numberOfPatterns() {
        return patterns.length;
    }

    public NeighbourhoodPattern pattern(int patternIndex) {
        return patterns[patternIndex];
    }

    public int patternIndex(int cellIndex) {
        return patternIndexes == null ? 0 : patternIndexes[cellIndex];
    }

    public NeighbourhoodPattern patternOfCell(int cellIndex) {
        return patterns[patternIndex(cellIndex)];
    }

    @Override
    public String toString() {
        return numberOfLabels + " labelled regions in " + grid;
    }

    private void checkLabel(int label) {
        if (label <= 0 || label > numberOfLabels) {
            throw new IndexOutOfBoundsException("Label " + label + " is out of range 1.." + numberOfLabels);
        }
    }
}
