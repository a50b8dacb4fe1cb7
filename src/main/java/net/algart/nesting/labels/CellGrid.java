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

import net.algart.arrays.TooLargeArrayException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Geometry of an n-dimensional array of cells, stored in AlgART order (coordinate #0 changes fastest).
 * Provides linear indexing, boundary tests and neighbour lookup by an offset.
 *
 * <p>Typical loop over all cells:
 * <pre>
 * final int[] coordinates = new int[grid.dimCount()];
 * for (int index = 0; index &lt; grid.length(); index++, grid.next(coordinates)) {
 *     ...
 * }
 * </pre>
 */
public final class CellGrid {
    private final int[] dimensions;
    private final int[] strides;
    private final int length;

    private CellGrid(long[] dimensions) {
        Objects.requireNonNull(dimensions, "Null dimensions");
        if (dimensions.length == 0) {
            throw new IllegalArgumentException("Empty dimensions array");
        }
        this.dimensions = new int[dimensions.length];
        this.strides = new int[dimensions.length];
        long product = 1;
        boolean empty = false;
        for (int k = 0; k < dimensions.length; k++) {
            if (dimensions[k] < 0) {
                throw new IllegalArgumentException("Negative dimension #" + k + ": " + dimensions[k]);
            }
            empty |= dimensions[k] == 0;
            if (dimensions[k] > Integer.MAX_VALUE || (!empty && product * dimensions[k] > Integer.MAX_VALUE)) {
                throw new TooLargeArrayException("Too large array " + Arrays.toString(dimensions)
                        + ": number of cells must be less than 2^31");
            }
            this.dimensions[k] = (int) dimensions[k];
            this.strides[k] = (int) product;
            product = empty ? 0 : product * dimensions[k];
        }
        this.length = (int) product;
    }

    public static CellGrid newInstance(long... dimensions) {
        return new CellGrid(dimensions);
    }

    public int dimCount() {
        return dimensions.length;
    }

    public long[] dimensions() {
        final long[] result = new long[dimensions.length];
        for (int k = 0; k < result.length; k++) {
            result[k] = dimensions[k];
        }
        return result;
    }

    public int dim(int coordIndex) {
        return dimensions[coordIndex];
    }

    public int length() {
        return length;
    }

    public int index(long... coordinates) {
        Objects.requireNonNull(coordinates, "Null coordinates");
        if (coordinates.length != dimensions.length) {
            throw new IllegalArgumentException("Illegal number of coordinates " + coordinates.length
                    + " for " + dimensions.length + "-dimensional array");
        }
        int index = 0;
        for (int k = dimensions.length - 1; k >= 0; k--) {
            if (coordinates[k] < 0 || coordinates[k] >= dimensions[k]) {
                throw new IndexOutOfBoundsException("Coordinate #" + k + " = " + coordinates[k]
                        + " is out of range 0.." + (dimensions[k] - 1));
            }
            index += (int) coordinates[k] * strides[k];
        }
        return index;
    }

    public int[] coordinates(int index, int[] result) {
        Objects.requireNonNull(result, "Null result");
        for (int k = 0; k < dimensions.length; k++) {
            result[k] = index % dimensions[k];
            index /= dimensions[k];
        }
        return result;
    }

    /**
     * Moves the coordinates to the next cell in the linear order.
     *
     * @param coordinates coordinates of some cell; modified by this method.
     */
    public void next(int[] coordinates) {
        for (int k = 0; k < dimensions.length; k++) {
            if (++coordinates[k] < dimensions[k]) {
                return;
            }
            coordinates[k] = 0;
        }
    }

    public boolean isOnBoundary(int[] coordinates) {
        for (int k = 0; k < dimensions.length; k++) {
            if (coordinates[k] == 0 || coordinates[k] == dimensions[k] - 1) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the linear index of the cell <code>coordinates+offset</code>,
     * or &minus;1 if it lies outside the array.
     *
     * @param index       linear index of the cell.
     * @param coordinates its coordinates.
     * @param offset      neighbour offset.
     * @return index of the neighbour or &minus;1.
     */
    public int neighbour(int index, int[] coordinates, int[] offset) {
        for (int k = 0; k < dimensions.length; k++) {
            final int c = coordinates[k] + offset[k];
            if (c < 0 || c >= dimensions[k]) {
                return -1;
            }
            index += offset[k] * strides[k];
        }
        return index;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        for (int k = 0; k < dimensions.length; k++) {
            sb.append(k > 0 ? "x" : "").append(dimensions[k]);
        }
        return sb + " cells grid";
    }
}
