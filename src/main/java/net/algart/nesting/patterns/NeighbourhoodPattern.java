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

package net.algart.nesting.patterns;

import net.algart.arrays.BitArray;
import net.algart.arrays.Matrix;
import net.algart.math.IPoint;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Boolean mask over the neighbour offsets of a cell in n-dimensional space.
 * Every dimension of the mask is odd; the mask is centred on the origin, and the origin itself
 * is ignored: a cell is never a neighbour of itself.
 *
 * <p>Mask elements are stored in AlgART order: coordinate #0 changes fastest.
 * The element with index <code>i<sub>0</sub>+dim<sub>0</sub>*(i<sub>1</sub>+...)</code> corresponds
 * to the offset <code>(i<sub>0</sub>-r<sub>0</sub>, i<sub>1</sub>-r<sub>1</sub>, ...)</code>,
 * where <code>r<sub>k</sub>=(dim<sub>k</sub>-1)/2</code> is the radius along the axis <i>k</i>.
 *
 * <p>This class is immutable and thread-safe.
 */
public final class NeighbourhoodPattern {
    private final long[] dimensions;
    private final int[] radii;
    private final boolean[] mask;
    private final int[][] offsets;

    private NeighbourhoodPattern(boolean[] mask, long[] dimensions) {
        Objects.requireNonNull(mask, "Null mask");
        Objects.requireNonNull(dimensions, "Null dimensions");
        if (dimensions.length == 0) {
            throw new InvalidPatternException("Pattern must have at least 1 dimension", dimensions);
        }
        long product = 1;
        for (int k = 0; k < dimensions.length; k++) {
            final long dim = dimensions[k];
            if (dim <= 0) {
                throw new InvalidPatternException("Zero or negative pattern dimension #" + k + ": " + dim,
                        dimensions);
            }
            if (dim % 2 == 0) {
                throw new InvalidPatternException("Pattern has even extent " + dim + " along the axis #" + k,
                        dimensions);
            }
            product *= dim;
            if (product > Integer.MAX_VALUE) {
                throw new InvalidPatternException("Too large pattern", dimensions);
            }
        }
        if (product != mask.length) {
            throw new IllegalArgumentException("Mask length " + mask.length
                    + " does not match pattern dimensions " + InvalidPatternException.dimensionsToString(dimensions));
        }
        this.dimensions = dimensions.clone();
        this.radii = new int[dimensions.length];
        for (int k = 0; k < dimensions.length; k++) {
            this.radii[k] = (int) (dimensions[k] - 1) / 2;
        }
        this.mask = mask.clone();
        this.mask[centerIndex()] = false;
        // - the origin is never a neighbour
        final List<int[]> list = new ArrayList<>();
        final int[] offset = new int[dimensions.length];
        for (int i = 0; i < this.mask.length; i++) {
            if (this.mask[i]) {
                list.add(offsetOfIndex(i, offset).clone());
            }
        }
        if (list.isEmpty()) {
            throw new InvalidPatternException("Empty pattern: no neighbours besides the origin", dimensions);
        }
        this.offsets = list.toArray(new int[0][]);
    }

    public static NeighbourhoodPattern of(boolean[] mask, long... dimensions) {
        return new NeighbourhoodPattern(mask, dimensions);
    }

    public static NeighbourhoodPattern valueOf(Matrix<? extends BitArray> mask) {
        Objects.requireNonNull(mask, "Null mask matrix");
        final BitArray array = mask.array();
        if (array.length() > Integer.MAX_VALUE) {
            throw new InvalidPatternException("Too large pattern", mask.dimensions());
        }
        final boolean[] bits = new boolean[(int) array.length()];
        for (int i = 0; i < bits.length; i++) {
            bits[i] = array.getBit(i);
        }
        return new NeighbourhoodPattern(bits, mask.dimensions());
    }

    /**
     * Creates the minimal pattern containing all given offsets.
     * The dimension count of the pattern is the dimension count of the points;
     * zero offsets (the origin) are ignored.
     *
     * @param offsets neighbour offsets.
     * @return new pattern.
     * @throws InvalidPatternException if there are no non-zero offsets.
     */
    public static NeighbourhoodPattern ofOffsets(Collection<IPoint> offsets) {
        Objects.requireNonNull(offsets, "Null offsets");
        if (offsets.isEmpty()) {
            throw new InvalidPatternException("Empty pattern: no offsets", null);
        }
        final int dimCount = offsets.iterator().next().coordCount();
        final long[] dimensions = new long[dimCount];
        Arrays.fill(dimensions, 1);
        for (IPoint offset : offsets) {
            Objects.requireNonNull(offset, "Null offset");
            if (offset.coordCount() != dimCount) {
                throw new IllegalArgumentException("Offsets have different number of coordinates: "
                        + offset + " is not " + dimCount + "-dimensional");
            }
            for (int k = 0; k < dimCount; k++) {
                dimensions[k] = Math.max(dimensions[k], 2 * Math.abs(offset.coord(k)) + 1);
            }
        }
        final NeighbourhoodPattern layout = new NeighbourhoodPattern(fullMask(dimensions), dimensions);
        final boolean[] mask = new boolean[layout.mask.length];
        for (IPoint offset : offsets) {
            if (!offset.isOrigin()) {
                mask[layout.indexOfOffset(offset.coordinates())] = true;
            }
        }
        return new NeighbourhoodPattern(mask, dimensions);
    }

    /**
     * Creates 3x3x...x3 pattern, containing only 2<i>n</i> neighbours sharing a face with the central
     * cell (4-connectivity in 2D case, 6-connectivity in 3D case).
     *
     * @param dimCount number of dimensions.
     * @return straight neighbourhood.
     */
    public static NeighbourhoodPattern newStraight(int dimCount) {
        final long[] dimensions = cubeDimensions(dimCount);
        final NeighbourhoodPattern full = new NeighbourhoodPattern(fullMask(dimensions), dimensions);
        final boolean[] mask = new boolean[full.mask.length];
        for (int[] offset : full.offsets) {
            int nonZero = 0;
            for (int c : offset) {
                if (c != 0) {
                    nonZero++;
                }
            }
            mask[full.indexOfOffset(offset)] = nonZero == 1;
        }
        return new NeighbourhoodPattern(mask, dimensions);
    }

    /**
     * Creates 3x3x...x3 pattern, containing all 3<sup><i>n</i></sup>&minus;1 neighbours
     * (8-connectivity in 2D case, 26-connectivity in 3D case).
     *
     * @param dimCount number of dimensions.
     * @return straight-and-diagonal neighbourhood.
     */
    public static NeighbourhoodPattern newStraightAndDiagonal(int dimCount) {
        final long[] dimensions = cubeDimensions(dimCount);
        return new NeighbourhoodPattern(fullMask(dimensions), dimensions);
    }

    public int dimCount() {
        return dimensions.length;
    }

    public long[] dimensions() {
        return dimensions.clone();
    }

    public long dim(int coordIndex) {
        return dimensions[coordIndex];
    }

    public int radius(int coordIndex) {
        return radii[coordIndex];
    }

    public int numberOfOffsets() {
        return offsets.length;
    }

    /**
     * Returns all neighbour offsets in the order of the mask elements.
     * The returned arrays are newly allocated.
     *
     * @return neighbour offsets; never contains the origin.
     */
    public int[][] offsetCoordinates() {
        final int[][] result = new int[offsets.length][];
        for (int i = 0; i < offsets.length; i++) {
            result[i] = offsets[i].clone();
        }
        return result;
    }

    public List<IPoint> offsets() {
        final List<IPoint> result = new ArrayList<>(offsets.length);
        for (int[] offset : offsets) {
            result.add(toPoint(offset));
        }
        return Collections.unmodifiableList(result);
    }

    public boolean contains(long... offset) {
        Objects.requireNonNull(offset, "Null offset");
        if (offset.length != dimensions.length) {
            throw new IllegalArgumentException("Offset has " + offset.length
                    + " coordinates, but the pattern is " + dimensions.length + "-dimensional");
        }
        for (int k = 0; k < offset.length; k++) {
            if (Math.abs(offset[k]) > radii[k]) {
                return false;
            }
        }
        return mask[indexOfOffset(offset)];
    }

    public boolean contains(IPoint offset) {
        Objects.requireNonNull(offset, "Null offset");
        return contains(offset.coordinates());
    }

    public boolean isCentrosymmetric() {
        return firstAsymmetricOffset() == null;
    }

    /**
     * Returns the first offset <i>o</i> (in the mask order) such that exactly one
     * of <i>o</i> and &minus;<i>o</i> belongs to this pattern, or <code>null</code> if the pattern
     * is centrosymmetric.
     *
     * @return first asymmetric offset or <code>null</code>.
     */
    public IPoint firstAsymmetricOffset() {
        final int[] offset = new int[dimensions.length];
        for (int i = 0; i < mask.length; i++) {
            offsetOfIndex(i, offset);
            final int mirrored = indexOfMirror(offset);
            if (mask[i] != mask[mirrored]) {
                return toPoint(offset);
            }
        }
        return null;
    }

    /**
     * Returns the pattern containing both <i>o</i> and &minus;<i>o</i> for every offset <i>o</i>
     * of this one. Two cells of equal values are connected if their offset belongs to the pattern of
     * at least one of them; for equal patterns it is the same as belonging to this closure.
     *
     * @return centrosymmetric closure of this pattern; <code>this</code> if it is already centrosymmetric.
     */
    public NeighbourhoodPattern symmetricClosure() {
        if (isCentrosymmetric()) {
            return this;
        }
        final boolean[] result = mask.clone();
        final int[] offset = new int[dimensions.length];
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                result[indexOfMirror(offsetOfIndex(i, offset))] = true;
            }
        }
        return new NeighbourhoodPattern(result, dimensions);
    }

    @Override
    public String toString() {
        return InvalidPatternException.dimensionsToString(dimensions) + " neighbourhood pattern, "
                + offsets.length + " offsets" + (isCentrosymmetric() ? "" : ", asymmetric");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NeighbourhoodPattern that = (NeighbourhoodPattern) o;
        return Arrays.equals(dimensions, that.dimensions) && Arrays.equals(mask, that.mask);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dimensions) + Arrays.hashCode(mask);
    }

    private int centerIndex() {
        return indexOfOffset(new int[dimensions.length]);
    }

    private int indexOfOffset(int[] offset) {
        int index = 0;
        for (int k = dimensions.length - 1; k >= 0; k--) {
            index = index * (int) dimensions[k] + offset[k] + radii[k];
        }
        return index;
    }

    private int indexOfOffset(long[] offset) {
        int index = 0;
        for (int k = dimensions.length - 1; k >= 0; k--) {
            index = index * (int) dimensions[k] + (int) offset[k] + radii[k];
        }
        return index;
    }

    private int indexOfMirror(int[] offset) {
        int index = 0;
        for (int k = dimensions.length - 1; k >= 0; k--) {
            index = index * (int) dimensions[k] - offset[k] + radii[k];
        }
        return index;
    }

    private int[] offsetOfIndex(int index, int[] result) {
        for (int k = 0; k < dimensions.length; k++) {
            final int dim = (int) dimensions[k];
            result[k] = index % dim - radii[k];
            index /= dim;
        }
        return result;
    }

    private static IPoint toPoint(int[] offset) {
        final long[] coordinates = new long[offset.length];
        for (int k = 0; k < offset.length; k++) {
            coordinates[k] = offset[k];
        }
        return IPoint.valueOf(coordinates);
    }

    private static long[] cubeDimensions(int dimCount) {
        if (dimCount <= 0) {
            throw new IllegalArgumentException("Zero or negative number of dimensions: " + dimCount);
        }
        final long[] dimensions = new long[dimCount];
        Arrays.fill(dimensions, 3);
        return dimensions;
    }

    private static boolean[] fullMask(long[] dimensions) {
        long product = 1;
        for (long dim : dimensions) {
            product *= dim;
            if (product > Integer.MAX_VALUE) {
                throw new InvalidPatternException("Too large pattern", dimensions);
            }
        }
        final boolean[] result = new boolean[(int) product];
        Arrays.fill(result, true);
        return result;
    }
}
