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

/**
 * Union-find over objects <code>0..count-1</code> with path compression and union by size.
 * Objects are added by {@link #expand(int)} or implicitly by {@link #jointObjects(int, int)}.
 */
public final class DynamicDisjointSet {
    private static final int MAX_NUMBER_OF_OBJECTS = Integer.MAX_VALUE - 1000;
    // - allows to freely add +1 to object index

    private static final int[] EMPTY_INTS = new int[0];

    private int[] parent;
    private int[] cardinalities;
    private int count;

    private DynamicDisjointSet() {
        clear();
    }

    public static DynamicDisjointSet newInstance() {
        return new DynamicDisjointSet();
    }

    public static DynamicDisjointSet newInstance(int numberOfObjects) {
        final DynamicDisjointSet result = new DynamicDisjointSet();
        if (numberOfObjects > 0) {
            result.expand(numberOfObjects - 1);
        }
        return result;
    }

    public int count() {
        return count;
    }

    public void expand(int objectIndex) {
        if (objectIndex < 0) {
            throw new IllegalArgumentException("Negative object index: " + objectIndex);
        }
        if (objectIndex >= count) {
            final long newNumberOfObjects = (long) objectIndex + 1;
            ensureCapacity(newNumberOfObjects);
            count = objectIndex + 1;
        }
    }

    public void clear() {
        count = 0;
        parent = EMPTY_INTS;
        cardinalities = EMPTY_INTS;
    }

    public int[] parent() {
        return Arrays.copyOf(parent, count);
    }

    public int findBase(int objectIndex) {
        int base = objectIndex;
        int newBase;
        while ((newBase = parent[base]) != base) {
            base = newBase;
        }
        while ((newBase = parent[objectIndex]) != base) {
            parent[objectIndex] = base;
            objectIndex = newBase;
        }
        // - full path compression
        return base;
    }

    public int jointBases(int base1, int base2) {
        if (base1 == base2) {
            return base1;
        }
        int cardinality1 = cardinalities[base1];
        int cardinality2 = cardinalities[base2];
        if (cardinality1 < cardinality2) {
            int temp = base1;
            base1 = base2;
            base2 = temp;
            cardinality2 = cardinality1;
        }
        parent[base2] = base1;
        // - joining smaller (base2) to larger (base1)
        cardinalities[base1] += cardinality2;
        return base1;
    }

    public int jointObjects(int object1, int object2) {
        expand(object1);
        expand(object2);
        final int o1 = findBase(object1);
        final int o2 = findBase(object2);
        return jointBases(o1, o2);
    }

    /**
     * Returns the number of objects in the set containing the given base.
     *
     * @param base base of some set, returned by {@link #findBase(int)}.
     * @return cardinality of this set.
     */
    public int cardinality(int base) {
        if (parent[base] != base) {
            throw new IllegalArgumentException("Object #" + base + " is not a base of its set");
        }
        return cardinalities[base];
    }

    public void resolveAllBases() {
        for (int i = 0; i < count; i++) {
            findBase(i);
        }
    }

    /**
     * Numbers all sets, containing at least one object with <code>included[object]=true</code>,
     * by sequential integers <code>1, 2, ...</code> in the order of the first appearance of their
     * objects, and stores the number of the set of every included object in <code>result</code>.
     * Other elements of <code>result</code> are set to 0.
     *
     * @param result   result labels; its length must be at least {@link #count()}.
     * @param included which objects take part in numbering.
     * @return number of numbered sets.
     */
    public int reindexToSequentialLabels(int[] result, boolean[] included) {
        if (result.length < count || included.length < count) {
            throw new IllegalArgumentException("Too short arrays for " + count + " objects");
        }
        resolveAllBases();
        final int[] labelOfBase = new int[count];
        // - zero-filled by Java
        int numberOfLabels = 0;
        for (int i = 0; i < count; i++) {
            if (!included[i]) {
                result[i] = 0;
                continue;
            }
            final int base = parent[i];
            if (labelOfBase[base] == 0) {
                labelOfBase[base] = ++numberOfLabels;
            }
            result[i] = labelOfBase[base];
        }
        return numberOfLabels;
    }

    private void ensureCapacity(final long newNumberOfObjects) {
        if (newNumberOfObjects > MAX_NUMBER_OF_OBJECTS) {
            throw new TooLargeArrayException("Too large array required");
        }
        assert newNumberOfObjects == (int) newNumberOfObjects;
        final int oldNumberOfObjects = parent.length;
        if (newNumberOfObjects > oldNumberOfObjects) {
            final int newLength = Math.max(16, Math.max((int) newNumberOfObjects,
                    (int) Math.min(MAX_NUMBER_OF_OBJECTS, (long) (2.0 * oldNumberOfObjects))));
            parent = Arrays.copyOf(parent, newLength);
            cardinalities = Arrays.copyOf(cardinalities, newLength);
            for (int k = oldNumberOfObjects; k < parent.length; k++) {
                parent[k] = k;
                cardinalities[k] = 1;
            }
        }
    }
}
