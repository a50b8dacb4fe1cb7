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

package net.algart.nesting.trees;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Implicit form of the containment DAG: depth, parents and children of every label
 * <code>1..{@link #numberOfLabels()}</code>. Parents and children are stored in increasing order.
 *
 * <p>This class is immutable. Use {@link TreeMaterializer} to create it.
 */
public final class ContainmentTree {
    private final int numberOfLabels;
    private final int[] depths;
    private final int[][] parents;
    private final int[][] children;
    private final int[] roots;
    private final int maxDepth;

    ContainmentTree(int[] depths, int[][] parents, int[][] children) {
        assert depths.length == parents.length && depths.length == children.length;
        this.numberOfLabels = depths.length - 1;
        this.depths = depths;
        this.parents = parents;
        this.children = children;
        int rootCount = 0;
        int max = -1;
        for (int label = 1; label <= numberOfLabels; label++) {
            if (depths[label] == 0) {
                rootCount++;
            }
            max = Math.max(max, depths[label]);
        }
        this.roots = new int[rootCount];
        for (int label = 1, k = 0; label <= numberOfLabels; label++) {
            if (depths[label] == 0) {
                roots[k++] = label;
            }
        }
        this.maxDepth = max;
    }

    public int numberOfLabels() {
        return numberOfLabels;
    }

    public int depth(int label) {
        checkLabel(label);
        return depths[label];
    }

    public int[] parents(int label) {
        checkLabel(label);
        return parents[label].clone();
    }

    public int[] children(int label) {
        checkLabel(label);
        return children[label].clone();
    }

    int[] childrenArray(int label) {
        return children[label];
    }

    public int numberOfChildren(int label) {
        checkLabel(label);
        return children[label].length;
    }

    /**
     * Returns all labels of depth 0 (touching the exterior) in increasing order:
     * the top level of the containment DAG.
     *
     * @return depth-0 labels.
     */
    public int[] roots() {
        return roots.clone();
    }

    /**
     * Returns the maximal depth or &minus;1 if there are no labels.
     *
     * @return maximal depth.
     */
    public int maxDepth() {
        return maxDepth;
    }

    public int[] labelsAtDepth(int depth) {
        int count = 0;
        for (int label = 1; label <= numberOfLabels; label++) {
            if (depths[label] == depth) {
                count++;
            }
        }
        final int[] result = new int[count];
        for (int label = 1, k = 0; label <= numberOfLabels; label++) {
            if (depths[label] == depth) {
                result[k++] = label;
            }
        }
        return result;
    }

    public int numberOfEdges() {
        int count = 0;
        for (int label = 1; label <= numberOfLabels; label++) {
            count += children[label].length;
        }
        return count;
    }

    /**
     * Returns the mapping <i>label</i>&nbsp;&rarr;&nbsp;<i>children</i> for all labels, including leaves
     * (with empty lists).
     *
     * @return unmodifiable children mapping.
     */
    public SortedMap<Integer, List<Integer>> childrenMap() {
        final SortedMap<Integer, List<Integer>> result = new TreeMap<>();
        for (int label = 1; label <= numberOfLabels; label++) {
            final List<Integer> list = new ArrayList<>(children[label].length);
            for (int child : children[label]) {
                list.add(child);
            }
            result.put(label, Collections.unmodifiableList(list));
        }
        return Collections.unmodifiableSortedMap(result);
    }

    @Override
    public String toString() {
        return "containment tree: " + numberOfLabels + " labels, " + roots.length + " roots, max depth " + maxDepth;
    }

    private void checkLabel(int label) {
        if (label <= 0 || label > numberOfLabels) {
            throw new IndexOutOfBoundsException("Label " + label + " is out of range 1.." + numberOfLabels);
        }
    }
}
