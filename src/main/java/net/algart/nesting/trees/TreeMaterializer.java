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

import net.algart.nesting.ContainmentInvariantException;
import net.algart.nesting.graph.GroupAdjacencyGraph;
import net.algart.nesting.layers.SeparationLayering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders the containment DAG in two forms: implicit {@link ContainmentTree} (flat children mapping)
 * and explicit {@link ContainmentForest} (nested nodes with shared sub-structures).
 *
 * <p>Before materializing, every edge <i>parent</i>&nbsp;&rarr;&nbsp;<i>child</i> is checked:
 * depth must increase exactly by 1, and, if the adjacency graph is known, the labels must be adjacent.
 * Violation leads to {@link ContainmentInvariantException}.
 */
public final class TreeMaterializer {
    private static final System.Logger LOG = System.getLogger(TreeMaterializer.class.getName());

    private TreeMaterializer() {
    }

    public static ContainmentTree implicitTree(SeparationLayering layering) {
        Objects.requireNonNull(layering, "Null layering");
        final int n = layering.numberOfLabels();
        final int[] depths = new int[n + 1];
        final int[][] parents = new int[n + 1][];
        parents[0] = new int[0];
        for (int label = 1; label <= n; label++) {
            depths[label] = layering.depth(label);
            parents[label] = layering.parents(label);
        }
        return implicitTree(depths, parents, layering.graph());
    }

    /**
     * Builds the implicit tree from depth and parents, indexed by labels <code>1..depths.length-1</code>
     * (elements #0 are ignored).
     *
     * @param depths  depth of every label.
     * @param parents parents of every label.
     * @return implicit tree.
     * @throws ContainmentInvariantException if some edge does not increase depth by 1 or some label of
     *                                       non-zero depth has no parents.
     */
    public static ContainmentTree implicitTree(int[] depths, int[][] parents) {
        return implicitTree(depths, parents, null);
    }

    /**
     * Builds the explicit nested structure. Expansion goes depth-first from every root
     * in increasing label order, children in increasing label order; the node of a label met again
     * as a child of another parent is reused from the memo instead of being built again.
     * An explicit stack is used instead of recursion, so deep nesting cannot overflow the thread stack.
     *
     * @param tree implicit tree.
     * @return explicit forest.
     */
    public static ContainmentForest explicitTree(ContainmentTree tree) {
        Objects.requireNonNull(tree, "Null tree");
        long t1 = System.nanoTime();
        final int n = tree.numberOfLabels();
        final ContainmentNode[] memo = new ContainmentNode[n + 1];
        final int[] stack = new int[Math.max(tree.maxDepth() + 1, 0)];
        final int[] cursors = new int[n + 1];
        int materialized = 0;
        final List<ContainmentNode> roots = new ArrayList<>();
        for (int root : tree.roots()) {
            if (memo[root] == null) {
                int top = 0;
                stack[0] = root;
                while (top >= 0) {
                    final int label = stack[top];
                    final int[] children = tree.childrenArray(label);
                    int cursor = cursors[label];
                    while (cursor < children.length && memo[children[cursor]] != null) {
                        cursor++;
                    }
                    cursors[label] = cursor;
                    if (cursor < children.length) {
                        stack[++top] = children[cursor];
                        // - depth of the child is greater, so the stack cannot overflow
                        continue;
                    }
                    final List<ContainmentNode> childNodes = new ArrayList<>(children.length);
                    for (int child : children) {
                        childNodes.add(memo[child]);
                    }
                    memo[label] = new ContainmentNode(label, tree.depth(label), tree.parents(label), childNodes);
                    materialized++;
                    top--;
                }
            }
            roots.add(memo[root]);
        }
        for (int label = 1; label <= n; label++) {
            if (memo[label] == null) {
                throw ContainmentInvariantException.unreachedLabel(label);
            }
        }
        assert materialized == n;
        final ContainmentForest result = new ContainmentForest(roots, memo);
        long t2 = System.nanoTime();
        LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                "Materializing %s: %.3f ms", result, (t2 - t1) * 1e-6));
        return result;
    }

    private static ContainmentTree implicitTree(int[] depths, int[][] parents, GroupAdjacencyGraph graph) {
        Objects.requireNonNull(depths, "Null depths");
        Objects.requireNonNull(parents, "Null parents");
        if (depths.length != parents.length) {
            throw new IllegalArgumentException("Different lengths of depths and parents arrays: "
                    + depths.length + " and " + parents.length);
        }
        if (depths.length == 0) {
            throw new IllegalArgumentException("Empty depths array: element #0 must exist");
        }
        final int n = depths.length - 1;
        final int[] numberOfChildren = new int[n + 1];
        final int[][] parentsCopy = new int[n + 1][];
        parentsCopy[0] = new int[0];
        for (int child = 1; child <= n; child++) {
            Objects.requireNonNull(parents[child], "Null parents of label " + child);
            if (depths[child] < 0) {
                throw ContainmentInvariantException.unreachedLabel(child);
            }
            if (depths[child] > 0 && parents[child].length == 0) {
                throw ContainmentInvariantException.unreachedLabel(child);
            }
            parentsCopy[child] = parents[child].clone();
            Arrays.sort(parentsCopy[child]);
            for (int k = 1; k < parentsCopy[child].length; k++) {
                if (parentsCopy[child][k] == parentsCopy[child][k - 1]) {
                    throw new IllegalArgumentException("Parent " + parentsCopy[child][k]
                            + " is repeated for label " + child);
                }
            }
            for (int parent : parentsCopy[child]) {
                if (parent <= 0 || parent > n) {
                    throw new IndexOutOfBoundsException("Parent " + parent + " of label " + child
                            + " is out of range 1.." + n);
                }
                if (depths[child] != depths[parent] + 1) {
                    throw ContainmentInvariantException.illegalEdge(parent, depths[parent], child, depths[child]);
                }
                if (graph != null && !graph.areAdjacent(parent, child)) {
                    throw ContainmentInvariantException.notAdjacent(parent, child);
                }
                numberOfChildren[parent]++;
            }
        }
        final int[][] children = new int[n + 1][];
        for (int label = 0; label <= n; label++) {
            children[label] = new int[numberOfChildren[label]];
        }
        final int[] indexes = new int[n + 1];
        for (int child = 1; child <= n; child++) {
            for (int parent : parentsCopy[child]) {
                children[parent][indexes[parent]++] = child;
                // - children are added in increasing order
            }
        }
        return new ContainmentTree(depths.clone(), parentsCopy, children);
    }
}
