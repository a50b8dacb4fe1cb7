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

package net.algart.nesting.layers;

import net.algart.nesting.ContainmentInvariantException;
import net.algart.nesting.graph.GroupAdjacencyGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Minimal separation degree (depth) of every label of {@link GroupAdjacencyGraph}:
 * the least number of other regions, which must be crossed to reach the exterior.
 *
 * <p>Multi-source breadth-first search, processed strictly layer by layer: the frontier of depth 0
 * consists of all labels touching the exterior; all labels of depth <i>d</i>+1 are finalized before their
 * parents are collected. The parents of a label are <b>all</b> its neighbours with depth less by 1,
 * stored in increasing order; so the result is a layered DAG, not a spanning tree.
 *
 * <p>This class is immutable.
 */
public final class SeparationLayering {
    private static final System.Logger LOG = System.getLogger(SeparationLayering.class.getName());
    private static final boolean LOGGABLE_TRACE = LOG.isLoggable(System.Logger.Level.TRACE);

    private static final int[] NO_PARENTS = new int[0];
    private static final int UNREACHED = -1;

    private final GroupAdjacencyGraph graph;
    private final int n;
    private final int[] depths;
    private final int[][] parents;
    private final List<int[]> layers;

    private SeparationLayering(GroupAdjacencyGraph graph) {
        this.graph = Objects.requireNonNull(graph, "Null graph");
        this.n = graph.numberOfLabels();
        this.depths = new int[n + 1];
        this.parents = new int[n + 1][];
        this.layers = new ArrayList<>();
        findDepths();
    }

    public static SeparationLayering newInstance(GroupAdjacencyGraph graph) {
        return new SeparationLayering(graph);
    }

    public GroupAdjacencyGraph graph() {
        return graph;
    }

    public int numberOfLabels() {
        return n;
    }

    public int depth(int label) {
        graph.checkLabel(label);
        return depths[label];
    }

    public int[] parents(int label) {
        graph.checkLabel(label);
        return parents[label].clone();
    }

    public int numberOfParents(int label) {
        graph.checkLabel(label);
        return parents[label].length;
    }

    /**
     * Returns the maximal depth or &minus;1 if there are no labels.
     *
     * @return maximal depth.
     */
    public int maxDepth() {
        return layers.size() - 1;
    }

    public int[] labelsAtDepth(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Negative depth " + depth);
        }
        return depth < layers.size() ? layers.get(depth).clone() : NO_PARENTS.clone();
    }

    public List<int[]> layers() {
        final List<int[]> result = new ArrayList<>(layers.size());
        for (int[] layer : layers) {
            result.add(layer.clone());
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "separation layering of " + n + " labels, " + layers.size() + " layers";
    }

    private void findDepths() {
        long t1 = System.nanoTime();
        Arrays.fill(depths, UNREACHED);
        int[] frontier = graph.exteriorLabels();
        for (int label : frontier) {
            depths[label] = 0;
            parents[label] = NO_PARENTS;
        }
        final int[] buffer = new int[n];
        int depth = 0;
        while (frontier.length > 0) {
            layers.add(frontier);
            final int nextDepth = depth + 1;
            int count = 0;
            for (int label : frontier) {
                for (int i = 0, m = graph.numberOfNeighbours(label); i < m; i++) {
                    final int neighbour = graph.neighbour(label, i);
                    if (depths[neighbour] == UNREACHED) {
                        depths[neighbour] = nextDepth;
                        buffer[count++] = neighbour;
                    }
                }
            }
            final int[] next = Arrays.copyOf(buffer, count);
            Arrays.sort(next);
            // - all labels of the next layer are finalized before collecting parents
            for (int label : next) {
                parents[label] = collectParents(label, depth);
                assert parents[label].length > 0 : "label " + label + " was discovered without parents";
            }
            if (LOGGABLE_TRACE && next.length > 0) {
                final int[] layer = next;
                LOG.log(System.Logger.Level.TRACE, () -> String.format(Locale.US,
                        "  depth %d: %d labels %s", nextDepth, layer.length,
                        layer.length <= 32 ? Arrays.toString(layer) : "..."));
            }
            frontier = next;
            depth = nextDepth;
        }
        for (int label = 1; label <= n; label++) {
            if (depths[label] == UNREACHED) {
                throw ContainmentInvariantException.unreachedLabel(label);
            }
        }
        long t2 = System.nanoTime();
        LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                "Layering %d labels: %d layers (%d at depth 0); %.3f ms",
                n, layers.size(), layers.isEmpty() ? 0 : layers.get(0).length, (t2 - t1) * 1e-6));
    }

    private int[] collectParents(int label, int parentDepth) {
        int count = 0;
        final int m = graph.numberOfNeighbours(label);
        final int[] result = new int[m];
        for (int i = 0; i < m; i++) {
            final int neighbour = graph.neighbour(label, i);
            if (depths[neighbour] == parentDepth) {
                result[count++] = neighbour;
            }
        }
        return Arrays.copyOf(result, count);
    }
}
