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

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Undirected graph over region labels <code>1..{@link #numberOfLabels()}</code>
 * with a "touches exterior" flag for every label. Neighbours of every label are stored
 * in increasing order without repetitions.
 *
 * <p>This class is immutable.
 */
public final class GroupAdjacencyGraph {
    public static final class Edge {
        final int label1;
        final int label2;

        public Edge(int label1, int label2) {
            if (label1 <= 0) {
                throw new IllegalArgumentException("Zero or negative label1: " + label1);
            }
            if (label2 <= 0) {
                throw new IllegalArgumentException("Zero or negative label2: " + label2);
            }
            if (label1 == label2) {
                throw new IllegalArgumentException("Loops are not allowed: label " + label1);
            }
            this.label1 = label1;
            this.label2 = label2;
        }

        public int label1() {
            return label1;
        }

        public int label2() {
            return label2;
        }

        @Override
        public String toString() {
            return label1 + "-" + label2;
        }
    }

    private final int numberOfLabels;
    private final int[][] neighbours;
    private final BitSet exterior;
    private final int numberOfEdges;

    private GroupAdjacencyGraph(int numberOfLabels, Iterable<Edge> edges, BitSet exteriorLabels) {
        Objects.requireNonNull(edges, "Null edges");
        Objects.requireNonNull(exteriorLabels, "Null exterior labels");
        if (numberOfLabels < 0) {
            throw new IllegalArgumentException("Negative numberOfLabels");
        }
        this.numberOfLabels = numberOfLabels;
        if (exteriorLabels.get(0) || exteriorLabels.length() > numberOfLabels + 1) {
            throw new IllegalArgumentException("Exterior labels " + exteriorLabels
                    + " are out of range 1.." + numberOfLabels);
        }
        this.exterior = (BitSet) exteriorLabels.clone();
        final int[] degrees = new int[numberOfLabels + 1];
        // - zero-filled by Java
        for (Edge edge : edges) {
            checkLabel(edge.label1);
            checkLabel(edge.label2);
            degrees[edge.label1]++;
            degrees[edge.label2]++;
        }
        final int[][] all = new int[numberOfLabels + 1][];
        for (int k = 0; k <= numberOfLabels; k++) {
            all[k] = new int[degrees[k]];
        }
        final int[] indexes = new int[numberOfLabels + 1];
        for (Edge edge : edges) {
            all[edge.label1][indexes[edge.label1]++] = edge.label2;
            all[edge.label2][indexes[edge.label2]++] = edge.label1;
        }
        long count = 0;
        for (int k = 1; k <= numberOfLabels; k++) {
            all[k] = sortedUnique(all[k]);
            count += all[k].length;
        }
        assert count % 2 == 0;
        this.neighbours = all;
        this.numberOfEdges = (int) (count / 2);
    }

    public static GroupAdjacencyGraph newInstance(
            int numberOfLabels,
            Iterable<Edge> edges,
            BitSet exteriorLabels) {
        return new GroupAdjacencyGraph(numberOfLabels, edges, exteriorLabels);
    }

    public int numberOfLabels() {
        return numberOfLabels;
    }

    public int numberOfEdges() {
        return numberOfEdges;
    }

    public int numberOfNeighbours(int label) {
        checkLabel(label);
        return neighbours[label].length;
    }

    public int neighbour(int label, int neighbourIndex) {
        checkLabel(label);
        return neighbours[label][neighbourIndex];
    }

    public int[] neighbours(int label) {
        checkLabel(label);
        return neighbours[label].clone();
    }

    public boolean areAdjacent(int label1, int label2) {
        checkLabel(label1);
        checkLabel(label2);
        return Arrays.binarySearch(neighbours[label1], label2) >= 0;
    }

    public boolean touchesExterior(int label) {
        checkLabel(label);
        return exterior.get(label);
    }

    public int[] exteriorLabels() {
        return exterior.stream().toArray();
    }

    public int numberOfExteriorLabels() {
        return exterior.cardinality();
    }

    public void checkLabel(int label) {
        if (label <= 0 || label > numberOfLabels) {
            throw new IndexOutOfBoundsException("Label " + label + " is out of range 1.." + numberOfLabels);
        }
    }

    @Override
    public String toString() {
        return "group adjacency graph: " + numberOfLabels + " labels ("
                + exterior.cardinality() + " touching exterior), " + numberOfEdges + " edges";
    }

    private static int[] sortedUnique(int[] labels) {
        Arrays.sort(labels);
        int count = 0;
        for (int i = 0; i < labels.length; i++) {
            if (i == 0 || labels[i] != labels[i - 1]) {
                labels[count++] = labels[i];
            }
        }
        return count == labels.length ? labels : Arrays.copyOf(labels, count);
    }
}
