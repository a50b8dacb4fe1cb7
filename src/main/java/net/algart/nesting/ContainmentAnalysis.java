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

package net.algart.nesting;

import net.algart.arrays.IntArray;
import net.algart.arrays.Matrix;
import net.algart.nesting.graph.GroupAdjacencyGraph;
import net.algart.nesting.labels.LabelledRegions;
import net.algart.nesting.layers.SeparationLayering;
import net.algart.nesting.trees.ContainmentForest;
import net.algart.nesting.trees.ContainmentNode;
import net.algart.nesting.trees.ContainmentTree;

import java.util.Objects;

/**
 * All results of {@link ContainmentAnalyser}: labelled regions, their adjacency graph,
 * depths and both forms of the containment DAG. Immutable.
 */
public final class ContainmentAnalysis {
    private final LabelledRegions regions;
    private final GroupAdjacencyGraph graph;
    private final SeparationLayering layering;
    private final ContainmentTree implicitTree;
    private final ContainmentForest explicitTree;

    ContainmentAnalysis(
            LabelledRegions regions,
            GroupAdjacencyGraph graph,
            SeparationLayering layering,
            ContainmentTree implicitTree,
            ContainmentForest explicitTree) {
        this.regions = Objects.requireNonNull(regions);
        this.graph = Objects.requireNonNull(graph);
        this.layering = Objects.requireNonNull(layering);
        this.implicitTree = Objects.requireNonNull(implicitTree);
        this.explicitTree = Objects.requireNonNull(explicitTree);
    }

    public LabelledRegions regions() {
        return regions;
    }

    public Matrix<? extends IntArray> labels() {
        return regions.labels();
    }

    public int numberOfLabels() {
        return regions.numberOfLabels();
    }

    public GroupAdjacencyGraph graph() {
        return graph;
    }

    public SeparationLayering layering() {
        return layering;
    }

    public ContainmentTree implicitTree() {
        return implicitTree;
    }

    public ContainmentForest explicitTree() {
        return explicitTree;
    }

    public int depth(int label) {
        return implicitTree.depth(label);
    }

    public int[] parents(int label) {
        return implicitTree.parents(label);
    }

    public int[] children(int label) {
        return implicitTree.children(label);
    }

    public ContainmentNode node(int label) {
        return explicitTree.node(label);
    }

    public int value(int label) {
        return regions.value(label);
    }

    @Override
    public String toString() {
        return "containment analysis of " + regions + ": " + implicitTree;
    }
}
