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

import net.algart.arrays.Matrix;
import net.algart.arrays.PFixedArray;
import net.algart.nesting.graph.GroupAdjacencyGraph;
import net.algart.nesting.graph.GroupGraphBuilder;
import net.algart.nesting.labels.LabelledRegions;
import net.algart.nesting.labels.RegionLabeler;
import net.algart.nesting.layers.SeparationLayering;
import net.algart.nesting.patterns.PatternRegistry;
import net.algart.nesting.trees.ContainmentForest;
import net.algart.nesting.trees.ContainmentTree;
import net.algart.nesting.trees.TreeMaterializer;

import java.util.Locale;
import java.util.Objects;

/**
 * Full pipeline: labeling of connected regions, group adjacency graph, separation layering
 * and materialization of the containment DAG.
 *
 * <p>Typical usage:
 * <pre>
 * ContainmentAnalysis analysis = ContainmentAnalyser.newInstance()
 *         .setPatterns(PatternRegistry.newStraight(2))
 *         .setBackgroundValues(0)
 *         .analyse(matrix);
 * </pre>
 *
 * <p>This object only stores options; every call of <code>analyse</code> works with a snapshot of them
 * and does not share any mutable data with other calls.
 */
public final class ContainmentAnalyser {
    private static final System.Logger LOG = System.getLogger(ContainmentAnalyser.class.getName());

    public enum BackgroundPolicy {
        /**
         * Background cells are not labeled; labels in contact with them touch the exterior.
         */
        TRANSPARENT,
        /**
         * Background values are labeled and layered as all other values; the background set is ignored.
         */
        LABELED
    }

    private PatternRegistry patterns = null;
    private int[] backgroundValues = new int[0];
    private BackgroundPolicy backgroundPolicy = BackgroundPolicy.TRANSPARENT;

    private ContainmentAnalyser() {
    }

    public static ContainmentAnalyser newInstance() {
        return new ContainmentAnalyser();
    }

    public PatternRegistry getPatterns() {
        return patterns == null ? null : patterns.clone();
    }

    /**
     * Sets the registry of patterns. If it is <code>null</code> (default), every array is labeled
     * with {@link PatternRegistry#newStraight(int) straight} neighbourhood of its dimension count.
     *
     * @param patterns pattern registry; may be <code>null</code>.
     * @return a reference to this object.
     */
    public ContainmentAnalyser setPatterns(PatternRegistry patterns) {
        this.patterns = patterns == null ? null : patterns.clone();
        return this;
    }

    public int[] getBackgroundValues() {
        return backgroundValues.clone();
    }

    public ContainmentAnalyser setBackgroundValues(int... backgroundValues) {
        Objects.requireNonNull(backgroundValues, "Null background values");
        this.backgroundValues = backgroundValues.clone();
        return this;
    }

    public BackgroundPolicy getBackgroundPolicy() {
        return backgroundPolicy;
    }

    public ContainmentAnalyser setBackgroundPolicy(BackgroundPolicy backgroundPolicy) {
        this.backgroundPolicy = Objects.requireNonNull(backgroundPolicy, "Null background policy");
        return this;
    }

    public ContainmentAnalysis analyse(Matrix<? extends PFixedArray> matrix) {
        Objects.requireNonNull(matrix, "Null matrix");
        final RegionLabeler labeler = newLabeler(matrix.dimCount());
        long t1 = System.nanoTime();
        final LabelledRegions regions = labeler.label(matrix);
        return analyse(regions, t1);
    }

    public ContainmentAnalysis analyse(int[] values, long... dimensions) {
        Objects.requireNonNull(values, "Null values");
        Objects.requireNonNull(dimensions, "Null dimensions");
        final RegionLabeler labeler = newLabeler(dimensions.length);
        long t1 = System.nanoTime();
        final LabelledRegions regions = labeler.label(values, dimensions);
        return analyse(regions, t1);
    }

    public RegionLabeler newLabeler(int dimCount) {
        final PatternRegistry patterns = this.patterns != null ? this.patterns : PatternRegistry.newStraight(dimCount);
        return RegionLabeler.newInstance(patterns,
                backgroundPolicy == BackgroundPolicy.TRANSPARENT ? backgroundValues : new int[0]);
    }

    @Override
    public String toString() {
        return "containment analyser (" + (patterns == null ? "straight neighbourhood" : patterns)
                + ", " + backgroundValues.length + " background values, " + backgroundPolicy + ")";
    }

    private static ContainmentAnalysis analyse(LabelledRegions regions, long t1) {
        long t2 = System.nanoTime();
        final GroupAdjacencyGraph graph = GroupGraphBuilder.build(regions);
        long t3 = System.nanoTime();
        final SeparationLayering layering = SeparationLayering.newInstance(graph);
        long t4 = System.nanoTime();
        final ContainmentTree implicitTree = TreeMaterializer.implicitTree(layering);
        final ContainmentForest explicitTree = TreeMaterializer.explicitTree(implicitTree);
        long t5 = System.nanoTime();
        LOG.log(System.Logger.Level.DEBUG, () -> String.format(Locale.US,
                "Containment analysis of %s: %.3f ms = "
                        + "%.3f ms labeling + %.3f ms graph + %.3f ms layering + %.3f ms materializing",
                regions,
                (t5 - t1) * 1e-6,
                (t2 - t1) * 1e-6,
                (t3 - t2) * 1e-6,
                (t4 - t3) * 1e-6,
                (t5 - t4) * 1e-6));
        return new ContainmentAnalysis(regions, graph, layering, implicitTree, explicitTree);
    }
}
