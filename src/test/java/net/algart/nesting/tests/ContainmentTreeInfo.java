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

package net.algart.nesting.tests;

import net.algart.nesting.ContainmentAnalyser;
import net.algart.nesting.ContainmentAnalysis;
import net.algart.nesting.patterns.PatternRegistry;
import net.algart.nesting.trees.ContainmentNode;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Deque;
import java.util.Locale;
import java.util.Random;

public class ContainmentTreeInfo {
    private static final int MAX_PRINTED_NODES = 200;

    public static void main(String[] args) {
        int startArgIndex = 0;
        boolean diagonal = false;
        if (args.length > startArgIndex && args[startArgIndex].equalsIgnoreCase("-diagonal")) {
            diagonal = true;
            startArgIndex++;
        }
        if (args.length < startArgIndex + 2) {
            System.out.println("Usage:");
            System.out.println("    " + ContainmentTreeInfo.class.getName()
                    + " [-diagonal] dimX dimY [numberOfSquares [seed]]");
            return;
        }
        final int dimX = Integer.parseInt(args[startArgIndex++]);
        final int dimY = Integer.parseInt(args[startArgIndex++]);
        final int numberOfSquares = args.length <= startArgIndex ? 10 : Integer.parseInt(args[startArgIndex]);
        final long seed = args.length <= ++startArgIndex ? 157 : Long.parseLong(args[startArgIndex]);

        final int[] values = nestedSquares(dimX, dimY, numberOfSquares, new Random(seed));
        if (dimX <= 64 && dimY <= 32) {
            for (int y = 0; y < dimY; y++) {
                final StringBuilder sb = new StringBuilder();
                for (int x = 0; x < dimX; x++) {
                    sb.append(values[y * dimX + x] == 0 ? '.' : (char) ('a' + (values[y * dimX + x] - 1) % 26));
                }
                System.out.println(sb);
            }
            System.out.println();
        }

        final ContainmentAnalyser analyser = ContainmentAnalyser.newInstance()
                .setPatterns(diagonal ? PatternRegistry.newStraightAndDiagonal(2) : PatternRegistry.newStraight(2))
                .setBackgroundValues(0);
        System.out.printf("Analysing %dx%d matrix by %s...%n", dimX, dimY, analyser);
        for (int test = 1; test <= 3; test++) {
            long t1 = System.nanoTime();
            final ContainmentAnalysis analysis = analyser.analyse(values, dimX, dimY);
            long t2 = System.nanoTime();
            System.out.printf(Locale.US, "Test #%d: %s in %.3f ms%n", test, analysis, (t2 - t1) * 1e-6);
            if (test == 1) {
                showTree(analysis);
            }
        }
    }

    private static void showTree(ContainmentAnalysis analysis) {
        final BitSet shown = new BitSet();
        final Deque<ContainmentNode> stack = new ArrayDeque<>();
        final var roots = analysis.explicitTree().roots();
        for (int k = roots.size() - 1; k >= 0; k--) {
            stack.push(roots.get(k));
        }
        int printed = 0;
        while (!stack.isEmpty() && printed < MAX_PRINTED_NODES) {
            final ContainmentNode node = stack.pop();
            final boolean again = shown.get(node.label());
            System.out.printf("%s%d (value %d, %d cells)%s%s%n",
                    "  ".repeat(node.depth()),
                    node.label(),
                    analysis.value(node.label()),
                    analysis.regions().cardinality(node.label()),
                    node.isShared() ? ", parents " + Arrays.toString(node.parentLabels()) : "",
                    again ? " [shown above]" : "");
            printed++;
            if (!again) {
                shown.set(node.label());
                for (int k = node.children().size() - 1; k >= 0; k--) {
                    stack.push(node.children().get(k));
                }
            }
        }
        if (!stack.isEmpty()) {
            System.out.println("...");
        }
        System.out.println();
    }

    // Random squares drawn one over another; every square gets its own value.
    private static int[] nestedSquares(int dimX, int dimY, int numberOfSquares, Random random) {
        final int[] result = new int[dimX * dimY];
        for (int k = 1; k <= numberOfSquares; k++) {
            final int size = 1 + random.nextInt(Math.max(1, Math.min(dimX, dimY) / 2));
            final int x0 = random.nextInt(Math.max(1, dimX - size + 1));
            final int y0 = random.nextInt(Math.max(1, dimY - size + 1));
            for (int y = y0; y < Math.min(dimY, y0 + size); y++) {
                Arrays.fill(result, y * dimX + x0, y * dimX + Math.min(dimX, x0 + size), k);
            }
        }
        return result;
    }
}
