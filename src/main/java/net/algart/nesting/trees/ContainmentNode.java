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

import java.util.Collections;
import java.util.List;

/**
 * One label in the explicit containment structure. A label with several parents is represented
 * by a single node, referenced from the children lists of all its parents.
 * Nodes use identity equality.
 */
public final class ContainmentNode {
    private final int label;
    private final int depth;
    private final int[] parentLabels;
    private final List<ContainmentNode> children;

    ContainmentNode(int label, int depth, int[] parentLabels, List<ContainmentNode> children) {
        this.label = label;
        this.depth = depth;
        this.parentLabels = parentLabels;
        this.children = Collections.unmodifiableList(children);
    }

    public int label() {
        return label;
    }

    public int depth() {
        return depth;
    }

    public int[] parentLabels() {
        return parentLabels.clone();
    }

    public int numberOfParents() {
        return parentLabels.length;
    }

    public boolean isShared() {
        return parentLabels.length > 1;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public List<ContainmentNode> children() {
        return children;
    }

    @Override
    public String toString() {
        return "node " + label + " (depth " + depth + ", " + children.size() + " children"
                + (isShared() ? ", " + parentLabels.length + " parents" : "") + ")";
    }
}
