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
 * Explicit form of the containment DAG: nested {@link ContainmentNode} structures,
 * starting from the depth-0 labels. Every label is materialized exactly once.
 */
public final class ContainmentForest {
    private final List<ContainmentNode> roots;
    private final ContainmentNode[] nodes;

    ContainmentForest(List<ContainmentNode> roots, ContainmentNode[] nodes) {
        this.roots = Collections.unmodifiableList(roots);
        this.nodes = nodes;
    }

    public List<ContainmentNode> roots() {
        return roots;
    }

    public int numberOfNodes() {
        return nodes.length - 1;
    }

    /**
     * Returns the only node of the given label; it is the same object, that is contained
     * in the children lists of all parents of this label.
     *
     * @param label region label.
     * @return its node.
     */
    public ContainmentNode node(int label) {
        if (label <= 0 || label >= nodes.length) {
            throw new IndexOutOfBoundsException("Label " + label + " is out of range 1.." + (nodes.length - 1));
        }
        return nodes[label];
    }

    /**
     * Collects parent&nbsp;&rarr;&nbsp;children edges of the nested structure by walking it from the roots.
     * The result has the same form as {@link ContainmentTree#childrenMap()}.
     *
     * @return unmodifiable children mapping.
     */
    public SortedMap<Integer, List<Integer>> flatten() {
        final SortedMap<Integer, List<Integer>> result = new TreeMap<>();
        final List<ContainmentNode> stack = new ArrayList<>(roots);
        while (!stack.isEmpty()) {
            final ContainmentNode node = stack.remove(stack.size() - 1);
            if (result.containsKey(node.label())) {
                continue;
            }
            final List<Integer> children = new ArrayList<>(node.children().size());
            for (ContainmentNode child : node.children()) {
                children.add(child.label());
                stack.add(child);
            }
            result.put(node.label(), Collections.unmodifiableList(children));
        }
        return Collections.unmodifiableSortedMap(result);
    }

    @Override
    public String toString() {
        return "containment forest: " + roots.size() + " roots, " + numberOfNodes() + " nodes";
    }
}
