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

/**
 * Thrown when the containment layering or its materialization finds a violated invariant:
 * a label unreachable from the exterior, or a containment edge that does not increase the depth by 1.
 * It signals a defect of the graph, not an illegal input array; the computation is deterministic,
 * so repeating it will fail in the same way.
 */
public class ContainmentInvariantException extends IllegalStateException {
    private static final long serialVersionUID = -2754177930158102271L;

    public static final int NO_LABEL = -1;

    private final int label;
    private final int parentLabel;

    private ContainmentInvariantException(String message, int label, int parentLabel) {
        super(message);
        this.label = label;
        this.parentLabel = parentLabel;
    }

    public static ContainmentInvariantException unreachedLabel(int label) {
        return new ContainmentInvariantException("Label " + label
                + " is not reachable from the labels touching the exterior", label, NO_LABEL);
    }

    public static ContainmentInvariantException illegalEdge(
            int parentLabel,
            int parentDepth,
            int childLabel,
            int childDepth) {
        return new ContainmentInvariantException("Containment edge " + parentLabel + " -> " + childLabel
                + " does not increase depth by 1: depth " + parentDepth + " -> " + childDepth,
                childLabel, parentLabel);
    }

    public static ContainmentInvariantException notAdjacent(int parentLabel, int childLabel) {
        return new ContainmentInvariantException("Containment edge " + parentLabel + " -> " + childLabel
                + " connects labels, which are not adjacent", childLabel, parentLabel);
    }

    /**
     * Returns the offending label: the unreached label or the child of the offending edge.
     *
     * @return offending label or {@link #NO_LABEL}.
     */
    public int label() {
        return label;
    }

    /**
     * Returns the parent of the offending edge or {@link #NO_LABEL} if the problem is not an edge.
     *
     * @return parent label or {@link #NO_LABEL}.
     */
    public int parentLabel() {
        return parentLabel;
    }

    public boolean isEdgeViolation() {
        return parentLabel != NO_LABEL;
    }
}
