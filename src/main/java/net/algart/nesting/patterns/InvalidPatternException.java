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

package net.algart.nesting.patterns;

import java.util.Arrays;

/**
 * Thrown when a neighbourhood pattern is malformed (even extent, empty mask, asymmetric while symmetry
 * is required) or does not match the dimension count of the array being labeled.
 * Always thrown before any labeling occurs.
 */
public class InvalidPatternException extends IllegalArgumentException {
    private static final long serialVersionUID = 6032844172015290115L;

    private final long[] patternDimensions;
    private final Integer cellValue;

    public InvalidPatternException(String message, long[] patternDimensions) {
        this(message, patternDimensions, null);
    }

    public InvalidPatternException(String message, long[] patternDimensions, Integer cellValue) {
        super(message
                + (patternDimensions == null ? "" : " (pattern " + dimensionsToString(patternDimensions) + ")")
                + (cellValue == null ? "" : " (pattern for value " + cellValue + ")"));
        this.patternDimensions = patternDimensions == null ? null : patternDimensions.clone();
        this.cellValue = cellValue;
    }

    /**
     * Returns the dimensions of the offending pattern or <code>null</code> if they are unknown.
     *
     * @return dimensions of the offending pattern.
     */
    public long[] patternDimensions() {
        return patternDimensions == null ? null : patternDimensions.clone();
    }

    /**
     * Returns the cell value, for which the offending pattern was registered, or <code>null</code>
     * for the default pattern.
     *
     * @return cell value or <code>null</code>.
     */
    public Integer cellValue() {
        return cellValue;
    }

    static String dimensionsToString(long[] dimensions) {
        final StringBuilder sb = new StringBuilder();
        for (int k = 0; k < dimensions.length; k++) {
            if (k > 0) {
                sb.append("x");
            }
            sb.append(dimensions[k]);
        }
        return dimensions.length == 0 ? Arrays.toString(dimensions) : sb.toString();
    }
}
