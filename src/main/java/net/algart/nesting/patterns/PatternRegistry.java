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

import net.algart.math.IPoint;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Resolves the neighbourhood pattern for every cell value: a default pattern plus optional
 * per-value overrides. A registry without overrides is the single-pattern mode.
 *
 * <p>All patterns of one registry have the same number of dimensions.
 * This class is not thread-safe; {@link #clone()} it to get a stable snapshot.
 */
public final class PatternRegistry implements Cloneable {
    private NeighbourhoodPattern defaultPattern;
    private TreeMap<Integer, NeighbourhoodPattern> overrides = new TreeMap<>();
    private boolean requireCentrosymmetric = false;

    private PatternRegistry(NeighbourhoodPattern defaultPattern) {
        this.defaultPattern = Objects.requireNonNull(defaultPattern, "Null default pattern");
    }

    public static PatternRegistry newInstance(NeighbourhoodPattern defaultPattern) {
        return new PatternRegistry(defaultPattern);
    }

    public static PatternRegistry newStraight(int dimCount) {
        return new PatternRegistry(NeighbourhoodPattern.newStraight(dimCount));
    }

    public static PatternRegistry newStraightAndDiagonal(int dimCount) {
        return new PatternRegistry(NeighbourhoodPattern.newStraightAndDiagonal(dimCount));
    }

    public NeighbourhoodPattern getDefaultPattern() {
        return defaultPattern;
    }

    public PatternRegistry setDefaultPattern(NeighbourhoodPattern defaultPattern) {
        Objects.requireNonNull(defaultPattern, "Null default pattern");
        checkSameDimCount(defaultPattern, null, true);
        this.defaultPattern = defaultPattern;
        return this;
    }

    public PatternRegistry setPattern(int value, NeighbourhoodPattern pattern) {
        Objects.requireNonNull(pattern, "Null pattern for value " + value);
        checkSameDimCount(pattern, value, false);
        overrides.put(value, pattern);
        return this;
    }

    public PatternRegistry removePattern(int value) {
        overrides.remove(value);
        return this;
    }

    public boolean isRequireCentrosymmetric() {
        return requireCentrosymmetric;
    }

    /**
     * Requires all patterns to be centrosymmetric. If set, {@link #checkPatterns(int)} rejects
     * any pattern containing an offset <i>o</i> without &minus;<i>o</i>.
     * By default, asymmetric patterns are allowed: two cells are adjacent when the offset between them
     * belongs to the pattern of either cell.
     *
     * @param requireCentrosymmetric whether asymmetric patterns must be rejected.
     * @return a reference to this object.
     */
    public PatternRegistry setRequireCentrosymmetric(boolean requireCentrosymmetric) {
        this.requireCentrosymmetric = requireCentrosymmetric;
        return this;
    }

    public boolean hasOverrides() {
        return !overrides.isEmpty();
    }

    public Map<Integer, NeighbourhoodPattern> overrides() {
        return Collections.unmodifiableMap(overrides);
    }

    public int dimCount() {
        return defaultPattern.dimCount();
    }

    public NeighbourhoodPattern patternFor(int value) {
        final NeighbourhoodPattern result = overrides.get(value);
        return result != null ? result : defaultPattern;
    }

    /**
     * Checks that all patterns are suitable for labeling an array with the given number of dimensions.
     *
     * @param arrayDimCount number of dimensions of the labeled array.
     * @throws InvalidPatternException if some pattern has another number of dimensions or,
     *                                 when {@link #isRequireCentrosymmetric()}, is not centrosymmetric.
     */
    public void checkPatterns(int arrayDimCount) {
        checkPattern(defaultPattern, null, arrayDimCount);
        for (Map.Entry<Integer, NeighbourhoodPattern> entry : overrides.entrySet()) {
            checkPattern(entry.getValue(), entry.getKey(), arrayDimCount);
        }
    }

    @Override
    public PatternRegistry clone() {
        try {
            final PatternRegistry result = (PatternRegistry) super.clone();
            result.overrides = new TreeMap<>(overrides);
            return result;
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
    }

    @Override
    public String toString() {
        return "pattern registry: default " + defaultPattern
                + (overrides.isEmpty() ? "" : ", " + overrides.size() + " per-value patterns " + overrides.keySet())
                + (requireCentrosymmetric ? ", centrosymmetric only" : "");
    }

    private void checkPattern(NeighbourhoodPattern pattern, Integer value, int arrayDimCount) {
        if (pattern.dimCount() != arrayDimCount) {
            throw new InvalidPatternException(pattern.dimCount() + "-dimensional pattern cannot be used for "
                    + arrayDimCount + "-dimensional array", pattern.dimensions(), value);
        }
        if (requireCentrosymmetric) {
            final IPoint asymmetric = pattern.firstAsymmetricOffset();
            if (asymmetric != null) {
                throw new InvalidPatternException("Pattern is not centrosymmetric: it "
                        + (pattern.contains(asymmetric) ? "contains " : "does not contain ") + asymmetric
                        + ", but " + (pattern.contains(asymmetric) ? "does not contain " : "contains ")
                        + asymmetric.symmetric(), pattern.dimensions(), value);
            }
        }
    }

    private void checkSameDimCount(NeighbourhoodPattern pattern, Integer value, boolean replacingDefault) {
        if (!replacingDefault && pattern.dimCount() != defaultPattern.dimCount()) {
            throw new InvalidPatternException("Pattern has " + pattern.dimCount()
                    + " dimensions, but other patterns in the registry have " + defaultPattern.dimCount(),
                    pattern.dimensions(), value);
        }
        for (Map.Entry<Integer, NeighbourhoodPattern> entry : overrides.entrySet()) {
            if (entry.getValue().dimCount() != pattern.dimCount() && !Objects.equals(entry.getKey(), value)) {
                throw new InvalidPatternException("Pattern has " + pattern.dimCount()
                        + " dimensions, but the pattern for value " + entry.getKey() + " has "
                        + entry.getValue().dimCount(), pattern.dimensions(), value);
            }
        }
    }
}
