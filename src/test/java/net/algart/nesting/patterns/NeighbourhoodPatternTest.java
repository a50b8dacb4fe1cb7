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

import net.algart.arrays.Arrays;
import net.algart.arrays.Matrix;
import net.algart.arrays.UpdatableBitArray;
import net.algart.math.IPoint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NeighbourhoodPatternTest {
    @Test
    void straight2D_containsOnlyFaceNeighbours() {
        NeighbourhoodPattern pattern = NeighbourhoodPattern.newStraight(2);

        assertThat(pattern.dimCount()).isEqualTo(2);
        assertThat(pattern.dimensions()).containsExactly(3, 3);
        assertThat(pattern.numberOfOffsets()).isEqualTo(4);
        assertThat(pattern.contains(1, 0)).isTrue();
        assertThat(pattern.contains(0, -1)).isTrue();
        assertThat(pattern.contains(1, 1)).isFalse();
        assertThat(pattern.contains(0, 0)).isFalse();
        assertThat(pattern.contains(2, 0)).isFalse();
        assertThat(pattern.isCentrosymmetric()).isTrue();
    }

    @Test
    void straightAndDiagonal3D_contains26Neighbours() {
        NeighbourhoodPattern pattern = NeighbourhoodPattern.newStraightAndDiagonal(3);

        assertThat(pattern.numberOfOffsets()).isEqualTo(26);
        assertThat(pattern.contains(-1, 1, -1)).isTrue();
        assertThat(pattern.offsets()).doesNotContain(IPoint.valueOf(0, 0, 0));
    }

    @Test
    void maskElementsFollowCoordinateZeroFastest() {
        boolean[] mask = new boolean[9];
        mask[5] = true;
        // - x = 2, y = 1: offset (1, 0)
        NeighbourhoodPattern pattern = NeighbourhoodPattern.of(mask, 3, 3);

        assertThat(pattern.offsets()).containsExactly(IPoint.valueOf(1, 0));
        assertThat(pattern.offsetCoordinates()[0]).containsExactly(1, 0);
    }

    @Test
    void evenExtent_isRejected() {
        assertThatThrownBy(() -> NeighbourhoodPattern.of(new boolean[6], 3, 2))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("even extent")
                .satisfies(e -> assertThat(((InvalidPatternException) e).patternDimensions())
                        .containsExactly(3, 2));
    }

    @Test
    void maskWithOnlyOrigin_isEmpty() {
        boolean[] mask = new boolean[9];
        mask[4] = true;
        assertThatThrownBy(() -> NeighbourhoodPattern.of(mask, 3, 3))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("Empty pattern");
        assertThatThrownBy(() -> NeighbourhoodPattern.ofOffsets(List.of(IPoint.valueOf(0, 0))))
                .isInstanceOf(InvalidPatternException.class);
    }

    @Test
    void maskLengthMismatch_isIllegalArgument() {
        assertThatThrownBy(() -> NeighbourhoodPattern.of(new boolean[8], 3, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .isNotInstanceOf(InvalidPatternException.class);
    }

    @Test
    void ofOffsets_buildsMinimalWindow() {
        NeighbourhoodPattern pattern = NeighbourhoodPattern.ofOffsets(List.of(
                IPoint.valueOf(2, 0), IPoint.valueOf(0, 1)));

        assertThat(pattern.dimensions()).containsExactly(5, 3);
        assertThat(pattern.radius(0)).isEqualTo(2);
        assertThat(pattern.radius(1)).isEqualTo(1);
        assertThat(pattern.numberOfOffsets()).isEqualTo(2);
        assertThat(pattern.contains(IPoint.valueOf(2, 0))).isTrue();
        assertThat(pattern.contains(IPoint.valueOf(-2, 0))).isFalse();
    }

    @Test
    void asymmetricPattern_hasSymmetricClosure() {
        NeighbourhoodPattern pattern = NeighbourhoodPattern.ofOffsets(List.of(IPoint.valueOf(1, 0)));

        assertThat(pattern.isCentrosymmetric()).isFalse();
        assertThat(pattern.firstAsymmetricOffset()).isEqualTo(IPoint.valueOf(-1, 0));
        NeighbourhoodPattern closure = pattern.symmetricClosure();
        assertThat(closure.isCentrosymmetric()).isTrue();
        assertThat(closure.offsets()).containsExactlyInAnyOrder(IPoint.valueOf(1, 0), IPoint.valueOf(-1, 0));
        NeighbourhoodPattern straight = NeighbourhoodPattern.newStraight(2);
        assertThat(straight.symmetricClosure()).isSameAs(straight);
    }

    @Test
    void valueOfBitMatrix_readsMask() {
        Matrix<UpdatableBitArray> bits = Arrays.SMM.newBitMatrix(3, 1);
        bits.array().setBit(0);
        NeighbourhoodPattern pattern = NeighbourhoodPattern.valueOf(bits);

        assertThat(pattern.offsets()).containsExactly(IPoint.valueOf(-1, 0));
    }

    @Test
    void equalMasks_areEqualPatterns() {
        boolean[] mask = {true, false, true};
        assertThat(NeighbourhoodPattern.of(mask, 3))
                .isEqualTo(NeighbourhoodPattern.newStraight(1))
                .hasSameHashCodeAs(NeighbourhoodPattern.newStraightAndDiagonal(1));
    }
}
