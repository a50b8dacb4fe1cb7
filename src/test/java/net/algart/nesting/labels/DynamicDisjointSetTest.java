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

package net.algart.nesting.labels;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DynamicDisjointSetTest {
    @Test
    void newInstance_hasSingletonSets() {
        DynamicDisjointSet set = DynamicDisjointSet.newInstance(5);

        assertThat(set.count()).isEqualTo(5);
        assertThat(set.parent()).containsExactly(0, 1, 2, 3, 4);
        assertThat(set.cardinality(3)).isEqualTo(1);
    }

    @Test
    void jointObjects_mergesSetsAndCountsCardinality() {
        DynamicDisjointSet set = DynamicDisjointSet.newInstance();
        set.jointObjects(0, 1);
        set.jointObjects(2, 3);
        set.jointObjects(3, 4);
        final int base = set.jointObjects(1, 4);

        assertThat(set.count()).isEqualTo(5);
        assertThat(set.findBase(0)).isEqualTo(base);
        assertThat(set.findBase(2)).isEqualTo(base);
        assertThat(set.cardinality(base)).isEqualTo(5);
        assertThat(set.jointObjects(0, 4)).isEqualTo(base);
    }

    @Test
    void cardinality_requiresBase() {
        DynamicDisjointSet set = DynamicDisjointSet.newInstance(3);
        final int base = set.jointObjects(0, 1);
        final int other = base == 0 ? 1 : 0;

        assertThatThrownBy(() -> set.cardinality(other)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reindex_numbersSetsInOrderOfFirstAppearance() {
        DynamicDisjointSet set = DynamicDisjointSet.newInstance(7);
        set.jointObjects(6, 1);
        set.jointObjects(5, 2);
        set.jointObjects(2, 4);
        final boolean[] included = {true, true, true, false, true, true, true};
        final int[] labels = new int[7];

        final int numberOfLabels = set.reindexToSequentialLabels(labels, included);

        assertThat(numberOfLabels).isEqualTo(3);
        assertThat(labels).containsExactly(1, 2, 3, 0, 3, 3, 2);
    }

    @Test
    void clear_removesAllObjects() {
        DynamicDisjointSet set = DynamicDisjointSet.newInstance(3);
        set.jointObjects(0, 2);
        set.clear();

        assertThat(set.count()).isZero();
        set.expand(1);
        assertThat(set.parent()).containsExactly(0, 1);
        assertThatThrownBy(() -> set.expand(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
