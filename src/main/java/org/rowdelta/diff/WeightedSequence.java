/*
 * Copyright 2026 The RowDelta Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rowdelta.diff;

/**
 * Finds a maximum-weight strictly increasing subsequence of integer keys, in
 * O(n log k) time using a binary indexed tree over the key range. Among
 * subsequences of equal weight, the one found first in sequence order wins,
 * so results are stable for equal inputs.
 *
 * @author RowDelta Authors
 */
class WeightedSequence {
    /**
     * @param keys distinct keys, each in the range [0, keyRange)
     * @param weights positive weight of each key
     * @param keyRange exclusive upper bound of keys
     * @return selection flags, parallel to keys
     */
    static boolean[] select(int[] keys, long[] weights, int keyRange) {
        int n = keys.length;
        boolean[] selected = new boolean[n];
        if (n == 0) {
            return selected;
        }

        // Tree nodes hold the best total ending at a key, and the element index.
        long[] treeBest = new long[keyRange + 1];
        int[] treeIndex = new int[keyRange + 1];
        for (int i=0; i<treeIndex.length; i++) {
            treeIndex[i] = -1;
        }

        long[] best = new long[n];
        int[] prev = new int[n];

        int bestEnd = -1;
        for (int i=0; i<n; i++) {
            int key = keys[i];
            if (key < 0 || key >= keyRange) {
                throw new IllegalArgumentException("Key out of range: " + key);
            }

            // Prefix maximum over keys strictly less than this one.
            long prefixBest = 0;
            int prefixIndex = -1;
            for (int j=key; j>0; j -= j & -j) {
                if (treeIndex[j] >= 0 && treeBest[j] > prefixBest) {
                    prefixBest = treeBest[j];
                    prefixIndex = treeIndex[j];
                }
            }

            best[i] = prefixBest + weights[i];
            prev[i] = prefixIndex;

            for (int j=key + 1; j<=keyRange; j += j & -j) {
                if (treeIndex[j] < 0 || best[i] > treeBest[j]) {
                    treeBest[j] = best[i];
                    treeIndex[j] = i;
                }
            }

            if (bestEnd < 0 || best[i] > best[bestEnd]) {
                bestEnd = i;
            }
        }

        for (int i=bestEnd; i>=0; i=prev[i]) {
            selected[i] = true;
        }

        return selected;
    }

    private WeightedSequence() {
    }
}
