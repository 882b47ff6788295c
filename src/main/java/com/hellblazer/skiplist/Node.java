/** (C) Copyright 2010 Hal Hildebrand, All Rights Reserved
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
package com.hellblazer.skiplist;

/**
 * A node of the skip list graph. Nodes are handed out by a
 * {@link NodeAllocator} and are only ever linked and unlinked by the
 * {@link SkipList} that owns them. The head and tail sentinels are nodes
 * without a value.
 *
 * @author hhildebrand
 *
 * @param <E>
 */
public final class Node<E> {
    int            generation;
    int            level;
    final Node<E>[] next;
    Node<E>        prev;
    E              value;

    /**
     * @param capacity
     *            - the maximum number of levels this node can participate in
     */
    @SuppressWarnings("unchecked")
    public Node(int capacity) {
        if (capacity < 1 || capacity > SkipList.MAX_LEVEL) {
            throw new IllegalArgumentException(
                                               String.format("Node capacity %s must be in [1, %s]",
                                                             capacity,
                                                             SkipList.MAX_LEVEL));
        }
        next = new Node[capacity];
    }

    public int capacity() {
        return next.length;
    }

    /**
     * @return the number of levels the node currently participates in, 0 if
     *         the node is not linked into a list
     */
    public int level() {
        return level;
    }

    Node<E> next() {
        return next[0];
    }

    @Override
    public String toString() {
        return String.format("Node[%s] level: %s", value, level);
    }
}
