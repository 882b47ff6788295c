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

import java.util.ConcurrentModificationException;

/**
 * An immutable cursor over the base level of a {@link SkipList}. A position
 * is on an element, on the end of the list, or empty.
 * <p>
 * Two positions are equal when they refer to the same node, regardless of the
 * values stored. A position becomes stale once the element it refers to is
 * erased; any use of a stale position fails with a
 * {@link ConcurrentModificationException}.
 *
 * @author hhildebrand
 *
 * @param <E>
 */
public final class Position<E> {
    private static final Position<?> EMPTY = new Position<Object>(null);

    @SuppressWarnings("unchecked")
    public static <E> Position<E> empty() {
        return (Position<E>) EMPTY;
    }

    private final int     generation;
    private final Node<E> node;

    Position(Node<E> node) {
        this.node = node;
        generation = node == null ? 0 : node.generation;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Position)) {
            return false;
        }
        return node == ((Position<?>) obj).node;
    }

    /**
     * @return the element at the receiver
     * @throws InvalidDereferenceException
     *             if the receiver is the end position or empty
     */
    public E get() {
        if (node == null) {
            throw new InvalidDereferenceException("Dereferencing an empty position");
        }
        checkLive();
        if (node.value == null) {
            throw new InvalidDereferenceException("Dereferencing the end position");
        }
        return node.value;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(node);
    }

    public boolean isEmpty() {
        return node == null;
    }

    /**
     * @return true if the receiver is the end position of its list
     */
    public boolean isEnd() {
        return node != null && node.value == null && node.prev != null;
    }

    /**
     * @return the position of the successor of the receiver
     * @throws PositionOutOfRangeException
     *             if the receiver is the end position or empty
     */
    public Position<E> next() {
        if (node == null) {
            throw new PositionOutOfRangeException("Advancing an empty position");
        }
        checkLive();
        if (node.next() == null) {
            throw new PositionOutOfRangeException("Advancing past the end");
        }
        return new Position<E>(node.next());
    }

    /**
     * @return the position of the predecessor of the receiver
     * @throws PositionOutOfRangeException
     *             if the receiver is the first element, the end of an empty
     *             list, or empty
     */
    public Position<E> previous() {
        if (node == null) {
            throw new PositionOutOfRangeException("Retreating an empty position");
        }
        checkLive();
        Node<E> prev = node.prev;
        // only the head sentinel has no predecessor
        if (prev == null || prev.prev == null) {
            throw new PositionOutOfRangeException("Retreating before the first element");
        }
        return new Position<E>(prev);
    }

    @Override
    public String toString() {
        if (node == null) {
            return "Position[empty]";
        }
        if (node.generation != generation) {
            return "Position[stale]";
        }
        return node.value == null ? "Position[end]"
                                 : String.format("Position[%s]", node.value);
    }

    int level() {
        checkLive();
        return node.level;
    }

    /**
     * @return the node of the receiver, after checking it has not been
     *         released since the receiver was created
     */
    Node<E> node() {
        if (node != null) {
            checkLive();
        }
        return node;
    }

    private void checkLive() {
        if (node.generation != generation) {
            throw new ConcurrentModificationException(
                                                      "Position refers to an element that has been removed");
        }
    }
}
