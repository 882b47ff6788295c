/*
* Copyright (C) 2010 Zhenya Leonov
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
* http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/

package com.hellblazer.skiplist;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.skiplist.alloc.HeapNodeAllocator;

/**
 * A sorted, bidirectional skip list. Elements are kept in the order of the
 * list's comparator; elements comparing equal are all retained, each new one
 * placed after the existing equal elements.
 * <p>
 * Every search, insertion and removal makes one top down sweep through the
 * levels of the list. Searches and removals collect the rightmost node at
 * each level whose element is strictly less than the target; insertions
 * collect the rightmost node whose element is not greater. Traversal through
 * {@link Position} only follows the base level.
 * <p>
 * This class is not thread safe.
 *
 * @param <E>
 */
public final class SkipList<E> implements SortedCollection<E> {

    public static final int     MAX_LEVEL = 32;

    private static final Logger log       = LoggerFactory.getLogger(SkipList.class);

    /**
     * Answer a list that takes over the contents of the source, leaving the
     * source empty.
     */
    public static <E> SkipList<E> move(SkipList<E> source) {
        return move(source, new Random());
    }

    /**
     * Answer a list that takes over the contents of the source, leaving the
     * source empty. Levels of nodes later inserted into the new list are drawn
     * from the supplied random.
     */
    public static <E> SkipList<E> move(SkipList<E> source, Random random) {
        SkipList<E> moved = new SkipList<E>(source.comparator, random,
                                            source.allocator.forCopy());
        moved.swap(source);
        if (log.isDebugEnabled()) {
            log.debug(String.format("Moved %s elements into a new list",
                                    moved.size));
        }
        return moved;
    }

    /**
     * @return the natural ordering of mutually comparable elements
     */
    @SuppressWarnings({ "unchecked", "rawtypes" })
    public static <E> Comparator<E> naturalOrder() {
        return (Comparator) Comparator.<Comparable<Object>> naturalOrder();
    }

    private NodeAllocator         allocator;
    private Comparator<? super E> comparator;
    private Node<E>               head;
    private Random                random;
    private int                   size;
    private Node<E>               tail;

    /**
     * Construct a list ordered by the natural ordering of its elements.
     */
    public SkipList() {
        this(SkipList.<E> naturalOrder());
    }

    public SkipList(Comparator<? super E> comparator) {
        this(comparator, new Random());
    }

    public SkipList(Comparator<? super E> comparator, Random random) {
        this(comparator, random, new HeapNodeAllocator());
    }

    /**
     * @param comparator
     *            - the ordering of the list's elements
     * @param random
     *            - the source of the levels of inserted nodes
     * @param allocator
     *            - the allocation strategy for the list's nodes
     */
    public SkipList(Comparator<? super E> comparator, Random random,
                    NodeAllocator allocator) {
        if (comparator == null) {
            throw new NullPointerException("Invalid Comparator");
        }
        if (random == null) {
            throw new NullPointerException("Invalid Random");
        }
        if (allocator == null) {
            throw new NullPointerException("Invalid NodeAllocator");
        }
        this.comparator = comparator;
        this.random = random;
        this.allocator = allocator;
        initializeSentinels();
    }

    /**
     * Construct an independent copy of the supplied list.
     */
    public SkipList(SkipList<E> other) {
        this(other, new Random());
    }

    /**
     * Construct an independent copy of the supplied list, drawing the levels
     * of the copied nodes from the supplied random.
     */
    public SkipList(SkipList<E> other, Random random) {
        this(other.comparator, random, other.allocator.forCopy());
        copyElements(other);
    }

    @Override
    public void add(E element) {
        insert(element);
    }

    @Override
    public void addAll(Iterable<? extends E> col) {
        if (col == null) {
            throw new NullPointerException(
                                           "Null/Invalid Collection has been passed. ");
        }
        for (E e : col) {
            insert(e);
        }
    }

    /**
     * Replace the contents of the receiver with a copy of the contents of the
     * other list. The receiver adopts the other list's comparator and keeps
     * its own allocator.
     */
    public void assign(SkipList<E> other) {
        if (other == this) {
            return;
        }
        clear();
        comparator = other.comparator;
        copyElements(other);
    }

    /**
     * @return the position of the first element, or the end position if the
     *         receiver is empty
     */
    public Position<E> begin() {
        return new Position<E>(head.next());
    }

    /**
     * Remove all the elements of the receiver.
     */
    @Override
    public void clear() {
        int cleared = size;
        Node<E> current = head.next();
        while (current != tail) {
            Node<E> next = current.next();
            release(current);
            current = next;
        }
        for (int i = 0; i < MAX_LEVEL; i++) {
            head.next[i] = tail;
        }
        tail.prev = head;
        size = 0;
        if (log.isDebugEnabled()) {
            log.debug(String.format("Cleared %s elements", cleared));
        }
    }

    @Override
    public Comparator<? super E> comparator() {
        return comparator;
    }

    @Override
    public boolean contains(E element) {
        return !find(element).isEnd();
    }

    /**
     * Insert the element constructed by the supplied factory. The element is
     * fully constructed before the list is searched for its place, so a
     * factory that fails leaves the receiver untouched.
     *
     * @return the position of the new element
     */
    public Position<E> emplace(Supplier<? extends E> factory) {
        E element = factory.get();
        return insert(element);
    }

    /**
     * @return the end position of the receiver
     */
    public Position<E> end() {
        return new Position<E>(tail);
    }

    /**
     * Two lists are equal when they hold equal elements in the same order.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SkipList)) {
            return false;
        }
        SkipList<?> other = (SkipList<?>) obj;
        if (size != other.size) {
            return false;
        }
        Node<E> a = head.next();
        Node<?> b = other.head.next();
        while (a != tail && b != other.tail) {
            if (!a.value.equals(b.value)) {
                return false;
            }
            a = a.next();
            b = b.next();
        }
        return true;
    }

    /**
     * Remove the element at the supplied position.
     *
     * @return the position of the element that followed the removed element
     * @throws PositionOutOfRangeException
     *             if the position is the end position or empty
     */
    public Position<E> erase(Position<E> position) {
        Node<E> node = position.node();
        if (node == null) {
            throw new PositionOutOfRangeException("Cannot erase an empty position");
        }
        if (node == tail) {
            throw new PositionOutOfRangeException("Cannot erase the end position");
        }
        if (node.value == null) {
            throw new IllegalArgumentException(
                                               "Position does not belong to this list");
        }
        Node<E>[] update = predecessorsOf(node);
        for (int i = 0; i < node.level; i++) {
            update[i].next[i] = node.next[i];
        }
        Node<E> successor = node.next();
        successor.prev = node.prev;
        if (log.isTraceEnabled()) {
            log.trace(String.format("Unlinked %s from %s levels", node.value,
                                    node.level));
        }
        release(node);
        size--;
        return new Position<E>(successor);
    }

    /**
     * @return the position of the first element comparing equal to the
     *         target, or the end position if there is none
     */
    public Position<E> find(E element) {
        if (element == null) {
            throw new NullPointerException("Invalid element to be found.");
        }
        Node<E> candidate = descend(element, null).next();
        if (candidate != tail && comparator.compare(element, candidate.value) == 0) {
            return new Position<E>(candidate);
        }
        return end();
    }

    @Override
    public E first() {
        if (size == 0) {
            throw new NoSuchElementException("Empty list");
        }
        return head.next().value;
    }

    public NodeAllocator getAllocator() {
        return allocator;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (Node<E> x = head.next(); x != tail; x = x.next()) {
            hash = 31 * hash + x.value.hashCode();
        }
        return hash;
    }

    /**
     * Insert the element into the receiver. Elements comparing equal to the
     * inserted element are retained; the new element follows them.
     *
     * @return the position of the new element
     */
    public Position<E> insert(E element) {
        if (element == null) {
            throw new NullPointerException("Invalid element to be added.");
        }
        Node<E>[] update = newUpdate();
        descendPast(element, update);

        final int newLevel = randomLevel();
        Node<E> x = allocate(element, newLevel);
        for (int i = 0; i < newLevel; i++) {
            x.next[i] = update[i].next[i];
            update[i].next[i] = x;
        }
        x.prev = update[0];
        x.next().prev = x;
        size++;
        if (log.isTraceEnabled()) {
            log.trace(String.format("Linked %s at %s levels", element, newLevel));
        }
        return new Position<E>(x);
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * @return an iterator over the elements in ascending order. The iterator
     *         supports removal.
     */
    @Override
    public Iterator<E> iterator() {
        return new Iterator<E>() {
            private Position<E> cursor = begin();
            private Position<E> lastReturned;

            @Override
            public boolean hasNext() {
                return !cursor.isEnd();
            }

            @Override
            public E next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                E value = cursor.get();
                lastReturned = cursor;
                cursor = cursor.next();
                return value;
            }

            @Override
            public void remove() {
                if (lastReturned == null) {
                    throw new IllegalStateException();
                }
                erase(lastReturned);
                lastReturned = null;
            }
        };
    }

    /**
     * @return an iterator over the elements in descending order
     */
    public Iterator<E> descendingIterator() {
        return new Iterator<E>() {
            private Node<E> cursor = tail;

            @Override
            public boolean hasNext() {
                return cursor.prev != head;
            }

            @Override
            public E next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                cursor = cursor.prev;
                return cursor.value;
            }

            @Override
            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    @Override
    public E last() {
        if (size == 0) {
            throw new NoSuchElementException("Empty list");
        }
        return tail.prev.value;
    }

    /**
     * Remove the last element of the receiver.
     *
     * @throws PositionOutOfRangeException
     *             if the receiver is empty
     */
    public void popBack() {
        if (size == 0) {
            throw new PositionOutOfRangeException("popBack called on empty list");
        }
        erase(new Position<E>(tail.prev));
    }

    /**
     * Remove the first element of the receiver.
     *
     * @throws PositionOutOfRangeException
     *             if the receiver is empty
     */
    public void popFront() {
        if (size == 0) {
            throw new PositionOutOfRangeException("popFront called on empty list");
        }
        erase(begin());
    }

    /**
     * Equivalent to {@link #insert(Object)}; the element still takes its
     * sorted place.
     */
    public Position<E> pushBack(E element) {
        return insert(element);
    }

    /**
     * Equivalent to {@link #insert(Object)}; the element still takes its
     * sorted place.
     */
    public Position<E> pushFront(E element) {
        return insert(element);
    }

    /**
     * Remove the first element comparing equal to the supplied element.
     *
     * @return true if an element was removed
     */
    @Override
    public boolean remove(E element) {
        Position<E> found = find(element);
        if (found.isEnd()) {
            return false;
        }
        erase(found);
        return true;
    }

    /**
     * Shrink the receiver to the requested size, removing the elements at and
     * after position <code>count</code>.
     *
     * @throws IllegalArgumentException
     *             if the receiver would have to grow
     */
    public void resize(int count) {
        if (count > size) {
            throw new IllegalArgumentException(
                                               String.format("Growing from %s to %s elements requires a fill value",
                                                             size, count));
        }
        resize(count, null);
    }

    /**
     * Resize the receiver to the requested size. The receiver grows by
     * inserting the fill value and shrinks by removing the elements at and
     * after position <code>count</code>.
     */
    public void resize(int count, E fill) {
        if (count < 0) {
            throw new IllegalArgumentException(
                                               String.format("Invalid size %s",
                                                             count));
        }
        int original = size;
        if (count > size) {
            for (int i = size; i < count; i++) {
                insert(fill);
            }
        } else if (count < size) {
            Position<E> it = begin();
            for (int i = 0; i < count; i++) {
                it = it.next();
            }
            while (!it.isEnd()) {
                it = erase(it);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug(String.format("Resized from %s to %s elements", original,
                                    size));
        }
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * Answer the elements greater than or equal to <code>from</code> and less
     * than <code>to</code>.
     */
    @Override
    public Iterable<E> subset(final E from, final E to) {
        if (from == null || to == null) {
            throw new NullPointerException("Invalid subset bounds");
        }
        return new Iterable<E>() {
            @Override
            public Iterator<E> iterator() {
                return new Iterator<E>() {
                    private Node<E> cursor = descend(from, null).next();

                    @Override
                    public boolean hasNext() {
                        return cursor != tail
                               && comparator.compare(cursor.value, to) < 0;
                    }

                    @Override
                    public E next() {
                        if (!hasNext()) {
                            throw new NoSuchElementException();
                        }
                        E value = cursor.value;
                        cursor = cursor.next();
                        return value;
                    }

                    @Override
                    public void remove() {
                        throw new UnsupportedOperationException();
                    }
                };
            }
        };
    }

    /**
     * Exchange the entire state of the receiver with the other list.
     */
    public void swap(SkipList<E> other) {
        Node<E> h = head;
        head = other.head;
        other.head = h;

        Node<E> t = tail;
        tail = other.tail;
        other.tail = t;

        int s = size;
        size = other.size;
        other.size = s;

        Comparator<? super E> c = comparator;
        comparator = other.comparator;
        other.comparator = c;

        Random r = random;
        random = other.random;
        other.random = r;

        NodeAllocator a = allocator;
        allocator = other.allocator;
        other.allocator = a;
    }

    @Override
    public String toString() {
        final StringBuilder buf = new StringBuilder();
        buf.append("[ ");
        for (Node<E> x = head.next(); x != tail; x = x.next()) {
            buf.append(x.value);
            buf.append(", ");
        }
        buf.append("]");
        return buf.toString();
    }

    /**
     * Replace the contents of the receiver with the contents of the source,
     * leaving the source empty.
     */
    public void transfer(SkipList<E> source) {
        if (source == this) {
            return;
        }
        clear();
        swap(source);
        if (log.isDebugEnabled()) {
            log.debug(String.format("Transferred %s elements", size));
        }
    }

    /**
     * Verify the structural invariants of the receiver.
     *
     * @throws IllegalStateException
     *             describing the first violation found
     */
    public void checkInvariants() {
        if (head.prev != null) {
            throw new IllegalStateException("Head has a predecessor");
        }
        int count = 0;
        Node<E> prev = head;
        for (Node<E> x = head.next(); x != tail; x = x.next()) {
            if (x.prev != prev) {
                throw new IllegalStateException(
                                                String.format("Broken back link at %s",
                                                              x));
            }
            if (prev != head && comparator.compare(prev.value, x.value) > 0) {
                throw new IllegalStateException(
                                                String.format("%s out of order after %s",
                                                              x, prev));
            }
            prev = x;
            count++;
        }
        if (tail.prev != prev) {
            throw new IllegalStateException("Broken back link at tail");
        }
        if (count != size) {
            throw new IllegalStateException(
                                            String.format("Size %s but %s elements linked",
                                                          size, count));
        }
        for (int i = 1; i < MAX_LEVEL; i++) {
            Node<E> below = head.next();
            for (Node<E> x = head.next[i]; x != tail; x = x.next[i]) {
                if (x.level <= i) {
                    throw new IllegalStateException(
                                                    String.format("%s linked above its level at %s",
                                                                  x, i));
                }
                // every express link must land on a node of the base chain,
                // in base order
                while (below != x) {
                    if (below == tail) {
                        throw new IllegalStateException(
                                                        String.format("%s at level %s is not on the base level",
                                                                      x, i));
                    }
                    below = below.next();
                }
            }
        }
    }

    private Node<E> allocate(E value, int level) {
        Node<E> node = allocator.allocate(level);
        if (node.capacity() < level) {
            throw new IllegalStateException(
                                            String.format("Allocator returned a node of capacity %s for level %s",
                                                          node.capacity(),
                                                          level));
        }
        node.value = value;
        node.level = level;
        return node;
    }

    private void copyElements(SkipList<E> other) {
        for (Node<E> x = other.head.next(); x != other.tail; x = x.next()) {
            insert(x.value);
        }
        if (log.isDebugEnabled()) {
            log.debug(String.format("Copied %s elements", other.size));
        }
    }

    /**
     * Sweep from the top level to the base level, recording in the update
     * vector the last node at each level whose element is less than the
     * target.
     *
     * @return the last node of the base level whose element is less than the
     *         target, or the head
     */
    private Node<E> descend(E element, Node<E>[] update) {
        Node<E> x = head;
        for (int i = MAX_LEVEL - 1; i >= 0; i--) {
            while (x.next[i] != tail
                   && comparator.compare(x.next[i].value, element) < 0) {
                x = x.next[i];
            }
            if (update != null) {
                update[i] = x;
            }
        }
        return x;
    }

    /**
     * Sweep from the top level to the base level, recording in the update
     * vector the last node at each level whose element is not greater than
     * the target. Splicing after these nodes places the target behind every
     * equal element.
     */
    private void descendPast(E element, Node<E>[] update) {
        Node<E> x = head;
        for (int i = MAX_LEVEL - 1; i >= 0; i--) {
            while (x.next[i] != tail
                   && comparator.compare(x.next[i].value, element) <= 0) {
                x = x.next[i];
            }
            update[i] = x;
        }
    }

    private void initializeSentinels() {
        head = allocate(null, MAX_LEVEL);
        tail = allocate(null, MAX_LEVEL);
        for (int i = 0; i < MAX_LEVEL; i++) {
            head.next[i] = tail;
        }
        tail.prev = head;
        size = 0;
    }

    @SuppressWarnings("unchecked")
    private Node<E>[] newUpdate() {
        return new Node[MAX_LEVEL];
    }

    /**
     * Find the predecessor of the node at each of its levels. The descent
     * stops in front of the first element equal to the node's, so the run of
     * equal elements is walked until the node itself is reached.
     */
    private Node<E>[] predecessorsOf(Node<E> node) {
        Node<E>[] update = newUpdate();
        descend(node.value, update);
        for (int i = 0; i < node.level; i++) {
            Node<E> x = update[i];
            while (x.next[i] != node && x.next[i] != tail
                   && comparator.compare(node.value, x.next[i].value) >= 0) {
                x = x.next[i];
            }
            if (x.next[i] != node) {
                if (i == 0) {
                    throw new IllegalArgumentException(
                                                       "Position does not belong to this list");
                }
                log.error(String.format("Node %s is missing from level %s", node,
                                        i));
                throw new IllegalStateException(
                                                String.format("Node %s is missing from level %s",
                                                              node, i));
            }
            update[i] = x;
        }
        return update;
    }

    /**
     * @return a level in [1, MAX_LEVEL], each level half as likely as the
     *         level below
     */
    private int randomLevel() {
        int level = 1;
        while (level < MAX_LEVEL && random.nextDouble() < 0.5) {
            level++;
        }
        return level;
    }

    private void release(Node<E> node) {
        node.value = null;
        node.prev = null;
        node.level = 0;
        Arrays.fill(node.next, null);
        node.generation++;
        allocator.free(node);
    }
}
