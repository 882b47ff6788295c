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
package com.hellblazer.skiplist.util;

import java.util.AbstractQueue;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Provides a fixed size Queue implementation. This class is not thread safe.
 *
 * @author hhildebrand
 *
 * @param <T>
 */
public class RingBuffer<T> extends AbstractQueue<T> {

    private int         head = 0;
    protected final T[] items;
    private int         size = 0;

    @SuppressWarnings("unchecked")
    public RingBuffer(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException(
                                               String.format("Invalid capacity %s",
                                                             capacity));
        }
        items = (T[]) new Object[capacity];
    }

    public int capacity() {
        return items.length;
    }

    @Override
    public void clear() {
        for (int i = 0; i < size; i++) {
            items[slot(i)] = null;
        }
        head = 0;
        size = 0;
    }

    /* (non-Javadoc)
     * @see java.util.AbstractCollection#iterator()
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<T>() {
            int current = 0;

            @Override
            public boolean hasNext() {
                return current < size;
            }

            @Override
            public T next() {
                if (current == size) {
                    throw new NoSuchElementException();
                }
                return items[slot(current++)];
            }

            @Override
            public void remove() {
                throw new UnsupportedOperationException();
            }
        };
    }

    /* (non-Javadoc)
     * @see java.util.Queue#offer(java.lang.Object)
     */
    @Override
    public boolean offer(T value) {
        if (value == null) {
            throw new NullPointerException();
        }
        if (size == items.length) {
            return false;
        }
        items[slot(size)] = value;
        size++;
        return true;
    }

    /* (non-Javadoc)
     * @see java.util.Queue#peek()
     */
    @Override
    public T peek() {
        if (size == 0) {
            return null;
        }
        return items[head];
    }

    /* (non-Javadoc)
     * @see java.util.Queue#poll()
     */
    @Override
    public T poll() {
        if (size == 0) {
            return null;
        }
        T item = items[head];
        items[head] = null;
        size--;
        head = (head + 1) % items.length;
        return item;
    }

    /**
     * Remove the oldest item accepted by the filter. The items behind the
     * removed item keep their order.
     *
     * @return the removed item, or null if no item matched
     */
    public T pollFirst(Predicate<? super T> filter) {
        for (int i = 0; i < size; i++) {
            T item = items[slot(i)];
            if (filter.test(item)) {
                for (int j = i; j < size - 1; j++) {
                    items[slot(j)] = items[slot(j + 1)];
                }
                items[slot(size - 1)] = null;
                size--;
                return item;
            }
        }
        return null;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public String toString() {
        final StringBuilder buf = new StringBuilder();
        buf.append("[ ");
        for (int i = 0; i < size; i++) {
            buf.append(items[slot(i)]);
            buf.append(", ");
        }
        buf.append("]");
        return buf.toString();
    }

    private int slot(int index) {
        return (head + index) % items.length;
    }
}
