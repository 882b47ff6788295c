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
package com.hellblazer.skiplist.alloc;

import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.skiplist.Node;
import com.hellblazer.skiplist.NodeAllocator;
import com.hellblazer.skiplist.util.RingBuffer;

/**
 * A bounded pool of free nodes. A node is reused for any level that fits its
 * capacity; nodes freed while the pool is full are discarded. This class is
 * not thread safe.
 *
 * @author hhildebrand
 *
 */
public class PooledNodeAllocator implements NodeAllocator {
    private static final Logger     log       = LoggerFactory.getLogger(PooledNodeAllocator.class);

    private int                     created   = 0;
    private int                     discarded = 0;
    private final int               limit;
    private final RingBuffer<Node<?>> pool;
    private int                     pooled    = 0;
    private int                     reused    = 0;

    public PooledNodeAllocator(int limit) {
        this.limit = limit;
        pool = new RingBuffer<Node<?>>(limit);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <E> Node<E> allocate(final int level) {
        if (!pool.isEmpty()) {
            Node<?> allocated = pool.pollFirst(new Predicate<Node<?>>() {
                @Override
                public boolean test(Node<?> node) {
                    return node.capacity() >= level;
                }
            });
            if (allocated != null) {
                reused++;
                return (Node<E>) allocated;
            }
        }
        created++;
        return new Node<E>(level);
    }

    @Override
    public NodeAllocator forCopy() {
        return new PooledNodeAllocator(limit);
    }

    @Override
    public void free(Node<?> node) {
        if (node.level() != 0) {
            throw new IllegalArgumentException(
                                               String.format("Cannot pool %s, it is still linked",
                                                             node));
        }
        if (!pool.offer(node)) {
            discarded++;
            if (log.isTraceEnabled()) {
                log.trace(String.format("Pool full, discarding node of capacity %s",
                                        node.capacity()));
            }
        } else {
            pooled++;
        }
    }

    /**
     * @return the number of nodes created
     */
    public int getCreated() {
        return created;
    }

    /**
     * @return the number of freed nodes discarded because the pool was full
     */
    public int getDiscarded() {
        return discarded;
    }

    public int getLimit() {
        return limit;
    }

    public int getPooled() {
        return pooled;
    }

    /**
     * @return the number of allocations served from the pool
     */
    public int getReused() {
        return reused;
    }

    public int size() {
        return pool.size();
    }

    @Override
    public String toString() {
        return String.format("Node pool size: %s reused: %s created: %s pooled: %s discarded: %s",
                             size(), reused, created, pooled, discarded);
    }
}
