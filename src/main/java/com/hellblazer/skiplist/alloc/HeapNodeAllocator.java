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

import com.hellblazer.skiplist.Node;
import com.hellblazer.skiplist.NodeAllocator;

/**
 * Allocates every node fresh from the heap and leaves freed nodes to the
 * garbage collector.
 *
 * @author hhildebrand
 *
 */
public class HeapNodeAllocator implements NodeAllocator {

    private int allocated = 0;

    @Override
    public <E> Node<E> allocate(int level) {
        allocated++;
        return new Node<E>(level);
    }

    @Override
    public NodeAllocator forCopy() {
        return new HeapNodeAllocator();
    }

    @Override
    public void free(Node<?> node) {
        // unreachable once unlinked
    }

    /**
     * @return the number of nodes allocated
     */
    public int getAllocated() {
        return allocated;
    }

    @Override
    public String toString() {
        return String.format("Heap allocator allocated: %s", allocated);
    }
}
