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
 * The node allocation strategy of a skip list. An allocator belongs to exactly
 * one list for the lifetime of that list and is not shared between lists.
 *
 * @author hhildebrand
 *
 */
public interface NodeAllocator {

    /**
     * Answer an unlinked node able to hold at least the requested number of
     * levels.
     *
     * @param level
     *            - the number of levels the node will participate in
     */
    <E> Node<E> allocate(int level);

    /**
     * Take back a node that its list has unlinked and scrubbed.
     */
    void free(Node<?> node);

    /**
     * Answer a new allocator of the same strategy, for use by a copy of the
     * list owning the receiver.
     */
    NodeAllocator forCopy();
}
