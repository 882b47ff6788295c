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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hellblazer.skiplist.NodeAllocator;
import com.hellblazer.skiplist.NodeAllocatorFactory;

/**
 * @author hhildebrand
 *
 */
public class PooledNodeAllocatorFactory implements NodeAllocatorFactory {
    public static final int DEFAULT_LIMIT = 1024;

    @JsonCreator
    public static PooledNodeAllocatorFactory withLimit(@JsonProperty("limit") Integer limit) {
        return new PooledNodeAllocatorFactory(limit == null ? DEFAULT_LIMIT
                                                           : limit);
    }

    private final int       limit;

    public PooledNodeAllocatorFactory() {
        this(DEFAULT_LIMIT);
    }

    /**
     * @param limit
     *            - the maximum number of free nodes each allocator retains
     */
    public PooledNodeAllocatorFactory(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException(
                                               String.format("Pool limit %s must be >= 0",
                                                             limit));
        }
        this.limit = limit;
    }

    @Override
    public NodeAllocator create() {
        return new PooledNodeAllocator(limit);
    }

    public int getLimit() {
        return limit;
    }

}
