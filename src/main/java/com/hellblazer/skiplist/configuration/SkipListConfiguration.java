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
package com.hellblazer.skiplist.configuration;

import java.util.Comparator;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hellblazer.skiplist.NodeAllocatorFactory;
import com.hellblazer.skiplist.SkipList;
import com.hellblazer.skiplist.alloc.HeapNodeAllocatorFactory;

/**
 * A configuration bean for constructing SkipList instances
 *
 * @author hhildebrand
 *
 */
public class SkipListConfiguration {

    private static final Logger  log        = LoggerFactory.getLogger(SkipListConfiguration.class);

    public NodeAllocatorFactory allocator  = new HeapNodeAllocatorFactory();
    public Comparator<?>        comparator = SkipList.<Object> naturalOrder();
    public Long                 seed;

    /**
     * Construct an empty list. The comparator must be able to order the
     * elements that will be inserted.
     */
    @SuppressWarnings("unchecked")
    public <E> SkipList<E> construct() {
        if (log.isDebugEnabled()) {
            log.debug(String.format("Constructing skip list, comparator: %s seed: %s allocator: %s",
                                    comparator, seed,
                                    allocator.getClass().getSimpleName()));
        }
        return new SkipList<E>((Comparator<? super E>) comparator, getRandom(),
                               allocator.create());
    }

    /**
     * @return a random source seeded by the configured seed, or an unseeded
     *         one
     */
    public Random getRandom() {
        if (seed == null) {
            return new Random();
        }
        return new Random(seed);
    }
}
