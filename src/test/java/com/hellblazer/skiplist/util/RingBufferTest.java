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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Random;
import java.util.function.Predicate;

import org.junit.Test;

/**
 * @author hhildebrand
 *
 */
public class RingBufferTest {
    @Test
    public void testOffer() {
        RingBuffer<String> test = new RingBuffer<String>(1000);
        for (int i = 0; i < 1000; i++) {
            assertEquals("Invalid size", i, test.size());
            assertTrue(test.offer(String.format("Offer: %s", i)));
        }
        assertEquals("Invalid size", 1000, test.size());
        assertFalse((test.offer(String.format("Offer: %s", 1001))));
    }

    @Test
    public void testPollOrder() {
        RingBuffer<String> test = new RingBuffer<String>(1000);
        for (int i = 0; i < 1000; i++) {
            test.add(String.format("Add: %s", i));
        }
        for (int i = 0; i < 1000; i++) {
            assertEquals("Invalid size", 1000 - i, test.size());
            assertEquals(String.format("Add: %s", i), test.poll());
        }
        assertNull(test.poll());
    }

    @Test
    public void testAccordian() {
        Random r = new Random(0x666);
        RingBuffer<Integer> test = new RingBuffer<Integer>(1000);
        for (int i = 0; i < 500; i++) {
            test.add(i);
        }
        int count = test.size();
        for (int i = 0; i < 10000; i++) {
            if (r.nextBoolean()) {
                assertTrue(test.offer(i));
                count++;
                assertEquals(count, test.size());
            } else {
                assertNotNull(test.poll());
                count--;
                assertEquals(count, test.size());
            }
        }
        assertEquals(count, test.size());
    }

    @Test
    public void testPollFirstMatching() {
        RingBuffer<Integer> test = new RingBuffer<Integer>(5);
        // wrap the ring before filtering
        test.offer(-1);
        test.offer(-2);
        test.poll();
        test.poll();
        for (int i = 0; i < 5; i++) {
            test.offer(i);
        }
        Integer found = test.pollFirst(new Predicate<Integer>() {
            @Override
            public boolean test(Integer value) {
                return value >= 2;
            }
        });
        assertEquals(Integer.valueOf(2), found);
        assertEquals(4, test.size());
        assertEquals("[ 0, 1, 3, 4, ]", test.toString());
        assertNull(test.pollFirst(new Predicate<Integer>() {
            @Override
            public boolean test(Integer value) {
                return value > 10;
            }
        }));
        assertTrue(test.offer(5));
        assertEquals(Integer.valueOf(0), test.poll());
        assertEquals("[ 1, 3, 4, 5, ]", test.toString());
    }

    @Test
    public void testClear() {
        RingBuffer<String> test = new RingBuffer<String>(3);
        test.add("a");
        test.add("b");
        test.clear();
        assertTrue(test.isEmpty());
        assertEquals(3, test.capacity());
        assertTrue(test.offer("c"));
        assertEquals("c", test.peek());
    }
}
