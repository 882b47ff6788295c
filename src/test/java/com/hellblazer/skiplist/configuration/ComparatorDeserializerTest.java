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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Collections;
import java.util.Comparator;

import org.junit.Test;

/**
 * @author hhildebrand
 *
 */
public class ComparatorDeserializerTest {

    public static class ByLength implements Comparator<String> {
        @Override
        public int compare(String a, String b) {
            return Integer.compare(a.length(), b.length());
        }
    }

    @SuppressWarnings("unchecked")
    @Test
    public void testDeserialization() throws Exception {
        ComparatorDeserializer test = new ComparatorDeserializer();
        Comparator<Object> natural = (Comparator<Object>) test._deserialize("natural",
                                                                             null);
        assertTrue(natural.compare(1, 2) < 0);
        assertSame(Comparator.naturalOrder(), natural);
        assertSame(natural, new SkipListConfiguration().comparator);
        assertSame(Collections.reverseOrder(),
                   test._deserialize(" reverse ", null));
        assertSame(String.CASE_INSENSITIVE_ORDER,
                   test._deserialize("caseInsensitive", null));

        Comparator<String> byLength = (Comparator<String>) test._deserialize(ByLength.class.getName(),
                                                                              null);
        assertEquals(0, byLength.compare("abc", "xyz"));

        // failure cases
        try {
            test._deserialize("com.example.Missing", null);
            fail("Should have failed with an unknown comparator");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            test._deserialize(String.class.getName(), null);
            fail("Should have failed with a class that is not a comparator");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
