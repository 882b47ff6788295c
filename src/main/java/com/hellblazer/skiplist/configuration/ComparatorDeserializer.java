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

import java.io.IOException;
import java.util.Collections;
import java.util.Comparator;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.hellblazer.skiplist.SkipList;

/**
 * Resolves the ordering of a list from its name: <code>natural</code>,
 * <code>reverse</code>, <code>caseInsensitive</code>, or the fully qualified
 * name of a {@link Comparator} class with a public no argument constructor.
 *
 * @author hhildebrand
 *
 */
public class ComparatorDeserializer extends
        FromStringDeserializer<Comparator<?>> {

    private static final long serialVersionUID = 1L;

    public static final String CASE_INSENSITIVE = "caseInsensitive";
    public static final String NATURAL          = "natural";
    public static final String REVERSE          = "reverse";

    protected ComparatorDeserializer() {
        super(Comparator.class);
    }

    /* (non-Javadoc)
     * @see com.fasterxml.jackson.databind.deser.std.FromStringDeserializer#_deserialize(java.lang.String, com.fasterxml.jackson.databind.DeserializationContext)
     */
    @Override
    protected Comparator<?> _deserialize(String value,
                                         DeserializationContext ctxt)
                                                                     throws IOException {
        String name = value.trim();
        if (NATURAL.equals(name)) {
            return SkipList.<Object> naturalOrder();
        }
        if (REVERSE.equals(name)) {
            return Collections.reverseOrder();
        }
        if (CASE_INSENSITIVE.equals(name)) {
            return String.CASE_INSENSITIVE_ORDER;
        }
        Class<?> clazz;
        try {
            clazz = Class.forName(name);
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException(
                                               String.format("Unknown comparator %s",
                                                             name), e);
        }
        if (!Comparator.class.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException(
                                               String.format("%s is not a Comparator",
                                                             name));
        }
        try {
            return (Comparator<?>) clazz.getConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException(
                                               String.format("Unable to instantiate comparator %s",
                                                             name), e);
        }
    }

}
