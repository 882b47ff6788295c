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
 * Signals an attempt to read the value of a position that does not hold one.
 *
 * @author hhildebrand
 *
 */
public class InvalidDereferenceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public InvalidDereferenceException(String message) {
        super(message);
    }
}
