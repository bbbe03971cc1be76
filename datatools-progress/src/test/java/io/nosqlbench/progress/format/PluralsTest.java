/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.nosqlbench.progress.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PluralsTest {

    @Test
    public void regularNouns() {
        assertEquals("items", Plurals.pluralize("item"));
        assertEquals("boxes", Plurals.pluralize("box"));
        assertEquals("batches", Plurals.pluralize("batch"));
        assertEquals("queries", Plurals.pluralize("query"));
        assertEquals("keys", Plurals.pluralize("key"));
        assertEquals("buses", Plurals.pluralize("bus"));
    }

    @Test
    public void irregularAndUncountableNouns() {
        assertEquals("children", Plurals.pluralize("child"));
        assertEquals("indices", Plurals.pluralize("index"));
        assertEquals("vertices", Plurals.pluralize("vertex"));
        assertEquals("Leaves", Plurals.pluralize("Leaf"));
        assertEquals("data", Plurals.pluralize("data"));
        assertEquals("sheep", Plurals.pluralize("sheep"));
    }

    @Test
    public void onlyLastWordIsInflected() {
        assertEquals("record batches", Plurals.pluralize("record batch"));
        assertEquals("graph vertices", Plurals.pluralize("graph vertex"));
    }

    @Test
    public void blankNamesStayBlank() {
        assertEquals("", Plurals.pluralize(""));
        assertNull(Plurals.pluralize(null));
    }

    @Test
    public void forCountUsesSingularOnlyForOne() {
        assertEquals("file", Plurals.forCount("file", "files", 1));
        assertEquals("files", Plurals.forCount("file", "files", 0));
        assertEquals("files", Plurals.forCount("file", "files", 2));
    }
}
