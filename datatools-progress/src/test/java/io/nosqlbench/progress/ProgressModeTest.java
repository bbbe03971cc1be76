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

package io.nosqlbench.progress;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ProgressModeTest {

    @Test
    public void parsesAliases() {
        for (String value : new String[]{"log", "LOGGER", " text ", "on", "true"}) {
            assertEquals(ProgressMode.LOG, ProgressMode.fromString(value), value);
        }
        for (String value : new String[]{"off", "None", "disable", "disabled", "FALSE"}) {
            assertEquals(ProgressMode.OFF, ProgressMode.fromString(value), value);
        }
        assertNull(ProgressMode.fromString(null));
    }

    @Test
    public void rejectsUnknownMode() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ProgressMode.fromString("panel"));
        assertTrue(e.getMessage().contains("panel"));
    }

    @Test
    public void readsSystemProperty() {
        String previous = System.getProperty(ProgressMode.MODE_PROPERTY);
        try {
            System.clearProperty(ProgressMode.MODE_PROPERTY);
            assertEquals(ProgressMode.LOG, ProgressMode.fromSystemProperties());

            System.setProperty(ProgressMode.MODE_PROPERTY, "none");
            assertEquals(ProgressMode.OFF, ProgressMode.fromSystemProperties());
        } finally {
            if (previous == null) {
                System.clearProperty(ProgressMode.MODE_PROPERTY);
            } else {
                System.setProperty(ProgressMode.MODE_PROPERTY, previous);
            }
        }
    }

    @Test
    public void createsMatchingLoggers() {
        ProgressLogConfig config = ProgressLogConfig.defaults().withItemName("row");

        ProgressLog log = ProgressMode.LOG.create(config);
        assertInstanceOf(ProgressLogger.class, log);
        assertEquals(config, ((ProgressLogger) log).getConfig());
        assertInstanceOf(ConcurrentProgressLogger.class, ProgressMode.LOG.createConcurrent(config));

        assertSame(NoopProgressLogger.getInstance(), ProgressMode.OFF.create(config));
        assertSame(NoopProgressLogger.getInstance(), ProgressMode.OFF.createConcurrent(config));
    }

    @Test
    public void propertyValueRoundTrips() {
        for (ProgressMode mode : ProgressMode.values()) {
            assertEquals(mode, ProgressMode.fromString(mode.getPropertyValue()));
            assertEquals(mode.getPropertyValue(), mode.toString());
        }
    }
}
