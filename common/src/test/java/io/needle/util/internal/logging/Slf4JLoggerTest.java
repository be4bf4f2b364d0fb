/*
 * Copyright 2026 The Needle Project
 *
 * The Needle Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.needle.util.internal.logging;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class Slf4JLoggerTest {
    private static final Exception e = new Exception();

    @Test
    public void testName() {
        Logger mockLogger = mock(Logger.class);
        when(mockLogger.getName()).thenReturn("foo");

        InternalLogger logger = new Slf4JLogger(mockLogger);
        assertEquals("foo", logger.name());
    }

    @Test
    public void testIsDebugEnabled() {
        Logger mockLogger = mock(Logger.class);
        when(mockLogger.isDebugEnabled()).thenReturn(true);

        InternalLogger logger = new Slf4JLogger(mockLogger);
        assertTrue(logger.isDebugEnabled());
        verify(mockLogger).isDebugEnabled();
    }

    @Test
    public void testIsWarnEnabled() {
        Logger mockLogger = mock(Logger.class);
        when(mockLogger.isWarnEnabled()).thenReturn(true);

        InternalLogger logger = new Slf4JLogger(mockLogger);
        assertTrue(logger.isWarnEnabled());
        verify(mockLogger).isWarnEnabled();
    }

    @Test
    public void testTrace() {
        Logger mockLogger = mock(Logger.class);

        InternalLogger logger = new Slf4JLogger(mockLogger);
        logger.trace("a");
        verify(mockLogger).trace("a");
    }

    @Test
    public void testDebugWithArguments() {
        Logger mockLogger = mock(Logger.class);

        InternalLogger logger = new Slf4JLogger(mockLogger);
        logger.debug("-D{}: {}", "key", 4);
        verify(mockLogger).debug("-D{}: {}", "key", 4);
    }

    @Test
    public void testInfoWithArgumentArray() {
        Logger mockLogger = mock(Logger.class);

        InternalLogger logger = new Slf4JLogger(mockLogger);
        logger.info("{} {} {}", 1, 2, 3);
        verify(mockLogger).info("{} {} {}", 1, 2, 3);
    }

    @Test
    public void testWarnWithException() {
        Logger mockLogger = mock(Logger.class);

        InternalLogger logger = new Slf4JLogger(mockLogger);
        logger.warn("a", e);
        verify(mockLogger).warn("a", e);
    }

    @Test
    public void testError() {
        Logger mockLogger = mock(Logger.class);

        InternalLogger logger = new Slf4JLogger(mockLogger);
        logger.error("a {}", "b");
        verify(mockLogger).error("a {}", "b");
    }
}
