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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JdkLoggerTest {

    private static final String NAME = "io.needle.test.JdkLoggerTest";

    private final List<LogRecord> records = new ArrayList<LogRecord>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };
    private Logger julLogger;

    @BeforeEach
    public void setUp() {
        julLogger = Logger.getLogger(NAME);
        julLogger.setUseParentHandlers(false);
        julLogger.setLevel(Level.INFO);
        julLogger.addHandler(handler);
    }

    @AfterEach
    public void tearDown() {
        julLogger.removeHandler(handler);
    }

    @Test
    public void testFactoryCreatesNamedLogger() {
        InternalLogger logger = JdkLoggerFactory.INSTANCE.newInstance(NAME);
        assertEquals(NAME, logger.name());
        assertTrue(logger.isWarnEnabled());
        assertFalse(logger.isDebugEnabled());
    }

    @Test
    public void testFormattedMessageIsPublished() {
        InternalLogger logger = JdkLoggerFactory.INSTANCE.newInstance(NAME);
        logger.warn("Unknown value for -D{}: {}", "key", "bogus");
        logger.debug("not published {}", 1);

        assertEquals(1, records.size());
        assertEquals(Level.WARNING, records.get(0).getLevel());
        assertEquals("Unknown value for -Dkey: bogus", records.get(0).getMessage());
        assertEquals(NAME, records.get(0).getSourceClassName());
    }

    @Test
    public void testThrowableIsAttached() {
        Exception cause = new Exception("boom");
        InternalLogger logger = JdkLoggerFactory.INSTANCE.newInstance(NAME);
        logger.error("failed {}", "x", cause);
        logger.info("plain", cause);

        assertThat(records).hasSize(2);
        assertEquals(Level.SEVERE, records.get(0).getLevel());
        assertEquals("failed x", records.get(0).getMessage());
        assertSame(cause, records.get(0).getThrown());
        assertSame(cause, records.get(1).getThrown());
    }
}
