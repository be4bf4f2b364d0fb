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
package io.needle.util.internal;

import io.needle.util.internal.logging.InternalLogger;
import io.needle.util.internal.logging.InternalLoggerFactory;

/**
 * Reads the {@code -Dio.needle.*} tuning knobs from the Java system properties.
 */
public final class SystemPropertyUtil {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(SystemPropertyUtil.class);

    /**
     * Returns the value of the system property {@code key}, or {@code def} if it is unset or cannot
     * be read.
     *
     * @throws NullPointerException if {@code key} is {@code null}.
     * @throws IllegalArgumentException if {@code key} is empty.
     */
    public static String get(String key, String def) {
        ObjectUtil.checkNotNull(key, "key");
        if (key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty.");
        }

        String value;
        try {
            value = System.getProperty(key);
        } catch (SecurityException e) {
            logger.warn("Unable to read system property '{}' (using: {})", key, def, e);
            return def;
        }
        return value == null ? def : value;
    }

    /**
     * Returns the system property {@code key} parsed as an {@code int}. Falls back to {@code def},
     * with a warning, when the value is not a decimal integer.
     */
    public static int getInt(String key, int def) {
        String value = get(key, null);
        if (value == null) {
            return def;
        }

        value = value.trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("-D{} is not an integer: {} (using: {})", key, value, def);
            return def;
        }
    }

    private SystemPropertyUtil() {
    }
}
