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

import java.util.Arrays;

/**
 * Formats messages according to the SLF4J anchor convention: every {@code {}} pair is replaced by the
 * next argument, {@code \{}} escapes an anchor. Used by loggers that have no native support for it.
 */
final class MessageFormatter {

    private static final String DELIM_STR = "{}";
    private static final char ESCAPE_CHAR = '\\';

    private MessageFormatter() {
    }

    static FormattingTuple format(String messagePattern, Object arg) {
        return arrayFormat(messagePattern, new Object[] { arg });
    }

    static FormattingTuple format(String messagePattern, Object argA, Object argB) {
        return arrayFormat(messagePattern, new Object[] { argA, argB });
    }

    static FormattingTuple arrayFormat(final String messagePattern, final Object[] argArray) {
        if (argArray == null || argArray.length == 0) {
            return new FormattingTuple(messagePattern, null);
        }

        int lastArrIdx = argArray.length - 1;
        Object lastEntry = argArray[lastArrIdx];
        Throwable throwable = lastEntry instanceof Throwable ? (Throwable) lastEntry : null;

        if (messagePattern == null) {
            return new FormattingTuple(null, throwable);
        }

        int j = messagePattern.indexOf(DELIM_STR);
        if (j == -1) {
            return new FormattingTuple(messagePattern, throwable);
        }

        StringBuilder sbuf = new StringBuilder(messagePattern.length() + 50);
        int i = 0;
        int L = 0;
        do {
            boolean notEscaped = j == 0 || messagePattern.charAt(j - 1) != ESCAPE_CHAR;
            if (notEscaped) {
                sbuf.append(messagePattern, i, j);
            } else {
                sbuf.append(messagePattern, i, j - 1);
                // \\{} is a literal backslash followed by an anchor.
                notEscaped = j >= 2 && messagePattern.charAt(j - 2) == ESCAPE_CHAR;
            }

            i = j + 2;
            if (notEscaped) {
                deeplyAppendParameter(sbuf, argArray[L]);
                L++;
                if (L > lastArrIdx) {
                    break;
                }
            } else {
                sbuf.append(DELIM_STR);
            }
            j = messagePattern.indexOf(DELIM_STR, i);
        } while (j != -1);

        sbuf.append(messagePattern, i, messagePattern.length());
        return new FormattingTuple(sbuf.toString(), L <= lastArrIdx ? throwable : null);
    }

    private static void deeplyAppendParameter(StringBuilder sbuf, Object o) {
        if (o == null) {
            sbuf.append("null");
            return;
        }
        if (!o.getClass().isArray()) {
            try {
                sbuf.append(o);
            } catch (Throwable t) {
                sbuf.append("[FAILED toString(): ").append(t.getClass().getName()).append(']');
            }
        } else if (o instanceof Object[]) {
            sbuf.append(Arrays.deepToString((Object[]) o));
        } else if (o instanceof int[]) {
            sbuf.append(Arrays.toString((int[]) o));
        } else if (o instanceof long[]) {
            sbuf.append(Arrays.toString((long[]) o));
        } else if (o instanceof char[]) {
            sbuf.append(Arrays.toString((char[]) o));
        } else if (o instanceof byte[]) {
            sbuf.append(Arrays.toString((byte[]) o));
        } else {
            sbuf.append(o);
        }
    }

    /**
     * Holds the formatted message and the cause extracted from the arguments, if any.
     */
    static final class FormattingTuple {

        private final String message;
        private final Throwable throwable;

        FormattingTuple(String message, Throwable throwable) {
            this.message = message;
            this.throwable = throwable;
        }

        String getMessage() {
            return message;
        }

        Throwable getThrowable() {
            return throwable;
        }
    }
}
