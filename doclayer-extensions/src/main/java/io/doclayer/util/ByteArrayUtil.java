/*
 * ByteArrayUtil.java
 *
 * This source file is part of the DocLayer open source project
 *
 * Copyright 2025 the DocLayer project authors
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

package io.doclayer.util;

import com.apple.foundationdb.annotation.API;

import javax.annotation.Nullable;

/**
 * Helpers for putting raw bytes into log messages.
 */
@API(API.Status.UNSTABLE)
public final class ByteArrayUtil {
    private static final char[] LOWER_CASE_HEX_CHARS = "0123456789abcdef".toCharArray();
    private static final int MINIMUM_PRINTABLE_CHARACTER = 32;
    private static final int MAXIMUM_PRINTABLE_CHARACTER = 127;
    private static final byte BACKSLASH_CHARACTER = '\\';
    private static final byte EQUALS_CHARACTER = '=';
    private static final byte DOUBLE_QUOTE_CHARACTER = '"';

    private ByteArrayUtil() {
    }

    /**
     * Render a byte array so that it can be safely embedded in a {@code key="value"} log message.
     * Printable ASCII is kept as is; backslashes are doubled; everything else, including {@code =} and
     * {@code "}, is written as {@code \xNN}.
     *
     * @param bytes the bytes to render
     * @return the rendered string, or {@code null} if {@code bytes} is {@code null}
     */
    @Nullable
    public static String loggable(@Nullable byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            if (b >= MINIMUM_PRINTABLE_CHARACTER && b < MAXIMUM_PRINTABLE_CHARACTER &&
                    b != BACKSLASH_CHARACTER && b != EQUALS_CHARACTER && b != DOUBLE_QUOTE_CHARACTER) {
                sb.append((char)b);
            } else if (b == BACKSLASH_CHARACTER) {
                sb.append("\\\\");
            } else {
                sb.append("\\x").append(LOWER_CASE_HEX_CHARS[(b >>> 4) & 0x0F]).append(LOWER_CASE_HEX_CHARS[b & 0x0F]);
            }
        }
        return sb.toString();
    }
}
