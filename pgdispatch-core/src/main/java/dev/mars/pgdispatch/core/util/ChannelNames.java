/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
package dev.mars.pgdispatch.core.util;

import java.nio.charset.StandardCharsets;

/**
 * Validation and quoting of LISTEN/NOTIFY channel names.
 *
 * <p>Channel names are PostgreSQL identifiers:
 * <ul>
 *   <li>Maximum length: 63 bytes in UTF-8 (longer names are silently truncated by the server,
 *       so notifications would arrive on a different name)</li>
 *   <li>Cannot be empty or contain NUL characters</li>
 *   <li>Are always emitted as quoted identifiers, so case and punctuation are preserved</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-18
 * @version 1.0
 */
public final class ChannelNames {

    /**
     * PostgreSQL maximum identifier length in bytes.
     * @see <a href="https://www.postgresql.org/docs/current/sql-syntax-lexical.html#SQL-SYNTAX-IDENTIFIERS">PostgreSQL Documentation</a>
     */
    public static final int MAX_CHANNEL_LENGTH = 63;

    private ChannelNames() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Validates a channel name.
     *
     * @throws IllegalArgumentException if validation fails
     */
    public static void validate(String channel) {
        if (channel == null || channel.isEmpty()) {
            throw new IllegalArgumentException("Channel name cannot be null or empty");
        }
        int bytes = byteLength(channel);
        if (bytes > MAX_CHANNEL_LENGTH) {
            throw new IllegalArgumentException(
                String.format("Channel name '%s' exceeds PostgreSQL maximum length of %d bytes (length: %d)",
                    channel, MAX_CHANNEL_LENGTH, bytes));
        }
        if (channel.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Channel name cannot contain NUL characters");
        }
    }

    /**
     * Checks if a channel name is valid without throwing an exception.
     */
    public static boolean isValid(String channel) {
        return channel != null && !channel.isEmpty() && byteLength(channel) <= MAX_CHANNEL_LENGTH
            && channel.indexOf('\0') < 0;
    }

    private static int byteLength(String channel) {
        return channel.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Quotes a channel name as a PostgreSQL identifier, doubling embedded quotes.
     */
    public static String quote(String channel) {
        validate(channel);
        return '"' + channel.replace("\"", "\"\"") + '"';
    }

    public static String listenSql(String channel) {
        return "LISTEN " + quote(channel);
    }

    public static String unlistenSql(String channel) {
        return "UNLISTEN " + quote(channel);
    }
}
