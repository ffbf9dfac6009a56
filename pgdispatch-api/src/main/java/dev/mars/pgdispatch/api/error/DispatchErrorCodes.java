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
package dev.mars.pgdispatch.api.error;

/**
 * Standard error codes reported to application error taggers.
 *
 * Error code ranges:
 * - PGDERR0001-0049: Command validation errors
 * - PGDERR0050-0099: Connection lifecycle errors
 * - PGDERR0100-0149: SQL execution errors
 * - PGDERR0150-0199: LISTEN/UNLISTEN errors
 */
public final class DispatchErrorCodes {

    private DispatchErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // Command Validation Errors (0001-0049)
    // ========================================================================
    public static final String INVALID_CONNECTION_ID = "PGDERR0001";
    public static final String NOT_CONNECTED = "PGDERR0002";

    // ========================================================================
    // Connection Lifecycle Errors (0050-0099)
    // ========================================================================
    public static final String CONNECT_FAILED = "PGDERR0050";
    public static final String DISCONNECT_FAILED = "PGDERR0051";

    // ========================================================================
    // SQL Execution Errors (0100-0149)
    // ========================================================================
    public static final String SQL_FAILED = "PGDERR0100";

    // ========================================================================
    // LISTEN/UNLISTEN Errors (0150-0199)
    // ========================================================================
    public static final String LISTEN_FAILED = "PGDERR0150";
    public static final String UNLISTEN_FAILED = "PGDERR0151";
}
