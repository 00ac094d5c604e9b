/**
 * Copyright Delegator Authors.
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
package io.delegator.common;

import org.slf4j.Logger;

/**
 * Logging helpers for network-bound operations and credential material.
 */
public final class LoggerHelpers {

    private static final int VISIBLE_TOKEN_CHARS = 6;

    private LoggerHelpers() {
    }

    /**
     * Logs entry into an operation at TRACE level.
     *
     * @param log     The logger.
     * @param context Identifies the instance performing the operation (for example a zone or an issuer).
     * @param method  The operation name.
     * @param args    Arguments worth logging. Never pass tokens or secrets here.
     * @return A correlation id for {@link #traceLeave}; 0 when TRACE is disabled.
     */
    public static long traceEnterWithContext(Logger log, String context, String method, Object... args) {
        if (!log.isTraceEnabled()) {
            return 0;
        }

        long time = System.nanoTime();
        log.trace("ENTER {}::{}@{} {}.", context, method, time, args);
        return time;
    }

    /**
     * Logs exit from an operation started with {@link #traceEnterWithContext}, including the elapsed time.
     *
     * @param log          The logger.
     * @param context      Same context passed on entry.
     * @param method       The operation name.
     * @param traceEnterId The id returned on entry.
     * @param args         Result details worth logging.
     */
    public static void traceLeave(Logger log, String context, String method, long traceEnterId, Object... args) {
        if (!log.isTraceEnabled()) {
            return;
        }

        long elapsedMicros = (System.nanoTime() - traceEnterId) / 1000;
        if (args.length == 0) {
            log.trace("LEAVE {}::{}@{} (elapsed={}us).", context, method, traceEnterId, elapsedMicros);
        } else {
            log.trace("LEAVE {}::{}@{} {} (elapsed={}us).", context, method, traceEnterId, args, elapsedMicros);
        }
    }

    /**
     * Returns the throwable itself when DEBUG is on (so the stack trace gets logged), or just its string form.
     *
     * @param log The logger to query.
     * @param e   The failure.
     * @return e or e.toString().
     */
    public static Object exceptionSummary(Logger log, Throwable e) {
        return log.isDebugEnabled() ? e : e.toString();
    }

    /**
     * Renders a credential so that it can appear in a log line: only a short prefix and the length are kept.
     *
     * @param token The token or secret, may be null.
     * @return A redacted form.
     */
    public static String redact(String token) {
        if (token == null) {
            return "<none>";
        }
        if (token.length() <= VISIBLE_TOKEN_CHARS) {
            return "***(" + token.length() + ")";
        }
        return token.substring(0, VISIBLE_TOKEN_CHARS) + "...(" + token.length() + ")";
    }
}
