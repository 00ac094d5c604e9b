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

import com.google.common.base.Preconditions;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Argument checks and exception plumbing shared by all modules.
 */
public final class Exceptions {

    private Exceptions() {
    }

    /**
     * Tells whether the throwable is a JVM-level failure that must never be turned into an error value.
     *
     * @param ex The throwable to inspect.
     * @return True for {@link VirtualMachineError}s.
     */
    public static boolean mustRethrow(Throwable ex) {
        return ex instanceof VirtualMachineError;
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers, returning the innermost cause that
     * is not such a wrapper.
     *
     * @param ex The exception to unwrap.
     * @return The real failure, or ex itself if it is not a wrapper.
     */
    public static Throwable unwrap(Throwable ex) {
        if (ex instanceof CompletionException || ex instanceof ExecutionException) {
            Throwable cause = ex.getCause();
            if (cause != null) {
                return unwrap(cause);
            }
        }
        return ex;
    }

    /**
     * Wraps the throwable in a {@link CompletionException}, unless it already is one.
     *
     * @param ex The failure.
     * @return A CompletionException suitable for rethrowing from inside a future stage.
     */
    public static CompletionException asCompletionException(Throwable ex) {
        return ex instanceof CompletionException ? (CompletionException) ex : new CompletionException(ex);
    }

    /**
     * Throws a NullPointerException if arg is null, or an IllegalArgumentException if it is empty.
     *
     * @param arg     The argument to check.
     * @param argName The name of the argument, used in the exception message.
     * @return The arg.
     * @throws NullPointerException     If arg is null.
     * @throws IllegalArgumentException If arg is empty.
     */
    public static String checkNotNullOrEmpty(String arg, String argName) throws NullPointerException, IllegalArgumentException {
        Preconditions.checkNotNull(arg, argName);
        checkArgument(arg.length() > 0, argName, "Cannot be an empty string.");
        return arg;
    }

    /**
     * Collection variant of {@link #checkNotNullOrEmpty(String, String)}.
     *
     * @param <T>     Element type.
     * @param <V>     Collection type.
     * @param arg     The argument to check.
     * @param argName The name of the argument, used in the exception message.
     * @return The arg.
     */
    public static <T, V extends Collection<T>> V checkNotNullOrEmpty(V arg, String argName) throws NullPointerException, IllegalArgumentException {
        Preconditions.checkNotNull(arg, argName);
        checkArgument(!arg.isEmpty(), argName, "Cannot be an empty collection.");
        return arg;
    }

    /**
     * Map variant of {@link #checkNotNullOrEmpty(String, String)}.
     *
     * @param <K>     Key type.
     * @param <V>     Value type.
     * @param arg     The argument to check.
     * @param argName The name of the argument, used in the exception message.
     * @return The arg.
     */
    public static <K, V> Map<K, V> checkNotNullOrEmpty(Map<K, V> arg, String argName) throws NullPointerException, IllegalArgumentException {
        Preconditions.checkNotNull(arg, argName);
        checkArgument(!arg.isEmpty(), argName, "Cannot be an empty map.");
        return arg;
    }

    /**
     * Throws an IllegalArgumentException prefixed with the argument name if the condition does not hold.
     *
     * @param validCondition The condition.
     * @param argName        The name of the argument.
     * @param message        Message format, without the argument name.
     * @param args           Format arguments for message.
     * @throws IllegalArgumentException If validCondition is false.
     */
    public static void checkArgument(boolean validCondition, String argName, String message, Object... args) throws IllegalArgumentException {
        if (!validCondition) {
            throw new IllegalArgumentException(argName + ": " + String.format(message, args));
        }
    }

    /**
     * Tells whether the string is null or blank.
     *
     * @param value The string.
     * @return True if null, empty, or whitespace only.
     */
    public static boolean isNullOrBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
