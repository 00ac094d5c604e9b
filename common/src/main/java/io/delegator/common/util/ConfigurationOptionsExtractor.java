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
package io.delegator.common.util;

import com.google.common.annotations.VisibleForTesting;
import java.util.function.Function;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves tunables that may be overridden through a system property or an environment variable. A non-blank
 * system property wins over the environment, which wins over the supplied default.
 */
@Slf4j
public final class ConfigurationOptionsExtractor {

    private ConfigurationOptionsExtractor() {
    }

    /**
     * Resolves a string option.
     *
     * @param systemProperty      the system property name
     * @param environmentVariable the environment variable name
     * @param defaultValue        value used when neither source is set
     * @return the resolved value
     */
    public static String extractString(@NonNull String systemProperty, @NonNull String environmentVariable,
                                       @NonNull String defaultValue) {
        return extractString(systemProperty, environmentVariable, defaultValue, System::getenv);
    }

    @VisibleForTesting
    static String extractString(String systemProperty, String environmentVariable, String defaultValue,
                                Function<String, String> environment) {
        String valueFromSystemProperty = System.getProperty(systemProperty);
        if (valueFromSystemProperty != null && !valueFromSystemProperty.trim().isEmpty()) {
            return valueFromSystemProperty.trim();
        }
        String valueFromEnv = environment.apply(environmentVariable);
        if (valueFromEnv != null && !valueFromEnv.trim().isEmpty()) {
            return valueFromEnv.trim();
        }
        return defaultValue;
    }

    /**
     * Resolves an integer option. A value that does not parse is logged and replaced by the default.
     *
     * @param systemProperty      the system property name
     * @param environmentVariable the environment variable name
     * @param defaultValue        value used when neither source is set or the value is malformed
     * @return the resolved value
     */
    public static Integer extractInt(@NonNull String systemProperty, @NonNull String environmentVariable,
                                     @NonNull Integer defaultValue) {
        return extractInt(systemProperty, environmentVariable, defaultValue, System::getenv);
    }

    @VisibleForTesting
    static Integer extractInt(String systemProperty, String environmentVariable, Integer defaultValue,
                              Function<String, String> environment) {
        String property = extractString(systemProperty, environmentVariable, String.valueOf(defaultValue), environment);
        try {
            return Integer.parseInt(property);
        } catch (NumberFormatException e) {
            log.warn("Value of the system property {} or environment variable {} is not an integer: {}",
                    systemProperty, environmentVariable, property);
            return defaultValue;
        }
    }
}
