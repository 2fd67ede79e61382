package org.safepay.config;

import org.safepay.lang.Cause;

/// Error types for policy configuration.
public sealed interface ConfigError extends Cause {
    /// Setting whose value cannot be used for its key.
    ///
    /// @param key      Policy key, e.g. `cvv.max-length`
    /// @param value    Raw value as configured
    /// @param origin   Name of the layer which supplied the value
    /// @param expected Description of acceptable values
    record InvalidValue(String key, String value, String origin, String expected) implements ConfigError {
        public static InvalidValue invalidValue(String key, String value, String origin, String expected) {
            return new InvalidValue(key, value, origin, expected);
        }

        @Override
        public String message() {
            return "Invalid value '" + value + "' for config key '" + key + "' in " + origin + ": expected " + expected;
        }
    }

    static InvalidValue invalidValue(PolicySettings.Setting setting, String expected) {
        return InvalidValue.invalidValue(setting.key(), setting.value(), setting.origin(), expected);
    }

    /// Properties file or resource which cannot be read.
    record ReadFailed(String location, Throwable cause) implements ConfigError {
        public static ReadFailed readFailed(String location, Throwable cause) {
            return new ReadFailed(location, cause);
        }

        @Override
        public String message() {
            return "Failed to read config file '" + location + "': " + cause.getMessage();
        }
    }

    static ReadFailed readFailed(String location, Throwable cause) {
        return ReadFailed.readFailed(location, cause);
    }
}
