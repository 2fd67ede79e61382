package org.safepay.config;

import org.safepay.lang.Option;
import org.safepay.lang.Result;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import static org.safepay.lang.Option.option;

/// Named set of policy settings. When several layers provide the same key, the one with the higher priority wins.
///
/// Standard layers, lowest priority first:
///
///   - built-in defaults (-1000)
///   - properties file or classpath resource (0)
///   - environment variables (100), e.g. `SAFEPAY_CVV_MAX__LENGTH` for `cvv.max-length`
///   - system properties (200), e.g. `-Dsafepay.cvv.max-length=4`
///
/// Properties content is always decoded as UTF-8. Values are trimmed.
public record ConfigLayer(String name, int priority, Map<String, String> values) {
    public static final int DEFAULTS_PRIORITY = -1000;
    public static final int PROPERTIES_PRIORITY = 0;
    public static final int ENVIRONMENT_PRIORITY = 100;
    public static final int SYSTEM_PROPERTIES_PRIORITY = 200;

    public ConfigLayer {
        values = Map.copyOf(values);
    }

    public static ConfigLayer configLayer(String name, int priority, Map<String, String> values) {
        return new ConfigLayer(name, priority, values);
    }

    public static ConfigLayer defaults(Map<String, String> values) {
        return configLayer("defaults", DEFAULTS_PRIORITY, values);
    }

    /// Read the variables which correspond to the given keys.
    ///
    /// A key maps to the prefix followed by the upper-cased key, with `-` written as `__` and `.` as `_`.
    public static ConfigLayer environment(String prefix, Collection<String> keys, Map<String, String> environment) {
        var values = new LinkedHashMap<String, String>();

        for (var key : keys) {
            option(environment.get(variableName(prefix, key))).onPresent(value -> values.put(key, value.trim()));
        }
        return configLayer("environment " + prefix + "*", ENVIRONMENT_PRIORITY, values);
    }

    /// Read the system properties named by the prefix followed by each key.
    public static ConfigLayer systemProperties(String prefix, Collection<String> keys, Properties properties) {
        var values = new LinkedHashMap<String, String>();

        for (var key : keys) {
            option(properties.getProperty(prefix + key)).onPresent(value -> values.put(key, value.trim()));
        }
        return configLayer("system properties " + prefix + "*", SYSTEM_PROPERTIES_PRIORITY, values);
    }

    public static Result<ConfigLayer> propertiesFile(Path path) {
        var location = path.toString();

        return Result.lift(throwable -> ConfigError.readFailed(location, throwable),
                           () -> {
                               try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                                   return load(reader);
                               }
                           })
                     .map(values -> configLayer(location, PROPERTIES_PRIORITY, values));
    }

    public static Result<ConfigLayer> classpathResource(String resource) {
        var location = "classpath:" + resource;

        return Result.lift(throwable -> ConfigError.readFailed(location, throwable),
                           () -> {
                               try (var reader = openResource(resource)) {
                                   return load(reader);
                               }
                           })
                     .map(values -> configLayer(location, PROPERTIES_PRIORITY, values));
    }

    public Option<String> value(String key) {
        return option(values.get(key));
    }

    static String variableName(String prefix, String key) {
        return prefix + key.toUpperCase(Locale.ROOT)
                           .replace("-", "__")
                           .replace('.', '_');
    }

    private static Reader openResource(String resource) throws FileNotFoundException {
        var stream = ConfigLayer.class.getClassLoader().getResourceAsStream(resource);

        if (stream == null) {
            throw new FileNotFoundException("Resource not found: " + resource);
        }
        return new InputStreamReader(stream, StandardCharsets.UTF_8);
    }

    private static Map<String, String> load(Reader reader) throws IOException {
        var properties = new Properties();
        properties.load(reader);

        var result = new LinkedHashMap<String, String>();
        properties.stringPropertyNames()
                  .forEach(key -> result.put(key, properties.getProperty(key).trim()));
        return result;
    }
}
