package org.safepay.config;

import org.safepay.config.PolicySettings.Setting;
import org.safepay.domain.policy.ValidationPolicy;
import org.safepay.domain.value.LengthBounds;
import org.safepay.domain.value.PasswordPolicy;
import org.safepay.lang.Option;
import org.safepay.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.safepay.lang.Result.success;

/// Builds a [ValidationPolicy] from layered settings.
///
/// Absent keys take their values from [ValidationPolicy#DEFAULT]. Every malformed value is reported, so a
/// configuration with several mistakes fails once with all of them, each naming the layer it came from.
public final class PolicyLoader {
    private static final Logger log = LoggerFactory.getLogger(PolicyLoader.class);

    public static final String NAME_MIN_LENGTH = "name.min-length";
    public static final String CARD_NUMBER_MAX_LENGTH = "card.number.max-length";
    public static final String CVV_MIN_LENGTH = "cvv.min-length";
    public static final String CVV_MAX_LENGTH = "cvv.max-length";
    public static final String ACCOUNT_MIN_LENGTH = "account.min-length";
    public static final String ACCOUNT_MAX_LENGTH = "account.max-length";
    public static final String PASSWORD_MIN_LENGTH = "password.min-length";
    public static final String PASSWORD_REQUIRE_UPPERCASE = "password.require-uppercase";
    public static final String PASSWORD_REQUIRE_LOWERCASE = "password.require-lowercase";
    public static final String PASSWORD_REQUIRE_DIGIT = "password.require-digit";
    public static final String PASSWORD_REQUIRE_SYMBOL = "password.require-symbol";

    /// Every key the policy reads.
    public static final List<String> KEYS = List.of(NAME_MIN_LENGTH,
                                                    CARD_NUMBER_MAX_LENGTH,
                                                    CVV_MIN_LENGTH,
                                                    CVV_MAX_LENGTH,
                                                    ACCOUNT_MIN_LENGTH,
                                                    ACCOUNT_MAX_LENGTH,
                                                    PASSWORD_MIN_LENGTH,
                                                    PASSWORD_REQUIRE_UPPERCASE,
                                                    PASSWORD_REQUIRE_LOWERCASE,
                                                    PASSWORD_REQUIRE_DIGIT,
                                                    PASSWORD_REQUIRE_SYMBOL);

    public static final String PROPERTIES_RESOURCE = "safepay.properties";
    public static final String ENVIRONMENT_PREFIX = "SAFEPAY_";
    public static final String SYSTEM_PROPERTY_PREFIX = "safepay.";

    private static final String POSITIVE_INTEGER = "a positive integer";
    private static final String BOOLEAN = "true or false";

    private PolicyLoader() {}

    /// Load the policy from the standard layers of this process.
    public static Result<ValidationPolicy> validationPolicy() {
        return validationPolicy(standardLayers(System.getenv(), System.getProperties()));
    }

    /// Load the policy from a properties file laid over the built-in defaults. The file must be readable.
    public static Result<ValidationPolicy> validationPolicy(Path file) {
        return ConfigLayer.propertiesFile(file)
                          .map(layer -> PolicySettings.policySettings(ConfigLayer.defaults(defaults()), layer))
                          .flatMap(settings -> validationPolicy(settings));
    }

    public static Result<ValidationPolicy> validationPolicy(PolicySettings settings) {
        var defaults = ValidationPolicy.DEFAULT;

        return Result.all(positiveInt(settings, NAME_MIN_LENGTH, defaults.nameMinLength()),
                          positiveInt(settings, CARD_NUMBER_MAX_LENGTH, defaults.cardNumberMaxLength()),
                          bounds(settings, CVV_MIN_LENGTH, CVV_MAX_LENGTH, defaults.cvvBounds()),
                          bounds(settings, ACCOUNT_MIN_LENGTH, ACCOUNT_MAX_LENGTH, defaults.accountNumberBounds()),
                          passwordPolicy(settings, defaults.passwordPolicy()))
                     .map(ValidationPolicy::validationPolicy)
                     .onSuccess(policy -> log.info("Validation policy loaded from {}: {}", settings.origins(), policy))
                     .onFailure(cause -> cause.causes()
                                              .forEach(error -> log.warn("Rejected configuration value: {}",
                                                                         error.message())));
    }

    /// Built-in defaults, `safepay.properties` from the classpath when present, `SAFEPAY_*` variables and
    /// `safepay.*` system properties.
    public static PolicySettings standardLayers(Map<String, String> environment, Properties systemProperties) {
        var layers = new ArrayList<ConfigLayer>();

        layers.add(ConfigLayer.defaults(defaults()));
        ConfigLayer.classpathResource(PROPERTIES_RESOURCE)
                   .onSuccess(layers::add)
                   .onFailure(cause -> log.debug("Properties layer skipped: {}", cause.message()));
        layers.add(ConfigLayer.environment(ENVIRONMENT_PREFIX, KEYS, environment));
        layers.add(ConfigLayer.systemProperties(SYSTEM_PROPERTY_PREFIX, KEYS, systemProperties));

        return PolicySettings.policySettings(layers);
    }

    /// Built-in values of every key, matching [ValidationPolicy#DEFAULT]. Unbounded limits have no entry.
    public static Map<String, String> defaults() {
        var defaults = ValidationPolicy.DEFAULT;
        var password = defaults.passwordPolicy();

        return Map.of(NAME_MIN_LENGTH, String.valueOf(defaults.nameMinLength()),
                      CARD_NUMBER_MAX_LENGTH, String.valueOf(defaults.cardNumberMaxLength()),
                      CVV_MIN_LENGTH, String.valueOf(defaults.cvvBounds().min().unwrap()),
                      CVV_MAX_LENGTH, String.valueOf(defaults.cvvBounds().max().unwrap()),
                      PASSWORD_MIN_LENGTH, String.valueOf(password.minLength()),
                      PASSWORD_REQUIRE_UPPERCASE, String.valueOf(password.requireUppercase()),
                      PASSWORD_REQUIRE_LOWERCASE, String.valueOf(password.requireLowercase()),
                      PASSWORD_REQUIRE_DIGIT, String.valueOf(password.requireDigit()),
                      PASSWORD_REQUIRE_SYMBOL, String.valueOf(password.requireSymbol()));
    }

    private static Result<PasswordPolicy> passwordPolicy(PolicySettings settings, PasswordPolicy defaults) {
        return Result.all(positiveInt(settings, PASSWORD_MIN_LENGTH, defaults.minLength()),
                          flag(settings, PASSWORD_REQUIRE_UPPERCASE, defaults.requireUppercase()),
                          flag(settings, PASSWORD_REQUIRE_LOWERCASE, defaults.requireLowercase()),
                          flag(settings, PASSWORD_REQUIRE_DIGIT, defaults.requireDigit()),
                          flag(settings, PASSWORD_REQUIRE_SYMBOL, defaults.requireSymbol()))
                     .map(PasswordPolicy::passwordPolicy);
    }

    private static Result<LengthBounds> bounds(PolicySettings settings,
                                               String minKey,
                                               String maxKey,
                                               LengthBounds defaults) {
        return Result.all(optionalPositiveInt(settings, minKey, defaults.min()),
                          optionalPositiveInt(settings, maxKey, defaults.max()))
                     .map(LengthBounds::new)
                     .filter(bounds -> invertedBounds(settings, minKey, maxKey, bounds), PolicyLoader::ordered);
    }

    private static ConfigError invertedBounds(PolicySettings settings,
                                              String minKey,
                                              String maxKey,
                                              LengthBounds bounds) {
        var minimum = Setting.setting(minKey, String.valueOf(bounds.min().unwrap()), "defaults");

        return ConfigError.invalidValue(settings.setting(minKey).or(minimum),
                                        "a value not greater than " + maxKey + " (" + bounds.max().unwrap() + ")");
    }

    private static boolean ordered(LengthBounds bounds) {
        return bounds.min().fold(() -> true, bounds::fitsMax);
    }

    private static Result<Integer> positiveInt(PolicySettings settings, String key, int defaultValue) {
        return optionalPositiveInt(settings, key, Option.some(defaultValue)).map(Option::unwrap);
    }

    private static Result<Option<Integer>> optionalPositiveInt(PolicySettings settings,
                                                               String key,
                                                               Option<Integer> defaultValue) {
        return settings.setting(key)
                       .<Result<Option<Integer>>>fold(() -> success(defaultValue),
                                                      setting -> positiveInt(setting).map(Option::some));
    }

    private static Result<Integer> positiveInt(Setting setting) {
        return Result.lift(throwable -> ConfigError.invalidValue(setting, POSITIVE_INTEGER),
                           () -> Integer.parseInt(setting.value().trim()))
                     .filter(value -> ConfigError.invalidValue(setting, POSITIVE_INTEGER), value -> value > 0);
    }

    private static Result<Boolean> flag(PolicySettings settings, String key, boolean defaultValue) {
        return settings.setting(key)
                       .<Result<Boolean>>fold(() -> success(defaultValue), PolicyLoader::flag);
    }

    private static Result<Boolean> flag(Setting setting) {
        var text = setting.value().trim();

        if ("true".equalsIgnoreCase(text)) {
            return success(true);
        }
        if ("false".equalsIgnoreCase(text)) {
            return success(false);
        }
        return ConfigError.invalidValue(setting, BOOLEAN).result();
    }
}
