package org.safepay.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.safepay.domain.policy.ValidationPolicy;
import org.safepay.lang.Cause;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyLoaderTest {
    private static PolicySettings settings(Map<String, String> values) {
        return PolicySettings.policySettings(ConfigLayer.configLayer("test", 0, values));
    }

    @Nested
    class FromSettings {
        @Test
        void validationPolicy_usesDefaultsForEmptySettings() {
            PolicyLoader.validationPolicy(settings(Map.of()))
                        .onFailureRun(Assertions::fail)
                        .onSuccess(policy -> assertThat(policy).isEqualTo(ValidationPolicy.DEFAULT));
        }

        @Test
        void validationPolicy_appliesConfiguredValues() {
            var layer = ConfigLayer.classpathResource("policy-test.properties").unwrap();

            PolicyLoader.validationPolicy(PolicySettings.policySettings(layer))
                        .onFailureRun(Assertions::fail)
                        .onSuccess(policy -> {
                            assertThat(policy.nameMinLength()).isEqualTo(2);
                            assertThat(policy.cardNumberMaxLength()).isEqualTo(16);
                            assertThat(policy.accountNumberBounds().min().unwrap()).isEqualTo(4);
                            assertThat(policy.accountNumberBounds().max().unwrap()).isEqualTo(17);
                            assertThat(policy.cvvBounds()).isEqualTo(ValidationPolicy.DEFAULT.cvvBounds());
                            assertThat(policy.passwordPolicy().requireSymbol()).isFalse();
                            assertThat(policy.passwordPolicy().requireDigit()).isTrue();
                        });
        }

        @Test
        void validationPolicy_reportsEveryMalformedValue() {
            var result = PolicyLoader.validationPolicy(settings(Map.of(PolicyLoader.NAME_MIN_LENGTH, "zero",
                                                                       PolicyLoader.CARD_NUMBER_MAX_LENGTH, "-19",
                                                                       PolicyLoader.PASSWORD_REQUIRE_DIGIT, "yes")));

            assertThat(result.causes()).hasSize(3)
                                       .allMatch(ConfigError.InvalidValue.class::isInstance);
            assertThat(result.causes()).extracting(cause -> ((ConfigError.InvalidValue) cause).key())
                                       .containsExactly(PolicyLoader.NAME_MIN_LENGTH,
                                                        PolicyLoader.CARD_NUMBER_MAX_LENGTH,
                                                        PolicyLoader.PASSWORD_REQUIRE_DIGIT);
        }

        @Test
        void validationPolicy_acceptsFlagsInAnyCase() {
            PolicyLoader.validationPolicy(settings(Map.of(PolicyLoader.PASSWORD_REQUIRE_SYMBOL, " FALSE ")))
                        .onFailureRun(Assertions::fail)
                        .onSuccess(policy -> assertThat(policy.passwordPolicy().requireSymbol()).isFalse());
        }

        @Test
        void validationPolicy_rejectsInvertedBounds() {
            var result = PolicyLoader.validationPolicy(settings(Map.of(PolicyLoader.CVV_MIN_LENGTH, "5",
                                                                       PolicyLoader.CVV_MAX_LENGTH, "4")));

            assertThat(result.causes()).extracting(Cause::message)
                                       .containsExactly("Invalid value '5' for config key 'cvv.min-length' in test: "
                                                        + "expected a value not greater than cvv.max-length (4)");
        }

        @Test
        void validationPolicy_rejectsMinimumAboveDefaultMaximum() {
            assertThat(PolicyLoader.validationPolicy(settings(Map.of(PolicyLoader.CVV_MIN_LENGTH, "6")))
                                   .isFailure()).isTrue();
        }

        @Test
        void defaults_describeDefaultPolicy() {
            PolicyLoader.validationPolicy(PolicySettings.policySettings(ConfigLayer.defaults(PolicyLoader.defaults())))
                        .onFailureRun(Assertions::fail)
                        .onSuccess(policy -> assertThat(policy).isEqualTo(ValidationPolicy.DEFAULT));
        }
    }

    @Nested
    class StandardLayers {
        @Test
        void standardLayers_orderSystemPropertiesOverEnvironmentOverResource() {
            var properties = new Properties();
            properties.setProperty("safepay.password.min-length", "20");

            var settings = PolicyLoader.standardLayers(Map.of("SAFEPAY_PASSWORD_MIN__LENGTH", "16",
                                                              "SAFEPAY_CVV_MAX__LENGTH", "5"),
                                                       properties);

            assertThat(settings.origins()).containsExactly("system properties safepay.*",
                                                           "environment SAFEPAY_*",
                                                           "classpath:safepay.properties",
                                                           "defaults");
            PolicyLoader.validationPolicy(settings)
                        .onFailureRun(Assertions::fail)
                        .onSuccess(policy -> {
                            assertThat(policy.passwordPolicy().minLength()).isEqualTo(20);
                            assertThat(policy.cvvBounds().max().unwrap()).isEqualTo(5);
                        });
        }

        @Test
        void standardLayers_nameTheLayerOfARejectedValue() {
            var settings = PolicyLoader.standardLayers(Map.of("SAFEPAY_NAME_MIN__LENGTH", "many"), new Properties());

            assertThat(PolicyLoader.validationPolicy(settings).causes()).extracting(Cause::message)
                                                                        .containsExactly("Invalid value 'many' for config key "
                                                                                         + "'name.min-length' in environment SAFEPAY_*: "
                                                                                         + "expected a positive integer");
        }

        @Test
        void validationPolicy_readsClasspathPropertiesLayer() {
            PolicyLoader.validationPolicy()
                        .onFailureRun(Assertions::fail)
                        .onSuccess(policy -> assertThat(policy.passwordPolicy().minLength()).isEqualTo(14));
        }
    }

    @Nested
    class FromFile {
        @TempDir
        Path tempDir;

        @Test
        void validationPolicy_readsFileOverDefaults() throws IOException {
            var file = tempDir.resolve("policy.properties");
            Files.writeString(file, "cvv.min-length = 4\npassword.require-uppercase=false\n");

            PolicyLoader.validationPolicy(file)
                        .onFailureRun(Assertions::fail)
                        .onSuccess(policy -> {
                            assertThat(policy.cvvBounds().min().unwrap()).isEqualTo(4);
                            assertThat(policy.cvvBounds().max().unwrap()).isEqualTo(4);
                            assertThat(policy.passwordPolicy().requireUppercase()).isFalse();
                            assertThat(policy.passwordPolicy().minLength()).isEqualTo(12);
                        });
        }

        @Test
        void validationPolicy_failsForMissingFile() {
            PolicyLoader.validationPolicy(tempDir.resolve("missing.properties"))
                        .onSuccessRun(Assertions::fail)
                        .onFailure(cause -> assertThat(cause).isInstanceOf(ConfigError.ReadFailed.class));
        }
    }
}
