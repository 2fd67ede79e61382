package org.safepay.config;

import org.safepay.lang.Option;

import java.util.Comparator;
import java.util.List;

/// Policy settings resolved across layers. For each key the highest-priority layer providing it wins; among layers
/// of equal priority, the one given first wins.
public record PolicySettings(List<ConfigLayer> layers) {
    public PolicySettings {
        layers = layers.stream()
                       .sorted(Comparator.comparingInt(ConfigLayer::priority)
                                         .reversed())
                       .toList();
    }

    public static PolicySettings policySettings(List<ConfigLayer> layers) {
        return new PolicySettings(layers);
    }

    public static PolicySettings policySettings(ConfigLayer... layers) {
        return policySettings(List.of(layers));
    }

    /// Resolved value of the key, together with the name of the layer that supplied it.
    public Option<Setting> setting(String key) {
        for (var layer : layers) {
            var value = layer.value(key);

            if (value.isPresent()) {
                return value.map(text -> Setting.setting(key, text, layer.name()));
            }
        }
        return Option.none();
    }

    /// Layer names, highest priority first.
    public List<String> origins() {
        return layers.stream()
                     .map(ConfigLayer::name)
                     .toList();
    }

    public record Setting(String key, String value, String origin) {
        public static Setting setting(String key, String value, String origin) {
            return new Setting(key, value, origin);
        }
    }
}
