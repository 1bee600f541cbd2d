package theory.provider;

import java.util.LinkedHashMap; // zachowuje kolejność kluczy z pliku
import java.util.Map;

/**
 * One entry of a YAML data file's {@code testCases} list.
 */
public record YamlTestCase(String description, Map<String, Object> data, Map<String, Object> expected) {

    public static final String DEFAULTS_DESCRIPTION = "defaultValues";

    public boolean isDefaults() {
        return DEFAULTS_DESCRIPTION.equals(description);
    }

    /**
     * Overlays this entry on {@code defaults}. Nested maps are merged recursively, other values
     * from this entry win.
     */
    public YamlTestCase merge(YamlTestCase defaults) {
        if (defaults == null) {
            return this;
        }
        return new YamlTestCase(
                description != null ? description : defaults.description(),
                deepMerge(defaults.data(), data),
                deepMerge(defaults.expected(), expected));
    }

    static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> overlay) {
        if (base == null && overlay == null) {
            return null;
        }
        if (overlay == null) {
            return new LinkedHashMap<>(base);
        }
        if (base == null) {
            return new LinkedHashMap<>(overlay);
        }

        Map<String, Object> result = new LinkedHashMap<>(base);
        overlay.forEach((key, value) -> {
            Object baseValue = result.get(key);
            if (baseValue instanceof Map && value instanceof Map) {
                result.put(key, deepMerge((Map<String, Object>) baseValue, (Map<String, Object>) value));
            } else {
                result.put(key, value);
            }
        });
        return result;
    }
}
