package theory.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import theory.annotation.YamlData;
import theory.model.DataRow;
import theory.model.TestMethod;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads rows from a YAML resource shaped like:
 * <pre>
 * testCases:
 *   - Description: defaultValues      # optional, merged into every other entry
 *     Data:     { order: { currency: PLN } }
 *     Expected: { order_result: { vat_rate: 0.23 } }
 *   - Description: small order
 *     Data:     { order: { amount: 10.00 } }
 *     Expected: { order_result: { total: 12.30 } }
 * </pre>
 * Every entry except {@code defaultValues} yields the row {@code (data, expected)}.
 */
public class YamlDataProviderFactory implements DataProviderFactory<YamlData> {

    private static final Logger log = LoggerFactory.getLogger(YamlDataProviderFactory.class);

    static final String TEST_CASES_KEY = "testCases";

    @Override
    public DataProvider create(YamlData annotation, TestMethod testMethod) {
        String resourcePath = annotation.value();
        ClassLoader classLoader = testMethod.declaringClass().getClassLoader();

        return new DataProvider() {
            @Override
            public boolean canEnumerateAhead() {
                return true;
            }

            @Override
            public Iterable<DataRow> rows() {
                List<DataRow> rows = new ArrayList<>();
                for (YamlTestCase testCase : load(classLoader, resourcePath)) {
                    rows.add(DataRow.of(testCase.data(), testCase.expected()));
                }
                return rows;
            }
        };
    }

    static List<YamlTestCase> load(ClassLoader classLoader, String resourcePath) {
        try (InputStream inputStream = classLoader.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new DataDiscoveryException("Test data file not found: " + resourcePath
                        + ". Make sure it's in your resources folder and the path is correct.");
            }
            Object document = new Yaml().load(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
            return parse(document, resourcePath);
        } catch (IOException | YAMLException e) {
            throw new DataDiscoveryException("Failed to read test data from YAML file: " + resourcePath, e);
        }
    }

    static List<YamlTestCase> parse(Object document, String resourcePath) {
        if (document == null) {
            log.debug("YAML file {} is empty", resourcePath);
            return List.of();
        }
        if (!(document instanceof Map<?, ?> content)) {
            throw new DataDiscoveryException("YAML file " + resourcePath + " must contain a mapping with '" + TEST_CASES_KEY + "'");
        }
        Object rawCases = content.get(TEST_CASES_KEY);
        if (rawCases == null) {
            log.debug("No '{}' in YAML file {}", TEST_CASES_KEY, resourcePath);
            return List.of();
        }
        if (!(rawCases instanceof List<?> entries)) {
            throw new DataDiscoveryException("'" + TEST_CASES_KEY + "' in " + resourcePath + " must be a list");
        }

        List<YamlTestCase> cases = new ArrayList<>();
        YamlTestCase defaults = null;
        for (int i = 0; i < entries.size(); i++) {
            if (!(entries.get(i) instanceof Map<?, ?> entry)) {
                throw new DataDiscoveryException("Entry #" + i + " of '" + TEST_CASES_KEY + "' in " + resourcePath + " is not a mapping");
            }
            YamlTestCase testCase = new YamlTestCase(
                    entry.get("Description") == null ? null : entry.get("Description").toString(),
                    (Map<String, Object>) entry.get("Data"),
                    (Map<String, Object>) entry.get("Expected"));

            // defaultValues liczy się tylko jako pierwszy wpis
            if (i == 0 && testCase.isDefaults()) {
                defaults = testCase;
                log.debug("Loaded defaultValues from {}: data={}, expected={}", resourcePath, defaults.data(), defaults.expected());
                continue;
            }
            YamlTestCase merged = testCase.merge(defaults);
            log.debug("Test case '{}' from {}: data={}, expected={}", merged.description(), resourcePath, merged.data(), merged.expected());
            cases.add(merged);
        }
        return cases;
    }
}
