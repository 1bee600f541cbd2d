package theory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import theory.model.DiscoveryOptions;
import theory.model.MethodDisplay;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Loads {@link DiscoveryOptions} from {@code theory-discovery.properties} on the classpath.
 * System properties with the same keys take precedence over the file.
 */
public class DiscoveryOptionsLoader {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryOptionsLoader.class);

    public static final String CONFIG_FILE_NAME = "theory-discovery.properties";
    public static final String PRE_ENUMERATE_KEY = "theory.preEnumerateTheories";
    public static final String METHOD_DISPLAY_KEY = "theory.methodDisplay";

    private final ClassLoader classLoader;
    private final Properties systemProperties;

    public DiscoveryOptionsLoader() {
        this(DiscoveryOptionsLoader.class.getClassLoader(), System.getProperties());
    }

    public DiscoveryOptionsLoader(ClassLoader classLoader, Properties systemProperties) {
        this.classLoader = classLoader;
        this.systemProperties = systemProperties;
    }

    public DiscoveryOptions load() {
        return load(CONFIG_FILE_NAME);
    }

    public DiscoveryOptions load(String fileName) {
        Properties props = loadProperties(fileName);
        DiscoveryOptions defaults = DiscoveryOptions.defaults();

        String preEnumerate = lookup(props, PRE_ENUMERATE_KEY);
        String methodDisplay = lookup(props, METHOD_DISPLAY_KEY);

        DiscoveryOptions options = new DiscoveryOptions(
                preEnumerate == null ? defaults.preEnumerateTheories() : Boolean.parseBoolean(preEnumerate.trim()),
                methodDisplay == null ? defaults.methodDisplay() : parseMethodDisplay(methodDisplay));
        log.info("Discovery options: preEnumerateTheories={}, methodDisplay={}", options.preEnumerateTheories(), options.methodDisplay());
        return options;
    }

    private String lookup(Properties fileProps, String key) {
        String value = systemProperties.getProperty(key);
        return value != null ? value : fileProps.getProperty(key);
    }

    static MethodDisplay parseMethodDisplay(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return MethodDisplay.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown " + METHOD_DISPLAY_KEY + " value: '" + value
                    + "'; expected one of CLASS_AND_METHOD, METHOD", e);
        }
    }

    private Properties loadProperties(String fileName) {
        Properties props = new Properties();
        try (InputStream input = classLoader.getResourceAsStream(fileName)) {
            if (input == null) {
                log.warn("Configuration file {} not found. Default values will be used.", fileName);
                return props;
            }
            props.load(input);
        } catch (IOException ex) {
            log.error("Failed to load configuration file: {}", fileName, ex);
            throw new IllegalStateException("Cannot load discovery configuration from " + fileName, ex);
        }
        return props;
    }
}
