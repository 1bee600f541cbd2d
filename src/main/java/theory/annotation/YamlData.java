package theory.annotation;

import theory.provider.YamlDataProviderFactory;

import java.lang.annotation.*;

/**
 * Rows read from a YAML resource on the classpath, e.g. {@code @YamlData("theories/orders.yaml")}.
 * Each entry of the top-level {@code testCases} list becomes a {@code (data, expected)} row.
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Repeatable(YamlData.List.class)
@DataDiscoverer(YamlDataProviderFactory.class)
public @interface YamlData {

    /** Resource path with slashes and extension, no further conversion is done. */
    String value();

    @Target({ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Documented
    @interface List {
        YamlData[] value();
    }
}
