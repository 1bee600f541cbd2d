package theory.annotation;

import theory.provider.InlineDataProviderFactory;

import java.lang.annotation.*;

/**
 * One row of literal arguments.
 * <pre>
 * &#64;Theory
 * &#64;InlineData({"PLN", "100.00"})
 * &#64;InlineData({"EUR", "12.50"})
 * void shouldAcceptCurrency(String currency, String amount) { ... }
 * </pre>
 */
@Target({ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Repeatable(InlineData.List.class)
@DataDiscoverer(InlineDataProviderFactory.class)
public @interface InlineData {
    String[] value();

    @Target({ElementType.METHOD})
    @Retention(RetentionPolicy.RUNTIME)
    @Documented
    @interface List {
        InlineData[] value();
    }
}
