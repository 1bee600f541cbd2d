package common;

import theory.annotation.InlineData;
import theory.annotation.MemberData;
import theory.annotation.Theory;
import theory.annotation.YamlData;
import theory.model.DataRow;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Theories discovered by the tests; none of them is ever run.
 */
public class SampleTheories {

    static List<Object[]> amounts() {
        return List.of(
                new Object[]{new BigDecimal("100.00"), "PLN"},
                new Object[]{new BigDecimal("12.50"), "EUR"});
    }

    static final String[] CURRENCIES = {"PLN", "EUR", "USD"};

    static Stream<DataRow> nothing() {
        return Stream.empty();
    }

    static List<Object[]> exploding() {
        throw new IllegalStateException("database not reachable");
    }

    static List<Object> freshObjects() {
        return List.of(new Object());
    }

    int notStatic() {
        return 1;
    }

    @Theory
    @InlineData({"PLN", "100.00"})
    @InlineData({"EUR", "12.50"})
    void inlineRows(String currency, String amount) {
    }

    @Theory
    @MemberData("amounts")
    void memberRows(BigDecimal amount, String currency) {
    }

    @Theory
    @MemberData("CURRENCIES")
    void fieldRows(String currency) {
    }

    @Theory(skip = "VAT rules under review")
    @MemberData("exploding")
    void skipped(Object value) {
    }

    @Theory
    @MemberData("nothing")
    void noData(Object value) {
    }

    @Theory
    @InlineData({"PLN"})
    @MemberData(value = "freshObjects", disableDiscoveryEnumeration = true)
    void runtimeOnly(Object value) {
    }

    @Theory
    @MemberData("exploding")
    void brokenSource(Object value) {
    }

    @Theory
    @MemberData("missingMember")
    void missingSource(Object value) {
    }

    @Theory
    @MemberData("notStatic")
    void instanceSource(Object value) {
    }

    @Theory
    @YamlData("theories/orders.yaml")
    void yamlRows(Map<String, Object> data, Map<String, Object> expected) {
    }

    @Theory
    @YamlData("theories/no-cases.yaml")
    void emptyYaml(Map<String, Object> data, Map<String, Object> expected) {
    }

    @Theory
    @YamlData("theories/does-not-exist.yaml")
    void missingYaml(Map<String, Object> data, Map<String, Object> expected) {
    }

    @Theory
    @MemberData(value = "CURRENCIES", of = OtherSources.class)
    void foreignRows(String currency) {
    }

    @Theory
    void undeclaredData(String currency) {
    }

    @Theory
    @MemberData(value = "RATES", of = UninitializableSource.class)
    void uninitializableSource(Object rate) {
    }

    void notATheory() {
    }

    public static class OtherSources {
        static final List<String> CURRENCIES = List.of("CHF", "GBP");
    }

    /** Fails static initialization on first access. */
    public static class UninitializableSource {
        static final List<Object> RATES = fetchRates();

        private static List<Object> fetchRates() {
            throw new IllegalStateException("exchange rates unavailable");
        }
    }
}
