package theory.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import theory.diagnostics.DiagnosticSink;
import theory.factory.TestCaseFactory;
import theory.model.DataProviderDirective;
import theory.model.DataRow;
import theory.model.DiscoveryOptions;
import theory.model.TestCase;
import theory.model.TestMethod;
import theory.provider.DataProvider;
import theory.provider.ProviderResolver;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expands one theory into the test cases registered for it.
 * <ul>
 *     <li>a skipped theory gives a single skipped case, its data is never read;</li>
 *     <li>with pre-enumeration off, or when any provider cannot enumerate ahead, a single deferred case;</li>
 *     <li>otherwise one bound case per row, in directive order and then row order;</li>
 *     <li>no rows at all gives a single execution-error case;</li>
 *     <li>any failure while enumerating is reported to the diagnostic sink and gives a single deferred case.</li>
 * </ul>
 * The result is never empty and nothing thrown by a provider escapes {@link #discover}.
 */
public class TheoryDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(TheoryDiscoverer.class);

    private final ProviderResolver providerResolver;
    private final TestCaseFactory testCaseFactory;
    private final DiagnosticSink diagnosticSink;

    public TheoryDiscoverer(ProviderResolver providerResolver, TestCaseFactory testCaseFactory, DiagnosticSink diagnosticSink) {
        this.providerResolver = Objects.requireNonNull(providerResolver, "providerResolver is required");
        this.testCaseFactory = Objects.requireNonNull(testCaseFactory, "testCaseFactory is required");
        this.diagnosticSink = Objects.requireNonNull(diagnosticSink, "diagnosticSink is required");
    }

    /**
     * @param directives data annotations in declaration order, may be empty
     * @param skipReason reason the theory is skipped, or {@code null}
     * @return unmodifiable, non-empty list in the order the runner must register it
     */
    public List<TestCase> discover(DiscoveryOptions options,
                                   TestMethod testMethod,
                                   List<DataProviderDirective> directives,
                                   String skipReason) {
        Objects.requireNonNull(options, "options is required");
        Objects.requireNonNull(testMethod, "testMethod is required");
        List<DataProviderDirective> safeDirectives = directives == null ? List.of() : directives;

        // Skip wygrywa ze wszystkim, nawet z brakiem danych
        if (skipReason != null) {
            log.debug("{} is skipped: {}", testMethod.qualifiedName(), skipReason);
            return List.of(testCaseFactory.createSkipped(options, testMethod, skipReason));
        }

        if (!options.preEnumerateTheories()) {
            log.debug("Pre-enumeration disabled, {} discovered as a single case", testMethod.qualifiedName());
            return deferred(options, testMethod);
        }

        Enumeration enumeration = enumerate(options, testMethod, safeDirectives);
        if (enumeration.outcome() == Outcome.NOT_ENUMERABLE) {
            log.debug("Directive #{} on {} cannot be enumerated during discovery, falling back to a single case",
                    enumeration.directiveIndex(), testMethod.qualifiedName());
            return deferred(options, testMethod);
        }
        if (enumeration.outcome() == Outcome.FAILED) {
            log.debug("Enumeration of {} failed, falling back to a single case", testMethod.qualifiedName(), enumeration.failure());
            report("Exception thrown during theory discovery on '" + testMethod.qualifiedName()
                    + "'; falling back to single test case." + System.lineSeparator() + stackTraceOf(enumeration.failure()));
            return deferred(options, testMethod);
        }

        log.debug("{} expanded into {} test case(s)", testMethod.qualifiedName(), enumeration.testCases().size());
        return enumeration.testCases();
    }

    private Enumeration enumerate(DiscoveryOptions options, TestMethod testMethod, List<DataProviderDirective> directives) {
        try {
            List<TestCase> results = new ArrayList<>();
            for (DataProviderDirective directive : directives) {
                DataProvider provider = providerResolver.resolve(directive, testMethod);
                if (!provider.canEnumerateAhead()) {
                    return Enumeration.notEnumerable(directive.index());
                }
                // null z rows() leci dalej jako NPE i kończy się pojedynczym przypadkiem
                for (DataRow dataRow : provider.rows()) {
                    results.add(testCaseFactory.createBound(options, testMethod, dataRow));
                }
            }

            if (results.isEmpty()) {
                results.add(testCaseFactory.createExecutionError(options, testMethod,
                        "No data found for " + testMethod.qualifiedName()));
            }
            return Enumeration.of(results);
        } catch (Exception | LinkageError e) {
            // LinkageError: klasa źródła danych nie przeszła inicjalizacji statycznej
            return Enumeration.failed(e);
        }
    }

    private List<TestCase> deferred(DiscoveryOptions options, TestMethod testMethod) {
        return List.of(testCaseFactory.createDeferred(options, testMethod));
    }

    private void report(String message) {
        try {
            diagnosticSink.emit(message);
        } catch (RuntimeException e) {
            log.warn("Diagnostic sink rejected message: {}", message, e);
        }
    }

    private static String stackTraceOf(Throwable failure) {
        StringWriter out = new StringWriter();
        failure.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    /* ------------------------------------------------ wynik enumeracji */

    private enum Outcome {
        CASES,
        NOT_ENUMERABLE,
        FAILED
    }

    private record Enumeration(Outcome outcome, List<TestCase> testCases, int directiveIndex, Throwable failure) {

        static Enumeration of(List<TestCase> testCases) {
            return new Enumeration(Outcome.CASES, Collections.unmodifiableList(testCases), -1, null);
        }

        static Enumeration notEnumerable(int directiveIndex) {
            return new Enumeration(Outcome.NOT_ENUMERABLE, List.of(), directiveIndex, null);
        }

        static Enumeration failed(Throwable failure) {
            return new Enumeration(Outcome.FAILED, List.of(), -1, failure);
        }
    }
}
