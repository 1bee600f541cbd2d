package theory.factory;

import theory.model.BoundTestCase;
import theory.model.DataRow;
import theory.model.DeferredTestCase;
import theory.model.DiscoveryOptions;
import theory.model.ExecutionErrorTestCase;
import theory.model.SkippedTestCase;
import theory.model.TestCase;
import theory.model.TestMethod;

import java.util.Objects;

public class DefaultTestCaseFactory implements TestCaseFactory {

    private final ArgumentFormatter argumentFormatter;

    public DefaultTestCaseFactory() {
        this(new ArgumentFormatter());
    }

    public DefaultTestCaseFactory(ArgumentFormatter argumentFormatter) {
        this.argumentFormatter = Objects.requireNonNull(argumentFormatter, "argumentFormatter is required");
    }

    @Override
    public TestCase createSkipped(DiscoveryOptions options, TestMethod testMethod, String skipReason) {
        return new SkippedTestCase(testMethod, baseName(options, testMethod), skipReason);
    }

    @Override
    public TestCase createBound(DiscoveryOptions options, TestMethod testMethod, DataRow dataRow) {
        String displayName = baseName(options, testMethod) + "(" + argumentFormatter.format(dataRow) + ")";
        return new BoundTestCase(testMethod, displayName, dataRow);
    }

    @Override
    public TestCase createDeferred(DiscoveryOptions options, TestMethod testMethod) {
        return new DeferredTestCase(testMethod, baseName(options, testMethod));
    }

    @Override
    public TestCase createExecutionError(DiscoveryOptions options, TestMethod testMethod, String errorMessage) {
        return new ExecutionErrorTestCase(testMethod, baseName(options, testMethod), errorMessage);
    }

    private static String baseName(DiscoveryOptions options, TestMethod testMethod) {
        return testMethod.displayName(options.methodDisplay());
    }
}
