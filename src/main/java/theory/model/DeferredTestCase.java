package theory.model;

import java.util.Objects;

/**
 * Runs the whole theory as one case. Its rows are read at execution time, see
 * {@link theory.provider.TheoryDataReader}.
 */
public record DeferredTestCase(TestMethod testMethod, String displayName) implements TestCase {
    public DeferredTestCase {
        Objects.requireNonNull(testMethod, "testMethod is required");
        Objects.requireNonNull(displayName, "displayName is required");
    }

    @Override
    public TestCaseKind kind() {
        return TestCaseKind.DEFERRED;
    }
}
