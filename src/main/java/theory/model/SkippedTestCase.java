package theory.model;

import java.util.Objects;

public record SkippedTestCase(TestMethod testMethod, String displayName, String skipReason) implements TestCase {
    public SkippedTestCase {
        Objects.requireNonNull(testMethod, "testMethod is required");
        Objects.requireNonNull(displayName, "displayName is required");
        Objects.requireNonNull(skipReason, "skipReason is required");
    }

    @Override
    public TestCaseKind kind() {
        return TestCaseKind.SKIPPED;
    }
}
