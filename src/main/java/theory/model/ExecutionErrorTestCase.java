package theory.model;

import java.util.Objects;

public record ExecutionErrorTestCase(TestMethod testMethod, String displayName, String errorMessage) implements TestCase {
    public ExecutionErrorTestCase {
        Objects.requireNonNull(testMethod, "testMethod is required");
        Objects.requireNonNull(displayName, "displayName is required");
        Objects.requireNonNull(errorMessage, "errorMessage is required");
    }

    @Override
    public TestCaseKind kind() {
        return TestCaseKind.EXECUTION_ERROR;
    }
}
