package theory.model;

import java.util.Objects;

public record BoundTestCase(TestMethod testMethod, String displayName, DataRow dataRow) implements TestCase {
    public BoundTestCase {
        Objects.requireNonNull(testMethod, "testMethod is required");
        Objects.requireNonNull(displayName, "displayName is required");
        Objects.requireNonNull(dataRow, "dataRow is required");
    }

    @Override
    public TestCaseKind kind() {
        return TestCaseKind.BOUND;
    }
}
