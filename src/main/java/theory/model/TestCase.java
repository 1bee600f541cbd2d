package theory.model;

/**
 * A unit of discovery output, registered with the host runner in the order it was produced.
 */
public interface TestCase {

    TestCaseKind kind();

    TestMethod testMethod();

    String displayName();
}
