package theory.factory;

import theory.model.DataRow;
import theory.model.DiscoveryOptions;
import theory.model.TestCase;
import theory.model.TestMethod;

/**
 * Builds the test cases discovery hands to the runner. Hosts implement it to return their own
 * case types.
 */
public interface TestCaseFactory {

    /** A single case for a theory declared as skipped. */
    TestCase createSkipped(DiscoveryOptions options, TestMethod testMethod, String skipReason);

    /** A case bound to one pre-enumerated row. */
    TestCase createBound(DiscoveryOptions options, TestMethod testMethod, DataRow dataRow);

    /** A single case for the whole theory; its data is read when it runs. */
    TestCase createDeferred(DiscoveryOptions options, TestMethod testMethod);

    /** A case that fails with {@code errorMessage} when run. */
    TestCase createExecutionError(DiscoveryOptions options, TestMethod testMethod, String errorMessage);
}
