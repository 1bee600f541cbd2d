package theory.model;

public enum TestCaseKind {
    /** The theory is marked skipped; carries a reason and no data. */
    SKIPPED,
    /** One case per pre-enumerated data row. */
    BOUND,
    /** Whole theory as one case; data is read when it runs. */
    DEFERRED,
    /** Discovery found no usable data. */
    EXECUTION_ERROR
}
