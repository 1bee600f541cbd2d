package theory.provider;

import theory.model.DataRow;

/**
 * Source of rows for one data annotation of one theory.
 */
public interface DataProvider {

    /**
     * Whether {@link #rows()} may be called during discovery. Providers whose rows need the
     * running test (fresh instances, external state) return {@code false}.
     */
    boolean canEnumerateAhead();

    /**
     * Produces the rows in order. May throw when the rows are realized.
     */
    Iterable<DataRow> rows();
}
