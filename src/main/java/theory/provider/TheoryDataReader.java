package theory.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import theory.model.DataProviderDirective;
import theory.model.DataRow;
import theory.model.TestMethod;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the rows of a deferred theory when it runs. Unlike discovery, providers that cannot
 * enumerate ahead are read as well and failures propagate to the caller.
 */
public class TheoryDataReader {

    private static final Logger log = LoggerFactory.getLogger(TheoryDataReader.class);

    private final ProviderResolver providerResolver;

    public TheoryDataReader(ProviderResolver providerResolver) {
        this.providerResolver = Objects.requireNonNull(providerResolver, "providerResolver is required");
    }

    public List<DataRow> readRows(TestMethod testMethod, List<DataProviderDirective> directives) {
        List<DataRow> rows = new ArrayList<>();
        for (DataProviderDirective directive : directives) {
            DataProvider provider = providerResolver.resolve(directive, testMethod);
            Iterable<DataRow> providerRows = provider.rows();
            if (providerRows == null) {
                throw new DataDiscoveryException("Directive #" + directive.index() + " on " + testMethod.qualifiedName() + " returned no rows");
            }
            providerRows.forEach(rows::add);
        }
        log.debug("Read {} row(s) for {} at execution time", rows.size(), testMethod.qualifiedName());
        return rows;
    }
}
