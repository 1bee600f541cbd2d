package theory.provider;

import theory.model.DataProviderDirective;
import theory.model.TestMethod;

/**
 * Maps a data directive to the provider able to enumerate its rows.
 */
public interface ProviderResolver {

    /**
     * @throws DataDiscoveryException when no provider can be obtained for the directive
     */
    DataProvider resolve(DataProviderDirective directive, TestMethod testMethod);
}
