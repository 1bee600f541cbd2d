package theory.provider;

import theory.model.TestMethod;

import java.lang.annotation.Annotation;

/**
 * Turns a data annotation into a {@link DataProvider}. Registered on the annotation type via
 * {@link theory.annotation.DataDiscoverer}; instances are shared, so implementations keep no state.
 */
public interface DataProviderFactory<A extends Annotation> {

    DataProvider create(A annotation, TestMethod testMethod);
}
