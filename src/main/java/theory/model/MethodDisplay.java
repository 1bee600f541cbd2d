package theory.model;

/**
 * How a test case names its method.
 */
public enum MethodDisplay {
    CLASS_AND_METHOD,
    METHOD
}
