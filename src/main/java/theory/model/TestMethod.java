package theory.model;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Identifies a declared parameterized test: owning class, method name and formal parameters.
 */
public record TestMethod(Class<?> declaringClass, String methodName, List<Class<?>> parameterTypes) {
    public TestMethod {
        Objects.requireNonNull(declaringClass, "declaringClass is required");
        Objects.requireNonNull(methodName, "methodName is required");
        if (methodName.isBlank()) {
            throw new IllegalArgumentException("Method name cannot be blank");
        }
        parameterTypes = parameterTypes == null ? List.of() : List.copyOf(parameterTypes);
    }

    public static TestMethod of(Method method) {
        Objects.requireNonNull(method, "method is required");
        return new TestMethod(method.getDeclaringClass(), method.getName(), Arrays.asList(method.getParameterTypes()));
    }

    public String typeName() {
        return declaringClass.getName();
    }

    /** {@code Type.method}, used in diagnostics and error messages. */
    public String qualifiedName() {
        return typeName() + "." + methodName;
    }

    public String displayName(MethodDisplay methodDisplay) {
        return methodDisplay == MethodDisplay.METHOD ? methodName : qualifiedName();
    }

    /**
     * Looks the method up again on its declaring class.
     *
     * @throws IllegalStateException if the class no longer declares it
     */
    public Method toReflectMethod() {
        try {
            return declaringClass.getDeclaredMethod(methodName, parameterTypes.toArray(new Class<?>[0]));
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Method " + qualifiedName() + " not found", e);
        }
    }
}
