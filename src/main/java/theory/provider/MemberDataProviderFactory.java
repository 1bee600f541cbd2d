package theory.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import theory.annotation.MemberData;
import theory.model.DataRow;
import theory.model.TestMethod;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

public class MemberDataProviderFactory implements DataProviderFactory<MemberData> {

    private static final Logger log = LoggerFactory.getLogger(MemberDataProviderFactory.class);

    @Override
    public DataProvider create(MemberData annotation, TestMethod testMethod) {
        Class<?> owner = annotation.of() == void.class ? testMethod.declaringClass() : annotation.of();
        String memberName = annotation.value();
        boolean enumerable = !annotation.disableDiscoveryEnumeration();

        return new DataProvider() {
            @Override
            public boolean canEnumerateAhead() {
                return enumerable;
            }

            @Override
            public Iterable<DataRow> rows() {
                Object source = readMember(owner, memberName);
                if (source == null) {
                    throw new DataDiscoveryException("Member " + owner.getName() + "." + memberName + " returned null");
                }
                List<DataRow> rows = toRows(source, owner.getName() + "." + memberName);
                log.debug("Member {}.{} supplied {} row(s) for {}", owner.getSimpleName(), memberName, rows.size(), testMethod.qualifiedName());
                return rows;
            }
        };
    }

    private static Object readMember(Class<?> owner, String memberName) {
        for (Class<?> type = owner; type != null && type != Object.class; type = type.getSuperclass()) {
            for (Method method : type.getDeclaredMethods()) {
                if (method.getName().equals(memberName) && method.getParameterCount() == 0) {
                    return invoke(method, owner);
                }
            }
            for (Field field : type.getDeclaredFields()) {
                if (field.getName().equals(memberName)) {
                    return read(field, owner);
                }
            }
        }
        throw new DataDiscoveryException("No no-arg method or field named '" + memberName + "' on " + owner.getName());
    }

    private static Object invoke(Method method, Class<?> owner) {
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new DataDiscoveryException("Member data method " + owner.getName() + "." + method.getName() + " must be static");
        }
        try {
            method.setAccessible(true);
            return method.invoke(null);
        } catch (InvocationTargetException e) {
            throw new DataDiscoveryException("Member data method " + owner.getName() + "." + method.getName() + " threw", e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new DataDiscoveryException("Cannot call member data method " + owner.getName() + "." + method.getName(), e);
        } catch (LinkageError e) {
            // ExceptionInInitializerError za pierwszym razem, NoClassDefFoundError przy kolejnych próbach
            throw new DataDiscoveryException("Class " + owner.getName() + " failed to initialize", e);
        }
    }

    private static Object read(Field field, Class<?> owner) {
        if (!Modifier.isStatic(field.getModifiers())) {
            throw new DataDiscoveryException("Member data field " + owner.getName() + "." + field.getName() + " must be static");
        }
        try {
            field.setAccessible(true);
            return field.get(null);
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new DataDiscoveryException("Cannot read member data field " + owner.getName() + "." + field.getName(), e);
        } catch (LinkageError e) {
            throw new DataDiscoveryException("Class " + owner.getName() + " failed to initialize", e);
        }
    }

    static List<DataRow> toRows(Object source, String memberDescription) {
        List<DataRow> rows = new ArrayList<>();
        if (source instanceof Stream<?> stream) {
            try (stream) {
                stream.forEachOrdered(element -> rows.add(toRow(element)));
            }
        } else if (source instanceof Iterable<?> iterable) {
            Iterator<?> iterator = iterable.iterator();
            while (iterator.hasNext()) {
                rows.add(toRow(iterator.next()));
            }
        } else if (source.getClass().isArray()) {
            int length = Array.getLength(source);
            for (int i = 0; i < length; i++) {
                rows.add(toRow(Array.get(source, i)));
            }
        } else {
            throw new DataDiscoveryException("Member " + memberDescription + " must return an Iterable, Stream or array, got "
                    + source.getClass().getName());
        }
        return rows;
    }

    private static DataRow toRow(Object element) {
        if (element instanceof DataRow row) {
            return row;
        }
        if (element instanceof Object[] arguments) {
            return DataRow.of(arguments);
        }
        return DataRow.of(element);
    }
}
