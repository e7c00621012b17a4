package org.kohsuke.maven.unit;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

/**
 * Name to body table of the test methods of one {@link TestCase}.
 *
 * <p>
 * Built from a reflective scan of the class, done once per class, plus whatever the instance
 * registered explicitly. Names are kept sorted so that a seeded shuffle is reproducible.
 */
final class TestMethodTable {
    /**
     * The one and only rule for recognizing a test method.
     */
    static final String PREFIX = "test";

    /**
     * Scan results, kept with each class so that a test class loader can still be collected.
     */
    private static final ClassValue<List<Method>> SCANNED = new ClassValue<List<Method>>() {
        @Override
        protected List<Method> computeValue(Class<?> c) {
            List<Method> methods = new ArrayList<Method>();
            for (Method m : c.getMethods()) {
                if (!m.getName().startsWith(PREFIX) || m.getParameterTypes().length != 0)
                    continue;
                if (Modifier.isStatic(m.getModifiers()) || m.isBridge() || m.isSynthetic())
                    continue;
                // the class itself may be a non-public nested class
                m.setAccessible(true);
                methods.add(m);
            }
            return Collections.unmodifiableList(methods);
        }
    };

    private final Map<String, TestBody> bodies;

    private TestMethodTable(Map<String, TestBody> bodies) {
        this.bodies = bodies;
    }

    static TestMethodTable of(final TestCase testCase) {
        Map<String, TestBody> bodies = new TreeMap<String, TestBody>();
        for (final Method m : scan(testCase.getClass())) {
            bodies.put(m.getName(), new TestBody() {
                public void run() throws Throwable {
                    try {
                        m.invoke(testCase);
                    } catch (InvocationTargetException e) {
                        throw e.getTargetException();
                    }
                }
            });
        }
        for (Entry<String, TestBody> e : testCase.getRegisteredTests().entrySet()) {
            if (bodies.containsKey(e.getKey()))
                throw new MalformedTestDeclarationException(String.format(
                        "%s registers test '%s', which is already a method of the class", testCase, e.getKey()));
            bodies.put(e.getKey(), e.getValue());
        }
        return new TestMethodTable(bodies);
    }

    /**
     * Public zero-argument instance methods named {@code test*}.
     */
    static List<Method> scan(Class<?> c) {
        return SCANNED.get(c);
    }

    /**
     * Test method names in lexicographic order.
     */
    List<String> names() {
        return new ArrayList<String>(bodies.keySet());
    }

    TestBody get(String name) {
        return bodies.get(name);
    }

    int size() {
        return bodies.size();
    }
}
