package org.kohsuke.maven.unit;

/**
 * Loads the engine classes from another class loader, but otherwise delegates everything to the parent.
 *
 * <p>
 * Test cases have to see the very same {@link TestCase} class as the runner does,
 * while the rest of the test classpath stays isolated from the plugin.
 */
final class EngineSharingClassLoader extends ClassLoader {
    private static final String PACKAGE = TestCase.class.getPackage().getName() + '.';

    private final ClassLoader engineLoader;

    EngineSharingClassLoader(ClassLoader parent, ClassLoader engineLoader) {
        super(parent);
        this.engineLoader = engineLoader;
    }

    @Override
    protected synchronized Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (isEngineClass(name))
            return engineLoader.loadClass(name);
        return super.loadClass(name, resolve);
    }

    /**
     * Classes of this package itself, not of its subpackages.
     */
    static boolean isEngineClass(String name) {
        return name.startsWith(PACKAGE) && name.indexOf('.', PACKAGE.length()) < 0;
    }
}
