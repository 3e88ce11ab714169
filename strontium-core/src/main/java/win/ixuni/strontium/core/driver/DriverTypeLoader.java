package win.ixuni.strontium.core.driver;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.strontium.core.exception.DriverRegistrationFailedException;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Driver type loader
 * <p>
 * Resolves a {@link TypeDescriptor} to a class. A qualified descriptor names a driver library;
 * the library is first looked up among the modules already loaded in this process, and otherwise
 * loaded from {@code <libraryDirectory>/<ModuleName>.jar}. Loaded libraries are cached and reused
 * by every later descriptor naming the same module.
 */
@Slf4j
public class DriverTypeLoader {

    public static final String DEFAULT_LIBRARY_DIRECTORY = "DriverLibraries";

    private static final String LIBRARY_EXTENSION = ".jar";

    @Getter
    private final Path libraryDirectory;

    private final ClassLoader parentClassLoader;

    /**
     * Loaded driver libraries: module name -> class loader
     */
    private final Map<String, ClassLoader> loadedModules = new ConcurrentHashMap<>();

    public DriverTypeLoader() {
        this(defaultLibraryDirectory());
    }

    public DriverTypeLoader(Path libraryDirectory) {
        this(libraryDirectory, DriverTypeLoader.class.getClassLoader());
    }

    public DriverTypeLoader(Path libraryDirectory, ClassLoader parentClassLoader) {
        this.libraryDirectory = libraryDirectory;
        this.parentClassLoader = parentClassLoader;
    }

    /**
     * Resolve the class named by a descriptor
     *
     * @param typeDescriptor {@code "TypeName"} or {@code "TypeName, ModuleName"}
     * @return the resolved class
     * @throws DriverRegistrationFailedException if the descriptor, module or type cannot be resolved
     */
    public Class<?> loadType(String typeDescriptor) {
        TypeDescriptor descriptor;
        try {
            descriptor = TypeDescriptor.parse(typeDescriptor);
        } catch (IllegalArgumentException e) {
            throw new DriverRegistrationFailedException(typeDescriptor, e.getMessage(), e);
        }

        ClassLoader classLoader = descriptor.hasModule()
                ? resolveModule(typeDescriptor, descriptor.getModuleName())
                : parentClassLoader;

        try {
            Class<?> type = Class.forName(descriptor.getTypeName(), false, classLoader);
            log.debug("Resolved driver type {} from {}", type.getName(),
                    descriptor.hasModule() ? descriptor.getModuleName() : "server class path");
            return type;
        } catch (ClassNotFoundException | LinkageError e) {
            String where = descriptor.hasModule() ? " in module " + descriptor.getModuleName() : "";
            throw new DriverRegistrationFailedException(typeDescriptor,
                    "Could not load type " + descriptor.getTypeName() + where, e);
        }
    }

    /**
     * Make a module available under a name without loading it from the library directory
     *
     * @param moduleName  module name used in descriptors
     * @param classLoader class loader providing the module's types
     */
    public void registerModule(String moduleName, ClassLoader classLoader) {
        loadedModules.put(moduleName, classLoader);
        log.info("Registered driver module: {}", moduleName);
    }

    public boolean isModuleLoaded(String moduleName) {
        return loadedModules.containsKey(moduleName);
    }

    private ClassLoader resolveModule(String typeDescriptor, String moduleName) {
        ClassLoader loaded = loadedModules.get(moduleName);
        if (loaded != null) {
            return loaded;
        }

        Optional<Module> bootModule = ModuleLayer.boot().findModule(moduleName);
        if (bootModule.isPresent() && bootModule.get().getClassLoader() != null) {
            log.debug("Driver module {} found in boot layer", moduleName);
            return bootModule.get().getClassLoader();
        }

        return loadedModules.computeIfAbsent(moduleName, name -> openLibrary(typeDescriptor, name));
    }

    private ClassLoader openLibrary(String typeDescriptor, String moduleName) {
        Path library;
        try {
            library = libraryDirectory.resolve(moduleName + LIBRARY_EXTENSION);
        } catch (InvalidPathException e) {
            throw new DriverRegistrationFailedException(typeDescriptor,
                    "Invalid driver module name '" + moduleName + "': " + e.getReason(), e);
        }
        if (!Files.isRegularFile(library)) {
            throw new DriverRegistrationFailedException(typeDescriptor,
                    "Could not find driver library " + library.toAbsolutePath());
        }
        try {
            URL url = library.toUri().toURL();
            log.info("Loading driver library {} from {}", moduleName, library.toAbsolutePath());
            return new URLClassLoader("driver-" + moduleName, new URL[]{url}, parentClassLoader);
        } catch (MalformedURLException e) {
            throw new DriverRegistrationFailedException(typeDescriptor,
                    "Invalid driver library path " + library, e);
        }
    }

    /**
     * {@code DriverLibraries} beside the jar (or classes directory) this class was loaded from
     */
    public static Path defaultLibraryDirectory() {
        CodeSource codeSource = DriverTypeLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource != null && codeSource.getLocation() != null) {
            try {
                Path location = Paths.get(codeSource.getLocation().toURI());
                Path parent = location.getParent();
                if (parent != null) {
                    return parent.resolve(DEFAULT_LIBRARY_DIRECTORY);
                }
            } catch (URISyntaxException | IllegalArgumentException e) {
                log.warn("Cannot derive driver library directory from {}: {}",
                        codeSource.getLocation(), e.getMessage());
            }
        }
        return Paths.get(DEFAULT_LIBRARY_DIRECTORY);
    }

    /**
     * Close every library class loader opened by this loader
     */
    public void close() {
        for (Map.Entry<String, ClassLoader> entry : loadedModules.entrySet()) {
            if (entry.getValue() instanceof URLClassLoader) {
                try {
                    ((URLClassLoader) entry.getValue()).close();
                } catch (IOException e) {
                    log.warn("Failed to close driver library {}: {}", entry.getKey(), e.getMessage());
                }
            }
        }
        loadedModules.clear();
    }
}
