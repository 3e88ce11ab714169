package win.ixuni.strontium.core.driver;

import lombok.Value;

/**
 * Parsed driver type descriptor
 * <p>
 * Format: {@code "TypeName"} or {@code "TypeName, ModuleName"}. The module name, when present,
 * names a driver library that may have to be loaded before the type can be resolved.
 */
@Value
public class TypeDescriptor {

    String typeName;

    /**
     * Module (library) name, or null when the type lives on the server's own class path
     */
    String moduleName;

    public static TypeDescriptor parse(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            throw new IllegalArgumentException("Type descriptor is empty");
        }
        String[] parts = descriptor.split(",");
        String typeName = parts[0].trim();
        if (typeName.isEmpty()) {
            throw new IllegalArgumentException("Type descriptor has no type name: " + descriptor);
        }
        String moduleName = null;
        if (parts.length > 1) {
            moduleName = parts[1].trim();
            if (moduleName.isEmpty()) {
                throw new IllegalArgumentException("Type descriptor has an empty module name: " + descriptor);
            }
        }
        return new TypeDescriptor(typeName, moduleName);
    }

    public boolean hasModule() {
        return moduleName != null;
    }
}
