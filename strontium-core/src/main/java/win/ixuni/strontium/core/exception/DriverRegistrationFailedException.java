package win.ixuni.strontium.core.exception;

import lombok.Getter;

/**
 * Driver registration failure
 * <p>
 * Only used inside the driver registry; {@code DriverRegistry.registerDriver} converts it
 * into a listener notification and never lets it escape.
 */
@Getter
public class DriverRegistrationFailedException extends StrontiumException {

    private final String typeDescriptor;
    private final String reason;

    public DriverRegistrationFailedException(String typeDescriptor, String reason) {
        super("driver registration failed",
                "Failed to register driver '" + typeDescriptor + "': " + reason, 500);
        this.typeDescriptor = typeDescriptor;
        this.reason = reason;
    }

    public DriverRegistrationFailedException(String typeDescriptor, String reason, Throwable cause) {
        super("driver registration failed",
                "Failed to register driver '" + typeDescriptor + "': " + reason, 500, cause);
        this.typeDescriptor = typeDescriptor;
        this.reason = reason;
    }
}
