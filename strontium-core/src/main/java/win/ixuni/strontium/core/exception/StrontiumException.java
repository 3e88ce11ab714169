package win.ixuni.strontium.core.exception;

import lombok.Getter;

/**
 * Strontium base exception
 * <p>
 * Carries a WebDriver error code and the HTTP status a transport layer should answer with.
 */
@Getter
public class StrontiumException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public StrontiumException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public StrontiumException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
