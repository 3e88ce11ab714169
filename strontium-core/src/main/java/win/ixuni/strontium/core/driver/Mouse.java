package win.ixuni.strontium.core.driver;

/**
 * Pointer device of a driver
 * <p>
 * All actions happen at the last coordinates the pointer was moved to.
 */
public interface Mouse {

    void click();

    void contextClick();

    void doubleClick();
}
