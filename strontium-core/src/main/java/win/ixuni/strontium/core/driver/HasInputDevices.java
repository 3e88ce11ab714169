package win.ixuni.strontium.core.driver;

/**
 * Implemented by drivers that expose low-level input devices
 */
public interface HasInputDevices {

    Mouse getMouse();
}
