package win.ixuni.strontium.core.support;

import win.ixuni.strontium.core.driver.AutomationDriver;
import win.ixuni.strontium.core.driver.Capabilities;
import win.ixuni.strontium.core.driver.HasInputDevices;
import win.ixuni.strontium.core.driver.Mouse;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * In-memory driver used by tests
 */
public class FakeAutomationDriver implements AutomationDriver, HasInputDevices {

    private final Capabilities capabilities;
    private final List<String> windowHandles = new CopyOnWriteArrayList<>(List.of("window-1"));
    private final RecordingMouse mouse = new RecordingMouse();
    private volatile Supplier<List<String>> windowHandleSource;
    private volatile boolean quit;

    public FakeAutomationDriver(Capabilities capabilities) {
        this.capabilities = capabilities;
    }

    public Capabilities getCapabilities() {
        return capabilities;
    }

    public void setWindowHandles(List<String> handles) {
        windowHandles.clear();
        windowHandles.addAll(handles);
    }

    /**
     * Replace the window handle lookup, e.g. to block or fail inside the driver
     */
    public void setWindowHandleSource(Supplier<List<String>> source) {
        this.windowHandleSource = source;
    }

    @Override
    public List<String> getWindowHandles() {
        Supplier<List<String>> source = windowHandleSource;
        if (source != null) {
            return source.get();
        }
        return new ArrayList<>(windowHandles);
    }

    @Override
    public String getWindowHandle() {
        return windowHandles.isEmpty() ? null : windowHandles.get(0);
    }

    @Override
    public void quit() {
        quit = true;
        windowHandles.clear();
    }

    public boolean isQuit() {
        return quit;
    }

    @Override
    public RecordingMouse getMouse() {
        return mouse;
    }

    /**
     * Mouse recording the actions performed on it
     */
    public static class RecordingMouse implements Mouse {

        private final List<String> actions = new CopyOnWriteArrayList<>();

        @Override
        public void click() {
            actions.add("click");
        }

        @Override
        public void contextClick() {
            actions.add("contextClick");
        }

        @Override
        public void doubleClick() {
            actions.add("doubleClick");
        }

        public List<String> getActions() {
            return List.copyOf(actions);
        }
    }
}
