package imagekit.crop.ui;

import imagekit.crop.model.CanvasOrigin;
import imagekit.crop.model.PointerInput;
import javafx.beans.value.ChangeListener;
import javafx.event.EventHandler;
import javafx.geometry.Point2D;
import javafx.scene.Node;
import javafx.scene.Scene;
import javafx.scene.input.MouseEvent;
import javafx.scene.input.TouchEvent;
import javafx.stage.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link InputBinding} for a JavaFX node.
 *
 * <p>Mouse presses and all touch events are handled on the node. On a press, filters for
 * mouse drags and releases are added to the node's scene, so the drag is followed wherever
 * the pointer goes; they are removed again on release. If the window loses focus during a
 * drag the drag is cancelled.
 */
public class FxInputBinding implements InputBinding {
    private static final Logger logger = LoggerFactory.getLogger(FxInputBinding.class);

    private final Node target;

    private Consumer<PointerInput> listener;
    private Scene trackingScene;
    private Window focusWindow;

    private final EventHandler<MouseEvent> pressHandler = this::onMousePressed;
    private final EventHandler<MouseEvent> sceneDragFilter = this::onSceneMouse;
    private final EventHandler<MouseEvent> sceneReleaseFilter = this::onSceneMouse;
    private final EventHandler<TouchEvent> touchHandler = this::onTouch;
    private final ChangeListener<Boolean> focusListener = (obs, wasFocused, focused) -> {
        if (!focused && isTrackingDrag()) {
            logger.debug("Window lost focus during drag, cancelling");
            dispatch(PointerInput.cancel());
            stopDragTracking();
        }
    };

    public FxInputBinding(Node target) {
        this.target = target;
    }

    @Override
    public void bind(Consumer<PointerInput> listener) {
        unbind();
        this.listener = listener;
        target.addEventHandler(MouseEvent.MOUSE_PRESSED, pressHandler);
        target.addEventHandler(TouchEvent.ANY, touchHandler);
        logger.debug("Input bound to {}", target);
    }

    @Override
    public void unbind() {
        stopDragTracking();
        if (listener == null) {
            return;
        }
        target.removeEventHandler(MouseEvent.MOUSE_PRESSED, pressHandler);
        target.removeEventHandler(TouchEvent.ANY, touchHandler);
        listener = null;
        logger.debug("Input unbound from {}", target);
    }

    @Override
    public boolean isTrackingDrag() {
        return trackingScene != null;
    }

    @Override
    public CanvasOrigin currentOrigin() {
        Point2D origin = target.localToScene(0, 0);
        return new CanvasOrigin(origin.getX(), origin.getY());
    }

    private void onMousePressed(MouseEvent event) {
        Optional<PointerInput> input = PointerInputAdapter.fromMouse(event);
        if (input.isEmpty()) {
            return;
        }
        event.consume();
        startDragTracking();
        dispatch(input.get());
    }

    private void onSceneMouse(MouseEvent event) {
        Optional<PointerInput> input = PointerInputAdapter.fromMouse(event);
        if (input.isEmpty()) {
            return;
        }
        dispatch(input.get());
        if (input.get().kind() == PointerInput.Kind.END) {
            stopDragTracking();
        }
    }

    private void onTouch(TouchEvent event) {
        PointerInputAdapter.fromTouch(event).ifPresent(this::dispatch);
        event.consume();
    }

    private void dispatch(PointerInput input) {
        if (listener != null) {
            listener.accept(input);
        }
    }

    private void startDragTracking() {
        Scene scene = target.getScene();
        if (scene == null || scene == trackingScene) {
            return;
        }
        stopDragTracking();
        scene.addEventFilter(MouseEvent.MOUSE_DRAGGED, sceneDragFilter);
        scene.addEventFilter(MouseEvent.MOUSE_RELEASED, sceneReleaseFilter);
        trackingScene = scene;

        focusWindow = scene.getWindow();
        if (focusWindow != null) {
            focusWindow.focusedProperty().addListener(focusListener);
        }
    }

    private void stopDragTracking() {
        if (trackingScene == null) {
            return;
        }
        trackingScene.removeEventFilter(MouseEvent.MOUSE_DRAGGED, sceneDragFilter);
        trackingScene.removeEventFilter(MouseEvent.MOUSE_RELEASED, sceneReleaseFilter);
        trackingScene = null;
        if (focusWindow != null) {
            focusWindow.focusedProperty().removeListener(focusListener);
            focusWindow = null;
        }
    }
}
