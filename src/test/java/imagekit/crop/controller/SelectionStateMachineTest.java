package imagekit.crop.controller;

import static org.junit.jupiter.api.Assertions.*;

import imagekit.crop.controller.SelectionStateMachine.State;
import imagekit.crop.model.CanvasOrigin;
import imagekit.crop.model.PointerInput;
import imagekit.crop.model.SelectionRect;
import imagekit.crop.model.Viewport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

/**
 * Unit tests for SelectionStateMachine on a 600x400 canvas showing a 1200x800 image.
 */
class SelectionStateMachineTest {

    private SelectionStateMachine machine;

    @BeforeEach
    void setUp() {
        machine = new SelectionStateMachine(new Viewport(1200, 800, 600, 400));
    }

    private void drag(double x1, double y1, double x2, double y2) {
        machine.handle(PointerInput.start(x1, y1), CanvasOrigin.ZERO);
        machine.handle(PointerInput.move(x2, y2), CanvasOrigin.ZERO);
        machine.handle(PointerInput.end(x2, y2), CanvasOrigin.ZERO);
    }

    // ==================== Transition Tests ====================

    @Test
    @DisplayName("A new machine is cleared with an empty, free-form selection")
    void testInitialState() {
        assertEquals(State.CLEARED, machine.getState());
        assertEquals(SelectionRect.EMPTY, machine.getSelection());
        assertEquals(0, machine.getRatio());
    }

    @Test
    @DisplayName("Start, move and end produce an idle machine holding the selection")
    void testDragLifecycle() {
        assertTrue(machine.handle(PointerInput.start(100, 100), CanvasOrigin.ZERO));
        assertEquals(State.DRAWING, machine.getState());
        assertEquals(new SelectionRect(100, 100, 100, 100), machine.getSelection());

        assertTrue(machine.handle(PointerInput.move(300, 200), CanvasOrigin.ZERO));
        assertTrue(machine.isDrawing());

        assertFalse(machine.handle(PointerInput.end(300, 200), CanvasOrigin.ZERO));
        assertEquals(State.IDLE, machine.getState());
        assertEquals(new SelectionRect(100, 100, 300, 200), machine.getSelection());
    }

    @Test
    @DisplayName("Moves, ends and cancels outside a drag are ignored")
    void testInputOutsideDragIgnored() {
        assertFalse(machine.handle(PointerInput.move(50, 50), CanvasOrigin.ZERO));
        assertFalse(machine.handle(PointerInput.end(50, 50), CanvasOrigin.ZERO));
        assertFalse(machine.handle(PointerInput.cancel(), CanvasOrigin.ZERO));

        assertEquals(State.CLEARED, machine.getState());
        assertEquals(SelectionRect.EMPTY, machine.getSelection());
    }

    @Test
    @DisplayName("Cancel freezes the selection like an end")
    void testCancel() {
        machine.handle(PointerInput.start(10, 10), CanvasOrigin.ZERO);
        machine.handle(PointerInput.move(60, 70), CanvasOrigin.ZERO);
        machine.handle(PointerInput.cancel(), CanvasOrigin.ZERO);

        assertEquals(State.IDLE, machine.getState());
        assertEquals(new SelectionRect(10, 10, 60, 70), machine.getSelection());
        assertFalse(machine.handle(PointerInput.move(200, 200), CanvasOrigin.ZERO));
    }

    @Test
    @DisplayName("A new start replaces the previous selection")
    void testRestart() {
        drag(100, 100, 300, 200);

        machine.handle(PointerInput.start(400, 300), CanvasOrigin.ZERO);

        assertEquals(State.DRAWING, machine.getState());
        assertEquals(new SelectionRect(400, 300, 400, 300), machine.getSelection());
    }

    @Test
    @DisplayName("A move to the same point reports no change")
    void testMoveWithoutChange() {
        machine.handle(PointerInput.start(100, 100), CanvasOrigin.ZERO);
        machine.handle(PointerInput.move(150, 150), CanvasOrigin.ZERO);
        assertFalse(machine.handle(PointerInput.move(150, 150), CanvasOrigin.ZERO));
    }

    @Test
    @DisplayName("Clear is valid mid-drag and ends the drag")
    void testClearMidDrag() {
        machine.handle(PointerInput.start(100, 100), CanvasOrigin.ZERO);
        machine.handle(PointerInput.move(200, 200), CanvasOrigin.ZERO);

        machine.clear();

        assertEquals(State.CLEARED, machine.getState());
        assertEquals(SelectionRect.EMPTY, machine.getSelection());
        assertFalse(machine.handle(PointerInput.move(300, 300), CanvasOrigin.ZERO));
    }

    @Test
    @DisplayName("A started selection counts for the readout even while tiny; clearing drops it")
    void testHasSelection() {
        assertFalse(machine.hasSelection());

        machine.handle(PointerInput.start(100, 100), CanvasOrigin.ZERO);
        assertTrue(machine.hasSelection(), "shown from the first press");
        machine.handle(PointerInput.move(103, 102), CanvasOrigin.ZERO);
        assertTrue(machine.getSelection().isBelow(5));
        assertTrue(machine.hasSelection(), "still shown below the minimum extent");

        machine.handle(PointerInput.end(103, 102), CanvasOrigin.ZERO);
        assertTrue(machine.hasSelection());

        machine.clear();
        assertFalse(machine.hasSelection());
    }

    // ==================== Bounds Tests ====================

    @Test
    @DisplayName("A drag running off the canvas is clamped to its bounds")
    void testClampedToCanvas() {
        drag(-50, -50, 900, 700);

        SelectionRect rect = machine.getSelection();
        assertEquals(0, rect.getX());
        assertEquals(0, rect.getY());
        assertEquals(600, rect.getWidth());
        assertEquals(400, rect.getHeight());
    }

    @Test
    @DisplayName("The origin captured at start is used for the whole drag")
    void testOriginCapturedOnStart() {
        CanvasOrigin origin = new CanvasOrigin(50, 30);
        machine.handle(PointerInput.start(150, 130), origin);
        // a later origin is not read
        machine.handle(PointerInput.move(350, 230), new CanvasOrigin(999, 999));

        assertEquals(new SelectionRect(100, 100, 300, 200), machine.getSelection());
    }

    // ==================== Ratio Tests ====================

    @Test
    @DisplayName("A 1:1 ratio makes the height follow the width")
    void testSquareRatio() {
        machine.setRatio(1);
        drag(100, 100, 250, 180);

        SelectionRect rect = machine.getSelection();
        assertEquals(150, rect.getWidth());
        assertEquals(150, rect.getHeight());
    }

    @Test
    @DisplayName("Ratio-constrained height is cut short at the canvas edge")
    void testRatioClampedAtEdge() {
        machine.setRatio(1);
        drag(0, 300, 200, 350);

        SelectionRect rect = machine.getSelection();
        assertEquals(200, rect.getWidth());
        assertEquals(100, rect.getHeight());
        assertTrue(rect.getEndY() <= 400);
    }

    @Test
    @DisplayName("Changing the ratio does not reshape the current selection")
    void testRatioChangeKeepsSelection() {
        drag(100, 100, 300, 200);
        SelectionRect before = machine.getSelection();

        machine.setRatio(1);

        assertEquals(before, machine.getSelection());
        assertEquals(1, machine.getRatio());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-1, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Negative and non-finite ratios are rejected")
    void testInvalidRatio(double ratio) {
        assertThrows(IllegalArgumentException.class, () -> machine.setRatio(ratio));
        assertEquals(0, machine.getRatio());
    }

    @Test
    @DisplayName("Random pointer sequences keep every coordinate on the canvas and honour the ratio away from edges")
    void testRandomSequencesStayInBounds() {
        Random random = new Random(42);
        double[] ratios = {0, 1, 4.0 / 3.0, 0.75, 16.0 / 9.0};

        for (int run = 0; run < 200; run++) {
            double ratio = ratios[run % ratios.length];
            machine.setRatio(ratio);
            machine.handle(PointerInput.start(random.nextDouble() * 800 - 100, random.nextDouble() * 600 - 100),
                    CanvasOrigin.ZERO);
            for (int step = 0; step < 10; step++) {
                machine.handle(PointerInput.move(random.nextDouble() * 1000 - 200, random.nextDouble() * 800 - 200),
                        CanvasOrigin.ZERO);

                SelectionRect rect = machine.getSelection();
                for (double x : new double[]{rect.getStartX(), rect.getEndX()}) {
                    assertTrue(x >= 0 && x <= 600, "x out of bounds: " + rect);
                }
                for (double y : new double[]{rect.getStartY(), rect.getEndY()}) {
                    assertTrue(y >= 0 && y <= 400, "y out of bounds: " + rect);
                }
                if (ratio > 0 && rect.getEndY() > 0 && rect.getEndY() < 400) {
                    assertEquals(rect.getWidth() / ratio, rect.getHeight(), 1e-6, "ratio broken: " + rect);
                }
            }
            machine.handle(PointerInput.end(0, 0), CanvasOrigin.ZERO);
        }
    }
}
