package imagekit.crop.controller;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import imagekit.crop.model.CanvasOrigin;
import imagekit.crop.model.CropEdges;
import imagekit.crop.model.PointerInput;
import imagekit.crop.model.SelectionRect;
import imagekit.crop.model.SourceImage;
import imagekit.crop.model.Viewport;
import imagekit.crop.service.DeliveredImage;
import imagekit.crop.service.ImageDelivery;
import imagekit.crop.service.ImageProcessor;
import imagekit.crop.service.ProcessingOptions;
import imagekit.crop.service.ProcessingResult;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for CropCommitter with a mocked processing capability and delivery target.
 */
@ExtendWith(MockitoExtension.class)
class CropCommitterTest {

    private static final String SOURCE_DATA = "data:image/png;base64,iVBORw0KGgo=";
    private static final String RESULT_DATA = "data:image/png;base64,QUJD";

    @Mock ImageProcessor processor;
    @Mock ImageDelivery delivery;

    private CropCommitter committer;
    private DialogSession session;

    @BeforeEach
    void setUp() {
        committer = new CropCommitter(processor, delivery, 5, "_cropped");
        session = new DialogSession(new SourceImage(SOURCE_DATA, "photo.png", 1200, 800),
                new Viewport(1200, 800, 600, 400));
    }

    private void select(double x1, double y1, double x2, double y2) {
        SelectionStateMachine machine = session.getSelectionStateMachine();
        machine.handle(PointerInput.start(x1, y1), CanvasOrigin.ZERO);
        machine.handle(PointerInput.move(x2, y2), CanvasOrigin.ZERO);
        machine.handle(PointerInput.end(x2, y2), CanvasOrigin.ZERO);
    }

    // ==================== Refusal Tests ====================

    @Test
    @DisplayName("Without a selection nothing reaches the processor")
    void testNoSelection() {
        CropCommitException e = assertThrows(CropCommitException.class, () -> committer.commit(session));

        assertEquals(CropCommitException.Reason.SELECTION_TOO_SMALL, e.getReason());
        verifyNoInteractions(processor, delivery);
    }

    @Test
    @DisplayName("A selection narrower than the minimum is refused")
    void testTinySelection() {
        select(100, 100, 104, 200);

        CropCommitException e = assertThrows(CropCommitException.class, () -> committer.commit(session));

        assertEquals(CropCommitException.Reason.SELECTION_TOO_SMALL, e.getReason());
        verifyNoInteractions(processor, delivery);
    }

    // ==================== Success Tests ====================

    @Test
    @DisplayName("A valid selection is sent as a crop-only request and delivered under the suffixed name")
    void testCommitSuccess() throws Exception {
        select(100, 100, 300, 200);
        when(processor.process(eq(SOURCE_DATA), any(ProcessingOptions.class)))
                .thenReturn(ProcessingResult.success(RESULT_DATA));

        DeliveredImage delivered = committer.commit(session);

        assertEquals("photo_cropped.png", delivered.name());
        assertEquals(RESULT_DATA, delivered.data());

        ArgumentCaptor<ProcessingOptions> captor = ArgumentCaptor.forClass(ProcessingOptions.class);
        verify(processor).process(eq(SOURCE_DATA), captor.capture());
        ProcessingOptions options = captor.getValue();
        assertTrue(options.isCrop());
        assertFalse(options.isResize());
        assertFalse(options.isDpi());
        assertEquals(new CropEdges(200, 600, 400, 200), options.getEdges());

        verify(delivery).deliver(delivered);
    }

    @Test
    @DisplayName("computeEdges satisfies the edge sum on both axes")
    void testComputeEdges() throws CropCommitException {
        Viewport viewport = new Viewport(4032, 3024, 1067, 800);
        SelectionRect rect = new SelectionRect(17.3, 42.9, 901.6, 777.1);

        CropEdges edges = CropCommitter.computeEdges(rect, viewport, 5);

        double scale = viewport.getScale();
        assertEquals(Math.round(17.3 / scale), edges.left());
        assertEquals(Math.round(42.9 / scale), edges.top());
        assertEquals(Math.round(rect.getWidth() / scale), 4032 - edges.left() - edges.right(),
                "kept width is the selection width in real pixels");
        assertEquals(Math.round(rect.getHeight() / scale), 3024 - edges.top() - edges.bottom(),
                "kept height is the selection height in real pixels");
        assertEquals(new CropEdges(162, 625, 88, 65), edges);
    }

    // ==================== Failure Tests ====================

    @Test
    @DisplayName("A failed result is reported with the engine's message and not delivered")
    void testProcessingFailure() throws Exception {
        select(100, 100, 300, 200);
        when(processor.process(any(), any())).thenReturn(ProcessingResult.failure("Cropping would remove entire width"));

        CropCommitException e = assertThrows(CropCommitException.class, () -> committer.commit(session));

        assertEquals(CropCommitException.Reason.PROCESSING_FAILURE, e.getReason());
        assertEquals("Cropping would remove entire width", e.getMessage());
        verify(delivery, never()).deliver(any());
        assertEquals(new SelectionRect(100, 100, 300, 200), session.getSelection(), "session is left untouched");
    }

    @Test
    @DisplayName("A successful result without data counts as a failure")
    void testSuccessWithoutData() throws Exception {
        select(100, 100, 300, 200);
        when(processor.process(any(), any())).thenReturn(new ProcessingResult(true, "", null));

        CropCommitException e = assertThrows(CropCommitException.class, () -> committer.commit(session));

        assertEquals(CropCommitException.Reason.PROCESSING_FAILURE, e.getReason());
        assertEquals("Unknown error", e.getMessage());
        verify(delivery, never()).deliver(any());
    }

    @Test
    @DisplayName("An exception from the processor becomes a processing failure")
    void testProcessorThrows() throws Exception {
        select(100, 100, 300, 200);
        IllegalStateException boom = new IllegalStateException("engine crashed");
        when(processor.process(any(), any())).thenThrow(boom);

        CropCommitException e = assertThrows(CropCommitException.class, () -> committer.commit(session));

        assertEquals(CropCommitException.Reason.PROCESSING_FAILURE, e.getReason());
        assertEquals("An error occurred while cropping the image", e.getMessage());
        assertSame(boom, e.getCause());
        verify(delivery, never()).deliver(any());
    }

    @Test
    @DisplayName("A delivery error is reported as a delivery failure")
    void testDeliveryFailure() throws Exception {
        select(100, 100, 300, 200);
        when(processor.process(any(), any())).thenReturn(ProcessingResult.success(RESULT_DATA));
        doThrow(new IOException("disk full")).when(delivery).deliver(any());

        CropCommitException e = assertThrows(CropCommitException.class, () -> committer.commit(session));

        assertEquals(CropCommitException.Reason.DELIVERY_FAILURE, e.getReason());
        assertTrue(e.getMessage().contains("photo_cropped.png"));
        assertTrue(e.getMessage().contains("disk full"));
        assertInstanceOf(IOException.class, e.getCause());
    }

    // ==================== DialogSession Tests ====================

    @Test
    @DisplayName("A session rejects a viewport that does not match the image")
    void testSessionDimensionMismatch() {
        SourceImage image = new SourceImage(SOURCE_DATA, "photo.png", 1200, 800);
        assertThrows(IllegalArgumentException.class,
                () -> new DialogSession(image, new Viewport(1000, 800, 600, 480)));
    }
}
