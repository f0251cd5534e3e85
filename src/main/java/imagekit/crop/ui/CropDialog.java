package imagekit.crop.ui;

import imagekit.crop.controller.CropCommitException;
import imagekit.crop.controller.CropCommitter;
import imagekit.crop.controller.DialogSession;
import imagekit.crop.controller.SelectionStateMachine;
import imagekit.crop.model.AspectRatioPreset;
import imagekit.crop.model.PointerInput;
import imagekit.crop.model.RealRegion;
import imagekit.crop.model.SelectionRect;
import imagekit.crop.model.SourceImage;
import imagekit.crop.model.Viewport;
import imagekit.crop.service.DeliveredImage;
import imagekit.crop.service.ImageLoadException;
import imagekit.crop.utilities.CoordinateTransform;
import imagekit.crop.utilities.CropConfig;
import imagekit.crop.utilities.ImageDataCodec;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.geometry.Rectangle2D;
import javafx.scene.Scene;
import javafx.scene.canvas.Canvas;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.control.ToggleButton;
import javafx.scene.control.ToggleGroup;
import javafx.scene.image.Image;
import javafx.scene.layout.BorderPane;
import javafx.scene.layout.FlowPane;
import javafx.scene.layout.HBox;
import javafx.scene.layout.StackPane;
import javafx.scene.layout.VBox;
import javafx.stage.Modality;
import javafx.stage.Screen;
import javafx.stage.Stage;
import javafx.stage.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;
import java.util.function.Consumer;

/**
 * Modal window in which the user drags out a crop rectangle on an image and commits it.
 *
 * <p>The dialog is constructed once by the surrounding UI and reused: every
 * {@link #open(String, String)} starts a new {@link DialogSession}, every {@link #close()}
 * discards it. Layout:
 * <ul>
 *   <li>Centre: the crop canvas with the dimmed overlay and dashed selection border</li>
 *   <li>Right: live preview of the selected region, real-pixel coordinates, ratio presets</li>
 *   <li>Bottom: clear, cancel and crop buttons</li>
 * </ul>
 *
 * <p>All methods must be called on the FX application thread.
 */
public class CropDialog {
    private static final Logger logger = LoggerFactory.getLogger(CropDialog.class);

    private static final double PANEL_SPACING = 10;

    private final ResourceBundle res = ResourceBundle.getBundle("imagekit.crop.ui.strings");

    private final CropConfig config;
    private final CropCommitter committer;
    private final Window owner;

    // ========== Window Components ==========
    private Stage stage;
    private Canvas mainCanvas;
    private Canvas previewCanvas;
    private Label positionLabel;
    private Label sizeLabel;
    private ToggleGroup ratioGroup;
    private final List<ToggleButton> ratioButtons = new ArrayList<>();

    // ========== Rendering / Input ==========
    private CanvasRenderSurface mainSurface;
    private CanvasRenderSurface previewSurface;
    private CropRenderer renderer;
    private InputBinding inputBinding;
    private CropErrorHandler errorHandler;

    // ========== State ==========
    private DialogSession session;
    private Consumer<DeliveredImage> onCommitted;

    /**
     * @param owner     window the dialog is modal to, may be null
     * @param config    dialog settings
     * @param committer commits selections to the processing capability
     */
    public CropDialog(Window owner, CropConfig config, CropCommitter committer) {
        this.owner = owner;
        this.config = config;
        this.committer = committer;
        buildUI();
    }

    private void buildUI() {
        stage = new Stage();
        stage.setTitle(res.getString("dialog.title"));
        if (owner != null) {
            stage.initOwner(owner);
            stage.initModality(Modality.WINDOW_MODAL);
        } else {
            stage.initModality(Modality.APPLICATION_MODAL);
        }
        stage.setOnCloseRequest(e -> close());

        mainCanvas = new Canvas(1, 1);
        StackPane canvasPane = new StackPane(mainCanvas);
        canvasPane.setAlignment(Pos.TOP_LEFT);
        canvasPane.setStyle("-fx-background-color: #2b2b2b;");

        previewCanvas = new Canvas(1, 1);
        StackPane previewPane = new StackPane(previewCanvas);
        double previewMax = config.getPreviewMaxSize();
        previewPane.setMinSize(previewMax, previewMax);
        previewPane.setPrefSize(previewMax, previewMax);

        positionLabel = new Label();
        sizeLabel = new Label();

        FlowPane ratioPane = new FlowPane(5, 5);
        ratioPane.setPrefWrapLength(previewMax);
        ratioGroup = new ToggleGroup();
        for (AspectRatioPreset preset : config.getRatioPresets()) {
            ToggleButton button = new ToggleButton(preset.label());
            button.setUserData(preset);
            button.setToggleGroup(ratioGroup);
            ratioButtons.add(button);
            ratioPane.getChildren().add(button);
        }
        ratioGroup.selectedToggleProperty().addListener((obs, oldToggle, newToggle) -> {
            if (newToggle == null) {
                // keep one preset active at all times
                ratioGroup.selectToggle(oldToggle);
                return;
            }
            applyPreset((AspectRatioPreset) newToggle.getUserData());
        });

        VBox sidePanel = new VBox(PANEL_SPACING,
                new Label(res.getString("dialog.preview")), previewPane,
                positionLabel, sizeLabel,
                new Label(res.getString("dialog.ratio")), ratioPane);
        sidePanel.setPadding(new Insets(0, 0, 0, PANEL_SPACING));

        Button clearButton = new Button(res.getString("dialog.clear"));
        clearButton.setOnAction(e -> clearSelection());
        Button cancelButton = new Button(res.getString("dialog.cancel"));
        cancelButton.setCancelButton(true);
        cancelButton.setOnAction(e -> close());
        Button applyButton = new Button(res.getString("dialog.apply"));
        applyButton.setDefaultButton(true);
        applyButton.setOnAction(e -> applyCrop());

        HBox buttons = new HBox(PANEL_SPACING, clearButton, cancelButton, applyButton);
        buttons.setAlignment(Pos.CENTER_RIGHT);
        buttons.setPadding(new Insets(PANEL_SPACING, 0, 0, 0));

        BorderPane root = new BorderPane();
        root.setCenter(canvasPane);
        root.setRight(sidePanel);
        root.setBottom(buttons);
        root.setPadding(new Insets(PANEL_SPACING));
        stage.setScene(new Scene(root));

        mainSurface = new CanvasRenderSurface(mainCanvas);
        previewSurface = new CanvasRenderSurface(previewCanvas);
        renderer = new CropRenderer(mainSurface, previewSurface, config);
        inputBinding = new FxInputBinding(mainCanvas);
        errorHandler = new CropErrorHandler(stage);
    }

    /**
     * Opens the dialog for an image, replacing any session already open.
     *
     * <p>The image is decoded before anything is shown; if that fails the failure is reported
     * to the user and the dialog stays closed.
     *
     * @param imageData encoded image, as a {@code data:} URL or bare base64
     * @param imageName file name used for the delivered result
     * @return true if the dialog is now showing the image
     */
    public boolean open(String imageData, String imageName) {
        close();

        Image image;
        try {
            image = decodeForDisplay(imageData);
        } catch (ImageLoadException e) {
            errorHandler.handleImageLoadFailure(e);
            return false;
        }

        int naturalWidth = (int) Math.round(image.getWidth());
        int naturalHeight = (int) Math.round(image.getHeight());
        double[] area = availableCanvasArea();
        Viewport viewport = Viewport.fit(naturalWidth, naturalHeight, area[0], area[1]);

        session = new DialogSession(new SourceImage(imageData, imageName, naturalWidth, naturalHeight), viewport);
        logger.info("Opened crop session {}", session);

        mainSurface.setSource(image);
        previewSurface.setSource(image);
        renderer.initialize(viewport);
        updateCoords(SelectionRect.EMPTY);

        // new sessions always start free-form
        if (!ratioButtons.isEmpty()) {
            if (ratioGroup.getSelectedToggle() == ratioButtons.get(0)) {
                applyPreset((AspectRatioPreset) ratioButtons.get(0).getUserData());
            } else {
                ratioGroup.selectToggle(ratioButtons.get(0));
            }
        }

        inputBinding.bind(this::onInput);
        stage.sizeToScene();
        if (!stage.isShowing()) {
            stage.show();
        }
        stage.toFront();
        return true;
    }

    /**
     * Closes the dialog, discarding the session and releasing all input bindings.
     * Safe to call at any time, including mid-drag, and when already closed.
     */
    public void close() {
        inputBinding.unbind();
        if (session != null) {
            session.getSelectionStateMachine().clear();
            logger.info("Closed crop session {}", session);
            session = null;
        }
        mainSurface.setSource(null);
        previewSurface.setSource(null);
        renderer.clearPreview();
        updateCoords(SelectionRect.EMPTY);
        if (stage.isShowing()) {
            stage.hide();
        }
    }

    /**
     * Sets a callback invoked with the delivered image after a successful commit.
     */
    public void setOnCommitted(Consumer<DeliveredImage> onCommitted) {
        this.onCommitted = onCommitted;
    }

    public boolean isOpen() {
        return session != null;
    }

    /**
     * @return the current session, or null when closed
     */
    public DialogSession getSession() {
        return session;
    }

    public Stage getStage() {
        return stage;
    }

    private void onInput(PointerInput input) {
        if (session == null) {
            return;
        }
        SelectionStateMachine machine = session.getSelectionStateMachine();
        if (machine.handle(input, inputBinding.currentOrigin())) {
            redraw();
        }
    }

    private void applyPreset(AspectRatioPreset preset) {
        if (session == null) {
            return;
        }
        session.getSelectionStateMachine().setRatio(preset.ratio());
        redraw();
    }

    private void clearSelection() {
        if (session == null) {
            return;
        }
        session.getSelectionStateMachine().clear();
        redraw();
    }

    private void redraw() {
        SelectionRect selection = session.getSelection();
        renderer.redraw(session.getViewport(), selection);
        updateCoords(selection);
    }

    private void updateCoords(SelectionRect selection) {
        if (session == null || !session.getSelectionStateMachine().hasSelection()) {
            positionLabel.setText("");
            sizeLabel.setText("");
            return;
        }
        RealRegion region = CoordinateTransform.toRealRegion(selection, session.getViewport());
        positionLabel.setText(MessageFormat.format(res.getString("dialog.coords.position"), region.x(), region.y()));
        sizeLabel.setText(MessageFormat.format(res.getString("dialog.coords.size"), region.width(), region.height()));
    }

    private void applyCrop() {
        if (session == null) {
            return;
        }
        try {
            DeliveredImage delivered = committer.commit(session);
            close();
            if (onCommitted != null) {
                onCommitted.accept(delivered);
            }
        } catch (CropCommitException e) {
            errorHandler.handleCommitFailure(e);
        }
    }

    /**
     * Canvas area for a new image, sized against the screen the dialog opens on rather than
     * the owner window behind it.
     */
    private double[] availableCanvasArea() {
        Rectangle2D screen = Screen.getPrimary().getVisualBounds();
        return config.getCanvasArea(screen.getWidth(), screen.getHeight());
    }

    /**
     * Decodes image data into a displayable image.
     *
     * @throws ImageLoadException if the data is not base64 or not an image JavaFX can decode
     */
    static Image decodeForDisplay(String imageData) throws ImageLoadException {
        byte[] bytes;
        try {
            bytes = ImageDataCodec.decode(imageData);
        } catch (IllegalArgumentException e) {
            throw new ImageLoadException("Image data could not be decoded: " + e.getMessage(), e);
        }
        Image image = new Image(new ByteArrayInputStream(bytes));
        if (image.isError()) {
            Exception cause = image.getException();
            throw new ImageLoadException("Unsupported or damaged image"
                    + (cause != null ? ": " + cause.getMessage() : ""), cause);
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageLoadException("Image has no pixels");
        }
        return image;
    }
}
