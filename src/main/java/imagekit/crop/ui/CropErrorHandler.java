package imagekit.crop.ui;

import imagekit.crop.controller.CropCommitException;
import imagekit.crop.service.ImageLoadException;
import javafx.application.Platform;
import javafx.scene.control.Alert;
import javafx.scene.control.Label;
import javafx.scene.control.TextArea;
import javafx.scene.layout.GridPane;
import javafx.scene.layout.Priority;
import javafx.stage.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.text.MessageFormat;
import java.util.ResourceBundle;

/**
 * Centralized error reporting for the crop dialog.
 * Turns each failure into an alert with a message and guidance, logs it, and keeps the
 * dialog that raised it open.
 */
public class CropErrorHandler {
    private static final Logger logger = LoggerFactory.getLogger(CropErrorHandler.class);

    private final ResourceBundle res;
    private final Window owner;

    public CropErrorHandler(Window owner) {
        this.owner = owner;
        this.res = ResourceBundle.getBundle("imagekit.crop.ui.strings");
    }

    /**
     * Reports a refused or failed crop commit.
     */
    public void handleCommitFailure(CropCommitException e) {
        switch (e.getReason()) {
            case SELECTION_TOO_SMALL:
                logger.info("Commit refused: {}", e.getMessage());
                show(Alert.AlertType.WARNING,
                        res.getString("error.tooSmall.header"),
                        res.getString("error.tooSmall.content"),
                        null);
                break;
            case PROCESSING_FAILURE:
                logger.warn("Processing failure: {}", e.getMessage());
                show(Alert.AlertType.ERROR,
                        res.getString("error.processing.header"),
                        MessageFormat.format(res.getString("error.processing.content"), e.getMessage())
                                + "\n\n" + res.getString("error.processing.guidance"),
                        e.getCause());
                break;
            case DELIVERY_FAILURE:
                logger.error("Delivery failure: {}", e.getMessage(), e);
                show(Alert.AlertType.ERROR,
                        res.getString("error.delivery.header"),
                        e.getMessage() + "\n\n" + res.getString("error.delivery.guidance"),
                        e.getCause());
                break;
            default:
                throw new IllegalStateException("Unhandled reason: " + e.getReason());
        }
    }

    /**
     * Reports an image that could not be decoded for display.
     */
    public void handleImageLoadFailure(ImageLoadException e) {
        logger.error("Image load failure: {}", e.getMessage(), e);
        show(Alert.AlertType.ERROR,
                res.getString("error.load.header"),
                e.getMessage() + "\n\n" + res.getString("error.load.guidance"),
                e);
    }

    private void show(Alert.AlertType type, String header, String content, Throwable details) {
        Runnable showAlert = () -> {
            Alert alert = new Alert(type);
            if (owner != null) {
                alert.initOwner(owner);
            }
            alert.setTitle(res.getString("error.title"));
            alert.setHeaderText(header);
            alert.setContentText(content);
            if (details != null) {
                alert.getDialogPane().setExpandableContent(buildDetails(details));
            }
            alert.showAndWait();
        };
        if (Platform.isFxApplicationThread()) {
            showAlert.run();
        } else {
            Platform.runLater(showAlert);
        }
    }

    private GridPane buildDetails(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));

        Label label = new Label(res.getString("error.details"));
        TextArea textArea = new TextArea(sw.toString());
        textArea.setEditable(false);
        textArea.setWrapText(true);
        textArea.setMaxWidth(Double.MAX_VALUE);
        textArea.setMaxHeight(Double.MAX_VALUE);
        GridPane.setVgrow(textArea, Priority.ALWAYS);
        GridPane.setHgrow(textArea, Priority.ALWAYS);

        GridPane expContent = new GridPane();
        expContent.setMaxWidth(Double.MAX_VALUE);
        expContent.add(label, 0, 0);
        expContent.add(textArea, 0, 1);
        return expContent;
    }
}
