package imagekit.crop.ui;

import imagekit.crop.controller.CropCommitter;
import imagekit.crop.service.DirectoryImageDelivery;
import imagekit.crop.service.EdgeCropProcessor;
import imagekit.crop.service.ImageLoadException;
import imagekit.crop.utilities.CropConfig;
import imagekit.crop.utilities.ImageDataCodec;
import javafx.application.Application;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.Scene;
import javafx.scene.control.Button;
import javafx.scene.control.Label;
import javafx.scene.layout.VBox;
import javafx.stage.FileChooser;
import javafx.stage.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;

/**
 * Desktop entry point: a small window with an "Open image" button that feeds the chosen
 * file to a {@link CropDialog}. Cropped images are written to the configured output
 * directory.
 *
 * <p>An image path given as the first command-line argument is opened immediately.
 */
public class CropLauncher extends Application {
    private static final Logger logger = LoggerFactory.getLogger(CropLauncher.class);

    private final ResourceBundle res = ResourceBundle.getBundle("imagekit.crop.ui.strings");

    private CropDialog dialog;
    private CropErrorHandler errorHandler;
    private Label statusLabel;

    public static void main(String[] args) {
        launch(args);
    }

    @Override
    public void start(Stage primaryStage) {
        CropConfig config = CropConfig.load();
        DirectoryImageDelivery delivery = new DirectoryImageDelivery(config.getOutputDirectory());
        CropCommitter committer = new CropCommitter(
                new EdgeCropProcessor(config.getJpegQuality()),
                delivery,
                config.getMinSelectionExtent(),
                config.getOutputSuffix());
        logger.info("Cropped images will be written to {}", delivery.getDirectory());

        statusLabel = new Label(res.getString("launcher.status.ready"));
        Button openButton = new Button(res.getString("launcher.open"));
        openButton.setOnAction(e -> {
            FileChooser fileChooser = new FileChooser();
            fileChooser.setTitle(res.getString("launcher.open"));
            fileChooser.getExtensionFilters().addAll(
                    new FileChooser.ExtensionFilter(res.getString("launcher.filter.images"),
                            "*.png", "*.jpg", "*.jpeg", "*.gif", "*.bmp"),
                    new FileChooser.ExtensionFilter("All Files", "*.*"));
            File file = fileChooser.showOpenDialog(primaryStage);
            if (file != null) {
                openFile(file.toPath());
            }
        });

        VBox root = new VBox(10, openButton, statusLabel);
        root.setAlignment(Pos.CENTER);
        root.setPadding(new Insets(20));
        primaryStage.setTitle(res.getString("launcher.title"));
        primaryStage.setScene(new Scene(root, 360, 140));
        primaryStage.show();

        errorHandler = new CropErrorHandler(primaryStage);
        dialog = new CropDialog(primaryStage, config, committer);
        dialog.setOnCommitted(image -> {
            Path written = delivery.getLastWritten();
            statusLabel.setText(MessageFormat.format(res.getString("launcher.status.saved"),
                    written != null ? written.toString() : image.name()));
        });

        List<String> args = getParameters().getUnnamed();
        if (!args.isEmpty()) {
            openFile(Paths.get(args.get(0)));
        }
    }

    private void openFile(Path file) {
        String data;
        try {
            data = ImageDataCodec.encodeFile(file);
        } catch (IOException e) {
            errorHandler.handleImageLoadFailure(
                    new ImageLoadException("Could not read " + file + ": " + e.getMessage(), e));
            return;
        }
        dialog.open(data, file.getFileName().toString());
    }
}
