package imagekit.crop.ui;

import javafx.scene.canvas.Canvas;
import javafx.scene.canvas.GraphicsContext;
import javafx.scene.image.Image;
import javafx.scene.paint.Color;

/**
 * {@link RenderSurface} backed by a JavaFX {@link Canvas}. Must be used on the FX thread.
 */
public class CanvasRenderSurface implements RenderSurface {

    private final Canvas canvas;
    private Image source;

    public CanvasRenderSurface(Canvas canvas) {
        this.canvas = canvas;
    }

    /**
     * Binds the surface to the image that {@link #drawSource} samples from.
     */
    public void setSource(Image source) {
        this.source = source;
    }

    public Canvas getCanvas() {
        return canvas;
    }

    @Override
    public void resize(double width, double height) {
        canvas.setWidth(width);
        canvas.setHeight(height);
    }

    @Override
    public double getWidth() {
        return canvas.getWidth();
    }

    @Override
    public double getHeight() {
        return canvas.getHeight();
    }

    @Override
    public void clearRect(double x, double y, double width, double height) {
        canvas.getGraphicsContext2D().clearRect(x, y, width, height);
    }

    @Override
    public void drawSource(double sx, double sy, double sw, double sh,
                           double dx, double dy, double dw, double dh) {
        if (source == null) {
            return;
        }
        canvas.getGraphicsContext2D().drawImage(source, sx, sy, sw, sh, dx, dy, dw, dh);
    }

    @Override
    public void fillRect(double x, double y, double width, double height, String color, double opacity) {
        GraphicsContext gc = canvas.getGraphicsContext2D();
        gc.setFill(Color.web(color, opacity));
        gc.fillRect(x, y, width, height);
    }

    @Override
    public void strokeDashedRect(double x, double y, double width, double height,
                                 String color, double lineWidth, double dash) {
        GraphicsContext gc = canvas.getGraphicsContext2D();
        gc.setStroke(Color.web(color));
        gc.setLineWidth(lineWidth);
        gc.setLineDashes(dash, dash);
        gc.strokeRect(x, y, width, height);
        gc.setLineDashes(null);  // Reset to solid
    }
}
