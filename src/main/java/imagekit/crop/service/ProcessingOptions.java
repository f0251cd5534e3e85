package imagekit.crop.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import imagekit.crop.model.CropEdges;

/**
 * Options passed to an {@link ImageProcessor}.
 *
 * <p>The option record carries one flag per operation (resize, crop, DPI). A crop commit from
 * the dialog enables cropping only:
 *
 * <pre>{@code
 * ProcessingOptions options = ProcessingOptions.forCrop(new CropEdges(200, 600, 400, 200));
 * options.isResize(); // false
 * options.isCrop();   // true
 * options.isDpi();    // false
 * }</pre>
 */
public final class ProcessingOptions {

    private static final Gson GSON = new GsonBuilder().create();

    private final CropEdges edges;

    private ProcessingOptions(CropEdges edges) {
        this.edges = edges;
    }

    /**
     * Single-purpose crop request: resize and DPI disabled, edges in pixels.
     *
     * @throws IllegalArgumentException if {@code edges} is null
     */
    public static ProcessingOptions forCrop(CropEdges edges) {
        if (edges == null) {
            throw new IllegalArgumentException("Crop edges are required");
        }
        return new ProcessingOptions(edges);
    }

    public boolean isResize() { return false; }

    public boolean isCrop() { return true; }

    public boolean isDpi() { return false; }

    /**
     * @return pixels to remove from each edge of the natural-resolution image
     */
    public CropEdges getEdges() { return edges; }

    /**
     * @return a JSON rendering of the options, as logged on commit
     */
    public String toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("resize", isResize());
        json.addProperty("crop", isCrop());
        json.addProperty("dpi", isDpi());
        json.addProperty("cropTop", edges.top());
        json.addProperty("cropRight", edges.right());
        json.addProperty("cropBottom", edges.bottom());
        json.addProperty("cropLeft", edges.left());
        return GSON.toJson(json);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
