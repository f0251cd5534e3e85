package imagekit.crop.model;

/**
 * The image a crop session works on: its encoded data, its display name and its decoded
 * natural size.
 *
 * @param data          encoded image, as a {@code data:} URL or bare base64
 * @param name          file name used to derive the delivered name
 * @param naturalWidth  decoded width in pixels
 * @param naturalHeight decoded height in pixels
 */
public record SourceImage(String data, String name, int naturalWidth, int naturalHeight) {

    public SourceImage {
        if (data == null || data.isEmpty()) {
            throw new IllegalArgumentException("Image data is required");
        }
        if (name == null) {
            name = "";
        }
    }

    @Override
    public String toString() {
        // data can be megabytes long
        return "SourceImage[name=" + name + ", " + naturalWidth + "x" + naturalHeight
                + ", " + data.length() + " chars]";
    }
}
