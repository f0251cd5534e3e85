package imagekit.crop.service;

/**
 * A finished image handed to the delivery collaborator.
 *
 * @param name file name to save under
 * @param data encoded image, as a {@code data:} URL or bare base64
 */
public record DeliveredImage(String name, String data) {

    @Override
    public String toString() {
        return "DeliveredImage[name=" + name + ", " + (data == null ? 0 : data.length()) + " chars]";
    }
}
