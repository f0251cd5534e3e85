package imagekit.crop.service;

import java.io.IOException;

/**
 * The source image could not be decoded for display. A crop dialog is never opened for
 * an image that raised this.
 */
public class ImageLoadException extends IOException {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
