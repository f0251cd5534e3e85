package imagekit.crop.service;

import java.io.IOException;

/**
 * Exception thrown inside an image processing engine when an image cannot be decoded,
 * transformed or re-encoded. The engine converts it to a failed {@link ProcessingResult}
 * at its boundary.
 */
public class ImageProcessingException extends IOException {

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
