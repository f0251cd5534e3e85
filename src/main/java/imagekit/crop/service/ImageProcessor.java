package imagekit.crop.service;

/**
 * The image processing capability the crop dialog commits to.
 *
 * <p>The call is synchronous and one-shot. Implementations report failures through
 * {@link ProcessingResult#failure(String)} rather than by throwing; callers still guard
 * against unchecked exceptions.
 */
public interface ImageProcessor {

    /**
     * Applies the requested operations to an encoded image.
     *
     * @param imageData encoded image, as a {@code data:} URL or bare base64
     * @param options   operations to apply
     * @return the encoded result, or a failure with a message suitable for the user
     */
    ProcessingResult process(String imageData, ProcessingOptions options);
}
