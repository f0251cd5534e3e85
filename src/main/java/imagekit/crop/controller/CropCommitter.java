package imagekit.crop.controller;

import imagekit.crop.model.CropEdges;
import imagekit.crop.model.RealRegion;
import imagekit.crop.model.SelectionRect;
import imagekit.crop.model.SourceImage;
import imagekit.crop.model.Viewport;
import imagekit.crop.service.DeliveredImage;
import imagekit.crop.service.ImageDelivery;
import imagekit.crop.service.ImageProcessor;
import imagekit.crop.service.ProcessingOptions;
import imagekit.crop.service.ProcessingResult;
import imagekit.crop.utilities.CoordinateTransform;
import imagekit.crop.utilities.CroppedNameGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Turns a finished selection into a crop request and hands the result on.
 *
 * <p>Steps of {@link #commit(DialogSession)}:
 * <ol>
 *   <li>Refuse selections below the minimum extent ({@code SELECTION_TOO_SMALL}).</li>
 *   <li>Convert the selection to real pixels and derive the four crop edges.</li>
 *   <li>Invoke the processing capability with a crop-only request.</li>
 *   <li>On a result with data, deliver it under the suffixed name.</li>
 * </ol>
 * Any failure leaves the session untouched; discarding the session after success is the
 * caller's job.
 */
public class CropCommitter {
    private static final Logger logger = LoggerFactory.getLogger(CropCommitter.class);

    private final ImageProcessor processor;
    private final ImageDelivery delivery;
    private final double minExtent;
    private final String nameSuffix;

    /**
     * @param processor  processing capability
     * @param delivery   receives the cropped image
     * @param minExtent  minimum selection width and height, display pixels
     * @param nameSuffix inserted before the extension of the delivered name
     */
    public CropCommitter(ImageProcessor processor, ImageDelivery delivery, double minExtent, String nameSuffix) {
        if (processor == null || delivery == null) {
            throw new IllegalArgumentException("Processor and delivery are required");
        }
        this.processor = processor;
        this.delivery = delivery;
        this.minExtent = minExtent;
        this.nameSuffix = nameSuffix;
    }

    /**
     * Computes the crop edges for a selection.
     *
     * @param rect      selection in display space
     * @param viewport  viewport of the session
     * @param minExtent minimum width and height in display pixels
     * @return the edges; {@code top + bottom + realHeight == naturalHeight} and
     *         {@code left + right + realWidth == naturalWidth}
     * @throws CropCommitException with {@code SELECTION_TOO_SMALL} if either side is below {@code minExtent}
     */
    public static CropEdges computeEdges(SelectionRect rect, Viewport viewport, double minExtent)
            throws CropCommitException {
        if (rect.isBelow(minExtent)) {
            throw new CropCommitException(CropCommitException.Reason.SELECTION_TOO_SMALL,
                    String.format("Selection %.0fx%.0f is smaller than the minimum of %.0f pixels",
                            rect.getWidth(), rect.getHeight(), minExtent));
        }
        RealRegion region = CoordinateTransform.toRealRegion(rect, viewport);
        return CropEdges.around(region, viewport.getNaturalWidth(), viewport.getNaturalHeight());
    }

    /**
     * Commits the session's current selection.
     *
     * @return the image that was delivered
     * @throws CropCommitException if the selection is too small, processing fails or delivery fails
     */
    public DeliveredImage commit(DialogSession session) throws CropCommitException {
        SelectionRect rect = session.getSelection();
        Viewport viewport = session.getViewport();
        SourceImage image = session.getImage();

        CropEdges edges;
        try {
            edges = computeEdges(rect, viewport, minExtent);
        } catch (CropCommitException e) {
            logger.warn("Crop refused: {}", e.getMessage());
            throw e;
        }

        ProcessingOptions options = ProcessingOptions.forCrop(edges);
        logger.info("Crop options: {}", options.toJson());

        ProcessingResult result;
        try {
            result = processor.process(image.data(), options);
        } catch (RuntimeException e) {
            logger.error("Processing capability threw while cropping {}", image.name(), e);
            throw new CropCommitException(CropCommitException.Reason.PROCESSING_FAILURE,
                    "An error occurred while cropping the image", e);
        }

        if (result == null || !result.hasData()) {
            String error = result != null && result.error() != null ? result.error() : "Unknown error";
            logger.warn("Crop of {} failed: {}", image.name(), error);
            throw new CropCommitException(CropCommitException.Reason.PROCESSING_FAILURE, error);
        }

        DeliveredImage delivered = new DeliveredImage(
                CroppedNameGenerator.generate(image.name(), nameSuffix), result.data());
        try {
            delivery.deliver(delivered);
        } catch (IOException e) {
            logger.error("Failed to deliver {}", delivered.name(), e);
            throw new CropCommitException(CropCommitException.Reason.DELIVERY_FAILURE,
                    "Failed to save " + delivered.name() + ": " + e.getMessage(), e);
        }

        logger.info("Cropped {} to {} with {}", image.name(), delivered.name(), edges);
        return delivered;
    }
}
