package imagekit.crop.service;

import imagekit.crop.model.CropEdges;
import imagekit.crop.utilities.ImageDataCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * In-process implementation of the processing capability that supports edge cropping.
 *
 * <p>Workflow for each call:
 * <ol>
 *   <li>Strip the {@code data:} prefix and decode base64.</li>
 *   <li>Decode the image with ImageIO, remembering its format.</li>
 *   <li>Crop the requested edges, rejecting crops that remove the whole width or height.</li>
 *   <li>Re-encode as JPEG (configured quality) or PNG and return a data URL.</li>
 * </ol>
 */
public class EdgeCropProcessor implements ImageProcessor {
    private static final Logger logger = LoggerFactory.getLogger(EdgeCropProcessor.class);

    private final float jpegQuality;

    public EdgeCropProcessor() {
        this(0.95f);
    }

    /**
     * @param jpegQuality compression quality for JPEG output, in (0, 1]
     */
    public EdgeCropProcessor(float jpegQuality) {
        if (!(jpegQuality > 0 && jpegQuality <= 1)) {
            throw new IllegalArgumentException("JPEG quality must be in (0, 1]: " + jpegQuality);
        }
        this.jpegQuality = jpegQuality;
    }

    @Override
    public ProcessingResult process(String imageData, ProcessingOptions options) {
        try {
            DecodedImage decoded = decode(imageData);
            BufferedImage result = cropEdges(decoded.image(), options.getEdges());
            String format = ImageDataCodec.outputFormatFor(decoded.formatName());
            byte[] encoded = encode(result, format);
            logger.info("Processed {}x{} {} image into {}x{} {} ({} bytes)",
                    decoded.image().getWidth(), decoded.image().getHeight(), decoded.formatName(),
                    result.getWidth(), result.getHeight(), format, encoded.length);
            return ProcessingResult.success(ImageDataCodec.toDataUrl(encoded, ImageDataCodec.mimeTypeForFormat(format)));
        } catch (ImageProcessingException e) {
            logger.warn("Image processing failed: {}", e.getMessage());
            return ProcessingResult.failure(e.getMessage());
        } catch (IOException e) {
            logger.error("I/O error while processing image", e);
            return ProcessingResult.failure("Failed to process image: " + e.getMessage());
        }
    }

    /**
     * Crops the given edges from an image.
     *
     * @return a new image of {@code (width - left - right) x (height - top - bottom)} pixels
     * @throws ImageProcessingException if the crop would remove the entire width or height
     */
    public static BufferedImage cropEdges(BufferedImage image, CropEdges edges) throws ImageProcessingException {
        int width = image.getWidth();
        int height = image.getHeight();

        int topCrop = edges.top();
        int bottomCrop = edges.bottom();
        int leftCrop = edges.left();
        int rightCrop = edges.right();

        validate(width, height, topCrop, rightCrop, bottomCrop, leftCrop);

        int newWidth = width - leftCrop - rightCrop;
        int newHeight = height - topCrop - bottomCrop;
        logger.debug("Cropping {}x{} by top={}, right={}, bottom={}, left={} -> {}x{}",
                width, height, topCrop, rightCrop, bottomCrop, leftCrop, newWidth, newHeight);

        // copy, so the result does not share the source raster
        BufferedImage sub = image.getSubimage(leftCrop, topCrop, newWidth, newHeight);
        BufferedImage copy = new BufferedImage(newWidth, newHeight, normalizedType(image));
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(sub, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    /**
     * Checks that cropping leaves at least one pixel on both axes.
     *
     * @throws ImageProcessingException naming the axis that would be removed entirely
     */
    public static void validate(int width, int height, int top, int right, int bottom, int left)
            throws ImageProcessingException {
        int remainingWidth = width - left - right;
        int remainingHeight = height - top - bottom;
        if (remainingWidth <= 0) {
            throw new ImageProcessingException(String.format(
                    "Cropping would remove entire width (left: %d, right: %d, width: %d)", left, right, width));
        }
        if (remainingHeight <= 0) {
            throw new ImageProcessingException(String.format(
                    "Cropping would remove entire height (top: %d, bottom: %d, height: %d)", top, bottom, height));
        }
    }

    private static DecodedImage decode(String imageData) throws IOException {
        byte[] bytes;
        try {
            bytes = ImageDataCodec.decode(imageData);
        } catch (IllegalArgumentException e) {
            throw new ImageProcessingException(e.getMessage(), e);
        }

        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                throw new ImageProcessingException("Failed to decode image: unknown format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                BufferedImage image = reader.read(0);
                return new DecodedImage(image, reader.getFormatName());
            } catch (IOException | RuntimeException e) {
                throw new ImageProcessingException("Failed to decode image: " + e.getMessage(), e);
            } finally {
                reader.dispose();
            }
        }
    }

    private byte[] encode(BufferedImage image, String format) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if ("jpeg".equals(format)) {
            writeJpeg(toRgb(image), out);
        } else if (!ImageIO.write(image, "png", out)) {
            throw new ImageProcessingException("Failed to encode image: no PNG writer available");
        }
        return out.toByteArray();
    }

    private void writeJpeg(BufferedImage image, ByteArrayOutputStream out) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new ImageProcessingException("Failed to encode image: no JPEG writer available");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }

    // JPEG has no alpha channel
    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    private static int normalizedType(BufferedImage image) {
        return image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }

    private record DecodedImage(BufferedImage image, String formatName) {
    }
}
