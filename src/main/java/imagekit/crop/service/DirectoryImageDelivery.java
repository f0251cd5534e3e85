package imagekit.crop.service;

import imagekit.crop.utilities.ImageDataCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Delivers images by writing them into a directory, creating it if needed.
 * Existing files with the same name are overwritten.
 */
public class DirectoryImageDelivery implements ImageDelivery {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryImageDelivery.class);

    private final Path directory;
    private Path lastWritten;

    public DirectoryImageDelivery(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("Output directory is required");
        }
        this.directory = directory;
    }

    @Override
    public void deliver(DeliveredImage image) throws IOException {
        String name = image.name();
        if (name == null || name.isBlank()) {
            throw new IOException("Delivered image has no name");
        }
        if (name.contains("/") || name.contains("\\") || name.equals("..")) {
            throw new IOException("Delivered name must not contain path separators: " + name);
        }

        byte[] bytes;
        try {
            bytes = ImageDataCodec.decode(image.data());
        } catch (IllegalArgumentException e) {
            throw new IOException("Delivered image data is not valid base64", e);
        }

        Files.createDirectories(directory);
        Path target = directory.resolve(name);
        Files.write(target, bytes);
        lastWritten = target;
        logger.info("Saved {} ({} bytes)", target, bytes.length);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @return the file written by the most recent delivery, or null if none yet
     */
    public Path getLastWritten() {
        return lastWritten;
    }
}
