package imagekit.crop.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CroppedNameGenerator
 *
 * <p>Derives the file name a cropped image is delivered under by inserting a suffix before
 * the file extension:
 * <ul>
 *   <li>{@code photo.jpg} becomes {@code photo_cropped.jpg}</li>
 *   <li>{@code scan.final.PNG} becomes {@code scan.final_cropped.PNG}</li>
 *   <li>{@code notes} becomes {@code notes_cropped}</li>
 * </ul>
 * The extension keeps its original case.
 */
public class CroppedNameGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CroppedNameGenerator.class);

    public static final String DEFAULT_SUFFIX = "_cropped";

    // extension after the last dot, not a leading dot of a hidden file
    private static final Pattern EXTENSION = Pattern.compile("^(.+)\\.([A-Za-z0-9]+)$");

    /**
     * Generates the delivered name.
     *
     * @param originalName name of the source image, may be null or empty
     * @param suffix       text to insert, {@link #DEFAULT_SUFFIX} if null
     * @return the name with the suffix inserted before the extension
     */
    public static String generate(String originalName, String suffix) {
        if (suffix == null) {
            suffix = DEFAULT_SUFFIX;
        }
        if (originalName == null || originalName.isBlank()) {
            logger.warn("Source image has no name, using 'image'");
            originalName = "image";
        }

        Matcher matcher = EXTENSION.matcher(originalName);
        String result;
        if (matcher.matches()) {
            result = matcher.group(1) + suffix + "." + matcher.group(2);
        } else {
            result = originalName + suffix;
        }
        logger.debug("Delivered name for '{}': '{}'", originalName, result);
        return result;
    }
}
