package imagekit.crop.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;

/**
 * ImageDataCodec
 *
 * <p>Helpers for moving encoded images around as text:
 *   - Builds {@code data:image/...;base64,} URLs from raw bytes or files.
 *   - Strips the URL prefix and decodes the payload, tolerating URL-safe and unpadded base64.
 *   - Maps between file extensions, ImageIO format names and MIME types.
 */
public final class ImageDataCodec {
    private static final Logger logger = LoggerFactory.getLogger(ImageDataCodec.class);

    private static final String DATA_PREFIX = "data:";
    private static final String BASE64_MARKER = ";base64";

    private ImageDataCodec() {
    }

    /**
     * Reads a file and encodes it as a data URL, guessing the MIME type from the extension.
     *
     * @param file image file
     * @return {@code data:<mime>;base64,<payload>}
     * @throws IOException if the file cannot be read
     */
    public static String encodeFile(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        String mime = mimeTypeForName(file.getFileName().toString());
        logger.debug("Encoding {} ({} bytes, {})", file, bytes.length, mime);
        return toDataUrl(bytes, mime);
    }

    /**
     * @return {@code data:<mimeType>;base64,<payload>}
     */
    public static String toDataUrl(byte[] bytes, String mimeType) {
        return DATA_PREFIX + mimeType + BASE64_MARKER + "," + Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * Decodes a data URL or a bare base64 string.
     *
     * <p>Standard base64 is tried first, then the URL-safe alphabet, then the standard alphabet
     * with trailing padding removed. Characters outside the alphabet are never skipped.
     *
     * @param data encoded image text
     * @return the raw bytes
     * @throws IllegalArgumentException if the data URL has no payload or no alphabet decodes it
     */
    public static byte[] decode(String data) {
        if (data == null) {
            throw new IllegalArgumentException("Image data is null");
        }
        String payload = stripPrefix(data).trim();

        try {
            return Base64.getDecoder().decode(payload);
        } catch (IllegalArgumentException standard) {
            try {
                return Base64.getUrlDecoder().decode(payload);
            } catch (IllegalArgumentException urlSafe) {
                try {
                    // the JDK decoders already accept missing padding; this covers surplus '='
                    return Base64.getDecoder().decode(stripPadding(payload));
                } catch (IllegalArgumentException unpadded) {
                    throw new IllegalArgumentException(
                            "Failed to decode base64 (data length: " + payload.length() + ")", standard);
                }
            }
        }
    }

    private static String stripPadding(String payload) {
        int end = payload.length();
        while (end > 0 && payload.charAt(end - 1) == '=') {
            end--;
        }
        return payload.substring(0, end);
    }

    /**
     * Removes a {@code data:...,} prefix if present.
     *
     * @throws IllegalArgumentException if the text starts with {@code data:} but has no comma
     */
    public static String stripPrefix(String data) {
        if (!data.startsWith(DATA_PREFIX)) {
            return data;
        }
        int comma = data.indexOf(',');
        if (comma < 0) {
            throw new IllegalArgumentException("Invalid data URL format");
        }
        return data.substring(comma + 1);
    }

    /**
     * Guesses the MIME type from a file name, defaulting to PNG.
     */
    public static String mimeTypeForName(String name) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return "image/jpeg";
        } else if (lower.endsWith(".gif")) {
            return "image/gif";
        } else if (lower.endsWith(".bmp")) {
            return "image/bmp";
        }
        return "image/png";
    }

    /**
     * Maps an ImageIO format name ({@code "JPEG"}, {@code "png"}, ...) to the format a result is
     * written in. Only JPEG and PNG are written; everything else becomes PNG.
     */
    public static String outputFormatFor(String formatName) {
        if (formatName != null) {
            String lower = formatName.toLowerCase(Locale.ROOT);
            if (lower.equals("jpeg") || lower.equals("jpg")) {
                return "jpeg";
            }
        }
        return "png";
    }

    /**
     * @return the MIME type of an output format produced by {@link #outputFormatFor(String)}
     */
    public static String mimeTypeForFormat(String outputFormat) {
        return "jpeg".equals(outputFormat) ? "image/jpeg" : "image/png";
    }
}
