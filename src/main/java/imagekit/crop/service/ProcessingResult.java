package imagekit.crop.service;

/**
 * Outcome of an {@link ImageProcessor} call: {@code {success, data?, error?}}.
 *
 * <p>A result only counts as usable when it is successful <em>and</em> carries data; see
 * {@link #hasData()}.
 *
 * @param success whether the engine reported success
 * @param data    encoded result image, null on failure
 * @param error   failure message, null on success
 */
public record ProcessingResult(boolean success, String data, String error) {

    public static ProcessingResult success(String data) {
        return new ProcessingResult(true, data, null);
    }

    public static ProcessingResult failure(String error) {
        return new ProcessingResult(false, null, error);
    }

    /**
     * @return true if the result is successful and carries non-empty image data
     */
    public boolean hasData() {
        return success && data != null && !data.isEmpty();
    }

    @Override
    public String toString() {
        return success
                ? "ProcessingResult[success, " + (data == null ? 0 : data.length()) + " chars]"
                : "ProcessingResult[failure: " + error + "]";
    }
}
