package imagekit.crop.model;

/**
 * A selectable ratio constraint for the crop rectangle.
 *
 * <p>{@code ratio} is width divided by height. A ratio of {@code 0} means free-form; any
 * positive value forces {@code height = width / ratio} while dragging.
 *
 * @param label text shown on the preset button (e.g. "16:9")
 * @param ratio width / height, or 0 for free-form
 */
public record AspectRatioPreset(String label, double ratio) {

    public static final AspectRatioPreset FREE = new AspectRatioPreset("Free", 0);

    public AspectRatioPreset {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Preset label is required");
        }
        if (!(ratio >= 0) || Double.isInfinite(ratio)) {
            throw new IllegalArgumentException("Ratio must be a finite non-negative number: " + ratio);
        }
    }

    public boolean isFreeForm() {
        return ratio == 0;
    }
}
