package imagekit.crop.controller;

/**
 * A crop commit that could not be completed. The dialog stays open after any of these so
 * the user can adjust the selection or retry.
 */
public class CropCommitException extends Exception {

    public enum Reason {
        /** The selection is below the minimum extent; nothing was sent to the engine. */
        SELECTION_TOO_SMALL,
        /** The engine reported a failure or returned no data. */
        PROCESSING_FAILURE,
        /** The engine succeeded but the result could not be saved. */
        DELIVERY_FAILURE
    }

    private final Reason reason;

    public CropCommitException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CropCommitException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
