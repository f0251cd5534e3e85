package imagekit.crop.controller;

import imagekit.crop.model.SelectionRect;
import imagekit.crop.model.SourceImage;
import imagekit.crop.model.Viewport;

/**
 * Binds one source image to its viewport, selection and ratio constraint for the lifetime
 * of one opening of the crop dialog.
 *
 * <p>A session is created when the dialog opens an image and discarded when the dialog
 * closes or a crop is committed. The ratio constraint starts free-form for every session.
 */
public class DialogSession {

    private final SourceImage image;
    private final Viewport viewport;
    private final SelectionStateMachine selection;

    public DialogSession(SourceImage image, Viewport viewport) {
        if (image == null || viewport == null) {
            throw new IllegalArgumentException("Image and viewport are required");
        }
        if (image.naturalWidth() != viewport.getNaturalWidth()
                || image.naturalHeight() != viewport.getNaturalHeight()) {
            throw new IllegalArgumentException("Viewport " + viewport + " does not match " + image);
        }
        this.image = image;
        this.viewport = viewport;
        this.selection = new SelectionStateMachine(viewport);
    }

    public SourceImage getImage() {
        return image;
    }

    public Viewport getViewport() {
        return viewport;
    }

    public SelectionStateMachine getSelectionStateMachine() {
        return selection;
    }

    /**
     * @return the current selection rectangle, in display space
     */
    public SelectionRect getSelection() {
        return selection.getSelection();
    }

    @Override
    public String toString() {
        return "DialogSession[" + image.name() + ", " + viewport + "]";
    }
}
