package imagekit.crop.service;

import java.io.IOException;

/**
 * Saves or exports a processed image. Called once per successful crop commit.
 */
public interface ImageDelivery {

    /**
     * @param image name and data of the image to deliver
     * @throws IOException if the image could not be delivered
     */
    void deliver(DeliveredImage image) throws IOException;
}
