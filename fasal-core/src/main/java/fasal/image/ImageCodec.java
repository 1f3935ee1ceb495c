package fasal.image;

import fasal.common.exception.DecodeException;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * Decodes uploaded bytes into a raster with the JDK image readers.
 */
@Slf4j
public class ImageCodec {

    private static final long MAX_PIXELS = 50_000_000L;

    public BufferedImage decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeException("Image is empty");
        }
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            if (in == null) {
                throw new DecodeException("Image stream could not be opened");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new DecodeException("Unrecognized or unsupported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                long pixels = (long) reader.getWidth(0) * reader.getHeight(0);
                if (pixels <= 0 || pixels > MAX_PIXELS) {
                    throw new DecodeException("Image dimensions out of range: "
                            + reader.getWidth(0) + "x" + reader.getHeight(0));
                }
                BufferedImage image = reader.read(0);
                if (image == null) {
                    throw new DecodeException("Image could not be decoded");
                }
                log.debug("Decoded {} image {}x{}", reader.getFormatName(), image.getWidth(), image.getHeight());
                return image;
            } finally {
                reader.dispose();
            }
        } catch (DecodeException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Corrupt image data: " + e.getMessage(), e);
        }
    }
}
