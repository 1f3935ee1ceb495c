package fasal.image;

import fasal.config.pojo.ClassifierConfig;
import fasal.image.pojo.ImageTensor;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Resizes a decoded leaf image to the classifier's square input and scales it to floats.
 */
public class ImagePreprocessor {

    private final int inputSize;
    private final float scaleMin;
    private final float scaleMax;

    public ImagePreprocessor(ClassifierConfig config) {
        this(config.getInputSize(), config.getScaleMin(), config.getScaleMax());
    }

    public ImagePreprocessor(int inputSize, float scaleMin, float scaleMax) {
        if (inputSize <= 0) {
            throw new IllegalArgumentException("input size must be positive: " + inputSize);
        }
        this.inputSize = inputSize;
        this.scaleMin = scaleMin;
        this.scaleMax = scaleMax;
    }

    public ImageTensor preprocess(BufferedImage image) {
        BufferedImage resized = resizeToRgb(image);

        float[] input = new float[inputSize * inputSize * 3];
        float range = scaleMax - scaleMin;
        int idx = 0;
        for (int y = 0; y < inputSize; y++) {
            for (int x = 0; x < inputSize; x++) {
                int pixel = resized.getRGB(x, y);
                input[idx++] = scale((pixel >> 16) & 0xFF, range);
                input[idx++] = scale((pixel >> 8) & 0xFF, range);
                input[idx++] = scale(pixel & 0xFF, range);
            }
        }
        return new ImageTensor(input, new long[]{1, inputSize, inputSize, 3});
    }

    private float scale(int value, float range) {
        return value / 255f * range + scaleMin;
    }

    // drawing into TYPE_INT_RGB drops alpha and converts gray or indexed images
    private BufferedImage resizeToRgb(BufferedImage image) {
        BufferedImage resized = new BufferedImage(inputSize, inputSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = resized.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, inputSize, inputSize, null);
        } finally {
            g.dispose();
        }
        return resized;
    }
}
