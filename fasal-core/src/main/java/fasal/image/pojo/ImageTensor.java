package fasal.image.pojo;

import lombok.Getter;

import java.util.Arrays;

/**
 * Model-ready input in NHWC order: [1, height, width, 3].
 */
@Getter
public class ImageTensor {
    private final float[] data;
    private final long[] shape;

    public ImageTensor(float[] data, long[] shape) {
        long expected = Arrays.stream(shape).reduce(1L, (a, b) -> a * b);
        if (expected != data.length) {
            throw new IllegalArgumentException("Tensor data length " + data.length
                    + " does not match shape " + Arrays.toString(shape));
        }
        this.data = data;
        this.shape = shape;
    }
}
