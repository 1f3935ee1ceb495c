package fasal.classifier.adapter;

import fasal.image.pojo.ImageTensor;

/**
 * A loaded, read-only multi-class leaf classifier.
 * Implementations must allow concurrent {@link #classify} calls.
 */
public interface IImageClassifierAdapter extends AutoCloseable {

    /**
     * @return one score per class, in the order of the label table
     */
    float[] classify(ImageTensor tensor);

    String getModelName();

    /**
     * Width of the output vector as declared by the model, or -1 when the runtime cannot tell.
     */
    default int getNumClasses() {
        return -1;
    }

    @Override
    default void close() {
    }
}
