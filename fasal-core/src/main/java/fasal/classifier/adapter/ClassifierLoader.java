package fasal.classifier.adapter;

/**
 * Creates the classifier; may fail when weights are missing or the runtime is incompatible.
 */
@FunctionalInterface
public interface ClassifierLoader {
    IImageClassifierAdapter load() throws Exception;
}
