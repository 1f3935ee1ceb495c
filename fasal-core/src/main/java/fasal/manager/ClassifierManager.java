package fasal.manager;

import fasal.classifier.adapter.ClassifierLoader;
import fasal.classifier.adapter.IImageClassifierAdapter;
import fasal.classifier.adapter.impl.OnnxImageClassifierAdapter;
import fasal.common.exception.ModelUnavailableException;
import fasal.common.exception.UnknownLabelException;
import fasal.config.pojo.ClassifierConfig;
import fasal.disease.pojo.ModelStatus;
import fasal.image.pojo.ImageTensor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the single classifier instance. The first caller loads it, concurrent callers wait
 * for that load, and a failed load leaves the manager degraded until {@link #reload()}.
 * <p>
 * Inference runs under the read lock. A replaced or closed instance is only released after
 * the write lock is taken, so no call is still using it.
 */
@Slf4j
public class ClassifierManager implements AutoCloseable {

    private final ClassifierLoader loader;
    private final int expectedClasses;
    private final AtomicInteger loadAttempts = new AtomicInteger();
    private final ReentrantReadWriteLock inferenceLock = new ReentrantReadWriteLock();

    private volatile IImageClassifierAdapter adapter;
    private volatile ModelStatus status = ModelStatus.NOT_LOADED;
    private volatile String degradedReason;

    public ClassifierManager(ClassifierLoader loader, int expectedClasses) {
        this.loader = loader;
        this.expectedClasses = expectedClasses;
    }

    public static ClassifierManager onnx(ClassifierConfig config, int expectedClasses) {
        return new ClassifierManager(() -> new OnnxImageClassifierAdapter(config), expectedClasses);
    }

    /**
     * Loads the classifier if no attempt has been made yet. Never loads once closed.
     *
     * @return the status after the attempt
     */
    public ModelStatus ensureLoaded() {
        if (status != ModelStatus.NOT_LOADED) {
            return status;
        }
        synchronized (this) {
            if (status == ModelStatus.NOT_LOADED) {
                publish(load());
            }
            return status;
        }
    }

    /**
     * Loads a new instance and swaps it in. The previous one is closed once in-flight
     * inference on it has finished.
     */
    public synchronized ModelStatus reload() {
        if (status == ModelStatus.CLOSED) {
            log.warn("Reload requested after the classifier was closed");
            return status;
        }
        publish(load());
        return status;
    }

    /**
     * @throws ModelUnavailableException while degraded or after close
     */
    public IImageClassifierAdapter requireReady() {
        ModelStatus current = ensureLoaded();
        IImageClassifierAdapter ready = adapter;
        if (current != ModelStatus.READY || ready == null) {
            throw new ModelUnavailableException(unavailableReason(current));
        }
        return ready;
    }

    public float[] classify(ImageTensor tensor) {
        ensureLoaded();
        float[] scores;
        inferenceLock.readLock().lock();
        try {
            IImageClassifierAdapter ready = adapter;
            if (status != ModelStatus.READY || ready == null) {
                throw new ModelUnavailableException(unavailableReason(status));
            }
            scores = ready.classify(tensor);
        } finally {
            inferenceLock.readLock().unlock();
        }
        if (scores == null || scores.length != expectedClasses) {
            throw new UnknownLabelException("Classifier returned " + (scores == null ? 0 : scores.length)
                    + " scores, expected " + expectedClasses);
        }
        return scores;
    }

    public ModelStatus getStatus() {
        return status;
    }

    public String getDegradedReason() {
        return degradedReason;
    }

    public String getModelName() {
        IImageClassifierAdapter current = adapter;
        return current == null ? null : current.getModelName();
    }

    public int getLoadAttempts() {
        return loadAttempts.get();
    }

    /**
     * Terminal: later calls fail with {@link ModelUnavailableException} and nothing is loaded again.
     */
    @Override
    public synchronized void close() {
        IImageClassifierAdapter old = swap(null, ModelStatus.CLOSED);
        if (old != null) {
            old.close();
        }
    }

    // callers hold the monitor
    private void publish(IImageClassifierAdapter loaded) {
        IImageClassifierAdapter old = swap(loaded, loaded == null ? ModelStatus.DEGRADED : ModelStatus.READY);
        if (old != null) {
            old.close();
            log.info("Previous classifier instance released");
        }
    }

    private IImageClassifierAdapter swap(IImageClassifierAdapter next, ModelStatus nextStatus) {
        inferenceLock.writeLock().lock();
        try {
            IImageClassifierAdapter old = adapter;
            adapter = next;
            status = nextStatus;
            return old;
        } finally {
            inferenceLock.writeLock().unlock();
        }
    }

    // callers hold the monitor; returns null and records the reason on failure
    private IImageClassifierAdapter load() {
        loadAttempts.incrementAndGet();
        try {
            IImageClassifierAdapter loaded = loader.load();
            if (loaded == null) {
                throw new IllegalStateException("loader returned no classifier");
            }
            int classes = loaded.getNumClasses();
            if (classes > 0 && classes != expectedClasses) {
                loaded.close();
                throw new IllegalStateException("model outputs " + classes + " classes, label table has " + expectedClasses);
            }
            degradedReason = null;
            log.info("Classifier loaded: {}", loaded.getModelName());
            return loaded;
        } catch (Exception | LinkageError e) {
            degradedReason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("Classifier failed to load, detection runs in degraded mode: {}", degradedReason, e);
            return null;
        }
    }

    private String unavailableReason(ModelStatus current) {
        if (current == ModelStatus.CLOSED) {
            return "classifier closed";
        }
        return degradedReason == null ? "model not loaded" : degradedReason;
    }
}
