package fasal.disease.service;

import fasal.common.exception.DetectionTimeoutException;
import fasal.common.exception.ModelUnavailableException;
import fasal.common.exception.RRException;
import fasal.common.exception.UnknownLabelException;
import fasal.common.utils.ThreadPoolManager;
import fasal.config.pojo.GlobalConfigurations;
import fasal.disease.ClassLabelTable;
import fasal.disease.ClassificationInterpreter;
import fasal.disease.DiseaseKnowledgeBase;
import fasal.disease.RequestValidator;
import fasal.disease.ResponseAssembler;
import fasal.disease.SeverityEstimator;
import fasal.disease.TreatmentAdvisor;
import fasal.disease.pojo.ClassificationResult;
import fasal.disease.pojo.DetectionRequest;
import fasal.disease.pojo.DetectionResponse;
import fasal.disease.pojo.DiseaseInfo;
import fasal.disease.pojo.ModelStatus;
import fasal.disease.pojo.ServiceStatus;
import fasal.disease.pojo.SeverityTier;
import fasal.disease.pojo.TreatmentPlan;
import fasal.image.ImageCodec;
import fasal.image.ImagePreprocessor;
import fasal.image.pojo.ImageTensor;
import fasal.llm.adapter.IAdviceGeneratorAdapter;
import fasal.llm.adapter.impl.OpenAIStandardAdviceAdapter;
import fasal.manager.ClassifierManager;
import lombok.extern.slf4j.Slf4j;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the diagnosis pipeline.
 * <p>
 * Validation and the model availability check run on the caller's thread; decoding,
 * inference and advice run on a bounded worker pool so a slow inference cannot stall
 * unrelated requests. Each detection is bounded by the configured timeout.
 */
@Slf4j
public class DiseaseDetectionService implements AutoCloseable {
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();
    private static final String ONNX_BACKEND = "onnx";

    private final RequestValidator validator;
    private final ImageCodec codec;
    private final ImagePreprocessor preprocessor;
    private final ClassifierManager classifierManager;
    private final ClassLabelTable labelTable;
    private final ClassificationInterpreter interpreter;
    private final SeverityEstimator severityEstimator;
    private final DiseaseKnowledgeBase knowledgeBase;
    private final TreatmentAdvisor treatmentAdvisor;
    private final ResponseAssembler assembler;
    private final long timeoutMillis;
    private final String poolName;
    private final ExecutorService executor;

    public DiseaseDetectionService(GlobalConfigurations config,
                                   ClassifierManager classifierManager,
                                   ClassLabelTable labelTable,
                                   DiseaseKnowledgeBase knowledgeBase,
                                   IAdviceGeneratorAdapter adviceGenerator) {
        this.validator = new RequestValidator(config.getUpload());
        this.codec = new ImageCodec();
        this.preprocessor = new ImagePreprocessor(config.getClassifier());
        this.classifierManager = classifierManager;
        this.labelTable = labelTable;
        this.interpreter = new ClassificationInterpreter(labelTable);
        this.severityEstimator = new SeverityEstimator(config.getSeverity());
        this.knowledgeBase = knowledgeBase;
        this.treatmentAdvisor = new TreatmentAdvisor(knowledgeBase, adviceGenerator);
        this.assembler = new ResponseAssembler(config.getDetection().getCropMismatchPolicy());
        this.timeoutMillis = config.getDetection().getTimeoutMillis();
        this.poolName = "disease-detection-" + POOL_SEQ.incrementAndGet();
        int threads = config.getDetection().getWorkerThreads();
        this.executor = ThreadPoolManager.getOrRegister(poolName, threads, threads, config.getDetection().getQueueSize());
        if (config.getClassifier().isEagerLoad()) {
            classifierManager.ensureLoaded();
        }
    }

    public static DiseaseDetectionService fromConfig(GlobalConfigurations config) {
        if (!ONNX_BACKEND.equalsIgnoreCase(config.getClassifier().getBackend())) {
            throw new IllegalArgumentException("Unsupported classifier backend: " + config.getClassifier().getBackend());
        }
        ClassLabelTable labelTable = ClassLabelTable.load(config.getData().getClassLabels());
        DiseaseKnowledgeBase knowledgeBase = DiseaseKnowledgeBase.load(config.getData().getDiseaseDatabase());
        ClassifierManager classifierManager = ClassifierManager.onnx(config.getClassifier(), labelTable.size());
        IAdviceGeneratorAdapter adviceGenerator = new OpenAIStandardAdviceAdapter(config.getAdvice());
        return new DiseaseDetectionService(config, classifierManager, labelTable, knowledgeBase, adviceGenerator);
    }

    /**
     * Runs one detection and waits for it up to the configured timeout.
     *
     * @throws fasal.common.exception.ValidationException  for rejected uploads
     * @throws fasal.common.exception.DecodeException      for corrupt images
     * @throws ModelUnavailableException                   while the classifier is degraded
     * @throws DetectionTimeoutException                   when the deadline passes
     * @throws UnknownLabelException                       on label or knowledge base integrity faults
     */
    public DetectionResponse detect(DetectionRequest request) {
        Future<DetectionResponse> future = detectAsync(request);
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Detection timed out after {} ms for crop {}", timeoutMillis, request.getCropHint());
            throw new DetectionTimeoutException(timeoutMillis);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RRException(500, "Detection interrupted");
        } catch (ExecutionException e) {
            throw unwrap(request, e.getCause());
        }
    }

    /**
     * Validates on the calling thread and schedules the rest. Cancelling the returned
     * future stops the work at the next stage boundary.
     */
    public Future<DetectionResponse> detectAsync(DetectionRequest request) {
        validator.validate(request.getByteLength(), request.getContentType(), request.getCropHint());
        try {
            classifierManager.requireReady();
        } catch (ModelUnavailableException e) {
            throw withFallback(request, e);
        }
        return executor.submit(() -> runPipeline(request));
    }

    public List<String> listSupportedCrops() {
        return labelTable.supportedCrops();
    }

    public List<DiseaseInfo> listKnownDiseases(String cropFilter) {
        return knowledgeBase.listDiseases(cropFilter);
    }

    public ServiceStatus getStatus() {
        return ServiceStatus.builder()
                .modelStatus(classifierManager.getStatus())
                .modelUsed(classifierManager.getModelName())
                .degradedReason(classifierManager.getDegradedReason())
                .adviceEnabled(treatmentAdvisor.isAdviceEnabled())
                .supportedClasses(labelTable.size())
                .knownDiseases(knowledgeBase.size())
                .build();
    }

    public ServiceStatus reloadModel() {
        ModelStatus status = classifierManager.reload();
        log.info("Classifier reload finished with status {}", status);
        return getStatus();
    }

    /**
     * Stops the worker pool, interrupting running detections, and closes the classifier.
     */
    public void shutdown() {
        ThreadPoolManager.shutdown(poolName);
        classifierManager.close();
        log.info("Detection pool {} shut down", poolName);
    }

    @Override
    public void close() {
        shutdown();
    }

    private DetectionResponse runPipeline(DetectionRequest request) {
        BufferedImage image = codec.decode(request.getImageBytes());
        checkpoint("decode");
        ImageTensor tensor = preprocessor.preprocess(image);
        checkpoint("preprocess");
        float[] scores = classifierManager.classify(tensor);
        checkpoint("inference");

        ClassificationResult result = interpreter.interpret(scores);
        SeverityTier severity = severityEstimator.severity(result.getLabel(), result.getConfidencePercent());
        TreatmentPlan plan = treatmentAdvisor.advise(result, severity, request.getLocation());
        checkpoint("advice");

        log.info("Detected {} ({}%, {}) for declared crop {}", result.getLabel().getKey(),
                result.getConfidencePercent(), severity.code(), request.getCropHint());
        return assembler.assemble(request, result, severity, plan, classifierManager.getModelName());
    }

    private static void checkpoint(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Detection cancelled after " + stage);
        }
    }

    private RuntimeException unwrap(DetectionRequest request, Throwable cause) {
        if (cause instanceof ModelUnavailableException) {
            return withFallback(request, (ModelUnavailableException) cause);
        }
        if (cause instanceof UnknownLabelException) {
            log.error("Data integrity defect during detection: {}", ((UnknownLabelException) cause).getMsg(), cause);
            return (UnknownLabelException) cause;
        }
        if (cause instanceof RRException) {
            return (RRException) cause;
        }
        if (cause instanceof CancellationException) {
            return (CancellationException) cause;
        }
        log.error("Unexpected detection failure", cause);
        return new RRException(500, "Detection failed", cause);
    }

    private ModelUnavailableException withFallback(DetectionRequest request, ModelUnavailableException e) {
        if (e.getFallbackResponse() != null) {
            return e;
        }
        return new ModelUnavailableException(e.getReason(), assembler.assembleFallback(request, e.getReason()));
    }
}
