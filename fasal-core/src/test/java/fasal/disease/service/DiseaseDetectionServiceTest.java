package fasal.disease.service;

import com.google.gson.Gson;
import fasal.classifier.adapter.ClassifierLoader;
import fasal.classifier.adapter.IImageClassifierAdapter;
import fasal.common.exception.AdviceUnavailableException;
import fasal.common.exception.DecodeException;
import fasal.common.exception.DetectionTimeoutException;
import fasal.common.exception.ModelUnavailableException;
import fasal.common.exception.ValidationException;
import fasal.common.exception.ValidationReason;
import fasal.config.pojo.DetectionConfig.CropMismatchPolicy;
import fasal.config.pojo.GlobalConfigurations;
import fasal.disease.ClassLabelTable;
import fasal.disease.DiseaseKnowledgeBase;
import fasal.disease.ResponseAssembler;
import fasal.disease.TreatmentAdvisor;
import fasal.disease.pojo.ClassLabel;
import fasal.disease.pojo.DetectionRequest;
import fasal.disease.pojo.DetectionResponse;
import fasal.disease.pojo.ModelStatus;
import fasal.disease.pojo.ServiceStatus;
import fasal.disease.pojo.SeverityTier;
import fasal.image.SampleImages;
import fasal.image.pojo.ImageTensor;
import fasal.llm.adapter.IAdviceGeneratorAdapter;
import fasal.manager.ClassifierManager;
import org.junit.After;
import org.junit.Test;

import java.io.FileNotFoundException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DiseaseDetectionServiceTest {

    private static final DiseaseKnowledgeBase KNOWLEDGE_BASE = DiseaseKnowledgeBase.load("/data/plant_diseases.json");
    private static final byte[] LEAF = SampleImages.leafPng();

    private final List<DiseaseDetectionService> services = new ArrayList<>();

    @After
    public void tearDown() {
        services.forEach(DiseaseDetectionService::close);
    }

    @Test
    public void testEarlyBlightIsModerate() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.TOMATO_EARLY_BLIGHT, 0.945f);
        DetectionResponse response = service(new GlobalConfigurations(), () -> classifier).detect(request(LEAF));

        assertEquals(ClassLabel.TOMATO_EARLY_BLIGHT.getKey(), response.getDiseaseLabel());
        assertFalse(response.getIsHealthy());
        assertEquals(SeverityTier.MODERATE, response.getSeverity());
        assertEquals("Tomato", response.getCropDetected());
        assertEquals(94.5, response.getConfidencePercent(), 1e-9);
        assertFalse(response.getRecommendations().isEmpty());
        assertFalse(response.getCause().isEmpty());
        assertFalse(response.getTreatment().isEmpty());
        assertEquals("scripted", response.getModelUsed());
        assertTrue(new Gson().toJson(response).contains("\"severity\":\"moderate\""));
    }

    @Test
    public void testHealthyLeaf() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.TOMATO_HEALTHY, 0.982f);
        DetectionResponse response = service(new GlobalConfigurations(), () -> classifier).detect(request(LEAF));

        assertTrue(response.getIsHealthy());
        assertEquals(SeverityTier.NONE, response.getSeverity());
        assertEquals("None", response.getUrgency());
        assertEquals(98.2, response.getConfidencePercent(), 1e-9);
    }

    @Test
    public void testBackgroundAsksForReuploadWithoutKnowledgeLookup() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.BACKGROUND, 0.80f);
        DiseaseDetectionService service = service(new GlobalConfigurations(), () -> classifier,
                new DiseaseKnowledgeBase(Collections.emptyMap()), null);
        DetectionResponse response = service.detect(request(LEAF));

        assertFalse(response.getIsHealthy());
        assertEquals(SeverityTier.NONE, response.getSeverity());
        assertTrue(response.getRecommendations().contains(TreatmentAdvisor.REUPLOAD_RECOMMENDATION));
    }

    @Test
    public void testOversizedUploadRejectedBeforeInference() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.TOMATO_EARLY_BLIGHT, 0.9f);
        DiseaseDetectionService service = service(new GlobalConfigurations(), () -> classifier);
        try {
            service.detect(request(new byte[12 * 1024 * 1024]));
            fail("12 MB upload should be rejected");
        } catch (ValidationException e) {
            assertEquals(ValidationReason.TOO_LARGE, e.getReason());
        }
        assertEquals(0, classifier.calls.get());
    }

    @Test
    public void testMissingWeightsReturnModelUnavailableEveryTime() {
        AtomicInteger attempts = new AtomicInteger();
        ClassifierLoader missing = () -> {
            attempts.incrementAndGet();
            throw new FileNotFoundException("models/plant_disease_recog_model.onnx not found");
        };
        DiseaseDetectionService service = service(new GlobalConfigurations(), missing);
        byte[] corrupt = new byte[2048];

        for (int i = 0; i < 3; i++) {
            try {
                // corrupt bytes would raise DecodeException if preprocessing ran
                service.detect(request(corrupt));
                fail("Degraded service should not diagnose");
            } catch (ModelUnavailableException e) {
                assertEquals(503, e.getCode());
                DetectionResponse fallback = e.getFallbackResponse();
                assertNotNull(fallback);
                assertTrue(fallback.isFallback());
                assertEquals(ResponseAssembler.MODEL_NOT_AVAILABLE, fallback.getDiseaseLabel());
                assertEquals("Tomato", fallback.getCropType());
            }
        }
        assertEquals(1, attempts.get());
        assertEquals(ModelStatus.DEGRADED, service.getStatus().getModelStatus());
    }

    @Test
    public void testReloadLeavesDegradedMode() {
        AtomicBoolean weightsPresent = new AtomicBoolean(false);
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.POTATO_LATE_BLIGHT, 0.97f);
        DiseaseDetectionService service = service(new GlobalConfigurations(), () -> {
            if (!weightsPresent.get()) {
                throw new FileNotFoundException("weights");
            }
            return classifier;
        });
        assertEquals(ModelStatus.DEGRADED, service.getStatus().getModelStatus());

        weightsPresent.set(true);
        ServiceStatus status = service.reloadModel();
        assertEquals(ModelStatus.READY, status.getModelStatus());
        assertNull(status.getDegradedReason());
        assertEquals(SeverityTier.SEVERE, service.detect(request(LEAF)).getSeverity());
    }

    @Test
    public void testDetectAfterShutdownDoesNotLoadAgain() {
        AtomicInteger loads = new AtomicInteger();
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.TOMATO_HEALTHY, 0.9f);
        DiseaseDetectionService service = service(new GlobalConfigurations(), () -> {
            loads.incrementAndGet();
            return classifier;
        });
        assertEquals(ModelStatus.READY, service.getStatus().getModelStatus());

        service.shutdown();
        try {
            service.detect(request(LEAF));
            fail("Shut down service should not diagnose");
        } catch (ModelUnavailableException e) {
            assertEquals(503, e.getCode());
            assertTrue(e.getFallbackResponse().isFallback());
        }
        assertEquals(ModelStatus.CLOSED, service.getStatus().getModelStatus());
        assertEquals(ModelStatus.CLOSED, service.reloadModel().getModelStatus());
        assertEquals(1, loads.get());
        assertEquals(0, classifier.calls.get());
    }

    @Test
    public void testCorruptImageIsDecodeError() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.APPLE_SCAB, 0.9f);
        byte[] garbage = new byte[4096];
        Arrays.fill(garbage, (byte) 7);
        try {
            service(new GlobalConfigurations(), () -> classifier).detect(request(garbage));
            fail("Garbage should not decode");
        } catch (DecodeException e) {
            assertEquals(422, e.getCode());
        }
        assertEquals(0, classifier.calls.get());
    }

    @Test
    public void testRepeatedDetectionIsDeterministic() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.CORN_COMMON_RUST, 0.7731f);
        DiseaseDetectionService service = service(new GlobalConfigurations(), () -> classifier);

        DetectionResponse first = service.detect(request(LEAF));
        DetectionResponse second = service.detect(request(LEAF.clone()));
        assertEquals(first.getDiseaseLabel(), second.getDiseaseLabel());
        assertEquals(first.getConfidencePercent(), second.getConfidencePercent(), 0);
        assertFalse(first.getDetectionId().equals(second.getDetectionId()));
    }

    @Test
    public void testAdviceFailureKeepsDeterministicFields() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.GRAPE_BLACK_ROT, 0.9f);
        IAdviceGeneratorAdapter failing = context -> {
            throw new AdviceUnavailableException("advice service down");
        };
        DetectionResponse response = service(new GlobalConfigurations(), () -> classifier, KNOWLEDGE_BASE, failing)
                .detect(request(LEAF));

        assertNull(response.getGeneratedAdvice());
        assertEquals(SeverityTier.SEVERE, response.getSeverity());
        assertFalse(response.getRecommendations().isEmpty());
        assertFalse(response.getNextSteps().isEmpty());
        assertFalse(response.getCause().isEmpty());
    }

    @Test
    public void testGeneratedAdviceIncluded() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.APPLE_SCAB, 0.8f);
        IAdviceGeneratorAdapter advice = context -> "Prune the canopy for " + context.getCrop();
        DetectionResponse response = service(new GlobalConfigurations(), () -> classifier, KNOWLEDGE_BASE, advice)
                .detect(request(LEAF));
        assertEquals("Prune the canopy for Apple", response.getGeneratedAdvice());
    }

    @Test
    public void testSlowInferenceTimesOut() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.TOMATO_LEAF_MOLD, 0.9f);
        classifier.delayMillis = 5000;
        GlobalConfigurations config = new GlobalConfigurations();
        config.getDetection().setTimeoutMillis(200);

        long start = System.nanoTime();
        try {
            service(config, () -> classifier).detect(request(LEAF));
            fail("Detection should time out");
        } catch (DetectionTimeoutException e) {
            assertEquals(504, e.getCode());
        }
        assertTrue("Timeout should not wait for the slow classifier",
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 4000);
    }

    @Test
    public void testAsyncDetectionAndCancellation() throws Exception {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.STRAWBERRY_LEAF_SCORCH, 0.66f);
        DiseaseDetectionService service = service(new GlobalConfigurations(), () -> classifier);

        Future<DetectionResponse> done = service.detectAsync(request(LEAF));
        assertEquals(SeverityTier.MILD, done.get(10, TimeUnit.SECONDS).getSeverity());

        classifier.delayMillis = 5000;
        Future<DetectionResponse> slow = service.detectAsync(request(LEAF));
        assertTrue(slow.cancel(true));
        assertTrue(slow.isCancelled());
    }

    @Test
    public void testValidationRunsOnCallerThread() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.APPLE_SCAB, 0.9f);
        DetectionRequest noCrop = request(LEAF);
        noCrop.setCropHint(null);
        try {
            service(new GlobalConfigurations(), () -> classifier).detectAsync(noCrop);
            fail("Missing crop should be rejected before scheduling");
        } catch (ValidationException e) {
            assertEquals(ValidationReason.MISSING_CROP_HINT, e.getReason());
        }
    }

    @Test
    public void testCropMismatchWarning() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.POTATO_EARLY_BLIGHT, 0.9f);
        GlobalConfigurations config = new GlobalConfigurations();
        config.getDetection().setCropMismatchPolicy(CropMismatchPolicy.WARN);

        DetectionResponse response = service(config, () -> classifier).detect(request(LEAF));
        assertEquals("Tomato", response.getCropType());
        assertEquals("Potato", response.getCropDetected());
        assertEquals(1, response.getWarnings().size());
    }

    @Test
    public void testConcurrentDetectionsShareOneModel() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.PEACH_BACTERIAL_SPOT, 0.75f);
        GlobalConfigurations config = new GlobalConfigurations();
        config.getClassifier().setEagerLoad(false);
        DiseaseDetectionService service = service(config, () -> {
            loads.incrementAndGet();
            return classifier;
        });

        ExecutorService callers = Executors.newFixedThreadPool(6);
        try {
            List<Future<DetectionResponse>> futures = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                futures.add(callers.submit(() -> service.detect(request(LEAF))));
            }
            for (Future<DetectionResponse> future : futures) {
                DetectionResponse response = future.get(10, TimeUnit.SECONDS);
                assertEquals(SeverityTier.MODERATE, response.getSeverity());
                assertTrue(response.getConfidencePercent() >= 0 && response.getConfidencePercent() <= 100);
            }
        } finally {
            callers.shutdownNow();
        }
        assertEquals(1, loads.get());
        assertEquals(12, classifier.calls.get());
    }

    @Test
    public void testListingsAndStatus() {
        ScriptedClassifier classifier = new ScriptedClassifier(ClassLabel.APPLE_SCAB, 0.9f);
        DiseaseDetectionService service = service(new GlobalConfigurations(), () -> classifier);

        assertEquals(14, service.listSupportedCrops().size());
        assertEquals(3, service.listKnownDiseases("Apple").size());
        assertEquals(26, service.listKnownDiseases("").size());

        ServiceStatus status = service.getStatus();
        assertEquals(ModelStatus.READY, status.getModelStatus());
        assertEquals(39, status.getSupportedClasses());
        assertEquals(26, status.getKnownDiseases());
        assertFalse(status.isAdviceEnabled());
    }

    @Test
    public void testFromConfigWithoutWeightsStartsDegraded() {
        GlobalConfigurations config = new GlobalConfigurations();
        config.getClassifier().setModelPath("target/missing-model.onnx");
        DiseaseDetectionService service = DiseaseDetectionService.fromConfig(config);
        services.add(service);

        ServiceStatus status = service.getStatus();
        assertEquals(ModelStatus.DEGRADED, status.getModelStatus());
        assertTrue(status.getDegradedReason().contains("missing-model.onnx"));
        assertEquals(26, status.getKnownDiseases());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedBackendRejected() {
        GlobalConfigurations config = new GlobalConfigurations();
        config.getClassifier().setBackend("tflite");
        DiseaseDetectionService.fromConfig(config);
    }

    private DiseaseDetectionService service(GlobalConfigurations config, ClassifierLoader loader) {
        return service(config, loader, KNOWLEDGE_BASE, null);
    }

    private DiseaseDetectionService service(GlobalConfigurations config, ClassifierLoader loader,
                                            DiseaseKnowledgeBase knowledgeBase, IAdviceGeneratorAdapter advice) {
        ClassLabelTable labels = ClassLabelTable.defaultTable();
        ClassifierManager manager = new ClassifierManager(loader, labels.size());
        DiseaseDetectionService service = new DiseaseDetectionService(config, manager, labels, knowledgeBase, advice);
        services.add(service);
        return service;
    }

    private static DetectionRequest request(byte[] bytes) {
        return DetectionRequest.builder()
                .imageBytes(bytes)
                .contentType("image/png")
                .fileName("leaf.png")
                .cropHint("Tomato")
                .location("Rajkot")
                .build();
    }

    static class ScriptedClassifier implements IImageClassifierAdapter {
        private final ClassLabel winner;
        private final float confidence;
        final AtomicInteger calls = new AtomicInteger();
        volatile long delayMillis;

        ScriptedClassifier(ClassLabel winner, float confidence) {
            this.winner = winner;
            this.confidence = confidence;
        }

        @Override
        public float[] classify(ImageTensor tensor) {
            calls.incrementAndGet();
            if (delayMillis > 0) {
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            float[] scores = new float[ClassLabel.values().length];
            Arrays.fill(scores, (1f - confidence) / (scores.length - 1));
            scores[winner.ordinal()] = confidence;
            return scores;
        }

        @Override
        public String getModelName() {
            return "scripted";
        }

        @Override
        public int getNumClasses() {
            return ClassLabel.values().length;
        }
    }
}
