package fasal.classifier.adapter.impl;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import fasal.classifier.adapter.IImageClassifierAdapter;
import fasal.common.exception.RRException;
import fasal.config.pojo.ClassifierConfig;
import fasal.image.pojo.ImageTensor;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;

/**
 * Leaf classifier exported to ONNX. The session is created once and shared by all requests.
 */
@Slf4j
public class OnnxImageClassifierAdapter implements IImageClassifierAdapter {

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final String modelName;
    private final boolean applySoftmax;
    private final int numClasses;

    public OnnxImageClassifierAdapter(ClassifierConfig config) throws Exception {
        Path modelPath = Paths.get(config.getModelPath());
        if (!Files.isRegularFile(modelPath)) {
            throw new FileNotFoundException("Model file not found at " + modelPath.toAbsolutePath());
        }
        log.info("Loading ONNX classifier from {}", modelPath.toAbsolutePath());
        this.env = OrtEnvironment.getEnvironment();
        this.session = openSession(env, modelPath, config.getIntraOpThreads());
        try {
            this.inputName = session.getInputNames().iterator().next();
            this.numClasses = readNumClasses(session);
        } catch (OrtException | RuntimeException e) {
            session.close();
            throw e;
        }
        this.modelName = "ONNX " + config.getModelName();
        this.applySoftmax = config.isApplySoftmax();
        log.info("ONNX classifier ready, input={}, classes={}", inputName, numClasses);
    }

    @Override
    public float[] classify(ImageTensor tensor) {
        try (OnnxTensor input = OnnxTensor.createTensor(env, FloatBuffer.wrap(tensor.getData()), tensor.getShape());
             OrtSession.Result result = session.run(Collections.singletonMap(inputName, input))) {
            float[] scores = ((float[][]) result.get(0).getValue())[0];
            return applySoftmax ? softmax(scores) : scores;
        } catch (OrtException e) {
            throw new RRException(500, "Classifier inference failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public int getNumClasses() {
        return numClasses;
    }

    @Override
    public void close() {
        try {
            session.close();
        } catch (OrtException e) {
            log.warn("Failed to close ONNX session", e);
        }
    }

    private static OrtSession openSession(OrtEnvironment env, Path modelPath, int intraOpThreads) throws OrtException {
        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            if (intraOpThreads > 0) {
                options.setIntraOpNumThreads(intraOpThreads);
            }
            return env.createSession(modelPath.toString(), options);
        }
    }

    private static int readNumClasses(OrtSession session) throws OrtException {
        Map<String, NodeInfo> outputs = session.getOutputInfo();
        for (NodeInfo info : outputs.values()) {
            if (info.getInfo() instanceof TensorInfo) {
                long[] shape = ((TensorInfo) info.getInfo()).getShape();
                return shape.length == 0 ? -1 : (int) shape[shape.length - 1];
            }
        }
        return -1;
    }

    static float[] softmax(float[] logits) {
        float max = Float.NEGATIVE_INFINITY;
        for (float v : logits) {
            max = Math.max(max, v);
        }
        double sum = 0;
        double[] exp = new double[logits.length];
        for (int i = 0; i < logits.length; i++) {
            exp[i] = Math.exp(logits[i] - max);
            sum += exp[i];
        }
        float[] out = new float[logits.length];
        for (int i = 0; i < logits.length; i++) {
            out[i] = (float) (exp[i] / sum);
        }
        return out;
    }
}
