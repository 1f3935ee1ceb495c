package fasal.disease;

import fasal.common.exception.UnknownLabelException;
import fasal.disease.pojo.ClassLabel;
import fasal.disease.pojo.ClassificationResult;

/**
 * Turns a score vector into a labelled result. Ties go to the lower index.
 */
public class ClassificationInterpreter {

    private final ClassLabelTable labelTable;

    public ClassificationInterpreter(ClassLabelTable labelTable) {
        this.labelTable = labelTable;
    }

    public ClassificationResult interpret(float[] scores) {
        if (scores == null || scores.length != labelTable.size()) {
            throw new UnknownLabelException("Expected " + labelTable.size() + " scores, got "
                    + (scores == null ? 0 : scores.length));
        }
        int best = -1;
        for (int i = 0; i < scores.length; i++) {
            if (Float.isNaN(scores[i])) {
                continue;
            }
            if (best < 0 || scores[i] > scores[best]) {
                best = i;
            }
        }
        if (best < 0) {
            throw new UnknownLabelException("Classifier produced no usable score");
        }
        ClassLabel label = labelTable.get(best);
        return new ClassificationResult(label, best, toPercent(scores[best]));
    }

    static double toPercent(float probability) {
        double percent = probability * 100.0;
        if (percent < 0) {
            percent = 0;
        } else if (percent > 100 || Double.isInfinite(percent)) {
            percent = 100;
        }
        return Math.round(percent * 100.0) / 100.0;
    }
}
