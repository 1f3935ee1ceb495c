package fasal.disease;

import com.google.common.collect.ImmutableList;
import fasal.common.exception.UnknownLabelException;
import fasal.disease.pojo.ClassLabel;
import fasal.utils.ResourceUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifier output index to {@link ClassLabel}. The order comes from the data file the
 * model was exported with and is checked against the closed label set on load.
 */
@Slf4j
public class ClassLabelTable {

    private final List<ClassLabel> labels;

    public ClassLabelTable(List<ClassLabel> labels) {
        Set<ClassLabel> seen = EnumSet.noneOf(ClassLabel.class);
        for (ClassLabel label : labels) {
            Objects.requireNonNull(label, "label");
            if (!seen.add(label)) {
                throw new IllegalStateException("Duplicate class label " + label.getKey());
            }
        }
        if (seen.size() != ClassLabel.values().length) {
            throw new IllegalStateException("Label table has " + seen.size()
                    + " entries, expected " + ClassLabel.values().length);
        }
        this.labels = ImmutableList.copyOf(labels);
    }

    public static ClassLabelTable load(String resPath) {
        List<String> lines = ResourceUtil.loadLines(resPath);
        if (lines == null) {
            throw new IllegalStateException("Class label file not found: " + resPath);
        }
        List<ClassLabel> labels = new ArrayList<>(lines.size());
        for (String key : lines) {
            ClassLabel label = ClassLabel.fromKey(key);
            if (label == null) {
                throw new IllegalStateException("Unknown class label '" + key + "' in " + resPath);
            }
            labels.add(label);
        }
        log.info("Loaded {} class labels from {}", labels.size(), resPath);
        return new ClassLabelTable(labels);
    }

    /**
     * Table in enum declaration order, which matches the training label order.
     */
    public static ClassLabelTable defaultTable() {
        List<ClassLabel> labels = new ArrayList<>();
        for (ClassLabel label : ClassLabel.values()) {
            labels.add(label);
        }
        return new ClassLabelTable(labels);
    }

    public ClassLabel get(int index) {
        if (index < 0 || index >= labels.size()) {
            throw new UnknownLabelException("Class index " + index + " is outside the label table");
        }
        return labels.get(index);
    }

    public int size() {
        return labels.size();
    }

    public List<ClassLabel> getLabels() {
        return labels;
    }

    public List<String> supportedCrops() {
        Set<String> crops = new TreeSet<>();
        for (ClassLabel label : labels) {
            if (!label.isBackground()) {
                crops.add(label.getCrop());
            }
        }
        return ImmutableList.copyOf(crops);
    }
}
