package fasal.disease;

import cn.hutool.core.util.StrUtil;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import fasal.common.exception.UnknownLabelException;
import fasal.disease.pojo.ClassLabel;
import fasal.disease.pojo.DiseaseInfo;
import fasal.disease.pojo.DiseaseRecord;
import fasal.utils.ResourceUtil;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Cause and cure text per disease label, read once from a JSON file and never modified.
 */
@Slf4j
public class DiseaseKnowledgeBase {

    private final Map<ClassLabel, DiseaseRecord> records;

    public DiseaseKnowledgeBase(Map<ClassLabel, DiseaseRecord> records) {
        EnumMap<ClassLabel, DiseaseRecord> copy = new EnumMap<>(ClassLabel.class);
        copy.putAll(records);
        this.records = Collections.unmodifiableMap(copy);
        for (ClassLabel label : ClassLabel.values()) {
            if (label.isDisease() && !copy.containsKey(label)) {
                log.warn("Knowledge base has no record for disease label {}", label.getKey());
            }
        }
    }

    public static DiseaseKnowledgeBase load(String resPath) {
        String json = ResourceUtil.loadAsString(resPath);
        if (json == null) {
            throw new IllegalStateException("Disease database not found: " + resPath);
        }
        List<RawRecord> raw;
        try {
            raw = new Gson().fromJson(json, new TypeToken<List<RawRecord>>() {
            }.getType());
        } catch (JsonParseException e) {
            throw new IllegalStateException("Disease database " + resPath + " is not valid JSON", e);
        }
        Map<ClassLabel, DiseaseRecord> records = Maps.newEnumMap(ClassLabel.class);
        for (RawRecord entry : raw == null ? Collections.<RawRecord>emptyList() : raw) {
            ClassLabel label = ClassLabel.fromKey(entry.getName());
            if (label == null) {
                log.warn("Skipping disease record with unknown label '{}'", entry.getName());
                continue;
            }
            if (!label.isDisease()) {
                continue;
            }
            if (StrUtil.isBlank(entry.getCause()) || StrUtil.isBlank(entry.getCure())) {
                log.warn("Skipping disease record {} with empty cause or cure", label.getKey());
                continue;
            }
            records.put(label, new DiseaseRecord(label, label.getDisplayName(), entry.getCause().trim(), entry.getCure().trim()));
        }
        log.info("Loaded {} disease records from {}", records.size(), resPath);
        return new DiseaseKnowledgeBase(records);
    }

    /**
     * @throws IllegalArgumentException for healthy or background labels, which have no record
     * @throws UnknownLabelException when a disease label is missing from the table
     */
    public DiseaseRecord record(ClassLabel label) {
        if (!label.isDisease()) {
            throw new IllegalArgumentException(label.getKey() + " is not a disease label");
        }
        DiseaseRecord record = records.get(label);
        if (record == null) {
            throw new UnknownLabelException("No knowledge base record for " + label.getKey());
        }
        return record;
    }

    public List<DiseaseInfo> listDiseases(String cropFilter) {
        ImmutableList.Builder<DiseaseInfo> out = ImmutableList.builder();
        for (DiseaseRecord record : records.values()) {
            String crop = record.getLabel().getCrop();
            if (StrUtil.isNotBlank(cropFilter) && !crop.equalsIgnoreCase(cropFilter.trim())) {
                continue;
            }
            out.add(DiseaseInfo.builder()
                    .diseaseId(record.getLabel().getKey())
                    .name(record.getName())
                    .crop(crop)
                    .cause(record.getCause())
                    .cure(record.getCure())
                    .build());
        }
        return out.build();
    }

    public int size() {
        return records.size();
    }

    @Data
    private static class RawRecord {
        private String name;
        private String cause;
        private String cure;
    }
}
