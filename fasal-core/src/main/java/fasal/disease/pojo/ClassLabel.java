package fasal.disease.pojo;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of crop/condition tags the leaf classifier can output.
 * The key is the label string the model was trained with.
 */
public enum ClassLabel {
    APPLE_SCAB("Apple___Apple_scab", "Apple", "Apple Scab", ConditionCategory.FUNGAL),
    APPLE_BLACK_ROT("Apple___Black_rot", "Apple", "Black Rot", ConditionCategory.ROT),
    APPLE_CEDAR_RUST("Apple___Cedar_apple_rust", "Apple", "Cedar Apple Rust", ConditionCategory.FUNGAL),
    APPLE_HEALTHY("Apple___healthy", "Apple", "Healthy", ConditionCategory.HEALTHY),
    BACKGROUND("Background_without_leaves", null, "No Leaf Detected", ConditionCategory.BACKGROUND),
    BLUEBERRY_HEALTHY("Blueberry___healthy", "Blueberry", "Healthy", ConditionCategory.HEALTHY),
    CHERRY_POWDERY_MILDEW("Cherry___Powdery_mildew", "Cherry", "Powdery Mildew", ConditionCategory.FUNGAL),
    CHERRY_HEALTHY("Cherry___healthy", "Cherry", "Healthy", ConditionCategory.HEALTHY),
    CORN_GRAY_LEAF_SPOT("Corn___Cercospora_leaf_spot Gray_leaf_spot", "Corn", "Cercospora Leaf Spot (Gray Leaf Spot)", ConditionCategory.FUNGAL),
    CORN_COMMON_RUST("Corn___Common_rust", "Corn", "Common Rust", ConditionCategory.FUNGAL),
    CORN_NORTHERN_LEAF_BLIGHT("Corn___Northern_Leaf_Blight", "Corn", "Northern Leaf Blight", ConditionCategory.BLIGHT),
    CORN_HEALTHY("Corn___healthy", "Corn", "Healthy", ConditionCategory.HEALTHY),
    GRAPE_BLACK_ROT("Grape___Black_rot", "Grape", "Black Rot", ConditionCategory.ROT),
    GRAPE_ESCA("Grape___Esca_(Black_Measles)", "Grape", "Esca (Black Measles)", ConditionCategory.FUNGAL),
    GRAPE_LEAF_BLIGHT("Grape___Leaf_blight_(Isariopsis_Leaf_Spot)", "Grape", "Leaf Blight (Isariopsis Leaf Spot)", ConditionCategory.FUNGAL),
    GRAPE_HEALTHY("Grape___healthy", "Grape", "Healthy", ConditionCategory.HEALTHY),
    ORANGE_HUANGLONGBING("Orange___Haunglongbing_(Citrus_greening)", "Orange", "Huanglongbing (Citrus Greening)", ConditionCategory.BACTERIAL),
    PEACH_BACTERIAL_SPOT("Peach___Bacterial_spot", "Peach", "Bacterial Spot", ConditionCategory.BACTERIAL),
    PEACH_HEALTHY("Peach___healthy", "Peach", "Healthy", ConditionCategory.HEALTHY),
    PEPPER_BACTERIAL_SPOT("Pepper,_bell___Bacterial_spot", "Pepper", "Bacterial Spot", ConditionCategory.BACTERIAL),
    PEPPER_HEALTHY("Pepper,_bell___healthy", "Pepper", "Healthy", ConditionCategory.HEALTHY),
    POTATO_EARLY_BLIGHT("Potato___Early_blight", "Potato", "Early Blight", ConditionCategory.FUNGAL),
    POTATO_LATE_BLIGHT("Potato___Late_blight", "Potato", "Late Blight", ConditionCategory.BLIGHT),
    POTATO_HEALTHY("Potato___healthy", "Potato", "Healthy", ConditionCategory.HEALTHY),
    RASPBERRY_HEALTHY("Raspberry___healthy", "Raspberry", "Healthy", ConditionCategory.HEALTHY),
    SOYBEAN_HEALTHY("Soybean___healthy", "Soybean", "Healthy", ConditionCategory.HEALTHY),
    SQUASH_POWDERY_MILDEW("Squash___Powdery_mildew", "Squash", "Powdery Mildew", ConditionCategory.FUNGAL),
    STRAWBERRY_LEAF_SCORCH("Strawberry___Leaf_scorch", "Strawberry", "Leaf Scorch", ConditionCategory.FUNGAL),
    STRAWBERRY_HEALTHY("Strawberry___healthy", "Strawberry", "Healthy", ConditionCategory.HEALTHY),
    TOMATO_BACTERIAL_SPOT("Tomato___Bacterial_spot", "Tomato", "Bacterial Spot", ConditionCategory.BACTERIAL),
    TOMATO_EARLY_BLIGHT("Tomato___Early_blight", "Tomato", "Early Blight", ConditionCategory.FUNGAL),
    TOMATO_LATE_BLIGHT("Tomato___Late_blight", "Tomato", "Late Blight", ConditionCategory.BLIGHT),
    TOMATO_LEAF_MOLD("Tomato___Leaf_Mold", "Tomato", "Leaf Mold", ConditionCategory.FUNGAL),
    TOMATO_SEPTORIA_LEAF_SPOT("Tomato___Septoria_leaf_spot", "Tomato", "Septoria Leaf Spot", ConditionCategory.FUNGAL),
    TOMATO_SPIDER_MITES("Tomato___Spider_mites Two-spotted_spider_mite", "Tomato", "Spider Mites (Two-spotted Spider Mite)", ConditionCategory.PEST),
    TOMATO_TARGET_SPOT("Tomato___Target_Spot", "Tomato", "Target Spot", ConditionCategory.FUNGAL),
    TOMATO_YELLOW_LEAF_CURL_VIRUS("Tomato___Tomato_Yellow_Leaf_Curl_Virus", "Tomato", "Yellow Leaf Curl Virus", ConditionCategory.VIRAL),
    TOMATO_MOSAIC_VIRUS("Tomato___Tomato_mosaic_virus", "Tomato", "Mosaic Virus", ConditionCategory.VIRAL),
    TOMATO_HEALTHY("Tomato___healthy", "Tomato", "Healthy", ConditionCategory.HEALTHY);

    private static final Map<String, ClassLabel> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toMap(ClassLabel::getKey, Function.identity()));

    private final String key;
    private final String crop;
    private final String conditionName;
    private final ConditionCategory category;

    ClassLabel(String key, String crop, String conditionName, ConditionCategory category) {
        this.key = key;
        this.crop = crop;
        this.conditionName = conditionName;
        this.category = category;
    }

    public String getKey() {
        return key;
    }

    /**
     * @return crop name, or null for the background label
     */
    public String getCrop() {
        return crop;
    }

    public String getConditionName() {
        return conditionName;
    }

    public ConditionCategory getCategory() {
        return category;
    }

    public boolean isHealthy() {
        return category == ConditionCategory.HEALTHY;
    }

    public boolean isBackground() {
        return category == ConditionCategory.BACKGROUND;
    }

    public boolean isDisease() {
        return !isHealthy() && !isBackground();
    }

    /**
     * Display name such as "Tomato - Early Blight".
     */
    public String getDisplayName() {
        if (crop == null) {
            return conditionName;
        }
        return crop + " - " + conditionName;
    }

    public static ClassLabel fromKey(String key) {
        return key == null ? null : BY_KEY.get(key.trim());
    }
}
