package com.DentalCare.chart_backend.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fixed catalog of clinical status codes shipped with the application.
 * Clinics extend it at runtime through custom statuses.
 */
public enum BuiltInStatus {

    // Hard tissue
    CARIES_INCIPIENT("caries_incipient", "Caries (Incipient)", "#F1C40F", StatusCategory.HARD_TISSUE),
    CARIES_MODERATE("caries_moderate", "Caries (Moderate)", "#F39C12", StatusCategory.HARD_TISSUE),
    CARIES_DEEP("caries_deep", "Caries (Deep)", "#E74C3C", StatusCategory.HARD_TISSUE),
    FRACTURE("fracture", "Fracture", "#FF0000", StatusCategory.HARD_TISSUE),
    WEAR("wear", "Wear / Attrition", "#BDB76B", StatusCategory.HARD_TISSUE),
    ENAMEL_DEFECT("enamel_defect", "Enamel Defect", "#C71585", StatusCategory.HARD_TISSUE),
    FILLING("filling", "Filling", "#95A5A6", StatusCategory.HARD_TISSUE),
    DEFECTIVE_RESTORATION("defective_restoration", "Defective Restoration", "#CD853F", StatusCategory.HARD_TISSUE),
    CROWN("crown", "Crown", "#3498DB", StatusCategory.HARD_TISSUE),
    MISSING("missing", "Missing", "#34495E", StatusCategory.HARD_TISSUE),
    EXTRACTED("extracted", "Extracted", "#2C3E50", StatusCategory.HARD_TISSUE),
    IMPLANT("implant", "Implant", "#9B59B6", StatusCategory.HARD_TISSUE),

    // Pulpal / periapical
    PULPITIS_REVERSIBLE("pulpitis_reversible", "Reversible Pulpitis", "#FFB6C1", StatusCategory.PULPAL_PERIAPICAL),
    PULPITIS_IRREVERSIBLE("pulpitis_irreversible", "Irreversible Pulpitis", "#FF69B4", StatusCategory.PULPAL_PERIAPICAL),
    PULP_NECROSIS("pulp_necrosis", "Pulp Necrosis", "#8B0000", StatusCategory.PULPAL_PERIAPICAL),
    PERIAPICAL_ABSCESS("periapical_abscess", "Periapical Abscess", "#B22222", StatusCategory.PULPAL_PERIAPICAL),
    ROOT_CANAL("root_canal", "Root Canal Treated", "#E91E63", StatusCategory.PULPAL_PERIAPICAL),

    // Periodontal
    GINGIVITIS("gingivitis", "Gingivitis", "#FF6347", StatusCategory.PERIODONTAL),
    PERIODONTITIS("periodontitis", "Periodontitis", "#B22222", StatusCategory.PERIODONTAL),
    GUM_RECESSION("gum_recession", "Gum Recession", "#F08080", StatusCategory.PERIODONTAL),
    POCKET_FORMATION("pocket_formation", "Pocket Formation", "#CD5C5C", StatusCategory.PERIODONTAL),
    MOBILITY("mobility", "Mobility", "#A0522D", StatusCategory.PERIODONTAL),

    // Soft tissue
    SWELLING("swelling", "Swelling", "#FF7F50", StatusCategory.SOFT_TISSUE),
    ULCER("ulcer", "Ulcer", "#DB7093", StatusCategory.SOFT_TISSUE),
    SOFT_TISSUE_LESION("soft_tissue_lesion", "Soft Tissue Lesion", "#C04000", StatusCategory.SOFT_TISSUE),

    // Other, including patient-reported complaints
    NORMAL("normal", "Normal", "#FFFFFF", StatusCategory.OTHER),
    TOOTHACHE("toothache", "Toothache", "#E67E22", StatusCategory.OTHER),
    PAIN("pain", "Pain", "#D35400", StatusCategory.OTHER),
    SENSITIVITY("sensitivity", "Sensitivity", "#FFFF00", StatusCategory.OTHER),
    BLEEDING("bleeding", "Bleeding", "#C0392B", StatusCategory.OTHER),
    FOOD_IMPACTION("food_impaction", "Food Impaction", "#A67B5B", StatusCategory.OTHER),
    TREATED("treated", "Treated", "#4CAF50", StatusCategory.OTHER),
    TREATMENT_PLANNED("treatment_planned", "Treatment Planned", "#00CED1", StatusCategory.OTHER),
    OBSERVATION("observation", "Under Observation", "#40E0D0", StatusCategory.OTHER);

    private static final Map<String, BuiltInStatus> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(BuiltInStatus::getCode, Function.identity()));

    private final String code;
    private final String displayName;
    private final String color;
    private final StatusCategory category;

    BuiltInStatus(String code, String displayName, String color, StatusCategory category) {
        this.code = code;
        this.displayName = displayName;
        this.color = color;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getColor() {
        return color;
    }

    public StatusCategory getCategory() {
        return category;
    }

    /**
     * Case-insensitive lookup by code.
     */
    public static Optional<BuiltInStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE.get(code.trim().toLowerCase(Locale.ROOT)));
    }

    public static boolean isBuiltIn(String code) {
        return fromCode(code).isPresent();
    }
}
