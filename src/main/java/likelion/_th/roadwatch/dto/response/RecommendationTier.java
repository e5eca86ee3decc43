package likelion._th.roadwatch.dto.response;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationTier {
    SAFE("safe"),
    RECOMMENDED("recommended"),
    CONSIDER("consider"),
    CAUTION("caution");

    private final String value;

    RecommendationTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
