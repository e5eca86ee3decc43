package likelion._th.roadwatch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 포트홀 심각도. 선언 순서가 곧 크기 순서 (NONE < LOW < MEDIUM < HIGH)
 */
public enum Severity {
    NONE("None"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isPothole() {
        return this != NONE;
    }

    /**
     * 탐지 개수 → 심각도
     * 0: None, 1: Low, 2: Medium, 3 이상: High
     */
    public static Severity fromDetections(int detections) {
        if (detections <= 0) return NONE;
        if (detections == 1) return LOW;
        if (detections == 2) return MEDIUM;
        return HIGH;
    }

    // 저장소 문자열 → 심각도 (모르는 값은 NONE)
    @JsonCreator
    public static Severity fromLabel(String label) {
        if (label == null) {
            return NONE;
        }
        String trimmed = label.trim();
        for (Severity severity : values()) {
            if (severity.label.equalsIgnoreCase(trimmed) || severity.name().equalsIgnoreCase(trimmed)) {
                return severity;
            }
        }
        return NONE;
    }

    // null 은 비교에서 제외
    public static Severity max(Severity a, Severity b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    // 수동 등록 시 심각도에 맞춰 기록하는 탐지 개수
    public int toDetections() {
        return ordinal();
    }
}
