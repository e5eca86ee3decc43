package likelion._th.roadwatch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

// 클러스터 처리 상태 (대시보드에서만 변경)
public enum ClusterStatus {
    OPEN("Open"),
    IN_PROGRESS("In Progress"),
    FIXED("Fixed");

    private final String label;

    ClusterStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static ClusterStatus fromLabel(String label) {
        for (ClusterStatus status : values()) {
            if (status.label.equals(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Invalid status: " + label + " (allowed: Open, In Progress, Fixed)");
    }

    // 저장된 값이 깨져 있으면 Open 으로 본다
    public static ClusterStatus fromStoredLabel(String label) {
        for (ClusterStatus status : values()) {
            if (status.label.equals(label)) {
                return status;
            }
        }
        return OPEN;
    }
}
