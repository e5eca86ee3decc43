package likelion._th.roadwatch.repository.firestore;

import java.util.Map;

// 문서 필드 값 변환 (메신저로 들어온 신고는 좌표가 문자열로 저장돼 있다)
final class DocumentValues {

    private DocumentValues() {
    }

    static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Integer toInteger(Object value) {
        Double number = toDouble(value);
        return number != null ? number.intValue() : null;
    }

    static String toText(Map<String, Object> data, String field) {
        Object value = data.get(field);
        return value != null ? value.toString() : null;
    }
}
