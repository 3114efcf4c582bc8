package alertscheduler.alertmanager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 按标签精确匹配过滤告警
 */
public final class LabelMatcher {

    private LabelMatcher() {
    }

    /**
     * 返回保持原顺序的子序列, 每条告警必须包含所有 predicate 中的标签且值相等。
     * predicate 为空时原样返回。
     */
    public static List<Alert> filter(List<Alert> alerts, Map<String, String> predicate) {
        if (predicate == null || predicate.isEmpty()) {
            return alerts;
        }
        List<Alert> filtered = new ArrayList<>();
        for (Alert alert : alerts) {
            if (matches(alert.getLabels(), predicate)) {
                filtered.add(alert);
            }
        }
        return filtered;
    }

    public static boolean matches(Map<String, String> labels, Map<String, String> predicate) {
        for (Map.Entry<String, String> required : predicate.entrySet()) {
            if (labels == null || !labels.containsKey(required.getKey())) {
                return false;
            }
            String value = labels.get(required.getKey());
            if (value == null ? required.getValue() != null : !value.equals(required.getValue())) {
                return false;
            }
        }
        return true;
    }
}
