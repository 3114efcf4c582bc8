package alertscheduler.alertmanager;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * 一次拉取得到的告警, 不落盘
 */
@Value
@Builder
public class Alert {
    public static final String STATE_ACTIVE = "active";

    @Singular
    Map<String, String> labels;
    @Singular
    Map<String, String> annotations;
    OffsetDateTime startsAt;
    OffsetDateTime endsAt;
    String state;
    List<String> silencedBy;
    List<String> inhibitedBy;
    @Singular
    List<String> receivers;
    String fingerprint;
    String generatorUrl;
}
