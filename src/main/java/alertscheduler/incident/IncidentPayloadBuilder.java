package alertscheduler.incident;

import alertscheduler.alertmanager.Alert;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * 将过滤后的告警转换为事件载荷
 */
public class IncidentPayloadBuilder {

    public static final DateTimeFormatter RFC3339 = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");

    private final Clock clock;

    public IncidentPayloadBuilder(Clock clock) {
        this.clock = clock;
    }

    public IncidentPayloadBuilder() {
        this(Clock.systemUTC());
    }

    /**
     * 空列表返回 Optional.empty(), 调用方据此跳过投递
     */
    public Optional<IncidentPayload> build(List<Alert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            return Optional.empty();
        }

        IncidentPayload payload = new IncidentPayload();
        for (Alert alert : alerts) {
            payload.getAlerts().add(IncidentAlert.builder()
                    .status(alert.getState())
                    .labels(alert.getLabels())
                    .annotations(alert.getAnnotations())
                    .startsAt(format(alert.getStartsAt()))
                    .endsAt(format(alert.getEndsAt()))
                    .fingerprint(alert.getFingerprint())
                    .generatorUrl(alert.getGeneratorUrl())
                    .build());
        }

        // only meaningful when match_labels narrowed the set to one group
        Alert first = alerts.get(0);
        payload.setReceiver(IncidentPayload.RECEIVER);
        payload.setStatus(IncidentPayload.STATUS_FIRING);
        payload.setCommonLabels(new LinkedHashMap<>(first.getLabels()));
        payload.setCommonAnnotations(new LinkedHashMap<>(first.getAnnotations()));
        payload.setExternalUrl("");
        payload.setGroupKey(IncidentPayload.GROUP_KEY_PREFIX + clock.instant().getEpochSecond());
        return Optional.of(payload);
    }

    static String format(OffsetDateTime time) {
        return time == null ? null : time.format(RFC3339);
    }
}
