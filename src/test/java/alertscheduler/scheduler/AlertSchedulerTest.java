package alertscheduler.scheduler;

import alertscheduler.alertmanager.Alert;
import alertscheduler.alertmanager.AlertFormatException;
import alertscheduler.alertmanager.AlertSourceClient;
import alertscheduler.alertmanager.AlertTransportException;
import alertscheduler.config.AlertmanagerEndpoint;
import alertscheduler.config.ScheduledAlertConfig;
import alertscheduler.config.ScheduledJob;
import alertscheduler.incident.DispatchException;
import alertscheduler.incident.IncidentDispatcher;
import alertscheduler.incident.IncidentPayload;
import alertscheduler.incident.IncidentPayloadBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;

class AlertSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");
    private static final Instant TRIGGER = Instant.parse("2024-05-01T09:00:00Z");

    private ManualCronEngine engine;
    private IncidentDispatcher dispatcher;
    private Map<String, AlertSourceClient> clients;

    @BeforeEach
    void setUp() {
        engine = new ManualCronEngine(NOW);
        dispatcher = mock(IncidentDispatcher.class);
        clients = new ConcurrentHashMap<>();
    }

    private AlertScheduler scheduler(ScheduledAlertConfig config) {
        return new AlertScheduler(
                config,
                engine,
                endpoint -> clients.get(endpoint.getUrl()),
                new IncidentPayloadBuilder(Clock.fixed(TRIGGER, ZoneOffset.UTC)),
                dispatcher);
    }

    private AlertScheduler scheduler(ScheduledJob... jobs) {
        return scheduler(ScheduledAlertConfig.of(true, "UTC", List.of(jobs)));
    }

    static ScheduledJob job(String name, String schedule, String url) {
        ScheduledJob job = new ScheduledJob();
        job.setName(name);
        job.setEnable(true);
        job.setSchedule(schedule);
        job.setAlertmanager(new AlertmanagerEndpoint(url, null, null));
        return job;
    }

    static Alert alert(String alertname, String severity) {
        return Alert.builder()
                .label("alertname", alertname)
                .label("severity", severity)
                .annotation("summary", alertname + " is firing")
                .startsAt(ZonedDateTime.parse("2024-05-01T07:30:00Z").toOffsetDateTime())
                .state(Alert.STATE_ACTIVE)
                .fingerprint(alertname + "-fp")
                .generatorUrl("http://prometheus/graph")
                .build();
    }

    @Nested
    class Start {

        @Test
        void disabledConfig_registersNothing() {
            AlertScheduler scheduler = scheduler(ScheduledAlertConfig.of(false, "UTC",
                    List.of(job("a", "09:00", "http://am"))));

            scheduler.start();

            assertThat(scheduler.isEnabled()).isFalse();
            assertThat(scheduler.status()).isEmpty();
            assertThat(engine.registered).isEmpty();
        }

        @Test
        void emptySchedule_failsWithDescriptiveErrorAndNoEntry() {
            AlertScheduler scheduler = scheduler(job("nightly", "", "http://am"));

            assertThatThrownBy(scheduler::start)
                    .isInstanceOf(ScheduleConfigException.class)
                    .hasMessageContaining("nightly")
                    .hasMessageContaining("schedule is required");
            assertThat(scheduler.status()).isEmpty();
            assertThat(engine.registered).isEmpty();
        }

        @Test
        void invalidCronAfterValidJob_registersNothing() {
            AlertScheduler scheduler = scheduler(
                    job("good", "0 9 * * *", "http://am"),
                    job("bad", "every morning", "http://am"));

            assertThatThrownBy(scheduler::start)
                    .isInstanceOf(ScheduleConfigException.class)
                    .hasMessageContaining("failed to add job 'bad'");
            assertThat(scheduler.status()).isEmpty();
            assertThat(engine.registered).isEmpty();
        }

        @Test
        void simpleSchedule_isRegisteredAsDailyCron() {
            AlertScheduler scheduler = scheduler(job("morning", "09:05", "http://am"));

            scheduler.start();

            assertThat(engine.registered).hasSize(1);
            CronTaskDescriptor descriptor = engine.registered.get(0).descriptor;
            assertThat(descriptor.getName()).isEqualTo("morning");
            assertThat(descriptor.getZone()).isEqualTo(ZoneId.of("UTC"));
            assertThat(scheduler.status()).singleElement().satisfies(status -> {
                assertThat(status.getNextRun()).isEqualTo(Instant.parse("2024-05-01T09:05:00Z"));
                assertThat(status.getPrevRun()).isNull();
                assertThat(status.isActive()).isTrue();
                assertThat(status.isFiring()).isFalse();
            });
        }

        @Test
        void disabledJob_isSkippedSilently() {
            ScheduledJob disabled = job("off", "", "http://am");
            disabled.setEnable(false);

            AlertScheduler scheduler = scheduler(disabled, job("on", "0 9 * * *", "http://am"));
            scheduler.start();

            assertThat(scheduler.status()).extracting(JobStatus::getName).containsExactly("on");
        }

        @Test
        void duplicateNames_leaveOneEntryAndCancelEarlierTask() {
            AlertScheduler scheduler = scheduler(
                    job("dup", "0 9 * * *", "http://first"),
                    job("dup", "0 10 * * *", "http://second"));

            scheduler.start();

            assertThat(scheduler.status()).singleElement().satisfies(status ->
                    assertThat(status.getNextRun()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z")));
            assertThat(engine.active()).hasSize(1);
            assertThat(engine.registered.get(0).cancelled).isTrue();
        }

        @Test
        void invalidTimezone_fallsBackToLocalZone() {
            AlertScheduler scheduler = scheduler(ScheduledAlertConfig.of(true, "Mars/Olympus_Mons",
                    List.of(job("a", "09:00", "http://am"))));

            scheduler.start();

            assertThat(scheduler.getZone()).isEqualTo(ZoneId.systemDefault());
            assertThat(scheduler.status()).hasSize(1);
        }

        @Test
        void startTwice_isRejected() {
            AlertScheduler scheduler = scheduler(job("a", "09:00", "http://am"));
            scheduler.start();

            assertThatThrownBy(scheduler::start).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class Fire {

        @Test
        void matchedAlerts_areDispatchedOnceWithOverlayAndParams() {
            clients.put("http://am", () -> List.of(alert("HighCPU", "critical"), alert("DiskLow", "warning")));
            ScheduledJob job = job("critical", "09:00", "http://am");
            job.setMatchLabels(Map.of("severity", "critical"));
            job.getChannels().setSlackChannelId("C123");
            AlertScheduler scheduler = scheduler(job);
            scheduler.start();

            engine.trigger("critical", TRIGGER);

            ArgumentCaptor<IncidentPayload> payload = ArgumentCaptor.forClass(IncidentPayload.class);
            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, String>> params = ArgumentCaptor.forClass(Map.class);
            then(dispatcher).should().deliver(eq("scheduled"), payload.capture(), params.capture());

            assertThat(payload.getValue().getStatus()).isEqualTo("firing");
            assertThat(payload.getValue().getAlerts()).hasSize(1);
            assertThat(payload.getValue().getCommonLabels()).containsEntry("alertname", "HighCPU");
            assertThat(payload.getValue().getScheduledJob()).isEqualTo("critical");
            assertThat(payload.getValue().getScheduledTime()).isEqualTo("2024-05-01T09:00:00Z");
            assertThat(payload.getValue().getGroupKey()).isEqualTo("scheduled-" + TRIGGER.getEpochSecond());
            assertThat(params.getValue())
                    .containsEntry("oncall_enable", "false")
                    .containsEntry("slack_channel_id", "C123")
                    .hasSize(2);
        }

        @Test
        void fetchFailure_producesNoDispatchAndKeepsEntry() {
            clients.put("http://down", () -> {
                throw new AlertTransportException("failed to fetch alerts: connection refused", null);
            });
            AlertScheduler scheduler = scheduler(job("flaky", "09:00", "http://down"));
            scheduler.start();

            engine.trigger("flaky", TRIGGER);

            then(dispatcher).shouldHaveNoInteractions();
            assertThat(engine.active()).hasSize(1);
            assertThat(scheduler.status()).singleElement().satisfies(status -> {
                assertThat(status.isActive()).isTrue();
                assertThat(status.isFiring()).isFalse();
                assertThat(status.getPrevRun()).isEqualTo(TRIGGER);
                assertThat(status.getNextRun()).isEqualTo(Instant.parse("2024-05-02T09:00:00Z"));
            });
        }

        @Test
        void formatFailure_producesNoDispatch() {
            clients.put("http://am", () -> {
                throw new AlertFormatException("failed to parse alerts");
            });
            AlertScheduler scheduler = scheduler(job("garbled", "09:00", "http://am"));
            scheduler.start();

            engine.trigger("garbled", TRIGGER);

            then(dispatcher).shouldHaveNoInteractions();
            assertThat(scheduler.status()).singleElement().extracting(JobStatus::isActive).isEqualTo(true);
        }

        @Test
        void noMatchedAlerts_skipsDispatch() {
            clients.put("http://am", () -> List.of(alert("DiskLow", "warning")));
            ScheduledJob job = job("critical", "09:00", "http://am");
            job.setMatchLabels(Map.of("severity", "critical"));
            AlertScheduler scheduler = scheduler(job);
            scheduler.start();

            engine.trigger("critical", TRIGGER);

            then(dispatcher).shouldHaveNoInteractions();
        }

        @Test
        void dispatchFailure_isContainedAndNextTickDispatchesAgain() {
            clients.put("http://am", () -> List.of(alert("HighCPU", "critical")));
            willThrow(new DispatchException("pipeline unavailable"))
                    .given(dispatcher).deliver(anyString(), any(), anyMap());
            AlertScheduler scheduler = scheduler(job("a", "09:00", "http://am"));
            scheduler.start();

            engine.trigger("a", TRIGGER);
            engine.trigger("a", TRIGGER.plusSeconds(86400));

            then(dispatcher).should(times(2)).deliver(anyString(), any(), anyMap());
            assertThat(scheduler.status()).singleElement()
                    .extracting(JobStatus::getPrevRun).isEqualTo(TRIGGER.plusSeconds(86400));
        }

        @Test
        void unexpectedRuntimeFailure_doesNotPropagate() {
            clients.put("http://am", () -> {
                throw new IllegalStateException("boom");
            });
            AlertScheduler scheduler = scheduler(job("a", "09:00", "http://am"));
            scheduler.start();

            engine.trigger("a", TRIGGER);

            then(dispatcher).shouldHaveNoInteractions();
            assertThat(scheduler.status()).singleElement().extracting(JobStatus::isFiring).isEqualTo(false);
        }

        @Test
        void oncallOverride_isPassedThrough() {
            clients.put("http://am", () -> List.of(alert("HighCPU", "critical")));
            ScheduledJob job = job("pager", "09:00", "http://am");
            job.setOncallEnable(true);
            AlertScheduler scheduler = scheduler(job);
            scheduler.start();

            engine.trigger("pager", TRIGGER);

            then(dispatcher).should().deliver(eq("scheduled"), any(), eq(Map.of("oncall_enable", "true")));
        }
    }

    @Nested
    class Stop {

        @Test
        void stopTwice_stopsEngineOnceAndDeactivatesEntries() {
            AlertScheduler scheduler = scheduler(job("a", "09:00", "http://am"));
            scheduler.start();

            scheduler.stop();
            scheduler.stop();

            assertThat(engine.stopCalls).hasValue(1);
            assertThat(scheduler.status()).singleElement().extracting(JobStatus::isActive).isEqualTo(false);
        }
    }
}
