package alertscheduler.incident;

import alertscheduler.config.ScheduledJob;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelParamsTest {

    @Test
    void noOverrides_onlyDisablesOncall() {
        ScheduledJob job = new ScheduledJob();

        assertThat(ChannelParams.from(job)).containsExactly(Map.entry("oncall_enable", "false"));
    }

    @Test
    void oncallEnable_canBeTurnedOnPerJob() {
        ScheduledJob job = new ScheduledJob();
        job.setOncallEnable(true);

        assertThat(ChannelParams.from(job)).containsEntry("oncall_enable", "true");
    }

    @Test
    void channelOverrides_mapToDeliveryParameters() {
        ScheduledJob job = new ScheduledJob();
        job.getChannels().setSlackChannelId("C123");
        job.getChannels().setTelegramChatId("-100200");
        job.getChannels().setLarkWebhookKey("https://open.larksuite.com/hook/abc");
        job.getChannels().setMsteamsPowerUrlKey("https://power.example/flow");
        job.getChannels().setEmailTo("ops@example.com");

        assertThat(ChannelParams.from(job))
                .containsEntry("slack_channel_id", "C123")
                .containsEntry("telegram_chat_id", "-100200")
                .containsEntry("lark_other_webhook_url", "https://open.larksuite.com/hook/abc")
                .containsEntry("msteams_other_power_url", "https://power.example/flow")
                .containsEntry("email_to", "ops@example.com");
    }

    @Test
    void emptyOverrides_areOmitted() {
        ScheduledJob job = new ScheduledJob();
        job.getChannels().setSlackChannelId("");
        job.getChannels().setEmailTo("ops@example.com");

        assertThat(ChannelParams.from(job))
                .doesNotContainKey("slack_channel_id")
                .containsEntry("email_to", "ops@example.com");
    }
}
