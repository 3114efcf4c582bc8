package alertscheduler.incident;

import alertscheduler.config.ChannelOverrides;
import alertscheduler.config.ScheduledJob;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 由任务配置生成渠道覆盖参数
 */
public final class ChannelParams {

    public static final String ONCALL_ENABLE = "oncall_enable";
    public static final String SLACK_CHANNEL_ID = "slack_channel_id";
    public static final String TELEGRAM_CHAT_ID = "telegram_chat_id";
    public static final String LARK_OTHER_WEBHOOK_URL = "lark_other_webhook_url";
    public static final String MSTEAMS_OTHER_POWER_URL = "msteams_other_power_url";
    public static final String EMAIL_TO = "email_to";

    private ChannelParams() {
    }

    public static Map<String, String> from(ScheduledJob job) {
        Map<String, String> params = new LinkedHashMap<>();
        // scheduled incidents do not page on-call unless the job asks for it
        params.put(ONCALL_ENABLE, String.valueOf(Boolean.TRUE.equals(job.getOncallEnable())));

        ChannelOverrides channels = job.getChannels();
        if (channels == null) {
            return params;
        }
        putIfNotEmpty(params, SLACK_CHANNEL_ID, channels.getSlackChannelId());
        putIfNotEmpty(params, TELEGRAM_CHAT_ID, channels.getTelegramChatId());
        putIfNotEmpty(params, LARK_OTHER_WEBHOOK_URL, channels.getLarkWebhookKey());
        putIfNotEmpty(params, MSTEAMS_OTHER_POWER_URL, channels.getMsteamsPowerUrlKey());
        putIfNotEmpty(params, EMAIL_TO, channels.getEmailTo());
        return params;
    }

    private static void putIfNotEmpty(Map<String, String> params, String key, String value) {
        if (StringUtils.isNotEmpty(value)) {
            params.put(key, value);
        }
    }
}
