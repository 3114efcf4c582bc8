package alertscheduler.config;

import lombok.Data;

/**
 * 按任务覆盖通知渠道
 */
@Data
public class ChannelOverrides {
    private String slackChannelId;
    private String telegramChatId;
    // key from lark other_webhook_urls
    private String larkWebhookKey;
    // key from msteams other_power_urls
    private String msteamsPowerUrlKey;
    private String emailTo;
}
