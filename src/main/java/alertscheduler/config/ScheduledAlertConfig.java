package alertscheduler.config;

import alertscheduler.scheduler.ScheduleConfigException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 定时告警配置, 启动时从YAML文件加载一次
 */
@Data
public class ScheduledAlertConfig {

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final Pattern ENV_PATTERN = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

    private boolean enable;
    // IANA zone name, empty means system default
    private String timezone;
    private List<ScheduledJob> jobs = new ArrayList<>();

    /**
     * 加载配置文件
     */
    public static ScheduledAlertConfig load(String configPath) {
        return load(Paths.get(configPath), System::getenv);
    }

    public static ScheduledAlertConfig load(Path path, UnaryOperator<String> env) {
        try {
            String content = Files.readString(path.toAbsolutePath(), StandardCharsets.UTF_8);
            return parse(content, env);
        } catch (IOException e) {
            throw new ScheduleConfigException("failed to load config file: " + path, e);
        }
    }

    public static ScheduledAlertConfig parse(String yaml, UnaryOperator<String> env) {
        try {
            ScheduledAlertConfig config = yamlMapper.readValue(expandEnv(yaml, env), ScheduledAlertConfig.class);
            if (config == null) {
                return new ScheduledAlertConfig();
            }
            if (config.getJobs() == null) {
                config.setJobs(new ArrayList<>());
            }
            return config;
        } catch (IOException e) {
            throw new ScheduleConfigException("failed to parse config file: " + e.getMessage(), e);
        }
    }

    /**
     * 替换 ${VAR} 为环境变量, 未设置的变量替换为空串
     */
    static String expandEnv(String content, UnaryOperator<String> env) {
        Matcher matcher = ENV_PATTERN.matcher(content);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    public static ScheduledAlertConfig of(boolean enable, String timezone, List<ScheduledJob> jobs) {
        ScheduledAlertConfig config = new ScheduledAlertConfig();
        config.setEnable(enable);
        config.setTimezone(timezone);
        config.setJobs(new ArrayList<>(jobs));
        return config;
    }

    public static ScheduledAlertConfig disabled() {
        return of(false, null, List.of());
    }
}
