package alertscheduler.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertmanagerEndpoint {
    private String url;
    private String username;
    private String password;
}
