package alertscheduler.alertmanager;

import alertscheduler.config.AlertmanagerEndpoint;

@FunctionalInterface
public interface AlertSourceClientFactory {

    AlertSourceClient create(AlertmanagerEndpoint endpoint);
}
