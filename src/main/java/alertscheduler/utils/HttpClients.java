package alertscheduler.utils;

import okhttp3.OkHttpClient;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

public class HttpClients {

    // bounds one whole call to an alert source, connect + read included
    public static final int ALERT_SOURCE_TIMEOUT_SECONDS = 30;

    private HttpClients() {
    }

    public static OkHttpClient alertSourceClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .readTimeout(ALERT_SOURCE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .callTimeout(ALERT_SOURCE_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .build();
    }

    public static OkHttpClient dispatchClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    public static String bodyOf(Response response) throws IOException {
        return response.body() == null ? "" : response.body().string();
    }
}
