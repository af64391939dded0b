package io.blamechain.core.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/** Request timing for the API server, tagged by method, context path, status and outcome. */
public final class HttpMetrics {
    private static final MeterRegistry REGISTRY = BlockMetrics.registry();

    private HttpMetrics() {}

    public static Timer.Sample start() {
        return Timer.start(REGISTRY);
    }

    public static void stop(Timer.Sample sample, String method, String path, int status) {
        Timer timer = Timer
                .builder("http.server.requests")
                .description("HTTP server request duration")
                .tag("method", method)
                .tag("path", path)
                .tag("status", Integer.toString(status))
                .tag("outcome", outcome(status))
                .register(REGISTRY);
        sample.stop(timer);
    }

    static String outcome(int status) {
        if (status >= 500) return "SERVER_ERROR";
        if (status >= 400) return "CLIENT_ERROR";
        if (status >= 200 && status < 300) return "SUCCESS";
        return "UNKNOWN";
    }
}
