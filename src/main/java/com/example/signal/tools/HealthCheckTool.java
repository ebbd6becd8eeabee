package com.example.signal.tools;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Liveness check. Answers "ok" whenever the server can execute a tool at all. */
public class HealthCheckTool
        implements Function<HealthCheckTool.Request, HealthCheckTool.Response> {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckTool.class);

    public static final String NAME = "health_check";
    public static final String SERVICE_NAME = "signal-server";

    public record Request() {}

    public record Response(String status, String service, String message) {}

    @Override
    public Response apply(Request request) {
        log.debug(">>> TOOL EXECUTION: {}", NAME);
        return new Response("ok", SERVICE_NAME, "Signal server operational");
    }
}
