package netlab.provisioner.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import netlab.provisioner.api.Controller;
import netlab.provisioner.api.v1.dto.HealthResponse;
import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.server.RouterHandler;

import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 *
 * Reports "degraded" when the node store file is missing; the platform is not probed.
 */
public class HealthController implements Controller {

    static final String VERSION = "1.0.0";

    private final ProvisionerConfig config;

    public HealthController(ProvisionerConfig config) {
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Path store = Path.of(config.nodeStorePath());
        HealthResponse response = Files.isRegularFile(store)
                ? HealthResponse.healthy("ok", config.platformUrl(), formatUptime(), VERSION)
                : HealthResponse.degraded("missing: " + store, config.platformUrl(), formatUptime(), VERSION);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
