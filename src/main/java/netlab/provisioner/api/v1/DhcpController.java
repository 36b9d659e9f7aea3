package netlab.provisioner.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import netlab.provisioner.api.Controller;
import netlab.provisioner.api.v1.dto.DhcpAssignRequest;
import netlab.provisioner.api.v1.dto.DhcpAssignResponse;
import netlab.provisioner.model.DhcpAssignResult;
import netlab.provisioner.server.RouterHandler;
import netlab.provisioner.service.DhcpOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * POST /api/v1/dhcp/assign - start DHCP servers, lease addresses on clients, record them.
 *
 * Runs synchronously; the response arrives once every node has been handled.
 */
public class DhcpController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(DhcpController.class);

    private final DhcpOrchestrator orchestrator;
    private final DhcpOrchestrator.Options defaults;

    public DhcpController(DhcpOrchestrator orchestrator, DhcpOrchestrator.Options defaults) {
        this.orchestrator = orchestrator;
        this.defaults = defaults;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/api/v1/dhcp/assign".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        DhcpAssignRequest request = RouterHandler.readBody(req, DhcpAssignRequest.class, DhcpAssignRequest::empty);
        request.validate();

        DhcpOrchestrator.Options options = request.toOptions(defaults);
        log.info("DHCP assign requested (hostOverride={}, dhclientTimeout={}, warmup={})",
                options.hostOverride(), options.dhclientTimeout(), options.dhcpWarmup());
        DhcpAssignResult result = orchestrator.assign(options);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(DhcpAssignResponse.from(result)));
    }
}
