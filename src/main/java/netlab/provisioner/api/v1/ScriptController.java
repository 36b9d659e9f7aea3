package netlab.provisioner.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import netlab.provisioner.api.Controller;
import netlab.provisioner.api.v1.dto.ScriptRunRequest;
import netlab.provisioner.model.ScriptExecutionResult;
import netlab.provisioner.server.RouterHandler;
import netlab.provisioner.service.ScriptRunner;

/**
 * POST /api/v1/scripts/run - run a script on a node and report its exit code.
 * A failing script is still a 200; the body says {@code success=false}.
 */
public class ScriptController implements Controller {

    private final ScriptRunner runner;

    public ScriptController(ScriptRunner runner) {
        this.runner = runner;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && "/api/v1/scripts/run".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        ScriptRunRequest request = RouterHandler.readBody(req, ScriptRunRequest.class,
                () -> new ScriptRunRequest(null, null, null, null));
        request.validate();

        ScriptExecutionResult result = runner.run(request.nodeName(), request.remotePath(), request.shell(),
                request.timeoutDuration());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(result));
    }
}
