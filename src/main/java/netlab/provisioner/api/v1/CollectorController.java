package netlab.provisioner.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import netlab.provisioner.api.Controller;
import netlab.provisioner.api.v1.dto.CollectorLogsResponse;
import netlab.provisioner.api.v1.dto.CollectorSetupRequest;
import netlab.provisioner.api.v1.dto.CollectorSetupResponse;
import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.model.LogCollectorResult;
import netlab.provisioner.model.SnitchNodeInfo;
import netlab.provisioner.server.RouterHandler;
import netlab.provisioner.service.NodeProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for per-student command logging.
 *
 * POST /api/v1/collectors/{student} - deploy collectors and inject history forwarding
 * GET /api/v1/collectors/{student}/logs - read collected logs
 * DELETE /api/v1/collectors/{student} - remove the student's collectors
 */
public class CollectorController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(CollectorController.class);

    private static final Pattern STUDENT_PATTERN = Pattern.compile("^/api/v1/collectors/([^/]+)$");
    private static final Pattern LOGS_PATTERN = Pattern.compile("^/api/v1/collectors/([^/]+)/logs$");

    // resolved on first use; building it may need a platform round-trip for the project id
    private final Supplier<NodeProvisioner> provisioner;
    private final ProvisionerConfig config;

    public CollectorController(Supplier<NodeProvisioner> provisioner, ProvisionerConfig config) {
        this.provisioner = provisioner;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return LOGS_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.POST) || method.equals(HttpMethod.DELETE)) {
            return STUDENT_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) throws Exception {
        Matcher logs = LOGS_PATTERN.matcher(path);
        if (logs.matches()) {
            return handleLogs(logs.group(1));
        }
        Matcher student = STUDENT_PATTERN.matcher(path);
        if (!student.matches()) {
            return ControllerResponse.notFound("unknown collector endpoint");
        }
        String name = NodeProvisioner.sanitizeStudentName(student.group(1));
        if (req.method().equals(HttpMethod.DELETE)) {
            return handleDelete(name);
        }
        return handleSetup(name, req);
    }

    private ControllerResponse handleSetup(String student, FullHttpRequest req) throws Exception {
        CollectorSetupRequest request = RouterHandler.readBody(req, CollectorSetupRequest.class,
                CollectorSetupRequest::empty);
        String itSwitch = request.itSwitchOr(config.itSwitchName());
        String otSwitch = request.otSwitchOr(config.otSwitchName());

        log.info("Setting up logging for {} (IT={}, OT={})", student, itSwitch, otSwitch);
        LogCollectorResult result = provisioner.get().setupLoggingForStudent(student, itSwitch, otSwitch);

        HttpResponseStatus status = result.success() ? HttpResponseStatus.OK
                : HttpResponseStatus.UNPROCESSABLE_ENTITY;
        return ControllerResponse.json(status,
                RouterHandler.mapper().writeValueAsString(CollectorSetupResponse.from(student, result)));
    }

    private ControllerResponse handleLogs(String rawStudent) throws Exception {
        String student = NodeProvisioner.sanitizeStudentName(rawStudent);
        NodeProvisioner service = provisioner.get();
        List<SnitchNodeInfo> collectors = service.findCollectors(student);
        if (collectors.isEmpty()) {
            return ControllerResponse.notFound("no collectors for student " + student);
        }
        NodeProvisioner.LogRetrieval retrieval = service.retrieveAllLogs(collectors);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                new CollectorLogsResponse(student, retrieval.logs(), retrieval.errors())));
    }

    private ControllerResponse handleDelete(String student) throws Exception {
        List<String> deleted = provisioner.get().deleteCollectorNodes(student);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("student", student, "deleted", deleted)));
    }
}
