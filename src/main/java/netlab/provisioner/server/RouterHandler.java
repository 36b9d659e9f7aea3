package netlab.provisioner.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import netlab.provisioner.api.Controller;
import netlab.provisioner.api.Controller.ControllerResponse;
import netlab.provisioner.config.ProvisionerConfig;
import netlab.provisioner.platform.PlatformException;
import netlab.provisioner.store.NodeStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_GATEWAY;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.FORBIDDEN;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* is served; anything else is 404. When an API key is
 * configured, POST and DELETE requests must carry it in {@value #API_KEY_HEADER}.
 *
 * Stateless per channel, hence @Sharable.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final String API_KEY_HEADER = "X-Netlab-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final ProvisionerConfig config;

    public RouterHandler(ProvisionerConfig config) {
        this.config = config;
    }

    /**
     * Controllers are checked in registration order.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        try {
            if (!checkAuth(req)) {
                log.warn("Auth failed for {} {}", method, path);
                write(ctx, FORBIDDEN, "application/json", "{\"error\":\"forbidden\"}");
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    write(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON on {} {}: {}", method, path, e.getOriginalMessage());
            writeError(ctx, BAD_REQUEST, "malformed JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Validation error on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, BAD_REQUEST, e.getMessage());
        } catch (NoSuchElementException e) {
            log.warn("Not found on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, NOT_FOUND, e.getMessage());
        } catch (PlatformException e) {
            log.error("Emulation platform error on {} {}: {}", method, path, e.getMessage());
            writeError(ctx, BAD_GATEWAY, e.getMessage());
        } catch (NodeStoreException e) {
            log.error("Node store error on {} {}: {}", method, path, e.getMessage(), e);
            writeError(ctx, INTERNAL_SERVER_ERROR, e.getMessage());
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            writeError(ctx, INTERNAL_SERVER_ERROR, errorChain(e));
        }
    }

    private boolean checkAuth(FullHttpRequest req) {
        if (!config.hasApiKey()) {
            return true;
        }
        HttpMethod method = req.method();
        if (!HttpMethod.POST.equals(method) && !HttpMethod.DELETE.equals(method)) {
            return true;
        }
        return config.apiKey().equals(req.headers().get(API_KEY_HEADER));
    }

    private static String errorChain(Throwable t) {
        StringBuilder chain = new StringBuilder(t.toString());
        Throwable cause = t.getCause();
        while (cause != null) {
            chain.append(" <- ").append(cause);
            cause = cause.getCause();
        }
        return chain.toString();
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        write(ctx, status, "application/json", "{\"error\":\"" + ControllerResponse.escapeJson(message) + "\"}");
    }

    private void write(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Decode a JSON request body; an empty body yields {@code whenEmpty}.
     */
    public static <T> T readBody(FullHttpRequest req, Class<T> type, Supplier<T> whenEmpty)
            throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            return whenEmpty.get();
        }
        T value = MAPPER.readValue(body, type);
        return value != null ? value : whenEmpty.get();
    }

    /**
     * Shared mapper for request and response bodies.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
