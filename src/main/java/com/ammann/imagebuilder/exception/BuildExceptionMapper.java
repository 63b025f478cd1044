/* (C)2026 */
package com.ammann.imagebuilder.exception;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JAX-RS exception mapper that converts {@link BuildException} and its subclasses into an
 * HTTP error response with a JSON body containing the error label and message.
 *
 * <p>Configuration errors map to 400, unknown images to 404, failed containers to 422,
 * wait timeouts to 504 and engine failures to 502. A container exit additionally reports
 * the container name and exit code.
 */
@Provider
public class BuildExceptionMapper implements ExceptionMapper<BuildException> {

    @Override
    public Response toResponse(BuildException exception) {
        Response.StatusType status = statusOf(exception);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("message", exception.getMessage());
        if (exception instanceof ContainerExitException exit) {
            body.put("container", exit.getContainerName());
            body.put("exitCode", exit.getExitCode());
        } else if (exception instanceof UnknownImageException unknown) {
            body.put("image", unknown.getImageName());
        }

        return Response.status(status).entity(body).build();
    }

    static Response.StatusType statusOf(BuildException exception) {
        if (exception instanceof InvalidFormatException
                || exception instanceof DependencyException) {
            return Response.Status.BAD_REQUEST;
        }
        if (exception instanceof UnknownImageException) {
            return Response.Status.NOT_FOUND;
        }
        if (exception instanceof ContainerExitException) {
            return new UnprocessableEntity();
        }
        if (exception instanceof ContainerWaitTimeoutException) {
            return Response.Status.GATEWAY_TIMEOUT;
        }
        if (exception instanceof EngineException) {
            return Response.Status.BAD_GATEWAY;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }

    /** 422 is not part of {@link Response.Status}. */
    private static final class UnprocessableEntity implements Response.StatusType {

        @Override
        public int getStatusCode() {
            return 422;
        }

        @Override
        public Response.Status.Family getFamily() {
            return Response.Status.Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Unprocessable Entity";
        }
    }
}
