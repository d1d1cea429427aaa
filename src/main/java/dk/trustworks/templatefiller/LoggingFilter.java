package dk.trustworks.templatefiller;


import jakarta.ws.rs.HttpMethod;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

/**
 * Logs path and parameters of incoming JSON posts. Bodies carry base64 images and are
 * never logged.
 */
@JBossLog
@Provider
public class LoggingFilter implements ContainerRequestFilter {

    @Override
    public void filter(ContainerRequestContext requestContext) {
        if (requestContext.getMethod().equals(HttpMethod.POST) && requestContext.getMediaType() != null
                && requestContext.getMediaType().isCompatible(MediaType.APPLICATION_JSON_TYPE)) {
            logRequest(requestContext);
        }
    }

    private void logRequest(ContainerRequestContext requestContext) {
        log.debugf("%s /%s (%s bytes)", requestContext.getMethod(), requestContext.getUriInfo().getPath(),
                requestContext.getLength());
        requestContext.getUriInfo().getPathParameters().forEach((k, v) -> log.debug(k + ": " + v));
        requestContext.getUriInfo().getQueryParameters().forEach((k, v) -> log.debug(k + ": " + v));
    }
}
