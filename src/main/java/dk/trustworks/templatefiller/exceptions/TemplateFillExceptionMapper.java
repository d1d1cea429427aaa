package dk.trustworks.templatefiller.exceptions;

import dk.trustworks.templatefiller.documentservice.dto.ErrorResponse;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

@JBossLog
@Provider
public class TemplateFillExceptionMapper implements ExceptionMapper<TemplateFillException> {

    @Override
    public Response toResponse(TemplateFillException exception) {
        if (exception.getStatus() >= 500) {
            log.errorf(exception, "Template fill failed with status %d", exception.getStatus());
        } else {
            log.warnf("Template fill rejected with status %d: %s", exception.getStatus(), exception.getMessage());
        }
        return Response.status(exception.getStatus())
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(errorCode(exception), exception.getMessage(), exception.getTokens()))
                .build();
    }

    private static String errorCode(TemplateFillException exception) {
        if (exception instanceof TemplateNotFoundException) {
            return "template_not_found";
        }
        if (exception instanceof ImageDecodeException) {
            return "image_decode_failed";
        }
        if (exception instanceof StoreFailureException) {
            return "store_failed";
        }
        if (exception instanceof InvalidTemplateException) {
            return "invalid_template";
        }
        return "template_fill_failed";
    }
}
