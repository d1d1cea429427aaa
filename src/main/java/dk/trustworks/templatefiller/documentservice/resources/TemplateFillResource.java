package dk.trustworks.templatefiller.documentservice.resources;

import dk.trustworks.templatefiller.documentservice.dto.FillAndUploadRequest;
import dk.trustworks.templatefiller.documentservice.dto.FillAndUploadResponse;
import dk.trustworks.templatefiller.documentservice.dto.FillRequest;
import dk.trustworks.templatefiller.documentservice.dto.FilledDocument;
import dk.trustworks.templatefiller.documentservice.services.TemplateFillService;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import lombok.extern.jbosslog.JBossLog;

import java.util.Map;
import java.util.Set;

/**
 * REST resource for filling IDS Word templates.
 */
@JBossLog
@Path("/")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TemplateFillResource {

    static final String DOCX_MEDIA_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    @Inject
    TemplateFillService templateFillService;

    @GET
    @Path("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    /**
     * Fill a template and return the document as an attachment.
     *
     * @param request placeholder values, images and optional template key and filename
     * @return the filled .docx
     */
    @POST
    @Path("/fill")
    @Produces(DOCX_MEDIA_TYPE)
    public Response fill(@NotNull @Valid FillRequest request) {
        log.infof("POST /fill: template_key=%s, placeholders=%d, images=%d",
                request.templateKey(), size(request.placeholders()), size(request.images()));

        FilledDocument document = templateFillService.fill(request);

        return Response.ok(document.content(), DOCX_MEDIA_TYPE)
                .header("Content-Disposition", "attachment; filename=\"" + document.filename() + "\"")
                .header("Content-Length", document.content().length)
                .build();
    }

    /**
     * Fill a template and store the result.
     *
     * @param request placeholder values, images, optional template key and the requested output key
     * @return the key actually written and the document's URL
     */
    @POST
    @Path("/fill-and-upload")
    public FillAndUploadResponse fillAndUpload(@NotNull @Valid FillAndUploadRequest request) {
        log.infof("POST /fill-and-upload: template_key=%s, output_key=%s, placeholders=%d, images=%d",
                request.templateKey(), request.outputKey(), size(request.placeholders()), size(request.images()));
        return templateFillService.fillAndUpload(request);
    }

    /**
     * List the placeholders a template contains.
     *
     * @param templateKey storage key of the template, the configured default when absent
     */
    @GET
    @Path("/templates/placeholders")
    public Set<String> placeholders(@QueryParam("template_key") String templateKey) {
        log.infof("GET /templates/placeholders?template_key=%s", templateKey);
        return templateFillService.extractPlaceholders(templateKey);
    }

    private static int size(Map<String, String> map) {
        return map != null ? map.size() : 0;
    }
}
