package dk.trustworks.templatefiller.exceptions;

/**
 * Thrown when a template cannot be fetched from storage.
 */
public class TemplateNotFoundException extends TemplateFillException {

    private final String key;

    public TemplateNotFoundException(String key, Throwable cause) {
        super(404, "Template not found: " + key, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
