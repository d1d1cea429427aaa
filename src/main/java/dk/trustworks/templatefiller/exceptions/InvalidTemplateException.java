package dk.trustworks.templatefiller.exceptions;

public class InvalidTemplateException extends TemplateFillException {

    public InvalidTemplateException(String message) {
        super(422, message);
    }

    public InvalidTemplateException(String message, Throwable cause) {
        super(422, message, cause);
    }
}
