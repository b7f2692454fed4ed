package tech.syncbridge.platform.webhook.parser;

public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String message) {
        super(message);
    }
}
