package tech.syncbridge.platform.credential;

public class CredentialNotFoundException extends CredentialException {

    public CredentialNotFoundException(String message) {
        super(message);
    }
}
