package tech.syncbridge.platform.credential;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CredentialType {
    OAUTH2("oauth2"),
    API_KEY("api_key");

    private final String value;

    CredentialType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static CredentialType fromValue(String value) {
        for (CredentialType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown credential type: " + value);
    }
}
