package tech.syncbridge.platform.sync;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncDirection {
    PULL("pull"),
    PUSH("push"),
    BIDIRECTIONAL("bidirectional");

    private final String value;

    SyncDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean pulls() {
        return this != PUSH;
    }

    public boolean pushes() {
        return this != PULL;
    }

    @JsonCreator
    public static SyncDirection fromValue(String value) {
        for (SyncDirection direction : values()) {
            if (direction.value.equalsIgnoreCase(value) || direction.name().equalsIgnoreCase(value)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown sync direction: " + value);
    }
}
