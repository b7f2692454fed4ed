package tech.syncbridge.platform.integration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * External platforms an integration instance can connect to.
 */
public enum ProviderType {
    HUBSPOT("hubspot", Category.CRM),
    SALESFORCE("salesforce", Category.CRM),
    WORDPRESS("wordpress", Category.CMS),
    GITHUB("github", Category.SCM);

    public enum Category {
        CRM, CMS, SCM
    }

    private final String value;
    private final Category category;

    ProviderType(String value, Category category) {
        this.value = value;
        this.category = category;
    }

    /**
     * Lowercase name used in URLs and configuration keys.
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    public Category getCategory() {
        return category;
    }

    @JsonCreator
    public static ProviderType fromValue(String value) {
        for (ProviderType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }
}
