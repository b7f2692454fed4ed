package tech.syncbridge.platform.sync;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Map;
import java.util.TreeMap;

/**
 * Per-phase progress of a job, keyed "pull:entityType" and "push:entityType".
 * Each value is the opaque provider cursor (pull) or last pushed change sequence (push).
 */
public class JobCursor {

    private final Map<String, String> positions = new TreeMap<>();

    public static String pullKey(String entityType) {
        return "pull:" + entityType;
    }

    public static String pushKey(String entityType) {
        return "push:" + entityType;
    }

    public String get(String key) {
        return positions.get(key);
    }

    @JsonAnySetter
    public void put(String key, String value) {
        if (value == null) {
            positions.remove(key);
        } else {
            positions.put(key, value);
        }
    }

    @JsonAnyGetter
    public Map<String, String> positions() {
        return positions;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return positions.isEmpty();
    }
}
