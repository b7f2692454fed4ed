package tech.syncbridge.transform.coerce;

import tech.syncbridge.transform.mapping.DataType;

/**
 * A value could not be converted to the requested {@link DataType}.
 */
public class TypeCoercionException extends RuntimeException {

    private final DataType target;

    public TypeCoercionException(DataType target, Object value) {
        super("Cannot coerce " + describe(value) + " to " + target);
        this.target = target;
    }

    public DataType getTarget() {
        return target;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        String text = String.valueOf(value);
        if (text.length() > 40) {
            text = text.substring(0, 40) + "...";
        }
        return value.getClass().getSimpleName() + " '" + text + "'";
    }
}
