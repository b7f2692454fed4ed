package tech.syncbridge.transform.mapping;

/**
 * Target data type a rule's value is coerced to before it is written.
 */
public enum DataType {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    DATE,
    DATETIME,
    LIST,
    OBJECT
}
