package io.fieldsync.core;

/** Kind of accepted entity mutation recorded in the event log. */
public enum ChangeOperation {
    CREATE, UPDATE, DELETE;

    /** Broadcast topic suffix: "created", "updated", "deleted". */
    public String topicSuffix() {
        return switch (this) {
            case CREATE -> "created";
            case UPDATE -> "updated";
            case DELETE -> "deleted";
        };
    }
}
