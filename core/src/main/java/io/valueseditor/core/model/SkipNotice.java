package io.valueseditor.core.model;

import java.util.Objects;

/**
 * Records an update entry that the merge left untouched because the field is
 * protected. A skip is reported to the caller, it is not an error.
 *
 * @param path   the accumulated (non-normalized) field path of the skipped entry
 * @param reason why the entry was skipped
 */
public record SkipNotice(String path, Reason reason) {

    /** Protection rule that caused the skip. */
    public enum Reason {
        /** The path is marked read-only. */
        READ_ONLY,
        /** The path holds a mapping with read-only fields and the update is not a mapping. */
        READ_ONLY_CHILDREN,
        /** The path holds the option list of an enumeration. */
        ENUM_OPTIONS
    }

    public SkipNotice {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    /** Human-readable notice suitable for an API response. */
    public String message() {
        return switch (reason) {
            case READ_ONLY -> "Field '" + path + "' is read-only and was not updated";
            case READ_ONLY_CHILDREN -> "Field '" + path + "' contains read-only fields and was not replaced";
            case ENUM_OPTIONS -> "Field '" + path + "' holds enumeration options and was not updated";
        };
    }
}
