package org.javai.status;

/**
 * Classifications shared by the tests.
 */
public enum SampleError implements Classification {
    NOT_FOUND("NotFound"),
    IO_ERROR("IOError"),
    CONFIG_LOAD_FAILED("ConfigLoadFailed"),
    PERMISSION_DENIED("PermissionDenied");

    private final String id;

    SampleError(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }
}
