package org.eventstatus.client;

/**
 * Non-2xx answer from the backend. Raised and absorbed inside the client.
 */
public class BackendApiException extends RuntimeException {

    private final String operation;
    private final int statusCode;
    private final String detail;

    public BackendApiException(String operation, int statusCode, String detail) {
        super(operation + " returned HTTP " + statusCode + ": " + detail);
        this.operation = operation;
        this.statusCode = statusCode;
        this.detail = detail;
    }

    public String getOperation() {
        return operation;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getDetail() {
        return detail;
    }
}
