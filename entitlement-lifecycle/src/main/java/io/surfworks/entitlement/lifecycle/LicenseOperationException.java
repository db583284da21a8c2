package io.surfworks.entitlement.lifecycle;

/**
 * User-facing failure of a lifecycle operation.
 *
 * <p>The message is safe to show to an operator; technical detail stays in
 * the cause, the logs and the license record's last error.
 */
public class LicenseOperationException extends Exception {

    public enum Failure {
        KEY_REQUIRED("License key is required in settings or as parameter."),
        TOKEN_REQUIRED("Activation token is required (not found in settings or validation response)."),
        EXPIRED("License is expired. Please renew your license."),
        OPERATION_FAILED("Operation failed. See logs for details."),
        ACTIVATION_SETTLING("Another activation attempt is still settling. Please retry in a few seconds."),
        ACTIVATION_LIMIT("Activation limit reached on the server and no fresh token was issued. "
            + "Please deactivate an existing activation or increase the limit."),
        UNEXPECTED("Operation failed due to unexpected error. See logs for details.");

        private final String message;

        Failure(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Failure failure;

    public LicenseOperationException(Failure failure) {
        this(failure, null);
    }

    public LicenseOperationException(Failure failure, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
