package com.mimecast.courier.transport;

/**
 * Result of a best-effort session step.
 *
 * <p>Steps such as clearing a seen flag, anonymous POP3 login or closing a session may fail
 * <br>without failing the enclosing operation. They report here instead of throwing.
 */
public final class Outcome {
    private static final Outcome OK = new Outcome(null, null);

    private final String detail;
    private final Exception cause;

    private Outcome(String detail, Exception cause) {
        this.detail = detail;
        this.cause = cause;
    }

    /**
     * Gets the successful outcome.
     *
     * @return Outcome instance.
     */
    public static Outcome ok() {
        return OK;
    }

    /**
     * Gets a failed outcome.
     *
     * @param detail What failed.
     * @param cause  Underlying exception, may be null.
     * @return Outcome instance.
     */
    public static Outcome failed(String detail, Exception cause) {
        return new Outcome(detail != null ? detail : "failed", cause);
    }

    public boolean isOk() {
        return detail == null;
    }

    public String getDetail() {
        return detail;
    }

    public Exception getCause() {
        return cause;
    }

    @Override
    public String toString() {
        if (isOk()) {
            return "OK";
        }
        return cause != null ? detail + " (" + cause.getMessage() + ")" : detail;
    }
}
