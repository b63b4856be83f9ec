package com.mimecast.courier.transport;

/**
 * Result of fetching or retrieving a single message.
 */
public final class FetchResult {
    private final byte[] bytes;
    private final String detail;

    private FetchResult(byte[] bytes, String detail) {
        this.bytes = bytes;
        this.detail = detail;
    }

    /**
     * Acknowledged fetch.
     *
     * @param bytes Raw RFC 822 message.
     * @return FetchResult instance.
     */
    public static FetchResult ok(byte[] bytes) {
        return new FetchResult(bytes.clone(), null);
    }

    /**
     * Fetch not acknowledged.
     *
     * @param detail Server reply or error.
     * @return FetchResult instance.
     */
    public static FetchResult notOk(String detail) {
        return new FetchResult(null, detail != null ? detail : "NO");
    }

    public boolean isOk() {
        return detail == null;
    }

    /**
     * Gets raw message bytes.
     *
     * @return Byte array or null when not acknowledged.
     */
    public byte[] getBytes() {
        return bytes != null ? bytes.clone() : null;
    }

    public String getDetail() {
        return detail;
    }
}
