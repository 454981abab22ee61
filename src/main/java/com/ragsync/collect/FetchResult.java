package com.ragsync.collect;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public record FetchResult(
        Status status,
        String url,
        int httpStatus,
        String contentType,
        byte[] body,
        String charset,
        String error) {

    public enum Status {
        OK,
        EMPTY,
        TRANSPORT_FAILURE
    }

    public static FetchResult ok(String url, int httpStatus, String contentType, byte[] body, String charset) {
        return new FetchResult(Status.OK, url, httpStatus, contentType, body, charset, "");
    }

    public static FetchResult empty(String url, int httpStatus, String reason) {
        return new FetchResult(Status.EMPTY, url, httpStatus, "", new byte[0], null, reason);
    }

    public static FetchResult transportFailure(String url, int httpStatus, String error) {
        return new FetchResult(Status.TRANSPORT_FAILURE, url, httpStatus, "", new byte[0], null, error);
    }

    public boolean isSuccess() {
        return status == Status.OK;
    }

    public boolean isRetryable() {
        return status == Status.TRANSPORT_FAILURE;
    }

    public String text() {
        Charset decoded = StandardCharsets.UTF_8;
        if (charset != null && Charset.isSupported(charset)) {
            decoded = Charset.forName(charset);
        }
        return new String(body, decoded);
    }
}
