package com.questrail.steward.transport;

import java.util.Objects;

/**
 * Listener decision for one inbound request, translated to a status by the endpoint.
 */
public record IngressVerdict(Kind kind, String detail) {

    public enum Kind {
        ACCEPTED,
        MALFORMED,
        UNAVAILABLE
    }

    public IngressVerdict {
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }

    public static IngressVerdict accepted() {
        return new IngressVerdict(Kind.ACCEPTED, "");
    }

    public static IngressVerdict malformed(String detail) {
        return new IngressVerdict(Kind.MALFORMED, detail);
    }

    public static IngressVerdict unavailable(String detail) {
        return new IngressVerdict(Kind.UNAVAILABLE, detail);
    }
}
