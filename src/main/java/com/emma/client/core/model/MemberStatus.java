package com.emma.client.core.model;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Delivery status of a member within an account.
 * The API sends the single-letter code; {@link #fromCode(String)} resolves it.
 */
public enum MemberStatus {
    ACTIVE("a", "Active"),
    ERROR("e", "Error"),
    FORWARDED("f", "Forwarded"),
    OPT_OUT("o", "Opt-out");

    private static final Map<String, MemberStatus> BY_CODE = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(MemberStatus::getCode, Function.identity()));

    private final String code;
    private final String label;

    MemberStatus(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether a member may be moved into this status through an update call.
     * Only these statuses are sent as {@code status_to}.
     */
    public boolean isTransitionTarget() {
        return this == ACTIVE || this == ERROR || this == OPT_OUT;
    }

    /**
     * Resolves a wire code.
     *
     * @param code the single-letter status code
     * @return the matching status
     * @throws IllegalArgumentException if the code is unknown
     */
    public static MemberStatus fromCode(String code) {
        MemberStatus status = code != null ? BY_CODE.get(code) : null;
        if (status == null) {
            throw new IllegalArgumentException("Unknown member status code: " + code);
        }
        return status;
    }
}
