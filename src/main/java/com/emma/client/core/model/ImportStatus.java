package com.emma.client.core.model;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Outcome of a member import.
 */
public enum ImportStatus {
    OK("o", "Ok"),
    ERROR("e", "Error");

    private static final Map<String, ImportStatus> BY_CODE = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(ImportStatus::getCode, Function.identity()));

    private final String code;
    private final String label;

    ImportStatus(String code, String label) {
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
     * @throws IllegalArgumentException if the code is unknown
     */
    public static ImportStatus fromCode(String code) {
        ImportStatus status = code != null ? BY_CODE.get(code) : null;
        if (status == null) {
            throw new IllegalArgumentException("Unknown import status code: " + code);
        }
        return status;
    }
}
