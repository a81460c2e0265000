package com.emma.client.core.model;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * How an import was submitted: through the API or as an uploaded file.
 */
public enum ImportStyle {
    API("a", "Api"),
    UPLOAD("u", "Upload");

    private static final Map<String, ImportStyle> BY_CODE = Stream.of(values())
            .collect(Collectors.toUnmodifiableMap(ImportStyle::getCode, Function.identity()));

    private final String code;
    private final String label;

    ImportStyle(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public static ImportStyle fromCode(String code) {
        ImportStyle style = code != null ? BY_CODE.get(code) : null;
        if (style == null) {
            throw new IllegalArgumentException("Unknown import style code: " + code);
        }
        return style;
    }
}
