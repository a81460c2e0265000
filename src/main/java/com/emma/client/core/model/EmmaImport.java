package com.emma.client.core.model;

import com.emma.client.api.Account;
import com.emma.client.core.wire.EmmaDates;
import com.emma.client.core.wire.WireValues;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * A member import run on the account, with its outcome and timing.
 */
public class EmmaImport extends ApiModel {

    public static final String IMPORT_ID = "import_id";
    public static final String IMPORT_NAME = "import_name";
    public static final String STATUS = "status";
    public static final String STYLE = "style";
    public static final String IMPORT_STARTED = "import_started";
    public static final String IMPORT_FINISHED = "import_finished";
    public static final String NUM_MEMBERS_ADDED = "num_members_added";
    public static final String NUM_MEMBERS_UPDATED = "num_members_updated";

    private static final List<String> DEFAULT_TOP_LEVEL = List.of(IMPORT_ID);

    private Long importId;
    private String importName;
    private ImportStatus status;
    private ImportStyle style;
    private LocalDateTime importStarted;
    private LocalDateTime importFinished;
    private Long numMembersAdded;
    private Long numMembersUpdated;

    public EmmaImport(Account account, Map<String, ?> raw) {
        super(account);
        if (raw != null) {
            parse(raw);
        }
    }

    @Override
    protected void readAttributes(Map<String, Object> values) {
        this.importId = WireValues.asLong(values.remove(IMPORT_ID));
        this.importName = WireValues.asString(values.remove(IMPORT_NAME));
        Object statusCode = values.remove(STATUS);
        this.status = statusCode != null ? ImportStatus.fromCode(statusCode.toString()) : null;
        Object styleCode = values.remove(STYLE);
        this.style = styleCode != null ? ImportStyle.fromCode(styleCode.toString()) : null;
        this.importStarted = EmmaDates.parse(values.remove(IMPORT_STARTED));
        this.importFinished = EmmaDates.parse(values.remove(IMPORT_FINISHED));
        this.numMembersAdded = WireValues.asLong(values.remove(NUM_MEMBERS_ADDED));
        this.numMembersUpdated = WireValues.asLong(values.remove(NUM_MEMBERS_UPDATED));
    }

    @Override
    protected void writeAttributes(Map<String, Object> wire) {
        putIfPresent(wire, IMPORT_ID, importId);
        putIfPresent(wire, IMPORT_NAME, importName);
        putIfPresent(wire, STATUS, status != null ? status.getCode() : null);
        putIfPresent(wire, STYLE, style != null ? style.getCode() : null);
        putIfPresent(wire, IMPORT_STARTED, EmmaDates.format(importStarted));
        putIfPresent(wire, IMPORT_FINISHED, EmmaDates.format(importFinished));
        putIfPresent(wire, NUM_MEMBERS_ADDED, numMembersAdded);
        putIfPresent(wire, NUM_MEMBERS_UPDATED, numMembersUpdated);
    }

    @Override
    protected List<String> defaultTopLevel() {
        return DEFAULT_TOP_LEVEL;
    }

    public Long getImportId() {
        return importId;
    }

    public String getImportName() {
        return importName;
    }

    public ImportStatus getStatus() {
        return status;
    }

    public ImportStyle getStyle() {
        return style;
    }

    public LocalDateTime getImportStarted() {
        return importStarted;
    }

    public LocalDateTime getImportFinished() {
        return importFinished;
    }

    public Long getNumMembersAdded() {
        return numMembersAdded;
    }

    public Long getNumMembersUpdated() {
        return numMembersUpdated;
    }

    public boolean isFinished() {
        return importFinished != null;
    }

    @Override
    public String toString() {
        return "EmmaImport{" +
                "importId=" + importId +
                ", status=" + status +
                ", style=" + style +
                ", importStarted=" + importStarted +
                ", importFinished=" + importFinished +
                '}';
    }
}
