package com.emma.client.core.model;

import com.emma.client.api.Account;
import com.emma.client.core.wire.EmmaDates;
import com.emma.client.core.wire.WireValues;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * A mailing sent from the account. Read-only from this client's point of view.
 */
public class Mailing extends ApiModel {

    public static final String MAILING_ID = "mailing_id";
    public static final String NAME = "name";
    public static final String SUBJECT = "subject";
    public static final String DELIVERY_TS = "delivery_ts";
    public static final String SEND_STARTED = "send_started";
    public static final String SEND_FINISHED = "send_finished";

    private static final List<String> DEFAULT_TOP_LEVEL = List.of(MAILING_ID);

    private Long mailingId;
    private String name;
    private String subject;
    private LocalDateTime deliveryTs;
    private LocalDateTime sendStarted;
    private LocalDateTime sendFinished;

    public Mailing(Account account, Map<String, ?> raw) {
        super(account);
        if (raw != null) {
            parse(raw);
        }
    }

    @Override
    protected void readAttributes(Map<String, Object> values) {
        this.mailingId = WireValues.asLong(values.remove(MAILING_ID));
        this.name = WireValues.asString(values.remove(NAME));
        this.subject = WireValues.asString(values.remove(SUBJECT));
        this.deliveryTs = EmmaDates.parse(values.remove(DELIVERY_TS));
        this.sendStarted = EmmaDates.parse(values.remove(SEND_STARTED));
        this.sendFinished = EmmaDates.parse(values.remove(SEND_FINISHED));
    }

    @Override
    protected void writeAttributes(Map<String, Object> wire) {
        putIfPresent(wire, MAILING_ID, mailingId);
        putIfPresent(wire, NAME, name);
        putIfPresent(wire, SUBJECT, subject);
        putIfPresent(wire, DELIVERY_TS, EmmaDates.format(deliveryTs));
        putIfPresent(wire, SEND_STARTED, EmmaDates.format(sendStarted));
        putIfPresent(wire, SEND_FINISHED, EmmaDates.format(sendFinished));
    }

    @Override
    protected List<String> defaultTopLevel() {
        return DEFAULT_TOP_LEVEL;
    }

    public Long getMailingId() {
        return mailingId;
    }

    public String getName() {
        return name;
    }

    public String getSubject() {
        return subject;
    }

    public LocalDateTime getDeliveryTs() {
        return deliveryTs;
    }

    public LocalDateTime getSendStarted() {
        return sendStarted;
    }

    public LocalDateTime getSendFinished() {
        return sendFinished;
    }

    @Override
    public String toString() {
        return "Mailing{mailingId=" + mailingId + ", name='" + name + "'}";
    }
}
