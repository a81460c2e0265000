package com.emma.client.core.model;

import com.emma.client.api.Account;
import com.emma.client.core.wire.WireValues;

import java.util.List;
import java.util.Map;

/**
 * A named group of members. The API reports the id as {@code group_id} on
 * member-scoped records and {@code member_group_id} on account-scoped ones.
 */
public class Group extends ApiModel {

    public static final String GROUP_ID = "group_id";
    public static final String MEMBER_GROUP_ID = "member_group_id";
    public static final String GROUP_NAME = "group_name";

    private static final List<String> DEFAULT_TOP_LEVEL = List.of(GROUP_ID, GROUP_NAME);

    private Long groupId;
    private String groupName;

    public Group(Account account) {
        this(account, null);
    }

    public Group(Account account, Map<String, ?> raw) {
        super(account);
        if (raw != null) {
            parse(raw);
        }
    }

    @Override
    protected void readAttributes(Map<String, Object> values) {
        Object id = values.remove(GROUP_ID);
        Object memberGroupId = values.remove(MEMBER_GROUP_ID);
        this.groupId = WireValues.asLong(id != null ? id : memberGroupId);
        this.groupName = WireValues.asString(values.remove(GROUP_NAME));
    }

    @Override
    protected void writeAttributes(Map<String, Object> wire) {
        putIfPresent(wire, GROUP_ID, groupId);
        putIfPresent(wire, GROUP_NAME, groupName);
    }

    @Override
    protected List<String> defaultTopLevel() {
        return DEFAULT_TOP_LEVEL;
    }

    public Long getGroupId() {
        return groupId;
    }

    public String getGroupName() {
        return groupName;
    }

    public void setGroupName(String groupName) {
        this.groupName = groupName;
    }

    @Override
    public String toString() {
        return "Group{groupId=" + groupId + ", groupName='" + groupName + "'}";
    }
}
