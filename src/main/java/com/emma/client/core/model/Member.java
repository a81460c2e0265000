package com.emma.client.core.model;

import com.emma.client.api.Account;
import com.emma.client.collection.MemberGroupCollection;
import com.emma.client.collection.MemberMailingCollection;
import com.emma.client.core.wire.EmmaDates;
import com.emma.client.core.wire.WireValues;
import com.emma.client.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A contact in an account's audience.
 *
 * <p>A member without a {@code member_id} has not been created remotely yet;
 * {@link #save()} creates it, otherwise {@link #save()} updates it. The member
 * owns two lazily loaded collections: its groups and the mailings it received.</p>
 *
 * Usage:
 * <pre>
 * Member member = account.getMembers().find(123).orElseThrow();
 * member.setCustomField("last_name", "New-Name");
 * member.save();
 *
 * Member fresh = account.getMembers().factory(Map.of("email", "new@example.com"));
 * fresh.save();
 * </pre>
 *
 * <p>Not thread-safe; use one instance per thread or lock externally.</p>
 */
public class Member extends ApiModel {
    private static final Logger log = LoggerFactory.getLogger(Member.class);

    public static final String MEMBER_ID = "member_id";
    public static final String EMAIL = "email";
    public static final String STATUS = "status";
    public static final String MEMBER_SINCE = "member_since";
    public static final String LAST_MODIFIED_AT = "last_modified_at";
    public static final String DELETED_AT = "deleted_at";

    static final String MEMBER_STATUS_ID = "member_status_id";
    static final String STATUS_TO = "status_to";
    static final String GROUP_IDS = "group_ids";
    static final String SIGNUP_FORM_ID = "signup_form_id";
    static final String ADDED = "added";

    static final String ADD_PATH = "/members/add";

    private static final List<String> DEFAULT_TOP_LEVEL = List.of(MEMBER_ID, EMAIL);

    private final MemberGroupCollection groups;
    private final MemberMailingCollection mailings;

    private Long memberId;
    private String email;
    private MemberStatus status;
    private LocalDateTime memberSince;
    private LocalDateTime lastModifiedAt;
    private LocalDateTime deletedAt;

    /**
     * Creates an empty member, to be filled in and created with {@link #save()}.
     */
    public Member(Account account) {
        this(account, null);
    }

    /**
     * Creates a member from an API record.
     *
     * @param account the owning account
     * @param raw     the raw record, or null for an empty member
     */
    public Member(Account account, Map<String, ?> raw) {
        super(account);
        this.groups = new MemberGroupCollection(this);
        this.mailings = new MemberMailingCollection(this);
        if (raw != null) {
            parse(raw);
        }
    }

    @Override
    protected void readAttributes(Map<String, Object> values) {
        this.memberId = WireValues.asLong(values.remove(MEMBER_ID));
        this.email = WireValues.asString(values.remove(EMAIL));
        Object statusCode = values.remove(STATUS);
        this.status = statusCode != null ? MemberStatus.fromCode(statusCode.toString()) : null;
        this.memberSince = EmmaDates.parse(values.remove(MEMBER_SINCE));
        this.lastModifiedAt = EmmaDates.parse(values.remove(LAST_MODIFIED_AT));
        this.deletedAt = EmmaDates.parse(values.remove(DELETED_AT));
    }

    @Override
    protected void writeAttributes(Map<String, Object> wire) {
        putIfPresent(wire, MEMBER_ID, memberId);
        putIfPresent(wire, EMAIL, email);
        putIfPresent(wire, STATUS, status != null ? status.getCode() : null);
        putIfPresent(wire, MEMBER_SINCE, EmmaDates.format(memberSince));
        putIfPresent(wire, LAST_MODIFIED_AT, EmmaDates.format(lastModifiedAt));
        putIfPresent(wire, DELETED_AT, EmmaDates.format(deletedAt));
    }

    @Override
    protected List<String> defaultTopLevel() {
        return DEFAULT_TOP_LEVEL;
    }

    @Override
    protected Set<String> internalKeys() {
        return Set.of(MEMBER_STATUS_ID);
    }

    @Override
    protected void checkExtractable() {
        if (email == null) {
            throw new MissingEmailException("Member has no email address");
        }
    }

    /**
     * Adds or updates this member.
     *
     * @throws MissingEmailException   if the member has no email
     * @throws MemberUpdateException   if the API does not accept the write
     */
    public void save() {
        save(null);
    }

    /**
     * Adds or updates this member. The signup form id is only sent when the
     * member is being created.
     *
     * @param signupFormId signup form to attribute a new member to, or null
     */
    public void save(Long signupFormId) {
        if (memberId == null) {
            add(signupFormId);
        } else {
            update();
        }
    }

    private void add(Long signupFormId) {
        Map<String, Object> data = extract();
        if (!groups.isEmpty()) {
            data.put(GROUP_IDS, groups.cached().values().stream()
                    .map(Group::getGroupId)
                    .filter(Objects::nonNull)
                    .toList());
        }
        if (signupFormId != null) {
            data.put(SIGNUP_FORM_ID, signupFormId);
        }

        try (LogContext ctx = LogContext.forMember(account.getAccountId(), null, "add")) {
            Object outcome = account.getAdapter().post(ADD_PATH, data);
            if (!WireValues.isTruthy(outcome)) {
                throw new MemberUpdateException("Member " + email + " was not added");
            }
            Map<String, Object> result = WireValues.asMap(outcome);
            Object statusCode = result.get(STATUS);
            MemberStatus resolved = statusCode != null ? MemberStatus.fromCode(statusCode.toString()) : status;
            Long assignedId = WireValues.isTruthy(result.get(ADDED))
                    ? WireValues.asLong(result.get(MEMBER_ID))
                    : null;

            this.status = resolved;
            if (assignedId != null) {
                this.memberId = assignedId;
                log.info("member.added memberId={} status={}", assignedId, resolved);
            } else {
                log.info("member.existing email={} status={}", email, resolved);
            }
        }
    }

    private void update() {
        Map<String, Object> data = extract();
        if (status != null && status.isTransitionTarget()) {
            data.put(STATUS_TO, status.getCode());
        }

        try (LogContext ctx = LogContext.forMember(account.getAccountId(), memberId, "update")) {
            Object outcome = account.getAdapter().put(memberPath(), data);
            if (!WireValues.isTruthy(outcome)) {
                log.warn("member.update_rejected memberId={}", memberId);
                throw new MemberUpdateException("Update of member " + memberId + " was not accepted");
            }
            log.debug("member.updated memberId={}", memberId);
        }
    }

    /**
     * Deletes this member remotely. Local fields are left untouched.
     *
     * @return whether the API confirmed the deletion
     * @throws MissingIdentifierException if the member was never created
     */
    public boolean delete() {
        requireMemberId("delete");
        try (LogContext ctx = LogContext.forMember(account.getAccountId(), memberId, "delete")) {
            boolean deleted = WireValues.isTruthy(account.getAdapter().delete(memberPath(), Map.of()));
            log.debug("member.deleted memberId={} confirmed={}", memberId, deleted);
            return deleted;
        }
    }

    /**
     * Opts this member out of future mailings from the account. The local status
     * only changes once the API confirms.
     *
     * @throws MissingEmailException if the member has no email
     */
    public void optOut() {
        if (email == null) {
            throw new MissingEmailException("Cannot opt out a member without an email address");
        }
        try (LogContext ctx = LogContext.forMember(account.getAccountId(), memberId, "optOut")) {
            if (WireValues.isTruthy(account.getAdapter().put("/members/email/optout/" + WireValues.pathSegment(email), null))) {
                this.status = MemberStatus.OPT_OUT;
                log.info("member.opted_out memberId={}", memberId);
            }
        }
    }

    /**
     * @throws MissingStatusException if no status has been resolved yet
     */
    public boolean hasOptedOut() {
        if (status == null) {
            throw new MissingStatusException("Member has no status");
        }
        return status == MemberStatus.OPT_OUT;
    }

    /**
     * Opt-out history of this member. Members that have not opted out have none,
     * so no request is made for them.
     *
     * @return the decoded history records, possibly empty
     * @throws MissingIdentifierException if the member was never created
     */
    public List<Object> getOptOutDetail() {
        requireMemberId("read opt-out detail");
        if (status != MemberStatus.OPT_OUT) {
            return List.of();
        }
        return WireValues.asList(account.getAdapter().get(memberPath() + "/optout", Map.of()));
    }

    private String memberPath() {
        return "/members/" + memberId;
    }

    private void requireMemberId(String operation) {
        if (memberId == null) {
            throw new MissingIdentifierException("Cannot " + operation + " for a member without member_id");
        }
    }

    public MemberGroupCollection getGroups() {
        return groups;
    }

    public MemberMailingCollection getMailings() {
        return mailings;
    }

    public Long getMemberId() {
        return memberId;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public MemberStatus getStatus() {
        return status;
    }

    public void setStatus(MemberStatus status) {
        this.status = status;
    }

    public LocalDateTime getMemberSince() {
        return memberSince;
    }

    public LocalDateTime getLastModifiedAt() {
        return lastModifiedAt;
    }

    public LocalDateTime getDeletedAt() {
        return deletedAt;
    }

    @Override
    public String toString() {
        return "Member{" +
                "memberId=" + memberId +
                ", email='" + email + '\'' +
                ", status=" + status +
                '}';
    }
}
