package com.emma.client.collection;

import com.emma.client.api.Account;
import com.emma.client.core.model.Member;
import com.emma.client.core.wire.WireValues;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Members of an account, keyed by member id.
 */
public class MemberCollection extends ApiCollection<Long, Member> {

    public MemberCollection(Account account) {
        super(account);
    }

    @Override
    protected String collectionPath() {
        return "/members";
    }

    @Override
    protected Member create(Map<String, Object> raw) {
        return new Member(account, raw);
    }

    @Override
    protected Long keyOf(Member item) {
        return item.getMemberId();
    }

    /**
     * Looks up a single member by id.
     */
    public Optional<Member> find(long memberId) {
        return fetchOne(memberId, "/members/" + memberId);
    }

    /**
     * Looks up a single member by email address. Always asks the API.
     */
    public Optional<Member> findByEmail(String email) {
        Objects.requireNonNull(email, "email is required");
        Object response = account.getAdapter().get("/members/email/" + WireValues.pathSegment(email), Map.of());
        if (response == null) {
            return Optional.empty();
        }
        Member member = create(WireValues.asMap(response));
        stage(member);
        return Optional.of(member);
    }

    /**
     * Builds a member bound to this account without touching the API.
     * Call {@link Member#save()} to create it.
     */
    public Member factory(Map<String, ?> raw) {
        return new Member(account, raw);
    }

    public Member factory() {
        return new Member(account);
    }
}
