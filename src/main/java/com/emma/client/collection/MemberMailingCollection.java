package com.emma.client.collection;

import com.emma.client.core.model.Mailing;
import com.emma.client.core.model.Member;

import java.util.Map;

/**
 * Mailings a member received, keyed by mailing id.
 */
public class MemberMailingCollection extends MemberRelationCollection<Long, Mailing> {

    public MemberMailingCollection(Member member) {
        super(member);
    }

    @Override
    protected String relation() {
        return "mailings";
    }

    @Override
    protected Mailing create(Map<String, Object> raw) {
        return new Mailing(account, raw);
    }

    @Override
    protected Long keyOf(Mailing item) {
        return item.getMailingId();
    }
}
