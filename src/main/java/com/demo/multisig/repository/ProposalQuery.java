package com.demo.multisig.repository;

import com.demo.multisig.model.ProposalStatus;

/** Filter and page for proposal listings. A null status matches every status. */
public record ProposalQuery(ProposalStatus status, int limit, int offset) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;

    public ProposalQuery {
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        offset = Math.max(0, offset);
    }

    public static ProposalQuery pending(int limit) {
        return new ProposalQuery(ProposalStatus.PENDING, limit, 0);
    }
}
