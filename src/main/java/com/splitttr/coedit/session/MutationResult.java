package com.splitttr.coedit.session;

import com.splitttr.coedit.message.Mutation;

public record MutationResult(boolean applied, Mutation mutation, String reason, long version) {

    static MutationResult applied(Mutation mutation, long version) {
        return new MutationResult(true, mutation, null, version);
    }

    static MutationResult rejected(Mutation mutation, String reason, long version) {
        return new MutationResult(false, mutation, reason, version);
    }
}
