package com.splitttr.coedit.session;

import com.splitttr.coedit.message.Mutation;

import java.util.List;

/**
 * Outcome of reconciling a batch of pending mutations. {@code applied} is in the
 * order the mutations were applied (ascending timestamp).
 */
public record Resolution(
    boolean resolved,
    String finalContent,
    long version,
    List<Mutation> applied,
    List<Mutation> rejected
) {}
