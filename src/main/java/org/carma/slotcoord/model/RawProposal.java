package org.carma.slotcoord.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unvalidated slot list extracted from a decision source reply.
 *
 * Entries keep whatever shape the reply had (numbers, numeric strings, junk);
 * coercion happens in the validator. An unusable proposal carries no entries
 * and the reason it was rejected.
 */
public final class RawProposal {

    private static final RawProposal EMPTY_UNUSABLE = new RawProposal(Collections.emptyList(), false, "no reply");

    private final List<Object> entries;
    private final boolean usable;
    private final String reason;

    private RawProposal(List<Object> entries, boolean usable, String reason) {
        this.entries = entries;
        this.usable = usable;
        this.reason = reason;
    }

    public static RawProposal of(List<?> entries) {
        return new RawProposal(Collections.unmodifiableList(new ArrayList<>(entries)), true, null);
    }

    public static RawProposal unusable(String reason) {
        if (reason == null) return EMPTY_UNUSABLE;
        return new RawProposal(Collections.emptyList(), false, reason);
    }

    public List<Object> getEntries() {
        return entries;
    }

    public boolean isUsable() {
        return usable;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return usable ? "RawProposal" + entries : "RawProposal[unusable: " + reason + "]";
    }
}
