package com.graysky.api.model.visitor;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Deduplication key for a visitor: the sanitized name plus agent type.
 *
 * Two submissions are the same visitor only if both strings are exactly equal.
 * No case folding or whitespace trimming happens here, so "Ada" and "ada" are
 * different visitors. A missing agent type is its own bucket and never equals
 * any present agent type.
 */
public record IdentityKey(String name, String agentType) {

    public IdentityKey {
        Preconditions.checkNotNull(name, "name");
    }

    public boolean matches(VisitorRecord record) {
        return name.equals(record.getName()) && Objects.equals(agentType, record.getAgentType());
    }

    /**
     * Fixed-width SHA-256 hex of the pair, stored in the unique {@code identity_key} column.
     */
    public String digest() {
        String material = name + '\u0000' + (agentType == null ? "-" : "+" + agentType);
        return Hashing.sha256().hashString(material, StandardCharsets.UTF_8).toString();
    }
}
