package com.ehrportal.security;

import java.util.Objects;
import java.util.UUID;

/**
 * The target of an action as seen by the ownership gate: either nothing in
 * particular (collections, creation) or something owned by one identity.
 */
public final class ProtectedResource {

    private static final ProtectedResource NONE = new ProtectedResource(null);

    private final UUID ownerUserId;

    private ProtectedResource(UUID ownerUserId) {
        this.ownerUserId = ownerUserId;
    }

    public static ProtectedResource none() {
        return NONE;
    }

    public static ProtectedResource ownedBy(UUID ownerUserId) {
        return new ProtectedResource(Objects.requireNonNull(ownerUserId, "ownerUserId"));
    }

    public boolean isOwned() {
        return ownerUserId != null;
    }

    public UUID getOwnerUserId() {
        return ownerUserId;
    }

    @Override
    public String toString() {
        return isOwned() ? "ProtectedResource{owner=" + ownerUserId + "}" : "ProtectedResource{none}";
    }
}
