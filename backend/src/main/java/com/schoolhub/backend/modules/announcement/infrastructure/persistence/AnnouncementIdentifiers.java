package com.schoolhub.backend.modules.announcement.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

/**
 * Syntax check for announcement store identifiers. Callers only ask whether a raw value is
 * well-formed; the UUID encoding stays local to the persistence layer.
 */
public final class AnnouncementIdentifiers {

    private static final int CANONICAL_LENGTH = 36;

    private AnnouncementIdentifiers() {
    }

    public static Optional<UUID> parse(String raw) {
        if (raw == null || raw.length() != CANONICAL_LENGTH) {
            return Optional.empty();
        }
        try {
            UUID id = UUID.fromString(raw);
            // fromString tolerates misplaced dashes and oversized groups
            return id.toString().equalsIgnoreCase(raw) ? Optional.of(id) : Optional.empty();
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
