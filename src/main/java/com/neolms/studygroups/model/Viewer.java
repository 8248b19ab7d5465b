package com.neolms.studygroups.model;

import java.util.Objects;

/**
 * The authenticated caller. Display name and avatar come from the access token
 * and are copied onto member rows when the viewer joins a group.
 */
public final class Viewer {

    private final String userId;
    private final String displayName;
    private final String avatarUrl;

    public Viewer(String userId, String displayName, String avatarUrl) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.displayName = displayName;
        this.avatarUrl = avatarUrl;
    }

    public static Viewer of(String userId) {
        return new Viewer(userId, null, null);
    }

    public String getUserId() {
        return userId;
    }

    public String getDisplayName() {
        return displayName != null ? displayName : "Student";
    }

    public String getAvatarUrl() {
        return avatarUrl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Viewer)) return false;
        return userId.equals(((Viewer) o).userId);
    }

    @Override
    public int hashCode() {
        return userId.hashCode();
    }

    @Override
    public String toString() {
        return "Viewer{" + userId + "}";
    }
}
