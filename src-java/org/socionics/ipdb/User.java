package org.socionics.ipdb;

import java.time.Instant;
import java.util.Objects;

/**
 * A user who rates, comments on or edits entities.
 */
public final class User {

    private final String id;
    private final String username;
    private final String displayName;
    private final UserRole role;
    private final ExperienceLevel experienceLevel;
    private final Instant createdAt;

    public User(String id, String username, String displayName, UserRole role,
                ExperienceLevel experienceLevel, Instant createdAt) {
        this.id = id;
        this.username = username;
        this.displayName = displayName;
        this.role = role;
        this.experienceLevel = experienceLevel;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getUsername() { return username; }
    public String getDisplayName() { return displayName; }
    public UserRole getRole() { return role; }
    public ExperienceLevel getExperienceLevel() { return experienceLevel; }
    public Instant getCreatedAt() { return createdAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User that = (User) o;
        return id.equals(that.id)
                && username.equals(that.username)
                && Objects.equals(displayName, that.displayName)
                && role == that.role
                && experienceLevel == that.experienceLevel
                && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, username);
    }

    @Override
    public String toString() {
        return "User{id='" + id + "', username='" + username + "', role=" + role.getCode() + "}";
    }
}
