package org.socionics.ipdb;

/**
 * Payload for {@link PersonalityStore#createUser(NewUser)}.
 * Role defaults to annotator, experience to novice, display name to the username.
 */
public final class NewUser {

    private final String username;
    private final String displayName;
    private final UserRole role;
    private final ExperienceLevel experienceLevel;

    public NewUser(String username, String displayName, UserRole role, ExperienceLevel experienceLevel) {
        this.username = username;
        this.displayName = displayName;
        this.role = role;
        this.experienceLevel = experienceLevel;
    }

    public NewUser(String username, String displayName) {
        this(username, displayName, null, null);
    }

    public String getUsername() { return username; }
    public String getDisplayName() { return displayName; }
    public UserRole getRole() { return role; }
    public ExperienceLevel getExperienceLevel() { return experienceLevel; }
}
