package com.engagewatch.slack.engine;

import com.engagewatch.slack.api.SlackTypes.SlackMember;
import com.engagewatch.slack.api.SlackTypes.SlackProfile;

import java.util.Map;

/**
 * Immutable snapshot of the workspace directory for a single request.
 */
public final class MemberDirectory {

    static final String UNKNOWN = "unknown";

    private final Map<String, SlackMember> members;

    public MemberDirectory(Map<String, SlackMember> members) {
        this.members = Map.copyOf(members);
    }

    /** Member record, or {@code null} if the id is not in the directory. */
    public SlackMember get(String userId) {
        return userId == null ? null : members.get(userId);
    }

    public int size() {
        return members.size();
    }

    /**
     * Display name for an id; {@code "unknown"} when the id has no record.
     */
    public String nameOf(String userId) {
        return displayName(get(userId));
    }

    /**
     * Resolve the label shown for a member, in order: "display (real)" when
     * both exist and differ, display, real, handle, id, "unknown".
     * Normalized profile fields win over their raw counterparts.
     */
    public static String displayName(SlackMember member) {
        if (member == null) {
            return UNKNOWN;
        }
        SlackProfile profile = member.getProfile();
        String display = null;
        String real = null;
        if (profile != null) {
            display = firstNonEmpty(profile.getDisplayNameNormalized(), profile.getDisplayName());
            real = firstNonEmpty(profile.getRealNameNormalized(), profile.getRealName());
        }

        if (display != null && real != null && !display.equals(real)) {
            return display + " (" + real + ")";
        }
        String name = firstNonEmpty(display, real, member.getName(), member.getId());
        return name != null ? name : UNKNOWN;
    }

    private static String firstNonEmpty(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return null;
    }
}
