package com.neolms.studygroups.sync;

import java.time.Instant;

/**
 * "Something changed" notification published after a successful write.
 * Carries no state; receivers resync from the store.
 */
public class GroupChangeEvent {

    public enum Type {
        GROUP_CREATED,
        MEMBER_JOINED,
        MEMBER_LEFT,
        PIN_CHANGED,
        PRESENCE_CHANGED,
        INVITE_CHANGED
    }

    private final Type type;
    private final String groupId;
    private final String actorId;
    private final Instant occurredAt;

    public GroupChangeEvent(Type type, String groupId, String actorId, Instant occurredAt) {
        this.type = type;
        this.groupId = groupId;
        this.actorId = actorId;
        this.occurredAt = occurredAt;
    }

    public Type getType() {
        return type;
    }

    public String getGroupId() {
        return groupId;
    }

    public String getActorId() {
        return actorId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "GroupChangeEvent{" + type + ", group=" + groupId + ", actor=" + actorId + "}";
    }
}
