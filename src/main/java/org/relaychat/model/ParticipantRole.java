package org.relaychat.model;

public enum ParticipantRole {
    ADMIN, MEMBER
}
