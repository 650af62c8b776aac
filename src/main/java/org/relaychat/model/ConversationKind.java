package org.relaychat.model;

public enum ConversationKind {
    DIRECT, GROUP
}
