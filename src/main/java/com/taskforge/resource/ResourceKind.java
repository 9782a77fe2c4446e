package com.taskforge.resource;

public enum ResourceKind {
    TEAM("Team"),
    BOT("Bot"),
    GHOST("Ghost"),
    SHELL("Shell"),
    MODEL("Model"),
    PUBLIC_MODEL("PublicModel");

    private final String kindName;

    ResourceKind(String kindName) {
        this.kindName = kindName;
    }

    public String kindName() {
        return kindName;
    }
}
