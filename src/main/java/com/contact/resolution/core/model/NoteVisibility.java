package com.contact.resolution.core.model;

public enum NoteVisibility {
    PUBLIC,
    PRIVATE,
    TEAM
}
