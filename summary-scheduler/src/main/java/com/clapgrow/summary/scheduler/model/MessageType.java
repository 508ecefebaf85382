package com.clapgrow.summary.scheduler.model;

public enum MessageType {
    TEXT,
    MEDIA,
    SYSTEM
}
