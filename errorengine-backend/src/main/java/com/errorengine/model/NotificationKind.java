package com.errorengine.model;

public enum NotificationKind {
    NEW, REMINDER
}
