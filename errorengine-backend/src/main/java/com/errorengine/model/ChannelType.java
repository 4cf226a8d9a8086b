package com.errorengine.model;

public enum ChannelType {
    WEBHOOK, TEAMS, TELEGRAM
}
