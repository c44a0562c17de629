package com.knowledge.sync.ingestion.model;

public enum IntegrationType {
    GOOGLE_CALENDAR,
    GOOGLE_DRIVE,
    GOOGLE_GMAIL,
    MICROSOFT_TEAMS,
    MICROSOFT_ONEDRIVE,
    MICROSOFT_OUTLOOK,
    MICROSOFT_CALENDER,
    SLACK_CHAT,
    POSTGRESQL
}
