package com.dcruver.alerttriage.domain;

/**
 * Chat thread an alert was posted to.
 */
public record AlertThread(String channelId, String threadId) {
}
