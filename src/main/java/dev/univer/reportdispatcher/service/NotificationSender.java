package dev.univer.reportdispatcher.service;

import java.util.List;

/**
 * Delivers a rendered report. Returns {@code false} when the message was rejected;
 * throws {@link dev.univer.reportdispatcher.exception.NotificationUnavailableException}
 * when the transport is temporarily down.
 */
public interface NotificationSender {
    boolean send(List<String> recipients, String subject, String body);
}
