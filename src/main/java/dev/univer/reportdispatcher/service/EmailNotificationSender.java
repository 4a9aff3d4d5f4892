package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.exception.NotificationUnavailableException;
import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailPreparationException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class EmailNotificationSender implements NotificationSender {
    private final JavaMailSender mailSender;
    private final ReportSchedulerProperties props;

    @Override
    public boolean send(List<String> recipients, String subject, String body) {
        if (recipients == null || recipients.isEmpty()) {
            log.warn("Mail '{}' has no recipients, not sent", subject);
            return false;
        }

        MimeMessage message = mailSender.createMimeMessage();
        try {
            MimeMessageHelper helper = new MimeMessageHelper(message, StandardCharsets.UTF_8.name());
            String from = props.getMail().getFrom();
            if (!ScheduleParseUtil.isBlank(from)) {
                helper.setFrom(from, props.getMail().getSenderName());
            }
            helper.setTo(recipients.toArray(new String[0]));
            helper.setSubject(subject);
            helper.setText(body, true);
        } catch (MessagingException | UnsupportedEncodingException e) {
            log.error("Failed to build mail '{}': {}", subject, e.getMessage());
            return false;
        }

        try {
            mailSender.send(message);
        } catch (MailParseException | MailPreparationException | MailAuthenticationException e) {
            log.error("Mail '{}' rejected: {}", subject, e.getMessage());
            return false;
        } catch (MailSendException e) {
            if (isRejectedByServer(e)) {
                // some recipients may already have it, sending again would duplicate
                log.error("Mail '{}' refused by the server: {}", subject, e.getMessage());
                return false;
            }
            throw new NotificationUnavailableException("Mail transport failed for '" + subject + "'", e);
        } catch (MailException e) {
            throw new NotificationUnavailableException("Mail transport failed for '" + subject + "'", e);
        }

        log.info("Mail '{}' sent to {} recipient(s)", subject, recipients.size());
        return true;
    }

    // per-address refusals come as SendFailedException; connection failures do not
    private static boolean isRejectedByServer(MailSendException e) {
        if (e.getCause() instanceof SendFailedException) return true;
        for (Exception failure : e.getFailedMessages().values()) {
            if (failure instanceof SendFailedException) return true;
        }
        return false;
    }
}
