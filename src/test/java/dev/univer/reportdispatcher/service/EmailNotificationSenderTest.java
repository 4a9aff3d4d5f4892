package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.config.RetryConfig;
import dev.univer.reportdispatcher.exception.NotificationUnavailableException;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailParseException;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.retry.backoff.NoBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class EmailNotificationSenderTest {
    private final JavaMailSender mailSender = mock(JavaMailSender.class);
    private final ReportSchedulerProperties props = new ReportSchedulerProperties();
    private final EmailNotificationSender sender = new EmailNotificationSender(mailSender, props);

    @BeforeEach
    void setUp() {
        props.getMail().setFrom("reports@acme.test");
        when(mailSender.createMimeMessage()).thenAnswer(inv -> new MimeMessage((Session) null));
    }

    @Test
    void sendsHtmlMailToEveryRecipient() throws Exception {
        assertTrue(sender.send(List.of("a@acme.test", "b@acme.test"), "Orders - 10.03.2024", "<p>hi</p>"));

        ArgumentCaptor<MimeMessage> sent = ArgumentCaptor.forClass(MimeMessage.class);
        verify(mailSender).send(sent.capture());
        MimeMessage message = sent.getValue();
        assertEquals("Orders - 10.03.2024", message.getSubject());
        Address[] to = message.getRecipients(Message.RecipientType.TO);
        assertEquals(2, to.length);
        assertEquals("a@acme.test", ((InternetAddress) to[0]).getAddress());
        assertEquals("b@acme.test", ((InternetAddress) to[1]).getAddress());
        InternetAddress from = (InternetAddress) message.getFrom()[0];
        assertEquals("reports@acme.test", from.getAddress());
        assertEquals("Production Reports", from.getPersonal());
    }

    @Test
    void noRecipientsIsNotSent() {
        assertFalse(sender.send(List.of(), "Orders", "body"));
        assertFalse(sender.send(null, "Orders", "body"));
        verify(mailSender, never()).send(any(MimeMessage.class));
    }

    @Test
    void malformedAddressIsRejected() {
        assertFalse(sender.send(List.of("Bob <bob@acme.test"), "Orders", "body"));
        verify(mailSender, never()).send(any(MimeMessage.class));
    }

    @Test
    void messageRejectedByTransportIsNotRetryable() {
        doThrow(new MailParseException("bad header")).when(mailSender).send(any(MimeMessage.class));

        assertFalse(sender.send(List.of("a@acme.test"), "Orders", "body"));
    }

    @Test
    void unreachableTransportIsRetryable() {
        doThrow(new MailSendException("connection refused")).when(mailSender).send(any(MimeMessage.class));

        assertThrows(NotificationUnavailableException.class,
                () -> sender.send(List.of("a@acme.test"), "Orders", "body"));
    }

    @Test
    void refusedRecipientIsNotRetried() throws Exception {
        Map<Object, Exception> failed = new LinkedHashMap<>();
        failed.put("report", new SendFailedException("550 user unknown", null,
                new Address[]{new InternetAddress("boss@acme.test")}, new Address[0],
                new Address[]{new InternetAddress("typo@acme.test")}));
        doThrow(new MailSendException(failed)).when(mailSender).send(any(MimeMessage.class));
        RetryTemplate retry = RetryConfig.transientFailureRetry(3, new NoBackOffPolicy());

        boolean sent = retry.execute(ctx -> sender.send(List.of("boss@acme.test", "typo@acme.test"), "Orders", "body"));

        assertFalse(sent);
        verify(mailSender, times(1)).send(any(MimeMessage.class));
    }

    @Test
    void failedAuthenticationIsNotRetryable() {
        doThrow(new MailAuthenticationException("535 bad credentials")).when(mailSender).send(any(MimeMessage.class));

        assertFalse(sender.send(List.of("a@acme.test"), "Orders", "body"));
    }

    @Test
    void lostConnectionIsRetriedUntilItSucceeds() {
        doThrow(new MailSendException("Mail server connection failed", new MessagingException("connect timed out")))
                .doNothing()
                .when(mailSender).send(any(MimeMessage.class));
        RetryTemplate retry = RetryConfig.transientFailureRetry(3, new NoBackOffPolicy());

        boolean sent = retry.execute(ctx -> sender.send(List.of("a@acme.test"), "Orders", "body"));

        assertTrue(sent);
        verify(mailSender, times(2)).send(any(MimeMessage.class));
    }
}
