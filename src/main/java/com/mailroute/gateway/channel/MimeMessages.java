package com.mailroute.gateway.channel;

import com.mailroute.gateway.model.EmailAttachment;
import com.mailroute.gateway.model.EmailMessage;
import jakarta.activation.DataHandler;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Renders an {@link EmailMessage} as a MIME message. Used by the SMTP
 * adapter for delivery and by the SES adapter for raw sends with attachments.
 */
final class MimeMessages {

    private static final String UTF_8 = "UTF-8";

    private MimeMessages() {}

    static MimeMessage build(
            final Session session,
            final EmailMessage message,
            final String fromName,
            final String fromEmail,
            final String replyTo) throws MessagingException {

        final MimeMessage mime = new MimeMessage(session);
        try {
            mime.setFrom(fromName != null && !fromName.isBlank()
                    ? new InternetAddress(fromEmail, fromName, UTF_8)
                    : new InternetAddress(fromEmail));
        } catch (UnsupportedEncodingException e) {
            throw new MessagingException("Unsupported sender name encoding", e);
        }
        setRecipients(mime, Message.RecipientType.TO,  message.getTo());
        setRecipients(mime, Message.RecipientType.CC,  message.getCc());
        setRecipients(mime, Message.RecipientType.BCC, message.getBcc());
        if (replyTo != null && !replyTo.isBlank()) {
            mime.setReplyTo(InternetAddress.parse(replyTo));
        }
        mime.setSubject(message.getSubject(), UTF_8);

        final MimeMultipart alternative = new MimeMultipart("alternative");
        final MimeBodyPart text = new MimeBodyPart();
        text.setText(message.plainText(), UTF_8);
        alternative.addBodyPart(text);
        if (!message.getHtml().isEmpty()) {
            final MimeBodyPart html = new MimeBodyPart();
            html.setContent(message.getHtml(), "text/html; charset=UTF-8");
            alternative.addBodyPart(html);
        }

        if (message.getAttachments().isEmpty()) {
            mime.setContent(alternative);
        } else {
            final MimeMultipart mixed = new MimeMultipart("mixed");
            final MimeBodyPart body = new MimeBodyPart();
            body.setContent(alternative);
            mixed.addBodyPart(body);
            for (final EmailAttachment a : message.getAttachments()) {
                final MimeBodyPart part = new MimeBodyPart();
                part.setDataHandler(new DataHandler(new ByteArrayDataSource(a.getContent(), a.getContentType())));
                part.setFileName(a.getFilename());
                mixed.addBodyPart(part);
            }
            mime.setContent(mixed);
        }

        for (final Map.Entry<String, String> h : message.getHeaders().entrySet()) {
            mime.setHeader(h.getKey(), h.getValue());
        }
        mime.saveChanges();
        return mime;
    }

    /** Serialised RFC 822 bytes, as expected by raw-send APIs. */
    static byte[] toBytes(final MimeMessage mime) throws MessagingException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            mime.writeTo(out);
        } catch (IOException e) {
            throw new MessagingException("Failed to serialise MIME message", e);
        }
        return out.toByteArray();
    }

    /** A session with no transport configuration, for rendering only. */
    static Session renderingSession() {
        return Session.getInstance(new Properties());
    }

    private static void setRecipients(
            final MimeMessage mime,
            final Message.RecipientType type,
            final List<String> addresses) throws MessagingException {
        if (addresses.isEmpty()) return;
        mime.setRecipients(type, InternetAddress.parse(String.join(",", addresses)));
    }
}
