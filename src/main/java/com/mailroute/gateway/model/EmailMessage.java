package com.mailroute.gateway.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical email envelope handed to the routing engine.
 *
 * <p>The body is rendered upstream and treated as opaque. Instances are
 * immutable: every collection is copied on build, so a message can be
 * attempted against several providers without risk of mutation between
 * attempts.
 */
public final class EmailMessage {

    private final List<String> to;
    private final List<String> cc;
    private final List<String> bcc;
    private final String subject;
    private final String html;
    private final String text;
    private final String fromName;      // optional override of the provider sender
    private final String fromEmail;     // optional override of the provider sender
    private final String replyTo;
    private final List<EmailAttachment> attachments;
    private final Map<String, String> headers;
    private final Map<String, Object> metadata;

    private EmailMessage(final Builder b) {
        if (b.to.isEmpty()) {
            throw new IllegalArgumentException("EmailMessage requires at least one 'to' recipient");
        }
        this.to          = List.copyOf(b.to);
        this.cc          = List.copyOf(b.cc);
        this.bcc         = List.copyOf(b.bcc);
        this.subject     = b.subject != null ? b.subject : "";
        this.html        = b.html != null ? b.html : "";
        this.text        = b.text;
        this.fromName    = b.fromName;
        this.fromEmail   = b.fromEmail;
        this.replyTo     = b.replyTo;
        this.attachments = List.copyOf(b.attachments);
        this.headers     = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.metadata    = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> to  = new ArrayList<>();
        private final List<String> cc  = new ArrayList<>();
        private final List<String> bcc = new ArrayList<>();
        private String subject;
        private String html;
        private String text;
        private String fromName;
        private String fromEmail;
        private String replyTo;
        private final List<EmailAttachment> attachments = new ArrayList<>();
        private final Map<String, String> headers  = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder to(final String... addresses)  { return addAll(to, List.of(addresses)); }
        public Builder to(final List<String> list)    { return addAll(to, list); }
        public Builder cc(final List<String> list)    { return addAll(cc, list); }
        public Builder bcc(final List<String> list)   { return addAll(bcc, list); }
        public Builder subject(final String v)        { this.subject = v; return this; }
        public Builder html(final String v)           { this.html = v; return this; }
        public Builder text(final String v)           { this.text = v; return this; }
        public Builder replyTo(final String v)        { this.replyTo = v; return this; }

        public Builder from(final String name, final String email) {
            this.fromName  = name;
            this.fromEmail = email;
            return this;
        }

        public Builder attachment(final EmailAttachment a) {
            attachments.add(Objects.requireNonNull(a, "attachment"));
            return this;
        }

        public Builder header(final String name, final String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(final Map<String, String> values) {
            if (values != null) headers.putAll(values);
            return this;
        }

        public Builder metadata(final Map<String, Object> values) {
            if (values != null) metadata.putAll(values);
            return this;
        }

        private Builder addAll(final List<String> target, final List<String> values) {
            if (values == null) return this;
            for (final String v : values) {
                if (v != null && !v.isBlank()) target.add(v.trim());
            }
            return this;
        }

        public EmailMessage build() { return new EmailMessage(this); }
    }

    public List<String> getTo()                    { return to; }
    public List<String> getCc()                    { return cc; }
    public List<String> getBcc()                   { return bcc; }
    public String getSubject()                     { return subject; }
    public String getHtml()                        { return html; }
    public String getText()                        { return text; }
    public String getFromName()                    { return fromName; }
    public String getFromEmail()                   { return fromEmail; }
    public String getReplyTo()                     { return replyTo; }
    public List<EmailAttachment> getAttachments()  { return attachments; }
    public Map<String, String> getHeaders()        { return headers; }
    public Map<String, Object> getMetadata()       { return metadata; }

    public boolean hasFromOverride() {
        return fromEmail != null && !fromEmail.isBlank();
    }

    /** Plain-text body, derived from the HTML by stripping tags when none was supplied. */
    public String plainText() {
        if (text != null && !text.isBlank()) return text;
        return html.replaceAll("<[^>]*>", "");
    }

    /** Total of to, cc and bcc addresses. */
    public int recipientCount() {
        return to.size() + cc.size() + bcc.size();
    }

    /** Deliberately omits addresses, subject and body. */
    @Override
    public String toString() {
        return "EmailMessage{recipients=" + recipientCount()
             + ", attachments=" + attachments.size() + "}";
    }
}
