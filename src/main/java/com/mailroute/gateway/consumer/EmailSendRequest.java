package com.mailroute.gateway.consumer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mailroute.gateway.model.EmailAttachment;
import com.mailroute.gateway.model.EmailMessage;
import com.mailroute.gateway.model.SendOptions;
import com.mailroute.gateway.model.TaskType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Send request consumed from the mail request topics.
 *
 * <p>Attachment content is base64 in the JSON payload. {@code requestId} is
 * copied into audit records as the correlation id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmailSendRequest {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static class Attachment {
        private String filename;
        private byte[] content;
        private String contentType;

        public Attachment() { }

        public String getFilename()    { return filename; }
        public byte[] getContent()     { return content; }
        public String getContentType() { return contentType; }

        public void setFilename(String v)    { this.filename = v; }
        public void setContent(byte[] v)     { this.content = v; }
        public void setContentType(String v) { this.contentType = v; }
    }

    private String              requestId;
    private TaskType            taskType;
    private String              userId;
    private List<String>        to;
    private List<String>        cc;
    private List<String>        bcc;
    private String              subject;
    private String              html;
    private String              text;
    private String              fromName;
    private String              fromEmail;
    private String              replyTo;
    private List<Attachment>    attachments;
    private Map<String, String> headers;
    private Map<String, Object> metadata;
    private Instant             deadline;

    public EmailSendRequest() { }

    /**
     * @throws IllegalArgumentException on malformed JSON, a missing task type
     *         or no recipients
     */
    public static EmailSendRequest fromJson(final String json) {
        final EmailSendRequest request;
        try {
            request = MAPPER.readValue(json, EmailSendRequest.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialise EmailSendRequest: " + e.getMessage(), e);
        }
        if (request == null || request.taskType == null) {
            throw new IllegalArgumentException("EmailSendRequest has no taskType");
        }
        if (request.to == null || request.to.isEmpty()) {
            throw new IllegalArgumentException("EmailSendRequest has no recipients");
        }
        return request;
    }

    public EmailMessage toMessage() {
        final EmailMessage.Builder b = EmailMessage.builder()
                .to(to)
                .subject(subject)
                .html(html)
                .text(text)
                .replyTo(replyTo)
                .cc(cc)
                .bcc(bcc)
                .headers(headers)
                .metadata(metadata);
        if (fromEmail != null) b.from(fromName, fromEmail);
        if (attachments != null) {
            for (final Attachment a : attachments) {
                b.attachment(new EmailAttachment(a.getFilename(), a.getContent(), a.getContentType()));
            }
        }
        return b.build();
    }

    /**
     * @param defaultDeadline applied when the request carries none; may be null
     */
    public SendOptions toOptions(final Instant defaultDeadline) {
        return SendOptions.builder()
                .userId(userId)
                .emailId(requestId)
                .deadline(deadline != null ? deadline : defaultDeadline)
                .build();
    }

    public String              getRequestId()   { return requestId; }
    public TaskType            getTaskType()    { return taskType; }
    public String              getUserId()      { return userId; }
    public List<String>        getTo()          { return to; }
    public List<String>        getCc()          { return cc; }
    public List<String>        getBcc()         { return bcc; }
    public String              getSubject()     { return subject; }
    public String              getHtml()        { return html; }
    public String              getText()        { return text; }
    public String              getFromName()    { return fromName; }
    public String              getFromEmail()   { return fromEmail; }
    public String              getReplyTo()     { return replyTo; }
    public List<Attachment>    getAttachments() { return attachments; }
    public Map<String, String> getHeaders()     { return headers; }
    public Map<String, Object> getMetadata()    { return metadata; }
    public Instant             getDeadline()    { return deadline; }

    public void setRequestId(String v)             { this.requestId = v; }
    public void setTaskType(TaskType v)            { this.taskType = v; }
    public void setUserId(String v)                { this.userId = v; }
    public void setTo(List<String> v)              { this.to = v; }
    public void setCc(List<String> v)              { this.cc = v; }
    public void setBcc(List<String> v)             { this.bcc = v; }
    public void setSubject(String v)               { this.subject = v; }
    public void setHtml(String v)                  { this.html = v; }
    public void setText(String v)                  { this.text = v; }
    public void setFromName(String v)              { this.fromName = v; }
    public void setFromEmail(String v)             { this.fromEmail = v; }
    public void setReplyTo(String v)               { this.replyTo = v; }
    public void setAttachments(List<Attachment> v) { this.attachments = v; }
    public void setHeaders(Map<String, String> v)  { this.headers = v; }
    public void setMetadata(Map<String, Object> v) { this.metadata = v; }
    public void setDeadline(Instant v)             { this.deadline = v; }

    @Override
    public String toString() {
        return "EmailSendRequest{id=" + requestId
             + ", task=" + taskType
             + ", recipients=" + (to != null ? to.size() : 0) + "}";
    }
}
