package com.mailroute.gateway.model;

/** Static feature limits of a transport adapter. */
public final class ProviderCapabilities {

    private final boolean supportsAttachments;
    private final boolean supportsHtml;
    private final boolean supportsBulk;
    private final int     maxRecipientsPerEmail;
    private final long    maxAttachmentSize;   // bytes

    public ProviderCapabilities(
            final boolean supportsAttachments,
            final boolean supportsHtml,
            final boolean supportsBulk,
            final int maxRecipientsPerEmail,
            final long maxAttachmentSize) {
        this.supportsAttachments   = supportsAttachments;
        this.supportsHtml          = supportsHtml;
        this.supportsBulk          = supportsBulk;
        this.maxRecipientsPerEmail = maxRecipientsPerEmail;
        this.maxAttachmentSize     = maxAttachmentSize;
    }

    public boolean supportsAttachments()     { return supportsAttachments; }
    public boolean supportsHtml()            { return supportsHtml; }
    public boolean supportsBulk()            { return supportsBulk; }
    public int     getMaxRecipientsPerEmail() { return maxRecipientsPerEmail; }
    public long    getMaxAttachmentSize()     { return maxAttachmentSize; }

    @Override
    public String toString() {
        return "ProviderCapabilities{attachments=" + supportsAttachments
             + ", html=" + supportsHtml
             + ", bulk=" + supportsBulk
             + ", maxRecipients=" + maxRecipientsPerEmail
             + ", maxAttachmentBytes=" + maxAttachmentSize + "}";
    }
}
