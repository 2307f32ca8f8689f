package com.mailroute.gateway.model;

import java.util.Arrays;
import java.util.Objects;

/** A file attached to an {@link EmailMessage}. Content is held in memory. */
public final class EmailAttachment {

    private final String filename;
    private final byte[] content;
    private final String contentType;

    public EmailAttachment(final String filename, final byte[] content, final String contentType) {
        this.filename    = Objects.requireNonNull(filename, "filename");
        this.content     = content != null ? content.clone() : new byte[0];
        this.contentType = contentType != null ? contentType : "application/octet-stream";
    }

    public String getFilename()    { return filename; }
    public byte[] getContent()     { return content.clone(); }
    public String getContentType() { return contentType; }
    public int    size()           { return content.length; }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof EmailAttachment)) return false;
        final EmailAttachment other = (EmailAttachment) o;
        return filename.equals(other.filename)
            && contentType.equals(other.contentType)
            && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(filename, contentType) + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "EmailAttachment{" + filename + ", " + contentType + ", " + content.length + " bytes}";
    }
}
