package com.aldar.middleware.transcript.source;

import com.aldar.middleware.model.Attachment;

import java.util.List;

public interface AttachmentIndex {

    List<Attachment> listAttachments(String messageId);

    /**
     * Fallback for attachments whose message id was rewritten by a data migration:
     * matches on the session, the author role and the leading text of the message.
     */
    List<Attachment> findByContentSignature(String sessionId, String role, String contentPrefix);
}
