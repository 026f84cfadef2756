package com.example.secureshare.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of a recipient's inbox. {@code sharedId} is the link id the recipient
 * presents to retrieve the file; {@code senderEmail} is null when the owning
 * account no longer exists.
 */
public record ReceivedFileView(UUID sharedId,
                               UUID fileId,
                               String fileName,
                               String senderEmail,
                               Instant expirationDate,
                               Instant createdAt) {
}
