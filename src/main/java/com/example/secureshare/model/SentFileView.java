package com.example.secureshare.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One row of a sender's outbox: a file the user uploaded together with the
 * recipient it was shared with.
 */
public record SentFileView(UUID fileId,
                           String fileName,
                           String recipientEmail,
                           Instant expirationDate,
                           Instant createdAt) {
}
