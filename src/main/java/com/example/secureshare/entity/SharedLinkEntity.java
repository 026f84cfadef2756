package com.example.secureshare.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "shared_links",
       indexes = {
           @Index(name = "idx_shared_links_file_id", columnList = "file_id"),
           @Index(name = "idx_shared_links_recipient_created", columnList = "recipient_user_id,created_at"),
           @Index(name = "idx_shared_links_expiration_date", columnList = "expiration_date")
       }
)
public class SharedLinkEntity {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "file_id", nullable = false)
    private UUID fileId;

    @Column(name = "recipient_user_id", nullable = false)
    private UUID recipientUserId;

    // access password as handed to the store (a hash, see FileController)
    @Column(name = "password", nullable = false, length = 255)
    private String password;

    @Column(name = "expiration_date", nullable = false)
    private Instant expirationDate;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public SharedLinkEntity() {
        this.createdAt = Instant.now();
    }

    public SharedLinkEntity(UUID fileId, UUID recipientUserId, String password, Instant expirationDate) {
        this();
        this.fileId = fileId;
        this.recipientUserId = recipientUserId;
        this.password = password;
        this.expirationDate = expirationDate;
    }

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getFileId() { return fileId; }
    public void setFileId(UUID fileId) { this.fileId = fileId; }

    public UUID getRecipientUserId() { return recipientUserId; }
    public void setRecipientUserId(UUID recipientUserId) { this.recipientUserId = recipientUserId; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public Instant getExpirationDate() { return expirationDate; }
    public void setExpirationDate(Instant expirationDate) { this.expirationDate = expirationDate; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
