package com.example.secureshare.entity;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * An uploaded file. The key, payload and IV are ciphertext produced by the client
 * and are stored and returned byte for byte.
 */
@Entity
@Table(name = "files",
       indexes = {
           @Index(name = "idx_files_user_id", columnList = "user_id"),
           @Index(name = "idx_files_created_at", columnList = "created_at")
       }
)
public class FileEntity {

    @Id
    @GeneratedValue
    private UUID id;

    // nullable, matching the schema; rows go away with their owner
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "file_name", nullable = false, length = 255)
    private String fileName;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "encrypted_key", nullable = false)
    private byte[] encryptedKey;

    @Column(name = "encrypted_payload", nullable = false)
    private byte[] encryptedPayload;

    @Column(name = "iv", nullable = false)
    private byte[] iv;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public FileEntity() {
        this.createdAt = Instant.now();
    }

    public FileEntity(UUID userId, String fileName, Long fileSize,
                      byte[] encryptedKey, byte[] encryptedPayload, byte[] iv) {
        this();
        this.userId = userId;
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.encryptedKey = encryptedKey;
        this.encryptedPayload = encryptedPayload;
        this.iv = iv;
    }

    // Getters and setters
    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }

    public Long getFileSize() { return fileSize; }
    public void setFileSize(Long fileSize) { this.fileSize = fileSize; }

    public byte[] getEncryptedKey() { return encryptedKey; }
    public void setEncryptedKey(byte[] encryptedKey) { this.encryptedKey = encryptedKey; }

    public byte[] getEncryptedPayload() { return encryptedPayload; }
    public void setEncryptedPayload(byte[] encryptedPayload) { this.encryptedPayload = encryptedPayload; }

    public byte[] getIv() { return iv; }
    public void setIv(byte[] iv) { this.iv = iv; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
