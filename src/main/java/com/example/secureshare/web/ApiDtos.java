package com.example.secureshare.web;

import com.example.secureshare.entity.FileEntity;
import com.example.secureshare.entity.UserEntity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Future;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

// ---- requests ----

record RegisterUserRequest(
        @NotBlank(message = "Name is required") @Size(max = 100, message = "Name is too long") String name,
        @NotBlank(message = "Email is required") @Email(message = "Email is invalid") String email,
        @NotBlank(message = "Password is required")
        @Size(min = 6, message = "Password must be at least 6 characters") String password,
        @NotBlank(message = "Confirm Password is required") String passwordConfirm) {

    @JsonIgnore
    @AssertTrue(message = "Passwords do not match")
    public boolean isPasswordConfirmed() {
        return Objects.equals(password, passwordConfirm);
    }
}

record LoginRequest(
        @NotBlank(message = "Email is required") @Email(message = "Email is invalid") String email,
        @NotBlank(message = "Password is required")
        @Size(min = 6, message = "Password must be at least 6 characters") String password) {}

record NameUpdateRequest(
        @NotBlank(message = "Name is required") @Size(max = 100, message = "Name is too long") String name) {}

record PasswordUpdateRequest(
        @NotBlank(message = "Old password is required")
        @Size(min = 6, message = "Old password must be at least 6 characters") String oldPassword,
        @NotBlank(message = "New password is required")
        @Size(min = 6, message = "New password must be at least 6 characters") String newPassword,
        @NotBlank(message = "New password confirm is required") String newPasswordConfirm) {

    @JsonIgnore
    @AssertTrue(message = "New passwords do not match")
    public boolean isNewPasswordConfirmed() {
        return Objects.equals(newPassword, newPasswordConfirm);
    }
}

record PublicKeyRequest(@NotBlank(message = "Public key is required") String publicKey) {}

/**
 * Key, payload and IV arrive base64 encoded and are already encrypted by the client.
 */
record UploadFileRequest(
        @NotBlank(message = "Recipient email is required") @Email(message = "Invalid email format") String recipientEmail,
        @NotBlank(message = "Password is required")
        @Size(min = 6, message = "Password must be at least 6 characters") String password,
        @NotNull(message = "Expiration date is required")
        @Future(message = "Expiration date must be in the future") Instant expirationDate,
        @NotBlank(message = "File name is required") @Size(max = 255, message = "File name is too long") String fileName,
        @NotNull(message = "File size is required") @PositiveOrZero(message = "File size must not be negative") Long fileSize,
        @NotEmpty(message = "Encrypted key is required") byte[] encryptedKey,
        @NotNull(message = "Encrypted payload is required") byte[] encryptedPayload,
        @NotEmpty(message = "IV is required") byte[] iv) {}

record RetrieveFileRequest(
        @NotNull(message = "Shared id is required") UUID sharedId,
        @NotBlank(message = "Password is required")
        @Size(min = 6, message = "Password must be at least 6 characters") String password) {}

// ---- responses ----

record ErrorResponse(String status, String message) {

    static ErrorResponse fail(String message) {
        return new ErrorResponse("fail", message);
    }

    static ErrorResponse error(String message) {
        return new ErrorResponse("error", message);
    }
}

record MessageResponse(String status, String message) {

    static MessageResponse success(String message) {
        return new MessageResponse("success", message);
    }
}

record LoginResponse(String status, String token) {}

record UserDto(UUID id, String name, String email, String publicKey, Instant createdAt, Instant updatedAt) {

    static UserDto from(UserEntity user) {
        return new UserDto(user.getId(), user.getName(), user.getEmail(), user.getPublicKey(),
                user.getCreatedAt(), user.getUpdatedAt());
    }
}

record UserData(UserDto user) {}

record UserResponse(String status, UserData data) {

    static UserResponse success(UserEntity user) {
        return new UserResponse("success", new UserData(UserDto.from(user)));
    }
}

record EmailDto(String email) {}

record EmailListResponse(String status, List<EmailDto> emails) {}

record UploadResponse(String status, String message, UUID sharedId) {}

record RetrievedFileDto(String fileName, long fileSize, byte[] encryptedKey, byte[] encryptedPayload, byte[] iv) {

    static RetrievedFileDto from(FileEntity file) {
        return new RetrievedFileDto(file.getFileName(), file.getFileSize(),
                file.getEncryptedKey(), file.getEncryptedPayload(), file.getIv());
    }
}

record RetrievedFileResponse(String status, RetrievedFileDto file) {}

record FileListResponse<T>(String status, List<T> files, long results) {}
