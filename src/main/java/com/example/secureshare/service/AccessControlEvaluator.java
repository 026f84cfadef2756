package com.example.secureshare.service;

import com.example.secureshare.entity.FileEntity;
import com.example.secureshare.entity.SharedLinkEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a caller may retrieve the file behind a shared link.
 * <p>
 * The link lookup already folds in recipient and expiry, so a caller who is not
 * the recipient learns nothing beyond "not found". Only the real recipient of a
 * live link can get the more specific wrong-password answer.
 */
@Service
public class AccessControlEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AccessControlEvaluator.class);

    private final PersistenceGateway gateway;
    private final PasswordEncoder passwordEncoder;

    public AccessControlEvaluator(PersistenceGateway gateway, PasswordEncoder passwordEncoder) {
        this.gateway = gateway;
        this.passwordEncoder = passwordEncoder;
    }

    public AccessDecision authorize(UUID sharedId, UUID recipientId, String suppliedPassword) {
        Optional<SharedLinkEntity> link = gateway.fetchSharedLink(sharedId, recipientId);
        if (link.isEmpty()) {
            return AccessDecision.notFound();
        }

        if (suppliedPassword == null || !passwordEncoder.matches(suppliedPassword, link.get().getPassword())) {
            log.warn("Wrong access password for shared link: sharedId={}, recipient={}", sharedId, recipientId);
            return AccessDecision.wrongPassword();
        }

        Optional<FileEntity> file = gateway.fetchFile(link.get().getFileId());
        if (file.isEmpty()) {
            log.warn("Shared link points at a missing file: sharedId={}, fileId={}", sharedId, link.get().getFileId());
            return AccessDecision.notFound();
        }

        log.info("Access granted: sharedId={}, recipient={}, fileId={}", sharedId, recipientId, file.get().getId());
        return AccessDecision.granted(file.get());
    }
}
