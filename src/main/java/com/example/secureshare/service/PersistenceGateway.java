package com.example.secureshare.service;

import com.example.secureshare.entity.FileEntity;
import com.example.secureshare.entity.SharedLinkEntity;
import com.example.secureshare.entity.UserEntity;
import com.example.secureshare.model.PagedResult;
import com.example.secureshare.model.ReapResult;
import com.example.secureshare.model.ReceivedFileView;
import com.example.secureshare.model.SentFileView;
import com.example.secureshare.repository.FileRepository;
import com.example.secureshare.repository.SharedLinkRepository;
import com.example.secureshare.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * The only component that reads or writes users, files and shared links.
 * <p>
 * Stateless; all concurrency control is left to the database. Writes that span
 * several statements run inside an explicit {@link TransactionTemplate} scope so
 * that any failure rolls back every statement already issued.
 */
@Service
public class PersistenceGateway {

    private static final Logger log = LoggerFactory.getLogger(PersistenceGateway.class);

    private final UserRepository userRepository;
    private final FileRepository fileRepository;
    private final SharedLinkRepository sharedLinkRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public PersistenceGateway(UserRepository userRepository,
                              FileRepository fileRepository,
                              SharedLinkRepository sharedLinkRepository,
                              PlatformTransactionManager transactionManager,
                              Clock clock) {
        this.userRepository = userRepository;
        this.fileRepository = fileRepository;
        this.sharedLinkRepository = sharedLinkRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    // ---- users ----------------------------------------------------------------

    @Transactional
    public UserEntity createUser(String name, String email, String passwordHash) {
        if (userRepository.existsByEmail(email)) {
            log.debug("Rejected registration, email already in use");
            throw new EmailAlreadyExistsException(email);
        }

        UserEntity user = new UserEntity(name, email, passwordHash);
        Instant now = clock.instant();
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // lost a race with a concurrent registration
            throw new EmailAlreadyExistsException(email, ex);
        }
        log.info("Created user: id={}", user.getId());
        return user;
    }

    @Transactional(readOnly = true)
    public Optional<UserEntity> findUserById(UUID id) {
        return userRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public Optional<UserEntity> findUserByName(String name) {
        return userRepository.findFirstByNameOrderByCreatedAtAsc(name);
    }

    @Transactional(readOnly = true)
    public Optional<UserEntity> findUserByEmail(String email) {
        return userRepository.findByEmail(email);
    }

    @Transactional
    public UserEntity updateUserName(UUID id, String newName) {
        requireUpdated(id, userRepository.updateName(id, newName, clock.instant()));
        log.info("Updated name: userId={}", id);
        return reload(id);
    }

    @Transactional
    public UserEntity updateUserPassword(UUID id, String newPasswordHash) {
        requireUpdated(id, userRepository.updatePassword(id, newPasswordHash, clock.instant()));
        log.info("Updated password: userId={}", id);
        return reload(id);
    }

    @Transactional
    public void setUserPublicKey(UUID id, String publicKey) {
        requireUpdated(id, userRepository.updatePublicKey(id, publicKey, clock.instant()));
        log.info("Enrolled public key: userId={}", id);
    }

    /**
     * Users whose email matches {@code pattern} (SQL LIKE syntax, wildcards supplied
     * by the caller). The requester and users without a public key are never
     * returned.
     */
    @Transactional(readOnly = true)
    public List<UserEntity> searchUsersByEmailPrefix(UUID requesterId, String pattern) {
        List<UserEntity> users = userRepository.searchRecipients(requesterId, pattern);
        log.debug("Email search: requester={}, pattern='{}', matches={}", requesterId, pattern, users.size());
        return users;
    }

    private void requireUpdated(UUID id, int updatedRows) {
        if (updatedRows == 0) {
            throw new UserNotFoundException(id);
        }
    }

    private UserEntity reload(UUID id) {
        return userRepository.findById(id).orElseThrow(() -> new UserNotFoundException(id));
    }

    // ---- files and shared links -----------------------------------------------

    /**
     * Stores a file and the shared link granting {@code recipientId} access to it.
     * Both rows are written in one transaction: either both exist afterwards or
     * neither does.
     *
     * @param accessPassword stored verbatim; callers hash it beforehand
     * @return the created shared link
     * @throws TransactionFailureException if either insert failed and the pair was rolled back
     */
    public SharedLinkEntity storeEncryptedFile(UUID ownerId, String fileName, long fileSize,
                                               UUID recipientId, String accessPassword, Instant expirationDate,
                                               byte[] encryptedKey, byte[] encryptedPayload, byte[] iv) {
        log.info("Storing encrypted file: owner={}, recipient={}, fileName={}, size={}",
                ownerId, recipientId, fileName, fileSize);

        SharedLinkEntity link = inTransaction("store encrypted file", () -> {
            Instant now = clock.instant();

            FileEntity file = new FileEntity(ownerId, fileName, fileSize, encryptedKey, encryptedPayload, iv);
            file.setCreatedAt(now);
            file = fileRepository.saveAndFlush(file);

            SharedLinkEntity sharedLink = new SharedLinkEntity(file.getId(), recipientId, accessPassword, expirationDate);
            sharedLink.setCreatedAt(now);
            return sharedLinkRepository.saveAndFlush(sharedLink);
        });

        log.info("Stored file and shared link: fileId={}, sharedId={}, expires={}",
                link.getFileId(), link.getId(), link.getExpirationDate());
        return link;
    }

    /**
     * Returns the link only if it exists, belongs to {@code recipientId} and has not
     * expired. All other cases yield the same empty result.
     */
    @Transactional(readOnly = true)
    public Optional<SharedLinkEntity> fetchSharedLink(UUID sharedId, UUID recipientId) {
        Optional<SharedLinkEntity> link = sharedLinkRepository.findActive(sharedId, recipientId, clock.instant());
        if (link.isEmpty()) {
            log.debug("No active shared link: sharedId={}, recipient={}", sharedId, recipientId);
        }
        return link;
    }

    @Transactional(readOnly = true)
    public Optional<FileEntity> fetchFile(UUID fileId) {
        return fileRepository.findById(fileId);
    }

    @Transactional(readOnly = true)
    public PagedResult<SentFileView> listSentFiles(UUID ownerId, int page, int pageSize) {
        PageWindow window = PageWindow.of(page, pageSize);
        Page<SentFileView> result = sharedLinkRepository.findSentFiles(ownerId, window.toPageable());
        log.debug("Listed sent files: owner={}, {}, returned={}, total={}",
                ownerId, window, result.getNumberOfElements(), result.getTotalElements());
        return new PagedResult<>(result.getContent(), result.getTotalElements());
    }

    @Transactional(readOnly = true)
    public PagedResult<ReceivedFileView> listReceivedFiles(UUID recipientId, int page, int pageSize) {
        PageWindow window = PageWindow.of(page, pageSize);
        Page<ReceivedFileView> result = sharedLinkRepository.findReceivedFiles(recipientId, window.toPageable());
        log.debug("Listed received files: recipient={}, {}, returned={}, total={}",
                recipientId, window, result.getNumberOfElements(), result.getTotalElements());
        return new PagedResult<>(result.getContent(), result.getTotalElements());
    }

    // ---- retention ------------------------------------------------------------

    /**
     * Deletes every expired shared link, then the files they pointed at, then any
     * file no link references. Links go first so an interruption can only leave an
     * orphan file behind, never a link to a missing file. Safe to repeat.
     */
    public ReapResult deleteExpired() {
        return inTransaction("delete expired files", () -> {
            Instant now = clock.instant();

            List<UUID> expiredLinkIds = sharedLinkRepository.findExpiredIds(now);
            List<UUID> orphanFileIds = fileRepository.findUnreferencedIds();
            if (expiredLinkIds.isEmpty() && orphanFileIds.isEmpty()) {
                log.debug("No expired files or shared links to delete");
                return ReapResult.NOTHING;
            }

            Set<UUID> fileIds = new LinkedHashSet<>(orphanFileIds);
            int linksDeleted = 0;
            if (!expiredLinkIds.isEmpty()) {
                fileIds.addAll(sharedLinkRepository.findFileIdsByIdIn(expiredLinkIds));
                linksDeleted = sharedLinkRepository.deleteByIdIn(expiredLinkIds);
            }
            int filesDeleted = fileIds.isEmpty() ? 0 : fileRepository.deleteUnreferencedByIdIn(fileIds);

            return new ReapResult(linksDeleted, filesDeleted);
        });
    }

    private <T> T inTransaction(String operation, Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessResourceFailureException | TransientDataAccessException | CannotCreateTransactionException ex) {
            // store unreachable or transiently failing: surface as-is, retry policy belongs to the caller
            throw ex;
        } catch (RuntimeException ex) {
            log.warn("Rolled back '{}': {}", operation, ex.getMessage());
            throw new TransactionFailureException("Failed to " + operation + ", no changes were kept", ex);
        }
    }
}
