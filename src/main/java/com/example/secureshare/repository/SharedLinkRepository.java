package com.example.secureshare.repository;

import com.example.secureshare.entity.SharedLinkEntity;
import com.example.secureshare.model.ReceivedFileView;
import com.example.secureshare.model.SentFileView;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SharedLinkRepository extends JpaRepository<SharedLinkEntity, UUID> {

    /**
     * Recipient and expiry are part of the lookup so that a foreign or expired link
     * is indistinguishable from a missing one.
     */
    @Query("SELECT sl FROM SharedLinkEntity sl WHERE sl.id = :id " +
           "AND sl.recipientUserId = :recipientId AND sl.expirationDate > :now")
    Optional<SharedLinkEntity> findActive(@Param("id") UUID id,
                                          @Param("recipientId") UUID recipientId,
                                          @Param("now") Instant now);

    @Query(value = "SELECT new com.example.secureshare.model.SentFileView(" +
                   "f.id, f.fileName, u.email, sl.expirationDate, sl.createdAt) " +
                   "FROM SharedLinkEntity sl " +
                   "JOIN FileEntity f ON sl.fileId = f.id " +
                   "JOIN UserEntity u ON sl.recipientUserId = u.id " +
                   "WHERE f.userId = :ownerId " +
                   "ORDER BY sl.createdAt DESC, sl.id DESC",
           countQuery = "SELECT COUNT(sl) FROM SharedLinkEntity sl " +
                        "JOIN FileEntity f ON sl.fileId = f.id " +
                        "WHERE f.userId = :ownerId")
    Page<SentFileView> findSentFiles(@Param("ownerId") UUID ownerId, Pageable pageable);

    @Query(value = "SELECT new com.example.secureshare.model.ReceivedFileView(" +
                   "sl.id, f.id, f.fileName, u.email, sl.expirationDate, sl.createdAt) " +
                   "FROM SharedLinkEntity sl " +
                   "JOIN FileEntity f ON sl.fileId = f.id " +
                   "LEFT JOIN UserEntity u ON f.userId = u.id " +
                   "WHERE sl.recipientUserId = :recipientId " +
                   "ORDER BY sl.createdAt DESC, sl.id DESC",
           countQuery = "SELECT COUNT(sl) FROM SharedLinkEntity sl " +
                        "JOIN FileEntity f ON sl.fileId = f.id " +
                        "WHERE sl.recipientUserId = :recipientId")
    Page<ReceivedFileView> findReceivedFiles(@Param("recipientId") UUID recipientId, Pageable pageable);

    @Query("SELECT sl.id FROM SharedLinkEntity sl WHERE sl.expirationDate < :now")
    List<UUID> findExpiredIds(@Param("now") Instant now);

    @Query("SELECT DISTINCT sl.fileId FROM SharedLinkEntity sl WHERE sl.id IN :ids")
    List<UUID> findFileIdsByIdIn(@Param("ids") Collection<UUID> ids);

    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM SharedLinkEntity sl WHERE sl.id IN :ids")
    int deleteByIdIn(@Param("ids") Collection<UUID> ids);
}
