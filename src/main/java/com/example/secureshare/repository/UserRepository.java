package com.example.secureshare.repository;

import com.example.secureshare.entity.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, UUID> {

    Optional<UserEntity> findByEmail(String email);

    boolean existsByEmail(String email);

    /**
     * Names are not unique; the earliest registered account wins.
     */
    Optional<UserEntity> findFirstByNameOrderByCreatedAtAsc(String name);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE UserEntity u SET u.name = :name, u.updatedAt = :now WHERE u.id = :id")
    int updateName(@Param("id") UUID id, @Param("name") String name, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE UserEntity u SET u.password = :password, u.updatedAt = :now WHERE u.id = :id")
    int updatePassword(@Param("id") UUID id, @Param("password") String password, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE UserEntity u SET u.publicKey = :publicKey, u.updatedAt = :now WHERE u.id = :id")
    int updatePublicKey(@Param("id") UUID id, @Param("publicKey") String publicKey, @Param("now") Instant now);

    /**
     * Users eligible as recipients: email matches the LIKE pattern, a public key is
     * enrolled, and the user is not the requester.
     */
    @Query("SELECT u FROM UserEntity u WHERE u.email LIKE :pattern AND u.publicKey IS NOT NULL " +
           "AND u.id <> :requesterId ORDER BY u.email")
    List<UserEntity> searchRecipients(@Param("requesterId") UUID requesterId, @Param("pattern") String pattern);
}
