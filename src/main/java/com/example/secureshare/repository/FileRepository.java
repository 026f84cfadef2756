package com.example.secureshare.repository;

import com.example.secureshare.entity.FileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface FileRepository extends JpaRepository<FileEntity, UUID> {

    /**
     * Files no shared link points at any more.
     */
    @Query("SELECT f.id FROM FileEntity f WHERE NOT EXISTS " +
           "(SELECT sl.id FROM SharedLinkEntity sl WHERE sl.fileId = f.id)")
    List<UUID> findUnreferencedIds();

    /**
     * Deletes the given files unless a shared link still references them.
     */
    @Modifying(clearAutomatically = true)
    @Query("DELETE FROM FileEntity f WHERE f.id IN :ids AND NOT EXISTS " +
           "(SELECT sl.id FROM SharedLinkEntity sl WHERE sl.fileId = f.id)")
    int deleteUnreferencedByIdIn(@Param("ids") Collection<UUID> ids);
}
