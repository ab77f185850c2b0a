package com.schoolhub.backend.modules.announcement.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.schoolhub.backend.modules.announcement.domain.Announcement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AnnouncementRepository extends JpaRepository<Announcement, UUID> {

    List<Announcement> findAllByOrderByExpirationDateDesc();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Announcement a set a.startDate = null, a.updatedAt = :updatedAt where a.id = :id")
    int clearStartDate(@Param("id") UUID id, @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Announcement a
               set a.message = :message,
                   a.expirationDate = :expirationDate,
                   a.updatedAt = :updatedAt
             where a.id = :id
            """)
    int updateMessageAndExpiration(@Param("id") UUID id,
                                   @Param("message") String message,
                                   @Param("expirationDate") String expirationDate,
                                   @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Announcement a
               set a.message = :message,
                   a.startDate = :startDate,
                   a.expirationDate = :expirationDate,
                   a.updatedAt = :updatedAt
             where a.id = :id
            """)
    int updateMessageAndWindow(@Param("id") UUID id,
                               @Param("message") String message,
                               @Param("startDate") String startDate,
                               @Param("expirationDate") String expirationDate,
                               @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from Announcement a where a.id = :id")
    int deleteAnnouncement(@Param("id") UUID id);
}
