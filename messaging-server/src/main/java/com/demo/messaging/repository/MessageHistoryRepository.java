package com.demo.messaging.repository;

import com.demo.messaging.domain.MessageHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Repository for message edit history
 */
@Repository
public interface MessageHistoryRepository extends JpaRepository<MessageHistory, Long> {

    /**
     * Get max version recorded for a message
     */
    @Query("SELECT MAX(h.version) FROM MessageHistory h " +
           "WHERE h.message.id = :messageId")
    Optional<Integer> findMaxVersionByMessageId(@Param("messageId") Long messageId);

    /**
     * Full history of a message, oldest edit first
     */
    @Query("SELECT h FROM MessageHistory h " +
           "JOIN FETCH h.editedBy " +
           "WHERE h.message.id = :messageId " +
           "ORDER BY h.version")
    List<MessageHistory> findAllByMessageIdOrderByVersion(@Param("messageId") Long messageId);

    @Query("SELECT COUNT(h) FROM MessageHistory h WHERE h.message.id = :messageId")
    long countByMessage(@Param("messageId") Long messageId);

    @Query("SELECT COUNT(h) FROM MessageHistory h WHERE h.editedBy.id = :userId")
    long countByEditor(@Param("userId") Long userId);

    /**
     * Delete edits authored by a user (cleanup job)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM MessageHistory h WHERE h.editedBy.id = :userId")
    int deleteByEditor(@Param("userId") Long userId);
}
