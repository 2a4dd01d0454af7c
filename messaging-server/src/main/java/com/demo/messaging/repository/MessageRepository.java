package com.demo.messaging.repository;

import com.demo.messaging.domain.Message;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.hibernate.jpa.HibernateHints;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Message persistence
 */
@Repository
public interface MessageRepository extends JpaRepository<Message, Long> {

    /**
     * Load a message and hold a row lock until the surrounding transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Message m WHERE m.id = :id")
    Optional<Message> findByIdForUpdate(@Param("id") Long id);

    /**
     * Load a message together with both participants
     */
    @Query("SELECT m FROM Message m " +
           "JOIN FETCH m.sender " +
           "JOIN FETCH m.receiver " +
           "WHERE m.id = :id")
    Optional<Message> findWithParticipantsById(@Param("id") Long id);

    /**
     * Content as currently stored, ignoring unflushed changes of the persistence context
     */
    @QueryHints(@QueryHint(name = HibernateHints.HINT_FLUSH_MODE, value = "COMMIT"))
    @Query("SELECT m.content FROM Message m WHERE m.id = :id")
    Optional<String> findPersistedContentById(@Param("id") Long id);

    /**
     * Direct replies of all given parents, oldest first, id breaking ties
     */
    @Query("SELECT m FROM Message m " +
           "JOIN FETCH m.sender " +
           "JOIN FETCH m.receiver " +
           "WHERE m.parentMessage.id IN :parentIds " +
           "ORDER BY m.timestamp ASC, m.id ASC")
    List<Message> findRepliesOf(@Param("parentIds") Collection<Long> parentIds);

    /**
     * Unread messages received by a user, newest first, sender fetched
     */
    @Query("SELECT m FROM Message m " +
           "JOIN FETCH m.sender " +
           "WHERE m.receiver.id = :userId " +
           "AND m.read = false " +
           "ORDER BY m.timestamp DESC, m.id DESC")
    List<Message> findUnreadForReceiver(@Param("userId") Long userId);

    @Query("SELECT COUNT(m) FROM Message m " +
           "WHERE m.receiver.id = :userId " +
           "AND m.read = false")
    long countUnreadForReceiver(@Param("userId") Long userId);

    @Query("SELECT COUNT(m) FROM Message m WHERE m.sender.id = :userId")
    long countBySender(@Param("userId") Long userId);

    @Query("SELECT COUNT(m) FROM Message m WHERE m.receiver.id = :userId")
    long countByReceiver(@Param("userId") Long userId);

    @Query("SELECT COUNT(m) FROM Message m " +
           "WHERE m.sender.id = :userId OR m.receiver.id = :userId")
    long countBySenderOrReceiver(@Param("userId") Long userId);

    /**
     * Mark every unread message of a receiver as read
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE Message m SET m.read = true " +
           "WHERE m.receiver.id = :userId " +
           "AND m.read = false")
    int markAllReadForReceiver(@Param("userId") Long userId);

    /**
     * Mark the given unread messages of a receiver as read; other ids are skipped
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE Message m SET m.read = true " +
           "WHERE m.receiver.id = :userId " +
           "AND m.read = false " +
           "AND m.id IN :ids")
    int markReadForReceiver(@Param("userId") Long userId, @Param("ids") Collection<Long> ids);

    /**
     * Delete everything a user sent or received (cleanup job)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM Message m " +
           "WHERE m.sender.id = :userId OR m.receiver.id = :userId")
    int deleteBySenderOrReceiver(@Param("userId") Long userId);
}
