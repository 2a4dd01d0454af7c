package com.demo.messaging.repository;

import com.demo.messaging.domain.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Repository for user notifications
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, Long> {

    /**
     * Notifications of a user, newest first
     */
    @Query("SELECT n FROM Notification n " +
           "LEFT JOIN FETCH n.message " +
           "WHERE n.user.id = :userId " +
           "ORDER BY n.createdAt DESC, n.id DESC")
    List<Notification> findByUserNewestFirst(@Param("userId") Long userId);

    @Query("SELECT n FROM Notification n " +
           "JOIN FETCH n.user " +
           "WHERE n.message.id = :messageId")
    List<Notification> findByMessage(@Param("messageId") Long messageId);

    @Query("SELECT COUNT(n) FROM Notification n " +
           "WHERE n.user.id = :userId " +
           "AND n.read = false")
    long countUnreadByUser(@Param("userId") Long userId);

    @Query("SELECT COUNT(n) FROM Notification n WHERE n.user.id = :userId")
    long countByUser(@Param("userId") Long userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("UPDATE Notification n SET n.read = true " +
           "WHERE n.user.id = :userId " +
           "AND n.read = false")
    int markAllReadByUser(@Param("userId") Long userId);

    /**
     * Delete notifications targeted at a user (cleanup job)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM Notification n WHERE n.user.id = :userId")
    int deleteByUser(@Param("userId") Long userId);
}
