package com.demo.chatrelay.repository;

import com.demo.chatrelay.domain.UserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<UserEntity, String> {

    Optional<UserEntity> findByUsername(String username);

    @Query("SELECT u FROM UserEntity u WHERE u.isBot = false ORDER BY u.username ASC")
    List<UserEntity> findHumans();

    /**
     * Update online flag and last-seen timestamp
     */
    @Modifying
    @Transactional
    @Query("UPDATE UserEntity u " +
           "SET u.isOnline = :online, u.lastSeen = :now " +
           "WHERE u.id = :userId")
    int updatePresence(
        @Param("userId") String userId,
        @Param("online") boolean online,
        @Param("now") Instant now
    );
}
