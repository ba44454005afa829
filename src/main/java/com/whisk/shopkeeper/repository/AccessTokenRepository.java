package com.whisk.shopkeeper.repository;

import com.whisk.shopkeeper.model.AccessToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface AccessTokenRepository extends JpaRepository<AccessToken, Long> {
    Optional<AccessToken> findByToken(String token);

    @Modifying
    @Transactional
    @Query("DELETE FROM AccessToken t WHERE t.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);
}
