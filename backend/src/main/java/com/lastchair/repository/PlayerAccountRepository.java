package com.lastchair.repository;

import com.lastchair.model.PlayerAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PlayerAccountRepository extends JpaRepository<PlayerAccount, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from PlayerAccount a where a.walletAddress = :walletAddress")
    Optional<PlayerAccount> findByWalletForUpdate(@Param("walletAddress") String walletAddress);
}
