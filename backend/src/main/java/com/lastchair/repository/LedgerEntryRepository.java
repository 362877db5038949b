package com.lastchair.repository;

import com.lastchair.model.LedgerEntry;
import com.lastchair.model.LedgerEntryType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {

    List<LedgerEntry> findByMatchIdOrderByCreatedAtAsc(Long matchId);

    @Query("select coalesce(sum(e.amount), 0) from LedgerEntry e where e.entryType = :entryType")
    long sumAmountByEntryType(@Param("entryType") LedgerEntryType entryType);
}
