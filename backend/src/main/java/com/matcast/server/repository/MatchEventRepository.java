package com.matcast.server.repository;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.matcast.server.model.MatchEvent;
import com.matcast.server.model.MatchEventType;

/**
 * Append-only access to the audit log. The only delete is the bulk purge.
 */
@Repository
public interface MatchEventRepository extends JpaRepository<MatchEvent, String> {

    List<MatchEvent> findByMatchIdOrderByTimestampDesc(String matchId, Pageable pageable);

    List<MatchEvent> findByMatchIdAndEventTypeOrderByTimestampDesc(String matchId, MatchEventType eventType,
                                                                   Pageable pageable);

    long countByMatchId(String matchId);

    @Modifying
    @Query("DELETE FROM MatchEvent e WHERE e.matchId = :matchId")
    int deleteByMatchId(@Param("matchId") String matchId);
}
