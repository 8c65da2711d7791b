package com.matcast.server.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.matcast.server.model.Match;

@Repository
public interface MatchRepository extends JpaRepository<Match, String> {
}
