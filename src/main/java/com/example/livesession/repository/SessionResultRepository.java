package com.example.livesession.repository;

import com.example.livesession.model.SessionResultRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface SessionResultRepository extends JpaRepository<SessionResultRecord, String> {

    List<SessionResultRecord> findByCodeIgnoreCaseOrderByEndedAtDesc(String code);

    void deleteByEndedAtBefore(Instant cutoff);
}
