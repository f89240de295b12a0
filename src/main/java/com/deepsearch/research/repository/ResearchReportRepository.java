package com.deepsearch.research.repository;

import com.deepsearch.research.entity.ResearchReport;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ResearchReportRepository extends JpaRepository<ResearchReport, UUID> {

    List<ResearchReport> findBySessionIdOrderByCreatedAtAsc(UUID sessionId);
}
