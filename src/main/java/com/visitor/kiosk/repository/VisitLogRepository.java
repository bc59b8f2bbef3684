package com.visitor.kiosk.repository;

import com.visitor.kiosk.entity.VisitLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VisitLogRepository extends JpaRepository<VisitLog, Long> {

    @Query("SELECT l FROM VisitLog l JOIN FETCH l.visitor JOIN FETCH l.host WHERE l.id = :id")
    Optional<VisitLog> findWithPartiesById(@Param("id") Long id);

    long countByVisitorId(Long visitorId);
}
