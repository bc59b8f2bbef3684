package com.visitor.kiosk.repository;

import com.visitor.kiosk.entity.Visitor;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface VisitorRepository extends JpaRepository<Visitor, Long> {

    /** A null email matches visitors stored without one. */
    Optional<Visitor> findFirstByFullNameAndEmailOrderByIdAsc(String fullName, String email);
}
