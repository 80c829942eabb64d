package com.waqiti.auditpipeline.repository;

import com.waqiti.auditpipeline.domain.ViolationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ViolationRepository extends JpaRepository<ViolationRecord, UUID> {
}
