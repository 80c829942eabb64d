package com.waqiti.auditpipeline.repository;

import com.waqiti.auditpipeline.domain.ComplianceRuleRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ComplianceRuleRepository extends JpaRepository<ComplianceRuleRecord, String> {

    List<ComplianceRuleRecord> findByActiveTrue();
}
