package com.retail.billkeeper.repository;

import com.retail.billkeeper.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findByActionOrderByLoggedAtDesc(String action);
}
