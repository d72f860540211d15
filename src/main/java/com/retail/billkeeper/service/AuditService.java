package com.retail.billkeeper.service;

import com.retail.billkeeper.model.AuditLog;
import com.retail.billkeeper.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    public static final String SYSTEM_USER = "SYSTEM";

    public static final String NUMBER_ASSIGNED = "NUMBER_ASSIGNED";
    public static final String DOCUMENT_DELETED = "DOCUMENT_DELETED";
    public static final String LINE_ITEM_DELETED = "LINE_ITEM_DELETED";
    public static final String PAYMENT_DELETED = "PAYMENT_DELETED";
    public static final String RETURN_DELETED = "RETURN_DELETED";
    public static final String PARTY_DELETED = "PARTY_DELETED";
    public static final String STOCK_ITEM_DELETED = "STOCK_ITEM_DELETED";
    public static final String STOCK_ADJUSTED = "STOCK_ADJUSTED";

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    // Written in the caller's transaction: an audit row exists only if the change it describes committed
    public void log(String action, String details) {
        AuditLog log = new AuditLog();
        log.setAction(action);
        log.setDetails(details);
        log.setUsername(SYSTEM_USER);
        auditLogRepository.save(log);
        logger.debug("Audit {}: {}", action, details);
    }
}
