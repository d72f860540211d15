package com.retail.billkeeper.config;

import org.hibernate.dialect.H2Dialect;
import org.hibernate.engine.jdbc.dialect.spi.DialectResolutionInfo;
import org.hibernate.exception.LockAcquisitionException;
import org.hibernate.exception.spi.SQLExceptionConversionDelegate;

/**
 * H2 rejects an insert whose unique key is held by another, still open
 * transaction with error 90131 ("concurrent update") instead of waiting for
 * it. Reported here as a lock acquisition failure, which Spring surfaces as a
 * {@link org.springframework.dao.ConcurrencyFailureException} that the
 * numbering retry understands.
 */
public class H2ConcurrentInsertDialect extends H2Dialect {

    private static final int CONCURRENT_UPDATE = 90131;

    public H2ConcurrentInsertDialect() {
        super();
    }

    public H2ConcurrentInsertDialect(DialectResolutionInfo info) {
        super(info);
    }

    @Override
    public SQLExceptionConversionDelegate buildSQLExceptionConversionDelegate() {
        SQLExceptionConversionDelegate standard = super.buildSQLExceptionConversionDelegate();
        return (sqlException, message, sql) -> {
            if (sqlException.getErrorCode() == CONCURRENT_UPDATE) {
                return new LockAcquisitionException(message, sqlException, sql);
            }
            return standard != null ? standard.convert(sqlException, message, sql) : null;
        };
    }
}
