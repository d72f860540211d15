package com.retail.billkeeper.service;

import com.retail.billkeeper.config.NumberingProperties;
import com.retail.billkeeper.dto.AssignedNumber;
import com.retail.billkeeper.exception.NumberGenerationExhaustedException;
import com.retail.billkeeper.repository.SequenceSource;
import org.hibernate.JDBCException;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Hands out {@code PREFIX-SEQ} numbers and persists the numbered record in the
 * same unit of work.
 * <p>
 * There is no counter: each attempt reads {@code max(sequence)} for the prefix
 * inside a fresh transaction, claims {@code max + 1} and runs the persister.
 * The unique constraints on the number columns decide the race. When a
 * concurrent writer took the same sequence first, the attempt rolls back and
 * the whole read-compute-write cycle starts over after a short randomized
 * pause, at most {@link NumberingProperties#getMaxAttempts()} times.
 * <p>
 * Callers must not hold an open transaction of their own when invoking
 * {@link #generate}: the retry loop lives outside any transaction.
 */
@Component
public class DocumentNumberGenerator {

    private static final Logger logger = LoggerFactory.getLogger(DocumentNumberGenerator.class);

    private final TransactionTemplate attemptTemplate;
    private final NumberingProperties properties;

    public DocumentNumberGenerator(PlatformTransactionManager transactionManager, NumberingProperties properties) {
        this.attemptTemplate = new TransactionTemplate(transactionManager);
        this.attemptTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.properties = properties;
    }

    /**
     * Claims the next number in the series and persists with it.
     *
     * @param source    max-sequence lookup and guarding constraints of the numbered table
     * @param prefix    series prefix, e.g. {@code INV}
     * @param persister writes the record using the assigned number; must flush so that a
     *                  duplicate surfaces inside the attempt
     * @return whatever the persister returned for the winning attempt
     * @throws NumberGenerationExhaustedException when every attempt collided
     */
    public <T> T generate(SequenceSource source, String prefix, Function<AssignedNumber, T> persister) {
        int maxAttempts = properties.getMaxAttempts();
        int attempt = 0;
        while (attempt < maxAttempts) {
            attempt++;
            try {
                T result = attemptTemplate.execute(status -> persister.apply(nextNumber(source, prefix)));
                if (attempt > 1) {
                    logger.info("Claimed a number in series {} on attempt {}/{}", prefix, attempt, maxAttempts);
                }
                return result;
            } catch (DataIntegrityViolationException e) {
                if (!isNumberCollision(e, source)) {
                    throw e;
                }
                logger.warn("Number collision in series {} on attempt {}/{}: {}", prefix, attempt, maxAttempts,
                        e.getMostSpecificCause().getMessage());
            } catch (ConcurrencyFailureException e) {
                if (!isNumberedInsert(e, source)) {
                    throw e;
                }
                // Lost the race against a writer that had not committed yet
                logger.warn("Concurrent insert in series {} on attempt {}/{}: {}", prefix, attempt, maxAttempts,
                        e.getMostSpecificCause().getMessage());
            }
            if (attempt < maxAttempts && !backOff(attempt)) {
                break;
            }
        }
        logger.error("Gave up generating a number in series {} after {} attempts", prefix, attempt);
        throw new NumberGenerationExhaustedException(prefix, attempt);
    }

    private boolean backOff(int attempt) {
        long baseMillis = properties.getRetryBackoff().toMillis();
        if (baseMillis <= 0) {
            return true;
        }
        long delay = baseMillis * attempt + ThreadLocalRandom.current().nextLong(baseMillis + 1);
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting to retry numbering; giving up");
            return false;
        }
    }

    AssignedNumber nextNumber(SequenceSource source, String prefix) {
        Long max = source.findMaxSequence(prefix);
        long next = (max != null ? max : 0L) + 1;
        return new AssignedNumber(prefix, next, format(prefix, next));
    }

    public String format(String prefix, long sequence) {
        return prefix + "-" + String.format("%0" + properties.getSequenceWidth() + "d", sequence);
    }

    /**
     * True if the violation came from one of the number constraints and not from
     * some other integrity rule (missing party, null column), which must not be
     * retried.
     */
    boolean isNumberCollision(DataIntegrityViolationException e, SequenceSource source) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && mentionsConstraint(violation.getConstraintName(), source)) {
                return true;
            }
            if (mentionsConstraint(cause.getMessage(), source)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if the lock failure was raised by the insert of the numbered row
     * itself. Lock timeouts on other statements (a locked party or stock row)
     * are ordinary conflicts and propagate.
     */
    boolean isNumberedInsert(ConcurrencyFailureException e, SequenceSource source) {
        Pattern insert = Pattern.compile("\\binsert\\s+into\\s+\"?" + Pattern.quote(source.tableName()) + "\\b",
                Pattern.CASE_INSENSITIVE);
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof JDBCException jdbc && jdbc.getSQL() != null) {
                if (insert.matcher(jdbc.getSQL()).find()) {
                    return true;
                }
                logger.debug("Lock failure outside the numbered insert: {}", jdbc.getSQL());
                return false;
            }
        }
        return false;
    }

    private boolean mentionsConstraint(String text, SequenceSource source) {
        if (text == null) {
            return false;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        return source.numberConstraintNames().stream()
                .anyMatch(name -> normalized.contains(name.toLowerCase(Locale.ROOT)));
    }
}
