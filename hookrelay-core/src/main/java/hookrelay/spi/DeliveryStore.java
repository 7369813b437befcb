package hookrelay.spi;

import hookrelay.model.Delivery;
import hookrelay.model.DeliveryAttempt;
import hookrelay.model.DeliveryPage;
import hookrelay.model.DeliveryQuery;
import hookrelay.model.DeliveryStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for deliveries and their attempts.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries: the delivery worker writes an attempt and the delivery update
 * in a single transaction. Implementations signal failures with unchecked exceptions.
 * Implementations live in the {@code hookrelay-jdbc} module.
 *
 * @see hookrelay.jdbc.store.AbstractJdbcDeliveryStore
 */
public interface DeliveryStore {

    /**
     * Inserts a new delivery row.
     *
     * @param conn     the JDBC connection
     * @param delivery the delivery, normally {@link DeliveryStatus#PENDING}
     */
    void createDelivery(Connection conn, Delivery delivery);

    /**
     * Writes the mutable state of a delivery (status, attempt count, schedule, error,
     * timestamps).
     *
     * <p>Implementations <strong>must</strong> guard the update so that it only applies to a
     * row that is still {@code PENDING} or {@code RETRYING} and whose stored attempt count
     * does not exceed {@code delivery.attemptCount()}. A stale or terminal row is left
     * untouched and {@code 0} is returned.
     *
     * @param conn     the JDBC connection
     * @param delivery the new state
     * @return the number of rows updated (0 or 1)
     */
    int updateDelivery(Connection conn, Delivery delivery);

    /**
     * Moves a {@code FAILED} row back to {@code RETRYING}. Only rows currently
     * {@code FAILED} are affected.
     *
     * @param conn    the JDBC connection
     * @param revived the delivery in its revived state
     * @return the number of rows updated (0 or 1)
     */
    int reviveFailed(Connection conn, Delivery revived);

    /**
     * Appends an attempt record.
     *
     * @param conn    the JDBC connection
     * @param attempt the attempt
     */
    void createAttempt(Connection conn, DeliveryAttempt attempt);

    Optional<Delivery> findDelivery(Connection conn, String deliveryId);

    /**
     * Returns the attempts of a delivery ordered by attempt number.
     */
    List<DeliveryAttempt> listAttempts(Connection conn, String deliveryId);

    /**
     * Returns deliveries in the given status, oldest first.
     *
     * @param conn   the JDBC connection
     * @param status the status to match
     * @param limit  maximum number of rows
     */
    List<Delivery> listByStatus(Connection conn, DeliveryStatus status, int limit);

    /**
     * Returns {@code FAILED} deliveries with {@code attemptCount < maxAttempts}, oldest first.
     * Rows whose {@code lastError} starts with {@code excludedErrorPrefix} are left out.
     *
     * @param conn                the JDBC connection
     * @param maxAttempts         attempt budget; rows at or above it are exhausted
     * @param excludedErrorPrefix error prefix of rows reserved for operators
     * @param limit               maximum number of rows
     */
    List<Delivery> listRevivable(Connection conn, int maxAttempts, String excludedErrorPrefix, int limit);

    /**
     * Counts {@code FAILED} deliveries with {@code attemptCount >= maxAttempts}.
     */
    long countExhausted(Connection conn, int maxAttempts);

    /**
     * Returns {@code RETRYING} deliveries whose {@code nextRetryAt <= now}, earliest due first.
     *
     * @param conn  the JDBC connection
     * @param now   the current time
     * @param limit maximum number of rows
     */
    List<Delivery> listDueRetries(Connection conn, Instant now, int limit);

    /**
     * Returns {@code PENDING} deliveries created before {@code createdBefore}, oldest first.
     * These are rows that never reached a worker, for instance because the fresh queue was
     * full at ingestion or the process stopped.
     */
    List<Delivery> listStalePending(Connection conn, Instant createdBefore, int limit);

    /**
     * Returns a page of deliveries matching the query, newest first.
     */
    DeliveryPage listDeliveries(Connection conn, DeliveryQuery query);

    /**
     * Deletes up to {@code limit} terminal deliveries ({@code SUCCESS} or {@code FAILED})
     * completed before {@code cutoff}, together with their attempts. Rows without a
     * completion time fall back to their creation time. {@code PENDING} and
     * {@code RETRYING} rows are never deleted.
     *
     * <p>Attempts are only deleted together with their delivery: a row revived after being
     * selected keeps its history.
     *
     * @param conn   the JDBC connection (auto-commit)
     * @param cutoff deliveries older than this are eligible
     * @param limit  maximum number of deliveries to delete
     * @return the number of deliveries deleted
     */
    int deleteOlderThan(Connection conn, Instant cutoff, int limit);
}
