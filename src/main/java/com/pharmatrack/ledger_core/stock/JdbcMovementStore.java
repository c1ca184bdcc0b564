package com.pharmatrack.ledger_core.stock;

import com.pharmatrack.ledger_core.exception.ImmutableRecordViolationException;
import com.pharmatrack.ledger_core.exception.LedgerValidationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link MovementStore} backed by the {@code stock_movements} table.
 *
 * Uses JDBC directly: movements are insert-only, so there is nothing for an
 * ORM to track. Reads are ordered by the table-assigned {@code sequence_number},
 * which follows insertion order.
 */
@Repository
public class JdbcMovementStore implements MovementStore {

    static final int MAX_REFERENCE_KIND_LENGTH = 100;

    private static final String COLUMNS =
        "id, entity_kind, entity_id, lot_id, movement_kind, quantity, " +
        "reference_id, reference_kind, actor_id, created_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcMovementStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public UUID append(Movement movement) {
        validate(movement);

        try {
            jdbcTemplate.update(
                "INSERT INTO stock_movements (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
                movement.getId(),
                movement.getEntityKind().name(),
                movement.getEntityId(),
                movement.getLotId(),
                movement.getMovementKind().name(),
                movement.getQuantity(),
                movement.getReferenceId(),
                movement.getReferenceKind(),
                movement.getActorId(),
                Timestamp.from(movement.getCreatedAt())
            );
        } catch (DuplicateKeyException e) {
            throw new ImmutableRecordViolationException(
                "Movement " + movement.getId() + " already exists and cannot be rewritten", e);
        }

        return movement.getId();
    }

    @Override
    public List<Movement> queryOrdered(StockKey key) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM stock_movements " +
            "WHERE entity_kind = ? AND entity_id = ? AND lot_id = ? " +
            "ORDER BY sequence_number",
            movementRowMapper(),
            key.getEntityKind().name(),
            key.getEntityId(),
            key.getLotId()
        );
    }

    @Override
    public Map<MovementKind, Long> totalsByKind(StockKey key) {
        Map<MovementKind, Long> totals = new EnumMap<>(MovementKind.class);
        jdbcTemplate.query(
            "SELECT movement_kind, SUM(quantity) AS total FROM stock_movements " +
            "WHERE entity_kind = ? AND entity_id = ? AND lot_id = ? " +
            "GROUP BY movement_kind",
            rs -> {
                totals.put(MovementKind.valueOf(rs.getString("movement_kind")), rs.getLong("total"));
            },
            key.getEntityKind().name(),
            key.getEntityId(),
            key.getLotId()
        );
        return totals;
    }

    @Override
    public Optional<Movement> findById(UUID id) {
        List<Movement> found = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM stock_movements WHERE id = ?",
            movementRowMapper(),
            id
        );
        return found.stream().findFirst();
    }

    @Override
    public List<Movement> findByReference(UUID referenceId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM stock_movements WHERE reference_id = ? " +
            "ORDER BY sequence_number",
            movementRowMapper(),
            referenceId
        );
    }

    private void validate(Movement movement) {
        if (movement.getMovementKind() == null) {
            throw new LedgerValidationException("Movement kind is required");
        }
        if (movement.getEntityKind() == null || movement.getEntityId() == null || movement.getLotId() == null) {
            throw new LedgerValidationException("Entity kind, entity id and lot id are required");
        }
        if (movement.getReferenceKind() != null && movement.getReferenceKind().length() > MAX_REFERENCE_KIND_LENGTH) {
            throw new LedgerValidationException(
                "Reference kind must be at most " + MAX_REFERENCE_KIND_LENGTH + " characters");
        }
        if (movement.getMovementKind() == MovementKind.ADJUSTMENT) {
            if (movement.getQuantity() == 0) {
                throw new LedgerValidationException("Adjustment quantity must be non-zero");
            }
        } else if (movement.getQuantity() <= 0) {
            throw new LedgerValidationException(
                "Quantity must be positive for " + movement.getMovementKind() + ": " + movement.getQuantity());
        }
    }

    private RowMapper<Movement> movementRowMapper() {
        return (rs, rowNum) -> new Movement(
            UUID.fromString(rs.getString("id")),
            EntityKind.valueOf(rs.getString("entity_kind")),
            UUID.fromString(rs.getString("entity_id")),
            UUID.fromString(rs.getString("lot_id")),
            MovementKind.valueOf(rs.getString("movement_kind")),
            rs.getInt("quantity"),
            uuidOrNull(rs.getString("reference_id")),
            rs.getString("reference_kind"),
            uuidOrNull(rs.getString("actor_id")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private static UUID uuidOrNull(String value) {
        return value != null ? UUID.fromString(value) : null;
    }
}
