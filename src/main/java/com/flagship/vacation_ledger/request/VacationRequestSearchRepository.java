package com.flagship.vacation_ledger.request;

import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries that join requests with their owning account.
 *
 * Uses JDBC rather than JPA: the WHERE clause is assembled from whichever
 * filter fields are present.
 */
@Repository
public class VacationRequestSearchRepository {

    private static final String BASE_SELECT =
        "SELECT vr.id, vr.account_id, vr.start_date, vr.end_date, vr.reason, vr.status, " +
        "       vr.decided_by, vr.decided_at, vr.manager_notes, vr.submitted_at, vr.updated_at, " +
        "       a.name AS account_name, a.email AS account_email " +
        "FROM vacation_requests vr " +
        "JOIN accounts a ON a.id = vr.account_id ";

    private static final RowMapper<VacationRequestView> ROW_MAPPER = (rs, rowNum) -> {
        long decidedBy = rs.getLong("decided_by");
        Long decidedById = rs.wasNull() ? null : decidedBy;
        VacationRequest request = new VacationRequest(
            rs.getLong("id"),
            rs.getLong("account_id"),
            DateRange.of(rs.getDate("start_date").toLocalDate(), rs.getDate("end_date").toLocalDate()),
            rs.getString("reason"),
            RequestStatus.valueOf(rs.getString("status")),
            decidedById,
            toInstant(rs.getTimestamp("decided_at")),
            rs.getString("manager_notes"),
            toInstant(rs.getTimestamp("submitted_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
        return new VacationRequestView(request, rs.getString("account_name"), rs.getString("account_email"));
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public VacationRequestSearchRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<VacationRequestView> findById(Long id) {
        List<VacationRequestView> rows = jdbcTemplate.query(
            BASE_SELECT + "WHERE vr.id = :id",
            new MapSqlParameterSource("id", id),
            ROW_MAPPER
        );
        return rows.stream().findFirst();
    }

    /**
     * Lists requests matching every non-null field of {@code filter}, newest
     * submission first.
     */
    public List<VacationRequestView> findByFilter(RequestFilter filter) {
        StringBuilder sql = new StringBuilder(BASE_SELECT).append("WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();

        if (filter.getStatus() != null) {
            sql.append(" AND vr.status = :status");
            params.addValue("status", filter.getStatus().name());
        }
        if (filter.getAccountId() != null) {
            sql.append(" AND vr.account_id = :accountId");
            params.addValue("accountId", filter.getAccountId());
        }
        if (filter.hasSearch()) {
            sql.append(" AND (a.name ILIKE :search OR vr.reason ILIKE :search)");
            params.addValue("search", "%" + escapeLike(filter.getSearch().trim()) + "%");
        }
        if (filter.getFrom() != null) {
            sql.append(" AND vr.start_date >= :from");
            params.addValue("from", filter.getFrom());
        }
        if (filter.getTo() != null) {
            sql.append(" AND vr.end_date <= :to");
            params.addValue("to", filter.getTo());
        }
        sql.append(" ORDER BY vr.submitted_at DESC, vr.id DESC");

        return jdbcTemplate.query(sql.toString(), params, ROW_MAPPER);
    }

    /**
     * Escapes LIKE wildcards so user input matches literally (PostgreSQL's default escape is backslash).
     */
    static String escapeLike(String value) {
        return value
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
