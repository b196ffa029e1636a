package com.aegis.adminapi.infrastructure.persistence;

import com.aegis.adminapi.domain.User;
import com.aegis.adminapi.domain.UserFilter;
import com.aegis.security.Role;
import com.aegis.security.TenantScopedRepository;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Users table access. Every statement carries {@code tenant_id = :tenantId}.
 *
 * <p>Listing and counting filter on status, active users by default; lookups by id also see
 * deactivated ones so that they can be reactivated.
 */
@Repository
public class JdbcUserRepository implements TenantScopedRepository<User> {

    private static final String COLUMNS = "id, tenant_id, email, password_hash, full_name, role,"
            + " is_active, created_at, updated_at";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcUserRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String resourceType() {
        return "user";
    }

    @Override
    public Optional<User> findById(String tenantId, String id) {
        String sql = "SELECT " + COLUMNS + " FROM users WHERE id = :id AND tenant_id = :tenantId";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("tenantId", tenantId);
        return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    }

    public Optional<User> findByEmail(String tenantId, String email) {
        String sql = "SELECT " + COLUMNS
                + " FROM users WHERE LOWER(email) = LOWER(:email) AND tenant_id = :tenantId";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("email", email)
                .addValue("tenantId", tenantId);
        return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
    }

    /** Active users, newest first. */
    @Override
    public List<User> findAll(String tenantId, int offset, int limit) {
        return findMatching(tenantId, UserFilter.ACTIVE, offset, limit);
    }

    @Override
    public long count(String tenantId) {
        return countMatching(tenantId, UserFilter.ACTIVE);
    }

    /** Users of the tenant matching the filter, newest first. */
    public List<User> findMatching(String tenantId, UserFilter filter, int offset, int limit) {
        String sql = "SELECT " + COLUMNS + " FROM users" + where(filter)
                + " ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :offset";
        MapSqlParameterSource params = filterParams(tenantId, filter)
                .addValue("limit", limit)
                .addValue("offset", offset);
        return jdbcTemplate.query(sql, params, this::mapRow);
    }

    public long countMatching(String tenantId, UserFilter filter) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM users" + where(filter),
                filterParams(tenantId, filter),
                Long.class);
        return count == null ? 0 : count;
    }

    @Override
    public User insert(User user) {
        String sql = """
                INSERT INTO users (id, tenant_id, email, password_hash, full_name, role,
                                   is_active, created_at, updated_at)
                VALUES (:id, :tenantId, :email, :passwordHash, :fullName, :role,
                        :active, :createdAt, :updatedAt)
                """;
        jdbcTemplate.update(sql, params(user));
        return user;
    }

    @Override
    public Optional<User> update(String tenantId, User user) {
        String sql = """
                UPDATE users
                SET full_name = :fullName,
                    role = :role,
                    is_active = :active,
                    updated_at = :updatedAt
                WHERE id = :id AND tenant_id = :scopeTenantId
                """;
        MapSqlParameterSource params = params(user).addValue("scopeTenantId", tenantId);
        int rows = jdbcTemplate.update(sql, params);
        return rows == 0 ? Optional.empty() : Optional.of(user);
    }

    @Override
    public boolean delete(String tenantId, String id) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("tenantId", tenantId);
        return jdbcTemplate.update(
                "DELETE FROM users WHERE id = :id AND tenant_id = :tenantId", params) > 0;
    }

    private static String where(UserFilter filter) {
        String where = " WHERE tenant_id = :tenantId AND is_active = :active";
        if (filter.search() != null) {
            where += " AND (LOWER(email) LIKE :search ESCAPE '\\'"
                    + " OR LOWER(full_name) LIKE :search ESCAPE '\\')";
        }
        return where;
    }

    private static MapSqlParameterSource filterParams(String tenantId, UserFilter filter) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("active", filter.active());
        if (filter.search() != null) {
            params.addValue("search",
                    "%" + escapeLike(filter.search().toLowerCase(Locale.ROOT)) + "%");
        }
        return params;
    }

    /** Escapes LIKE wildcards so that the search matches them literally. */
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static MapSqlParameterSource params(User user) {
        return new MapSqlParameterSource()
                .addValue("id", user.id())
                .addValue("tenantId", user.tenantId())
                .addValue("email", user.email())
                .addValue("passwordHash", user.passwordHash())
                .addValue("fullName", user.fullName())
                .addValue("role", user.role().value())
                .addValue("active", user.active())
                .addValue("createdAt", Timestamp.from(user.createdAt()))
                .addValue("updatedAt", Timestamp.from(user.updatedAt()));
    }

    private User mapRow(ResultSet rs, int rowNum) throws SQLException {
        String role = rs.getString("role");
        return new User(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("email"),
                rs.getString("password_hash"),
                rs.getString("full_name"),
                Role.fromString(role).orElseThrow(
                        () -> new SQLException("Unknown role '%s' in users table".formatted(role))),
                rs.getBoolean("is_active"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }
}
