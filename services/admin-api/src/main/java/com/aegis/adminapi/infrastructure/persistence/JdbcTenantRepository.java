package com.aegis.adminapi.infrastructure.persistence;

import com.aegis.adminapi.domain.Tenant;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Tenants table access. Tenants are global, so unlike users no tenant predicate applies here.
 */
@Repository
public class JdbcTenantRepository {

    private static final String COLUMNS = "id, name, domain, is_active, created_at, updated_at";

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcTenantRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<Tenant> findById(String id) {
        String sql = "SELECT " + COLUMNS + " FROM tenants WHERE id = :id";
        return jdbcTemplate.query(sql, new MapSqlParameterSource("id", id), this::mapRow)
                .stream()
                .findFirst();
    }

    public Optional<Tenant> findByName(String name) {
        String sql = "SELECT " + COLUMNS + " FROM tenants WHERE LOWER(name) = LOWER(:name)";
        return jdbcTemplate.query(sql, new MapSqlParameterSource("name", name), this::mapRow)
                .stream()
                .findFirst();
    }

    public Optional<Tenant> findByDomain(String domain) {
        String sql = "SELECT " + COLUMNS + " FROM tenants WHERE LOWER(domain) = LOWER(:domain)";
        return jdbcTemplate.query(sql, new MapSqlParameterSource("domain", domain), this::mapRow)
                .stream()
                .findFirst();
    }

    /** Newest first. */
    public List<Tenant> findAll(int offset, int limit) {
        String sql = "SELECT " + COLUMNS + """
                 FROM tenants
                ORDER BY created_at DESC, id DESC
                LIMIT :limit OFFSET :offset
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("limit", limit)
                .addValue("offset", offset);
        return jdbcTemplate.query(sql, params, this::mapRow);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM tenants", new MapSqlParameterSource(), Long.class);
        return count == null ? 0 : count;
    }

    public Tenant insert(Tenant tenant) {
        String sql = """
                INSERT INTO tenants (id, name, domain, is_active, created_at, updated_at)
                VALUES (:id, :name, :domain, :active, :createdAt, :updatedAt)
                """;
        jdbcTemplate.update(sql, params(tenant));
        return tenant;
    }

    public Optional<Tenant> update(Tenant tenant) {
        String sql = """
                UPDATE tenants
                SET name = :name,
                    domain = :domain,
                    is_active = :active,
                    updated_at = :updatedAt
                WHERE id = :id
                """;
        int rows = jdbcTemplate.update(sql, params(tenant));
        return rows == 0 ? Optional.empty() : Optional.of(tenant);
    }

    private static MapSqlParameterSource params(Tenant tenant) {
        return new MapSqlParameterSource()
                .addValue("id", tenant.id())
                .addValue("name", tenant.name())
                .addValue("domain", tenant.domain())
                .addValue("active", tenant.active())
                .addValue("createdAt", Timestamp.from(tenant.createdAt()))
                .addValue("updatedAt", Timestamp.from(tenant.updatedAt()));
    }

    private Tenant mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Tenant(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("domain"),
                rs.getBoolean("is_active"),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant());
    }
}
