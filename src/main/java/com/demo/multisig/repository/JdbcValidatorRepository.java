package com.demo.multisig.repository;

import com.demo.multisig.model.SigningPolicy;
import com.demo.multisig.model.Validator;
import com.demo.multisig.model.ValidatorKind;
import com.demo.multisig.model.ValidatorMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcValidatorRepository implements ValidatorRepository {

    private static final String COLUMNS = "id, user_id, kind, name, public_key, metadata, created_at, last_used, active";

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;
    private final JsonColumns json;

    @Override
    public Optional<Validator> findById(String validatorId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM validators WHERE id = ?", rm(), validatorId)
                .stream().findFirst();
    }

    @Override
    public List<Validator> findByUser(String userId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM validators WHERE user_id = ? ORDER BY created_at, id",
                rm(), userId);
    }

    @Override
    public List<Validator> findByIds(Collection<String> validatorIds) {
        if (validatorIds == null || validatorIds.isEmpty()) return List.of();
        return named.query("SELECT " + COLUMNS + " FROM validators WHERE id IN (:ids)",
                new MapSqlParameterSource("ids", validatorIds), rm());
    }

    @Override
    public void insert(Validator v) {
        jdbc.update("""
                INSERT INTO validators (id, user_id, kind, name, public_key, metadata, created_at, last_used, active)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                v.getId(), v.getUserId(), v.getKind().wire(), v.getName(), v.getPublicKey(),
                json.write(v.getMetadata(), ValidatorMetadata.class), ts(v.getCreatedAt()), ts(v.getLastUsed()), v.isActive());
    }

    @Override
    public void updateActive(String validatorId, boolean active) {
        jdbc.update("UPDATE validators SET active = ? WHERE id = ?", active, validatorId);
    }

    @Override
    public void touch(String validatorId, Instant lastUsed) {
        jdbc.update("UPDATE validators SET last_used = ? WHERE id = ?", ts(lastUsed), validatorId);
    }

    @Override
    public Optional<SigningPolicy> findPolicy(String userId) {
        String sql = """
            SELECT require_multisig, threshold, high_value_threshold
            FROM signing_policies
            WHERE user_id = ?
        """;
        return jdbc.query(sql, (rs, i) -> new SigningPolicy(
                rs.getBoolean("require_multisig"),
                rs.getInt("threshold"),
                rs.getBigDecimal("high_value_threshold")
        ), userId).stream().findFirst();
    }

    @Override
    public void savePolicy(String userId, SigningPolicy policy) {
        jdbc.update("""
                MERGE INTO signing_policies (user_id, require_multisig, threshold, high_value_threshold)
                KEY (user_id) VALUES (?, ?, ?, ?)
                """,
                userId, policy.requireMultiSig(), policy.threshold(), policy.highValueThreshold());
    }

    private RowMapper<Validator> rm() {
        return (rs, i) -> Validator.builder()
                .id(rs.getString("id"))
                .userId(rs.getString("user_id"))
                .kind(ValidatorKind.fromWire(rs.getString("kind")))
                .name(rs.getString("name"))
                .publicKey(rs.getString("public_key"))
                .metadata(json.read(rs.getString("metadata"), ValidatorMetadata.class))
                .createdAt(instant(rs.getTimestamp("created_at")))
                .lastUsed(instant(rs.getTimestamp("last_used")))
                .active(rs.getBoolean("active"))
                .build();
    }

    static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    static Instant instant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
