package com.demo.multisig.repository;

import com.demo.multisig.model.Proposal;
import com.demo.multisig.model.ProposalMetadata;
import com.demo.multisig.model.ProposalSignature;
import com.demo.multisig.model.ProposalStatus;
import com.demo.multisig.model.SignatureMetadata;
import com.demo.multisig.model.ValidatorKind;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.demo.multisig.repository.JdbcValidatorRepository.instant;
import static com.demo.multisig.repository.JdbcValidatorRepository.ts;

@Repository
@RequiredArgsConstructor
public class JdbcProposalRepository implements ProposalRepository {

    private static final String COLUMNS = """
            p.id, p.created_by, p.to_address, p.amount_eth, p.call_data, p.required_signatures, p.status,
            p.created_at, p.expires_at, p.executed_at, p.transaction_hash, p.metadata""";

    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate named;
    private final JsonColumns json;

    @Override
    @Transactional
    public void insert(Proposal p) {
        jdbc.update("""
                INSERT INTO proposals (id, created_by, to_address, amount_eth, call_data, required_signatures,
                                       status, created_at, expires_at, executed_at, transaction_hash, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                p.getId(), p.getCreatedBy(), p.getTo(), p.getValue(), p.getData(), p.getRequiredSignatures(),
                p.getStatus().wire(), ts(p.getCreatedAt()), ts(p.getExpiresAt()), ts(p.getExecutedAt()),
                p.getTransactionHash(), json.write(p.getMetadata()));

        List<Object[]> rows = new ArrayList<>();
        List<String> ids = p.getValidatorIds();
        for (int i = 0; i < ids.size(); i++) {
            rows.add(new Object[]{p.getId(), ids.get(i), i});
        }
        jdbc.batchUpdate("INSERT INTO proposal_validators (proposal_id, validator_id, seq) VALUES (?, ?, ?)", rows);
    }

    @Override
    public Optional<Proposal> findById(String proposalId) {
        List<Proposal.ProposalBuilder> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM proposals p WHERE p.id = ?", rm(), proposalId);
        return hydrate(rows).stream().findFirst();
    }

    @Override
    public List<Proposal> findForUser(String userId, Set<String> validatorIds, ProposalQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("limit", query.limit())
                .addValue("offset", query.offset());

        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM proposals p WHERE (p.created_by = :userId");
        if (validatorIds != null && !validatorIds.isEmpty()) {
            sql.append(" OR EXISTS (SELECT 1 FROM proposal_validators pv")
               .append(" WHERE pv.proposal_id = p.id AND pv.validator_id IN (:validatorIds))");
            params.addValue("validatorIds", validatorIds);
        }
        sql.append(")");
        if (query.status() != null) {
            sql.append(" AND p.status = :status");
            params.addValue("status", query.status().wire());
        }
        sql.append(" ORDER BY p.created_at DESC, p.id LIMIT :limit OFFSET :offset");

        return hydrate(named.query(sql.toString(), params, rm()));
    }

    @Override
    public void appendSignature(String proposalId, ProposalSignature s, int position) {
        jdbc.update("""
                INSERT INTO proposal_signatures (proposal_id, validator_id, seq, signature, signer_type,
                                                 signed_at, signed_by, metadata)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """,
                proposalId, s.validatorId(), position, s.signature(), s.signerType().wire(),
                ts(s.signedAt()), s.signedBy(), json.write(s.metadata()));
    }

    @Override
    public void updateResolution(Proposal p) {
        jdbc.update("""
                UPDATE proposals
                SET status = ?, executed_at = ?, transaction_hash = ?, metadata = ?
                WHERE id = ?
                """,
                p.getStatus().wire(), ts(p.getExecutedAt()), p.getTransactionHash(),
                json.write(p.getMetadata()), p.getId());
    }

    @Override
    public List<String> findExpiredPendingIds(Instant now) {
        return jdbc.queryForList(
                "SELECT id FROM proposals WHERE status = ? AND expires_at < ? ORDER BY expires_at",
                String.class, ProposalStatus.PENDING.wire(), ts(now));
    }

    // Loads eligible validators and signatures for all rows in two queries.
    private List<Proposal> hydrate(List<Proposal.ProposalBuilder> rows) {
        if (rows.isEmpty()) return List.of();
        Map<String, Proposal.ProposalBuilder> byId = new LinkedHashMap<>();
        for (Proposal.ProposalBuilder b : rows) {
            byId.put(b.build().getId(), b);
        }
        MapSqlParameterSource ids = new MapSqlParameterSource("ids", byId.keySet());

        Map<String, List<String>> validators = new LinkedHashMap<>();
        named.query("SELECT proposal_id, validator_id FROM proposal_validators WHERE proposal_id IN (:ids) ORDER BY seq",
                ids, rs -> {
                    validators.computeIfAbsent(rs.getString("proposal_id"), k -> new ArrayList<>())
                            .add(rs.getString("validator_id"));
                });

        Map<String, List<ProposalSignature>> signatures = new LinkedHashMap<>();
        named.query("""
                SELECT proposal_id, validator_id, signature, signer_type, signed_at, signed_by, metadata
                FROM proposal_signatures WHERE proposal_id IN (:ids) ORDER BY seq
                """, ids, rs -> {
                    signatures.computeIfAbsent(rs.getString("proposal_id"), k -> new ArrayList<>())
                            .add(new ProposalSignature(
                                    rs.getString("validator_id"),
                                    rs.getString("signature"),
                                    ValidatorKind.fromWire(rs.getString("signer_type")),
                                    instant(rs.getTimestamp("signed_at")),
                                    rs.getString("signed_by"),
                                    json.read(rs.getString("metadata"), SignatureMetadata.class)));
                });

        List<Proposal> out = new ArrayList<>(byId.size());
        byId.forEach((id, b) -> out.add(b
                .validatorIds(List.copyOf(validators.getOrDefault(id, List.of())))
                .signatures(List.copyOf(signatures.getOrDefault(id, List.of())))
                .build()));
        return out;
    }

    private RowMapper<Proposal.ProposalBuilder> rm() {
        return (rs, i) -> Proposal.builder()
                .id(rs.getString("id"))
                .createdBy(rs.getString("created_by"))
                .to(rs.getString("to_address"))
                .value(rs.getBigDecimal("amount_eth").stripTrailingZeros())
                .data(rs.getString("call_data"))
                .requiredSignatures(rs.getInt("required_signatures"))
                .status(ProposalStatus.fromWire(rs.getString("status")))
                .createdAt(instant(rs.getTimestamp("created_at")))
                .expiresAt(instant(rs.getTimestamp("expires_at")))
                .executedAt(instant(rs.getTimestamp("executed_at")))
                .transactionHash(rs.getString("transaction_hash"))
                .metadata(json.read(rs.getString("metadata"), ProposalMetadata.class));
    }
}
