package com.dealengine.evidence;

import com.dealengine.activation.Activation;
import com.dealengine.activation.ActivationService;
import com.dealengine.common.IdempotencyKeys;
import com.dealengine.condition.Condition;
import com.dealengine.game.GameFact;
import com.dealengine.security.AccessGuard;
import com.dealengine.security.Permission;
import com.dealengine.security.PrincipalBinding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Service for the write-once evidence store.
 *
 * Payloads are serialized to canonical JSON (keys sorted at every level) and
 * addressed by the SHA-256 of that form. Storing identical content twice returns
 * the first record.
 */
@Service
@Slf4j
public class EvidenceService {

    public static final String KIND_TRIGGER = "TRIGGER";
    public static final String KIND_FORCE_TRIGGER = "FORCE_TRIGGER";
    public static final String KIND_REVERSAL = "REVERSAL";

    private final EvidenceRepository evidenceRepository;
    private final ActivationService activationService;
    private final AccessGuard accessGuard;
    private final ObjectMapper canonicalMapper;

    public EvidenceService(EvidenceRepository evidenceRepository,
                           ActivationService activationService,
                           AccessGuard accessGuard) {
        this.evidenceRepository = evidenceRepository;
        this.activationService = activationService;
        this.accessGuard = accessGuard;
        this.canonicalMapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();
    }

    /**
     * Attach evidence to an existing activation on behalf of a principal.
     *
     * @throws com.dealengine.common.exception.PermissionDeniedException without WRITE_EVIDENCE
     * @throws com.dealengine.common.exception.ActivationNotFoundException if the activation is unknown
     */
    public EvidenceRecord store(PrincipalBinding actor, String activationKey, String kind,
                                Map<String, Object> payload) {
        accessGuard.require(actor, Permission.WRITE_EVIDENCE, activationKey);
        activationService.getActivation(activationKey);
        return save(activationKey, kind, payload, actor.getPrincipalId());
    }

    /**
     * Snapshot of the fact and condition that caused an automatic trigger.
     */
    public EvidenceRecord recordTrigger(Activation activation, Condition condition, GameFact fact) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("activationKey", activation.getActivationKey());
        payload.put("dealId", activation.getDealId());
        payload.put("gameId", activation.getGameId());
        payload.put("triggeredAt", String.valueOf(activation.getTriggeredAt()));
        payload.put("expiresAt", String.valueOf(activation.getExpiresAt()));
        payload.put("condition", condition.getNormalizedSource());
        payload.put("conditionSignature", condition.getSignature());
        payload.put("predicate", condition.getPredicate().describe());
        payload.put("fact", factSnapshot(fact));
        return save(activation.getActivationKey(), KIND_TRIGGER, payload, PrincipalBinding.SYSTEM_PRINCIPAL_ID);
    }

    /**
     * Record a manual override (forced trigger or reversal) and who made it.
     */
    public EvidenceRecord recordOverride(PrincipalBinding actor, Activation activation, String kind, String reason) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("activationKey", activation.getActivationKey());
        payload.put("dealId", activation.getDealId());
        payload.put("gameId", activation.getGameId());
        payload.put("status", activation.getStatus().name());
        payload.put("actor", actor.getPrincipalId());
        payload.put("role", actor.getRole().name());
        payload.put("reason", reason);
        payload.put("updatedAt", String.valueOf(activation.getUpdatedAt()));
        return save(activation.getActivationKey(), kind, payload, actor.getPrincipalId());
    }

    @Transactional(readOnly = true)
    public List<EvidenceRecord> listForActivation(PrincipalBinding actor, String activationKey) {
        accessGuard.require(actor, Permission.READ_EVIDENCE, activationKey);
        return evidenceRepository.findByActivationKeyOrderByStoredAtAsc(activationKey);
    }

    @Transactional(readOnly = true)
    public Optional<EvidenceRecord> find(PrincipalBinding actor, String evidenceKey) {
        accessGuard.require(actor, Permission.READ_EVIDENCE, evidenceKey);
        return evidenceRepository.findByEvidenceKey(evidenceKey);
    }

    /**
     * Canonical JSON of a payload: map keys sorted at every level, no whitespace.
     */
    public String canonicalize(Map<String, Object> payload) {
        try {
            return canonicalMapper.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Evidence payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private EvidenceRecord save(String activationKey, String kind, Map<String, Object> payload, String storedBy) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Evidence kind is required");
        }
        Map<String, Object> envelope = new TreeMap<>();
        envelope.put("activationKey", activationKey);
        envelope.put("kind", kind);
        envelope.put("payload", payload == null ? Map.of() : payload);

        String canonical = canonicalize(envelope);
        String hash = IdempotencyKeys.sha256Hex(canonical);
        String evidenceKey = IdempotencyKeys.keyFor(hash);

        Optional<EvidenceRecord> existing = evidenceRepository.findByEvidenceKey(evidenceKey);
        if (existing.isPresent()) {
            log.info("Duplicate evidence {} for activation {}", evidenceKey, activationKey);
            return existing.get();
        }

        EvidenceRecord record = new EvidenceRecord(evidenceKey, hash, activationKey, kind, canonical,
            canonical.getBytes(StandardCharsets.UTF_8).length, storedBy);
        try {
            evidenceRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            // Same content stored concurrently
            return evidenceRepository.findByEvidenceKey(evidenceKey).orElseThrow(() -> e);
        }

        log.info("Stored {} evidence {} for activation {} ({} bytes, by {})",
            kind, evidenceKey, activationKey, record.getSizeBytes(), storedBy);
        return record;
    }

    private static Map<String, Object> factSnapshot(GameFact fact) {
        Map<String, Object> snapshot = new TreeMap<>();
        snapshot.put("gameId", fact.getGameId());
        snapshot.put("teamId", fact.getTeamId());
        snapshot.put(GameFact.IS_HOME, fact.isHome());
        snapshot.put(GameFact.IS_COMPLETE, fact.isComplete());
        snapshot.put(GameFact.TEAM_SCORE, fact.getTeamScore());
        snapshot.put(GameFact.OPPONENT_SCORE, fact.getOpponentScore());
        snapshot.put("countedStats", new TreeMap<>(fact.getCountedStats()));
        return snapshot;
    }
}
