package com.lendingledger.ledger;

import com.lendingledger.domain.enums.LiquidationIndexPolicy;
import com.lendingledger.domain.model.Position;
import com.lendingledger.domain.model.RiskParameters;
import com.lendingledger.engine.LedgerMath;
import com.lendingledger.exception.ErrorCode;
import com.lendingledger.exception.LedgerException;
import com.lendingledger.exception.ResourceNotFoundException;
import com.lendingledger.exception.UnauthorizedException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The complete mutable state of one ledger: initialization flag, risk parameters, oracle
 * quotes, positions, the per-borrower active index and the protocol aggregates.
 *
 * <p>Not thread-safe. Every access goes through {@link LedgerStateStore}, which serializes
 * writers, so an operation sees and leaves a consistent state. Operations check all of their
 * preconditions before the first mutation; the mutators here assume those checks passed.
 */
public class LedgerState {

    private final String administrator;
    private final Set<String> recognizedAssets;

    private boolean initialized;
    private RiskParameters riskParameters;

    private final Map<String, Long> prices = new HashMap<>();

    /** Insertion-ordered, so iteration follows id order. */
    private final Map<Long, Position> positions = new LinkedHashMap<>();

    private final Map<String, List<Long>> userIndex = new HashMap<>();
    private final Map<String, Long> collateralBalances = new HashMap<>();

    private long lastPositionId;
    private long totalCollateralLocked;
    private long totalCollateralDeposited;
    private long totalPositionsIssued;

    public LedgerState(String administrator, Collection<String> recognizedAssets, RiskParameters initialParameters) {
        if (administrator == null || administrator.isBlank()) {
            throw new IllegalArgumentException("administrator identity is required");
        }
        this.administrator = administrator;
        Set<String> normalized = new LinkedHashSet<>();
        recognizedAssets.forEach(asset -> normalized.add(normalizeAsset(asset)));
        this.recognizedAssets = Collections.unmodifiableSet(normalized);
        this.riskParameters = initialParameters.toBuilder().initialized(false).build();
    }

    // ---- Guards ----

    public String getAdministrator() {
        return administrator;
    }

    public boolean isAdministrator(String caller) {
        return administrator.equals(caller);
    }

    public void requireAdministrator(String caller) {
        if (!isAdministrator(caller)) {
            throw UnauthorizedException.notAdministrator(caller);
        }
    }

    /** Every mutating operation is attributed to a non-blank caller identity. */
    public static String requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw UnauthorizedException.missingCaller();
        }
        return caller;
    }

    public void requireInitialized() {
        if (!initialized) {
            throw new LedgerException(ErrorCode.NOT_INITIALIZED, "Ledger has not been initialized");
        }
    }

    public boolean isInitialized() {
        return initialized;
    }

    public void markInitialized() {
        this.initialized = true;
    }

    // ---- Risk parameters ----

    public RiskParameters getRiskParameters() {
        return riskParameters.toBuilder().initialized(initialized).build();
    }

    public void setRiskParameters(RiskParameters riskParameters) {
        this.riskParameters = riskParameters.toBuilder().build();
    }

    // ---- Oracle ----

    public Set<String> getRecognizedAssets() {
        return recognizedAssets;
    }

    /**
     * Returns the canonical symbol for a recognized asset.
     *
     * @throws LedgerException INVALID_ASSET if the symbol is not one of the recognized pair
     */
    public String requireRecognizedAsset(String asset) {
        String symbol = asset == null ? "" : normalizeAsset(asset);
        if (!recognizedAssets.contains(symbol)) {
            throw new LedgerException(
                    ErrorCode.INVALID_ASSET,
                    "Unrecognized asset: " + asset,
                    Map.of("recognizedAssets", List.copyOf(recognizedAssets)));
        }
        return symbol;
    }

    public Optional<Long> findPrice(String asset) {
        return Optional.ofNullable(prices.get(asset));
    }

    /** @throws LedgerException NOT_INITIALIZED if no quote has been published for the asset */
    public long requirePrice(String asset) {
        return findPrice(asset)
                .orElseThrow(() -> new LedgerException(
                        ErrorCode.NOT_INITIALIZED, "No price has been set for asset " + asset));
    }

    public void putPrice(String asset, long price) {
        prices.put(asset, price);
    }

    // ---- Positions ----

    public Optional<Position> findPosition(long id) {
        return Optional.ofNullable(positions.get(id));
    }

    /**
     * Live (mutable) position for the given id.
     *
     * @throws LedgerException INVALID_LOAN_ID for non-positive ids
     * @throws ResourceNotFoundException if no position was ever issued under the id
     */
    public Position requirePosition(long id) {
        if (id <= 0) {
            throw new LedgerException(ErrorCode.INVALID_LOAN_ID, "Position id must be positive: " + id);
        }
        Position position = positions.get(id);
        if (position == null) {
            throw new ResourceNotFoundException(id);
        }
        return position;
    }

    public List<Position> getActivePositions() {
        List<Position> active = new ArrayList<>();
        for (Position position : positions.values()) {
            if (position.isActive()) {
                active.add(position);
            }
        }
        return active;
    }

    public long nextPositionId() {
        return LedgerMath.add(lastPositionId, 1);
    }

    public void insertPosition(Position position) {
        positions.put(position.getId(), position);
        lastPositionId = position.getId();
    }

    // ---- User index ----

    public List<Long> getUserPositionIds(String user) {
        List<Long> ids = userIndex.get(user);
        return ids == null ? List.of() : List.copyOf(ids);
    }

    public void appendToUserIndex(String user, long positionId) {
        userIndex.computeIfAbsent(user, key -> new ArrayList<>()).add(positionId);
    }

    public void removeFromUserIndex(String user, long positionId, LiquidationIndexPolicy policy) {
        if (policy == LiquidationIndexPolicy.CLEAR_ALL) {
            userIndex.remove(user);
            return;
        }
        List<Long> ids = userIndex.get(user);
        if (ids == null) {
            return;
        }
        ids.remove(Long.valueOf(positionId));
        if (ids.isEmpty()) {
            userIndex.remove(user);
        }
    }

    // ---- Aggregates ----

    public long getTotalCollateralLocked() {
        return totalCollateralLocked;
    }

    public void setTotalCollateralLocked(long totalCollateralLocked) {
        this.totalCollateralLocked = totalCollateralLocked;
    }

    public long getTotalCollateralDeposited() {
        return totalCollateralDeposited;
    }

    public void setTotalCollateralDeposited(long totalCollateralDeposited) {
        this.totalCollateralDeposited = totalCollateralDeposited;
    }

    public long getTotalPositionsIssued() {
        return totalPositionsIssued;
    }

    public void setTotalPositionsIssued(long totalPositionsIssued) {
        this.totalPositionsIssued = totalPositionsIssued;
    }

    public long getCollateralBalance(String user) {
        return collateralBalances.getOrDefault(user, 0L);
    }

    public void setCollateralBalance(String user, long balance) {
        collateralBalances.put(user, balance);
    }

    private static String normalizeAsset(String asset) {
        return asset.trim().toUpperCase(Locale.ROOT);
    }
}
