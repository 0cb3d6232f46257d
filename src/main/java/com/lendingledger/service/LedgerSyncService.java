package com.lendingledger.service;

import com.lendingledger.entity.PositionEntity;
import com.lendingledger.entity.RiskParameterHistoryEntity;
import com.lendingledger.event.PositionEvent;
import com.lendingledger.mapper.PositionMapper;
import com.lendingledger.repository.jpa.PositionJpaRepository;
import com.lendingledger.repository.jpa.RiskParameterHistoryJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Write-behind persistence of the ledger's audit trail to H2.
 *
 * <p>The in-memory ledger is the system of record and commits without waiting on the
 * database. Position snapshots (from {@link PositionEvent}s) and risk parameter changes are
 * buffered in bounded queues and flushed in batches on a schedule:
 * <ul>
 *   <li>Position snapshots are upserted by id, so only the latest state of each position
 *       survives in the positions table.</li>
 *   <li>Parameter changes are append-only.</li>
 * </ul>
 *
 * <p>Events are published after the ledger lock is released, so snapshots of one position
 * can arrive out of order. A snapshot whose revision is older than one already accepted for
 * the same position is discarded.
 *
 * <p>When a queue is full the entry is written synchronously rather than dropped. A failed
 * batch is logged and put back on its queue for the next flush.
 */
@Service
public class LedgerSyncService {

    private static final Logger log = LoggerFactory.getLogger(LedgerSyncService.class);

    private static final int POSITION_QUEUE_CAPACITY = 10_000;
    private static final int PARAMETER_QUEUE_CAPACITY = 1_000;
    private static final int MAX_BATCH_SIZE = 500;

    private final BlockingQueue<PositionEntity> positionQueue;
    private final BlockingQueue<RiskParameterHistoryEntity> parameterQueue;

    private final PositionJpaRepository positionJpaRepository;
    private final RiskParameterHistoryJpaRepository riskParameterHistoryJpaRepository;
    private final PositionMapper positionMapper = Mappers.getMapper(PositionMapper.class);

    /** Highest snapshot revision accepted per position id. */
    private final Map<Long, Long> acceptedRevisions = new ConcurrentHashMap<>();

    @Autowired
    public LedgerSyncService(
            PositionJpaRepository positionJpaRepository,
            RiskParameterHistoryJpaRepository riskParameterHistoryJpaRepository) {
        this(positionJpaRepository, riskParameterHistoryJpaRepository, POSITION_QUEUE_CAPACITY, PARAMETER_QUEUE_CAPACITY);
    }

    /** Secondary constructor for tests that need small queue capacities. */
    public LedgerSyncService(
            PositionJpaRepository positionJpaRepository,
            RiskParameterHistoryJpaRepository riskParameterHistoryJpaRepository,
            int positionQueueCapacity,
            int parameterQueueCapacity) {
        this.positionJpaRepository = positionJpaRepository;
        this.riskParameterHistoryJpaRepository = riskParameterHistoryJpaRepository;
        this.positionQueue = new LinkedBlockingQueue<>(positionQueueCapacity);
        this.parameterQueue = new LinkedBlockingQueue<>(parameterQueueCapacity);
    }

    // ---- Queueing ----

    @EventListener
    public void onPositionEvent(PositionEvent event) {
        queuePositionSnapshot(positionMapper.toEntity(event.getPosition()));
    }

    public void queuePositionSnapshot(PositionEntity positionEntity) {
        if (isStale(positionEntity)) {
            log.debug(
                    "Discarding stale snapshot of position {} at revision {}",
                    positionEntity.getId(),
                    positionEntity.getRevision());
            return;
        }
        if (!positionQueue.offer(positionEntity)) {
            log.warn("Position queue full, forcing synchronous write for position {}", positionEntity.getId());
            positionEntity.setSyncedAt(LocalDateTime.now());
            positionJpaRepository.save(positionEntity);
        }
    }

    public void queueParameterChange(RiskParameterHistoryEntity entity) {
        if (!parameterQueue.offer(entity)) {
            log.warn("Parameter change queue full, forcing synchronous write for {}", entity.getParameterName());
            riskParameterHistoryJpaRepository.save(entity);
        }
    }

    // ---- Scheduled flush ----

    @Scheduled(fixedDelayString = "#{@ledgerProperties.persistence.flushIntervalMs}")
    public void flush() {
        flushPositions();
        flushParameterChanges();
    }

    public void flushPositions() {
        List<PositionEntity> batch = new ArrayList<>();
        positionQueue.drainTo(batch, MAX_BATCH_SIZE);
        if (batch.isEmpty()) {
            return;
        }

        LocalDateTime now = LocalDateTime.now();
        batch.forEach(entity -> entity.setSyncedAt(now));
        try {
            positionJpaRepository.saveAll(batch);
            log.debug("Flushed {} position snapshots", batch.size());
        } catch (RuntimeException e) {
            log.error("Failed to flush {} position snapshots, re-queueing", batch.size(), e);
            requeue(batch, positionQueue);
        }
    }

    public void flushParameterChanges() {
        List<RiskParameterHistoryEntity> batch = new ArrayList<>();
        parameterQueue.drainTo(batch, MAX_BATCH_SIZE);
        if (batch.isEmpty()) {
            return;
        }

        try {
            riskParameterHistoryJpaRepository.saveAll(batch);
            log.debug("Flushed {} risk parameter changes", batch.size());
        } catch (RuntimeException e) {
            log.error("Failed to flush {} risk parameter changes, re-queueing", batch.size(), e);
            requeue(batch, parameterQueue);
        }
    }

    public int getPendingPositionCount() {
        return positionQueue.size();
    }

    public int getPendingParameterChangeCount() {
        return parameterQueue.size();
    }

    private boolean isStale(PositionEntity positionEntity) {
        long revision = positionEntity.getRevision();
        long accepted = acceptedRevisions.merge(positionEntity.getId(), revision, Math::max);
        return accepted > revision;
    }

    private <T> void requeue(List<T> batch, BlockingQueue<T> queue) {
        int dropped = 0;
        for (T entity : batch) {
            if (!queue.offer(entity)) {
                dropped++;
            }
        }
        if (dropped > 0) {
            log.error("Audit queue full while re-queueing, {} entries could not be retained", dropped);
        }
    }
}
