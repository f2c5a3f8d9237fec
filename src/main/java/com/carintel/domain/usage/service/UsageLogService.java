package com.carintel.domain.usage.service;

import com.carintel.config.VehicleApiProperties;
import com.carintel.domain.usage.entity.UsageRecord;
import com.carintel.domain.usage.repository.UsageLogRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * API 사용 로그 비동기 기록
 *
 * 요청 스레드는 큐에 넣기만 하고, 스케줄러가 주기적으로 일괄 저장.
 * 큐가 가득 차면 기록을 버리고 카운터만 증가
 */
@Slf4j
@Service
public class UsageLogService {

    private final UsageLogRepository usageLogRepository;
    private final BlockingQueue<UsageRecord> queue;
    private final int batchSize;
    private final AtomicLong droppedCount = new AtomicLong();

    public UsageLogService(UsageLogRepository usageLogRepository, VehicleApiProperties properties) {
        this.usageLogRepository = usageLogRepository;
        this.queue = new ArrayBlockingQueue<>(properties.getUsage().getQueueCapacity());
        this.batchSize = properties.getUsage().getBatchSize();
    }

    /**
     * 사용 로그 등록 (블로킹 없음)
     */
    public boolean enqueue(UsageRecord record) {
        boolean accepted = queue.offer(record);
        if (!accepted) {
            long dropped = droppedCount.incrementAndGet();
            if (dropped % 1000 == 1) {
                log.warn("Usage log queue full, dropped {} record(s) so far", dropped);
            }
        }
        return accepted;
    }

    /**
     * 큐에 쌓인 로그 저장
     */
    @Scheduled(fixedDelayString = "${carintel.usage.flush-interval-ms:1000}")
    public void flush() {
        while (true) {
            List<UsageRecord> batch = new ArrayList<>(batchSize);
            if (queue.drainTo(batch, batchSize) == 0) {
                return;
            }
            persist(batch);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Flushing {} pending usage record(s) before shutdown", queue.size());
        flush();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public int getPendingCount() {
        return queue.size();
    }

    private void persist(List<UsageRecord> batch) {
        try {
            usageLogRepository.insertBatch(batch);
            log.debug("Persisted {} usage record(s)", batch.size());
        } catch (Exception e) {
            log.error("Failed to persist {} usage record(s), discarding", batch.size(), e);
        }
    }
}
