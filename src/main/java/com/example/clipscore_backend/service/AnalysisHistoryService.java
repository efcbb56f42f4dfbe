package com.example.clipscore_backend.service;

import com.example.clipscore_backend.config.AnalysisProperties;
import com.example.clipscore_backend.dto.AnalysisReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bounded in-memory log of completed analyses. Entries are never modified; once the capacity is
 * reached the oldest entry is evicted.
 */
@Service
public class AnalysisHistoryService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisHistoryService.class);

    private final Deque<AnalysisReport> entries = new ArrayDeque<>();
    private final int capacity;
    private final int defaultLimit;

    public AnalysisHistoryService(AnalysisProperties properties) {
        this.capacity = Math.max(1, properties.getHistoryCapacity());
        this.defaultLimit = Math.max(1, properties.getHistoryDefaultLimit());
    }

    public synchronized void record(AnalysisReport report) {
        entries.addLast(report);
        while (entries.size() > capacity) {
            AnalysisReport evicted = entries.removeFirst();
            LOGGER.trace("history evicted id={}", evicted.id());
        }
    }

    /**
     * @param limit maximum number of entries; {@code null} selects the configured default.
     * @return newest entries first.
     */
    public synchronized List<AnalysisReport> recent(Integer limit) {
        int n = limit == null ? defaultLimit : Math.max(1, Math.min(capacity, limit));
        List<AnalysisReport> out = new ArrayList<>(Math.min(n, entries.size()));
        Iterator<AnalysisReport> it = entries.descendingIterator();
        while (it.hasNext() && out.size() < n) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized Optional<AnalysisReport> find(UUID id) {
        return entries.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        int removed = entries.size();
        entries.clear();
        LOGGER.info("history cleared removed={}", removed);
    }
}
