package com.pocketpilot.budget.service;

import com.pocketpilot.budget.config.PocketPilotProperties;
import com.pocketpilot.budget.model.Transaction;
import com.pocketpilot.budget.repository.TransactionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLongArray;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Per user and month cache of transactions. Entries expire after the configured TTL and are
 * dropped explicitly whenever a transaction in that month changes.
 *
 * <p>Every invalidation bumps a data version shared by the user's stripe. A load that started
 * before an invalidation is returned to its caller but never stored, and callers can compare
 * {@link #version(UUID)} before and after a computation to detect concurrent changes.
 */
@Component
public class MonthlyTransactionCache {

    private static final Logger log = LoggerFactory.getLogger(MonthlyTransactionCache.class);
    private static final int VERSION_STRIPES = 1024;

    private final TransactionRepository transactionRepository;
    private final Duration ttl;
    private final Clock clock;
    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLongArray versions = new AtomicLongArray(VERSION_STRIPES);
    private final AtomicReference<Instant> nextSweep;

    @Autowired
    public MonthlyTransactionCache(TransactionRepository transactionRepository, PocketPilotProperties properties, Clock clock) {
        this(transactionRepository, properties.cache().transactionTtl(), clock);
    }

    MonthlyTransactionCache(TransactionRepository transactionRepository, Duration ttl, Clock clock) {
        this.transactionRepository = transactionRepository;
        this.ttl = ttl;
        this.clock = clock;
        this.nextSweep = new AtomicReference<>(clock.instant().plus(ttl));
    }

    public List<Transaction> get(UUID userId, YearMonth month) {
        Key key = new Key(userId, month);
        Instant now = clock.instant();
        sweepExpired(now);
        Entry cached = entries.get(key);
        if (cached != null && !cached.expiredAt(now, ttl)) {
            return cached.transactions();
        }
        long version = version(userId);
        List<Transaction> loaded = List.copyOf(transactionRepository.findByUserIdAndMonth(userId, month));
        Entry stored = entries.compute(key, (k, existing) -> version(userId) == version ? new Entry(loaded, now) : existing);
        if (stored == null || stored.transactions() != loaded) {
            log.debug("Transactions of user {} month {} changed while loading; not caching", userId, month);
        } else {
            log.debug("Loaded {} transactions for user {} month {}", loaded.size(), userId, month);
        }
        return loaded;
    }

    public void invalidate(UUID userId, YearMonth month) {
        versions.incrementAndGet(stripe(userId));
        entries.remove(new Key(userId, month));
    }

    /**
     * Data version of the user's transactions; changes on every invalidation.
     */
    public long version(UUID userId) {
        return versions.get(stripe(userId));
    }

    int size() {
        return entries.size();
    }

    private void sweepExpired(Instant now) {
        Instant due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(ttl))) {
            return;
        }
        int before = entries.size();
        entries.values().removeIf(entry -> entry.expiredAt(now, ttl));
        log.debug("Swept expired transaction cache entries ({} -> {})", before, entries.size());
    }

    private static int stripe(UUID userId) {
        return Math.floorMod(userId.hashCode(), VERSION_STRIPES);
    }

    private record Key(UUID userId, YearMonth month) {
    }

    private record Entry(List<Transaction> transactions, Instant loadedAt) {
        boolean expiredAt(Instant now, Duration ttl) {
            return !loadedAt.plus(ttl).isAfter(now);
        }
    }
}
