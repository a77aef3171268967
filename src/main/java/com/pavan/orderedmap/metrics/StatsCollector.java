package com.pavan.orderedmap.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects operation counters for an ordered map.
 * Thread-safe using atomic counters, so recording never takes the map's lock.
 */
public class StatsCollector {
    
    // Read counters
    private final AtomicLong totalGets;
    private final AtomicLong hits;
    private final AtomicLong misses;
    
    // Write counters
    private final AtomicLong inserts;
    private final AtomicLong updates;
    private final AtomicLong totalDeletes;
    private final AtomicLong removals;
    
    private final long startTime;
    
    public StatsCollector() {
        this.totalGets = new AtomicLong(0);
        this.hits = new AtomicLong(0);
        this.misses = new AtomicLong(0);
        this.inserts = new AtomicLong(0);
        this.updates = new AtomicLong(0);
        this.totalDeletes = new AtomicLong(0);
        this.removals = new AtomicLong(0);
        this.startTime = System.currentTimeMillis();
    }
    
    // Operation recording methods
    
    public void recordGet(boolean hit) {
        totalGets.incrementAndGet();
        if (hit) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
    }
    
    public void recordSet(boolean wasNew) {
        if (wasNew) {
            inserts.incrementAndGet();
        } else {
            updates.incrementAndGet();
        }
    }
    
    public void recordDelete(boolean existed) {
        totalDeletes.incrementAndGet();
        if (existed) {
            removals.incrementAndGet();
        }
    }
    
    // Getter methods
    
    public long getTotalGets() {
        return totalGets.get();
    }
    
    public long getHits() {
        return hits.get();
    }
    
    public long getMisses() {
        return misses.get();
    }
    
    public long getTotalSets() {
        return inserts.get() + updates.get();
    }
    
    public long getInserts() {
        return inserts.get();
    }
    
    public long getUpdates() {
        return updates.get();
    }
    
    public long getTotalDeletes() {
        return totalDeletes.get();
    }
    
    public long getRemovals() {
        return removals.get();
    }
    
    public long getTotalOperations() {
        return getTotalGets() + getTotalSets() + getTotalDeletes();
    }
    
    public double getHitRate() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }
    
    public long getUptimeMillis() {
        return System.currentTimeMillis() - startTime;
    }
    
    /**
     * Returns a snapshot of current statistics.
     */
    public StatsSnapshot getSnapshot() {
        return new StatsSnapshot(
            totalGets.get(),
            hits.get(),
            misses.get(),
            inserts.get(),
            updates.get(),
            totalDeletes.get(),
            removals.get(),
            getUptimeMillis()
        );
    }
    
    /**
     * Resets all statistics counters.
     */
    public void reset() {
        totalGets.set(0);
        hits.set(0);
        misses.set(0);
        inserts.set(0);
        updates.set(0);
        totalDeletes.set(0);
        removals.set(0);
    }
    
    /**
     * Merges statistics from another collector into this one.
     * Useful for aggregating over several maps.
     */
    public void merge(StatsCollector other) {
        totalGets.addAndGet(other.totalGets.get());
        hits.addAndGet(other.hits.get());
        misses.addAndGet(other.misses.get());
        inserts.addAndGet(other.inserts.get());
        updates.addAndGet(other.updates.get());
        totalDeletes.addAndGet(other.totalDeletes.get());
        removals.addAndGet(other.removals.get());
    }
    
    @Override
    public String toString() {
        return String.format(
            "StatsCollector{gets=%d, hits=%d, misses=%d, hitRate=%.2f%%, " +
            "inserts=%d, updates=%d, deletes=%d, removals=%d, uptime=%dms}",
            totalGets.get(), hits.get(), misses.get(), getHitRate() * 100,
            inserts.get(), updates.get(), totalDeletes.get(), removals.get(),
            getUptimeMillis()
        );
    }
    
    /**
     * Immutable snapshot of statistics at a point in time.
     */
    public static class StatsSnapshot {
        public final long totalGets;
        public final long hits;
        public final long misses;
        public final long inserts;
        public final long updates;
        public final long totalDeletes;
        public final long removals;
        public final long uptimeMillis;
        
        public StatsSnapshot(long totalGets, long hits, long misses, long inserts,
                           long updates, long totalDeletes, long removals,
                           long uptimeMillis) {
            this.totalGets = totalGets;
            this.hits = hits;
            this.misses = misses;
            this.inserts = inserts;
            this.updates = updates;
            this.totalDeletes = totalDeletes;
            this.removals = removals;
            this.uptimeMillis = uptimeMillis;
        }
        
        public long getTotalOperations() {
            return totalGets + inserts + updates + totalDeletes;
        }
        
        public double getHitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }
        
        @Override
        public String toString() {
            return String.format(
                "StatsSnapshot{operations=%d, hitRate=%.2f%%, inserts=%d, updates=%d, " +
                "removals=%d, uptime=%dms}",
                getTotalOperations(), getHitRate() * 100, inserts, updates,
                removals, uptimeMillis
            );
        }
    }
}
