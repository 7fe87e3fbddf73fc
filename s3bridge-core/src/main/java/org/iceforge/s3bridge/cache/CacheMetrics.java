package org.iceforge.s3bridge.cache;

public interface CacheMetrics {
    long hits();
    long misses();
    long refreshes();
    long refreshFailures();
}
