/**
 * Service for tracking thumbnail pipeline metrics
 * Provides counters, gauges, and timers for monitoring
 */

package com.thumbservice.thumbnail_engine.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter alignmentFallbacks;
    private final Counter conversionFailures;
    private final Counter storageErrors;

    // Gauges
    private final AtomicInteger activeGenerations = new AtomicInteger(0);

    // Timers
    private final Timer conversionTimer;
    private final Timer uploadTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.cacheHits = Counter.builder("thumbnails.cache.hits")
            .description("Thumbnails served from object storage without regeneration")
            .register(meterRegistry);

        this.cacheMisses = Counter.builder("thumbnails.cache.misses")
            .description("Thumbnails that had to be generated")
            .register(meterRegistry);

        this.alignmentFallbacks = Counter.builder("thumbnails.alignment.fallbacks")
            .description("Color thumbnails generated from unaligned frames")
            .register(meterRegistry);

        this.conversionFailures = Counter.builder("thumbnails.conversion.failures")
            .description("Number of failed FITS to JPEG conversions")
            .register(meterRegistry);

        this.storageErrors = Counter.builder("s3.errors")
            .description("Number of S3 operation errors")
            .register(meterRegistry);

        Gauge.builder("thumbnails.generations.active", activeGenerations, AtomicInteger::get)
            .description("Thumbnail generations currently in progress")
            .register(meterRegistry);

        this.conversionTimer = Timer.builder("thumbnails.conversion.duration")
            .description("FITS to JPEG conversion duration")
            .register(meterRegistry);

        this.uploadTimer = Timer.builder("s3.operation.duration")
            .description("S3 upload duration")
            .register(meterRegistry);
    }

    // Counter methods
    public void incrementCacheHit() {
        cacheHits.increment();
    }

    public void incrementCacheMiss() {
        cacheMisses.increment();
    }

    public void incrementAlignmentFallback() {
        alignmentFallbacks.increment();
    }

    public void incrementConversionFailure() {
        conversionFailures.increment();
    }

    public void incrementStorageError() {
        storageErrors.increment();
    }

    // Gauge methods
    public void incrementActiveGenerations() {
        activeGenerations.incrementAndGet();
    }

    public void decrementActiveGenerations() {
        activeGenerations.decrementAndGet();
    }

    // Timer methods
    public Timer.Sample startConversionTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopConversionTimer(Timer.Sample sample) {
        sample.stop(conversionTimer);
    }

    public Timer.Sample startUploadTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopUploadTimer(Timer.Sample sample) {
        sample.stop(uploadTimer);
    }
}
