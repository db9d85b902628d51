package com.shoptalk.catalog.service;

import com.shoptalk.catalog.config.CatalogConfig;
import com.shoptalk.catalog.exception.CatalogException;
import com.shoptalk.catalog.index.IndexSnapshot;
import com.shoptalk.catalog.model.Product;
import com.shoptalk.catalog.provider.CatalogDataProvider;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the catalog lifecycle: initial load, on-demand rebuild, periodic refresh and shutdown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogSyncService {

    private final CatalogDataProvider catalogDataProvider;
    private final CatalogIndex catalogIndex;
    private final CatalogConfig catalogConfig;

    private final AtomicBoolean syncInProgress = new AtomicBoolean(false);

    /**
     * Load the catalog on application startup if configured.
     * A failing source leaves the index not ready instead of aborting startup.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!catalogConfig.isSyncOnStartup()) {
            log.info("Catalog sync on startup disabled");
            return;
        }
        try {
            rebuild();
        } catch (CatalogException e) {
            log.error("Initial catalog sync failed, searches will report catalog not ready: {}", e.getMessage());
        }
    }

    /**
     * Fetch the full catalog and publish a new index snapshot.
     *
     * @throws CatalogException if the source is unavailable or a sync is already running
     */
    public IndexSnapshot rebuild() {
        if (!syncInProgress.compareAndSet(false, true)) {
            log.warn("Catalog sync already in progress, skipping");
            throw CatalogException.syncInProgress();
        }
        try {
            log.info("Starting catalog sync from {}", catalogDataProvider.describe());
            List<Product> products = catalogDataProvider.fetchAll();
            return catalogIndex.rebuild(products);
        } finally {
            syncInProgress.set(false);
        }
    }

    /**
     * Periodic refresh. On failure the previous snapshot stays published.
     */
    @Scheduled(fixedDelayString = "${shoptalk.catalog.refresh.interval-ms:3600000}",
            initialDelayString = "${shoptalk.catalog.refresh.interval-ms:3600000}")
    public void scheduledRefresh() {
        if (!catalogConfig.getRefresh().isEnabled()) {
            return;
        }
        try {
            rebuild();
        } catch (CatalogException e) {
            log.error("Scheduled catalog refresh failed, keeping previous snapshot: {}", e.getMessage());
        }
    }

    public boolean isSyncInProgress() {
        return syncInProgress.get();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down catalog");
        catalogIndex.shutdown();
    }
}
