package com.shoptalk.catalog.service;

import com.shoptalk.catalog.CatalogFixtures;
import com.shoptalk.catalog.config.CatalogConfig;
import com.shoptalk.catalog.exception.CatalogException;
import com.shoptalk.catalog.index.IndexSnapshot;
import com.shoptalk.catalog.provider.CatalogDataProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogSyncServiceTest {

    @Mock
    private CatalogDataProvider catalogDataProvider;

    private CatalogIndex catalogIndex;
    private CatalogConfig catalogConfig;
    private CatalogSyncService catalogSyncService;

    @BeforeEach
    void setUp() {
        catalogIndex = new CatalogIndex();
        catalogConfig = new CatalogConfig();
        catalogSyncService = new CatalogSyncService(catalogDataProvider, catalogIndex, catalogConfig);
    }

    @Test
    void rebuildPublishesProviderCatalog() {
        when(catalogDataProvider.fetchAll()).thenReturn(CatalogFixtures.furniture());

        IndexSnapshot snapshot = catalogSyncService.rebuild();

        assertThat(snapshot.size()).isEqualTo(CatalogFixtures.furniture().size());
        assertThat(catalogIndex.isReady()).isTrue();
        assertThat(catalogSyncService.isSyncInProgress()).isFalse();
    }

    @Test
    void providerFailurePropagatesAndKeepsPreviousSnapshot() {
        when(catalogDataProvider.fetchAll())
                .thenReturn(CatalogFixtures.furniture())
                .thenThrow(CatalogException.sourceUnavailable("classpath:catalog/products.json", null));
        IndexSnapshot first = catalogSyncService.rebuild();

        assertThatThrownBy(catalogSyncService::rebuild).isInstanceOf(CatalogException.class);

        assertThat(catalogIndex.snapshot()).containsSame(first);
        assertThat(catalogSyncService.isSyncInProgress()).isFalse();
    }

    @Test
    void startupFailureLeavesCatalogNotReady() {
        when(catalogDataProvider.fetchAll())
                .thenThrow(CatalogException.sourceUnavailable("classpath:catalog/products.json", null));

        catalogSyncService.onApplicationReady();

        assertThat(catalogIndex.isReady()).isFalse();
    }

    @Test
    void startupSyncCanBeDisabled() {
        catalogConfig.setSyncOnStartup(false);

        catalogSyncService.onApplicationReady();

        verify(catalogDataProvider, never()).fetchAll();
    }

    @Test
    void scheduledRefreshIsSkippedWhenDisabled() {
        catalogSyncService.scheduledRefresh();

        verify(catalogDataProvider, never()).fetchAll();
    }

    @Test
    void shutdownReleasesIndex() {
        when(catalogDataProvider.fetchAll()).thenReturn(CatalogFixtures.furniture());
        catalogSyncService.rebuild();

        catalogSyncService.shutdown();

        assertThat(catalogIndex.snapshot()).isEmpty();
    }
}
