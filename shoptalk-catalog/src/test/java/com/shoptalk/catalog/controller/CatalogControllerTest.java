package com.shoptalk.catalog.controller;

import com.shoptalk.catalog.CatalogFixtures;
import com.shoptalk.catalog.config.CatalogConfig;
import com.shoptalk.catalog.exception.CatalogException;
import com.shoptalk.catalog.exception.CatalogExceptionHandler;
import com.shoptalk.catalog.provider.CatalogDataProvider;
import com.shoptalk.catalog.service.CatalogIndex;
import com.shoptalk.catalog.service.CatalogSyncService;
import com.shoptalk.catalog.service.ProductSearcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CatalogControllerTest {

    @Mock
    private CatalogDataProvider catalogDataProvider;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        CatalogIndex catalogIndex = new CatalogIndex();
        CatalogConfig catalogConfig = new CatalogConfig();
        CatalogSyncService syncService = new CatalogSyncService(catalogDataProvider, catalogIndex, catalogConfig);
        ProductSearcher searcher = new ProductSearcher(catalogIndex, catalogConfig);

        mockMvc = MockMvcBuilders
                .standaloneSetup(new CatalogController(syncService, catalogIndex, searcher))
                .setControllerAdvice(new CatalogExceptionHandler())
                .build();
    }

    @Test
    void rebuildThenSearch() throws Exception {
        when(catalogDataProvider.describe()).thenReturn("test");
        when(catalogDataProvider.fetchAll()).thenReturn(CatalogFixtures.furniture());

        mockMvc.perform(post("/api/catalog/rebuild"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.products").value(6));

        mockMvc.perform(get("/api/catalog/search").param("q", "office chair").param("limit", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("found"))
                .andExpect(jsonPath("$.products[0].id").value("artiss-1"));

        mockMvc.perform(get("/api/catalog/status"))
                .andExpect(jsonPath("$.ready").value(true))
                .andExpect(jsonPath("$.generation").value(1));
    }

    @Test
    void searchBeforeSyncReportsNotReady() throws Exception {
        mockMvc.perform(get("/api/catalog/search").param("q", "chair"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("catalog_not_ready"))
                .andExpect(jsonPath("$.products").isEmpty());
    }

    @Test
    void sourceFailureMapsToServiceUnavailable() throws Exception {
        when(catalogDataProvider.describe()).thenReturn("test");
        when(catalogDataProvider.fetchAll())
                .thenThrow(CatalogException.sourceUnavailable("test", null));

        mockMvc.perform(post("/api/catalog/rebuild"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("CATALOG_SOURCE_UNAVAILABLE"));
    }
}
