package com.shoptalk.catalog.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoptalk.catalog.config.CatalogConfig;
import com.shoptalk.catalog.exception.CatalogException;
import com.shoptalk.catalog.model.Product;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.http.HttpStatus;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileCatalogDataProviderTest {

    private JsonFileCatalogDataProvider providerFor(String location) {
        CatalogConfig config = new CatalogConfig();
        config.setSource(location);
        return new JsonFileCatalogDataProvider(new DefaultResourceLoader(), new ObjectMapper(), config);
    }

    @Test
    void loadsValidRecordsAndSkipsInvalidOnes() {
        List<Product> products = providerFor("classpath:catalog/test-products.json").fetchAll();

        assertThat(products).extracting(Product::getId).containsExactly("p-100", "p-101", "p-102");

        Product chair = products.get(0);
        assertThat(chair.getPrice()).isEqualByComparingTo(new BigDecimal("129.95"));
        assertThat(chair.colorTags()).containsExactly("black");
        assertThat(chair.isInStock()).isTrue();
    }

    @Test
    void availabilityFallsBackToInventory() {
        List<Product> products = providerFor("classpath:catalog/test-products.json").fetchAll();

        assertThat(products.get(1).isInStock()).isFalse();
        assertThat(products.get(1).getTags()).containsExactly("Color_Brown");
        assertThat(products.get(2).getTags()).isEmpty();
    }

    @Test
    void skuStandsInForMissingId() {
        List<Product> products = providerFor("classpath:catalog/sku-only-products.json").fetchAll();

        assertThat(products).extracting(Product::getId).containsExactly("SKU-1", "p-200");
        assertThat(products.get(0).getSku()).isEqualTo("SKU-1");
        assertThat(products.get(0).isInStock()).isTrue();
    }

    @Test
    void missingSourceIsFatal() {
        JsonFileCatalogDataProvider provider = providerFor("classpath:catalog/does-not-exist.json");

        assertThatThrownBy(provider::fetchAll)
                .isInstanceOf(CatalogException.class)
                .satisfies(ex -> {
                    CatalogException catalogException = (CatalogException) ex;
                    assertThat(catalogException.getErrorCode()).isEqualTo("CATALOG_SOURCE_UNAVAILABLE");
                    assertThat(catalogException.getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
                });
    }

    @Test
    void malformedSourceIsFatal() {
        JsonFileCatalogDataProvider provider = providerFor("classpath:catalog/malformed.json");

        assertThatThrownBy(provider::fetchAll)
                .isInstanceOf(CatalogException.class)
                .extracting(ex -> ((CatalogException) ex).getErrorCode())
                .isEqualTo("CATALOG_SOURCE_UNREADABLE");
    }
}
