package com.shoptalk.catalog.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shoptalk.catalog.config.CatalogConfig;
import com.shoptalk.catalog.dto.CatalogProductJson;
import com.shoptalk.catalog.exception.CatalogException;
import com.shoptalk.catalog.model.Product;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the catalog from a JSON array at a Spring resource location.
 */
@Slf4j
@Component
public class JsonFileCatalogDataProvider implements CatalogDataProvider {

    private static final TypeReference<List<CatalogProductJson>> PRODUCT_LIST = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public JsonFileCatalogDataProvider(ResourceLoader resourceLoader, ObjectMapper objectMapper,
                                       CatalogConfig catalogConfig) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = catalogConfig.getSource();
    }

    @Override
    public List<Product> fetchAll() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw CatalogException.sourceUnavailable(location, null);
        }

        List<CatalogProductJson> records;
        try (InputStream in = resource.getInputStream()) {
            records = objectMapper.readValue(in, PRODUCT_LIST);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse catalog {}: {}", location, e.getOriginalMessage());
            throw CatalogException.sourceUnreadable(location, e);
        } catch (IOException e) {
            log.error("Failed to read catalog {}: {}", location, e.getMessage());
            throw CatalogException.sourceUnavailable(location, e);
        }

        List<Product> products = new ArrayList<>();
        int skipped = 0;
        for (CatalogProductJson record : records) {
            if (record == null || !record.isValid()) {
                skipped++;
                continue;
            }
            products.add(record.toProduct());
        }

        log.info("Loaded catalog from {}: {} products ({} skipped)", location, products.size(), skipped);
        return products;
    }

    @Override
    public String describe() {
        return location;
    }
}
