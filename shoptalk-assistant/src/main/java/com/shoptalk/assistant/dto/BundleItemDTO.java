package com.shoptalk.assistant.dto;

import com.shoptalk.assistant.bundle.BundleLine;
import com.shoptalk.catalog.dto.ProductDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BundleItemDTO {

    private String itemType;
    private ProductDTO product;
    private BigDecimal unitPrice;
    private Integer quantity;
    private BigDecimal lineTotal;
    private Boolean required;

    public static BundleItemDTO fromLine(BundleLine line) {
        return BundleItemDTO.builder()
                .itemType(line.getItemType())
                .product(ProductDTO.fromEntity(line.getProduct()))
                .unitPrice(line.getUnitPrice())
                .quantity(line.getQuantity())
                .lineTotal(line.getLineTotal())
                .required(line.isRequired())
                .build();
    }
}
