package com.example.phoneshop.lisa.service;

import java.util.List;

/**
 * @param foundCount products for which at least one passage was retrieved
 */
public record ComparisonReport(String table, List<ProductImage> images, int foundCount) {

    public record ProductImage(String name, String url) {
    }
}
