package com.example.phoneshop.lisa.service;

import com.example.phoneshop.lisa.model.RankedResult;
import com.example.phoneshop.lisa.retrieval.RetrievalService;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds a side-by-side Markdown table for several products. Each product is retrieved
 * concurrently; a failed lookup becomes an error cell instead of failing the comparison.
 */
@Slf4j
public class ProductComparisonService {

    static final int PER_PRODUCT_TOP_K = 3;
    static final String TOO_FEW = "Vui lòng cung cấp ít nhất hai sản phẩm để so sánh.";
    static final String NOT_FOUND = "Không tìm thấy thông tin.";

    private final RetrievalService retrievalService;

    public ProductComparisonService(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    private record ProductInfo(String name, String content, String imageUrl, boolean found) {
    }

    public Mono<ComparisonReport> compare(List<String> productNames) {
        if (productNames == null || productNames.size() < 2) {
            return Mono.just(new ComparisonReport(TOO_FEW, List.of(), 0));
        }
        return Flux.fromIterable(productNames)
                .flatMapSequential(this::lookup)
                .collectList()
                .map(infos -> report(productNames, infos));
    }

    private Mono<ProductInfo> lookup(String name) {
        return retrievalService.retrieve(name, PER_PRODUCT_TOP_K)
                .map(results -> toInfo(name, results))
                .onErrorResume(e -> {
                    log.error("comparison lookup failed for '{}': {}", name, e.toString());
                    return Mono.just(new ProductInfo(name, "Lỗi khi truy xuất thông tin cho " + name + ".", null, false));
                });
    }

    private static ProductInfo toInfo(String name, List<RankedResult> results) {
        if (results.isEmpty()) {
            return new ProductInfo(name, NOT_FOUND, null, false);
        }
        String content = results.stream()
                .map(r -> r.passage().content())
                .collect(Collectors.joining("\n"));
        return new ProductInfo(name, content, results.get(0).passage().metadata().imageUrl(), true);
    }

    private static ComparisonReport report(List<String> names, List<ProductInfo> infos) {
        String header = "| Tính năng | " + String.join(" | ", names) + " |";
        String separator = "|:--- | " + names.stream().map(n -> ":---").collect(Collectors.joining(" | ")) + " |";
        String row = "| **Thông tin chi tiết** | " + infos.stream()
                .map(i -> cell(i.content()))
                .collect(Collectors.joining(" | ")) + " |";

        List<ComparisonReport.ProductImage> images = new ArrayList<>();
        int found = 0;
        for (ProductInfo info : infos) {
            if (info.found()) {
                found++;
            }
            if (info.imageUrl() != null && !info.imageUrl().isBlank()) {
                images.add(new ComparisonReport.ProductImage(info.name(), info.imageUrl()));
            }
        }
        return new ComparisonReport(String.join("\n", header, separator, row), images, found);
    }

    private static String cell(String content) {
        return content.replace("|", "\\|").replace("\n", "<br>");
    }

    /** Renders the report as generator context: the table followed by the image list. */
    public static String toContext(ComparisonReport report) {
        StringBuilder sb = new StringBuilder(report.table());
        if (!report.images().isEmpty()) {
            sb.append("\n\nHình ảnh sản phẩm:\n");
            for (ComparisonReport.ProductImage img : report.images()) {
                sb.append("- ").append(img.name()).append(": ").append(img.url()).append('\n');
            }
        }
        return sb.toString();
    }
}
