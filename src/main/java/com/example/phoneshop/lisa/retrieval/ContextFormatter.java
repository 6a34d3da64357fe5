package com.example.phoneshop.lisa.retrieval;

import com.example.phoneshop.lisa.model.PassageMetadata;
import com.example.phoneshop.lisa.model.RankedResult;

import java.util.List;
import java.util.stream.Collectors;

/** Renders ranked passages as the plain-text context block handed to the generator. */
public final class ContextFormatter {

    public static final String NO_RESULTS =
            "Không tìm thấy thông tin sản phẩm phù hợp trong cửa hàng.";
    public static final String RETRIEVAL_UNAVAILABLE =
            "Xin lỗi, hệ thống tra cứu sản phẩm đang gặp sự cố nên hiện chưa có thông tin sản phẩm.";

    private static final String SEPARATOR = "\n\n---\n\n";

    private ContextFormatter() {
    }

    public static String format(List<RankedResult> results) {
        if (results == null || results.isEmpty()) {
            return NO_RESULTS;
        }
        return results.stream()
                .map(ContextFormatter::entry)
                .collect(Collectors.joining(SEPARATOR));
    }

    private static String entry(RankedResult r) {
        PassageMetadata m = r.passage().metadata();
        return "Source: " + orNa(m.title()) + "\n"
                + "URL: " + orNa(m.url()) + "\n"
                + "Price: " + orNa(m.price()) + "\n"
                + "Content: " + r.passage().content();
    }

    private static String orNa(String v) {
        return v == null || v.isBlank() ? "N/A" : v;
    }
}
