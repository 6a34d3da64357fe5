package com.example.phoneshop.lisa.router;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Small-talk patterns answered without asking the model to classify: greetings, thanks,
 * farewells, questions about the assistant and bare acknowledgements.
 */
final class ChatFastPath {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("^\\s*(chào|hi|hello|alo)\\b", FLAGS),
            Pattern.compile("\\b(cảm ơn|thank you|thanks)\\b", FLAGS),
            Pattern.compile("\\b(tạm biệt|bye)\\b", FLAGS),
            Pattern.compile("\\b(bạn là ai|bạn tên gì)\\b", FLAGS),
            Pattern.compile("^\\s*(oke|ok|tuyệt vời|tốt quá)\\s*$", FLAGS)
    );

    private ChatFastPath() {
    }

    static boolean matches(String utterance) {
        if (utterance == null) {
            return false;
        }
        for (Pattern p : PATTERNS) {
            if (p.matcher(utterance).find()) {
                return true;
            }
        }
        return false;
    }
}
