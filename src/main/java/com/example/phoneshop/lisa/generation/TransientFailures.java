package com.example.phoneshop.lisa.generation;

import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.RateLimitException;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether an upstream failure is worth retrying: overload, rate limiting and timeouts
 * are; authentication, validation and programming errors are not.
 */
public final class TransientFailures {

    private TransientFailures() {
    }

    public static boolean isTransient(Throwable t) {
        Throwable cur = t;
        int hops = 0;
        while (cur != null && hops++ < 20) {
            if (cur instanceof TimeoutException
                    || cur instanceof InternalServerException
                    || cur instanceof RateLimitException) {
                return true;
            }
            if (cur instanceof HttpException he) {
                int sc = he.statusCode();
                return sc == 429 || (sc >= 500 && sc <= 599);
            }
            String msg = cur.getMessage();
            if (msg != null) {
                String l = msg.toLowerCase(Locale.ROOT);
                if (l.contains("503") || l.contains("unavailable") || l.contains("overloaded")) {
                    return true;
                }
            }
            Throwable next = cur.getCause();
            if (next == cur) {
                break;
            }
            cur = next;
        }
        return false;
    }
}
