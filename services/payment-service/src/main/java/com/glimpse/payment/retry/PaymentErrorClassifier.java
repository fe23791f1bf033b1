package com.glimpse.payment.retry;

import com.glimpse.payment.retry.exception.PaymentProviderException;
import com.glimpse.payment.retry.exception.TransientProviderException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Splits processor failures into client errors (never retried) and transient ones.
 * Anything unrecognised is treated as a client error.
 */
public class PaymentErrorClassifier {

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "econnreset", "econnrefused", "etimedout", "enotfound",
            "network", "timeout", "server error", "502", "503", "504");

    private static final int MAX_DEPTH = 16;

    public FailureClass classify(Throwable error) {
        List<Throwable> chain = causeChain(error);

        for (Throwable t : chain) {
            int status = statusCode(t);
            if (status >= 400 && status < 500) {
                return FailureClass.CLIENT;
            }
            if (status >= 500 && status < 600) {
                return FailureClass.TRANSIENT;
            }
        }
        for (Throwable t : chain) {
            if (t instanceof TransientProviderException
                    || t instanceof IOException
                    || t instanceof TimeoutException
                    || t instanceof ResourceAccessException) {
                return FailureClass.TRANSIENT;
            }
        }
        for (Throwable t : chain) {
            String message = t.getMessage();
            if (message == null) {
                continue;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            for (String marker : TRANSIENT_MARKERS) {
                if (lower.contains(marker)) {
                    return FailureClass.TRANSIENT;
                }
            }
        }
        return FailureClass.CLIENT;
    }

    private static int statusCode(Throwable t) {
        if (t instanceof PaymentProviderException p) {
            return p.getStatusCode();
        }
        if (t instanceof RestClientResponseException r) {
            return r.getStatusCode().value();
        }
        return 0;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Throwable current = error;
        while (current != null && chain.size() < MAX_DEPTH && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
