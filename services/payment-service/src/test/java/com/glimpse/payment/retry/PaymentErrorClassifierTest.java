package com.glimpse.payment.retry;

import com.glimpse.payment.retry.exception.PaymentProviderException;
import com.glimpse.payment.retry.exception.TransientProviderException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentErrorClassifierTest {

    private final PaymentErrorClassifier classifier = new PaymentErrorClassifier();

    @Test
    void fourHundredsAreClientErrorsEvenWithTransientWording() {
        assertThat(classifier.classify(new PaymentProviderException(402, "card declined"))).isEqualTo(FailureClass.CLIENT);
        assertThat(classifier.classify(new PaymentProviderException(408, "request timeout"))).isEqualTo(FailureClass.CLIENT);
        assertThat(classifier.classify(HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "bad", null, null, null)))
                .isEqualTo(FailureClass.CLIENT);
    }

    @Test
    void fiveHundredsAndTransportFailuresAreTransient() {
        assertThat(classifier.classify(new PaymentProviderException(503, "unavailable"))).isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "bad gateway", null, null, null)))
                .isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(new ResourceAccessException("I/O error"))).isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(new IllegalStateException("wrapped", new SocketTimeoutException("read"))))
                .isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(new RuntimeException(new TimeoutException()))).isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(new TransientProviderException("provider busy"))).isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(new RuntimeException(new IOException("broken pipe")))).isEqualTo(FailureClass.TRANSIENT);
    }

    @Test
    void messageMarkersAreMatchedCaseInsensitively() {
        assertThat(classifier.classify(new RuntimeException("connect ECONNREFUSED 10.0.0.1"))).isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(new RuntimeException("Network unreachable"))).isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(new RuntimeException("Internal Server Error"))).isEqualTo(FailureClass.TRANSIENT);
        assertThat(classifier.classify(new RuntimeException("upstream returned 504"))).isEqualTo(FailureClass.TRANSIENT);
    }

    @Test
    void unknownFailuresAreNotRetried() {
        assertThat(classifier.classify(new IllegalArgumentException("amount must be positive"))).isEqualTo(FailureClass.CLIENT);
        assertThat(classifier.classify(new NullPointerException())).isEqualTo(FailureClass.CLIENT);
    }
}
