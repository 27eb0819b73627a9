package com.example.finsight.source;

import org.springframework.core.codec.DecodingException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

/**
 * WebClient 예외를 SourceException 사유로 분류한다.
 */
public final class SourceErrors {

    private SourceErrors() {}

    public static SourceException classify(String sourceId, Throwable e) {
        if (e instanceof SourceException se) return se;
        if (e instanceof WebClientResponseException w) {
            int code = w.getStatusCode().value();
            if (code == 429) {
                return new SourceException(sourceId, SourceException.Reason.RATE_LIMITED, "HTTP 429", e);
            }
            if (code == 404) {
                return new SourceException(sourceId, SourceException.Reason.NOT_FOUND, "HTTP 404", e);
            }
            if (code >= 500 || code == 403) {
                // 403 은 SEC/Yahoo 의 일시 차단 응답
                return new SourceException(sourceId, SourceException.Reason.UNAVAILABLE, "HTTP " + code, e);
            }
            return new SourceException(sourceId, SourceException.Reason.MALFORMED, "HTTP " + code, e);
        }
        if (e instanceof TimeoutException || e instanceof WebClientRequestException) {
            return new SourceException(sourceId, SourceException.Reason.UNAVAILABLE, e.toString(), e);
        }
        if (e instanceof DecodingException || e instanceof ClassCastException || e instanceof NumberFormatException) {
            return new SourceException(sourceId, SourceException.Reason.MALFORMED, e.toString(), e);
        }
        return new SourceException(sourceId, SourceException.Reason.UNAVAILABLE, e.toString(), e);
    }
}
