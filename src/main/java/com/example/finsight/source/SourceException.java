package com.example.finsight.source;

/**
 * 원천 어댑터 실패. 호출자에게 직접 노출되지 않고 라우터가 집계 오류로 바꾼다.
 */
public class SourceException extends RuntimeException {

    public enum Reason {
        NOT_FOUND(false),
        /** 네트워크, 5xx, 타임아웃 */
        UNAVAILABLE(true),
        RATE_LIMITED(true),
        MALFORMED(false);

        private final boolean retryable;

        Reason(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final String sourceId;
    private final Reason reason;

    public SourceException(String sourceId, Reason reason, String message) {
        super(message);
        this.sourceId = sourceId;
        this.reason = reason;
    }

    public SourceException(String sourceId, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
        this.reason = reason;
    }

    public static SourceException notFound(String sourceId, String message) {
        return new SourceException(sourceId, Reason.NOT_FOUND, message);
    }

    public static SourceException malformed(String sourceId, String message) {
        return new SourceException(sourceId, Reason.MALFORMED, message);
    }

    public String getSourceId() {
        return sourceId;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return reason.isRetryable();
    }
}
