package exception;

/**
 * 错误码：code = http_status * 1000 + subcode
 */
public enum ErrorCode {
    LOCK_UNAVAILABLE(409101),
    LOCK_NOT_OWNED(409102),
    CONFLICT_REJECTED(409103),
    INVALID_RESOLUTION(500101);

    private final int code;

    ErrorCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public int getHttpStatus() {
        return code / 1000;
    }
}
