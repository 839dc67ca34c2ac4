package Server.http;

/**
 * JSON error envelope: {@code {"error":{"code":..,"status":..,"message":..}}}.
 */
public record ApiErrorResponse(ApiError error) {

    public static ApiErrorResponse of(String code, int status, String message) {
        return new ApiErrorResponse(new ApiError(code, status, message));
    }

    public record ApiError(String code, int status, String message) {}
}
