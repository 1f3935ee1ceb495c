package fasal.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RestfulResponse<T> {
    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";

    private String status;
    private Integer code;
    private String msg;
    private T data;

    public static <T> RestfulResponse<T> succeeded(T data) {
        return new RestfulResponse<>(SUCCESS, 200, null, data);
    }

    public static <T> RestfulResponse<T> error(String msg) {
        return new RestfulResponse<>(FAILED, 500, msg, null);
    }

    public static <T> RestfulResponse<T> error(int code, String msg) {
        return new RestfulResponse<>(FAILED, code, msg, null);
    }

    public static <T> RestfulResponse<T> error(int code, String msg, T data) {
        return new RestfulResponse<>(FAILED, code, msg, data);
    }
}
