package com.dbkeeper.server.model.api.global;

import com.dbkeeper.server.exception.DbKeeperException;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import lombok.Data;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.http.HttpStatus;


@Data
public class DbKeeperHttpResponse<T> {

    private int statusCode;

    private String message;

    private T data;

    @JsonSerialize(using = ToStringSerializer.class)
    private final long timestamp = System.currentTimeMillis();

    private DbKeeperHttpResponse() {}

    public static <T> DbKeeperHttpResponse<T> success(T data, String message) {
        DbKeeperHttpResponse<T> result = new DbKeeperHttpResponse<>();
        result.statusCode = HttpStatus.OK.value();
        result.message = message;
        result.data = data;
        return result;
    }

    public static <T> DbKeeperHttpResponse<T> success(T data) {
        return success(data, "success");
    }

    public static DbKeeperHttpResponse<Void> success() {
        return success(null);
    }

    public static DbKeeperHttpResponse<Void> fail(DbKeeperException e) {
        DbKeeperHttpResponse<Void> result = new DbKeeperHttpResponse<>();
        result.statusCode = ObjectUtils.isEmpty(e.getStatus()) ?
                HttpStatus.INTERNAL_SERVER_ERROR.value() :
                e.getStatus().value();
        result.message = e.getDbKeeperMessage();
        return result;
    }

    public static DbKeeperHttpResponse<Void> fail(HttpStatus status, String message) {
        DbKeeperHttpResponse<Void> result = new DbKeeperHttpResponse<>();
        result.statusCode = status.value();
        result.message = message;
        return result;
    }
}
