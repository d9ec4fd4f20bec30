package org.distributed.agentmesh.common.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope for management endpoints: {"code":"0000","message":"Success","data":...}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MeshResponseDto<T> {
    private String code;
    private String message;
    private T data;

    public static <T> MeshResponseDto<T> success(T data) {
        return new MeshResponseDto<>(MeshResponseCode.SUCCESS.getCode(), MeshResponseCode.SUCCESS.getMessage(), data);
    }

    public static <T> MeshResponseDto<T> error(MeshResponseCode code) {
        return new MeshResponseDto<>(code.getCode(), code.getMessage(), null);
    }

    public static <T> MeshResponseDto<T> error(String code, String message) {
        return new MeshResponseDto<>(code, message, null);
    }
}
