package com.wangbin.master.core.buffer;

/**
 * 缓冲区操作结果，调用方必须检查 status 而不是根据值判断
 *
 * @param status  操作状态
 * @param value   读取到的值，写操作或失败时为 null
 * @param message 附加说明
 */
public record BufferResult<T>(BufferStatus status, T value, String message) {

    public static <T> BufferResult<T> success(T value) {
        return new BufferResult<>(BufferStatus.SUCCESS, value, BufferStatus.SUCCESS.getDescription());
    }

    public static BufferResult<Void> success() {
        return new BufferResult<>(BufferStatus.SUCCESS, null, BufferStatus.SUCCESS.getDescription());
    }

    public static <T> BufferResult<T> failure(BufferStatus status, String message) {
        if (status == BufferStatus.SUCCESS) {
            throw new IllegalArgumentException("失败结果不能使用 SUCCESS 状态");
        }
        return new BufferResult<>(status, null, message);
    }

    public boolean isSuccess() {
        return status == BufferStatus.SUCCESS;
    }
}
