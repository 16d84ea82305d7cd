package com.cacheshield.codec;

import java.util.function.Function;

/**
 * 单一类型的编解码函数对
 *
 * @param <T> 值类型
 */
public interface ValueCodec<T> {

    String encode(T value);

    T decode(String payload);

    static <T> ValueCodec<T> of(Function<T, String> encoder, Function<String, T> decoder) {
        return new ValueCodec<>() {
            @Override
            public String encode(T value) {
                return encoder.apply(value);
            }

            @Override
            public T decode(String payload) {
                return decoder.apply(payload);
            }
        };
    }
}
