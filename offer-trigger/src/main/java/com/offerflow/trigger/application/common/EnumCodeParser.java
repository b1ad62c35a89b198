package com.offerflow.trigger.application.common;

import com.offerflow.types.enums.ResponseCode;
import com.offerflow.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;

import java.util.function.Function;

/**
 * 请求中枚举编码的解析，未知编码转为参数错误。
 */
public final class EnumCodeParser {

    private EnumCodeParser() {
    }

    /**
     * 解析必填编码。
     */
    public static <E> E require(String code, Function<String, E> parser, String field) {
        if (StringUtils.isBlank(code)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, field + " 不能为空");
        }
        return parse(code, parser, field);
    }

    /**
     * 解析可选编码，空白返回 null。
     */
    public static <E> E optional(String code, Function<String, E> parser, String field) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        return parse(code, parser, field);
    }

    private static <E> E parse(String code, Function<String, E> parser, String field) {
        try {
            return parser.apply(code);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, field + " 取值非法: " + code, ex);
        }
    }
}
